package ll1.parser.ll;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.*;
import java.util.concurrent.*;

import ll1.grammar.*;

import static ll1.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class LLParserTest {

	static LLParser parser(String text){
		return new LLParser(LLAnalysis.analyze(grammar(text)));
	}

	@Nested
	public class TestExpressionGrammar {

		LLParser parser = parser(EXPRESSION);

		@ParameterizedTest
		@ValueSource(strings = {"num + num * num", "( num + num ) * num", "num", "( ( num ) )", "num * num * num + num"})
		public void testAccept(String input){
			assertTrue(parser.parse(input).accepted, input);
		}

		@ParameterizedTest
		@ValueSource(strings = {"num * num +", "", "num num", "( num", "num )", "+ num", "num + x"})
		public void testReject(String input){
			ParseResult result = parser.parse(input);
			assertFalse(result.accepted, input);
			assertNotNull(result.reason);
		}

		@Test
		public void testIncompleteInput(){
			ParseResult result = parser.parse("num * num +");
			assertEquals(ParseResult.RejectReason.NO_APPLICABLE_PRODUCTION, result.reason);
			assertEquals(4, result.position);
			assertTrue(result.found.isEndMarker());
			assertEquals(nt("T"), result.top);
			assertEquals(new HashSet<>(Arrays.asList(t("("), t("num"))), result.expected);
		}

		@Test
		public void testMissingClosingParenthesis(){
			ParseResult result = parser.parse("( num");
			assertEquals(ParseResult.RejectReason.TERMINAL_MISMATCH, result.reason);
			assertEquals(2, result.position);
			assertEquals(t(")"), result.top);
			assertEquals("Expected ) but got $ at position 2", result.message);
		}

		@Test
		public void testUnknownToken(){
			ParseResult result = parser.parse(Arrays.asList("num", "-", "num"));
			assertEquals(ParseResult.RejectReason.NO_APPLICABLE_PRODUCTION, result.reason);
			assertEquals(1, result.position);
			assertEquals(t("-"), result.found);
		}

		@Test
		public void testEndMarkerNameAsToken(){
			assertFalse(parser.parse(Arrays.asList("num", "$")).accepted);
		}

		@Test
		public void testTokenListAndStringAgree(){
			assertEquals(parser.parse("( num + num ) * num"),
					parser.parse(Arrays.asList("(", "num", "+", "num", ")", "*", "num")));
		}
	}

	@Nested
	public class TestTrace {

		LLParser parser = parser(EXPRESSION);

		@ParameterizedTest
		@ValueSource(strings = {"num + num * num", "( num + num ) * num", "num * num +", "", "( num", "num )"})
		public void testSameResultAsUntraced(String input){
			assertEquals(parser.parse(input), parser.parseTraced(input).result);
		}

		@Test
		public void testSteps(){
			ParseTrace trace = parser.parseTraced("num");
			assertTrue(trace.isAccepted());
			List<TraceStep.Action> actions = new ArrayList<>();
			for (TraceStep step : trace.steps){
				actions.add(step.action);
			}
			assertEquals(Arrays.asList(TraceStep.Action.EXPAND, TraceStep.Action.EXPAND, TraceStep.Action.EXPAND,
					TraceStep.Action.MATCH, TraceStep.Action.EXPAND, TraceStep.Action.EXPAND, TraceStep.Action.MATCH,
					TraceStep.Action.ACCEPT), actions);
			TraceStep first = trace.steps.get(0);
			assertEquals(Arrays.asList(new EndMarker(), nt("E")), first.stack);
			assertEquals(Arrays.asList(t("num"), new EndMarker()), first.remainingInput);
			assertEquals("E -> T EREST", first.production.toString());
			TraceStep last = trace.steps.get(trace.steps.size() - 1);
			assertTrue(last.stack.isEmpty());
			assertTrue(last.remainingInput.isEmpty());
		}

		@Test
		public void testEpsilonIsNeverPushed(){
			ParseTrace trace = parser.parseTraced("num + num * num");
			assertTrue(trace.isAccepted());
			boolean expandedEpsilon = false;
			for (TraceStep step : trace.steps){
				for (Symbol symbol : step.stack){
					assertFalse(symbol instanceof Epsilon);
				}
				expandedEpsilon |= step.production != null && step.production.isEpsilonProduction();
			}
			assertTrue(expandedEpsilon);
		}

		@Test
		public void testErrorStep(){
			ParseTrace trace = parser.parseTraced("num * num +");
			assertFalse(trace.isAccepted());
			TraceStep last = trace.steps.get(trace.steps.size() - 1);
			assertEquals(TraceStep.Action.ERROR, last.action);
			assertEquals(nt("T"), last.stack.get(last.stack.size() - 1));
			assertEquals(Collections.singletonList(new EndMarker()), last.remainingInput);
		}
	}

	@Test
	public void testNullableStart(){
		LLParser parser = parser("S -> a S | ε");
		assertTrue(parser.parse("").accepted);
		assertTrue(parser.parse("a a a").accepted);
		assertFalse(parser.parse("a b").accepted);
	}

	@Test
	public void testTrailingInputIsRejectedAtTheEndMarker(){
		ParseTrace trace = parser("S -> a").parseTraced("a a");
		ParseResult result = trace.result;
		assertFalse(result.accepted);
		assertEquals(ParseResult.RejectReason.TERMINAL_MISMATCH, result.reason);
		assertEquals(1, result.position);
		assertEquals(t("a"), result.found);
		assertTrue(result.top instanceof EndMarker);
		assertEquals(TraceStep.Action.ERROR, trace.steps.get(trace.steps.size() - 1).action);
	}

	@Test
	public void testNullablePrefix(){
		LLParser parser = parser(NULLABLE_PREFIX);
		for (String input : new String[]{"c", "a c", "b c", "a b c"}){
			assertTrue(parser.parse(input).accepted, input);
		}
		for (String input : new String[]{"a a c", "b a c", "a b", ""}){
			assertFalse(parser.parse(input).accepted, input);
		}
	}

	@Test
	public void testAmbiguousGrammarIsRefused(){
		LLAnalysis analysis = LLAnalysis.analyze(grammar(AMBIGUOUS));
		GrammarAmbiguous error = assertThrows(GrammarAmbiguous.class, () -> new LLParser(analysis));
		assertTrue(error.conflicts.hasConflict(nt("S"), t("a")));
	}

	@Test
	public void testConcurrentParses() throws Exception {
		LLParser parser = parser(EXPRESSION);
		List<String> inputs = Arrays.asList("num + num * num", "( num + num ) * num", "num * num +", "( num");
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<ParseResult>> futures = new ArrayList<>();
			for (int i = 0; i < 200; i++){
				String input = inputs.get(i % inputs.size());
				futures.add(executor.submit(() -> parser.parse(input)));
			}
			for (int i = 0; i < futures.size(); i++){
				assertEquals(parser.parse(inputs.get(i % inputs.size())), futures.get(i).get());
			}
		} finally {
			executor.shutdown();
		}
	}
}
