package ll1;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import ll1.grammar.*;
import ll1.parser.ll.*;

import static ll1.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class LL1Test {

	@Test
	public void testEndToEnd(){
		Grammar grammar = LL1.buildGrammar(GrammarNotation.parse(EXPRESSION));
		assertTrue(LL1.validate(grammar).isLL1());
		LLAnalysis analysis = LL1.analyze(grammar);
		assertTrue(LL1.parse(analysis, Arrays.asList("num", "+", "num", "*", "num")).accepted);
		assertTrue(LL1.parse(analysis, Arrays.asList("(", "num", "+", "num", ")", "*", "num")).accepted);
		assertFalse(LL1.parse(analysis, Arrays.asList("num", "*", "num", "+")).accepted);
		ParseTrace trace = LL1.parseTraced(analysis, Arrays.asList("num", "*", "num", "+"));
		assertFalse(trace.isAccepted());
		assertEquals(TraceStep.Action.ERROR, trace.steps.get(trace.steps.size() - 1).action);
	}

	@Test
	public void testExplicitClassifier(){
		List<Rule> rules = Arrays.asList(Rule.of("list", "item rest"), Rule.of("rest", ", item rest", ""),
				Rule.of("item", "id"));
		Grammar grammar = LL1.buildGrammar(rules, SymbolClassifier.declaredHeads());
		assertTrue(LL1.parse(LL1.analyze(grammar), Arrays.asList("id", ",", "id")).accepted);
		assertThrows(MalformedGrammar.class, () -> LL1.buildGrammar(rules));
	}

	@Test
	public void testLeftRecursiveGrammarHasNoTable(){
		Grammar grammar = LL1.buildGrammar(GrammarNotation.parse(DIRECT_LEFT_RECURSION));
		assertThrows(LeftRecursionError.class, () -> LL1.analyze(grammar));
		assertTrue(LL1.validate(grammar).isLeftRecursive());
	}

	@Test
	public void testAmbiguousGrammarCantBeParsed(){
		LLAnalysis analysis = LL1.analyze(LL1.buildGrammar(GrammarNotation.parse(AMBIGUOUS)));
		assertThrows(GrammarAmbiguous.class, () -> LL1.parse(analysis, Arrays.asList("a", "b")));
	}

	static String run(int expectedExitCode, String... args) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "UTF-8");
		assertEquals(expectedExitCode, Main.run(args, out));
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testMainDemo() throws Exception {
		String output = run(1);
		assertTrue(output.contains("FIRST(E) = { (, num }"));
		assertTrue(output.contains("=== num * num + ==="));
		assertTrue(output.contains("accepted"));
		assertTrue(output.contains("rejected: Unexpected $ at position 4"));
	}

	@Test
	public void testMainWithGrammarFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("list.grammar");
		Files.write(file, "L -> a R\nR -> , a R | ε\n".getBytes(StandardCharsets.UTF_8));
		String output = run(0, file.toString(), "a , a", "a");
		assertTrue(output.contains("=== a , a ==="));
		assertFalse(output.contains("rejected"));
	}

	@Test
	public void testMainWithLeftRecursiveGrammar(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("left.grammar");
		Files.write(file, DIRECT_LEFT_RECURSION.getBytes(StandardCharsets.UTF_8));
		String output = run(1, "--dot", file.toString(), "b a");
		assertTrue(output.contains("directly left recursive: S -> S a"));
		assertTrue(output.contains("digraph"));
	}
}
