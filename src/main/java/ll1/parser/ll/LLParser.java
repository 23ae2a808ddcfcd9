package ll1.parser.ll;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import ll1.grammar.*;

import static ll1.util.Utils.formatSet;

/**
 * Table driven LL(1) parser that decides whether a token sequence is derivable from the start symbol.
 *
 * The parser holds no state between calls, a single instance can be used from several threads.
 */
public class LLParser {

	private static final Logger LOG = Logger.getLogger("ll1.parser.ll");

	private final Grammar grammar;
	private final LLParserTable table;

	/**
	 * @throws GrammarAmbiguous if the table has conflicts
	 */
	public LLParser(LLParserTable table){
		if (table.hasConflicts()){
			throw new GrammarAmbiguous(table.getConflicts());
		}
		this.grammar = table.grammar;
		this.table = table;
	}

	/**
	 * @throws GrammarAmbiguous if the table has conflicts
	 */
	public LLParser(LLAnalysis analysis){
		this(analysis.table);
	}

	/**
	 * Parses a whitespace separated string of tokens.
	 */
	public ParseResult parse(String input){
		return parse(split(input));
	}

	public ParseResult parse(List<String> tokens){
		return run(new ParserState(grammar, tokens, false));
	}

	public ParseTrace parseTraced(String input){
		return parseTraced(split(input));
	}

	/**
	 * Parses the tokens and records every step, the result equals the one of {@link #parse(List)}.
	 */
	public ParseTrace parseTraced(List<String> tokens){
		ParserState state = new ParserState(grammar, tokens, true);
		ParseResult result = run(state);
		return new ParseTrace(result, state.getTrace());
	}

	private static List<String> split(String input){
		String trimmed = input.trim();
		return trimmed.isEmpty() ? Collections.<String>emptyList() : Arrays.asList(trimmed.split("\\s+"));
	}

	private ParseResult run(ParserState state){
		while (!state.isStackEmpty()){
			ParseResult rejection = step(state);
			if (rejection != null){
				LOG.fine(() -> "Rejected input: " + rejection.message);
				return rejection;
			}
		}
		// the end marker sits at the bottom of the stack and matches only the last input symbol
		if (!state.isInputConsumed()){
			String message = String.format("Unexpected %s at position %d, expected the end of the input",
					state.current(), state.cursor());
			state.record(TraceStep.Action.ERROR, null, message);
			return ParseResult.reject(ParseResult.RejectReason.INPUT_REMAINING, state.cursor(), state.current(),
					null, Collections.<Terminal>emptySet(), message);
		}
		state.record(TraceStep.Action.ACCEPT, null, "accept");
		return ParseResult.accept();
	}

	/**
	 * Matches or expands the symbol on top of the stack.
	 *
	 * @return the rejection or null if parsing can go on
	 */
	private ParseResult step(ParserState state){
		Symbol top = state.peek();
		Terminal current = state.current();
		if (LOG.isLoggable(Level.FINEST)){
			LOG.finest(String.format("Top of stack: %s, current input: %s", top, current));
		}
		if (top instanceof Terminal) {
			if (!top.equals(current)) {
				String message = String.format("Expected %s but got %s at position %d", top, current, state.cursor());
				state.record(TraceStep.Action.ERROR, null, message);
				return ParseResult.reject(ParseResult.RejectReason.TERMINAL_MISMATCH, state.cursor(), current, top,
						Collections.singleton((Terminal)top), message);
			}
			state.record(TraceStep.Action.MATCH, null, "match " + top);
			state.pop();
			state.advance();
			return null;
		}
		NonTerminal nonTerminal = (NonTerminal)top;
		Production production = table.get(nonTerminal, current);
		if (production == null) {
			Set<Terminal> expected = new TreeSet<>(table.expectedTerminals(nonTerminal));
			String message = String.format("Unexpected %s at position %d, expected %s", current, state.cursor(),
					formatSet(expected));
			state.record(TraceStep.Action.ERROR, null, message);
			return ParseResult.reject(ParseResult.RejectReason.NO_APPLICABLE_PRODUCTION, state.cursor(), current,
					top, expected, message);
		}
		state.record(TraceStep.Action.EXPAND, production, "expand " + production);
		state.pop();
		if (!production.isEpsilonProduction()){
			state.pushReversed(production.right);
		}
		return null;
	}
}
