package ll1.parser.ll;

import java.util.ArrayList;
import java.util.List;

import ll1.grammar.*;

/**
 * State of a single parse: symbol stack, input cursor and optionally the recorded steps.
 *
 * Created for every parse call and never shared.
 */
class ParserState {

	private final ArrayList<Symbol> stack = new ArrayList<>();

	/**
	 * Tokens followed by the end marker
	 */
	private final List<Terminal> input;

	private int cursor = 0;

	/**
	 * Null if the parse isn't traced
	 */
	private final List<TraceStep> trace;

	ParserState(Grammar grammar, List<String> tokens, boolean traced) {
		input = new ArrayList<>(tokens.size() + 1);
		for (String token : tokens){
			input.add(new Terminal(token));
		}
		input.add(grammar.eof);
		stack.add(grammar.eof);
		stack.add(grammar.getStart());
		trace = traced ? new ArrayList<>() : null;
	}

	boolean isStackEmpty(){
		return stack.isEmpty();
	}

	Symbol peek(){
		return stack.get(stack.size() - 1);
	}

	Symbol pop(){
		return stack.remove(stack.size() - 1);
	}

	/**
	 * Pushes the symbols in reverse order, so that the first one is on top of the stack afterwards.
	 */
	void pushReversed(List<Symbol> symbols){
		for (int i = symbols.size() - 1; i >= 0; i--){
			stack.add(symbols.get(i));
		}
	}

	/**
	 * Current token, the end marker if the cursor is behind the input
	 */
	Terminal current(){
		return cursor < input.size() ? input.get(cursor) : input.get(input.size() - 1);
	}

	int cursor(){
		return cursor;
	}

	void advance(){
		cursor++;
	}

	/**
	 * Are all tokens and the end marker consumed?
	 */
	boolean isInputConsumed(){
		return cursor >= input.size();
	}

	void record(TraceStep.Action action, Production production, String message){
		if (trace != null){
			trace.add(new TraceStep(new ArrayList<>(stack), new ArrayList<>(input.subList(Math.min(cursor, input.size()),
					input.size())), action, production, message));
		}
	}

	List<TraceStep> getTrace(){
		return trace;
	}
}
