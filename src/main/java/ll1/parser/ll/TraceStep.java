package ll1.parser.ll;

import java.util.Collections;
import java.util.List;

import ll1.grammar.Production;
import ll1.grammar.Symbol;
import ll1.grammar.Terminal;

import static ll1.util.Utils.join;

/**
 * A recorded parser step: the stack and the remaining input before the step and the action that was taken.
 */
public class TraceStep {

	public enum Action {
		/** The terminal on top of the stack matched the current token */
		MATCH,
		/** The non terminal on top of the stack was replaced by the right hand side of a production */
		EXPAND,
		/** Stack and input are empty */
		ACCEPT,
		/** The parser rejected the input */
		ERROR;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	/**
	 * Stack content, the top of the stack is the last element
	 */
	public final List<Symbol> stack;

	/**
	 * Input that isn't consumed yet, including the end marker
	 */
	public final List<Terminal> remainingInput;

	public final Action action;

	/**
	 * Expanded production, only set for {@link Action#EXPAND}
	 */
	public final Production production;

	public final String message;

	TraceStep(List<Symbol> stack, List<Terminal> remainingInput, Action action, Production production, String message) {
		this.stack = Collections.unmodifiableList(stack);
		this.remainingInput = Collections.unmodifiableList(remainingInput);
		this.action = action;
		this.production = production;
		this.message = message;
	}

	@Override
	public String toString() {
		return String.format("%-30s %-30s %s", join(stack, " "), join(remainingInput, " "), message);
	}
}
