package ll1.parser.ll;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import ll1.grammar.Symbol;
import ll1.grammar.Terminal;

/**
 * Outcome of a parse: accepted or rejected with a reason.
 *
 * Rejections are ordinary results, the parser never throws for invalid input.
 */
public class ParseResult {

	public enum RejectReason {
		/** The terminal on top of the stack differs from the current token */
		TERMINAL_MISMATCH,
		/** The parsing table has no production for the non terminal on top of the stack and the current token */
		NO_APPLICABLE_PRODUCTION,
		/** The stack is empty, but the input isn't */
		INPUT_REMAINING
	}

	private static final ParseResult ACCEPTED = new ParseResult(true, null, -1, null, null,
			Collections.<Terminal>emptySet(), "accepted");

	public final boolean accepted;

	/**
	 * Null if accepted
	 */
	public final RejectReason reason;

	/**
	 * Index of the offending token, the number of tokens if it is the end marker
	 */
	public final int position;

	/**
	 * The offending token
	 */
	public final Terminal found;

	/**
	 * Symbol on top of the stack when the input was rejected
	 */
	public final Symbol top;

	/**
	 * Tokens that would have been valid at the position
	 */
	public final Set<Terminal> expected;

	public final String message;

	private ParseResult(boolean accepted, RejectReason reason, int position, Terminal found, Symbol top,
	                    Set<Terminal> expected, String message) {
		this.accepted = accepted;
		this.reason = reason;
		this.position = position;
		this.found = found;
		this.top = top;
		this.expected = Collections.unmodifiableSet(new LinkedHashSet<>(expected));
		this.message = message;
	}

	public static ParseResult accept(){
		return ACCEPTED;
	}

	public static ParseResult reject(RejectReason reason, int position, Terminal found, Symbol top,
	                                 Set<Terminal> expected, String message){
		return new ParseResult(false, reason, position, found, top, expected, message);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParseResult)){
			return false;
		}
		ParseResult other = (ParseResult)obj;
		return accepted == other.accepted && reason == other.reason && position == other.position
				&& message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return message.hashCode() * 31 + position;
	}

	@Override
	public String toString() {
		return accepted ? "accepted" : "rejected: " + message;
	}
}
