package ll1.parser.ll;

import java.util.Collections;
import java.util.List;

import static ll1.util.Utils.join;

/**
 * Result of a traced parse together with all steps the parser took.
 */
public class ParseTrace {

	public final ParseResult result;

	public final List<TraceStep> steps;

	ParseTrace(ParseResult result, List<TraceStep> steps) {
		this.result = result;
		this.steps = Collections.unmodifiableList(steps);
	}

	public boolean isAccepted(){
		return result.accepted;
	}

	@Override
	public String toString() {
		return join(steps, "\n") + "\n" + result;
	}
}
