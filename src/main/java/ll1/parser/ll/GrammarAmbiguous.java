package ll1.parser.ll;

import ll1.LL1Exception;

/**
 * The parsing table has conflicts, so the grammar isn't LL(1) and can't be used for parsing.
 */
public class GrammarAmbiguous extends LL1Exception {

	public final ConflictReport conflicts;

	public GrammarAmbiguous(ConflictReport conflicts) {
		super("Grammar is not LL(1):\n" + conflicts);
		this.conflicts = conflicts;
	}
}
