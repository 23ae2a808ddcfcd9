package ll1.grammar;

/**
 * Element of a FIRST set: either a terminal or epsilon.
 */
public abstract class TerminalOrEpsilon extends Symbol {

	protected TerminalOrEpsilon(String name) {
		super(name);
	}
}
