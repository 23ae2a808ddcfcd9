package ll1.grammar;

import ll1.Config;

/**
 * The empty word
 */
public class Epsilon extends TerminalOrEpsilon {

	public Epsilon() {
		super(Config.emptyMarker());
	}

	@Override
	int kindOrder() {
		return 3;
	}
}
