package ll1.grammar;

import ll1.Config;

/**
 * The terminal that marks the end of the input, it never appears in a production body.
 */
public class EndMarker extends Terminal {

	public EndMarker() {
		super(Config.endMarker());
	}

	@Override
	public boolean isEndMarker() {
		return true;
	}

	@Override
	int kindOrder() {
		return 2;
	}
}
