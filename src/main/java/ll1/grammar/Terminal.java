package ll1.grammar;

/**
 * A terminal symbol, an atomic token of the input
 */
public class Terminal extends TerminalOrEpsilon {

	public Terminal(String name) {
		super(name);
	}

	/**
	 * Is this the marker for the end of the input?
	 */
	public boolean isEndMarker(){
		return false;
	}

	@Override
	int kindOrder() {
		return 1;
	}
}
