package ll1.grammar;

/**
 * A non terminal symbol, its productions are owned by the {@link Grammar}.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}

	@Override
	int kindOrder() {
		return 0;
	}
}
