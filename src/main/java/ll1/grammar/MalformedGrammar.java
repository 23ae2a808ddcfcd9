package ll1.grammar;

import ll1.LL1Exception;

/**
 * Structural problem of a grammar: no rules, an undeclared non terminal, a head that is a terminal, ...
 */
public class MalformedGrammar extends LL1Exception {

	public MalformedGrammar(String message) {
		super(message);
	}
}
