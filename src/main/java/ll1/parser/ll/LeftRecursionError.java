package ll1.parser.ll;

import java.util.Set;

import ll1.LL1Exception;
import ll1.grammar.LeftRecursion;
import ll1.grammar.NonTerminal;
import ll1.grammar.Production;

/**
 * The grammar is left recursive and can't be represented by an LL(1) parsing table.
 */
public class LeftRecursionError extends LL1Exception {

	public final LeftRecursion leftRecursion;

	public LeftRecursionError(LeftRecursion leftRecursion) {
		super("Grammar is left recursive, " + leftRecursion);
		this.leftRecursion = leftRecursion;
	}

	public Set<Production> getProductions(){
		return leftRecursion.directProductions;
	}

	public Set<NonTerminal> getNonTerminals(){
		return leftRecursion.indirectNonTerminals;
	}
}
