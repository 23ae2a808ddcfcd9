package ll1.grammar;

import java.util.*;

import static ll1.util.Utils.join;

/**
 * Result of the left recursion analysis: the directly left recursive productions (A → A β) and the non terminals
 * that derive a string starting with themselves in more than one step.
 */
public class LeftRecursion {

	public final Set<Production> directProductions;

	public final Set<NonTerminal> indirectNonTerminals;

	public LeftRecursion(Set<Production> directProductions, Set<NonTerminal> indirectNonTerminals) {
		this.directProductions = Collections.unmodifiableSet(new LinkedHashSet<>(directProductions));
		this.indirectNonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(indirectNonTerminals));
	}

	public boolean isLeftRecursive(){
		return !directProductions.isEmpty() || !indirectNonTerminals.isEmpty();
	}

	/**
	 * All left recursive non terminals, direct and indirect ones
	 */
	public Set<NonTerminal> nonTerminals(){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (Production production : directProductions){
			ret.add(production.left);
		}
		ret.addAll(indirectNonTerminals);
		return ret;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LeftRecursion && ((LeftRecursion)obj).directProductions.equals(directProductions)
				&& ((LeftRecursion)obj).indirectNonTerminals.equals(indirectNonTerminals);
	}

	@Override
	public int hashCode() {
		return Objects.hash(directProductions, indirectNonTerminals);
	}

	@Override
	public String toString() {
		if (!isLeftRecursive()){
			return "no left recursion";
		}
		List<String> parts = new ArrayList<>();
		if (!directProductions.isEmpty()){
			parts.add("directly left recursive: " + join(directProductions, ", "));
		}
		if (!indirectNonTerminals.isEmpty()){
			parts.add("indirectly left recursive: " + join(indirectNonTerminals, ", "));
		}
		return join(parts, "; ");
	}
}
