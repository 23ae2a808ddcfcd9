package ll1.grammar;

import java.util.*;

import static ll1.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * Instances are immutable, use the {@link GrammarBuilder} to build one.
 */
public class Grammar {

	/**
	 * Non terminals in the grammar, in order of their first appearance
	 */
	private final Set<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the productions (without the end marker and epsilon)
	 */
	private final Set<Terminal> terminals;

	private final List<Production> productions;

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal;

	private final NonTerminal start;

	/**
	 * End of input terminal
	 */
	public final EndMarker eof = new EndMarker();

	/**
	 * Create a new Grammar object
	 *
	 * @param nonTerminals used non terminals
	 * @param terminals used terminals
	 * @param start start non terminal
	 * @param productions productions, their ids have to be their positions in this list
	 */
	Grammar(Set<NonTerminal> nonTerminals, Set<Terminal> terminals, NonTerminal start, List<Production> productions) {
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		this.start = start;
		Map<NonTerminal, List<Production>> perNonTerminal = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			perNonTerminal.put(nonTerminal, new ArrayList<>());
		}
		for (Production production : productions) {
			perNonTerminal.get(production.left).add(production);
		}
		for (NonTerminal nonTerminal : nonTerminals) {
			perNonTerminal.put(nonTerminal, Collections.unmodifiableList(perNonTerminal.get(nonTerminal)));
		}
		this.productionsPerNonTerminal = Collections.unmodifiableMap(perNonTerminal);
	}

	public List<Production> getProductionsOfNonTerminal(NonTerminal nonTerminal) {
		List<Production> ret = productionsPerNonTerminal.get(nonTerminal);
		if (ret == null){
			throw new IllegalArgumentException("No such non terminal " + nonTerminal);
		}
		return ret;
	}

	public boolean hasEpsilonProduction(NonTerminal nonTerminal){
		for (Production production : getProductionsOfNonTerminal(nonTerminal)) {
			if (production.isEpsilonProduction()){
				return true;
			}
		}
		return false;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Set<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	public Set<Terminal> getTerminals() {
		return terminals;
	}

	public NonTerminal getStart(){
		return start;
	}

	public boolean isTerminal(String name){
		return terminals.contains(new Terminal(name));
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		List<String> lines = new ArrayList<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			List<String> alternatives = new ArrayList<>();
			for (Production production : productionsPerNonTerminal.get(nonTerminal)) {
				alternatives.add(production.formatRightSide());
			}
			lines.add(nonTerminal + " -> " + join(alternatives, " | "));
		}
		return join(lines, "\n");
	}
}
