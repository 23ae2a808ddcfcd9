package ll1.grammar;

import java.util.*;
import java.util.logging.Logger;

import static ll1.util.Utils.formatSet;

/**
 * FIRST(1) and FOLLOW(1) sets of a grammar, both calculated lazily by fixed point iteration.
 *
 * The returned sets are read only and don't change after their calculation.
 */
public class FirstFollowSets {

	private static final Logger LOG = Logger.getLogger("ll1.grammar.sets");

	public final Grammar grammar;

	private Map<NonTerminal, Set<TerminalOrEpsilon>> first1Sets;
	private Map<NonTerminal, Set<Terminal>> follow1Sets;

	public FirstFollowSets(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Calculates FIRST(A) for every non terminal A.
	 *
	 * FIRST(A) is the union of FIRST(β) over all productions A → β, the iteration stops after the first pass
	 * over all productions that doesn't add anything to any set.
	 *
	 * @return first(k=1) sets, contain epsilon for nullable non terminals
	 */
	public Map<NonTerminal, Set<TerminalOrEpsilon>> calculateFirst1Sets(){
		if (first1Sets != null){
			return first1Sets;
		}
		Map<NonTerminal, Set<TerminalOrEpsilon>> first = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean firstChanged;
		int passes = 0;
		do {
			firstChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				if (first.get(production.left).addAll(first1OfTerm(production.right, first))){
					firstChanged = true;
				}
			}
		} while (firstChanged);
		LOG.fine(String.format("FIRST sets reached their fixed point after %d passes", passes));
		first1Sets = freeze(first);
		return first1Sets;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except for ε
	 * is placed in FOLLOW(B).
	 * If there is a production A → aB, then everything in FOLLOW(A) is in FOLLOW(B)
	 * If there is a production A → aBb, where FIRST(b) contains ε, then everything in FOLLOW(A) is in FOLLOW(B)
	 *
	 * @return follow(k=1) sets, never contain epsilon
	 */
	public Map<NonTerminal, Set<Terminal>> calculateFollow1Sets(){
		if (follow1Sets != null){
			return follow1Sets;
		}
		Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		follow.get(grammar.getStart()).add(grammar.eof);
		boolean followChanged;
		int passes = 0;
		do {
			followChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				List<Symbol> right = production.right;
				for (int i = 0; i < right.size(); i++){
					if (!(right.get(i) instanceof NonTerminal)){
						continue;
					}
					Set<Terminal> followSet = follow.get((NonTerminal)right.get(i));
					Set<TerminalOrEpsilon> rest = first1OfTerm(right.subList(i + 1, right.size()));
					for (TerminalOrEpsilon toe : rest){
						if (toe instanceof Terminal && followSet.add((Terminal)toe)){
							followChanged = true;
						}
					}
					if (rest.contains(new Epsilon()) && followSet.addAll(follow.get(production.left))){
						followChanged = true;
					}
				}
			}
		} while (followChanged);
		LOG.fine(String.format("FOLLOW sets reached their fixed point after %d passes", passes));
		follow1Sets = freeze(follow);
		return follow1Sets;
	}

	/**
	 * FIRST set of a term (a list of symbols).
	 *
	 * Collects the FIRST sets (without ε) of the symbols from left to right, until the first symbol that isn't
	 * nullable. Contains ε iff all symbols are nullable (or the term is empty).
	 */
	public Set<TerminalOrEpsilon> first1OfTerm(List<Symbol> term){
		return Collections.unmodifiableSet(first1OfTerm(term, calculateFirst1Sets()));
	}

	private static Set<TerminalOrEpsilon> first1OfTerm(List<Symbol> term,
	                                                   Map<NonTerminal, Set<TerminalOrEpsilon>> firstSets){
		Set<TerminalOrEpsilon> set = new LinkedHashSet<>();
		Epsilon epsilon = new Epsilon();
		for (Symbol symbol : term){
			if (symbol instanceof Epsilon){
				continue;
			}
			if (symbol instanceof Terminal){
				set.add((Terminal)symbol);
				return set;
			}
			Set<TerminalOrEpsilon> symbolFirst = firstSets.get((NonTerminal)symbol);
			for (TerminalOrEpsilon toe : symbolFirst){
				if (toe instanceof Terminal){
					set.add(toe);
				}
			}
			if (!symbolFirst.contains(epsilon)){
				return set;
			}
		}
		set.add(epsilon);
		return set;
	}

	/**
	 * FIRST set of a single symbol, {X} for a terminal X
	 */
	public Set<TerminalOrEpsilon> first1(Symbol symbol){
		if (symbol instanceof NonTerminal){
			return calculateFirst1Sets().get(symbol);
		}
		return Collections.singleton((TerminalOrEpsilon)symbol);
	}

	public Set<Terminal> follow1(NonTerminal nonTerminal){
		return calculateFollow1Sets().get(nonTerminal);
	}

	/**
	 * Can the symbol be derived to the empty word?
	 */
	public boolean isNullable(Symbol symbol){
		return symbol instanceof Epsilon
				|| (symbol instanceof NonTerminal && first1(symbol).contains(new Epsilon()));
	}

	/**
	 * Terminals that select the production in an LL(1) parser: FIRST(β), plus FOLLOW(A) if β is nullable
	 */
	public Set<Terminal> calculateFirstFollowForProduction(Production production){
		Set<Terminal> set = new LinkedHashSet<>();
		Set<TerminalOrEpsilon> first = first1OfTerm(production.right);
		for (TerminalOrEpsilon toe : first){
			if (toe instanceof Terminal){
				set.add((Terminal)toe);
			}
		}
		if (first.contains(new Epsilon())){
			set.addAll(follow1(production.left));
		}
		return set;
	}

	private static <T> Map<NonTerminal, Set<T>> freeze(Map<NonTerminal, Set<T>> sets){
		Map<NonTerminal, Set<T>> ret = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, Set<T>> entry : sets.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return Collections.unmodifiableMap(ret);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			builder.append("FIRST(").append(nonTerminal).append(") = ")
					.append(formatSet(calculateFirst1Sets().get(nonTerminal))).append("\n");
		}
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			builder.append("FOLLOW(").append(nonTerminal).append(") = ")
					.append(formatSet(calculateFollow1Sets().get(nonTerminal))).append("\n");
		}
		return builder.toString();
	}
}
