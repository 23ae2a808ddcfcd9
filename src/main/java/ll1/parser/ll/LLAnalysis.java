package ll1.parser.ll;

import java.util.Map;
import java.util.Set;

import ll1.grammar.*;

/**
 * FIRST and FOLLOW sets and the parsing table of a grammar without left recursion.
 */
public class LLAnalysis {

	public final Grammar grammar;

	public final FirstFollowSets sets;

	public final LLParserTable table;

	private LLAnalysis(FirstFollowSets sets, LLParserTable table) {
		this.grammar = sets.grammar;
		this.sets = sets;
		this.table = table;
	}

	/**
	 * Checks for left recursion before the table is built.
	 *
	 * @throws LeftRecursionError if the grammar is left recursive
	 */
	public static LLAnalysis analyze(Grammar grammar){
		FirstFollowSets sets = new FirstFollowSets(grammar);
		LeftRecursion leftRecursion = new LeftRecursionDetector(sets).detect();
		if (leftRecursion.isLeftRecursive()){
			throw new LeftRecursionError(leftRecursion);
		}
		return new LLAnalysis(sets, LLParserTable.fromGrammar(sets));
	}

	public Map<NonTerminal, Set<TerminalOrEpsilon>> getFirst(){
		return sets.calculateFirst1Sets();
	}

	public Map<NonTerminal, Set<Terminal>> getFollow(){
		return sets.calculateFollow1Sets();
	}

	public ConflictReport getConflicts(){
		return table.getConflicts();
	}

	/**
	 * Is the grammar LL(1)? (the table has no conflicts)
	 */
	public boolean isLL1(){
		return !table.hasConflicts();
	}

	@Override
	public String toString() {
		return sets + "\n" + table + "\n\n" + table.getConflicts();
	}
}
