package ll1.parser.ll;

import java.util.*;
import java.util.logging.Logger;

import ll1.grammar.*;

import static ll1.util.Utils.padRight;

/**
 * LL(1) parsing table that maps a non terminal and a lookahead terminal to the production that is expanded.
 *
 * Conflicting insertions don't overwrite the cell, the first inserted production stays and the conflict is
 * recorded in the {@link ConflictReport}.
 */
public class LLParserTable {

	private static final Logger LOG = Logger.getLogger("ll1.parser.ll");

	public final Grammar grammar;

	/**
	 * Maps a non terminal and a lookahead terminal to an executed production.
	 */
	private final Map<NonTerminal, Map<Terminal, Production>> table = new LinkedHashMap<>();

	private final ConflictReport conflicts = new ConflictReport();

	LLParserTable(Grammar grammar){
		this.grammar = grammar;
	}

	/**
	 * Inserts every production A → β at (A, t) for each terminal t in FIRST(β) and, if β is nullable,
	 * for each t in FOLLOW(A).
	 */
	public static LLParserTable fromGrammar(FirstFollowSets sets){
		LLParserTable llTable = new LLParserTable(sets.grammar);
		for (Production production : sets.grammar.getProductions()){
			for (Terminal lookahead : sets.calculateFirstFollowForProduction(production)) {
				llTable.insertAction(production.left, lookahead, production);
			}
		}
		if (!llTable.conflicts.isEmpty()){
			LOG.warning(() -> String.format("Parsing table has %d conflicting cells", llTable.conflicts.size()));
		}
		return llTable;
	}

	void insertAction(NonTerminal nonTerminal, Terminal lookahead, Production executedProduction){
		Map<Terminal, Production> row = table.computeIfAbsent(nonTerminal, k -> new LinkedHashMap<>());
		Production occupant = row.get(lookahead);
		if (occupant == null){
			row.put(lookahead, executedProduction);
		} else if (!occupant.equals(executedProduction)){
			LOG.warning(() -> String.format("Conflict between %s and %s at lookahead token %s, the first production " +
					"will be used", occupant, executedProduction, lookahead));
			conflicts.record(nonTerminal, lookahead, occupant, executedProduction);
		}
	}

	/**
	 * @return the production or null if the cell is empty
	 */
	public Production get(NonTerminal nonTerminal, Terminal lookahead){
		Map<Terminal, Production> row = table.get(nonTerminal);
		return row == null ? null : row.get(lookahead);
	}

	/**
	 * Lookahead terminals with a non empty cell in the row of the non terminal
	 */
	public Set<Terminal> expectedTerminals(NonTerminal nonTerminal){
		Map<Terminal, Production> row = table.get(nonTerminal);
		return row == null ? Collections.emptySet() : Collections.unmodifiableSet(row.keySet());
	}

	/**
	 * Number of non empty cells
	 */
	public int size(){
		int size = 0;
		for (Map<Terminal, Production> row : table.values()){
			size += row.size();
		}
		return size;
	}

	public ConflictReport getConflicts(){
		return conflicts;
	}

	public boolean hasConflicts(){
		return !conflicts.isEmpty();
	}

	/**
	 * Table with one row per non terminal and one column per terminal (and the end marker), "-" marks empty cells
	 */
	@Override
	public String toString() {
		List<Terminal> columns = new ArrayList<>(grammar.getTerminals());
		Collections.sort(columns);
		columns.add(grammar.eof);
		List<List<String>> rows = new ArrayList<>();
		List<String> header = new ArrayList<>();
		header.add("");
		for (Terminal terminal : columns){
			header.add(terminal.name);
		}
		rows.add(header);
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			List<String> row = new ArrayList<>();
			row.add(nonTerminal.name);
			for (Terminal terminal : columns){
				Production production = get(nonTerminal, terminal);
				row.add(production == null ? "-" : production.toString());
			}
			rows.add(row);
		}
		int[] widths = new int[header.size()];
		for (List<String> row : rows){
			for (int i = 0; i < row.size(); i++){
				widths[i] = Math.max(widths[i], row.get(i).length());
			}
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < rows.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			List<String> row = rows.get(i);
			for (int j = 0; j < row.size(); j++){
				builder.append(j == 0 ? "" : " | ").append(padRight(row.get(j), widths[j]));
			}
		}
		return builder.toString();
	}
}
