package ll1.parser.ll;

import java.util.*;

import ll1.grammar.NonTerminal;
import ll1.grammar.Production;
import ll1.grammar.Terminal;
import ll1.util.Pair;

import static ll1.util.Utils.join;

/**
 * Table cells that more than one production claims. The grammar is LL(1) iff the report is empty.
 */
public class ConflictReport {

	/**
	 * Maps a non terminal and a lookahead terminal to the competing productions, the production that
	 * occupies the table cell comes first.
	 */
	private final Map<Pair<NonTerminal, Terminal>, List<Production>> conflicts = new LinkedHashMap<>();

	void record(NonTerminal nonTerminal, Terminal lookahead, Production occupant, Production competitor){
		List<Production> productions = conflicts.computeIfAbsent(new Pair<>(nonTerminal, lookahead),
				k -> new ArrayList<>(Collections.singletonList(occupant)));
		if (!productions.contains(competitor)){
			productions.add(competitor);
		}
	}

	public boolean isEmpty(){
		return conflicts.isEmpty();
	}

	public int size(){
		return conflicts.size();
	}

	public Map<Pair<NonTerminal, Terminal>, List<Production>> getConflicts(){
		Map<Pair<NonTerminal, Terminal>, List<Production>> ret = new LinkedHashMap<>();
		for (Map.Entry<Pair<NonTerminal, Terminal>, List<Production>> entry : conflicts.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
		}
		return Collections.unmodifiableMap(ret);
	}

	/**
	 * @return competing productions or an empty list if the cell has no conflict
	 */
	public List<Production> get(NonTerminal nonTerminal, Terminal lookahead){
		List<Production> productions = conflicts.get(new Pair<>(nonTerminal, lookahead));
		return productions == null ? Collections.emptyList() : Collections.unmodifiableList(productions);
	}

	public boolean hasConflict(NonTerminal nonTerminal, Terminal lookahead){
		return conflicts.containsKey(new Pair<>(nonTerminal, lookahead));
	}

	@Override
	public String toString() {
		if (conflicts.isEmpty()){
			return "no conflicts";
		}
		List<String> lines = new ArrayList<>();
		for (Map.Entry<Pair<NonTerminal, Terminal>, List<Production>> entry : conflicts.entrySet()){
			lines.add(String.format("Conflict at (%s, %s): %s", entry.getKey().first, entry.getKey().second,
					join(entry.getValue(), " vs. ")));
		}
		return join(lines, "\n");
	}
}
