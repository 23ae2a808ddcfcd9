package ll1.grammar;

import java.util.*;

/**
 * A non terminal name with all its alternative bodies, each body is a list of symbol names.
 *
 * An empty body (or a body consisting only of empty markers) derives the empty word.
 */
public class Rule {

	public final String head;

	public final List<List<String>> alternatives;

	public Rule(String head, List<List<String>> alternatives) {
		this.head = Objects.requireNonNull(head);
		List<List<String>> alts = new ArrayList<>();
		for (List<String> alternative : alternatives){
			alts.add(Collections.unmodifiableList(new ArrayList<>(alternative)));
		}
		this.alternatives = Collections.unmodifiableList(alts);
	}

	/**
	 * Creates a rule, each alternative is a whitespace separated string of symbol names.
	 *
	 * <pre>Rule.of("EREST", "+ T EREST", "ε")</pre>
	 */
	public static Rule of(String head, String... alternatives){
		List<List<String>> alts = new ArrayList<>();
		for (String alternative : alternatives){
			String trimmed = alternative.trim();
			alts.add(trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s+")));
		}
		return new Rule(head, alts);
	}

	@Override
	public String toString() {
		List<String> alts = new ArrayList<>();
		for (List<String> alternative : alternatives){
			alts.add(String.join(" ", alternative));
		}
		return head + " -> " + String.join(" | ", alts);
	}
}
