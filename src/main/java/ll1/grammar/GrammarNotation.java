package ll1.grammar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reader for the line based grammar notation
 *
 * <pre>
 * E -> T EREST
 * EREST -> + T EREST | ε
 * </pre>
 *
 * Symbols are separated by whitespace, alternatives by "|". Empty lines are ignored.
 */
public class GrammarNotation {

	public static final String ARROW = "->";

	public static final String ALTERNATIVE = "|";

	private GrammarNotation() {
	}

	/**
	 * Splits the text into rules, one per line.
	 *
	 * @throws MalformedGrammar if a line has no arrow or no head
	 */
	public static List<Rule> parse(String text){
		List<Rule> rules = new ArrayList<>();
		String[] lines = text.split("\\R");
		for (int i = 0; i < lines.length; i++){
			String line = lines[i].trim();
			if (line.isEmpty()){
				continue;
			}
			int arrow = line.indexOf(ARROW);
			if (arrow == -1){
				throw new MalformedGrammar(String.format("Line %d: expected '%s' in \"%s\"", i + 1, ARROW, line));
			}
			String head = line.substring(0, arrow).trim();
			if (head.isEmpty() || head.split("\\s+").length > 1){
				throw new MalformedGrammar(String.format("Line %d: expected a single symbol left of '%s' in \"%s\"",
						i + 1, ARROW, line));
			}
			String body = line.substring(arrow + ARROW.length());
			List<List<String>> alternatives = new ArrayList<>();
			for (String alternative : body.split("\\" + ALTERNATIVE, -1)){
				String trimmed = alternative.trim();
				alternatives.add(trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s+")));
			}
			rules.add(new Rule(head, alternatives));
		}
		return rules;
	}

	public static List<Rule> read(Path file) throws IOException {
		return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
	}

	/**
	 * Parses the text and builds the grammar with the passed classifier.
	 */
	public static Grammar toGrammar(String text, SymbolClassifier classifier){
		return new GrammarBuilder(classifier).ingest(parse(text)).toGrammar();
	}

	/**
	 * Parses the text and builds the grammar with the configured classifier.
	 */
	public static Grammar toGrammar(String text){
		return toGrammar(text, SymbolClassifier.fromConfig());
	}
}
