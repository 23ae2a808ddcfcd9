package ll1;

import java.util.List;

import ll1.grammar.*;
import ll1.parser.ll.*;

/**
 * Entry points of the toolkit: build a grammar, analyze and validate it and parse token sequences.
 */
public class LL1 {

	private LL1() {
	}

	/**
	 * Builds the grammar with the configured symbol classifier.
	 *
	 * @throws MalformedGrammar if the rules don't form a valid grammar
	 */
	public static Grammar buildGrammar(List<Rule> rules){
		return new GrammarBuilder().ingest(rules).toGrammar();
	}

	/**
	 * @throws MalformedGrammar if the rules don't form a valid grammar
	 */
	public static Grammar buildGrammar(List<Rule> rules, SymbolClassifier classifier){
		return new GrammarBuilder(classifier).ingest(rules).toGrammar();
	}

	/**
	 * FIRST and FOLLOW sets and the parsing table.
	 *
	 * @throws LeftRecursionError if the grammar is left recursive
	 */
	public static LLAnalysis analyze(Grammar grammar){
		return LLAnalysis.analyze(grammar);
	}

	public static ValidationResult validate(Grammar grammar){
		return LLValidator.validate(grammar);
	}

	/**
	 * @throws GrammarAmbiguous if the grammar isn't LL(1)
	 */
	public static ParseResult parse(LLAnalysis analysis, List<String> tokens){
		return new LLParser(analysis).parse(tokens);
	}

	/**
	 * @throws GrammarAmbiguous if the grammar isn't LL(1)
	 */
	public static ParseTrace parseTraced(LLAnalysis analysis, List<String> tokens){
		return new LLParser(analysis).parseTraced(tokens);
	}
}
