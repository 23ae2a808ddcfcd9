package ll1.parser.ll;

import java.util.logging.Logger;

import ll1.grammar.FirstFollowSets;
import ll1.grammar.Grammar;
import ll1.grammar.LeftRecursion;
import ll1.grammar.LeftRecursionDetector;

/**
 * Decides whether a grammar is LL(1). Doesn't modify the grammar, so repeated calls give equal results.
 */
public class LLValidator {

	private static final Logger LOG = Logger.getLogger("ll1.parser.ll");

	private LLValidator() {
	}

	/**
	 * Checks for left recursion first and stops if there is any, builds the parsing table and collects its
	 * conflicts otherwise.
	 */
	public static ValidationResult validate(Grammar grammar){
		FirstFollowSets sets = new FirstFollowSets(grammar);
		LeftRecursion leftRecursion = new LeftRecursionDetector(sets).detect();
		ValidationResult result;
		if (leftRecursion.isLeftRecursive()){
			result = new ValidationResult(leftRecursion, null);
		} else {
			result = new ValidationResult(leftRecursion, LLParserTable.fromGrammar(sets).getConflicts());
		}
		LOG.fine(() -> "Validated grammar with start symbol " + grammar.getStart() + ": " + result);
		return result;
	}
}
