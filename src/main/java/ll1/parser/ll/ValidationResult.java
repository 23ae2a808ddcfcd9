package ll1.parser.ll;

import ll1.grammar.LeftRecursion;

/**
 * Verdict of the {@link LLValidator}: either a left recursion diagnosis (no table was built) or the conflict report
 * of the parsing table.
 */
public class ValidationResult {

	public final LeftRecursion leftRecursion;

	/**
	 * Null if the grammar is left recursive
	 */
	public final ConflictReport conflicts;

	ValidationResult(LeftRecursion leftRecursion, ConflictReport conflicts) {
		this.leftRecursion = leftRecursion;
		this.conflicts = conflicts;
	}

	public boolean isLeftRecursive(){
		return leftRecursion.isLeftRecursive();
	}

	public boolean isAmbiguous(){
		return conflicts != null && !conflicts.isEmpty();
	}

	/**
	 * Is the grammar LL(1)? (no left recursion and no table conflicts)
	 */
	public boolean isLL1(){
		return !isLeftRecursive() && !isAmbiguous();
	}

	@Override
	public String toString() {
		if (isLeftRecursive()){
			return "Not LL(1): " + leftRecursion;
		}
		if (isAmbiguous()){
			return "Not LL(1):\n" + conflicts;
		}
		return "LL(1)";
	}
}
