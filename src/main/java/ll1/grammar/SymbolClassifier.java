package ll1.grammar;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import ll1.Config;
import ll1.LL1Exception;

/**
 * Decides whether a symbol name used in a grammar denotes a non terminal.
 *
 * Every name that isn't classified as a non terminal is a terminal, so both sets are disjoint.
 */
@FunctionalInterface
public interface SymbolClassifier {

	/**
	 * @param name symbol name
	 * @param declaredHeads names of all rule heads of the grammar under construction
	 * @return true if the name denotes a non terminal
	 */
	boolean isNonTerminal(String name, Set<String> declaredHeads);

	/**
	 * Names that contain cased characters, but no lower case ones, are non terminals
	 * ("EREST" and "E1" are, "num" and "+" aren't).
	 */
	static SymbolClassifier uppercase(){
		return (name, heads) -> {
			boolean cased = false;
			for (int i = 0; i < name.length(); i++){
				char c = name.charAt(i);
				if (Character.isLowerCase(c)){
					return false;
				}
				cased |= Character.isUpperCase(c) || Character.isTitleCase(c);
			}
			return cased;
		};
	}

	/**
	 * Exactly the names that appear as rule heads are non terminals.
	 */
	static SymbolClassifier declaredHeads(){
		return (name, heads) -> heads.contains(name);
	}

	/**
	 * Explicit tagging: exactly the passed names are non terminals.
	 */
	static SymbolClassifier explicit(Set<String> nonTerminals){
		Set<String> names = Collections.unmodifiableSet(new HashSet<>(nonTerminals));
		return (name, heads) -> names.contains(name);
	}

	/**
	 * The classifier selected by the "nonTerminalPolicy" setting
	 */
	static SymbolClassifier fromConfig(){
		switch (Config.nonTerminalPolicy()){
			case "uppercase":
				return uppercase();
			case "declared":
				return declaredHeads();
			default:
				throw new LL1Exception("Unknown non terminal policy " + Config.nonTerminalPolicy());
		}
	}
}
