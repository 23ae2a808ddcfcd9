package ll1.grammar;

import java.util.*;
import java.util.logging.Logger;

import ll1.Config;
import ll1.util.Pair;

/**
 * Allows the simple creation of grammars.
 *
 * Symbols are passed as names, the {@link SymbolClassifier} decides which of them are non terminals.
 * The empty string and the configured empty marker (ε by default) denote the empty word.
 * The start symbol is the head of the first added production.
 */
public class GrammarBuilder {

	private static final Logger LOG = Logger.getLogger("ll1.grammar");

	private final SymbolClassifier classifier;

	/**
	 * Added productions: head name and body names
	 */
	private final List<Pair<String, List<String>>> productions = new ArrayList<>();

	/**
	 * Heads of rules that were added without any alternative
	 */
	private final Set<String> emptyRules = new LinkedHashSet<>();

	public GrammarBuilder(SymbolClassifier classifier) {
		this.classifier = Objects.requireNonNull(classifier);
	}

	/**
	 * Uses the classifier selected in the configuration
	 */
	public GrammarBuilder() {
		this(SymbolClassifier.fromConfig());
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are symbol names, "" and the empty marker are equivalent to ε.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 * @return self
	 */
	public GrammarBuilder add(String left, String... right){
		return add(left, Arrays.asList(right));
	}

	public GrammarBuilder add(String left, List<String> right){
		productions.add(new Pair<>(Objects.requireNonNull(left), new ArrayList<>(right)));
		return this;
	}

	/**
	 * Adds a production for each alternative of the rule.
	 */
	public GrammarBuilder add(Rule rule){
		if (rule.alternatives.isEmpty()){
			emptyRules.add(rule.head);
		}
		for (List<String> alternative : rule.alternatives){
			add(rule.head, alternative);
		}
		return this;
	}

	/**
	 * Adds all passed rules, in order.
	 */
	public GrammarBuilder ingest(Collection<Rule> rules){
		for (Rule rule : rules){
			add(rule);
		}
		return this;
	}

	private boolean isEpsilon(String name){
		return name.isEmpty() || name.equals(Config.emptyMarker());
	}

	/**
	 * Classifies all symbols and creates the grammar.
	 *
	 * @throws MalformedGrammar if there are no productions, a head is classified as a terminal, a used non terminal
	 * has no productions or the end marker is used
	 */
	public Grammar toGrammar() {
		if (!emptyRules.isEmpty()){
			throw new MalformedGrammar(String.format("Rule for %s has no alternatives", emptyRules.iterator().next()));
		}
		if (productions.isEmpty()){
			throw new MalformedGrammar("The grammar has no rules");
		}
		Set<String> heads = new LinkedHashSet<>();
		for (Pair<String, List<String>> production : productions){
			heads.add(production.first);
		}
		for (String head : heads){
			if (isEpsilon(head) || head.equals(Config.endMarker())){
				throw new MalformedGrammar(String.format("The reserved symbol '%s' can't be the head of a rule", head));
			}
			if (!classifier.isNonTerminal(head, heads)){
				throw new MalformedGrammar(String.format("'%s' is the head of a rule but is classified as a terminal",
						head));
			}
		}
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		for (String head : heads){
			nonTerminals.put(head, new NonTerminal(head));
		}
		Map<String, Terminal> terminals = new LinkedHashMap<>();
		List<Production> prods = new ArrayList<>();
		for (Pair<String, List<String>> production : productions){
			List<Symbol> right = new ArrayList<>();
			for (String name : production.second){
				if (isEpsilon(name)){
					right.add(new Epsilon());
				} else if (name.equals(Config.endMarker())){
					throw new MalformedGrammar(String.format("The end marker '%s' is used in a rule of %s",
							name, production.first));
				} else if (classifier.isNonTerminal(name, heads)){
					if (!nonTerminals.containsKey(name)){
						throw new MalformedGrammar(String.format("Non terminal '%s' is used in a rule of %s, " +
								"but has no rules", name, production.first));
					}
					right.add(nonTerminals.get(name));
				} else {
					right.add(terminals.computeIfAbsent(name, Terminal::new));
				}
			}
			prods.add(new Production(prods.size(), nonTerminals.get(production.first), right));
		}
		Grammar grammar = new Grammar(new LinkedHashSet<>(nonTerminals.values()),
				new LinkedHashSet<>(terminals.values()), nonTerminals.get(productions.get(0).first), prods);
		LOG.fine(() -> String.format("Built grammar with %d productions, %d non terminals and %d terminals",
				prods.size(), nonTerminals.size(), terminals.size()));
		return grammar;
	}
}
