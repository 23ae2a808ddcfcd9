package ll1.grammar;

import java.util.*;
import java.util.logging.Logger;

import guru.nidi.graphviz.attribute.Color;
import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import static guru.nidi.graphviz.model.Factory.mutGraph;
import static guru.nidi.graphviz.model.Factory.mutNode;

/**
 * Finds direct and indirect left recursion.
 *
 * Indirect left recursion is found on the left derivation graph: it has an edge A → B iff a production of A
 * starts with B after a possibly empty prefix of nullable non terminals. The edge A → A of a directly left
 * recursive production is left out, so that a non terminal with a cycle is indirectly left recursive.
 * Nullability needs the FIRST sets, the direct check doesn't.
 */
public class LeftRecursionDetector {

	private static final Logger LOG = Logger.getLogger("ll1.grammar.recursion");

	public final Grammar grammar;

	private final FirstFollowSets sets;

	private Graph<NonTerminal, DefaultEdge> derivationGraph;

	public LeftRecursionDetector(FirstFollowSets sets) {
		this.grammar = sets.grammar;
		this.sets = sets;
	}

	public LeftRecursion detect(){
		LeftRecursion result = new LeftRecursion(findDirectLeftRecursion(), findIndirectLeftRecursion());
		if (result.isLeftRecursive()){
			LOG.fine(() -> "Grammar is left recursive, " + result);
		}
		return result;
	}

	/**
	 * Productions of the form A → A β
	 */
	public Set<Production> findDirectLeftRecursion(){
		Set<Production> ret = new LinkedHashSet<>();
		for (Production production : grammar.getProductions()){
			if (production.isDirectlyLeftRecursive()){
				ret.add(production);
			}
		}
		return ret;
	}

	/**
	 * Non terminals that reach themselves in the left derivation graph
	 */
	public Set<NonTerminal> findIndirectLeftRecursion(){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (reachesItself(nonTerminal)){
				ret.add(nonTerminal);
			}
		}
		return ret;
	}

	/**
	 * Iterative depth first search, every node is expanded at most once.
	 */
	private boolean reachesItself(NonTerminal start){
		Graph<NonTerminal, DefaultEdge> graph = getDerivationGraph();
		Deque<NonTerminal> depthFirstStack = new ArrayDeque<>(Graphs.successorListOf(graph, start));
		Set<NonTerminal> visited = new HashSet<>();
		while (!depthFirstStack.isEmpty()){
			NonTerminal current = depthFirstStack.pop();
			if (current.equals(start)){
				return true;
			}
			if (visited.add(current)){
				for (NonTerminal successor : Graphs.successorListOf(graph, current)){
					if (!visited.contains(successor)){
						depthFirstStack.push(successor);
					}
				}
			}
		}
		return false;
	}

	public Graph<NonTerminal, DefaultEdge> getDerivationGraph(){
		if (derivationGraph == null){
			derivationGraph = new AsUnmodifiableGraph<>(buildDerivationGraph());
		}
		return derivationGraph;
	}

	private Graph<NonTerminal, DefaultEdge> buildDerivationGraph(){
		Graph<NonTerminal, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			graph.addVertex(nonTerminal);
		}
		for (Production production : grammar.getProductions()){
			for (int i = 0; i < production.right.size(); i++){
				Symbol symbol = production.right.get(i);
				if (!(symbol instanceof NonTerminal)){
					break;
				}
				if (i != 0 || !symbol.equals(production.left)){
					graph.addEdge(production.left, (NonTerminal)symbol);
				}
				if (!sets.isNullable(symbol)){
					break;
				}
			}
		}
		return graph;
	}

	/**
	 * The left derivation graph in the dot format, left recursive non terminals are colored red.
	 */
	public String toDot(){
		Graph<NonTerminal, DefaultEdge> graph = getDerivationGraph();
		LeftRecursion recursion = detect();
		Set<NonTerminal> recursive = recursion.nonTerminals();
		Map<NonTerminal, MutableNode> nodes = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : graph.vertexSet()){
			MutableNode node = mutNode(nonTerminal.name).add(Label.of(nonTerminal.name));
			if (recursive.contains(nonTerminal)){
				node.add(Color.RED);
			}
			nodes.put(nonTerminal, node);
		}
		for (DefaultEdge edge : graph.edgeSet()){
			nodes.get(graph.getEdgeSource(edge)).addLink(nodes.get(graph.getEdgeTarget(edge)));
		}
		for (Production production : recursion.directProductions){
			nodes.get(production.left).addLink(nodes.get(production.left));
		}
		MutableGraph dot = mutGraph("left derivations").setDirected(true);
		for (MutableNode node : nodes.values()){
			dot.add(node);
		}
		return dot.toString();
	}
}
