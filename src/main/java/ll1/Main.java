package ll1;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ll1.grammar.*;
import ll1.parser.ll.*;

/**
 * Command line driver
 *
 * <pre>
 * Main [--trace] [--dot] GRAMMAR_FILE [INPUT...]
 * </pre>
 *
 * Prints the FIRST and FOLLOW sets, the parsing table and its conflicts and parses each INPUT (a whitespace
 * separated token string). Without arguments it runs on an arithmetic expression grammar.
 */
public class Main {

	static final String EXPRESSION_GRAMMAR = "E -> T EREST\n" +
			"EREST -> + T EREST | ε\n" +
			"T -> F TREST\n" +
			"TREST -> * F TREST | ε\n" +
			"F -> ( E ) | num";

	static final List<String> EXPRESSION_INPUTS = Arrays.asList("num + num * num", "( num + num ) * num",
			"num * num +");

	public static void main(String[] args) {
		try {
			System.exit(run(args, System.out));
		} catch (IOException | LL1Exception e) {
			System.err.println(e.getMessage());
			System.exit(2);
		}
	}

	/**
	 * @return 0 if all inputs were accepted, 1 if the grammar isn't LL(1) or an input was rejected
	 */
	static int run(String[] args, PrintStream out) throws IOException {
		boolean trace = false;
		boolean dot = false;
		List<String> rest = new ArrayList<>();
		for (String arg : args){
			if (arg.equals("--trace")){
				trace = true;
			} else if (arg.equals("--dot")){
				dot = true;
			} else {
				rest.add(arg);
			}
		}
		List<Rule> rules;
		List<String> inputs;
		if (rest.isEmpty()){
			rules = GrammarNotation.parse(EXPRESSION_GRAMMAR);
			inputs = EXPRESSION_INPUTS;
			trace = true;
		} else {
			rules = GrammarNotation.read(Paths.get(rest.get(0)));
			inputs = rest.subList(1, rest.size());
		}
		Grammar grammar = LL1.buildGrammar(rules);
		out.println(grammar);
		out.println();
		if (dot){
			out.println(new LeftRecursionDetector(new FirstFollowSets(grammar)).toDot());
		}
		ValidationResult validation = LL1.validate(grammar);
		if (validation.isLeftRecursive()){
			out.println(validation);
			return 1;
		}
		LLAnalysis analysis = LL1.analyze(grammar);
		out.println(analysis);
		if (!validation.isLL1()){
			return 1;
		}
		LLParser parser = new LLParser(analysis);
		int exitCode = 0;
		for (String input : inputs){
			out.println();
			out.println("=== " + input + " ===");
			ParseResult result;
			if (trace){
				ParseTrace parseTrace = parser.parseTraced(input);
				out.println(parseTrace);
				result = parseTrace.result;
			} else {
				result = parser.parse(input);
				out.println(result);
			}
			if (!result.accepted){
				exitCode = 1;
			}
		}
		return exitCode;
	}
}
