package ll1;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import ll1.grammar.*;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	private String savedSettings;

	private Level savedLevel;

	private final List<LogRecord> records = new ArrayList<>();

	private final Handler handler = new Handler() {
		@Override
		public void publish(LogRecord record) {
			records.add(record);
		}

		@Override
		public void flush() {
		}

		@Override
		public void close() {
		}
	};

	static void load(String text) throws IOException {
		Config.load(new BufferedReader(new StringReader(text)), "test");
	}

	@BeforeEach
	public void save(){
		savedSettings = "emptyMarker = " + Config.emptyMarker() + "\n" +
				"endMarker = " + Config.endMarker() + "\n" +
				"nonTerminalPolicy = " + Config.nonTerminalPolicy() + "\n" +
				"logLevel = " + Config.logLevel().getName();
		savedLevel = Config.LOG.getLevel();
		Config.LOG.addHandler(handler);
	}

	@AfterEach
	public void restore() throws IOException {
		Config.LOG.removeHandler(handler);
		load(savedSettings);
		Config.LOG.setLevel(savedLevel);
	}

	@Test
	public void testDefaults(){
		assertEquals("ε", Config.emptyMarker());
		assertEquals("$", Config.endMarker());
		assertEquals("uppercase", Config.nonTerminalPolicy());
		assertEquals(Level.INFO, Config.logLevel());
	}

	@Test
	public void testOverrideSingleKey() throws IOException {
		load("endMarker = #\nno separator here");
		assertEquals("#", Config.endMarker());
		assertEquals("ε", Config.emptyMarker());
		assertEquals("#", new EndMarker().name);
	}

	@Test
	public void testWorkingDirectoryFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve(Config.configFile);
		Files.write(file, Arrays.asList("emptyMarker = eps", "logLevel = WARNING"), StandardCharsets.UTF_8);
		Config.loadFile(file.toFile());
		assertEquals("eps", Config.emptyMarker());
		assertEquals("$", Config.endMarker());
		assertEquals(Level.WARNING, Config.LOG.getLevel());
	}

	@Test
	public void testMissingWorkingDirectoryFile(@TempDir Path dir){
		Config.loadFile(dir.resolve(Config.configFile).toFile());
		assertEquals("$", Config.endMarker());
	}

	@Test
	public void testUnknownKeyIsLogged() throws IOException {
		load("colour = blue");
		assertEquals(1, records.size());
		assertEquals(Level.WARNING, records.get(0).getLevel());
		assertTrue(records.get(0).getMessage().contains("colour"));
	}

	@Test
	public void testInvalidLogLevel(){
		LL1Exception error = assertThrows(LL1Exception.class, () -> load("logLevel = LOUD"));
		assertTrue(error.getMessage().contains("LOUD"));
		assertEquals(Level.INFO, Config.logLevel());
	}

	@Test
	public void testDeclaredPolicy() throws IOException {
		load("nonTerminalPolicy = declared");
		SymbolClassifier classifier = SymbolClassifier.fromConfig();
		Set<String> heads = Collections.singleton("expr");
		assertTrue(classifier.isNonTerminal("expr", heads));
		assertFalse(classifier.isNonTerminal("NUM", heads));
		Grammar grammar = new GrammarBuilder().add("expr", "NUM").add("expr", "(", "expr", ")").toGrammar();
		assertEquals(Collections.singleton(new NonTerminal("expr")), grammar.getNonTerminals());
	}

	@Test
	public void testUppercasePolicy(){
		SymbolClassifier classifier = SymbolClassifier.fromConfig();
		assertTrue(classifier.isNonTerminal("EXPR", Collections.emptySet()));
		assertFalse(classifier.isNonTerminal("num", Collections.emptySet()));
	}

	@Test
	public void testUnknownPolicy() throws IOException {
		load("nonTerminalPolicy = alphabetical");
		assertThrows(LL1Exception.class, SymbolClassifier::fromConfig);
		assertThrows(LL1Exception.class, GrammarBuilder::new);
	}
}
