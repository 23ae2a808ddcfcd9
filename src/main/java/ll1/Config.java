package ll1;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read from {@code ll1.ini} lines of the form {@code key = value}.
 *
 * The defaults ship as a classpath resource, a {@code ll1.ini} in the working directory overrides
 * single keys.
 */
public class Config {

	public static final String configFile = "ll1.ini";

	/**
	 * Parent logger of every logger in this project
	 */
	public static final Logger LOG = Logger.getLogger("ll1");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("emptyMarker", "ε");
		put("endMarker", "$");
		put("logLevel", "INFO");
		put("nonTerminalPolicy", "uppercase");
	}};

	/** Literal that denotes the empty string in a production body */
	public static String emptyMarker(){
		return config.get("emptyMarker");
	}

	/** Name of the end of input marker */
	public static String endMarker(){
		return config.get("endMarker");
	}

	/**
	 * Default classification of symbol names: "uppercase" or "declared"
	 */
	public static String nonTerminalPolicy(){
		return config.get("nonTerminalPolicy");
	}

	public static Level logLevel(){
		return parseLevel(config.get("logLevel"), configFile);
	}

	private static Level parseLevel(String value, String source){
		try {
			return Level.parse(value);
		} catch (IllegalArgumentException e) {
			throw new LL1Exception(String.format("Invalid log level \"%s\" in %s", value, source), e);
		}
	}

	static void load(BufferedReader reader, String source) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.contains(" = ")){
				String[] parts = line.split(" = ", 2);
				String key = parts[0].trim();
				String value = parts[1].trim();
				if (key.equals("logLevel")){
					parseLevel(value, source);
				}
				if (config.containsKey(key)){
					config.put(key, value);
				} else {
					LOG.warning(String.format("Unknown config key \"%s\" in %s", key, source));
				}
			}
		}
	}

	private static void loadConfig(){
		try (InputStream in = Config.class.getResourceAsStream("/" + configFile)) {
			if (in != null){
				load(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), "classpath:" + configFile);
			}
		} catch (IOException e) {
			throw new LL1Exception("Can't read " + configFile + ": " + e.getMessage(), e);
		}
		loadFile(new File(configFile));
	}

	/**
	 * Overrides the keys set in the passed file, if it exists
	 */
	static void loadFile(File file){
		if (file.exists()){
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file),
					StandardCharsets.UTF_8))) {
				load(reader, file.getAbsolutePath());
			} catch (IOException e) {
				throw new LL1Exception("Can't read " + file + ": " + e.getMessage(), e);
			}
		}
		LOG.setLevel(logLevel());
	}

	static {
		loadConfig();
	}
}
