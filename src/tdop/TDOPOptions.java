package tdop;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;
import tdop.calc.CalcGrammars;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TDOPOptions {
	public static final String VERSION = "0.1.0";

	public static final String GRAMMAR_FIELD = "grammar";
	public static final String STATIC_EVALUATION_FIELD = "static_evaluation";
	public static final String VARIABLES_FIELD = "variables";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "-f path to a file holding an expression to evaluate")
	public String expressionFilePath;

	@Option(value = "-t Print the token tree of each expression", aliases = { "-tree" })
	public boolean printTree = false;

	@Option(value = "-s Print the normalized source of each expression", aliases = { "-source" })
	public boolean printSource = false;

	@Option(value = "-g name of the grammar level, overrides the configuration file")
	public String grammarName;

	// fields extracted from the JSON configuration file, or their defaults
	public String grammar = CalcGrammars.LEVEL_2;
	public boolean staticEvaluation = true;
	public Map<String, Object> variables = Collections.emptyMap();

	public List<String> expressions = Collections.emptyList();

	private final Options plumeOptions;
	private final String[] args;
	private String[] remainingArgs;

	public TDOPOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("tdop [options] expression...", this);
	}

	public void printHelp(PrintStream out) {
		plumeOptions.printUsage(out);
	}

	public void parse() throws TDOPOptionException {
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new TDOPOptionException(e.getMessage(), e);
		}

		if (version || help) {
			return;
		}

		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new TDOPOptionException("Error reading configuration file: " + ex.getMessage(), ex);
			}
			loadConfig(configFilePath, s);
		}

		if (grammarName != null) {
			grammar = grammarName;
		}

		List<String> collected = new ArrayList<>(Arrays.asList(remainingArgs));
		if (expressionFilePath != null) {
			try {
				collected.add(FileUtils.readFileToString(new File(expressionFilePath), StandardCharsets.UTF_8));
			} catch (IOException ex) {
				throw new TDOPOptionException("Error reading expression file: " + ex.getMessage(), ex);
			}
		}
		if (collected.isEmpty()) {
			throw new TDOPOptionException("At least an expression is required");
		}
		expressions = collected;
	}

	/**
	 * Reads the fields of a JSON configuration. Absent fields keep their defaults.
	 *
	 * @param origin where the configuration comes from, for error messages
	 */
	public void loadConfig(String origin, String json) throws TDOPOptionException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new TDOPOptionException(origin + ": parsing error: " + e.getMessage(), e);
		}

		try {
			grammar = config.optString(GRAMMAR_FIELD, grammar);
			staticEvaluation = config.optBoolean(STATIC_EVALUATION_FIELD, staticEvaluation);
			if (config.has(VARIABLES_FIELD)) {
				JSONObject vars = config.getJSONObject(VARIABLES_FIELD);
				Map<String, Object> values = new LinkedHashMap<>();
				for (String name : vars.keySet()) {
					values.put(name, toItem(origin, name, vars.get(name)));
				}
				variables = values;
			}
		} catch (JSONException e) {
			throw new TDOPOptionException(origin + ": " + e.getMessage(), e);
		}
	}

	private static Object toItem(String origin, String name, Object value) throws TDOPOptionException {
		if (value instanceof String || value instanceof Boolean) {
			return value;
		} else if (value instanceof Number) {
			// same classification as numeric literals in expressions
			String text = value.toString();
			if (text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
				return ((Number) value).doubleValue();
			} else if (text.indexOf('.') >= 0) {
				return new BigDecimal(text);
			}
			return new BigInteger(text);
		} else if (value instanceof JSONArray) {
			JSONArray array = (JSONArray) value;
			List<Object> items = new ArrayList<>();
			for (int i = 0; i < array.length(); i++) {
				Object item = array.get(i);
				if (item instanceof JSONArray) {
					throw new TDOPOptionException(origin + ": variable " + name + ": nested arrays are not allowed");
				}
				items.add(toItem(origin, name, item));
			}
			return items;
		}
		throw new TDOPOptionException(origin + ": variable " + name + ": unsupported value " + value);
	}
}
