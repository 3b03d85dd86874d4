package tdop.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Symbols the parser itself produces rather than reads from the source. Their
 * parenthesized spelling keeps them from colliding with any symbol of a language.
 */
public final class SpecialSymbols {
	private SpecialSymbols() {}

	public static final String START = "(start)";
	public static final String END = "(end)";
	public static final String STRING = "(string)";
	public static final String FLOAT = "(float)";
	public static final String DECIMAL = "(decimal)";
	public static final String INTEGER = "(integer)";
	public static final String NAME = "(name)";
	public static final String INVALID = "(invalid)";
	public static final String UNKNOWN = "(unknown)";

	public static final Set<String> ALL = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
			START, END, STRING, FLOAT, DECIMAL, INTEGER, NAME, INVALID, UNKNOWN)));

	public static boolean isSpecial(String symbol) {
		return ALL.contains(symbol);
	}
}
