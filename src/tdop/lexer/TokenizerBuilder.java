package tdop.lexer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Assembles the single regular expression a {@link Tokenizer} runs.
 *
 * <p>Symbols are partitioned into four families, which appear in the symbol group in this
 * order:</p>
 * <ul>
 *     <li>multi-character symbols, longest first, so that {@code >=} is never lexed as
 *     {@code >} followed by {@code =};</li>
 *     <li>single-character symbols, as one character class;</li>
 *     <li>name-like symbols (those the name pattern matches at their start), longest first
 *     and between word boundaries, so that {@code div} does not match the start of
 *     {@code divisor};</li>
 *     <li>custom patterns, verbatim.</li>
 * </ul>
 *
 * <p>The complete pattern is {@code (literal)|(symbols)|(name)|(\S)|\s+}.</p>
 */
public class TokenizerBuilder {

	private final Pattern literalsPattern;
	private final Pattern namePattern;

	private final List<String> stringPatterns = new ArrayList<>();
	private final List<String> characterPatterns = new ArrayList<>();
	private final List<String> namePatterns = new ArrayList<>();
	private final Set<String> customPatterns = new LinkedHashSet<>();

	public TokenizerBuilder(Pattern literalsPattern, Pattern namePattern) {
		this.literalsPattern = literalsPattern;
		this.namePattern = namePattern;
	}

	/**
	 * Adds a symbol to the tokenizer.
	 * @param symbol the surface text of the symbol
	 * @param customPattern a regex matching the symbol, used verbatim instead of the symbol
	 *                      text, or null
	 * @return this builder
	 */
	public TokenizerBuilder addSymbol(String symbol, String customPattern) {
		if(customPattern != null) {
			customPatterns.add(customPattern);
		}else if(namePattern.matcher(symbol).lookingAt()) {
			namePatterns.add(escape(symbol));
		}else if(symbol.length() == 1) {
			characterPatterns.add(escape(symbol));
		}else {
			stringPatterns.add(escape(symbol));
		}
		return this;
	}

	public TokenizerBuilder addSymbol(String symbol) {
		return addSymbol(symbol, null);
	}

	public Tokenizer build() {
		List<String> symbolsPatterns = new ArrayList<>();
		if(!stringPatterns.isEmpty()) {
			symbolsPatterns.add(longestFirst(stringPatterns));
		}
		if(!characterPatterns.isEmpty()) {
			symbolsPatterns.add("[" + String.join("", characterPatterns) + "]");
		}
		if(!namePatterns.isEmpty()) {
			symbolsPatterns.add("\\b(?:" + longestFirst(namePatterns) + ")\\b(?![\\-.])");
		}
		if(!customPatterns.isEmpty()) {
			symbolsPatterns.add(String.join("|", customPatterns));
		}
		// a group that can never match keeps the group numbering when there are no symbols
		String symbols = symbolsPatterns.isEmpty() ? "(?!)" : String.join("|", symbolsPatterns);
		String pattern = "(" + literalsPattern.pattern() + ")|(" + symbols + ")|(" + namePattern.pattern() +
				")|(\\S)|\\s+";
		return new Tokenizer(Pattern.compile(pattern));
	}

	private static String longestFirst(List<String> patterns) {
		// stable, so symbols of equal length keep their registration order
		return patterns.stream()
				.sorted(Comparator.comparingInt(String::length).reversed())
				.collect(Collectors.joining("|"));
	}

	/**
	 * Escapes every character that is not a letter or a digit. A backslash before a
	 * non-alphanumeric character is always a literal in Java regexes, both inside and
	 * outside character classes.
	 */
	static String escape(String symbol) {
		StringBuilder sb = new StringBuilder(symbol.length() * 2);
		symbol.codePoints().forEach(cp -> {
			if(!Character.isLetterOrDigit(cp)) {
				sb.append('\\');
			}
			sb.appendCodePoint(cp);
		});
		return sb.toString();
	}
}
