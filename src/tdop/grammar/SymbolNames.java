package tdop.grammar;

import java.util.regex.Pattern;

/**
 * Derives the deterministic descriptor class name of a symbol. Characters that cannot
 * appear in an identifier are spelled out through their Unicode names, so {@code >=}
 * becomes {@code GreaterThanSignEqualsSign}.
 */
public final class SymbolNames {
	private SymbolNames() {}

	private static final Pattern ALNUM = Pattern.compile("[\\p{L}\\p{N}]+");
	private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

	public static String toClassName(String symbol) {
		if(ALNUM.matcher(symbol).matches()) {
			return titleCase(symbol);
		}else if(SpecialSymbols.isSpecial(symbol)) {
			return titleCase(symbol.substring(1, symbol.length() - 1));
		}else if(symbol.chars().allMatch(c -> c == '-' || c == '_')) {
			StringBuilder names = new StringBuilder();
			symbol.codePoints().forEach(cp -> {
				if(names.length() > 0) {
					names.append(' ');
				}
				names.append(unicodeName(cp));
			});
			return stripSeparators(titleCase(names.toString()));
		}

		String value = symbol.replace('-', '_');
		if(IDENTIFIER.matcher(value).matches()) {
			return titleCase(value).replace("_", "");
		}

		StringBuilder sb = new StringBuilder();
		symbol.codePoints().forEach(cp -> {
			if(Character.isLetterOrDigit(cp) || cp == '_') {
				sb.appendCodePoint(cp);
			}else {
				sb.append(titleCase(unicodeName(cp))).append('_');
			}
		});
		return stripSeparators(sb.toString());
	}

	/**
	 * @return the name of the descriptor class of symbol when registered with label
	 */
	public static String tokenClassName(String symbol, Label label) {
		return "_" + toClassName(symbol) + titleCase(label.toString()).replace(" ", "");
	}

	/**
	 * Upper-cases the first letter of every run of letters and lower-cases the rest.
	 */
	static String titleCase(String s) {
		StringBuilder sb = new StringBuilder(s.length());
		boolean previousIsLetter = false;
		for(int i = 0; i < s.length(); ) {
			int cp = s.codePointAt(i);
			if(Character.isLetter(cp)) {
				sb.appendCodePoint(previousIsLetter ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
				previousIsLetter = true;
			}else {
				sb.appendCodePoint(cp);
				previousIsLetter = false;
			}
			i += Character.charCount(cp);
		}
		return sb.toString();
	}

	private static String unicodeName(int codePoint) {
		String name = Character.getName(codePoint);
		return name != null ? name : String.format("U%04X", codePoint);
	}

	private static String stripSeparators(String s) {
		return s.replace(" ", "").replace("-", "").replace("_", "");
	}
}
