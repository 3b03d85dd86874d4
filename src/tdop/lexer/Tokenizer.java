package tdop.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled tokenizer. The pattern has four capture groups, tried in order: literal,
 * symbol, name and unknown. Runs of whitespace are matched by a trailing alternative
 * outside any group, so every position of any input is matched and the tokenizer
 * always makes progress.
 *
 * Instances are immutable and may be shared between threads; each call to
 * {@link #reader(CharSequence)} returns an independent cursor.
 */
public class Tokenizer {

	static final int LITERAL_GROUP = 1;
	static final int SYMBOL_GROUP = 2;
	static final int NAME_GROUP = 3;
	static final int UNKNOWN_GROUP = 4;

	private final Pattern pattern;

	Tokenizer(Pattern pattern) {
		this.pattern = pattern;
	}

	public Pattern getPattern() {
		return pattern;
	}

	public Reader reader(CharSequence source) {
		return new Reader(pattern.matcher(source));
	}

	/**
	 * @return every non-whitespace lexeme of source, in order
	 */
	public List<Lexeme> readLexemes(CharSequence source) {
		List<Lexeme> lexemes = new ArrayList<>();
		Reader reader = reader(source);
		Lexeme lexeme;
		while((lexeme = reader.next()) != null) {
			lexemes.add(lexeme);
		}
		return lexemes;
	}

	public static class Reader {

		private final Matcher matcher;

		Reader(Matcher matcher) {
			this.matcher = matcher;
		}

		/**
		 * @return the next lexeme, whitespace included, or null at the end of the source
		 */
		public Lexeme nextRaw() {
			if(!matcher.find()) {
				return null;
			}
			LexemeType type;
			if(matcher.group(LITERAL_GROUP) != null) {
				type = LexemeType.LITERAL;
			}else if(matcher.group(SYMBOL_GROUP) != null) {
				type = LexemeType.SYMBOL;
			}else if(matcher.group(NAME_GROUP) != null) {
				type = LexemeType.NAME;
			}else if(matcher.group(UNKNOWN_GROUP) != null) {
				type = LexemeType.UNKNOWN;
			}else {
				type = LexemeType.WHITESPACE;
			}
			return new Lexeme(matcher.group(), type, matcher.start(), matcher.end());
		}

		/**
		 * @return the next lexeme that is not whitespace, or null at the end of the source
		 */
		public Lexeme next() {
			Lexeme lexeme;
			do {
				lexeme = nextRaw();
			} while(lexeme != null && lexeme.getType() == LexemeType.WHITESPACE);
			return lexeme;
		}
	}
}
