package tdop.lexer;

import java.util.Objects;

/**
 * One match of a {@link Tokenizer} over some source text: the matched text, the group it was
 * classified into and its [start, end) offsets.
 */
public class Lexeme {

	private final String text;
	private final LexemeType type;
	private final int start;
	private final int end;

	public Lexeme(String text, LexemeType type, int start, int end) {
		this.text = text;
		this.type = type;
		this.start = start;
		this.end = end;
	}

	public String getText() {
		return text;
	}

	public LexemeType getType() {
		return type;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	@Override
	public String toString() {
		return "Lexeme [text=" + text + ", type=" + type + ", start=" + start + ", end=" + end + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Lexeme lexeme = (Lexeme) o;
		return start == lexeme.start && end == lexeme.end && type == lexeme.type &&
				Objects.equals(text, lexeme.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, type, start, end);
	}
}
