package tdop.lexer;

public enum LexemeType {
	LITERAL,
	SYMBOL,
	NAME,
	// any single non-space character not matched by the other groups
	UNKNOWN,
	// only returned by raw reads, see Tokenizer.Reader#nextRaw
	WHITESPACE,
}
