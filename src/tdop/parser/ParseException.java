package tdop.parser;

import tdop.TDOPException;

/**
 * A syntax error, tied to the token it was detected at.
 */
public class ParseException extends TDOPException {

	private final transient Token<?> token;
	private final String tokenDescription;

	public ParseException(Token<?> token, String msg) {
		super("Parse error", msg, token.getLine(), token.getColumn());
		this.token = token;
		this.tokenDescription = token.toString();
	}

	public Token<?> getToken() {
		return token;
	}

	@Override
	public String getMessage() {
		return tokenDescription + " at line " + getLine() + ", column " + getColumn() + ": " + getMsg();
	}
}
