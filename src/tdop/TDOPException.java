package tdop;

/**
 * A tdop exception consisting of a prefix (type of error), a message and, when the
 * error can be traced back to the parsed source, the line and column it occurred at.
 *
 */
public abstract class TDOPException extends RuntimeException {
	private final int line;
	private final int column;
	private final String msg;
	private final String prefix;

	public TDOPException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
		this.column = -1;
	}

	public TDOPException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
		this.column = -1;
	}

	public TDOPException(String prefix, String msg, int line, int column) {
		super(prefix + ": " + msg + " at line " + line + ", column " + column);
		this.prefix = prefix;
		this.msg = msg;
		this.line = line;
		this.column = column;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	/**
	 * @return the 1-based line of the error, or -1 if the error has no source position
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return the 1-based column of the error, or -1 if the error has no source position
	 */
	public int getColumn() {
		return column;
	}
}
