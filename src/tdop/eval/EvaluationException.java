package tdop.eval;

import tdop.TDOPException;

/**
 * An error raised while evaluating a token tree: an operand of the wrong type, or a value
 * outside what an operation accepts.
 */
public class EvaluationException extends TDOPException {

	public enum Kind {
		TYPE("Type error"),
		VALUE("Value error");

		private final String prefix;

		Kind(String prefix) {
			this.prefix = prefix;
		}

		public String getPrefix() {
			return prefix;
		}
	}

	private final Kind kind;

	public EvaluationException(Kind kind, String msg) {
		super(kind.getPrefix(), msg);
		this.kind = kind;
	}

	public EvaluationException(Kind kind, String msg, Throwable cause) {
		super(kind.getPrefix(), msg, cause);
		this.kind = kind;
	}

	/**
	 * The error reported when a tree is too deep for the recursive evaluation protocol.
	 */
	public static EvaluationException tooDeeplyNested(StackOverflowError cause) {
		return new EvaluationException(Kind.VALUE, "expression is too deeply nested to evaluate", cause);
	}

	public Kind getKind() {
		return kind;
	}
}
