package tdop.eval;

import tdop.TDOPException;

/**
 * Signals that a token can't be evaluated without a dynamic context. The static evaluation
 * pass of {@link tdop.parser.Parser#parse(String)} expects it and moves on; everywhere else it
 * is an ordinary error.
 */
public class MissingContextException extends TDOPException {

	public MissingContextException(String msg) {
		super("Missing context", msg);
	}
}
