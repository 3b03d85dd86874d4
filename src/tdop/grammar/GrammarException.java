package tdop.grammar;

import tdop.TDOPException;

/**
 * Raised while a grammar is being built: an invalid symbol, a descriptor that does not
 * belong to the grammar, or a second grammar defined under the same name.
 */
public class GrammarException extends TDOPException {

	private static final long serialVersionUID = 4619203750129366612L;
	private static final String prefix = "Grammar error";

	public GrammarException(String msg) {
		super(prefix, msg);
	}

}
