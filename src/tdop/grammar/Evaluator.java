package tdop.grammar;

import tdop.parser.Token;

@FunctionalInterface
public interface Evaluator<C> {
	/**
	 * @param self the token being evaluated
	 * @param context the dynamic context, null during static evaluation
	 * @return a single item, a list of items, or null for the empty sequence
	 */
	Object evaluate(Token<C> self, C context);
}
