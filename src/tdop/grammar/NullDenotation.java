package tdop.grammar;

import tdop.parser.Token;

/**
 * The behaviour of a token that begins an expression.
 */
@FunctionalInterface
public interface NullDenotation<C> {
	Token<C> nud(Token<C> self);
}
