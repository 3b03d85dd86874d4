package tdop.grammar;

import tdop.parser.Token;

/**
 * The behaviour of a token that follows an already parsed left operand.
 */
@FunctionalInterface
public interface LeftDenotation<C> {
	Token<C> led(Token<C> self, Token<C> left);
}
