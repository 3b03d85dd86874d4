package tdop.grammar;

import tdop.parser.Token;

/**
 * A named method attached to a symbol at registration time, invoked with
 * {@link Token#call(String, Object...)}.
 */
@FunctionalInterface
public interface TokenMethod<C> {
	Object invoke(Token<C> self, Object... args);
}
