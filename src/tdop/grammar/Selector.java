package tdop.grammar;

import tdop.parser.Token;

import java.util.stream.Stream;

@FunctionalInterface
public interface Selector<C> {
	/**
	 * @param self the token being selected from
	 * @param context the dynamic context, null during static evaluation
	 * @return the lazily produced items; a new call runs the selection again
	 */
	Stream<Object> select(Token<C> self, C context);
}
