package tdop.eval;

import tdop.parser.Token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Conversions between the two shapes a token produces: the result of evaluate (a single
 * item, a list of items, or null for the empty sequence) and the stream returned by select.
 */
public final class Sequences {

	private Sequences() {}

	/**
	 * @return the items of an evaluation result, a list being flattened by one level
	 */
	public static Stream<Object> of(Object value) {
		if(value == null) {
			return Stream.empty();
		}
		if(value instanceof List) {
			return ((List<?>) value).stream().map(item -> (Object) item);
		}
		return Stream.of(value);
	}

	/**
	 * @return null for an empty stream, its item for a singleton
	 * @throws EvaluationException if the stream has more than one item
	 */
	public static Object single(Token<?> token, Stream<Object> items) {
		Iterator<Object> it = items.iterator();
		if(!it.hasNext()) {
			return null;
		}
		Object first = it.next();
		if(it.hasNext()) {
			throw token.wrongType("a sequence of more than one item is not allowed as operand of " + token);
		}
		return first;
	}

	/**
	 * The effective boolean value: false for the empty sequence, the value of a single
	 * boolean, false for a zero number or an empty string and true for any other single item.
	 * @throws EvaluationException for a sequence of more than one item
	 */
	public static boolean booleanValue(Token<?> token, Stream<Object> items) {
		Object item = single(token, items);
		if(item == null) {
			return false;
		}else if(item instanceof Boolean) {
			return (Boolean) item;
		}else if(item instanceof String) {
			return !((String) item).isEmpty();
		}else if(item instanceof BigInteger) {
			return ((BigInteger) item).signum() != 0;
		}else if(item instanceof BigDecimal) {
			return ((BigDecimal) item).signum() != 0;
		}else if(item instanceof Double) {
			double d = (Double) item;
			return d != 0 && !Double.isNaN(d);
		}
		return true;
	}
}
