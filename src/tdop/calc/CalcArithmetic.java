package tdop.calc;

import tdop.parser.Token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Arithmetic and comparison of calc items. Numbers are integers (BigInteger), decimals
 * (BigDecimal) or floats (Double); mixed operands are promoted along that order.
 */
final class CalcArithmetic {

	private static final int MAX_EXACT_EXPONENT = 100_000;

	private CalcArithmetic() {}

	private enum NumericType {
		INTEGER, DECIMAL, FLOAT
	}

	static String typeName(Object item) {
		if(item instanceof BigInteger) {
			return "integer";
		}else if(item instanceof BigDecimal) {
			return "decimal";
		}else if(item instanceof Double) {
			return "float";
		}else if(item instanceof String) {
			return "string";
		}else if(item instanceof Boolean) {
			return "boolean";
		}
		return item.getClass().getSimpleName();
	}

	static boolean isNumber(Object item) {
		return item instanceof BigInteger || item instanceof BigDecimal || item instanceof Double;
	}

	private static NumericType numericType(Object item) {
		if(item instanceof BigInteger) {
			return NumericType.INTEGER;
		}else if(item instanceof BigDecimal) {
			return NumericType.DECIMAL;
		}
		return NumericType.FLOAT;
	}

	private static NumericType promote(Token<?> token, Object a, Object b) {
		if(!isNumber(a) || !isNumber(b)) {
			throw token.wrongType("unsupported operand types for " + token.getSymbol() + ": " +
					typeName(a) + " and " + typeName(b));
		}
		NumericType ta = numericType(a);
		NumericType tb = numericType(b);
		return ta.compareTo(tb) >= 0 ? ta : tb;
	}

	private static BigDecimal toDecimal(Object item) {
		if(item instanceof BigInteger) {
			return new BigDecimal((BigInteger) item);
		}
		return (BigDecimal) item;
	}

	private static double toDouble(Object item) {
		return ((Number) item).doubleValue();
	}

	static Object negate(Token<?> token, Object a) {
		if(a instanceof BigInteger) {
			return ((BigInteger) a).negate();
		}else if(a instanceof BigDecimal) {
			return ((BigDecimal) a).negate();
		}else if(a instanceof Double) {
			return -(Double) a;
		}
		throw token.wrongType("unsupported operand type for unary " + token.getSymbol() + ": " + typeName(a));
	}

	static Object plus(Token<?> token, Object a) {
		if(!isNumber(a)) {
			throw token.wrongType("unsupported operand type for unary " + token.getSymbol() + ": " + typeName(a));
		}
		return a;
	}

	static Object add(Token<?> token, Object a, Object b) {
		switch(promote(token, a, b)) {
			case INTEGER:
				return ((BigInteger) a).add((BigInteger) b);
			case DECIMAL:
				return toDecimal(a).add(toDecimal(b));
			default:
				return toDouble(a) + toDouble(b);
		}
	}

	static Object subtract(Token<?> token, Object a, Object b) {
		switch(promote(token, a, b)) {
			case INTEGER:
				return ((BigInteger) a).subtract((BigInteger) b);
			case DECIMAL:
				return toDecimal(a).subtract(toDecimal(b));
			default:
				return toDouble(a) - toDouble(b);
		}
	}

	static Object multiply(Token<?> token, Object a, Object b) {
		switch(promote(token, a, b)) {
			case INTEGER:
				return ((BigInteger) a).multiply((BigInteger) b);
			case DECIMAL:
				return toDecimal(a).multiply(toDecimal(b));
			default:
				return toDouble(a) * toDouble(b);
		}
	}

	/**
	 * Division of exact numbers gives a decimal, rounded to 34 digits.
	 */
	static Object divide(Token<?> token, Object a, Object b) {
		if(promote(token, a, b) == NumericType.FLOAT) {
			return toDouble(a) / toDouble(b);
		}
		BigDecimal divisor = toDecimal(b);
		if(divisor.signum() == 0) {
			throw token.wrongValue("division by zero");
		}
		BigDecimal result = toDecimal(a).divide(divisor, MathContext.DECIMAL128).stripTrailingZeros();
		return result.scale() < 0 ? result.setScale(0) : result;
	}

	/**
	 * The remainder of a truncating division; its sign is the sign of the dividend.
	 */
	static Object mod(Token<?> token, Object a, Object b) {
		NumericType type = promote(token, a, b);
		if(type == NumericType.FLOAT) {
			return toDouble(a) % toDouble(b);
		}
		if(toDecimal(b).signum() == 0) {
			throw token.wrongValue("modulo by zero");
		}
		if(type == NumericType.INTEGER) {
			return ((BigInteger) a).remainder((BigInteger) b);
		}
		return toDecimal(a).remainder(toDecimal(b));
	}

	static Object power(Token<?> token, Object a, Object b) {
		NumericType type = promote(token, a, b);
		if(type != NumericType.FLOAT && b instanceof BigInteger && ((BigInteger) b).signum() >= 0) {
			BigInteger exponent = (BigInteger) b;
			if(exponent.compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) > 0) {
				throw token.wrongValue("exponent " + exponent + " is too large");
			}
			if(a instanceof BigInteger) {
				return ((BigInteger) a).pow(exponent.intValue());
			}
			return toDecimal(a).pow(exponent.intValue());
		}
		return Math.pow(toDouble(a), toDouble(b));
	}

	/**
	 * Compares two numbers, two strings or two booleans.
	 * @throws tdop.eval.EvaluationException for any other pair of items
	 */
	static int compare(Token<?> token, Object a, Object b) {
		if(isNumber(a) && isNumber(b)) {
			switch(promote(token, a, b)) {
				case INTEGER:
					return ((BigInteger) a).compareTo((BigInteger) b);
				case DECIMAL:
					return toDecimal(a).compareTo(toDecimal(b));
				default:
					return Double.compare(toDouble(a), toDouble(b));
			}
		}else if(a instanceof String && b instanceof String) {
			return ((String) a).compareTo((String) b);
		}else if(a instanceof Boolean && b instanceof Boolean) {
			return Boolean.compare((Boolean) a, (Boolean) b);
		}
		throw token.wrongType("can't compare " + typeName(a) + " with " + typeName(b));
	}
}
