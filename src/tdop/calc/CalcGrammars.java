package tdop.calc;

import tdop.eval.Sequences;
import tdop.grammar.Grammar;
import tdop.grammar.GrammarException;
import tdop.grammar.GrammarRegistry;
import tdop.grammar.Role;
import tdop.grammar.SpecialSymbols;
import tdop.grammar.SymbolDefinition;
import tdop.parser.Parser;
import tdop.parser.Token;

import java.math.BigInteger;
import java.util.AbstractList;
import java.util.Collections;
import java.util.Iterator;
import java.util.function.BinaryOperator;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

/**
 * <p>
 * A small expression language in two levels, built on the tdop engine.
 * </p>
 *
 * <p>
 * {@value #LEVEL_1} has string and numeric literals, variables ({@code $name}), arithmetic
 * ({@code + - * div mod ^}), comparisons, {@code and}, {@code or} and the functions
 * {@code not} and {@code number}.
 * </p>
 *
 * <p>
 * {@value #LEVEL_2} extends it with sequences ({@code ,}), integer ranges ({@code to}),
 * unions ({@code |} or {@code union}), conditionals ({@code if (c) then a else b}) and the
 * functions {@code count}, {@code sum}, {@code empty} and {@code trace}.
 * </p>
 */
public final class CalcGrammars {

	public static final String LEVEL_1 = "calc-1.0";
	public static final String LEVEL_2 = "calc-2.0";

	private static final GrammarRegistry<CalcContext> REGISTRY = createRegistry();

	private CalcGrammars() {}

	/**
	 * @return the shared registry of the calc grammar levels
	 */
	public static GrammarRegistry<CalcContext> registry() {
		return REGISTRY;
	}

	/**
	 * @throws GrammarException if there is no calc grammar called name
	 */
	public static Grammar<CalcContext> grammar(String name) {
		Grammar<CalcContext> grammar = REGISTRY.get(name);
		if(grammar == null) {
			throw new GrammarException("unknown grammar '" + name + "', expected one of " + REGISTRY.names());
		}
		return grammar;
	}

	public static Parser<CalcContext> parser(String name) {
		return new Parser<>(grammar(name));
	}

	/**
	 * Builds a new registry holding both calc levels.
	 */
	public static GrammarRegistry<CalcContext> createRegistry() {
		GrammarRegistry<CalcContext> registry = new GrammarRegistry<>();
		Grammar<CalcContext> level1 = registry.define(LEVEL_1);
		defineLevel1(level1);
		Grammar<CalcContext> level2 = registry.define(LEVEL_2, LEVEL_1);
		defineLevel2(level2);
		level1.build();
		level2.build();
		return registry;
	}

	private static void defineLevel1(Grammar<CalcContext> g) {
		g.literal(SpecialSymbols.STRING);
		g.literal(SpecialSymbols.INTEGER);
		g.literal(SpecialSymbols.DECIMAL);
		g.literal(SpecialSymbols.FLOAT);
		g.register(SpecialSymbols.NAME);

		g.register(")");
		g.register(",");
		g.register("(", SymbolDefinition.<CalcContext>define()
				.nud(self -> {
					Parser<CalcContext> parser = self.getParser();
					if(!parser.getNextToken().getSymbol().equals(")")) {
						self.setChildren(parser.expression());
					}
					parser.advance(")");
					return self;
				})
				.evaluate((self, context) -> self.arity() == 0 ? null : self.get(0).evaluate(context))
				.select((self, context) -> self.arity() == 0 ? Stream.empty() : self.get(0).select(context))
				.method("source", (self, args) -> self.arity() == 0 ? "()" : "(" + self.get(0).source() + ")"));

		g.register("$", SymbolDefinition.<CalcContext>define()
				.label(Role.OPERATOR)
				.rbp(90)
				.nud(self -> {
					Parser<CalcContext> parser = self.getParser();
					parser.expectedNext(SpecialSymbols.NAME);
					self.setChildren(parser.advance());
					return self;
				})
				.evaluate(CalcGrammars::variable)
				.method("source", (self, args) -> "$" + self.get(0).getValue()));

		g.infix("+", 40);
		g.method("+").nud(self -> {
			self.setChildren(self.getParser().expression(70));
			return self;
		}).evaluate((self, context) -> {
			if(self.arity() == 1) {
				Object operand = operand(self, 0, context);
				return operand == null ? null : CalcArithmetic.plus(self, operand);
			}
			return binary(self, context, (a, b) -> CalcArithmetic.add(self, a, b));
		});

		g.infix("-", 40);
		g.method("-").nud(self -> {
			self.setChildren(self.getParser().expression(70));
			return self;
		}).evaluate((self, context) -> {
			if(self.arity() == 1) {
				Object operand = operand(self, 0, context);
				return operand == null ? null : CalcArithmetic.negate(self, operand);
			}
			return binary(self, context, (a, b) -> CalcArithmetic.subtract(self, a, b));
		});

		g.infix("*", 50);
		g.method("*").evaluate((self, context) ->
				binary(self, context, (a, b) -> CalcArithmetic.multiply(self, a, b)));
		g.infix("div", 50);
		g.method("div").evaluate((self, context) ->
				binary(self, context, (a, b) -> CalcArithmetic.divide(self, a, b)));
		g.infix("mod", 50);
		g.method("mod").evaluate((self, context) ->
				binary(self, context, (a, b) -> CalcArithmetic.mod(self, a, b)));
		g.infixr("^", 60);
		g.method("^").evaluate((self, context) ->
				binary(self, context, (a, b) -> CalcArithmetic.power(self, a, b)));

		comparison(g, "=", c -> c == 0);
		comparison(g, "!=", c -> c != 0);
		comparison(g, "<", c -> c < 0);
		comparison(g, "<=", c -> c <= 0);
		comparison(g, ">", c -> c > 0);
		comparison(g, ">=", c -> c >= 0);

		g.infix("and", 15);
		g.method("and").evaluate((self, context) ->
				Sequences.booleanValue(self, self.get(0).select(context)) &&
						Sequences.booleanValue(self, self.get(1).select(context)));
		g.infix("or", 10);
		g.method("or").evaluate((self, context) ->
				Sequences.booleanValue(self, self.get(0).select(context)) ||
						Sequences.booleanValue(self, self.get(1).select(context)));

		CalcFunctions.registerLevel1(g);
	}

	private static void defineLevel2(Grammar<CalcContext> g) {
		g.infix(",", 5);
		g.register(",", SymbolDefinition.<CalcContext>define()
				.method("source", (self, args) -> self.get(0).source() + ", " + self.get(1).source()));
		g.method(",").select((self, context) -> self.getChildren().stream()
				.flatMap(child -> child.select(context)));

		g.infix("to", 30);
		g.method("to").evaluate(CalcGrammars::range).select((self, context) -> {
			BigInteger[] bounds = rangeBounds(self, context);
			if(bounds == null) {
				return Stream.empty();
			}
			return rangeStream(bounds[0], bounds[1]);
		});

		g.infix("|", 25);
		g.method("|").select((self, context) ->
				Stream.concat(self.get(0).select(context), self.get(1).select(context)).distinct());
		g.duplicate("|", "union");

		g.register("then");
		g.register("else");
		g.register("if", SymbolDefinition.<CalcContext>define()
				.label(Role.OPERATOR)
				.rbp(5)
				.nud(self -> {
					Parser<CalcContext> parser = self.getParser();
					parser.advance("(");
					Token<CalcContext> condition = parser.expression();
					parser.advance(")");
					parser.advance("then");
					Token<CalcContext> then = parser.expression(5);
					parser.advance("else");
					self.setChildren(condition, then, parser.expression(5));
					return self;
				})
				.select((self, context) -> Sequences.booleanValue(self, self.get(0).select(context))
						? self.get(1).select(context)
						: self.get(2).select(context))
				.method("source", (self, args) -> "if (" + self.get(0).source() + ") then " +
						self.get(1).source() + " else " + self.get(2).source()));

		CalcFunctions.registerLevel2(g);
	}

	private static void comparison(Grammar<CalcContext> g, String symbol, IntPredicate test) {
		g.infix(symbol, 20);
		g.method(symbol).evaluate((self, context) ->
				binary(self, context, (a, b) -> test.test(CalcArithmetic.compare(self, a, b))));
	}

	/**
	 * @return the single item of the index-th operand, or null if the operand is empty
	 */
	private static Object operand(Token<CalcContext> self, int index, CalcContext context) {
		return Sequences.single(self, self.get(index).select(context));
	}

	/**
	 * Applies a binary operation to the items of both operands. An empty operand gives an
	 * empty result.
	 */
	private static Object binary(Token<CalcContext> self, CalcContext context, BinaryOperator<Object> op) {
		Object a = operand(self, 0, context);
		Object b = operand(self, 1, context);
		if(a == null || b == null) {
			return null;
		}
		return op.apply(a, b);
	}

	private static Object variable(Token<CalcContext> self, CalcContext context) {
		if(context == null) {
			throw self.missingContext();
		}
		String name = (String) self.get(0).getValue();
		if(!context.hasVariable(name)) {
			throw self.wrongValue("unknown variable '$" + name + "'");
		}
		return context.getVariable(name);
	}

	/**
	 * @return the first and last integer of a range, or null for an empty range
	 */
	private static BigInteger[] rangeBounds(Token<CalcContext> self, CalcContext context) {
		Object start = operand(self, 0, context);
		Object end = operand(self, 1, context);
		if(start == null || end == null) {
			return null;
		}
		if(!(start instanceof BigInteger) || !(end instanceof BigInteger)) {
			throw self.wrongType("range bounds must be integers, got " + CalcArithmetic.typeName(start) +
					" and " + CalcArithmetic.typeName(end));
		}
		BigInteger first = (BigInteger) start;
		BigInteger last = (BigInteger) end;
		if(first.compareTo(last) > 0) {
			return null;
		}
		return new BigInteger[] {first, last};
	}

	private static Object range(Token<CalcContext> self, CalcContext context) {
		BigInteger[] bounds = rangeBounds(self, context);
		if(bounds == null) {
			return Collections.emptyList();
		}
		return new RangeList(bounds[0], bounds[1]);
	}

	private static Stream<Object> rangeStream(BigInteger first, BigInteger last) {
		return Stream.iterate(first, i -> i.compareTo(last) <= 0, i -> i.add(BigInteger.ONE))
				.map(i -> (Object) i);
	}

	/**
	 * The integers of a range, computed on access. A range of more than Integer.MAX_VALUE
	 * items reports Integer.MAX_VALUE as its size and can only be indexed up to that size,
	 * but its iterator and stream go through all of it.
	 */
	private static final class RangeList extends AbstractList<Object> {
		private static final BigInteger MAX_SIZE = BigInteger.valueOf(Integer.MAX_VALUE);

		private final BigInteger first;
		private final BigInteger last;
		private final int size;

		RangeList(BigInteger first, BigInteger last) {
			this.first = first;
			this.last = last;
			this.size = last.subtract(first).add(BigInteger.ONE).min(MAX_SIZE).intValue();
		}

		@Override
		public Object get(int index) {
			if(index < 0 || index >= size) {
				throw new IndexOutOfBoundsException("index " + index + " of range of size " + size);
			}
			return first.add(BigInteger.valueOf(index));
		}

		@Override
		public int size() {
			return size;
		}

		@Override
		public Iterator<Object> iterator() {
			return stream().iterator();
		}

		@Override
		public Stream<Object> stream() {
			return rangeStream(first, last);
		}
	}
}
