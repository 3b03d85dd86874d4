package tdop.calc;

import tdop.eval.Sequences;
import tdop.grammar.Evaluator;
import tdop.grammar.Grammar;
import tdop.grammar.Label;
import tdop.grammar.Role;
import tdop.grammar.SpecialSymbols;
import tdop.grammar.SymbolDefinition;
import tdop.parser.Parser;
import tdop.parser.Token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The functions of the calc grammars. A function call is the function symbol followed by a
 * parenthesized, comma separated argument list; the arguments become the children of the
 * function token.
 */
final class CalcFunctions {

	private static final Logger logger = Logger.getLogger(CalcFunctions.class.getName());

	private static final int FUNCTION_BP = 90;
	private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
	private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(?:\\d+\\.\\d*|\\.\\d+)");
	private static final Pattern FLOAT_PATTERN = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)[Ee][+-]?\\d+");

	private CalcFunctions() {}

	static void function(Grammar<CalcContext> grammar, String name, int minArgs, int maxArgs,
						 Evaluator<CalcContext> evaluator) {
		function(grammar, name, minArgs, maxArgs, SymbolDefinition.<CalcContext>define()
				.label(Role.FUNCTION)
				.evaluate(evaluator));
	}

	/**
	 * Registers a function with a fixed arity range. The definition supplies the label and
	 * the evaluation protocol; parsing of the argument list and the source rendering are
	 * added here. The name is a symbol only when an argument list follows, elsewhere it
	 * is lexed as a (name).
	 */
	static void function(Grammar<CalcContext> grammar, String name, int minArgs, int maxArgs,
						 SymbolDefinition<CalcContext> definition) {
		grammar.register(name, definition
				.pattern("\\b" + name + "(?=\\s*\\()")
				.lbp(FUNCTION_BP)
				.rbp(FUNCTION_BP)
				.nud(self -> {
					parseArguments(self, minArgs, maxArgs);
					return self;
				})
				.method("source", (self, args) -> name + "(" + self.getChildren().stream()
						.map(Token::source)
						.collect(Collectors.joining(", ")) + ")"));
	}

	private static void parseArguments(Token<CalcContext> self, int minArgs, int maxArgs) {
		Parser<CalcContext> parser = self.getParser();
		parser.advance("(");
		int count = 0;
		while(!parser.getNextToken().getSymbol().equals(")")) {
			if(parser.getNextToken().getSymbol().equals(SpecialSymbols.END)) {
				throw parser.getNextToken().wrongSyntax();
			}
			if(count == maxArgs) {
				throw self.wrongSyntax("too many arguments for " + self.getSymbol() +
						"(): expected at most " + maxArgs);
			}
			if(count > 0) {
				parser.advance(",");
			}
			self.addChild(parser.expression(5));
			count++;
		}
		if(count < minArgs) {
			throw self.wrongSyntax("too few arguments for " + self.getSymbol() +
					"(): expected at least " + minArgs);
		}
		parser.advance(")");
	}

	static void registerLevel1(Grammar<CalcContext> grammar) {
		function(grammar, "not", 1, 1, (self, context) ->
				!Sequences.booleanValue(self, self.get(0).select(context)));

		// number('1.5') is a constructor and rejects invalid strings, number($x) is lenient
		function(grammar, "number", 1, 1, SymbolDefinition.<CalcContext>define()
				.label(Label.of(Role.FUNCTION, Role.CONSTRUCTOR_FUNCTION))
				.evaluate(CalcFunctions::number));
		grammar.method("number").nud(self -> {
			parseArguments(self, 1, 1);
			if(self.get(0).getSymbol().equals(SpecialSymbols.STRING)) {
				self.resolveRole(Role.CONSTRUCTOR_FUNCTION);
			}else {
				self.resolveRole(Role.FUNCTION);
			}
			return self;
		});
	}

	static void registerLevel2(Grammar<CalcContext> grammar) {
		function(grammar, "count", 1, 1, (self, context) ->
				BigInteger.valueOf(self.get(0).select(context).count()));
		function(grammar, "empty", 1, 1, (self, context) ->
				!self.get(0).select(context).findAny().isPresent());
		function(grammar, "sum", 1, 1, (self, context) ->
				self.get(0).select(context).reduce(BigInteger.ZERO, (a, b) -> CalcArithmetic.add(self, a, b)));
		function(grammar, "trace", 2, 2, SymbolDefinition.<CalcContext>define()
				.label(Role.FUNCTION)
				.sideEffecting()
				.evaluate(CalcFunctions::trace));
	}

	private static Object number(Token<CalcContext> self, CalcContext context) {
		Object item = Sequences.single(self, self.get(0).select(context));
		if(item == null) {
			return Double.NaN;
		}else if(CalcArithmetic.isNumber(item)) {
			return ((Number) item).doubleValue();
		}else if(item instanceof Boolean) {
			return (Boolean) item ? 1.0 : 0.0;
		}
		String text = item.toString().trim();
		if(INTEGER_PATTERN.matcher(text).matches()) {
			return new BigInteger(text).doubleValue();
		}else if(DECIMAL_PATTERN.matcher(text).matches()) {
			return new BigDecimal(text).doubleValue();
		}else if(FLOAT_PATTERN.matcher(text).matches()) {
			return Double.valueOf(text);
		}
		switch(text) {
			case "NaN":
				return Double.NaN;
			case "INF":
			case "+INF":
				return Double.POSITIVE_INFINITY;
			case "-INF":
				return Double.NEGATIVE_INFINITY;
			default:
				if(self.getRole() == Role.CONSTRUCTOR_FUNCTION) {
					throw self.wrongValue("invalid value '" + item + "' for number()");
				}
				return Double.NaN;
		}
	}

	private static Object trace(Token<CalcContext> self, CalcContext context) {
		List<Object> items = self.get(0).select(context).collect(Collectors.toList());
		Object label = Sequences.single(self, self.get(1).select(context));
		String message = label + ": " + items;
		logger.info(message);
		if(context != null) {
			context.addTraceMessage(message);
		}
		return items;
	}
}
