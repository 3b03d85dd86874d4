package tdop.calc;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import tdop.eval.EvaluationException;
import tdop.eval.MissingContextException;
import tdop.eval.Sequences;
import tdop.grammar.GrammarException;
import tdop.grammar.Role;
import tdop.parser.ParseException;
import tdop.parser.Parser;
import tdop.parser.Token;

public class CalcGrammarsTest {

	private final Logger traceLogger = Logger.getLogger(CalcFunctions.class.getName());
	private final List<LogRecord> traced = new ArrayList<>();
	private final Handler traceHandler = new Handler() {
		@Override
		public void publish(LogRecord record) {
			traced.add(record);
		}

		@Override
		public void flush() {
		}

		@Override
		public void close() {
		}
	};

	private Parser<CalcContext> parser;

	@Before
	public void setup() {
		traceLogger.addHandler(traceHandler);
		parser = CalcGrammars.parser(CalcGrammars.LEVEL_2);
	}

	@After
	public void teardown() {
		traceLogger.removeHandler(traceHandler);
	}

	private EvaluationException evaluationError(Runnable r) {
		try {
			r.run();
		} catch (EvaluationException e) {
			return e;
		}
		fail("expected an evaluation error");
		return null;
	}

	private String parseError(Parser<CalcContext> p, String source) {
		try {
			p.parse(source);
		} catch (ParseException e) {
			return e.getMsg();
		}
		fail("expected a parse error for " + source);
		return null;
	}

	@Test
	public void testLevels() {
		assertThat(CalcGrammars.registry().names(), hasItems(CalcGrammars.LEVEL_1, CalcGrammars.LEVEL_2));
		assertNull(CalcGrammars.grammar(CalcGrammars.LEVEL_1).lookup("to"));
		assertNotNull(CalcGrammars.grammar(CalcGrammars.LEVEL_2).lookup("to"));
		assertEquals(0, CalcGrammars.grammar(CalcGrammars.LEVEL_1).lookup(",").getLbp());
		assertEquals(5, CalcGrammars.grammar(CalcGrammars.LEVEL_2).lookup(",").getLbp());
		assertTrue(CalcGrammars.grammar(CalcGrammars.LEVEL_1).isBuilt());
	}

	@Test(expected = GrammarException.class)
	public void testUnknownGrammar() {
		CalcGrammars.grammar("calc-3.0");
	}

	// the first level knows neither ranges nor sequences
	@Test
	public void testLevel1Syntax() {
		Parser<CalcContext> level1 = CalcGrammars.parser(CalcGrammars.LEVEL_1);
		assertEquals("unexpected name 'to'", parseError(level1, "1 to 3"));
		assertEquals("unexpected ',' symbol", parseError(level1, "1, 2"));
		assertEquals("unexpected name 'count'", parseError(level1, "count(1)"));
		assertEquals("(+ (1) (2))", level1.parse("1 + 2").tree());
	}

	@Test
	public void testTrees() {
		assertEquals("(+ ($ (div)) (1))", parser.parse("$div + 1").tree());
		assertEquals("(union (1) (2))", parser.parse("1 union 2").tree());
		assertEquals("(- (1))", parser.parse("-1").tree());
		assertEquals("(if (< (1) (2)) ('a') ('b'))", parser.parse("if (1 < 2) then 'a' else 'b'").tree());
		assertEquals("(count (to (1) (3)))", parser.parse("count(1 to 3)").tree());
	}

	@Test
	public void testSource() {
		assertEquals("if (1 < 2) then $x else - 1", parser.parse("if(1<2)then $x else -1").source());
		assertEquals("count((1, 2))", parser.parse("count((1,2))").source());
		assertEquals("trace(1 to 2, 'r')", parser.parse("trace(1 to 2,'r')").source());
	}

	@Test
	public void testUnionSharesBehaviour() {
		assertSame(parser.getGrammar().lookup("|").getLed(), parser.getGrammar().lookup("union").getLed());
		assertSame(parser.getGrammar().lookup("|").getSelector(), parser.getGrammar().lookup("union").getSelector());
	}

	// function names are symbols only before an argument list
	@Test
	public void testFunctionNameAsVariable() {
		CalcContext context = new CalcContext()
				.setVariable("count", BigInteger.valueOf(2))
				.setVariable("sum", BigInteger.valueOf(3))
				.setVariable("number", "n")
				.setVariable("trace", "t");
		assertEquals(BigInteger.valueOf(3), parser.parse("$count + 1").evaluate(context));
		assertEquals(BigInteger.valueOf(1), parser.parse("count ($sum)").evaluate(context));
		assertEquals("n", parser.parse("$number").evaluate(context));
		assertEquals("t", parser.parse("$trace").evaluate(context));
		assertEquals("$count + count($sum)", parser.parse("$count+count($sum)").source());
	}

	@Test
	public void testArity() {
		assertEquals("too few arguments for not(): expected at least 1", parseError(parser, "not()"));
		assertEquals("too many arguments for not(): expected at most 1", parseError(parser, "not(1, 2)"));
		assertEquals("unexpected end of source", parseError(parser, "count(1"));
	}

	// errors that don't depend on data are found when parsing
	@Test
	public void testStaticEvaluationErrors() {
		EvaluationException e = evaluationError(() -> parser.parse("1 div 0"));
		assertEquals(EvaluationException.Kind.VALUE, e.getKind());
		assertEquals("division by zero", e.getMsg());

		e = evaluationError(() -> parser.parse("'a' + 1"));
		assertEquals(EvaluationException.Kind.TYPE, e.getKind());

		e = evaluationError(() -> parser.parse("(1, 2) + 1"));
		assertEquals(EvaluationException.Kind.TYPE, e.getKind());

		e = evaluationError(() -> parser.parse("1 to 2.5"));
		assertEquals(EvaluationException.Kind.TYPE, e.getKind());
	}

	@Test
	public void testStaticEvaluationDisabled() {
		parser.setStaticEvaluation(false);
		Token<CalcContext> root = parser.parse("1 div 0");
		EvaluationException e = evaluationError(() -> root.evaluate(new CalcContext()));
		assertEquals("division by zero", e.getMsg());
	}

	// an expression that needs variables parses without a context
	@Test
	public void testMissingContext() {
		Token<CalcContext> root = parser.parse("$x div 0");
		try {
			root.evaluate(null);
			fail("variables need a context");
		} catch (MissingContextException e) {
			assertThat(e.getMsg(), containsString("requires a dynamic context"));
		}
		EvaluationException e = evaluationError(() -> root.evaluate(new CalcContext().setVariable("x", BigInteger.ONE)));
		assertEquals(EvaluationException.Kind.VALUE, e.getKind());
	}

	@Test
	public void testUnknownVariable() {
		Token<CalcContext> root = parser.parse("$y + 1");
		EvaluationException e = evaluationError(() -> root.evaluate(new CalcContext()));
		assertEquals("unknown variable '$y'", e.getMsg());
	}

	// trace() has side effects, so it is left alone until evaluated with a context
	@Test
	public void testTraceNotStaticallyEvaluated() {
		Token<CalcContext> root = parser.parse("trace(1 to 2, 'range')");
		assertTrue(traced.isEmpty());

		CalcContext context = new CalcContext();
		assertEquals(Arrays.asList(BigInteger.ONE, BigInteger.valueOf(2)),
				root.select(context).collect(Collectors.toList()));
		assertEquals(1, traced.size());
		assertEquals("range: [1, 2]", traced.get(0).getMessage());
		assertEquals(Arrays.asList("range: [1, 2]"), context.getTraceMessages());
	}

	// a side-effecting token anywhere in the tree disables the static evaluation
	@Test
	public void testTraceFencesWholeTree() {
		parser.parse("1 div 0 + count(trace(1, 'x'))");
		assertTrue(traced.isEmpty());
	}

	@Test
	public void testNumberRoles() {
		Token<CalcContext> constructor = parser.parse("number('1.5')");
		assertEquals(Role.CONSTRUCTOR_FUNCTION, constructor.getRole());
		assertTrue(constructor.isRoleResolved());

		Token<CalcContext> function = parser.parse("number($s)");
		assertEquals(Role.FUNCTION, function.getRole());
		assertEquals("'number' function", function.toString());
	}

	// the constructor role rejects invalid strings, already when parsing
	@Test
	public void testNumberConstructorRejectsInvalid() {
		EvaluationException e = evaluationError(() -> parser.parse("number('abc')"));
		assertEquals("invalid value 'abc' for number()", e.getMsg());
	}

	// Java-only spellings of doubles are not numbers
	@Test
	public void testNumberRejectsJavaSpellings() {
		for(String text : Arrays.asList("1f", "0x1p3", "Infinity", "1d", "1e")) {
			EvaluationException e = evaluationError(() -> parser.parse("number('" + text + "')"));
			assertEquals("invalid value '" + text + "' for number()", e.getMsg());

			Token<CalcContext> lenient = parser.parse("number($v)");
			Object result = lenient.evaluate(new CalcContext().setVariable("v", text));
			assertTrue(text, Double.isNaN((Double) result));
		}
	}

	// ranges are lazy
	@Test
	public void testLargeRange() {
		Token<CalcContext> root = parser.parse("1 to 1000000000");
		CalcContext context = new CalcContext();
		assertEquals(Arrays.asList(BigInteger.ONE, BigInteger.valueOf(2), BigInteger.valueOf(3)),
				root.select(context).limit(3).collect(Collectors.toList()));
		List<?> items = (List<?>) root.evaluate(context);
		assertEquals(1000000000, items.size());
		assertEquals(BigInteger.valueOf(1000000000), items.get(999999999));
	}

	// ranges beyond int size parse and evaluate to the same sequence select streams
	@Test
	public void testRangeBeyondIntSize() {
		Token<CalcContext> root = parser.parse("1 to 3000000000");
		CalcContext context = new CalcContext();
		List<Object> first = Arrays.asList(BigInteger.ONE, BigInteger.valueOf(2), BigInteger.valueOf(3));
		assertEquals(first, root.select(context).limit(3).collect(Collectors.toList()));
		assertEquals(first, Sequences.of(root.evaluate(context)).limit(3).collect(Collectors.toList()));
		List<?> items = (List<?>) root.evaluate(context);
		assertEquals(Integer.MAX_VALUE, items.size());
		assertEquals(BigInteger.valueOf(Integer.MAX_VALUE), items.get(Integer.MAX_VALUE - 1));
		Iterator<?> it = items.iterator();
		it.next();
		assertEquals(BigInteger.valueOf(2), it.next());
	}

	@Test
	public void testRangeBeyondIntSizeFromVariable() {
		Token<CalcContext> root = parser.parse("$n to $n + 2");
		CalcContext context = new CalcContext().setVariable("n", BigInteger.valueOf(3000000000L));
		assertEquals(Arrays.asList(BigInteger.valueOf(3000000000L), BigInteger.valueOf(3000000001L),
				BigInteger.valueOf(3000000002L)), root.select(context).collect(Collectors.toList()));
		assertEquals(3, ((List<?>) root.evaluate(context)).size());
	}

	@Test
	public void testDeeplyNestedStaticEvaluation() {
		String source = String.join(" + ", Collections.nCopies(200000, "1"));
		EvaluationException e = evaluationError(() -> parser.parse(source));
		assertEquals(EvaluationException.Kind.VALUE, e.getKind());
		assertEquals("expression is too deeply nested to evaluate", e.getMsg());
		assertThat(e.getCause(), instanceOf(StackOverflowError.class));

		// the parser is still usable
		assertEquals(BigInteger.valueOf(2), parser.parse("1 + 1").evaluate(null));
	}

	@Test
	public void testContextVariables() {
		CalcContext context = new CalcContext().setVariable("a", "b");
		assertTrue(context.hasVariable("a"));
		assertFalse(context.hasVariable("b"));
		assertEquals("b", context.getVariable("a"));
		assertThat(context.getVariables().keySet(), hasItem("a"));
	}
}
