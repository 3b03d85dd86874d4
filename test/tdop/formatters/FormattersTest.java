package tdop.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.stream.Stream;

import org.junit.Test;

import tdop.calc.CalcContext;
import tdop.calc.CalcGrammars;
import tdop.errors.ExpressionIssue;
import tdop.errors.OptionIssue;
import tdop.errors.TopLevelIssueContext;
import tdop.eval.EvaluationException;
import tdop.parser.ParseException;
import tdop.parser.Parser;

public class FormattersTest {

	private static String value(Stream<Object> items) throws IOException {
		StringWriter w = new StringWriter();
		new ValueFormatter(w).format(items);
		return w.toString();
	}

	@Test
	public void testValueFormatter() throws IOException {
		assertEquals("()", value(Stream.empty()));
		assertEquals("3", value(Stream.of(BigInteger.valueOf(3))));
		assertEquals("'it''s'", value(Stream.of("it's")));
		assertEquals("0.00000001", value(Stream.of(new BigDecimal("1E-8"))));
		assertEquals("(1, 'a', true, 2.5)", value(Stream.of(BigInteger.ONE, "a", true, 2.5)));
	}

	@Test
	public void testTokenTreeFormatter() throws IOException {
		StringWriter w = new StringWriter();
		Parser<CalcContext> parser = CalcGrammars.parser(CalcGrammars.LEVEL_2);
		new TokenTreeFormatter(new IndentingWriter(w)).format(parser.parse("1 + $x * 2"));
		assertEquals("'+' operator\n" +
				"  1 integer\n" +
				"  '*' operator\n" +
				"    '$' operator\n" +
				"      'x' name\n" +
				"    2 integer", w.toString());
	}

	@Test
	public void testIssues() {
		Parser<CalcContext> parser = CalcGrammars.parser(CalcGrammars.LEVEL_2);
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());

		ctx.error(new OptionIssue("At least an expression is required"));
		try {
			parser.parse("1 +");
			fail("incomplete expression");
		} catch (ParseException e) {
			ctx.error(new ExpressionIssue(2, "1 +", e));
		}
		try {
			parser.parse("1 mod 0");
			fail("modulo by zero");
		} catch (EvaluationException e) {
			ctx.error(new ExpressionIssue(3, "1 mod 0", e));
		}

		assertTrue(ctx.hasErrors());
		assertEquals(3, ctx.getIssues().size());
		assertEquals("Detected 3 issue(s):\n" +
				"unable to parse options: At least an expression is required\n" +
				"expression 2: Parse error: unexpected end of source\n" +
				"  at line 1, column 4\n" +
				"  1 +\n" +
				"     ^ EOF\n" +
				"expression 3: Value error: modulo by zero", ctx.format());
		assertThat(ctx.getIssues().get(2).getMessage(), is("expression 3: Value error: modulo by zero"));
	}
}
