package tdop.parser;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ParserTreeTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"1", "(1)"},
				{"a", "(a)"},
				{"'it''s'", "('it's')"},
				{"1.50", "(1.50)"},

				// precedence
				{"2 + 3 * 4", "(+ (2) (* (3) (4)))"},
				{"2 * 3 + 4", "(+ (* (2) (3)) (4))"},
				{"(2 + 3) * 4", "(* (+ (2) (3)) (4))"},
				{"((1))", "(1)"},

				// associativity
				{"1 - 2 - 3", "(- (- (1) (2)) (3))"},
				{"2 ^ 3 ^ 2", "(^ (2) (^ (3) (2)))"},

				// prefix and postfix operators
				{"~ 1 + 2", "(+ (~ (1)) (2))"},
				{"x ^ ~ 2", "(^ (x) (~ (2)))"},
				{"3 ! * 2", "(* (! (3)) (2))"},
				{"~ 3 !", "(~ (! (3)))"},

				// whitespace is not significant
				{"\n 1 +\n\t2", "(+ (1) (2))"},
				{"1+2*3", "(+ (1) (* (2) (3)))"},

				// raw capture
				{"{ a b + c } + 1", "(+ ({ ('a b + c')) (1))"},
				{"{}", "({ (''))"},
		});
	}

	private final String source;
	private final String tree;

	public ParserTreeTest(String source, String tree) {
		this.source = source;
		this.tree = tree;
	}

	@Test
	public void test() {
		assertEquals(tree, ArithmeticGrammar.parser().parse(source).tree());
	}
}
