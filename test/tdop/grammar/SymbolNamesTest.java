package tdop.grammar;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class SymbolNamesTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{">=", "GreaterThanSignEqualsSign"},
				{"+", "PlusSign"},
				{"$", "DollarSign"},
				{"||", "VerticalLineVerticalLine"},
				{"-", "HyphenMinus"},
				{"--", "HyphenMinusHyphenMinus"},
				{"node-name", "NodeName"},
				{"div", "Div"},
				{"a2b", "A2B"},
				{"(name)", "Name"},
				{"(integer)", "Integer"},
		});
	}

	private final String symbol;
	private final String className;

	public SymbolNamesTest(String symbol, String className) {
		this.symbol = symbol;
		this.className = className;
	}

	@Test
	public void test() {
		assertEquals(className, SymbolNames.toClassName(symbol));
	}

	@Test
	public void testTokenClassName() {
		assertEquals("_" + className + "Operator", SymbolNames.tokenClassName(symbol, Label.of(Role.OPERATOR)));
		assertEquals("_" + className + "PrefixOperator",
				SymbolNames.tokenClassName(symbol, Label.of(Role.PREFIX_OPERATOR)));
		assertEquals("_" + className + "Function__Constructor_Function",
				SymbolNames.tokenClassName(symbol, Label.of(Role.FUNCTION, Role.CONSTRUCTOR_FUNCTION)));
	}
}
