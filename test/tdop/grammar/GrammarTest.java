package tdop.grammar;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import tdop.lexer.LexemeType;

public class GrammarTest {

	@Test
	public void testRegisterDefaults() {
		Grammar<Object> g = new Grammar<>("test");
		TokenDescriptor<Object> d = g.register("foo");
		assertEquals("foo", d.getSymbol());
		assertEquals("foo", d.getLookupName());
		assertEquals("_FooSymbol", d.getClassName());
		assertEquals(Label.of(Role.SYMBOL), d.getLabel());
		assertEquals(0, d.getLbp());
		assertEquals(0, d.getRbp());
		assertNull(d.getNud());
		assertNull(d.getLed());
		assertSame(d, g.lookup("foo"));
	}

	// binding powers can only go up
	@Test
	public void testMonotonicBindingPowers() {
		Grammar<Object> g = new Grammar<>("test");
		g.infix("+", 40);
		TokenDescriptor<Object> d = g.register("+", SymbolDefinition.define().lbp(10).rbp(10));
		assertEquals(40, d.getLbp());
		assertEquals(40, d.getRbp());
		g.register("+", SymbolDefinition.define().lbp(50));
		assertEquals(50, d.getLbp());
		assertEquals(40, d.getRbp());
	}

	// registering the same symbol again updates the same descriptor
	@Test
	public void testIdempotentRegistration() {
		Grammar<Object> g = new Grammar<>("test");
		TokenDescriptor<Object> first = g.infix("+", 10);
		int size = g.getSymbolTable().size();
		TokenDescriptor<Object> second = g.infix("+", 10);
		assertSame(first, second);
		assertEquals(size, g.getSymbolTable().size());
		assertEquals(Label.of(Role.OPERATOR), second.getLabel());
	}

	// the first registration decides the label
	@Test
	public void testLabelKept() {
		Grammar<Object> g = new Grammar<>("test");
		g.prefix("~", 40);
		TokenDescriptor<Object> d = g.register("~", SymbolDefinition.define().label(Role.FUNCTION));
		assertEquals(Label.of(Role.PREFIX_OPERATOR), d.getLabel());
	}

	@Test(expected = GrammarException.class)
	public void testWhitespaceRejected() {
		new Grammar<>("test").register("a b");
	}

	@Test(expected = GrammarException.class)
	public void testForeignDescriptorRejected() {
		Grammar<Object> a = new Grammar<>("a");
		Grammar<Object> b = new Grammar<>("b");
		TokenDescriptor<Object> d = a.register("x");
		b.register(d, SymbolDefinition.define().lbp(10));
	}

	@Test
	public void testRegisterDescriptor() {
		Grammar<Object> g = new Grammar<>("test");
		TokenDescriptor<Object> d = g.register("x");
		g.register(d, SymbolDefinition.define().lbp(10).sideEffecting());
		assertEquals(10, d.getLbp());
		assertTrue(d.isSideEffecting());
	}

	@Test
	public void testMultiRoleLabel() {
		Grammar<Object> g = new Grammar<>("test");
		TokenDescriptor<Object> d = g.register("number",
				SymbolDefinition.define().label(Role.FUNCTION, Role.CONSTRUCTOR_FUNCTION));
		assertTrue(d.getLabel().isMultiRole());
		assertTrue(d.getLabel().is(Role.FUNCTION));
		assertTrue(d.getLabel().is(Role.CONSTRUCTOR_FUNCTION));
		assertFalse(d.getLabel().is(Role.AXIS));
		assertEquals(Role.FUNCTION, d.getLabel().getPrimaryRole());
		assertEquals("function__constructor_function", d.getLabel().toString());
		assertEquals("_NumberFunction__Constructor_Function", d.getClassName());
	}

	@Test
	public void testLookupName() {
		Grammar<Object> g = new Grammar<>("test");
		TokenDescriptor<Object> d = g.register("-", SymbolDefinition.define()
				.lookupName("unary-")
				.className("UnaryMinus"));
		assertSame(d, g.lookup("unary-"));
		assertNull(g.lookup("-"));
		assertEquals("-", d.getSymbol());
		assertEquals("UnaryMinus", d.getClassName());
	}

	@Test
	public void testDuplicate() {
		Grammar<Object> g = new Grammar<>("test");
		TokenDescriptor<Object> bar = g.infix("|", 25);
		TokenDescriptor<Object> union = g.duplicate("|", "union");
		assertNotSame(bar, union);
		assertEquals("union", union.getSymbol());
		assertEquals(25, union.getLbp());
		assertEquals(25, union.getRbp());
		assertEquals(bar.getLabel(), union.getLabel());
		assertSame(bar.getLed(), union.getLed());
		assertEquals("_UnionSymbol", union.getClassName());
	}

	@Test
	public void testDuplicateOverride() {
		Grammar<Object> g = new Grammar<>("test");
		g.infix("|", 25);
		TokenDescriptor<Object> union = g.duplicate("|", "union", SymbolDefinition.define().lbp(30));
		assertEquals(30, union.getLbp());
		assertEquals(25, union.getRbp());
	}

	@Test(expected = GrammarException.class)
	public void testDuplicateUnregistered() {
		new Grammar<>("test").duplicate("|", "union");
	}

	// changes to a derived level never reach its base, nor the other way around
	@Test
	public void testExtendIsolation() {
		Grammar<Object> base = new Grammar<>("base");
		base.infix("+", 10);
		Grammar<Object> derived = base.extend("derived");
		derived.register("+", SymbolDefinition.define().lbp(20));
		derived.register("*");
		base.register("-");

		assertEquals(10, base.lookup("+").getLbp());
		assertEquals(20, derived.lookup("+").getLbp());
		assertNull(base.lookup("*"));
		assertNull(derived.lookup("-"));
		assertNotSame(base.lookup("+"), derived.lookup("+"));
		assertNotNull(derived.lookup("+").getLed());
	}

	@Test
	public void testUnregister() {
		Grammar<Object> g = new Grammar<>("test");
		g.register("x");
		g.unregister("x");
		assertNull(g.lookup("x"));
	}

	@Test
	public void testBuildRegistersSpecialSymbols() {
		Grammar<Object> g = new Grammar<>("test");
		assertFalse(g.isBuilt());
		g.build();
		assertTrue(g.isBuilt());
		for(String special : SpecialSymbols.ALL) {
			assertNotNull(special, g.lookup(special));
		}
	}

	// changing the symbol table invalidates the tokenizer
	@Test
	public void testTokenizerRebuilt() {
		Grammar<Object> g = new Grammar<>("test");
		g.build();
		assertEquals(LexemeType.NAME, g.getTokenizer().readLexemes("foo").get(0).getType());
		g.register("foo");
		assertFalse(g.isBuilt());
		assertEquals(LexemeType.SYMBOL, g.getTokenizer().readLexemes("foo").get(0).getType());
		assertTrue(g.isBuilt());
	}

	@Test
	public void testIsNameLike() {
		Grammar<Object> g = new Grammar<>("test");
		assertTrue(g.isNameLike("div"));
		assertTrue(g.isNameLike("node-name"));
		assertFalse(g.isNameLike(">="));
		assertFalse(g.isNameLike("$"));
	}

	@Test
	public void testMethodBinder() {
		Grammar<Object> g = new Grammar<>("test");
		g.register("f", SymbolDefinition.define().method("arity", (self, args) -> 1));
		MethodBinder<Object> binder = g.method("f");
		binder.bind("arity", (self, args) -> 2);
		assertEquals(2, binder.getDescriptor().getMethod("arity").invoke(null));
	}

	@Test(expected = GrammarException.class)
	public void testMethodBinderUnknownMethod() {
		new Grammar<>("test").method("f").bind("arity", (self, args) -> 2);
	}

	@Test(expected = GrammarException.class)
	public void testMethodBinderSlot() {
		new Grammar<>("test").method("f").bind(TokenDescriptor.EVALUATE, (self, args) -> 2);
	}

	// method() registers unknown symbols as operators
	@Test
	public void testMethodRegisters() {
		Grammar<Object> g = new Grammar<>("test");
		MethodBinder<Object> binder = g.method("?", 30);
		assertSame(binder.getDescriptor(), g.lookup("?"));
		assertEquals(Label.of(Role.OPERATOR), binder.getDescriptor().getLabel());
		assertEquals(30, binder.getDescriptor().getLbp());
	}

	@Test
	public void testOperatorShapes() {
		Grammar<Object> g = new Grammar<>("test");
		assertThat(g.infixr("^", 30).getRbp(), is(29));
		assertThat(g.prefix("~", 40).getLabel(), is(Label.of(Role.PREFIX_OPERATOR)));
		assertThat(g.postfix("!", 50).getLabel(), is(Label.of(Role.POSTFIX_OPERATOR)));
		assertThat(g.literal(SpecialSymbols.INTEGER).getLabel(), is(Label.of(Role.LITERAL)));
		assertNotNull(g.nullary("*").getNud());
	}

	@Test
	public void testRegistry() {
		GrammarRegistry<Object> registry = new GrammarRegistry<>();
		Grammar<Object> one = registry.define("one");
		one.infix("+", 10);
		Grammar<Object> two = registry.define("two", "one");
		assertNotNull(two.lookup("+"));
		assertSame(one, registry.get("one"));
		assertTrue(registry.contains("two"));
		assertThat(registry.names().size(), is(2));
	}

	@Test(expected = GrammarException.class)
	public void testRegistryDuplicateName() {
		GrammarRegistry<Object> registry = new GrammarRegistry<>();
		registry.define("one");
		registry.define("one");
	}

	@Test(expected = GrammarException.class)
	public void testRegistryUnknownBase() {
		new GrammarRegistry<>().define("two", "one");
	}
}
