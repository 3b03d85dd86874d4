package tdop.grammar;

import tdop.lexer.Tokenizer;
import tdop.lexer.TokenizerBuilder;

import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * <p>
 * A grammar for a top-down operator precedence (Pratt) parser: the symbol table of a
 * language together with the patterns its tokenizer is built from.
 * </p>
 *
 * <p>
 * A language is defined by registering its symbols. {@link #register(String, SymbolDefinition)}
 * is the general form; {@link #literal}, {@link #nullary}, {@link #prefix}, {@link #postfix},
 * {@link #infix} and {@link #infixr} register the usual operator shapes with a canned
 * nud or led, and {@link #method(String, int)} replaces methods of a symbol afterwards.
 * </p>
 *
 * <p>
 * Levels of a language are built with {@link #extend(String)}: the derived grammar starts
 * from copies of the descriptors of this one, so registrations on either side never leak
 * into the other.
 * </p>
 *
 * <p>
 * A grammar is read-mostly: it may be shared by parsers on several threads once it is
 * complete, provided nothing registers symbols concurrently with a parse. The tokenizer is
 * compiled lazily and recompiled after the symbol table changes.
 * </p>
 *
 * @param <C> the type of the dynamic context the tokens of this grammar are evaluated against
 */
public class Grammar<C> {

	private static final Logger logger = Logger.getLogger(Grammar.class.getName());

	public static final Pattern DEFAULT_LITERALS_PATTERN = Pattern.compile(
			"'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"|(?:\\d+|\\.\\d+)(?:\\.\\d*)?(?:[Ee][+-]?\\d+)?");
	public static final Pattern DEFAULT_NAME_PATTERN = Pattern.compile("[A-Za-z0-9_]+");

	private final String name;
	private final SymbolTable<C> symbolTable;
	private Pattern literalsPattern;
	private Pattern namePattern;
	private volatile Tokenizer tokenizer;

	public Grammar(String name) {
		this(name, new SymbolTable<>(), DEFAULT_LITERALS_PATTERN, DEFAULT_NAME_PATTERN);
	}

	private Grammar(String name, SymbolTable<C> symbolTable, Pattern literalsPattern, Pattern namePattern) {
		this.name = name;
		this.symbolTable = symbolTable;
		this.literalsPattern = literalsPattern;
		this.namePattern = namePattern;
	}

	/**
	 * @return a new grammar level that starts with copies of every symbol of this one
	 */
	public Grammar<C> extend(String name) {
		return new Grammar<>(name, symbolTable.copy(), literalsPattern, namePattern);
	}

	public String getName() {
		return name;
	}

	public SymbolTable<C> getSymbolTable() {
		return symbolTable;
	}

	/**
	 * @return the descriptor registered under lookupName, or null
	 */
	public TokenDescriptor<C> lookup(String lookupName) {
		return symbolTable.get(lookupName);
	}

	public Pattern getLiteralsPattern() {
		return literalsPattern;
	}

	public void setLiteralsPattern(Pattern literalsPattern) {
		this.literalsPattern = literalsPattern;
		tokenizer = null;
	}

	public Pattern getNamePattern() {
		return namePattern;
	}

	public void setNamePattern(Pattern namePattern) {
		this.namePattern = namePattern;
		tokenizer = null;
	}

	/**
	 * @return true if text starts like a name of this grammar
	 */
	public boolean isNameLike(String text) {
		return namePattern.matcher(text).lookingAt();
	}

	public TokenDescriptor<C> register(String symbol) {
		return register(symbol, SymbolDefinition.define());
	}

	/**
	 * Registers a new symbol or updates a registered one.
	 *
	 * <p>A new symbol gets a descriptor with binding powers 0, the label of the definition
	 * (or {@link Role#SYMBOL}) and the custom pattern of the definition, stored under the
	 * lookup name of the definition (or the symbol). A registered symbol keeps its label
	 * and pattern. In both cases the binding powers of the definition are applied only
	 * when they are greater than the current ones, and every behaviour the definition sets
	 * replaces the previous one.</p>
	 *
	 * @throws GrammarException if symbol contains whitespace
	 */
	public TokenDescriptor<C> register(String symbol, SymbolDefinition<C> definition) {
		if(symbol.codePoints().anyMatch(Character::isWhitespace)) {
			throw new GrammarException("'" + symbol + "': a symbol can't contain whitespaces");
		}
		String lookupName = definition.getLookupName() != null ? definition.getLookupName() : symbol;
		TokenDescriptor<C> descriptor = symbolTable.get(lookupName);
		if(descriptor == null) {
			Label label = definition.getLabel() != null ? definition.getLabel() : Label.of(Role.SYMBOL);
			String className = definition.getClassName() != null
					? definition.getClassName()
					: SymbolNames.tokenClassName(symbol, label);
			descriptor = new TokenDescriptor<>(symbol, lookupName, className, definition.getPattern(), label);
			symbolTable.put(descriptor);
			tokenizer = null;
			logger.finest("registered " + descriptor.getClassName() + " in grammar " + name);
		}
		definition.applyTo(descriptor);
		return descriptor;
	}

	/**
	 * Updates a descriptor that is already registered in this grammar.
	 * @throws GrammarException if descriptor is not the one registered under its lookup name
	 */
	public TokenDescriptor<C> register(TokenDescriptor<C> descriptor, SymbolDefinition<C> definition) {
		if(symbolTable.get(descriptor.getLookupName()) != descriptor) {
			throw new GrammarException("token class " + descriptor.getClassName() +
					" is not registered in grammar " + name);
		}
		definition.applyTo(descriptor);
		return descriptor;
	}

	public void unregister(String symbol) {
		if(symbolTable.remove(symbol.trim()) != null) {
			tokenizer = null;
		}
	}

	/**
	 * Registers newSymbol with the behaviour of symbol. Everything the definition does not set
	 * is copied from the descriptor of symbol, except its symbol, lookup name, class name and
	 * pattern.
	 */
	public TokenDescriptor<C> duplicate(String symbol, String newSymbol, SymbolDefinition<C> definition) {
		TokenDescriptor<C> source = symbolTable.get(symbol);
		if(source == null) {
			throw new GrammarException("can't duplicate unregistered symbol '" + symbol + "'");
		}
		TokenDescriptor<C> target = register(newSymbol, definition);
		if(definition.getLabel() == null) {
			target.setLabel(source.getLabel());
		}
		target.setBindingPowers(
				definition.getLbp() != null ? target.getLbp() : source.getLbp(),
				definition.getRbp() != null ? target.getRbp() : source.getRbp());
		if(source.isSideEffecting()) {
			target.setSideEffecting(true);
		}
		if(!definition.defines(TokenDescriptor.NUD)) {
			target.setNud(source.getNud());
		}
		if(!definition.defines(TokenDescriptor.LED)) {
			target.setLed(source.getLed());
		}
		if(!definition.defines(TokenDescriptor.EVALUATE)) {
			target.setEvaluator(source.getEvaluator());
		}
		if(!definition.defines(TokenDescriptor.SELECT)) {
			target.setSelector(source.getSelector());
		}
		source.getMethods().forEach((methodName, method) -> {
			if(!definition.defines(methodName)) {
				target.putMethod(methodName, method);
			}
		});
		return target;
	}

	public TokenDescriptor<C> duplicate(String symbol, String newSymbol) {
		return duplicate(symbol, newSymbol, SymbolDefinition.define());
	}

	/**
	 * Registers a symbol that stands for a literal: it begins an expression by itself and
	 * evaluates to its value.
	 */
	public TokenDescriptor<C> literal(String symbol, int bp) {
		return register(symbol, SymbolDefinition.<C>define()
				.label(Role.LITERAL)
				.lbp(bp)
				.nud(self -> self)
				.evaluate((self, context) -> self.getValue()));
	}

	public TokenDescriptor<C> literal(String symbol) {
		return literal(symbol, 0);
	}

	/**
	 * Registers a nullary operator: a symbol that is an expression by itself.
	 */
	public TokenDescriptor<C> nullary(String symbol, int bp) {
		return register(symbol, SymbolDefinition.<C>define()
				.label(Role.OPERATOR)
				.lbp(bp)
				.nud(self -> self));
	}

	public TokenDescriptor<C> nullary(String symbol) {
		return nullary(symbol, 0);
	}

	public TokenDescriptor<C> prefix(String symbol, int bp) {
		return register(symbol, SymbolDefinition.<C>define()
				.label(Role.PREFIX_OPERATOR)
				.lbp(bp)
				.rbp(bp)
				.nud(self -> {
					self.setChildren(self.getParser().expression(bp));
					return self;
				}));
	}

	public TokenDescriptor<C> postfix(String symbol, int bp) {
		return register(symbol, SymbolDefinition.<C>define()
				.label(Role.POSTFIX_OPERATOR)
				.lbp(bp)
				.rbp(bp)
				.led((self, left) -> {
					self.setChildren(left);
					return self;
				}));
	}

	/**
	 * Registers a left-associative binary operator, with lbp = rbp = bp.
	 */
	public TokenDescriptor<C> infix(String symbol, int bp) {
		return register(symbol, SymbolDefinition.<C>define()
				.label(Role.OPERATOR)
				.lbp(bp)
				.rbp(bp)
				.led((self, left) -> {
					self.setChildren(left, self.getParser().expression(bp));
					return self;
				}));
	}

	/**
	 * Registers a right-associative binary operator, with lbp = bp and rbp = bp - 1.
	 */
	public TokenDescriptor<C> infixr(String symbol, int bp) {
		return register(symbol, SymbolDefinition.<C>define()
				.label(Role.OPERATOR)
				.lbp(bp)
				.rbp(bp - 1)
				.led((self, left) -> {
					self.setChildren(left, self.getParser().expression(bp - 1));
					return self;
				}));
	}

	/**
	 * Registers symbol as an operator with binding powers bp, if it is not registered yet,
	 * and returns a binder that replaces its methods.
	 */
	public MethodBinder<C> method(String symbol, int bp) {
		TokenDescriptor<C> descriptor = register(symbol, SymbolDefinition.<C>define()
				.label(Role.OPERATOR)
				.lbp(bp)
				.rbp(bp));
		return new MethodBinder<>(descriptor);
	}

	public MethodBinder<C> method(String symbol) {
		return method(symbol, 0);
	}

	/**
	 * Registers the special symbols that are missing and compiles the tokenizer.
	 */
	public synchronized Tokenizer build() {
		for(String special : SpecialSymbols.ALL) {
			if(!symbolTable.contains(special)) {
				register(special);
			}
		}
		TokenizerBuilder builder = new TokenizerBuilder(literalsPattern, namePattern);
		for(TokenDescriptor<C> descriptor : symbolTable.descriptors()) {
			if(SpecialSymbols.isSpecial(descriptor.getLookupName())) {
				continue;
			}
			builder.addSymbol(descriptor.getSymbol(), descriptor.getPattern());
		}
		Tokenizer built = builder.build();
		logger.fine("built tokenizer of grammar " + name + " for " + symbolTable.size() + " symbols");
		tokenizer = built;
		return built;
	}

	public boolean isBuilt() {
		return tokenizer != null;
	}

	/**
	 * @return the tokenizer of the current symbol table, building it if needed
	 */
	public Tokenizer getTokenizer() {
		Tokenizer current = tokenizer;
		if(current != null) {
			return current;
		}
		synchronized(this) {
			if(tokenizer == null) {
				return build();
			}
			return tokenizer;
		}
	}

	@Override
	public String toString() {
		return "Grammar [name=" + name + ", symbols=" + symbolTable.size() + "]";
	}
}
