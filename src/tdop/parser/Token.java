package tdop.parser;

import tdop.eval.EvaluationException;
import tdop.eval.MissingContextException;
import tdop.eval.Sequences;
import tdop.grammar.Evaluator;
import tdop.grammar.GrammarException;
import tdop.grammar.Label;
import tdop.grammar.LeftDenotation;
import tdop.grammar.NullDenotation;
import tdop.grammar.Role;
import tdop.grammar.Selector;
import tdop.grammar.SpecialSymbols;
import tdop.grammar.TokenDescriptor;
import tdop.grammar.TokenMethod;
import tdop.util.SourceLocatable;
import tdop.util.SourceLocation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * <p>
 * A node of a parsed expression. Every token is an instance of this one class; what a
 * token does is decided by the {@link TokenDescriptor} of its symbol, which the grammar
 * fills in at registration time.
 * </p>
 *
 * <p>
 * During parsing, the parser calls {@link #nud()} on a token that begins an expression and
 * {@link #led(Token)} on a token that follows a complete left operand. Both attach the
 * operands they consume as children of the token. After parsing, {@link #evaluate(Object)}
 * and {@link #select(Object)} compute the value of the tree against a dynamic context.
 * </p>
 *
 * <p>
 * The two protocols are kept consistent by their defaults: without an evaluator a token
 * evaluates to the list of the items it selects, and without a selector it selects the
 * items of its evaluation. A token with neither evaluates to its value.
 * </p>
 */
public class Token<C> extends SourceLocatable {

	private final TokenDescriptor<C> descriptor;
	private final Parser<C> parser;
	private final String source;
	private final Object value;
	private int start;
	private int end;
	private final List<Token<C>> children;
	private Role role;

	public Token(Parser<C> parser, TokenDescriptor<C> descriptor, Object value, int start, int end) {
		this.parser = parser;
		this.descriptor = descriptor;
		this.source = parser.getSource();
		this.value = value != null ? value : descriptor.getSymbol();
		this.start = start;
		this.end = end;
		this.children = new ArrayList<>();
	}

	public TokenDescriptor<C> getDescriptor() {
		return descriptor;
	}

	public Parser<C> getParser() {
		return parser;
	}

	public String getSymbol() {
		return descriptor.getSymbol();
	}

	public Label getLabel() {
		return descriptor.getLabel();
	}

	public int getLbp() {
		return descriptor.getLbp();
	}

	public int getRbp() {
		return descriptor.getRbp();
	}

	/**
	 * @return the value of the token, which is its symbol unless the token is a literal or a name
	 */
	public Object getValue() {
		return value;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public void setSpan(int start, int end) {
		this.start = start;
		this.end = end;
	}

	// children

	public int arity() {
		return children.size();
	}

	public Token<C> get(int index) {
		return children.get(index);
	}

	public List<Token<C>> getChildren() {
		return Collections.unmodifiableList(children);
	}

	@SafeVarargs
	public final void setChildren(Token<C>... tokens) {
		setChildren(Arrays.asList(tokens));
	}

	public void setChildren(List<Token<C>> tokens) {
		children.clear();
		children.addAll(tokens);
	}

	public void addChild(Token<C> token) {
		children.add(token);
	}

	public void setChild(int index, Token<C> token) {
		children.set(index, token);
	}

	// parsing protocol

	public Token<C> nud() {
		NullDenotation<C> nud = descriptor.getNud();
		if(nud == null) {
			throw wrongSyntax();
		}
		return nud.nud(this);
	}

	public Token<C> led(Token<C> left) {
		LeftDenotation<C> led = descriptor.getLed();
		if(led == null) {
			throw wrongSyntax();
		}
		return led.led(this, left);
	}

	// evaluation protocol

	/**
	 * @param context the dynamic context, null when there is none
	 * @return a single item, a list of items, or null for the empty sequence
	 */
	public Object evaluate(C context) {
		Evaluator<C> evaluator = descriptor.getEvaluator();
		if(evaluator != null) {
			return evaluator.evaluate(this, context);
		}
		Selector<C> selector = descriptor.getSelector();
		if(selector != null) {
			try(Stream<Object> items = selector.select(this, context)) {
				return items.collect(Collectors.toList());
			}
		}
		return value;
	}

	/**
	 * @param context the dynamic context, null when there is none
	 * @return a lazy stream of the items of this token; each call runs the selection again
	 */
	public Stream<Object> select(C context) {
		Selector<C> selector = descriptor.getSelector();
		if(selector != null) {
			return selector.select(this, context);
		}
		return Sequences.of(evaluate(context));
	}

	/**
	 * Invokes the method attached to the symbol of this token under name.
	 * @throws GrammarException if the symbol has no such method
	 */
	public Object call(String name, Object... args) {
		TokenMethod<C> method = descriptor.getMethod(name);
		if(method == null) {
			throw new GrammarException("'" + name + "' is not a method of " + descriptor.getClassName());
		}
		return method.invoke(this, args);
	}

	/**
	 * Fixes the role of a token whose label allows several.
	 * @throws GrammarException if role is not one of the roles of the label
	 */
	public void resolveRole(Role role) {
		if(!getLabel().is(role)) {
			throw new GrammarException(role + " is not a role of " + descriptor.getClassName());
		}
		this.role = role;
	}

	/**
	 * @return the resolved role, or the primary role of the label when none was resolved
	 */
	public Role getRole() {
		return role != null ? role : getLabel().getPrimaryRole();
	}

	public boolean isRoleResolved() {
		return role != null;
	}

	// tree utilities

	/**
	 * Iterates the tree rooted at this token without recursion. A token with one child comes
	 * before it, a token with more children comes after its first child, so that binary
	 * operators appear between their operands.
	 *
	 * @param symbols if not empty, only tokens with one of these symbols are returned
	 */
	public Iterator<Token<C>> iter(String... symbols) {
		return new TokenTreeIterator<>(this, symbols);
	}

	public Stream<Token<C>> stream(String... symbols) {
		return StreamSupport.stream(
				Spliterators.spliteratorUnknownSize(iter(symbols), Spliterator.ORDERED | Spliterator.NONNULL),
				false);
	}

	/**
	 * @return the tree as an S-expression, e.g. {@code (+ (1) (* (2) (3)))}
	 */
	public String tree() {
		String symbol = getSymbol();
		if(symbol.equals(SpecialSymbols.NAME)) {
			return "(" + value + ")";
		}else if(SpecialSymbols.isSpecial(symbol)) {
			return "(" + repr(value) + ")";
		}else if(symbol.equals("(")) {
			if(children.size() == 1) {
				return children.get(0).tree();
			}
			return "(" + joinChildren(Token::tree) + ")";
		}else if(children.isEmpty()) {
			return "(" + symbol + ")";
		}
		return "(" + symbol + " " + joinChildren(Token::tree) + ")";
	}

	/**
	 * @return a normalized source text for the tree rooted at this token
	 */
	public String source() {
		if(descriptor.getMethod("source") != null) {
			return String.valueOf(call("source"));
		}
		String symbol = getSymbol();
		if(symbol.equals(SpecialSymbols.NAME)) {
			return String.valueOf(value);
		}else if(symbol.equals(SpecialSymbols.DECIMAL)) {
			return value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : String.valueOf(value);
		}else if(SpecialSymbols.isSpecial(symbol)) {
			return repr(value);
		}
		switch(children.size()) {
			case 0:
				return symbol;
			case 1:
				if(getLabel().is(Role.POSTFIX_OPERATOR)) {
					return children.get(0).source() + " " + symbol;
				}
				return symbol + " " + children.get(0).source();
			case 2:
				return children.get(0).source() + " " + symbol + " " + children.get(1).source();
			default:
				return symbol + " " + joinChildren(Token::source);
		}
	}

	private String joinChildren(Function<Token<C>, String> render) {
		return children.stream().map(render).collect(Collectors.joining(" "));
	}

	/**
	 * @return a (name) token with the span of this token, which must have a name-like symbol
	 */
	public Token<C> asName() {
		if(!parser.getGrammar().isNameLike(getSymbol())) {
			throw new IllegalStateException("symbol '" + getSymbol() + "' is not compatible with the name pattern");
		}
		return parser.newToken(SpecialSymbols.NAME, getSymbol(), start, end);
	}

	// position

	@Override
	public SourceLocation getLocation() {
		return SourceLocation.of(source, start, end);
	}

	public int getLine() {
		return getLocation().getLine();
	}

	public int getColumn() {
		return getLocation().getColumn();
	}

	/**
	 * @return the source text this token was read from
	 */
	public String getSourceText() {
		return source;
	}

	/**
	 * @return true if only whitespace precedes the token
	 */
	public boolean isSourceStart() {
		return source.substring(0, Math.min(start, source.length())).trim().isEmpty();
	}

	/**
	 * @return true if only whitespace precedes the token on its line
	 */
	public boolean isLineStart() {
		int limit = Math.min(start, source.length());
		int lineStart = source.lastIndexOf('\n', limit - 1) + 1;
		return source.substring(lineStart, limit).trim().isEmpty();
	}

	/**
	 * @return true if a space, tab or newline is immediately before the token (when before is
	 * set) or immediately after it (when after is set)
	 */
	public boolean isSpaced(boolean before, boolean after) {
		if(before && start > 0 && start <= source.length() && isSpace(source.charAt(start - 1))) {
			return true;
		}
		return after && end < source.length() && isSpace(source.charAt(end));
	}

	public boolean isSpaced() {
		return isSpaced(true, true);
	}

	private static boolean isSpace(char c) {
		return c == ' ' || c == '\t' || c == '\n';
	}

	// errors

	/**
	 * @throws ParseException if symbols is not empty and the symbol of this token is not one of them
	 */
	public void expected(String... symbols) {
		if(symbols.length > 0 && !Arrays.asList(symbols).contains(getSymbol())) {
			throw wrongSyntax();
		}
	}

	/**
	 * @throws ParseException if symbols is empty or the symbol of this token is one of them
	 */
	public void unexpected(String... symbols) {
		if(symbols.length == 0 || Arrays.asList(symbols).contains(getSymbol())) {
			throw wrongSyntax();
		}
	}

	public ParseException wrongSyntax() {
		return wrongSyntax(null);
	}

	/**
	 * @param message the message, or null for one describing this token
	 */
	public ParseException wrongSyntax(String message) {
		if(message != null) {
			return new ParseException(this, message);
		}
		String symbol = getSymbol();
		if(!SpecialSymbols.isSpecial(symbol)) {
			return new ParseException(this, "unexpected " + this);
		}
		switch(symbol) {
			case SpecialSymbols.INVALID:
				return new ParseException(this, "invalid literal " + repr(value));
			case SpecialSymbols.UNKNOWN:
				return new ParseException(this, "unknown symbol " + repr(value));
			case SpecialSymbols.NAME:
				return new ParseException(this, "unexpected name " + repr(value));
			case SpecialSymbols.END:
				if(parser.getToken().getSymbol().equals(SpecialSymbols.START)) {
					return new ParseException(this, "source is empty");
				}
				return new ParseException(this, "unexpected end of source");
			default:
				return new ParseException(this, "unexpected literal " + repr(value));
		}
	}

	public EvaluationException wrongType(String message) {
		return new EvaluationException(EvaluationException.Kind.TYPE, message);
	}

	public EvaluationException wrongValue(String message) {
		return new EvaluationException(EvaluationException.Kind.VALUE, message);
	}

	public MissingContextException missingContext() {
		return new MissingContextException(this + " requires a dynamic context");
	}

	static String repr(Object value) {
		if(value instanceof String) {
			return "'" + value + "'";
		}else if(value instanceof BigDecimal) {
			return ((BigDecimal) value).toPlainString();
		}
		return String.valueOf(value);
	}

	@Override
	public boolean equals(Object obj) {
		if(this == obj) {
			return true;
		}
		if(!(obj instanceof Token)) {
			return false;
		}
		Token<?> other = (Token<?>) obj;
		return getSymbol().equals(other.getSymbol()) && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSymbol(), value);
	}

	/**
	 * @return e.g. {@code '+' operator} or, for literals and names, {@code 'foo' name}
	 */
	@Override
	public String toString() {
		String symbol = getSymbol();
		if(SpecialSymbols.isSpecial(symbol)) {
			return repr(value) + " " + symbol.substring(1, symbol.length() - 1);
		}
		if(role != null) {
			return "'" + symbol + "' " + role;
		}
		return "'" + symbol + "' " + getLabel();
	}
}
