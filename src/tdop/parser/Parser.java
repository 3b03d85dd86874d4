package tdop.parser;

import tdop.Unreachable;
import tdop.eval.EvaluationException;
import tdop.eval.MissingContextException;
import tdop.grammar.Grammar;
import tdop.grammar.GrammarException;
import tdop.grammar.Role;
import tdop.grammar.SpecialSymbols;
import tdop.grammar.TokenDescriptor;
import tdop.lexer.Lexeme;
import tdop.lexer.LexemeType;
import tdop.lexer.Tokenizer;
import tdop.util.SourceLocation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * <p>
 * A top-down operator precedence parser over a {@link Grammar}.
 * </p>
 *
 * <p>
 * A parser holds the cursor of one parse at a time: the current token, the lookahead token
 * and the lexeme reader. Parsers must not be shared between threads; the grammar may be, see
 * {@link Grammar}.
 * </p>
 *
 * <p>
 * After a successful parse, the tree is evaluated once without a dynamic context, so that
 * errors that don't depend on data are reported by {@link #parse(String)} itself. Tokens that
 * need a context signal it with a {@link MissingContextException}, which ends the pass
 * quietly. Trees containing side-effecting symbols are not evaluated at all.
 * </p>
 */
public class Parser<C> {

	private static final Logger logger = Logger.getLogger(Parser.class.getName());

	private final Grammar<C> grammar;
	private final Token<C> startToken;
	private String source;
	private Tokenizer.Reader reader;
	private Token<C> token;
	private Token<C> nextToken;
	private boolean staticEvaluation;

	public Parser(Grammar<C> grammar) {
		this.grammar = grammar;
		grammar.getTokenizer();
		this.source = "";
		this.staticEvaluation = true;
		this.startToken = newToken(SpecialSymbols.START, null, 0, 0);
		this.token = this.nextToken = startToken;
	}

	public Grammar<C> getGrammar() {
		return grammar;
	}

	public boolean isStaticEvaluation() {
		return staticEvaluation;
	}

	/**
	 * Switches the evaluation pass that follows a successful parse on or off.
	 */
	public void setStaticEvaluation(boolean staticEvaluation) {
		this.staticEvaluation = staticEvaluation;
	}

	/**
	 * Parses source into a token tree.
	 *
	 * @return the root of the tree
	 * @throws ParseException if source is not a single well-formed expression
	 * @throws tdop.TDOPException if the static evaluation of the tree fails for a reason
	 * other than a missing context
	 */
	public Token<C> parse(String source) {
		Token<C> root;
		try {
			if(source == null) {
				Token<C> invalid = newToken(SpecialSymbols.INVALID, null, 0, 0);
				throw invalid.wrongSyntax("invalid source type");
			}
			this.source = source;
			this.reader = grammar.getTokenizer().reader(source);
			advance();
			root = expression();
			nextToken.expected(SpecialSymbols.END);
		} finally {
			reset();
		}
		if(staticEvaluation) {
			evaluateStatically(root);
		}
		return root;
	}

	private void reset() {
		source = "";
		reader = null;
		token = nextToken = startToken;
	}

	private void evaluateStatically(Token<C> root) {
		Iterator<Token<C>> it = root.iter();
		while(it.hasNext()) {
			Token<C> tk = it.next();
			if(tk.getDescriptor().isSideEffecting()) {
				logger.finer("static evaluation skipped, " + tk + " has side effects");
				return;
			}
		}
		try {
			root.evaluate(null);
		} catch (MissingContextException e) {
			logger.finer("static evaluation stopped: " + e.getMsg());
		} catch (StackOverflowError e) {
			throw EvaluationException.tooDeeplyNested(e);
		}
	}

	/**
	 * Moves to the next token: the lookahead token becomes the current one and the next
	 * lexeme is read into a new lookahead token.
	 *
	 * @param symbols if not empty, the symbols the lookahead token is expected to have
	 * @return the new current token
	 * @throws ParseException at the end of source, if the lookahead is not one of symbols, or
	 * if the next lexeme is not a valid token
	 */
	public Token<C> advance(String... symbols) {
		if(nextToken.getSymbol().equals(SpecialSymbols.END)) {
			throw nextToken.wrongSyntax();
		}else if(symbols.length > 0 && !Arrays.asList(symbols).contains(nextToken.getSymbol())) {
			throw nextToken.wrongSyntax();
		}

		token = nextToken;
		Lexeme lexeme = reader.next();
		if(lexeme == null) {
			nextToken = newToken(SpecialSymbols.END, null, source.length(), source.length());
			return token;
		}

		String text = lexeme.getText();
		int start = lexeme.getStart();
		int end = lexeme.getEnd();
		switch(lexeme.getType()) {
			case SYMBOL:
				if(grammar.lookup(text) != null) {
					nextToken = newToken(text, null, start, end);
				}else if(!grammar.isNameLike(text)) {
					nextToken = newToken(SpecialSymbols.UNKNOWN, text, start, end);
					throw nextToken.wrongSyntax();
				}else {
					nextToken = newToken(SpecialSymbols.NAME, text, start, end);
				}
				break;
			case LITERAL:
				nextToken = literalToken(text, start, end);
				break;
			case NAME:
				nextToken = newToken(SpecialSymbols.NAME, text, start, end);
				break;
			case UNKNOWN:
				nextToken = newToken(SpecialSymbols.UNKNOWN, text, start, end);
				break;
			default:
				throw new Unreachable("unexpected lexeme " + lexeme + ": incompatible tokenizer");
		}
		return token;
	}

	private Token<C> literalToken(String text, int start, int end) {
		char first = text.charAt(0);
		if(first == '\'' || first == '"') {
			return newToken(SpecialSymbols.STRING, unescape(text), start, end);
		}
		try {
			if(text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
				return newToken(SpecialSymbols.FLOAT, Double.valueOf(text), start, end);
			}else if(text.indexOf('.') >= 0) {
				return newToken(SpecialSymbols.DECIMAL, new BigDecimal(text), start, end);
			}
			return newToken(SpecialSymbols.INTEGER, new BigInteger(text), start, end);
		} catch (NumberFormatException e) {
			nextToken = newToken(SpecialSymbols.INVALID, text, start, end);
			throw nextToken.wrongSyntax();
		}
	}

	/**
	 * Advances until the lookahead is one of stopSymbols or the end of source is reached. The
	 * lookahead at the time of the call becomes the current token.
	 *
	 * @return the raw source text between the end of the current token and the stop symbol
	 */
	public String advanceUntil(String... stopSymbols) {
		if(stopSymbols.length == 0) {
			throw new IllegalArgumentException("at least a stop symbol required");
		}else if(nextToken.getSymbol().equals(SpecialSymbols.END)) {
			throw nextToken.wrongSyntax();
		}

		List<String> stops = Arrays.asList(stopSymbols);
		int from = token.getEnd();
		if(stops.contains(nextToken.getSymbol())) {
			return source.substring(from, nextToken.getStart());
		}
		token = nextToken;
		while(true) {
			Lexeme lexeme = reader.nextRaw();
			if(lexeme == null) {
				nextToken = newToken(SpecialSymbols.END, null, source.length(), source.length());
				return source.substring(from);
			}
			if(lexeme.getType() != LexemeType.SYMBOL || !stops.contains(lexeme.getText())) {
				continue;
			}
			if(grammar.lookup(lexeme.getText()) == null) {
				nextToken = newToken(SpecialSymbols.UNKNOWN, lexeme.getText(), lexeme.getStart(), lexeme.getEnd());
				throw nextToken.wrongSyntax();
			}
			nextToken = newToken(lexeme.getText(), null, lexeme.getStart(), lexeme.getEnd());
			return source.substring(from, lexeme.getStart());
		}
	}

	/**
	 * Parses an expression whose operators bind tighter than rbp.
	 */
	public Token<C> expression(int rbp) {
		advance();
		Token<C> left = token.nud();
		while(rbp < nextToken.getLbp()) {
			advance();
			left = token.led(left);
		}
		return left;
	}

	public Token<C> expression() {
		return expression(0);
	}

	/**
	 * Checks the lookahead token against symbols. When (name) is one of them, a lookahead with
	 * a name-like symbol that is not a function or an axis is replaced by a (name) token.
	 *
	 * @throws ParseException if the lookahead doesn't match
	 */
	public void expectedNext(String... symbols) {
		List<String> expected = Arrays.asList(symbols);
		if(expected.contains(nextToken.getSymbol())) {
			return;
		}
		if(expected.contains(SpecialSymbols.NAME) && !SpecialSymbols.isSpecial(nextToken.getSymbol()) &&
				grammar.isNameLike(nextToken.getSymbol()) &&
				!nextToken.getLabel().is(Role.FUNCTION) && !nextToken.getLabel().is(Role.AXIS)) {
			nextToken = nextToken.asName();
			return;
		}
		throw nextToken.wrongSyntax();
	}

	/**
	 * Creates a token of the symbol registered under lookupName.
	 * @throws GrammarException if nothing is registered under lookupName
	 */
	public Token<C> newToken(String lookupName, Object value, int start, int end) {
		TokenDescriptor<C> descriptor = grammar.lookup(lookupName);
		if(descriptor == null) {
			throw new GrammarException("symbol '" + lookupName + "' is not registered in grammar " +
					grammar.getName());
		}
		return new Token<>(this, descriptor, value, start, end);
	}

	/**
	 * Strips the quotes of a string literal and collapses doubled quotes.
	 */
	public static String unescape(String literal) {
		char quote = literal.charAt(0);
		String body = literal.substring(1, literal.length() - 1);
		return body.replace(new String(new char[] {quote, quote}), String.valueOf(quote));
	}

	public Token<C> getToken() {
		return token;
	}

	public Token<C> getNextToken() {
		return nextToken;
	}

	public String getSource() {
		return source;
	}

	public SourceLocation getPosition() {
		return token.getLocation();
	}

	public boolean isSourceStart() {
		return token.isSourceStart();
	}

	public boolean isLineStart() {
		return token.isLineStart();
	}

	public boolean isSpaced(boolean before, boolean after) {
		return token.isSpaced(before, after);
	}

	@Override
	public String toString() {
		return "Parser [grammar=" + grammar.getName() + "]";
	}
}
