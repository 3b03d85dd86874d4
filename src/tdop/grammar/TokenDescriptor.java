package tdop.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a grammar knows about one symbol: its binding powers, its label, an optional
 * custom tokenizer pattern and the behaviour slots that every {@link tdop.parser.Token} of
 * this symbol dispatches to. Empty slots fall back to the defaults of
 * {@link tdop.parser.Token}.
 *
 * <p>Binding powers only grow: see {@link #raiseLbp(int)}.</p>
 */
public class TokenDescriptor<C> {

	public static final String NUD = "nud";
	public static final String LED = "led";
	public static final String EVALUATE = "evaluate";
	public static final String SELECT = "select";

	private final String symbol;
	private final String lookupName;
	private final String className;
	private final String pattern;
	private Label label;
	private int lbp;
	private int rbp;
	private boolean sideEffecting;

	private NullDenotation<C> nud;
	private LeftDenotation<C> led;
	private Evaluator<C> evaluator;
	private Selector<C> selector;
	private final Map<String, TokenMethod<C>> methods;

	TokenDescriptor(String symbol, String lookupName, String className, String pattern, Label label) {
		this.symbol = symbol;
		this.lookupName = lookupName;
		this.className = className;
		this.pattern = pattern;
		this.label = label;
		this.methods = new LinkedHashMap<>();
	}

	/**
	 * @return a copy of this descriptor whose slots can be changed without affecting this one
	 */
	TokenDescriptor<C> copy() {
		TokenDescriptor<C> copy = new TokenDescriptor<>(symbol, lookupName, className, pattern, label);
		copy.lbp = lbp;
		copy.rbp = rbp;
		copy.sideEffecting = sideEffecting;
		copy.nud = nud;
		copy.led = led;
		copy.evaluator = evaluator;
		copy.selector = selector;
		copy.methods.putAll(methods);
		return copy;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return the symbol table key, usually the symbol itself
	 */
	public String getLookupName() {
		return lookupName;
	}

	public String getClassName() {
		return className;
	}

	/**
	 * @return the custom tokenizer pattern, or null when the symbol text itself is matched
	 */
	public String getPattern() {
		return pattern;
	}

	public Label getLabel() {
		return label;
	}

	void setLabel(Label label) {
		this.label = label;
	}

	public int getLbp() {
		return lbp;
	}

	public int getRbp() {
		return rbp;
	}

	/**
	 * Raises the left binding power to lbp. A lower value leaves the current one in place,
	 * so that a grammar level can only make a symbol bind tighter.
	 */
	void raiseLbp(int lbp) {
		if(lbp > this.lbp) {
			this.lbp = lbp;
		}
	}

	void raiseRbp(int rbp) {
		if(rbp > this.rbp) {
			this.rbp = rbp;
		}
	}

	void setBindingPowers(int lbp, int rbp) {
		this.lbp = lbp;
		this.rbp = rbp;
	}

	/**
	 * @return true if evaluating tokens of this symbol has effects beyond computing a value
	 */
	public boolean isSideEffecting() {
		return sideEffecting;
	}

	void setSideEffecting(boolean sideEffecting) {
		this.sideEffecting = sideEffecting;
	}

	public NullDenotation<C> getNud() {
		return nud;
	}

	public void setNud(NullDenotation<C> nud) {
		this.nud = nud;
	}

	public LeftDenotation<C> getLed() {
		return led;
	}

	public void setLed(LeftDenotation<C> led) {
		this.led = led;
	}

	public Evaluator<C> getEvaluator() {
		return evaluator;
	}

	public void setEvaluator(Evaluator<C> evaluator) {
		this.evaluator = evaluator;
	}

	public Selector<C> getSelector() {
		return selector;
	}

	public void setSelector(Selector<C> selector) {
		this.selector = selector;
	}

	public TokenMethod<C> getMethod(String name) {
		return methods.get(name);
	}

	public void putMethod(String name, TokenMethod<C> method) {
		methods.put(Objects.requireNonNull(name), Objects.requireNonNull(method));
	}

	public Map<String, TokenMethod<C>> getMethods() {
		return Collections.unmodifiableMap(methods);
	}

	/**
	 * @return true if name is one of the four protocol slots or a named method of this symbol
	 */
	public boolean hasMethod(String name) {
		switch(name) {
			case NUD:
			case LED:
			case EVALUATE:
			case SELECT:
				return true;
			default:
				return methods.containsKey(name);
		}
	}

	@Override
	public String toString() {
		return className + "[symbol=" + symbol + ", lbp=" + lbp + ", rbp=" + rbp + ", label=" + label + "]";
	}
}
