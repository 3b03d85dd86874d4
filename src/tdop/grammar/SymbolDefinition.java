package tdop.grammar;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The optional attributes of a registration, see
 * {@link Grammar#register(String, SymbolDefinition)}. Unset attributes leave the registered
 * descriptor unchanged.
 *
 * <pre>
 * grammar.register("+", SymbolDefinition.&lt;Ctx&gt;define()
 *         .lbp(40).rbp(40)
 *         .label(Role.OPERATOR)
 *         .led((self, left) -&gt; ...));
 * </pre>
 */
public class SymbolDefinition<C> {

	private String lookupName;
	private String className;
	private String pattern;
	private Label label;
	private Integer lbp;
	private Integer rbp;
	private boolean sideEffecting;
	private NullDenotation<C> nud;
	private LeftDenotation<C> led;
	private Evaluator<C> evaluator;
	private Selector<C> selector;
	private final Map<String, TokenMethod<C>> methods = new LinkedHashMap<>();

	public static <C> SymbolDefinition<C> define() {
		return new SymbolDefinition<>();
	}

	/**
	 * Registers the symbol under a different symbol table key, so that several surface
	 * symbols can be told apart, or one descriptor can be reached under another name.
	 */
	public SymbolDefinition<C> lookupName(String lookupName) {
		this.lookupName = lookupName;
		return this;
	}

	public SymbolDefinition<C> className(String className) {
		this.className = className;
		return this;
	}

	public SymbolDefinition<C> pattern(String pattern) {
		this.pattern = pattern;
		return this;
	}

	public SymbolDefinition<C> label(Role role, Role... more) {
		this.label = Label.of(role, more);
		return this;
	}

	public SymbolDefinition<C> label(Label label) {
		this.label = label;
		return this;
	}

	public SymbolDefinition<C> lbp(int lbp) {
		this.lbp = lbp;
		return this;
	}

	public SymbolDefinition<C> rbp(int rbp) {
		this.rbp = rbp;
		return this;
	}

	/**
	 * Marks the symbol as having effects beyond its value, which keeps trees containing it
	 * out of the static evaluation pass of the parser.
	 */
	public SymbolDefinition<C> sideEffecting() {
		this.sideEffecting = true;
		return this;
	}

	public SymbolDefinition<C> nud(NullDenotation<C> nud) {
		this.nud = nud;
		return this;
	}

	public SymbolDefinition<C> led(LeftDenotation<C> led) {
		this.led = led;
		return this;
	}

	public SymbolDefinition<C> evaluate(Evaluator<C> evaluator) {
		this.evaluator = evaluator;
		return this;
	}

	public SymbolDefinition<C> select(Selector<C> selector) {
		this.selector = selector;
		return this;
	}

	public SymbolDefinition<C> method(String name, TokenMethod<C> method) {
		this.methods.put(name, method);
		return this;
	}

	String getLookupName() {
		return lookupName;
	}

	String getClassName() {
		return className;
	}

	String getPattern() {
		return pattern;
	}

	Label getLabel() {
		return label;
	}

	Integer getLbp() {
		return lbp;
	}

	Integer getRbp() {
		return rbp;
	}

	boolean isSideEffecting() {
		return sideEffecting;
	}

	/**
	 * @return true if this definition sets the slot or method called name
	 */
	boolean defines(String name) {
		switch(name) {
			case TokenDescriptor.NUD:
				return nud != null;
			case TokenDescriptor.LED:
				return led != null;
			case TokenDescriptor.EVALUATE:
				return evaluator != null;
			case TokenDescriptor.SELECT:
				return selector != null;
			default:
				return methods.containsKey(name);
		}
	}

	/**
	 * Attaches the behaviour of this definition to descriptor, overwriting the slots it sets.
	 */
	void applyTo(TokenDescriptor<C> descriptor) {
		if(lbp != null) {
			descriptor.raiseLbp(lbp);
		}
		if(rbp != null) {
			descriptor.raiseRbp(rbp);
		}
		if(sideEffecting) {
			descriptor.setSideEffecting(true);
		}
		if(nud != null) {
			descriptor.setNud(nud);
		}
		if(led != null) {
			descriptor.setLed(led);
		}
		if(evaluator != null) {
			descriptor.setEvaluator(evaluator);
		}
		if(selector != null) {
			descriptor.setSelector(selector);
		}
		methods.forEach(descriptor::putMethod);
	}
}
