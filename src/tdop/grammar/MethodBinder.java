package tdop.grammar;

/**
 * Replaces methods of an already registered symbol, see {@link Grammar#method(String, int)}.
 */
public class MethodBinder<C> {

	private final TokenDescriptor<C> descriptor;

	MethodBinder(TokenDescriptor<C> descriptor) {
		this.descriptor = descriptor;
	}

	public TokenDescriptor<C> getDescriptor() {
		return descriptor;
	}

	public MethodBinder<C> nud(NullDenotation<C> nud) {
		descriptor.setNud(nud);
		return this;
	}

	public MethodBinder<C> led(LeftDenotation<C> led) {
		descriptor.setLed(led);
		return this;
	}

	public MethodBinder<C> evaluate(Evaluator<C> evaluator) {
		descriptor.setEvaluator(evaluator);
		return this;
	}

	public MethodBinder<C> select(Selector<C> selector) {
		descriptor.setSelector(selector);
		return this;
	}

	/**
	 * Replaces the named method of the symbol.
	 * @throws GrammarException if the symbol has no method called name
	 */
	public MethodBinder<C> bind(String name, TokenMethod<C> method) {
		if(isSlot(name)) {
			throw new GrammarException("'" + name + "' is a protocol slot of " + descriptor.getClassName() +
					", bind it with the matching method of the binder");
		}
		if(!descriptor.hasMethod(name)) {
			throw new GrammarException("'" + name + "' is not a method of " + descriptor.getClassName());
		}
		descriptor.putMethod(name, method);
		return this;
	}

	private static boolean isSlot(String name) {
		return name.equals(TokenDescriptor.NUD) || name.equals(TokenDescriptor.LED) ||
				name.equals(TokenDescriptor.EVALUATE) || name.equals(TokenDescriptor.SELECT);
	}
}
