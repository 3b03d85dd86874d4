package tdop.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The grammars of one language family, by name. A grammar level is defined once, either
 * from scratch or by extending a level defined before it.
 */
public class GrammarRegistry<C> {

	private final Map<String, Grammar<C>> grammars = new LinkedHashMap<>();

	/**
	 * @throws GrammarException if a grammar called name is already defined
	 */
	public Grammar<C> define(String name) {
		checkUndefined(name);
		Grammar<C> grammar = new Grammar<>(name);
		grammars.put(name, grammar);
		return grammar;
	}

	/**
	 * Defines a grammar level that starts from a copy of the symbols of base.
	 * @throws GrammarException if a grammar called name is already defined, or base is not
	 */
	public Grammar<C> define(String name, String base) {
		checkUndefined(name);
		Grammar<C> baseGrammar = get(base);
		if(baseGrammar == null) {
			throw new GrammarException("can't extend undefined grammar '" + base + "'");
		}
		Grammar<C> grammar = baseGrammar.extend(name);
		grammars.put(name, grammar);
		return grammar;
	}

	private void checkUndefined(String name) {
		if(grammars.containsKey(name)) {
			throw new GrammarException("multiple definitions of grammar '" + name + "' are not allowed");
		}
	}

	public Grammar<C> get(String name) {
		return grammars.get(name);
	}

	public boolean contains(String name) {
		return grammars.containsKey(name);
	}

	public Set<String> names() {
		return Collections.unmodifiableSet(grammars.keySet());
	}
}
