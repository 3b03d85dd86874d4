package tdop.grammar;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The mapping from lookup names to descriptors of one grammar, in registration order.
 */
public class SymbolTable<C> {

	private final Map<String, TokenDescriptor<C>> descriptors;

	public SymbolTable() {
		this.descriptors = new LinkedHashMap<>();
	}

	/**
	 * @return a table holding copies of every descriptor of this one
	 */
	SymbolTable<C> copy() {
		SymbolTable<C> copy = new SymbolTable<>();
		descriptors.forEach((name, descriptor) -> copy.descriptors.put(name, descriptor.copy()));
		return copy;
	}

	public TokenDescriptor<C> get(String lookupName) {
		return descriptors.get(lookupName);
	}

	public boolean contains(String lookupName) {
		return descriptors.containsKey(lookupName);
	}

	void put(TokenDescriptor<C> descriptor) {
		descriptors.put(descriptor.getLookupName(), descriptor);
	}

	TokenDescriptor<C> remove(String lookupName) {
		return descriptors.remove(lookupName);
	}

	public Collection<TokenDescriptor<C>> descriptors() {
		return Collections.unmodifiableCollection(descriptors.values());
	}

	public int size() {
		return descriptors.size();
	}
}
