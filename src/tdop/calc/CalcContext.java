package tdop.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The dynamic context of calc expressions: variable bindings, and the messages written by
 * trace(). A variable is bound to a single item or to a list of items.
 */
public class CalcContext {

	private final Map<String, Object> variables;
	private final List<String> traceMessages = new ArrayList<>();

	public CalcContext() {
		this(Collections.emptyMap());
	}

	public CalcContext(Map<String, Object> variables) {
		this.variables = new LinkedHashMap<>(variables);
	}

	public CalcContext setVariable(String name, Object value) {
		variables.put(name, value);
		return this;
	}

	public boolean hasVariable(String name) {
		return variables.containsKey(name);
	}

	public Object getVariable(String name) {
		return variables.get(name);
	}

	public Map<String, Object> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	void addTraceMessage(String message) {
		traceMessages.add(message);
	}

	public List<String> getTraceMessages() {
		return Collections.unmodifiableList(traceMessages);
	}
}
