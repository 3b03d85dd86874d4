package tdop.grammar;

/**
 * The roles a token can play. A token's {@link Label} holds one role, or several when the
 * symbol is ambiguous until the parser sees its surroundings.
 */
public enum Role {
	SYMBOL("symbol"),
	LITERAL("literal"),
	OPERATOR("operator"),
	PREFIX_OPERATOR("prefix operator"),
	POSTFIX_OPERATOR("postfix operator"),
	FUNCTION("function"),
	CONSTRUCTOR_FUNCTION("constructor function"),
	AXIS("axis"),
	KIND_TEST("kind test"),
	SEQUENCE_TYPE("sequence type"),
	FUNCTION_TEST("function test"),
	;

	private final String displayName;

	Role(String displayName) {
		this.displayName = displayName;
	}

	public String getDisplayName() {
		return displayName;
	}

	@Override
	public String toString() {
		return displayName;
	}
}
