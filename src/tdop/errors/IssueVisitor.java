package tdop.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionIssue optionIssue) throws E;
	public abstract T visit(ExpressionIssue expressionIssue) throws E;
}
