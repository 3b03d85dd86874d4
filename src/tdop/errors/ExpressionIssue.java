package tdop.errors;

import tdop.TDOPException;

/**
 * An expression given on the command line that failed to parse or to evaluate.
 */
public class ExpressionIssue extends Issue {

	private final int index;
	private final String expression;
	private final TDOPException error;

	/**
	 * @param index the 1-based position of the expression among those given
	 */
	public ExpressionIssue(int index, String expression, TDOPException error) {
		super(error.getMsg());
		this.index = index;
		this.expression = expression;
		this.error = error;
	}

	public int getIndex() {
		return index;
	}

	public String getExpression() {
		return expression;
	}

	public TDOPException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
