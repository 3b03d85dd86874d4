package tdop.errors;

/**
 * Invalid command line options or configuration.
 */
public class OptionIssue extends Issue {

	private final String reason;

	public OptionIssue(String reason) {
		super(reason);
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
