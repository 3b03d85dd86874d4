package tdop.errors;

public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract boolean hasErrors();

}
