package tdop.formatters;

import tdop.TDOPException;
import tdop.errors.ExpressionIssue;
import tdop.errors.IssueVisitor;
import tdop.errors.OptionIssue;
import tdop.parser.ParseException;
import tdop.parser.Token;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(OptionIssue optionIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionIssue.getReason());
		return null;
	}

	@Override
	public Void visit(ExpressionIssue expressionIssue) throws IOException {
		TDOPException error = expressionIssue.getError();
		out.write("expression " + expressionIssue.getIndex() + ": ");
		if(error instanceof ParseException) {
			Token<?> token = ((ParseException) error).getToken();
			out.write(error.getPrefix() + ": " + error.getMsg());
			try(IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				token.getLocation().writePretty(out, token.getSourceText());
			}
		}else {
			out.write(error.getPrefix() + ": " + error.getMsg());
		}
		return null;
	}
}
