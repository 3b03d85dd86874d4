package tdop.formatters;

import tdop.parser.Token;

import java.io.IOException;

/**
 * Writes a token tree one token per line, children indented below their parent.
 */
public class TokenTreeFormatter {

	private final IndentingWriter out;

	public TokenTreeFormatter(IndentingWriter out) {
		this.out = out;
	}

	public void format(Token<?> token) throws IOException {
		out.write(token.toString());
		try(IndentingWriter.Indent ignored = out.indent()) {
			for(Token<?> child : token.getChildren()) {
				out.newLine();
				format(child);
			}
		}
	}
}
