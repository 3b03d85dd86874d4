package tdop.formatters;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

public class IndentingWriterTest {

	@Test
	public void testIndent() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("a");
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("b\nc");
			try(IndentingWriter.Indent ignored2 = out.indent(3)) {
				out.newLine();
				out.write("d");
			}
		}
		out.newLine();
		out.write("e");
		assertEquals("a\n  b\n  c\n     d\ne", w.toString());
	}

	@Test(expected = IllegalStateException.class)
	public void testUnindentBelowZero() {
		new IndentingWriter(new StringWriter()).unindent(1);
	}
}
