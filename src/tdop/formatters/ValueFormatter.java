package tdop.formatters;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Writes evaluation results: a single item as itself, any other sequence parenthesized and
 * comma separated. Strings are quoted, decimals are written without exponent.
 */
public class ValueFormatter {

	private final Writer out;

	public ValueFormatter(Writer out) {
		this.out = out;
	}

	public void format(Stream<Object> items) throws IOException {
		Iterator<Object> it = items.iterator();
		if(!it.hasNext()) {
			out.write("()");
			return;
		}
		Object first = it.next();
		if(!it.hasNext()) {
			formatItem(first);
			return;
		}
		out.write("(");
		formatItem(first);
		while(it.hasNext()) {
			out.write(", ");
			formatItem(it.next());
		}
		out.write(")");
	}

	public void formatItem(Object item) throws IOException {
		if(item instanceof String) {
			out.write("'");
			out.write(((String) item).replace("'", "''"));
			out.write("'");
		}else if(item instanceof BigDecimal) {
			out.write(((BigDecimal) item).toPlainString());
		}else {
			out.write(String.valueOf(item));
		}
	}
}
