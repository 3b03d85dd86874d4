package tdop.util;

import tdop.Unreachable;
import tdop.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A span of source text. Offsets are 0-based and the end offset is exclusive; line and
 * column are 1-based and refer to the start of the span.
 */
public class SourceLocation {
	private final int startOffset;
	private final int endOffset;
	private final int line;
	private final int column;

	public SourceLocation(int startOffset, int endOffset, int line, int column) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.line = line;
		this.column = column;
	}

	/**
	 * Computes the location of the span [start, end) within source. The line is
	 * found by counting the newlines preceding start, so this is linear in the
	 * size of the source and meant for diagnostics only.
	 */
	public static SourceLocation of(CharSequence source, int start, int end) {
		int line = 1;
		int lastNewline = -1;
		int limit = Math.min(start, source.length());
		for(int pos = 0; pos < limit; pos++) {
			if(source.charAt(pos) == '\n') {
				++line;
				lastNewline = pos;
			}
		}
		return new SourceLocation(start, end, line, start - lastNewline);
	}

	public String prettyString(CharSequence source) {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw), source);
		return sw.getBuffer().toString();
	}

	/**
	 * Writes the position followed by the source line containing the start of this
	 * location, with carets under the located text.
	 */
	public void writePretty(IndentingWriter out, CharSequence source) {
		try {
			out.write("at line " + line + ", column " + column);
			out.newLine();
			int lineStart = startOffset;
			while(lineStart > 0 && (lineStart > source.length() || source.charAt(lineStart - 1) != '\n')) {
				lineStart--;
			}
			int lineEnd = Integer.min(startOffset, source.length());
			while(lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
				lineEnd++;
			}
			out.append(source, lineStart, lineEnd);
			out.newLine();
			for(int pos = lineStart; pos < startOffset; pos++) {
				out.append(' ');
			}
			if(startOffset >= source.length()) {
				out.append("^ EOF");
				return;
			}
			int effectiveEndOffset = endOffset > startOffset ? endOffset : startOffset + 1;
			for(int pos = startOffset; pos < lineEnd && pos < effectiveEndOffset; pos++) {
				out.append('^');
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startOffset, endOffset, line, column);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset && line == other.line &&
				column == other.column;
	}

	@Override
	public String toString() {
		return "SourceLocation [startOffset=" + startOffset + ", endOffset=" + endOffset +
				", line=" + line + ", column=" + column + "]";
	}

}
