package knitscript.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line it starts by the current indentation level. Nested output
 * (calls within calls in an issue trace, rows within a row repeat) opens an {@link Indent} and
 * closes it when done.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final String lineSeparator;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;
	private int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4, System.lineSeparator());
	}

	public IndentingWriter(Writer out, String lineSeparator) {
		this(out, 4, lineSeparator);
	}

	public IndentingWriter(Writer out, int defaultIndent, String lineSeparator) {
		this.out = out;
		this.defaultIndent = defaultIndent;
		this.lineSeparator = lineSeparator;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	public String getLineSeparator() {
		return lineSeparator;
	}

	public void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(lineSeparator);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			if (shouldIndent) {
				for (int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
				horizontalPosition = indent;
			}
			int next = data.indexOf(lineSeparator, start);
			if (next == -1) {
				horizontalPosition += data.length() - start;
				out.write(data, start, data.length() - start);
				break;
			}
			int end = next + lineSeparator.length();
			out.write(data, start, end - start);
			horizontalPosition = 0;
			shouldIndent = true;
			start = end;
		}
	}

}
