package knitscript.util;

import knitscript.Unreachable;
import knitscript.formatters.IndentingWriter;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at ");
			if (startLine != endLine) {
				out.write((startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn);
			} else if (startColumn != endColumn) {
				out.write((startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn);
			} else {
				out.write((startLine + 1) + ":" + (startColumn + 1));
			}
			out.write(" in file " + file);
			if (!file.toFile().isFile() || startOffset < 0) {
				return;
			}
			String source;
			try {
				source = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
			} catch (IOException e) {
				// the location is still useful without the excerpt
				out.write(" (source unavailable: " + e.getMessage() + ")");
				return;
			}
			if (startOffset > source.length()) {
				return;
			}
			int lineStart = source.lastIndexOf('\n', Math.max(startOffset - 1, 0)) + 1;
			if (startOffset == 0) {
				lineStart = 0;
			}
			int lineEnd = source.indexOf('\n', startOffset);
			if (lineEnd == -1) {
				lineEnd = source.length();
			}
			out.newLine();
			out.append(source, lineStart, lineEnd);
			out.newLine();
			for (int pos = lineStart; pos < startOffset; pos++) {
				out.append(' ');
			}
			int caretEnd = Math.min(Math.max(endOffset, startOffset + 1), lineEnd);
			for (int pos = startOffset; pos < caretEnd; pos++) {
				out.append('^');
			}
			if (startOffset == source.length()) {
				out.append("^ EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	/**
	 * Produces the smallest location spanning both locations. Nodes merged from different
	 * documents (patterns imported with a using statement) have no common span, so the result is
	 * unknown in that case.
	 */
	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (!file.equals(other.getFile())) {
			return unknown();
		}
		int mStartColumn, mEndColumn;
		if (startLine == other.getStartLine()) {
			mStartColumn = Integer.min(startColumn, other.getStartColumn());
		} else if (startLine < other.getStartLine()) {
			mStartColumn = startColumn;
		} else /* startLine > other.getStartLine() */ {
			mStartColumn = other.getStartColumn();
		}
		if (endLine == other.getEndLine()) {
			mEndColumn = Integer.max(endColumn, other.getEndColumn());
		} else if (endLine > other.getEndLine()) {
			mEndColumn = endColumn;
		} else /* endLine < other.getEndLine() */ {
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(file,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedFile = getFile().compareTo(o.getFile());
		if (comparedFile != 0) {
			return comparedFile;
		}
		int comparedStartLine = Integer.compare(getStartLine(), o.getStartLine());
		if (comparedStartLine != 0) {
			return comparedStartLine;
		}
		int comparedStartColumn = Integer.compare(getStartColumn(), o.getStartColumn());
		if (comparedStartColumn != 0) {
			return comparedStartColumn;
		}
		int comparedStartOffset = Integer.compare(getStartOffset(), o.getStartOffset());
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
