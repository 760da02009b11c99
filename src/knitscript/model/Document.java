package knitscript.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

public class Document {
	private final Path source;
	private final List<Statement> statements;

	public Document(Path source, List<Statement> statements) {
		this.source = source;
		this.statements = Collections.unmodifiableList(statements);
	}

	/**
	 * @return the KnitScript source file the document was parsed from
	 */
	public Path getSource() {
		return source;
	}

	public List<Statement> getStatements() {
		return statements;
	}
}
