package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;

public record ContinueStatement(SourceLocation location) implements Statement {
}
