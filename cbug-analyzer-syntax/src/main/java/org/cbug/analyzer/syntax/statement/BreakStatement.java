package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;

public record BreakStatement(SourceLocation location) implements Statement {
}
