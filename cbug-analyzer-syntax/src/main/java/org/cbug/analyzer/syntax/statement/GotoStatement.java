package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;

public record GotoStatement(String label, SourceLocation location) implements Statement {
}
