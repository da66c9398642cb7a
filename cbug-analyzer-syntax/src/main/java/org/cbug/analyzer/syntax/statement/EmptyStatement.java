package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;

public record EmptyStatement(SourceLocation location) implements Statement {
}
