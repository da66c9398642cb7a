package org.cbug.analyzer.syntax.parser;

public enum TokenKind {
    IDENTIFIER, INTEGER, FLOATING, CHARACTER, STRING, PUNCTUATOR, END
}
