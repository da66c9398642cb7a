package org.cbug.analyzer.syntax.parser;

/*
for STRING tokens, text holds the unescaped content; for CHARACTER tokens the text between the quotes
 */
public record Token(TokenKind kind, String text, int line, int column) {

    public boolean is(String s) {
        return (kind == TokenKind.PUNCTUATOR || kind == TokenKind.IDENTIFIER) && text.equals(s);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    public Token at(int newLine, int newColumn) {
        return new Token(kind, text, newLine, newColumn);
    }

    @Override
    public String toString() {
        return kind == TokenKind.END ? "end of file" : "'" + text + "'";
    }
}
