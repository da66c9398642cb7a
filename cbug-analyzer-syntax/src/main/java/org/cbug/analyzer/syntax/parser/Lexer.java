package org.cbug.analyzer.syntax.parser;

import org.cbug.analyzer.syntax.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer with a minimal preprocessor: {@code #include} lines are recorded, object-like and
 * function-like {@code #define}s are expanded, every other directive is ignored.
 */
public class Lexer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private static final List<String> PUNCTUATORS_3 = List.of("...", ">>=", "<<=");
    private static final List<String> PUNCTUATORS_2 = List.of("->", "++", "--", "<<", ">>", "<=", ">=", "==",
            "!=", "&&", "||", "+=", "-=", "*=", "/=", "%=", "&=", "^=", "|=", "##");
    private static final String PUNCTUATORS_1 = "[](){}.&*+-~!/%<>^|?:;=,#";
    private static final Pattern DIRECTIVE = Pattern.compile("(\\w+)\\s*(.*)", Pattern.DOTALL);
    private static final Pattern MACRO = Pattern.compile("([A-Za-z_$][\\w$]*)(\\(([^)]*)\\))?\\s*(.*)", Pattern.DOTALL);
    private static final int MAX_EXPANSION_DEPTH = 64;

    public record Macro(String name, List<String> parameters, List<Token> body) {
        public boolean isFunctionLike() {
            return parameters != null;
        }
    }

    private final String file;
    private final String text;
    private final Map<String, Macro> macros;
    private final Set<String> includes = new LinkedHashSet<>();
    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean lineStart = true;

    public Lexer(String file, String text, Map<String, Macro> predefined) {
        this.file = file;
        this.text = text;
        this.macros = new HashMap<>(predefined);
    }

    public Set<String> includes() {
        return includes;
    }

    public Map<String, Macro> macros() {
        return Collections.unmodifiableMap(macros);
    }

    /*
    tokens after macro expansion, terminated by an END token
     */
    public List<Token> tokenize() {
        List<Token> raw = scan();
        List<Token> expanded = expand(raw, Set.of(), 0);
        expanded.add(new Token(TokenKind.END, "", line, column));
        LOGGER.debug("{}: {} tokens, {} after expansion, includes {}", file, raw.size(), expanded.size(), includes);
        return expanded;
    }

    /*
    raw tokens, without END; directives are processed as they are met
     */
    List<Token> scan() {
        List<Token> tokens = new ArrayList<>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                advance();
                lineStart = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }
            if (c == '\\' && peek(1) == '\n') {
                advance();
                advance();
                continue;
            }
            if (c == '/' && peek(1) == '/') {
                while (pos < text.length() && text.charAt(pos) != '\n') advance();
                continue;
            }
            if (c == '/' && peek(1) == '*') {
                skipBlockComment();
                continue;
            }
            if (c == '#' && lineStart) {
                directive();
                continue;
            }
            lineStart = false;
            int l = line;
            int col = column;
            if (isIdentifierStart(c)) {
                String identifier = identifier();
                if (pos < text.length() && text.charAt(pos) == '"' && isStringPrefix(identifier)) {
                    tokens.add(new Token(TokenKind.STRING, stringLiteral(), l, col));
                } else if (pos < text.length() && text.charAt(pos) == '\'' && isStringPrefix(identifier)) {
                    tokens.add(new Token(TokenKind.CHARACTER, characterLiteral(), l, col));
                } else {
                    tokens.add(new Token(TokenKind.IDENTIFIER, identifier, l, col));
                }
            } else if (Character.isDigit(c) || c == '.' && Character.isDigit(peek(1))) {
                tokens.add(number(l, col));
            } else if (c == '\'') {
                tokens.add(new Token(TokenKind.CHARACTER, characterLiteral(), l, col));
            } else if (c == '"') {
                tokens.add(new Token(TokenKind.STRING, stringLiteral(), l, col));
            } else {
                tokens.add(new Token(TokenKind.PUNCTUATOR, punctuator(), l, col));
            }
        }
        return tokens;
    }

    private static boolean isStringPrefix(String s) {
        return "L".equals(s) || "u".equals(s) || "U".equals(s) || "u8".equals(s);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private char peek(int offset) {
        int p = pos + offset;
        return p < text.length() ? text.charAt(p) : '\0';
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private ParseException error(String message) {
        return new ParseException(file, line, column, message);
    }

    private void skipBlockComment() {
        advance();
        advance();
        while (pos < text.length() && !(text.charAt(pos) == '*' && peek(1) == '/')) advance();
        if (pos >= text.length()) throw error("Unterminated comment");
        advance();
        advance();
    }

    private String identifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) advance();
        return text.substring(start, pos);
    }

    private Token number(int l, int col) {
        int start = pos;
        boolean floating = false;
        if (text.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            advance();
            advance();
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.digit(c, 16) >= 0) {
                    advance();
                } else if (c == '.') {
                    floating = true;
                    advance();
                } else if (c == 'p' || c == 'P') {
                    floating = true;
                    advance();
                    if (peek(0) == '+' || peek(0) == '-') advance();
                } else break;
            }
        } else {
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
            if (pos < text.length() && text.charAt(pos) == '.') {
                floating = true;
                advance();
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
            }
            if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                floating = true;
                advance();
                if (peek(0) == '+' || peek(0) == '-') advance();
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
            }
        }
        while (pos < text.length() && "uUlLfF".indexOf(text.charAt(pos)) >= 0) {
            char c = text.charAt(pos);
            if (c == 'f' || c == 'F') floating = true;
            advance();
        }
        if (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            throw error("Malformed number " + text.substring(start, pos + 1));
        }
        return new Token(floating ? TokenKind.FLOATING : TokenKind.INTEGER, text.substring(start, pos), l, col);
    }

    private String characterLiteral() {
        advance();
        int start = pos;
        while (pos < text.length() && text.charAt(pos) != '\'') {
            if (text.charAt(pos) == '\n') throw error("Unterminated character literal");
            if (text.charAt(pos) == '\\') advance();
            advance();
        }
        if (pos >= text.length()) throw error("Unterminated character literal");
        String content = text.substring(start, pos);
        advance();
        return content;
    }

    private String stringLiteral() {
        advance();
        int start = pos;
        while (pos < text.length() && text.charAt(pos) != '"') {
            if (text.charAt(pos) == '\n') throw error("Unterminated string literal");
            if (text.charAt(pos) == '\\') advance();
            advance();
        }
        if (pos >= text.length()) throw error("Unterminated string literal");
        String content = text.substring(start, pos);
        advance();
        return unescape(content);
    }

    private String punctuator() {
        for (String p : PUNCTUATORS_3) {
            if (text.startsWith(p, pos)) return take(p);
        }
        for (String p : PUNCTUATORS_2) {
            if (text.startsWith(p, pos)) return take(p);
        }
        char c = text.charAt(pos);
        if (PUNCTUATORS_1.indexOf(c) >= 0) return take(String.valueOf(c));
        throw error("Unexpected character '" + c + "'");
    }

    private String take(String p) {
        for (int i = 0; i < p.length(); i++) advance();
        return p;
    }

    public static String unescape(String s) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i++);
            if (c != '\\' || i >= s.length()) {
                sb.append(c);
                continue;
            }
            char e = s.charAt(i++);
            switch (e) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000b');
                case 'x' -> {
                    int start = i;
                    while (i < s.length() && Character.digit(s.charAt(i), 16) >= 0) i++;
                    sb.append(start == i ? 'x' : (char) Integer.parseInt(s.substring(start, i), 16));
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        int start = i - 1;
                        while (i < s.length() && i - start < 3 && s.charAt(i) >= '0' && s.charAt(i) <= '7') i++;
                        sb.append((char) Integer.parseInt(s.substring(start, i), 8));
                    } else {
                        sb.append(e);
                    }
                }
            }
        }
        return sb.toString();
    }

    // ---- preprocessing

    private void directive() {
        int directiveLine = line;
        advance();
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && peek(1) == '\n') {
                advance();
                advance();
                sb.append(' ');
            } else if (c == '\n') {
                break;
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
                sb.append(' ');
            } else if (c == '/' && peek(1) == '/') {
                while (pos < text.length() && text.charAt(pos) != '\n') advance();
            } else {
                sb.append(c);
                advance();
            }
        }
        Matcher m = DIRECTIVE.matcher(sb.toString().strip());
        if (!m.matches()) return;
        String name = m.group(1);
        String rest = m.group(2).strip();
        switch (name) {
            case "include" -> include(rest, directiveLine);
            case "define" -> define(rest, directiveLine);
            case "undef" -> macros.remove(rest);
            default -> LOGGER.debug("Ignoring #{} at {}:{}", name, file, directiveLine);
        }
    }

    private void include(String rest, int directiveLine) {
        if (rest.startsWith("<") && rest.indexOf('>') > 0) {
            includes.add(rest.substring(1, rest.indexOf('>')).strip());
        } else if (rest.startsWith("\"") && rest.indexOf('"', 1) > 0) {
            includes.add(rest.substring(1, rest.indexOf('"', 1)).strip());
        } else {
            throw new ParseException(file, directiveLine, 1, "Malformed #include " + rest);
        }
    }

    private void define(String rest, int directiveLine) {
        Matcher m = MACRO.matcher(rest);
        if (!m.matches()) throw new ParseException(file, directiveLine, 1, "Malformed #define " + rest);
        String name = m.group(1);
        List<String> parameters = null;
        if (m.group(2) != null) {
            String list = m.group(3).strip();
            parameters = list.isEmpty() ? List.of()
                    : Arrays.stream(list.split(",")).map(String::strip).toList();
        }
        Lexer bodyLexer = new Lexer(file, m.group(4), Map.of());
        bodyLexer.lineStart = false;
        List<Token> body = bodyLexer.scan().stream()
                .map(t -> t.at(directiveLine, t.column()))
                .toList();
        macros.put(name, new Macro(name, parameters, body));
    }

    private List<Token> expand(List<Token> tokens, Set<String> disabled, int depth) {
        if (depth > MAX_EXPANSION_DEPTH) {
            Token t = tokens.isEmpty() ? new Token(TokenKind.END, "", line, column) : tokens.get(0);
            throw new ParseException(file, t.line(), t.column(), "Macro expansion too deep");
        }
        List<Token> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            Macro macro = t.isIdentifier() && !disabled.contains(t.text()) ? macros.get(t.text()) : null;
            if (macro == null || macro.isFunctionLike() && (i + 1 >= tokens.size() || !tokens.get(i + 1).is("("))) {
                out.add(t);
                i++;
                continue;
            }
            Set<String> inner = new HashSet<>(disabled);
            inner.add(macro.name());
            List<Token> body = macro.body().stream().map(b -> b.at(t.line(), t.column())).toList();
            if (!macro.isFunctionLike()) {
                out.addAll(expand(body, inner, depth + 1));
                i++;
                continue;
            }
            List<List<Token>> arguments = new ArrayList<>();
            List<Token> current = new ArrayList<>();
            int level = 0;
            int j = i + 2;
            for (; j < tokens.size(); j++) {
                Token a = tokens.get(j);
                if (a.is("(")) {
                    level++;
                } else if (a.is(")")) {
                    if (level == 0) break;
                    level--;
                } else if (a.is(",") && level == 0) {
                    arguments.add(current);
                    current = new ArrayList<>();
                    continue;
                }
                current.add(a);
            }
            if (j >= tokens.size()) {
                throw new ParseException(file, t.line(), t.column(), "Unterminated invocation of macro " + macro.name());
            }
            if (!current.isEmpty() || !arguments.isEmpty()) arguments.add(current);
            List<Token> substituted = new ArrayList<>();
            for (Token b : body) {
                int index = b.isIdentifier() ? macro.parameters().indexOf(b.text()) : -1;
                if (index < 0) {
                    substituted.add(b);
                } else if (index < arguments.size()) {
                    substituted.addAll(expand(arguments.get(index), disabled, depth + 1));
                }
            }
            out.addAll(expand(substituted, inner, depth + 1));
            i = j + 1;
        }
        return out;
    }
}
