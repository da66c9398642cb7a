package org.cbug.analyzer.syntax.parser;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.*;
import org.cbug.analyzer.syntax.expression.*;
import org.cbug.analyzer.syntax.statement.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * Recursive-descent parser for the C subset handled by the analyzer. Names are resolved while parsing:
 * every variable reference points to its {@link Symbol}, and every expression carries its static type
 * as far as it can be determined without the standard headers.
 * <p>
 * Nested function definitions (a GCC extension) are hoisted to the translation unit.
 * Identifiers that are never declared become implicit global symbols of unknown type.
 */
public class CParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(CParser.class);

    private static final Set<String> STORAGE = Set.of("typedef", "extern", "static", "auto", "register", "inline",
            "__inline", "__inline__", "_Noreturn", "_Thread_local", "__extension__");
    private static final Set<String> QUALIFIERS = Set.of("const", "volatile", "restrict", "__restrict",
            "__restrict__", "_Atomic", "__const", "__volatile__");
    private static final Set<String> BASIC_TYPE_WORDS = Set.of("void", "char", "short", "int", "long", "float",
            "double", "signed", "unsigned", "_Bool", "__signed__", "_Complex");
    private static final Set<String> STATEMENT_KEYWORDS = Set.of("if", "else", "while", "do", "for", "switch", "case",
            "default", "return", "break", "continue", "goto", "sizeof", "struct", "union", "enum");
    private static final Map<String, BinaryOperator> COMPOUND_ASSIGNMENT = Map.of(
            "+=", BinaryOperator.ADD, "-=", BinaryOperator.SUBTRACT, "*=", BinaryOperator.MULTIPLY,
            "/=", BinaryOperator.DIVIDE, "%=", BinaryOperator.REMAINDER, "<<=", BinaryOperator.SHIFT_LEFT,
            ">>=", BinaryOperator.SHIFT_RIGHT, "&=", BinaryOperator.BIT_AND, "^=", BinaryOperator.BIT_XOR,
            "|=", BinaryOperator.BIT_OR);

    private record Specifiers(CType type, boolean isTypedef, boolean isStatic, boolean isExtern) {
    }

    private record Parameter(String name, Token nameToken, CType type) {
    }

    private record ParameterList(List<Parameter> parameters, boolean variadic) {
    }

    /*
    for a function declarator, type is the return type
     */
    private record Declarator(String name, Token nameToken, CType type, ParameterList parameterList,
                              boolean function) {
    }

    private final String file;
    private final List<Token> tokens;
    private int pos;

    private final Deque<Map<String, Symbol>> scopes = new ArrayDeque<>();
    private final Deque<Integer> scopeIds = new ArrayDeque<>();
    private int nextScopeId;
    private int anonymousStructs;

    private final Map<String, CType> typedefs = new HashMap<>(LibraryTypes.TYPEDEFS);
    private final Map<String, Map<String, CType>> structFields = new HashMap<>();
    private final Map<String, Long> enumConstants = new HashMap<>();
    private final Map<String, CType> declaredFunctions = new LinkedHashMap<>();
    private final List<FunctionDefinition> functions = new ArrayList<>();
    private final List<VariableDeclaration> globals = new ArrayList<>();
    private final SymbolTable.Builder symbolTable = new SymbolTable.Builder();
    private final Deque<String> enclosingFunctions = new ArrayDeque<>();

    public CParser(String file, List<Token> tokens) {
        this.file = file;
        this.tokens = tokens;
    }

    public TranslationUnit parse(Set<String> includes) {
        openScope();
        while (peek().kind() != TokenKind.END) {
            externalDeclaration();
        }
        closeScope();
        functions.sort(Comparator.comparing(FunctionDefinition::location));
        LOGGER.debug("Parsed {}: {} functions, {} globals", file, functions.size(), globals.size());
        return new TranslationUnit(file, includes, globals, functions, declaredFunctions, symbolTable.build());
    }

    // ---- token helpers

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        int p = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(p);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != TokenKind.END) pos++;
        return t;
    }

    private boolean accept(String s) {
        if (peek().is(s)) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(String s) {
        Token t = peek();
        if (!t.is(s)) throw error(t, "expected '" + s + "' but found " + t);
        return next();
    }

    private ParseException error(Token t, String message) {
        return new ParseException(file, t.line(), t.column(), message);
    }

    private SourceLocation location(Token t) {
        return new SourceLocation(file, t.line(), t.column());
    }

    private void skipBalanced(String open, String close) {
        Token start = expect(open);
        int level = 1;
        while (level > 0) {
            Token t = next();
            if (t.kind() == TokenKind.END) throw error(start, "unbalanced '" + open + "'");
            if (t.is(open)) level++;
            else if (t.is(close)) level--;
        }
    }

    private void skipAttributes() {
        while (peek().is("__attribute__") || peek().is("__declspec") || peek().is("__asm__") || peek().is("asm")
               && peek(1).is("(")) {
            next();
            skipBalanced("(", ")");
        }
    }

    private void skipQualifiers() {
        while (peek().isIdentifier() && QUALIFIERS.contains(peek().text())) next();
    }

    // ---- scopes and symbols

    private void openScope() {
        scopes.push(new HashMap<>());
        scopeIds.push(nextScopeId++);
    }

    private void closeScope() {
        scopes.pop();
        scopeIds.pop();
    }

    private Symbol declare(String name, CType type, StorageKind storage, Token token) {
        Symbol symbol = new Symbol(name, type, scopeIds.peek(), storage, location(token));
        scopes.peek().put(name, symbol);
        symbolTable.add(symbol);
        return symbol;
    }

    private Symbol lookupVariable(String name) {
        for (Map<String, Symbol> scope : scopes) {
            Symbol symbol = scope.get(name);
            if (symbol != null) return symbol;
        }
        return null;
    }

    private boolean isVariable(String name) {
        return lookupVariable(name) != null;
    }

    private Symbol implicitSymbol(String name, CType type, Token token) {
        Symbol symbol = new Symbol(name, type, 0, StorageKind.GLOBAL, location(token));
        scopes.getLast().put(name, symbol);
        symbolTable.add(symbol);
        return symbol;
    }

    // ---- declarations

    private void externalDeclaration() {
        if (accept(";")) return;
        Token start = peek();
        if (start.is("_Static_assert")) {
            next();
            skipBalanced("(", ")");
            expect(";");
            return;
        }
        if ((start.is("asm") || start.is("__asm__")) && peek(1).is("(")) {
            next();
            skipBalanced("(", ")");
            expect(";");
            return;
        }
        Specifiers specifiers = specifiers();
        if (specifiers == null) {
            if (start.isIdentifier() && peek(1).is("(")) {
                specifiers = new Specifiers(CType.INT, false, false, false);
            } else {
                throw error(start, "expected a declaration but found " + start);
            }
        }
        if (accept(";")) return;
        globals.addAll(initDeclaratorList(specifiers, StorageKind.GLOBAL));
    }

    private boolean isDeclarationStart() {
        Token t = peek();
        if (!t.isIdentifier()) return false;
        String s = t.text();
        if (STORAGE.contains(s) || QUALIFIERS.contains(s) || BASIC_TYPE_WORDS.contains(s)
            || "struct".equals(s) || "union".equals(s) || "enum".equals(s) || "__attribute__".equals(s)) {
            return true;
        }
        return typedefs.containsKey(s) && !isVariable(s) && !peek(1).is(":");
    }

    private boolean isTypeNameStart(int offset) {
        Token t = peek(offset);
        if (!t.isIdentifier()) return false;
        String s = t.text();
        return BASIC_TYPE_WORDS.contains(s) || QUALIFIERS.contains(s) || "struct".equals(s) || "union".equals(s)
               || "enum".equals(s) || typedefs.containsKey(s) && !isVariable(s);
    }

    private Specifiers specifiers() {
        boolean isTypedef = false;
        boolean isStatic = false;
        boolean isExtern = false;
        boolean seen = false;
        CType base = null;
        List<String> words = new ArrayList<>();
        while (peek().isIdentifier()) {
            String s = peek().text();
            if (STORAGE.contains(s)) {
                next();
                seen = true;
                switch (s) {
                    case "typedef" -> isTypedef = true;
                    case "static" -> isStatic = true;
                    case "extern" -> isExtern = true;
                    default -> {
                    }
                }
            } else if (QUALIFIERS.contains(s)) {
                next();
                seen = true;
            } else if ("__attribute__".equals(s) || "__declspec".equals(s)) {
                next();
                skipBalanced("(", ")");
                seen = true;
            } else if (("struct".equals(s) || "union".equals(s)) && base == null && words.isEmpty()) {
                base = structSpecifier();
                seen = true;
            } else if ("enum".equals(s) && base == null && words.isEmpty()) {
                base = enumSpecifier();
                seen = true;
            } else if (BASIC_TYPE_WORDS.contains(s) && base == null) {
                next();
                words.add(s);
                seen = true;
            } else if (base == null && words.isEmpty() && typedefs.containsKey(s) && !isVariable(s)) {
                next();
                base = typedefs.get(s);
                seen = true;
            } else {
                break;
            }
        }
        if (!seen) return null;
        if (base == null) base = words.isEmpty() ? CType.INT : basicType(words);
        return new Specifiers(base, isTypedef, isStatic, isExtern);
    }

    private static CType basicType(List<String> words) {
        if (words.contains("void")) return CType.VOID;
        if (words.contains("float")) return CType.FLOAT;
        if (words.contains("double")) return words.contains("long") ? CType.floating("long double") : CType.DOUBLE;
        if (words.contains("_Bool")) return CType.integral("_Bool");
        boolean unsigned = words.contains("unsigned");
        if (words.contains("char")) {
            return CType.integral(unsigned ? "unsigned char" : words.contains("signed") ? "signed char" : "char");
        }
        String base;
        long longs = words.stream().filter("long"::equals).count();
        if (words.contains("short")) base = "short";
        else if (longs >= 2) base = "long long";
        else if (longs == 1) base = "long";
        else base = "int";
        return CType.integral(unsigned ? "unsigned " + base : base);
    }

    private CType structSpecifier() {
        String kind = next().text();
        skipAttributes();
        String tag;
        if (peek().isIdentifier()) {
            tag = next().text();
        } else {
            tag = "<anonymous" + (++anonymousStructs) + ">";
        }
        String name = kind + " " + tag;
        if (accept("{")) {
            Map<String, CType> fields = new LinkedHashMap<>();
            structFields.put(name, fields);
            while (!accept("}")) {
                Token fieldStart = peek();
                Specifiers fieldSpecifiers = specifiers();
                if (fieldSpecifiers == null) throw error(fieldStart, "expected a field declaration");
                if (!peek().is(";")) {
                    do {
                        if (accept(":")) {
                            conditionalExpression();
                            continue;
                        }
                        Declarator d = declarator(fieldSpecifiers.type(), false);
                        if (accept(":")) conditionalExpression();
                        fields.put(d.name(), d.function() ? CType.function(d.type()) : d.type());
                    } while (accept(","));
                }
                expect(";");
            }
        }
        skipAttributes();
        return CType.struct(name);
    }

    private CType enumSpecifier() {
        next();
        skipAttributes();
        if (peek().isIdentifier()) next();
        if (accept("{")) {
            long value = 0;
            while (!accept("}")) {
                Token name = next();
                if (!name.isIdentifier()) throw error(name, "expected an enumerator");
                if (accept("=")) {
                    Expression e = conditionalExpression();
                    Number n = ConstantFolder.fold(e);
                    if (n == null) throw error(name, "enumerator value of " + name.text() + " is not a constant");
                    value = n.longValue();
                }
                enumConstants.put(name.text(), value++);
                if (!accept(",")) {
                    expect("}");
                    break;
                }
            }
        }
        return CType.INT;
    }

    private Declarator declarator(CType base, boolean abstractAllowed) {
        CType type = base;
        while (accept("*")) {
            type = CType.pointerTo(type);
            skipQualifiers();
        }
        skipAttributes();
        if (peek().is("(") && peek(1).is("*")) {
            next();
            int stars = 0;
            while (accept("*")) {
                stars++;
                skipQualifiers();
            }
            Token nameToken = peek().isIdentifier() ? next() : null;
            if (nameToken == null && !abstractAllowed) throw error(peek(), "expected an identifier");
            expect(")");
            CType inner;
            if (accept("(")) {
                parameterList();
                inner = CType.function(type);
            } else {
                inner = arraySuffixes(type);
            }
            for (int i = 0; i < stars; i++) inner = CType.pointerTo(inner);
            skipAttributes();
            return new Declarator(nameToken == null ? null : nameToken.text(), nameToken, inner, null, false);
        }
        Token nameToken = null;
        if (peek().isIdentifier() && !STATEMENT_KEYWORDS.contains(peek().text())) {
            nameToken = next();
        } else if (!abstractAllowed) {
            throw error(peek(), "expected an identifier but found " + peek());
        }
        String name = nameToken == null ? null : nameToken.text();
        if (accept("(")) {
            ParameterList parameterList = parameterList();
            skipAttributes();
            return new Declarator(name, nameToken, type, parameterList, true);
        }
        type = arraySuffixes(type);
        skipAttributes();
        return new Declarator(name, nameToken, type, null, false);
    }

    private CType arraySuffixes(CType element) {
        List<Integer> dimensions = new ArrayList<>();
        while (accept("[")) {
            while (peek().is("static") || peek().isIdentifier() && QUALIFIERS.contains(peek().text())) next();
            if (accept("]")) {
                dimensions.add(-1);
                continue;
            }
            Expression size = assignmentExpression();
            expect("]");
            Number n = ConstantFolder.fold(size);
            dimensions.add(n == null ? -1 : n.intValue());
        }
        CType type = element;
        for (int i = dimensions.size() - 1; i >= 0; i--) {
            type = CType.arrayOf(type, dimensions.get(i));
        }
        return type;
    }

    // after the opening parenthesis; consumes the closing one
    private ParameterList parameterList() {
        List<Parameter> parameters = new ArrayList<>();
        if (accept(")")) return new ParameterList(parameters, false);
        if (peek().is("void") && peek(1).is(")")) {
            next();
            next();
            return new ParameterList(parameters, false);
        }
        boolean variadic = false;
        do {
            if (accept("...")) {
                variadic = true;
                break;
            }
            Specifiers specifiers = specifiers();
            if (specifiers == null) {
                Token t = next();
                if (!t.isIdentifier()) throw error(t, "expected a parameter but found " + t);
                parameters.add(new Parameter(t.text(), t, CType.INT));
                continue;
            }
            Declarator d = declarator(specifiers.type(), true);
            CType type = d.function() ? CType.pointerTo(CType.function(d.type())) : d.type().decay();
            parameters.add(new Parameter(d.name(), d.nameToken(), type));
        } while (accept(","));
        expect(")");
        return new ParameterList(parameters, variadic);
    }

    /*
    after the specifiers; returns the variables declared. A function definition ends the list.
     */
    private List<VariableDeclaration> initDeclaratorList(Specifiers specifiers, StorageKind storage) {
        List<VariableDeclaration> declarations = new ArrayList<>();
        while (true) {
            Declarator d = declarator(specifiers.type(), false);
            if (specifiers.isTypedef()) {
                typedefs.put(d.name(), d.function() ? CType.function(d.type()) : d.type());
            } else if (d.function()) {
                declaredFunctions.putIfAbsent(d.name(), d.type());
                if (peek().is("{")) {
                    functionDefinition(d);
                    return declarations;
                }
            } else {
                StorageKind kind = storage;
                if (storage == StorageKind.LOCAL && specifiers.isExtern()) kind = StorageKind.GLOBAL;
                else if (storage == StorageKind.LOCAL && specifiers.isStatic()) kind = StorageKind.STATIC_LOCAL;
                Symbol symbol = declare(d.name(), d.type(), kind, d.nameToken());
                Expression initializer = null;
                if (accept("=")) {
                    initializer = initializer();
                    if (symbol.type().isArray() && symbol.type().arrayLength() < 0) {
                        symbol = completeArrayType(symbol, initializer);
                    }
                }
                declarations.add(new VariableDeclaration(symbol, initializer));
            }
            if (accept(",")) continue;
            expect(";");
            return declarations;
        }
    }

    private Symbol completeArrayType(Symbol symbol, Expression initializer) {
        int length;
        if (initializer instanceof StringLiteral sl) length = sl.value().length() + 1;
        else if (initializer instanceof InitializerList il) length = il.elements().size();
        else return symbol;
        Symbol completed = symbol.withType(CType.arrayOf(symbol.type().pointee(), length));
        scopes.peek().put(completed.name(), completed);
        symbolTable.replace(symbol, completed);
        return completed;
    }

    private void functionDefinition(Declarator d) {
        String enclosing = enclosingFunctions.peek();
        openScope();
        List<Symbol> parameters = new ArrayList<>();
        for (Parameter p : d.parameterList().parameters()) {
            if (p.name() != null) {
                parameters.add(declare(p.name(), p.type(), StorageKind.PARAMETER, p.nameToken()));
            }
        }
        enclosingFunctions.push(d.name());
        Block body = compoundStatement();
        enclosingFunctions.pop();
        closeScope();
        functions.add(new FunctionDefinition(d.name(), d.type(), parameters, d.parameterList().variadic(), body,
                location(d.nameToken()), enclosing));
    }

    private Expression initializer() {
        if (!peek().is("{")) return assignmentExpression();
        Token open = next();
        List<Expression> elements = new ArrayList<>();
        while (!accept("}")) {
            if (peek().is(".") || peek().is("[")) {
                while (peek().is(".") || peek().is("[")) {
                    if (accept(".")) {
                        next();
                    } else {
                        next();
                        conditionalExpression();
                        expect("]");
                    }
                }
                expect("=");
            }
            elements.add(initializer());
            if (!accept(",")) {
                expect("}");
                break;
            }
        }
        return new InitializerList(elements, location(open));
    }

    private CType typeName() {
        Token start = peek();
        Specifiers specifiers = specifiers();
        if (specifiers == null) throw error(start, "expected a type name");
        Declarator d = declarator(specifiers.type(), true);
        return d.function() ? CType.function(d.type()) : d.type();
    }

    // ---- statements

    private Block compoundStatement() {
        Token open = expect("{");
        openScope();
        List<Statement> statements = new ArrayList<>();
        while (!peek().is("}")) {
            if (peek().kind() == TokenKind.END) throw error(peek(), "expected '}' to close the block at line " + open.line());
            statements.add(blockItem());
        }
        next();
        closeScope();
        return new Block(statements, location(open));
    }

    private Statement blockItem() {
        Token start = peek();
        if (isDeclarationStart()) {
            Specifiers specifiers = specifiers();
            if (accept(";")) return new EmptyStatement(location(start));
            List<VariableDeclaration> declarations = initDeclaratorList(specifiers, StorageKind.LOCAL);
            return declarations.isEmpty() ? new EmptyStatement(location(start))
                    : new DeclarationStatement(declarations, location(start));
        }
        return statement();
    }

    private Statement statement() {
        Token t = peek();
        SourceLocation loc = location(t);
        if (t.is("{")) return compoundStatement();
        if (t.is(";")) {
            next();
            return new EmptyStatement(loc);
        }
        if (t.isIdentifier()) {
            switch (t.text()) {
                case "if" -> {
                    next();
                    expect("(");
                    Expression condition = expression();
                    expect(")");
                    Statement thenStatement = statement();
                    Statement elseStatement = accept("else") ? statement() : null;
                    return new IfStatement(condition, thenStatement, elseStatement, loc);
                }
                case "while" -> {
                    next();
                    expect("(");
                    Expression condition = expression();
                    expect(")");
                    return new WhileStatement(condition, statement(), loc);
                }
                case "do" -> {
                    next();
                    Statement body = statement();
                    expect("while");
                    expect("(");
                    Expression condition = expression();
                    expect(")");
                    expect(";");
                    return new DoWhileStatement(body, condition, loc);
                }
                case "for" -> {
                    return forStatement(loc);
                }
                case "switch" -> {
                    next();
                    expect("(");
                    Expression selector = expression();
                    expect(")");
                    return new SwitchStatement(selector, statement(), loc);
                }
                case "case" -> {
                    next();
                    Expression value = conditionalExpression();
                    if (accept("...")) conditionalExpression();
                    expect(":");
                    return new CaseStatement(value, loc);
                }
                case "default" -> {
                    next();
                    expect(":");
                    return new CaseStatement(null, loc);
                }
                case "return" -> {
                    next();
                    Expression value = peek().is(";") ? null : expression();
                    expect(";");
                    return new ReturnStatement(value, loc);
                }
                case "break" -> {
                    next();
                    expect(";");
                    return new BreakStatement(loc);
                }
                case "continue" -> {
                    next();
                    expect(";");
                    return new ContinueStatement(loc);
                }
                case "goto" -> {
                    next();
                    Token label = next();
                    if (!label.isIdentifier()) throw error(label, "expected a label");
                    expect(";");
                    return new GotoStatement(label.text(), loc);
                }
                case "asm", "__asm__", "__asm" -> {
                    next();
                    while (peek().is("volatile") || peek().is("__volatile__") || peek().is("goto")) next();
                    skipBalanced("(", ")");
                    expect(";");
                    return new UnknownStatement("inline assembly", List.of(), loc);
                }
                default -> {
                    if (peek(1).is(":") && !STATEMENT_KEYWORDS.contains(t.text())) {
                        next();
                        next();
                        Statement labeled = peek().is("}") ? new EmptyStatement(loc) : statement();
                        return new LabeledStatement(t.text(), labeled, loc);
                    }
                }
            }
        }
        Expression expression = expression();
        expect(";");
        return new ExpressionStatement(expression, loc);
    }

    private Statement forStatement(SourceLocation loc) {
        next();
        expect("(");
        openScope();
        Statement initializer = null;
        Token start = peek();
        if (!accept(";")) {
            if (isDeclarationStart()) {
                Specifiers specifiers = specifiers();
                initializer = new DeclarationStatement(initDeclaratorList(specifiers, StorageKind.LOCAL),
                        location(start));
            } else {
                Expression e = expression();
                expect(";");
                initializer = new ExpressionStatement(e, location(start));
            }
        }
        Expression condition = peek().is(";") ? null : expression();
        expect(";");
        Expression update = peek().is(")") ? null : expression();
        expect(")");
        Statement body = statement();
        closeScope();
        return new ForStatement(initializer, condition, update, body, loc);
    }

    // ---- expressions

    private Expression expression() {
        Expression first = assignmentExpression();
        if (!peek().is(",")) return first;
        List<Expression> list = new ArrayList<>();
        list.add(first);
        while (accept(",")) list.add(assignmentExpression());
        return new CommaExpression(list, first.location());
    }

    private Expression assignmentExpression() {
        Expression lhs = conditionalExpression();
        Token t = peek();
        if (t.kind() != TokenKind.PUNCTUATOR) return lhs;
        if (t.is("=")) {
            next();
            return new AssignmentExpression(null, lhs, assignmentExpression(), lhs.location());
        }
        BinaryOperator compound = COMPOUND_ASSIGNMENT.get(t.text());
        if (compound != null) {
            next();
            return new AssignmentExpression(compound, lhs, assignmentExpression(), lhs.location());
        }
        return lhs;
    }

    private Expression conditionalExpression() {
        Expression condition = binaryExpression(1);
        if (!accept("?")) return condition;
        Expression ifTrue = peek().is(":") ? condition : expression();
        expect(":");
        Expression ifFalse = conditionalExpression();
        return new ConditionalExpression(condition, ifTrue, ifFalse, commonType(ifTrue, ifFalse),
                condition.location());
    }

    private Expression binaryExpression(int minPrecedence) {
        Expression lhs = castExpression();
        while (peek().kind() == TokenKind.PUNCTUATOR) {
            BinaryOperator operator = BinaryOperator.fromSymbol(peek().text()).orElse(null);
            if (operator == null || operator.precedence < minPrecedence) break;
            next();
            Expression rhs = binaryExpression(operator.precedence + 1);
            lhs = new BinaryExpression(operator, lhs, rhs, binaryType(operator, lhs.type(), rhs.type()),
                    lhs.location());
        }
        return lhs;
    }

    private Expression castExpression() {
        if (peek().is("(") && isTypeNameStart(1)) {
            Token open = next();
            CType type = typeName();
            expect(")");
            if (peek().is("{")) {
                return new CastExpression(type, initializer(), location(open));
            }
            return new CastExpression(type, castExpression(), location(open));
        }
        return unaryExpression();
    }

    private Expression unaryExpression() {
        Token t = peek();
        if (t.kind() == TokenKind.PUNCTUATOR) {
            UnaryOperator operator = switch (t.text()) {
                case "++" -> UnaryOperator.PRE_INCREMENT;
                case "--" -> UnaryOperator.PRE_DECREMENT;
                case "&" -> UnaryOperator.ADDRESS_OF;
                case "*" -> UnaryOperator.DEREFERENCE;
                case "+" -> UnaryOperator.PLUS;
                case "-" -> UnaryOperator.MINUS;
                case "!" -> UnaryOperator.NOT;
                case "~" -> UnaryOperator.BIT_NOT;
                default -> null;
            };
            if (operator != null) {
                next();
                Expression operand = operator.isIncrementOrDecrement() ? unaryExpression() : castExpression();
                return new UnaryExpression(operator, operand, unaryType(operator, operand.type()), location(t));
            }
        }
        if (t.is("sizeof") || t.is("_Alignof") || t.is("__alignof__")) {
            next();
            if (peek().is("(") && isTypeNameStart(1)) {
                next();
                CType type = typeName();
                expect(")");
                return new SizeofExpression(type, null, location(t));
            }
            Expression operand = unaryExpression();
            return new SizeofExpression(operand.type(), operand, location(t));
        }
        return postfixExpression();
    }

    private Expression postfixExpression() {
        Expression e = primaryExpression();
        while (true) {
            Token t = peek();
            if (t.is("[")) {
                next();
                Expression index = expression();
                expect("]");
                e = new IndexExpression(e, index, elementType(e.type()), e.location());
            } else if (t.is("(")) {
                next();
                List<Expression> arguments = arguments();
                if (e instanceof VariableExpression ve) {
                    CType returnType = ve.type().pointee().category() == TypeCategory.FUNCTION
                            ? ve.type().pointee().pointee() : CType.UNKNOWN;
                    e = new CallExpression(ve.symbol().name(), ve, arguments, returnType, ve.location());
                } else {
                    e = new CallExpression(null, e, arguments, CType.UNKNOWN, e.location());
                }
            } else if (t.is(".") || t.is("->")) {
                next();
                Token member = next();
                if (!member.isIdentifier()) throw error(member, "expected a member name");
                boolean arrow = t.is("->");
                CType structType = arrow ? e.type().pointee() : e.type();
                e = new MemberExpression(e, member.text(), arrow, fieldType(structType, member.text()), e.location());
            } else if (t.is("++") || t.is("--")) {
                next();
                UnaryOperator operator = t.is("++") ? UnaryOperator.POST_INCREMENT : UnaryOperator.POST_DECREMENT;
                e = new UnaryExpression(operator, e, e.type(), e.location());
            } else {
                return e;
            }
        }
    }

    // after the opening parenthesis; consumes the closing one
    private List<Expression> arguments() {
        List<Expression> arguments = new ArrayList<>();
        if (accept(")")) return arguments;
        do {
            if (isTypeNameStart(0)) {
                Token start = peek();
                CType type = typeName();
                arguments.add(new UnknownExpression(type.name(), location(start)));
            } else {
                arguments.add(assignmentExpression());
            }
        } while (accept(","));
        expect(")");
        return arguments;
    }

    private Expression primaryExpression() {
        Token t = next();
        SourceLocation loc = location(t);
        switch (t.kind()) {
            case INTEGER -> {
                return integerLiteral(t);
            }
            case FLOATING -> {
                return floatingLiteral(t);
            }
            case CHARACTER -> {
                String value = Lexer.unescape(t.text());
                return new IntegerLiteral(value.isEmpty() ? 0 : value.charAt(0), "'" + t.text() + "'", CType.CHAR, loc);
            }
            case STRING -> {
                StringBuilder sb = new StringBuilder(t.text());
                while (peek().kind() == TokenKind.STRING) sb.append(next().text());
                return new StringLiteral(sb.toString(), loc);
            }
            case IDENTIFIER -> {
                return identifierExpression(t);
            }
            default -> {
                if (t.is("(")) {
                    if (peek().is("{")) {
                        compoundStatement();
                        expect(")");
                        return new UnknownExpression("statement expression", loc);
                    }
                    Expression e = expression();
                    expect(")");
                    return e;
                }
                throw error(t, "unexpected " + t);
            }
        }
    }

    private Expression identifierExpression(Token t) {
        String name = t.text();
        SourceLocation loc = location(t);
        if (STATEMENT_KEYWORDS.contains(name) || BASIC_TYPE_WORDS.contains(name)) {
            throw error(t, "unexpected keyword '" + name + "'");
        }
        Symbol symbol = lookupVariable(name);
        if (symbol == null && peek().is("(")) {
            next();
            List<Expression> arguments = arguments();
            return new CallExpression(name, arguments, returnType(name), loc);
        }
        if (symbol != null) return new VariableExpression(symbol, loc);
        Long enumValue = enumConstants.get(name);
        if (enumValue != null) return new IntegerLiteral(enumValue, name, CType.INT, loc);
        switch (name) {
            case "NULL", "nullptr" -> {
                return new NullLiteral(loc);
            }
            case "true" -> {
                return new IntegerLiteral(1, name, CType.INT, loc);
            }
            case "false" -> {
                return new IntegerLiteral(0, name, CType.INT, loc);
            }
            default -> {
                CType type = declaredFunctions.containsKey(name) || LibraryTypes.RETURN_TYPES.containsKey(name)
                        ? CType.pointerTo(CType.function(returnType(name))) : CType.UNKNOWN;
                return new VariableExpression(implicitSymbol(name, type, t), loc);
            }
        }
    }

    private CType returnType(String function) {
        CType declared = declaredFunctions.get(function);
        if (declared != null) return declared;
        return LibraryTypes.RETURN_TYPES.getOrDefault(function, CType.UNKNOWN);
    }

    private IntegerLiteral integerLiteral(Token t) {
        String text = t.text();
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) >= 0) end--;
        String digits = text.substring(0, end);
        String suffix = text.substring(end).toLowerCase(Locale.ROOT);
        long value;
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                value = new BigInteger(digits.substring(2), 16).longValue();
            } else if (digits.startsWith("0b") || digits.startsWith("0B")) {
                value = new BigInteger(digits.substring(2), 2).longValue();
            } else if (digits.length() > 1 && digits.startsWith("0")) {
                value = new BigInteger(digits.substring(1), 8).longValue();
            } else {
                value = new BigInteger(digits).longValue();
            }
        } catch (NumberFormatException nfe) {
            throw error(t, "malformed integer constant " + text);
        }
        CType type;
        if (suffix.contains("u")) type = CType.integral(suffix.contains("l") ? "unsigned long" : "unsigned int");
        else if (suffix.contains("l")) type = CType.LONG;
        else type = CType.INT;
        return new IntegerLiteral(value, text, type, location(t));
    }

    private FloatingLiteral floatingLiteral(Token t) {
        String text = t.text();
        boolean isHex = text.startsWith("0x") || text.startsWith("0X");
        char last = text.charAt(text.length() - 1);
        CType type = CType.DOUBLE;
        String digits = text;
        if (!isHex && (last == 'f' || last == 'F') || last == 'l' || last == 'L') {
            type = last == 'f' || last == 'F' ? CType.FLOAT : CType.floating("long double");
            digits = text.substring(0, text.length() - 1);
        }
        try {
            return new FloatingLiteral(Double.parseDouble(isHex && !digits.contains("p") && !digits.contains("P")
                    ? digits + "p0" : digits), text, type, location(t));
        } catch (NumberFormatException nfe) {
            throw error(t, "malformed floating constant " + text);
        }
    }

    // ---- types

    private CType fieldType(CType structType, String member) {
        if (structType.category() != TypeCategory.STRUCT) return CType.UNKNOWN;
        Map<String, CType> fields = structFields.get(structType.name());
        if (fields == null) return CType.UNKNOWN;
        return fields.getOrDefault(member, CType.UNKNOWN);
    }

    private static CType elementType(CType type) {
        return type.isPointerLike() ? type.pointee() : CType.UNKNOWN;
    }

    private static CType unaryType(UnaryOperator operator, CType operand) {
        return switch (operator) {
            case DEREFERENCE -> elementType(operand);
            case ADDRESS_OF -> CType.pointerTo(operand);
            case NOT -> CType.INT;
            case PLUS, MINUS, BIT_NOT -> promote(operand);
            default -> operand;
        };
    }

    private static CType promote(CType type) {
        if (type.isIntegral() && (type.isCharacter() || type.name().endsWith("short") || "_Bool".equals(type.name()))) {
            return CType.INT;
        }
        return type;
    }

    private static int rank(CType type) {
        if (type.name().contains("long long")) return 3;
        if (type.name().contains("long")) return 2;
        return 1;
    }

    private static CType binaryType(BinaryOperator operator, CType lhs, CType rhs) {
        if (operator.isComparison() || operator.isLogical()) return CType.INT;
        if (operator == BinaryOperator.ADD || operator == BinaryOperator.SUBTRACT) {
            if (lhs.isPointerLike() && rhs.isPointerLike()) {
                return operator == BinaryOperator.SUBTRACT ? CType.LONG : CType.UNKNOWN;
            }
            if (lhs.isPointerLike()) return lhs.decay();
            if (rhs.isPointerLike() && operator == BinaryOperator.ADD) return rhs.decay();
        }
        if (!lhs.isArithmetic() || !rhs.isArithmetic()) return CType.UNKNOWN;
        if (lhs.isFloating() || rhs.isFloating()) {
            if (!lhs.isFloating()) return rhs;
            if (!rhs.isFloating()) return lhs;
            return lhs.name().length() >= rhs.name().length() ? lhs : rhs;
        }
        if (operator == BinaryOperator.SHIFT_LEFT || operator == BinaryOperator.SHIFT_RIGHT) return promote(lhs);
        CType l = promote(lhs);
        CType r = promote(rhs);
        if (rank(l) != rank(r)) return rank(l) > rank(r) ? l : r;
        return r.isUnsigned() ? r : l;
    }

    private static CType commonType(Expression ifTrue, Expression ifFalse) {
        CType l = ifTrue.type();
        CType r = ifFalse.type();
        if (l.equals(r)) return l;
        if (l.isArithmetic() && r.isArithmetic()) return binaryType(BinaryOperator.ADD, l, r);
        if (l.isPointerLike() && ifFalse.isNullConstant()) return l.decay();
        if (r.isPointerLike() && ifTrue.isNullConstant()) return r.decay();
        return l.isKnown() ? l : r;
    }
}
