package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.StandardLibrary;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.syntax.CType;
import org.cbug.analyzer.syntax.expression.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the literal format string of the printf and scanf families with the arguments that follow it.
 * A different number of arguments is an error, and the types are then not compared. Otherwise each argument
 * whose static type is known is compared with the kind of value its conversion expects. A scanf argument
 * that is not an address is an error.
 */
public class FormatStringChecker implements Checker {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormatStringChecker.class);

    public enum Kind {
        INTEGER("an integer"), CHARACTER("a character"), FLOATING("a floating point value"),
        STRING("a string"), POINTER("a pointer");

        public final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    /*
    one conversion of a format string; arguments is the number of arguments it consumes,
    including those of '*' width and precision in printf
     */
    public record Conversion(String text, char conversion, Kind kind, int arguments) {
    }

    private static final String LENGTH_MODIFIERS = "hlLqjzt";

    @Override
    public String name() {
        return "format-string";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            cfg.elements().forEach(element -> element.expressions().forEach(expression -> expression.visit(e -> {
                if (e instanceof CallExpression call && call.callee() != null) {
                    StandardLibrary.FormatFunction function = StandardLibrary.formatFunction(call.callee());
                    if (function != null) issues.addAll(check(call, function));
                }
                return true;
            })));
        }
        return issues;
    }

    List<Issue> check(CallExpression call, StandardLibrary.FormatFunction function) {
        Expression formatArgument = call.argument(function.formatIndex());
        if (formatArgument == null || !(formatArgument.withoutCasts() instanceof StringLiteral literal)) {
            return List.of();
        }
        List<Conversion> conversions = parse(literal.value(), function.scan());
        List<Expression> arguments = call.arguments().subList(function.formatIndex() + 1, call.arguments().size());
        int expected = conversions.stream().mapToInt(Conversion::arguments).sum();
        String name = function.name();
        if (expected != arguments.size()) {
            LOGGER.debug("{} at {}: {} conversion argument(s), {} given", name, call.location(), expected,
                    arguments.size());
            return List.of(new Issue(Category.FORMAT_STRING, Severity.ERROR, "'" + name + "' expects " + expected
                                                                           + " argument(s) after its format string but receives "
                                                                           + arguments.size(), call.location(),
                    new Suggestion("Match the arguments to the format",
                            "Give exactly one argument per conversion of \"" + literal.value().replace("\n", "\\n")
                            + "\".")));
        }
        List<Issue> issues = new ArrayList<>();
        int index = 0;
        for (Conversion conversion : conversions) {
            if (conversion.kind() == null) {
                index += conversion.arguments();
                continue;
            }
            // '*' arguments come first and are ints
            index += conversion.arguments() - 1;
            Expression argument = arguments.get(index);
            int position = index + 1;
            index++;
            Issue issue = function.scan()
                    ? checkScanArgument(name, conversion, argument, position)
                    : checkPrintArgument(name, conversion, argument, position);
            if (issue != null) issues.add(issue);
        }
        return issues;
    }

    private static Issue checkPrintArgument(String name, Conversion conversion, Expression argument, int position) {
        CType type = argument.type();
        if (!type.isKnown() || matches(conversion.kind(), type)) return null;
        return mismatch(name, conversion, argument, position, type, false);
    }

    private static Issue checkScanArgument(String name, Conversion conversion, Expression argument, int position) {
        CType type = argument.type();
        if (!type.isKnown()) return null;
        if (!type.isPointerLike()) {
            return new Issue(Category.FORMAT_STRING, Severity.ERROR, "Argument " + position + " of '" + name
                                                                     + "' must be an address, not '" + type + "'",
                    argument.location(), new Suggestion("Pass the address",
                    "Write '&" + argument + "' so that '" + name + "' can store the value."));
        }
        CType target = type.pointee();
        if (!target.isKnown()) return null;
        boolean ok = switch (conversion.kind()) {
            case INTEGER -> target.isIntegral();
            case CHARACTER, STRING -> target.isCharacter();
            case FLOATING -> target.isFloating();
            case POINTER -> target.isPointer();
        };
        return ok ? null : mismatch(name, conversion, argument, position, type, true);
    }

    private static Issue mismatch(String name, Conversion conversion, Expression argument, int position, CType type,
                                  boolean scan) {
        String expects = scan ? "the address of " + conversion.kind().description : conversion.kind().description;
        return new Issue(Category.FORMAT_STRING, Severity.WARNING, "Conversion '" + conversion.text() + "' of '"
                                                                   + name + "' expects " + expects
                                                                   + " but argument " + position + " is '" + type + "'",
                argument.location(), new Suggestion("Fix the conversion",
                "Use a conversion that matches the type of '" + argument + "', or cast the argument."));
    }

    static boolean matches(Kind kind, CType type) {
        return switch (kind) {
            case INTEGER, CHARACTER -> type.isIntegral();
            case FLOATING -> type.isFloating();
            case STRING -> type.isPointerLike() && (!type.pointee().isKnown() || type.pointee().isCharacter());
            case POINTER -> type.isPointerLike();
        };
    }

    /*
    flags, width, precision, length modifiers and the conversion; %% produces nothing.
    In scanf, '*' suppresses the assignment and %[...] reads a set.
     */
    public static List<Conversion> parse(String format, boolean scan) {
        List<Conversion> conversions = new ArrayList<>();
        int i = 0;
        int n = format.length();
        while (i < n) {
            if (format.charAt(i) != '%') {
                i++;
                continue;
            }
            int start = i++;
            if (i < n && format.charAt(i) == '%') {
                i++;
                continue;
            }
            int arguments = 1;
            boolean suppressed = false;
            while (i < n && "-+ #0'".indexOf(format.charAt(i)) >= 0) i++;
            if (i < n && format.charAt(i) == '*') {
                if (scan) suppressed = true;
                else arguments++;
                i++;
            }
            while (i < n && Character.isDigit(format.charAt(i))) i++;
            if (!scan && i < n && format.charAt(i) == '.') {
                i++;
                if (i < n && format.charAt(i) == '*') {
                    arguments++;
                    i++;
                }
                while (i < n && Character.isDigit(format.charAt(i))) i++;
            }
            while (i < n && LENGTH_MODIFIERS.indexOf(format.charAt(i)) >= 0) i++;
            if (i >= n) break;
            char conversion = format.charAt(i++);
            if (scan && conversion == '[') {
                if (i < n && format.charAt(i) == '^') i++;
                if (i < n && format.charAt(i) == ']') i++;
                while (i < n && format.charAt(i) != ']') i++;
                i = Math.min(i + 1, n);
            }
            Kind kind = kind(conversion, scan);
            if (kind == null && conversion != 'n') continue;
            if (suppressed) arguments = 0;
            String text = format.substring(start, i);
            conversions.add(new Conversion(text, conversion, suppressed ? null : kind,
                    conversion == 'n' && !suppressed ? 1 : arguments));
        }
        return conversions;
    }

    private static Kind kind(char conversion, boolean scan) {
        return switch (conversion) {
            case 'd', 'i', 'u', 'o', 'x', 'X' -> Kind.INTEGER;
            case 'c' -> Kind.CHARACTER;
            case 'f', 'F', 'e', 'E', 'g', 'G', 'a', 'A' -> Kind.FLOATING;
            case 's', '[' -> Kind.STRING;
            case 'p' -> Kind.POINTER;
            default -> null;
        };
    }
}
