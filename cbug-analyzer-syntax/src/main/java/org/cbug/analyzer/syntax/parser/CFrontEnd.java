package org.cbug.analyzer.syntax.parser;

import org.cbug.analyzer.syntax.FrontEnd;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The built-in front-end. Of the compile arguments only {@code -DNAME} and {@code -DNAME=value}
 * (also written as {@code -D NAME}) are honored; include paths are not searched.
 */
public class CFrontEnd implements FrontEnd {
    private static final Logger LOGGER = LoggerFactory.getLogger(CFrontEnd.class);

    @Override
    public TranslationUnit parse(Path source, List<String> compileArgs) throws IOException {
        String content = Files.readString(source);
        return parse(source.toString(), content, compileArgs);
    }

    @Override
    public TranslationUnit parse(String file, String content, List<String> compileArgs) {
        LOGGER.debug("Parsing {} with arguments {}", file, compileArgs);
        Lexer lexer = new Lexer(file, content, predefinedMacros(compileArgs));
        List<Token> tokens = lexer.tokenize();
        return new CParser(file, tokens).parse(lexer.includes());
    }

    static Map<String, Lexer.Macro> predefinedMacros(List<String> compileArgs) {
        Map<String, Lexer.Macro> macros = new HashMap<>();
        for (int i = 0; i < compileArgs.size(); i++) {
            String arg = compileArgs.get(i);
            String definition;
            if ("-D".equals(arg) && i + 1 < compileArgs.size()) {
                definition = compileArgs.get(++i);
            } else if (arg.startsWith("-D") && arg.length() > 2) {
                definition = arg.substring(2);
            } else {
                continue;
            }
            int eq = definition.indexOf('=');
            String name = eq < 0 ? definition : definition.substring(0, eq);
            String value = eq < 0 ? "1" : definition.substring(eq + 1);
            List<Token> body = new Lexer("<command line>", value, Map.of()).scan();
            macros.put(name, new Lexer.Macro(name, null, body));
        }
        return macros;
    }
}
