package org.cbug.analyzer.syntax;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The parser boundary: turns one C source file into a {@link TranslationUnit}.
 * Implementations throw {@link ParseException} when the source cannot be parsed.
 */
public interface FrontEnd {

    TranslationUnit parse(Path source, List<String> compileArgs) throws IOException;

    TranslationUnit parse(String file, String content, List<String> compileArgs);

    default TranslationUnit parse(String file, String content) {
        return parse(file, content, List.of());
    }
}
