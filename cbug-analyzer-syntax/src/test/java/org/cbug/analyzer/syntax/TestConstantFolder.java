package org.cbug.analyzer.syntax;

import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.statement.DeclarationStatement;
import org.cbug.analyzer.syntax.statement.VariableDeclaration;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestConstantFolder extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            enum { K = 3 };
            void f(int v) {
                int a = (1 << 4) | 2;
                int b = 10 / (K - 3);
                double c = 1.0 / 4;
                int d = v && 0;
                int e = 0 && v;
                int g = K > 2 ? -K : 7;
                long h = (long) 300;
                int i = !v;
                int j = 7 % 0;
            }
            """;

    private static List<Expression> initializers(TranslationUnit tu) {
        return tu.function("f").body().statements().stream()
                .map(s -> ((DeclarationStatement) s).declarations().get(0))
                .map(VariableDeclaration::initializer)
                .toList();
    }

    @DisplayName("folding literals, enums and operators")
    @Test
    public void test1() {
        List<Expression> initializers = initializers(parse(INPUT1));
        assertEquals(18L, ConstantFolder.fold(initializers.get(0)));
        assertNull(ConstantFolder.fold(initializers.get(1)), "division by zero is never folded");
        assertEquals(0.25, ConstantFolder.fold(initializers.get(2)));
        assertNull(ConstantFolder.fold(initializers.get(3)));
        assertEquals(0L, ConstantFolder.fold(initializers.get(4)));
        assertEquals(-3L, ConstantFolder.fold(initializers.get(5)));
        assertEquals(300L, ConstantFolder.fold(initializers.get(6)));
        assertNull(ConstantFolder.fold(initializers.get(7)));
        assertNull(ConstantFolder.fold(initializers.get(8)));
    }

    @DisplayName("folding with an environment")
    @Test
    public void test2() {
        TranslationUnit tu = parse(INPUT1);
        Symbol v = tu.function("f").parameters().get(0);
        List<Expression> initializers = initializers(tu);
        assertEquals(1L, ConstantFolder.fold(initializers.get(7), s -> s == v ? 0L : null));
        assertEquals(0L, ConstantFolder.fold(initializers.get(3), s -> s == v ? 5L : null));
        assertEquals(Boolean.FALSE, ConstantFolder.truthValue(initializers.get(4)));
        assertNull(ConstantFolder.truthValue(initializers.get(7)));
    }
}
