package org.cbug.analyzer.syntax.parser;

import org.cbug.analyzer.syntax.*;
import org.cbug.analyzer.syntax.expression.*;
import org.cbug.analyzer.syntax.statement.*;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestParser extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            #include <stdlib.h>
            int counter;
            static char *names[4];

            int *make(int n) {
                int *p = malloc(n * sizeof(int));
                return p;
            }

            int main(void) {
                int *q;
                int a = 3 + 4 * 2;
                q = make(a);
                free(q);
                return 0;
            }
            """;

    @DisplayName("globals, functions, symbols")
    @Test
    public void test1() {
        TranslationUnit tu = parse(INPUT1);
        assertEquals("test.c", tu.file());
        assertTrue(tu.includes("stdlib.h"));
        assertEquals(List.of("counter", "names"), tu.globals().stream().map(vd -> vd.symbol().name()).toList());
        {
            Symbol names = tu.globals().get(1).symbol();
            assertTrue(names.type().isArray());
            assertEquals(4, names.type().arrayLength());
            assertEquals(StorageKind.GLOBAL, names.storage());
        }
        assertEquals(List.of("make", "main"), tu.functions().stream().map(FunctionDefinition::name).toList());
        assertTrue(tu.declares("make"));

        FunctionDefinition make = tu.function("make");
        assertTrue(make.returnType().isPointer());
        assertEquals(1, make.parameters().size());
        assertEquals(StorageKind.PARAMETER, make.parameters().get(0).storage());
        {
            DeclarationStatement ds = (DeclarationStatement) make.body().statements().get(0);
            VariableDeclaration p = ds.declarations().get(0);
            assertEquals(StorageKind.LOCAL, p.symbol().storage());
            assertEquals(6, p.symbol().location().line());
            CallExpression malloc = (CallExpression) p.initializer();
            assertTrue(malloc.calls("malloc"));
            assertEquals(CType.VOID_POINTER, malloc.type());
            BinaryExpression size = (BinaryExpression) malloc.argument(0);
            assertEquals(BinaryOperator.MULTIPLY, size.operator());
            assertInstanceOf(SizeofExpression.class, size.rhs());
        }
        {
            ReturnStatement rs = (ReturnStatement) make.body().statements().get(1);
            VariableExpression ve = (VariableExpression) rs.value();
            DeclarationStatement ds = (DeclarationStatement) make.body().statements().get(0);
            assertSame(ds.declarations().get(0).symbol(), ve.symbol());
        }
        FunctionDefinition main = tu.function("main");
        assertTrue(main.parameters().isEmpty());
        {
            DeclarationStatement ds = (DeclarationStatement) main.body().statements().get(1);
            BinaryExpression be = (BinaryExpression) ds.declarations().get(0).initializer();
            assertEquals("(3 + (4 * 2))", be.toString());
            assertEquals(11L, ConstantFolder.fold(be));
        }
        {
            ExpressionStatement es = (ExpressionStatement) main.body().statements().get(2);
            AssignmentExpression ae = (AssignmentExpression) es.expression();
            assertTrue(ae.isPlain());
            CallExpression ce = (CallExpression) ae.value();
            assertTrue(ce.type().isPointer());
        }
    }

    @Language("c")
    private static final String INPUT2 = """
            typedef struct node {
                int value;
                struct node *next;
            } Node;

            enum color { RED, GREEN = 5, BLUE };

            int sum(Node *list) {
                int total = 0;
                for (Node *n = list; n != NULL; n = n->next) {
                    total += n->value;
                }
                switch (total) {
                    case RED: return 0;
                    case BLUE: break;
                    default: total++;
                }
                do { total--; } while (total > 100);
                while (1) {
                    if (total < 0) goto out;
                    total = total / 2;
                }
            out:
                return total;
            }
            """;

    @DisplayName("structs, typedefs, enums and every statement kind")
    @Test
    public void test2() {
        TranslationUnit tu = parse(INPUT2);
        FunctionDefinition sum = tu.function("sum");
        Symbol list = sum.parameters().get(0);
        assertTrue(list.type().isPointer());
        assertEquals("struct node *", list.type().name());

        List<Statement> statements = sum.body().statements();
        ForStatement fs = (ForStatement) statements.get(1);
        assertInstanceOf(DeclarationStatement.class, fs.initializer());
        {
            BinaryExpression condition = (BinaryExpression) fs.condition();
            assertEquals(BinaryOperator.NOT_EQUALS, condition.operator());
            assertTrue(condition.rhs().isNullConstant());
            AssignmentExpression update = (AssignmentExpression) fs.update();
            MemberExpression next = (MemberExpression) update.value();
            assertTrue(next.arrow());
            assertTrue(next.type().isPointer());
        }
        {
            Block body = (Block) fs.body();
            ExpressionStatement es = (ExpressionStatement) body.statements().get(0);
            AssignmentExpression ae = (AssignmentExpression) es.expression();
            assertEquals(BinaryOperator.ADD, ae.compoundOperator());
            assertEquals(CType.INT, ae.value().type());
        }
        {
            SwitchStatement ss = (SwitchStatement) statements.get(2);
            Block body = (Block) ss.body();
            List<CaseStatement> cases = body.statements().stream()
                    .filter(s -> s instanceof CaseStatement).map(s -> (CaseStatement) s).toList();
            assertEquals(3, cases.size());
            assertEquals(0L, ((IntegerLiteral) cases.get(0).value()).value());
            assertEquals(6L, ((IntegerLiteral) cases.get(1).value()).value());
            assertTrue(cases.get(2).isDefault());
        }
        assertInstanceOf(DoWhileStatement.class, statements.get(3));
        {
            WhileStatement ws = (WhileStatement) statements.get(4);
            assertEquals(Boolean.TRUE, ConstantFolder.truthValue(ws.condition()));
            IfStatement is = (IfStatement) ((Block) ws.body()).statements().get(0);
            assertEquals("out", ((GotoStatement) is.thenStatement()).label());
        }
        LabeledStatement ls = (LabeledStatement) statements.get(5);
        assertEquals("out", ls.label());
        assertInstanceOf(ReturnStatement.class, ls.statement());
    }

    @Language("c")
    private static final String INPUT3 = """
            #include <stdio.h>
            int apply(int (*f)(int), int x) {
                return f(x);
            }
            void show(const char *fmt, ...) {
                char buf[] = "hello";
                double ratio = (double) 1 / 3;
                unsigned long len = sizeof buf;
                int grid[2][3] = {{1, 2, 3}, {4, 5, 6}};
                int *cell = &grid[1][2];
                int odd = len > 3 ? 1 : 0;
                printf("%s %f %d\\n", buf, ratio, *cell + odd);
            }
            """;

    @DisplayName("function pointers, arrays, casts and variadic functions")
    @Test
    public void test3() {
        TranslationUnit tu = parse(INPUT3);
        FunctionDefinition apply = tu.function("apply");
        Symbol f = apply.parameters().get(0);
        assertTrue(f.type().isPointer());
        assertEquals(TypeCategory.FUNCTION, f.type().pointee().category());
        {
            ReturnStatement rs = (ReturnStatement) apply.body().statements().get(0);
            CallExpression call = (CallExpression) rs.value();
            assertEquals("f", call.callee());
            assertEquals(CType.INT, call.type());
        }
        FunctionDefinition show = tu.function("show");
        assertTrue(show.variadic());
        List<Statement> statements = show.body().statements();
        {
            Symbol buf = ((DeclarationStatement) statements.get(0)).declarations().get(0).symbol();
            assertEquals(6, buf.type().arrayLength());
            assertTrue(buf.type().pointee().isCharacter());
        }
        {
            Expression ratio = ((DeclarationStatement) statements.get(1)).declarations().get(0).initializer();
            assertEquals(CType.DOUBLE, ratio.type());
        }
        {
            Symbol grid = ((DeclarationStatement) statements.get(3)).declarations().get(0).symbol();
            assertEquals(2, grid.type().arrayLength());
            assertEquals(3, grid.type().pointee().arrayLength());
            Expression cell = ((DeclarationStatement) statements.get(4)).declarations().get(0).initializer();
            UnaryExpression addressOf = (UnaryExpression) cell;
            assertEquals(UnaryOperator.ADDRESS_OF, addressOf.operator());
            assertEquals("grid[1][2]", addressOf.operand().toString());
            assertEquals(CType.INT, addressOf.operand().type());
        }
        {
            ExpressionStatement es = (ExpressionStatement) statements.get(6);
            CallExpression printf = (CallExpression) es.expression();
            assertEquals(4, printf.arguments().size());
            assertEquals("%s %f %d\n", ((StringLiteral) printf.argument(0)).value());
        }
    }

    @Language("c")
    private static final String INPUT4 = """
            int outer(int a) {
                int helper(int b) { return b * 2; }
                __asm__("nop");
                return helper(a) + undeclared;
            }
            """;

    @DisplayName("nested functions, inline assembly and undeclared identifiers")
    @Test
    public void test4() {
        TranslationUnit tu = parse(INPUT4);
        assertEquals(List.of("outer", "helper"), tu.functions().stream().map(FunctionDefinition::name).toList());
        FunctionDefinition helper = tu.function("helper");
        assertTrue(helper.isNested());
        assertEquals("outer", helper.enclosingFunction());
        FunctionDefinition outer = tu.function("outer");
        assertInstanceOf(EmptyStatement.class, outer.body().statements().get(0));
        UnknownStatement asm = (UnknownStatement) outer.body().statements().get(1);
        assertEquals("inline assembly", asm.description());
        assertTrue(asm.expressions().isEmpty());
        ReturnStatement rs = (ReturnStatement) outer.body().statements().get(2);
        BinaryExpression be = (BinaryExpression) rs.value();
        VariableExpression undeclared = (VariableExpression) be.rhs();
        assertEquals(StorageKind.GLOBAL, undeclared.symbol().storage());
        assertFalse(undeclared.type().isKnown());
    }

    @DisplayName("scopes: a shadowing local is a different symbol")
    @Test
    public void test5() {
        TranslationUnit tu = parse("""
                int x;
                void f(void) {
                    int x = 1;
                    { int x = 2; x++; }
                    x--;
                }
                """);
        List<Symbol> xs = tu.symbolTable().symbols().stream().filter(s -> "x".equals(s.name())).toList();
        assertEquals(3, xs.size());
        assertEquals(3, xs.stream().map(Symbol::scopeId).distinct().count());
        FunctionDefinition f = tu.function("f");
        Block inner = (Block) f.body().statements().get(1);
        UnaryExpression increment = (UnaryExpression) ((ExpressionStatement) inner.statements().get(1)).expression();
        assertEquals(4, ((VariableExpression) increment.operand()).symbol().location().line());
        UnaryExpression decrement = (UnaryExpression) ((ExpressionStatement) f.body().statements().get(2)).expression();
        assertEquals(3, ((VariableExpression) decrement.operand()).symbol().location().line());
    }
}
