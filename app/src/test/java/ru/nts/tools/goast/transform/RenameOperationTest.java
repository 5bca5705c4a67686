/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.goast.transform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.GoPrinter;
import ru.nts.tools.goast.ast.Node;
import ru.nts.tools.goast.ast.NodeRewriter;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.Stmt.IncDecStmt;
import ru.nts.tools.goast.ast.Stmt.RawStmt;
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import static org.junit.jupiter.api.Assertions.*;

class RenameOperationTest {

    private static final String SOURCE = """
            package shadow

            var count = 10

            func Inc(delta int) int {
            	x := count
            	if delta > 0 {
            		x := delta
            		x++
            		return x
            	}
            	x = x + delta
            	return x
            }
            """;

    private final RenameOperation operation = new RenameOperation();
    private GoFile tree;

    @BeforeEach
    void setUp() {
        tree = new GoSourceParser().parse("shadow.go", SOURCE).file();
    }

    private static Position at(int line, int column) {
        return new Position(line, column, -1);
    }

    @Test
    void renamesOnlyTheShadowingVariable() {
        GoFile result = operation.rename(tree, at(8, 3), "y");

        assertEquals("""
                package shadow

                var count = 10

                func Inc(delta int) int {
                	x := count
                	if delta > 0 {
                		y := delta
                		y++
                		return y
                	}
                	x = x + delta
                	return x
                }
                """, GoPrinter.print(result));
    }

    @Test
    void renameFromAnyOccurrence() {
        GoFile fromRead = operation.rename(tree, at(13, 9), "n");
        String printed = GoPrinter.print(fromRead);

        assertTrue(printed.contains("\tn := count\n"));
        assertTrue(printed.contains("\tn = n + delta\n"));
        assertTrue(printed.contains("\t\tx := delta\n"));
    }

    @Test
    void packageVariableAndParameter() {
        String printed = GoPrinter.print(operation.rename(operation.rename(tree, at(3, 5), "total"), at(5, 10), "step"));

        assertTrue(printed.contains("var total = 10"));
        assertTrue(printed.contains("x := total"));
        assertTrue(printed.contains("func Inc(step int) int {"));
        assertTrue(printed.contains("if step > 0 {"));
        assertFalse(printed.contains("delta"));
    }

    @Test
    void sourceTreeIsNotModified() {
        String before = GoPrinter.print(tree);

        operation.rename(tree, at(5, 6), "Increment");

        assertEquals(before, GoPrinter.print(tree));
    }

    @Test
    void sameNameReturnsTreeUnchanged() {
        assertSame(tree, operation.rename(tree, at(6, 2), "x"));
    }

    @Test
    void conflictInSameScope() {
        GoAstException e = assertThrows(GoAstException.class, () -> operation.rename(tree, at(6, 2), "delta"));

        assertEquals(GoAstErrorCode.NAME_CONFLICT, e.getCode());
    }

    @Test
    void shadowingAnOuterNameIsAllowed() {
        GoFile result = operation.rename(tree, at(8, 3), "delta");

        assertTrue(GoPrinter.print(result).contains("\t\tdelta := delta\n"));
    }

    @Test
    void noIdentifierAtPosition() {
        GoAstException e = assertThrows(GoAstException.class, () -> operation.rename(tree, at(2, 1), "y"));

        assertEquals(GoAstErrorCode.SYMBOL_NOT_FOUND, e.getCode());
    }

    @Test
    void invalidNewName() {
        GoAstException e = assertThrows(GoAstException.class, () -> operation.rename(tree, at(8, 3), "func"));

        assertEquals(GoAstErrorCode.INVALID_SOURCE, e.getCode());
    }

    @Nested
    class TypeSwitchAndSelect {

        private static final String BRANCHES = """
                package main

                func run(v any) int {
                	x := 1
                	switch t := v.(type) {
                	case int:
                		return x + t
                	}
                	select {
                	default:
                		x++
                	}
                	return x
                }
                """;

        @Test
        void occurrencesInsideClausesAreRenamed() {
            GoFile branches = new GoSourceParser().parse("run.go", BRANCHES).file();

            assertEquals("""
                    package main

                    func run(v any) int {
                    	y := 1
                    	switch t := v.(type) {
                    	case int:
                    		return y + t
                    	}
                    	select {
                    	default:
                    		y++
                    	}
                    	return y
                    }
                    """, GoPrinter.print(operation.rename(branches, at(4, 2), "y")));
        }

        @Test
        void guardIsRenamedInEveryClause() {
            GoFile branches = new GoSourceParser().parse("run.go", BRANCHES).file();

            String printed = GoPrinter.print(operation.rename(branches, at(7, 14), "n"));

            assertTrue(printed.contains("switch n := v.(type) {"));
            assertTrue(printed.contains("return x + n"));
        }

        @Test
        void nameInUnparsedStatementIsRejected() {
            GoFile branches = new GoSourceParser().parse("run.go", BRANCHES).file();
            GoFile withRaw = new NodeRewriter() {
                @Override
                public Node visitIncDecStmt(IncDecStmt node) {
                    return new RawStmt("x++", node.span());
                }
            }.rewrite(branches);

            GoAstException e = assertThrows(GoAstException.class, () -> operation.rename(withRaw, at(4, 2), "y"));

            assertEquals(GoAstErrorCode.UNSUPPORTED_CONSTRUCT, e.getCode());
            assertEquals(11, e.getContext().get("line"));
        }
    }

    @Nested
    class Capture {

        @Test
        void nestedDeclarationOfNewName() {
            GoFile nested = new GoSourceParser().parse("nested.go", """
                    package main

                    func f() int {
                    	x := 1
                    	{
                    		y := 2
                    		x = x + y
                    	}
                    	return x
                    }
                    """).file();

            GoAstException e = assertThrows(GoAstException.class, () -> operation.rename(nested, at(4, 2), "y"));

            assertEquals(GoAstErrorCode.NAME_CONFLICT, e.getCode());
            assertEquals("y", e.getContext().get("name"));
        }

        @Test
        void existingReadOfNewName() {
            GoFile outer = new GoSourceParser().parse("outer.go", """
                    package main

                    var y = 5

                    func g() int {
                    	x := 1
                    	return x + y
                    }
                    """).file();

            GoAstException e = assertThrows(GoAstException.class, () -> operation.rename(outer, at(6, 2), "y"));

            assertEquals(GoAstErrorCode.NAME_CONFLICT, e.getCode());
        }

        @Test
        void unrelatedNestedNameIsFine() {
            GoFile nested = new GoSourceParser().parse("nested.go", """
                    package main

                    func f() int {
                    	x := 1
                    	{
                    		y := 2
                    		x = x + y
                    	}
                    	return x
                    }
                    """).file();

            String printed = GoPrinter.print(operation.rename(nested, at(4, 2), "z"));

            assertTrue(printed.contains("\t\tz = z + y\n"));
        }
    }
}
