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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.GoPrinter;
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import static org.junit.jupiter.api.Assertions.*;

class ExtractFunctionOperationTest {

    private static final String SOURCE = """
            package main

            import "fmt"

            func main() {
            	fmt.Println("start")
            	fmt.Println("a")
            	fmt.Println("b")
            	fmt.Println("end")
            }
            """;

    private final ExtractFunctionOperation operation = new ExtractFunctionOperation();
    private final GoSourceParser parser = new GoSourceParser();

    @Test
    void movesStatementsIntoNewFunction() {
        GoFile tree = parser.parse("main.go", SOURCE).file();

        GoFile result = operation.extract(tree, 7, 8, "helper");

        assertEquals("""
                package main

                import "fmt"

                func main() {
                	fmt.Println("start")
                	helper()
                	fmt.Println("end")
                }

                func helper() {
                	fmt.Println("a")
                	fmt.Println("b")
                }
                """, GoPrinter.print(result));
        assertEquals(2, tree.decls().size());
    }

    @Test
    void partiallyCoveredStatementIsNotMoved() {
        GoFile tree = parser.parse("loop.go", """
                package loop

                func run(n int) {
                	total := 0
                	for i := 0; i < n; i++ {
                		total += i
                	}
                	println(total)
                }
                """).file();

        GoFile result = operation.extract(tree, 4, 6, "prepare");

        FuncDecl extracted = (FuncDecl) result.decls().get(1);
        assertEquals("prepare", extracted.name().name());
        assertEquals(1, extracted.body().list().size());
        assertEquals("func prepare() {\n\ttotal := 0\n}", GoPrinter.print(extracted));
    }

    @Nested
    class Failures {

        @Test
        void rangeWithoutStatements() {
            GoFile tree = parser.parse("main.go", SOURCE).file();

            GoAstException e = assertThrows(GoAstException.class, () -> operation.extract(tree, 1, 3, "helper"));

            assertEquals(GoAstErrorCode.NO_STATEMENTS_IN_RANGE, e.getCode());
        }

        @Test
        void invalidRange() {
            GoFile tree = parser.parse("main.go", SOURCE).file();

            assertEquals(GoAstErrorCode.INVALID_SOURCE,
                    assertThrows(GoAstException.class, () -> operation.extract(tree, 0, 3, "helper")).getCode());
            assertEquals(GoAstErrorCode.INVALID_SOURCE,
                    assertThrows(GoAstException.class, () -> operation.extract(tree, 8, 7, "helper")).getCode());
        }

        @Test
        void invalidName() {
            GoFile tree = parser.parse("main.go", SOURCE).file();

            GoAstException e = assertThrows(GoAstException.class, () -> operation.extract(tree, 7, 8, "2nd"));

            assertEquals(GoAstErrorCode.INVALID_SOURCE, e.getCode());
        }
    }
}
