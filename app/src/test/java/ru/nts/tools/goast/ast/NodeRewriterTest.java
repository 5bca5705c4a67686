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
package ru.nts.tools.goast.ast;

import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Expr.CallExpr;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NodeRewriterTest {

    private static final String SOURCE = """
            package calc

            func Sum(xs []int) int {
            	total := 0
            	for _, x := range xs {
            		total += x
            	}
            	return total
            }
            """;

    private final GoSourceParser parser = new GoSourceParser();

    @Test
    void copyIsDeepAndEqual() {
        GoFile original = parser.parse("calc.go", SOURCE).file();

        GoFile copy = NodeRewriter.copy(original);

        assertEquals(original, copy);
        assertNotSame(original, copy);
        assertNotSame(original.decls().get(0), copy.decls().get(0));
        assertEquals(GoPrinter.print(original), GoPrinter.print(copy));
    }

    @Test
    void overriddenIdentChangesOnlyTheCopy() {
        GoFile original = parser.parse("calc.go", SOURCE).file();

        GoFile renamed = new NodeRewriter() {
            @Override
            public Node visitIdent(Ident node) {
                return "total".equals(node.name()) ? new Ident("sum", node.span()) : node;
            }
        }.rewrite(original);

        assertTrue(GoPrinter.print(renamed).contains("\tsum := 0"));
        assertTrue(GoPrinter.print(renamed).contains("return sum"));
        assertTrue(GoPrinter.print(original).contains("return total"));
    }

    @Test
    void collectFindsNestedNodesInSourceOrder() {
        ParsedUnit unit = parser.parse("main.go", """
                package main

                func main() {
                	a()
                	if true {
                		b(c())
                	}
                }
                """);

        List<String> calls = Ast.collect(unit.file(), CallExpr.class).stream()
                .map(call -> ((Ident) call.fun()).name())
                .collect(Collectors.toList());

        assertEquals(List.of("a", "b", "c"), calls);
    }

    @Test
    void inspectStopsDescendingWhenVisitorReturnsFalse() {
        ParsedUnit unit = parser.parse("main.go", """
                package main

                func outer() {
                	inner()
                }
                """);

        List<String> seen = new ArrayList<>();
        Ast.inspect(unit.file(), node -> {
            if (node instanceof FuncDecl fd) {
                seen.add(fd.name().name());
                return false;
            }
            return true;
        });

        assertEquals(List.of("outer"), seen);
        assertEquals(1, Ast.collect(unit.file().decls().get(0), CallExpr.class).size());
    }

    @Test
    void childrenOfFileAreItsNameAndDeclarations() {
        GoFile file = parser.parse("calc.go", SOURCE).file();

        List<Node> children = Ast.children(file);

        assertEquals(2, children.size());
        assertInstanceOf(Ident.class, children.get(0));
        assertInstanceOf(FuncDecl.class, children.get(1));
    }
}
