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
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr.ArrayType;
import ru.nts.tools.goast.ast.Expr.ChanDir;
import ru.nts.tools.goast.ast.Expr.ChanType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.MapType;
import ru.nts.tools.goast.ast.Expr.SelectorExpr;
import ru.nts.tools.goast.ast.Expr.StarExpr;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeFormatterTest {

    private final GoSourceParser parser = new GoSourceParser();

    @Test
    void synthesizedTypes() {
        Expr mapOfSlices = new MapType(new Ident("string"),
                new ArrayType(null, new StarExpr(new Ident("User"), Span.NONE), Span.NONE), Span.NONE);
        Expr qualified = new SelectorExpr(new Ident("io"), new Ident("Reader"), Span.NONE);
        Expr sendOnly = new ChanType(ChanDir.SEND, new Ident("int"), Span.NONE);

        assertEquals("map[string][]*User", TypeFormatter.format(mapOfSlices));
        assertEquals("io.Reader", TypeFormatter.format(qualified));
        assertEquals("chan<- int", TypeFormatter.format(sendOnly));
        assertEquals("", TypeFormatter.format(null));
    }

    @Test
    void parsedSignatures() {
        ParsedUnit unit = parser.parse("sig.go", """
                package sig

                func Copy(dst, src []byte, opts ...Option) (n int, err error) {
                	return 0, nil
                }

                func Apply(fn func(int) error, ch <-chan string, m map[string][4]int) {
                }
                """);

        FuncDecl copy = (FuncDecl) unit.file().decls().get(0);
        FuncDecl apply = (FuncDecl) unit.file().decls().get(1);

        assertEquals("([]byte, []byte, ...Option) (int, error)", TypeFormatter.signature(copy.type()));
        assertEquals("(func(int) error, <-chan string, map[string][4]int)", TypeFormatter.signature(apply.type()));
        assertEquals(List.of("[]byte", "[]byte", "...Option"), TypeFormatter.expandTypes(copy.type().params()));
    }

    @Test
    void genericAndStructTypes() {
        ParsedUnit unit = parser.parse("types.go", """
                package types

                type Cache struct {
                	entries map[string]List[int]
                	Name, Owner string
                }
                """);

        TypeSpec spec = (TypeSpec) ((GenDecl) unit.file().decls().get(0)).specs().get(0);

        assertEquals("struct{entries map[string]List[int]; Name, Owner string}", TypeFormatter.format(spec.type()));
    }
}
