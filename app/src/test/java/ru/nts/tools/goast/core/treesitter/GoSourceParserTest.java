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
package ru.nts.tools.goast.core.treesitter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.goast.ast.CaseClause;
import ru.nts.tools.goast.ast.CommClause;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr.CompositeLit;
import ru.nts.tools.goast.ast.Expr.Ellipsis;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.StructType;
import ru.nts.tools.goast.ast.Expr.TypeAssertExpr;
import ru.nts.tools.goast.ast.ParsedUnit;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Stmt.AssignStmt;
import ru.nts.tools.goast.ast.Stmt.IfStmt;
import ru.nts.tools.goast.ast.Stmt.RangeStmt;
import ru.nts.tools.goast.ast.Stmt.ReturnStmt;
import ru.nts.tools.goast.ast.Stmt.SelectStmt;
import ru.nts.tools.goast.ast.Stmt.SendStmt;
import ru.nts.tools.goast.ast.Stmt.TypeSwitchStmt;
import ru.nts.tools.goast.core.GoAstConfig;
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GoSourceParserTest {

    private GoSourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new GoSourceParser();
    }

    @Nested
    class Conversion {

        @Test
        void packageImportsAndFunctions() {
            ParsedUnit unit = parser.parse("main.go", """
                    package main

                    import (
                    	"fmt"
                    	str "strings"
                    )

                    func greet(name string) string {
                    	return fmt.Sprintf("hi %s", str.ToUpper(name))
                    }
                    """);

            assertEquals("main", unit.file().packageName().name());
            List<ImportSpec> imports = unit.file().imports();
            assertEquals(2, imports.size());
            assertEquals("fmt", imports.get(0).path().unquoted());
            assertEquals("str", imports.get(1).name().name());
            assertTrue(((GenDecl) unit.file().decls().get(0)).grouped());

            FuncDecl fn = (FuncDecl) unit.file().decls().get(1);
            assertEquals("greet", fn.name().name());
            assertFalse(fn.isMethod());
            assertEquals(1, fn.type().params().numFields());
            assertEquals(1, fn.type().resultCount());
            assertInstanceOf(ReturnStmt.class, fn.body().list().get(0));
            assertEquals(8, unit.line(fn.span().start()));
        }

        @Test
        void methodsStructsAndVariadics() {
            ParsedUnit unit = parser.parse("list.go", """
                    package list

                    type List[T any] struct {
                    	items []T
                    	size  int `json:"size"`
                    }

                    func (l *List[T]) Push(values ...T) {
                    	for _, v := range values {
                    		l.items = append(l.items, v)
                    	}
                    }
                    """);

            TypeSpec spec = (TypeSpec) ((GenDecl) unit.file().decls().get(0)).specs().get(0);
            assertEquals("List", spec.name().name());
            assertEquals(1, spec.typeParams().numFields());
            StructType struct = assertInstanceOf(StructType.class, spec.type());
            assertEquals(2, struct.fields().numFields());
            assertEquals("`json:\"size\"`", struct.fields().list().get(1).tag().value());

            FuncDecl push = (FuncDecl) unit.file().decls().get(1);
            assertTrue(push.isMethod());
            assertEquals("l", push.recv().list().get(0).names().get(0).name());
            assertInstanceOf(Ellipsis.class, push.type().params().list().get(0).type());
            RangeStmt loop = assertInstanceOf(RangeStmt.class, push.body().list().get(0));
            assertEquals(":=", loop.tok());
            assertEquals("v", ((Ident) loop.value()).name());
        }

        @Test
        void shortDeclarationsAndIfElse() {
            ParsedUnit unit = parser.parse("main.go", """
                    package main

                    func run() int {
                    	p := &Point{X: 1}
                    	if p.X > 0 {
                    		return 1
                    	} else {
                    		return 0
                    	}
                    }
                    """);

            FuncDecl run = (FuncDecl) unit.file().decls().get(0);
            AssignStmt assign = assertInstanceOf(AssignStmt.class, run.body().list().get(0));
            assertTrue(assign.isDefine());
            IfStmt branch = assertInstanceOf(IfStmt.class, run.body().list().get(1));
            assertNotNull(branch.els());
            assertEquals(4, assign.span().start().line());
            assertEquals(2, assign.span().start().column());
        }

        @Test
        void typeSwitchHasGuardAndTypeLists() {
            ParsedUnit unit = parser.parse("kind.go", """
                    package main

                    func kind(v any) string {
                    	switch t := v.(type) {
                    	case int, int64:
                    		return "int"
                    	case string:
                    		return t
                    	default:
                    		return "other"
                    	}
                    }
                    """);

            FuncDecl fn = (FuncDecl) unit.file().decls().get(0);
            TypeSwitchStmt sw = assertInstanceOf(TypeSwitchStmt.class, fn.body().list().get(0));
            AssignStmt guard = assertInstanceOf(AssignStmt.class, sw.assign());
            assertTrue(guard.isDefine());
            assertEquals("t", ((Ident) guard.lhs().get(0)).name());
            TypeAssertExpr assertion = assertInstanceOf(TypeAssertExpr.class, guard.rhs().get(0));
            assertNull(assertion.type());
            assertEquals(3, sw.clauses().size());
            CaseClause ints = sw.clauses().get(0);
            assertEquals(List.of("int", "int64"), ints.list().stream().map(e -> ((Ident) e).name()).collect(Collectors.toList()));
            assertEquals(1, ints.body().size());
            assertTrue(sw.clauses().get(2).isDefault());
        }

        @Test
        void selectClauses() {
            ParsedUnit unit = parser.parse("pump.go", """
                    package main

                    func pump(in chan int, out chan int) {
                    	select {
                    	case v, ok := <-in:
                    		println(v, ok)
                    	case out <- 1:
                    	case <-in:
                    	default:
                    		return
                    	}
                    }
                    """);

            FuncDecl fn = (FuncDecl) unit.file().decls().get(0);
            SelectStmt sel = assertInstanceOf(SelectStmt.class, fn.body().list().get(0));
            List<CommClause> clauses = sel.clauses();
            assertEquals(4, clauses.size());
            AssignStmt receive = assertInstanceOf(AssignStmt.class, clauses.get(0).comm());
            assertTrue(receive.isDefine());
            assertEquals(2, receive.lhs().size());
            assertEquals(1, clauses.get(0).body().size());
            assertInstanceOf(SendStmt.class, clauses.get(1).comm());
            assertTrue(clauses.get(1).body().isEmpty());
            assertNotNull(clauses.get(2).comm());
            assertTrue(clauses.get(3).isDefault());
        }

        @Test
        void compositeLiteralKeepsType() {
            ParsedUnit unit = parser.parse("main.go", """
                    package main

                    var origin = Point{X: 0, Y: 0}
                    """);

            GenDecl decl = (GenDecl) unit.file().decls().get(0);
            var spec = (ru.nts.tools.goast.ast.Spec.ValueSpec) decl.specs().get(0);
            CompositeLit lit = assertInstanceOf(CompositeLit.class, spec.values().get(0));
            assertEquals("Point", ((Ident) lit.type()).name());
            assertEquals(2, lit.elts().size());
        }
    }

    @Nested
    class Errors {

        @Test
        void blankSourceIsEmpty() {
            GoAstException e = assertThrows(GoAstException.class, () -> parser.parse("empty.go", "   \n"));
            assertEquals(GoAstErrorCode.EMPTY_SOURCE, e.getCode());
        }

        @Test
        void syntaxErrorsAreReported() {
            GoAstException e = assertThrows(GoAstException.class,
                    () -> parser.parse("bad.go", "package main\n\nfunc broken( {\n"));

            assertEquals(GoAstErrorCode.PARSE_FAILED, e.getCode());
            assertFalse(e.getSyntaxErrors().isEmpty());
        }

        @Test
        void oversizedSourceIsRejected() {
            GoSourceParser small = new GoSourceParser(TreeSitterManager.getInstance(),
                    new GoAstConfig(16, 10, "template", "main"));

            GoAstException e = assertThrows(GoAstException.class,
                    () -> small.parse("big.go", "package main\n\nfunc main() {}\n"));
            assertEquals(GoAstErrorCode.FILE_TOO_LARGE, e.getCode());
        }

        @Test
        void missingFile(@TempDir Path dir) {
            GoAstException e = assertThrows(GoAstException.class, () -> parser.parse(dir.resolve("nope.go")));
            assertEquals(GoAstErrorCode.FILE_NOT_FOUND, e.getCode());
        }
    }

    @Nested
    class FileCache {

        @Test
        void unchangedFileIsServedFromCache(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("a.go");
            Files.writeString(file, "package a\n\nfunc A() {}\n");

            ParsedUnit first = parser.parse(file);
            ParsedUnit second = parser.parse(file);

            assertSame(first, second);
            assertEquals(1, parser.getCacheSize());
        }

        @Test
        void changedContentIsReparsed(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("a.go");
            Files.writeString(file, "package a\n\nfunc A() {}\n");
            ParsedUnit first = parser.parse(file);

            Files.writeString(file, "package a\n\nfunc B() {}\n");
            ParsedUnit second = parser.parse(file);

            assertNotSame(first, second);
            assertEquals("B", ((FuncDecl) second.file().decls().get(0)).name().name());
        }

        @Test
        void invalidateDropsEntry(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("a.go");
            Files.writeString(file, "package a\n");
            parser.parse(file);

            parser.invalidate(file);

            assertEquals(0, parser.getCacheSize());
        }
    }
}
