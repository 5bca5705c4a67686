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
package ru.nts.tools.goast.template;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr.ArrayType;
import ru.nts.tools.goast.ast.Expr.FuncType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.InterfaceType;
import ru.nts.tools.goast.ast.Field;
import ru.nts.tools.goast.ast.FieldList;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.GoPrinter;
import ru.nts.tools.goast.ast.Span;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.core.GoAstConfig;
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeGeneratorTest {

    private final GoSourceParser parser = new GoSourceParser();
    private final CodeGenerator generator = new CodeGenerator(new GoAstConfig(1024 * 1024, 10, "template", "main"));

    private InterfaceType parseInterface(String source) {
        GoFile file = parser.parse("iface.go", source).file();
        TypeSpec spec = (TypeSpec) ((GenDecl) file.decls().get(0)).specs().get(0);
        return (InterfaceType) spec.type();
    }

    private FuncDecl parseFunction(String source) {
        return (FuncDecl) parser.parse("fn.go", source).file().decls().get(0);
    }

    @Nested
    class InterfaceImplementation {

        @Test
        void singleMethodInterface() {
            InterfaceType iface = parseInterface("""
                    package io

                    type Writer interface {
                    	Write(data string) error
                    }
                    """);

            GoFile result = generator.generateInterfaceImplementation(iface, "FileWriter", null);

            assertEquals("main", result.packageName().name());
            assertEquals(2, result.decls().size());
            assertEquals("type FileWriter struct{}", GoPrinter.print(result.decls().get(0)));
            assertEquals("func (f *FileWriter) Write(data string) error {\n\treturn nil\n}",
                    GoPrinter.print(result.decls().get(1)));
        }

        @Test
        void zeroValuesPerResult() {
            InterfaceType iface = parseInterface("""
                    package store

                    type Store interface {
                    	Flush()
                    	Size() (int, bool)
                    	Name() string
                    }
                    """);

            GoFile result = generator.generateInterfaceImplementation(iface, "Memory", Map.of());

            assertEquals(4, result.decls().size());
            assertEquals("func (m *Memory) Flush() {\n\treturn\n}", GoPrinter.print(result.decls().get(1)));
            assertEquals("func (m *Memory) Size() (int, bool) {\n\treturn 0, false\n}",
                    GoPrinter.print(result.decls().get(2)));
            assertEquals("func (m *Memory) Name() string {\n\treturn \"\"\n}", GoPrinter.print(result.decls().get(3)));
        }

        @Test
        void overrideReplacesSignature() {
            InterfaceType iface = parseInterface("""
                    package io

                    type Writer interface {
                    	Write(data string) error
                    }
                    """);
            FuncType bytes = new FuncType(
                    new FieldList(List.of(new Field(List.of(new Ident("p")), new ArrayType(null, new Ident("byte"), Span.NONE)))),
                    new FieldList(List.of(new Field(List.of(), new Ident("int")), new Field(List.of(), new Ident("error")))),
                    Span.NONE);

            GoFile result = generator.generateInterfaceImplementation(iface, "Buffer", Map.of("Write", bytes));

            assertEquals("func (b *Buffer) Write(p []byte) (int, error) {\n\treturn 0, nil\n}",
                    GoPrinter.print(result.decls().get(1)));
        }

        @Test
        void interfaceWithoutMethods() {
            InterfaceType empty = new InterfaceType(FieldList.empty(), Span.NONE);

            assertEquals(GoAstErrorCode.INVALID_SOURCE, assertThrows(GoAstException.class,
                    () -> generator.generateInterfaceImplementation(empty, "Nothing", null)).getCode());
            assertEquals(GoAstErrorCode.INVALID_SOURCE, assertThrows(GoAstException.class,
                    () -> generator.generateInterfaceImplementation(null, "Nothing", null)).getCode());
        }
    }

    @Nested
    class TestScaffold {

        @Test
        void tableForPlainFunction() {
            FuncDecl add = parseFunction("package calc\n\nfunc Add(a, b int) int {\n\treturn a + b\n}\n");

            FuncDecl scaffold = generator.generateTestScaffold(add);

            assertEquals("""
                    func TestAdd(t *testing.T) {
                    	var tests []struct {
                    		a int
                    		b int
                    	}
                    	for _, tt := range tests {
                    		Add(tt.a, tt.b)
                    	}
                    }""", GoPrinter.print(scaffold));
        }

        @Test
        void variadicParameterIsPassedWithEllipsis() {
            FuncDecl join = parseFunction("package text\n\nfunc join(sep string, parts ...string) string {\n\treturn sep\n}\n");

            String printed = GoPrinter.print(generator.generateTestScaffold(join));

            assertTrue(printed.startsWith("func TestJoin(t *testing.T) {"));
            assertTrue(printed.contains("\t\tparts []string\n"));
            assertTrue(printed.contains("\t\tjoin(tt.sep, tt.parts...)\n"));
        }

        @Test
        void functionWithoutParameters() {
            FuncDecl init = parseFunction("package app\n\nfunc Setup() {\n}\n");

            assertEquals("func TestSetup(t *testing.T) {\n\tvar tests []struct{}\n\tfor range tests {\n\t\tSetup()\n\t}\n}",
                    GoPrinter.print(generator.generateTestScaffold(init)));
        }

        @Test
        void methodOnlyUsesRow() {
            FuncDecl push = parseFunction("package stack\n\nfunc (s *Stack) Push(v int) {\n}\n");

            String printed = GoPrinter.print(generator.generateTestScaffold(push));

            assertTrue(printed.contains("\tfor _, tt := range tests {\n\t\t_ = tt\n\t}\n"));
            assertTrue(printed.startsWith("func TestPush(t *testing.T) {"));
        }

        @Test
        void testNames() {
            assertEquals("TestAdd", CodeGenerator.testName("add"));
            assertEquals("TestParse", CodeGenerator.testName("Parse"));
        }
    }
}
