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
package ru.nts.tools.goast.scope;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTreeTest {

    private static final String SHADOW = """
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

    private static final String GENERIC = """
            package box

            type Box[T any] struct {
            	Value T
            }

            func (b *Box[T]) Get() T {
            	return b.Value
            }
            """;

    private final GoSourceParser parser = new GoSourceParser();

    private static Position at(int line, int column) {
        return new Position(line, column, -1);
    }

    @Nested
    class Shadowing {

        private ScopeTree tree;

        @BeforeEach
        void setUp() {
            tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));
        }

        @Test
        void innerDeclarationWinsInsideBlock() {
            Symbol inner = tree.resolve("x", at(10, 10)).orElseThrow();

            assertEquals(8, inner.definingSpan().start().line());
            assertEquals(3, inner.definingSpan().start().column());
        }

        @Test
        void outerDeclarationAfterBlock() {
            Symbol outer = tree.resolve("x", at(13, 9)).orElseThrow();

            assertEquals(6, outer.definingSpan().start().line());
            assertNotSame(outer, tree.resolve("x", at(10, 10)).orElseThrow());
        }

        @Test
        void localIsNotVisibleBeforeItsStatement() {
            assertTrue(tree.resolve("x", at(5, 20)).isEmpty());
        }

        @Test
        void packageVariableAndParameter() {
            Symbol count = tree.resolve("count", at(6, 7)).orElseThrow();
            Symbol delta = tree.resolve("delta", at(7, 5)).orElseThrow();

            assertEquals(0, count.scope());
            assertEquals(SymbolKind.VARIABLE, count.kind());
            assertEquals(SymbolKind.VARIABLE, delta.kind());
            assertEquals(5, delta.definingSpan().start().line());
            assertEquals(10, delta.definingSpan().start().column());
        }

        @Test
        void innermostScopeIsNested() {
            assertEquals(Scope.Kind.UNIT, tree.innermostScope(at(3, 1)).kind());
            assertNotEquals(Scope.Kind.UNIT, tree.innermostScope(at(9, 3)).kind());
            assertTrue(tree.innermostScope(at(9, 3)).index() > tree.innermostScope(at(6, 2)).index());
        }
    }

    @Nested
    class Definitions {

        @Test
        void functionDefinition() {
            ScopeTree tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));

            DefinitionResult inc = tree.lookupDefinition("Inc", at(13, 2)).orElseThrow();

            assertEquals(SymbolKind.FUNCTION, inc.kind());
            assertEquals("shadow.go", inc.unit());
            assertEquals(5, inc.line());
            assertEquals(6, inc.column());
            assertEquals("func(int) int", inc.typeText());
            assertTrue(inc.exported());
        }

        @Test
        void unexportedVariableWithoutDeclaredType() {
            ScopeTree tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));

            DefinitionResult count = tree.lookupDefinition("count", at(6, 7)).orElseThrow();

            assertEquals(3, count.line());
            assertEquals(5, count.column());
            assertEquals("", count.typeText());
            assertFalse(count.exported());
        }

        @Test
        void undeclaredNameIsEmpty() {
            ScopeTree tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));

            assertTrue(tree.lookupDefinition("missing", at(6, 2)).isEmpty());
        }

        @Test
        void typeParameterAndField() {
            ScopeTree tree = ScopeTree.build(parser.parse("box.go", GENERIC));

            Symbol typeParam = tree.resolve("T", at(4, 8)).orElseThrow();
            Symbol field = tree.symbolAt(at(8, 11)).orElseThrow();

            assertEquals(SymbolKind.TYPE, typeParam.kind());
            assertEquals(3, typeParam.definingSpan().start().line());
            assertEquals(SymbolKind.FIELD, field.kind());
            assertEquals("T", tree.describe(field).typeText());
            assertTrue(tree.describe(field).exported());
        }

        @Test
        void nullFileIsRejected() {
            GoAstException e = assertThrows(GoAstException.class, () -> ScopeTree.build("none", null));
            assertEquals(GoAstErrorCode.INVALID_SOURCE, e.getCode());
        }
    }

    @Nested
    class References {

        @Test
        void innerVariableReferences() {
            ScopeTree tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));
            Symbol inner = tree.resolve("x", at(10, 10)).orElseThrow();

            List<Reference> refs = tree.findReferences(inner);

            assertEquals(List.of(Reference.Kind.DEFINITION, Reference.Kind.WRITE, Reference.Kind.READ),
                    refs.stream().map(Reference::kind).collect(Collectors.toList()));
            assertEquals(List.of(8, 9, 10), refs.stream().map(Reference::line).collect(Collectors.toList()));
        }

        @Test
        void outerVariableReferences() {
            ScopeTree tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));
            Symbol outer = tree.resolve("x", at(13, 9)).orElseThrow();

            List<Reference> refs = tree.findReferences(outer);

            assertEquals(List.of(Reference.Kind.DEFINITION, Reference.Kind.WRITE, Reference.Kind.READ,
                            Reference.Kind.READ),
                    refs.stream().map(Reference::kind).collect(Collectors.toList()));
            assertEquals(12, refs.get(1).line());
            assertEquals(2, refs.get(1).column());
            assertEquals(6, refs.get(2).column());
        }

        @Test
        void receiverReferences() {
            ScopeTree tree = ScopeTree.build(parser.parse("box.go", GENERIC));
            Symbol receiver = tree.symbolAt(at(7, 7)).orElseThrow();

            List<Reference> refs = tree.findReferences(receiver);

            assertEquals(SymbolKind.VARIABLE, receiver.kind());
            assertEquals(2, refs.size());
            assertEquals(Reference.Kind.DEFINITION, refs.get(0).kind());
            assertEquals(8, refs.get(1).line());
            assertEquals(9, refs.get(1).column());
        }

        @Test
        void nullSymbolHasNoReferences() {
            ScopeTree tree = ScopeTree.build(parser.parse("shadow.go", SHADOW));

            assertTrue(tree.findReferences(null).isEmpty());
        }
    }

    @Nested
    class TypeSwitchAndSelect {

        private static final String SOURCE = """
                package main

                func run(v any, in chan int) int {
                	x := 1
                	switch t := v.(type) {
                	case int:
                		return x + t
                	default:
                		println(t)
                	}
                	select {
                	case x := <-in:
                		return x
                	default:
                		x++
                	}
                	return x
                }
                """;

        private ScopeTree tree;

        @BeforeEach
        void setUp() {
            tree = ScopeTree.build(parser.parse("run.go", SOURCE));
        }

        @Test
        void guardIsOneSymbolForAllClauses() {
            Symbol inCase = tree.symbolAt(at(7, 14)).orElseThrow();
            Symbol inDefault = tree.symbolAt(at(9, 11)).orElseThrow();

            assertSame(inCase, inDefault);
            assertEquals(5, inCase.definingSpan().start().line());
            assertEquals(9, inCase.definingSpan().start().column());
            assertEquals(List.of(5, 7, 9), tree.findReferences(inCase).stream()
                    .map(Reference::line).collect(Collectors.toList()));
        }

        @Test
        void guardIsNotVisibleAfterSwitch() {
            assertTrue(tree.resolve("t", at(11, 2)).isEmpty());
        }

        @Test
        void caseTypesAreTypeReferences() {
            IdentUse use = tree.useAt(at(6, 7)).orElseThrow();

            assertEquals(IdentUse.Role.TYPE, use.role());
        }

        @Test
        void receiveDeclaresInsideItsClause() {
            Symbol received = tree.symbolAt(at(13, 10)).orElseThrow();
            Symbol outer = tree.symbolAt(at(15, 3)).orElseThrow();

            assertEquals(12, received.definingSpan().start().line());
            assertEquals(4, outer.definingSpan().start().line());
            assertSame(outer, tree.symbolAt(at(7, 10)).orElseThrow());
            assertSame(outer, tree.symbolAt(at(17, 9)).orElseThrow());
        }
    }
}
