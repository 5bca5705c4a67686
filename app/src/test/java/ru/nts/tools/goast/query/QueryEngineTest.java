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
package ru.nts.tools.goast.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;
import ru.nts.tools.goast.query.QueryMatch.MatchKind;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    private static final String FUNCS = """
            package funcs

            import (
            	"fmt"
            	str "strings"
            	"github.com/acme/log"
            	"github.com/acme/log/level"
            )

            func foo(a, b int) int {
            	return a + b
            }

            func fooBar(s string) {
            	fmt.Println(str.ToUpper(s))
            }

            func baz() (int, error) {
            	log.Info(level.Debug)
            	return 0, nil
            }
            """;

    private static final String IO = """
            package io

            type Closer interface {
            	Close() error
            }

            type File struct {
            	name string
            	size int64
            }

            func (f *File) Close() bool {
            	return true
            }

            type Conn struct {
            	addr string
            }

            func (c Conn) Close(force bool) error {
            	return nil
            }

            type Pipe struct{}

            func (p *Pipe) Close() error {
            	return nil
            }
            """;

    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        GoSourceParser parser = new GoSourceParser();
        engine = new QueryEngine(List.of(parser.parse("funcs.go", FUNCS), parser.parse("io.go", IO)));
    }

    private static List<String> names(List<QueryMatch> matches) {
        return matches.stream().map(QueryMatch::name).collect(Collectors.toList());
    }

    @Nested
    class Functions {

        @Test
        void wildcardMatchesEverything() {
            List<QueryMatch> all = engine.findFunctions("*");

            assertEquals(List.of("foo", "fooBar", "baz", "Close", "Close", "Close"), names(all));
        }

        @Test
        void prefixPattern() {
            assertEquals(List.of("foo", "fooBar"), names(engine.findFunctions("foo*")));
            assertTrue(engine.findFunctions("Foo*").isEmpty());
        }

        @Test
        void exactNameIgnoresCase() {
            List<QueryMatch> matches = engine.findFunctions("FOO");

            assertEquals(1, matches.size());
            QueryMatch foo = matches.get(0);
            assertEquals("funcs.go", foo.unitName());
            assertEquals(10, foo.line());
            assertEquals("(int, int) int", foo.formattedSignature());
            assertEquals(MatchKind.FUNCTION, foo.matchKind());
        }

        @Test
        void emptyPatternFindsNothing() {
            assertTrue(engine.findFunctions("").isEmpty());
            assertTrue(engine.findFunctions(null).isEmpty());
        }

        @Test
        void signatureIgnoresWhitespace() {
            assertEquals(List.of("foo"), names(engine.findBySignature("(int,int)int")));
            assertEquals(List.of("baz"), names(engine.findBySignature("() (int, error)")));
            assertEquals(List.of("io.go"), engine.findBySignature("()error").stream()
                    .map(QueryMatch::unitName).collect(Collectors.toList()));
        }
    }

    @Nested
    class Implementations {

        @Test
        void resultTypesAreNotCompared() {
            List<QueryMatch> matches = engine.findImplementations("Closer");

            assertEquals(List.of("File", "Pipe"), names(matches));
            assertEquals(MatchKind.IMPLEMENTATION, matches.get(0).matchKind());
            assertEquals("struct{name string; size int64}", matches.get(0).formattedSignature());
            assertEquals("io.go", matches.get(1).unitName());
        }

        @Test
        void unknownInterfaceFindsNothing() {
            assertTrue(engine.findImplementations("Reader").isEmpty());
            assertTrue(engine.findImplementations("File").isEmpty());
        }
    }

    @Nested
    class StructsAndImports {

        @Test
        void structsByFieldType() {
            assertEquals(List.of("File", "Conn"), names(engine.findStructsByFieldType("string")));
            assertEquals(List.of("File"), names(engine.findStructsByFieldType("int64")));
            assertEquals(List.of("File", "Conn", "Pipe"), names(engine.findStructsByFieldType("*")));
            assertEquals(MatchKind.STRUCT_FIELD, engine.findStructsByFieldType("int64").get(0).matchKind());
        }

        @Test
        void importsByPath() {
            List<QueryMatch> aliased = engine.findByImportDependency("strings");

            assertEquals(1, aliased.size());
            assertEquals("str", aliased.get(0).name());
            assertEquals("strings", aliased.get(0).formattedSignature());
            assertEquals(5, aliased.get(0).line());
            assertEquals(MatchKind.IMPORT, aliased.get(0).matchKind());
        }

        @Test
        void importPrefixAndWildcard() {
            assertEquals(List.of("github.com/acme/log/level"),
                    names(engine.findByImportDependency("github.com/acme/log/*")));
            assertEquals(4, engine.findByImportDependency("*").size());
            assertTrue(engine.findByImportDependency("os").isEmpty());
        }
    }

    @Test
    void matchKindLabels() {
        assertEquals("function", MatchKind.FUNCTION.getLabel());
        assertEquals("struct", MatchKind.STRUCT_FIELD.getLabel());
    }
}
