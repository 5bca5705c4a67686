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
package ru.nts.tools.goast.core;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.goast.core.treesitter.SyntaxChecker.SyntaxError;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GoAstExceptionTest {

    @Nested
    class ErrorCodeFormatting {

        @Test
        void formatInterpolatesContext() {
            String text = GoAstErrorCode.TEMPLATE_NOT_FOUND.format(Map.of("name", "crud", "available", "struct"));

            assertTrue(text.startsWith("[ERROR: TEMPLATE_NOT_FOUND]"));
            assertTrue(text.contains("Template 'crud' is not registered. Registered: struct."));
            assertTrue(text.contains("Context: "));
        }

        @Test
        void unresolvedPlaceholdersAreMasked() {
            String text = GoAstErrorCode.SYMBOL_NOT_FOUND.format();

            assertFalse(text.contains("%symbol%"));
            assertTrue(text.contains("No symbol '...'"));
            assertFalse(text.contains("Context:"));
        }
    }

    @Nested
    class Factories {

        @Test
        void invalidSourceCarriesReason() {
            GoAstException e = GoAstException.invalidSource("tree is null");

            assertEquals(GoAstErrorCode.INVALID_SOURCE, e.getCode());
            assertEquals("tree is null", e.getContext().get("reason"));
            assertTrue(e.getMessage().contains("tree is null"));
        }

        @Test
        void symbolNotFoundKeepsPosition() {
            GoAstException e = GoAstException.symbolNotFound("count", "main.go", 12, 5);

            assertEquals(GoAstErrorCode.SYMBOL_NOT_FOUND, e.getCode());
            assertTrue(e.toUserMessage().contains("main.go:12:5"));
            assertEquals("[SYMBOL_NOT_FOUND] Symbol not found | symbol=count, unit=main.go, line=12, column=5",
                    e.toLogMessage());
        }

        @Test
        void parseFailedExposesSyntaxErrors() {
            SyntaxError first = new SyntaxError(3, 7, "Syntax error", "func (");
            GoAstException e = GoAstException.parseFailed("bad.go", List.of(first));

            assertEquals(GoAstErrorCode.PARSE_FAILED, e.getCode());
            assertEquals(1, e.getSyntaxErrors().size());
            assertEquals(3, e.getContext().get("line"));
            assertEquals(1, e.getContext().get("count"));
        }

        @Test
        void nameConflictCarriesReason() {
            GoAstException same = GoAstException.nameConflict("variable", "y");
            GoAstException captured = GoAstException.nameConflict("variable", "y",
                    "would change what 'y' refers to at line 7, column 3");

            assertTrue(same.toUserMessage().contains("'y' is already declared in the same scope"));
            assertTrue(captured.toUserMessage().contains("line 7, column 3"));
        }

        @Test
        void unsupportedConstructKeepsLine() {
            GoAstException e = GoAstException.unsupportedConstruct("x", 11);

            assertEquals(GoAstErrorCode.UNSUPPORTED_CONSTRUCT, e.getCode());
            assertTrue(e.toUserMessage().contains("line 11"));
        }

        @Test
        void templateNotFoundListsRegisteredNames() {
            GoAstException empty = GoAstException.templateNotFound("x", List.of());
            GoAstException some = GoAstException.templateNotFound("x", List.of("struct", "function"));

            assertEquals("none", empty.getContext().get("available"));
            assertEquals("struct, function", some.getContext().get("available"));
        }

        @Test
        void contextIsReadOnly() {
            GoAstException e = GoAstException.nameConflict("variable", "y");

            assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("extra", 1));
        }
    }
}
