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

import static org.junit.jupiter.api.Assertions.*;

class PositionIndexTest {

    private final PositionIndex index = PositionIndex.of("main.go", "package main\n\nfunc main() {}\n");

    @Test
    void linesAreOneBased() {
        assertEquals(1, index.line(0));
        assertEquals(1, index.line(12));
        assertEquals(2, index.line(13));
        assertEquals(3, index.line(14));
    }

    @Test
    void negativeOffsetHasNoLine() {
        assertEquals(0, index.line(-1));
        assertSame(Position.NONE, index.position(-1));
    }

    @Test
    void positionFromOffset() {
        Position pos = index.position(19);

        assertEquals(3, pos.line());
        assertEquals(6, pos.column());
        assertEquals(19, pos.offset());
    }

    @Test
    void validPositionWinsOverOffset() {
        assertEquals(7, index.line(new Position(7, 1, 0)));
        assertEquals(3, index.line(new Position(0, 0, 20)));
    }

    @Test
    void multibyteCharactersCountAsBytes() {
        PositionIndex utf = PositionIndex.of("u.go", "// привет\nx");

        assertEquals(2, utf.lineCount());
        assertEquals(1, utf.line(10));
        assertEquals(2, utf.line(16));
    }

    @Test
    void spansContainTheirEnd() {
        Span span = new Span(new Position(2, 3, -1), new Position(2, 8, -1));

        assertTrue(span.contains(new Position(2, 3, -1)));
        assertTrue(span.contains(new Position(2, 8, -1)));
        assertFalse(span.contains(new Position(2, 9, -1)));
        assertFalse(Span.NONE.contains(new Position(2, 3, -1)));
    }
}
