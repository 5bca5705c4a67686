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

/**
 * Позиция в разобранном модуле.
 *
 * @param line   номер строки (1-based)
 * @param column номер колонки в байтах (1-based)
 * @param offset байтовое смещение от начала модуля (0-based)
 */
public record Position(int line, int column, int offset) implements Comparable<Position> {

    /**
     * Позиция синтезированных узлов, не привязанных к исходнику.
     */
    public static final Position NONE = new Position(0, 0, -1);

    public boolean isValid() {
        return line > 0;
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Position other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
