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
 * Диапазон узла: начало включительно, конец исключительно.
 */
public record Span(Position start, Position end) {

    public static final Span NONE = new Span(Position.NONE, Position.NONE);

    public boolean isValid() {
        return start.isValid();
    }

    /**
     * Содержит ли диапазон позицию (по строке и колонке).
     * Конец включается, чтобы позиция сразу за идентификатором указывала на него.
     */
    public boolean contains(Position pos) {
        return isValid() && pos.isValid() && start.compareTo(pos) <= 0 && pos.compareTo(end) <= 0;
    }

    public boolean contains(Span other) {
        return isValid() && other.isValid()
                && start.compareTo(other.start) <= 0 && other.end.compareTo(end) <= 0;
    }

    @Override
    public String toString() {
        return isValid() ? start + "-" + end : "<synthetic>";
    }
}
