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

import java.util.List;

/**
 * Список полей: параметры, результаты, поля структуры или методы интерфейса.
 */
public record FieldList(List<Field> list, Span span) implements Node {

    public FieldList {
        list = List.copyOf(list);
    }

    public FieldList(List<Field> list) {
        this(list, Span.NONE);
    }

    public static FieldList empty() {
        return new FieldList(List.of(), Span.NONE);
    }

    /**
     * Число элементов с учетом группировки имен: {@code a, b int} дает 2.
     */
    public int numFields() {
        int n = 0;
        for (Field field : list) {
            n += field.names().isEmpty() ? 1 : field.names().size();
        }
        return n;
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFieldList(this);
    }
}
