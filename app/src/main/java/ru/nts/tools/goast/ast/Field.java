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

import ru.nts.tools.goast.ast.Expr.BasicLit;
import ru.nts.tools.goast.ast.Expr.Ident;

import java.util.List;

/**
 * Поле структуры, параметр, результат или элемент интерфейса.
 * Пустой список имен означает встроенное поле или безымянный параметр.
 */
public record Field(List<Ident> names, Expr type, BasicLit tag, Span span) implements Node {

    public Field {
        names = List.copyOf(names);
    }

    public Field(List<Ident> names, Expr type) {
        this(names, type, null, Span.NONE);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitField(this);
    }
}
