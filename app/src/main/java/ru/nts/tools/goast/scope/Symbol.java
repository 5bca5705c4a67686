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

import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.Span;

/**
 * Объявленное имя. Создается один раз при построении {@link ScopeTree}.
 * Символы сравниваются по ссылке: два одноименных объявления это разные символы.
 *
 * @param name         имя
 * @param kind         вид
 * @param declaration  объявляющий идентификатор
 * @param scope        индекс области видимости, которой принадлежит символ
 * @param declaredType тип из объявления, если он известен (может быть null)
 * @param visibleFrom  позиция, начиная с которой локальный символ виден
 */
public record Symbol(String name, SymbolKind kind, Ident declaration, int scope, Expr declaredType,
                     Position visibleFrom) {

    public Span definingSpan() {
        return declaration.span();
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + " " + name + " @" + definingSpan().start();
    }
}
