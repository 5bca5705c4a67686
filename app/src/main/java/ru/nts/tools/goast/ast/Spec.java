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
 * Спецификации внутри {@link Decl.GenDecl}.
 */
public sealed interface Spec extends Node {

    /**
     * @param name псевдоним пакета ({@code .}, {@code _} или имя), может быть null
     */
    record ImportSpec(Ident name, BasicLit path, Span span) implements Spec {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitImportSpec(this);
        }
    }

    record ValueSpec(List<Ident> names, Expr type, List<Expr> values, Span span) implements Spec {
        public ValueSpec {
            names = List.copyOf(names);
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitValueSpec(this);
        }
    }

    /**
     * @param alias true для {@code type A = B}
     */
    record TypeSpec(Ident name, FieldList typeParams, boolean alias, Expr type, Span span) implements Spec {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeSpec(this);
        }
    }
}
