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

import ru.nts.tools.goast.ast.Expr.FuncType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Stmt.BlockStmt;

import java.util.List;

/**
 * Объявления верхнего уровня.
 */
public sealed interface Decl extends Node {

    /**
     * Функция или метод.
     *
     * @param recv       получатель метода, null для функций
     * @param typeParams параметры типа, null если функция не обобщенная
     * @param body       тело, null для объявлений без тела
     */
    record FuncDecl(FieldList recv, Ident name, FieldList typeParams, FuncType type, BlockStmt body,
                    Span span) implements Decl {

        public boolean isMethod() {
            return recv != null && !recv.list().isEmpty();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFuncDecl(this);
        }
    }

    /**
     * import, const, type или var; {@code grouped} означает форму со скобками.
     */
    record GenDecl(String tok, List<Spec> specs, boolean grouped, Span span) implements Decl {
        public GenDecl {
            specs = List.copyOf(specs);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitGenDecl(this);
        }
    }
}
