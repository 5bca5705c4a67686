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
 * Узел синтаксического дерева Go.
 * Все узлы неизменяемы; преобразования строят новое дерево через {@link NodeRewriter}.
 */
public sealed interface Node permits GoFile, Decl, Spec, Expr, Stmt, Field, FieldList, CaseClause, CommClause {

    /**
     * Диапазон узла в исходном модуле ({@link Span#NONE} для синтезированных узлов).
     */
    Span span();

    <R> R accept(NodeVisitor<R> visitor);
}
