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
 * Ветка select: {@code comm} это {@link Stmt.SendStmt}, приём ({@link Stmt.AssignStmt}
 * или {@link Stmt.ExprStmt}) либо null для {@code default}.
 */
public record CommClause(Stmt comm, List<Stmt> body, Span span) implements Node {

    public CommClause {
        body = List.copyOf(body);
    }

    public boolean isDefault() {
        return comm == null;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCommClause(this);
    }
}
