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

import ru.nts.tools.goast.ast.Expr.Ident;

import java.util.List;

/**
 * Операторы Go.
 */
public sealed interface Stmt extends Node {

    record BlockStmt(List<Stmt> list, Span span) implements Stmt {
        public BlockStmt {
            list = List.copyOf(list);
        }

        public BlockStmt(List<Stmt> list) {
            this(list, Span.NONE);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBlockStmt(this);
        }
    }

    record ExprStmt(Expr x, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }
    }

    /**
     * Присваивание; {@code tok} это {@code :=}, {@code =} или составной оператор вроде {@code +=}.
     */
    record AssignStmt(List<Expr> lhs, String tok, List<Expr> rhs, Span span) implements Stmt {
        public AssignStmt {
            lhs = List.copyOf(lhs);
            rhs = List.copyOf(rhs);
        }

        public boolean isDefine() {
            return ":=".equals(tok);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssignStmt(this);
        }
    }

    record IncDecStmt(Expr x, String tok, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIncDecStmt(this);
        }
    }

    record ReturnStmt(List<Expr> results, Span span) implements Stmt {
        public ReturnStmt {
            results = List.copyOf(results);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitReturnStmt(this);
        }
    }

    /**
     * Условный оператор; {@code els} это {@link BlockStmt}, вложенный {@link IfStmt} или null.
     */
    record IfStmt(Stmt init, Expr cond, BlockStmt body, Stmt els, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIfStmt(this);
        }
    }

    record ForStmt(Stmt init, Expr cond, Stmt post, BlockStmt body, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitForStmt(this);
        }
    }

    /**
     * Цикл по диапазону; {@code tok} равен {@code :=}, {@code =} или null для {@code for range x}.
     */
    record RangeStmt(Expr key, Expr value, String tok, Expr x, BlockStmt body, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRangeStmt(this);
        }
    }

    record SwitchStmt(Stmt init, Expr tag, List<CaseClause> clauses, Span span) implements Stmt {
        public SwitchStmt {
            clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSwitchStmt(this);
        }
    }

    /**
     * Переключатель по типу. {@code assign} это {@code t := x.(type)} ({@link AssignStmt})
     * или {@code x.(type)} ({@link ExprStmt}); в ветках {@code list} содержит типы.
     */
    record TypeSwitchStmt(Stmt init, Stmt assign, List<CaseClause> clauses, Span span) implements Stmt {
        public TypeSwitchStmt {
            clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeSwitchStmt(this);
        }
    }

    record SelectStmt(List<CommClause> clauses, Span span) implements Stmt {
        public SelectStmt {
            clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSelectStmt(this);
        }
    }

    record DeclStmt(Decl.GenDecl decl, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDeclStmt(this);
        }
    }

    record GoStmt(Expr call, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitGoStmt(this);
        }
    }

    record DeferStmt(Expr call, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDeferStmt(this);
        }
    }

    /**
     * break, continue, goto или fallthrough; {@code label} может быть null.
     */
    record BranchStmt(String tok, Ident label, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBranchStmt(this);
        }
    }

    record SendStmt(Expr chan, Expr value, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSendStmt(this);
        }
    }

    record LabeledStmt(Ident label, Stmt stmt, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLabeledStmt(this);
        }
    }

    /**
     * Оператор без структурной модели, хранится как текст исходника.
     */
    record RawStmt(String text, Span span) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRawStmt(this);
        }
    }
}
