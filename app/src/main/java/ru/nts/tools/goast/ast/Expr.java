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
 * Выражения и типы Go.
 * Типы представлены выражениями, как в go/ast: {@code *T} это {@link StarExpr},
 * {@code []T} это {@link ArrayType} без длины.
 */
public sealed interface Expr extends Node {

    record Ident(String name, Span span) implements Expr {
        public Ident(String name) {
            this(name, Span.NONE);
        }

        public boolean isBlank() {
            return "_".equals(name);
        }

        public boolean isExported() {
            return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIdent(this);
        }
    }

    enum LitKind { INT, FLOAT, IMAG, CHAR, STRING }

    /**
     * Литерал; {@code value} хранит текст как в исходнике (строки с кавычками).
     */
    record BasicLit(LitKind kind, String value, Span span) implements Expr {
        public BasicLit(LitKind kind, String value) {
            this(kind, value, Span.NONE);
        }

        /**
         * Значение строкового литерала без кавычек.
         */
        public String unquoted() {
            if (kind == LitKind.STRING && value.length() >= 2) {
                return value.substring(1, value.length() - 1);
            }
            return value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBasicLit(this);
        }
    }

    record SelectorExpr(Expr x, Ident sel, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSelectorExpr(this);
        }
    }

    record CallExpr(Expr fun, List<Expr> args, boolean ellipsis, Span span) implements Expr {
        public CallExpr {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /**
     * Составной литерал; {@code type} равен null для вложенных литералов без типа.
     */
    record CompositeLit(Expr type, List<Expr> elts, Span span) implements Expr {
        public CompositeLit {
            elts = List.copyOf(elts);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCompositeLit(this);
        }
    }

    record KeyValueExpr(Expr key, Expr value, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitKeyValueExpr(this);
        }
    }

    record UnaryExpr(String op, Expr x, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    record BinaryExpr(Expr x, String op, Expr y, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    record ParenExpr(Expr x, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitParenExpr(this);
        }
    }

    /**
     * Указатель {@code *T} или разыменование {@code *p}.
     */
    record StarExpr(Expr x, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStarExpr(this);
        }
    }

    /**
     * Индексирование {@code a[i]} или инстанцирование дженерика {@code Box[K, V]}.
     */
    record IndexExpr(Expr x, List<Expr> indices, Span span) implements Expr {
        public IndexExpr {
            indices = List.copyOf(indices);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    record SliceExpr(Expr x, Expr low, Expr high, Expr max, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSliceExpr(this);
        }
    }

    /**
     * Приведение {@code x.(T)}; {@code type} равен null для {@code x.(type)}.
     */
    record TypeAssertExpr(Expr x, Expr type, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeAssertExpr(this);
        }
    }

    /**
     * Массив {@code [N]T} или срез {@code []T} (len == null).
     */
    record ArrayType(Expr len, Expr elt, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitArrayType(this);
        }
    }

    record MapType(Expr key, Expr value, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMapType(this);
        }
    }

    enum ChanDir { BOTH, SEND, RECV }

    record ChanType(ChanDir dir, Expr value, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitChanType(this);
        }
    }

    /**
     * Сигнатура функции; {@code results} равен null, если результатов нет.
     */
    record FuncType(FieldList params, FieldList results, Span span) implements Expr {
        public int resultCount() {
            return results == null ? 0 : results.numFields();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFuncType(this);
        }
    }

    record StructType(FieldList fields, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStructType(this);
        }
    }

    /**
     * Интерфейс: методы это поля с одним именем и типом {@link FuncType},
     * встроенные интерфейсы и ограничения это поля без имен.
     */
    record InterfaceType(FieldList methods, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInterfaceType(this);
        }
    }

    /**
     * {@code ...T} в вариадическом параметре или {@code [...]T} (elt == null).
     */
    record Ellipsis(Expr elt, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitEllipsis(this);
        }
    }

    record FuncLit(FuncType type, Stmt.BlockStmt body, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFuncLit(this);
        }
    }

    /**
     * Конструкция без структурной модели, хранится как текст исходника.
     */
    record RawExpr(String text, Span span) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRawExpr(this);
        }
    }
}
