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

import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr.*;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Stmt.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Обход дерева: прямые потомки узла и обход в глубину.
 */
public final class Ast {

    private static final ChildCollector CHILDREN = new ChildCollector();

    private Ast() {}

    /**
     * Прямые потомки узла в порядке исходника (null-поля пропускаются).
     */
    public static List<Node> children(Node node) {
        return node.accept(CHILDREN);
    }

    /**
     * Обход в глубину в прямом порядке. Если {@code visitor} возвращает false,
     * потомки узла не посещаются.
     */
    public static void inspect(Node root, Predicate<Node> visitor) {
        if (root == null) {
            return;
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!visitor.test(node)) {
                continue;
            }
            List<Node> kids = children(node);
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
    }

    /**
     * Все узлы заданного типа в порядке обхода.
     */
    public static <T extends Node> List<T> collect(Node root, Class<T> type) {
        List<T> result = new ArrayList<>();
        inspect(root, n -> {
            if (type.isInstance(n)) {
                result.add(type.cast(n));
            }
            return true;
        });
        return result;
    }

    private static final class ChildCollector implements NodeVisitor<List<Node>> {

        private static List<Node> of(Object... parts) {
            List<Node> result = new ArrayList<>();
            for (Object part : parts) {
                if (part instanceof Node n) {
                    result.add(n);
                } else if (part instanceof Collection<?> c) {
                    for (Object o : c) {
                        if (o instanceof Node n) {
                            result.add(n);
                        }
                    }
                }
            }
            return result;
        }

        @Override
        public List<Node> visitGoFile(GoFile node) {
            return of(node.packageName(), node.decls());
        }

        @Override
        public List<Node> visitFuncDecl(FuncDecl node) {
            return of(node.recv(), node.name(), node.typeParams(), node.type(), node.body());
        }

        @Override
        public List<Node> visitGenDecl(GenDecl node) {
            return of(node.specs());
        }

        @Override
        public List<Node> visitImportSpec(ImportSpec node) {
            return of(node.name(), node.path());
        }

        @Override
        public List<Node> visitValueSpec(ValueSpec node) {
            return of(node.names(), node.type(), node.values());
        }

        @Override
        public List<Node> visitTypeSpec(TypeSpec node) {
            return of(node.name(), node.typeParams(), node.type());
        }

        @Override
        public List<Node> visitField(Field node) {
            return of(node.names(), node.type(), node.tag());
        }

        @Override
        public List<Node> visitFieldList(FieldList node) {
            return of(node.list());
        }

        @Override
        public List<Node> visitCaseClause(CaseClause node) {
            return of(node.list(), node.body());
        }

        @Override
        public List<Node> visitCommClause(CommClause node) {
            return of(node.comm(), node.body());
        }

        @Override
        public List<Node> visitIdent(Ident node) {
            return List.of();
        }

        @Override
        public List<Node> visitBasicLit(BasicLit node) {
            return List.of();
        }

        @Override
        public List<Node> visitSelectorExpr(SelectorExpr node) {
            return of(node.x(), node.sel());
        }

        @Override
        public List<Node> visitCallExpr(CallExpr node) {
            return of(node.fun(), node.args());
        }

        @Override
        public List<Node> visitCompositeLit(CompositeLit node) {
            return of(node.type(), node.elts());
        }

        @Override
        public List<Node> visitKeyValueExpr(KeyValueExpr node) {
            return of(node.key(), node.value());
        }

        @Override
        public List<Node> visitUnaryExpr(UnaryExpr node) {
            return of(node.x());
        }

        @Override
        public List<Node> visitBinaryExpr(BinaryExpr node) {
            return of(node.x(), node.y());
        }

        @Override
        public List<Node> visitParenExpr(ParenExpr node) {
            return of(node.x());
        }

        @Override
        public List<Node> visitStarExpr(StarExpr node) {
            return of(node.x());
        }

        @Override
        public List<Node> visitIndexExpr(IndexExpr node) {
            return of(node.x(), node.indices());
        }

        @Override
        public List<Node> visitSliceExpr(SliceExpr node) {
            return of(node.x(), node.low(), node.high(), node.max());
        }

        @Override
        public List<Node> visitTypeAssertExpr(TypeAssertExpr node) {
            return of(node.x(), node.type());
        }

        @Override
        public List<Node> visitArrayType(ArrayType node) {
            return of(node.len(), node.elt());
        }

        @Override
        public List<Node> visitMapType(MapType node) {
            return of(node.key(), node.value());
        }

        @Override
        public List<Node> visitChanType(ChanType node) {
            return of(node.value());
        }

        @Override
        public List<Node> visitFuncType(FuncType node) {
            return of(node.params(), node.results());
        }

        @Override
        public List<Node> visitStructType(StructType node) {
            return of(node.fields());
        }

        @Override
        public List<Node> visitInterfaceType(InterfaceType node) {
            return of(node.methods());
        }

        @Override
        public List<Node> visitEllipsis(Ellipsis node) {
            return of(node.elt());
        }

        @Override
        public List<Node> visitFuncLit(FuncLit node) {
            return of(node.type(), node.body());
        }

        @Override
        public List<Node> visitRawExpr(RawExpr node) {
            return List.of();
        }

        @Override
        public List<Node> visitBlockStmt(BlockStmt node) {
            return of(node.list());
        }

        @Override
        public List<Node> visitExprStmt(ExprStmt node) {
            return of(node.x());
        }

        @Override
        public List<Node> visitAssignStmt(AssignStmt node) {
            return of(node.lhs(), node.rhs());
        }

        @Override
        public List<Node> visitIncDecStmt(IncDecStmt node) {
            return of(node.x());
        }

        @Override
        public List<Node> visitReturnStmt(ReturnStmt node) {
            return of(node.results());
        }

        @Override
        public List<Node> visitIfStmt(IfStmt node) {
            return of(node.init(), node.cond(), node.body(), node.els());
        }

        @Override
        public List<Node> visitForStmt(ForStmt node) {
            return of(node.init(), node.cond(), node.post(), node.body());
        }

        @Override
        public List<Node> visitRangeStmt(RangeStmt node) {
            return of(node.key(), node.value(), node.x(), node.body());
        }

        @Override
        public List<Node> visitSwitchStmt(SwitchStmt node) {
            return of(node.init(), node.tag(), node.clauses());
        }

        @Override
        public List<Node> visitTypeSwitchStmt(TypeSwitchStmt node) {
            return of(node.init(), node.assign(), node.clauses());
        }

        @Override
        public List<Node> visitSelectStmt(SelectStmt node) {
            return of(node.clauses());
        }

        @Override
        public List<Node> visitDeclStmt(DeclStmt node) {
            return of(node.decl());
        }

        @Override
        public List<Node> visitGoStmt(GoStmt node) {
            return of(node.call());
        }

        @Override
        public List<Node> visitDeferStmt(DeferStmt node) {
            return of(node.call());
        }

        @Override
        public List<Node> visitBranchStmt(BranchStmt node) {
            return of(node.label());
        }

        @Override
        public List<Node> visitSendStmt(SendStmt node) {
            return of(node.chan(), node.value());
        }

        @Override
        public List<Node> visitLabeledStmt(LabeledStmt node) {
            return of(node.label(), node.stmt());
        }

        @Override
        public List<Node> visitRawStmt(RawStmt node) {
            return List.of();
        }
    }
}
