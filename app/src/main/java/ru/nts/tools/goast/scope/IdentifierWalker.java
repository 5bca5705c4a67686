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

import ru.nts.tools.goast.ast.CaseClause;
import ru.nts.tools.goast.ast.CommClause;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.*;
import ru.nts.tools.goast.ast.Field;
import ru.nts.tools.goast.ast.FieldList;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.Node;
import ru.nts.tools.goast.ast.NodeVisitor;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Stmt.*;
import ru.nts.tools.goast.scope.IdentUse.Role;

import java.util.ArrayList;
import java.util.List;

/**
 * Собирает все вхождения идентификаторов в порядке исходника и классифицирует их по роли.
 * Контекст (значение или тип) передается сверху вниз: внутри конструкций типов
 * идентификаторы считаются ссылками на типы, квалифицированные имена {@code pkg.T} не связываются.
 */
public final class IdentifierWalker implements NodeVisitor<Void> {

    private final List<IdentUse> uses = new ArrayList<>();
    private boolean typeContext;
    private boolean writeContext;

    private IdentifierWalker() {}

    public static List<IdentUse> collect(Node root) {
        IdentifierWalker walker = new IdentifierWalker();
        if (root != null) {
            root.accept(walker);
        }
        return walker.uses;
    }

    private void add(Ident ident, Role role) {
        if (ident != null && !ident.isBlank()) {
            uses.add(new IdentUse(ident, role, writeContext && role != Role.DECLARATION));
        }
    }

    private void value(Node node) {
        if (node == null) {
            return;
        }
        boolean saved = typeContext;
        typeContext = false;
        node.accept(this);
        typeContext = saved;
    }

    private void type(Node node) {
        if (node == null) {
            return;
        }
        boolean saved = typeContext;
        typeContext = true;
        node.accept(this);
        typeContext = saved;
    }

    private void values(List<? extends Node> nodes) {
        for (Node n : nodes) {
            value(n);
        }
    }

    /**
     * Цель присваивания: идентификаторы и селекторы помечаются как запись.
     */
    private void target(Expr expr) {
        boolean saved = writeContext;
        writeContext = true;
        if (expr instanceof Ident id) {
            add(id, Role.VALUE);
        } else if (expr instanceof SelectorExpr sel) {
            writeContext = false;
            value(sel.x());
            writeContext = true;
            add(sel.sel(), Role.MEMBER);
        } else {
            writeContext = false;
            value(expr);
        }
        writeContext = saved;
    }

    private void declare(List<Ident> names) {
        for (Ident name : names) {
            add(name, Role.DECLARATION);
        }
    }

    private void fieldList(FieldList list) {
        if (list != null) {
            list.accept(this);
        }
    }

    @Override
    public Void visitGoFile(GoFile node) {
        add(node.packageName(), Role.NONE);
        for (var decl : node.decls()) {
            decl.accept(this);
        }
        return null;
    }

    @Override
    public Void visitFuncDecl(FuncDecl node) {
        if (node.recv() != null) {
            for (Field field : node.recv().list()) {
                declare(field.names());
                receiverType(field.type());
            }
        }
        add(node.name(), Role.DECLARATION);
        fieldList(node.typeParams());
        type(node.type());
        if (node.body() != null) {
            value(node.body());
        }
        return null;
    }

    /**
     * Тип получателя: {@code *List[T]} объявляет параметр типа T.
     */
    private void receiverType(Expr type) {
        Expr base = type instanceof StarExpr star ? star.x() : type;
        if (base instanceof IndexExpr idx) {
            type(idx.x());
            for (Expr param : idx.indices()) {
                if (param instanceof Ident id) {
                    add(id, Role.DECLARATION);
                }
            }
        } else {
            type(base);
        }
    }

    @Override
    public Void visitGenDecl(GenDecl node) {
        for (var spec : node.specs()) {
            spec.accept(this);
        }
        return null;
    }

    @Override
    public Void visitImportSpec(ImportSpec node) {
        add(node.name(), Role.NONE);
        return null;
    }

    @Override
    public Void visitValueSpec(ValueSpec node) {
        declare(node.names());
        type(node.type());
        values(node.values());
        return null;
    }

    @Override
    public Void visitTypeSpec(TypeSpec node) {
        add(node.name(), Role.DECLARATION);
        fieldList(node.typeParams());
        type(node.type());
        return null;
    }

    @Override
    public Void visitField(Field node) {
        declare(node.names());
        type(node.type());
        if (node.tag() != null) {
            node.tag().accept(this);
        }
        return null;
    }

    @Override
    public Void visitFieldList(FieldList node) {
        for (Field field : node.list()) {
            field.accept(this);
        }
        return null;
    }

    @Override
    public Void visitCaseClause(CaseClause node) {
        values(node.list());
        values(node.body());
        return null;
    }

    @Override
    public Void visitCommClause(CommClause node) {
        value(node.comm());
        values(node.body());
        return null;
    }

    @Override
    public Void visitIdent(Ident node) {
        add(node, typeContext ? Role.TYPE : Role.VALUE);
        return null;
    }

    @Override
    public Void visitBasicLit(BasicLit node) {
        return null;
    }

    @Override
    public Void visitSelectorExpr(SelectorExpr node) {
        if (typeContext) {
            // pkg.Type: квалифицированные имена не переименовываются
            if (node.x() instanceof Ident pkg) {
                add(pkg, Role.NONE);
            } else {
                node.x().accept(this);
            }
            add(node.sel(), Role.NONE);
            return null;
        }
        value(node.x());
        add(node.sel(), Role.MEMBER);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node) {
        node.fun().accept(this);
        values(node.args());
        return null;
    }

    @Override
    public Void visitCompositeLit(CompositeLit node) {
        type(node.type());
        for (Expr elt : node.elts()) {
            if (elt instanceof KeyValueExpr kv) {
                if (kv.key() instanceof Ident key) {
                    add(key, Role.KEY);
                } else {
                    value(kv.key());
                }
                value(kv.value());
            } else {
                value(elt);
            }
        }
        return null;
    }

    @Override
    public Void visitKeyValueExpr(KeyValueExpr node) {
        value(node.key());
        value(node.value());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node) {
        node.x().accept(this);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node) {
        node.x().accept(this);
        node.y().accept(this);
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node) {
        node.x().accept(this);
        return null;
    }

    @Override
    public Void visitStarExpr(StarExpr node) {
        node.x().accept(this);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node) {
        node.x().accept(this);
        for (Expr index : node.indices()) {
            index.accept(this);
        }
        return null;
    }

    @Override
    public Void visitSliceExpr(SliceExpr node) {
        value(node.x());
        value(node.low());
        value(node.high());
        value(node.max());
        return null;
    }

    @Override
    public Void visitTypeAssertExpr(TypeAssertExpr node) {
        value(node.x());
        type(node.type());
        return null;
    }

    @Override
    public Void visitArrayType(ArrayType node) {
        value(node.len());
        type(node.elt());
        return null;
    }

    @Override
    public Void visitMapType(MapType node) {
        type(node.key());
        type(node.value());
        return null;
    }

    @Override
    public Void visitChanType(ChanType node) {
        type(node.value());
        return null;
    }

    @Override
    public Void visitFuncType(FuncType node) {
        boolean saved = typeContext;
        typeContext = true;
        fieldList(node.params());
        fieldList(node.results());
        typeContext = saved;
        return null;
    }

    @Override
    public Void visitStructType(StructType node) {
        type(node.fields());
        return null;
    }

    @Override
    public Void visitInterfaceType(InterfaceType node) {
        type(node.methods());
        return null;
    }

    @Override
    public Void visitEllipsis(Ellipsis node) {
        type(node.elt());
        return null;
    }

    @Override
    public Void visitFuncLit(FuncLit node) {
        type(node.type());
        value(node.body());
        return null;
    }

    @Override
    public Void visitRawExpr(RawExpr node) {
        return null;
    }

    @Override
    public Void visitBlockStmt(BlockStmt node) {
        values(node.list());
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node) {
        value(node.x());
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node) {
        // правая часть вычисляется до объявления левой
        if (node.isDefine()) {
            for (Expr lhs : node.lhs()) {
                if (lhs instanceof Ident id) {
                    add(id, Role.DECLARATION);
                } else {
                    value(lhs);
                }
            }
        } else {
            for (Expr lhs : node.lhs()) {
                target(lhs);
            }
        }
        values(node.rhs());
        return null;
    }

    @Override
    public Void visitIncDecStmt(IncDecStmt node) {
        target(node.x());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node) {
        values(node.results());
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node) {
        value(node.init());
        value(node.cond());
        value(node.body());
        value(node.els());
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node) {
        value(node.init());
        value(node.cond());
        value(node.post());
        value(node.body());
        return null;
    }

    @Override
    public Void visitRangeStmt(RangeStmt node) {
        for (Expr e : new Expr[] {node.key(), node.value()}) {
            if (e == null) {
                continue;
            }
            if (":=".equals(node.tok()) && e instanceof Ident id) {
                add(id, Role.DECLARATION);
            } else {
                target(e);
            }
        }
        value(node.x());
        value(node.body());
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node) {
        value(node.init());
        value(node.tag());
        for (CaseClause clause : node.clauses()) {
            clause.accept(this);
        }
        return null;
    }

    @Override
    public Void visitTypeSwitchStmt(TypeSwitchStmt node) {
        value(node.init());
        value(node.assign());
        // в ветках перечислены типы, а не значения
        for (CaseClause clause : node.clauses()) {
            for (Expr e : clause.list()) {
                type(e);
            }
            values(clause.body());
        }
        return null;
    }

    @Override
    public Void visitSelectStmt(SelectStmt node) {
        for (CommClause clause : node.clauses()) {
            clause.accept(this);
        }
        return null;
    }

    @Override
    public Void visitDeclStmt(DeclStmt node) {
        node.decl().accept(this);
        return null;
    }

    @Override
    public Void visitGoStmt(GoStmt node) {
        value(node.call());
        return null;
    }

    @Override
    public Void visitDeferStmt(DeferStmt node) {
        value(node.call());
        return null;
    }

    @Override
    public Void visitBranchStmt(BranchStmt node) {
        add(node.label(), Role.NONE);
        return null;
    }

    @Override
    public Void visitSendStmt(SendStmt node) {
        value(node.chan());
        value(node.value());
        return null;
    }

    @Override
    public Void visitLabeledStmt(LabeledStmt node) {
        add(node.label(), Role.NONE);
        value(node.stmt());
        return null;
    }

    @Override
    public Void visitRawStmt(RawStmt node) {
        return null;
    }
}
