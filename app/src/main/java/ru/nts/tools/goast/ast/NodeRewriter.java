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

import java.util.ArrayList;
import java.util.List;

/**
 * Перестраивает дерево, создавая новый экземпляр каждого узла.
 * Без переопределений дает глубокую копию; наследники подменяют отдельные узлы.
 * Позиции исходных узлов сохраняются в копии.
 */
public class NodeRewriter implements NodeVisitor<Node> {

    /**
     * Глубокая копия узла.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Node> T copy(T node) {
        return node == null ? null : (T) node.accept(new NodeRewriter());
    }

    @SuppressWarnings("unchecked")
    public <T extends Node> T rewrite(T node) {
        return node == null ? null : (T) node.accept(this);
    }

    protected Expr expr(Expr e) {
        return e == null ? null : (Expr) e.accept(this);
    }

    protected Stmt stmt(Stmt s) {
        return s == null ? null : (Stmt) s.accept(this);
    }

    protected Ident ident(Ident id) {
        return id == null ? null : (Ident) id.accept(this);
    }

    protected BlockStmt block(BlockStmt b) {
        return b == null ? null : (BlockStmt) b.accept(this);
    }

    protected FieldList fields(FieldList f) {
        return f == null ? null : (FieldList) f.accept(this);
    }

    protected FuncType funcType(FuncType t) {
        return t == null ? null : (FuncType) t.accept(this);
    }

    protected BasicLit lit(BasicLit lit) {
        return lit == null ? null : (BasicLit) lit.accept(this);
    }

    protected List<Expr> exprs(List<Expr> list) {
        List<Expr> result = new ArrayList<>(list.size());
        for (Expr e : list) {
            result.add(expr(e));
        }
        return result;
    }

    protected List<Ident> idents(List<Ident> list) {
        List<Ident> result = new ArrayList<>(list.size());
        for (Ident id : list) {
            result.add(ident(id));
        }
        return result;
    }

    /**
     * Перестраивает список операторов блока или ветки switch.
     * Наследники переопределяют метод, чтобы удалять или вставлять операторы.
     */
    protected List<Stmt> stmts(List<Stmt> list) {
        List<Stmt> result = new ArrayList<>(list.size());
        for (Stmt s : list) {
            result.add(stmt(s));
        }
        return result;
    }

    @Override
    public Node visitGoFile(GoFile node) {
        List<Decl> decls = new ArrayList<>(node.decls().size());
        for (Decl d : node.decls()) {
            decls.add((Decl) d.accept(this));
        }
        return new GoFile(ident(node.packageName()), decls, node.span());
    }

    @Override
    public Node visitFuncDecl(FuncDecl node) {
        return new FuncDecl(fields(node.recv()), ident(node.name()), fields(node.typeParams()),
                funcType(node.type()), block(node.body()), node.span());
    }

    @Override
    public Node visitGenDecl(GenDecl node) {
        List<Spec> specs = new ArrayList<>(node.specs().size());
        for (Spec s : node.specs()) {
            specs.add((Spec) s.accept(this));
        }
        return new GenDecl(node.tok(), specs, node.grouped(), node.span());
    }

    @Override
    public Node visitImportSpec(ImportSpec node) {
        return new ImportSpec(ident(node.name()), lit(node.path()), node.span());
    }

    @Override
    public Node visitValueSpec(ValueSpec node) {
        return new ValueSpec(idents(node.names()), expr(node.type()), exprs(node.values()), node.span());
    }

    @Override
    public Node visitTypeSpec(TypeSpec node) {
        return new TypeSpec(ident(node.name()), fields(node.typeParams()), node.alias(), expr(node.type()),
                node.span());
    }

    @Override
    public Node visitField(Field node) {
        return new Field(idents(node.names()), expr(node.type()), lit(node.tag()), node.span());
    }

    @Override
    public Node visitFieldList(FieldList node) {
        List<Field> list = new ArrayList<>(node.list().size());
        for (Field f : node.list()) {
            list.add((Field) f.accept(this));
        }
        return new FieldList(list, node.span());
    }

    @Override
    public Node visitCaseClause(CaseClause node) {
        return new CaseClause(exprs(node.list()), stmts(node.body()), node.span());
    }

    @Override
    public Node visitCommClause(CommClause node) {
        return new CommClause(stmt(node.comm()), stmts(node.body()), node.span());
    }

    @Override
    public Node visitIdent(Ident node) {
        return new Ident(node.name(), node.span());
    }

    @Override
    public Node visitBasicLit(BasicLit node) {
        return new BasicLit(node.kind(), node.value(), node.span());
    }

    @Override
    public Node visitSelectorExpr(SelectorExpr node) {
        return new SelectorExpr(expr(node.x()), ident(node.sel()), node.span());
    }

    @Override
    public Node visitCallExpr(CallExpr node) {
        return new CallExpr(expr(node.fun()), exprs(node.args()), node.ellipsis(), node.span());
    }

    @Override
    public Node visitCompositeLit(CompositeLit node) {
        return new CompositeLit(expr(node.type()), exprs(node.elts()), node.span());
    }

    @Override
    public Node visitKeyValueExpr(KeyValueExpr node) {
        return new KeyValueExpr(expr(node.key()), expr(node.value()), node.span());
    }

    @Override
    public Node visitUnaryExpr(UnaryExpr node) {
        return new UnaryExpr(node.op(), expr(node.x()), node.span());
    }

    @Override
    public Node visitBinaryExpr(BinaryExpr node) {
        return new BinaryExpr(expr(node.x()), node.op(), expr(node.y()), node.span());
    }

    @Override
    public Node visitParenExpr(ParenExpr node) {
        return new ParenExpr(expr(node.x()), node.span());
    }

    @Override
    public Node visitStarExpr(StarExpr node) {
        return new StarExpr(expr(node.x()), node.span());
    }

    @Override
    public Node visitIndexExpr(IndexExpr node) {
        return new IndexExpr(expr(node.x()), exprs(node.indices()), node.span());
    }

    @Override
    public Node visitSliceExpr(SliceExpr node) {
        return new SliceExpr(expr(node.x()), expr(node.low()), expr(node.high()), expr(node.max()), node.span());
    }

    @Override
    public Node visitTypeAssertExpr(TypeAssertExpr node) {
        return new TypeAssertExpr(expr(node.x()), expr(node.type()), node.span());
    }

    @Override
    public Node visitArrayType(ArrayType node) {
        return new ArrayType(expr(node.len()), expr(node.elt()), node.span());
    }

    @Override
    public Node visitMapType(MapType node) {
        return new MapType(expr(node.key()), expr(node.value()), node.span());
    }

    @Override
    public Node visitChanType(ChanType node) {
        return new ChanType(node.dir(), expr(node.value()), node.span());
    }

    @Override
    public Node visitFuncType(FuncType node) {
        return new FuncType(fields(node.params()), fields(node.results()), node.span());
    }

    @Override
    public Node visitStructType(StructType node) {
        return new StructType(fields(node.fields()), node.span());
    }

    @Override
    public Node visitInterfaceType(InterfaceType node) {
        return new InterfaceType(fields(node.methods()), node.span());
    }

    @Override
    public Node visitEllipsis(Ellipsis node) {
        return new Ellipsis(expr(node.elt()), node.span());
    }

    @Override
    public Node visitFuncLit(FuncLit node) {
        return new FuncLit(funcType(node.type()), block(node.body()), node.span());
    }

    @Override
    public Node visitRawExpr(RawExpr node) {
        return new RawExpr(node.text(), node.span());
    }

    @Override
    public Node visitBlockStmt(BlockStmt node) {
        return new BlockStmt(stmts(node.list()), node.span());
    }

    @Override
    public Node visitExprStmt(ExprStmt node) {
        return new ExprStmt(expr(node.x()), node.span());
    }

    @Override
    public Node visitAssignStmt(AssignStmt node) {
        return new AssignStmt(exprs(node.lhs()), node.tok(), exprs(node.rhs()), node.span());
    }

    @Override
    public Node visitIncDecStmt(IncDecStmt node) {
        return new IncDecStmt(expr(node.x()), node.tok(), node.span());
    }

    @Override
    public Node visitReturnStmt(ReturnStmt node) {
        return new ReturnStmt(exprs(node.results()), node.span());
    }

    @Override
    public Node visitIfStmt(IfStmt node) {
        return new IfStmt(stmt(node.init()), expr(node.cond()), block(node.body()), stmt(node.els()), node.span());
    }

    @Override
    public Node visitForStmt(ForStmt node) {
        return new ForStmt(stmt(node.init()), expr(node.cond()), stmt(node.post()), block(node.body()), node.span());
    }

    @Override
    public Node visitRangeStmt(RangeStmt node) {
        return new RangeStmt(expr(node.key()), expr(node.value()), node.tok(), expr(node.x()), block(node.body()),
                node.span());
    }

    @Override
    public Node visitSwitchStmt(SwitchStmt node) {
        List<CaseClause> clauses = new ArrayList<>(node.clauses().size());
        for (CaseClause c : node.clauses()) {
            clauses.add((CaseClause) c.accept(this));
        }
        return new SwitchStmt(stmt(node.init()), expr(node.tag()), clauses, node.span());
    }

    @Override
    public Node visitTypeSwitchStmt(TypeSwitchStmt node) {
        List<CaseClause> clauses = new ArrayList<>(node.clauses().size());
        for (CaseClause c : node.clauses()) {
            clauses.add((CaseClause) c.accept(this));
        }
        return new TypeSwitchStmt(stmt(node.init()), stmt(node.assign()), clauses, node.span());
    }

    @Override
    public Node visitSelectStmt(SelectStmt node) {
        List<CommClause> clauses = new ArrayList<>(node.clauses().size());
        for (CommClause c : node.clauses()) {
            clauses.add((CommClause) c.accept(this));
        }
        return new SelectStmt(clauses, node.span());
    }

    @Override
    public Node visitDeclStmt(DeclStmt node) {
        return new DeclStmt((GenDecl) node.decl().accept(this), node.span());
    }

    @Override
    public Node visitGoStmt(GoStmt node) {
        return new GoStmt(expr(node.call()), node.span());
    }

    @Override
    public Node visitDeferStmt(DeferStmt node) {
        return new DeferStmt(expr(node.call()), node.span());
    }

    @Override
    public Node visitBranchStmt(BranchStmt node) {
        return new BranchStmt(node.tok(), ident(node.label()), node.span());
    }

    @Override
    public Node visitSendStmt(SendStmt node) {
        return new SendStmt(expr(node.chan()), expr(node.value()), node.span());
    }

    @Override
    public Node visitLabeledStmt(LabeledStmt node) {
        return new LabeledStmt(ident(node.label()), stmt(node.stmt()), node.span());
    }

    @Override
    public Node visitRawStmt(RawStmt node) {
        return new RawStmt(node.text(), node.span());
    }
}
