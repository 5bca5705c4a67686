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

import ru.nts.tools.goast.ast.Ast;
import ru.nts.tools.goast.ast.CaseClause;
import ru.nts.tools.goast.ast.CommClause;
import ru.nts.tools.goast.ast.Decl;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.CompositeLit;
import ru.nts.tools.goast.ast.Expr.FuncLit;
import ru.nts.tools.goast.ast.Expr.FuncType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.IndexExpr;
import ru.nts.tools.goast.ast.Expr.InterfaceType;
import ru.nts.tools.goast.ast.Expr.StarExpr;
import ru.nts.tools.goast.ast.Expr.StructType;
import ru.nts.tools.goast.ast.Expr.UnaryExpr;
import ru.nts.tools.goast.ast.Field;
import ru.nts.tools.goast.ast.FieldList;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.Span;
import ru.nts.tools.goast.ast.Spec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Stmt;
import ru.nts.tools.goast.ast.Stmt.*;
import ru.nts.tools.goast.core.DebugLog;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Строит дерево областей видимости за один обход в глубину.
 * Используется только через {@link ScopeTree#build}.
 */
final class ScopeBuilder {

    private final List<Scope> scopes = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private final Map<Ident, Symbol> declarations = new IdentityHashMap<>();

    List<Scope> scopes() {
        return scopes;
    }

    List<Symbol> symbols() {
        return symbols;
    }

    Map<Ident, Symbol> declarations() {
        return declarations;
    }

    void build(GoFile file) {
        int root = open(-1, Scope.Kind.UNIT, file.span());
        declare(file.packageName(), SymbolKind.UNIT, root, null, Position.NONE);
        for (Decl decl : file.decls()) {
            if (decl instanceof FuncDecl fd) {
                funcDecl(fd, root);
            } else if (decl instanceof GenDecl gd) {
                genDecl(gd, root, null);
            }
        }
        DebugLog.log("Scope tree: " + scopes.size() + " scopes, " + symbols.size() + " symbols");
    }

    private int open(int parent, Scope.Kind kind, Span span) {
        int index = scopes.size();
        scopes.add(new Scope(index, parent, kind, span));
        if (parent >= 0) {
            scopes.get(parent).addChild(index);
        }
        return index;
    }

    private void declare(Ident ident, SymbolKind kind, int scope, Expr type, Position visibleFrom) {
        if (ident == null || ident.isBlank()) {
            return;
        }
        Position from = visibleFrom.isValid() ? visibleFrom : ident.span().start();
        Symbol symbol = new Symbol(ident.name(), kind, ident, scope, type, from);
        scopes.get(scope).put(symbol);
        symbols.add(symbol);
        declarations.put(ident, symbol);
    }

    private void funcDecl(FuncDecl fd, int scope) {
        declare(fd.name(), fd.isMethod() ? SymbolKind.METHOD : SymbolKind.FUNCTION, scope, fd.type(),
                Position.NONE);
        int fn = open(scope, Scope.Kind.FUNCTION, fd.span());
        Position start = fd.span().start();
        if (fd.recv() != null) {
            for (Field field : fd.recv().list()) {
                receiverTypeParams(field.type(), fn, start);
                for (Ident name : field.names()) {
                    declare(name, SymbolKind.VARIABLE, fn, field.type(), start);
                }
            }
        }
        typeParams(fd.typeParams(), fn, start);
        signature(fd.type(), fn, start);
        if (fd.body() != null) {
            stmts(fd.body().list(), fn);
        }
    }

    /**
     * {@code func (l *List[T]) ...}: T объявляется в области функции.
     */
    private void receiverTypeParams(Expr type, int scope, Position start) {
        Expr base = type instanceof StarExpr star ? star.x() : type;
        if (base instanceof IndexExpr idx) {
            for (Expr param : idx.indices()) {
                if (param instanceof Ident id) {
                    declare(id, SymbolKind.TYPE, scope, null, start);
                }
            }
        }
    }

    private void typeParams(FieldList params, int scope, Position start) {
        if (params == null) {
            return;
        }
        for (Field field : params.list()) {
            for (Ident name : field.names()) {
                declare(name, SymbolKind.TYPE, scope, field.type(), start);
            }
        }
    }

    private void signature(FuncType type, int scope, Position start) {
        if (type == null) {
            return;
        }
        for (FieldList list : new FieldList[] {type.params(), type.results()}) {
            if (list == null) {
                continue;
            }
            for (Field field : list.list()) {
                for (Ident name : field.names()) {
                    declare(name, SymbolKind.VARIABLE, scope, field.type(), start);
                }
            }
        }
    }

    /**
     * @param visibleFrom позиция видимости локальных var/const, null на уровне пакета
     */
    private void genDecl(GenDecl gd, int scope, Position visibleFrom) {
        for (Spec spec : gd.specs()) {
            if (spec instanceof ValueSpec vs) {
                for (Expr value : vs.values()) {
                    expr(value, scope);
                }
                SymbolKind kind = "const".equals(gd.tok()) ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
                for (int i = 0; i < vs.names().size(); i++) {
                    Expr type = vs.type();
                    if (type == null && vs.values().size() == vs.names().size()) {
                        type = literalType(vs.values().get(i));
                    }
                    declare(vs.names().get(i), kind, scope, type,
                            visibleFrom != null ? visibleFrom : Position.NONE);
                }
            } else if (spec instanceof TypeSpec ts) {
                typeSpec(ts, scope);
            }
        }
    }

    private void typeSpec(TypeSpec ts, int scope) {
        declare(ts.name(), SymbolKind.TYPE, scope, ts.type(), Position.NONE);
        if (ts.typeParams() != null && !ts.typeParams().isEmpty()) {
            int inner = open(scope, Scope.Kind.TYPE, ts.span());
            typeParams(ts.typeParams(), inner, ts.span().start());
        }
        members(ts.type(), scope);
    }

    /**
     * Поля структур и методы интерфейсов объявляются в области, содержащей тип.
     */
    private void members(Expr type, int scope) {
        if (type instanceof StructType st) {
            for (Field field : st.fields().list()) {
                for (Ident name : field.names()) {
                    declare(name, SymbolKind.FIELD, scope, field.type(), Position.NONE);
                }
                members(field.type(), scope);
            }
        } else if (type instanceof InterfaceType it) {
            for (Field field : it.methods().list()) {
                if (field.type() instanceof FuncType) {
                    for (Ident name : field.names()) {
                        declare(name, SymbolKind.METHOD, scope, field.type(), Position.NONE);
                    }
                }
            }
        }
    }

    private static Expr literalType(Expr value) {
        if (value instanceof CompositeLit lit) {
            return lit.type();
        }
        if (value instanceof UnaryExpr un && "&".equals(un.op()) && un.x() instanceof CompositeLit lit) {
            return new StarExpr(lit.type(), Span.NONE);
        }
        return null;
    }

    // Операторы

    private void stmts(List<Stmt> list, int scope) {
        for (Stmt s : list) {
            stmt(s, scope);
        }
    }

    private void stmt(Stmt s, int scope) {
        if (s == null) {
            return;
        }
        if (s instanceof BlockStmt block) {
            int inner = open(scope, Scope.Kind.BLOCK, block.span());
            stmts(block.list(), inner);
        } else if (s instanceof ExprStmt es) {
            expr(es.x(), scope);
        } else if (s instanceof AssignStmt as) {
            assign(as, scope);
        } else if (s instanceof IncDecStmt ids) {
            expr(ids.x(), scope);
        } else if (s instanceof ReturnStmt rs) {
            rs.results().forEach(e -> expr(e, scope));
        } else if (s instanceof IfStmt is) {
            int inner = open(scope, Scope.Kind.IF, is.span());
            stmt(is.init(), inner);
            expr(is.cond(), inner);
            stmt(is.body(), inner);
            stmt(is.els(), inner);
        } else if (s instanceof ForStmt fs) {
            int inner = open(scope, Scope.Kind.FOR, fs.span());
            stmt(fs.init(), inner);
            expr(fs.cond(), inner);
            stmt(fs.post(), inner);
            stmt(fs.body(), inner);
        } else if (s instanceof RangeStmt rs) {
            range(rs, scope);
        } else if (s instanceof SwitchStmt ss) {
            int inner = open(scope, Scope.Kind.SWITCH, ss.span());
            stmt(ss.init(), inner);
            expr(ss.tag(), inner);
            for (CaseClause clause : ss.clauses()) {
                int c = open(inner, Scope.Kind.CASE, clause.span());
                clause.list().forEach(e -> expr(e, c));
                stmts(clause.body(), c);
            }
        } else if (s instanceof TypeSwitchStmt ts) {
            typeSwitch(ts, scope);
        } else if (s instanceof SelectStmt sel) {
            int inner = open(scope, Scope.Kind.SELECT, sel.span());
            for (CommClause clause : sel.clauses()) {
                int c = open(inner, Scope.Kind.CASE, clause.span());
                stmt(clause.comm(), c);
                stmts(clause.body(), c);
            }
        } else if (s instanceof DeclStmt ds) {
            genDecl(ds.decl(), scope, ds.span().end());
        } else if (s instanceof GoStmt gs) {
            expr(gs.call(), scope);
        } else if (s instanceof DeferStmt dfs) {
            expr(dfs.call(), scope);
        } else if (s instanceof SendStmt ss) {
            expr(ss.chan(), scope);
            expr(ss.value(), scope);
        } else if (s instanceof LabeledStmt ls) {
            stmt(ls.stmt(), scope);
        }
    }

    private void assign(AssignStmt as, int scope) {
        as.rhs().forEach(e -> expr(e, scope));
        if (!as.isDefine()) {
            as.lhs().forEach(e -> expr(e, scope));
            return;
        }
        Scope current = scopes.get(scope);
        for (int i = 0; i < as.lhs().size(); i++) {
            if (!(as.lhs().get(i) instanceof Ident id)) {
                continue;
            }
            // a, err := ... повторно использует уже объявленный err
            if (current.lookupLocal(id.name()) != null) {
                continue;
            }
            Expr type = as.lhs().size() == as.rhs().size() ? literalType(as.rhs().get(i)) : null;
            declare(id, SymbolKind.VARIABLE, scope, type, as.span().end());
        }
    }

    /**
     * Переменная {@code t} из {@code switch t := x.(type)} объявляется один раз в области switch,
     * поэтому все ветки ссылаются на один символ.
     */
    private void typeSwitch(TypeSwitchStmt ts, int scope) {
        int inner = open(scope, Scope.Kind.SWITCH, ts.span());
        stmt(ts.init(), inner);
        stmt(ts.assign(), inner);
        for (CaseClause clause : ts.clauses()) {
            int c = open(inner, Scope.Kind.CASE, clause.span());
            clause.list().forEach(e -> expr(e, c));
            stmts(clause.body(), c);
        }
    }

    private void range(RangeStmt rs, int scope) {
        int inner = open(scope, Scope.Kind.RANGE, rs.span());
        expr(rs.x(), inner);
        if (":=".equals(rs.tok())) {
            Position from = rs.body() != null ? rs.body().span().start() : rs.span().end();
            for (Expr e : new Expr[] {rs.key(), rs.value()}) {
                if (e instanceof Ident id) {
                    declare(id, SymbolKind.VARIABLE, inner, null, from);
                }
            }
        } else {
            expr(rs.key(), inner);
            expr(rs.value(), inner);
        }
        stmt(rs.body(), inner);
    }

    /**
     * Выражения сами областей не открывают, кроме функциональных литералов.
     */
    private void expr(Expr e, int scope) {
        Ast.inspect(e, node -> {
            if (node instanceof FuncLit lit) {
                funcLit(lit, scope);
                return false;
            }
            return true;
        });
    }

    private void funcLit(FuncLit lit, int scope) {
        int fn = open(scope, Scope.Kind.FUNCTION, lit.span());
        signature(lit.type(), fn, lit.span().start());
        if (lit.body() != null) {
            stmts(lit.body().list(), fn);
        }
    }
}
