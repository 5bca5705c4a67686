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
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Печать дерева в исходный текст Go в стиле gofmt: отступы табами,
 * пустая строка между объявлениями верхнего уровня, {@code struct{}} для пустых структур.
 * Выравнивание колонок полей не выполняется.
 */
public final class GoPrinter implements NodeVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int indent;

    private GoPrinter() {}

    /**
     * Печатает любой узел. Для {@link GoFile} результат завершается переводом строки.
     */
    public static String print(Node node) {
        if (node == null) {
            throw GoAstException.invalidSource("cannot print a null node");
        }
        GoPrinter printer = new GoPrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    public static String print(ParsedUnit unit) {
        return print(unit.file());
    }

    /**
     * Печатает модуль и записывает его в файл (UTF-8).
     */
    public static void write(GoFile file, Path path) {
        if (file == null) {
            throw GoAstException.invalidSource("cannot write a null file");
        }
        if (path == null) {
            throw GoAstException.invalidSource("output path is empty");
        }
        try {
            Files.writeString(path, print(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GoAstException(GoAstErrorCode.IO_ERROR, Map.of("path", path.toString()), e);
        }
    }

    // ---------- helpers ----------

    private void newline() {
        out.append('\n');
        for (int i = 0; i < indent; i++) {
            out.append('\t');
        }
    }

    private void node(Node n) {
        if (n != null) {
            n.accept(this);
        }
    }

    private void list(List<? extends Node> nodes, String separator) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            node(nodes.get(i));
        }
    }

    private void names(List<Ident> names) {
        list(names, ", ");
    }

    private void statements(List<Stmt> stmts) {
        indent++;
        for (Stmt s : stmts) {
            if (s instanceof LabeledStmt) {
                indent--;
                newline();
                indent++;
            } else {
                newline();
            }
            node(s);
        }
        indent--;
    }

    /**
     * Параметры в скобках: {@code (a, b int, c ...string)}.
     */
    private void params(FieldList params) {
        out.append('(');
        if (params != null) {
            list(params.list(), ", ");
        }
        out.append(')');
    }

    private void typeParams(FieldList typeParams) {
        if (typeParams != null && !typeParams.isEmpty()) {
            out.append('[');
            list(typeParams.list(), ", ");
            out.append(']');
        }
    }

    private void results(FieldList results) {
        if (results == null || results.isEmpty()) {
            return;
        }
        out.append(' ');
        if (results.list().size() == 1 && results.list().get(0).names().isEmpty()) {
            node(results.list().get(0).type());
        } else {
            params(results);
        }
    }

    private void signature(FuncType type) {
        params(type.params());
        results(type.results());
    }

    private void spec(Spec spec) {
        node(spec);
    }

    // ---------- file & declarations ----------

    @Override
    public Void visitGoFile(GoFile node) {
        out.append("package ");
        node(node.packageName());
        out.append('\n');
        for (Decl decl : node.decls()) {
            out.append('\n');
            node(decl);
            out.append('\n');
        }
        return null;
    }

    @Override
    public Void visitFuncDecl(FuncDecl node) {
        out.append("func ");
        if (node.recv() != null) {
            params(node.recv());
            out.append(' ');
        }
        node(node.name());
        typeParams(node.typeParams());
        signature(node.type());
        if (node.body() != null) {
            out.append(' ');
            node(node.body());
        }
        return null;
    }

    @Override
    public Void visitGenDecl(GenDecl node) {
        out.append(node.tok()).append(' ');
        if (node.grouped() || node.specs().size() != 1) {
            out.append('(');
            indent++;
            for (Spec spec : node.specs()) {
                newline();
                spec(spec);
            }
            indent--;
            newline();
            out.append(')');
        } else {
            spec(node.specs().get(0));
        }
        return null;
    }

    @Override
    public Void visitImportSpec(ImportSpec node) {
        if (node.name() != null) {
            node(node.name());
            out.append(' ');
        }
        node(node.path());
        return null;
    }

    @Override
    public Void visitValueSpec(ValueSpec node) {
        names(node.names());
        if (node.type() != null) {
            out.append(' ');
            node(node.type());
        }
        if (!node.values().isEmpty()) {
            out.append(" = ");
            list(node.values(), ", ");
        }
        return null;
    }

    @Override
    public Void visitTypeSpec(TypeSpec node) {
        node(node.name());
        typeParams(node.typeParams());
        out.append(node.alias() ? " = " : " ");
        node(node.type());
        return null;
    }

    @Override
    public Void visitField(Field node) {
        names(node.names());
        if (!node.names().isEmpty() && node.type() != null) {
            out.append(' ');
        }
        node(node.type());
        if (node.tag() != null) {
            out.append(' ');
            node(node.tag());
        }
        return null;
    }

    @Override
    public Void visitFieldList(FieldList node) {
        params(node);
        return null;
    }

    @Override
    public Void visitCaseClause(CaseClause node) {
        if (node.isDefault()) {
            out.append("default:");
        } else {
            out.append("case ");
            list(node.list(), ", ");
            out.append(':');
        }
        statements(node.body());
        return null;
    }

    @Override
    public Void visitCommClause(CommClause node) {
        if (node.isDefault()) {
            out.append("default:");
        } else {
            out.append("case ");
            node(node.comm());
            out.append(':');
        }
        statements(node.body());
        return null;
    }

    // ---------- expressions ----------

    @Override
    public Void visitIdent(Ident node) {
        out.append(node.name());
        return null;
    }

    @Override
    public Void visitBasicLit(BasicLit node) {
        out.append(node.value());
        return null;
    }

    @Override
    public Void visitSelectorExpr(SelectorExpr node) {
        node(node.x());
        out.append('.');
        node(node.sel());
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node) {
        node(node.fun());
        out.append('(');
        list(node.args(), ", ");
        if (node.ellipsis()) {
            out.append("...");
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitCompositeLit(CompositeLit node) {
        node(node.type());
        out.append('{');
        list(node.elts(), ", ");
        out.append('}');
        return null;
    }

    @Override
    public Void visitKeyValueExpr(KeyValueExpr node) {
        node(node.key());
        out.append(": ");
        node(node.value());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node) {
        out.append(node.op());
        node(node.x());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node) {
        node(node.x());
        out.append(' ').append(node.op()).append(' ');
        node(node.y());
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node) {
        out.append('(');
        node(node.x());
        out.append(')');
        return null;
    }

    @Override
    public Void visitStarExpr(StarExpr node) {
        out.append('*');
        node(node.x());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node) {
        node(node.x());
        out.append('[');
        list(node.indices(), ", ");
        out.append(']');
        return null;
    }

    @Override
    public Void visitSliceExpr(SliceExpr node) {
        node(node.x());
        out.append('[');
        node(node.low());
        out.append(':');
        node(node.high());
        if (node.max() != null) {
            out.append(':');
            node(node.max());
        }
        out.append(']');
        return null;
    }

    @Override
    public Void visitTypeAssertExpr(TypeAssertExpr node) {
        node(node.x());
        out.append(".(");
        if (node.type() == null) {
            out.append("type");
        } else {
            node(node.type());
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitArrayType(ArrayType node) {
        out.append('[');
        node(node.len());
        out.append(']');
        node(node.elt());
        return null;
    }

    @Override
    public Void visitMapType(MapType node) {
        out.append("map[");
        node(node.key());
        out.append(']');
        node(node.value());
        return null;
    }

    @Override
    public Void visitChanType(ChanType node) {
        switch (node.dir()) {
            case SEND -> out.append("chan<- ");
            case RECV -> out.append("<-chan ");
            case BOTH -> out.append("chan ");
        }
        node(node.value());
        return null;
    }

    @Override
    public Void visitFuncType(FuncType node) {
        out.append("func");
        signature(node);
        return null;
    }

    @Override
    public Void visitStructType(StructType node) {
        if (node.fields() == null || node.fields().isEmpty()) {
            out.append("struct{}");
            return null;
        }
        out.append("struct {");
        indent++;
        for (Field field : node.fields().list()) {
            newline();
            node(field);
        }
        indent--;
        newline();
        out.append('}');
        return null;
    }

    @Override
    public Void visitInterfaceType(InterfaceType node) {
        if (node.methods() == null || node.methods().isEmpty()) {
            out.append("interface{}");
            return null;
        }
        out.append("interface {");
        indent++;
        for (Field method : node.methods().list()) {
            newline();
            if (method.names().size() == 1 && method.type() instanceof FuncType fn) {
                node(method.names().get(0));
                signature(fn);
            } else {
                node(method.type());
            }
        }
        indent--;
        newline();
        out.append('}');
        return null;
    }

    @Override
    public Void visitEllipsis(Ellipsis node) {
        out.append("...");
        node(node.elt());
        return null;
    }

    @Override
    public Void visitFuncLit(FuncLit node) {
        node(node.type());
        out.append(' ');
        node(node.body());
        return null;
    }

    @Override
    public Void visitRawExpr(RawExpr node) {
        out.append(node.text());
        return null;
    }

    // ---------- statements ----------

    @Override
    public Void visitBlockStmt(BlockStmt node) {
        out.append('{');
        statements(node.list());
        newline();
        out.append('}');
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node) {
        node(node.x());
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node) {
        list(node.lhs(), ", ");
        out.append(' ').append(node.tok()).append(' ');
        list(node.rhs(), ", ");
        return null;
    }

    @Override
    public Void visitIncDecStmt(IncDecStmt node) {
        node(node.x());
        out.append(node.tok());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node) {
        out.append("return");
        if (!node.results().isEmpty()) {
            out.append(' ');
            list(node.results(), ", ");
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node) {
        out.append("if ");
        if (node.init() != null) {
            node(node.init());
            out.append("; ");
        }
        node(node.cond());
        out.append(' ');
        node(node.body());
        if (node.els() != null) {
            out.append(" else ");
            node(node.els());
        }
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node) {
        out.append("for ");
        if (node.init() != null || node.post() != null) {
            node(node.init());
            out.append("; ");
            node(node.cond());
            out.append("; ");
            node(node.post());
            out.append(' ');
        } else if (node.cond() != null) {
            node(node.cond());
            out.append(' ');
        }
        node(node.body());
        return null;
    }

    @Override
    public Void visitRangeStmt(RangeStmt node) {
        out.append("for ");
        if (node.key() != null) {
            node(node.key());
            if (node.value() != null) {
                out.append(", ");
                node(node.value());
            }
            out.append(' ').append(node.tok()).append(' ');
        }
        out.append("range ");
        node(node.x());
        out.append(' ');
        node(node.body());
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node) {
        out.append("switch ");
        if (node.init() != null) {
            node(node.init());
            out.append("; ");
        }
        if (node.tag() != null) {
            node(node.tag());
            out.append(' ');
        }
        out.append('{');
        for (CaseClause clause : node.clauses()) {
            newline();
            node(clause);
        }
        newline();
        out.append('}');
        return null;
    }

    @Override
    public Void visitTypeSwitchStmt(TypeSwitchStmt node) {
        out.append("switch ");
        if (node.init() != null) {
            node(node.init());
            out.append("; ");
        }
        node(node.assign());
        out.append(" {");
        for (CaseClause clause : node.clauses()) {
            newline();
            node(clause);
        }
        newline();
        out.append('}');
        return null;
    }

    @Override
    public Void visitSelectStmt(SelectStmt node) {
        out.append("select {");
        for (CommClause clause : node.clauses()) {
            newline();
            node(clause);
        }
        newline();
        out.append('}');
        return null;
    }

    @Override
    public Void visitDeclStmt(DeclStmt node) {
        node(node.decl());
        return null;
    }

    @Override
    public Void visitGoStmt(GoStmt node) {
        out.append("go ");
        node(node.call());
        return null;
    }

    @Override
    public Void visitDeferStmt(DeferStmt node) {
        out.append("defer ");
        node(node.call());
        return null;
    }

    @Override
    public Void visitBranchStmt(BranchStmt node) {
        out.append(node.tok());
        if (node.label() != null) {
            out.append(' ');
            node(node.label());
        }
        return null;
    }

    @Override
    public Void visitSendStmt(SendStmt node) {
        node(node.chan());
        out.append(" <- ");
        node(node.value());
        return null;
    }

    @Override
    public Void visitLabeledStmt(LabeledStmt node) {
        node(node.label());
        out.append(':');
        if (node.stmt() != null) {
            newline();
            node(node.stmt());
        }
        return null;
    }

    @Override
    public Void visitRawStmt(RawStmt node) {
        out.append(node.text());
        return null;
    }
}
