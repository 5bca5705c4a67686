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
package ru.nts.tools.goast.core.treesitter;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import ru.nts.tools.goast.ast.CaseClause;
import ru.nts.tools.goast.ast.CommClause;
import ru.nts.tools.goast.ast.Decl;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.*;
import ru.nts.tools.goast.ast.Field;
import ru.nts.tools.goast.ast.FieldList;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.Spec;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Span;
import ru.nts.tools.goast.ast.Stmt;
import ru.nts.tools.goast.ast.Stmt.*;
import ru.nts.tools.goast.core.DebugLog;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Преобразует конкретное дерево tree-sitter-go в неизменяемое AST.
 * Конструкции без структурной модели (type switch, select) сохраняются как сырой текст.
 * Дерево должно быть предварительно проверено {@link SyntaxChecker}.
 */
public final class GoTreeConverter {

    private final String unitName;
    private final byte[] contentBytes;

    public GoTreeConverter(String unitName, String content) {
        this.unitName = unitName;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    // ==================== Утилиты ====================

    /**
     * Извлекает текст узла (tree-sitter возвращает байтовые смещения, а не символьные).
     */
    private String text(TSNode node) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= contentBytes.length && start < end) {
            return new String(contentBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    private Span span(TSNode node) {
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        return new Span(
                new Position(start.getRow() + 1, start.getColumn() + 1, node.getStartByte()),
                new Position(end.getRow() + 1, end.getColumn() + 1, node.getEndByte()));
    }

    private static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    private static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return present(child) ? child : null;
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a != null && b != null
                && a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    /**
     * Именованные дочерние узлы без комментариев.
     */
    private static List<TSNode> named(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (present(child) && child.isNamed() && !child.getType().equals("comment")) {
                result.add(child);
            }
        }
        return result;
    }

    private static TSNode firstNamed(TSNode node) {
        List<TSNode> children = named(node);
        return children.isEmpty() ? null : children.get(0);
    }

    private static boolean hasToken(TSNode node, String token) {
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (present(child) && !child.isNamed() && child.getType().equals(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Последний безымянный дочерний узел с данным текстом токена.
     */
    private static TSNode lastToken(TSNode node, String token) {
        TSNode found = null;
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (present(child) && !child.isNamed() && child.getType().equals(token)) {
                found = child;
            }
        }
        return found;
    }

    private Ident ident(TSNode node) {
        return new Ident(text(node), span(node));
    }

    // ==================== Модуль и объявления ====================

    public GoFile convertFile(TSNode root) {
        Ident packageName = null;
        List<Decl> decls = new ArrayList<>();
        for (TSNode child : named(root)) {
            switch (child.getType()) {
                case "package_clause" -> {
                    TSNode name = firstNamed(child);
                    if (name != null) {
                        packageName = ident(name);
                    }
                }
                case "import_declaration" -> decls.add(importDecl(child));
                case "function_declaration", "method_declaration" -> decls.add(funcDecl(child));
                case "type_declaration", "var_declaration", "const_declaration" -> decls.add(genDecl(child));
                default -> DebugLog.log(unitName + ": skipping top-level " + child.getType());
            }
        }
        if (packageName == null) {
            packageName = new Ident("");
        }
        return new GoFile(packageName, decls, span(root));
    }

    private GenDecl importDecl(TSNode node) {
        List<Spec> specs = new ArrayList<>();
        boolean grouped = false;
        for (TSNode child : named(node)) {
            if (child.getType().equals("import_spec_list")) {
                grouped = true;
                for (TSNode spec : named(child)) {
                    if (spec.getType().equals("import_spec")) {
                        specs.add(importSpec(spec));
                    }
                }
            } else if (child.getType().equals("import_spec")) {
                specs.add(importSpec(child));
            }
        }
        return new GenDecl("import", specs, grouped, span(node));
    }

    private ImportSpec importSpec(TSNode node) {
        TSNode name = field(node, "name");
        TSNode path = field(node, "path");
        BasicLit pathLit = path != null
                ? new BasicLit(LitKind.STRING, text(path), span(path))
                : new BasicLit(LitKind.STRING, "\"\"", Span.NONE);
        return new ImportSpec(name != null ? ident(name) : null, pathLit, span(node));
    }

    private FuncDecl funcDecl(TSNode node) {
        TSNode receiver = field(node, "receiver");
        TSNode typeParams = field(node, "type_parameters");
        TSNode body = field(node, "body");
        FuncType type = new FuncType(paramList(field(node, "parameters")), results(field(node, "result")),
                span(node));
        return new FuncDecl(
                receiver != null ? paramList(receiver) : null,
                ident(field(node, "name")),
                typeParams != null ? typeParamList(typeParams) : null,
                type,
                body != null ? block(body) : null,
                span(node));
    }

    /**
     * type/var/const объявление, одиночное или сгруппированное.
     */
    private GenDecl genDecl(TSNode node) {
        String tok = switch (node.getType()) {
            case "type_declaration" -> "type";
            case "var_declaration" -> "var";
            default -> "const";
        };
        List<Spec> specs = new ArrayList<>();
        boolean grouped = hasToken(node, "(");
        for (TSNode child : named(node)) {
            String type = child.getType();
            if (type.endsWith("_spec_list")) {
                grouped = true;
                for (TSNode spec : named(child)) {
                    addSpec(spec, specs);
                }
            } else {
                addSpec(child, specs);
            }
        }
        return new GenDecl(tok, specs, grouped, span(node));
    }

    private void addSpec(TSNode node, List<Spec> specs) {
        switch (node.getType()) {
            case "type_spec" -> specs.add(typeSpec(node, false));
            case "type_alias" -> specs.add(typeSpec(node, true));
            case "var_spec", "const_spec" -> specs.add(valueSpec(node));
            default -> DebugLog.log(unitName + ": unexpected spec " + node.getType());
        }
    }

    private TypeSpec typeSpec(TSNode node, boolean alias) {
        TSNode typeParams = field(node, "type_parameters");
        return new TypeSpec(
                ident(field(node, "name")),
                typeParams != null ? typeParamList(typeParams) : null,
                alias,
                type(field(node, "type")),
                span(node));
    }

    private ValueSpec valueSpec(TSNode node) {
        List<Ident> names = new ArrayList<>();
        for (TSNode child : named(node)) {
            if (child.getType().equals("identifier")) {
                names.add(ident(child));
            }
        }
        TSNode type = field(node, "type");
        return new ValueSpec(names, type != null ? type(type) : null, exprList(field(node, "value")), span(node));
    }

    // ==================== Параметры и поля ====================

    private FieldList paramList(TSNode node) {
        if (node == null) {
            return FieldList.empty();
        }
        List<Field> fields = new ArrayList<>();
        for (TSNode child : named(node)) {
            switch (child.getType()) {
                case "parameter_declaration" -> {
                    List<Ident> names = new ArrayList<>();
                    for (TSNode part : named(child)) {
                        if (part.getType().equals("identifier")) {
                            names.add(ident(part));
                        }
                    }
                    fields.add(new Field(names, type(field(child, "type")), null, span(child)));
                }
                case "variadic_parameter_declaration" -> {
                    TSNode name = field(child, "name");
                    TSNode elt = field(child, "type");
                    Expr type = new Ellipsis(elt != null ? type(elt) : null, span(child));
                    fields.add(new Field(name != null ? List.of(ident(name)) : List.of(), type, null, span(child)));
                }
                default -> DebugLog.log(unitName + ": unexpected parameter " + child.getType());
            }
        }
        return new FieldList(fields, span(node));
    }

    private FieldList results(TSNode node) {
        if (node == null) {
            return null;
        }
        if (node.getType().equals("parameter_list")) {
            return paramList(node);
        }
        return new FieldList(List.of(new Field(List.of(), type(node), null, span(node))), span(node));
    }

    private FieldList typeParamList(TSNode node) {
        List<Field> fields = new ArrayList<>();
        for (TSNode child : named(node)) {
            if (!child.getType().equals("type_parameter_declaration")) {
                continue;
            }
            List<Ident> names = new ArrayList<>();
            for (TSNode part : named(child)) {
                if (part.getType().equals("identifier")) {
                    names.add(ident(part));
                }
            }
            fields.add(new Field(names, type(field(child, "type")), null, span(child)));
        }
        return new FieldList(fields, span(node));
    }

    private FieldList structFields(TSNode node) {
        List<Field> fields = new ArrayList<>();
        TSNode list = null;
        for (TSNode child : named(node)) {
            if (child.getType().equals("field_declaration_list")) {
                list = child;
            }
        }
        if (list == null) {
            return new FieldList(fields, span(node));
        }
        for (TSNode decl : named(list)) {
            if (!decl.getType().equals("field_declaration")) {
                continue;
            }
            List<Ident> names = new ArrayList<>();
            for (TSNode part : named(decl)) {
                if (part.getType().equals("field_identifier")) {
                    names.add(ident(part));
                }
            }
            Expr type = type(field(decl, "type"));
            if (names.isEmpty() && hasToken(decl, "*")) {
                // встроенное поле по указателю: *Base
                type = new StarExpr(type, span(decl));
            }
            TSNode tag = field(decl, "tag");
            BasicLit tagLit = tag != null ? new BasicLit(LitKind.STRING, text(tag), span(tag)) : null;
            fields.add(new Field(names, type, tagLit, span(decl)));
        }
        return new FieldList(fields, span(list));
    }

    private FieldList interfaceElems(TSNode node) {
        List<Field> fields = new ArrayList<>();
        for (TSNode child : named(node)) {
            String kind = child.getType();
            if (kind.equals("method_elem") || kind.equals("method_spec")) {
                FuncType fn = new FuncType(paramList(field(child, "parameters")), results(field(child, "result")),
                        span(child));
                fields.add(new Field(List.of(ident(field(child, "name"))), fn, null, span(child)));
            } else {
                fields.add(new Field(List.of(), type(child), null, span(child)));
            }
        }
        return new FieldList(fields, span(node));
    }

    // ==================== Типы ====================

    private Expr type(TSNode node) {
        if (node == null) {
            return new RawExpr("", Span.NONE);
        }
        return expr(node);
    }

    private List<Expr> typeArgs(TSNode node) {
        List<Expr> args = new ArrayList<>();
        if (node != null) {
            for (TSNode child : named(node)) {
                args.add(expr(child));
            }
        }
        return args;
    }

    private ChanDir chanDir(TSNode node) {
        TSNode first = node.getChild(0);
        if (present(first) && first.getType().equals("<-")) {
            return ChanDir.RECV;
        }
        return hasToken(node, "<-") ? ChanDir.SEND : ChanDir.BOTH;
    }

    // ==================== Выражения ====================

    private List<Expr> exprList(TSNode node) {
        List<Expr> result = new ArrayList<>();
        if (node == null) {
            return result;
        }
        if (node.getType().equals("expression_list")) {
            for (TSNode child : named(node)) {
                result.add(expr(child));
            }
        } else {
            result.add(expr(node));
        }
        return result;
    }

    /**
     * Выражение или тип (в Go типы допустимы в позиции выражения, например в make).
     */
    Expr expr(TSNode node) {
        Span span = span(node);
        switch (node.getType()) {
            case "identifier", "field_identifier", "package_identifier", "type_identifier", "label_name",
                 "blank_identifier", "true", "false", "nil", "iota", "dot" -> {
                return new Ident(text(node), span);
            }
            case "int_literal" -> {
                return new BasicLit(LitKind.INT, text(node), span);
            }
            case "float_literal" -> {
                return new BasicLit(LitKind.FLOAT, text(node), span);
            }
            case "imaginary_literal" -> {
                return new BasicLit(LitKind.IMAG, text(node), span);
            }
            case "rune_literal" -> {
                return new BasicLit(LitKind.CHAR, text(node), span);
            }
            case "interpreted_string_literal", "raw_string_literal" -> {
                return new BasicLit(LitKind.STRING, text(node), span);
            }
            case "selector_expression" -> {
                return new SelectorExpr(expr(field(node, "operand")), ident(field(node, "field")), span);
            }
            case "call_expression" -> {
                return call(node, span);
            }
            case "composite_literal" -> {
                TSNode body = field(node, "body");
                return new CompositeLit(type(field(node, "type")),
                        body != null ? literalElements(body) : List.of(), span);
            }
            case "literal_value" -> {
                return new CompositeLit(null, literalElements(node), span);
            }
            case "literal_element", "parenthesized_type", "type_elem", "type_constraint", "constraint_elem" -> {
                List<TSNode> children = named(node);
                if (children.size() == 1) {
                    return expr(children.get(0));
                }
                return raw(node);
            }
            case "keyed_element" -> {
                List<TSNode> children = named(node);
                TSNode key = field(node, "key");
                TSNode value = field(node, "value");
                if (key == null && !children.isEmpty()) key = children.get(0);
                if (value == null && children.size() > 1) value = children.get(children.size() - 1);
                return new KeyValueExpr(expr(key), expr(value), span);
            }
            case "func_literal" -> {
                FuncType type = new FuncType(paramList(field(node, "parameters")), results(field(node, "result")),
                        span);
                return new FuncLit(type, block(field(node, "body")), span);
            }
            case "unary_expression" -> {
                String op = text(field(node, "operator"));
                Expr operand = expr(field(node, "operand"));
                return op.equals("*") ? new StarExpr(operand, span) : new UnaryExpr(op, operand, span);
            }
            case "binary_expression" -> {
                return new BinaryExpr(expr(field(node, "left")), text(field(node, "operator")),
                        expr(field(node, "right")), span);
            }
            case "parenthesized_expression" -> {
                return new ParenExpr(expr(firstNamed(node)), span);
            }
            case "index_expression" -> {
                return new IndexExpr(expr(field(node, "operand")), List.of(expr(field(node, "index"))), span);
            }
            case "slice_expression" -> {
                return new SliceExpr(expr(field(node, "operand")), optional(field(node, "start")),
                        optional(field(node, "end")), optional(field(node, "capacity")), span);
            }
            case "type_assertion_expression" -> {
                return new TypeAssertExpr(expr(field(node, "operand")), type(field(node, "type")), span);
            }
            case "type_conversion_expression" -> {
                return new CallExpr(type(field(node, "type")), List.of(expr(field(node, "operand"))), false, span);
            }
            case "generic_type" -> {
                return new IndexExpr(type(field(node, "type")), typeArgs(field(node, "type_arguments")), span);
            }
            case "qualified_type" -> {
                return new SelectorExpr(ident(field(node, "package")), ident(field(node, "name")), span);
            }
            case "pointer_type" -> {
                return new StarExpr(type(firstNamed(node)), span);
            }
            case "slice_type" -> {
                return new ArrayType(null, type(field(node, "element")), span);
            }
            case "array_type" -> {
                return new ArrayType(expr(field(node, "length")), type(field(node, "element")), span);
            }
            case "implicit_length_array_type" -> {
                return new ArrayType(new Ellipsis(null, Span.NONE), type(field(node, "element")), span);
            }
            case "map_type" -> {
                return new MapType(type(field(node, "key")), type(field(node, "value")), span);
            }
            case "channel_type" -> {
                return new ChanType(chanDir(node), type(field(node, "value")), span);
            }
            case "function_type" -> {
                return new FuncType(paramList(field(node, "parameters")), results(field(node, "result")), span);
            }
            case "struct_type" -> {
                return new StructType(structFields(node), span);
            }
            case "interface_type" -> {
                return new InterfaceType(interfaceElems(node), span);
            }
            default -> {
                return raw(node);
            }
        }
    }

    private Expr optional(TSNode node) {
        return node != null ? expr(node) : null;
    }

    private RawExpr raw(TSNode node) {
        DebugLog.log(unitName + ": keeping " + node.getType() + " as raw text at line "
                + (node.getStartPoint().getRow() + 1));
        return new RawExpr(text(node), span(node));
    }

    private CallExpr call(TSNode node, Span span) {
        Expr fun = expr(field(node, "function"));
        TSNode typeArgs = field(node, "type_arguments");
        if (typeArgs != null) {
            fun = new IndexExpr(fun, typeArgs(typeArgs), span(typeArgs));
        }
        List<Expr> args = new ArrayList<>();
        boolean ellipsis = false;
        TSNode argList = field(node, "arguments");
        if (argList != null) {
            ellipsis = hasToken(argList, "...");
            for (TSNode arg : named(argList)) {
                if (arg.getType().equals("variadic_argument")) {
                    ellipsis = true;
                    args.add(expr(firstNamed(arg)));
                } else {
                    args.add(expr(arg));
                }
            }
        }
        return new CallExpr(fun, args, ellipsis, span);
    }

    private List<Expr> literalElements(TSNode literalValue) {
        List<Expr> elements = new ArrayList<>();
        for (TSNode child : named(literalValue)) {
            elements.add(expr(child));
        }
        return elements;
    }

    // ==================== Операторы ====================

    private BlockStmt block(TSNode node) {
        if (node == null) {
            return new BlockStmt(List.of(), Span.NONE);
        }
        return new BlockStmt(statements(named(node)), span(node));
    }

    /**
     * Операторы из списка узлов; узлы statement_list разворачиваются.
     */
    private List<Stmt> statements(List<TSNode> nodes) {
        List<Stmt> result = new ArrayList<>();
        for (TSNode child : nodes) {
            if (child.getType().equals("statement_list")) {
                result.addAll(statements(named(child)));
                continue;
            }
            Stmt stmt = stmt(child);
            if (stmt != null) {
                result.add(stmt);
            }
        }
        return result;
    }

    private Stmt simpleStmt(TSNode node) {
        return node != null ? stmt(node) : null;
    }

    /**
     * Оператор; null для пустого оператора.
     */
    Stmt stmt(TSNode node) {
        Span span = span(node);
        switch (node.getType()) {
            case "expression_statement" -> {
                return new ExprStmt(expr(firstNamed(node)), span);
            }
            case "short_var_declaration" -> {
                return new AssignStmt(exprList(field(node, "left")), ":=", exprList(field(node, "right")), span);
            }
            case "assignment_statement" -> {
                return new AssignStmt(exprList(field(node, "left")), text(field(node, "operator")),
                        exprList(field(node, "right")), span);
            }
            case "inc_statement" -> {
                return new IncDecStmt(expr(firstNamed(node)), "++", span);
            }
            case "dec_statement" -> {
                return new IncDecStmt(expr(firstNamed(node)), "--", span);
            }
            case "send_statement" -> {
                return new SendStmt(expr(field(node, "channel")), expr(field(node, "value")), span);
            }
            case "return_statement" -> {
                TSNode values = firstNamed(node);
                return new ReturnStmt(exprList(values), span);
            }
            case "if_statement" -> {
                TSNode alternative = field(node, "alternative");
                return new IfStmt(simpleStmt(field(node, "initializer")), expr(field(node, "condition")),
                        block(field(node, "consequence")), alternative != null ? stmt(alternative) : null, span);
            }
            case "for_statement" -> {
                return forStmt(node, span);
            }
            case "expression_switch_statement" -> {
                return switchStmt(node, span);
            }
            case "type_switch_statement" -> {
                return typeSwitchStmt(node, span);
            }
            case "select_statement" -> {
                return selectStmt(node, span);
            }
            case "receive_statement" -> {
                return receiveStmt(node, span);
            }
            case "go_statement" -> {
                return new GoStmt(expr(firstNamed(node)), span);
            }
            case "defer_statement" -> {
                return new DeferStmt(expr(firstNamed(node)), span);
            }
            case "break_statement", "continue_statement", "goto_statement" -> {
                TSNode label = firstNamed(node);
                String tok = node.getType().substring(0, node.getType().indexOf('_'));
                return new BranchStmt(tok, label != null ? ident(label) : null, span);
            }
            case "fallthrough_statement" -> {
                return new BranchStmt("fallthrough", null, span);
            }
            case "labeled_statement" -> {
                List<TSNode> children = named(node);
                Stmt inner = children.size() > 1 ? stmt(children.get(1)) : null;
                return new LabeledStmt(ident(field(node, "label")), inner, span);
            }
            case "block" -> {
                return block(node);
            }
            case "var_declaration", "const_declaration", "type_declaration" -> {
                return new DeclStmt(genDecl(node), span);
            }
            case "empty_statement" -> {
                return null;
            }
            default -> {
                DebugLog.log(unitName + ": keeping " + node.getType() + " as raw statement at line " + span.start().line());
                return new RawStmt(text(node), span);
            }
        }
    }

    private Stmt forStmt(TSNode node, Span span) {
        TSNode bodyNode = field(node, "body");
        BlockStmt body = block(bodyNode);
        TSNode header = null;
        for (TSNode child : named(node)) {
            if (!sameNode(child, bodyNode)) {
                header = child;
                break;
            }
        }
        if (header == null) {
            return new ForStmt(null, null, null, body, span);
        }
        switch (header.getType()) {
            case "for_clause" -> {
                return new ForStmt(simpleStmt(field(header, "initializer")), optional(field(header, "condition")),
                        simpleStmt(field(header, "update")), body, span);
            }
            case "range_clause" -> {
                List<Expr> left = exprList(field(header, "left"));
                String tok = left.isEmpty() ? null : (hasToken(header, ":=") ? ":=" : "=");
                Expr key = left.isEmpty() ? null : left.get(0);
                Expr value = left.size() > 1 ? left.get(1) : null;
                return new RangeStmt(key, value, tok, expr(field(header, "right")), body, span);
            }
            default -> {
                return new ForStmt(null, expr(header), null, body, span);
            }
        }
    }

    private Stmt switchStmt(TSNode node, Span span) {
        List<CaseClause> clauses = new ArrayList<>();
        for (TSNode child : named(node)) {
            String kind = child.getType();
            if (kind.equals("expression_case")) {
                TSNode values = field(child, "value");
                List<TSNode> body = new ArrayList<>();
                for (TSNode part : named(child)) {
                    if (!sameNode(part, values)) {
                        body.add(part);
                    }
                }
                clauses.add(new CaseClause(exprList(values), statements(body), span(child)));
            } else if (kind.equals("default_case")) {
                clauses.add(new CaseClause(List.of(), statements(named(child)), span(child)));
            }
        }
        return new SwitchStmt(simpleStmt(field(node, "initializer")), optional(field(node, "value")), clauses, span);
    }

    /**
     * {@code switch [init;] [t :=] x.(type) {...}}. Заголовок моделируется как
     * {@code t := x.(type)} либо {@code x.(type)}.
     */
    private Stmt typeSwitchStmt(TSNode node, Span span) {
        TSNode alias = field(node, "alias");
        if (alias == null && hasToken(node, ":=")) {
            for (TSNode child : named(node)) {
                if (child.getType().equals("expression_list")) {
                    alias = child;
                    break;
                }
            }
        }
        TSNode value = field(node, "value");
        TSNode close = lastToken(node, ")");
        Position end = close != null ? span(close).end() : span(value).end();
        Expr assertion = new TypeAssertExpr(expr(value), null, new Span(span(value).start(), end));
        Stmt assign;
        if (alias != null) {
            Span header = new Span(span(alias).start(), end);
            assign = new AssignStmt(exprList(alias), ":=", List.of(assertion), header);
        } else {
            assign = new ExprStmt(assertion, assertion.span());
        }
        List<CaseClause> clauses = new ArrayList<>();
        for (TSNode child : named(node)) {
            String kind = child.getType();
            if (kind.equals("type_case")) {
                clauses.add(typeCase(child));
            } else if (kind.equals("default_case")) {
                clauses.add(new CaseClause(List.of(), statements(named(child)), span(child)));
            }
        }
        return new TypeSwitchStmt(simpleStmt(field(node, "initializer")), assign, clauses, span);
    }

    /**
     * Типы ветки стоят до двоеточия, операторы после него.
     */
    private CaseClause typeCase(TSNode node) {
        List<Expr> types = new ArrayList<>();
        List<TSNode> body = new ArrayList<>();
        boolean afterColon = false;
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (!present(child) || child.getType().equals("comment")) {
                continue;
            }
            if (!child.isNamed()) {
                afterColon |= child.getType().equals(":");
            } else if (afterColon) {
                body.add(child);
            } else {
                types.add(type(child));
            }
        }
        return new CaseClause(types, statements(body), span(node));
    }

    private Stmt selectStmt(TSNode node, Span span) {
        List<CommClause> clauses = new ArrayList<>();
        for (TSNode child : named(node)) {
            String kind = child.getType();
            if (kind.equals("communication_case")) {
                TSNode comm = field(child, "communication");
                List<TSNode> body = new ArrayList<>();
                for (TSNode part : named(child)) {
                    if (!sameNode(part, comm)) {
                        body.add(part);
                    }
                }
                clauses.add(new CommClause(comm != null ? stmt(comm) : null, statements(body), span(child)));
            } else if (kind.equals("default_case")) {
                clauses.add(new CommClause(null, statements(named(child)), span(child)));
            }
        }
        return new SelectStmt(clauses, span);
    }

    /**
     * {@code v, ok := <-ch}, {@code v = <-ch} или просто {@code <-ch}.
     */
    private Stmt receiveStmt(TSNode node, Span span) {
        TSNode left = field(node, "left");
        Expr right = expr(field(node, "right"));
        if (left == null) {
            return new ExprStmt(right, span);
        }
        String tok = hasToken(node, ":=") ? ":=" : "=";
        return new AssignStmt(exprList(left), tok, List.of(right), span);
    }
}
