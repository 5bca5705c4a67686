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
package ru.nts.tools.goast.transform;

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.goast.ast.Decl;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Expr.CallExpr;
import ru.nts.tools.goast.ast.Expr.FuncType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.FieldList;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.GoNames;
import ru.nts.tools.goast.ast.NodeRewriter;
import ru.nts.tools.goast.ast.Span;
import ru.nts.tools.goast.ast.Stmt;
import ru.nts.tools.goast.ast.Stmt.BlockStmt;
import ru.nts.tools.goast.ast.Stmt.ExprStmt;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.core.GoAstException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Выделение операторов в новую функцию без параметров и результатов.
 * Параметры: {@code startLine}, {@code endLine} (включительно), {@code newName}.
 */
public class ExtractFunctionOperation implements TransformOperation {

    @Override
    public String getName() {
        return "extract";
    }

    @Override
    public void validateParams(JsonNode params) throws IllegalArgumentException {
        if (params == null || !params.has("startLine") || !params.has("endLine")) {
            throw new IllegalArgumentException("Parameters 'startLine' and 'endLine' are required");
        }
        if (!params.has("newName")) {
            throw new IllegalArgumentException("Parameter 'newName' is required for extract operation");
        }
        if (params.get("startLine").asInt() > params.get("endLine").asInt()) {
            throw new IllegalArgumentException("startLine must not be greater than endLine");
        }
    }

    @Override
    public GoFile execute(GoFile tree, JsonNode params) {
        return extract(tree, params.get("startLine").asInt(), params.get("endLine").asInt(),
                params.get("newName").asText());
    }

    public GoFile extract(GoFile tree, int startLine, int endLine, String newName) {
        if (tree == null) {
            throw GoAstException.invalidSource("tree is null");
        }
        if (startLine < 1 || endLine < startLine) {
            throw GoAstException.invalidSource("invalid line range " + startLine + "-" + endLine);
        }
        if (!GoNames.isIdentifier(newName)) {
            throw GoAstException.invalidSource("'" + newName + "' is not a valid Go identifier");
        }

        for (int i = 0; i < tree.decls().size(); i++) {
            if (!(tree.decls().get(i) instanceof FuncDecl fd) || fd.body() == null) {
                continue;
            }
            List<Stmt> selected = new ArrayList<>();
            for (Stmt s : fd.body().list()) {
                if (insideRange(s, startLine, endLine)) {
                    selected.add(s);
                }
            }
            if (!selected.isEmpty()) {
                DebugLog.log("Extracting " + selected.size() + " statement(s) from " + fd.name().name()
                        + " into " + newName);
                return rebuild(tree, i, selected, newName);
            }
        }
        throw GoAstException.noStatementsInRange(startLine, endLine);
    }

    private static boolean insideRange(Stmt s, int startLine, int endLine) {
        Span span = s.span();
        return span.isValid() && span.start().line() >= startLine && span.end().line() <= endLine;
    }

    private static GoFile rebuild(GoFile tree, int index, List<Stmt> selected, String newName) {
        FuncDecl enclosing = (FuncDecl) tree.decls().get(index);
        NodeRewriter copier = new NodeRewriter();

        Set<Stmt> chosen = Collections.newSetFromMap(new IdentityHashMap<>());
        chosen.addAll(selected);
        List<Stmt> remaining = new ArrayList<>();
        boolean callInserted = false;
        for (Stmt s : enclosing.body().list()) {
            if (!chosen.contains(s)) {
                remaining.add(copier.rewrite(s));
            } else if (!callInserted) {
                remaining.add(new ExprStmt(new CallExpr(new Ident(newName), List.of(), false, Span.NONE), Span.NONE));
                callInserted = true;
            }
        }
        FuncDecl updated = new FuncDecl(copier.rewrite(enclosing.recv()), copier.rewrite(enclosing.name()),
                copier.rewrite(enclosing.typeParams()), copier.rewrite(enclosing.type()),
                new BlockStmt(remaining, enclosing.body().span()), enclosing.span());

        List<Stmt> moved = new ArrayList<>();
        for (Stmt s : selected) {
            moved.add(copier.rewrite(s));
        }
        FuncDecl extracted = new FuncDecl(null, new Ident(newName), null,
                new FuncType(FieldList.empty(), null, Span.NONE), new BlockStmt(moved), Span.NONE);

        List<Decl> decls = new ArrayList<>();
        for (int i = 0; i < tree.decls().size(); i++) {
            if (i == index) {
                decls.add(updated);
                decls.add(extracted);
            } else {
                decls.add(copier.rewrite(tree.decls().get(i)));
            }
        }
        return new GoFile(copier.rewrite(tree.packageName()), decls, tree.span());
    }
}
