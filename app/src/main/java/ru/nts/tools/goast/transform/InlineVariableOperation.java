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
import ru.nts.tools.goast.ast.Ast;
import ru.nts.tools.goast.ast.CaseClause;
import ru.nts.tools.goast.ast.CommClause;
import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.BasicLit;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.RawExpr;
import ru.nts.tools.goast.ast.Expr.StarExpr;
import ru.nts.tools.goast.ast.Expr.UnaryExpr;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.NodeRewriter;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Stmt;
import ru.nts.tools.goast.ast.Stmt.AssignStmt;
import ru.nts.tools.goast.ast.Stmt.BlockStmt;
import ru.nts.tools.goast.ast.Stmt.DeclStmt;
import ru.nts.tools.goast.ast.Stmt.RawStmt;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.scope.IdentUse;
import ru.nts.tools.goast.scope.ScopeTree;
import ru.nts.tools.goast.scope.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Встраивание переменной: определение удаляется, последующие чтения заменяются копией значения.
 *
 * <p>Встраиваются только определения с одной переменной слева и простым значением справа:
 * идентификатор, литерал или унарное выражение над простым операндом (кроме приема из канала).
 * Имена внутри значения должны в каждой точке чтения означать то же, что и в определении.
 * Параметры: {@code name}.
 */
public class InlineVariableOperation implements TransformOperation {

    @Override
    public String getName() {
        return "inline";
    }

    @Override
    public void validateParams(JsonNode params) throws IllegalArgumentException {
        if (params == null || !params.has("name")) {
            throw new IllegalArgumentException("Parameter 'name' is required for inline operation");
        }
        if (params.get("name").asText().isEmpty()) {
            throw new IllegalArgumentException("Parameter 'name' must not be empty");
        }
    }

    @Override
    public GoFile execute(GoFile tree, JsonNode params) {
        return inline(tree, params.get("name").asText());
    }

    public GoFile inline(GoFile tree, String varName) {
        if (tree == null) {
            throw GoAstException.invalidSource("tree is null");
        }
        if (varName == null || varName.isEmpty()) {
            throw GoAstException.invalidSource("variable name is empty");
        }

        Definition def = findDefinition(tree, varName);
        if (def == null) {
            throw GoAstException.symbolNotFound(varName);
        }
        if (!isSimple(def.value())) {
            throw GoAstException.inlineNotPossible(varName, "is defined with a value that is not a simple expression");
        }

        ScopeTree scopes = ScopeTree.build(RenameOperation.UNIT_NAME, tree);
        Symbol symbol = null;
        for (IdentUse use : scopes.uses()) {
            if (use.ident() == def.target()) {
                symbol = scopes.resolveUse(use).orElse(null);
                break;
            }
        }
        if (symbol == null) {
            throw GoAstException.symbolNotFound(varName);
        }

        Position after = def.stmt().span().end();
        Set<Expr> reads = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IdentUse use : scopes.uses()) {
            Ident ident = use.ident();
            if (ident == def.target() || !ident.name().equals(varName)
                    || !ident.span().start().isAfter(after)) {
                continue;
            }
            if (scopes.resolveUse(use).orElse(null) != symbol) {
                continue;
            }
            boolean redeclared = use.role() == IdentUse.Role.DECLARATION;
            if (use.write() || redeclared) {
                throw GoAstException.inlineNotPossible(varName, "is assigned again after its definition");
            }
            if (use.role() == IdentUse.Role.VALUE || use.role() == IdentUse.Role.KEY) {
                reads.add(ident);
            }
        }
        checkValueNames(scopes, def, reads, varName);
        checkRawText(tree, varName);
        DebugLog.log("Inline " + varName + ": " + reads.size() + " read(s) replaced");
        return new Inliner(def.stmt(), reads, def.value()).rewrite(tree);
    }

    /**
     * Первое по исходнику определение переменной в списке операторов.
     */
    private static Definition findDefinition(GoFile tree, String varName) {
        List<Definition> found = new ArrayList<>();
        Ast.inspect(tree, node -> {
            List<Stmt> list = null;
            if (node instanceof BlockStmt block) {
                list = block.list();
            } else if (node instanceof CaseClause clause) {
                list = clause.body();
            } else if (node instanceof CommClause clause) {
                list = clause.body();
            }
            if (list != null) {
                for (Stmt s : list) {
                    Definition def = definitionIn(s, varName);
                    if (def != null) {
                        found.add(def);
                    }
                }
            }
            return true;
        });
        Definition first = null;
        for (Definition def : found) {
            if (first == null || def.stmt().span().start().isBefore(first.stmt().span().start())) {
                first = def;
            }
        }
        return first;
    }

    /**
     * Идентификаторы значения не должны быть перекрыты в точке чтения
     * и не должны переприсваиваться после определения.
     */
    private static void checkValueNames(ScopeTree scopes, Definition def, Set<Expr> reads, String varName) {
        Position after = def.stmt().span().end();
        for (Ident name : Ast.collect(def.value(), Ident.class)) {
            Position at = name.span().start();
            Symbol bound = scopes.resolveAs(name.name(), at, IdentUse.Role.VALUE).orElse(null);
            for (Expr read : reads) {
                Symbol seen = scopes.resolveAs(name.name(), read.span().start(), IdentUse.Role.VALUE).orElse(null);
                if (!Objects.equals(bound, seen)) {
                    throw GoAstException.inlineNotPossible(varName, "uses '" + name.name()
                            + "', which refers to another declaration at line " + read.span().start().line());
                }
            }
            if (bound == null) {
                continue;
            }
            for (IdentUse use : scopes.uses()) {
                if (use.write() && use.ident().name().equals(name.name())
                        && use.ident().span().start().isAfter(after)
                        && scopes.resolveUse(use).orElse(null) == bound) {
                    throw GoAstException.inlineNotPossible(varName, "uses '" + name.name()
                            + "', which is assigned again at line " + use.ident().span().start().line());
                }
            }
        }
    }

    private static void checkRawText(GoFile tree, String varName) {
        Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(varName) + "(?![\\p{L}\\p{N}_])");
        for (RawStmt raw : Ast.collect(tree, RawStmt.class)) {
            if (word.matcher(raw.text()).find()) {
                throw GoAstException.unsupportedConstruct(varName, raw.span().start().line());
            }
        }
        for (RawExpr raw : Ast.collect(tree, RawExpr.class)) {
            if (word.matcher(raw.text()).find()) {
                throw GoAstException.unsupportedConstruct(varName, raw.span().start().line());
            }
        }
    }

    private static Definition definitionIn(Stmt s, String varName) {
        if (s instanceof AssignStmt as) {
            boolean plain = as.isDefine() || "=".equals(as.tok());
            if (plain && as.lhs().size() == 1 && as.rhs().size() == 1
                    && as.lhs().get(0) instanceof Ident id && id.name().equals(varName)) {
                return new Definition(s, id, as.rhs().get(0));
            }
        } else if (s instanceof DeclStmt ds && "var".equals(ds.decl().tok()) && ds.decl().specs().size() == 1
                && ds.decl().specs().get(0) instanceof ValueSpec vs) {
            if (vs.names().size() == 1 && vs.values().size() == 1 && vs.names().get(0).name().equals(varName)) {
                return new Definition(s, vs.names().get(0), vs.values().get(0));
            }
        }
        return null;
    }

    static boolean isSimple(Expr expr) {
        if (expr instanceof Ident || expr instanceof BasicLit) {
            return true;
        }
        if (expr instanceof UnaryExpr un) {
            return !"<-".equals(un.op()) && isSimple(un.x());
        }
        if (expr instanceof StarExpr star) {
            return isSimple(star.x());
        }
        return false;
    }

    private record Definition(Stmt stmt, Ident target, Expr value) {
    }

    private static final class Inliner extends NodeRewriter {

        private final Stmt definition;
        private final Set<Expr> reads;
        private final Expr value;

        Inliner(Stmt definition, Set<Expr> reads, Expr value) {
            this.definition = definition;
            this.reads = reads;
            this.value = value;
        }

        @Override
        protected Expr expr(Expr e) {
            if (e != null && reads.contains(e)) {
                return NodeRewriter.copy(value);
            }
            return super.expr(e);
        }

        @Override
        protected List<Stmt> stmts(List<Stmt> list) {
            List<Stmt> result = new ArrayList<>(list.size());
            for (Stmt s : list) {
                if (s != definition) {
                    result.add(stmt(s));
                }
            }
            return result;
        }
    }
}
