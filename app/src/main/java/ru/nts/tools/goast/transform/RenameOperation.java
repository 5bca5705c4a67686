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
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.RawExpr;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.GoNames;
import ru.nts.tools.goast.ast.Node;
import ru.nts.tools.goast.ast.NodeRewriter;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.Span;
import ru.nts.tools.goast.ast.Stmt.RawStmt;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.scope.IdentUse;
import ru.nts.tools.goast.scope.ScopeTree;
import ru.nts.tools.goast.scope.Symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Переименование символа под курсором.
 *
 * <p>Переименовываются только вхождения, разрешающиеся в тот же символ:
 * одноименные переменные во вложенных или внешних областях остаются нетронутыми.
 * Переименование отклоняется, если после него хотя бы одно вхождение разрешилось бы
 * в другой символ, или если старое либо новое имя встречается в неразобранном коде.
 * Параметры: {@code line}, {@code column} (1-based), {@code newName}.
 */
public class RenameOperation implements TransformOperation {

    static final String UNIT_NAME = "<tree>";

    @Override
    public String getName() {
        return "rename";
    }

    @Override
    public void validateParams(JsonNode params) throws IllegalArgumentException {
        if (params == null || !params.has("line") || !params.has("column")) {
            throw new IllegalArgumentException("Parameters 'line' and 'column' are required for rename operation");
        }
        if (!params.has("newName")) {
            throw new IllegalArgumentException("Parameter 'newName' is required for rename operation");
        }
        String newName = params.get("newName").asText();
        if (!GoNames.isIdentifier(newName)) {
            throw new IllegalArgumentException("Invalid identifier: '" + newName + "'");
        }
    }

    @Override
    public GoFile execute(GoFile tree, JsonNode params) {
        Position pos = new Position(params.get("line").asInt(), params.get("column").asInt(), -1);
        return rename(tree, pos, params.get("newName").asText());
    }

    public GoFile rename(GoFile tree, Position position, String newName) {
        if (tree == null) {
            throw GoAstException.invalidSource("tree is null");
        }
        if (!GoNames.isIdentifier(newName)) {
            throw GoAstException.invalidSource("'" + newName + "' is not a valid Go identifier");
        }
        ScopeTree scopes = ScopeTree.build(UNIT_NAME, tree);
        Optional<IdentUse> use = scopes.useAt(position);
        if (use.isEmpty()) {
            throw GoAstException.symbolNotFound("<none>", UNIT_NAME, position.line(), position.column());
        }
        String oldName = use.get().ident().name();
        Symbol target = scopes.resolveUse(use.get()).orElseThrow(
                () -> GoAstException.symbolNotFound(oldName, UNIT_NAME, position.line(), position.column()));

        if (target.name().equals(newName)) {
            return tree;
        }
        checkConflict(scopes, target, newName);
        checkRawText(tree, oldName);
        checkRawText(tree, newName);

        Set<Ident> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IdentUse candidate : scopes.uses()) {
            if (candidate.ident().name().equals(target.name())
                    && scopes.resolveUse(candidate).orElse(null) == target) {
                targets.add(candidate.ident());
            }
        }
        DebugLog.log("Rename " + target + " -> " + newName + ": " + targets.size() + " occurrence(s)");
        GoFile result = new IdentRenamer(targets, newName).rewrite(tree);
        checkBindings(scopes, ScopeTree.build(UNIT_NAME, result), target, newName);
        return result;
    }

    /**
     * Конфликт: в области символа уже объявлено имя того же пространства (значения или члены типа).
     */
    private static void checkConflict(ScopeTree scopes, Symbol target, String newName) {
        for (Symbol other : scopes.symbols()) {
            if (other.scope() == target.scope() && other.name().equals(newName)
                    && other.kind().isMember() == target.kind().isMember()) {
                throw GoAstException.nameConflict(other.kind().getDisplayName(), newName);
            }
        }
    }

    /**
     * Каждое вхождение должно разрешаться в то же объявление, что и до переименования.
     * Спаны при переписывании сохраняются, поэтому вхождения сопоставляются по спану.
     */
    private static void checkBindings(ScopeTree before, ScopeTree after, Symbol target, String newName) {
        Map<Span, Span> expected = new HashMap<>();
        for (IdentUse use : before.uses()) {
            if (!Span.NONE.equals(use.ident().span())) {
                expected.put(use.ident().span(), declarationSpan(before.resolveUse(use)));
            }
        }
        for (IdentUse use : after.uses()) {
            Span span = use.ident().span();
            if (Span.NONE.equals(span) || !expected.containsKey(span)) {
                continue;
            }
            Span now = declarationSpan(after.resolveUse(use));
            if (!Objects.equals(expected.get(span), now)) {
                Position at = span.start();
                DebugLog.log("Rename " + target + " -> " + newName + " rebinds " + use.ident().name() + " at " + at);
                throw GoAstException.nameConflict(target.kind().getDisplayName(), newName,
                        "would change what '" + use.ident().name() + "' refers to at line " + at.line()
                                + ", column " + at.column());
            }
        }
    }

    private static Span declarationSpan(Optional<Symbol> symbol) {
        return symbol.map(Symbol::definingSpan).orElse(null);
    }

    /**
     * Неразобранные операторы и выражения хранят исходный текст; имя в нем переименовать нельзя.
     */
    private static void checkRawText(GoFile tree, String name) {
        Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}_])");
        for (RawStmt raw : Ast.collect(tree, RawStmt.class)) {
            if (word.matcher(raw.text()).find()) {
                throw GoAstException.unsupportedConstruct(name, raw.span().start().line());
            }
        }
        for (RawExpr raw : Ast.collect(tree, RawExpr.class)) {
            if (word.matcher(raw.text()).find()) {
                throw GoAstException.unsupportedConstruct(name, raw.span().start().line());
            }
        }
    }

    private static final class IdentRenamer extends NodeRewriter {

        private final Set<Ident> targets;
        private final String newName;

        IdentRenamer(Set<Ident> targets, String newName) {
            this.targets = targets;
            this.newName = newName;
        }

        @Override
        public Node visitIdent(Ident node) {
            if (targets.contains(node)) {
                return new Ident(newName, node.span());
            }
            return super.visitIdent(node);
        }
    }
}
