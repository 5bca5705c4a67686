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

import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.ParsedUnit;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.ast.TypeFormatter;
import ru.nts.tools.goast.core.GoAstException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Дерево областей видимости и таблица символов одной единицы трансляции.
 *
 * <p>Области хранятся в арене и ссылаются друг на друга индексами; корень имеет индекс 0.
 * После построения дерево только читается. Экземпляр не потокобезопасен из-за ленивого
 * списка вхождений идентификаторов.
 *
 * <p>Разрешение имени в позиции:
 * <ul>
 *   <li>кандидат это локальный символ, чья область содержит позицию и который виден в ней;</li>
 *   <li>из кандидатов выбирается объявленный позже всех;</li>
 *   <li>если кандидатов нет, используется символ пакетного уровня (виден во всей единице).</li>
 * </ul>
 */
public final class ScopeTree {

    private static final Predicate<SymbolKind> VALUE_KINDS = k -> !k.isMember() && k != SymbolKind.UNIT;
    private static final Predicate<SymbolKind> MEMBER_KINDS = SymbolKind::isMember;
    private static final Predicate<SymbolKind> TYPE_KINDS = k -> k == SymbolKind.TYPE;

    private final String unitName;
    private final GoFile file;
    private final List<Scope> scopes;
    private final List<Symbol> symbols;
    private final Map<Ident, Symbol> declarations;
    private List<IdentUse> uses;

    private ScopeTree(String unitName, GoFile file, ScopeBuilder builder) {
        this.unitName = unitName;
        this.file = file;
        this.scopes = builder.scopes();
        this.symbols = builder.symbols();
        this.declarations = builder.declarations();
    }

    public static ScopeTree build(ParsedUnit unit) {
        if (unit == null) {
            throw GoAstException.invalidSource("parsed unit is null");
        }
        return build(unit.name(), unit.file());
    }

    public static ScopeTree build(String unitName, GoFile file) {
        if (file == null) {
            throw GoAstException.invalidSource("tree is null");
        }
        ScopeBuilder builder = new ScopeBuilder();
        builder.build(file);
        return new ScopeTree(unitName, file, builder);
    }

    public String unitName() {
        return unitName;
    }

    public GoFile file() {
        return file;
    }

    public Scope root() {
        return scopes.get(0);
    }

    public Scope scope(int index) {
        return scopes.get(index);
    }

    public List<Scope> scopes() {
        return Collections.unmodifiableList(scopes);
    }

    /**
     * Все символы в порядке построения.
     */
    public List<Symbol> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    /**
     * Символ, объявленный данным идентификатором (сравнение по ссылке).
     */
    public Optional<Symbol> declarationOf(Ident ident) {
        return Optional.ofNullable(declarations.get(ident));
    }

    /**
     * Самая вложенная область, содержащая позицию.
     */
    public Scope innermostScope(Position pos) {
        Scope current = root();
        boolean descended = true;
        while (descended) {
            descended = false;
            for (int child : current.children()) {
                Scope candidate = scopes.get(child);
                if (candidate.span().contains(pos)) {
                    current = candidate;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }

    public Optional<Symbol> resolve(String name, Position pos) {
        return resolve(name, pos, k -> true);
    }

    /**
     * Разрешает имя в позиции среди символов допустимых видов.
     */
    public Optional<Symbol> resolve(String name, Position pos, Predicate<SymbolKind> kinds) {
        Symbol best = null;
        for (Symbol symbol : symbols) {
            if (symbol.scope() == 0 || !symbol.name().equals(name) || !kinds.test(symbol.kind())) {
                continue;
            }
            if (!scopes.get(symbol.scope()).span().contains(pos)) {
                continue;
            }
            boolean visible = !symbol.visibleFrom().isAfter(pos) || symbol.definingSpan().contains(pos);
            if (visible && (best == null || !symbol.definingSpan().start().isBefore(best.definingSpan().start()))) {
                best = symbol;
            }
        }
        if (best != null) {
            return Optional.of(best);
        }
        for (int i = symbols.size() - 1; i >= 0; i--) {
            Symbol symbol = symbols.get(i);
            if (symbol.scope() == 0 && symbol.name().equals(name) && kinds.test(symbol.kind())) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Все вхождения идентификаторов единицы в порядке исходника.
     */
    public List<IdentUse> uses() {
        if (uses == null) {
            uses = IdentifierWalker.collect(file);
        }
        return uses;
    }

    /**
     * Разрешает вхождение идентификатора с учетом его роли.
     */
    public Optional<Symbol> resolveUse(IdentUse use) {
        Ident ident = use.ident();
        Position pos = ident.span().start();
        switch (use.role()) {
            case DECLARATION: {
                Symbol declared = declarations.get(ident);
                if (declared != null) {
                    return Optional.of(declared);
                }
                // повторное объявление в := ссылается на существующую переменную
                return resolve(ident.name(), pos, k -> k == SymbolKind.VARIABLE);
            }
            default:
                return resolveAs(ident.name(), pos, use.role());
        }
    }

    /**
     * Разрешение имени в позиции так, как его разрешило бы вхождение с данной ролью.
     * Для {@link IdentUse.Role#DECLARATION} и {@link IdentUse.Role#NONE} результат пуст.
     */
    public Optional<Symbol> resolveAs(String name, Position pos, IdentUse.Role role) {
        switch (role) {
            case VALUE:
                return resolve(name, pos, VALUE_KINDS);
            case MEMBER:
                return resolve(name, pos, MEMBER_KINDS);
            case KEY: {
                Optional<Symbol> field = resolve(name, pos, k -> k == SymbolKind.FIELD);
                return field.isPresent() ? field : resolve(name, pos, VALUE_KINDS);
            }
            case TYPE:
                return resolve(name, pos, TYPE_KINDS);
            default:
                return Optional.empty();
        }
    }

    /**
     * Вхождение идентификатора, диапазон которого содержит позицию.
     */
    public Optional<IdentUse> useAt(Position pos) {
        for (IdentUse use : uses()) {
            if (use.ident().span().contains(pos)) {
                return Optional.of(use);
            }
        }
        return Optional.empty();
    }

    /**
     * Символ под курсором: идентификатор в позиции, разрешенный по своей роли.
     */
    public Optional<Symbol> symbolAt(Position pos) {
        return useAt(pos).flatMap(this::resolveUse);
    }

    /**
     * Определение имени, видимого в позиции, с координатами и текстом типа.
     * Пустой результат означает, что имя не объявлено в единице.
     */
    public Optional<DefinitionResult> lookupDefinition(String name, Position pos) {
        return resolve(name, pos).map(this::describe);
    }

    public DefinitionResult describe(Symbol symbol) {
        String typeText = symbol.declaredType() != null ? TypeFormatter.format(symbol.declaredType()) : "";
        boolean exported = symbol.declaration().isExported()
                && (symbol.scope() == 0 || symbol.kind().isMember());
        Position start = symbol.definingSpan().start();
        return new DefinitionResult(symbol.name(), symbol.kind(), unitName, start.line(), start.column(),
                typeText, exported);
    }

    /**
     * Все вхождения символа: объявление, чтения и записи.
     */
    public List<Reference> findReferences(Symbol symbol) {
        List<Reference> result = new ArrayList<>();
        if (symbol == null) {
            return result;
        }
        for (IdentUse use : uses()) {
            if (!use.ident().name().equals(symbol.name())) {
                continue;
            }
            Optional<Symbol> resolved = resolveUse(use);
            if (resolved.isEmpty() || resolved.get() != symbol) {
                continue;
            }
            Reference.Kind kind;
            if (declarations.get(use.ident()) == symbol) {
                kind = Reference.Kind.DEFINITION;
            } else if (use.write()) {
                kind = Reference.Kind.WRITE;
            } else {
                kind = Reference.Kind.READ;
            }
            result.add(new Reference(symbol, use.ident().span(), kind));
        }
        return result;
    }
}
