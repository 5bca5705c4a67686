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

import ru.nts.tools.goast.ast.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Лексическая область видимости. Хранится в арене {@link ScopeTree} и адресуется индексом.
 */
public final class Scope {

    public enum Kind { UNIT, FUNCTION, TYPE, BLOCK, IF, FOR, RANGE, SWITCH, SELECT, CASE }

    private final int index;
    private final int parent;
    private final Kind kind;
    private final Span span;
    private final List<Integer> children = new ArrayList<>();
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(int index, int parent, Kind kind, Span span) {
        this.index = index;
        this.parent = parent;
        this.kind = kind;
        this.span = span;
    }

    public int index() {
        return index;
    }

    /**
     * Индекс родителя, -1 для корня.
     */
    public int parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent < 0;
    }

    public Kind kind() {
        return kind;
    }

    public Span span() {
        return span;
    }

    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public Map<String, Symbol> symbols() {
        return Collections.unmodifiableMap(symbols);
    }

    public Symbol lookupLocal(String name) {
        return symbols.get(name);
    }

    void addChild(int child) {
        children.add(child);
    }

    /**
     * Добавляет символ; при совпадении имен побеждает последняя вставка.
     */
    void put(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
    }
}
