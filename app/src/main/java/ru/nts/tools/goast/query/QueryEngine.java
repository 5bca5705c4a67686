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
package ru.nts.tools.goast.query;

import ru.nts.tools.goast.ast.Decl;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.FuncType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.IndexExpr;
import ru.nts.tools.goast.ast.Expr.InterfaceType;
import ru.nts.tools.goast.ast.Expr.ParenExpr;
import ru.nts.tools.goast.ast.Expr.SelectorExpr;
import ru.nts.tools.goast.ast.Expr.StarExpr;
import ru.nts.tools.goast.ast.Expr.StructType;
import ru.nts.tools.goast.ast.Field;
import ru.nts.tools.goast.ast.ParsedUnit;
import ru.nts.tools.goast.ast.Spec;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.TypeFormatter;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.query.QueryMatch.MatchKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Поиск по набору разобранных единиц трансляции.
 *
 * <p>Единицы обходятся в порядке имен, объявления внутри единицы в порядке исходника.
 * Движок не хранит состояния между вызовами, кроме самого набора единиц.
 */
public final class QueryEngine {

    private final TreeMap<String, ParsedUnit> units = new TreeMap<>();

    public QueryEngine(Collection<ParsedUnit> units) {
        for (ParsedUnit unit : units) {
            this.units.put(unit.name(), unit);
        }
    }

    public QueryEngine(Map<String, ParsedUnit> units) {
        this.units.putAll(units);
    }

    public Collection<ParsedUnit> units() {
        return Collections.unmodifiableCollection(units.values());
    }

    // ==================== ФУНКЦИИ ====================

    /**
     * Функции и методы по шаблону имени.
     * {@code *} выбирает все, завершающая {@code *} задает префикс (с учетом регистра),
     * иначе имя сравнивается без учета регистра. Пустой шаблон ничего не находит.
     */
    public List<QueryMatch> findFunctions(String pattern) {
        List<QueryMatch> result = new ArrayList<>();
        if (pattern == null || pattern.isEmpty()) {
            return result;
        }
        for (ParsedUnit unit : units.values()) {
            for (FuncDecl fd : functions(unit)) {
                if (matchesName(fd.name().name(), pattern)) {
                    result.add(functionMatch(unit, fd));
                }
            }
        }
        DebugLog.log("findFunctions '" + pattern + "': " + result.size() + " match(es)");
        return result;
    }

    static boolean matchesName(String name, String pattern) {
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith("*")) {
            return name.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return name.equalsIgnoreCase(pattern);
    }

    /**
     * Функции с заданной сигнатурой. Пробелы игнорируются с обеих сторон:
     * {@code (int,int)int} совпадает с {@code (a, b int) int}.
     */
    public List<QueryMatch> findBySignature(String signature) {
        List<QueryMatch> result = new ArrayList<>();
        if (signature == null || signature.isBlank()) {
            return result;
        }
        String wanted = stripWhitespace(signature);
        for (ParsedUnit unit : units.values()) {
            for (FuncDecl fd : functions(unit)) {
                if (stripWhitespace(TypeFormatter.signature(fd.type())).equals(wanted)) {
                    result.add(functionMatch(unit, fd));
                }
            }
        }
        return result;
    }

    static String stripWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static QueryMatch functionMatch(ParsedUnit unit, FuncDecl fd) {
        return new QueryMatch(unit.name(), unit.line(fd.span().start()), fd.name().name(),
                TypeFormatter.signature(fd.type()), MatchKind.FUNCTION);
    }

    private static List<FuncDecl> functions(ParsedUnit unit) {
        List<FuncDecl> result = new ArrayList<>();
        for (Decl decl : unit.file().decls()) {
            if (decl instanceof FuncDecl fd) {
                result.add(fd);
            }
        }
        return result;
    }

    // ==================== ИНТЕРФЕЙСЫ ====================

    /**
     * Типы, реализующие интерфейс. Метод соответствует требуемому, если совпадают
     * число параметров, тексты их типов и число результатов; типы результатов не сравниваются.
     * Неизвестный интерфейс дает пустой результат.
     */
    public List<QueryMatch> findImplementations(String interfaceName) {
        List<QueryMatch> result = new ArrayList<>();
        if (interfaceName == null || interfaceName.isEmpty()) {
            return result;
        }
        InterfaceType iface = findInterface(interfaceName);
        if (iface == null) {
            DebugLog.log("Interface '" + interfaceName + "' not found");
            return result;
        }
        Map<String, FuncType> required = interfaceMethods(iface);
        if (required.isEmpty()) {
            return result;
        }
        for (ParsedUnit unit : units.values()) {
            for (TypeSpec ts : typeSpecs(unit)) {
                Map<String, FuncType> methods = methodSet(ts.name().name());
                if (implementsAll(methods, required)) {
                    result.add(new QueryMatch(unit.name(), unit.line(ts.span().start()), ts.name().name(),
                            TypeFormatter.format(ts.type()), MatchKind.IMPLEMENTATION));
                }
            }
        }
        return result;
    }

    private InterfaceType findInterface(String name) {
        for (ParsedUnit unit : units.values()) {
            for (TypeSpec ts : typeSpecs(unit)) {
                if (ts.name().name().equals(name) && ts.type() instanceof InterfaceType it) {
                    return it;
                }
            }
        }
        return null;
    }

    static Map<String, FuncType> interfaceMethods(InterfaceType iface) {
        Map<String, FuncType> methods = new LinkedHashMap<>();
        for (Field field : iface.methods().list()) {
            if (field.type() instanceof FuncType ft) {
                for (Ident name : field.names()) {
                    methods.put(name.name(), ft);
                }
            }
        }
        return methods;
    }

    /**
     * Методы, получатель которых указывает на тип по значению, по указателю
     * или как обобщенная инстанциация, во всех единицах.
     */
    private Map<String, FuncType> methodSet(String typeName) {
        Map<String, FuncType> methods = new LinkedHashMap<>();
        for (ParsedUnit unit : units.values()) {
            for (FuncDecl fd : functions(unit)) {
                if (fd.isMethod() && typeName.equals(receiverBaseName(fd.recv().list().get(0).type()))) {
                    methods.put(fd.name().name(), fd.type());
                }
            }
        }
        return methods;
    }

    static String receiverBaseName(Expr type) {
        if (type instanceof Ident id) {
            return id.name();
        }
        if (type instanceof StarExpr star) {
            return receiverBaseName(star.x());
        }
        if (type instanceof ParenExpr paren) {
            return receiverBaseName(paren.x());
        }
        if (type instanceof IndexExpr idx) {
            return receiverBaseName(idx.x());
        }
        if (type instanceof SelectorExpr sel) {
            return sel.sel().name();
        }
        return "";
    }

    private static boolean implementsAll(Map<String, FuncType> methods, Map<String, FuncType> required) {
        if (methods.size() < required.size()) {
            return false;
        }
        for (Map.Entry<String, FuncType> entry : required.entrySet()) {
            FuncType actual = methods.get(entry.getKey());
            if (actual == null || !shapeMatches(actual, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    static boolean shapeMatches(FuncType actual, FuncType required) {
        List<String> actualParams = TypeFormatter.expandTypes(actual.params());
        List<String> requiredParams = TypeFormatter.expandTypes(required.params());
        return actualParams.equals(requiredParams) && actual.resultCount() == required.resultCount();
    }

    // ==================== СТРУКТУРЫ И ИМПОРТЫ ====================

    /**
     * Структуры, у которых хотя бы одно поле имеет тип с заданным текстом; {@code *} выбирает все.
     */
    public List<QueryMatch> findStructsByFieldType(String pattern) {
        List<QueryMatch> result = new ArrayList<>();
        if (pattern == null || pattern.isEmpty()) {
            return result;
        }
        for (ParsedUnit unit : units.values()) {
            for (TypeSpec ts : typeSpecs(unit)) {
                if (ts.type() instanceof StructType st && hasFieldType(st, pattern)) {
                    result.add(new QueryMatch(unit.name(), unit.line(ts.span().start()), ts.name().name(),
                            TypeFormatter.format(st), MatchKind.STRUCT_FIELD));
                }
            }
        }
        return result;
    }

    private static boolean hasFieldType(StructType struct, String pattern) {
        if ("*".equals(pattern)) {
            return true;
        }
        for (Field field : struct.fields().list()) {
            if (TypeFormatter.format(field.type()).equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Импорты по пути без кавычек: точное совпадение, {@code *} или {@code prefix/*}.
     */
    public List<QueryMatch> findByImportDependency(String pattern) {
        List<QueryMatch> result = new ArrayList<>();
        if (pattern == null || pattern.isEmpty()) {
            return result;
        }
        for (ParsedUnit unit : units.values()) {
            for (ImportSpec spec : unit.file().imports()) {
                String path = spec.path().unquoted();
                if (matchesImport(path, pattern)) {
                    String name = spec.name() != null ? spec.name().name() : path;
                    result.add(new QueryMatch(unit.name(), unit.line(spec.span().start()), name, path,
                            MatchKind.IMPORT));
                }
            }
        }
        return result;
    }

    static boolean matchesImport(String path, String pattern) {
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith("/*")) {
            return path.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return path.equals(pattern);
    }

    private static List<TypeSpec> typeSpecs(ParsedUnit unit) {
        List<TypeSpec> result = new ArrayList<>();
        for (Decl decl : unit.file().decls()) {
            if (decl instanceof GenDecl gd && "type".equals(gd.tok())) {
                for (Spec spec : gd.specs()) {
                    if (spec instanceof TypeSpec ts) {
                        result.add(ts);
                    }
                }
            }
        }
        return result;
    }
}
