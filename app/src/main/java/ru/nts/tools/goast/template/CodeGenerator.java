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
package ru.nts.tools.goast.template;

import ru.nts.tools.goast.ast.Decl;
import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr;
import ru.nts.tools.goast.ast.Expr.ArrayType;
import ru.nts.tools.goast.ast.Expr.BasicLit;
import ru.nts.tools.goast.ast.Expr.CallExpr;
import ru.nts.tools.goast.ast.Expr.Ellipsis;
import ru.nts.tools.goast.ast.Expr.FuncType;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Expr.InterfaceType;
import ru.nts.tools.goast.ast.Expr.LitKind;
import ru.nts.tools.goast.ast.Expr.SelectorExpr;
import ru.nts.tools.goast.ast.Expr.StarExpr;
import ru.nts.tools.goast.ast.Expr.StructType;
import ru.nts.tools.goast.ast.Field;
import ru.nts.tools.goast.ast.FieldList;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.NodeRewriter;
import ru.nts.tools.goast.ast.Span;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Stmt;
import ru.nts.tools.goast.ast.Stmt.AssignStmt;
import ru.nts.tools.goast.ast.Stmt.BlockStmt;
import ru.nts.tools.goast.ast.Stmt.DeclStmt;
import ru.nts.tools.goast.ast.Stmt.ExprStmt;
import ru.nts.tools.goast.ast.Stmt.RangeStmt;
import ru.nts.tools.goast.ast.Stmt.ReturnStmt;
import ru.nts.tools.goast.core.GoAstConfig;
import ru.nts.tools.goast.core.GoAstException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Генерация кода по существующим объявлениям: заготовки реализаций интерфейсов и табличных тестов.
 */
public final class CodeGenerator {

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
            "float32", "float64", "complex64", "complex128", "rune", "byte");

    private final GoAstConfig config;

    public CodeGenerator() {
        this(GoAstConfig.get());
    }

    public CodeGenerator(GoAstConfig config) {
        this.config = config;
    }

    /**
     * Структура без полей и по методу на каждый метод интерфейса.
     * Получатель это указатель на структуру с именем из первой буквы {@code implName} в нижнем регистре,
     * тело возвращает нулевые значения результатов.
     *
     * @param iface     интерфейс
     * @param implName  имя генерируемого типа
     * @param overrides сигнатуры, заменяющие сигнатуры интерфейса (по имени метода), может быть null
     * @return модуль в пакете {@code generatedPackage} из конфигурации
     */
    public GoFile generateInterfaceImplementation(InterfaceType iface, String implName,
                                                  Map<String, FuncType> overrides) {
        if (iface == null) {
            throw GoAstException.invalidSource("interface is null");
        }
        if (implName == null || implName.isEmpty()) {
            throw GoAstException.invalidSource("implementation type name is empty");
        }
        List<Decl> decls = new ArrayList<>();
        decls.add(new GenDecl("type", List.of(new TypeSpec(new Ident(implName), null, false,
                new StructType(FieldList.empty(), Span.NONE), Span.NONE)), false, Span.NONE));

        String receiver = implName.substring(0, Character.charCount(implName.codePointAt(0))).toLowerCase();
        for (Field method : iface.methods().list()) {
            if (!(method.type() instanceof FuncType declared)) {
                continue;
            }
            for (Ident name : method.names()) {
                FuncType signature = overrides != null && overrides.containsKey(name.name())
                        ? overrides.get(name.name()) : declared;
                FieldList recv = new FieldList(List.of(new Field(List.of(new Ident(receiver)),
                        new StarExpr(new Ident(implName), Span.NONE))));
                decls.add(new FuncDecl(recv, new Ident(name.name()), null, NodeRewriter.copy(signature),
                        new BlockStmt(List.of(zeroReturn(signature))), Span.NONE));
            }
        }
        if (decls.size() == 1) {
            throw GoAstException.invalidSource("interface has no methods");
        }
        return new GoFile(config.generatedPackage(), decls);
    }

    private static Stmt zeroReturn(FuncType signature) {
        List<Expr> values = new ArrayList<>();
        if (signature.results() != null) {
            for (Field result : signature.results().list()) {
                int count = result.names().isEmpty() ? 1 : result.names().size();
                for (int i = 0; i < count; i++) {
                    values.add(zeroValue(result.type()));
                }
            }
        }
        return new ReturnStmt(values, Span.NONE);
    }

    /**
     * Нулевое значение типа: {@code ""}, {@code 0}, {@code false} или {@code nil}.
     */
    static Expr zeroValue(Expr type) {
        if (type instanceof Ident id) {
            if ("string".equals(id.name())) {
                return new BasicLit(LitKind.STRING, "\"\"");
            }
            if (NUMERIC_TYPES.contains(id.name())) {
                return new BasicLit(LitKind.INT, "0");
            }
            if ("bool".equals(id.name())) {
                return new Ident("false");
            }
        }
        return new Ident("nil");
    }

    /**
     * Заготовка табличного теста для функции.
     *
     * <pre>
     * func TestAdd(t *testing.T) {
     *     var tests []struct {
     *         a int
     *         b int
     *     }
     *     for _, tt := range tests {
     *         Add(tt.a, tt.b)
     *     }
     * }
     * </pre>
     * Для методов тело цикла только использует строку таблицы, так как получателя создать нельзя.
     */
    public FuncDecl generateTestScaffold(FuncDecl function) {
        if (function == null) {
            throw GoAstException.invalidSource("function is null");
        }
        List<Field> rowFields = new ArrayList<>();
        List<Expr> args = new ArrayList<>();
        boolean variadic = false;
        int index = 0;
        FieldList params = function.type().params();
        if (params != null) {
            for (Field param : params.list()) {
                Expr type = param.type();
                if (type instanceof Ellipsis ell) {
                    type = new ArrayType(null, ell.elt(), Span.NONE);
                    variadic = true;
                }
                List<String> names = new ArrayList<>();
                if (param.names().isEmpty()) {
                    names.add("arg" + index);
                } else {
                    for (Ident name : param.names()) {
                        names.add(name.isBlank() ? "arg" + index : name.name());
                    }
                }
                for (String name : names) {
                    rowFields.add(new Field(List.of(new Ident(name)), NodeRewriter.copy(type)));
                    args.add(new SelectorExpr(new Ident("tt"), new Ident(name), Span.NONE));
                    index++;
                }
            }
        }

        Ident table = new Ident("tests");
        Stmt tableDecl = new DeclStmt(new GenDecl("var", List.of(new ValueSpec(List.of(table),
                new ArrayType(null, new StructType(new FieldList(rowFields), Span.NONE), Span.NONE),
                List.of(), Span.NONE)), false, Span.NONE), Span.NONE);

        Stmt loop;
        String name = function.name().name();
        if (function.isMethod()) {
            Stmt use = new AssignStmt(List.of(new Ident("_")), "=", List.of(new Ident("tt")), Span.NONE);
            loop = new RangeStmt(new Ident("_"), new Ident("tt"), ":=", new Ident("tests"),
                    new BlockStmt(List.of(use)), Span.NONE);
        } else {
            Stmt call = new ExprStmt(new CallExpr(new Ident(name), args, variadic, Span.NONE), Span.NONE);
            loop = args.isEmpty()
                    ? new RangeStmt(null, null, null, new Ident("tests"), new BlockStmt(List.of(call)), Span.NONE)
                    : new RangeStmt(new Ident("_"), new Ident("tt"), ":=", new Ident("tests"),
                            new BlockStmt(List.of(call)), Span.NONE);
        }

        FieldList testParams = new FieldList(List.of(new Field(List.of(new Ident("t")),
                new StarExpr(new SelectorExpr(new Ident("testing"), new Ident("T"), Span.NONE), Span.NONE))));
        return new FuncDecl(null, new Ident(testName(name)), null, new FuncType(testParams, null, Span.NONE),
                new BlockStmt(List.of(tableDecl, loop)), Span.NONE);
    }

    /**
     * {@code add} дает {@code TestAdd}: go test требует заглавную букву после Test.
     */
    static String testName(String name) {
        if (name.isEmpty()) {
            return "Test";
        }
        return "Test" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
