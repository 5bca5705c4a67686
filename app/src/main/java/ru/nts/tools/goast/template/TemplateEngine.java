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

import ru.nts.tools.goast.ast.Ast;
import ru.nts.tools.goast.ast.Expr.BasicLit;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.GoNames;
import ru.nts.tools.goast.ast.Node;
import ru.nts.tools.goast.ast.NodeRewriter;
import ru.nts.tools.goast.ast.ParsedUnit;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.core.GoAstConfig;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.core.treesitter.GoSourceParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Реестр шаблонов кода.
 *
 * <p>Шаблон это фрагмент Go, в котором заполнители записаны обычными идентификаторами
 * ({@code TypeName}, {@code FunctionName}) или путями импорта. При выполнении дерево шаблона
 * копируется, и каждое имя, присутствующее в данных, заменяется значением.
 * Реестр не потокобезопасен.
 */
public final class TemplateEngine {

    /**
     * Имена, которые считаются заполнителями при регистрации.
     */
    public static final Set<String> PLACEHOLDER_VOCABULARY = Set.of(
            "TypeName", "FieldName", "FieldType", "FunctionName", "MethodName", "ReturnType",
            "ParamType", "Param", "VarName", "InterfaceName", "StructName", "ImplTypeName",
            "ReceiverName", "Element", "Key", "Value", "ErrorType");

    private static final Pattern PACKAGE_CLAUSE = Pattern.compile("^\\s*(?://[^\\n]*\\n\\s*)*package\\s+\\w+");

    private static final Map<String, String> BUILT_INS = Map.of(
            "struct", """
                    type TypeName struct {
                    \tFieldName FieldType
                    }
                    """,
            "function", """
                    func FunctionName(param ParamType) ReturnType {
                    \treturn DefaultValue
                    }
                    """,
            "method", """
                    func (r *TypeName) MethodName(param ParamType) ReturnType {
                    \treturn DefaultValue
                    }
                    """,
            "interface", """
                    type TypeName interface {
                    \tMethodName(param ParamType) ReturnType
                    }
                    """);

    private final GoSourceParser parser;
    private final GoAstConfig config;
    private final Map<String, Template> templates = new LinkedHashMap<>();

    public TemplateEngine() {
        this(new GoSourceParser(), GoAstConfig.get());
    }

    public TemplateEngine(GoSourceParser parser, GoAstConfig config) {
        this.parser = parser;
        this.config = config;
    }

    /**
     * Регистрирует шаблон. Исходник без package оборачивается в {@code package <templatePackage>}.
     *
     * @throws GoAstException INVALID_SOURCE для пустого имени, исходника или шаблона без объявлений,
     *                        PARSE_FAILED при синтаксических ошибках
     */
    public Template registerTemplate(String name, String source) {
        if (name == null || name.isEmpty()) {
            throw GoAstException.invalidSource("template name is empty");
        }
        if (source == null || source.isBlank()) {
            throw GoAstException.invalidSource("template '" + name + "' has empty source");
        }
        boolean synthetic = !PACKAGE_CLAUSE.matcher(source).find();
        String text = synthetic ? "package " + config.templatePackage() + "\n" + source : source;

        ParsedUnit unit = parser.parse("template:" + name, text);
        GoFile file = unit.file();
        if (file.decls().isEmpty()) {
            throw GoAstException.invalidSource("template '" + name + "' has no declarations");
        }
        Template template = new Template(name, source, file, placeholders(file), synthetic);
        templates.put(name, template);
        DebugLog.log("Registered template '" + name + "' with placeholders " + template.placeholders());
        return template;
    }

    /**
     * Регистрирует встроенные шаблоны: struct, function, method, interface.
     */
    public void registerBuiltIns() {
        for (String name : List.of("struct", "function", "method", "interface")) {
            registerTemplate(name, BUILT_INS.get(name));
        }
    }

    public Optional<Template> getTemplate(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    public List<String> templateNames() {
        return new ArrayList<>(templates.keySet());
    }

    /**
     * Выполняет шаблон над данными.
     * Ключи, отсутствующие в шаблоне, игнорируются; заполнители без данных остаются как есть.
     *
     * @return объявление, если шаблон был обернут синтезированным package и содержит одно объявление,
     *         иначе дерево модуля
     */
    public Node execute(String name, Map<String, String> data) {
        Template template = templates.get(name);
        if (template == null) {
            throw GoAstException.templateNotFound(name, templates.keySet());
        }
        Map<String, String> values = new LinkedHashMap<>();
        if (data != null) {
            for (Map.Entry<String, String> entry : data.entrySet()) {
                if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                    values.put(entry.getKey(), entry.getValue());
                }
            }
        }
        GoFile result = new PlaceholderReplacer(values).rewrite(template.parsed());
        if (template.synthetic() && result.decls().size() == 1) {
            return result.decls().get(0);
        }
        return result;
    }

    static Set<String> placeholders(GoFile file) {
        Set<String> found = new LinkedHashSet<>();
        Ast.inspect(file, node -> {
            if (node == file.packageName()) {
                return true;
            }
            if (node instanceof Ident id && isPlaceholder(id.name())) {
                found.add(id.name());
            } else if (node instanceof ImportSpec spec && isPlaceholder(spec.path().unquoted())) {
                found.add(spec.path().unquoted());
            }
            return true;
        });
        return found;
    }

    static boolean isPlaceholder(String name) {
        return PLACEHOLDER_VOCABULARY.contains(name) && !GoNames.isKeyword(name) && !GoNames.isPredeclared(name);
    }

    /**
     * Копирует дерево шаблона, подставляя значения вместо имен и путей импорта.
     */
    private static final class PlaceholderReplacer extends NodeRewriter {

        private final Map<String, String> values;

        PlaceholderReplacer(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Node visitIdent(Ident node) {
            String value = values.get(node.name());
            return value != null ? new Ident(value, node.span()) : super.visitIdent(node);
        }

        @Override
        public Node visitImportSpec(ImportSpec node) {
            BasicLit path = node.path();
            String value = values.get(path.value());
            if (value == null) {
                value = values.get(path.unquoted());
            }
            if (value == null) {
                return super.visitImportSpec(node);
            }
            String quoted = value.startsWith("\"") ? value : "\"" + value + "\"";
            return new ImportSpec(ident(node.name()), new BasicLit(path.kind(), quoted, path.span()), node.span());
        }
    }
}
