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
package ru.nts.tools.goast.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.goast.ast.GoPrinter;
import ru.nts.tools.goast.ast.Node;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.query.QueryMatch;
import ru.nts.tools.goast.scope.DefinitionResult;
import ru.nts.tools.goast.scope.Reference;

import java.util.List;
import java.util.Optional;

/**
 * JSON-представления результатов для внешних слоев (CLI, MCP-инструменты).
 */
public final class AstReports {

    private final ObjectMapper mapper;

    public AstReports() {
        this(new ObjectMapper());
    }

    public AstReports(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode matches(String query, List<QueryMatch> matches) {
        ObjectNode root = mapper.createObjectNode();
        root.put("query", query);
        root.put("count", matches.size());
        ArrayNode items = root.putArray("matches");
        for (QueryMatch match : matches) {
            ObjectNode item = items.addObject();
            item.put("file", match.unitName());
            item.put("line", match.line());
            item.put("name", match.name());
            item.put("signature", match.formattedSignature());
            item.put("kind", match.matchKind().getLabel());
        }
        return root;
    }

    public ObjectNode definition(String name, Optional<DefinitionResult> result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", name);
        root.put("found", result.isPresent());
        result.ifPresent(def -> {
            root.put("kind", def.kind().getDisplayName());
            root.put("file", def.unit());
            root.put("line", def.line());
            root.put("column", def.column());
            root.put("type", def.typeText());
            root.put("exported", def.exported());
        });
        return root;
    }

    public ObjectNode references(String name, List<Reference> references) {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", name);
        root.put("count", references.size());
        ArrayNode items = root.putArray("references");
        for (Reference ref : references) {
            ObjectNode item = items.addObject();
            item.put("line", ref.line());
            item.put("column", ref.column());
            item.put("kind", ref.kind().name().toLowerCase());
        }
        return root;
    }

    /**
     * Сгенерированный или преобразованный код в виде текста.
     */
    public ObjectNode code(String operation, Node node) {
        ObjectNode root = mapper.createObjectNode();
        root.put("operation", operation);
        root.put("code", GoPrinter.print(node));
        return root;
    }

    public ObjectNode error(GoAstException e) {
        ObjectNode root = mapper.createObjectNode();
        root.put("error", e.getCode().name());
        root.put("message", e.getCode().getMessage());
        root.put("details", e.toUserMessage());
        ObjectNode context = root.putObject("context");
        e.getContext().forEach((key, value) -> context.put(key, String.valueOf(value)));
        return root;
    }

    public String toJson(ObjectNode node) {
        return node.toPrettyString();
    }
}
