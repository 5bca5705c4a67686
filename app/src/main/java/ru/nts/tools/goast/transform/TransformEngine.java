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
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.Position;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.core.GoAstException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Движок преобразований.
 * Управляет регистрацией и выполнением операций.
 */
public final class TransformEngine {

    private static final TransformEngine INSTANCE = new TransformEngine();

    private final Map<String, TransformOperation> operations = new LinkedHashMap<>();
    private final RenameOperation rename = new RenameOperation();
    private final ExtractFunctionOperation extract = new ExtractFunctionOperation();
    private final InlineVariableOperation inline = new InlineVariableOperation();

    public TransformEngine() {
        registerOperation(rename);
        registerOperation(extract);
        registerOperation(inline);
    }

    public static TransformEngine getInstance() {
        return INSTANCE;
    }

    /**
     * Регистрирует операцию; операция с тем же именем заменяется.
     */
    public void registerOperation(TransformOperation operation) {
        operations.put(operation.getName(), operation);
    }

    public TransformOperation getOperation(String name) {
        return operations.get(name);
    }

    public boolean hasOperation(String name) {
        return operations.containsKey(name);
    }

    public Iterable<String> getAvailableOperations() {
        return operations.keySet();
    }

    /**
     * Выполняет операцию по имени с параметрами в JSON.
     *
     * @throws IllegalArgumentException если операция неизвестна или параметры некорректны
     */
    public GoFile execute(String action, GoFile tree, JsonNode params) {
        TransformOperation operation = operations.get(action);
        if (operation == null) {
            throw new IllegalArgumentException("Unknown transform action: " + action
                    + ". Available: " + String.join(", ", operations.keySet()));
        }
        operation.validateParams(params);
        try {
            return operation.execute(tree, params);
        } catch (GoAstException e) {
            DebugLog.log("Transform '" + action + "' failed: " + e.toLogMessage());
            throw e;
        }
    }

    // Типизированные точки входа

    public GoFile renameSymbolAtPos(GoFile tree, Position position, String newName) {
        return rename.rename(tree, position, newName);
    }

    public GoFile extractFunction(GoFile tree, int startLine, int endLine, String newName) {
        return extract.extract(tree, startLine, endLine, newName);
    }

    public GoFile inlineVariable(GoFile tree, String varName) {
        return inline.inline(tree, varName);
    }
}
