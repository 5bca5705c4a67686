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
package ru.nts.tools.goast.core;

import java.util.Map;

/**
 * Structured error codes of the Go analysis engine.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of a formatted error:
 * <pre>
 * [ERROR: SYMBOL_NOT_FOUND]
 * Message: Symbol not found
 * Solution: No symbol 'count' at main.go:12:5. Check the position points at an identifier.
 * Context: symbol=count, unit=main.go, line=12, column=5
 * </pre>
 */
public enum GoAstErrorCode {

    // ============ Source Errors ============

    INVALID_SOURCE("Invalid source or arguments",
            "%reason%. Check the tree and the operation arguments."),

    EMPTY_SOURCE("Empty source",
            "Unit '%unit%' has no content. Provide non-empty Go source."),

    FILE_NOT_FOUND("File not found",
            "Check file path '%path%'."),

    FILE_TOO_LARGE("File too large",
            "Source has %size% bytes, limit is %limit% bytes. Raise goast.maxSourceBytes if needed."),

    PARSE_FAILED("Parse failed",
            "Unit '%unit%' has %count% syntax error(s), first at line %line%: %detail%."),

    // ============ Symbol Errors ============

    SYMBOL_NOT_FOUND("Symbol not found",
            "No symbol '%symbol%' at %unit%:%line%:%column%. Check the position points at an identifier."),

    NAME_CONFLICT("Name conflict",
            "%kind% '%name%' %reason%. Choose another name."),

    // ============ Transform Errors ============

    NO_STATEMENTS_IN_RANGE("No statements in range",
            "No function body has a statement fully inside lines %startLine%-%endLine%."),

    UNSUPPORTED_CONSTRUCT("Unsupported construct",
            "Name '%name%' occurs in unparsed code at line %line%. Edit that code manually."),

    INLINE_NOT_POSSIBLE("Variable cannot be inlined",
            "Variable '%name%' %reason%. Only single-assignment variables with simple values are inlined."),

    // ============ Template Errors ============

    TEMPLATE_NOT_FOUND("Template not found",
            "Template '%name%' is not registered. Registered: %available%."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Check permissions for '%path%' and try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Enable GOAST_DEBUG=true for details.");

    private final String message;
    private final String solution;

    GoAstErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (unit, symbol, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    /**
     * Formats error message without context.
     *
     * @return Formatted error string
     */
    public String format() {
        return format(null);
    }
}
