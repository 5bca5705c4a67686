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

import ru.nts.tools.goast.core.treesitter.SyntaxChecker.SyntaxError;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base exception of the Go analysis engine.
 * Carries an error code and an ordered context map.
 *
 * <p>Usage:
 * <pre>
 * throw new GoAstException(GoAstErrorCode.TEMPLATE_NOT_FOUND, Map.of("name", name));
 * throw GoAstException.invalidSource("new name is empty");
 * </pre>
 */
public class GoAstException extends RuntimeException {

    private final GoAstErrorCode code;
    private final Map<String, Object> context;
    private final List<SyntaxError> syntaxErrors;

    public GoAstException(GoAstErrorCode code) {
        super(code.getMessage());
        this.code = code;
        this.context = Collections.emptyMap();
        this.syntaxErrors = List.of();
    }

    public GoAstException(GoAstErrorCode code, Map<String, Object> context) {
        this(code, context, null, List.of());
    }

    public GoAstException(GoAstErrorCode code, String key, Object value) {
        super(code.getMessage());
        this.code = code;
        this.context = Map.of(key, value);
        this.syntaxErrors = List.of();
    }

    public GoAstException(GoAstErrorCode code, Map<String, Object> context, Throwable cause) {
        this(code, context, cause, List.of());
    }

    private GoAstException(GoAstErrorCode code, Map<String, Object> context, Throwable cause,
                           List<SyntaxError> syntaxErrors) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
        this.syntaxErrors = List.copyOf(syntaxErrors);
    }

    public GoAstErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Синтаксические ошибки, найденные при разборе (только для PARSE_FAILED).
     */
    public List<SyntaxError> getSyntaxErrors() {
        return syntaxErrors;
    }

    /**
     * Returns a formatted user-friendly error message.
     */
    public String toUserMessage() {
        return code.format(context);
    }

    @Override
    public String getMessage() {
        return toUserMessage();
    }

    /**
     * Returns a compact single-line error message for logs.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(code.getMessage());
        if (!context.isEmpty()) {
            sb.append(" | ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }
        return sb.toString();
    }

    // Фабричные методы для типичных ошибок

    public static GoAstException invalidSource(String reason) {
        return new GoAstException(GoAstErrorCode.INVALID_SOURCE, "reason", reason);
    }

    public static GoAstException emptySource(String unit) {
        return new GoAstException(GoAstErrorCode.EMPTY_SOURCE, "unit", unit);
    }

    public static GoAstException parseFailed(String unit, List<SyntaxError> errors) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("unit", unit);
        ctx.put("count", errors.size());
        if (!errors.isEmpty()) {
            SyntaxError first = errors.get(0);
            ctx.put("line", first.line());
            ctx.put("detail", first.message());
        }
        return new GoAstException(GoAstErrorCode.PARSE_FAILED, ctx, null, errors);
    }

    public static GoAstException symbolNotFound(String symbol, String unit, int line, int column) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("symbol", symbol);
        ctx.put("unit", unit);
        ctx.put("line", line);
        ctx.put("column", column);
        return new GoAstException(GoAstErrorCode.SYMBOL_NOT_FOUND, ctx);
    }

    public static GoAstException symbolNotFound(String symbol) {
        return new GoAstException(GoAstErrorCode.SYMBOL_NOT_FOUND, "symbol", symbol);
    }

    public static GoAstException nameConflict(String kind, String name) {
        return nameConflict(kind, name, "is already declared in the same scope");
    }

    public static GoAstException nameConflict(String kind, String name, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("kind", kind);
        ctx.put("name", name);
        ctx.put("reason", reason);
        return new GoAstException(GoAstErrorCode.NAME_CONFLICT, ctx);
    }

    public static GoAstException unsupportedConstruct(String name, int line) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("name", name);
        ctx.put("line", line);
        return new GoAstException(GoAstErrorCode.UNSUPPORTED_CONSTRUCT, ctx);
    }

    public static GoAstException noStatementsInRange(int startLine, int endLine) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("startLine", startLine);
        ctx.put("endLine", endLine);
        return new GoAstException(GoAstErrorCode.NO_STATEMENTS_IN_RANGE, ctx);
    }

    public static GoAstException inlineNotPossible(String name, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("name", name);
        ctx.put("reason", reason);
        return new GoAstException(GoAstErrorCode.INLINE_NOT_POSSIBLE, ctx);
    }

    public static GoAstException templateNotFound(String name, Collection<String> available) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("name", name);
        ctx.put("available", available.isEmpty() ? "none" : String.join(", ", available));
        return new GoAstException(GoAstErrorCode.TEMPLATE_NOT_FOUND, ctx);
    }
}
