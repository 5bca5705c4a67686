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
package ru.nts.tools.goast.ast;

import java.util.Set;

/**
 * Зарезервированные и предобъявленные имена Go.
 */
public final class GoNames {

    public static final Set<String> KEYWORDS = Set.of(
            "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough",
            "for", "func", "go", "goto", "if", "import", "interface", "map", "package", "range",
            "return", "select", "struct", "switch", "type", "var");

    public static final Set<String> PREDECLARED = Set.of(
            // типы
            "any", "bool", "byte", "comparable", "complex64", "complex128", "error", "float32", "float64",
            "int", "int8", "int16", "int32", "int64", "rune", "string",
            "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
            // константы
            "true", "false", "iota", "nil",
            // встроенные функции
            "append", "cap", "clear", "close", "complex", "copy", "delete", "imag", "len", "make",
            "max", "min", "new", "panic", "print", "println", "real", "recover");

    private GoNames() {}

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    public static boolean isPredeclared(String name) {
        return PREDECLARED.contains(name);
    }

    /**
     * Допустимый идентификатор: буква или {@code _}, затем буквы, цифры и {@code _}; не ключевое слово.
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty() || isKeyword(name)) {
            return false;
        }
        int first = name.codePointAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        for (int i = Character.charCount(first); i < name.length(); ) {
            int cp = name.codePointAt(i);
            if (!Character.isLetterOrDigit(cp) && cp != '_') {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }
}
