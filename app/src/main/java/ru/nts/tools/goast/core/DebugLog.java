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

/**
 * Отладочный вывод в stderr.
 * Выключен по умолчанию. Включить можно через переменную окружения GOAST_DEBUG=true
 * или системное свойство goast.debug=true.
 */
public final class DebugLog {

    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("GOAST_DEBUG"))
            || Boolean.getBoolean("goast.debug");

    private DebugLog() {}

    public static boolean isEnabled() {
        return DEBUG;
    }

    /**
     * Пишет сообщение в stderr, если отладка включена.
     */
    public static void log(String message) {
        if (DEBUG) {
            System.err.println("[goast] " + message);
        }
    }
}
