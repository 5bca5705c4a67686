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

/**
 * Результат запроса.
 *
 * @param unitName           имя единицы трансляции
 * @param line               строка объявления (1-based)
 * @param name               имя найденного элемента
 * @param formattedSignature отформатированная сигнатура, тип или путь импорта
 * @param matchKind          вид совпадения
 */
public record QueryMatch(String unitName, int line, String name, String formattedSignature, MatchKind matchKind) {

    public enum MatchKind {
        FUNCTION("function"),
        IMPLEMENTATION("implementation"),
        STRUCT_FIELD("struct"),
        IMPORT("import");

        private final String label;

        MatchKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
