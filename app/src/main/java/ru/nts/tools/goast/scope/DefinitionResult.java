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
package ru.nts.tools.goast.scope;

/**
 * Результат поиска определения.
 *
 * @param name     имя символа
 * @param kind     вид символа
 * @param unit     имя единицы трансляции
 * @param line     строка объявления (1-based)
 * @param column   колонка объявления (1-based)
 * @param typeText отформатированный тип из объявления, пустая строка если неизвестен
 * @param exported true для экспортируемых имен пакетного уровня и членов типов
 */
public record DefinitionResult(String name, SymbolKind kind, String unit, int line, int column,
                               String typeText, boolean exported) {
}
