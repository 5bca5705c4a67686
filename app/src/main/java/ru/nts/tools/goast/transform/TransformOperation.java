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

/**
 * Операция преобразования дерева.
 * Возвращает тот же объект, если менять нечего, иначе независимую копию; входное дерево не изменяется.
 */
public interface TransformOperation {

    /**
     * Имя операции (rename, extract, inline).
     */
    String getName();

    /**
     * Выполняет операцию над деревом.
     *
     * @param tree   исходное дерево
     * @param params параметры операции
     * @return новое дерево или {@code tree}, если операция ничего не меняет
     * @throws ru.nts.tools.goast.core.GoAstException если операция невозможна
     */
    GoFile execute(GoFile tree, JsonNode params);

    /**
     * Валидирует параметры операции.
     *
     * @param params параметры для проверки
     * @throws IllegalArgumentException если параметры некорректны
     */
    void validateParams(JsonNode params) throws IllegalArgumentException;
}
