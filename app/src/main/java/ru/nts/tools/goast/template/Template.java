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

import ru.nts.tools.goast.ast.GoFile;

import java.util.Set;

/**
 * Зарегистрированный шаблон. Неизменяем после регистрации.
 *
 * @param name         имя шаблона
 * @param source       исходный текст, как он был передан
 * @param parsed       разобранное дерево (с синтезированным package, если его не было)
 * @param placeholders имена-заполнители, найденные в шаблоне
 * @param synthetic    true, если package был добавлен при регистрации
 */
public record Template(String name, String source, GoFile parsed, Set<String> placeholders, boolean synthetic) {

    public Template {
        placeholders = Set.copyOf(placeholders);
    }
}
