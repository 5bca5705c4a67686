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

import ru.nts.tools.goast.ast.Expr.Ident;

/**
 * Вхождение идентификатора с его синтаксической ролью.
 *
 * @param ident идентификатор в дереве
 * @param role  роль, определяющая, среди каких символов искать
 * @param write true, если вхождение изменяет переменную (присваивание, ++, range с =)
 */
public record IdentUse(Ident ident, Role role, boolean write) {

    public enum Role {
        /** Объявление: имя функции, типа, переменной, параметра, поля. */
        DECLARATION,
        /** Чтение или запись значения. */
        VALUE,
        /** Селектор {@code x.Name}: поле или метод. */
        MEMBER,
        /** Ключ составного литерала: поле, иначе значение. */
        KEY,
        /** Ссылка на тип. */
        TYPE,
        /** Имя пакета, метка, псевдоним импорта: не связывается с символами. */
        NONE
    }
}
