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

import ru.nts.tools.goast.ast.Expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Каноническое текстовое представление типов.
 * Один и тот же формат используется для сравнения сигнатур и поиска полей по типу.
 *
 * <pre>
 * *User, []string, map[string]int, ...int, chan&lt;- T, func(int) error,
 * List[T], struct{Name string; Age int}
 * </pre>
 */
public final class TypeFormatter {

    private TypeFormatter() {}

    public static String format(Expr type) {
        if (type == null) {
            return "";
        }
        if (type instanceof Ident id) {
            return id.name();
        }
        if (type instanceof SelectorExpr sel) {
            return format(sel.x()) + "." + sel.sel().name();
        }
        if (type instanceof StarExpr star) {
            return "*" + format(star.x());
        }
        if (type instanceof ParenExpr paren) {
            return format(paren.x());
        }
        if (type instanceof ArrayType arr) {
            return "[" + arrayLength(arr.len()) + "]" + format(arr.elt());
        }
        if (type instanceof Ellipsis ell) {
            return "..." + format(ell.elt());
        }
        if (type instanceof MapType map) {
            return "map[" + format(map.key()) + "]" + format(map.value());
        }
        if (type instanceof ChanType chan) {
            return switch (chan.dir()) {
                case SEND -> "chan<- " + format(chan.value());
                case RECV -> "<-chan " + format(chan.value());
                case BOTH -> "chan " + format(chan.value());
            };
        }
        if (type instanceof FuncType fn) {
            return "func" + signature(fn);
        }
        if (type instanceof IndexExpr idx) {
            List<String> args = new ArrayList<>();
            for (Expr arg : idx.indices()) {
                args.add(format(arg));
            }
            return format(idx.x()) + "[" + String.join(", ", args) + "]";
        }
        if (type instanceof StructType struct) {
            return formatStruct(struct);
        }
        return "any";
    }

    /**
     * Сигнатура без имени: {@code (int, string) (bool, error)}.
     * Параметры раскрываются по именам, {@code a, b int} дает {@code (int, int)}.
     */
    public static String signature(FuncType type) {
        StringBuilder sb = new StringBuilder();
        sb.append("(").append(String.join(", ", expandTypes(type.params()))).append(")");
        List<String> results = expandTypes(type.results());
        if (results.size() == 1) {
            sb.append(" ").append(results.get(0));
        } else if (results.size() > 1) {
            sb.append(" (").append(String.join(", ", results)).append(")");
        }
        return sb.toString();
    }

    /**
     * Типы элементов списка, по одному на каждое имя.
     */
    public static List<String> expandTypes(FieldList fields) {
        List<String> result = new ArrayList<>();
        if (fields == null) {
            return result;
        }
        for (Field field : fields.list()) {
            String text = format(field.type());
            int count = field.names().isEmpty() ? 1 : field.names().size();
            for (int i = 0; i < count; i++) {
                result.add(text);
            }
        }
        return result;
    }

    private static String arrayLength(Expr len) {
        if (len == null) {
            return "";
        }
        if (len instanceof BasicLit lit) {
            return lit.value();
        }
        if (len instanceof Ident id) {
            return id.name();
        }
        return "...";
    }

    private static String formatStruct(StructType struct) {
        List<String> parts = new ArrayList<>();
        for (Field field : struct.fields().list()) {
            String type = format(field.type());
            if (field.names().isEmpty()) {
                parts.add(type);
            } else {
                List<String> names = new ArrayList<>();
                for (Ident name : field.names()) {
                    names.add(name.name());
                }
                parts.add(String.join(", ", names) + " " + type);
            }
        }
        return "struct{" + String.join("; ", parts) + "}";
    }
}
