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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Индекс строк модуля: переводит байтовые смещения в номера строк и колонок.
 */
public final class PositionIndex {

    private final String unitName;
    private final int[] lineStarts;

    private PositionIndex(String unitName, int[] lineStarts) {
        this.unitName = unitName;
        this.lineStarts = lineStarts;
    }

    /**
     * Строит индекс по исходному тексту (смещения в байтах UTF-8, как у tree-sitter).
     */
    public static PositionIndex of(String unitName, String source) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts.add(i + 1);
            }
        }
        int[] arr = new int[starts.size()];
        for (int i = 0; i < arr.length; i++) {
            arr[i] = starts.get(i);
        }
        return new PositionIndex(unitName, arr);
    }

    public String unitName() {
        return unitName;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Номер строки (1-based) для позиции узла.
     */
    public int line(Position position) {
        if (position.isValid()) {
            return position.line();
        }
        return position.offset() >= 0 ? line(position.offset()) : 0;
    }

    /**
     * Номер строки (1-based) для байтового смещения.
     */
    public int line(int offset) {
        if (offset < 0) {
            return 0;
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /**
     * Полная позиция для байтового смещения.
     */
    public Position position(int offset) {
        int line = line(offset);
        if (line == 0) {
            return Position.NONE;
        }
        return new Position(line, offset - lineStarts[line - 1] + 1, offset);
    }
}
