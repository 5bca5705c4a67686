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
package ru.nts.tools.goast.core.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32C;

/**
 * Менеджер tree-sitter парсера Go.
 * Thread-safe через ThreadLocal парсеров.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * TSLanguage потокобезопасен, загружается один раз.
     */
    private final TSLanguage language = new TreeSitterGo();

    /**
     * ThreadLocal парсеры (TSParser не thread-safe).
     */
    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        parser.setLanguage(language);
        return parser;
    });

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    public TSLanguage getLanguage() {
        return language;
    }

    /**
     * Парсит исходный код Go и возвращает конкретное дерево разбора.
     *
     * @param content исходный код
     * @return дерево tree-sitter
     * @throws IllegalStateException если парсер не вернул дерево
     */
    public TSTree parse(String content) {
        TSTree tree = parsers.get().parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse Go content");
        }
        return tree;
    }

    /**
     * Парсит контент и возвращает дерево вместе с контрольной суммой.
     */
    public ParseResult parseWithContent(String content) {
        return new ParseResult(parse(content), content, crc(content));
    }

    /**
     * Вычисляет CRC32C хеш содержимого.
     */
    public static long crc(String content) {
        CRC32C crc = new CRC32C();
        crc.update(content.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    /**
     * Результат парсинга с контентом.
     */
    public record ParseResult(TSTree tree, String content, long crc32c) {}
}
