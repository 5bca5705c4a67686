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

import org.treesitter.TSNode;
import ru.nts.tools.goast.ast.GoFile;
import ru.nts.tools.goast.ast.ParsedUnit;
import ru.nts.tools.goast.ast.PositionIndex;
import ru.nts.tools.goast.core.DebugLog;
import ru.nts.tools.goast.core.GoAstConfig;
import ru.nts.tools.goast.core.GoAstErrorCode;
import ru.nts.tools.goast.core.GoAstException;
import ru.nts.tools.goast.core.treesitter.SyntaxChecker.SyntaxCheckResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Разбор исходников Go в {@link ParsedUnit}.
 * Разбор файлов кэшируется; кэш инвалидируется при изменении CRC содержимого.
 */
public final class GoSourceParser {

    private final TreeSitterManager manager;
    private final GoAstConfig config;

    /**
     * Кэш разобранных файлов с CRC для инвалидации.
     */
    private final Map<Path, CachedUnit> cache = new ConcurrentHashMap<>();

    public GoSourceParser() {
        this(TreeSitterManager.getInstance(), GoAstConfig.get());
    }

    public GoSourceParser(TreeSitterManager manager, GoAstConfig config) {
        this.manager = manager;
        this.config = config;
    }

    /**
     * Разбирает исходный текст.
     *
     * @param unitName имя модуля (используется в позициях и сообщениях)
     * @param source   исходный код Go
     * @return разобранный модуль
     * @throws GoAstException EMPTY_SOURCE, FILE_TOO_LARGE или PARSE_FAILED
     */
    public ParsedUnit parse(String unitName, String source) {
        if (source == null || source.isBlank()) {
            throw GoAstException.emptySource(unitName);
        }
        long size = source.getBytes(StandardCharsets.UTF_8).length;
        if (size > config.maxSourceBytes()) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("size", size);
            ctx.put("limit", config.maxSourceBytes());
            throw new GoAstException(GoAstErrorCode.FILE_TOO_LARGE, ctx);
        }

        TreeSitterManager.ParseResult result = manager.parseWithContent(source);
        TSNode root = result.tree().getRootNode();
        SyntaxCheckResult check = SyntaxChecker.check(root, source);
        if (check.hasErrors()) {
            DebugLog.log(unitName + ": " + check.errorCount() + " syntax error(s)");
            throw GoAstException.parseFailed(unitName, check.errors());
        }

        GoFile file = new GoTreeConverter(unitName, source).convertFile(root);
        return new ParsedUnit(unitName, file, PositionIndex.of(unitName, source), source);
    }

    /**
     * Разбирает файл с диска, используя кэш.
     *
     * @throws GoAstException FILE_NOT_FOUND, IO_ERROR, EMPTY_SOURCE или PARSE_FAILED
     */
    public ParsedUnit parse(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        String content;
        try {
            content = Files.readString(normalized, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new GoAstException(GoAstErrorCode.FILE_NOT_FOUND, Map.of("path", path.toString()), e);
        } catch (IOException e) {
            if (!Files.exists(normalized)) {
                throw new GoAstException(GoAstErrorCode.FILE_NOT_FOUND, Map.of("path", path.toString()), e);
            }
            throw new GoAstException(GoAstErrorCode.IO_ERROR, Map.of("path", path.toString()), e);
        }

        long crc = TreeSitterManager.crc(content);
        CachedUnit cached = cache.get(normalized);
        if (cached != null && cached.crc32c() == crc) {
            return cached.unit();
        }

        ParsedUnit unit = parse(path.toString(), content);
        if (cache.size() >= config.cacheSize()) {
            evictOldestEntries(Math.max(1, config.cacheSize() / 4));
        }
        cache.put(normalized, new CachedUnit(unit, crc, Instant.now()));
        return unit;
    }

    /**
     * Инвалидирует кэш для указанного файла.
     */
    public void invalidate(Path path) {
        cache.remove(path.toAbsolutePath().normalize());
    }

    public int getCacheSize() {
        return cache.size();
    }

    /**
     * Удаляет указанное количество старых записей.
     */
    private void evictOldestEntries(int count) {
        DebugLog.log("Evicting " + count + " parsed unit(s) from cache");
        cache.entrySet().stream()
                .sorted((a, b) -> a.getValue().parsedAt().compareTo(b.getValue().parsedAt()))
                .limit(count)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(cache::remove);
    }

    private record CachedUnit(ParsedUnit unit, long crc32c, Instant parsedAt) {}
}
