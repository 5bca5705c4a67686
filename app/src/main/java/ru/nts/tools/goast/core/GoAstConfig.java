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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Настройки движка.
 * Значения по умолчанию читаются из ресурса {@code goast-defaults.json},
 * системные свойства {@code goast.*} имеют приоритет.
 *
 * @param maxSourceBytes   максимальный размер исходника для разбора
 * @param cacheSize        максимальное число деревьев в кэше файлов
 * @param templatePackage  имя пакета, которым оборачиваются шаблоны без package
 * @param generatedPackage имя пакета сгенерированных реализаций интерфейсов
 */
public record GoAstConfig(long maxSourceBytes, int cacheSize, String templatePackage, String generatedPackage) {

    static final String RESOURCE = "goast-defaults.json";

    private static final GoAstConfig DEFAULTS = new GoAstConfig(5L * 1024 * 1024, 100, "template", "main");

    private static volatile GoAstConfig instance;

    public static GoAstConfig get() {
        GoAstConfig local = instance;
        if (local == null) {
            synchronized (GoAstConfig.class) {
                local = instance;
                if (local == null) {
                    local = load(new ObjectMapper());
                    instance = local;
                }
            }
        }
        return local;
    }

    /**
     * Загружает конфигурацию из classpath и применяет системные свойства.
     */
    static GoAstConfig load(ObjectMapper mapper) {
        GoAstConfig base = DEFAULTS;
        try (InputStream in = GoAstConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                base = fromJson(mapper.readTree(in));
            } else {
                DebugLog.log("Config resource " + RESOURCE + " not found, using built-in defaults");
            }
        } catch (IOException e) {
            DebugLog.log("Cannot read " + RESOURCE + ": " + e.getMessage());
        }
        return base.withSystemOverrides();
    }

    static GoAstConfig fromJson(JsonNode node) {
        return new GoAstConfig(
                node.path("maxSourceBytes").asLong(DEFAULTS.maxSourceBytes),
                node.path("cacheSize").asInt(DEFAULTS.cacheSize),
                node.path("templatePackage").asText(DEFAULTS.templatePackage),
                node.path("generatedPackage").asText(DEFAULTS.generatedPackage));
    }

    GoAstConfig withSystemOverrides() {
        return new GoAstConfig(
                Long.getLong("goast.maxSourceBytes", maxSourceBytes),
                Integer.getInteger("goast.cacheSize", cacheSize),
                System.getProperty("goast.templatePackage", templatePackage),
                System.getProperty("goast.generatedPackage", generatedPackage));
    }
}
