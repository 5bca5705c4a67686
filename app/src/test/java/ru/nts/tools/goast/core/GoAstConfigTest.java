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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GoAstConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @AfterEach
    void clearProperties() {
        System.clearProperty("goast.cacheSize");
        System.clearProperty("goast.templatePackage");
    }

    @Test
    void defaultsAreReadFromClasspath() {
        GoAstConfig config = GoAstConfig.load(mapper);

        assertEquals(5L * 1024 * 1024, config.maxSourceBytes());
        assertEquals(100, config.cacheSize());
        assertEquals("template", config.templatePackage());
        assertEquals("main", config.generatedPackage());
    }

    @Test
    void missingJsonKeysFallBackToDefaults() throws Exception {
        GoAstConfig config = GoAstConfig.fromJson(mapper.readTree("{\"cacheSize\": 7}"));

        assertEquals(7, config.cacheSize());
        assertEquals("template", config.templatePackage());
    }

    @Test
    void systemPropertiesOverrideResource() {
        System.setProperty("goast.cacheSize", "3");
        System.setProperty("goast.templatePackage", "tmpl");

        GoAstConfig config = GoAstConfig.load(mapper);

        assertEquals(3, config.cacheSize());
        assertEquals("tmpl", config.templatePackage());
    }

    @Test
    void sharedInstanceIsStable() {
        assertSame(GoAstConfig.get(), GoAstConfig.get());
    }
}
