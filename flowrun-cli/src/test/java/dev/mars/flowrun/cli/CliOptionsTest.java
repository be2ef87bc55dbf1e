/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowrun.cli;

import dev.mars.flowrun.core.exceptions.UsageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    @DisplayName("Inline file value")
    void testInlineFile() throws UsageException {
        CliOptions options = CliOptions.parse(new String[]{"execute", "--file=workflow.json"});

        assertEquals("workflow.json", options.getFilePath());
        assertNull(options.getWorkflowId());
        assertFalse(options.isHelp());
    }

    @Test
    @DisplayName("Id value as next argument")
    void testSeparateId() throws UsageException {
        CliOptions options = CliOptions.parse(new String[]{"--id", "5"});

        assertEquals("5", options.getWorkflowId());
        assertNull(options.getFilePath());
    }

    @Test
    @DisplayName("Both sources are parsed, the conflict is reported later")
    void testBothSources() throws UsageException {
        CliOptions options = CliOptions.parse(new String[]{"--id=5", "--file=a.json"});

        assertEquals("5", options.getWorkflowId());
        assertEquals("a.json", options.getFilePath());
    }

    @Test
    @DisplayName("Empty inline value is kept as empty")
    void testEmptyInlineValue() throws UsageException {
        assertEquals("", CliOptions.parse(new String[]{"--file="}).getFilePath());
    }

    @Test
    void testNoArguments() throws UsageException {
        CliOptions options = CliOptions.parse(new String[0]);

        assertNull(options.getFilePath());
        assertNull(options.getWorkflowId());
    }

    @ParameterizedTest
    @ValueSource(strings = {"--help", "-h"})
    void testHelp(String flag) throws UsageException {
        assertTrue(CliOptions.parse(new String[]{"execute", flag}).isHelp());
    }

    @Test
    void testUnknownOption() {
        UsageException e = assertThrows(UsageException.class,
                () -> CliOptions.parse(new String[]{"--verbose=true"}));
        assertEquals("Unknown option: --verbose", e.getMessage());
    }

    @Test
    void testMissingValue() {
        UsageException e = assertThrows(UsageException.class,
                () -> CliOptions.parse(new String[]{"--file", "--id=5"}));
        assertEquals("Option --file expects a value", e.getMessage());

        assertThrows(UsageException.class, () -> CliOptions.parse(new String[]{"--id"}));
    }

    @Test
    @DisplayName("Command word is only accepted first")
    void testMisplacedCommand() {
        UsageException e = assertThrows(UsageException.class,
                () -> CliOptions.parse(new String[]{"--id=5", "execute"}));
        assertEquals("Unexpected argument: execute", e.getMessage());
    }

    @Test
    void testStrayArgument() {
        UsageException e = assertThrows(UsageException.class,
                () -> CliOptions.parse(new String[]{"workflow.json"}));
        assertEquals("Unexpected argument: workflow.json", e.getMessage());
    }
}
