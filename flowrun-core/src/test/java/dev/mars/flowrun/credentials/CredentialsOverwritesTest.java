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

package dev.mars.flowrun.credentials;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CredentialsOverwritesTest {

    @Test
    void testFillsOnlyEmptyFields() throws Exception {
        CredentialsOverwrites overwrites = new CredentialsOverwrites(
                "{\"httpBasicAuth\": {\"user\": \"svc\", \"password\": \"fallback\", \"realm\": \"corp\"}}");
        overwrites.init();

        Map<String, Object> stored = new HashMap<>();
        stored.put("user", "alice");
        stored.put("password", "");
        stored.put("realm", null);

        Map<String, Object> applied = overwrites.apply("httpBasicAuth", stored);

        assertThat(applied)
                .containsEntry("user", "alice")
                .containsEntry("password", "fallback")
                .containsEntry("realm", "corp");
        assertThat(stored).containsEntry("password", "");
    }

    @Test
    void testOtherTypesUntouched() throws Exception {
        CredentialsOverwrites overwrites = new CredentialsOverwrites("{\"httpBasicAuth\": {\"user\": \"svc\"}}");
        overwrites.init();

        assertThat(overwrites.apply("httpHeaderAuth", Map.of("name", "X-Key")))
                .containsExactly(entry("name", "X-Key"));
        assertThat(overwrites.apply("httpBasicAuth", null)).containsExactly(entry("user", "svc"));
    }

    @Test
    void testEmptyDataMeansNoOverwrites() throws Exception {
        CredentialsOverwrites overwrites = new CredentialsOverwrites("  ");
        overwrites.init();

        assertThat(overwrites.getOverwrites("httpBasicAuth")).isEmpty();
        assertThat(overwrites.apply("httpBasicAuth", Map.of("user", ""))).containsEntry("user", "");
    }

    @Test
    void testMalformedDataFailsInit() {
        CredentialsOverwrites overwrites = new CredentialsOverwrites("{\"httpBasicAuth\": 5}");

        assertThatThrownBy(overwrites::init).isInstanceOf(JsonProcessingException.class);
    }
}
