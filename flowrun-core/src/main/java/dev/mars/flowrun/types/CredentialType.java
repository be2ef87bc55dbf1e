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

package dev.mars.flowrun.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Description of a credential type: its name and the properties its data carries.
 */
public class CredentialType {

    private final String name;
    private final String displayName;
    private final List<String> properties;

    @JsonCreator
    public CredentialType(@JsonProperty("name") String name,
                          @JsonProperty("displayName") String displayName,
                          @JsonProperty("properties") List<String> properties) {
        this.name = Objects.requireNonNull(name, "Credential type name cannot be null");
        this.displayName = displayName != null ? displayName : name;
        this.properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialType that = (CredentialType) o;
        return name.equals(that.name) &&
               Objects.equals(displayName, that.displayName) &&
               Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, displayName, properties);
    }

    @Override
    public String toString() {
        return "CredentialType{name='" + name + "'}";
    }
}
