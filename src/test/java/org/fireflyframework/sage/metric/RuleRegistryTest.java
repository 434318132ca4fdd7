/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.sage.metric;

import org.fireflyframework.sage.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleRegistry}.
 */
class RuleRegistryTest {

    @Test
    void register_duplicateName_shouldKeepExistingRule() {
        // Given
        RuleRegistry<String> registry = new RuleRegistry<>("consistency");
        registry.register("adult", "first");

        // When & Then
        assertThatThrownBy(() -> registry.register("adult", "second"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("A rule named 'adult' already exists in metric 'consistency'");
        assertThat(registry.find("adult")).contains("first");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void register_afterSeal_shouldBeRejectedUntilCleared() {
        // Given
        RuleRegistry<String> registry = new RuleRegistry<>("accuracy");
        registry.register("range:age", "rule");
        registry.seal();

        // When & Then
        assertThatThrownBy(() -> registry.register("pattern:email", "rule"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("has already been evaluated");

        registry.clear();
        registry.register("pattern:email", "rule");
        assertThat(registry.isSealed()).isFalse();
        assertThat(registry.asMap()).containsOnlyKeys("pattern:email");
    }

    @Test
    void rules_shouldPreserveRegistrationOrder() {
        // Given
        RuleRegistry<Integer> registry = new RuleRegistry<>("metric");
        registry.register("c", 3);
        registry.register("a", 1);
        registry.register("b", 2);

        // When & Then
        assertThat(registry.rules()).containsExactly(3, 1, 2);
    }
}
