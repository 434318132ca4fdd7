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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, name-keyed collection of rules owned by a single metric.
 *
 * <p>The registry has a build phase and an evaluation phase: {@link #seal()} is
 * called by the owning metric on its first evaluation, after which registration
 * is rejected until {@link #clear()} reopens the registry.</p>
 *
 * @param <R> the rule type
 */
@Slf4j
public class RuleRegistry<R> {

    private final String owner;
    private final Map<String, R> rules = new LinkedHashMap<>();
    private volatile boolean sealed;

    public RuleRegistry(String owner) {
        this.owner = owner;
    }

    /**
     * Registers a rule under a unique name.
     *
     * @param name the rule name
     * @param rule the rule
     * @throws ConfigurationException if the name is taken or the registry is sealed
     */
    public synchronized void register(String name, R rule) {
        if (sealed) {
            throw new ConfigurationException("Metric '" + owner
                    + "' has already been evaluated; call clear() before adding rule '" + name + "'");
        }
        if (rules.containsKey(name)) {
            throw new ConfigurationException("A rule named '" + name + "' already exists in metric '" + owner + "'");
        }
        rules.put(name, rule);
    }

    public synchronized void seal() {
        if (!sealed) {
            sealed = true;
            log.debug("Sealed {} rule(s) of metric '{}'", rules.size(), owner);
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    public synchronized void clear() {
        rules.clear();
        sealed = false;
    }

    public synchronized boolean contains(String name) {
        return rules.containsKey(name);
    }

    public synchronized Optional<R> find(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public synchronized Collection<R> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }

    public synchronized Map<String, R> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public synchronized boolean isEmpty() {
        return rules.isEmpty();
    }

    public synchronized int size() {
        return rules.size();
    }
}
