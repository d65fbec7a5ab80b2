/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.xbrl.model;

import org.apache.calcite.adapter.xbrl.ElementIds;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable collection of facts keyed by (normalized element id, context id).
 *
 * <p>Each store records its generation. A store produced by sign correction
 * carries {@link #isSignCorrected()} so that correction is never applied twice.
 */
public final class FactStore {
  private final ImmutableMap<String, Fact> factsByKey;
  private final ImmutableListMultimap<String, Fact> factsByElement;
  private final int generation;
  private final boolean signCorrected;

  private FactStore(Map<String, Fact> factsByKey, int generation, boolean signCorrected) {
    this.factsByKey = ImmutableMap.copyOf(factsByKey);
    ImmutableListMultimap.Builder<String, Fact> byElement = ImmutableListMultimap.builder();
    for (Fact fact : this.factsByKey.values()) {
      byElement.put(fact.getElementId(), fact);
    }
    this.factsByElement = byElement.build();
    this.generation = generation;
    this.signCorrected = signCorrected;
  }

  public static FactStore empty() {
    return new FactStore(ImmutableMap.of(), 0, false);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Looks up a fact; the element id may use either the colon or the underscore form. */
  public @Nullable Fact get(String elementId, String contextId) {
    return factsByKey.get(Fact.key(elementId, contextId));
  }

  /** All facts reported for an element, across contexts. */
  public List<Fact> getFacts(String elementId) {
    return factsByElement.get(ElementIds.normalize(elementId));
  }

  public Collection<Fact> all() {
    return factsByKey.values();
  }

  public int size() {
    return factsByKey.size();
  }

  public int getGeneration() {
    return generation;
  }

  public boolean isSignCorrected() {
    return signCorrected;
  }

  /**
   * Returns a new store in which each fact with the same key as one of
   * {@code replacements} is replaced. This store is left as it is.
   */
  public FactStore withReplacements(Collection<Fact> replacements, boolean signCorrected) {
    Map<String, Fact> copy = new LinkedHashMap<>(factsByKey);
    for (Fact fact : replacements) {
      copy.put(fact.getKey(), fact);
    }
    return new FactStore(copy, generation + 1, signCorrected);
  }

  /** Collects facts; a later fact with the same key overwrites the earlier one. */
  public static final class Builder {
    private final Map<String, Fact> facts = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder add(Fact fact) {
      facts.put(fact.getKey(), fact);
      return this;
    }

    public int size() {
      return facts.size();
    }

    public FactStore build() {
      return new FactStore(facts, 0, false);
    }
  }

  @Override public String toString() {
    return String.format("FactStore{facts=%d, generation=%d, signCorrected=%s}",
        factsByKey.size(), generation, signCorrected);
  }
}
