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
package org.apache.calcite.adapter.xbrl;

import org.apache.calcite.adapter.xbrl.standardization.ConceptMapper;
import org.apache.calcite.adapter.xbrl.standardization.MappingStore;
import org.apache.calcite.adapter.xbrl.standardization.SimilarityScorer;
import org.apache.calcite.adapter.xbrl.statement.RoleResolver;
import org.apache.calcite.adapter.xbrl.statement.StatementRegistry;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Read-only settings shared by every component that parses or combines
 * filings.
 *
 * <p>Operand keys, all optional:
 * <ul>
 *   <li>{@code mappingResource}: classpath JSON with concept mappings</li>
 *   <li>{@code standardizationThreshold}: score an inferred mapping must exceed</li>
 *   <li>{@code maxPeriods}: default number of periods when stitching</li>
 * </ul>
 */
public final class XbrlConfig {
  public static final String MAPPING_RESOURCE = "mappingResource";
  public static final String STANDARDIZATION_THRESHOLD = "standardizationThreshold";
  public static final String MAX_PERIODS = "maxPeriods";

  public static final int DEFAULT_MAX_PERIODS = 8;

  private static final Supplier<XbrlConfig> DEFAULT =
      Suppliers.memoize(() -> builder().build());

  private final StatementRegistry registry;
  private final MappingStore mappingStore;
  private final String mappingResource;
  private final double standardizationThreshold;
  private final int defaultMaxPeriods;

  private XbrlConfig(Builder builder) {
    this.registry = builder.registry;
    this.mappingResource = builder.mappingResource;
    this.mappingStore = builder.mappingStore != null
        ? builder.mappingStore
        : MappingStore.fromResource(builder.mappingResource);
    this.standardizationThreshold = builder.standardizationThreshold;
    this.defaultMaxPeriods = builder.defaultMaxPeriods;
  }

  /** Default registry and the bundled concept mappings. */
  public static XbrlConfig defaults() {
    return DEFAULT.get();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads a Calcite schema operand. */
  public static XbrlConfig fromOperand(Map<String, Object> operand) {
    Builder builder = builder();
    Object resource = operand.get(MAPPING_RESOURCE);
    if (resource != null) {
      builder.mappingResource(resource.toString());
    }
    Object threshold = operand.get(STANDARDIZATION_THRESHOLD);
    if (threshold != null) {
      builder.standardizationThreshold(toDouble(threshold));
    }
    Object maxPeriods = operand.get(MAX_PERIODS);
    if (maxPeriods != null) {
      builder.defaultMaxPeriods((int) toDouble(maxPeriods));
    }
    return builder.build();
  }

  private static double toDouble(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + value, e);
    }
  }

  public StatementRegistry getRegistry() { return registry; }
  public MappingStore getMappingStore() { return mappingStore; }
  public String getMappingResource() { return mappingResource; }
  public double getStandardizationThreshold() { return standardizationThreshold; }
  public int getDefaultMaxPeriods() { return defaultMaxPeriods; }

  public ConceptMapper newConceptMapper() {
    return new ConceptMapper(mappingStore, standardizationThreshold,
        SimilarityScorer.RATCLIFF_OBERSHELP);
  }

  public RoleResolver newRoleResolver() {
    return new RoleResolver();
  }

  public Builder toBuilder() {
    return builder()
        .registry(registry)
        .mappingResource(mappingResource)
        .mappingStore(mappingStore)
        .standardizationThreshold(standardizationThreshold)
        .defaultMaxPeriods(defaultMaxPeriods);
  }

  /** Builder for {@link XbrlConfig}. */
  public static final class Builder {
    private StatementRegistry registry = StatementRegistry.defaults();
    private @Nullable MappingStore mappingStore;
    private String mappingResource = MappingStore.DEFAULT_RESOURCE;
    private double standardizationThreshold = ConceptMapper.DEFAULT_THRESHOLD;
    private int defaultMaxPeriods = DEFAULT_MAX_PERIODS;

    private Builder() {
    }

    public Builder registry(StatementRegistry registry) {
      this.registry = Preconditions.checkNotNull(registry, "registry");
      return this;
    }

    /** Mappings to use as is; when unset they are loaded from the mapping resource. */
    public Builder mappingStore(MappingStore mappingStore) {
      this.mappingStore = Preconditions.checkNotNull(mappingStore, "mappingStore");
      return this;
    }

    public Builder mappingResource(String mappingResource) {
      this.mappingResource = Preconditions.checkNotNull(mappingResource, "mappingResource");
      this.mappingStore = null;
      return this;
    }

    public Builder standardizationThreshold(double threshold) {
      Preconditions.checkArgument(threshold >= 0 && threshold <= 1,
          "standardizationThreshold must be within [0, 1]: %s", threshold);
      this.standardizationThreshold = threshold;
      return this;
    }

    public Builder defaultMaxPeriods(int maxPeriods) {
      Preconditions.checkArgument(maxPeriods > 0, "maxPeriods must be positive: %s", maxPeriods);
      this.defaultMaxPeriods = maxPeriods;
      return this;
    }

    public XbrlConfig build() {
      return new XbrlConfig(this);
    }
  }
}
