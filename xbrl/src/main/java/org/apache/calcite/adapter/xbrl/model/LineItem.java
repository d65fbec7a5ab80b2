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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of a resolved statement.
 *
 * <p>{@code values} maps period key to either a {@link Double} (numeric facts)
 * or the raw {@link String} value. {@code decimals} maps period key to the
 * display scale, where infinite precision is 0.
 */
public final class LineItem {
  private final String concept;
  private final String label;
  private final @Nullable String originalLabel;
  private final int level;
  private final boolean isAbstract;
  private final boolean isTotal;
  private final ImmutableMap<String, Object> values;
  private final ImmutableMap<String, Integer> decimals;
  private final ImmutableList<String> children;
  private final @Nullable String preferredLabel;
  private final int preferredSign;
  private final @Nullable String balance;
  private final @Nullable Double weight;
  private final boolean isDimension;
  private final ImmutableMap<String, String> dimensionMetadata;

  private LineItem(Builder b) {
    this.concept = b.concept;
    this.label = b.label;
    this.originalLabel = b.originalLabel;
    this.level = b.level;
    this.isAbstract = b.isAbstract;
    this.isTotal = b.isTotal;
    this.values = ImmutableMap.copyOf(b.values);
    this.decimals = ImmutableMap.copyOf(b.decimals);
    this.children = ImmutableList.copyOf(b.children);
    this.preferredLabel = b.preferredLabel;
    this.preferredSign = b.preferredSign;
    this.balance = b.balance;
    this.weight = b.weight;
    this.isDimension = b.isDimension;
    this.dimensionMetadata = ImmutableMap.copyOf(b.dimensionMetadata);
  }

  public static Builder builder(String concept, String label) {
    return new Builder(concept, label);
  }

  /** Normalized element id. */
  public String getConcept() { return concept; }

  /** Element name without namespace prefix. */
  public String getName() {
    return ElementIds.localName(concept);
  }

  public String getLabel() { return label; }
  public @Nullable String getOriginalLabel() { return originalLabel; }
  public int getLevel() { return level; }
  public boolean isAbstract() { return isAbstract; }
  public boolean isTotal() { return isTotal; }
  public Map<String, Object> getValues() { return values; }
  public Map<String, Integer> getDecimals() { return decimals; }
  public List<String> getChildren() { return children; }
  public @Nullable String getPreferredLabel() { return preferredLabel; }
  public int getPreferredSign() { return preferredSign; }
  public @Nullable String getBalance() { return balance; }
  public @Nullable Double getWeight() { return weight; }
  public boolean isDimension() { return isDimension; }
  public Map<String, String> getDimensionMetadata() { return dimensionMetadata; }

  public boolean hasValues() {
    return !values.isEmpty();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public @Nullable Object getValue(String periodKey) {
    return values.get(periodKey);
  }

  public @Nullable Double getNumericValue(String periodKey) {
    Object value = values.get(periodKey);
    return value instanceof Number ? ((Number) value).doubleValue() : null;
  }

  /** Copy of this item with a new display label, keeping the current one as the original. */
  public LineItem withStandardLabel(String standardLabel) {
    return toBuilder().label(standardLabel).originalLabel(label).build();
  }

  public Builder toBuilder() {
    Builder b = new Builder(concept, label)
        .originalLabel(originalLabel)
        .level(level)
        .isAbstract(isAbstract)
        .isTotal(isTotal)
        .children(children)
        .preferredLabel(preferredLabel)
        .preferredSign(preferredSign)
        .balance(balance)
        .weight(weight)
        .isDimension(isDimension)
        .dimensionMetadata(dimensionMetadata);
    b.values.putAll(values);
    b.decimals.putAll(decimals);
    return b;
  }

  @Override public String toString() {
    return String.format("LineItem{concept='%s', label='%s', level=%d, values=%s}",
        concept, label, level, values);
  }

  /** Builder for {@link LineItem}. */
  public static final class Builder {
    private final String concept;
    private String label;
    private @Nullable String originalLabel;
    private int level;
    private boolean isAbstract;
    private boolean isTotal;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Integer> decimals = new LinkedHashMap<>();
    private List<String> children = ImmutableList.of();
    private @Nullable String preferredLabel;
    private int preferredSign = 1;
    private @Nullable String balance;
    private @Nullable Double weight;
    private boolean isDimension;
    private Map<String, String> dimensionMetadata = ImmutableMap.of();

    private Builder(String concept, String label) {
      this.concept = ElementIds.normalize(concept);
      this.label = label;
    }

    public Builder label(String label) {
      this.label = label;
      return this;
    }

    public Builder originalLabel(@Nullable String originalLabel) {
      this.originalLabel = originalLabel;
      return this;
    }

    public Builder level(int level) {
      this.level = level;
      return this;
    }

    public Builder isAbstract(boolean isAbstract) {
      this.isAbstract = isAbstract;
      return this;
    }

    public Builder isTotal(boolean isTotal) {
      this.isTotal = isTotal;
      return this;
    }

    public Builder value(String periodKey, Object value) {
      values.put(periodKey, value);
      return this;
    }

    public Builder decimals(String periodKey, int scale) {
      decimals.put(periodKey, scale);
      return this;
    }

    public Builder children(List<String> children) {
      this.children = children;
      return this;
    }

    public Builder preferredLabel(@Nullable String preferredLabel) {
      this.preferredLabel = preferredLabel;
      return this;
    }

    public Builder preferredSign(int preferredSign) {
      this.preferredSign = preferredSign;
      return this;
    }

    public Builder balance(@Nullable String balance) {
      this.balance = balance;
      return this;
    }

    public Builder weight(@Nullable Double weight) {
      this.weight = weight;
      return this;
    }

    public Builder isDimension(boolean isDimension) {
      this.isDimension = isDimension;
      return this;
    }

    public Builder dimensionMetadata(Map<String, String> dimensionMetadata) {
      this.dimensionMetadata = dimensionMetadata;
      return this;
    }

    public boolean hasValues() {
      return !values.isEmpty();
    }

    public LineItem build() {
      return new LineItem(this);
    }
  }
}
