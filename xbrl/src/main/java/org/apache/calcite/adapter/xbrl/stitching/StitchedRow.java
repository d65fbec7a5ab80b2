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
package org.apache.calcite.adapter.xbrl.stitching;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/** One concept of a stitched statement with its values per selected period. */
public final class StitchedRow {
  private final String label;
  private final String concept;
  private final int level;
  private final boolean isAbstract;
  private final boolean isTotal;
  private final ImmutableMap<String, Object> values;
  private final ImmutableMap<String, Integer> decimals;

  StitchedRow(String label, String concept, int level, boolean isAbstract, boolean isTotal,
      Map<String, Object> values, Map<String, Integer> decimals) {
    this.label = label;
    this.concept = concept;
    this.level = level;
    this.isAbstract = isAbstract;
    this.isTotal = isTotal;
    this.values = ImmutableMap.copyOf(values);
    this.decimals = ImmutableMap.copyOf(decimals);
  }

  public String getLabel() { return label; }

  /** Concept of the filing that first reported this row. */
  public String getConcept() { return concept; }

  public int getLevel() { return level; }
  public boolean isAbstract() { return isAbstract; }
  public boolean isTotal() { return isTotal; }
  public Map<String, Object> getValues() { return values; }
  public Map<String, Integer> getDecimals() { return decimals; }

  public boolean hasValues() {
    return !values.isEmpty();
  }

  public @Nullable Object getValue(String periodKey) {
    return values.get(periodKey);
  }

  @Override public String toString() {
    return String.format("StitchedRow{label='%s', level=%d, values=%s}", label, level, values);
  }
}
