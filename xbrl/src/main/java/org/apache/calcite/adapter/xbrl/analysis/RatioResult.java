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
package org.apache.calcite.adapter.xbrl.analysis;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/** A computed financial ratio with the inputs it was computed from. */
public final class RatioResult {
  private final String name;
  private final double value;
  private final ImmutableMap<String, Double> components;
  private final String periodKey;

  public RatioResult(String name, double value, Map<String, Double> components,
      String periodKey) {
    this.name = name;
    this.value = value;
    this.components = ImmutableMap.copyOf(components);
    this.periodKey = periodKey;
  }

  public String getName() { return name; }
  public double getValue() { return value; }
  public Map<String, Double> getComponents() { return components; }
  public String getPeriodKey() { return periodKey; }

  @Override public String toString() {
    return String.format(Locale.ROOT, "%s=%.2f (%s)", name, value, periodKey);
  }
}
