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
package org.apache.calcite.adapter.xbrl.period;

import org.apache.calcite.adapter.xbrl.model.DurationClass;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The reporting periods of one filing, most recent first, and the index from
 * context id to period key.
 */
public final class ReportingPeriods {
  private final ImmutableList<ReportingPeriod> periods;
  private final ImmutableMap<String, ReportingPeriod> byKey;
  private final ImmutableMap<String, String> contextPeriodKeys;

  ReportingPeriods(List<ReportingPeriod> periods, Map<String, String> contextPeriodKeys) {
    this.periods = ImmutableList.copyOf(periods);
    Map<String, ReportingPeriod> keyed = new LinkedHashMap<>();
    for (ReportingPeriod period : periods) {
      keyed.put(period.getKey(), period);
    }
    this.byKey = ImmutableMap.copyOf(keyed);
    this.contextPeriodKeys = ImmutableMap.copyOf(contextPeriodKeys);
  }

  public static ReportingPeriods empty() {
    return new ReportingPeriods(ImmutableList.of(), ImmutableMap.of());
  }

  /** All periods, sorted descending by end date (or instant). */
  public List<ReportingPeriod> getPeriods() {
    return periods;
  }

  public @Nullable ReportingPeriod get(String key) {
    return byKey.get(key);
  }

  /** Period key of a context, or null for forever and unparseable periods. */
  public @Nullable String periodKeyOf(String contextId) {
    return contextPeriodKeys.get(contextId);
  }

  public Map<String, String> getContextPeriodKeys() {
    return contextPeriodKeys;
  }

  /** Period key to display label, most recent first. */
  public Map<String, String> getPeriodLabels() {
    Map<String, String> labels = new LinkedHashMap<>();
    for (ReportingPeriod period : periods) {
      labels.put(period.getKey(), period.getLabel());
    }
    return labels;
  }

  public List<ReportingPeriod> instants() {
    List<ReportingPeriod> result = new ArrayList<>();
    for (ReportingPeriod period : periods) {
      if (period.isInstant()) {
        result.add(period);
      }
    }
    return result;
  }

  public List<ReportingPeriod> durations() {
    List<ReportingPeriod> result = new ArrayList<>();
    for (ReportingPeriod period : periods) {
      if (!period.isInstant()) {
        result.add(period);
      }
    }
    return result;
  }

  /** Durations of the given class, most recent first. */
  public List<ReportingPeriod> durations(DurationClass durationClass) {
    List<ReportingPeriod> result = new ArrayList<>();
    for (ReportingPeriod period : periods) {
      if (period.getDurationClass() == durationClass) {
        result.add(period);
      }
    }
    return result;
  }

  public boolean isEmpty() {
    return periods.isEmpty();
  }

  public int size() {
    return periods.size();
  }
}
