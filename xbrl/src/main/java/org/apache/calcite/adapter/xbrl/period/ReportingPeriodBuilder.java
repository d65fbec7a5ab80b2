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

import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.DurationClass;
import org.apache.calcite.adapter.xbrl.model.PeriodDescriptor;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the distinct instant and duration periods used by a set of contexts.
 *
 * <p>Contexts with a forever period or with dates that do not parse are left
 * out; every other context is mapped to exactly one period key.
 */
public class ReportingPeriodBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReportingPeriodBuilder.class);

  private static final Comparator<ReportingPeriod> MOST_RECENT_FIRST =
      Comparator.comparing(ReportingPeriod::getEndDate).reversed()
          .thenComparing(ReportingPeriod::isInstant)
          .thenComparing(ReportingPeriod::getDays, Comparator.reverseOrder());

  public ReportingPeriods build(Collection<Context> contexts) {
    Map<String, PeriodGroup> groups = new LinkedHashMap<>();
    Map<String, String> contextPeriodKeys = new LinkedHashMap<>();

    for (Context context : contexts) {
      PeriodDescriptor period = context.getPeriod();
      String key;
      if (period.isInstant()) {
        LocalDate date = PeriodFormats.parseDate(period.getInstant());
        if (date == null) {
          LOGGER.debug("Skipping context {} with unparseable instant {}",
              context.getContextId(), period.getInstant());
          continue;
        }
        key = ReportingPeriod.instantKey(date.toString());
        groups.computeIfAbsent(key, k -> new PeriodGroup(null, date))
            .contextIds.add(context.getContextId());
      } else if (period.isDuration()) {
        LocalDate start = PeriodFormats.parseDate(period.getStartDate());
        LocalDate end = PeriodFormats.parseDate(period.getEndDate());
        if (start == null || end == null) {
          LOGGER.debug("Skipping context {} with unparseable duration {} to {}",
              context.getContextId(), period.getStartDate(), period.getEndDate());
          continue;
        }
        key = ReportingPeriod.durationKey(start.toString(), end.toString());
        groups.computeIfAbsent(key, k -> new PeriodGroup(start, end))
            .contextIds.add(context.getContextId());
      } else {
        continue;
      }
      contextPeriodKeys.put(context.getContextId(), key);
    }

    List<ReportingPeriod> periods = new ArrayList<>(groups.size());
    for (PeriodGroup group : groups.values()) {
      periods.add(group.toPeriod());
    }
    periods.sort(MOST_RECENT_FIRST);
    return new ReportingPeriods(periods, contextPeriodKeys);
  }

  /** Label for a duration, e.g. {@code Annual: Jan 1, 2024 to Dec 31, 2024}. */
  static String durationLabel(LocalDate start, LocalDate end) {
    long days = ChronoUnit.DAYS.between(start, end);
    return DurationClass.classify(days).getDisplayName() + ": "
        + PeriodFormats.formatDate(start) + " to " + PeriodFormats.formatDate(end);
  }

  /** Contexts sharing one period; {@code start} is null for instants. */
  private static final class PeriodGroup {
    final @Nullable LocalDate start;
    final LocalDate end;
    final List<String> contextIds = new ArrayList<>();

    PeriodGroup(@Nullable LocalDate start, LocalDate end) {
      this.start = start;
      this.end = end;
    }

    ReportingPeriod toPeriod() {
      if (start == null) {
        return ReportingPeriod.instant(end, PeriodFormats.formatDate(end), contextIds);
      }
      return ReportingPeriod.duration(start, end, durationLabel(start, end), contextIds);
    }
  }
}
