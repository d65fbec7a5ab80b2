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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * A distinct instant or duration found among the contexts of a filing, with a
 * stable key, a display label and the ids of the contexts that use it.
 */
public final class ReportingPeriod {
  private static final String INSTANT_PREFIX = "instant_";
  private static final String DURATION_PREFIX = "duration_";

  private final String key;
  private final String label;
  private final @Nullable LocalDate instant;
  private final @Nullable LocalDate startDate;
  private final @Nullable LocalDate endDate;
  private final @Nullable DurationClass durationClass;
  private final ImmutableList<String> contextIds;

  private ReportingPeriod(String key, String label, @Nullable LocalDate instant,
      @Nullable LocalDate startDate, @Nullable LocalDate endDate,
      @Nullable DurationClass durationClass, List<String> contextIds) {
    this.key = key;
    this.label = label;
    this.instant = instant;
    this.startDate = startDate;
    this.endDate = endDate;
    this.durationClass = durationClass;
    this.contextIds = ImmutableList.copyOf(contextIds);
  }

  public static ReportingPeriod instant(LocalDate date, String label, List<String> contextIds) {
    return new ReportingPeriod(instantKey(date.toString()), label, date, null, null, null,
        contextIds);
  }

  public static ReportingPeriod duration(LocalDate start, LocalDate end, String label,
      List<String> contextIds) {
    long days = ChronoUnit.DAYS.between(start, end);
    return new ReportingPeriod(durationKey(start.toString(), end.toString()), label, null,
        start, end, DurationClass.classify(days), contextIds);
  }

  public static String instantKey(String date) {
    return INSTANT_PREFIX + date;
  }

  public static String durationKey(String startDate, String endDate) {
    return DURATION_PREFIX + startDate + "_" + endDate;
  }

  /**
   * Recovers the end date (or instant) encoded in a period key.
   *
   * @return the date, or null when the key is not a period key
   */
  public static @Nullable LocalDate endDateOfKey(String key) {
    try {
      if (key.startsWith(INSTANT_PREFIX)) {
        return LocalDate.parse(key.substring(INSTANT_PREFIX.length()));
      }
      if (key.startsWith(DURATION_PREFIX)) {
        String[] parts = key.substring(DURATION_PREFIX.length()).split("_");
        return parts.length == 2 ? LocalDate.parse(parts[1]) : null;
      }
    } catch (DateTimeParseException e) {
      return null;
    }
    return null;
  }

  /** Start date encoded in a duration key, or null for instants and unknown keys. */
  public static @Nullable LocalDate startDateOfKey(String key) {
    if (!key.startsWith(DURATION_PREFIX)) {
      return null;
    }
    String[] parts = key.substring(DURATION_PREFIX.length()).split("_");
    try {
      return parts.length == 2 ? LocalDate.parse(parts[0]) : null;
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  public static boolean isInstantKey(String key) {
    return key.startsWith(INSTANT_PREFIX);
  }

  public String getKey() { return key; }
  public String getLabel() { return label; }
  public @Nullable LocalDate getInstant() { return instant; }
  public @Nullable LocalDate getStartDate() { return startDate; }
  public @Nullable DurationClass getDurationClass() { return durationClass; }
  public List<String> getContextIds() { return contextIds; }

  public boolean isInstant() {
    return instant != null;
  }

  /** The instant date, or the end date of a duration. */
  public LocalDate getEndDate() {
    LocalDate date = instant != null ? instant : endDate;
    if (date == null) {
      throw new IllegalStateException("Period " + key + " has no end date");
    }
    return date;
  }

  /** Length in days; zero for instants. */
  public long getDays() {
    if (startDate == null || endDate == null) {
      return 0;
    }
    return ChronoUnit.DAYS.between(startDate, endDate);
  }

  @Override public String toString() {
    return key;
  }
}
