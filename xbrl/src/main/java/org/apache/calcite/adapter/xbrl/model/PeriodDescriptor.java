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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Period of a context: exactly one of an instant, a start/end duration, or forever.
 * Dates are kept as the literal strings from the instance document.
 */
public final class PeriodDescriptor {

  /** Kind of period. */
  public enum Kind { INSTANT, DURATION, FOREVER }

  private static final PeriodDescriptor FOREVER =
      new PeriodDescriptor(Kind.FOREVER, null, null, null);

  private final Kind kind;
  private final @Nullable String instant;
  private final @Nullable String startDate;
  private final @Nullable String endDate;

  private PeriodDescriptor(Kind kind, @Nullable String instant, @Nullable String startDate,
      @Nullable String endDate) {
    this.kind = kind;
    this.instant = instant;
    this.startDate = startDate;
    this.endDate = endDate;
  }

  public static PeriodDescriptor instant(String date) {
    return new PeriodDescriptor(Kind.INSTANT, date, null, null);
  }

  public static PeriodDescriptor duration(String startDate, String endDate) {
    return new PeriodDescriptor(Kind.DURATION, null, startDate, endDate);
  }

  public static PeriodDescriptor forever() {
    return FOREVER;
  }

  public Kind getKind() { return kind; }
  public @Nullable String getInstant() { return instant; }
  public @Nullable String getStartDate() { return startDate; }
  public @Nullable String getEndDate() { return endDate; }

  public boolean isInstant() {
    return kind == Kind.INSTANT;
  }

  public boolean isDuration() {
    return kind == Kind.DURATION;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PeriodDescriptor)) {
      return false;
    }
    PeriodDescriptor that = (PeriodDescriptor) o;
    return kind == that.kind
        && Objects.equals(instant, that.instant)
        && Objects.equals(startDate, that.startDate)
        && Objects.equals(endDate, that.endDate);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, instant, startDate, endDate);
  }

  @Override public String toString() {
    switch (kind) {
      case INSTANT:
        return "As of " + instant;
      case DURATION:
        return "From " + startDate + " to " + endDate;
      default:
        return "Forever";
    }
  }
}
