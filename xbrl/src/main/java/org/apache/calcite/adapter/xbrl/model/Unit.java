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

/** A unit of measure: a single measure such as {@code iso4217:USD}, or a ratio of two. */
public final class Unit {
  private final String unitId;
  private final @Nullable String measure;
  private final @Nullable String numerator;
  private final @Nullable String denominator;

  private Unit(String unitId, @Nullable String measure, @Nullable String numerator,
      @Nullable String denominator) {
    this.unitId = unitId;
    this.measure = measure;
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Unit simple(String unitId, String measure) {
    return new Unit(unitId, measure, null, null);
  }

  public static Unit divide(String unitId, String numerator, String denominator) {
    return new Unit(unitId, null, numerator, denominator);
  }

  public String getUnitId() { return unitId; }
  public @Nullable String getMeasure() { return measure; }
  public @Nullable String getNumerator() { return numerator; }
  public @Nullable String getDenominator() { return denominator; }

  public boolean isDivide() {
    return measure == null;
  }

  /** Short form for display, e.g. {@code USD} or {@code USD/shares}. */
  public String getDisplay() {
    if (measure != null) {
      return stripPrefix(measure);
    }
    return stripPrefix(String.valueOf(numerator)) + "/" + stripPrefix(String.valueOf(denominator));
  }

  private static String stripPrefix(String measure) {
    int colon = measure.indexOf(':');
    return colon >= 0 ? measure.substring(colon + 1) : measure;
  }

  @Override public String toString() {
    return unitId + "(" + getDisplay() + ")";
  }
}
