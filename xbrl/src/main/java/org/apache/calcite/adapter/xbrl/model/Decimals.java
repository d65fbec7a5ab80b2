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

/**
 * The {@code decimals} attribute of a fact: an integer precision or the
 * {@code INF} sentinel for infinite precision.
 */
public final class Decimals {
  public static final Decimals INF = new Decimals(0, true);

  private final int value;
  private final boolean infinite;

  private Decimals(int value, boolean infinite) {
    this.value = value;
    this.infinite = infinite;
  }

  public static Decimals of(int value) {
    return new Decimals(value, false);
  }

  /** Parses an attribute value; returns null when absent or not a number. */
  public static @Nullable Decimals parse(@Nullable String text) {
    if (text == null || text.trim().isEmpty()) {
      return null;
    }
    String trimmed = text.trim();
    if ("INF".equalsIgnoreCase(trimmed)) {
      return INF;
    }
    try {
      return of(Integer.parseInt(trimmed));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public boolean isInfinite() {
    return infinite;
  }

  public int getValue() {
    return value;
  }

  /** Scale used for display; infinite precision means no scaling. */
  public int toScale() {
    return infinite ? 0 : value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Decimals)) {
      return false;
    }
    Decimals that = (Decimals) o;
    return value == that.value && infinite == that.infinite;
  }

  @Override public int hashCode() {
    return infinite ? Integer.MIN_VALUE : value;
  }

  @Override public String toString() {
    return infinite ? "INF" : Integer.toString(value);
  }
}
