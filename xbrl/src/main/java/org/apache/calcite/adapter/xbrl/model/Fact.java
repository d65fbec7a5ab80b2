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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One reported value, identified by its element and context.
 *
 * <p>Facts are values; {@link #negate()} returns a new instance rather than
 * changing this one.
 */
public final class Fact {
  private final String elementId;
  private final String contextRef;
  private final String value;
  private final @Nullable String unitRef;
  private final @Nullable Decimals decimals;
  private final @Nullable Double numericValue;
  private final @Nullable String factId;

  public Fact(String elementId, String contextRef, String value, @Nullable String unitRef,
      @Nullable Decimals decimals, @Nullable Double numericValue, @Nullable String factId) {
    this.elementId = ElementIds.normalize(elementId);
    this.contextRef = contextRef;
    this.value = value;
    this.unitRef = unitRef;
    this.decimals = decimals;
    this.numericValue = numericValue;
    this.factId = factId;
  }

  /**
   * Parses a numeric value by stripping thousands separators.
   *
   * @return the value, or null when the text is not a number
   */
  public static @Nullable Double parseNumeric(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String cleanValue = text.trim().replace(",", "");
    if (cleanValue.isEmpty()) {
      return null;
    }
    try {
      return Double.parseDouble(cleanValue);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Deduplication key: normalized element id plus context id. */
  public static String key(String elementId, String contextRef) {
    return ElementIds.normalize(elementId) + "|" + contextRef;
  }

  public String getKey() {
    return key(elementId, contextRef);
  }

  public String getElementId() { return elementId; }
  public String getContextRef() { return contextRef; }
  public String getValue() { return value; }
  public @Nullable String getUnitRef() { return unitRef; }
  public @Nullable Decimals getDecimals() { return decimals; }
  public @Nullable Double getNumericValue() { return numericValue; }
  public @Nullable String getFactId() { return factId; }

  public boolean isNumeric() {
    return numericValue != null;
  }

  /**
   * Returns a copy with the sign of both the numeric and the textual value
   * flipped. Non-numeric facts are returned unchanged.
   */
  public Fact negate() {
    if (numericValue == null) {
      return this;
    }
    String text = value;
    if (!text.isEmpty()) {
      text = text.startsWith("-") ? text.substring(1) : "-" + text;
    }
    return new Fact(elementId, contextRef, text, unitRef, decimals, -numericValue, factId);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fact)) {
      return false;
    }
    Fact that = (Fact) o;
    return elementId.equals(that.elementId)
        && contextRef.equals(that.contextRef)
        && value.equals(that.value)
        && Objects.equals(unitRef, that.unitRef)
        && Objects.equals(decimals, that.decimals)
        && Objects.equals(numericValue, that.numericValue)
        && Objects.equals(factId, that.factId);
  }

  @Override public int hashCode() {
    return Objects.hash(elementId, contextRef, value, unitRef, decimals, numericValue);
  }

  @Override public String toString() {
    return String.format("Fact{element='%s', context='%s', value='%s'}",
        elementId, contextRef, value);
  }
}
