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
package org.apache.calcite.adapter.xbrl.query;

import org.apache.calcite.adapter.xbrl.ElementIds;
import org.apache.calcite.adapter.xbrl.XbrlFactsTable;
import org.apache.calcite.adapter.xbrl.model.StatementType;
import org.apache.calcite.adapter.xbrl.period.PeriodFormats;
import org.apache.calcite.schema.ScannableTable;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoublePredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Chainable filter over the facts of a document.
 *
 * <p>Filters are combined with AND and evaluated when a terminal operation
 * runs. For example:
 *
 * <pre>
 * List&lt;Map&lt;String, Object&gt;&gt; revenue = document.query()
 *     .byConcept("Revenue")
 *     .byPeriodType("duration")
 *     .excludeDimensions()
 *     .sortBy(FactsView.PERIOD_END, false)
 *     .execute();
 * </pre>
 */
public class FactQuery {
  private final FactsView view;
  private final List<Predicate<Map<String, Object>>> filters = new ArrayList<>();
  private @Nullable Comparator<Map<String, Object>> order;
  private int limit = -1;

  public FactQuery(FactsView view) {
    this.view = Preconditions.checkNotNull(view, "view");
  }

  // ========== Concept and label ==========

  /** Concepts whose qualified or normalized name contains a match of {@code pattern}. */
  public FactQuery byConcept(String pattern) {
    return byConcept(pattern, false);
  }

  public FactQuery byConcept(String pattern, boolean exact) {
    if (exact) {
      String normalized = ElementIds.normalize(pattern);
      return where(r -> normalized.equals(r.get(FactsView.ELEMENT_ID)));
    }
    Pattern regex = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    return where(r -> find(regex, r.get(FactsView.CONCEPT))
        || find(regex, r.get(FactsView.ELEMENT_ID)));
  }

  public FactQuery byLabel(String pattern) {
    return byLabel(pattern, false);
  }

  public FactQuery byLabel(String pattern, boolean exact) {
    if (exact) {
      return where(r -> pattern.equals(r.get(FactsView.LABEL)));
    }
    Pattern regex = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    return where(r -> find(regex, r.get(FactsView.LABEL)));
  }

  // ========== Values ==========

  /** Numeric facts whose value satisfies {@code predicate}. */
  public FactQuery byValue(DoublePredicate predicate) {
    return where(r -> {
      Object value = r.get(FactsView.NUMERIC_VALUE);
      return value instanceof Double && predicate.test((Double) value);
    });
  }

  /** Numeric facts within an inclusive range; a null bound is open. */
  public FactQuery byValue(@Nullable Double min, @Nullable Double max) {
    return byValue(v -> (min == null || v >= min) && (max == null || v <= max));
  }

  public FactQuery byValue(double exact) {
    return byValue(v -> v == exact);
  }

  // ========== Periods ==========

  /** {@code instant} or {@code duration}. */
  public FactQuery byPeriodType(String periodType) {
    String type = periodType.toLowerCase(Locale.ROOT);
    return where(r -> type.equals(r.get(FactsView.PERIOD_TYPE)));
  }

  public FactQuery byPeriodKey(String periodKey) {
    return where(r -> periodKey.equals(r.get(FactsView.PERIOD_KEY)));
  }

  public FactQuery byPeriodKeys(Collection<String> periodKeys) {
    Set<String> keys = new HashSet<>(periodKeys);
    return where(r -> keys.contains(r.get(FactsView.PERIOD_KEY)));
  }

  public FactQuery byInstantDate(LocalDate date) {
    String text = date.toString();
    return where(r -> text.equals(r.get(FactsView.PERIOD_INSTANT)));
  }

  /** Facts whose instant or end date falls within an inclusive range; a null bound is open. */
  public FactQuery byDateRange(@Nullable LocalDate start, @Nullable LocalDate end) {
    return where(r -> {
      Object text = r.containsKey(FactsView.PERIOD_INSTANT)
          ? r.get(FactsView.PERIOD_INSTANT)
          : r.get(FactsView.PERIOD_END);
      LocalDate date = text == null ? null : PeriodFormats.parseDate(text.toString());
      return date != null
          && (start == null || !date.isBefore(start))
          && (end == null || !date.isAfter(end));
    });
  }

  public FactQuery byFiscalYear(int fiscalYear) {
    return where(r -> Objects.equals(r.get(FactsView.FISCAL_YEAR), fiscalYear));
  }

  public FactQuery byFiscalPeriod(String fiscalPeriod) {
    return where(r -> fiscalPeriod.equalsIgnoreCase(
        String.valueOf(r.get(FactsView.FISCAL_PERIOD))));
  }

  // ========== Dimensions ==========

  /** Facts qualified by the given axis, with any member. */
  public FactQuery byDimension(String axis) {
    String key = FactsView.DIMENSION_PREFIX + ElementIds.normalize(axis);
    return where(r -> r.containsKey(key));
  }

  public FactQuery byDimension(String axis, String member) {
    String key = FactsView.DIMENSION_PREFIX + ElementIds.normalize(axis);
    String normalizedMember = ElementIds.normalize(member);
    return where(r -> normalizedMember.equals(r.get(key)));
  }

  /** Facts without any dimension qualifiers. */
  public FactQuery excludeDimensions() {
    return where(r -> {
      for (String key : r.keySet()) {
        if (key.startsWith(FactsView.DIMENSION_PREFIX)) {
          return false;
        }
      }
      return true;
    });
  }

  // ========== Other ==========

  public FactQuery byStatementType(StatementType type) {
    return where(r -> type.getTypeName().equals(r.get(FactsView.STATEMENT_TYPE)));
  }

  public FactQuery byStatementType(String type) {
    StatementType statementType = StatementType.fromName(type);
    if (statementType == null) {
      return where(r -> type.equals(r.get(FactsView.STATEMENT_TYPE)));
    }
    return byStatementType(statementType);
  }

  /** Facts whose unit id or unit display matches, ignoring case. */
  public FactQuery byUnit(String unit) {
    return where(r -> unit.equalsIgnoreCase(String.valueOf(r.get(FactsView.UNIT_REF)))
        || unit.equalsIgnoreCase(String.valueOf(r.get(FactsView.UNIT))));
  }

  /** Case-insensitive substring search over concept, label and text value. */
  public FactQuery byText(String text) {
    String needle = text.toLowerCase(Locale.ROOT);
    return where(r -> contains(r.get(FactsView.CONCEPT), needle)
        || contains(r.get(FactsView.LABEL), needle)
        || contains(r.get(FactsView.VALUE), needle));
  }

  public FactQuery byCustom(Predicate<Map<String, Object>> predicate) {
    return where(predicate);
  }

  // ========== Ordering ==========

  public FactQuery sortBy(String field) {
    return sortBy(field, true);
  }

  /** Orders by a record field; records lacking the field come last. */
  public FactQuery sortBy(String field, boolean ascending) {
    this.order = (a, b) -> compareValues(a.get(field), b.get(field), ascending);
    return this;
  }

  public FactQuery limit(int limit) {
    Preconditions.checkArgument(limit >= 0, "limit must not be negative: %s", limit);
    this.limit = limit;
    return this;
  }

  // ========== Terminal operations ==========

  public List<Map<String, Object>> execute() {
    List<Map<String, Object>> result = new ArrayList<>();
    for (Map<String, Object> record : view.getRecords()) {
      if (matches(record)) {
        result.add(record);
      }
    }
    if (order != null) {
      result.sort(order);
    }
    if (limit >= 0 && result.size() > limit) {
      return new ArrayList<>(result.subList(0, limit));
    }
    return result;
  }

  public int count() {
    return execute().size();
  }

  /** Matching facts as a Calcite table. */
  public ScannableTable toTable() {
    return new XbrlFactsTable(execute());
  }

  private FactQuery where(Predicate<Map<String, Object>> filter) {
    filters.add(filter);
    return this;
  }

  private boolean matches(Map<String, Object> record) {
    for (Predicate<Map<String, Object>> filter : filters) {
      if (!filter.test(record)) {
        return false;
      }
    }
    return true;
  }

  private static boolean find(Pattern regex, @Nullable Object value) {
    return value != null && regex.matcher(value.toString()).find();
  }

  private static boolean contains(@Nullable Object value, String needle) {
    return value != null && value.toString().toLowerCase(Locale.ROOT).contains(needle);
  }

  @SuppressWarnings("unchecked")
  private static int compareValues(@Nullable Object a, @Nullable Object b, boolean ascending) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : 1) : -1;
    }
    int c;
    if (a instanceof Comparable && a.getClass() == b.getClass()) {
      c = ((Comparable<Object>) a).compareTo(b);
    } else {
      c = a.toString().compareTo(b.toString());
    }
    return ascending ? c : -c;
  }
}
