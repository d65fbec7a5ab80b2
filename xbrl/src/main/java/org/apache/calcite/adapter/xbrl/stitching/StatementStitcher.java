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

import org.apache.calcite.adapter.xbrl.XbrlDocument;
import org.apache.calcite.adapter.xbrl.model.DurationClass;
import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.model.StatementType;
import org.apache.calcite.adapter.xbrl.period.PeriodFormats;
import org.apache.calcite.adapter.xbrl.standardization.ConceptMapper;
import org.apache.calcite.adapter.xbrl.standardization.StatementStandardizer;
import org.apache.calcite.adapter.xbrl.statement.StatementData;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Combines the same statement from several filings into one multi-period
 * statement.
 *
 * <p>Statements are expected most recent filing first. Rows are merged by
 * display label, so two concepts sharing a label become one row. Dimension
 * member rows are merged by member label within their parent row. The first
 * filing to report a row fixes its level and flags, and the first filing to
 * report a period fixes that period's value.
 */
public class StatementStitcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(StatementStitcher.class);

  private static final List<String> STRUCTURAL_MARKERS = ImmutableList.of(
      "[Axis]", "[Domain]", "[Member]", "[Line Items]", "[Table]", "[Abstract]");

  private static final Comparator<Candidate> BY_END_DATE_DESC =
      Comparator.comparing((Candidate c) -> c.endDate).reversed();

  private static final String MEMBER_SEPARATOR = "\n";

  private final ConceptMapper mapper;

  public StatementStitcher(ConceptMapper mapper) {
    this.mapper = Preconditions.checkNotNull(mapper, "mapper");
  }

  /** Stitches one statement type out of parsed filings, most recent first. */
  public static StitchedStatement stitchStatements(List<XbrlDocument> documents,
      StatementType type, StitchPolicy policy, int maxPeriods, boolean standardize) {
    List<StatementData> statements = new ArrayList<>();
    ConceptMapper mapper = null;
    for (XbrlDocument document : documents) {
      if (mapper == null) {
        mapper = document.getConfig().newConceptMapper();
      }
      StatementData data = document.getStatementByType(type);
      if (data != null) {
        statements.add(data);
      }
    }
    if (mapper == null) {
      return new StitchedStatement(type, new LinkedHashMap<>(), ImmutableList.of());
    }
    return new StatementStitcher(mapper).stitch(statements, policy, maxPeriods, standardize);
  }

  public StitchedStatement stitch(List<StatementData> statements, StitchPolicy policy,
      int maxPeriods, boolean standardize) {
    Preconditions.checkArgument(maxPeriods > 0, "maxPeriods must be positive: %s", maxPeriods);
    List<Candidate> candidates = extractPeriods(statements);
    List<Candidate> selected = selectPeriods(candidates, policy, maxPeriods);
    Map<String, String> periods = new LinkedHashMap<>();
    for (Candidate candidate : selected) {
      periods.put(candidate.key, candidate.label);
    }

    StatementType type = null;
    Map<String, RowBuilder> rows = new LinkedHashMap<>();
    for (StatementData statement : statements) {
      Set<String> relevant = new HashSet<>(statement.getPeriods().keySet());
      relevant.retainAll(periods.keySet());
      if (relevant.isEmpty()) {
        LOGGER.debug("Skipping {}: no selected periods", statement.getRole());
        continue;
      }
      if (type == null) {
        type = statement.getType();
      }
      List<LineItem> items = standardize
          ? StatementStandardizer.standardize(statement.getLineItems(), mapper,
              statement.getType())
          : statement.getLineItems();
      integrate(items, relevant, rows);
    }

    List<RowBuilder> ordered = new ArrayList<>(rows.values());
    ordered.sort(Comparator.comparingInt((RowBuilder r) -> r.level)
        .thenComparing(r -> r.label));
    List<StitchedRow> result = new ArrayList<>();
    for (RowBuilder row : ordered) {
      if (!row.values.isEmpty() || row.isAbstract || row.hasChildren) {
        result.add(row.build(periods.keySet()));
      }
    }
    LOGGER.debug("Stitched {} statements into {} rows over {}", statements.size(),
        result.size(), periods.keySet());
    return new StitchedStatement(type, periods, result);
  }

  /** Distinct periods across the statements, most recent end date first. */
  static List<Candidate> extractPeriods(List<StatementData> statements) {
    Map<String, Candidate> unique = new LinkedHashMap<>();
    for (StatementData statement : statements) {
      for (String key : statement.getPeriods().keySet()) {
        if (unique.containsKey(key)) {
          continue;
        }
        LocalDate end = ReportingPeriod.endDateOfKey(key);
        if (end == null) {
          LOGGER.debug("Ignoring malformed period key {}", key);
          continue;
        }
        LocalDate start = ReportingPeriod.startDateOfKey(key);
        if (start == null && !ReportingPeriod.isInstantKey(key)) {
          LOGGER.debug("Ignoring malformed period key {}", key);
          continue;
        }
        unique.put(key, new Candidate(key, start, end, PeriodFormats.formatDate(end)));
      }
    }
    List<Candidate> sorted = new ArrayList<>(unique.values());
    sorted.sort(BY_END_DATE_DESC);
    return sorted;
  }

  static List<Candidate> selectPeriods(List<Candidate> candidates, StitchPolicy policy,
      int maxPeriods) {
    List<Candidate> selected = new ArrayList<>();
    Set<Integer> years = new HashSet<>();
    for (Candidate candidate : candidates) {
      if (selected.size() >= maxPeriods) {
        break;
      }
      switch (policy) {
        case THREE_YEAR_COMPARISON:
          if (candidate.isInstant() && years.add(candidate.endDate.getYear())) {
            selected.add(candidate);
          }
          break;
        case RECENT_YEARS:
          if (years.add(candidate.endDate.getYear())) {
            selected.add(candidate);
          }
          break;
        case THREE_QUARTERS:
          if (!candidate.isInstant() && DurationClass.isQuarterly(candidate.days())) {
            selected.add(candidate);
          }
          break;
        case ANNUAL_COMPARISON:
          if (!candidate.isInstant() && DurationClass.isAnnual(candidate.days())) {
            selected.add(candidate);
          }
          break;
        case RECENT_PERIODS:
        case ALL_PERIODS:
        default:
          selected.add(candidate);
          break;
      }
    }
    return selected;
  }

  private static void integrate(List<LineItem> items, Set<String> relevant,
      Map<String, RowBuilder> rows) {
    String parentLabel = "";
    for (LineItem item : items) {
      String label = item.getLabel();
      if (item.getConcept().isEmpty() || label.isEmpty()) {
        continue;
      }
      if (!item.isDimension()) {
        parentLabel = label;
      }
      if (item.isAbstract() && !item.hasChildren()) {
        continue;
      }
      if (isStructural(label)) {
        continue;
      }
      // Member rows share their parent's concept, so they are keyed under it
      String rowKey = item.isDimension() ? parentLabel + MEMBER_SEPARATOR + label : label;
      if (item.isDimension()) {
        RowBuilder parent = rows.get(parentLabel);
        if (parent != null) {
          parent.hasChildren = true;
        }
      }
      RowBuilder row = rows.get(rowKey);
      if (row == null) {
        boolean total = item.isTotal() || label.toLowerCase(Locale.ROOT).contains("total");
        row = new RowBuilder(label, item.getConcept(), item.getLevel(), item.isAbstract(),
            total, item.hasChildren());
        rows.put(rowKey, row);
      }
      for (String key : relevant) {
        Object value = item.getValue(key);
        if (value != null && !row.values.containsKey(key)) {
          row.values.put(key, value);
          Integer scale = item.getDecimals().get(key);
          row.decimals.put(key, scale == null ? 0 : scale);
        }
      }
    }
  }

  private static boolean isStructural(String label) {
    for (String marker : STRUCTURAL_MARKERS) {
      if (label.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  /** A period offered by at least one filing. */
  static final class Candidate {
    final String key;
    final @Nullable LocalDate startDate;
    final LocalDate endDate;
    final String label;

    Candidate(String key, @Nullable LocalDate startDate, LocalDate endDate, String label) {
      this.key = key;
      this.startDate = startDate;
      this.endDate = endDate;
      this.label = label;
    }

    boolean isInstant() {
      return startDate == null;
    }

    long days() {
      return startDate == null ? 0 : endDate.toEpochDay() - startDate.toEpochDay();
    }
  }

  /** Row under construction; its metadata is fixed by the first filing. */
  private static final class RowBuilder {
    final String label;
    final String concept;
    final int level;
    final boolean isAbstract;
    final boolean isTotal;
    boolean hasChildren;
    final Map<String, Object> values = new LinkedHashMap<>();
    final Map<String, Integer> decimals = new LinkedHashMap<>();

    RowBuilder(String label, String concept, int level, boolean isAbstract, boolean isTotal,
        boolean hasChildren) {
      this.label = label;
      this.concept = concept;
      this.level = level;
      this.isAbstract = isAbstract;
      this.isTotal = isTotal;
      this.hasChildren = hasChildren;
    }

    StitchedRow build(Set<String> periodOrder) {
      Map<String, Object> orderedValues = new LinkedHashMap<>();
      Map<String, Integer> orderedDecimals = new LinkedHashMap<>();
      for (String key : periodOrder) {
        if (values.containsKey(key)) {
          orderedValues.put(key, values.get(key));
          orderedDecimals.put(key, decimals.get(key));
        }
      }
      return new StitchedRow(label, concept, level, isAbstract, isTotal, orderedValues,
          orderedDecimals);
    }
  }
}
