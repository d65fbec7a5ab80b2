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
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proposes period views for a statement from an ordered chain of
 * {@link PeriodViewRule}s.
 *
 * <p>Balance sheets use instants. Flow statements use annual, quarterly and
 * year-to-date durations. When no rule produces a view, a generic
 * "Most Recent Periods" view with at most three periods is returned.
 */
public class PeriodViewSelector {
  static final String MOST_RECENT_PERIODS = "Most Recent Periods";

  private static final int FISCAL_MONTH_TOLERANCE = 1;
  private static final int FISCAL_DAY_TOLERANCE = 15;
  private static final int MAX_BREAKDOWN_QUARTERS = 4;
  private static final int MAX_BREAKDOWN_COLUMNS = 5;

  private static final List<PeriodViewRule> INSTANT_RULES = ImmutableList.of(
      PeriodViewSelector::recentInstants,
      PeriodViewSelector::fiscalYearEndInstants);

  private static final List<PeriodViewRule> DURATION_RULES = ImmutableList.of(
      PeriodViewSelector::annualComparisons,
      PeriodViewSelector::quarterlyComparisons,
      PeriodViewSelector::yearToDateComparisons,
      PeriodViewSelector::yearToDateAndQuarters);

  private final ReportingPeriods periods;
  private final EntityInfo entityInfo;

  public PeriodViewSelector(ReportingPeriods periods, EntityInfo entityInfo) {
    this.periods = periods;
    this.entityInfo = entityInfo;
  }

  /** Views for a statement type name such as {@code BalanceSheet}; never null. */
  public List<PeriodView> getPeriodViews(String statementType) {
    return getPeriodViews(StatementType.fromName(statementType));
  }

  public List<PeriodView> getPeriodViews(@Nullable StatementType statementType) {
    if (periods.isEmpty()) {
      return Collections.emptyList();
    }
    List<PeriodViewRule> rules;
    List<ReportingPeriod> fallback;
    if (statementType == null) {
      rules = ImmutableList.of();
      fallback = periods.getPeriods();
    } else if (statementType.isInstantBased()) {
      rules = INSTANT_RULES;
      fallback = periods.instants();
    } else if (statementType.isCore()) {
      rules = DURATION_RULES;
      fallback = periods.durations();
    } else {
      rules = ImmutableList.of();
      fallback = periods.getPeriods();
    }

    List<PeriodView> views = new ArrayList<>();
    for (PeriodViewRule rule : rules) {
      views.addAll(rule.propose(periods, entityInfo));
    }
    if (views.isEmpty() && !fallback.isEmpty()) {
      views.add(
          new PeriodView(MOST_RECENT_PERIODS, "Shows the most recent reporting periods",
          keys(fallback, 3)));
    }
    return views;
  }

  // ========== Instant rules ==========

  static List<PeriodView> recentInstants(ReportingPeriods periods, EntityInfo entityInfo) {
    List<ReportingPeriod> instants = periods.instants();
    if (instants.size() >= 3) {
      return ImmutableList.of(
          new PeriodView("Three Recent Periods", "Shows the three most recent balance dates",
              keys(instants, 3)));
    }
    if (instants.size() == 2) {
      return ImmutableList.of(
          new PeriodView("Current vs. Previous Period",
              "Shows the current period and the previous period", keys(instants, 2)));
    }
    return ImmutableList.of();
  }

  static List<PeriodView> fiscalYearEndInstants(ReportingPeriods periods,
      EntityInfo entityInfo) {
    if (!entityInfo.hasFiscalYearEnd()) {
      return ImmutableList.of();
    }
    List<ReportingPeriod> yearEnds = new ArrayList<>();
    for (ReportingPeriod period : periods.instants()) {
      if (isNearFiscalYearEnd(period.getEndDate(), entityInfo.getFiscalYearEndMonth(),
          entityInfo.getFiscalYearEndDay())) {
        yearEnds.add(period);
      }
    }
    if (yearEnds.size() < 2) {
      return ImmutableList.of();
    }
    List<PeriodView> views = new ArrayList<>();
    if (yearEnds.size() >= 3) {
      views.add(
          new PeriodView("Three-Year Annual Comparison",
              "Shows three fiscal years for comparison", keys(yearEnds, 3)));
    }
    views.add(
        new PeriodView("Annual Comparison", "Shows two fiscal years for comparison",
            keys(yearEnds, 2)));
    return views;
  }

  /** Whether {@code date} falls within a month and fifteen days of the fiscal year end. */
  static boolean isNearFiscalYearEnd(LocalDate date, int fiscalMonth, int fiscalDay) {
    int monthDiff = Math.abs(date.getMonthValue() - fiscalMonth);
    monthDiff = Math.min(monthDiff, 12 - monthDiff);
    return monthDiff <= FISCAL_MONTH_TOLERANCE
        && Math.abs(date.getDayOfMonth() - fiscalDay) <= FISCAL_DAY_TOLERANCE;
  }

  // ========== Duration rules ==========

  static List<PeriodView> annualComparisons(ReportingPeriods periods, EntityInfo entityInfo) {
    return comparisons(periods.durations(DurationClass.ANNUAL),
        "Three-Year Comparison", "Compares three fiscal years",
        "Annual Comparison", "Compares recent fiscal years");
  }

  static List<PeriodView> quarterlyComparisons(ReportingPeriods periods,
      EntityInfo entityInfo) {
    List<ReportingPeriod> quarters = periods.durations(DurationClass.QUARTERLY);
    if (quarters.size() < 2) {
      return ImmutableList.of();
    }
    List<PeriodView> views = new ArrayList<>();
    if (quarters.size() >= 4) {
      ReportingPeriod current = quarters.get(0);
      for (ReportingPeriod candidate : quarters.subList(1, quarters.size())) {
        long days = ChronoUnit.DAYS.between(candidate.getEndDate(), current.getEndDate());
        if (DurationClass.isAnnual(days)) {
          views.add(
              new PeriodView("Current Quarter vs. Prior Year Quarter",
                  "Compares the current quarter with the same quarter last year",
                  ImmutableList.of(current.getKey(), candidate.getKey())));
          break;
        }
      }
    }
    views.add(
        new PeriodView("Three Recent Quarters", "Shows three most recent quarters in sequence",
            keys(quarters, 3)));
    return views;
  }

  static List<PeriodView> yearToDateComparisons(ReportingPeriods periods,
      EntityInfo entityInfo) {
    return comparisons(periods.durations(DurationClass.YTD),
        "Three-Year YTD Comparison", "Compares year-to-date figures across three years",
        "Year-to-Date Comparison", "Compares year-to-date figures across years");
  }

  static List<PeriodView> yearToDateAndQuarters(ReportingPeriods periods,
      EntityInfo entityInfo) {
    List<ReportingPeriod> ytd = periods.durations(DurationClass.YTD);
    List<ReportingPeriod> quarters = periods.durations(DurationClass.QUARTERLY);
    if (ytd.isEmpty() || quarters.isEmpty()) {
      return ImmutableList.of();
    }
    List<String> keys = new ArrayList<>();
    keys.add(ytd.get(0).getKey());
    for (ReportingPeriod quarter : quarters.subList(0,
        Math.min(MAX_BREAKDOWN_QUARTERS, quarters.size()))) {
      if (!keys.contains(quarter.getKey())) {
        keys.add(quarter.getKey());
      }
    }
    if (keys.size() < 2) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        new PeriodView("YTD and Quarterly Breakdown",
            "Shows YTD figures and quarterly breakdown",
            keys.subList(0, Math.min(MAX_BREAKDOWN_COLUMNS, keys.size()))));
  }

  private static List<PeriodView> comparisons(List<ReportingPeriod> candidates,
      String threeName, String threeDescription, String twoName, String twoDescription) {
    if (candidates.size() < 2) {
      return ImmutableList.of();
    }
    List<PeriodView> views = new ArrayList<>();
    if (candidates.size() >= 3) {
      views.add(new PeriodView(threeName, threeDescription, keys(candidates, 3)));
    }
    views.add(new PeriodView(twoName, twoDescription, keys(candidates, 2)));
    return views;
  }

  private static List<String> keys(List<ReportingPeriod> periods, int limit) {
    List<String> keys = new ArrayList<>();
    for (ReportingPeriod period : periods.subList(0, Math.min(limit, periods.size()))) {
      keys.add(period.getKey());
    }
    return keys;
  }
}
