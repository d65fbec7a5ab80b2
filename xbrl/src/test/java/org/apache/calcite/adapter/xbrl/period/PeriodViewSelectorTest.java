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
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.PeriodDescriptor;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link PeriodViewSelector}. */
@Tag("unit")
class PeriodViewSelectorTest {
  private static final String Q3_2024 = "duration_2024-07-01_2024-09-30";
  private static final String Q2_2024 = "duration_2024-04-01_2024-06-30";
  private static final String Q1_2024 = "duration_2024-01-01_2024-03-31";
  private static final String Q3_2023 = "duration_2023-07-01_2023-09-30";
  private static final String YTD_2024 = "duration_2024-01-01_2024-09-30";
  private static final String YTD_2023 = "duration_2023-01-01_2023-09-30";

  private static final EntityInfo CALENDAR_YEAR =
      EntityInfo.builder().fiscalYearEnd(12, 31).build();

  private static ReportingPeriods periods(String... dateRanges) {
    List<Context> contexts = new ArrayList<>();
    int i = 0;
    for (String range : dateRanges) {
      String[] dates = range.split("/");
      PeriodDescriptor period = dates.length == 1
          ? PeriodDescriptor.instant(dates[0])
          : PeriodDescriptor.duration(dates[0], dates[1]);
      contexts.add(new Context("c" + i++, "1", null, period, ImmutableMap.of()));
    }
    return new ReportingPeriodBuilder().build(contexts);
  }

  private static ReportingPeriods quarterlyFiling() {
    return periods("2024-07-01/2024-09-30", "2024-04-01/2024-06-30",
        "2024-01-01/2024-03-31", "2023-07-01/2023-09-30", "2024-01-01/2024-09-30",
        "2023-01-01/2023-09-30", "2024-09-30", "2023-12-31");
  }

  private static ReportingPeriods annualFiling() {
    return periods("2024-01-01/2024-12-31", "2023-01-01/2023-12-31",
        "2022-01-01/2022-12-31", "2024-12-31", "2023-12-31", "2022-12-31");
  }

  // ========== Flow statements ==========

  @Test
  void testQuarterlyIncomeStatement() {
    List<PeriodView> views = new PeriodViewSelector(quarterlyFiling(), CALENDAR_YEAR)
        .getPeriodViews(StatementType.INCOME_STATEMENT);

    assertEquals(4, views.size());
    assertEquals("Current Quarter vs. Prior Year Quarter", views.get(0).getName());
    assertEquals(ImmutableList.of(Q3_2024, Q3_2023), views.get(0).getPeriodKeys());
    assertEquals("Three Recent Quarters", views.get(1).getName());
    assertEquals(ImmutableList.of(Q3_2024, Q2_2024, Q1_2024), views.get(1).getPeriodKeys());
    assertEquals("Year-to-Date Comparison", views.get(2).getName());
    assertEquals(ImmutableList.of(YTD_2024, YTD_2023), views.get(2).getPeriodKeys());
    assertEquals("YTD and Quarterly Breakdown", views.get(3).getName());
    assertEquals(ImmutableList.of(YTD_2024, Q3_2024, Q2_2024, Q1_2024, Q3_2023),
        views.get(3).getPeriodKeys());
  }

  @Test
  void testAnnualCashFlowStatement() {
    List<PeriodView> views = new PeriodViewSelector(annualFiling(), CALENDAR_YEAR)
        .getPeriodViews("CashFlowStatement");

    assertEquals(2, views.size());
    assertEquals("Three-Year Comparison", views.get(0).getName());
    assertEquals(3, views.get(0).getPeriodKeys().size());
    assertEquals("Annual Comparison", views.get(1).getName());
    assertEquals(ImmutableList.of("duration_2024-01-01_2024-12-31",
        "duration_2023-01-01_2023-12-31"), views.get(1).getPeriodKeys());
  }

  // ========== Balance sheet ==========

  @Test
  void testAnnualBalanceSheet() {
    List<PeriodView> views = new PeriodViewSelector(annualFiling(), CALENDAR_YEAR)
        .getPeriodViews(StatementType.BALANCE_SHEET);

    assertEquals(3, views.size());
    assertEquals("Three Recent Periods", views.get(0).getName());
    assertEquals("Three-Year Annual Comparison", views.get(1).getName());
    assertEquals("Annual Comparison", views.get(2).getName());
    assertEquals(ImmutableList.of("instant_2024-12-31", "instant_2023-12-31"),
        views.get(2).getPeriodKeys());
  }

  @Test
  void testYearEndViewsDependOnlyOnKnownFiscalYearEnd() {
    ReportingPeriods periods = periods("2024-06-30", "2023-12-31", "2022-12-31");
    EntityInfo secondQuarter = EntityInfo.builder()
        .fiscalYearEnd(12, 31)
        .fiscalPeriod("Q2")
        .quarterlyReport(true)
        .build();
    List<PeriodView> views = new PeriodViewSelector(periods, secondQuarter)
        .getPeriodViews(StatementType.BALANCE_SHEET);
    assertEquals(2, views.size());
    assertEquals("Three Recent Periods", views.get(0).getName());
    assertEquals("Annual Comparison", views.get(1).getName());
    assertEquals(ImmutableList.of("instant_2023-12-31", "instant_2022-12-31"),
        views.get(1).getPeriodKeys());

    List<PeriodView> unknownYearEnd = new PeriodViewSelector(periods,
        EntityInfo.builder().fiscalPeriod("FY").build())
        .getPeriodViews(StatementType.BALANCE_SHEET);
    assertEquals(1, unknownYearEnd.size());
    assertEquals("Three Recent Periods", unknownYearEnd.get(0).getName());
  }

  @Test
  void testQuarterEndIsNotAFiscalYearEnd() {
    List<PeriodView> views = new PeriodViewSelector(quarterlyFiling(), CALENDAR_YEAR)
        .getPeriodViews(StatementType.BALANCE_SHEET);
    assertEquals(1, views.size());
    assertEquals("Current vs. Previous Period", views.get(0).getName());
    assertEquals(ImmutableList.of("instant_2024-09-30", "instant_2023-12-31"),
        views.get(0).getPeriodKeys());
  }

  @Test
  void testFiscalYearEndTolerance() {
    assertTrue(PeriodViewSelector.isNearFiscalYearEnd(LocalDate.of(2024, 9, 28), 9, 30));
    assertTrue(PeriodViewSelector.isNearFiscalYearEnd(LocalDate.of(2024, 10, 20), 9, 30));
    assertTrue(PeriodViewSelector.isNearFiscalYearEnd(LocalDate.of(2025, 1, 20), 12, 31));
    assertFalse(PeriodViewSelector.isNearFiscalYearEnd(LocalDate.of(2024, 6, 30), 9, 30));
    assertFalse(PeriodViewSelector.isNearFiscalYearEnd(LocalDate.of(2024, 9, 1), 9, 30));
  }

  // ========== Fallback ==========

  @Test
  void testFallbackForStatementsWithoutRules() {
    ReportingPeriods periods = quarterlyFiling();
    List<PeriodView> views = new PeriodViewSelector(periods, EntityInfo.empty())
        .getPeriodViews(StatementType.SEGMENT_DISCLOSURE);
    assertEquals(1, views.size());
    assertEquals(PeriodViewSelector.MOST_RECENT_PERIODS, views.get(0).getName());
    assertEquals(3, views.get(0).getPeriodKeys().size());
    assertEquals(periods.getPeriods().get(0).getKey(), views.get(0).getPeriodKeys().get(0));

    assertEquals(1, new PeriodViewSelector(periods, EntityInfo.empty())
        .getPeriodViews("NoSuchStatement").size());
  }

  @Test
  void testSingleInstantFallsBack() {
    List<PeriodView> views = new PeriodViewSelector(periods("2024-12-31"), EntityInfo.empty())
        .getPeriodViews(StatementType.BALANCE_SHEET);
    assertEquals(1, views.size());
    assertEquals(ImmutableList.of("instant_2024-12-31"), views.get(0).getPeriodKeys());
  }

  @Test
  void testNoPeriods() {
    assertTrue(new PeriodViewSelector(ReportingPeriods.empty(), EntityInfo.empty())
        .getPeriodViews(StatementType.INCOME_STATEMENT).isEmpty());
  }
}
