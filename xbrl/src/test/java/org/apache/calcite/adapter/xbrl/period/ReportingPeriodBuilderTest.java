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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link ReportingPeriodBuilder}. */
@Tag("unit")
class ReportingPeriodBuilderTest {

  private static Context context(String id, PeriodDescriptor period) {
    return new Context(id, "0000123456", "http://www.sec.gov/CIK", period, ImmutableMap.of());
  }

  @Test
  void testEveryUsableContextHasOnePeriod() {
    List<Context> contexts = ImmutableList.of(
        context("i2024", PeriodDescriptor.instant("2024-12-31")),
        context("i2024b", PeriodDescriptor.instant("2024-12-31")),
        context("fy2024", PeriodDescriptor.duration("2024-01-01", "2024-12-31")),
        context("fy2023", PeriodDescriptor.duration("2023-01-01", "2023-12-31")),
        context("forever", PeriodDescriptor.forever()),
        context("garbled", PeriodDescriptor.instant("December 2024")),
        context("halfDate", PeriodDescriptor.duration("2024-01-01", "soon")));
    ReportingPeriods periods = new ReportingPeriodBuilder().build(contexts);

    assertEquals(3, periods.size());
    assertEquals(4, periods.getContextPeriodKeys().size());
    assertEquals("instant_2024-12-31", periods.periodKeyOf("i2024"));
    assertEquals("instant_2024-12-31", periods.periodKeyOf("i2024b"));
    assertEquals("duration_2024-01-01_2024-12-31", periods.periodKeyOf("fy2024"));
    assertNull(periods.periodKeyOf("forever"));
    assertNull(periods.periodKeyOf("garbled"));
    assertNull(periods.periodKeyOf("halfDate"));
    for (String key : periods.getContextPeriodKeys().values()) {
      assertTrue(periods.get(key) != null, key);
    }
    assertEquals(ImmutableList.of("i2024", "i2024b"),
        periods.get("instant_2024-12-31").getContextIds());
  }

  @Test
  void testMostRecentFirstWithDurationsBeforeInstants() {
    List<Context> contexts = ImmutableList.of(
        context("i2023", PeriodDescriptor.instant("2023-12-31")),
        context("q4", PeriodDescriptor.duration("2024-10-01", "2024-12-31")),
        context("i2024", PeriodDescriptor.instant("2024-12-31")),
        context("fy2024", PeriodDescriptor.duration("2024-01-01", "2024-12-31")));
    List<ReportingPeriod> periods = new ReportingPeriodBuilder().build(contexts).getPeriods();

    assertEquals("duration_2024-01-01_2024-12-31", periods.get(0).getKey());
    assertEquals("duration_2024-10-01_2024-12-31", periods.get(1).getKey());
    assertEquals("instant_2024-12-31", periods.get(2).getKey());
    assertEquals("instant_2023-12-31", periods.get(3).getKey());
    assertEquals(DurationClass.QUARTERLY, periods.get(1).getDurationClass());
  }

  @Test
  void testLabels() {
    ReportingPeriods periods = new ReportingPeriodBuilder().build(ImmutableList.of(
        context("i", PeriodDescriptor.instant("2024-12-31T00:00:00")),
        context("d", PeriodDescriptor.duration("2024-01-01", "2024-12-31"))));
    assertEquals("Dec 31, 2024", periods.get("instant_2024-12-31").getLabel());
    assertEquals("Annual: Jan 1, 2024 to Dec 31, 2024",
        periods.get("duration_2024-01-01_2024-12-31").getLabel());
    assertEquals("Quarterly: Jul 1, 2024 to Sep 30, 2024",
        ReportingPeriodBuilder.durationLabel(LocalDate.of(2024, 7, 1),
            LocalDate.of(2024, 9, 30)));
  }

  @Test
  void testNoContexts() {
    assertTrue(new ReportingPeriodBuilder().build(ImmutableList.of()).isEmpty());
  }
}
