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
package org.apache.calcite.adapter.xbrl;

import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.PeriodDescriptor;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriodBuilder;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link EntityInfoExtractor}.
 */
@Tag("unit")
class EntityInfoExtractorTest {
  private final Map<String, Context> contexts = new LinkedHashMap<>();
  private final FactStore.Builder facts = FactStore.builder();

  EntityInfoExtractorTest() {
    contexts.put("d", new Context("d", "0000320193", "http://www.sec.gov/CIK",
        PeriodDescriptor.duration("2024-09-29", "2024-12-28"), ImmutableMap.<String, String>of()));
    contexts.put("seg", new Context("seg", "0000320193", "http://www.sec.gov/CIK",
        PeriodDescriptor.duration("2024-09-29", "2024-12-28"),
        ImmutableMap.of("dei_LegalEntityAxis", "acme_SubsidiaryMember")));
  }

  private EntityInfoExtractorTest dei(String localName, String contextRef, String value) {
    facts.add(new Fact("dei_" + localName, contextRef, value, null, null, null, null));
    return this;
  }

  private EntityInfo extract() {
    ReportingPeriods periods = new ReportingPeriodBuilder().build(contexts.values());
    Result<EntityInfo> result =
        new EntityInfoExtractor().extract(facts.build(), contexts, periods);
    assertFalse(result.hasWarnings());
    return result.getValue();
  }

  @Test
  void testQuarterlyAmendment() {
    dei("DocumentType", "d", "10-Q/A")
        .dei("DocumentFiscalYearFocus", "d", "2025")
        .dei("DocumentFiscalPeriodFocus", "d", "Q1")
        .dei("CurrentFiscalYearEndDate", "d", "--09-27");
    EntityInfo info = extract();
    assertTrue(info.isAmendment());
    assertTrue(info.isQuarterlyReport());
    assertFalse(info.isAnnualReport());
    assertEquals("320193", info.getIdentifier());
    assertEquals(Integer.valueOf(2025), info.getFiscalYear());
    assertEquals("Q1", info.getFiscalPeriod());
    assertEquals(Integer.valueOf(9), info.getFiscalYearEndMonth());
    assertEquals(Integer.valueOf(27), info.getFiscalYearEndDay());
  }

  @Test
  void testAnnualAmendment() {
    dei("DocumentType", "d", "10-K/A");
    EntityInfo info = extract();
    assertTrue(info.isAmendment());
    assertTrue(info.isAnnualReport());
  }

  @Test
  void testReportFlagsWithoutDocumentType() {
    dei("DocumentAnnualReport", "d", "true");
    EntityInfo info = extract();
    assertTrue(info.isAnnualReport());
    assertFalse(info.isQuarterlyReport());
    assertNull(info.getDocumentType());
  }

  @Test
  void testReportFlagsIgnoredWithDocumentType() {
    dei("DocumentType", "d", "8-K").dei("DocumentAnnualReport", "d", "true");
    assertFalse(extract().isAnnualReport());
  }

  @Test
  void testPrefersContextWithoutDimensions() {
    dei("EntityRegistrantName", "seg", "Subsidiary Inc")
        .dei("EntityRegistrantName", "d", "Parent Inc");
    assertEquals("Parent Inc", extract().getEntityName());
  }

  @Test
  void testInvalidValuesAreSkipped() {
    dei("DocumentFiscalYearFocus", "d", "FY2024")
        .dei("CurrentFiscalYearEndDate", "d", "--13-01");
    EntityInfo info = extract();
    assertNull(info.getFiscalYear());
    assertFalse(info.hasFiscalYearEnd());
  }

  @Test
  void testOverlongNumbersLeaveOtherFieldsIntact() {
    dei("DocumentFiscalYearFocus", "d", "202420242024")
        .dei("CurrentFiscalYearEndDate", "d", "--12345678901-31")
        .dei("DocumentType", "d", "10-K")
        .dei("EntityRegistrantName", "d", "Acme Corp");
    EntityInfo info = extract();
    assertNull(info.getFiscalYear());
    assertFalse(info.hasFiscalYearEnd());
    assertTrue(info.isAnnualReport());
    assertEquals("Acme Corp", info.getEntityName());
    assertEquals("320193", info.getIdentifier());
  }

  @Test
  void testParseMonthDay() {
    assertArrayEquals(new int[] {12, 31}, EntityInfoExtractor.parseMonthDay("--12-31"));
    assertArrayEquals(new int[] {6, 30}, EntityInfoExtractor.parseMonthDay("06-30"));
    assertNull(EntityInfoExtractor.parseMonthDay("--12"));
    assertNull(EntityInfoExtractor.parseMonthDay("--00-10"));
    assertNull(EntityInfoExtractor.parseMonthDay("--123-1"));
    assertNull(EntityInfoExtractor.parseMonthDay(null));
  }
}
