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

import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.StatementType;
import org.apache.calcite.adapter.xbrl.statement.StatementData;
import org.apache.calcite.adapter.xbrl.statement.StatementInfo;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.END_2023;
import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.END_2024;
import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.FY2024;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link XbrlDocument} and {@link XbrlDocumentBuilder}.
 */
@Tag("unit")
class XbrlDocumentTest {
  private static XbrlDocument document;

  @BeforeAll
  static void load() {
    document = XbrlTestFixtures.acme();
  }

  private static String minimal(String fileName) {
    return XbrlTestFixtures.readResource("xbrl/minimal/" + fileName);
  }

  @Test
  void testMinimalBalanceSheet() {
    XbrlDocument minimal = XbrlDocument.builder()
        .presentation(minimal("minimal_pre.xml"), "minimal_pre.xml")
        .instance(minimal("minimal.xml"), "minimal.xml")
        .build();

    List<LineItem> items = minimal.getStatement("BalanceSheet");
    assertEquals(2, items.size());

    LineItem root = items.get(0);
    assertEquals("us-gaap_StatementOfFinancialPositionAbstract", root.getConcept());
    assertTrue(root.isAbstract());
    assertTrue(root.getValues().isEmpty());

    LineItem assets = items.get(1);
    assertEquals("us-gaap_Assets", assets.getConcept());
    assertEquals(ImmutableMap.of("instant_2024-12-31", 1000.0), assets.getValues());
    assertEquals(Integer.valueOf(-3), assets.getDecimals().get("instant_2024-12-31"));
    assertEquals(1, assets.getLevel());
  }

  /** A schema whose embedded presentation link hangs Liabilities under the root. */
  private static final String EMBEDDED_SCHEMA = "<?xml version=\"1.0\"?>\n"
      + "<xsd:schema xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\"\n"
      + "    xmlns:link=\"http://www.xbrl.org/2003/linkbase\"\n"
      + "    xmlns:xlink=\"http://www.w3.org/1999/xlink\">\n"
      + "  <xsd:annotation><xsd:appinfo>\n"
      + "    <link:linkbase>\n"
      + "      <link:presentationLink xlink:type=\"extended\""
      + " xlink:role=\"http://example.com/role/BalanceSheet\">\n"
      + "        <link:loc xlink:href=\"#us-gaap_StatementOfFinancialPositionAbstract\""
      + " xlink:label=\"root\"/>\n"
      + "        <link:loc xlink:href=\"#us-gaap_Liabilities\" xlink:label=\"liab\"/>\n"
      + "        <link:presentationArc xlink:from=\"root\" xlink:to=\"liab\" order=\"1\"/>\n"
      + "      </link:presentationLink>\n"
      + "    </link:linkbase>\n"
      + "  </xsd:appinfo></xsd:annotation>\n"
      + "</xsd:schema>\n";

  @Test
  void testStandaloneLinkbaseReplacesEmbedded() {
    String role = "http://example.com/role/BalanceSheet";
    XbrlDocument embeddedOnly = XbrlDocument.builder()
        .schema(EMBEDDED_SCHEMA, "embedded.xsd")
        .instance(minimal("minimal.xml"), "minimal.xml")
        .build();
    assertTrue(embeddedOnly.getPresentationTrees().get(role).contains("us-gaap_Liabilities"));

    XbrlDocument both = XbrlDocument.builder()
        .schema(EMBEDDED_SCHEMA, "embedded.xsd")
        .presentation(minimal("minimal_pre.xml"), "minimal_pre.xml")
        .instance(minimal("minimal.xml"), "minimal.xml")
        .build();
    assertEquals(1, both.getPresentationTrees().size());
    assertTrue(both.getPresentationTrees().get(role).contains("us-gaap_Assets"));
    assertFalse(both.getPresentationTrees().get(role).contains("us-gaap_Liabilities"));
    List<LineItem> items = both.getStatement("BalanceSheet");
    assertEquals("us-gaap_Assets", items.get(1).getConcept());
  }

  @Test
  void testStatements() {
    List<StatementInfo> statements = document.getAllStatements();
    assertEquals(4, statements.size());

    StatementData balance = document.getStatementByType(StatementType.BALANCE_SHEET);
    assertNotNull(balance);
    assertEquals(XbrlTestFixtures.BALANCE_SHEET_ROLE, balance.getRole());
    assertEquals(ImmutableMap.of(END_2024, "Dec 31, 2024", END_2023, "Dec 31, 2023"),
        balance.getPeriods());

    List<LineItem> filtered = document.getStatement("IncomeStatement", FY2024);
    for (LineItem item : filtered) {
      for (String key : item.getValues().keySet()) {
        assertEquals(FY2024, key);
      }
    }
    assertTrue(document.getStatement("EquityStatement").isEmpty());
    assertNull(document.getStatementByType("EquityStatement"));
  }

  @Test
  void testEntityInfo() {
    EntityInfo info = document.getEntityInfo();
    assertEquals("Acme Corp", info.getEntityName());
    assertEquals("ACME", info.getTicker());
    assertEquals("123456", info.getIdentifier());
    assertEquals("10-K", info.getDocumentType());
    assertEquals(Integer.valueOf(2024), info.getFiscalYear());
    assertEquals("FY", info.getFiscalPeriod());
    assertEquals(Integer.valueOf(12), info.getFiscalYearEndMonth());
    assertEquals(Integer.valueOf(31), info.getFiscalYearEndDay());
    assertEquals(LocalDate.of(2024, 12, 31), info.getDocumentPeriodEndDate());
    assertEquals(LocalDate.of(2024, 12, 31), info.getReportingEndDate());
    assertTrue(info.isAnnualReport());
    assertFalse(info.isQuarterlyReport());
    assertFalse(info.isAmendment());
  }

  @Test
  void testFacts() {
    Fact assets = document.getFact("us-gaap:Assets", "c_i2024");
    assertNotNull(assets);
    assertEquals("1,000", assets.getValue());
    assertEquals(1000.0, assets.getNumericValue());
    assertEquals("f7", assets.getFactId());
    assertNull(document.getFact("us-gaap:Assets", "c_forever"));
    assertTrue(document.getFacts().isSignCorrected());
  }

  @Test
  void testContextPeriods() {
    assertEquals(END_2024, document.getContextPeriodMap().get("c_i2024"));
    assertEquals(FY2024, document.getContextPeriodMap().get("c_d2024_products"));
    assertFalse(document.getContextPeriodMap().containsKey("c_forever"));
    assertFalse(document.getPeriodViews("BalanceSheet").isEmpty());
  }

  @Test
  void testMalformedFileIsReported() {
    XbrlProcessingException e = assertThrows(XbrlProcessingException.class,
        () -> XbrlDocument.builder()
            .instance("<xbrl><context id=\"c1\">", "broken.xml")
            .build());
    assertEquals("broken.xml", e.getFileName());
  }

  @Test
  void testEmptyDocument() {
    XbrlDocument empty = XbrlDocument.builder().build();
    assertTrue(empty.getAllStatements().isEmpty());
    assertTrue(empty.getStatement("BalanceSheet").isEmpty());
    assertTrue(empty.getReportingPeriods().isEmpty());
    assertEquals(0, empty.query().count());
  }

  @Test
  void testDefinitionFallsBackToRoleName() {
    assertEquals("Some Statement", XbrlDocumentBuilder.definitionOf(
        "http://acme.com/role/Some_Statement", ImmutableMap.<String, String>of()));
    assertEquals("0001 - Statement - Cover", XbrlDocumentBuilder.definitionOf(
        "http://acme.com/role/Cover",
        ImmutableMap.of("http://acme.com/role/Cover", "0001 - Statement - Cover")));
  }
}
