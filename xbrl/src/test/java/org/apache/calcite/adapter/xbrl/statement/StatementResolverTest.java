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
package org.apache.calcite.adapter.xbrl.statement;

import org.apache.calcite.adapter.xbrl.XbrlDocument;
import org.apache.calcite.adapter.xbrl.XbrlTestFixtures;
import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.END_2023;
import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.END_2024;
import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.FY2023;
import static org.apache.calcite.adapter.xbrl.XbrlTestFixtures.FY2024;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link StatementResolver}, run against the sample filing.
 */
@Tag("unit")
class StatementResolverTest {
  private static XbrlDocument document;

  @BeforeAll
  static void load() {
    document = XbrlTestFixtures.acme();
  }

  private static LineItem item(List<LineItem> items, String concept) {
    for (LineItem item : items) {
      if (item.getConcept().equals(concept)) {
        return item;
      }
    }
    throw new AssertionError("No line item for " + concept);
  }

  private static List<LineItem> items(List<LineItem> items, String concept) {
    List<LineItem> matching = new ArrayList<>();
    for (LineItem item : items) {
      if (item.getConcept().equals(concept)) {
        matching.add(item);
      }
    }
    return matching;
  }

  // ========== Discovery ==========

  @Test
  void testStatementTypes() {
    List<StatementInfo> statements = document.getAllStatements();
    assertEquals(4, statements.size());
    StatementInfo balanceSheet = document.getAllStatements().get(0);
    assertEquals(XbrlTestFixtures.BALANCE_SHEET_ROLE, balanceSheet.getRole());
    assertEquals(StatementType.BALANCE_SHEET, balanceSheet.getType());
    assertEquals("us-gaap_StatementOfFinancialPositionAbstract",
        balanceSheet.getPrimaryConcept());
    assertEquals(12, balanceSheet.getElementCount());
    assertEquals(StatementType.INCOME_STATEMENT, statements.get(1).getType());
    assertEquals(StatementType.CASH_FLOW_STATEMENT, statements.get(2).getType());
    assertEquals(StatementType.SEGMENT_DISCLOSURE, statements.get(3).getType());
    assertEquals("0010 - Disclosure - Segment Information (Details)",
        statements.get(3).getDefinition());
  }

  @Test
  void testIdentifiers() {
    assertEquals(XbrlTestFixtures.BALANCE_SHEET_ROLE,
        document.getStatementByType(StatementType.BALANCE_SHEET).getRole());
    assertEquals(12, document.getStatement(XbrlTestFixtures.BALANCE_SHEET_ROLE).size());
    assertEquals(12, document.getStatement("ConsolidatedBalanceSheets").size());
    assertEquals(7, document.getStatement("IncomeStatement").size());
    assertEquals(4, document.getStatement("cashflows").size());
    assertTrue(document.getStatement("EquityStatement").isEmpty());
    assertNull(document.getStatementByType("EquityStatement"));
  }

  // ========== Line items ==========

  @Test
  void testBalanceSheet() {
    List<LineItem> items = document.getStatement("BalanceSheet");
    LineItem root = items.get(0);
    assertEquals("us-gaap_StatementOfFinancialPositionAbstract", root.getConcept());
    assertEquals(0, root.getLevel());
    assertTrue(root.isAbstract());
    assertFalse(root.hasValues());

    LineItem assets = item(items, "us-gaap_Assets");
    assertEquals("Total assets", assets.getLabel());
    assertEquals(2, assets.getLevel());
    assertTrue(assets.isTotal());
    assertEquals("debit", assets.getBalance());
    assertEquals(1.0, assets.getWeight());
    assertEquals(ImmutableMap.of(END_2024, 1000.0, END_2023, 900.0), assets.getValues());
    assertEquals(-6, assets.getDecimals().get(END_2024));

    LineItem cash = item(items, "us-gaap_CashAndCashEquivalentsAtCarryingValue");
    assertEquals("Cash and cash equivalents", cash.getLabel());
    assertFalse(cash.isTotal());
  }

  @Test
  void testPeriodFilter() {
    List<LineItem> items = document.getStatement("BalanceSheet", END_2023);
    assertEquals(ImmutableMap.of(END_2023, 900.0), item(items, "us-gaap_Assets").getValues());
    assertEquals(12, items.size());
  }

  @Test
  void testFewestDimensionsWinsOnPrimaryStatements() {
    List<LineItem> items = document.getStatement("IncomeStatement");
    LineItem revenue = item(items, "us-gaap_Revenues");
    assertEquals("Net sales", revenue.getLabel());
    assertEquals(ImmutableMap.of(FY2024, 2000.0, FY2023, 1800.0), revenue.getValues());
    assertEquals(1, items(items, "us-gaap_Revenues").size());
    assertEquals(2.0, item(items, "us-gaap_EarningsPerShareBasic").getNumericValue(FY2024));
  }

  @Test
  void testNegatedLabelsAndWeights() {
    LineItem inventories = item(document.getStatement("CashFlowStatement"),
        "us-gaap_IncreaseDecreaseInInventories");
    assertEquals("Inventories", inventories.getLabel());
    assertEquals(-1, inventories.getPreferredSign());
    assertEquals(-1.0, inventories.getWeight());
    assertEquals(-20.0, inventories.getNumericValue(FY2024));
  }

  @Test
  void testDimensionalRowsOnSegmentStatement() {
    List<LineItem> items = document.getStatement("SegmentDisclosure");
    List<LineItem> revenue = items(items, "us-gaap_Revenues");
    assertEquals(3, revenue.size());

    LineItem header = revenue.get(0);
    assertFalse(header.hasValues());
    assertFalse(header.isDimension());

    LineItem products = revenue.get(1);
    assertEquals("Products", products.getLabel());
    assertTrue(products.isDimension());
    assertEquals(header.getLevel() + 1, products.getLevel());
    assertEquals(ImmutableMap.of(FY2024, 1200.0), products.getValues());
    assertEquals(
        ImmutableMap.of("us-gaap_StatementBusinessSegmentsAxis", "acme_ProductsMember"),
        products.getDimensionMetadata());

    LineItem services = revenue.get(2);
    assertEquals("Services", services.getLabel());
    assertEquals(800.0, services.getNumericValue(FY2024));
  }

  // ========== Statement data ==========

  @Test
  void testStatementPeriods() {
    StatementData balanceSheet = document.getStatementByType(StatementType.BALANCE_SHEET);
    assertEquals(ImmutableList.of(END_2024, END_2023),
        ImmutableList.copyOf(balanceSheet.getPeriods().keySet()));
    assertEquals("Dec 31, 2024", balanceSheet.getPeriods().get(END_2024));

    StatementData income = document.getStatementByType("IncomeStatement");
    assertNotNull(income);
    assertEquals(StatementType.INCOME_STATEMENT, income.getType());
    assertEquals(ImmutableList.of(FY2024, FY2023),
        ImmutableList.copyOf(income.getPeriods().keySet()));
    assertEquals("Annual: Jan 1, 2024 to Dec 31, 2024", income.getPeriods().get(FY2024));
  }
}
