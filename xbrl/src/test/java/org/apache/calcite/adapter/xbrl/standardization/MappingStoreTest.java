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
package org.apache.calcite.adapter.xbrl.standardization;

import org.apache.calcite.adapter.xbrl.XbrlProcessingException;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MappingStore}.
 */
@Tag("unit")
class MappingStoreTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void testDefaults() {
    MappingStore store = MappingStore.defaults();
    assertEquals("Revenue", store.getStandardConcept("us-gaap_Revenues"));
    assertEquals("Revenue", store.getStandardConcept("us-gaap:Revenues"));
    assertEquals("Total Assets", store.getStandardConcept("us-gaap_Assets"));
    assertEquals("Net Cash from Operating Activities",
        store.getStandardConcept("us-gaap_NetCashProvidedByUsedInOperatingActivities"));
    assertTrue(store.getCompanyConcepts("Net Income").contains("us-gaap_NetIncomeLoss"));
    assertNull(store.getStandardConcept("acme_Widgets"));
  }

  @Test
  void testFlatJson() throws Exception {
    MappingStore store = MappingStore.fromJson(MAPPER.readTree(
        "{\"Revenue\": [\"acme:TotalSales\", \"acme_NetSales\"]}"));
    assertEquals(2, store.size());
    assertEquals("Revenue", store.getStandardConcept("acme_TotalSales"));
    assertEquals("Revenue", store.getStandardConcept("acme:NetSales"));
  }

  @Test
  void testGroupedJson() throws Exception {
    MappingStore store = MappingStore.fromJson(MAPPER.readTree(
        "{\"IncomeStatement\": {\"Revenue\": [\"acme_Sales\"]},"
            + " \"BalanceSheet\": {\"Inventory\": [\"acme_Stock\"]},"
            + " \"comment\": \"ignored\"}"));
    assertEquals(2, store.size());
    assertEquals("Inventory", store.getStandardConcept("acme_Stock"));
    assertTrue(store.getStandardConcepts().contains("Revenue"));
  }

  @Test
  void testFirstMappingOfAConceptWins() throws Exception {
    MappingStore store = MappingStore.fromJson(MAPPER.readTree(
        "{\"Revenue\": [\"acme_Sales\"], \"Gross Profit\": [\"acme_Sales\"]}"));
    assertEquals("Revenue", store.getStandardConcept("acme_Sales"));
  }

  @Test
  void testWithMappingLeavesOriginalUnchanged() {
    MappingStore empty = MappingStore.empty();
    MappingStore one = empty.withMapping("acme:Sales", "Revenue");
    assertEquals(0, empty.size());
    assertEquals(1, one.size());
    assertEquals("Revenue", one.getStandardConcept("acme_Sales"));
    assertTrue(empty.getCompanyConcepts("Revenue").isEmpty());
  }

  @Test
  void testMissingResource() {
    assertThrows(XbrlProcessingException.class,
        () -> MappingStore.fromResource("no_such_mappings.json"));
  }
}
