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
package org.apache.calcite.adapter.xbrl.calc;

import org.apache.calcite.adapter.xbrl.Result;
import org.apache.calcite.adapter.xbrl.XbrlDocument;
import org.apache.calcite.adapter.xbrl.XbrlTestFixtures;
import org.apache.calcite.adapter.xbrl.model.CalculationTree;
import org.apache.calcite.adapter.xbrl.model.Decimals;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.parser.Arc;
import org.apache.calcite.adapter.xbrl.parser.TreeBuilder;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link CalculationWeightCorrector}. */
@Tag("unit")
class CalculationWeightCorrectorTest {

  private static List<CalculationTree> cashFlowTree() {
    List<Arc> arcs = ImmutableList.of(
        new Arc("us-gaap_NetCashProvidedByUsedInOperatingActivities", "us-gaap_NetIncomeLoss",
            null, 1, 1.0, null, false),
        new Arc("us-gaap_NetCashProvidedByUsedInOperatingActivities",
            "us-gaap_IncreaseDecreaseInInventories", null, 2, -1.0, null, false));
    return ImmutableList.of(TreeBuilder.buildCalculationTree("urn:cf", "Cash flows", arcs,
        ElementCatalog.empty()));
  }

  private static FactStore facts() {
    return FactStore.builder()
        .add(new Fact("us-gaap_NetIncomeLoss", "c1", "200", "usd", Decimals.of(-6), 200.0,
            null))
        .add(new Fact("us-gaap_IncreaseDecreaseInInventories", "c1", "20", "usd",
            Decimals.of(-6), 20.0, null))
        .add(new Fact("us-gaap_IncreaseDecreaseInInventories", "c2", "n/a", null, null, null,
            null))
        .build();
  }

  @Test
  void testNegativeWeightNegatesOnce() {
    FactStore input = facts();
    Result<FactStore> result = new CalculationWeightCorrector().correct(input, cashFlowTree());
    FactStore corrected = result.getValue();

    assertFalse(result.hasWarnings());
    assertEquals(-20.0,
        corrected.get("us-gaap_IncreaseDecreaseInInventories", "c1").getNumericValue());
    assertEquals(200.0, corrected.get("us-gaap_NetIncomeLoss", "c1").getNumericValue());
    assertEquals("n/a", corrected.get("us-gaap_IncreaseDecreaseInInventories", "c2").getValue());
    assertTrue(corrected.isSignCorrected());
    assertEquals(1, corrected.getGeneration());

    assertEquals(20.0,
        input.get("us-gaap_IncreaseDecreaseInInventories", "c1").getNumericValue());
    assertFalse(input.isSignCorrected());
  }

  @Test
  void testSecondCorrectionIsRefused() {
    CalculationWeightCorrector corrector = new CalculationWeightCorrector();
    FactStore once = corrector.correct(facts(), cashFlowTree()).getValue();
    Result<FactStore> twice = corrector.correct(once, cashFlowTree());

    assertTrue(twice.hasWarnings());
    assertSame(once, twice.getValue());
    assertEquals(-20.0,
        twice.getValue().get("us-gaap_IncreaseDecreaseInInventories", "c1").getNumericValue());
  }

  @Test
  void testWeightsFromLaterRoleWin() {
    List<CalculationTree> trees = ImmutableList.of(
        TreeBuilder.buildCalculationTree("urn:a", "A", ImmutableList.of(
            new Arc("ex_Total", "ex_Item", null, 1, -1.0, null, false)),
            ElementCatalog.empty()),
        TreeBuilder.buildCalculationTree("urn:b", "B", ImmutableList.of(
            new Arc("ex_Other", "ex_Item", null, 1, 1.0, null, false)),
            ElementCatalog.empty()));
    assertEquals(1.0, CalculationWeightCorrector.weightsByElement(trees).get("ex_Item"));
  }

  @Test
  void testDocumentIsCorrectedExactlyOnce() {
    XbrlDocument document = XbrlTestFixtures.acme();
    FactStore facts = document.getFacts();
    assertEquals(1, facts.getGeneration());
    assertTrue(facts.isSignCorrected());
    assertEquals(-20.0,
        facts.get("us-gaap_IncreaseDecreaseInInventories", "c_d2024").getNumericValue());
    assertEquals(-10.0,
        facts.get("us-gaap_IncreaseDecreaseInInventories", "c_d2023").getNumericValue());
    assertEquals(1200.0, facts.get("us-gaap_CostOfRevenue", "c_d2024").getNumericValue());
  }
}
