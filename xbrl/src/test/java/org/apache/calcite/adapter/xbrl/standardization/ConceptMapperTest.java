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

import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ConceptMapper}.
 */
@Tag("unit")
class ConceptMapperTest {
  private static final MappingContext NO_TYPE = MappingContext.of((StatementType) null);

  /** Scores {@code score} against one standard name and nothing against the rest. */
  private static SimilarityScorer only(String standardName, double score) {
    return (label, standard) -> standard.equals(standardName) ? score : 0.0;
  }

  @Test
  void testInferredMappingBelowThresholdIsRejected() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Net Income", 0.79));
    assertNull(mapper.mapConcept("acme_ProfitForTheYear", "Profit for the year", NO_TYPE));
  }

  @Test
  void testInferredMappingAboveThresholdIsApplied() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Net Income", 0.81));
    assertEquals("Net Income",
        mapper.mapConcept("acme_ProfitForTheYear", "Profit for the year", NO_TYPE));
  }

  @Test
  void testThresholdIsExclusive() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty());
    assertFalse(mapper.accepts(0.8));
    assertTrue(mapper.accepts(0.8000001));
  }

  @Test
  void testInvalidThreshold() {
    assertThrows(IllegalArgumentException.class,
        () -> new ConceptMapper(MappingStore.empty(), 1.5, SimilarityScorer.RATCLIFF_OBERSHELP));
  }

  @Test
  void testStoredMappingWinsOverLabel() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.defaults(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Net Income", 1.0));
    assertEquals("Revenue", mapper.mapConcept("us-gaap:Revenues", "Net sales", NO_TYPE));
  }

  @Test
  void testTotalAssetsBoostOnBalanceSheet() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Total Assets", 0.7));
    assertEquals("Total Assets", mapper.mapConcept("acme_AssetsAll", "Total assets, all",
        MappingContext.of(StatementType.BALANCE_SHEET)));
    assertNull(mapper.mapConcept("acme_AssetsAll", "Total assets, all",
        MappingContext.of(StatementType.INCOME_STATEMENT)));
  }

  @Test
  void testRevenueBoostOnIncomeStatement() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Revenue", 0.65));
    ConceptMapper.Inference inference =
        mapper.infer("Net sales", MappingContext.of(StatementType.INCOME_STATEMENT));
    assertNotNull(inference);
    assertEquals("Revenue", inference.getStandardConcept());
    assertEquals(0.85, inference.getScore(), 1e-9);

    // No keyword, no boost
    inference = mapper.infer("Turnover", MappingContext.of(StatementType.INCOME_STATEMENT));
    assertNotNull(inference);
    assertEquals(0.65, inference.getScore(), 1e-9);
  }

  @Test
  void testBoostIsCapped() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Total Assets", 0.95));
    ConceptMapper.Inference inference =
        mapper.infer("Total assets", MappingContext.of(StatementType.BALANCE_SHEET));
    assertNotNull(inference);
    assertEquals(1.0, inference.getScore(), 1e-9);
  }

  @Test
  void testWeakInferenceIsDiscarded() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Goodwill", 0.49));
    assertNull(mapper.infer("Something else", NO_TYPE));
  }

  @Test
  void testDefaultScorerMatchesIdenticalLabels() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty());
    assertEquals("Gross Profit", mapper.mapConcept("acme_GrossProfit", "gross profit", NO_TYPE));
  }

  @Test
  void testLearnMappings() {
    SimilarityScorer scorer = (label, standard) -> {
      if (label.equals("Gross margin") && standard.equals("Gross Profit")) {
        return 0.95;
      }
      if (label.equals("Other earnings") && standard.equals("Net Income")) {
        return 0.6;
      }
      return 0.1;
    };
    ConceptMapper mapper = new ConceptMapper(MappingStore.empty(),
        ConceptMapper.DEFAULT_THRESHOLD, scorer);
    List<LineItem> items = ImmutableList.of(
        LineItem.builder("acme_GrossMargin", "Gross margin").build(),
        LineItem.builder("acme_OtherEarnings", "Other earnings").build(),
        LineItem.builder("acme_Misc", "Miscellaneous").build());

    ConceptMapper.Learning learning = mapper.learnMappings(items, null);

    assertEquals("Gross Profit", learning.getStore().getStandardConcept("acme_GrossMargin"));
    assertNull(learning.getStore().getStandardConcept("acme_OtherEarnings"));
    assertEquals(1, learning.getPending().size());
    ConceptMapper.PendingMapping pending = learning.getPending().get(0);
    assertEquals("acme_OtherEarnings", pending.getConcept());
    assertEquals("Other earnings", pending.getLabel());
    assertEquals("Net Income", pending.getStandardConcept());
    assertEquals(0.6, pending.getScore(), 1e-9);

    // The mapper's own store is untouched
    assertEquals(0, mapper.getStore().size());
  }

  @Test
  void testLearnMappingsSkipsKnownConcepts() {
    ConceptMapper mapper = new ConceptMapper(MappingStore.defaults(),
        ConceptMapper.DEFAULT_THRESHOLD, only("Goodwill", 0.95));
    ConceptMapper.Learning learning = mapper.learnMappings(
        ImmutableList.of(LineItem.builder("us-gaap_Revenues", "Net sales").build()),
        StatementType.INCOME_STATEMENT);
    assertEquals("Revenue", learning.getStore().getStandardConcept("us-gaap_Revenues"));
    assertTrue(learning.getPending().isEmpty());
  }
}
