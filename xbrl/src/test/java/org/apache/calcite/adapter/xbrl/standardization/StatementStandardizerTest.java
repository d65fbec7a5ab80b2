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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link StatementStandardizer}.
 */
@Tag("unit")
class StatementStandardizerTest {
  private static final String FY2024 = "duration_2024-01-01_2024-12-31";

  @Test
  void testStandardize() {
    LineItem root = LineItem.builder("us-gaap_IncomeStatementAbstract", "Income Statement")
        .isAbstract(true)
        .children(ImmutableList.of("us-gaap_Revenues"))
        .build();
    LineItem sales = LineItem.builder("us-gaap_Revenues", "Net sales")
        .level(1)
        .value(FY2024, 2000.0)
        .decimals(FY2024, -6)
        .build();
    LineItem other = LineItem.builder("acme_Royalties", "Royalties")
        .level(1)
        .value(FY2024, 5.0)
        .build();
    ConceptMapper mapper = new ConceptMapper(MappingStore.defaults(),
        ConceptMapper.DEFAULT_THRESHOLD, (label, standard) -> 0.0);

    List<LineItem> result = StatementStandardizer.standardize(
        ImmutableList.of(root, sales, other), mapper, StatementType.INCOME_STATEMENT);

    assertEquals(3, result.size());
    assertSame(root, result.get(0));

    LineItem revenue = result.get(1);
    assertEquals("Revenue", revenue.getLabel());
    assertEquals("Net sales", revenue.getOriginalLabel());
    assertEquals(2000.0, revenue.getValue(FY2024));
    assertEquals(Integer.valueOf(-6), revenue.getDecimals().get(FY2024));
    assertEquals(1, revenue.getLevel());

    assertEquals("Royalties", result.get(2).getLabel());
    assertNull(result.get(2).getOriginalLabel());
  }

  @Test
  void testAbstractItemsKeepTheirLabel() {
    LineItem header = LineItem.builder("us-gaap_Revenues", "Revenues [Abstract]")
        .isAbstract(true)
        .build();
    ConceptMapper mapper = new ConceptMapper(MappingStore.defaults());
    List<LineItem> result =
        StatementStandardizer.standardize(ImmutableList.of(header), mapper);
    assertEquals("Revenues [Abstract]", result.get(0).getLabel());
  }
}
