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
package org.apache.calcite.adapter.xbrl.model;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link FactStore} and {@link Fact}. */
@Tag("unit")
class FactStoreTest {

  private static Fact fact(String elementId, String contextRef, String value) {
    return new Fact(elementId, contextRef, value, "usd", Decimals.of(-6),
        Fact.parseNumeric(value), null);
  }

  @Test
  void testLookupIgnoresSeparatorForm() {
    FactStore store = FactStore.builder()
        .add(fact("us-gaap:Assets", "c1", "1000"))
        .build();
    Fact colon = store.get("us-gaap:Assets", "c1");
    Fact underscore = store.get("us-gaap_Assets", "c1");
    assertNotNull(colon);
    assertSame(colon, underscore);
    assertEquals("us-gaap_Assets", colon.getElementId());
    assertEquals(1, store.getFacts("us-gaap:Assets").size());
  }

  @Test
  void testLaterFactWithSameKeyWins() {
    FactStore store = FactStore.builder()
        .add(fact("us-gaap_Assets", "c1", "1000"))
        .add(fact("us-gaap:Assets", "c1", "2000"))
        .build();
    assertEquals(1, store.size());
    assertEquals(2000.0, store.get("us-gaap_Assets", "c1").getNumericValue());
  }

  @Test
  void testMissingFact() {
    FactStore store = FactStore.builder().add(fact("us-gaap_Assets", "c1", "1")).build();
    assertNull(store.get("us-gaap_Assets", "c2"));
    assertTrue(store.getFacts("us-gaap_Liabilities").isEmpty());
  }

  @Test
  void testReplacementsProduceNewGeneration() {
    Fact original = fact("us-gaap_IncreaseDecreaseInInventories", "c1", "20");
    FactStore store = FactStore.builder().add(original).build();
    FactStore corrected =
        store.withReplacements(ImmutableList.of(original.negate()), true);

    assertEquals(0, store.getGeneration());
    assertFalse(store.isSignCorrected());
    assertEquals(20.0, store.get("us-gaap_IncreaseDecreaseInInventories", "c1")
        .getNumericValue());

    assertEquals(1, corrected.getGeneration());
    assertTrue(corrected.isSignCorrected());
    Fact negated = corrected.get("us-gaap_IncreaseDecreaseInInventories", "c1");
    assertEquals(-20.0, negated.getNumericValue());
    assertEquals("-20", negated.getValue());
  }

  @Test
  void testParseNumeric() {
    assertEquals(1234567.0, Fact.parseNumeric("1,234,567"));
    assertEquals(-0.5, Fact.parseNumeric(" -0.5 "));
    assertNull(Fact.parseNumeric("Acme Corp"));
    assertNull(Fact.parseNumeric(""));
    assertNull(Fact.parseNumeric(null));
  }

  @Test
  void testNegateLeavesTextFactsAlone() {
    Fact text = fact("dei_EntityRegistrantName", "c1", "Acme Corp");
    assertSame(text, text.negate());
    Fact negative = fact("us-gaap_Assets", "c1", "-5");
    assertEquals("5", negative.negate().getValue());
  }

  @Test
  void testDecimals() {
    assertTrue(Decimals.parse("INF").isInfinite());
    assertEquals(0, Decimals.parse("INF").toScale());
    assertEquals(-6, Decimals.parse("-6").toScale());
    assertNull(Decimals.parse("precise"));
    assertNull(Decimals.parse(null));
  }
}
