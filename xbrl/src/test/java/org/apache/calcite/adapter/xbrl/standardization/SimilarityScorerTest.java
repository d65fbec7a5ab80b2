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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link SimilarityScorer#RATCLIFF_OBERSHELP}.
 */
@Tag("unit")
class SimilarityScorerTest {
  private static final SimilarityScorer SCORER = SimilarityScorer.RATCLIFF_OBERSHELP;

  @Test
  void testIdenticalIgnoringCase() {
    assertEquals(1.0, SCORER.score("Total Assets", "total assets"), 1e-9);
  }

  @Test
  void testEmpty() {
    assertEquals(1.0, SCORER.score("", ""), 1e-9);
    assertEquals(0.0, SCORER.score("", "Revenue"), 1e-9);
  }

  @Test
  void testNothingShared() {
    assertEquals(0.0, SCORER.score("abc", "xyz"), 1e-9);
  }

  @Test
  void testPartialMatch() {
    // One block "bcd" of 3 characters over 8 in total
    assertEquals(0.75, SCORER.score("abcd", "bcde"), 1e-9);
    // Blocks either side of the longest match count too
    assertEquals(2.0 * 5 / 14, SCORER.score("abxcdef", "abycdeg"), 1e-9);
  }
}
