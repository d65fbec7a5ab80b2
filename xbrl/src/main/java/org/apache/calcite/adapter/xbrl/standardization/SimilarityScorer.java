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

import java.util.Locale;

/**
 * Scores how alike two labels are, from 0 (nothing shared) to 1 (identical).
 */
@FunctionalInterface
public interface SimilarityScorer {

  double score(String label, String standardLabel);

  /**
   * Ratcliff/Obershelp similarity over lower-cased text: twice the number of
   * characters in matching blocks divided by the total length.
   */
  SimilarityScorer RATCLIFF_OBERSHELP = (a, b) -> {
    String left = a.toLowerCase(Locale.ROOT);
    String right = b.toLowerCase(Locale.ROOT);
    int total = left.length() + right.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * Matching.matchingCharacters(left, 0, left.length(), right, 0, right.length())
        / total;
  };

  /** Matching-block computation behind {@link #RATCLIFF_OBERSHELP}. */
  final class Matching {
    private Matching() {
    }

    static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
      int bestI = aLo;
      int bestJ = bLo;
      int bestSize = 0;
      int[] previous = new int[bHi - bLo + 1];
      for (int i = aLo; i < aHi; i++) {
        int[] current = new int[bHi - bLo + 1];
        for (int j = bLo; j < bHi; j++) {
          if (a.charAt(i) == b.charAt(j)) {
            int size = previous[j - bLo] + 1;
            current[j - bLo + 1] = size;
            if (size > bestSize) {
              bestSize = size;
              bestI = i - size + 1;
              bestJ = j - size + 1;
            }
          }
        }
        previous = current;
      }
      if (bestSize == 0) {
        return 0;
      }
      return bestSize
          + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
          + matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
  }
}
