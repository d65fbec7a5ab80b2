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
import org.apache.calcite.adapter.xbrl.model.CalculationNode;
import org.apache.calcite.adapter.xbrl.model.CalculationTree;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flips the sign of facts whose element carries a negative calculation weight,
 * so that for example an increase in inventories reduces operating cash flow.
 *
 * <p>The correction produces a new {@link FactStore}; the input store is not
 * modified. A store that has already been corrected is returned unchanged.
 */
public class CalculationWeightCorrector {
  private static final Logger LOGGER = LoggerFactory.getLogger(CalculationWeightCorrector.class);

  /**
   * Applies calculation weights.
   *
   * <p>When an element appears in several roles, the weight from the last role
   * read wins. Any failure leaves the facts uncorrected and is reported as a
   * warning.
   *
   * @param facts facts as extracted from the instance document
   * @param trees calculation trees of every role
   * @return the corrected store, with warnings for anything that went wrong
   */
  public Result<FactStore> correct(FactStore facts, Collection<CalculationTree> trees) {
    if (facts.isSignCorrected()) {
      String warning = "Calculation weights were already applied to this fact store";
      LOGGER.warn(warning);
      return Result.of(facts, Collections.singletonList(warning));
    }
    try {
      Map<String, Double> weights = weightsByElement(trees);
      List<Fact> adjusted = new ArrayList<>();
      for (Fact fact : facts.all()) {
        Double weight = weights.get(fact.getElementId());
        if (weight != null && weight < 0 && fact.getNumericValue() != null) {
          Fact negated = fact.negate();
          LOGGER.debug("Adjusted fact {}: {} -> {}", fact.getElementId(),
              fact.getNumericValue(), negated.getNumericValue());
          adjusted.add(negated);
        }
      }
      LOGGER.debug("Applied calculation weights to {} facts", adjusted.size());
      return Result.of(facts.withReplacements(adjusted, true));
    } catch (RuntimeException e) {
      String warning = "Error applying calculation weights: " + e.getMessage();
      LOGGER.warn(warning, e);
      return Result.of(facts, Collections.singletonList(warning));
    }
  }

  /** Normalized element id to weight, across all roles; later roles overwrite earlier ones. */
  static Map<String, Double> weightsByElement(Collection<CalculationTree> trees) {
    Map<String, Double> weights = new HashMap<>();
    for (CalculationTree tree : trees) {
      for (CalculationNode node : tree.getNodes().values()) {
        weights.put(node.getElementId(), node.getWeight());
      }
    }
    return weights;
  }
}
