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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Maps company concepts onto {@link StandardConcept} display names.
 *
 * <p>A concept already present in the {@link MappingStore} maps directly.
 * Otherwise the label is compared against every standard display name and the
 * best candidate is used when its score, after statement-specific boosts,
 * exceeds the acceptance threshold.
 */
public class ConceptMapper {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConceptMapper.class);

  public static final double DEFAULT_THRESHOLD = 0.8;

  /** Inferred mappings at or above this score are learned without review. */
  public static final double LEARN_THRESHOLD = 0.9;

  /** Inferred mappings below this score are discarded. */
  public static final double MINIMUM_SCORE = 0.5;

  private static final double CONTEXT_BOOST = 0.2;

  private final MappingStore store;
  private final double threshold;
  private final SimilarityScorer scorer;

  public ConceptMapper(MappingStore store) {
    this(store, DEFAULT_THRESHOLD, SimilarityScorer.RATCLIFF_OBERSHELP);
  }

  public ConceptMapper(MappingStore store, double threshold, SimilarityScorer scorer) {
    Preconditions.checkArgument(threshold >= 0 && threshold <= 1,
        "threshold must be within [0, 1]: %s", threshold);
    this.store = Preconditions.checkNotNull(store, "store");
    this.threshold = threshold;
    this.scorer = Preconditions.checkNotNull(scorer, "scorer");
  }

  public MappingStore getStore() {
    return store;
  }

  public double getThreshold() {
    return threshold;
  }

  /** Whether an inferred mapping with this score is applied. */
  public boolean accepts(double score) {
    return score > threshold;
  }

  /** Standard display name for a concept, or null when none is known or confident enough. */
  public @Nullable String mapConcept(String elementId, String label, MappingContext context) {
    String known = store.getStandardConcept(elementId);
    if (known != null) {
      return known;
    }
    Inference inference = infer(label, context);
    if (inference != null && accepts(inference.getScore())) {
      LOGGER.debug("Inferred {} -> {} ({})", elementId, inference.getStandardConcept(),
          inference.getScore());
      return inference.getStandardConcept();
    }
    return null;
  }

  /** Best-scoring standard concept for a label, or null when nothing reaches 0.5. */
  public @Nullable Inference infer(String label, MappingContext context) {
    StandardConcept best = null;
    double bestScore = 0;
    for (StandardConcept concept : StandardConcept.values()) {
      double score = scorer.score(label, concept.getDisplayName());
      if (score > bestScore) {
        bestScore = score;
        best = concept;
      }
    }
    if (best == null) {
      return null;
    }
    String lower = label.toLowerCase(Locale.ROOT);
    StatementType type = context.getStatementType();
    if (type == StatementType.BALANCE_SHEET
        && best == StandardConcept.TOTAL_ASSETS
        && lower.contains("total") && lower.contains("assets")) {
      bestScore = Math.min(1.0, bestScore + CONTEXT_BOOST);
    } else if (type == StatementType.INCOME_STATEMENT
        && best == StandardConcept.REVENUE
        && (lower.contains("revenue") || lower.contains("sales"))) {
      bestScore = Math.min(1.0, bestScore + CONTEXT_BOOST);
    }
    if (bestScore < MINIMUM_SCORE) {
      return null;
    }
    return new Inference(best.getDisplayName(), bestScore);
  }

  /**
   * Infers mappings for line items that have none yet. Confident inferences
   * go into a derived store; plausible ones are returned for review.
   */
  public Learning learnMappings(List<LineItem> items, @Nullable StatementType statementType) {
    MappingStore learned = store;
    ImmutableList.Builder<PendingMapping> pending = ImmutableList.builder();
    for (LineItem item : items) {
      if (learned.getStandardConcept(item.getConcept()) != null) {
        continue;
      }
      Inference inference = infer(item.getLabel(), MappingContext.of(item, statementType));
      if (inference == null) {
        continue;
      }
      if (inference.getScore() >= LEARN_THRESHOLD) {
        learned = learned.withMapping(item.getConcept(), inference.getStandardConcept());
      } else {
        pending.add(
            new PendingMapping(item.getConcept(), item.getLabel(), inference));
      }
    }
    return new Learning(learned, pending.build());
  }

  /** A candidate standard concept and its score. */
  public static final class Inference {
    private final String standardConcept;
    private final double score;

    Inference(String standardConcept, double score) {
      this.standardConcept = standardConcept;
      this.score = score;
    }

    public String getStandardConcept() {
      return standardConcept;
    }

    public double getScore() {
      return score;
    }

    @Override public String toString() {
      return String.format(Locale.ROOT, "%s (%.2f)", standardConcept, score);
    }
  }

  /** A mapping that needs review before it is added. */
  public static final class PendingMapping {
    private final String concept;
    private final String label;
    private final Inference inference;

    PendingMapping(String concept, String label, Inference inference) {
      this.concept = concept;
      this.label = label;
      this.inference = inference;
    }

    public String getConcept() {
      return concept;
    }

    public String getLabel() {
      return label;
    }

    public String getStandardConcept() {
      return inference.getStandardConcept();
    }

    public double getScore() {
      return inference.getScore();
    }
  }

  /** Outcome of {@link #learnMappings}. */
  public static final class Learning {
    private final MappingStore store;
    private final ImmutableList<PendingMapping> pending;

    Learning(MappingStore store, ImmutableList<PendingMapping> pending) {
      this.store = store;
      this.pending = pending;
    }

    public MappingStore getStore() {
      return store;
    }

    public List<PendingMapping> getPending() {
      return pending;
    }
  }
}
