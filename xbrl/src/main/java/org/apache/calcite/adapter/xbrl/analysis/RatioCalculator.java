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
package org.apache.calcite.adapter.xbrl.analysis;

import org.apache.calcite.adapter.xbrl.XbrlDocument;
import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;
import org.apache.calcite.adapter.xbrl.standardization.MappingStore;
import org.apache.calcite.adapter.xbrl.standardization.StandardConcept;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes common financial ratios from the facts of one filing.
 *
 * <p>Balance sheet inputs are read at the most recent instant and income
 * statement inputs over the most recent (longest) duration, unless other
 * periods are given. Concepts are found through the standard concept
 * mappings. A ratio whose denominator is zero or missing is not computed.
 */
public class RatioCalculator {
  private static final Logger LOGGER = LoggerFactory.getLogger(RatioCalculator.class);

  private final FactStore facts;
  private final Map<String, Context> contexts;
  private final ReportingPeriods periods;
  private final MappingStore mappings;
  private final @Nullable String instantKey;
  private final @Nullable String durationKey;

  public RatioCalculator(XbrlDocument document) {
    this(document.getFacts(), document.getContexts(), document.getReportingPeriods(),
        document.getConfig().getMappingStore());
  }

  public RatioCalculator(FactStore facts, Map<String, Context> contexts,
      ReportingPeriods periods, MappingStore mappings) {
    this(facts, contexts, periods, mappings, firstKey(periods.instants()),
        firstKey(periods.durations()));
  }

  public RatioCalculator(FactStore facts, Map<String, Context> contexts,
      ReportingPeriods periods, MappingStore mappings, @Nullable String instantKey,
      @Nullable String durationKey) {
    this.facts = facts;
    this.contexts = contexts;
    this.periods = periods;
    this.mappings = mappings;
    this.instantKey = instantKey;
    this.durationKey = durationKey;
  }

  private static @Nullable String firstKey(List<ReportingPeriod> periods) {
    return periods.isEmpty() ? null : periods.get(0).getKey();
  }

  /**
   * Value of a standard concept in a period, taken from the first mapped
   * company concept reported without dimensions.
   */
  public @Nullable Double getValue(StandardConcept concept, @Nullable String periodKey) {
    if (periodKey == null) {
      return null;
    }
    for (String companyConcept : mappings.getCompanyConcepts(concept.getDisplayName())) {
      for (Fact fact : facts.getFacts(companyConcept)) {
        Context context = contexts.get(fact.getContextRef());
        if (fact.getNumericValue() != null
            && (context == null || !context.hasDimensions())
            && periodKey.equals(periods.periodKeyOf(fact.getContextRef()))) {
          return fact.getNumericValue();
        }
      }
    }
    return null;
  }

  /** {@code numerator / denominator}, or null when either is missing or the denominator is 0. */
  static @Nullable Double divide(@Nullable Double numerator, @Nullable Double denominator) {
    if (numerator == null || denominator == null || denominator == 0d) {
      return null;
    }
    return numerator / denominator;
  }

  // ========== Liquidity ==========

  public @Nullable RatioResult currentRatio() {
    Double currentAssets = balance(StandardConcept.TOTAL_CURRENT_ASSETS);
    Double currentLiabilities = balance(StandardConcept.TOTAL_CURRENT_LIABILITIES);
    return ratio("current_ratio", instantKey, currentAssets, currentLiabilities,
        "current_assets", "current_liabilities");
  }

  public @Nullable RatioResult quickRatio() {
    Double currentAssets = balance(StandardConcept.TOTAL_CURRENT_ASSETS);
    Double inventory = balance(StandardConcept.INVENTORY);
    Double currentLiabilities = balance(StandardConcept.TOTAL_CURRENT_LIABILITIES);
    Double quickAssets = currentAssets == null || inventory == null
        ? null
        : currentAssets - inventory;
    return ratio("quick_ratio", instantKey, quickAssets, currentLiabilities,
        "quick_assets", "current_liabilities");
  }

  public @Nullable RatioResult cashRatio() {
    Double cash = balance(StandardConcept.CASH_AND_EQUIVALENTS);
    Double currentLiabilities = balance(StandardConcept.TOTAL_CURRENT_LIABILITIES);
    return ratio("cash_ratio", instantKey, cash, currentLiabilities,
        "cash", "current_liabilities");
  }

  public @Nullable RatioResult workingCapital() {
    Double currentAssets = balance(StandardConcept.TOTAL_CURRENT_ASSETS);
    Double currentLiabilities = balance(StandardConcept.TOTAL_CURRENT_LIABILITIES);
    if (currentAssets == null || currentLiabilities == null || instantKey == null) {
      return null;
    }
    return new RatioResult("working_capital", currentAssets - currentLiabilities,
        ImmutableMap.of("current_assets", currentAssets,
            "current_liabilities", currentLiabilities), instantKey);
  }

  // ========== Profitability ==========

  public @Nullable RatioResult grossMargin() {
    return margin("gross_margin", StandardConcept.GROSS_PROFIT, "gross_profit");
  }

  public @Nullable RatioResult operatingMargin() {
    return margin("operating_margin", StandardConcept.OPERATING_INCOME, "operating_income");
  }

  public @Nullable RatioResult netMargin() {
    return margin("net_margin", StandardConcept.NET_INCOME, "net_income");
  }

  private @Nullable RatioResult margin(String name, StandardConcept concept, String component) {
    return ratio(name, durationKey, getValue(concept, durationKey),
        getValue(StandardConcept.REVENUE, durationKey), component, "revenue");
  }

  // ========== Leverage ==========

  public @Nullable RatioResult debtToEquity() {
    Double debt = balance(StandardConcept.LONG_TERM_DEBT);
    Double equity = balance(StandardConcept.TOTAL_EQUITY);
    return ratio("debt_to_equity", instantKey, debt, equity, "total_debt", "total_equity");
  }

  // ========== Groups ==========

  public Map<String, RatioResult> liquidityRatios() {
    Map<String, RatioResult> results = new LinkedHashMap<>();
    put(results, currentRatio());
    put(results, quickRatio());
    put(results, cashRatio());
    put(results, workingCapital());
    return results;
  }

  public Map<String, RatioResult> profitabilityRatios() {
    Map<String, RatioResult> results = new LinkedHashMap<>();
    put(results, grossMargin());
    put(results, operatingMargin());
    put(results, netMargin());
    return results;
  }

  public Map<String, RatioResult> leverageRatios() {
    Map<String, RatioResult> results = new LinkedHashMap<>();
    put(results, debtToEquity());
    return results;
  }

  /** Every ratio that could be computed, grouped by category. */
  public Map<String, Map<String, RatioResult>> calculateAll() {
    Map<String, Map<String, RatioResult>> all = new LinkedHashMap<>();
    all.put("liquidity", liquidityRatios());
    all.put("profitability", profitabilityRatios());
    all.put("leverage", leverageRatios());
    return all;
  }

  private @Nullable Double balance(StandardConcept concept) {
    return getValue(concept, instantKey);
  }

  private static @Nullable RatioResult ratio(String name, @Nullable String periodKey,
      @Nullable Double numerator, @Nullable Double denominator, String numeratorName,
      String denominatorName) {
    Double value = divide(numerator, denominator);
    if (value == null || periodKey == null) {
      LOGGER.debug("Cannot compute {}: {}={}, {}={}", name, numeratorName, numerator,
          denominatorName, denominator);
      return null;
    }
    return new RatioResult(name, value,
        ImmutableMap.of(numeratorName, numerator, denominatorName, denominator), periodKey);
  }

  private static void put(Map<String, RatioResult> results, @Nullable RatioResult result) {
    if (result != null) {
      results.put(result.getName(), result);
    }
  }
}
