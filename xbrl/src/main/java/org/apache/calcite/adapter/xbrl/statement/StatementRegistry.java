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
package org.apache.calcite.adapter.xbrl.statement;

import org.apache.calcite.adapter.xbrl.ElementIds;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable description of how statement roles are recognised: for each
 * statement type, the abstract concepts that head its presentation tree and
 * the keywords that identify it in a role definition.
 *
 * <p>Types are tried in registration order, so more specific types (such as
 * comprehensive income) are registered before the broader ones they overlap.
 */
public final class StatementRegistry {
  private static final StatementRegistry DEFAULT = builder()
      .register(StatementType.BALANCE_SHEET,
          ImmutableList.of("us-gaap_StatementOfFinancialPositionAbstract",
              "us-gaap_StatementOfFinancialPositionClassifiedAbstract"),
          ImmutableList.of("balance sheet", "financial position", "financial condition"))
      .register(StatementType.COMPREHENSIVE_INCOME,
          ImmutableList.of("us-gaap_StatementOfComprehensiveIncomeAbstract"),
          ImmutableList.of("comprehensive income"))
      .register(StatementType.INCOME_STATEMENT,
          ImmutableList.of("us-gaap_IncomeStatementAbstract",
              "us-gaap_StatementOfIncomeAbstract"),
          ImmutableList.of("income statement", "statement of income", "statements of income",
              "statement of operations", "statements of operations", "profit and loss",
              "statement of earnings", "statements of earnings"))
      .register(StatementType.CASH_FLOW_STATEMENT,
          ImmutableList.of("us-gaap_StatementOfCashFlowsAbstract"),
          ImmutableList.of("cash flow"))
      .register(StatementType.STATEMENT_OF_EQUITY,
          ImmutableList.of("us-gaap_StatementOfStockholdersEquityAbstract",
              "us-gaap_StatementOfShareholdersEquityAbstract",
              "us-gaap_StatementOfPartnersCapitalAbstract"),
          ImmutableList.of("stockholders' equity", "shareholders' equity",
              "stockholders equity", "shareholders equity", "changes in equity",
              "statement of equity", "partners' capital"))
      .register(StatementType.SEGMENT_DISCLOSURE,
          ImmutableList.of("us-gaap_SegmentReportingDisclosureAbstract"),
          ImmutableList.of("segment"))
      .dimensionKeywords(
          ImmutableList.of("segment", "geography", "geographic", "region", "product",
              "business", "by country", "by region", "by product", "by segment",
              "revenues by"))
      .build();

  private final ImmutableMap<StatementType, Entry> entries;
  private final ImmutableList<String> dimensionKeywords;

  private StatementRegistry(Map<StatementType, Entry> entries, List<String> dimensionKeywords) {
    this.entries = ImmutableMap.copyOf(entries);
    this.dimensionKeywords = ImmutableList.copyOf(dimensionKeywords);
  }

  /** Registry for US-GAAP filings. */
  public static StatementRegistry defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<StatementType> getTypes() {
    return entries.keySet().asList();
  }

  public List<String> getPrimaryConcepts(StatementType type) {
    Entry entry = entries.get(type);
    return entry == null ? ImmutableList.of() : entry.primaryConcepts;
  }

  public List<String> getKeywords(StatementType type) {
    Entry entry = entries.get(type);
    return entry == null ? ImmutableList.of() : entry.keywords;
  }

  public List<String> getDimensionKeywords() {
    return dimensionKeywords;
  }

  /** Statement type whose primary concepts include {@code elementId}, or null. */
  public @Nullable StatementType typeOfPrimaryConcept(String elementId) {
    String normalized = ElementIds.normalize(elementId);
    for (Map.Entry<StatementType, Entry> e : entries.entrySet()) {
      if (e.getValue().primaryConcepts.contains(normalized)) {
        return e.getKey();
      }
    }
    return null;
  }

  /** Statement type whose keywords appear in a role definition, or null. */
  public @Nullable StatementType typeOfDefinition(String definition) {
    String lower = definition.toLowerCase(Locale.ROOT);
    for (Map.Entry<StatementType, Entry> e : entries.entrySet()) {
      for (String keyword : e.getValue().keywords) {
        if (lower.contains(keyword)) {
          return e.getKey();
        }
      }
    }
    return null;
  }

  /**
   * Whether a statement shows dimensional breakdowns as rows of their own.
   * Only statements outside the five primary statements whose definition
   * mentions a segment, geography, product or business keyword qualify.
   */
  public boolean isDimensionDisplaying(@Nullable StatementType type, String definition) {
    if (type != null && type.isCore()) {
      return false;
    }
    String lower = definition.toLowerCase(Locale.ROOT);
    for (String keyword : dimensionKeywords) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  /** Builder for {@link StatementRegistry}. */
  public static final class Builder {
    private final Map<StatementType, Entry> entries = new LinkedHashMap<>();
    private List<String> dimensionKeywords = ImmutableList.of();

    private Builder() {
    }

    public Builder register(StatementType type, List<String> primaryConcepts,
        List<String> keywords) {
      ImmutableList.Builder<String> concepts = ImmutableList.builder();
      for (String concept : primaryConcepts) {
        concepts.add(ElementIds.normalize(concept));
      }
      ImmutableList.Builder<String> lowerKeywords = ImmutableList.builder();
      for (String keyword : keywords) {
        lowerKeywords.add(keyword.toLowerCase(Locale.ROOT));
      }
      entries.put(type, new Entry(concepts.build(), lowerKeywords.build()));
      return this;
    }

    public Builder dimensionKeywords(List<String> keywords) {
      this.dimensionKeywords = keywords;
      return this;
    }

    public StatementRegistry build() {
      return new StatementRegistry(entries, dimensionKeywords);
    }
  }

  /** Concepts and keywords of one type. */
  private static final class Entry {
    final ImmutableList<String> primaryConcepts;
    final ImmutableList<String> keywords;

    Entry(ImmutableList<String> primaryConcepts, ImmutableList<String> keywords) {
      this.primaryConcepts = primaryConcepts;
      this.keywords = keywords;
    }
  }
}
