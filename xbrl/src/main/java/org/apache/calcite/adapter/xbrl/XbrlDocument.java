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
package org.apache.calcite.adapter.xbrl;

import org.apache.calcite.adapter.xbrl.model.CalculationTree;
import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.DimensionModel;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.PresentationTree;
import org.apache.calcite.adapter.xbrl.model.StatementType;
import org.apache.calcite.adapter.xbrl.model.Unit;
import org.apache.calcite.adapter.xbrl.period.PeriodView;
import org.apache.calcite.adapter.xbrl.period.PeriodViewSelector;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;
import org.apache.calcite.adapter.xbrl.query.FactQuery;
import org.apache.calcite.adapter.xbrl.query.FactsView;
import org.apache.calcite.adapter.xbrl.statement.StatementData;
import org.apache.calcite.adapter.xbrl.statement.StatementInfo;
import org.apache.calcite.adapter.xbrl.statement.StatementResolver;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * A parsed filing: taxonomy, relationship trees, facts and everything
 * derived from them.
 *
 * <p>A document does not change after it has been built; see
 * {@link XbrlDocumentBuilder} and {@link XbrlDirectoryReader}.
 */
public final class XbrlDocument {
  private final XbrlConfig config;
  private final ElementCatalog catalog;
  private final ImmutableMap<String, PresentationTree> presentationTrees;
  private final ImmutableMap<String, CalculationTree> calculationTrees;
  private final DimensionModel dimensionModel;
  private final ImmutableMap<String, Context> contexts;
  private final ImmutableMap<String, Unit> units;
  private final FactStore facts;
  private final ReportingPeriods periods;
  private final EntityInfo entityInfo;
  private final ImmutableList<String> warnings;
  private final StatementResolver resolver;
  private final Supplier<FactsView> factsView;

  XbrlDocument(XbrlConfig config, ElementCatalog catalog,
      Map<String, PresentationTree> presentationTrees,
      Map<String, CalculationTree> calculationTrees, DimensionModel dimensionModel,
      Map<String, Context> contexts, Map<String, Unit> units, FactStore facts,
      ReportingPeriods periods, EntityInfo entityInfo, List<String> warnings) {
    this.config = config;
    this.catalog = catalog;
    this.presentationTrees = ImmutableMap.copyOf(presentationTrees);
    this.calculationTrees = ImmutableMap.copyOf(calculationTrees);
    this.dimensionModel = dimensionModel;
    this.contexts = ImmutableMap.copyOf(contexts);
    this.units = ImmutableMap.copyOf(units);
    this.facts = facts;
    this.periods = periods;
    this.entityInfo = entityInfo;
    this.warnings = ImmutableList.copyOf(warnings);
    this.resolver = new StatementResolver(catalog, this.presentationTrees,
        this.calculationTrees, facts, this.contexts, periods, config.getRegistry(),
        config.newRoleResolver());
    this.factsView = Suppliers.memoize(() -> FactsView.of(this));
  }

  /** Parses every filing file found directly in {@code directory}. */
  public static XbrlDocument fromDirectory(File directory) {
    return new XbrlDirectoryReader(XbrlConfig.defaults()).read(directory);
  }

  public static XbrlDocumentBuilder builder() {
    return new XbrlDocumentBuilder(XbrlConfig.defaults());
  }

  // ========== Statements ==========

  public List<StatementInfo> getAllStatements() {
    return resolver.getAllStatements();
  }

  /**
   * Line items of a statement.
   *
   * @param roleOrType role URI, statement type such as {@code BalanceSheet},
   *     role name or definition
   * @return line items in presentation order; empty when no statement matches
   */
  public List<LineItem> getStatement(String roleOrType) {
    return resolver.getStatement(roleOrType);
  }

  public List<LineItem> getStatement(String roleOrType, @Nullable String periodFilter) {
    return resolver.getStatement(roleOrType, periodFilter);
  }

  public @Nullable StatementData getStatementByType(StatementType type) {
    return resolver.getStatementData(type.getTypeName());
  }

  public @Nullable StatementData getStatementByType(String roleOrType) {
    return resolver.getStatementData(roleOrType);
  }

  public List<PeriodView> getPeriodViews(String statementType) {
    return new PeriodViewSelector(periods, entityInfo).getPeriodViews(statementType);
  }

  public List<PeriodView> getPeriodViews(@Nullable StatementType statementType) {
    return new PeriodViewSelector(periods, entityInfo).getPeriodViews(statementType);
  }

  // ========== Facts and periods ==========

  public @Nullable Fact getFact(String elementId, String contextId) {
    return facts.get(elementId, contextId);
  }

  public FactQuery query() {
    return new FactQuery(factsView.get());
  }

  public FactsView getFactsView() {
    return factsView.get();
  }

  /** Context id to period key, for every context with a usable period. */
  public Map<String, String> getContextPeriodMap() {
    return periods.getContextPeriodKeys();
  }

  public ReportingPeriods getReportingPeriods() { return periods; }
  public EntityInfo getEntityInfo() { return entityInfo; }

  /** Problems that did not stop parsing, in the order they were raised. */
  public List<String> getWarnings() { return warnings; }

  public XbrlConfig getConfig() { return config; }
  public ElementCatalog getCatalog() { return catalog; }
  public Map<String, PresentationTree> getPresentationTrees() { return presentationTrees; }
  public Map<String, CalculationTree> getCalculationTrees() { return calculationTrees; }
  public DimensionModel getDimensionModel() { return dimensionModel; }
  public Map<String, Context> getContexts() { return contexts; }
  public Map<String, Unit> getUnits() { return units; }
  public FactStore getFacts() { return facts; }

  @Override public String toString() {
    return String.format("XbrlDocument{entity=%s, statements=%d, facts=%d, periods=%d}",
        entityInfo.getEntityName(), presentationTrees.size(), facts.size(), periods.size());
  }
}
