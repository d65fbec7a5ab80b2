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
import org.apache.calcite.adapter.xbrl.model.CalculationNode;
import org.apache.calcite.adapter.xbrl.model.CalculationTree;
import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.Decimals;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.ElementCatalogEntry;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.LabelRoles;
import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.PresentationNode;
import org.apache.calcite.adapter.xbrl.model.PresentationTree;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.model.StatementType;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a presentation tree into line items with one value per period.
 *
 * <p>The tree is walked depth first. For every element the facts of all
 * contexts are grouped by period. On ordinary statements the fact with the
 * fewest dimensions is kept per period. On dimension-displaying statements
 * each distinct combination of dimension members becomes a row of its own,
 * one level below its concept, and the concept itself becomes a header.
 */
public class StatementResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(StatementResolver.class);

  private final ElementCatalog catalog;
  private final ImmutableMap<String, PresentationTree> presentationTrees;
  private final ImmutableMap<String, CalculationTree> calculationTrees;
  private final FactStore facts;
  private final ImmutableMap<String, Context> contexts;
  private final ReportingPeriods periods;
  private final StatementRegistry registry;
  private final RoleResolver roleResolver;
  private final ImmutableList<StatementInfo> statements;

  public StatementResolver(ElementCatalog catalog,
      Map<String, PresentationTree> presentationTrees,
      Map<String, CalculationTree> calculationTrees, FactStore facts,
      Map<String, Context> contexts, ReportingPeriods periods, StatementRegistry registry,
      RoleResolver roleResolver) {
    this.catalog = catalog;
    this.presentationTrees = ImmutableMap.copyOf(presentationTrees);
    this.calculationTrees = ImmutableMap.copyOf(calculationTrees);
    this.facts = facts;
    this.contexts = ImmutableMap.copyOf(contexts);
    this.periods = periods;
    this.registry = registry;
    this.roleResolver = roleResolver;
    this.statements = classify();
  }

  // ========== Statement discovery ==========

  private ImmutableList<StatementInfo> classify() {
    ImmutableList.Builder<StatementInfo> result = ImmutableList.builder();
    for (PresentationTree tree : presentationTrees.values()) {
      String primaryConcept = null;
      StatementType type = null;
      if (!isParenthetical(tree.getDefinition())) {
        for (String elementId : tree.getNodes().keySet()) {
          type = registry.typeOfPrimaryConcept(elementId);
          if (type != null) {
            primaryConcept = elementId;
            break;
          }
        }
        if (type == null) {
          type = registry.typeOfDefinition(tree.getDefinition());
        }
      }
      result.add(
          new StatementInfo(tree.getRoleUri(), tree.getDefinition(), tree.size(), type,
              primaryConcept, StatementInfo.shortName(tree.getRoleUri())));
    }
    return result.build();
  }

  private static boolean isParenthetical(String definition) {
    return definition.toLowerCase(Locale.ROOT).contains("parenthetical");
  }

  /** Every presentation role with its inferred statement type. */
  public List<StatementInfo> getAllStatements() {
    return statements;
  }

  public @Nullable StatementInfo resolveRole(String roleOrType) {
    return roleResolver.resolve(roleOrType, statements);
  }

  // ========== Line items ==========

  /** Line items for every period. */
  public List<LineItem> getStatement(String roleOrType) {
    return getStatement(roleOrType, null);
  }

  /**
   * Resolves a statement.
   *
   * @param roleOrType role URI, statement type name, role name or definition
   * @param periodFilter when not null, only values of this period key are kept
   * @return line items in presentation order; empty when nothing matches
   */
  public List<LineItem> getStatement(String roleOrType, @Nullable String periodFilter) {
    StatementInfo info = resolveRole(roleOrType);
    if (info == null) {
      return ImmutableList.of();
    }
    PresentationTree tree = presentationTrees.get(info.getRole());
    if (tree == null) {
      return ImmutableList.of();
    }
    boolean dimensional = registry.isDimensionDisplaying(info.getType(), info.getDefinition());
    Map<String, Double> weights = weightsFor(info.getRole());

    List<LineItem> items = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    for (String root : tree.getRootElementIds()) {
      walk(tree, root, periodFilter, dimensional, weights, visited, items);
    }
    LOGGER.debug("Resolved {} line items for {} (dimensional={})", items.size(),
        info.getRole(), dimensional);
    return items;
  }

  /** Resolves the statement of a type together with the periods it has values for. */
  public @Nullable StatementData getStatementData(String roleOrType) {
    StatementInfo info = resolveRole(roleOrType);
    if (info == null) {
      return null;
    }
    List<LineItem> items = getStatement(info.getRole(), null);
    Set<String> used = new HashSet<>();
    for (LineItem item : items) {
      used.addAll(item.getValues().keySet());
    }
    Map<String, String> statementPeriods = new LinkedHashMap<>();
    for (ReportingPeriod period : periods.getPeriods()) {
      if (used.contains(period.getKey())) {
        statementPeriods.put(period.getKey(), period.getLabel());
      }
    }
    return new StatementData(info.getRole(), info.getDefinition(), info.getType(), items,
        statementPeriods);
  }

  private void walk(PresentationTree tree, String elementId, @Nullable String periodFilter,
      boolean dimensional, Map<String, Double> weights, Set<String> visited,
      List<LineItem> items) {
    PresentationNode node = tree.getNode(elementId);
    if (node == null || !visited.add(node.getElementId())) {
      return;
    }
    Map<String, List<Fact>> byPeriod = factsByPeriod(node.getElementId(), periodFilter);
    LineItem.Builder item = baseItem(node, weights);

    Map<String, Map<String, List<Fact>>> dimensionGroups = dimensional
        ? groupByDimensions(byPeriod)
        : ImmutableMap.of();

    if (!dimensionGroups.isEmpty()) {
      items.add(item.build());
      for (Map.Entry<String, Map<String, List<Fact>>> group : dimensionGroups.entrySet()) {
        items.add(dimensionItem(node, group.getValue(), weights));
      }
    } else {
      for (Map.Entry<String, List<Fact>> period : byPeriod.entrySet()) {
        Fact best = fewestDimensions(period.getValue());
        addValue(item, period.getKey(), best);
      }
      if (item.hasValues() || node.isAbstract() || !node.getChildren().isEmpty()) {
        items.add(item.build());
      }
    }

    for (String child : node.getChildren()) {
      walk(tree, child, periodFilter, dimensional, weights, visited, items);
    }
  }

  private LineItem.Builder baseItem(PresentationNode node, Map<String, Double> weights) {
    String label = node.getDisplayLabel();
    String preferred = node.getPreferredLabel();
    ElementCatalogEntry entry = catalog.get(node.getElementId());
    return LineItem.builder(node.getElementId(), label)
        .level(node.getDepth())
        .isAbstract(node.isAbstract())
        .isTotal(LabelRoles.isTotal(preferred)
            || label.toLowerCase(Locale.ROOT).contains("total"))
        .children(node.getChildren())
        .preferredLabel(preferred)
        .preferredSign(LabelRoles.isNegated(preferred) ? -1 : 1)
        .balance(entry == null ? null : entry.getBalance())
        .weight(weights.get(node.getElementId()));
  }

  private LineItem dimensionItem(PresentationNode node, Map<String, List<Fact>> byPeriod,
      Map<String, Double> weights) {
    Fact sample = byPeriod.values().iterator().next().get(0);
    Map<String, String> dimensions = dimensionsOf(sample);
    List<String> memberLabels = new ArrayList<>();
    for (String member : dimensions.values()) {
      memberLabels.add(memberLabel(member));
    }
    ElementCatalogEntry entry = catalog.get(node.getElementId());
    LineItem.Builder item =
        LineItem.builder(node.getElementId(), String.join(" - ", memberLabels))
            .level(node.getDepth() + 1)
            .isDimension(true)
            .dimensionMetadata(dimensions)
            .balance(entry == null ? null : entry.getBalance())
            .weight(weights.get(node.getElementId()));
    for (Map.Entry<String, List<Fact>> period : byPeriod.entrySet()) {
      addValue(item, period.getKey(), period.getValue().get(0));
    }
    return item.build();
  }

  private String memberLabel(String memberId) {
    String label = catalog.labelOf(memberId);
    return label.equals(ElementIds.normalize(memberId)) ? ElementIds.localName(memberId) : label;
  }

  private static void addValue(LineItem.Builder item, String periodKey, Fact fact) {
    Double numeric = fact.getNumericValue();
    item.value(periodKey, numeric != null ? (Object) numeric : fact.getValue());
    Decimals decimals = fact.getDecimals();
    if (decimals != null) {
      item.decimals(periodKey, decimals.toScale());
    }
  }

  /** Facts of an element grouped by period key, most recent period first. */
  private Map<String, List<Fact>> factsByPeriod(String elementId,
      @Nullable String periodFilter) {
    Map<String, List<Fact>> grouped = new LinkedHashMap<>();
    List<Fact> elementFacts = facts.getFacts(elementId);
    if (elementFacts.isEmpty()) {
      return grouped;
    }
    for (ReportingPeriod period : periods.getPeriods()) {
      if (periodFilter != null && !periodFilter.equals(period.getKey())) {
        continue;
      }
      grouped.put(period.getKey(), new ArrayList<>());
    }
    for (Fact fact : elementFacts) {
      String periodKey = periods.periodKeyOf(fact.getContextRef());
      if (periodKey == null) {
        continue;
      }
      List<Fact> bucket = grouped.get(periodKey);
      if (bucket != null) {
        bucket.add(fact);
      }
    }
    grouped.values().removeIf(List::isEmpty);
    return grouped;
  }

  /**
   * Groups dimension-qualified facts by their member combination. Facts without
   * dimensions are left out; the returned map is empty when there are none.
   */
  private Map<String, Map<String, List<Fact>>> groupByDimensions(
      Map<String, List<Fact>> byPeriod) {
    Map<String, Map<String, List<Fact>>> groups = new LinkedHashMap<>();
    for (Map.Entry<String, List<Fact>> period : byPeriod.entrySet()) {
      for (Fact fact : period.getValue()) {
        Map<String, String> dimensions = dimensionsOf(fact);
        if (dimensions.isEmpty()) {
          continue;
        }
        String signature = new TreeMap<>(dimensions).toString();
        groups.computeIfAbsent(signature, k -> new LinkedHashMap<>())
            .computeIfAbsent(period.getKey(), k -> new ArrayList<>())
            .add(fact);
      }
    }
    return groups;
  }

  private Map<String, String> dimensionsOf(Fact fact) {
    Context context = contexts.get(fact.getContextRef());
    return context == null ? ImmutableMap.of() : context.getDimensions();
  }

  /** The fact with the fewest dimensions; ties keep document order. */
  Fact fewestDimensions(List<Fact> candidates) {
    Fact best = candidates.get(0);
    int bestCount = dimensionsOf(best).size();
    for (Fact candidate : candidates) {
      int count = dimensionsOf(candidate).size();
      if (count < bestCount) {
        best = candidate;
        bestCount = count;
      }
    }
    return best;
  }

  /** Weights from the role's own calculation tree, falling back to every role. */
  private Map<String, Double> weightsFor(String roleUri) {
    Map<String, Double> weights = new LinkedHashMap<>();
    for (CalculationTree tree : calculationTrees.values()) {
      for (CalculationNode node : tree.getNodes().values()) {
        weights.put(node.getElementId(), node.getWeight());
      }
    }
    CalculationTree own = calculationTrees.get(roleUri);
    if (own != null) {
      for (CalculationNode node : own.getNodes().values()) {
        weights.put(node.getElementId(), node.getWeight());
      }
    }
    return weights;
  }
}
