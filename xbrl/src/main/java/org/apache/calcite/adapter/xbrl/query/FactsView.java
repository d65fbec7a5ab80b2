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
package org.apache.calcite.adapter.xbrl.query;

import org.apache.calcite.adapter.xbrl.ElementIds;
import org.apache.calcite.adapter.xbrl.XbrlDocument;
import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.ElementCatalogEntry;
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.PeriodDescriptor;
import org.apache.calcite.adapter.xbrl.model.PresentationTree;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.model.Unit;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;
import org.apache.calcite.adapter.xbrl.statement.StatementInfo;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every fact of a document flattened into a record with its concept, label,
 * period, unit, dimensions and statement.
 *
 * <p>Absent information is an absent key, never a null value. Dimension
 * members appear under {@code dim_<axis>} keys.
 */
public final class FactsView {
  private static final Logger LOGGER = LoggerFactory.getLogger(FactsView.class);

  public static final String CONCEPT = "concept";
  public static final String ELEMENT_ID = "element_id";
  public static final String LABEL = "label";
  public static final String VALUE = "value";
  public static final String NUMERIC_VALUE = "numeric_value";
  public static final String CONTEXT_REF = "context_ref";
  public static final String UNIT_REF = "unit_ref";
  public static final String UNIT = "unit";
  public static final String DECIMALS = "decimals";
  public static final String PERIOD_TYPE = "period_type";
  public static final String PERIOD_INSTANT = "period_instant";
  public static final String PERIOD_START = "period_start";
  public static final String PERIOD_END = "period_end";
  public static final String PERIOD_KEY = "period_key";
  public static final String PERIOD_LABEL = "period_label";
  public static final String ENTITY_IDENTIFIER = "entity_identifier";
  public static final String FISCAL_YEAR = "fiscal_year";
  public static final String FISCAL_PERIOD = "fiscal_period";
  public static final String ELEMENT_TYPE = "element_type";
  public static final String ELEMENT_PERIOD_TYPE = "element_period_type";
  public static final String BALANCE = "balance";
  public static final String STATEMENT_TYPE = "statement_type";
  public static final String STATEMENT_ROLE = "statement_role";
  public static final String DIMENSION_PREFIX = "dim_";

  private final ImmutableList<Map<String, Object>> records;

  private FactsView(List<Map<String, Object>> records) {
    this.records = ImmutableList.copyOf(records);
  }

  public static FactsView of(XbrlDocument document) {
    ElementCatalog catalog = document.getCatalog();
    ReportingPeriods periods = document.getReportingPeriods();
    EntityInfo entityInfo = document.getEntityInfo();
    Map<String, Context> contexts = document.getContexts();
    Map<String, Unit> units = document.getUnits();
    Map<String, StatementInfo> statementByElement =
        statementsByElement(document.getAllStatements(), document.getPresentationTrees());

    List<Map<String, Object>> records = new ArrayList<>(document.getFacts().size());
    for (Fact fact : document.getFacts().all()) {
      Map<String, Object> record = new LinkedHashMap<>();
      String elementId = fact.getElementId();
      record.put(CONCEPT, ElementIds.toQualifiedName(elementId));
      record.put(ELEMENT_ID, elementId);
      record.put(LABEL, catalog.labelOf(elementId));
      record.put(VALUE, fact.getValue());
      putIfPresent(record, NUMERIC_VALUE, fact.getNumericValue());
      record.put(CONTEXT_REF, fact.getContextRef());
      if (fact.getUnitRef() != null) {
        record.put(UNIT_REF, fact.getUnitRef());
        Unit unit = units.get(fact.getUnitRef());
        record.put(UNIT, unit == null ? fact.getUnitRef() : unit.getDisplay());
      }
      if (fact.getDecimals() != null && !fact.getDecimals().isInfinite()) {
        record.put(DECIMALS, fact.getDecimals().getValue());
      }

      Context context = contexts.get(fact.getContextRef());
      if (context != null) {
        putPeriod(record, context.getPeriod());
        putIfPresent(record, ENTITY_IDENTIFIER, context.getEntityIdentifier());
        for (Map.Entry<String, String> dim : context.getDimensions().entrySet()) {
          record.put(DIMENSION_PREFIX + dim.getKey(), dim.getValue());
        }
      }
      String periodKey = periods.periodKeyOf(fact.getContextRef());
      if (periodKey != null) {
        record.put(PERIOD_KEY, periodKey);
        ReportingPeriod period = periods.get(periodKey);
        if (period != null) {
          record.put(PERIOD_LABEL, period.getLabel());
        }
      }
      putIfPresent(record, FISCAL_YEAR, entityInfo.getFiscalYear());
      putIfPresent(record, FISCAL_PERIOD, entityInfo.getFiscalPeriod());

      ElementCatalogEntry entry = catalog.get(elementId);
      if (entry != null) {
        if (!entry.getDataType().isEmpty()) {
          record.put(ELEMENT_TYPE, entry.getDataType());
        }
        record.put(ELEMENT_PERIOD_TYPE, entry.getPeriodType());
        putIfPresent(record, BALANCE, entry.getBalance());
      }
      StatementInfo statement = statementByElement.get(elementId);
      if (statement != null) {
        record.put(STATEMENT_ROLE, statement.getRole());
        if (statement.getType() != null) {
          record.put(STATEMENT_TYPE, statement.getType().getTypeName());
        }
      }
      records.add(Collections.unmodifiableMap(record));
    }
    LOGGER.debug("Built {} fact records", records.size());
    return new FactsView(records);
  }

  /** First statement presenting each element, typed statements taking precedence. */
  private static Map<String, StatementInfo> statementsByElement(List<StatementInfo> statements,
      Map<String, PresentationTree> trees) {
    Map<String, StatementInfo> result = new HashMap<>();
    for (boolean typed : new boolean[] {true, false}) {
      for (StatementInfo statement : statements) {
        if ((statement.getType() != null) != typed) {
          continue;
        }
        PresentationTree tree = trees.get(statement.getRole());
        if (tree == null) {
          continue;
        }
        for (String elementId : tree.getNodes().keySet()) {
          result.putIfAbsent(elementId, statement);
        }
      }
    }
    return result;
  }

  private static void putPeriod(Map<String, Object> record, PeriodDescriptor period) {
    switch (period.getKind()) {
      case INSTANT:
        record.put(PERIOD_TYPE, "instant");
        putIfPresent(record, PERIOD_INSTANT, period.getInstant());
        break;
      case DURATION:
        record.put(PERIOD_TYPE, "duration");
        putIfPresent(record, PERIOD_START, period.getStartDate());
        putIfPresent(record, PERIOD_END, period.getEndDate());
        break;
      default:
        record.put(PERIOD_TYPE, "forever");
        break;
    }
  }

  private static void putIfPresent(Map<String, Object> record, String key,
      @Nullable Object value) {
    if (value != null) {
      record.put(key, value);
    }
  }

  public List<Map<String, Object>> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }
}
