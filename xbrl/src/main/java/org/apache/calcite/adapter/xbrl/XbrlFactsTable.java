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

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.xbrl.query.FactsView;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Table of XBRL facts, one row per fact record.
 *
 * <p>Dimension qualifiers are rendered into a single {@code dimensions}
 * column as {@code axis=member} pairs separated by {@code ;}.
 */
public class XbrlFactsTable extends AbstractTable implements ScannableTable {
  /** Record key naming the filing a fact came from. */
  public static final String FILING = "filing";

  private static final List<String> COLUMNS = ImmutableList.of(
      FILING,
      FactsView.CONCEPT,
      FactsView.ELEMENT_ID,
      FactsView.LABEL,
      FactsView.VALUE,
      FactsView.NUMERIC_VALUE,
      FactsView.UNIT,
      FactsView.DECIMALS,
      FactsView.CONTEXT_REF,
      FactsView.PERIOD_TYPE,
      FactsView.PERIOD_KEY,
      FactsView.PERIOD_LABEL,
      FactsView.PERIOD_INSTANT,
      FactsView.PERIOD_START,
      FactsView.PERIOD_END,
      FactsView.ENTITY_IDENTIFIER,
      FactsView.FISCAL_YEAR,
      FactsView.FISCAL_PERIOD,
      FactsView.STATEMENT_TYPE,
      FactsView.BALANCE);

  private final ImmutableList<Map<String, Object>> records;

  public XbrlFactsTable(List<Map<String, Object>> records) {
    this.records = ImmutableList.copyOf(records);
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return typeFactory.builder()
        .add(FILING, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.CONCEPT, SqlTypeName.VARCHAR)
        .add(FactsView.ELEMENT_ID, SqlTypeName.VARCHAR)
        .add(FactsView.LABEL, SqlTypeName.VARCHAR)
        .add(FactsView.VALUE, SqlTypeName.VARCHAR)
        .add(FactsView.NUMERIC_VALUE, SqlTypeName.DOUBLE).nullable(true)
        .add(FactsView.UNIT, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.DECIMALS, SqlTypeName.INTEGER).nullable(true)
        .add(FactsView.CONTEXT_REF, SqlTypeName.VARCHAR)
        .add(FactsView.PERIOD_TYPE, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.PERIOD_KEY, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.PERIOD_LABEL, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.PERIOD_INSTANT, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.PERIOD_START, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.PERIOD_END, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.ENTITY_IDENTIFIER, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.FISCAL_YEAR, SqlTypeName.INTEGER).nullable(true)
        .add(FactsView.FISCAL_PERIOD, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.STATEMENT_TYPE, SqlTypeName.VARCHAR).nullable(true)
        .add(FactsView.BALANCE, SqlTypeName.VARCHAR).nullable(true)
        .add("dimensions", SqlTypeName.VARCHAR).nullable(true)
        .build();
  }

  @Override public Enumerable<Object[]> scan(DataContext root) {
    return new AbstractEnumerable<Object[]>() {
      @Override public Enumerator<Object[]> enumerator() {
        return new FactEnumerator(records);
      }
    };
  }

  static Object[] toRow(Map<String, Object> record) {
    Object[] row = new Object[COLUMNS.size() + 1];
    for (int i = 0; i < COLUMNS.size(); i++) {
      row[i] = record.get(COLUMNS.get(i));
    }
    row[COLUMNS.size()] = dimensions(record);
    return row;
  }

  private static @Nullable String dimensions(Map<String, Object> record) {
    Map<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<String, Object> e : record.entrySet()) {
      if (e.getKey().startsWith(FactsView.DIMENSION_PREFIX)) {
        sorted.put(e.getKey().substring(FactsView.DIMENSION_PREFIX.length()), e.getValue());
      }
    }
    if (sorted.isEmpty()) {
      return null;
    }
    StringJoiner joiner = new StringJoiner(";");
    for (Map.Entry<String, Object> e : sorted.entrySet()) {
      joiner.add(e.getKey() + "=" + e.getValue());
    }
    return joiner.toString();
  }

  /** Enumerator over fact records. */
  private static class FactEnumerator implements Enumerator<Object[]> {
    private final Iterator<Map<String, Object>> iterator;
    private Object[] current;

    FactEnumerator(List<Map<String, Object>> records) {
      this.iterator = records.iterator();
    }

    @Override public Object[] current() {
      return current;
    }

    @Override public boolean moveNext() {
      if (iterator.hasNext()) {
        current = toRow(iterator.next());
        return true;
      }
      return false;
    }

    @Override public void reset() {
      throw new UnsupportedOperationException("Reset not supported");
    }

    @Override public void close() {
      // Nothing to close
    }
  }
}
