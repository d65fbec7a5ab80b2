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
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/** Reporting periods of one or more filings. */
public class XbrlPeriodsTable extends AbstractTable implements ScannableTable {
  private final ImmutableList<Object[]> rows;

  public XbrlPeriodsTable(List<Object[]> rows) {
    this.rows = ImmutableList.copyOf(rows);
  }

  /** Row for a period of the named filing. */
  public static Object[] row(String filing, ReportingPeriod period) {
    return new Object[] {
        filing,
        period.getKey(),
        period.getLabel(),
        period.isInstant() ? "instant" : "duration",
        period.getStartDate() == null ? null : period.getStartDate().toString(),
        period.getEndDate().toString(),
        period.isInstant() ? null : period.getDays(),
        period.getDurationClass() == null ? null : period.getDurationClass().name(),
        period.getContextIds().size()
    };
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return typeFactory.builder()
        .add("filing", SqlTypeName.VARCHAR)
        .add("period_key", SqlTypeName.VARCHAR)
        .add("label", SqlTypeName.VARCHAR)
        .add("period_type", SqlTypeName.VARCHAR)
        .add("start_date", SqlTypeName.VARCHAR).nullable(true)
        .add("end_date", SqlTypeName.VARCHAR)
        .add("days", SqlTypeName.BIGINT).nullable(true)
        .add("duration_class", SqlTypeName.VARCHAR).nullable(true)
        .add("context_count", SqlTypeName.INTEGER)
        .build();
  }

  @Override public Enumerable<Object[]> scan(DataContext root) {
    return new AbstractEnumerable<Object[]>() {
      @Override public Enumerator<Object[]> enumerator() {
        return new PeriodEnumerator(rows.iterator());
      }
    };
  }

  /** Enumerator over prepared period rows. */
  private static class PeriodEnumerator implements Enumerator<Object[]> {
    private final Iterator<Object[]> iterator;
    private Object[] current;

    PeriodEnumerator(Iterator<Object[]> iterator) {
      this.iterator = iterator;
    }

    @Override public Object[] current() {
      return current;
    }

    @Override public boolean moveNext() {
      if (iterator.hasNext()) {
        current = iterator.next();
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
