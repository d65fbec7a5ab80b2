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
package org.apache.calcite.adapter.xbrl.model;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Financial statement kinds recognised across filings. */
public enum StatementType {
  BALANCE_SHEET("BalanceSheet", true, true),
  INCOME_STATEMENT("IncomeStatement", false, true),
  CASH_FLOW_STATEMENT("CashFlowStatement", false, true),
  STATEMENT_OF_EQUITY("StatementOfEquity", false, true),
  COMPREHENSIVE_INCOME("ComprehensiveIncome", false, true),
  SEGMENT_DISCLOSURE("SegmentDisclosure", false, false),
  NOTES("Notes", false, false);

  private final String typeName;
  private final boolean instantBased;
  private final boolean core;

  StatementType(String typeName, boolean instantBased, boolean core) {
    this.typeName = typeName;
    this.instantBased = instantBased;
    this.core = core;
  }

  /** Name used by callers, e.g. {@code BalanceSheet}. */
  public String getTypeName() {
    return typeName;
  }

  /** Whether the statement reports point-in-time balances rather than flows. */
  public boolean isInstantBased() {
    return instantBased;
  }

  /** One of the five primary financial statements. */
  public boolean isCore() {
    return core;
  }

  /** Looks a type up by its type name or constant name, ignoring case. */
  public static @Nullable StatementType fromName(@Nullable String name) {
    if (name == null) {
      return null;
    }
    for (StatementType type : values()) {
      if (type.typeName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
        return type;
      }
    }
    return null;
  }
}
