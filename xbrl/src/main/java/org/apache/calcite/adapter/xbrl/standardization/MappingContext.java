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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/** Where a line item sits, used to adjust mapping confidence. */
public final class MappingContext {
  private final @Nullable StatementType statementType;
  private final int level;
  private final boolean total;

  public MappingContext(@Nullable StatementType statementType, int level, boolean total) {
    this.statementType = statementType;
    this.level = level;
    this.total = total;
  }

  public static MappingContext of(@Nullable StatementType statementType) {
    return new MappingContext(statementType, 0, false);
  }

  public static MappingContext of(LineItem item, @Nullable StatementType statementType) {
    boolean total = item.isTotal()
        || item.getLabel().toLowerCase(Locale.ROOT).contains("total");
    return new MappingContext(statementType, item.getLevel(), total);
  }

  public @Nullable StatementType getStatementType() {
    return statementType;
  }

  public int getLevel() {
    return level;
  }

  public boolean isTotal() {
    return total;
  }
}
