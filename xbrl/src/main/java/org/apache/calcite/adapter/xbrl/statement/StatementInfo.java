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

import org.apache.calcite.adapter.xbrl.model.StatementType;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Summary of one presentation role, as listed by {@code getAllStatements}. */
public final class StatementInfo {
  private final String role;
  private final String definition;
  private final int elementCount;
  private final @Nullable StatementType type;
  private final @Nullable String primaryConcept;
  private final String roleName;

  public StatementInfo(String role, String definition, int elementCount,
      @Nullable StatementType type, @Nullable String primaryConcept, String roleName) {
    this.role = role;
    this.definition = definition;
    this.elementCount = elementCount;
    this.type = type;
    this.primaryConcept = primaryConcept;
    this.roleName = roleName;
  }

  /** Last path segment of a role URI, e.g. {@code ConsolidatedBalanceSheets}. */
  public static String shortName(String roleUri) {
    String trimmed = roleUri.endsWith("/") ? roleUri.substring(0, roleUri.length() - 1) : roleUri;
    int slash = trimmed.lastIndexOf('/');
    return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
  }

  public String getRole() { return role; }
  public String getDefinition() { return definition; }
  public int getElementCount() { return elementCount; }
  public @Nullable StatementType getType() { return type; }
  public @Nullable String getPrimaryConcept() { return primaryConcept; }
  public String getRoleName() { return roleName; }

  @Override public String toString() {
    return String.format("StatementInfo{role='%s', type=%s, elements=%d}",
        role, type, elementCount);
  }
}
