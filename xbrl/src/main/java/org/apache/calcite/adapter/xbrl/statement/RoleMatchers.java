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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;

/** The built-in {@link RoleMatcher}s, in the order they are tried. */
public final class RoleMatchers {

  private RoleMatchers() {
  }

  /** Exact role URI. */
  public static final RoleMatcher ROLE_URI = (identifier, statements) -> {
    for (StatementInfo statement : statements) {
      if (statement.getRole().equals(identifier)) {
        return statement;
      }
    }
    return null;
  };

  /**
   * Statement type name such as {@code BalanceSheet}. Roles recognised by
   * their primary concept win over roles recognised by keyword.
   */
  public static final RoleMatcher STATEMENT_TYPE = (identifier, statements) -> {
    StatementType type = StatementType.fromName(identifier);
    if (type == null) {
      return null;
    }
    StatementInfo keywordMatch = null;
    for (StatementInfo statement : statements) {
      if (statement.getType() != type) {
        continue;
      }
      if (statement.getPrimaryConcept() != null) {
        return statement;
      }
      if (keywordMatch == null) {
        keywordMatch = statement;
      }
    }
    return keywordMatch;
  };

  /** Last segment of the role URI, ignoring case. */
  public static final RoleMatcher SHORT_NAME = (identifier, statements) -> {
    for (StatementInfo statement : statements) {
      if (statement.getRoleName().equalsIgnoreCase(identifier)) {
        return statement;
      }
    }
    return null;
  };

  /** Role definition with spaces removed, ignoring case. */
  public static final RoleMatcher DEFINITION = (identifier, statements) -> {
    String wanted = squash(identifier);
    for (StatementInfo statement : statements) {
      if (squash(statement.getDefinition()).equals(wanted)) {
        return statement;
      }
    }
    return null;
  };

  /** Identifier contained in a role name, ignoring case. */
  public static final RoleMatcher SUBSTRING = (identifier, statements) -> {
    String wanted = identifier.toLowerCase(Locale.ROOT);
    if (wanted.isEmpty()) {
      return null;
    }
    for (StatementInfo statement : statements) {
      if (statement.getRoleName().toLowerCase(Locale.ROOT).contains(wanted)) {
        return statement;
      }
    }
    return null;
  };

  /** The default chain. */
  public static List<RoleMatcher> defaultChain() {
    return ImmutableList.of(ROLE_URI, STATEMENT_TYPE, SHORT_NAME, DEFINITION, SUBSTRING);
  }

  static String squash(@Nullable String text) {
    return text == null ? "" : text.replace(" ", "").toLowerCase(Locale.ROOT);
  }
}
