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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Resolves a role URI, statement type or role name by trying each matcher in turn. */
public class RoleResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(RoleResolver.class);

  private final ImmutableList<RoleMatcher> matchers;

  public RoleResolver() {
    this(RoleMatchers.defaultChain());
  }

  public RoleResolver(List<RoleMatcher> matchers) {
    this.matchers = ImmutableList.copyOf(matchers);
  }

  /** Returns the first match, or null when no matcher recognises the identifier. */
  public @Nullable StatementInfo resolve(String identifier, List<StatementInfo> statements) {
    for (RoleMatcher matcher : matchers) {
      StatementInfo match = matcher.match(identifier, statements);
      if (match != null) {
        return match;
      }
    }
    LOGGER.debug("No statement matches '{}'", identifier);
    return null;
  }
}
