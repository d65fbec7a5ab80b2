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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * An XBRL context: the entity, reporting period and dimensional qualifiers a
 * fact applies to. Dimension and member ids are normalized.
 */
public final class Context {
  private final String contextId;
  private final @Nullable String entityIdentifier;
  private final @Nullable String entityScheme;
  private final PeriodDescriptor period;
  private final ImmutableMap<String, String> dimensions;

  public Context(String contextId, @Nullable String entityIdentifier,
      @Nullable String entityScheme, PeriodDescriptor period, Map<String, String> dimensions) {
    this.contextId = contextId;
    this.entityIdentifier = entityIdentifier;
    this.entityScheme = entityScheme;
    this.period = period;
    this.dimensions = ImmutableMap.copyOf(dimensions);
  }

  public String getContextId() { return contextId; }
  public @Nullable String getEntityIdentifier() { return entityIdentifier; }
  public @Nullable String getEntityScheme() { return entityScheme; }
  public PeriodDescriptor getPeriod() { return period; }

  /** Dimension id to member id (explicit) or to the typed member's tag name (typed). */
  public Map<String, String> getDimensions() { return dimensions; }

  public boolean hasDimensions() {
    return !dimensions.isEmpty();
  }

  @Override public String toString() {
    return String.format("Context{id='%s', period=%s, dimensions=%s}",
        contextId, period, dimensions);
  }
}
