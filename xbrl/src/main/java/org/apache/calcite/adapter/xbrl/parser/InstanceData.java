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
package org.apache.calcite.adapter.xbrl.parser;

import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.Unit;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** Contexts, units and facts read from one instance document. */
public final class InstanceData {
  private final ImmutableMap<String, Context> contexts;
  private final ImmutableMap<String, Unit> units;
  private final FactStore facts;

  public InstanceData(Map<String, Context> contexts, Map<String, Unit> units, FactStore facts) {
    this.contexts = ImmutableMap.copyOf(contexts);
    this.units = ImmutableMap.copyOf(units);
    this.facts = facts;
  }

  public static InstanceData empty() {
    return new InstanceData(ImmutableMap.of(), ImmutableMap.of(), FactStore.empty());
  }

  /** Contexts keyed by id, in document order. */
  public Map<String, Context> getContexts() {
    return contexts;
  }

  public Map<String, Unit> getUnits() {
    return units;
  }

  public FactStore getFacts() {
    return facts;
  }
}
