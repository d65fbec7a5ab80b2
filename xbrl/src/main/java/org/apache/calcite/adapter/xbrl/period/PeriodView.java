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
package org.apache.calcite.adapter.xbrl.period;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** A named, ordered selection of period keys to show as statement columns. */
public final class PeriodView {
  private final String name;
  private final String description;
  private final ImmutableList<String> periodKeys;

  public PeriodView(String name, String description, List<String> periodKeys) {
    this.name = name;
    this.description = description;
    this.periodKeys = ImmutableList.copyOf(periodKeys);
  }

  public String getName() { return name; }
  public String getDescription() { return description; }
  public List<String> getPeriodKeys() { return periodKeys; }

  @Override public String toString() {
    return name + " " + periodKeys;
  }
}
