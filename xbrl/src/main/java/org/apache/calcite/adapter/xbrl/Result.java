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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Outcome of a best-effort step: the data that could be obtained plus any
 * non-fatal diagnostics raised while obtaining it.
 *
 * @param <T> type of the value
 */
public final class Result<T> {
  private final T value;
  private final ImmutableList<String> warnings;

  private Result(T value, List<String> warnings) {
    this.value = value;
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public static <T> Result<T> of(T value) {
    return new Result<>(value, ImmutableList.of());
  }

  public static <T> Result<T> of(T value, List<String> warnings) {
    return new Result<>(value, warnings);
  }

  public T getValue() {
    return value;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  @Override public String toString() {
    return String.format("Result{value=%s, warnings=%s}", value, warnings);
  }
}
