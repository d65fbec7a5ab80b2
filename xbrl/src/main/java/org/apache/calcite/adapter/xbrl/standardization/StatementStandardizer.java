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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Rewrites line item labels to standard concept names. */
public final class StatementStandardizer {
  private StatementStandardizer() {
  }

  public static List<LineItem> standardize(List<LineItem> items, ConceptMapper mapper) {
    return standardize(items, mapper, null);
  }

  /**
   * Returns a copy of {@code items} where each mapped item that is neither
   * abstract nor a dimension member carries the standard label and keeps its
   * own as the original label.
   */
  public static List<LineItem> standardize(List<LineItem> items, ConceptMapper mapper,
      @Nullable StatementType statementType) {
    ImmutableList.Builder<LineItem> result = ImmutableList.builder();
    for (LineItem item : items) {
      // Member rows carry their parent's concept and keep their member labels
      if (item.isAbstract() || item.isDimension()) {
        result.add(item);
        continue;
      }
      String standard = mapper.mapConcept(item.getConcept(), item.getLabel(),
          MappingContext.of(item, statementType));
      result.add(standard == null ? item : item.withStandardLabel(standard));
    }
    return result.build();
  }
}
