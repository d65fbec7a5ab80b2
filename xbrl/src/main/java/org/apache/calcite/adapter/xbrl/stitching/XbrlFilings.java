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
package org.apache.calcite.adapter.xbrl.stitching;

import org.apache.calcite.adapter.xbrl.XbrlDocument;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Several filings of one company, most recent first, viewed together.
 *
 * <p>Stitched statements are cached per argument combination. Instances are
 * not thread-safe.
 */
public class XbrlFilings {
  public static final int DEFAULT_MAX_PERIODS = 8;

  private final ImmutableList<XbrlDocument> documents;
  private final Map<String, StitchedStatement> statementCache = new HashMap<>();

  public XbrlFilings(List<XbrlDocument> documents) {
    Preconditions.checkArgument(!documents.isEmpty(), "at least one filing is required");
    this.documents = ImmutableList.copyOf(documents);
  }

  public List<XbrlDocument> getDocuments() {
    return documents;
  }

  public StitchedStatement getStatement(StatementType type) {
    return getStatement(type, StitchPolicy.ALL_PERIODS, DEFAULT_MAX_PERIODS, true);
  }

  public StitchedStatement getStatement(StatementType type, StitchPolicy policy,
      int maxPeriods, boolean standardize) {
    String cacheKey = type.name() + "_" + policy.name() + "_" + maxPeriods + "_" + standardize;
    StitchedStatement cached = statementCache.get(cacheKey);
    if (cached == null) {
      cached = StatementStitcher.stitchStatements(documents, type, policy, maxPeriods,
          standardize);
      statementCache.put(cacheKey, cached);
    }
    return cached;
  }

  /** Reporting periods of all filings, one per key, earlier filings winning. */
  public List<ReportingPeriod> getPeriods() {
    Map<String, ReportingPeriod> unique = new LinkedHashMap<>();
    for (XbrlDocument document : documents) {
      for (ReportingPeriod period : document.getReportingPeriods().getPeriods()) {
        unique.putIfAbsent(period.getKey(), period);
      }
    }
    return new ArrayList<>(unique.values());
  }
}
