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

import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema over a directory of XBRL filings.
 *
 * <p>The directory either holds one filing's files itself, or one
 * subdirectory per filing. Filings are named after their directory.
 */
public class XbrlSchema extends AbstractSchema {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlSchema.class);

  public static final String FACTS_TABLE = "facts";
  public static final String PERIODS_TABLE = "reporting_periods";

  private final File directory;
  private final XbrlConfig config;
  private Map<String, Table> tableMap;

  public XbrlSchema(File directory, XbrlConfig config) {
    this.directory = directory;
    this.config = config;
  }

  @Override protected Map<String, Table> getTableMap() {
    if (tableMap == null) {
      tableMap = createTableMap();
    }
    return tableMap;
  }

  private Map<String, Table> createTableMap() {
    Map<String, XbrlDocument> documents = loadDocuments();
    List<Map<String, Object>> facts = new ArrayList<>();
    List<Object[]> periods = new ArrayList<>();
    for (Map.Entry<String, XbrlDocument> filing : documents.entrySet()) {
      for (Map<String, Object> record : filing.getValue().getFactsView().getRecords()) {
        Map<String, Object> withFiling = new LinkedHashMap<>(record);
        withFiling.put(XbrlFactsTable.FILING, filing.getKey());
        facts.add(withFiling);
      }
      for (ReportingPeriod period : filing.getValue().getReportingPeriods().getPeriods()) {
        periods.add(XbrlPeriodsTable.row(filing.getKey(), period));
      }
    }
    LOGGER.info("XBRL schema over {}: {} filings, {} facts, {} periods", directory,
        documents.size(), facts.size(), periods.size());
    return ImmutableMap.<String, Table>builder()
        .put(FACTS_TABLE, new XbrlFactsTable(facts))
        .put(PERIODS_TABLE, new XbrlPeriodsTable(periods))
        .build();
  }

  private Map<String, XbrlDocument> loadDocuments() {
    XbrlDirectoryReader reader = new XbrlDirectoryReader(config);
    Map<String, XbrlDocument> documents = new LinkedHashMap<>();
    if (XbrlDirectoryReader.isFilingDirectory(directory)) {
      documents.put(directory.getName(), reader.read(directory));
      return documents;
    }
    File[] children = directory.listFiles(File::isDirectory);
    if (children == null) {
      throw new XbrlProcessingException("Not a readable directory: " + directory);
    }
    Arrays.sort(children);
    for (File child : children) {
      if (XbrlDirectoryReader.isFilingDirectory(child)) {
        documents.put(child.getName(), reader.read(child));
      }
    }
    return documents;
  }
}
