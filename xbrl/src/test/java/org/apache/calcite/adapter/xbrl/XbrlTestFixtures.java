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

import com.google.common.io.Resources;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

/**
 * Access to the sample filing under {@code src/test/resources/xbrl/acme}.
 *
 * <p>The filing reports fiscal years 2024 and 2023 for a company with two
 * segments. Its cash flow statement subtracts an increase in inventories, so
 * that fact is negated when the document is built.
 */
public final class XbrlTestFixtures {
  public static final String BASE = "acme-20241231";
  public static final List<String> FILES = Arrays.asList(
      BASE + ".xsd", BASE + "_lab.xml", BASE + "_pre.xml", BASE + "_cal.xml",
      BASE + "_def.xml", BASE + "_htm.xml");

  public static final String BALANCE_SHEET_ROLE =
      "http://acme.com/role/ConsolidatedBalanceSheets";
  public static final String INCOME_STATEMENT_ROLE =
      "http://acme.com/role/ConsolidatedStatementsOfOperations";
  public static final String CASH_FLOW_ROLE =
      "http://acme.com/role/ConsolidatedStatementsOfCashFlows";
  public static final String SEGMENT_ROLE = "http://acme.com/role/SegmentInformationDetails";

  public static final String FY2024 = "duration_2024-01-01_2024-12-31";
  public static final String FY2023 = "duration_2023-01-01_2023-12-31";
  public static final String END_2024 = "instant_2024-12-31";
  public static final String END_2023 = "instant_2023-12-31";

  private XbrlTestFixtures() {
  }

  /** Text of one file of the sample filing. */
  public static String read(String fileName) {
    return readResource("xbrl/acme/" + fileName);
  }

  public static String readResource(String resource) {
    try {
      return Resources.toString(Resources.getResource(resource), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** The sample filing, built from its files. */
  public static XbrlDocument acme() {
    return XbrlDocument.builder()
        .schema(read(BASE + ".xsd"), BASE + ".xsd")
        .labels(read(BASE + "_lab.xml"), BASE + "_lab.xml")
        .presentation(read(BASE + "_pre.xml"), BASE + "_pre.xml")
        .calculation(read(BASE + "_cal.xml"), BASE + "_cal.xml")
        .definition(read(BASE + "_def.xml"), BASE + "_def.xml")
        .instance(read(BASE + "_htm.xml"), BASE + "_htm.xml")
        .build();
  }

  /** Copies the sample filing into {@code directory}. */
  public static File copyTo(File directory) {
    try {
      Files.createDirectories(directory.toPath());
      for (String name : FILES) {
        Files.write(new File(directory, name).toPath(),
            read(name).getBytes(StandardCharsets.UTF_8));
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return directory;
  }
}
