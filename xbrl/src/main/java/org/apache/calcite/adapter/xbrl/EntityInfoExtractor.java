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

import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.ReportingPeriod;
import org.apache.calcite.adapter.xbrl.period.PeriodFormats;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives who filed a document and what it covers from the {@code dei}
 * cover-page facts and the contexts.
 */
public class EntityInfoExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(EntityInfoExtractor.class);

  private static final String DEI = "dei_";

  /**
   * Extracts entity information. Failures yield whatever could be read
   * before the failure together with a warning.
   */
  public Result<EntityInfo> extract(FactStore facts, Map<String, Context> contexts,
      ReportingPeriods periods) {
    EntityInfo.Builder info = EntityInfo.builder();
    try {
      populate(info, facts, contexts, periods);
      EntityInfo result = info.build();
      LOGGER.debug("Entity info: {}", result);
      return Result.of(result);
    } catch (RuntimeException e) {
      String warning = "Error extracting entity info: " + e.getMessage();
      LOGGER.warn(warning, e);
      return Result.of(info.build(), Collections.singletonList(warning));
    }
  }

  private static void populate(EntityInfo.Builder info, FactStore facts,
      Map<String, Context> contexts, ReportingPeriods periods) {
    if (!contexts.isEmpty()) {
      String identifier = contexts.values().iterator().next().getEntityIdentifier();
      if (identifier != null && isDigits(identifier)) {
        String stripped = identifier.replaceFirst("^0+", "");
        info.identifier(stripped.isEmpty() ? "0" : stripped);
      }
    }

    info.entityName(deiValue(facts, contexts, "EntityRegistrantName"));
    info.ticker(deiValue(facts, contexts, "TradingSymbol"));
    info.fiscalPeriod(deiValue(facts, contexts, "DocumentFiscalPeriodFocus"));

    String fiscalYear = deiValue(facts, contexts, "DocumentFiscalYearFocus");
    if (fiscalYear != null && fiscalYear.length() == 4 && isDigits(fiscalYear)) {
      info.fiscalYear(Integer.valueOf(fiscalYear));
    }

    String documentType = deiValue(facts, contexts, "DocumentType");
    info.documentType(documentType);
    if (documentType != null) {
      String base = documentType.toUpperCase(Locale.ROOT);
      info.amendment(base.contains("/A"));
      base = base.replace("/A", "");
      info.annualReport("10-K".equals(base));
      info.quarterlyReport("10-Q".equals(base));
    } else {
      info.annualReport(isTrue(deiValue(facts, contexts, "DocumentAnnualReport")));
      info.quarterlyReport(isTrue(deiValue(facts, contexts, "DocumentQuarterlyReport")));
    }

    info.documentPeriodEndDate(
        PeriodFormats.parseDate(deiValue(facts, contexts, "DocumentPeriodEndDate")));

    int[] fiscalYearEnd = parseMonthDay(deiValue(facts, contexts, "CurrentFiscalYearEndDate"));
    if (fiscalYearEnd != null) {
      info.fiscalYearEnd(fiscalYearEnd[0], fiscalYearEnd[1]);
    }

    List<ReportingPeriod> instants = periods.instants();
    if (!instants.isEmpty()) {
      info.reportingEndDate(instants.get(0).getEndDate());
    }
  }

  /** Value of a {@code dei} fact, preferring contexts without dimensions. */
  static @Nullable String deiValue(FactStore facts, Map<String, Context> contexts,
      String localName) {
    String fallback = null;
    for (Fact fact : facts.getFacts(DEI + localName)) {
      Context context = contexts.get(fact.getContextRef());
      if (context == null || !context.hasDimensions()) {
        return fact.getValue();
      }
      if (fallback == null) {
        fallback = fact.getValue();
      }
    }
    return fallback;
  }

  /** Parses {@code --MM-DD} into month and day, or returns null. */
  static int @Nullable [] parseMonthDay(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String value = text.startsWith("--") ? text.substring(2) : text;
    String[] parts = value.split("-");
    if (parts.length != 2 || parts[0].length() > 2 || parts[1].length() > 2
        || !isDigits(parts[0]) || !isDigits(parts[1])) {
      return null;
    }
    int month = Integer.parseInt(parts[0]);
    int day = Integer.parseInt(parts[1]);
    if (month < 1 || month > 12 || day < 1 || day > 31) {
      return null;
    }
    return new int[] {month, day};
  }

  private static boolean isTrue(@Nullable String value) {
    return value != null && ("true".equalsIgnoreCase(value) || "1".equals(value));
  }

  private static boolean isDigits(String text) {
    if (text.isEmpty()) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
