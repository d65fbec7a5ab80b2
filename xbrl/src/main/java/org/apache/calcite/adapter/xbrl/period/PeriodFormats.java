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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/** Date parsing and display formatting for reporting periods. */
public final class PeriodFormats {
  private static final DateTimeFormatter DISPLAY =
      DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);

  private PeriodFormats() {
  }

  /** Formats a date as {@code Dec 31, 2024}. */
  public static String formatDate(LocalDate date) {
    return DISPLAY.format(date);
  }

  /**
   * Parses an ISO date as it appears in instance documents. A trailing time
   * component is ignored.
   *
   * @return the date, or null when the text is not a date
   */
  public static @Nullable LocalDate parseDate(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
      trimmed = trimmed.substring(0, 10);
    }
    try {
      return LocalDate.parse(trimmed);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
