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

/**
 * Classification of a duration period by its length in days.
 *
 * <p>The windows allow for leap years and for 52/53-week fiscal calendars.
 */
public enum DurationClass {
  ANNUAL("Annual"),
  QUARTERLY("Quarterly"),
  YTD("Year-to-Date"),
  OTHER("Period");

  private final String displayName;

  DurationClass(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  public static DurationClass classify(long days) {
    if (isAnnual(days)) {
      return ANNUAL;
    }
    if (isQuarterly(days)) {
      return QUARTERLY;
    }
    if (isYearToDate(days)) {
      return YTD;
    }
    return OTHER;
  }

  public static boolean isAnnual(long days) {
    return days >= 350 && days <= 380;
  }

  public static boolean isQuarterly(long days) {
    return days >= 85 && days <= 95;
  }

  /** Six-month (175-190 days) or nine-month (265-285 days) year-to-date windows. */
  public static boolean isYearToDate(long days) {
    return (days >= 175 && days <= 190) || (days >= 265 && days <= 285);
  }
}
