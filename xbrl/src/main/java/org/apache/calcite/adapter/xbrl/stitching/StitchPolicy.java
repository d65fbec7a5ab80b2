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

import org.checkerframework.checker.nullness.qual.Nullable;

/** How periods are chosen when statements from several filings are combined. */
public enum StitchPolicy {
  /** The most recent periods of any kind. */
  RECENT_PERIODS("Most Recent Periods"),
  /** At most one period per calendar year of the end date. */
  RECENT_YEARS("Recent Years"),
  /** At most one instant per calendar year. */
  THREE_YEAR_COMPARISON("Three-Year Comparison"),
  /** Quarter-length durations only. */
  THREE_QUARTERS("Three Recent Quarters"),
  /** Year-length durations only. */
  ANNUAL_COMPARISON("Annual Comparison"),
  ALL_PERIODS("All Available Periods");

  private final String displayName;

  StitchPolicy(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Looks a policy up by constant or display name; unknown names give
   * {@link #RECENT_PERIODS}.
   */
  public static StitchPolicy fromName(@Nullable String name) {
    if (name != null) {
      for (StitchPolicy policy : values()) {
        if (policy.name().equalsIgnoreCase(name)
            || policy.displayName.equalsIgnoreCase(name)) {
          return policy;
        }
      }
    }
    return RECENT_PERIODS;
  }
}
