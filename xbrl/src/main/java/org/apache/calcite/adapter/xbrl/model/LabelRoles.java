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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/** Label role URIs used by the XBRL 2.1 label linkbase. */
public final class LabelRoles {
  public static final String STANDARD = "http://www.xbrl.org/2003/role/label";
  public static final String TERSE = "http://www.xbrl.org/2003/role/terseLabel";
  public static final String VERBOSE = "http://www.xbrl.org/2003/role/verboseLabel";
  public static final String TOTAL = "http://www.xbrl.org/2003/role/totalLabel";
  public static final String PERIOD_START = "http://www.xbrl.org/2003/role/periodStartLabel";
  public static final String PERIOD_END = "http://www.xbrl.org/2003/role/periodEndLabel";
  public static final String NEGATED = "http://www.xbrl.org/2009/role/negatedLabel";
  public static final String NEGATED_TERSE = "http://www.xbrl.org/2009/role/negatedTerseLabel";
  public static final String NEGATED_TOTAL = "http://www.xbrl.org/2009/role/negatedTotalLabel";

  private LabelRoles() {
  }

  /** Whether a preferred-label role asks for the value to be shown with its sign flipped. */
  public static boolean isNegated(@Nullable String role) {
    return role != null && role.toLowerCase(Locale.ROOT).contains("negated");
  }

  public static boolean isTotal(@Nullable String role) {
    return role != null && role.toLowerCase(Locale.ROOT).contains("total");
  }
}
