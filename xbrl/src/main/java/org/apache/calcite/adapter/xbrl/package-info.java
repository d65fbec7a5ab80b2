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

/**
 * Parses SEC EDGAR XBRL filings and exposes their statements and facts.
 *
 * <p>An {@link org.apache.calcite.adapter.xbrl.XbrlDocument} is built from a
 * filing's schema, linkbases and instance document, either file by file with
 * {@link org.apache.calcite.adapter.xbrl.XbrlDocumentBuilder} or from a
 * directory with {@link org.apache.calcite.adapter.xbrl.XbrlDirectoryReader}.
 * Once built it is read-only.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.apache.calcite.adapter.xbrl.XbrlDocument} - resolved
 *       statements, facts, reporting periods and entity information</li>
 *   <li>{@link org.apache.calcite.adapter.xbrl.XbrlConfig} - statement
 *       registry, concept mappings and stitching defaults</li>
 *   <li>{@link org.apache.calcite.adapter.xbrl.XbrlSchemaFactory} - Calcite
 *       schema with {@code facts} and {@code reporting_periods} tables</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * XbrlDocument document = XbrlDocument.fromDirectory(new File("aapl-20240928"));
 * List<LineItem> balanceSheet = document.getStatement("BalanceSheet");
 * }</pre>
 */
package org.apache.calcite.adapter.xbrl;
