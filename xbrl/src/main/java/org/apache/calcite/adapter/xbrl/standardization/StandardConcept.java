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

import org.checkerframework.checker.nullness.qual.Nullable;

/** The fixed vocabulary that filer-specific concepts are mapped onto. */
public enum StandardConcept {
  // Balance sheet
  CASH_AND_EQUIVALENTS("Cash and Cash Equivalents"),
  ACCOUNTS_RECEIVABLE("Accounts Receivable"),
  INVENTORY("Inventory"),
  PREPAID_EXPENSES("Prepaid Expenses"),
  TOTAL_CURRENT_ASSETS("Total Current Assets"),
  PROPERTY_PLANT_EQUIPMENT("Property, Plant and Equipment"),
  GOODWILL("Goodwill"),
  INTANGIBLE_ASSETS("Intangible Assets"),
  TOTAL_ASSETS("Total Assets"),
  ACCOUNTS_PAYABLE("Accounts Payable"),
  ACCRUED_LIABILITIES("Accrued Liabilities"),
  SHORT_TERM_DEBT("Short-Term Debt"),
  TOTAL_CURRENT_LIABILITIES("Total Current Liabilities"),
  LONG_TERM_DEBT("Long-Term Debt"),
  DEFERRED_REVENUE("Deferred Revenue"),
  TOTAL_LIABILITIES("Total Liabilities"),
  COMMON_STOCK("Common Stock"),
  RETAINED_EARNINGS("Retained Earnings"),
  TOTAL_EQUITY("Total Stockholders' Equity"),

  // Income statement
  REVENUE("Revenue"),
  COST_OF_REVENUE("Cost of Revenue"),
  GROSS_PROFIT("Gross Profit"),
  OPERATING_EXPENSES("Operating Expenses"),
  RESEARCH_AND_DEVELOPMENT("Research and Development Expense"),
  SELLING_GENERAL_ADMIN("Selling, General and Administrative Expense"),
  OPERATING_INCOME("Operating Income"),
  INTEREST_EXPENSE("Interest Expense"),
  INCOME_BEFORE_TAX("Income Before Tax"),
  INCOME_TAX_EXPENSE("Income Tax Expense"),
  NET_INCOME("Net Income"),

  // Cash flow statement
  CASH_FROM_OPERATIONS("Net Cash from Operating Activities"),
  CASH_FROM_INVESTING("Net Cash from Investing Activities"),
  CASH_FROM_FINANCING("Net Cash from Financing Activities"),
  NET_CHANGE_IN_CASH("Net Change in Cash");

  private final String displayName;

  StandardConcept(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  public static @Nullable StandardConcept fromDisplayName(String displayName) {
    for (StandardConcept concept : values()) {
      if (concept.displayName.equalsIgnoreCase(displayName)) {
        return concept;
      }
    }
    return null;
  }
}
