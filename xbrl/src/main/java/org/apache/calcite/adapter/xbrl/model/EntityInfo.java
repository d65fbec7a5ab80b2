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

import java.time.LocalDate;

/** Filer and document facts taken from the DEI section of an instance document. */
public final class EntityInfo {
  private final @Nullable String entityName;
  private final @Nullable String ticker;
  private final @Nullable String identifier;
  private final @Nullable String documentType;
  private final @Nullable Integer fiscalYear;
  private final @Nullable String fiscalPeriod;
  private final @Nullable Integer fiscalYearEndMonth;
  private final @Nullable Integer fiscalYearEndDay;
  private final @Nullable LocalDate documentPeriodEndDate;
  private final @Nullable LocalDate reportingEndDate;
  private final boolean annualReport;
  private final boolean quarterlyReport;
  private final boolean amendment;

  private EntityInfo(Builder b) {
    this.entityName = b.entityName;
    this.ticker = b.ticker;
    this.identifier = b.identifier;
    this.documentType = b.documentType;
    this.fiscalYear = b.fiscalYear;
    this.fiscalPeriod = b.fiscalPeriod;
    this.fiscalYearEndMonth = b.fiscalYearEndMonth;
    this.fiscalYearEndDay = b.fiscalYearEndDay;
    this.documentPeriodEndDate = b.documentPeriodEndDate;
    this.reportingEndDate = b.reportingEndDate;
    this.annualReport = b.annualReport;
    this.quarterlyReport = b.quarterlyReport;
    this.amendment = b.amendment;
  }

  public static EntityInfo empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable String getEntityName() { return entityName; }
  public @Nullable String getTicker() { return ticker; }
  /** CIK with leading zeros stripped. */
  public @Nullable String getIdentifier() { return identifier; }
  public @Nullable String getDocumentType() { return documentType; }
  public @Nullable Integer getFiscalYear() { return fiscalYear; }
  public @Nullable String getFiscalPeriod() { return fiscalPeriod; }
  public @Nullable Integer getFiscalYearEndMonth() { return fiscalYearEndMonth; }
  public @Nullable Integer getFiscalYearEndDay() { return fiscalYearEndDay; }
  public @Nullable LocalDate getDocumentPeriodEndDate() { return documentPeriodEndDate; }
  public @Nullable LocalDate getReportingEndDate() { return reportingEndDate; }
  public boolean isAnnualReport() { return annualReport; }
  public boolean isQuarterlyReport() { return quarterlyReport; }
  public boolean isAmendment() { return amendment; }

  public boolean hasFiscalYearEnd() {
    return fiscalYearEndMonth != null && fiscalYearEndDay != null;
  }

  @Override public String toString() {
    return String.format("EntityInfo{name='%s', cik='%s', documentType='%s', fiscalYear=%s, "
        + "fiscalPeriod='%s'}", entityName, identifier, documentType, fiscalYear, fiscalPeriod);
  }

  /** Builder for {@link EntityInfo}. */
  public static final class Builder {
    private @Nullable String entityName;
    private @Nullable String ticker;
    private @Nullable String identifier;
    private @Nullable String documentType;
    private @Nullable Integer fiscalYear;
    private @Nullable String fiscalPeriod;
    private @Nullable Integer fiscalYearEndMonth;
    private @Nullable Integer fiscalYearEndDay;
    private @Nullable LocalDate documentPeriodEndDate;
    private @Nullable LocalDate reportingEndDate;
    private boolean annualReport;
    private boolean quarterlyReport;
    private boolean amendment;

    private Builder() {
    }

    public Builder entityName(@Nullable String entityName) {
      this.entityName = entityName;
      return this;
    }

    public Builder ticker(@Nullable String ticker) {
      this.ticker = ticker;
      return this;
    }

    public Builder identifier(@Nullable String identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder documentType(@Nullable String documentType) {
      this.documentType = documentType;
      return this;
    }

    public Builder fiscalYear(@Nullable Integer fiscalYear) {
      this.fiscalYear = fiscalYear;
      return this;
    }

    public Builder fiscalPeriod(@Nullable String fiscalPeriod) {
      this.fiscalPeriod = fiscalPeriod;
      return this;
    }

    public Builder fiscalYearEnd(@Nullable Integer month, @Nullable Integer day) {
      this.fiscalYearEndMonth = month;
      this.fiscalYearEndDay = day;
      return this;
    }

    public Builder documentPeriodEndDate(@Nullable LocalDate documentPeriodEndDate) {
      this.documentPeriodEndDate = documentPeriodEndDate;
      return this;
    }

    public Builder reportingEndDate(@Nullable LocalDate reportingEndDate) {
      this.reportingEndDate = reportingEndDate;
      return this;
    }

    public Builder annualReport(boolean annualReport) {
      this.annualReport = annualReport;
      return this;
    }

    public Builder quarterlyReport(boolean quarterlyReport) {
      this.quarterlyReport = quarterlyReport;
      return this;
    }

    public Builder amendment(boolean amendment) {
      this.amendment = amendment;
      return this;
    }

    public EntityInfo build() {
      return new EntityInfo(this);
    }
  }
}
