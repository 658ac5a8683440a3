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
package org.apache.calcite.adapter.tabnorm.quality;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A statistical anomaly found in one series.
 *
 * <p>Flags are informational. They never block ingestion and are never
 * merged into the fact store.
 *
 * @see QualityEngine
 */
public class QualityFlag {

  /**
   * Checks run by {@link QualityEngine}.
   */
  public enum Kind {
    /** Value far from the rest of the series (z-score). */
    OUTLIER,
    /** Large change against the previous value. */
    HIGH_VARIATION,
    /** Negative value in a series that cannot be negative. */
    NEGATIVE_VALUE,
    /** Reference date after the processing date. */
    FUTURE_DATE,
    /** One value dominates the series. */
    CONSTANT_SERIES
  }

  /**
   * How urgently a flag deserves attention.
   */
  public enum Severity {
    HIGH,
    MEDIUM,
    LOW
  }

  private final String seriesId;
  private final LocalDate referenceDate;
  private final Kind kind;
  private final Severity severity;
  private final @Nullable Double observedValue;
  private final String detail;

  public QualityFlag(String seriesId, LocalDate referenceDate, Kind kind, Severity severity,
      @Nullable Double observedValue, @Nullable String detail) {
    this.seriesId = Objects.requireNonNull(seriesId, "seriesId");
    this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.severity = Objects.requireNonNull(severity, "severity");
    this.observedValue = observedValue;
    this.detail = detail == null ? "" : detail;
  }

  public String getSeriesId() {
    return seriesId;
  }

  public LocalDate getReferenceDate() {
    return referenceDate;
  }

  public Kind getKind() {
    return kind;
  }

  public Severity getSeverity() {
    return severity;
  }

  public @Nullable Double getObservedValue() {
    return observedValue;
  }

  /** Human-readable explanation, such as {@code z=39.60}. */
  public String getDetail() {
    return detail;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QualityFlag)) {
      return false;
    }
    QualityFlag that = (QualityFlag) o;
    return seriesId.equals(that.seriesId)
        && referenceDate.equals(that.referenceDate)
        && kind == that.kind
        && severity == that.severity
        && Objects.equals(observedValue, that.observedValue)
        && Objects.equals(detail, that.detail);
  }

  @Override public int hashCode() {
    return Objects.hash(seriesId, referenceDate, kind, severity, observedValue, detail);
  }

  @Override public String toString() {
    return "QualityFlag{" + kind + "/" + severity + ", " + seriesId + " @ " + referenceDate
        + ", value=" + observedValue + ", " + detail + "}";
  }
}
