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

import org.apache.calcite.adapter.tabnorm.CanonicalRecord;

import com.google.common.base.Joiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs statistical checks over normalized series and reports anomalies.
 *
 * <p>Records are grouped by logical series (series id plus dimensions) and
 * each series is checked in date order:
 * <ul>
 *   <li>{@link QualityFlag.Kind#OUTLIER} - a value whose z-score against the
 *       other values of the series exceeds the threshold;</li>
 *   <li>{@link QualityFlag.Kind#HIGH_VARIATION} - a relative change against the
 *       previous value above the threshold;</li>
 *   <li>{@link QualityFlag.Kind#NEGATIVE_VALUE} - a negative value in a series
 *       configured as non-negative;</li>
 *   <li>{@link QualityFlag.Kind#FUTURE_DATE} - a reference date after today;</li>
 *   <li>{@link QualityFlag.Kind#CONSTANT_SERIES} - one value making up more
 *       than half of the series.</li>
 * </ul>
 *
 * <p>Flags carry the record's series id; when a series has dimensions they
 * are appended to the flag detail, as in {@code (uf=SP)}.
 *
 * <p>The engine never modifies its input and never throws for data it
 * dislikes; it only reports.
 */
public class QualityEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(QualityEngine.class);

  /** Orders flags by series, date, then check. */
  public static final Comparator<QualityFlag> FLAG_ORDER =
      Comparator.comparing(QualityFlag::getSeriesId)
          .thenComparing(QualityFlag::getReferenceDate)
          .thenComparing(QualityFlag::getKind);

  private static final Joiner.MapJoiner DIMENSION_JOINER =
      Joiner.on(", ").withKeyValueSeparator("=");

  private final QualityConfig config;
  private final Clock clock;

  public QualityEngine() {
    this(QualityConfig.defaults(), Clock.systemDefaultZone());
  }

  public QualityEngine(QualityConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  /**
   * Checks every logical series in a batch.
   *
   * @param records Records in any order, possibly spanning several series
   * @return Flags ordered by series, date and check
   */
  public List<QualityFlag> evaluate(Collection<CanonicalRecord> records) {
    Map<String, List<CanonicalRecord>> bySeries = new TreeMap<String, List<CanonicalRecord>>();
    for (CanonicalRecord record : records) {
      bySeries.computeIfAbsent(record.getSeriesKey(),
          k -> new ArrayList<CanonicalRecord>()).add(record);
    }

    List<QualityFlag> flags = new ArrayList<QualityFlag>();
    for (Map.Entry<String, List<CanonicalRecord>> entry : bySeries.entrySet()) {
      List<CanonicalRecord> series = new ArrayList<CanonicalRecord>(entry.getValue());
      series.sort(Comparator.comparing(CanonicalRecord::getReferenceDate));
      CanonicalRecord first = series.get(0);
      List<QualityFlag> seriesFlags = evaluateSeries(first.getSeriesId(), series);
      if (first.getDimensions().isEmpty()) {
        flags.addAll(seriesFlags);
        continue;
      }
      // same series id, different dimensions: name the dimensions in the detail
      String scope = DIMENSION_JOINER.join(first.getDimensions());
      for (QualityFlag flag : seriesFlags) {
        flags.add(
            new QualityFlag(flag.getSeriesId(), flag.getReferenceDate(), flag.getKind(),
            flag.getSeverity(), flag.getObservedValue(), flag.getDetail() + " (" + scope + ")"));
      }
    }
    Collections.sort(flags, FLAG_ORDER);
    LOGGER.info("Quality checks over {} records in {} series produced {} flags",
        records.size(), bySeries.size(), flags.size());
    return flags;
  }

  /**
   * Checks one series.
   *
   * @param seriesId Identifier reported on the flags
   * @param sorted Records of a single logical series, ordered by reference date
   * @return Flags for this series
   */
  public List<QualityFlag> evaluateSeries(String seriesId, List<CanonicalRecord> sorted) {
    List<CanonicalRecord> valued = new ArrayList<CanonicalRecord>();
    for (CanonicalRecord record : sorted) {
      if (record.getValue() != null) {
        valued.add(record);
      }
    }

    List<QualityFlag> flags = new ArrayList<QualityFlag>();
    if (config.isEnabled(QualityFlag.Kind.OUTLIER)) {
      checkOutliers(seriesId, valued, flags);
    }
    if (config.isEnabled(QualityFlag.Kind.HIGH_VARIATION)) {
      checkVariation(seriesId, valued, flags);
    }
    if (config.isEnabled(QualityFlag.Kind.NEGATIVE_VALUE)) {
      checkNegative(seriesId, valued, flags);
    }
    if (config.isEnabled(QualityFlag.Kind.FUTURE_DATE)) {
      checkFutureDates(seriesId, sorted, flags);
    }
    if (config.isEnabled(QualityFlag.Kind.CONSTANT_SERIES)) {
      checkConstant(seriesId, valued, flags);
    }
    for (QualityFlag flag : flags) {
      LOGGER.debug("{}", flag);
    }
    return flags;
  }

  /**
   * Flags values far from the rest of the series. The mean and population
   * standard deviation are taken over the other values, so a single spike does
   * not inflate the spread it is measured against.
   */
  private void checkOutliers(String seriesId, List<CanonicalRecord> valued,
      List<QualityFlag> flags) {
    int n = valued.size();
    if (n < config.getOutlierMinPoints() || n < 3) {
      return;
    }
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = valued.get(i).getValue();
    }
    for (int i = 0; i < n; i++) {
      double sum = 0;
      for (int j = 0; j < n; j++) {
        if (j != i) {
          sum += values[j];
        }
      }
      double mean = sum / (n - 1);
      double squares = 0;
      for (int j = 0; j < n; j++) {
        if (j != i) {
          squares += (values[j] - mean) * (values[j] - mean);
        }
      }
      double stddev = Math.sqrt(squares / (n - 1));
      if (stddev == 0) {
        continue;
      }
      double z = Math.abs(values[i] - mean) / stddev;
      if (z > config.getZScoreThreshold()) {
        QualityFlag.Severity severity = z > config.getZScoreHighThreshold()
            ? QualityFlag.Severity.HIGH
            : QualityFlag.Severity.MEDIUM;
        flags.add(
            new QualityFlag(seriesId, valued.get(i).getReferenceDate(),
            QualityFlag.Kind.OUTLIER, severity, values[i],
            String.format(Locale.ROOT, "z=%.2f (mean=%.4f, stddev=%.4f)", z, mean, stddev)));
      }
    }
  }

  private void checkVariation(String seriesId, List<CanonicalRecord> valued,
      List<QualityFlag> flags) {
    for (int i = 1; i < valued.size(); i++) {
      double previous = valued.get(i - 1).getValue();
      double current = valued.get(i).getValue();
      if (previous == 0) {
        continue;
      }
      double variation = (current - previous) / previous;
      if (Math.abs(variation) > config.getVariationThreshold()) {
        QualityFlag.Severity severity = Math.abs(variation) > config.getVariationHighThreshold()
            ? QualityFlag.Severity.HIGH
            : QualityFlag.Severity.MEDIUM;
        flags.add(
            new QualityFlag(seriesId, valued.get(i).getReferenceDate(),
            QualityFlag.Kind.HIGH_VARIATION, severity, current,
            String.format(Locale.ROOT, "variation=%.2f%% from %s", variation * 100,
                valued.get(i - 1).getReferenceDate())));
      }
    }
  }

  private void checkNegative(String seriesId, List<CanonicalRecord> valued,
      List<QualityFlag> flags) {
    for (CanonicalRecord record : valued) {
      if (record.getValue() < 0
          && config.getNonNegativeSeries().contains(record.getSeriesId())) {
        flags.add(
            new QualityFlag(seriesId, record.getReferenceDate(),
            QualityFlag.Kind.NEGATIVE_VALUE, QualityFlag.Severity.HIGH, record.getValue(),
            "negative value in non-negative series"));
      }
    }
  }

  private void checkFutureDates(String seriesId, List<CanonicalRecord> sorted,
      List<QualityFlag> flags) {
    LocalDate today = LocalDate.now(clock);
    for (CanonicalRecord record : sorted) {
      if (record.getReferenceDate().isAfter(today)) {
        flags.add(
            new QualityFlag(seriesId, record.getReferenceDate(),
            QualityFlag.Kind.FUTURE_DATE, QualityFlag.Severity.HIGH, record.getValue(),
            "reference date after " + today));
      }
    }
  }

  private void checkConstant(String seriesId, List<CanonicalRecord> valued,
      List<QualityFlag> flags) {
    int n = valued.size();
    if (n < config.getConstantMinPoints()) {
      return;
    }
    Map<Double, Integer> counts = new LinkedHashMap<Double, Integer>();
    for (CanonicalRecord record : valued) {
      counts.merge(record.getValue(), 1, Integer::sum);
    }
    Double mode = null;
    int modeCount = 0;
    for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > modeCount) {
        mode = entry.getKey();
        modeCount = entry.getValue();
      }
    }
    double share = (double) modeCount / n;
    if (mode == null || share <= config.getConstantShareThreshold()) {
      return;
    }
    LocalDate latest = null;
    for (CanonicalRecord record : valued) {
      if (mode.equals(record.getValue())) {
        latest = record.getReferenceDate();
      }
    }
    flags.add(
        new QualityFlag(seriesId, latest, QualityFlag.Kind.CONSTANT_SERIES,
        QualityFlag.Severity.MEDIUM, mode,
        String.format(Locale.ROOT, "value repeated in %d of %d points", modeCount, n)));
  }
}
