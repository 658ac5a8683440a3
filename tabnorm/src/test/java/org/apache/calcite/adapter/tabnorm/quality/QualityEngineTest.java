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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for QualityEngine.
 */
@Tag("unit")
public class QualityEngineTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

  private static QualityEngine engine(QualityFlag.Kind kind) {
    return new QualityEngine(QualityConfig.builder().checks(EnumSet.of(kind)).build(), CLOCK);
  }

  /** Builds a monthly series starting in January 2023. */
  private static List<CanonicalRecord> monthly(String seriesId, Double... values) {
    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>();
    for (int i = 0; i < values.length; i++) {
      records.add(record(seriesId, LocalDate.of(2023, 1, 1).plusMonths(i), values[i]));
    }
    return records;
  }

  private static CanonicalRecord record(String seriesId, LocalDate date, @Nullable Double value) {
    return CanonicalRecord.builder()
        .seriesId(seriesId)
        .referenceDate(date)
        .value(value)
        .build();
  }

  private static List<QualityFlag> ofKind(List<QualityFlag> flags, QualityFlag.Kind kind) {
    List<QualityFlag> result = new ArrayList<QualityFlag>();
    for (QualityFlag flag : flags) {
      if (flag.getKind() == kind) {
        result.add(flag);
      }
    }
    return result;
  }

  @Test void testSingleSpikeIsTheOnlyOutlier() {
    List<CanonicalRecord> records =
        monthly("cub", 100d, 102d, 101d, 103d, 105d, 200d, 106d, 107d);

    List<QualityFlag> flags = engine(QualityFlag.Kind.OUTLIER).evaluate(records);

    assertEquals(1, flags.size());
    QualityFlag flag = flags.get(0);
    assertEquals(QualityFlag.Kind.OUTLIER, flag.getKind());
    assertEquals(QualityFlag.Severity.HIGH, flag.getSeverity());
    assertEquals(LocalDate.of(2023, 6, 1), flag.getReferenceDate());
    assertEquals(200.0, flag.getObservedValue(), 0.0);
    assertTrue(flag.getDetail().startsWith("z="), flag.getDetail());
  }

  @Test void testDefaultChecksOnSpike() {
    List<CanonicalRecord> records =
        monthly("cub", 100d, 102d, 101d, 103d, 105d, 200d, 106d, 107d);

    List<QualityFlag> flags = new QualityEngine(QualityConfig.defaults(), CLOCK).evaluate(records);

    assertEquals(1, ofKind(flags, QualityFlag.Kind.OUTLIER).size());
    List<QualityFlag> jumps = ofKind(flags, QualityFlag.Kind.HIGH_VARIATION);
    assertEquals(2, jumps.size());
    assertEquals(LocalDate.of(2023, 6, 1), jumps.get(0).getReferenceDate());
    assertEquals(LocalDate.of(2023, 7, 1), jumps.get(1).getReferenceDate());
    assertTrue(ofKind(flags, QualityFlag.Kind.CONSTANT_SERIES).isEmpty());
  }

  @Test void testFlatSeriesHasNoOutliers() {
    List<CanonicalRecord> records = monthly("flat", 5d, 5d, 5d, 5d);
    assertTrue(engine(QualityFlag.Kind.OUTLIER).evaluate(records).isEmpty());
  }

  @Test void testHighVariation() {
    List<CanonicalRecord> records = monthly("incc", 100d, 112d, 150d, 151d);

    List<QualityFlag> flags = engine(QualityFlag.Kind.HIGH_VARIATION).evaluate(records);

    assertEquals(2, flags.size());
    assertEquals(QualityFlag.Severity.MEDIUM, flags.get(0).getSeverity());
    assertEquals(LocalDate.of(2023, 2, 1), flags.get(0).getReferenceDate());
    assertEquals(QualityFlag.Severity.HIGH, flags.get(1).getSeverity());
    assertEquals("variation=33.93% from 2023-02-01", flags.get(1).getDetail());
  }

  @Test void testVariationSkipsZeroBaseAndNulls() {
    List<CanonicalRecord> records = monthly("x", 0d, 50d, null, 51d);
    assertTrue(engine(QualityFlag.Kind.HIGH_VARIATION).evaluate(records).isEmpty());
  }

  @Test void testNegativeValue() {
    QualityConfig config = QualityConfig.builder()
        .checks(EnumSet.of(QualityFlag.Kind.NEGATIVE_VALUE))
        .nonNegativeSeries(ImmutableSet.of("cub"))
        .build();
    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>();
    records.addAll(monthly("cub", 10d, -5d));
    records.addAll(monthly("saldo", 10d, -5d));

    List<QualityFlag> flags = new QualityEngine(config, CLOCK).evaluate(records);

    assertEquals(1, flags.size());
    assertEquals("cub", flags.get(0).getSeriesId());
    assertEquals(QualityFlag.Severity.HIGH, flags.get(0).getSeverity());
    assertEquals(-5.0, flags.get(0).getObservedValue(), 0.0);
  }

  @Test void testFutureDate() {
    List<CanonicalRecord> records = ImmutableList.of(
        record("cub", LocalDate.of(2024, 6, 1), 1d),
        record("cub", LocalDate.of(2024, 6, 15), 1d),
        record("cub", LocalDate.of(2024, 7, 1), 1d));

    List<QualityFlag> flags = engine(QualityFlag.Kind.FUTURE_DATE).evaluate(records);

    assertEquals(1, flags.size());
    assertEquals(LocalDate.of(2024, 7, 1), flags.get(0).getReferenceDate());
    assertEquals(QualityFlag.Severity.HIGH, flags.get(0).getSeverity());
  }

  @Test void testConstantSeries() {
    List<CanonicalRecord> records = monthly("stuck", 5d, 5d, 6d, 5d, 5d);

    List<QualityFlag> flags = engine(QualityFlag.Kind.CONSTANT_SERIES).evaluate(records);

    assertEquals(1, flags.size());
    QualityFlag flag = flags.get(0);
    assertEquals(QualityFlag.Severity.MEDIUM, flag.getSeverity());
    assertEquals(LocalDate.of(2023, 5, 1), flag.getReferenceDate());
    assertEquals(5.0, flag.getObservedValue(), 0.0);
    assertEquals("value repeated in 4 of 5 points", flag.getDetail());
  }

  @Test void testShortSeriesIsNotConstant() {
    List<CanonicalRecord> records = monthly("short", 5d, 5d, 5d, 5d);
    assertTrue(engine(QualityFlag.Kind.CONSTANT_SERIES).evaluate(records).isEmpty());
  }

  @Test void testSeriesAreSplitByDimensions() {
    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>();
    for (CanonicalRecord r : monthly("cub", 10d, -1d)) {
      records.add(r.toBuilder().recordKey(null).dimension("uf", "SP").build());
    }
    for (CanonicalRecord r : monthly("cub", 10d, 11d)) {
      records.add(r.toBuilder().recordKey(null).dimension("uf", "RJ").build());
    }
    QualityConfig config = QualityConfig.builder()
        .checks(EnumSet.of(QualityFlag.Kind.NEGATIVE_VALUE))
        .nonNegativeSeries(ImmutableSet.of("cub"))
        .build();

    List<QualityFlag> flags = new QualityEngine(config, CLOCK).evaluate(records);

    assertEquals(1, flags.size());
    assertEquals("cub", flags.get(0).getSeriesId());
    assertEquals("negative value in non-negative series (uf=SP)", flags.get(0).getDetail());

    List<List<String>> rows = QualityFlagCodec.toRows(flags);
    assertEquals("cub", rows.get(1).get(0));
    assertEquals("NEGATIVE_VALUE", rows.get(1).get(2));
  }

  @Test void testFlagOrder() {
    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>();
    records.addAll(monthly("b", 1d, 2d));
    records.addAll(monthly("a", 1d, 2d));

    List<QualityFlag> flags = engine(QualityFlag.Kind.HIGH_VARIATION).evaluate(records);

    assertEquals(2, flags.size());
    assertEquals("a", flags.get(0).getSeriesId());
    assertEquals("b", flags.get(1).getSeriesId());
  }

  @Test void testFlagCodec() {
    QualityFlag flag = new QualityFlag("cub", LocalDate.of(2023, 6, 1),
        QualityFlag.Kind.OUTLIER, QualityFlag.Severity.HIGH, 200d, "z=39.60");

    List<List<String>> rows = QualityFlagCodec.toRows(ImmutableList.of(flag));

    assertEquals(2, rows.size());
    assertEquals(QualityFlagCodec.HEADER, rows.get(0));
    assertEquals(ImmutableList.of("cub", "2023-06-01", "OUTLIER", "HIGH", "200.0", "z=39.60"),
        rows.get(1));
  }
}
