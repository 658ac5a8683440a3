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
package org.apache.calcite.adapter.tabnorm.merge;

import org.apache.calcite.adapter.tabnorm.CanonicalRecord;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives period-over-period variations for a sorted record set.
 *
 * <p>Within each logical series (series id plus dimensions),
 * {@code variation_mom} compares a record with the previous record of the
 * series and {@code variation_yoy} with the record dated exactly one year
 * earlier. Both are fractions ({@code 0.0125} for +1.25%) and are null when
 * either value is missing or the base is zero.
 */
final class VariationCalculator {

  private VariationCalculator() {
  }

  /**
   * Returns copies of the records carrying freshly computed variations.
   *
   * @param sorted Records ordered by series id and reference date
   * @return Records in the same order
   */
  static List<CanonicalRecord> apply(List<CanonicalRecord> sorted) {
    Map<String, Map<LocalDate, CanonicalRecord>> byDate =
        new HashMap<String, Map<LocalDate, CanonicalRecord>>();
    for (CanonicalRecord record : sorted) {
      byDate.computeIfAbsent(record.getSeriesKey(),
          k -> new HashMap<LocalDate, CanonicalRecord>())
          .put(record.getReferenceDate(), record);
    }

    Map<String, CanonicalRecord> previousBySeries = new HashMap<String, CanonicalRecord>();
    List<CanonicalRecord> result = new ArrayList<CanonicalRecord>(sorted.size());
    for (CanonicalRecord record : sorted) {
      String seriesKey = record.getSeriesKey();
      CanonicalRecord previous = previousBySeries.put(seriesKey, record);
      CanonicalRecord yearAgo =
          byDate.get(seriesKey).get(record.getReferenceDate().minusYears(1));
      result.add(
          record.withVariations(
              previous == null ? null : ratio(record.getValue(), previous.getValue()),
              yearAgo == null ? null : ratio(record.getValue(), yearAgo.getValue())));
    }
    return result;
  }

  static @Nullable Double ratio(@Nullable Double value, @Nullable Double base) {
    if (value == null || base == null || base == 0d) {
      return null;
    }
    return (value - base) / base;
  }
}
