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
import org.apache.calcite.adapter.tabnorm.RawRow;
import org.apache.calcite.adapter.tabnorm.RawTable;
import org.apache.calcite.adapter.tabnorm.TabNormException;
import org.apache.calcite.adapter.tabnorm.parse.LocaleParsers;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Converts canonical records to and from the rows of a fact store table.
 *
 * <p>Column order is {@code record_key, series_id, reference_date, value,
 * variation_mom, variation_yoy}, then the sorted union of dimension names,
 * then {@code source_url, ingested_at}. Absent values are empty cells and
 * numbers use plain decimal notation with a dot.
 */
public final class CanonicalRecordCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalRecordCodec.class);

  public static final String RECORD_KEY = "record_key";
  public static final String SERIES_ID = "series_id";
  public static final String REFERENCE_DATE = "reference_date";
  public static final String VALUE = "value";
  public static final String VARIATION_MOM = "variation_mom";
  public static final String VARIATION_YOY = "variation_yoy";
  public static final String SOURCE_URL = "source_url";
  public static final String INGESTED_AT = "ingested_at";

  private static final List<String> LEADING_COLUMNS = ImmutableList.of(
      RECORD_KEY, SERIES_ID, REFERENCE_DATE, VALUE, VARIATION_MOM, VARIATION_YOY);
  private static final List<String> TRAILING_COLUMNS = ImmutableList.of(SOURCE_URL, INGESTED_AT);
  private static final Set<String> FIXED_COLUMNS = ImmutableSet.<String>builder()
      .addAll(LEADING_COLUMNS).addAll(TRAILING_COLUMNS).build();

  private static final Pattern CANONICAL_NUMBER =
      Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

  private CanonicalRecordCodec() {
  }

  /**
   * Builds the header row for a set of records.
   */
  public static List<String> header(List<CanonicalRecord> records) {
    List<String> header = new ArrayList<String>(LEADING_COLUMNS);
    header.addAll(dimensionNames(records));
    header.addAll(TRAILING_COLUMNS);
    return header;
  }

  /**
   * Encodes records as a header row followed by one row per record, in the
   * given order.
   *
   * @param records Records to encode
   * @return Rows ready for {@code SpreadsheetStore.writeTable}
   */
  public static List<List<String>> encode(List<CanonicalRecord> records) {
    Set<String> dimensions = dimensionNames(records);
    List<List<String>> rows = new ArrayList<List<String>>(records.size() + 1);
    rows.add(header(records));
    for (CanonicalRecord record : records) {
      List<String> row = new ArrayList<String>();
      row.add(record.getRecordKey());
      row.add(record.getSeriesId());
      row.add(record.getReferenceDate().toString());
      row.add(formatNumber(record.getValue()));
      row.add(formatNumber(record.getVariationMom()));
      row.add(formatNumber(record.getVariationYoy()));
      for (String dimension : dimensions) {
        String value = record.getDimensions().get(dimension);
        row.add(value == null ? "" : value);
      }
      row.add(Strings.nullToEmpty(record.getSourceUrl()));
      row.add(Strings.nullToEmpty(record.getIngestedAt()));
      rows.add(row);
    }
    return rows;
  }

  /**
   * Decodes a fact store table, header row first.
   *
   * <p>Rows without a key, series id or readable reference date are skipped.
   * Numbers are read in canonical notation first and then with the locale
   * parser, so cells edited by hand in the source convention still load.
   *
   * @param table Table as read from the store
   * @return Records in row order, duplicates included
   * @throws TabNormException if the header lacks the key, series or date column
   */
  public static List<CanonicalRecord> decode(RawTable table) {
    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>();
    List<RawRow> rows = table.getRows();
    if (rows.isEmpty()) {
      return records;
    }

    RawRow headerRow = rows.get(0);
    // fixed columns match in any case; dimension names are kept as written
    Map<String, Integer> columns = new HashMap<String, Integer>();
    Map<String, Integer> dimensionColumns = new LinkedHashMap<String, Integer>();
    for (int i = 0; i < headerRow.size(); i++) {
      String name = headerRow.cell(i).trim();
      if (name.isEmpty()) {
        continue;
      }
      String fixed = name.toLowerCase(Locale.ROOT);
      if (FIXED_COLUMNS.contains(fixed)) {
        columns.putIfAbsent(fixed, i);
      } else {
        dimensionColumns.putIfAbsent(name, i);
      }
    }
    for (String required : ImmutableList.of(RECORD_KEY, SERIES_ID, REFERENCE_DATE)) {
      if (!columns.containsKey(required)) {
        throw new TabNormException("Table '" + table.getName() + "' has no '" + required
            + "' column; header is " + headerRow.getCells());
      }
    }

    int skipped = 0;
    for (int r = 1; r < rows.size(); r++) {
      RawRow row = rows.get(r);
      String key = cell(row, columns, RECORD_KEY);
      String seriesId = cell(row, columns, SERIES_ID);
      LocalDate date = parseDate(cell(row, columns, REFERENCE_DATE));
      if (key.isEmpty() || seriesId.isEmpty() || date == null) {
        skipped++;
        continue;
      }
      CanonicalRecord.Builder builder = CanonicalRecord.builder()
          .recordKey(key)
          .seriesId(seriesId)
          .referenceDate(date)
          .value(parseNumber(cell(row, columns, VALUE)))
          .variationMom(parseNumber(cell(row, columns, VARIATION_MOM)))
          .variationYoy(parseNumber(cell(row, columns, VARIATION_YOY)))
          .sourceUrl(Strings.emptyToNull(cell(row, columns, SOURCE_URL)))
          .ingestedAt(Strings.emptyToNull(cell(row, columns, INGESTED_AT)));
      for (Map.Entry<String, Integer> dimension : dimensionColumns.entrySet()) {
        String value = row.cell(dimension.getValue());
        if (!value.isEmpty()) {
          builder.dimension(dimension.getKey(), value);
        }
      }
      records.add(builder.build());
    }
    if (skipped > 0) {
      LOGGER.debug("Skipped {} unreadable rows of '{}'", skipped, table.getName());
    }
    return records;
  }

  /**
   * Formats a number in plain decimal notation, or the empty string for null.
   */
  public static String formatNumber(@Nullable Double value) {
    if (value == null || value.isNaN() || value.isInfinite()) {
      return "";
    }
    return BigDecimal.valueOf(value).toPlainString();
  }

  /**
   * Parses a stored number: canonical notation first, then the locale parser.
   */
  public static @Nullable Double parseNumber(String text) {
    String s = text.trim();
    if (s.isEmpty()) {
      return null;
    }
    if (CANONICAL_NUMBER.matcher(s).matches()) {
      return Double.parseDouble(s);
    }
    return LocaleParsers.parseNumeric(s);
  }

  private static @Nullable LocalDate parseDate(String text) {
    if (text.isEmpty()) {
      return null;
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException e) {
      return LocaleParsers.parseReferenceDate(text);
    }
  }

  private static Set<String> dimensionNames(List<CanonicalRecord> records) {
    Set<String> names = new TreeSet<String>();
    for (CanonicalRecord record : records) {
      names.addAll(record.getDimensions().keySet());
    }
    names.removeAll(FIXED_COLUMNS);
    return names;
  }

  private static String cell(RawRow row, Map<String, Integer> columns, String name) {
    Integer index = columns.get(name);
    return index == null ? "" : row.cell(index);
  }
}
