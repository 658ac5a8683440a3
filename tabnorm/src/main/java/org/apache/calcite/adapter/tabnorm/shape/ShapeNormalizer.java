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
package org.apache.calcite.adapter.tabnorm.shape;

import org.apache.calcite.adapter.tabnorm.CanonicalRecord;
import org.apache.calcite.adapter.tabnorm.RawRow;
import org.apache.calcite.adapter.tabnorm.RawTable;
import org.apache.calcite.adapter.tabnorm.TableConfig;
import org.apache.calcite.adapter.tabnorm.noise.NoiseClassifier;
import org.apache.calcite.adapter.tabnorm.parse.LocaleParsers;
import org.apache.calcite.adapter.tabnorm.parse.MonthTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw source table into canonical records.
 *
 * <p>The detected {@link TableShape} selects the strategy:
 * <ul>
 *   <li><b>Tall</b>: every data row below the header is one record; the date
 *       comes from the date column, the value from the value column, and the
 *       remaining columns become dimensions.</li>
 *   <li><b>Wide</b>: rows are scanned top to bottom carrying the current group
 *       (a year, or a label such as a locality) over blank first cells, and the
 *       current section caption ({@code REGIÃO SUDESTE}, {@code BRASIL}) over
 *       the rows below it. Each non-empty period cell becomes one record.</li>
 *   <li><b>Unrecognized</b>: no records.</li>
 * </ul>
 *
 * <p>Records sharing a key inside one table collapse to the last one emitted.
 * The output is ordered by series id, reference date and key.
 */
public class ShapeNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShapeNormalizer.class);

  /** Format of {@link CanonicalRecord#getIngestedAt()}. */
  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

  private static final Pattern REGION_CAPTION = Pattern.compile("regiao\\s+([a-z][a-z-]*)");
  private static final Pattern COUNTRY_CAPTION = Pattern.compile("\\bbrasil\\b");

  private final NoiseClassifier noise;
  private final ShapeDetector detector;
  private final Clock clock;

  public ShapeNormalizer() {
    this(NoiseClassifier.defaults(), new ShapeDetector(), Clock.systemDefaultZone());
  }

  public ShapeNormalizer(NoiseClassifier noise, ShapeDetector detector, Clock clock) {
    this.noise = noise;
    this.detector = detector;
    this.clock = clock;
  }

  /**
   * Normalizes a source table.
   *
   * @param table Raw table as read from the source
   * @param config Table configuration
   * @return Records and counters; an unrecognized shape yields no records
   */
  public NormalizationResult normalize(RawTable table, TableConfig config) {
    TableShape shape = detector.detect(table, config);
    Context context = new Context(table, config, LocalDateTime.now(clock).format(TIMESTAMP_FORMAT));

    switch (shape.getKind()) {
    case TALL:
      normalizeTall(shape.asTall(), context);
      break;
    case WIDE:
      normalizeWide(shape.asWide(), context);
      break;
    case UNRECOGNIZED:
      LOGGER.warn("Table {} has no recognizable layout, no records emitted: {}",
          table.getName(), shape.asUnrecognized().getReason());
      break;
    default:
      throw new AssertionError("unknown shape " + shape.getKind());
    }

    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>(context.byKey.values());
    Collections.sort(records, CanonicalRecord.SERIES_DATE_ORDER);
    NormalizationResult result = new NormalizationResult(table.getName(), shape,
        table.rowCount(), context.noiseRows, context.collapsed, records);
    LOGGER.info("Normalized {}: shape={}, rows={}, noise={}, records={}, collapsed={}",
        table.getName(), shape.getKind(), table.rowCount(), context.noiseRows,
        records.size(), context.collapsed);
    return result;
  }

  private void normalizeTall(TableShape.Tall tall, Context context) {
    TableConfig config = context.config;
    List<String> columns = tall.getColumns();
    List<Integer> dimensionIndexes = dimensionIndexes(tall, config);

    for (RawRow row : context.table.getRows()) {
      if (row.getIndex() <= tall.getHeaderRowIndex()) {
        continue;
      }
      if (noise.isNoise(row)) {
        context.noiseRows++;
        LOGGER.debug("Dropped noise row {} of {}", row.getIndex(), context.table.getName());
        continue;
      }
      LocalDate date = LocaleParsers.parseReferenceDate(row.cell(tall.getDateColumn()));
      Double value = LocaleParsers.parseNumeric(row.cell(tall.getValueColumn()));
      if (date == null || value == null) {
        continue;
      }
      if (config.getFrequency() == TableConfig.Frequency.MONTHLY) {
        date = date.withDayOfMonth(1);
      }

      String seriesId = tall.getSeriesColumn() >= 0 && !row.isBlank(tall.getSeriesColumn())
          ? row.cell(tall.getSeriesColumn())
          : context.defaultSeriesId;
      Map<String, String> dimensions = new LinkedHashMap<String, String>(
          config.getStaticDimensions());
      for (int index : dimensionIndexes) {
        if (!row.isBlank(index)) {
          dimensions.put(columns.get(index), row.cell(index));
        }
      }
      context.emit(seriesId, date, value, dimensions);
    }
  }

  private static List<Integer> dimensionIndexes(TableShape.Tall tall, TableConfig config) {
    List<String> columns = tall.getColumns();
    List<Integer> indexes = new ArrayList<Integer>();
    if (!config.getDimensionColumns().isEmpty()) {
      for (String name : config.getDimensionColumns()) {
        int index = columns.indexOf(ColumnNames.normalize(name, -1));
        if (index < 0) {
          LOGGER.warn("Dimension column '{}' not found in {} header {}", name,
              config.getName(), columns);
        } else {
          indexes.add(index);
        }
      }
      return indexes;
    }
    for (int i = 0; i < columns.size(); i++) {
      if (i != tall.getDateColumn() && i != tall.getValueColumn()
          && i != tall.getSeriesColumn()) {
        indexes.add(i);
      }
    }
    return indexes;
  }

  private void normalizeWide(TableShape.Wide wide, Context context) {
    TableConfig config = context.config;
    boolean labelGroups = config.getGroup() == TableConfig.GroupKind.LABEL;
    if (labelGroups && config.getFixedYear() == null) {
      LOGGER.warn("Table {} groups rows by label but has no fixedYear, no records emitted",
          config.getName());
      return;
    }

    @Nullable String year = labelGroups ? String.valueOf(config.getFixedYear()) : null;
    @Nullable String label = null;
    @Nullable String caption = null;

    for (RawRow row : context.table.getRows()) {
      if (wide.getAxis() == TableShape.PeriodAxis.ACROSS_COLUMNS && isMonthHeader(row)) {
        continue;
      }
      String captionValue = caption(row, config);
      if (captionValue != null) {
        caption = captionValue;
        LOGGER.debug("Row {} of {} opens section {}", row.getIndex(),
            context.table.getName(), caption);
        continue;
      }
      if (noise.isNoise(row)) {
        context.noiseRows++;
        LOGGER.debug("Dropped noise row {} of {}", row.getIndex(), context.table.getName());
        continue;
      }

      String first = row.cell(0);
      if (!first.isEmpty()) {
        if (labelGroups) {
          if (isSkippedLabel(first, config)) {
            label = null;
            continue;
          }
          label = first;
        } else {
          Integer parsed = LocaleParsers.parseYear(first, config.getMinYear(),
              config.getMaxYear());
          if (parsed == null) {
            LOGGER.debug("Row {} of {} has no year in its first cell '{}'", row.getIndex(),
                context.table.getName(), first);
            continue;
          }
          year = String.valueOf(parsed);
        }
      }
      if (year == null || (labelGroups && label == null)) {
        continue;
      }

      Map<String, String> dimensions = new LinkedHashMap<String, String>(
          config.getStaticDimensions());
      if (caption != null) {
        dimensions.put(config.getCaptionDimension(), caption);
      }
      if (labelGroups) {
        dimensions.put(config.getGroupDimension(), label);
      }

      if (wide.getAxis() == TableShape.PeriodAxis.ACROSS_COLUMNS) {
        for (Map.Entry<Integer, Integer> entry : wide.getMonthByColumn().entrySet()) {
          emitCell(context, year, MonthTable.abbreviation(entry.getValue()),
              row.cell(entry.getKey()), dimensions);
        }
      } else {
        emitCell(context, year, row.cell(wide.getPeriodColumn()),
            row.cell(wide.getValueColumn()), dimensions);
      }
    }
  }

  private static void emitCell(Context context, String year, String monthLabel, String text,
      Map<String, String> dimensions) {
    if (monthLabel.isEmpty()) {
      return;
    }
    Double value = LocaleParsers.parseNumeric(text);
    if (value == null) {
      return;
    }
    if (value == 0d && context.config.isZeroAsAbsent()) {
      return;
    }
    LocalDate date = LocaleParsers.parseDate(year, monthLabel, context.config.getMinYear(),
        context.config.getMaxYear());
    if (date == null) {
      return;
    }
    context.emit(context.defaultSeriesId, date, value, dimensions);
  }

  private static boolean isMonthHeader(RawRow row) {
    int months = 0;
    for (int c = 1; c < row.size(); c++) {
      if (MonthTable.isMonth(row.cell(c))) {
        months++;
      }
    }
    return months >= 2;
  }

  /**
   * Returns the section named by a caption row, or null when the row is not
   * a caption. A caption has text in its first cell only.
   */
  private @Nullable String caption(RawRow row, TableConfig config) {
    String first = row.cell(0);
    if (first.isEmpty() || row.emptyCellCount() != row.size() - 1) {
      return null;
    }
    if (noise.isBoilerplate(first)
        || LocaleParsers.parseYear(first, config.getMinYear(), config.getMaxYear()) != null) {
      return null;
    }
    String folded = LocaleParsers.fold(first);
    Matcher region = REGION_CAPTION.matcher(folded);
    if (region.find()) {
      return region.group(1).toUpperCase(Locale.ROOT);
    }
    if (COUNTRY_CAPTION.matcher(folded).find()) {
      return "BRASIL";
    }
    return null;
  }

  private static boolean isSkippedLabel(String label, TableConfig config) {
    String folded = LocaleParsers.fold(label);
    for (String skip : config.getSkipGroupLabels()) {
      if (folded.equals(LocaleParsers.fold(skip))) {
        return true;
      }
    }
    return false;
  }

  /** Mutable state of one normalization pass. */
  private static class Context {
    final RawTable table;
    final TableConfig config;
    final String ingestedAt;
    final String defaultSeriesId;
    final @Nullable String sourceUrl;
    final Map<String, CanonicalRecord> byKey = new LinkedHashMap<String, CanonicalRecord>();
    int noiseRows;
    int collapsed;

    Context(RawTable table, TableConfig config, String ingestedAt) {
      this.table = table;
      this.config = config;
      this.ingestedAt = ingestedAt;
      this.defaultSeriesId = config.getSeriesId() != null ? config.getSeriesId() : config.getName();
      this.sourceUrl = table.getSourceUrl() != null ? table.getSourceUrl() : config.getSourceUrl();
    }

    void emit(String seriesId, LocalDate date, Double value, Map<String, String> dimensions) {
      CanonicalRecord record = CanonicalRecord.builder()
          .seriesId(seriesId)
          .referenceDate(date)
          .value(value)
          .dimensions(dimensions)
          .keyDimensions(config.getKeyDimensions())
          .sourceUrl(sourceUrl)
          .ingestedAt(ingestedAt)
          .build();
      if (byKey.remove(record.getRecordKey()) != null) {
        collapsed++;
      }
      byKey.put(record.getRecordKey(), record);
    }
  }
}
