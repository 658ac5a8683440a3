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

import org.apache.calcite.adapter.tabnorm.RawRow;
import org.apache.calcite.adapter.tabnorm.RawTable;
import org.apache.calcite.adapter.tabnorm.TableConfig;
import org.apache.calcite.adapter.tabnorm.parse.LocaleParsers;
import org.apache.calcite.adapter.tabnorm.parse.MonthTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides the layout of a raw table by inspecting its leading rows.
 *
 * <p>Detection order, unless the table configuration forces a shape:
 * <ol>
 *   <li>a row with at least two month tokens after the first column is a month
 *       header: {@link TableShape.PeriodAxis#ACROSS_COLUMNS};</li>
 *   <li>a column holding month tokens on at least two rows, with a year in the
 *       first column of at least one of them (or label groups):
 *       {@link TableShape.PeriodAxis#DOWN_ROWS}, value in the next column;</li>
 *   <li>a row whose normalized names include the configured date and value
 *       columns: {@link TableShape.Tall};</li>
 *   <li>otherwise {@link TableShape.Unrecognized}.</li>
 * </ol>
 */
public class ShapeDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShapeDetector.class);

  /** Default number of leading rows inspected. */
  public static final int DEFAULT_SCAN_ROWS = 60;

  private static final int MIN_MONTH_HITS = 2;

  private final int scanRows;

  public ShapeDetector() {
    this(DEFAULT_SCAN_ROWS);
  }

  public ShapeDetector(int scanRows) {
    if (scanRows <= 0) {
      throw new IllegalArgumentException("scanRows must be positive: " + scanRows);
    }
    this.scanRows = scanRows;
  }

  /**
   * Detects the shape of a table.
   *
   * @param table Raw table
   * @param config Table configuration (forced shape, column names, year range)
   * @return Detected shape, never null
   */
  public TableShape detect(RawTable table, TableConfig config) {
    if (table.isEmpty()) {
      return TableShape.unrecognized("table is empty");
    }
    List<RawRow> rows = table.getRows();
    int limit = Math.min(rows.size(), scanRows);

    TableShape shape;
    switch (config.getShape()) {
    case TALL:
      shape = detectTall(rows, limit, config);
      break;
    case WIDE:
      shape = detectWide(rows, limit, config);
      break;
    default:
      shape = detectWide(rows, limit, config);
      if (shape == null) {
        shape = detectTall(rows, limit, config);
      }
      break;
    }

    if (shape == null) {
      shape = TableShape.unrecognized("no month header, month column or "
          + config.getDateColumns() + "/" + config.getValueColumns() + " header in first "
          + limit + " rows");
    }
    LOGGER.debug("Detected shape of {}: {}", table.getName(), shape);
    return shape;
  }

  private @Nullable TableShape detectWide(List<RawRow> rows, int limit, TableConfig config) {
    TableShape.Wide across = detectMonthHeader(rows, limit);
    if (across != null) {
      return across;
    }
    return detectMonthColumn(rows, limit, config);
  }

  private TableShape.@Nullable Wide detectMonthHeader(List<RawRow> rows, int limit) {
    for (int r = 0; r < limit; r++) {
      RawRow row = rows.get(r);
      Map<Integer, Integer> months = new LinkedHashMap<Integer, Integer>();
      for (int c = 1; c < row.size(); c++) {
        Integer month = MonthTable.monthOf(row.cell(c));
        if (month != null && !months.containsValue(month)) {
          months.put(c, month);
        }
      }
      if (months.size() >= MIN_MONTH_HITS) {
        return TableShape.acrossColumns(row.getIndex(), months);
      }
    }
    return null;
  }

  private TableShape.@Nullable Wide detectMonthColumn(List<RawRow> rows, int limit,
      TableConfig config) {
    int width = 0;
    for (int r = 0; r < limit; r++) {
      width = Math.max(width, rows.get(r).size());
    }

    int bestColumn = -1;
    int bestHits = 0;
    for (int c = 1; c < width - 1; c++) {
      int hits = 0;
      boolean yearSeen = false;
      for (int r = 0; r < limit; r++) {
        RawRow row = rows.get(r);
        if (MonthTable.isMonth(row.cell(c))) {
          hits++;
          if (LocaleParsers.parseYear(row.cell(0), config.getMinYear(), config.getMaxYear())
              != null) {
            yearSeen = true;
          }
        }
      }
      boolean grouped = yearSeen || config.getGroup() == TableConfig.GroupKind.LABEL;
      if (hits >= MIN_MONTH_HITS && grouped && hits > bestHits) {
        bestColumn = c;
        bestHits = hits;
      }
    }
    if (bestColumn < 0) {
      return null;
    }
    return TableShape.downRows(bestColumn, bestColumn + 1);
  }

  private TableShape.@Nullable Tall detectTall(List<RawRow> rows, int limit, TableConfig config) {
    for (int r = 0; r < limit; r++) {
      RawRow row = rows.get(r);
      List<String> names = ColumnNames.normalize(row.getCells());
      int dateColumn = indexOfAny(names, config.getDateColumns());
      int valueColumn = indexOfAny(names, config.getValueColumns());
      if (dateColumn >= 0 && valueColumn >= 0 && dateColumn != valueColumn) {
        int seriesColumn = config.getSeriesColumn() == null
            ? -1
            : names.indexOf(ColumnNames.normalize(config.getSeriesColumn(), -1));
        return TableShape.tall(row.getIndex(), names, dateColumn, valueColumn, seriesColumn);
      }
    }
    return null;
  }

  private static int indexOfAny(List<String> names, List<String> candidates) {
    for (String candidate : candidates) {
      int index = names.indexOf(ColumnNames.normalize(candidate, -1));
      if (index >= 0) {
        return index;
      }
    }
    return -1;
  }
}
