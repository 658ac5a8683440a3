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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.List;
import java.util.Map;

/**
 * Layout of a source table, decided once by {@link ShapeDetector}.
 *
 * <p>Exactly one of three variants:
 * <ul>
 *   <li>{@link Tall} - a header row names the columns, each later row is a record;</li>
 *   <li>{@link Wide} - a sparse group column (year or label) with periods either
 *       across the columns or paired down the rows;</li>
 *   <li>{@link Unrecognized} - nothing the normalizer can read.</li>
 * </ul>
 * Callers switch on {@link #getKind()} and then use the matching accessor.
 */
public abstract class TableShape {

  /**
   * Shape variants.
   */
  public enum Kind {
    TALL,
    WIDE,
    UNRECOGNIZED
  }

  /**
   * Where the periods of a wide table live.
   */
  public enum PeriodAxis {
    /** A header row holds month tokens; each month is a column. */
    ACROSS_COLUMNS,
    /** Each row holds a month token in one column and its value in the next. */
    DOWN_ROWS
  }

  private TableShape() {
  }

  public abstract Kind getKind();

  public Tall asTall() {
    throw new IllegalStateException("Not a tall shape: " + this);
  }

  public Wide asWide() {
    throw new IllegalStateException("Not a wide shape: " + this);
  }

  public Unrecognized asUnrecognized() {
    throw new IllegalStateException("Shape was recognized: " + this);
  }

  public static Tall tall(int headerRowIndex, List<String> columns, int dateColumn,
      int valueColumn, int seriesColumn) {
    return new Tall(headerRowIndex, columns, dateColumn, valueColumn, seriesColumn);
  }

  public static Wide acrossColumns(int headerRowIndex, Map<Integer, Integer> monthByColumn) {
    return new Wide(PeriodAxis.ACROSS_COLUMNS, headerRowIndex, monthByColumn, -1, -1);
  }

  public static Wide downRows(int periodColumn, int valueColumn) {
    return new Wide(PeriodAxis.DOWN_ROWS, -1,
        ImmutableSortedMap.<Integer, Integer>of(), periodColumn, valueColumn);
  }

  public static Unrecognized unrecognized(String reason) {
    return new Unrecognized(reason);
  }

  /**
   * Tall layout: one record per data row below the header.
   */
  public static final class Tall extends TableShape {
    private final int headerRowIndex;
    private final List<String> columns;
    private final int dateColumn;
    private final int valueColumn;
    private final int seriesColumn;

    private Tall(int headerRowIndex, List<String> columns, int dateColumn, int valueColumn,
        int seriesColumn) {
      this.headerRowIndex = headerRowIndex;
      this.columns = ImmutableList.copyOf(columns);
      this.dateColumn = dateColumn;
      this.valueColumn = valueColumn;
      this.seriesColumn = seriesColumn;
    }

    @Override public Kind getKind() {
      return Kind.TALL;
    }

    @Override public Tall asTall() {
      return this;
    }

    public int getHeaderRowIndex() {
      return headerRowIndex;
    }

    /** Normalized column names, by position. */
    public List<String> getColumns() {
      return columns;
    }

    public int getDateColumn() {
      return dateColumn;
    }

    public int getValueColumn() {
      return valueColumn;
    }

    /** Column carrying the series id, or -1. */
    public int getSeriesColumn() {
      return seriesColumn;
    }

    @Override public String toString() {
      return "Tall{header=" + headerRowIndex + ", columns=" + columns + "}";
    }
  }

  /**
   * Wide layout: a sparse group in the first column and periods in cells.
   */
  public static final class Wide extends TableShape {
    private final PeriodAxis axis;
    private final int headerRowIndex;
    private final ImmutableSortedMap<Integer, Integer> monthByColumn;
    private final int periodColumn;
    private final int valueColumn;

    private Wide(PeriodAxis axis, int headerRowIndex, Map<Integer, Integer> monthByColumn,
        int periodColumn, int valueColumn) {
      this.axis = axis;
      this.headerRowIndex = headerRowIndex;
      this.monthByColumn = ImmutableSortedMap.copyOf(monthByColumn);
      this.periodColumn = periodColumn;
      this.valueColumn = valueColumn;
    }

    @Override public Kind getKind() {
      return Kind.WIDE;
    }

    @Override public Wide asWide() {
      return this;
    }

    public PeriodAxis getAxis() {
      return axis;
    }

    /** Row holding the month header, or -1 when periods run down the rows. */
    public int getHeaderRowIndex() {
      return headerRowIndex;
    }

    /** Column index to month number, for {@link PeriodAxis#ACROSS_COLUMNS}. */
    public Map<Integer, Integer> getMonthByColumn() {
      return monthByColumn;
    }

    /** Column holding month tokens, for {@link PeriodAxis#DOWN_ROWS}. */
    public int getPeriodColumn() {
      return periodColumn;
    }

    /** Column holding values, for {@link PeriodAxis#DOWN_ROWS}. */
    public int getValueColumn() {
      return valueColumn;
    }

    @Override public String toString() {
      return axis == PeriodAxis.ACROSS_COLUMNS
          ? "Wide{across, header=" + headerRowIndex + ", months=" + monthByColumn + "}"
          : "Wide{down, period=" + periodColumn + ", value=" + valueColumn + "}";
    }
  }

  /**
   * No readable layout was found.
   */
  public static final class Unrecognized extends TableShape {
    private final String reason;

    private Unrecognized(String reason) {
      this.reason = reason;
    }

    @Override public Kind getKind() {
      return Kind.UNRECOGNIZED;
    }

    @Override public Unrecognized asUnrecognized() {
      return this;
    }

    public String getReason() {
      return reason;
    }

    @Override public String toString() {
      return "Unrecognized{" + reason + "}";
    }
  }
}
