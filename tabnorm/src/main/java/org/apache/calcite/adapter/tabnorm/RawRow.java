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
package org.apache.calcite.adapter.tabnorm;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * One row of a source table, exactly as it was read.
 *
 * <p>Cells are kept as text; a missing or null cell is stored as the empty
 * string so that positional access never has to deal with nulls. The row
 * index is the 0-based position of the row within its source table.
 */
public final class RawRow {

  private final int index;
  private final ImmutableList<String> cells;

  private RawRow(int index, ImmutableList<String> cells) {
    this.index = index;
    this.cells = cells;
  }

  /**
   * Creates a row from raw cell values; null cells become empty strings.
   *
   * @param index 0-based row index within the source table
   * @param cells Cell values in column order
   * @return Immutable row
   */
  public static RawRow of(int index, List<? extends @Nullable Object> cells) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object cell : cells) {
      builder.add(cell == null ? "" : cell.toString());
    }
    return new RawRow(index, builder.build());
  }

  public static RawRow of(int index, String... cells) {
    return of(index, Arrays.asList(cells));
  }

  public int getIndex() {
    return index;
  }

  public List<String> getCells() {
    return cells;
  }

  public int size() {
    return cells.size();
  }

  /**
   * Returns the trimmed cell at the given column, or the empty string when the
   * row is shorter than that.
   */
  public String cell(int column) {
    if (column < 0 || column >= cells.size()) {
      return "";
    }
    return cells.get(column).trim();
  }

  public boolean isBlank(int column) {
    return cell(column).isEmpty();
  }

  /**
   * Returns the number of cells whose trimmed text is empty.
   */
  public int emptyCellCount() {
    int count = 0;
    for (int i = 0; i < cells.size(); i++) {
      if (isBlank(i)) {
        count++;
      }
    }
    return count;
  }

  @Override public String toString() {
    return "RawRow{" + index + ", " + cells + "}";
  }
}
