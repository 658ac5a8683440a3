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

import java.util.List;

/**
 * A source table as a sequence of untyped rows plus where it came from.
 *
 * <p>Produced by a fetcher, a {@link org.apache.calcite.adapter.tabnorm.source.WorkbookTableReader}
 * or a {@link org.apache.calcite.adapter.tabnorm.store.SpreadsheetStore}, and
 * consumed once by the normalizer or the fact store codec.
 */
public final class RawTable {

  private final String name;
  private final @Nullable String sourceUrl;
  private final ImmutableList<RawRow> rows;

  public RawTable(String name, @Nullable String sourceUrl, List<RawRow> rows) {
    this.name = name;
    this.sourceUrl = sourceUrl;
    this.rows = ImmutableList.copyOf(rows);
  }

  /**
   * Builds a table from plain cell lists, numbering rows from zero.
   *
   * @param name Table name
   * @param sourceUrl Origin URL, may be null
   * @param cells Rows of cell values
   * @return Immutable table
   */
  public static RawTable of(String name, @Nullable String sourceUrl,
      List<? extends List<? extends @Nullable Object>> cells) {
    ImmutableList.Builder<RawRow> builder = ImmutableList.builder();
    int index = 0;
    for (List<? extends @Nullable Object> row : cells) {
      builder.add(RawRow.of(index++, row));
    }
    return new RawTable(name, sourceUrl, builder.build());
  }

  public static RawTable empty(String name) {
    return new RawTable(name, null, ImmutableList.<RawRow>of());
  }

  public String getName() {
    return name;
  }

  public @Nullable String getSourceUrl() {
    return sourceUrl;
  }

  public List<RawRow> getRows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override public String toString() {
    return "RawTable{name='" + name + "', rows=" + rows.size() + "}";
  }
}
