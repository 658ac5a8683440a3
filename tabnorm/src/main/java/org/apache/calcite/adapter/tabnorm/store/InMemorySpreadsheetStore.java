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
package org.apache.calcite.adapter.tabnorm.store;

import org.apache.calcite.adapter.tabnorm.RawTable;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store that keeps tables in memory.
 *
 * <p>Rows are copied on the way in and out, so callers cannot alter stored
 * content through the lists they pass or receive. An optional cell quota
 * mimics the cell cap of hosted spreadsheets; a write that would exceed it
 * fails with {@link StoreQuotaException} and leaves the store unchanged.
 */
public class InMemorySpreadsheetStore implements SpreadsheetStore {

  private final Map<String, List<List<String>>> tables =
      new ConcurrentHashMap<String, List<List<String>>>();
  private final long maxCells;

  /** Creates a store without a cell quota. */
  public InMemorySpreadsheetStore() {
    this(Long.MAX_VALUE);
  }

  /**
   * Creates a store holding at most {@code maxCells} cells over all tables.
   */
  public InMemorySpreadsheetStore(long maxCells) {
    if (maxCells <= 0) {
      throw new IllegalArgumentException("maxCells must be positive: " + maxCells);
    }
    this.maxCells = maxCells;
  }

  @Override public RawTable readTable(String name) {
    List<List<String>> rows = tables.get(name);
    if (rows == null) {
      return RawTable.empty(name);
    }
    synchronized (rows) {
      return RawTable.of(name, null, new ArrayList<List<String>>(rows));
    }
  }

  @Override public synchronized void writeTable(String name, List<List<String>> rows)
      throws StoreQuotaException {
    checkQuota(name, cellCount(rows) - cellCount(rows(name)));
    tables.put(name, copy(rows));
  }

  @Override public synchronized void appendRows(String name, List<List<String>> rows)
      throws StoreQuotaException {
    checkQuota(name, cellCount(rows));
    List<List<String>> existing =
        tables.computeIfAbsent(name, k -> new ArrayList<List<String>>());
    synchronized (existing) {
      existing.addAll(copy(rows));
    }
  }

  @Override public boolean hasTable(String name) {
    return tables.containsKey(name);
  }

  @Override public String getStoreType() {
    return "memory";
  }

  /**
   * Returns the raw rows of a table, or an empty list.
   */
  public List<List<String>> rows(String name) {
    List<List<String>> rows = tables.get(name);
    if (rows == null) {
      return ImmutableList.of();
    }
    synchronized (rows) {
      return ImmutableList.copyOf(rows);
    }
  }

  /**
   * Returns the number of cells held over all tables.
   */
  public synchronized long totalCells() {
    long total = 0;
    for (String name : tables.keySet()) {
      total += cellCount(rows(name));
    }
    return total;
  }

  private void checkQuota(String name, long added) throws StoreQuotaException {
    if (maxCells == Long.MAX_VALUE) {
      return;
    }
    long after = totalCells() + added;
    if (after > maxCells) {
      throw new StoreQuotaException("Writing to '" + name + "' would hold " + after
          + " cells, above the quota of " + maxCells);
    }
  }

  private static long cellCount(List<List<String>> rows) {
    long count = 0;
    for (List<String> row : rows) {
      count += row.size();
    }
    return count;
  }

  private static List<List<String>> copy(List<List<String>> rows) {
    List<List<String>> copy = new ArrayList<List<String>>(rows.size());
    for (List<String> row : rows) {
      List<String> cells = new ArrayList<String>(row.size());
      for (String cell : row) {
        cells.add(cell == null ? "" : cell);
      }
      copy.add(ImmutableList.copyOf(cells));
    }
    return copy;
  }
}
