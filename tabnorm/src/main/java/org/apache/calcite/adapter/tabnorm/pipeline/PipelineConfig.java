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
package org.apache.calcite.adapter.tabnorm.pipeline;

import org.apache.calcite.adapter.tabnorm.TableConfig;
import org.apache.calcite.adapter.tabnorm.quality.QualityConfig;
import org.apache.calcite.adapter.tabnorm.store.ChunkedWriteSpreadsheetStore;
import org.apache.calcite.adapter.tabnorm.store.InMemorySpreadsheetStore;
import org.apache.calcite.adapter.tabnorm.store.SpreadsheetStore;
import org.apache.calcite.adapter.tabnorm.store.WorkbookSpreadsheetStore;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of an ingestion run: the fact store, the ingestion log, the
 * quality checks and the source tables.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * store:
 *   workbook: "data/fact_store.xlsx"   # omit for an in-memory store
 *   writeChunkSize: 500                # rows per write call; 0 disables chunking
 *   chunkPauseMs: 1000
 *   maxCells: 10000000                 # in-memory store only; omit for no quota
 * ingestionLog: _ingestion_log
 * quality:
 *   nonNegativeSeries: [cub_medio_br]
 * tables:
 *   - name: cub_medio
 *     target: fact_cub
 *     seriesId: cub_medio_br
 * }</pre>
 *
 * @see TableConfig
 * @see QualityConfig
 */
public class PipelineConfig {

  private final @Nullable String workbook;
  private final int writeChunkSize;
  private final long chunkPauseMs;
  private final long maxCells;
  private final @Nullable String ingestionLog;
  private final QualityConfig quality;
  private final List<TableConfig> tables;

  private PipelineConfig(@Nullable String workbook, int writeChunkSize, long chunkPauseMs,
      long maxCells, @Nullable String ingestionLog, QualityConfig quality,
      List<TableConfig> tables) {
    this.workbook = workbook;
    this.writeChunkSize = writeChunkSize;
    this.chunkPauseMs = chunkPauseMs;
    this.maxCells = maxCells;
    this.ingestionLog = ingestionLog;
    this.quality = quality;
    this.tables = ImmutableList.copyOf(tables);
  }

  /**
   * Loads a configuration file.
   *
   * @param path YAML or JSON file
   * @return Parsed configuration
   * @throws IOException if the file cannot be read or parsed
   * @throws IllegalArgumentException if the configuration is invalid
   */
  public static PipelineConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in, path.getFileName().toString());
    }
  }

  /**
   * Loads a configuration document.
   *
   * @param stream Document content
   * @param resourceName Name of the document; {@code .yaml}/{@code .yml} selects YAML
   * @return Parsed configuration
   * @throws IOException if the document cannot be read or parsed
   * @throws IllegalArgumentException if the configuration is invalid
   */
  public static PipelineConfig load(InputStream stream, String resourceName) throws IOException {
    JsonNode root = YamlUtils.parseYamlOrJson(stream, resourceName);
    return fromMap(YamlUtils.toMap(root));
  }

  /**
   * Creates a PipelineConfig from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return PipelineConfig instance
   * @throws IllegalArgumentException if a value has the wrong type or table names repeat
   */
  @SuppressWarnings("unchecked")
  public static PipelineConfig fromMap(Map<String, Object> map) {
    String workbook = null;
    int writeChunkSize = 0;
    long chunkPauseMs = 0;
    long maxCells = 0;
    Object store = map.get("store");
    if (store instanceof Map) {
      Map<String, Object> storeMap = (Map<String, Object>) store;
      Object path = storeMap.get("workbook");
      workbook = path == null ? null : path.toString();
      writeChunkSize = (int) longValue(storeMap, "writeChunkSize", 0);
      chunkPauseMs = longValue(storeMap, "chunkPauseMs", 0);
      maxCells = longValue(storeMap, "maxCells", 0);
    } else if (store != null) {
      throw new IllegalArgumentException("'store' must be a map");
    }

    Object log = map.get("ingestionLog");
    String ingestionLog = log == null ? null : log.toString();

    Object quality = map.get("quality");
    if (quality != null && !(quality instanceof Map)) {
      throw new IllegalArgumentException("'quality' must be a map");
    }
    QualityConfig qualityConfig = QualityConfig.fromMap((Map<String, Object>) quality);

    List<TableConfig> tables = new ArrayList<TableConfig>();
    Set<String> names = new HashSet<String>();
    Object tableList = map.get("tables");
    if (tableList instanceof List) {
      for (Object item : (List<?>) tableList) {
        if (!(item instanceof Map)) {
          throw new IllegalArgumentException("Each entry of 'tables' must be a map: " + item);
        }
        TableConfig table = TableConfig.fromMap((Map<String, Object>) item);
        if (!names.add(table.getName())) {
          throw new IllegalArgumentException("Duplicate table name '" + table.getName() + "'");
        }
        tables.add(table);
      }
    } else if (tableList != null) {
      throw new IllegalArgumentException("'tables' must be a list");
    }
    return new PipelineConfig(workbook, writeChunkSize, chunkPauseMs, maxCells, ingestionLog,
        qualityConfig, tables);
  }

  private static long longValue(Map<String, Object> map, String key, long defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be an integer: " + value, e);
    }
  }

  /**
   * Creates the store this configuration describes: a workbook store when
   * {@code store.workbook} is set, otherwise an in-memory store (with a cell
   * quota when {@code store.maxCells} is positive), wrapped in a chunking
   * decorator when {@code store.writeChunkSize} is positive.
   */
  public SpreadsheetStore createStore() {
    SpreadsheetStore store;
    if (workbook != null) {
      store = new WorkbookSpreadsheetStore(Path.of(workbook));
    } else if (maxCells > 0) {
      store = new InMemorySpreadsheetStore(maxCells);
    } else {
      store = new InMemorySpreadsheetStore();
    }
    if (writeChunkSize > 0) {
      store = new ChunkedWriteSpreadsheetStore(store, writeChunkSize, chunkPauseMs);
    }
    return store;
  }

  public @Nullable String getWorkbook() {
    return workbook;
  }

  public int getWriteChunkSize() {
    return writeChunkSize;
  }

  public long getChunkPauseMs() {
    return chunkPauseMs;
  }

  /** Cell quota of the in-memory store, or 0 for none. */
  public long getMaxCells() {
    return maxCells;
  }

  /** Append-only table receiving one row per ingestion, or null for none. */
  public @Nullable String getIngestionLog() {
    return ingestionLog;
  }

  public QualityConfig getQuality() {
    return quality;
  }

  public List<TableConfig> getTables() {
    return tables;
  }

  /**
   * Returns the configuration of a source table.
   *
   * @param name Table name
   * @return Table configuration
   * @throws IllegalArgumentException if no table has that name
   */
  public TableConfig getTable(String name) {
    for (TableConfig table : tables) {
      if (table.getName().equals(name)) {
        return table;
      }
    }
    throw new IllegalArgumentException("No table named '" + name + "' in configuration");
  }

  @Override public String toString() {
    return "PipelineConfig{workbook=" + workbook + ", ingestionLog=" + ingestionLog
        + ", tables=" + tables.size() + "}";
  }
}
