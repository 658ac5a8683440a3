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

import org.apache.calcite.adapter.tabnorm.RawTable;
import org.apache.calcite.adapter.tabnorm.TableConfig;
import org.apache.calcite.adapter.tabnorm.merge.FactStoreMerger;
import org.apache.calcite.adapter.tabnorm.merge.MergeResult;
import org.apache.calcite.adapter.tabnorm.noise.NoiseClassifier;
import org.apache.calcite.adapter.tabnorm.quality.QualityEngine;
import org.apache.calcite.adapter.tabnorm.quality.QualityFlag;
import org.apache.calcite.adapter.tabnorm.quality.QualityFlagCodec;
import org.apache.calcite.adapter.tabnorm.shape.NormalizationResult;
import org.apache.calcite.adapter.tabnorm.shape.ShapeDetector;
import org.apache.calcite.adapter.tabnorm.shape.ShapeNormalizer;
import org.apache.calcite.adapter.tabnorm.source.WorkbookTableReader;
import org.apache.calcite.adapter.tabnorm.store.SpreadsheetStore;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs source tables through normalization, quality checks and the fact
 * store merge.
 *
 * <p>For each table:
 * <ol>
 *   <li>Normalize - detect the layout and emit canonical records</li>
 *   <li>Quality - check the records; flags are logged and, when the table
 *       names a {@code flagsTable}, written there</li>
 *   <li>Merge - upsert the records into the table's {@code target}</li>
 *   <li>Log - append one row to the ingestion log table, if configured</li>
 * </ol>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PipelineConfig config = PipelineConfig.load(Path.of("tabnorm.yaml"));
 * IngestionPipeline pipeline = new IngestionPipeline(config, config.createStore());
 * for (IngestionResult result : pipeline.runAll()) {
 *   LOGGER.info("{}", result);
 * }
 * }</pre>
 *
 * <h3>Error Handling</h3>
 * <p>There are no retries. A failing table gets an {@code error} row in the
 * ingestion log and the original exception is rethrown by {@link #ingest};
 * {@link #runAll} records the failure and carries on with the next table.
 *
 * @see PipelineConfig
 * @see IngestionResult
 */
public class IngestionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionPipeline.class);

  /** Columns of the ingestion log table. */
  public static final List<String> LOG_HEADER = ImmutableList.of(
      "exec_id", "timestamp", "source", "status", "rows", "errors");

  private static final DateTimeFormatter EXEC_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);

  private final PipelineConfig config;
  private final SpreadsheetStore store;
  private final Clock clock;
  private final ShapeNormalizer normalizer;
  private final QualityEngine qualityEngine;
  private final FactStoreMerger merger;
  private final WorkbookTableReader reader;

  /**
   * Creates a pipeline using the system clock.
   *
   * @param config Pipeline configuration
   * @param store Fact store
   */
  public IngestionPipeline(PipelineConfig config, SpreadsheetStore store) {
    this(config, store, Clock.systemDefaultZone());
  }

  /**
   * Creates a pipeline.
   *
   * @param config Pipeline configuration
   * @param store Fact store
   * @param clock Clock for ingestion timestamps and the future-date check
   */
  public IngestionPipeline(PipelineConfig config, SpreadsheetStore store, Clock clock) {
    this.config = config;
    this.store = store;
    this.clock = clock;
    this.normalizer = new ShapeNormalizer(NoiseClassifier.defaults(), new ShapeDetector(), clock);
    this.qualityEngine = new QualityEngine(config.getQuality(), clock);
    this.merger = new FactStoreMerger(store);
    this.reader = new WorkbookTableReader();
  }

  /**
   * Ingests every configured table that names a {@code sourceFile}.
   *
   * @return One result per table, failures included
   */
  public List<IngestionResult> runAll() {
    List<IngestionResult> results = new ArrayList<IngestionResult>();
    for (TableConfig table : config.getTables()) {
      if (table.getSourceFile() == null) {
        LOGGER.warn("Table '{}' has no sourceFile, skipping", table.getName());
        continue;
      }
      long start = System.currentTimeMillis();
      try {
        RawTable raw = reader.read(Path.of(table.getSourceFile()), table.getSheet(),
            table.getSourceUrl());
        results.add(ingest(raw, table));
      } catch (IOException | RuntimeException e) {
        results.add(
            IngestionResult.builder()
            .execId(newExecId(table.getName()))
            .tableName(table.getName())
            .status(IngestionResult.STATUS_ERROR)
            .failureMessage(e.getMessage())
            .elapsedMs(System.currentTimeMillis() - start)
            .build());
      }
    }
    int failed = 0;
    for (IngestionResult result : results) {
      if (!result.isSuccessful()) {
        failed++;
      }
    }
    LOGGER.info("Ingestion run complete: {} tables, {} failed", results.size(), failed);
    return results;
  }

  /**
   * Ingests a table using the configuration entry with the same name.
   *
   * @param table Raw source table
   * @return Ingestion result
   * @throws IOException If the store fails
   * @throws IllegalArgumentException If no table of that name is configured
   */
  public IngestionResult ingest(RawTable table) throws IOException {
    return ingest(table, config.getTable(table.getName()));
  }

  /**
   * Ingests a table.
   *
   * @param table Raw source table
   * @param tableConfig How to read the table and where to merge it
   * @return Ingestion result
   * @throws IOException If the store fails; the failure is logged first
   */
  public IngestionResult ingest(RawTable table, TableConfig tableConfig) throws IOException {
    String execId = newExecId(tableConfig.getName());
    long start = System.currentTimeMillis();
    NormalizationResult normalization = null;
    LOGGER.info("Starting ingestion {} of '{}' into '{}'", execId, tableConfig.getName(),
        tableConfig.getTarget());
    try {
      normalization = normalizer.normalize(table, tableConfig);

      List<QualityFlag> flags = qualityEngine.evaluate(normalization.getRecords());
      int high = 0;
      for (QualityFlag flag : flags) {
        if (flag.getSeverity() == QualityFlag.Severity.HIGH) {
          high++;
        }
      }
      if (high > 0) {
        LOGGER.warn("Table '{}' has {} high severity quality flags", tableConfig.getName(), high);
      }
      if (tableConfig.getFlagsTable() != null) {
        store.writeTable(tableConfig.getFlagsTable(), QualityFlagCodec.toRows(flags));
      }

      MergeResult merge = null;
      String status;
      if (normalization.isShapeRecognized()) {
        merge = merger.merge(tableConfig.getTarget(), normalization.getRecords());
        status = IngestionResult.STATUS_SUCCESS;
      } else {
        status = IngestionResult.STATUS_PARTIAL;
      }

      writeLog(execId, tableConfig.getName(), status, normalization.getRecords().size(), "");
      long elapsed = System.currentTimeMillis() - start;
      LOGGER.info("Ingestion {} of '{}' finished with status {} in {}ms", execId,
          tableConfig.getName(), status, elapsed);
      return IngestionResult.builder()
          .execId(execId)
          .tableName(tableConfig.getName())
          .status(status)
          .normalization(normalization)
          .flags(flags)
          .merge(merge)
          .elapsedMs(elapsed)
          .build();
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Ingestion {} of '{}' failed: {}", execId, tableConfig.getName(),
          e.getMessage(), e);
      try {
        writeLog(execId, tableConfig.getName(), IngestionResult.STATUS_ERROR,
            normalization == null ? 0 : normalization.getRecords().size(),
            e.getClass().getSimpleName() + ": " + e.getMessage());
      } catch (IOException | RuntimeException logFailure) {
        e.addSuppressed(logFailure);
      }
      throw e;
    }
  }

  private void writeLog(String execId, String source, String status, int rows,
      @Nullable String errors) throws IOException {
    String logTable = config.getIngestionLog();
    if (logTable == null) {
      return;
    }
    List<String> row = ImmutableList.of(execId,
        LocalDateTime.now(clock).format(ShapeNormalizer.TIMESTAMP_FORMAT), source, status,
        String.valueOf(rows), errors == null ? "" : errors);
    if (store.hasTable(logTable)) {
      store.appendRows(logTable, ImmutableList.of(row));
    } else {
      store.appendRows(logTable, ImmutableList.of(LOG_HEADER, row));
    }
  }

  private String newExecId(String tableName) {
    return tableName + "_" + LocalDateTime.now(clock).format(EXEC_ID_FORMAT) + "_"
        + UUID.randomUUID().toString().substring(0, 8);
  }
}
