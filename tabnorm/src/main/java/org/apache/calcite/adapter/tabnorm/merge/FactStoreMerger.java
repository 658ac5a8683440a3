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
import org.apache.calcite.adapter.tabnorm.store.SpreadsheetStore;

import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upserts a batch of canonical records into a fact store table.
 *
 * <p>A merge reads the whole table ({@link MergeState#READ_EXISTING}), merges
 * in memory ({@link MergeState#MERGE}) and replaces the whole table
 * ({@link MergeState#WRITE_BACK}):
 * <ol>
 *   <li>the batch is deduplicated by record key, last record wins;</li>
 *   <li>stored rows sharing a key collapse to the one with the latest
 *       {@code ingested_at} (a later row wins a tie);</li>
 *   <li>batch records replace stored records with the same key and the rest
 *       are added;</li>
 *   <li>the snapshot is sorted by series id, reference date and key, and the
 *       month-over-month and year-over-year variations are recomputed.</li>
 * </ol>
 *
 * <p>Merging the same batch twice leaves the same keys and values in the
 * store. The keep-latest rule assumes one writer per table; two concurrent
 * merges into the same table may lose one of the batches. There are no
 * retries: a store failure aborts the merge and propagates unchanged.
 */
public class FactStoreMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(FactStoreMerger.class);

  private final SpreadsheetStore store;

  public FactStoreMerger(SpreadsheetStore store) {
    this.store = store;
  }

  /**
   * Merges a batch into a table.
   *
   * @param tableName Fact store table
   * @param batch Incoming records, possibly with repeated keys
   * @return Counters and the records written back
   * @throws IOException If the store cannot be read or written
   * @throws MergeInvariantException If the merged snapshot still has a duplicate key
   */
  public MergeResult merge(String tableName, List<CanonicalRecord> batch) throws IOException {
    long start = System.currentTimeMillis();
    MergeState state = MergeState.READ_EXISTING;
    try {
      List<CanonicalRecord> existing = readExisting(tableName);

      state = MergeState.MERGE;
      Map<String, CanonicalRecord> incoming = new LinkedHashMap<String, CanonicalRecord>();
      for (CanonicalRecord record : batch) {
        incoming.put(record.getRecordKey(), record);
      }
      Map<String, CanonicalRecord> snapshot = keepLatest(existing);
      int residualDuplicates = existing.size() - snapshot.size();

      int brandNew = 0;
      int updated = 0;
      int unchanged = 0;
      for (CanonicalRecord record : incoming.values()) {
        CanonicalRecord previous = snapshot.put(record.getRecordKey(), record);
        if (previous == null) {
          brandNew++;
        } else {
          updated++;
          if (previous.equals(record)) {
            unchanged++;
          }
        }
      }

      List<CanonicalRecord> merged = new ArrayList<CanonicalRecord>(snapshot.values());
      Collections.sort(merged, CanonicalRecord.SERIES_DATE_ORDER);
      merged = VariationCalculator.apply(merged);
      checkUniqueKeys(tableName, merged);

      state = MergeState.WRITE_BACK;
      store.writeTable(tableName, CanonicalRecordCodec.encode(merged));

      MergeResult result = MergeResult.builder()
          .tableName(tableName)
          .existingCount(existing.size())
          .batchCount(batch.size())
          .batchDuplicatesRemoved(batch.size() - incoming.size())
          .brandNewCount(brandNew)
          .updatedCount(updated)
          .unchangedCount(unchanged)
          .residualDuplicatesRemoved(residualDuplicates)
          .records(merged)
          .elapsedMs(System.currentTimeMillis() - start)
          .build();
      LOGGER.info("Merged {} records into '{}': existing={}, new={}, updated={} ({} unchanged),"
              + " residual duplicates removed={}, total={}", batch.size(), tableName,
          existing.size(), brandNew, updated, unchanged, residualDuplicates,
          merged.size());
      return result;
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Merge into '{}' failed during {}: {}", tableName, state, e.getMessage());
      throw e;
    }
  }

  private List<CanonicalRecord> readExisting(String tableName) throws IOException {
    if (!store.hasTable(tableName)) {
      LOGGER.debug("Table '{}' does not exist yet", tableName);
      return Collections.emptyList();
    }
    return CanonicalRecordCodec.decode(store.readTable(tableName));
  }

  /**
   * Collapses stored rows sharing a key to the one with the latest
   * {@code ingested_at}; timestamps compare as text.
   */
  static Map<String, CanonicalRecord> keepLatest(List<CanonicalRecord> existing) {
    Map<String, CanonicalRecord> latest = new LinkedHashMap<String, CanonicalRecord>();
    for (CanonicalRecord record : existing) {
      CanonicalRecord current = latest.get(record.getRecordKey());
      if (current == null
          || Strings.nullToEmpty(record.getIngestedAt())
              .compareTo(Strings.nullToEmpty(current.getIngestedAt())) >= 0) {
        latest.put(record.getRecordKey(), record);
      }
    }
    int removed = existing.size() - latest.size();
    if (removed > 0) {
      LOGGER.warn("Removed {} stale duplicate rows from stored snapshot", removed);
    }
    return latest;
  }

  static void checkUniqueKeys(String tableName, List<CanonicalRecord> records) {
    Set<String> seen = new HashSet<String>();
    Set<String> duplicates = new LinkedHashSet<String>();
    for (CanonicalRecord record : records) {
      if (!seen.add(record.getRecordKey())) {
        duplicates.add(record.getRecordKey());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new MergeInvariantException(tableName, duplicates);
    }
  }
}
