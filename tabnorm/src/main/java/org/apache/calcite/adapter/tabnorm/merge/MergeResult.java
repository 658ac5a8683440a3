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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of merging one batch into a fact store table.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * MergeResult result = merger.merge("fact_cub", records);
 * LOGGER.info("{} new, {} updated, {} stale duplicates removed",
 *     result.getBrandNewCount(), result.getUpdatedCount(),
 *     result.getResidualDuplicatesRemoved());
 * }</pre>
 *
 * @see FactStoreMerger
 */
public class MergeResult {

  private final String tableName;
  private final int existingCount;
  private final int batchCount;
  private final int batchDuplicatesRemoved;
  private final int brandNewCount;
  private final int updatedCount;
  private final int unchangedCount;
  private final int residualDuplicatesRemoved;
  private final long elapsedMs;
  private final List<CanonicalRecord> records;

  private MergeResult(Builder builder) {
    this.tableName = builder.tableName;
    this.existingCount = builder.existingCount;
    this.batchCount = builder.batchCount;
    this.batchDuplicatesRemoved = builder.batchDuplicatesRemoved;
    this.brandNewCount = builder.brandNewCount;
    this.updatedCount = builder.updatedCount;
    this.unchangedCount = builder.unchangedCount;
    this.residualDuplicatesRemoved = builder.residualDuplicatesRemoved;
    this.elapsedMs = builder.elapsedMs;
    this.records = builder.records != null
        ? Collections.unmodifiableList(new ArrayList<CanonicalRecord>(builder.records))
        : Collections.<CanonicalRecord>emptyList();
  }

  /**
   * Returns the fact store table name.
   */
  public String getTableName() {
    return tableName;
  }

  /**
   * Returns the number of rows read from the store, duplicates included.
   */
  public int getExistingCount() {
    return existingCount;
  }

  /**
   * Returns the number of records in the incoming batch.
   */
  public int getBatchCount() {
    return batchCount;
  }

  /**
   * Returns the number of batch records dropped because a later batch record had the same key.
   */
  public int getBatchDuplicatesRemoved() {
    return batchDuplicatesRemoved;
  }

  /**
   * Returns the number of batch keys that were not in the store.
   */
  public int getBrandNewCount() {
    return brandNewCount;
  }

  /**
   * Returns the number of batch keys that replaced a stored record.
   */
  public int getUpdatedCount() {
    return updatedCount;
  }

  /**
   * Returns how many of the updated records had the same value and dimensions as before.
   */
  public int getUnchangedCount() {
    return unchangedCount;
  }

  /**
   * Returns the number of stale stored rows dropped because another stored row had the same key.
   */
  public int getResidualDuplicatesRemoved() {
    return residualDuplicatesRemoved;
  }

  /**
   * Returns the number of records written back.
   */
  public int getFinalCount() {
    return records.size();
  }

  /**
   * Returns the elapsed time in milliseconds.
   */
  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns the records written back, in store order.
   */
  public List<CanonicalRecord> getRecords() {
    return records;
  }

  /**
   * Creates a new builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "MergeResult{table='" + tableName + "', existing=" + existingCount
        + ", batch=" + batchCount + ", new=" + brandNewCount + ", updated=" + updatedCount
        + ", residualDuplicates=" + residualDuplicatesRemoved + ", final=" + records.size()
        + ", elapsedMs=" + elapsedMs + "}";
  }

  /**
   * Builder for MergeResult.
   */
  public static class Builder {
    private String tableName;
    private int existingCount;
    private int batchCount;
    private int batchDuplicatesRemoved;
    private int brandNewCount;
    private int updatedCount;
    private int unchangedCount;
    private int residualDuplicatesRemoved;
    private long elapsedMs;
    private List<CanonicalRecord> records;

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder existingCount(int existingCount) {
      this.existingCount = existingCount;
      return this;
    }

    public Builder batchCount(int batchCount) {
      this.batchCount = batchCount;
      return this;
    }

    public Builder batchDuplicatesRemoved(int batchDuplicatesRemoved) {
      this.batchDuplicatesRemoved = batchDuplicatesRemoved;
      return this;
    }

    public Builder brandNewCount(int brandNewCount) {
      this.brandNewCount = brandNewCount;
      return this;
    }

    public Builder updatedCount(int updatedCount) {
      this.updatedCount = updatedCount;
      return this;
    }

    public Builder unchangedCount(int unchangedCount) {
      this.unchangedCount = unchangedCount;
      return this;
    }

    public Builder residualDuplicatesRemoved(int residualDuplicatesRemoved) {
      this.residualDuplicatesRemoved = residualDuplicatesRemoved;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public Builder records(List<CanonicalRecord> records) {
      this.records = records;
      return this;
    }

    public MergeResult build() {
      return new MergeResult(this);
    }
  }
}
