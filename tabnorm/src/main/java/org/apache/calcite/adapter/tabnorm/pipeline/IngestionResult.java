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

import org.apache.calcite.adapter.tabnorm.merge.MergeResult;
import org.apache.calcite.adapter.tabnorm.quality.QualityFlag;
import org.apache.calcite.adapter.tabnorm.shape.NormalizationResult;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of ingesting one source table.
 *
 * <p>A failed ingestion carries the failure message and whatever stages
 * completed before the failure; a successful one carries all three stages.
 *
 * @see IngestionPipeline
 */
public class IngestionResult {

  /** Value of the status column in the ingestion log. */
  public static final String STATUS_SUCCESS = "success";
  /** Status when the source had no recognizable layout and nothing was merged. */
  public static final String STATUS_PARTIAL = "partial";
  public static final String STATUS_ERROR = "error";

  private final String execId;
  private final String tableName;
  private final String status;
  private final @Nullable NormalizationResult normalization;
  private final List<QualityFlag> flags;
  private final @Nullable MergeResult merge;
  private final @Nullable String failureMessage;
  private final long elapsedMs;

  private IngestionResult(Builder builder) {
    this.execId = builder.execId;
    this.tableName = builder.tableName;
    this.status = builder.status;
    this.normalization = builder.normalization;
    this.flags = builder.flags != null
        ? Collections.unmodifiableList(new ArrayList<QualityFlag>(builder.flags))
        : Collections.<QualityFlag>emptyList();
    this.merge = builder.merge;
    this.failureMessage = builder.failureMessage;
    this.elapsedMs = builder.elapsedMs;
  }

  /**
   * Returns the execution id written to the ingestion log.
   */
  public String getExecId() {
    return execId;
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * Returns {@link #STATUS_SUCCESS}, {@link #STATUS_PARTIAL} or {@link #STATUS_ERROR}.
   */
  public String getStatus() {
    return status;
  }

  public boolean isSuccessful() {
    return !STATUS_ERROR.equals(status);
  }

  public @Nullable NormalizationResult getNormalization() {
    return normalization;
  }

  public List<QualityFlag> getFlags() {
    return flags;
  }

  public @Nullable MergeResult getMerge() {
    return merge;
  }

  public @Nullable String getFailureMessage() {
    return failureMessage;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns the number of records emitted by normalization, or 0.
   */
  public int getRecordCount() {
    return normalization == null ? 0 : normalization.getRecords().size();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "IngestionResult{execId='" + execId + "', table='" + tableName + "', status="
        + status + ", records=" + getRecordCount() + ", flags=" + flags.size()
        + (failureMessage == null ? "" : ", failure='" + failureMessage + "'") + "}";
  }

  /**
   * Builder for IngestionResult.
   */
  public static class Builder {
    private String execId;
    private String tableName;
    private String status = STATUS_SUCCESS;
    private @Nullable NormalizationResult normalization;
    private @Nullable List<QualityFlag> flags;
    private @Nullable MergeResult merge;
    private @Nullable String failureMessage;
    private long elapsedMs;

    public Builder execId(String execId) {
      this.execId = execId;
      return this;
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder status(String status) {
      this.status = status;
      return this;
    }

    public Builder normalization(@Nullable NormalizationResult normalization) {
      this.normalization = normalization;
      return this;
    }

    public Builder flags(@Nullable List<QualityFlag> flags) {
      this.flags = flags;
      return this;
    }

    public Builder merge(@Nullable MergeResult merge) {
      this.merge = merge;
      return this;
    }

    public Builder failureMessage(@Nullable String failureMessage) {
      this.failureMessage = failureMessage;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public IngestionResult build() {
      return new IngestionResult(this);
    }
  }
}
