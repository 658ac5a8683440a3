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

import org.apache.calcite.adapter.tabnorm.CanonicalRecord;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Records emitted for one source table plus counters describing the pass.
 *
 * @see ShapeNormalizer
 */
public class NormalizationResult {

  private final String tableName;
  private final TableShape shape;
  private final int rawRowCount;
  private final int noiseRowCount;
  private final int duplicatesCollapsed;
  private final List<CanonicalRecord> records;

  NormalizationResult(String tableName, TableShape shape, int rawRowCount, int noiseRowCount,
      int duplicatesCollapsed, List<CanonicalRecord> records) {
    this.tableName = tableName;
    this.shape = shape;
    this.rawRowCount = rawRowCount;
    this.noiseRowCount = noiseRowCount;
    this.duplicatesCollapsed = duplicatesCollapsed;
    this.records = ImmutableList.copyOf(records);
  }

  public String getTableName() {
    return tableName;
  }

  public TableShape getShape() {
    return shape;
  }

  public TableShape.Kind getShapeKind() {
    return shape.getKind();
  }

  /**
   * Returns whether the table had a readable layout.
   */
  public boolean isShapeRecognized() {
    return shape.getKind() != TableShape.Kind.UNRECOGNIZED;
  }

  /**
   * Returns the number of rows in the source table.
   */
  public int getRawRowCount() {
    return rawRowCount;
  }

  /**
   * Returns the number of rows dropped by the noise classifier.
   */
  public int getNoiseRowCount() {
    return noiseRowCount;
  }

  /**
   * Returns the number of emitted records replaced by a later record with the same key.
   */
  public int getDuplicatesCollapsed() {
    return duplicatesCollapsed;
  }

  /**
   * Returns the records, unique by key, ordered by series, date and key.
   */
  public List<CanonicalRecord> getRecords() {
    return records;
  }

  @Override public String toString() {
    return "NormalizationResult{table='" + tableName + "', shape=" + shape.getKind()
        + ", rawRows=" + rawRowCount + ", noiseRows=" + noiseRowCount
        + ", records=" + records.size() + "}";
  }
}
