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
package org.apache.calcite.adapter.tabnorm.quality;

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders quality flags as spreadsheet rows.
 */
public final class QualityFlagCodec {

  /** Column order of an exported flags table. */
  public static final List<String> HEADER = ImmutableList.of(
      "series_id", "reference_date", "flag_kind", "severity", "observed_value", "detail");

  private QualityFlagCodec() {
  }

  /**
   * Encodes flags as a header row followed by one row per flag.
   */
  public static List<List<String>> toRows(List<QualityFlag> flags) {
    List<List<String>> rows = new ArrayList<List<String>>(flags.size() + 1);
    rows.add(HEADER);
    for (QualityFlag flag : flags) {
      rows.add(
          ImmutableList.of(flag.getSeriesId(),
          flag.getReferenceDate().toString(),
          flag.getKind().name(),
          flag.getSeverity().name(),
          flag.getObservedValue() == null
              ? ""
              : BigDecimal.valueOf(flag.getObservedValue()).toPlainString(),
          flag.getDetail()));
    }
    return rows;
  }
}
