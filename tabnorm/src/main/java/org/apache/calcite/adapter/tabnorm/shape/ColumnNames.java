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

import org.apache.calcite.adapter.tabnorm.parse.LocaleParsers;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes header cells into column names usable as dimension keys.
 *
 * <p>{@code "Data de Referência"} becomes {@code data_de_referencia}; blank
 * headers and pandas-style {@code "Unnamed: 3"} headers become
 * {@code col_<index>}; repeated names get a numeric suffix.
 */
public final class ColumnNames {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

  private ColumnNames() {
  }

  /**
   * Normalizes a single header cell.
   *
   * @param header Raw header text
   * @param index 0-based column position, used for blank headers
   * @return Normalized name
   */
  public static String normalize(String header, int index) {
    String folded = LocaleParsers.fold(header);
    if (folded.isEmpty() || folded.startsWith("unnamed")) {
      return "col_" + index;
    }
    String name = NON_ALPHANUMERIC.matcher(folded).replaceAll("_");
    int start = 0;
    int end = name.length();
    while (start < end && name.charAt(start) == '_') {
      start++;
    }
    while (end > start && name.charAt(end - 1) == '_') {
      end--;
    }
    name = name.substring(start, end);
    return name.isEmpty() ? "col_" + index : name;
  }

  /**
   * Normalizes a header row; duplicates become {@code name_2}, {@code name_3}...
   *
   * @param headers Raw header cells in column order
   * @return Normalized names, same size as the input
   */
  public static List<String> normalize(List<String> headers) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    Set<String> seen = new HashSet<String>();
    for (int i = 0; i < headers.size(); i++) {
      String base = normalize(headers.get(i), i);
      String name = base;
      int suffix = 2;
      while (!seen.add(name)) {
        name = base + "_" + suffix++;
      }
      result.add(name);
    }
    return result.build();
  }
}
