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
package org.apache.calcite.adapter.tabnorm.parse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Portuguese month tokens as they appear in CBIC, IBGE and BCB exports.
 *
 * <p>The canonical table has twelve three-letter abbreviations
 * ({@code JAN FEV MAR ABR MAI JUN JUL AGO SET OUT NOV DEZ}); full month
 * names are accepted as aliases. Lookups are case and accent insensitive
 * and tolerate a trailing period ({@code "jan."}).
 */
public final class MonthTable {

  /** The twelve abbreviations, January first. */
  public static final List<String> ABBREVIATIONS = ImmutableList.of(
      "JAN", "FEV", "MAR", "ABR", "MAI", "JUN",
      "JUL", "AGO", "SET", "OUT", "NOV", "DEZ");

  private static final Map<String, Integer> TOKENS;

  static {
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < ABBREVIATIONS.size(); i++) {
      builder.put(ABBREVIATIONS.get(i).toLowerCase(Locale.ROOT), i + 1);
    }
    // Full names, already accent folded
    builder.put("janeiro", 1);
    builder.put("fevereiro", 2);
    builder.put("marco", 3);
    builder.put("abril", 4);
    builder.put("maio", 5);
    builder.put("junho", 6);
    builder.put("julho", 7);
    builder.put("agosto", 8);
    builder.put("setembro", 9);
    builder.put("outubro", 10);
    builder.put("novembro", 11);
    builder.put("dezembro", 12);
    TOKENS = builder.build();
  }

  private MonthTable() {
  }

  /**
   * Returns the month number (1-12) for a token, or null if it is not a month.
   *
   * @param token Cell text such as {@code "FEV"}, {@code "Março"} or {@code "jan."}
   * @return Month number, or null
   */
  public static @Nullable Integer monthOf(@Nullable String token) {
    if (token == null) {
      return null;
    }
    String folded = LocaleParsers.fold(token);
    if (folded.endsWith(".")) {
      folded = folded.substring(0, folded.length() - 1).trim();
    }
    return TOKENS.get(folded);
  }

  public static boolean isMonth(@Nullable String token) {
    return monthOf(token) != null;
  }

  /**
   * Returns the abbreviation for a month number.
   *
   * @param month Month number, 1-12
   * @return Abbreviation such as {@code "FEV"}
   */
  public static String abbreviation(int month) {
    return ABBREVIATIONS.get(month - 1);
  }
}
