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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.text.Normalizer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for cell text written in Brazilian (pt-BR) conventions.
 *
 * <p>Numbers use a decimal comma and dot thousands separators
 * ({@code "1.234,56"}); months are Portuguese abbreviations. Every method
 * here is pure and total: unparseable input yields null, never an exception,
 * and callers treat null as "skip this value".
 *
 * <h3>Numeric rules</h3>
 * <ul>
 *   <li>Sentinels {@code "..." "(...)" "-" "--" "N/D" "" "nan" "none" "x"} are null</li>
 *   <li>{@code R$}, {@code %} and whitespace are stripped</li>
 *   <li>With a comma present, dots are thousands separators and the comma is the decimal mark</li>
 *   <li>Without a comma, dots that form thousands groups ({@code "1.234.567"}) are
 *       separators; a single dot that does not ({@code "150.3"}) is a decimal point</li>
 * </ul>
 */
public final class LocaleParsers {

  /** Default lower bound for a plausible reference year. */
  public static final int DEFAULT_MIN_YEAR = 1950;

  /** Default upper bound for a plausible reference year. */
  public static final int DEFAULT_MAX_YEAR = 2035;

  private static final Set<String> NULL_SENTINELS = ImmutableSet.of(
      "...", "(...)", "-", "--", "n/d", "", "nan", "none", "x");

  private static final Pattern DECORATION = Pattern.compile("(?i)r\\$|%|\\s");
  private static final Pattern THOUSANDS_GROUPED = Pattern.compile("^[+-]?\\d{1,3}(\\.\\d{3})+$");
  private static final Pattern PLAIN_DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");
  private static final Pattern YEAR = Pattern.compile("^(\\d{4})(?:[.,]0+)?$");
  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

  private static final Pattern ISO_DAY =
      Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:[T ].*)?$");
  private static final Pattern BR_DAY = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
  private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})[/-](\\d{1,2})$");
  private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})[/-](\\d{4})$");
  private static final Pattern NAME_YEAR = Pattern.compile("^([a-z]+)\\.?[/\\- ](\\d{4}|\\d{2})$");

  private LocaleParsers() {
  }

  /**
   * Parses a pt-BR formatted number.
   *
   * <pre>{@code
   * parseNumeric("1.234,56")  -> 1234.56
   * parseNumeric("-50,5")     -> -50.5
   * parseNumeric("R$ 2.500")  -> 2500.0
   * parseNumeric("...")       -> null
   * }</pre>
   *
   * @param text Cell text, may be null
   * @return Parsed finite value, or null
   */
  public static @Nullable Double parseNumeric(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String s = text.replace('\u00A0', ' ').trim();
    if (NULL_SENTINELS.contains(s.toLowerCase(Locale.ROOT))) {
      return null;
    }
    s = DECORATION.matcher(s).replaceAll("");
    if (NULL_SENTINELS.contains(s.toLowerCase(Locale.ROOT))) {
      return null;
    }

    int comma = s.indexOf(',');
    if (comma >= 0) {
      if (s.indexOf(',', comma + 1) >= 0) {
        return null;
      }
      s = s.replace(".", "").replace(',', '.');
    } else if (s.indexOf('.') >= 0) {
      if (THOUSANDS_GROUPED.matcher(s).matches()) {
        s = s.replace(".", "");
      } else if (s.indexOf('.') != s.lastIndexOf('.')) {
        return null;
      }
    }

    if (!PLAIN_DECIMAL.matcher(s).matches()) {
      return null;
    }
    double value = Double.parseDouble(s);
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return null;
    }
    return value;
  }

  /**
   * Parses a bare four digit year within the default range.
   */
  public static @Nullable Integer parseYear(@Nullable String text) {
    return parseYear(text, DEFAULT_MIN_YEAR, DEFAULT_MAX_YEAR);
  }

  /**
   * Parses a bare four digit year. A trailing {@code ".0"} left by spreadsheet
   * float rendering is accepted.
   *
   * @param text Cell text
   * @param minYear Smallest accepted year, inclusive
   * @param maxYear Largest accepted year, inclusive
   * @return Year, or null if the text is not a year in range
   */
  public static @Nullable Integer parseYear(@Nullable String text, int minYear, int maxYear) {
    if (text == null) {
      return null;
    }
    Matcher matcher = YEAR.matcher(text.trim());
    if (!matcher.matches()) {
      return null;
    }
    int year = Integer.parseInt(matcher.group(1));
    if (year < minYear || year > maxYear) {
      return null;
    }
    return year;
  }

  /**
   * Builds a month-start date from a year cell and an optional month token.
   */
  public static @Nullable LocalDate parseDate(@Nullable String yearText,
      @Nullable String monthLabel) {
    return parseDate(yearText, monthLabel, DEFAULT_MIN_YEAR, DEFAULT_MAX_YEAR);
  }

  /**
   * Builds a month-start date from a year cell and an optional month token.
   *
   * <p>A blank month yields January (annual series). A month token that is not
   * in {@link MonthTable} yields null.
   *
   * @param yearText Year cell text
   * @param monthLabel Month token, may be null or blank
   * @param minYear Smallest accepted year, inclusive
   * @param maxYear Largest accepted year, inclusive
   * @return First day of the month, or null
   */
  public static @Nullable LocalDate parseDate(@Nullable String yearText,
      @Nullable String monthLabel, int minYear, int maxYear) {
    Integer year = parseYear(yearText, minYear, maxYear);
    if (year == null) {
      return null;
    }
    if (monthLabel == null || monthLabel.trim().isEmpty()) {
      return LocalDate.of(year, 1, 1);
    }
    Integer month = MonthTable.monthOf(monthLabel);
    if (month == null) {
      return null;
    }
    return LocalDate.of(year, month, 1);
  }

  /**
   * Parses the date column of a tall table.
   *
   * <p>Accepted forms: {@code 2024-01-15}, {@code 15/01/2024}, {@code 2024-01},
   * {@code 01/2024}, {@code jan/24}, {@code jan/2024}, {@code janeiro/2024}.
   * Two digit years pivot at 50. Forms without a day yield the first of the month.
   *
   * @param text Cell text
   * @return Parsed date, or null
   */
  public static @Nullable LocalDate parseReferenceDate(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String s = fold(text);
    if (s.isEmpty()) {
      return null;
    }

    Matcher m = ISO_DAY.matcher(s);
    if (m.matches()) {
      return safeDate(m.group(1), m.group(2), m.group(3));
    }
    m = BR_DAY.matcher(s);
    if (m.matches()) {
      return safeDate(m.group(3), m.group(2), m.group(1));
    }
    m = YEAR_MONTH.matcher(s);
    if (m.matches()) {
      return safeDate(m.group(1), m.group(2), "1");
    }
    m = MONTH_YEAR.matcher(s);
    if (m.matches()) {
      return safeDate(m.group(2), m.group(1), "1");
    }
    m = NAME_YEAR.matcher(s);
    if (m.matches()) {
      Integer month = MonthTable.monthOf(m.group(1));
      if (month == null) {
        return null;
      }
      String year = m.group(2);
      if (year.length() == 2) {
        int yy = Integer.parseInt(year);
        year = String.valueOf(yy < 50 ? 2000 + yy : 1900 + yy);
      }
      return safeDate(year, String.valueOf(month), "1");
    }
    return null;
  }

  /**
   * Folds text for comparisons: trims, lower-cases and strips accents, so that
   * {@code " Março "} becomes {@code "marco"}.
   */
  public static String fold(String text) {
    String decomposed = Normalizer.normalize(text.replace('\u00A0', ' '), Normalizer.Form.NFD);
    return DIACRITICS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT).trim();
  }

  private static @Nullable LocalDate safeDate(String year, String month, String day) {
    int y = Integer.parseInt(year);
    if (y < DEFAULT_MIN_YEAR || y > DEFAULT_MAX_YEAR) {
      return null;
    }
    try {
      return LocalDate.of(y, Integer.parseInt(month), Integer.parseInt(day));
    } catch (DateTimeException e) {
      // 31/02/2024 and friends
      return null;
    }
  }
}
