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
package org.apache.calcite.adapter.tabnorm.noise;

import org.apache.calcite.adapter.tabnorm.RawRow;
import org.apache.calcite.adapter.tabnorm.parse.LocaleParsers;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a row carries data or is boilerplate.
 *
 * <p>A row is noise when:
 * <ul>
 *   <li>all of its cells are empty;</li>
 *   <li>its first cell contains a boilerplate marker (source and note captions,
 *       methodology captions, {@code Unnamed} column labels), starts with a
 *       footnote marker such as {@code (1)}, {@code *} or a superscript digit,
 *       or is exactly a repeated header word such as {@code ANO};</li>
 *   <li>or more than 80% of its cells are empty.</li>
 * </ul>
 */
public class NoiseClassifier {

  /** Default share of empty cells above which a row is noise. */
  public static final double DEFAULT_EMPTY_THRESHOLD = 0.8;

  /** Markers matched anywhere in the folded first cell. */
  public static final List<String> DEFAULT_MARKERS = ImmutableList.of(
      "fonte:", "source:", "nota:", "notas:", "note:", "notes:", "obs:", "observacao:",
      "elaboracao:", "unnamed", "nbr 12", "banco de dados", "variacoes percentuais",
      "nova metodologia", "precos correntes", "dado nao disponivel", "metodologia:");

  /** Header words that are noise when they are the whole first cell. */
  public static final Set<String> DEFAULT_HEADER_WORDS = ImmutableSet.of(
      "ano", "mes", "periodo", "localidade", "nan", "nat");

  private static final Pattern FOOTNOTE = Pattern.compile("^(\\(\\d+\\)|\\*|[¹²³⁴⁵⁶⁷⁸⁹]).*");

  private static final NoiseClassifier DEFAULT = new NoiseClassifier(
      DEFAULT_MARKERS, DEFAULT_HEADER_WORDS, DEFAULT_EMPTY_THRESHOLD);

  private final List<String> markers;
  private final Set<String> headerWords;
  private final double emptyThreshold;

  /**
   * Creates a classifier.
   *
   * @param markers Boilerplate markers, compared against the accent-folded lower-case first cell
   * @param headerWords Exact first-cell values treated as repeated headers
   * @param emptyThreshold Share of empty cells above which a row is noise
   */
  public NoiseClassifier(Collection<String> markers, Collection<String> headerWords,
      double emptyThreshold) {
    if (emptyThreshold < 0 || emptyThreshold > 1) {
      throw new IllegalArgumentException("emptyThreshold must be within [0, 1]: " + emptyThreshold);
    }
    List<String> folded = new ArrayList<String>();
    for (String marker : markers) {
      folded.add(LocaleParsers.fold(marker));
    }
    this.markers = ImmutableList.copyOf(folded);
    ImmutableSet.Builder<String> words = ImmutableSet.builder();
    for (String word : headerWords) {
      words.add(LocaleParsers.fold(word));
    }
    this.headerWords = words.build();
    this.emptyThreshold = emptyThreshold;
  }

  /**
   * Returns the classifier with the default markers and threshold.
   */
  public static NoiseClassifier defaults() {
    return DEFAULT;
  }

  /**
   * Returns whether the row is boilerplate rather than data.
   *
   * @param row Row to classify
   * @return true if the row should be dropped
   */
  public boolean isNoise(RawRow row) {
    if (row.size() == 0) {
      return true;
    }
    int empty = row.emptyCellCount();
    if (empty == row.size()) {
      return true;
    }
    if (isBoilerplate(row.cell(0))) {
      return true;
    }
    return (double) empty / row.size() > emptyThreshold;
  }

  /**
   * Returns whether a first-cell text matches a boilerplate pattern.
   */
  public boolean isBoilerplate(String firstCell) {
    String folded = LocaleParsers.fold(firstCell);
    if (folded.isEmpty()) {
      return false;
    }
    if (headerWords.contains(folded)) {
      return true;
    }
    if (FOOTNOTE.matcher(folded).matches()) {
      return true;
    }
    for (String marker : markers) {
      if (folded.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  public double getEmptyThreshold() {
    return emptyThreshold;
  }
}
