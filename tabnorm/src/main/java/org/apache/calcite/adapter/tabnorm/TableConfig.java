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
package org.apache.calcite.adapter.tabnorm;

import org.apache.calcite.adapter.tabnorm.parse.LocaleParsers;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Describes one source table: how to read it and where its records go.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * tables:
 *   - name: cub_medio
 *     target: fact_cub
 *     flagsTable: fact_cub_quality_flags
 *     seriesId: cub_medio
 *     shape: auto            # auto | tall | wide
 *     frequency: monthly     # monthly | daily
 *     group: year            # year | label
 *     captionDimension: regiao
 *     staticDimensions:
 *       unidade: "R$/m²"
 *     sourceUrl: "http://www.cbicdados.com.br/media/anexos/cub_medio.xlsx"
 *     sourceFile: "downloads/cub_medio.xlsx"
 *     sheet: "CUB MÉDIO"
 *
 *   - name: consumo_cimento
 *     target: fact_cimento
 *     seriesId: consumo_cimento
 *     group: label           # localidade down the first column
 *     groupDimension: localidade
 *     fixedYear: 2024
 *
 *   - name: selic_diaria
 *     target: fact_series
 *     shape: tall
 *     frequency: daily
 *     dateColumn: data
 *     valueColumn: valor
 *     seriesColumn: series_id
 * }</pre>
 */
public class TableConfig {

  /** Date column names tried on tall tables when none is configured. */
  public static final List<String> DEFAULT_DATE_COLUMNS =
      ImmutableList.of("data_referencia", "reference_date", "data", "date");

  /** Value column names tried on tall tables when none is configured. */
  public static final List<String> DEFAULT_VALUE_COLUMNS = ImmutableList.of("valor", "value");

  /**
   * How the table shape is chosen.
   */
  public enum ShapeMode {
    /** Detect from the header rows. */
    AUTO,
    /** One record per row. */
    TALL,
    /** Periods spread across columns or paired down the rows. */
    WIDE
  }

  /**
   * Spacing of reference dates.
   */
  public enum Frequency {
    /** Dates are normalized to the first day of the month. */
    MONTHLY,
    /** Dates keep their exact day. */
    DAILY
  }

  /**
   * What the sparse first column of a wide table carries.
   */
  public enum GroupKind {
    /** A four digit year, carried forward over blank cells. */
    YEAR,
    /** A label such as a locality; the year comes from {@code fixedYear}. */
    LABEL
  }

  private final String name;
  private final String target;
  private final @Nullable String flagsTable;
  private final @Nullable String seriesId;
  private final ShapeMode shape;
  private final Frequency frequency;
  private final GroupKind group;
  private final String groupDimension;
  private final String captionDimension;
  private final @Nullable Integer fixedYear;
  private final @Nullable String dateColumn;
  private final @Nullable String valueColumn;
  private final @Nullable String seriesColumn;
  private final List<String> dimensionColumns;
  private final List<String> keyDimensions;
  private final Map<String, String> staticDimensions;
  private final List<String> skipGroupLabels;
  private final @Nullable String sourceUrl;
  private final @Nullable String sourceFile;
  private final @Nullable String sheet;
  private final int minYear;
  private final int maxYear;
  private final boolean zeroAsAbsent;

  private TableConfig(Builder builder) {
    if (builder.name == null || builder.name.trim().isEmpty()) {
      throw new IllegalArgumentException("Table configuration requires 'name'");
    }
    if (builder.minYear > builder.maxYear) {
      throw new IllegalArgumentException("Table '" + builder.name + "': minYear "
          + builder.minYear + " is after maxYear " + builder.maxYear);
    }
    this.name = builder.name;
    this.target = builder.target != null ? builder.target : builder.name;
    this.flagsTable = builder.flagsTable;
    this.seriesId = builder.seriesId;
    this.shape = builder.shape;
    this.frequency = builder.frequency;
    this.group = builder.group;
    this.groupDimension = builder.groupDimension;
    this.captionDimension = builder.captionDimension;
    this.fixedYear = builder.fixedYear;
    this.dateColumn = builder.dateColumn;
    this.valueColumn = builder.valueColumn;
    this.seriesColumn = builder.seriesColumn;
    this.dimensionColumns = ImmutableList.copyOf(builder.dimensionColumns);
    this.keyDimensions = ImmutableList.copyOf(builder.keyDimensions);
    this.staticDimensions = ImmutableMap.copyOf(builder.staticDimensions);
    this.skipGroupLabels = ImmutableList.copyOf(builder.skipGroupLabels);
    this.sourceUrl = builder.sourceUrl;
    this.sourceFile = builder.sourceFile;
    this.sheet = builder.sheet;
    this.minYear = builder.minYear;
    this.maxYear = builder.maxYear;
    this.zeroAsAbsent = builder.zeroAsAbsent;
  }

  /** Source table name. */
  public String getName() {
    return name;
  }

  /** Fact store table the records are merged into; defaults to the name. */
  public String getTarget() {
    return target;
  }

  /** Table receiving this source's quality flags, or null to only log them. */
  public @Nullable String getFlagsTable() {
    return flagsTable;
  }

  public @Nullable String getSeriesId() {
    return seriesId;
  }

  public ShapeMode getShape() {
    return shape;
  }

  public Frequency getFrequency() {
    return frequency;
  }

  public GroupKind getGroup() {
    return group;
  }

  public String getGroupDimension() {
    return groupDimension;
  }

  public String getCaptionDimension() {
    return captionDimension;
  }

  public @Nullable Integer getFixedYear() {
    return fixedYear;
  }

  /**
   * Returns the normalized date column names to look for in a tall header.
   */
  public List<String> getDateColumns() {
    return dateColumn != null ? ImmutableList.of(dateColumn) : DEFAULT_DATE_COLUMNS;
  }

  /**
   * Returns the normalized value column names to look for in a tall header.
   */
  public List<String> getValueColumns() {
    return valueColumn != null ? ImmutableList.of(valueColumn) : DEFAULT_VALUE_COLUMNS;
  }

  public @Nullable String getSeriesColumn() {
    return seriesColumn;
  }

  /** Tall-table columns kept as dimensions; empty means every other column. */
  public List<String> getDimensionColumns() {
    return dimensionColumns;
  }

  /** Dimensions that take part in the record key; empty means all of them. */
  public List<String> getKeyDimensions() {
    return keyDimensions;
  }

  public Map<String, String> getStaticDimensions() {
    return staticDimensions;
  }

  /** Group labels that end a group instead of starting one, such as totals. */
  public List<String> getSkipGroupLabels() {
    return skipGroupLabels;
  }

  public @Nullable String getSourceUrl() {
    return sourceUrl;
  }

  /** Local workbook holding this table, or null when the caller supplies the rows. */
  public @Nullable String getSourceFile() {
    return sourceFile;
  }

  /** Sheet of {@link #getSourceFile()}; null means the first sheet. */
  public @Nullable String getSheet() {
    return sheet;
  }

  public int getMinYear() {
    return minYear;
  }

  public int getMaxYear() {
    return maxYear;
  }

  /**
   * Whether a wide-table period cell that parses to exactly zero is absent.
   *
   * <p>True by default: the source layouts render missing cells as zero, so a
   * zero cell is dropped. This also drops genuine zero readings.
   */
  public boolean isZeroAsAbsent() {
    return zeroAsAbsent;
  }

  public static Builder builder(String name) {
    return new Builder().name(name);
  }

  /**
   * Creates a TableConfig from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return TableConfig instance
   * @throws IllegalArgumentException if a value has the wrong type or is unknown
   */
  @SuppressWarnings("unchecked")
  public static TableConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("Table configuration is null");
    }
    Builder builder = new Builder();
    builder.name(stringValue(map, "name"));
    builder.target(stringValue(map, "target"));
    builder.flagsTable(stringValue(map, "flagsTable"));
    builder.seriesId(stringValue(map, "seriesId"));
    builder.dateColumn(stringValue(map, "dateColumn"));
    builder.valueColumn(stringValue(map, "valueColumn"));
    builder.seriesColumn(stringValue(map, "seriesColumn"));
    builder.sourceUrl(stringValue(map, "sourceUrl"));
    builder.sourceFile(stringValue(map, "sourceFile"));
    builder.sheet(stringValue(map, "sheet"));

    String shape = stringValue(map, "shape");
    if (shape != null) {
      builder.shape(enumValue(ShapeMode.class, "shape", shape));
    }
    String frequency = stringValue(map, "frequency");
    if (frequency != null) {
      builder.frequency(enumValue(Frequency.class, "frequency", frequency));
    }
    String group = stringValue(map, "group");
    if (group != null) {
      builder.group(enumValue(GroupKind.class, "group", group));
    }
    String groupDimension = stringValue(map, "groupDimension");
    if (groupDimension != null) {
      builder.groupDimension(groupDimension);
    }
    String captionDimension = stringValue(map, "captionDimension");
    if (captionDimension != null) {
      builder.captionDimension(captionDimension);
    }

    Integer fixedYear = intValue(map, "fixedYear");
    if (fixedYear != null) {
      builder.fixedYear(fixedYear);
    }
    Integer minYear = intValue(map, "minYear");
    if (minYear != null) {
      builder.minYear(minYear);
    }
    Integer maxYear = intValue(map, "maxYear");
    if (maxYear != null) {
      builder.maxYear(maxYear);
    }

    Object zeroAsAbsent = map.get("zeroAsAbsent");
    if (zeroAsAbsent instanceof Boolean) {
      builder.zeroAsAbsent((Boolean) zeroAsAbsent);
    } else if (zeroAsAbsent instanceof String) {
      builder.zeroAsAbsent(Boolean.parseBoolean((String) zeroAsAbsent));
    }

    builder.dimensionColumns(stringList(map, "dimensionColumns"));
    builder.keyDimensions(stringList(map, "keyDimensions"));
    Object skip = map.get("skipGroupLabels");
    if (skip != null) {
      builder.skipGroupLabels(stringList(map, "skipGroupLabels"));
    }

    Object statics = map.get("staticDimensions");
    if (statics instanceof Map) {
      Map<String, String> dims = new LinkedHashMap<String, String>();
      for (Map.Entry<String, Object> entry : ((Map<String, Object>) statics).entrySet()) {
        if (entry.getValue() != null) {
          dims.put(entry.getKey(), entry.getValue().toString());
        }
      }
      builder.staticDimensions(dims);
    } else if (statics != null) {
      throw new IllegalArgumentException("'staticDimensions' must be a map");
    }
    return builder.build();
  }

  private static @Nullable String stringValue(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value == null ? null : value.toString();
  }

  private static @Nullable Integer intValue(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be an integer: " + value, e);
    }
  }

  private static List<String> stringList(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyList();
    }
    if (!(value instanceof List)) {
      throw new IllegalArgumentException("'" + key + "' must be a list");
    }
    List<String> result = new ArrayList<String>();
    for (Object item : (List<?>) value) {
      if (item != null) {
        result.add(item.toString());
      }
    }
    return result;
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String key, String value) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown " + key + " '" + value + "'", e);
    }
  }

  @Override public String toString() {
    return "TableConfig{name='" + name + "', target='" + target + "', shape=" + shape
        + ", group=" + group + "}";
  }

  /**
   * Builder for TableConfig.
   */
  public static class Builder {
    private @Nullable String name;
    private @Nullable String target;
    private @Nullable String flagsTable;
    private @Nullable String seriesId;
    private ShapeMode shape = ShapeMode.AUTO;
    private Frequency frequency = Frequency.MONTHLY;
    private GroupKind group = GroupKind.YEAR;
    private String groupDimension = "localidade";
    private String captionDimension = "regiao";
    private @Nullable Integer fixedYear;
    private @Nullable String dateColumn;
    private @Nullable String valueColumn;
    private @Nullable String seriesColumn;
    private List<String> dimensionColumns = Collections.emptyList();
    private List<String> keyDimensions = Collections.emptyList();
    private Map<String, String> staticDimensions = Collections.emptyMap();
    private List<String> skipGroupLabels = ImmutableList.of("TOTAL", "LOCALIDADE");
    private @Nullable String sourceUrl;
    private @Nullable String sourceFile;
    private @Nullable String sheet;
    private int minYear = LocaleParsers.DEFAULT_MIN_YEAR;
    private int maxYear = LocaleParsers.DEFAULT_MAX_YEAR;
    private boolean zeroAsAbsent = true;

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder target(@Nullable String target) {
      this.target = target;
      return this;
    }

    public Builder flagsTable(@Nullable String flagsTable) {
      this.flagsTable = flagsTable;
      return this;
    }

    public Builder seriesId(@Nullable String seriesId) {
      this.seriesId = seriesId;
      return this;
    }

    public Builder shape(ShapeMode shape) {
      this.shape = shape;
      return this;
    }

    public Builder frequency(Frequency frequency) {
      this.frequency = frequency;
      return this;
    }

    public Builder group(GroupKind group) {
      this.group = group;
      return this;
    }

    public Builder groupDimension(String groupDimension) {
      this.groupDimension = groupDimension;
      return this;
    }

    public Builder captionDimension(String captionDimension) {
      this.captionDimension = captionDimension;
      return this;
    }

    public Builder fixedYear(@Nullable Integer fixedYear) {
      this.fixedYear = fixedYear;
      return this;
    }

    public Builder dateColumn(@Nullable String dateColumn) {
      this.dateColumn = dateColumn;
      return this;
    }

    public Builder valueColumn(@Nullable String valueColumn) {
      this.valueColumn = valueColumn;
      return this;
    }

    public Builder seriesColumn(@Nullable String seriesColumn) {
      this.seriesColumn = seriesColumn;
      return this;
    }

    public Builder dimensionColumns(List<String> dimensionColumns) {
      this.dimensionColumns = dimensionColumns;
      return this;
    }

    public Builder keyDimensions(List<String> keyDimensions) {
      this.keyDimensions = keyDimensions;
      return this;
    }

    public Builder staticDimensions(Map<String, String> staticDimensions) {
      this.staticDimensions = staticDimensions;
      return this;
    }

    public Builder skipGroupLabels(List<String> skipGroupLabels) {
      this.skipGroupLabels = skipGroupLabels;
      return this;
    }

    public Builder sourceUrl(@Nullable String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    public Builder sourceFile(@Nullable String sourceFile) {
      this.sourceFile = sourceFile;
      return this;
    }

    public Builder sheet(@Nullable String sheet) {
      this.sheet = sheet;
      return this;
    }

    public Builder minYear(int minYear) {
      this.minYear = minYear;
      return this;
    }

    public Builder maxYear(int maxYear) {
      this.maxYear = maxYear;
      return this;
    }

    public Builder zeroAsAbsent(boolean zeroAsAbsent) {
      this.zeroAsAbsent = zeroAsAbsent;
      return this;
    }

    public TableConfig build() {
      return new TableConfig(this);
    }
  }
}
