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

import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A fully typed fact after normalization.
 *
 * <p>The record key is the merge and deduplication key: a deterministic
 * composite of the series id, the ISO reference date and the values of the
 * key dimensions (all dimensions unless restricted), for example
 * {@code cub_medio_2023-01-01_SUDESTE}.
 *
 * <p>A null value is a known gap and is distinct from a parsed zero. The
 * variation fields are derived by the fact store merger and are never
 * carried from inputs. Provenance ({@code sourceUrl}, {@code ingestedAt})
 * and the derived variations take no part in equality.
 */
public final class CanonicalRecord {

  /** Orders records by series id, then reference date, then record key. */
  public static final Comparator<CanonicalRecord> SERIES_DATE_ORDER =
      Comparator.comparing(CanonicalRecord::getSeriesId)
          .thenComparing(CanonicalRecord::getReferenceDate)
          .thenComparing(CanonicalRecord::getRecordKey);

  private final String recordKey;
  private final String seriesId;
  private final LocalDate referenceDate;
  private final @Nullable Double value;
  private final ImmutableSortedMap<String, String> dimensions;
  private final @Nullable Double variationMom;
  private final @Nullable Double variationYoy;
  private final @Nullable String sourceUrl;
  private final @Nullable String ingestedAt;

  private CanonicalRecord(Builder builder) {
    this.seriesId = Objects.requireNonNull(builder.seriesId, "seriesId");
    this.referenceDate = Objects.requireNonNull(builder.referenceDate, "referenceDate");
    this.value = builder.value;
    this.dimensions = ImmutableSortedMap.copyOf(builder.dimensions);
    this.recordKey = builder.recordKey != null
        ? builder.recordKey
        : composeKey(seriesId, referenceDate, dimensions, builder.keyDimensions);
    this.variationMom = builder.variationMom;
    this.variationYoy = builder.variationYoy;
    this.sourceUrl = builder.sourceUrl;
    this.ingestedAt = builder.ingestedAt;
  }

  /**
   * Composes a record key.
   *
   * @param seriesId Series identifier
   * @param referenceDate Reference date
   * @param dimensions Dimension values
   * @param keyDimensions Dimension names that take part in the key, or null for all
   * @return Key such as {@code ipca_2024-01-01} or {@code cub_2024-01-01_SP}
   */
  public static String composeKey(String seriesId, LocalDate referenceDate,
      Map<String, String> dimensions, @Nullable Collection<String> keyDimensions) {
    StringBuilder sb = new StringBuilder();
    sb.append(seriesId).append('_').append(referenceDate);
    for (Map.Entry<String, String> entry : new TreeMap<String, String>(dimensions).entrySet()) {
      if (keyDimensions == null || keyDimensions.isEmpty()
          || keyDimensions.contains(entry.getKey())) {
        sb.append('_').append(entry.getValue());
      }
    }
    return sb.toString();
  }

  public String getRecordKey() {
    return recordKey;
  }

  public String getSeriesId() {
    return seriesId;
  }

  public LocalDate getReferenceDate() {
    return referenceDate;
  }

  public @Nullable Double getValue() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  public Map<String, String> getDimensions() {
    return dimensions;
  }

  public @Nullable Double getVariationMom() {
    return variationMom;
  }

  public @Nullable Double getVariationYoy() {
    return variationYoy;
  }

  public @Nullable String getSourceUrl() {
    return sourceUrl;
  }

  public @Nullable String getIngestedAt() {
    return ingestedAt;
  }

  /**
   * Returns the identity of the logical time series this record belongs to:
   * the series id plus its dimensions, without the date.
   */
  public String getSeriesKey() {
    if (dimensions.isEmpty()) {
      return seriesId;
    }
    return seriesId + dimensions;
  }

  /**
   * Returns a copy carrying the given derived variations.
   */
  public CanonicalRecord withVariations(@Nullable Double mom, @Nullable Double yoy) {
    return toBuilder().variationMom(mom).variationYoy(yoy).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .recordKey(recordKey)
        .seriesId(seriesId)
        .referenceDate(referenceDate)
        .value(value)
        .dimensions(dimensions)
        .variationMom(variationMom)
        .variationYoy(variationYoy)
        .sourceUrl(sourceUrl)
        .ingestedAt(ingestedAt);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalRecord)) {
      return false;
    }
    CanonicalRecord that = (CanonicalRecord) o;
    return recordKey.equals(that.recordKey)
        && seriesId.equals(that.seriesId)
        && referenceDate.equals(that.referenceDate)
        && Objects.equals(value, that.value)
        && dimensions.equals(that.dimensions);
  }

  @Override public int hashCode() {
    return Objects.hash(recordKey, seriesId, referenceDate, value, dimensions);
  }

  @Override public String toString() {
    return "CanonicalRecord{" + recordKey + ", value=" + value
        + (dimensions.isEmpty() ? "" : ", dimensions=" + dimensions) + "}";
  }

  /**
   * Builder for {@link CanonicalRecord}.
   */
  public static final class Builder {
    private @Nullable String recordKey;
    private @Nullable String seriesId;
    private @Nullable LocalDate referenceDate;
    private @Nullable Double value;
    private final Map<String, String> dimensions = new TreeMap<String, String>();
    private @Nullable Collection<String> keyDimensions;
    private @Nullable Double variationMom;
    private @Nullable Double variationYoy;
    private @Nullable String sourceUrl;
    private @Nullable String ingestedAt;

    private Builder() {
    }

    /** Sets an explicit key; when absent the key is composed on build. */
    public Builder recordKey(@Nullable String recordKey) {
      this.recordKey = recordKey;
      return this;
    }

    public Builder seriesId(String seriesId) {
      this.seriesId = seriesId;
      return this;
    }

    public Builder referenceDate(LocalDate referenceDate) {
      this.referenceDate = referenceDate;
      return this;
    }

    public Builder value(@Nullable Double value) {
      this.value = value;
      return this;
    }

    public Builder dimension(String name, String value) {
      this.dimensions.put(name, value);
      return this;
    }

    public Builder dimensions(Map<String, String> dimensions) {
      this.dimensions.putAll(dimensions);
      return this;
    }

    /** Restricts which dimensions take part in a composed key. */
    public Builder keyDimensions(@Nullable Collection<String> keyDimensions) {
      this.keyDimensions = keyDimensions;
      return this;
    }

    public Builder variationMom(@Nullable Double variationMom) {
      this.variationMom = variationMom;
      return this;
    }

    public Builder variationYoy(@Nullable Double variationYoy) {
      this.variationYoy = variationYoy;
      return this;
    }

    public Builder sourceUrl(@Nullable String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    public Builder ingestedAt(@Nullable String ingestedAt) {
      this.ingestedAt = ingestedAt;
      return this;
    }

    public CanonicalRecord build() {
      return new CanonicalRecord(this);
    }
  }
}
