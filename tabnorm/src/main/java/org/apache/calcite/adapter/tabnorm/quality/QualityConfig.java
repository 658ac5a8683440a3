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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Thresholds and toggles for {@link QualityEngine}.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * quality:
 *   checks: [OUTLIER, HIGH_VARIATION, NEGATIVE_VALUE, FUTURE_DATE, CONSTANT_SERIES]
 *   zScoreThreshold: 3.0
 *   zScoreHighThreshold: 4.0
 *   variationThreshold: 0.10
 *   variationHighThreshold: 0.25
 *   constantShareThreshold: 0.5
 *   constantMinPoints: 5
 *   outlierMinPoints: 3
 *   nonNegativeSeries: [cub_medio_br, consumo_cimento]
 * }</pre>
 */
public class QualityConfig {

  private static final QualityConfig DEFAULTS = builder().build();

  private final Set<QualityFlag.Kind> checks;
  private final double zScoreThreshold;
  private final double zScoreHighThreshold;
  private final double variationThreshold;
  private final double variationHighThreshold;
  private final double constantShareThreshold;
  private final int constantMinPoints;
  private final int outlierMinPoints;
  private final Set<String> nonNegativeSeries;

  private QualityConfig(Builder builder) {
    if (builder.zScoreHighThreshold < builder.zScoreThreshold) {
      throw new IllegalArgumentException("zScoreHighThreshold " + builder.zScoreHighThreshold
          + " is below zScoreThreshold " + builder.zScoreThreshold);
    }
    if (builder.variationHighThreshold < builder.variationThreshold) {
      throw new IllegalArgumentException("variationHighThreshold "
          + builder.variationHighThreshold + " is below variationThreshold "
          + builder.variationThreshold);
    }
    this.checks = Sets.immutableEnumSet(builder.checks);
    this.zScoreThreshold = builder.zScoreThreshold;
    this.zScoreHighThreshold = builder.zScoreHighThreshold;
    this.variationThreshold = builder.variationThreshold;
    this.variationHighThreshold = builder.variationHighThreshold;
    this.constantShareThreshold = builder.constantShareThreshold;
    this.constantMinPoints = builder.constantMinPoints;
    this.outlierMinPoints = builder.outlierMinPoints;
    this.nonNegativeSeries = ImmutableSet.copyOf(builder.nonNegativeSeries);
  }

  /**
   * Returns the configuration with every check enabled and default thresholds.
   */
  public static QualityConfig defaults() {
    return DEFAULTS;
  }

  public boolean isEnabled(QualityFlag.Kind kind) {
    return checks.contains(kind);
  }

  public Set<QualityFlag.Kind> getChecks() {
    return checks;
  }

  /** z-score above which a value is an outlier; default 3.0. */
  public double getZScoreThreshold() {
    return zScoreThreshold;
  }

  /** z-score above which an outlier is HIGH severity; default 4.0. */
  public double getZScoreHighThreshold() {
    return zScoreHighThreshold;
  }

  /** Absolute relative change above which a step is flagged; default 0.10. */
  public double getVariationThreshold() {
    return variationThreshold;
  }

  /** Absolute relative change above which a step is HIGH severity; default 0.25. */
  public double getVariationHighThreshold() {
    return variationHighThreshold;
  }

  /** Share of the most frequent value above which a series is constant; default 0.5. */
  public double getConstantShareThreshold() {
    return constantShareThreshold;
  }

  public int getConstantMinPoints() {
    return constantMinPoints;
  }

  public int getOutlierMinPoints() {
    return outlierMinPoints;
  }

  /** Series ids whose values must not be negative. */
  public Set<String> getNonNegativeSeries() {
    return nonNegativeSeries;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a QualityConfig from a YAML/JSON map; missing keys take defaults.
   *
   * @param map Configuration map, may be null
   * @return QualityConfig instance
   * @throws IllegalArgumentException if a value has the wrong type or names an unknown check
   */
  public static QualityConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return DEFAULTS;
    }
    Builder builder = builder();
    Object checks = map.get("checks");
    if (checks instanceof List) {
      EnumSet<QualityFlag.Kind> kinds = EnumSet.noneOf(QualityFlag.Kind.class);
      for (Object item : (List<?>) checks) {
        try {
          kinds.add(QualityFlag.Kind.valueOf(item.toString().trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Unknown quality check '" + item + "'", e);
        }
      }
      builder.checks(kinds);
    } else if (checks != null) {
      throw new IllegalArgumentException("'checks' must be a list");
    }

    Double d = doubleValue(map, "zScoreThreshold");
    if (d != null) {
      builder.zScoreThreshold(d);
    }
    d = doubleValue(map, "zScoreHighThreshold");
    if (d != null) {
      builder.zScoreHighThreshold(d);
    }
    d = doubleValue(map, "variationThreshold");
    if (d != null) {
      builder.variationThreshold(d);
    }
    d = doubleValue(map, "variationHighThreshold");
    if (d != null) {
      builder.variationHighThreshold(d);
    }
    d = doubleValue(map, "constantShareThreshold");
    if (d != null) {
      builder.constantShareThreshold(d);
    }
    d = doubleValue(map, "constantMinPoints");
    if (d != null) {
      builder.constantMinPoints(d.intValue());
    }
    d = doubleValue(map, "outlierMinPoints");
    if (d != null) {
      builder.outlierMinPoints(d.intValue());
    }

    Object series = map.get("nonNegativeSeries");
    if (series instanceof List) {
      ImmutableSet.Builder<String> ids = ImmutableSet.builder();
      for (Object item : (List<?>) series) {
        if (item != null) {
          ids.add(item.toString());
        }
      }
      builder.nonNegativeSeries(ids.build());
    } else if (series != null) {
      throw new IllegalArgumentException("'nonNegativeSeries' must be a list");
    }
    return builder.build();
  }

  private static @Nullable Double doubleValue(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be a number: " + value, e);
    }
  }

  @Override public String toString() {
    return "QualityConfig{checks=" + checks + ", z=" + zScoreThreshold + "/"
        + zScoreHighThreshold + ", variation=" + variationThreshold + "/"
        + variationHighThreshold + "}";
  }

  /**
   * Builder for QualityConfig.
   */
  public static class Builder {
    private EnumSet<QualityFlag.Kind> checks = EnumSet.allOf(QualityFlag.Kind.class);
    private double zScoreThreshold = 3.0;
    private double zScoreHighThreshold = 4.0;
    private double variationThreshold = 0.10;
    private double variationHighThreshold = 0.25;
    private double constantShareThreshold = 0.5;
    private int constantMinPoints = 5;
    private int outlierMinPoints = 3;
    private Collection<String> nonNegativeSeries = Collections.emptySet();

    public Builder checks(Collection<QualityFlag.Kind> checks) {
      this.checks = checks.isEmpty()
          ? EnumSet.noneOf(QualityFlag.Kind.class)
          : EnumSet.copyOf(checks);
      return this;
    }

    public Builder disable(QualityFlag.Kind kind) {
      this.checks.remove(kind);
      return this;
    }

    public Builder zScoreThreshold(double zScoreThreshold) {
      this.zScoreThreshold = zScoreThreshold;
      return this;
    }

    public Builder zScoreHighThreshold(double zScoreHighThreshold) {
      this.zScoreHighThreshold = zScoreHighThreshold;
      return this;
    }

    public Builder variationThreshold(double variationThreshold) {
      this.variationThreshold = variationThreshold;
      return this;
    }

    public Builder variationHighThreshold(double variationHighThreshold) {
      this.variationHighThreshold = variationHighThreshold;
      return this;
    }

    public Builder constantShareThreshold(double constantShareThreshold) {
      this.constantShareThreshold = constantShareThreshold;
      return this;
    }

    public Builder constantMinPoints(int constantMinPoints) {
      this.constantMinPoints = constantMinPoints;
      return this;
    }

    public Builder outlierMinPoints(int outlierMinPoints) {
      this.outlierMinPoints = outlierMinPoints;
      return this;
    }

    public Builder nonNegativeSeries(Collection<String> nonNegativeSeries) {
      this.nonNegativeSeries = nonNegativeSeries;
      return this;
    }

    public QualityConfig build() {
      return new QualityConfig(this);
    }
  }
}
