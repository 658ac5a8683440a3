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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for QualityConfig.
 */
@Tag("unit")
public class QualityConfigTest {

  @Test void testDefaults() {
    QualityConfig config = QualityConfig.defaults();
    for (QualityFlag.Kind kind : QualityFlag.Kind.values()) {
      assertTrue(config.isEnabled(kind));
    }
    assertEquals(3.0, config.getZScoreThreshold(), 0.0);
    assertEquals(4.0, config.getZScoreHighThreshold(), 0.0);
    assertEquals(0.10, config.getVariationThreshold(), 0.0);
    assertEquals(0.25, config.getVariationHighThreshold(), 0.0);
    assertEquals(5, config.getConstantMinPoints());
    assertTrue(config.getNonNegativeSeries().isEmpty());
    assertSame(config, QualityConfig.fromMap(null));
  }

  @Test void testFromMap() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("checks", Arrays.asList("outlier", "FUTURE_DATE"));
    map.put("zScoreThreshold", 2.5);
    map.put("variationThreshold", "0.2");
    map.put("constantMinPoints", 10);
    map.put("nonNegativeSeries", Arrays.asList("cub_medio_br"));

    QualityConfig config = QualityConfig.fromMap(map);

    assertTrue(config.isEnabled(QualityFlag.Kind.OUTLIER));
    assertTrue(config.isEnabled(QualityFlag.Kind.FUTURE_DATE));
    assertFalse(config.isEnabled(QualityFlag.Kind.HIGH_VARIATION));
    assertEquals(2.5, config.getZScoreThreshold(), 0.0);
    assertEquals(4.0, config.getZScoreHighThreshold(), 0.0);
    assertEquals(0.2, config.getVariationThreshold(), 0.0);
    assertEquals(10, config.getConstantMinPoints());
    assertTrue(config.getNonNegativeSeries().contains("cub_medio_br"));
  }

  @Test void testDisable() {
    QualityConfig config = QualityConfig.builder().disable(QualityFlag.Kind.OUTLIER).build();
    assertFalse(config.isEnabled(QualityFlag.Kind.OUTLIER));
    assertTrue(config.isEnabled(QualityFlag.Kind.CONSTANT_SERIES));
  }

  @Test void testInvalidValues() {
    Map<String, Object> inverted = new HashMap<String, Object>();
    inverted.put("zScoreHighThreshold", 2);
    assertThrows(IllegalArgumentException.class, () -> QualityConfig.fromMap(inverted));

    Map<String, Object> unknown = new HashMap<String, Object>();
    unknown.put("checks", Arrays.asList("SPELLING"));
    assertThrows(IllegalArgumentException.class, () -> QualityConfig.fromMap(unknown));

    Map<String, Object> notNumber = new HashMap<String, Object>();
    notNumber.put("variationThreshold", "ten percent");
    assertThrows(IllegalArgumentException.class, () -> QualityConfig.fromMap(notNumber));
  }
}
