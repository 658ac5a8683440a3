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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for CanonicalRecord.
 */
@Tag("unit")
public class CanonicalRecordTest {

  private static final LocalDate JAN_2024 = LocalDate.of(2024, 1, 1);

  @Test void testKeyWithoutDimensions() {
    CanonicalRecord record = CanonicalRecord.builder()
        .seriesId("ipca")
        .referenceDate(JAN_2024)
        .value(0.42)
        .build();

    assertEquals("ipca_2024-01-01", record.getRecordKey());
    assertEquals("ipca", record.getSeriesKey());
  }

  @Test void testKeyUsesDimensionsInNameOrder() {
    CanonicalRecord record = CanonicalRecord.builder()
        .seriesId("cub")
        .referenceDate(JAN_2024)
        .dimension("uf", "SP")
        .dimension("padrao", "R8N")
        .build();

    assertEquals("cub_2024-01-01_R8N_SP", record.getRecordKey());
    assertEquals("cub{padrao=R8N, uf=SP}", record.getSeriesKey());
  }

  @Test void testKeyDimensionsRestrictKey() {
    CanonicalRecord record = CanonicalRecord.builder()
        .seriesId("cimento")
        .referenceDate(JAN_2024)
        .dimensions(ImmutableMap.of("localidade", "SP", "fonte", "CBIC"))
        .keyDimensions(ImmutableList.of("localidade"))
        .build();

    assertEquals("cimento_2024-01-01_SP", record.getRecordKey());
    assertEquals(2, record.getDimensions().size());
  }

  @Test void testEqualityIgnoresProvenanceAndVariations() {
    CanonicalRecord a = CanonicalRecord.builder()
        .seriesId("cub")
        .referenceDate(JAN_2024)
        .value(1200.0)
        .sourceUrl("http://a")
        .ingestedAt("2024-01-01 00:00:00")
        .build();
    CanonicalRecord b = a.toBuilder()
        .sourceUrl("http://b")
        .ingestedAt("2024-06-01 00:00:00")
        .build()
        .withVariations(0.01, 0.05);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(0.01, b.getVariationMom(), 0.0);
    assertNull(a.getVariationMom());
    assertNotEquals(a, a.toBuilder().value(1201.0).build());
  }
}
