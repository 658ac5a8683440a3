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
package org.apache.calcite.adapter.tabnorm.merge;

import org.apache.calcite.adapter.tabnorm.CanonicalRecord;
import org.apache.calcite.adapter.tabnorm.RawTable;
import org.apache.calcite.adapter.tabnorm.TabNormException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CanonicalRecordCodec.
 */
@Tag("unit")
public class CanonicalRecordCodecTest {

  private static final CanonicalRecord SP = CanonicalRecord.builder()
      .seriesId("cub")
      .referenceDate(LocalDate.of(2023, 2, 1))
      .value(1215.0)
      .dimension("uf", "SP")
      .variationMom(0.0125)
      .sourceUrl("http://www.cbicdados.com.br/cub")
      .ingestedAt("2024-06-15 12:00:00")
      .build();

  private static final CanonicalRecord NORTE = CanonicalRecord.builder()
      .seriesId("cub")
      .referenceDate(LocalDate.of(2023, 2, 1))
      .value(null)
      .dimension("regiao", "NORTE")
      .build();

  @Test void testEncode() {
    List<List<String>> rows = CanonicalRecordCodec.encode(ImmutableList.of(SP, NORTE));

    assertEquals(3, rows.size());
    assertEquals(
        ImmutableList.of("record_key", "series_id", "reference_date", "value", "variation_mom",
            "variation_yoy", "regiao", "uf", "source_url", "ingested_at"),
        rows.get(0));
    assertEquals(
        ImmutableList.of("cub_2023-02-01_SP", "cub", "2023-02-01", "1215.0", "0.0125", "", "",
            "SP", "http://www.cbicdados.com.br/cub", "2024-06-15 12:00:00"),
        rows.get(1));
    assertEquals("", rows.get(2).get(3));
  }

  @Test void testDecodeEncoded() {
    List<CanonicalRecord> records = ImmutableList.of(SP, NORTE);
    RawTable table = RawTable.of("fact_cub", null, CanonicalRecordCodec.encode(records));

    List<CanonicalRecord> decoded = CanonicalRecordCodec.decode(table);

    assertEquals(records, decoded);
    assertEquals(0.0125, decoded.get(0).getVariationMom(), 0.0);
    assertEquals("2024-06-15 12:00:00", decoded.get(0).getIngestedAt());
    assertNull(decoded.get(1).getSourceUrl());
  }

  @Test void testDecodeHandEditedTable() {
    RawTable table = RawTable.of("fact_cub", null, ImmutableList.of(
        ImmutableList.of("RECORD_KEY", "Series_Id", "reference_date", "value", "uf"),
        ImmutableList.of("cub_2023-01-01_SP", "cub", "01/2023", "1.234,56", "SP"),
        ImmutableList.of("", "cub", "2023-02-01", "1", "SP"),
        ImmutableList.of("cub_x", "cub", "not a date", "1", "SP")));

    List<CanonicalRecord> decoded = CanonicalRecordCodec.decode(table);

    assertEquals(1, decoded.size());
    CanonicalRecord record = decoded.get(0);
    assertEquals("cub_2023-01-01_SP", record.getRecordKey());
    assertEquals(LocalDate.of(2023, 1, 1), record.getReferenceDate());
    assertEquals(1234.56, record.getValue(), 1e-9);
    assertEquals("SP", record.getDimensions().get("uf"));
  }

  @Test void testDecodeKeepsDimensionNames() {
    RawTable table = RawTable.of("fact_cub", null, ImmutableList.of(
        ImmutableList.of("Record_Key", "SERIES_ID", "Reference_Date", "Value", "UF", "Padrao",
            "UF"),
        ImmutableList.of("cub_2023-01-01_R8N_SP", "cub", "2023-01-01", "100", "SP", "R8N",
            "RJ")));

    CanonicalRecord record = CanonicalRecordCodec.decode(table).get(0);

    assertEquals(ImmutableMap.of("Padrao", "R8N", "UF", "SP"), record.getDimensions());
    assertEquals(100.0, record.getValue(), 0.0);
  }

  @Test void testDecodeEmptyTable() {
    assertTrue(CanonicalRecordCodec.decode(RawTable.empty("fact_cub")).isEmpty());
  }

  @Test void testDecodeRequiresKeyColumns() {
    RawTable table = RawTable.of("fact_cub", null, ImmutableList.of(
        ImmutableList.of("record_key", "reference_date", "value"),
        ImmutableList.of("k", "2023-01-01", "1")));

    TabNormException e =
        assertThrows(TabNormException.class, () -> CanonicalRecordCodec.decode(table));
    assertTrue(e.getMessage().contains("series_id"), e.getMessage());
  }

  @Test void testNumbers() {
    assertEquals("", CanonicalRecordCodec.formatNumber(null));
    assertEquals("", CanonicalRecordCodec.formatNumber(Double.NaN));
    assertEquals("0.0125", CanonicalRecordCodec.formatNumber(0.0125));
    assertEquals("0.00015", CanonicalRecordCodec.formatNumber(1.5E-4));
    assertEquals(1.5E-4, CanonicalRecordCodec.parseNumber("1.5E-4"), 0.0);
    assertEquals(1234.5, CanonicalRecordCodec.parseNumber("1234.5"), 0.0);
    assertEquals(1234.5, CanonicalRecordCodec.parseNumber("1.234,5"), 0.0);
    assertNull(CanonicalRecordCodec.parseNumber(" "));
  }
}
