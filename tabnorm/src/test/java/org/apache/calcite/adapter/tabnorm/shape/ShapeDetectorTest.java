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

import org.apache.calcite.adapter.tabnorm.RawTable;
import org.apache.calcite.adapter.tabnorm.TableConfig;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ShapeDetector.
 */
@Tag("unit")
public class ShapeDetectorTest {

  private final ShapeDetector detector = new ShapeDetector();
  private final TableConfig config = TableConfig.builder("t").build();

  static RawTable table(String[]... rows) {
    List<List<String>> cells = new ArrayList<List<String>>();
    for (String[] row : rows) {
      cells.add(Arrays.asList(row));
    }
    return RawTable.of("t", null, cells);
  }

  @Test void testMonthHeaderAcrossColumns() {
    RawTable raw = table(
        new String[] {"Fonte: CBIC", "", "", ""},
        new String[] {"ANO", "JAN", "FEV", "MAR"},
        new String[] {"2023", "1", "2", "3"});

    TableShape shape = detector.detect(raw, config);

    assertEquals(TableShape.Kind.WIDE, shape.getKind());
    TableShape.Wide wide = shape.asWide();
    assertEquals(TableShape.PeriodAxis.ACROSS_COLUMNS, wide.getAxis());
    assertEquals(1, wide.getHeaderRowIndex());
    assertEquals(3, wide.getMonthByColumn().size());
    assertEquals(Integer.valueOf(2), wide.getMonthByColumn().get(2));
  }

  @Test void testMonthColumnDownRows() {
    RawTable raw = table(
        new String[] {"2023", "JAN", "1.200,00"},
        new String[] {"", "FEV", "1.215,00"});

    TableShape.Wide wide = detector.detect(raw, config).asWide();

    assertEquals(TableShape.PeriodAxis.DOWN_ROWS, wide.getAxis());
    assertEquals(1, wide.getPeriodColumn());
    assertEquals(2, wide.getValueColumn());
  }

  @Test void testMonthColumnNeedsYearOrLabelGroups() {
    RawTable raw = table(
        new String[] {"Norte", "JAN", "1"},
        new String[] {"Sul", "FEV", "2"});

    assertEquals(TableShape.Kind.UNRECOGNIZED, detector.detect(raw, config).getKind());

    TableConfig labels = TableConfig.builder("t").group(TableConfig.GroupKind.LABEL).build();
    assertEquals(TableShape.PeriodAxis.DOWN_ROWS,
        detector.detect(raw, labels).asWide().getAxis());
  }

  @Test void testTallHeader() {
    RawTable raw = table(
        new String[] {"Relatório mensal"},
        new String[] {"Data", "Valor", "UF"},
        new String[] {"2024-01-01", "10,5", "SP"});

    TableShape.Tall tall = detector.detect(raw, config).asTall();

    assertEquals(1, tall.getHeaderRowIndex());
    assertEquals(0, tall.getDateColumn());
    assertEquals(1, tall.getValueColumn());
    assertEquals(-1, tall.getSeriesColumn());
    assertEquals(Arrays.asList("data", "valor", "uf"), tall.getColumns());
  }

  @Test void testConfiguredTallColumns() {
    RawTable raw = table(
        new String[] {"Período", "Índice", "Série"},
        new String[] {"01/2024", "101,2", "incc"});
    TableConfig tallConfig = TableConfig.builder("t")
        .dateColumn("Período")
        .valueColumn("Índice")
        .seriesColumn("Série")
        .build();

    TableShape.Tall tall = detector.detect(raw, tallConfig).asTall();

    assertEquals(0, tall.getDateColumn());
    assertEquals(1, tall.getValueColumn());
    assertEquals(2, tall.getSeriesColumn());
  }

  @Test void testForcedShape() {
    RawTable wideTable = table(
        new String[] {"ANO", "JAN", "FEV"},
        new String[] {"2023", "1", "2"});
    TableConfig forcedTall = TableConfig.builder("t").shape(TableConfig.ShapeMode.TALL).build();

    TableShape shape = detector.detect(wideTable, forcedTall);

    assertEquals(TableShape.Kind.UNRECOGNIZED, shape.getKind());
    assertTrue(shape.asUnrecognized().getReason().contains("first 2 rows"));
  }

  @Test void testScanLimit() {
    RawTable raw = table(
        new String[] {"a"},
        new String[] {"b"},
        new String[] {"c"},
        new String[] {"ANO", "JAN", "FEV"},
        new String[] {"2023", "1", "2"});

    assertEquals(TableShape.Kind.UNRECOGNIZED, new ShapeDetector(3).detect(raw, config).getKind());
    assertEquals(TableShape.Kind.WIDE, new ShapeDetector(4).detect(raw, config).getKind());
  }

  @Test void testEmptyTable() {
    TableShape shape = detector.detect(RawTable.empty("t"), config);
    assertEquals(TableShape.Kind.UNRECOGNIZED, shape.getKind());
    assertThrows(IllegalStateException.class, shape::asWide);
  }

  @Test void testInvalidScanRows() {
    assertThrows(IllegalArgumentException.class, () -> new ShapeDetector(0));
  }
}
