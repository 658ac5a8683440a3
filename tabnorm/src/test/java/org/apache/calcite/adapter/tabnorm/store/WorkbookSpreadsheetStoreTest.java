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
package org.apache.calcite.adapter.tabnorm.store;

import org.apache.calcite.adapter.tabnorm.RawTable;

import com.google.common.collect.ImmutableList;

import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for WorkbookSpreadsheetStore.
 */
@Tag("unit")
public class WorkbookSpreadsheetStoreTest {

  @TempDir
  Path tempDir;

  private static final List<List<String>> FACTS = ImmutableList.<List<String>>of(
      ImmutableList.of("record_key", "series_id", "value"),
      ImmutableList.of("cub_2023-01-01", "cub", "1200.0"),
      ImmutableList.of("cub_2023-02-01", "cub", ""));

  @Test void testMissingFile() throws IOException {
    WorkbookSpreadsheetStore store = new WorkbookSpreadsheetStore(tempDir.resolve("store.xlsx"));

    assertFalse(store.hasTable("fact_cub"));
    assertTrue(store.readTable("fact_cub").isEmpty());
    assertEquals("workbook", store.getStoreType());
  }

  @Test void testWriteAndRead() throws IOException {
    Path path = tempDir.resolve("data").resolve("store.xlsx");
    WorkbookSpreadsheetStore store = new WorkbookSpreadsheetStore(path);

    store.writeTable("fact_cub", FACTS);

    assertTrue(Files.exists(path));
    assertTrue(store.hasTable("fact_cub"));
    RawTable table = store.readTable("fact_cub");
    assertEquals(3, table.rowCount());
    assertEquals(FACTS.get(1), table.getRows().get(1).getCells());
    assertEquals("", table.getRows().get(2).cell(2));
    assertEquals(path.toUri().toString(), table.getSourceUrl());
  }

  @Test void testRewriteReplacesAndKeepsSheetOrder() throws IOException {
    Path path = tempDir.resolve("store.xlsx");
    WorkbookSpreadsheetStore store = new WorkbookSpreadsheetStore(path);
    store.writeTable("fact_cub", FACTS);
    store.writeTable("fact_cimento", FACTS);

    store.writeTable("fact_cub", FACTS.subList(0, 2));

    assertEquals(2, store.readTable("fact_cub").rowCount());
    assertEquals(3, store.readTable("fact_cimento").rowCount());
    try (InputStream in = Files.newInputStream(path);
         Workbook workbook = WorkbookFactory.create(in)) {
      assertEquals(0, workbook.getSheetIndex("fact_cub"));
      assertEquals(1, workbook.getSheetIndex("fact_cimento"));
    }
  }

  @Test void testAppend() throws IOException {
    WorkbookSpreadsheetStore store = new WorkbookSpreadsheetStore(tempDir.resolve("store.xlsx"));

    store.appendRows("_ingestion_log", FACTS.subList(0, 2));
    store.appendRows("_ingestion_log", FACTS.subList(2, 3));

    RawTable table = store.readTable("_ingestion_log");
    assertEquals(3, table.rowCount());
    assertEquals("record_key", table.getRows().get(0).cell(0));
    assertEquals("cub_2023-02-01", table.getRows().get(2).cell(0));
  }

  @Test void testInvalidSheetName() {
    WorkbookSpreadsheetStore store = new WorkbookSpreadsheetStore(tempDir.resolve("store.xlsx"));
    assertThrows(IllegalArgumentException.class, () -> store.writeTable("a/b", FACTS));
  }
}
