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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for InMemorySpreadsheetStore.
 */
@Tag("unit")
public class InMemorySpreadsheetStoreTest {

  @Test void testWriteReadAppend() throws Exception {
    InMemorySpreadsheetStore store = new InMemorySpreadsheetStore();
    assertFalse(store.hasTable("t"));
    assertTrue(store.readTable("t").isEmpty());

    store.writeTable("t", ImmutableList.<List<String>>of(
        ImmutableList.of("a", "b"),
        ImmutableList.of("1", "2")));
    store.appendRows("t", ImmutableList.<List<String>>of(ImmutableList.of("3", "4")));

    RawTable table = store.readTable("t");
    assertTrue(store.hasTable("t"));
    assertEquals(3, table.rowCount());
    assertEquals(ImmutableList.of("3", "4"), table.getRows().get(2).getCells());
    assertEquals("memory", store.getStoreType());
    assertEquals(6, store.totalCells());
  }

  @Test void testRowsAreCopied() throws Exception {
    InMemorySpreadsheetStore store = new InMemorySpreadsheetStore();
    List<String> row = new ArrayList<String>(ImmutableList.of("x"));
    List<List<String>> rows = new ArrayList<List<String>>();
    rows.add(row);

    store.writeTable("t", rows);
    row.set(0, "changed");

    assertEquals("x", store.rows("t").get(0).get(0));
  }

  @Test void testCellQuota() throws Exception {
    InMemorySpreadsheetStore store = new InMemorySpreadsheetStore(6);
    store.writeTable("t", ImmutableList.<List<String>>of(
        ImmutableList.of("a", "b"),
        ImmutableList.of("1", "2")));

    assertThrows(StoreQuotaException.class,
        () -> store.appendRows("t",
            ImmutableList.<List<String>>of(ImmutableList.of("3", "4", "5"))));
    assertEquals(2, store.rows("t").size());

    // replacing a table only counts the difference
    store.writeTable("t", ImmutableList.<List<String>>of(
        ImmutableList.of("a", "b"),
        ImmutableList.of("1", "2"),
        ImmutableList.of("3", "4")));
    assertEquals(6, store.totalCells());

    assertThrows(StoreQuotaException.class,
        () -> store.writeTable("u", ImmutableList.<List<String>>of(ImmutableList.of("z"))));
    assertFalse(store.hasTable("u"));
  }

  @Test void testInvalidQuota() {
    assertThrows(IllegalArgumentException.class, () -> new InMemorySpreadsheetStore(0));
  }
}
