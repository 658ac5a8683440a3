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

import java.io.IOException;
import java.util.List;

/**
 * A store of named tables of text cells, such as a spreadsheet with one tab
 * per table.
 *
 * <p>The first row of every table is its header. Cells are plain strings;
 * callers encode and decode typed values. Implementations may be remote and
 * rate-limited; failures surface as {@link IOException}, and quota failures
 * as {@link StoreQuotaException}.
 */
public interface SpreadsheetStore {

  /**
   * Reads a whole table, header row first.
   *
   * @param name Table name
   * @return The table, or an empty table if it does not exist
   * @throws IOException If the store cannot be read
   */
  RawTable readTable(String name) throws IOException;

  /**
   * Replaces the whole content of a table, creating it if needed.
   *
   * @param name Table name
   * @param rows Header row followed by data rows
   * @throws IOException If the store cannot be written
   */
  void writeTable(String name, List<List<String>> rows) throws IOException;

  /**
   * Appends rows at the end of a table, creating it if needed.
   *
   * @param name Table name
   * @param rows Rows to append; when the table is created the first row is its header
   * @throws IOException If the store cannot be written
   */
  void appendRows(String name, List<List<String>> rows) throws IOException;

  /**
   * Checks if a table exists.
   *
   * @param name Table name
   * @return true if the table exists
   * @throws IOException If the store cannot be read
   */
  boolean hasTable(String name) throws IOException;

  /**
   * Gets the store type identifier.
   *
   * @return Store type (e.g., "memory", "workbook")
   */
  String getStoreType();
}
