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

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Store backed by a single local {@code .xlsx} workbook with one sheet per
 * table.
 *
 * <p>All cells are written as text. Every mutation rewrites the workbook to a
 * temporary file next to it and then moves it into place, so a crash never
 * leaves a half-written workbook behind.
 */
public class WorkbookSpreadsheetStore implements SpreadsheetStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkbookSpreadsheetStore.class);

  private final Path path;

  public WorkbookSpreadsheetStore(Path path) {
    this.path = path;
  }

  public Path getPath() {
    return path;
  }

  @Override public synchronized RawTable readTable(String name) throws IOException {
    if (!Files.exists(path)) {
      return RawTable.empty(name);
    }
    try (Workbook workbook = open()) {
      Sheet sheet = workbook.getSheet(name);
      if (sheet == null) {
        return RawTable.empty(name);
      }
      List<List<String>> rows = new ArrayList<List<String>>();
      for (int i = 0; i <= sheet.getLastRowNum(); i++) {
        Row row = sheet.getRow(i);
        List<String> cells = new ArrayList<String>();
        if (row != null) {
          for (int j = 0; j < row.getLastCellNum(); j++) {
            cells.add(cellText(row.getCell(j)));
          }
        }
        rows.add(cells);
      }
      LOGGER.debug("Read {} rows from sheet '{}' of {}", rows.size(), name, path);
      return RawTable.of(name, path.toUri().toString(), rows);
    }
  }

  @Override public synchronized void writeTable(String name, List<List<String>> rows)
      throws IOException {
    WorkbookUtil.validateSheetName(name);
    try (Workbook workbook = openOrCreate()) {
      int index = workbook.getSheetIndex(name);
      if (index >= 0) {
        workbook.removeSheetAt(index);
      }
      Sheet sheet = workbook.createSheet(name);
      if (index >= 0) {
        workbook.setSheetOrder(name, index);
      }
      writeRows(sheet, 0, rows);
      save(workbook);
    }
    LOGGER.debug("Wrote {} rows to sheet '{}' of {}", rows.size(), name, path);
  }

  @Override public synchronized void appendRows(String name, List<List<String>> rows)
      throws IOException {
    WorkbookUtil.validateSheetName(name);
    try (Workbook workbook = openOrCreate()) {
      Sheet sheet = workbook.getSheet(name);
      if (sheet == null) {
        sheet = workbook.createSheet(name);
      }
      int start = sheet.getPhysicalNumberOfRows() == 0 ? 0 : sheet.getLastRowNum() + 1;
      writeRows(sheet, start, rows);
      save(workbook);
    }
    LOGGER.debug("Appended {} rows to sheet '{}' of {}", rows.size(), name, path);
  }

  @Override public synchronized boolean hasTable(String name) throws IOException {
    if (!Files.exists(path)) {
      return false;
    }
    try (Workbook workbook = open()) {
      return workbook.getSheet(name) != null;
    }
  }

  @Override public String getStoreType() {
    return "workbook";
  }

  private Workbook open() throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return WorkbookFactory.create(in);
    }
  }

  private Workbook openOrCreate() throws IOException {
    return Files.exists(path) ? open() : new XSSFWorkbook();
  }

  private void save(Workbook workbook) throws IOException {
    Path dir = path.toAbsolutePath().getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }
    Path temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp)) {
        workbook.write(out);
      }
      try {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static void writeRows(Sheet sheet, int start, List<List<String>> rows) {
    int r = start;
    for (List<String> values : rows) {
      Row row = sheet.createRow(r++);
      for (int c = 0; c < values.size(); c++) {
        String value = values.get(c);
        row.createCell(c).setCellValue(value == null ? "" : value);
      }
    }
  }

  /**
   * Renders a cell as text. Text cells come back unchanged; numeric cells
   * typed in by hand are rendered in plain decimal notation.
   */
  private static String cellText(@Nullable Cell cell) {
    if (cell == null) {
      return "";
    }
    switch (cell.getCellType()) {
    case STRING:
      return cell.getStringCellValue();
    case NUMERIC:
      return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros()
          .toPlainString();
    case BOOLEAN:
      return String.valueOf(cell.getBooleanCellValue());
    case FORMULA:
      switch (cell.getCachedFormulaResultType()) {
      case NUMERIC:
        return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros()
            .toPlainString();
      case STRING:
        return cell.getStringCellValue();
      default:
        return "";
      }
    default:
      return "";
    }
  }
}
