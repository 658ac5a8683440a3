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
package org.apache.calcite.adapter.tabnorm.source;

import org.apache.calcite.adapter.tabnorm.RawTable;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one sheet of an Excel workbook ({@code .xlsx} or {@code .xls}) into a
 * {@link RawTable} of text cells.
 *
 * <p>Cells are rendered the way the source publishes them, so the locale
 * parsers see the same text a person would:
 * <ul>
 *   <li>numbers use a decimal comma and no grouping ({@code 1215,5});
 *       integral numbers have no decimals ({@code 2023});</li>
 *   <li>date-formatted cells become ISO dates;</li>
 *   <li>formulas yield their cached result;</li>
 *   <li>booleans become {@code true}/{@code false}.</li>
 * </ul>
 * Every physical row is kept, blank ones as empty rows, so row indexes match
 * the sheet.
 */
public class WorkbookTableReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkbookTableReader.class);

  /**
   * Reads a sheet from a workbook file.
   *
   * @param path Workbook file
   * @param sheetName Sheet to read, or null for the first sheet
   * @param sourceUrl Origin recorded on the table, or null for the file URI
   * @return The sheet as a raw table
   * @throws IOException If the file cannot be read or the sheet does not exist
   */
  public RawTable read(Path path, @Nullable String sheetName, @Nullable String sourceUrl)
      throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, sheetName, sourceUrl != null ? sourceUrl : path.toUri().toString());
    }
  }

  /**
   * Reads a sheet from a workbook stream. The stream is not closed.
   *
   * @param in Workbook content
   * @param sheetName Sheet to read, or null for the first sheet
   * @param sourceUrl Origin recorded on the table, may be null
   * @return The sheet as a raw table
   * @throws IOException If the content cannot be parsed or the sheet does not exist
   */
  public RawTable read(InputStream in, @Nullable String sheetName, @Nullable String sourceUrl)
      throws IOException {
    try (Workbook workbook = WorkbookFactory.create(in)) {
      Sheet sheet = sheetName != null && !sheetName.isEmpty()
          ? workbook.getSheet(sheetName)
          : workbook.getSheetAt(0);
      if (sheet == null) {
        throw new IOException("Sheet not found: " + sheetName);
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

      LOGGER.info("Read {} rows from Excel sheet '{}'", rows.size(), sheet.getSheetName());
      return RawTable.of(sheet.getSheetName(), sourceUrl, rows);
    }
  }

  static String cellText(@Nullable Cell cell) {
    if (cell == null) {
      return "";
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
    case STRING:
      return cell.getStringCellValue();
    case NUMERIC:
      if (DateUtil.isCellDateFormatted(cell)) {
        return cell.getLocalDateTimeCellValue().toLocalDate().toString();
      }
      return decimalComma(cell.getNumericCellValue());
    case BOOLEAN:
      return String.valueOf(cell.getBooleanCellValue());
    default:
      return "";
    }
  }

  private static String decimalComma(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return "";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString().replace('.', ',');
  }
}
