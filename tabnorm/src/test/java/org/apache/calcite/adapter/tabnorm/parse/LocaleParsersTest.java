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
package org.apache.calcite.adapter.tabnorm.parse;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for LocaleParsers.
 */
@Tag("unit")
public class LocaleParsersTest {

  @Test void testParseNumericBrazilianFormat() {
    assertEquals(1234.56, LocaleParsers.parseNumeric("1.234,56"), 1e-9);
    assertEquals(-50.5, LocaleParsers.parseNumeric("-50,5"), 1e-9);
    assertEquals(1215.0, LocaleParsers.parseNumeric("1.215,00"), 1e-9);
    assertEquals(0.75, LocaleParsers.parseNumeric("0,75"), 1e-9);
  }

  @Test void testParseNumericDecorations() {
    assertEquals(2500.0, LocaleParsers.parseNumeric("R$ 2.500"), 1e-9);
    assertEquals(12.5, LocaleParsers.parseNumeric("12,5%"), 1e-9);
    assertEquals(1000.0, LocaleParsers.parseNumeric(" 1.000,00 "), 1e-9);
  }

  @Test void testParseNumericWithoutComma() {
    assertEquals(1234567.0, LocaleParsers.parseNumeric("1.234.567"), 1e-9);
    assertEquals(150.3, LocaleParsers.parseNumeric("150.3"), 1e-9);
    assertEquals(42.0, LocaleParsers.parseNumeric("42"), 1e-9);
  }

  @Test void testParseNumericSentinels() {
    assertNull(LocaleParsers.parseNumeric(null));
    assertNull(LocaleParsers.parseNumeric(""));
    assertNull(LocaleParsers.parseNumeric("   "));
    assertNull(LocaleParsers.parseNumeric("..."));
    assertNull(LocaleParsers.parseNumeric("(...)"));
    assertNull(LocaleParsers.parseNumeric("-"));
    assertNull(LocaleParsers.parseNumeric("--"));
    assertNull(LocaleParsers.parseNumeric("N/D"));
    assertNull(LocaleParsers.parseNumeric("nan"));
    assertNull(LocaleParsers.parseNumeric("X"));
  }

  @Test void testParseNumericGarbage() {
    assertNull(LocaleParsers.parseNumeric("abc"));
    assertNull(LocaleParsers.parseNumeric("1,2,3"));
    assertNull(LocaleParsers.parseNumeric("1.2.3"));
    assertNull(LocaleParsers.parseNumeric("12abc"));
  }

  @Test void testParseYear() {
    assertEquals(Integer.valueOf(2023), LocaleParsers.parseYear("2023"));
    assertEquals(Integer.valueOf(2023), LocaleParsers.parseYear(" 2023.0 "));
    assertNull(LocaleParsers.parseYear("1800"));
    assertNull(LocaleParsers.parseYear("2040"));
    assertNull(LocaleParsers.parseYear("23"));
    assertNull(LocaleParsers.parseYear("Ano"));
    assertNull(LocaleParsers.parseYear(null));
    assertEquals(Integer.valueOf(1900), LocaleParsers.parseYear("1900", 1850, 2000));
  }

  @Test void testParseDate() {
    assertEquals(LocalDate.of(2023, 2, 1), LocaleParsers.parseDate("2023", "FEV"));
    assertEquals(LocalDate.of(2023, 3, 1), LocaleParsers.parseDate("2023", "Março"));
    assertEquals(LocalDate.of(2023, 1, 1), LocaleParsers.parseDate("2023", ""));
    assertEquals(LocalDate.of(2023, 1, 1), LocaleParsers.parseDate("2023", null));
    assertNull(LocaleParsers.parseDate("2023", "XYZ"));
    assertNull(LocaleParsers.parseDate("abc", "JAN"));
    assertNull(LocaleParsers.parseDate("1900", "JAN"));
  }

  @Test void testParseReferenceDate() {
    assertEquals(LocalDate.of(2024, 1, 15), LocaleParsers.parseReferenceDate("2024-01-15"));
    assertEquals(LocalDate.of(2024, 1, 15),
        LocaleParsers.parseReferenceDate("2024-01-15 00:00:00"));
    assertEquals(LocalDate.of(2024, 1, 15), LocaleParsers.parseReferenceDate("15/01/2024"));
    assertEquals(LocalDate.of(2024, 1, 1), LocaleParsers.parseReferenceDate("2024-01"));
    assertEquals(LocalDate.of(2024, 1, 1), LocaleParsers.parseReferenceDate("01/2024"));
    assertEquals(LocalDate.of(2024, 1, 1), LocaleParsers.parseReferenceDate("jan/24"));
    assertEquals(LocalDate.of(1999, 12, 1), LocaleParsers.parseReferenceDate("dez/99"));
    assertEquals(LocalDate.of(2023, 2, 1), LocaleParsers.parseReferenceDate("Fev/2023"));
    assertEquals(LocalDate.of(2024, 3, 1), LocaleParsers.parseReferenceDate("março/2024"));
  }

  @Test void testParseReferenceDateRejects() {
    assertNull(LocaleParsers.parseReferenceDate(null));
    assertNull(LocaleParsers.parseReferenceDate(""));
    assertNull(LocaleParsers.parseReferenceDate("hello"));
    assertNull(LocaleParsers.parseReferenceDate("31/02/2024"));
    assertNull(LocaleParsers.parseReferenceDate("2024-13-01"));
    assertNull(LocaleParsers.parseReferenceDate("xyz/2024"));
  }

  @Test void testFold() {
    assertEquals("marco", LocaleParsers.fold(" Março "));
    assertEquals("regiao sudeste", LocaleParsers.fold("REGIÃO SUDESTE"));
  }
}
