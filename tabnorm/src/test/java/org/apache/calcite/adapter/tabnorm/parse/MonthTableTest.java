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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for MonthTable.
 */
@Tag("unit")
public class MonthTableTest {

  @Test void testAbbreviations() {
    assertEquals(12, MonthTable.ABBREVIATIONS.size());
    for (int month = 1; month <= 12; month++) {
      assertEquals(Integer.valueOf(month), MonthTable.monthOf(MonthTable.abbreviation(month)));
    }
    assertEquals("FEV", MonthTable.abbreviation(2));
    assertEquals("DEZ", MonthTable.abbreviation(12));
  }

  @Test void testLookupIsLenient() {
    assertEquals(Integer.valueOf(1), MonthTable.monthOf("jan."));
    assertEquals(Integer.valueOf(1), MonthTable.monthOf(" Jan "));
    assertEquals(Integer.valueOf(3), MonthTable.monthOf("MARÇO"));
    assertEquals(Integer.valueOf(9), MonthTable.monthOf("setembro"));
  }

  @Test void testNonMonths() {
    assertNull(MonthTable.monthOf(null));
    assertNull(MonthTable.monthOf(""));
    assertNull(MonthTable.monthOf("xyz"));
    assertNull(MonthTable.monthOf("2023"));
    assertFalse(MonthTable.isMonth("TOTAL"));
    assertTrue(MonthTable.isMonth("out"));
  }
}
