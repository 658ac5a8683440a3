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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;

/**
 * Decorator that splits large writes into chunks with a pause between them.
 *
 * <p>Remote spreadsheet services cap the size of one request and the number
 * of requests per minute. A logical {@link #writeTable} becomes one
 * {@code writeTable} of the first chunk (header included) followed by
 * {@code appendRows} of the remaining chunks, each at least
 * {@code pauseMs} after the previous call. One logical write may therefore
 * take several seconds, and a failure part-way leaves a prefix of the rows
 * in the table; the next successful merge rewrites the whole table.
 */
public class ChunkedWriteSpreadsheetStore implements SpreadsheetStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedWriteSpreadsheetStore.class);

  private final SpreadsheetStore delegate;
  private final int chunkSize;
  private final long pauseMs;
  private long lastWriteTime;

  /**
   * Creates a chunking store.
   *
   * @param delegate Store receiving the chunks
   * @param chunkSize Maximum rows per call; 0 or less disables chunking
   * @param pauseMs Minimum interval between two write calls, in milliseconds
   */
  public ChunkedWriteSpreadsheetStore(SpreadsheetStore delegate, int chunkSize, long pauseMs) {
    if (pauseMs < 0) {
      throw new IllegalArgumentException("pauseMs must not be negative: " + pauseMs);
    }
    this.delegate = delegate;
    this.chunkSize = chunkSize;
    this.pauseMs = pauseMs;
  }

  @Override public RawTable readTable(String name) throws IOException {
    return delegate.readTable(name);
  }

  @Override public synchronized void writeTable(String name, List<List<String>> rows)
      throws IOException {
    if (chunkSize <= 0 || rows.size() <= chunkSize) {
      enforcePause();
      delegate.writeTable(name, rows);
      return;
    }
    int chunks = (rows.size() + chunkSize - 1) / chunkSize;
    LOGGER.info("Writing {} rows to '{}' in {} chunks of {}", rows.size(), name, chunks,
        chunkSize);
    enforcePause();
    delegate.writeTable(name, rows.subList(0, chunkSize));
    appendInChunks(name, rows.subList(chunkSize, rows.size()));
  }

  @Override public synchronized void appendRows(String name, List<List<String>> rows)
      throws IOException {
    if (chunkSize <= 0 || rows.size() <= chunkSize) {
      enforcePause();
      delegate.appendRows(name, rows);
      return;
    }
    appendInChunks(name, rows);
  }

  @Override public boolean hasTable(String name) throws IOException {
    return delegate.hasTable(name);
  }

  @Override public String getStoreType() {
    return delegate.getStoreType();
  }

  private void appendInChunks(String name, List<List<String>> rows) throws IOException {
    for (int start = 0; start < rows.size(); start += chunkSize) {
      int end = Math.min(rows.size(), start + chunkSize);
      enforcePause();
      delegate.appendRows(name, rows.subList(start, end));
      LOGGER.debug("Appended rows {}-{} to '{}'", start, end, name);
    }
  }

  private void enforcePause() throws InterruptedIOException {
    if (pauseMs <= 0) {
      return;
    }
    long elapsed = System.currentTimeMillis() - lastWriteTime;
    if (elapsed < pauseMs) {
      long waitTime = pauseMs - elapsed;
      LOGGER.trace("Pausing {} ms before next write", waitTime);
      try {
        Thread.sleep(waitTime);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException interrupted =
            new InterruptedIOException("Interrupted while pausing between writes");
        interrupted.initCause(e);
        throw interrupted;
      }
    }
    lastWriteTime = System.currentTimeMillis();
  }
}
