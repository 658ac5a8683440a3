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

import org.apache.calcite.adapter.tabnorm.TabNormException;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a merged snapshot about to be written still holds two records
 * with the same key. Nothing is written.
 */
public class MergeInvariantException extends TabNormException {

  private static final long serialVersionUID = 1L;

  private final String tableName;
  private final List<String> duplicateKeys;

  public MergeInvariantException(String tableName, Collection<String> duplicateKeys) {
    super("Merged snapshot of '" + tableName + "' has duplicate record keys "
        + duplicateKeys);
    this.tableName = tableName;
    this.duplicateKeys = ImmutableList.copyOf(duplicateKeys);
  }

  public String getTableName() {
    return tableName;
  }

  public List<String> getDuplicateKeys() {
    return duplicateKeys;
  }
}
