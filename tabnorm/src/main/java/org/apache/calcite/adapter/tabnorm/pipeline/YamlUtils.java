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
package org.apache.calcite.adapter.tabnorm.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

/**
 * Reads pipeline configuration documents.
 *
 * <p>YAML goes through SnakeYAML so that anchors and aliases shared between
 * table entries resolve, and the result is converted to a Jackson tree. JSON
 * is read by Jackson directly.
 */
final class YamlUtils {

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private YamlUtils() {
  }

  /**
   * Parses a YAML or JSON document.
   *
   * @param stream Document content
   * @param resourceName Name of the document; its extension selects the format
   * @return Parsed tree, {@link MissingNode} for an empty document
   * @throws IOException if the document cannot be read or parsed
   */
  static JsonNode parseYamlOrJson(InputStream stream, String resourceName) throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(500);
      Object parsed;
      try {
        parsed = new Yaml(loaderOptions).load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Cannot parse " + resourceName + ": " + e.getMessage(), e);
      }
      return parsed == null
          ? MissingNode.getInstance()
          : JSON_MAPPER.convertValue(parsed, JsonNode.class);
    }
    JsonNode node = JSON_MAPPER.readTree(stream);
    return node == null ? MissingNode.getInstance() : node;
  }

  /**
   * Converts an object node to a plain map, or returns an empty map.
   */
  static Map<String, Object> toMap(JsonNode node) {
    if (node == null || !node.isObject()) {
      return Collections.emptyMap();
    }
    return JSON_MAPPER.convertValue(node, MAP_TYPE);
  }
}
