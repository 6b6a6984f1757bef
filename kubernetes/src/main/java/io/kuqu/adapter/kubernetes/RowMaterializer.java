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
package io.kuqu.adapter.kubernetes;

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Converts documents into rows of an {@link InferredSchema}.
 *
 * <p>Each cell is {@code null}, {@link Long}, {@link Double},
 * {@link Boolean} or {@link String}, according to the type of its column.
 * A value that cannot be represented in its column's type becomes null.
 */
public class RowMaterializer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RowMaterializer.class);

  private final InferredSchema schema;
  private final int[] fields;

  /** Creates a RowMaterializer.
   *
   * @param schema Schema
   * @param projects Ordinals of the columns to produce, or null for all
   */
  public RowMaterializer(InferredSchema schema, int @Nullable [] projects) {
    this.schema = requireNonNull(schema, "schema");
    this.fields = projects != null
        ? projects.clone()
        : identity(schema.fields.size());
  }

  private static int[] identity(int count) {
    final int[] integers = new int[count];
    for (int i = 0; i < count; i++) {
      integers[i] = i;
    }
    return integers;
  }

  /** Converts a document to a row. */
  public @Nullable Object[] materialize(JsonNode document) {
    final @Nullable Object[] row = new Object[fields.length];
    for (int i = 0; i < fields.length; i++) {
      row[i] = value(document, schema.fields.get(fields[i]));
    }
    return row;
  }

  /** Returns the value of a field in a document. */
  static @Nullable Object value(JsonNode document, SchemaField field) {
    JsonNode node = document;
    for (String segment : field.path) {
      node = node.get(segment);
      if (node == null) {
        return null;
      }
    }
    return convert(node, field);
  }

  private static @Nullable Object convert(JsonNode node, SchemaField field) {
    if (node.isNull() || node.isMissingNode()) {
      return null;
    }
    switch (field.type) {
    case BOOLEAN:
      if (node.isBoolean()) {
        return node.booleanValue();
      }
      break;
    case INTEGER:
      if (node.isIntegralNumber() && node.canConvertToLong()) {
        return node.longValue();
      }
      break;
    case FLOAT:
      if (node.isNumber()) {
        return node.doubleValue();
      }
      break;
    case STRING:
      if (node.isTextual()) {
        return node.textValue();
      }
      break;
    case LIST:
      if (node.isArray()) {
        return node.toString();
      }
      break;
    case MAP:
      if (node.isObject()) {
        return node.toString();
      }
      break;
    case MIXED:
      return node.isContainerNode() ? node.toString() : node.asText();
    default:
      break;
    }
    LOGGER.debug("Value of column {} is {}, not {}; using null", field.name(),
        node.getNodeType(), field.type);
    return null;
  }
}
