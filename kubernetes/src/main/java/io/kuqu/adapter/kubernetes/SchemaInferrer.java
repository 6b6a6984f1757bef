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

import org.apache.calcite.util.Pair;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a flat schema from a set of JSON documents.
 *
 * <p>Nested objects are flattened into one column per leaf path. An object
 * with more distinct keys than the fan-out threshold (typically labels or
 * annotations on a large fleet) becomes a single {@link FieldType#MAP}
 * column instead. Arrays are never flattened. A path that holds an object
 * in some documents and a scalar or array in others becomes one
 * {@link FieldType#MIXED} column.
 *
 * <p>The result depends only on the documents, their order and the
 * threshold.
 */
public class SchemaInferrer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SchemaInferrer.class);

  private final int fanOutThreshold;

  /** Creates a SchemaInferrer.
   *
   * @param fanOutThreshold Maximum number of distinct keys of an object
   *                        that is flattened into columns; zero or negative
   *                        to flatten every object
   */
  public SchemaInferrer(int fanOutThreshold) {
    this.fanOutThreshold = fanOutThreshold;
  }

  /** Infers the schema of a list of documents. */
  public InferredSchema infer(List<? extends JsonNode> documents) {
    if (documents.isEmpty()) {
      return InferredSchema.skeleton();
    }
    final ShapeBuilder shapes = new ShapeBuilder();
    final Shape root = shapes.newShape();
    for (JsonNode document : documents) {
      shapes.mergeFields(root, document);
    }
    final List<Pair<Integer, SchemaField>> fields = new ArrayList<>();
    emitChildren(root, ImmutableList.of(), documents.size(), fields);
    fields.sort(Comparator.comparingInt(p -> p.left));
    final InferredSchema schema = new InferredSchema(Pair.right(fields));
    LOGGER.debug("Inferred {} columns from {} documents",
        schema.fields.size(), documents.size());
    return schema;
  }

  private void emitChildren(Shape parent, ImmutableList<String> path,
      int documentCount, List<Pair<Integer, SchemaField>> fields) {
    parent.children.forEach((key, child) ->
        emit(child,
            ImmutableList.<String>builder().addAll(path).add(key).build(),
            documentCount, fields));
  }

  private void emit(Shape shape, ImmutableList<String> path,
      int documentCount, List<Pair<Integer, SchemaField>> fields) {
    final boolean nullable = shape.presentCount < documentCount;
    final boolean nonObject = shape.kinds.stream()
        .anyMatch(kind -> kind != FieldType.NULL);
    if (shape.object && nonObject) {
      fields.add(
          Pair.of(shape.sequence,
              new SchemaField(path, FieldType.MIXED, nullable)));
    } else if (shape.object) {
      if (fanOutThreshold > 0 && shape.children.size() > fanOutThreshold) {
        fields.add(
            Pair.of(shape.sequence,
                new SchemaField(path, FieldType.MAP, nullable)));
      } else {
        emitChildren(shape, path, documentCount, fields);
      }
    } else {
      FieldType type = FieldType.NULL;
      for (FieldType kind : shape.kinds) {
        type = type.widen(kind);
      }
      fields.add(
          Pair.of(shape.sequence, new SchemaField(path, type, nullable)));
    }
  }

  /** Creates shapes, numbering them in the order they are first seen. */
  private static class ShapeBuilder {
    private int nextSequence;

    Shape newShape() {
      return new Shape(nextSequence++);
    }

    void mergeFields(Shape shape, JsonNode object) {
      for (Iterator<Map.Entry<String, JsonNode>> entries = object.fields();
           entries.hasNext();) {
        final Map.Entry<String, JsonNode> entry = entries.next();
        final Shape child =
            shape.children.computeIfAbsent(entry.getKey(), k -> newShape());
        merge(child, entry.getValue());
      }
    }

    void merge(Shape shape, JsonNode value) {
      if (value.isObject()) {
        shape.object = true;
        ++shape.presentCount;
        mergeFields(shape, value);
        return;
      }
      final FieldType kind = FieldType.of(value);
      shape.kinds.add(kind);
      if (kind != FieldType.NULL) {
        ++shape.presentCount;
      }
    }
  }

  /** What has been seen at one path, across all documents. */
  private static class Shape {
    final int sequence;
    /** Kinds of non-object values. */
    final EnumSet<FieldType> kinds = EnumSet.noneOf(FieldType.class);
    boolean object;
    /** Number of documents with a non-null value at this path. */
    int presentCount;
    final Map<String, Shape> children = new LinkedHashMap<>();

    Shape(int sequence) {
      this.sequence = sequence;
    }
  }
}
