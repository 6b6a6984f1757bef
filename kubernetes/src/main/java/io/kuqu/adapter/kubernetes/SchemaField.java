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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Column of an {@link InferredSchema}: the path of a value within a
 * document, its type and whether it may be null.
 */
public final class SchemaField {
  public final ImmutableList<String> path;
  public final FieldType type;
  public final boolean nullable;

  public SchemaField(List<String> path, FieldType type, boolean nullable) {
    this.path = ImmutableList.copyOf(path);
    this.type = requireNonNull(type, "type");
    this.nullable = nullable;
  }

  /** Returns the column name: path segments separated by dots.
   *
   * <p>A segment that contains a dot or a quote is enclosed in single
   * quotes, with quotes doubled, so that
   * {@code ["metadata", "labels", "app.kubernetes.io/name"]} becomes
   * {@code metadata.labels.'app.kubernetes.io/name'}. */
  public String name() {
    final StringBuilder b = new StringBuilder();
    for (String segment : path) {
      if (b.length() > 0) {
        b.append('.');
      }
      if (segment.indexOf('.') >= 0 || segment.indexOf('\'') >= 0) {
        b.append('\'').append(segment.replace("'", "''")).append('\'');
      } else {
        b.append(segment);
      }
    }
    return b.toString();
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof SchemaField
        && path.equals(((SchemaField) o).path)
        && type == ((SchemaField) o).type
        && nullable == ((SchemaField) o).nullable;
  }

  @Override public int hashCode() {
    return Objects.hash(path, type, nullable);
  }

  @Override public String toString() {
    return name() + " " + type + (nullable ? "" : " NOT NULL");
  }
}
