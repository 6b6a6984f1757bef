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

import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Columns inferred from a set of documents, in the order in which their
 * paths were first seen.
 */
public final class InferredSchema {
  /** Schema of a resource that has no objects. */
  private static final InferredSchema SKELETON =
      new InferredSchema(
          ImmutableList.of(
              new SchemaField(ImmutableList.of("apiVersion"), FieldType.STRING,
                  true),
              new SchemaField(ImmutableList.of("kind"), FieldType.STRING, true),
              new SchemaField(ImmutableList.of("metadata", "name"),
                  FieldType.STRING, true),
              new SchemaField(ImmutableList.of("metadata", "namespace"),
                  FieldType.STRING, true)));

  public final ImmutableList<SchemaField> fields;

  public InferredSchema(List<SchemaField> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  /** Returns the schema used when there are no documents to infer from:
   * {@code apiVersion}, {@code kind}, {@code metadata.name} and
   * {@code metadata.namespace}. */
  public static InferredSchema skeleton() {
    return SKELETON;
  }

  /** Returns the column names. */
  public List<String> fieldNames() {
    return fields.stream().map(SchemaField::name)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the field with a given column name, or null. */
  public @Nullable SchemaField field(String name) {
    for (SchemaField field : fields) {
      if (field.name().equals(name)) {
        return field;
      }
    }
    return null;
  }

  /** Converts this schema to a row type. */
  public RelDataType toRelDataType(RelDataTypeFactory typeFactory) {
    final RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (SchemaField field : fields) {
      builder.add(field.name(),
          typeFactory.createTypeWithNullability(
              typeFactory.createSqlType(field.type.sqlType), field.nullable));
    }
    return builder.build();
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof InferredSchema
        && fields.equals(((InferredSchema) o).fields);
  }

  @Override public int hashCode() {
    return fields.hashCode();
  }

  @Override public String toString() {
    return fields.toString();
  }
}
