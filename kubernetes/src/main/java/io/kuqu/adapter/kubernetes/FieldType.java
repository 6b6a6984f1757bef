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

import org.apache.calcite.sql.type.SqlTypeName;

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type of a column inferred from JSON documents.
 *
 * <p>Lists and maps are exposed as JSON text, which Calcite's
 * {@code JSON_VALUE} and {@code JSON_QUERY} functions can query.
 */
public enum FieldType {
  /** Only nulls have been seen. */
  NULL(SqlTypeName.VARCHAR),
  BOOLEAN(SqlTypeName.BOOLEAN),
  INTEGER(SqlTypeName.BIGINT),
  FLOAT(SqlTypeName.DOUBLE),
  STRING(SqlTypeName.VARCHAR),
  /** JSON array, as JSON text. */
  LIST(SqlTypeName.VARCHAR),
  /** Object with too many distinct keys to become columns, as JSON text. */
  MAP(SqlTypeName.VARCHAR),
  /** Values of incompatible kinds, as text. */
  MIXED(SqlTypeName.VARCHAR);

  public final SqlTypeName sqlType;

  FieldType(SqlTypeName sqlType) {
    this.sqlType = sqlType;
  }

  /** Returns the type of a single non-object JSON value.
   *
   * <p>Integers too large for {@code long} are treated as floating
   * point. */
  public static FieldType of(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NULL;
    }
    if (node.isBoolean()) {
      return BOOLEAN;
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return INTEGER;
    }
    if (node.isNumber()) {
      return FLOAT;
    }
    if (node.isArray()) {
      return LIST;
    }
    if (node.isObject()) {
      return MAP;
    }
    return STRING;
  }

  /** Returns the narrowest type that can hold values of this type and
   * another. */
  public FieldType widen(FieldType other) {
    if (this == other || other == NULL) {
      return this;
    }
    if (this == NULL) {
      return other;
    }
    if (isNumeric() && other.isNumeric()) {
      return FLOAT;
    }
    return MIXED;
  }

  private boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }
}
