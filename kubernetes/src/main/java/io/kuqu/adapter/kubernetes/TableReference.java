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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static io.kuqu.adapter.kubernetes.KubernetesStatic.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Table name as written in SQL, split into a resource name and an optional
 * namespace.
 *
 * <p>Accepted forms are {@code kind}, {@code kind/namespace},
 * {@code kind.group} and {@code kind.group/namespace}, where {@code kind} is
 * a plural, singular or short name. The namespace {@code *} stands for all
 * namespaces.
 */
public final class TableReference {
  /** Namespace qualifier that selects every namespace. */
  public static final String ALL_NAMESPACES = "*";

  public final String rawName;
  public final @Nullable String namespace;

  private TableReference(String rawName, @Nullable String namespace) {
    this.rawName = requireNonNull(rawName, "rawName");
    this.namespace = namespace;
  }

  /** Parses a table name.
   *
   * @throws InvalidTableNameException if the name is empty or malformed
   */
  public static TableReference parse(String tableName) {
    final String name = tableName.trim();
    if (name.isEmpty()) {
      throw RESOURCE.emptyTableName().ex();
    }
    final int slash = name.indexOf('/');
    if (slash < 0) {
      return new TableReference(name, null);
    }
    final String resource = name.substring(0, slash).trim();
    final String namespace = name.substring(slash + 1).trim();
    if (resource.isEmpty() || namespace.isEmpty()
        || namespace.indexOf('/') >= 0) {
      throw RESOURCE.invalidTableName(tableName).ex();
    }
    return new TableReference(resource, namespace);
  }

  /** Returns whether the name carries a group qualifier. */
  public boolean isGroupQualified() {
    return rawName.indexOf('.') > 0;
  }

  /** Returns whether the namespace qualifier selects every namespace. */
  public boolean isAllNamespaces() {
    return ALL_NAMESPACES.equals(namespace);
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof TableReference
        && rawName.equals(((TableReference) o).rawName)
        && Objects.equals(namespace, ((TableReference) o).namespace);
  }

  @Override public int hashCode() {
    return Objects.hash(rawName, namespace);
  }

  @Override public String toString() {
    return namespace == null ? rawName : rawName + "/" + namespace;
  }
}
