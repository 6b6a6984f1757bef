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

import static java.util.Objects.requireNonNull;

/**
 * Fully qualified identity of a Kubernetes resource kind: API group,
 * version, kind, plural name and scope.
 *
 * <p>The core API group is represented by the empty string.
 */
public final class ResourceDescriptor {
  public final String group;
  public final String version;
  public final String kind;
  public final String plural;
  public final boolean namespaced;

  public ResourceDescriptor(String group, String version, String kind,
      String plural, boolean namespaced) {
    this.group = requireNonNull(group, "group");
    this.version = requireNonNull(version, "version");
    this.kind = requireNonNull(kind, "kind");
    this.plural = requireNonNull(plural, "plural");
    this.namespaced = namespaced;
  }

  /** Returns whether this kind belongs to the core ("legacy") API group. */
  public boolean isCore() {
    return group.isEmpty();
  }

  /** Returns the value of the {@code apiVersion} field of objects of this
   * kind, for example "v1" or "apps/v1". */
  public String apiVersion() {
    return isCore() ? version : group + "/" + version;
  }

  /** Returns the plural name qualified by the API group, the form that
   * never needs disambiguation; for example "deployments.apps". Kinds of the
   * core group are qualified with "core". */
  public String qualifiedName() {
    return plural + "." + (isCore() ? "core" : group);
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof ResourceDescriptor
        && group.equals(((ResourceDescriptor) o).group)
        && version.equals(((ResourceDescriptor) o).version)
        && kind.equals(((ResourceDescriptor) o).kind)
        && plural.equals(((ResourceDescriptor) o).plural)
        && namespaced == ((ResourceDescriptor) o).namespaced;
  }

  @Override public int hashCode() {
    return Objects.hash(group, version, kind, plural, namespaced);
  }

  @Override public String toString() {
    return apiVersion() + "/" + kind + " (" + plural + ", "
        + (namespaced ? "namespaced" : "cluster-scoped") + ")";
  }
}
