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
import java.util.Locale;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Entry of a discovery snapshot: one resource kind served by the cluster,
 * with every name by which it may be referenced.
 */
public final class ApiResource {
  public final String group;
  public final String version;
  public final String kind;
  public final String plural;
  public final String singular;
  public final ImmutableList<String> shortNames;
  public final boolean namespaced;

  public ApiResource(String group, String version, String kind, String plural,
      @Nullable String singular, @Nullable List<String> shortNames,
      boolean namespaced) {
    this.group = requireNonNull(group, "group");
    this.version = requireNonNull(version, "version");
    this.kind = requireNonNull(kind, "kind");
    this.plural = requireNonNull(plural, "plural");
    // Older API servers leave singularName empty; kubectl derives it from kind
    this.singular = singular == null || singular.isEmpty()
        ? kind.toLowerCase(Locale.ROOT)
        : singular;
    this.shortNames = shortNames == null
        ? ImmutableList.of()
        : ImmutableList.copyOf(shortNames);
    this.namespaced = namespaced;
  }

  /** Returns the descriptor of this resource kind. */
  public ResourceDescriptor descriptor() {
    return new ResourceDescriptor(group, version, kind, plural, namespaced);
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof ApiResource
        && group.equals(((ApiResource) o).group)
        && version.equals(((ApiResource) o).version)
        && kind.equals(((ApiResource) o).kind)
        && plural.equals(((ApiResource) o).plural)
        && singular.equals(((ApiResource) o).singular)
        && shortNames.equals(((ApiResource) o).shortNames)
        && namespaced == ((ApiResource) o).namespaced;
  }

  @Override public int hashCode() {
    return Objects.hash(group, version, kind, plural, singular, shortNames,
        namespaced);
  }

  @Override public String toString() {
    return descriptor().toString();
  }
}
