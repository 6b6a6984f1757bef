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

import static io.kuqu.adapter.kubernetes.KubernetesStatic.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Result of resolving a {@link TableReference}: the resource kind, the
 * namespace to list it in, and any warnings produced on the way.
 */
public final class ResolvedResource {
  public final TableReference reference;
  public final ResourceDescriptor descriptor;
  /** Namespace to list, or null to list across the whole cluster. */
  public final @Nullable String namespace;
  public final ImmutableList<String> warnings;

  ResolvedResource(TableReference reference, ResourceDescriptor descriptor,
      @Nullable String namespace, List<String> warnings) {
    this.reference = requireNonNull(reference, "reference");
    this.descriptor = requireNonNull(descriptor, "descriptor");
    this.namespace = namespace;
    this.warnings = ImmutableList.copyOf(warnings);
  }

  /** Describes the scope being listed, for messages. */
  public String scope() {
    if (namespace != null) {
      return RESOURCE.namespaceScope(namespace).str();
    }
    return descriptor.namespaced
        ? RESOURCE.allNamespacesScope().str()
        : RESOURCE.clusterScope().str();
  }

  @Override public String toString() {
    return descriptor.qualifiedName() + " in " + scope();
  }
}
