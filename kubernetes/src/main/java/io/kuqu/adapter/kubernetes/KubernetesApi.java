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

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Access to the API server of a Kubernetes cluster.
 *
 * <p>This is the only way the adapter talks to a cluster. Implementations
 * own their transport and authentication; failures are reported as
 * unchecked exceptions of the underlying client and are wrapped by the
 * callers.
 */
public interface KubernetesApi extends AutoCloseable {
  /** Returns every resource kind served by the cluster, including custom
   * resources. Kinds served in several versions appear once per version,
   * the preferred version first. Sub-resources are not included. */
  List<ApiResource> discoverResourceKinds();

  /** Lists the objects of a resource kind.
   *
   * @param descriptor Resource kind
   * @param namespace Namespace to list, or null to list across all
   *                  namespaces (and for cluster-scoped kinds)
   * @return One JSON document per object, in the order returned by the
   *         cluster
   */
  List<ObjectNode> listResources(ResourceDescriptor descriptor,
      @Nullable String namespace);

  /** Returns the namespace of the current context of the client
   * configuration, or null if it has none. */
  @Nullable String defaultNamespace();

  @Override void close();
}
