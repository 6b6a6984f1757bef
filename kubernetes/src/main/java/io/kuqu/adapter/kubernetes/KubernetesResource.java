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

import static org.apache.calcite.runtime.Resources.BaseMessage;
import static org.apache.calcite.runtime.Resources.ExInst;
import static org.apache.calcite.runtime.Resources.ExInstWithCause;
import static org.apache.calcite.runtime.Resources.Inst;

/**
 * Compiler-checked resources for the Kubernetes adapter.
 */
public interface KubernetesResource {
  @BaseMessage("Table name is empty")
  ExInst<InvalidTableNameException> emptyTableName();

  @BaseMessage("Invalid table name ''{0}''. Supported formats: ''kind'', "
      + "''kind/namespace'', ''kind.group'', ''kind.group/namespace'', "
      + "''kind/*'' (all namespaces)")
  ExInst<InvalidTableNameException> invalidTableName(String rawName);

  @BaseMessage("Resource ''{0}'' not found")
  ExInst<UnknownResourceException> unknownResource(String rawName);

  @BaseMessage("Resource ''{0}'' not found; did you mean {1}?")
  ExInst<UnknownResourceException> unknownResourceWithCandidates(String rawName,
      String candidates);

  @BaseMessage("Resource ''{0}'' is ambiguous; qualify it with its API group, "
      + "one of {1}")
  ExInst<AmbiguousResourceException> ambiguousResource(String rawName,
      String candidates);

  @BaseMessage("Failed to list ''{0}'' in {1}")
  ExInstWithCause<ResourceFetchException> fetchFailed(String resource,
      String scope);

  @BaseMessage("Listing ''{0}'' in {1} was cancelled")
  ExInst<ResourceFetchException> fetchCancelled(String resource, String scope);

  @BaseMessage("Listing ''{0}'' in {1} timed out after {2,number,#} ms")
  ExInst<ResourceFetchException> fetchTimedOut(String resource, String scope,
      long timeoutMillis);

  @BaseMessage("Failed to discover the API resources of the cluster")
  ExInstWithCause<ResourceFetchException> discoveryFailed();

  @BaseMessage("Resource ''{0}'' is cluster-scoped; namespace ''{1}'' is ignored")
  Inst namespaceIgnored(String resource, String namespace);

  @BaseMessage("namespace ''{0}''")
  Inst namespaceScope(String namespace);

  @BaseMessage("all namespaces")
  Inst allNamespacesScope();

  @BaseMessage("the cluster scope")
  Inst clusterScope();
}
