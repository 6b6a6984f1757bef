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

/** Interface for reading the operands of a Kubernetes schema.
 *
 * @see KubernetesSchemaProperty
 */
public interface KubernetesSchemaConfig {
  /** Returns the value of {@link KubernetesSchemaProperty#CONTEXT}. */
  @Nullable String context();

  /** Returns the value of {@link KubernetesSchemaProperty#MASTER_URL}. */
  @Nullable String masterUrl();

  /** Returns the value of {@link KubernetesSchemaProperty#NAMESPACE}. */
  @Nullable String namespace();

  /** Returns the value of
   * {@link KubernetesSchemaProperty#FAN_OUT_THRESHOLD}. */
  int fanOutThreshold();

  /** Returns the value of
   * {@link KubernetesSchemaProperty#STRIP_MANAGED_FIELDS}. */
  boolean stripManagedFields();

  /** Returns the value of {@link KubernetesSchemaProperty#FETCH_TIMEOUT}. */
  int fetchTimeout();

  /** Returns the value of
   * {@link KubernetesSchemaProperty#DISCOVERY_PER_QUERY}. */
  boolean discoveryPerQuery();

  /** Returns the value of {@link KubernetesSchemaProperty#API_FACTORY},
   * or a default factory if not set. */
  <T> T apiFactory(Class<T> factoryClass, T defaultFactory);
}
