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

import org.apache.calcite.avatica.ConnectionProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import static org.apache.calcite.avatica.ConnectionConfigImpl.PropEnv;
import static org.apache.calcite.avatica.ConnectionConfigImpl.parse;

/**
 * Operands that may be specified for a Kubernetes schema in a Calcite
 * model.
 *
 * @see KubernetesSchemaConfig
 */
public enum KubernetesSchemaProperty implements ConnectionProperty {
  /** Name of the kubeconfig context to connect with. If not set, the
   * current context of the kubeconfig file is used. */
  CONTEXT("context", Type.STRING, null, false),

  /** URL of the API server; overrides the one of the kubeconfig context. */
  MASTER_URL("masterUrl", Type.STRING, null, false),

  /** Namespace listed by tables whose name carries no namespace qualifier.
   * If not set, the namespace of the kubeconfig context is used, and
   * "default" if that context has none. */
  NAMESPACE("namespace", Type.STRING, null, false),

  /** Number of distinct keys above which an object is kept as a single
   * JSON column instead of one column per key. Zero or a negative value
   * never collapses objects. */
  FAN_OUT_THRESHOLD("fanOutThreshold", Type.NUMBER, 64, false),

  /** Whether to remove {@code metadata.managedFields} from documents before
   * inferring their schema. */
  STRIP_MANAGED_FIELDS("stripManagedFields", Type.BOOLEAN, true, false),

  /** Milliseconds to wait for the cluster to list a resource. Zero or a
   * negative value waits forever. */
  FETCH_TIMEOUT("fetchTimeout", Type.NUMBER, 60_000, false),

  /** Whether to take a new discovery snapshot every time a table name is
   * resolved, instead of once per schema. */
  DISCOVERY_PER_QUERY("discoveryPerQuery", Type.BOOLEAN, false, false),

  /** Name of a class that implements {@link KubernetesApiFactory}. If not
   * set, a client based on the fabric8 Kubernetes client is created. */
  API_FACTORY("apiFactory", Type.PLUGIN, null, false);

  private final String camelName;
  private final Type type;
  private final @Nullable Object defaultValue;
  private final boolean required;
  private final @Nullable Class valueClass;

  private static final Map<String, KubernetesSchemaProperty> NAME_TO_PROPS;

  static {
    NAME_TO_PROPS = new HashMap<>();
    for (KubernetesSchemaProperty p : KubernetesSchemaProperty.values()) {
      NAME_TO_PROPS.put(p.camelName.toUpperCase(Locale.ROOT), p);
      NAME_TO_PROPS.put(p.name(), p);
    }
  }

  KubernetesSchemaProperty(String camelName, Type type,
      @Nullable Object defaultValue, boolean required) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    this.required = required;
    this.valueClass = type.deduceValueClass(defaultValue, null);
    if (!type.valid(defaultValue, this.valueClass)) {
      throw new AssertionError(camelName);
    }
  }

  @Override public String camelName() {
    return camelName;
  }

  @Override public @Nullable Object defaultValue() {
    return defaultValue;
  }

  @Override public Type type() {
    return type;
  }

  @Override public @Nullable Class valueClass() {
    return valueClass;
  }

  @Override public boolean required() {
    return required;
  }

  @Override public PropEnv wrap(Properties properties) {
    return new PropEnv(parse(properties, NAME_TO_PROPS), this);
  }
}
