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

import org.apache.calcite.avatica.ConnectionConfigImpl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Properties;

/** Implementation of {@link KubernetesSchemaConfig}. */
public class KubernetesSchemaConfigImpl extends ConnectionConfigImpl
    implements KubernetesSchemaConfig {
  public KubernetesSchemaConfigImpl(Properties properties) {
    super(properties);
  }

  /** Creates a configuration from the operand of a schema in a Calcite
   * model. Null values are treated as absent. */
  public static KubernetesSchemaConfigImpl of(Map<String, ?> operand) {
    final Properties properties = new Properties();
    operand.forEach((key, value) -> {
      if (value != null) {
        properties.setProperty(key, value.toString());
      }
    });
    return new KubernetesSchemaConfigImpl(properties);
  }

  /** Returns a copy of this configuration with one property changed.
   *
   * <p>Does not modify this configuration. */
  public KubernetesSchemaConfigImpl set(KubernetesSchemaProperty property,
      String value) {
    final Properties newProperties = (Properties) properties.clone();
    newProperties.setProperty(property.camelName(), value);
    return new KubernetesSchemaConfigImpl(newProperties);
  }

  /** Returns whether a given property has been assigned a value. */
  public boolean isSet(KubernetesSchemaProperty property) {
    return properties.containsKey(property.camelName());
  }

  @Override public @Nullable String context() {
    return KubernetesSchemaProperty.CONTEXT.wrap(properties).getString();
  }

  @Override public @Nullable String masterUrl() {
    return KubernetesSchemaProperty.MASTER_URL.wrap(properties).getString();
  }

  @Override public @Nullable String namespace() {
    return KubernetesSchemaProperty.NAMESPACE.wrap(properties).getString();
  }

  @Override public int fanOutThreshold() {
    return KubernetesSchemaProperty.FAN_OUT_THRESHOLD.wrap(properties)
        .getInt();
  }

  @Override public boolean stripManagedFields() {
    return KubernetesSchemaProperty.STRIP_MANAGED_FIELDS.wrap(properties)
        .getBoolean();
  }

  @Override public int fetchTimeout() {
    return KubernetesSchemaProperty.FETCH_TIMEOUT.wrap(properties).getInt();
  }

  @Override public boolean discoveryPerQuery() {
    return KubernetesSchemaProperty.DISCOVERY_PER_QUERY.wrap(properties)
        .getBoolean();
  }

  @Override public <T> T apiFactory(Class<T> factoryClass, T defaultFactory) {
    return KubernetesSchemaProperty.API_FACTORY.wrap(properties)
        .getPlugin(factoryClass, defaultFactory);
  }
}
