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

import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Factory that creates a {@link KubernetesSchema}.
 *
 * <p>Allows a custom schema to be included in a model.json file.
 * For example:
 *
 * <blockquote><pre>{
 *   "version": "1.0",
 *   "schemas": [
 *     {
 *       "name": "k8s",
 *       "type": "custom",
 *       "factory": "io.kuqu.adapter.kubernetes.KubernetesSchemaFactory",
 *       "cache": false,
 *       "operand": {
 *         "context": "prod",
 *         "namespace": "kube-system"
 *       }
 *     }
 *   ]
 * }</pre></blockquote>
 *
 * <p>The operands are described by {@link KubernetesSchemaProperty}.
 */
@SuppressWarnings("UnusedDeclaration")
public class KubernetesSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(KubernetesSchemaFactory.class);

  /** Public singleton, per factory contract. */
  public static final KubernetesSchemaFactory INSTANCE =
      new KubernetesSchemaFactory();

  public KubernetesSchemaFactory() {
  }

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    final KubernetesSchemaConfig config = KubernetesSchemaConfigImpl.of(operand);
    final KubernetesApiFactory apiFactory =
        config.apiFactory(KubernetesApiFactory.class,
            Fabric8KubernetesApi.FACTORY);
    LOGGER.debug("Creating schema '{}' with {}", name,
        apiFactory.getClass().getName());
    return new KubernetesSchema(apiFactory.create(config), config);
  }
}
