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

import org.apache.calcite.linq4j.function.Predicate1;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.apache.calcite.schema.lookup.LikePattern;
import org.apache.calcite.schema.lookup.Lookup;
import org.apache.calcite.schema.lookup.Named;

import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Schema whose tables are the resource kinds of a Kubernetes cluster.
 *
 * <p>Table names are resolved when a query references them, so any kind
 * the cluster serves, in any namespace, can be queried without declaring
 * it; see {@link TableReference} for the forms a name may take. Every
 * lookup returns a new {@link KubernetesTable}. Calcite must therefore not
 * cache the tables of this schema; declare it with {@code "cache": false}
 * in a model, or call {@code SchemaPlus.setCacheEnabled(false)}.
 *
 * <p>The schema owns its {@link KubernetesApi}. The API is closed by
 * {@link #close()}, or once the schema is no longer reachable, which is
 * when the connection that holds it goes away.
 */
public class KubernetesSchema extends AbstractSchema implements AutoCloseable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(KubernetesSchema.class);

  private static final Cleaner CLEANER = Cleaner.create();

  private final ResourceDiscovery discovery;
  private final ResourceResolver resolver;
  private final DocumentFetcher fetcher;
  private final SchemaInferrer inferrer;
  private final Cleaner.Cleanable cleanable;
  private final Lookup<Table> tables = new TableLookup();

  /** Creates a KubernetesSchema.
   *
   * @param api Cluster API
   * @param config Schema configuration
   */
  public KubernetesSchema(KubernetesApi api, KubernetesSchemaConfig config) {
    requireNonNull(api, "api");
    this.discovery = new ResourceDiscovery(api, config.discoveryPerQuery());
    this.resolver =
        new ResourceResolver(discovery,
            ResourceResolver.defaultNamespace(config.namespace(),
                api.defaultNamespace()));
    this.fetcher =
        new DocumentFetcher(api, config.stripManagedFields(),
            config.fetchTimeout());
    this.inferrer = new SchemaInferrer(config.fanOutThreshold());
    // The action must not reference this schema
    this.cleanable = CLEANER.register(this, new ApiCloser(api));
    LOGGER.debug("Created Kubernetes schema; default namespace is '{}'",
        resolver.defaultNamespace());
  }

  @Override public boolean isMutable() {
    return false;
  }

  /** {@inheritDoc}
   *
   * <p>{@link Lookup#get} and {@link Lookup#getIgnoreCase} accept any name
   * described by {@link TableReference} and throw
   * {@link InvalidTableNameException} if the name is malformed,
   * {@link UnknownResourceException} if the cluster has no such kind and
   * {@link AmbiguousResourceException} if several API groups have a kind
   * of that name. {@link Lookup#getNames} returns the plural names of the
   * kinds the cluster serves. */
  @Override public Lookup<Table> tables() {
    return tables;
  }

  /** Resolves a table name and creates a table for it. */
  KubernetesTable table(String name) {
    final ResolvedResource resource =
        resolver.resolve(TableReference.parse(name));
    return new KubernetesTable(resource, fetcher, inferrer);
  }

  /** Closes the cluster API. Calling this more than once has no effect. */
  @Override public void close() {
    cleanable.clean();
  }

  /** Table lookup that resolves names against the cluster. Names are
   * matched case-insensitively in either mode. */
  private class TableLookup implements Lookup<Table> {
    @Override public @Nullable Table get(String name) {
      return table(name);
    }

    @Override public @Nullable Named<Table> getIgnoreCase(String name) {
      return new Named<>(name, table(name));
    }

    @Override public Set<String> getNames(LikePattern pattern) {
      final Predicate1<String> matcher = pattern.matcher();
      final ImmutableSortedSet.Builder<String> names =
          ImmutableSortedSet.naturalOrder();
      for (String name : discovery.snapshot().pluralNames()) {
        if (matcher.apply(name)) {
          names.add(name);
        }
      }
      return names.build();
    }
  }

  /** Closes an API when its schema is closed or collected. */
  private static class ApiCloser implements Runnable {
    private final KubernetesApi api;

    ApiCloser(KubernetesApi api) {
      this.api = api;
    }

    @Override public void run() {
      LOGGER.debug("Closing Kubernetes API {}", api);
      api.close();
    }
  }
}
