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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

import static io.kuqu.adapter.kubernetes.KubernetesStatic.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Source of discovery snapshots: the resource kinds a cluster serves,
 * indexed by every name they can be referenced by.
 *
 * <p>By default the snapshot is taken once, on first use, and kept for the
 * life of the schema. A failed discovery is not remembered; the next use
 * tries again.
 */
public class ResourceDiscovery {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ResourceDiscovery.class);

  private final Supplier<Snapshot> snapshotSupplier;

  /** Creates a ResourceDiscovery.
   *
   * @param api Cluster API
   * @param perQuery Whether to take a new snapshot every time one is asked
   *                 for, rather than once
   */
  public ResourceDiscovery(KubernetesApi api, boolean perQuery) {
    requireNonNull(api, "api");
    final Supplier<Snapshot> supplier = () -> discover(api);
    this.snapshotSupplier = perQuery ? supplier : Suppliers.memoize(supplier);
  }

  /** Creates a ResourceDiscovery over a fixed list of resource kinds. */
  public static ResourceDiscovery of(List<ApiResource> resources) {
    final Snapshot snapshot = new Snapshot(resources);
    return new ResourceDiscovery(() -> snapshot);
  }

  private ResourceDiscovery(Supplier<Snapshot> snapshotSupplier) {
    this.snapshotSupplier = snapshotSupplier;
  }

  private static Snapshot discover(KubernetesApi api) {
    final List<ApiResource> resources;
    try {
      resources = api.discoverResourceKinds();
    } catch (RuntimeException e) {
      throw RESOURCE.discoveryFailed().ex(e);
    }
    LOGGER.debug("Discovered {} resource kinds", resources.size());
    return new Snapshot(resources);
  }

  /** Returns the current snapshot.
   *
   * @throws ResourceFetchException if discovery fails
   */
  public Snapshot snapshot() {
    return snapshotSupplier.get();
  }

  /** Resource kinds of a cluster at a point in time, indexed by name.
   *
   * <p>Within each index, kinds appear in discovery order, so the preferred
   * version of a group comes before its other versions. Keys are lower
   * case. */
  public static class Snapshot {
    public final ImmutableList<ApiResource> resources;
    final ImmutableListMultimap<String, ApiResource> byPlural;
    final ImmutableListMultimap<String, ApiResource> bySingular;
    final ImmutableListMultimap<String, ApiResource> byShortName;

    Snapshot(List<ApiResource> resources) {
      this.resources = ImmutableList.copyOf(resources);
      final ImmutableListMultimap.Builder<String, ApiResource> plurals =
          ImmutableListMultimap.builder();
      final ImmutableListMultimap.Builder<String, ApiResource> singulars =
          ImmutableListMultimap.builder();
      final ImmutableListMultimap.Builder<String, ApiResource> shortNames =
          ImmutableListMultimap.builder();
      for (ApiResource resource : this.resources) {
        plurals.put(key(resource.plural), resource);
        singulars.put(key(resource.singular), resource);
        for (String shortName : resource.shortNames) {
          shortNames.put(key(shortName), resource);
        }
      }
      this.byPlural = plurals.build();
      this.bySingular = singulars.build();
      this.byShortName = shortNames.build();
    }

    static String key(String name) {
      return name.toLowerCase(Locale.ROOT);
    }

    /** Returns the plural names of all kinds, sorted. */
    public ImmutableSortedSet<String> pluralNames() {
      return ImmutableSortedSet.copyOf(byPlural.keySet());
    }

    /** Returns every name by which a kind can be referenced. */
    ImmutableSortedSet<String> allNames() {
      return ImmutableSortedSet.<String>naturalOrder()
          .addAll(byPlural.keySet())
          .addAll(bySingular.keySet())
          .addAll(byShortName.keySet())
          .build();
    }
  }
}
