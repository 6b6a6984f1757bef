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

import org.apache.calcite.runtime.SqlFunctions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.kuqu.adapter.kubernetes.KubernetesStatic.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Maps table names to resource kinds and namespaces.
 *
 * <p>A name is matched, in order, against plural names, singular names and
 * short names; the first of these tiers that matches anything wins. If
 * nothing matches and the name contains a dot, the part after the first
 * dot is taken to be an API group ({@code core} for the core group) and the
 * part before it is matched the same way among the kinds of that group.
 * A plural or singular name that the core group shares with other groups
 * designates the core kind, as it does for {@code kubectl}.
 *
 * <p>Names are matched case-insensitively.
 */
public class ResourceResolver {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ResourceResolver.class);

  /** Group qualifier that designates the core API group. */
  public static final String CORE_GROUP = "core";

  /** Namespace used when neither the schema nor the kubeconfig names one. */
  public static final String DEFAULT_NAMESPACE = "default";

  private static final int MAX_SUGGESTIONS = 5;

  private final ResourceDiscovery discovery;
  private final String defaultNamespace;

  public ResourceResolver(ResourceDiscovery discovery,
      String defaultNamespace) {
    this.discovery = requireNonNull(discovery, "discovery");
    this.defaultNamespace =
        requireNonNull(defaultNamespace, "defaultNamespace");
  }

  /** Chooses the default namespace: the configured one if set, otherwise
   * the namespace of the kubeconfig context, otherwise "default". */
  public static String defaultNamespace(@Nullable String configured,
      @Nullable String contextNamespace) {
    if (configured != null && !configured.isEmpty()) {
      return configured;
    }
    if (contextNamespace != null && !contextNamespace.isEmpty()) {
      return contextNamespace;
    }
    return DEFAULT_NAMESPACE;
  }

  public String defaultNamespace() {
    return defaultNamespace;
  }

  /** Resolves a table name.
   *
   * @throws UnknownResourceException if no kind has that name
   * @throws AmbiguousResourceException if kinds of several API groups have
   *         that name
   * @throws ResourceFetchException if discovery fails
   */
  public ResolvedResource resolve(TableReference reference) {
    final ResourceDiscovery.Snapshot snapshot = discovery.snapshot();
    final String name = ResourceDiscovery.Snapshot.key(reference.rawName);
    List<ApiResource> candidates = match(snapshot, name, null);
    if (candidates.isEmpty() && reference.isGroupQualified()) {
      final int dot = name.indexOf('.');
      final String group = name.substring(dot + 1);
      candidates =
          match(snapshot, name.substring(0, dot),
              CORE_GROUP.equals(group) ? "" : group);
    }
    if (candidates.isEmpty()) {
      throw unknownResource(reference, snapshot);
    }
    if (candidates.size() > 1) {
      throw RESOURCE.ambiguousResource(reference.rawName,
          candidates.stream()
              .map(resource -> resource.descriptor().qualifiedName())
              .collect(Collectors.joining(", "))).ex();
    }
    final ResourceDescriptor descriptor = candidates.get(0).descriptor();

    final List<String> warnings = new ArrayList<>();
    final @Nullable String namespace;
    if (!descriptor.namespaced) {
      if (reference.namespace != null && !reference.isAllNamespaces()) {
        final String warning =
            RESOURCE.namespaceIgnored(reference.rawName, reference.namespace)
                .str();
        LOGGER.warn(warning);
        warnings.add(warning);
      }
      namespace = null;
    } else if (reference.namespace == null) {
      namespace = defaultNamespace;
    } else if (reference.isAllNamespaces()) {
      namespace = null;
    } else {
      namespace = reference.namespace;
    }
    final ResolvedResource resolved =
        new ResolvedResource(reference, descriptor, namespace, warnings);
    LOGGER.debug("Resolved table '{}' to {}", reference, resolved);
    return resolved;
  }

  /** Returns the kinds called {@code name} in the first tier that has any,
   * one per group, optionally restricted to one group.
   *
   * <p>If a plural or singular name is served by the core group and by
   * other groups, as {@code pods} is by the core group and
   * {@code metrics.k8s.io}, only the core kind is returned. Short names get
   * no such preference. */
  private static List<ApiResource> match(ResourceDiscovery.Snapshot snapshot,
      String name, @Nullable String group) {
    final List<ListMultimap<String, ApiResource>> tiers =
        ImmutableList.of(snapshot.byPlural, snapshot.bySingular,
            snapshot.byShortName);
    for (ListMultimap<String, ApiResource> tier : tiers) {
      // Discovery lists the preferred version of a group first
      final Map<String, ApiResource> byGroup = new LinkedHashMap<>();
      for (ApiResource resource : tier.get(name)) {
        if (group == null || group.equals(resource.group)) {
          byGroup.putIfAbsent(resource.group, resource);
        }
      }
      if (byGroup.isEmpty()) {
        continue;
      }
      final ApiResource core = byGroup.get("");
      if (core != null && tier != snapshot.byShortName) {
        return ImmutableList.of(core);
      }
      return new ArrayList<>(byGroup.values());
    }
    return ImmutableList.of();
  }

  private static UnknownResourceException unknownResource(
      TableReference reference, ResourceDiscovery.Snapshot snapshot) {
    final List<String> suggestions =
        suggestions(ResourceDiscovery.Snapshot.key(reference.rawName),
            snapshot);
    if (suggestions.isEmpty()) {
      return RESOURCE.unknownResource(reference.rawName).ex();
    }
    return RESOURCE.unknownResourceWithCandidates(reference.rawName,
        String.join(", ", suggestions)).ex();
  }

  /** Returns up to five known names that are close to a given name: those
   * it is a prefix of, and those within a small edit distance, nearest
   * first. */
  static List<String> suggestions(String name,
      ResourceDiscovery.Snapshot snapshot) {
    final String target =
        name.indexOf('.') > 0 ? name.substring(0, name.indexOf('.')) : name;
    final int maxDistance = Math.max(2, target.length() / 3);
    return snapshot.allNames().stream()
        .filter(candidate -> candidate.startsWith(target)
            || SqlFunctions.levenshtein(target, candidate) <= maxDistance)
        .sorted(
            Comparator.comparingInt((String candidate) ->
                    SqlFunctions.levenshtein(target, candidate))
                .thenComparing(Comparator.naturalOrder()))
        .limit(MAX_SUGGESTIONS)
        .collect(Collectors.toList());
  }
}
