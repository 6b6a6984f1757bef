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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Implementation of {@link KubernetesApi} that serves a fixed set of
 * resource kinds and objects, and records the list calls made to it.
 *
 * <p>Objects are keyed by the qualified name of their kind, for example
 * "pods.core" or "deployments.apps".
 */
public class FixtureKubernetesApi implements KubernetesApi {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ImmutableList<ApiResource> resources;
  private final ImmutableMap<String, ImmutableList<ObjectNode>> objects;
  private final @Nullable String defaultNamespace;
  private final List<String> listCalls = new CopyOnWriteArrayList<>();
  private int discoveryCount;
  private int closeCount;

  public FixtureKubernetesApi(List<ApiResource> resources,
      Map<String, ? extends List<ObjectNode>> objects,
      @Nullable String defaultNamespace) {
    this.resources = ImmutableList.copyOf(resources);
    final ImmutableMap.Builder<String, ImmutableList<ObjectNode>> builder =
        ImmutableMap.builder();
    objects.forEach((name, list) -> builder.put(name, ImmutableList.copyOf(list)));
    this.objects = builder.build();
    this.defaultNamespace = defaultNamespace;
  }

  /** Loads a fixture from a JSON file on the class path. */
  public static FixtureKubernetesApi load(String resourcePath) {
    try (InputStream stream =
             FixtureKubernetesApi.class.getResourceAsStream(resourcePath)) {
      requireNonNull(stream, () -> "fixture not found: " + resourcePath);
      return fromJson(MAPPER.readTree(stream));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Loads the standard fixture, "/cluster.json". */
  public static FixtureKubernetesApi cluster() {
    return load("/cluster.json");
  }

  private static FixtureKubernetesApi fromJson(JsonNode root) {
    final List<ApiResource> resources = new ArrayList<>();
    for (JsonNode r : root.get("resources")) {
      final List<String> shortNames = new ArrayList<>();
      for (JsonNode shortName : r.path("shortNames")) {
        shortNames.add(shortName.asText());
      }
      resources.add(
          new ApiResource(r.get("group").asText(), r.get("version").asText(),
              r.get("kind").asText(), r.get("plural").asText(),
              r.path("singular").asText(null), shortNames,
              r.get("namespaced").asBoolean()));
    }
    final ImmutableMap.Builder<String, List<ObjectNode>> objects =
        ImmutableMap.builder();
    for (Iterator<Map.Entry<String, JsonNode>> entries =
         root.path("objects").fields(); entries.hasNext();) {
      final Map.Entry<String, JsonNode> entry = entries.next();
      final List<ObjectNode> list = new ArrayList<>();
      entry.getValue().forEach(node -> list.add((ObjectNode) node));
      objects.put(entry.getKey(), list);
    }
    final JsonNode namespace = root.get("namespace");
    return new FixtureKubernetesApi(resources, objects.build(),
        namespace == null ? null : namespace.asText());
  }

  @Override public synchronized List<ApiResource> discoverResourceKinds() {
    ++discoveryCount;
    return resources;
  }

  @Override public List<ObjectNode> listResources(ResourceDescriptor descriptor,
      @Nullable String namespace) {
    listCalls.add(descriptor.qualifiedName()
        + (namespace == null ? "" : "/" + namespace));
    final List<ObjectNode> list = new ArrayList<>();
    for (ObjectNode object
        : objects.getOrDefault(descriptor.qualifiedName(), ImmutableList.of())) {
      if (namespace == null
          || namespace.equals(object.path("metadata").path("namespace").asText())) {
        list.add(object.deepCopy());
      }
    }
    return list;
  }

  @Override public @Nullable String defaultNamespace() {
    return defaultNamespace;
  }

  @Override public synchronized void close() {
    ++closeCount;
  }

  /** Returns the list calls made so far, as "plural.group/namespace". */
  public List<String> listCalls() {
    return ImmutableList.copyOf(listCalls);
  }

  public synchronized int discoveryCount() {
    return discoveryCount;
  }

  public synchronized int closeCount() {
    return closeCount;
  }
}
