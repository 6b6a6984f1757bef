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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.fabric8.kubernetes.api.model.APIGroup;
import io.fabric8.kubernetes.api.model.APIGroupList;
import io.fabric8.kubernetes.api.model.APIResource;
import io.fabric8.kubernetes.api.model.APIResourceList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.GroupVersionForDiscovery;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

import static java.util.Objects.requireNonNull;

/**
 * Implementation of {@link KubernetesApi} on top of the fabric8 Kubernetes
 * client.
 *
 * <p>The client is configured from the kubeconfig file (or the in-cluster
 * service account) the same way {@code kubectl} is.
 */
public class Fabric8KubernetesApi implements KubernetesApi {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Fabric8KubernetesApi.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /** Default factory; creates a client from the kubeconfig. */
  public static final KubernetesApiFactory FACTORY = Fabric8KubernetesApi::create;

  private final KubernetesClient client;

  public Fabric8KubernetesApi(KubernetesClient client) {
    this.client = requireNonNull(client, "client");
  }

  /** Creates an API backed by a new client, configured from the kubeconfig
   * context and master URL of a schema configuration. */
  public static Fabric8KubernetesApi create(KubernetesSchemaConfig config) {
    Config clientConfig = Config.autoConfigure(config.context());
    final String masterUrl = config.masterUrl();
    if (masterUrl != null) {
      clientConfig = new ConfigBuilder(clientConfig)
          .withMasterUrl(masterUrl)
          .build();
    }
    LOGGER.debug("Connecting to {} (context {})", clientConfig.getMasterUrl(),
        config.context() == null ? "<current>" : config.context());
    return new Fabric8KubernetesApi(
        new KubernetesClientBuilder().withConfig(clientConfig).build());
  }

  @Override public List<ApiResource> discoverResourceKinds() {
    final ImmutableList.Builder<ApiResource> builder = ImmutableList.builder();
    final APIResourceList core = get("/api/v1", APIResourceList.class);
    if (core != null) {
      addResources(builder, "", "v1", core);
    }
    final APIGroupList groups = get("/apis", APIGroupList.class);
    if (groups == null) {
      return builder.build();
    }
    for (APIGroup group : groups.getGroups()) {
      for (String version : versions(group)) {
        final String groupVersion = group.getName() + "/" + version;
        final APIResourceList resources;
        try {
          resources = get("/apis/" + groupVersion, APIResourceList.class);
        } catch (KubernetesClientException e) {
          // Aggregated API servers (metrics, custom metrics) are often
          // unavailable; discovery of the rest of the cluster goes on.
          LOGGER.warn("Skipping API group version {}: {}", groupVersion,
              e.getMessage());
          continue;
        }
        if (resources != null) {
          addResources(builder, group.getName(), version, resources);
        }
      }
    }
    return builder.build();
  }

  /** Returns the versions of a group, preferred version first. */
  private static List<String> versions(APIGroup group) {
    final Set<String> versions = new LinkedHashSet<>();
    final GroupVersionForDiscovery preferred = group.getPreferredVersion();
    if (preferred != null && preferred.getVersion() != null) {
      versions.add(preferred.getVersion());
    }
    for (GroupVersionForDiscovery version : group.getVersions()) {
      versions.add(version.getVersion());
    }
    return new ArrayList<>(versions);
  }

  private static void addResources(ImmutableList.Builder<ApiResource> builder,
      String group, String version, APIResourceList list) {
    for (APIResource resource : list.getResources()) {
      if (resource.getName().contains("/")) {
        continue; // sub-resource, such as "pods/log"
      }
      builder.add(
          new ApiResource(group, version, resource.getKind(),
              resource.getName(), resource.getSingularName(),
              resource.getShortNames(),
              Boolean.TRUE.equals(resource.getNamespaced())));
    }
  }

  private <T> @Nullable T get(String uri, Class<T> clazz) {
    final String json = client.raw(uri);
    if (json == null) {
      return null;
    }
    try {
      return MAPPER.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new KubernetesClientException("Invalid response from " + uri, e);
    }
  }

  @Override public List<ObjectNode> listResources(ResourceDescriptor descriptor,
      @Nullable String namespace) {
    final ResourceDefinitionContext context =
        new ResourceDefinitionContext.Builder()
            .withGroup(descriptor.group)
            .withVersion(descriptor.version)
            .withKind(descriptor.kind)
            .withPlural(descriptor.plural)
            .withNamespaced(descriptor.namespaced)
            .build();
    final GenericKubernetesResourceList list;
    if (!descriptor.namespaced) {
      list = client.genericKubernetesResources(context).list();
    } else if (namespace == null) {
      list = client.genericKubernetesResources(context).inAnyNamespace().list();
    } else {
      list = client.genericKubernetesResources(context).inNamespace(namespace)
          .list();
    }
    final List<ObjectNode> documents = new ArrayList<>(list.getItems().size());
    for (GenericKubernetesResource item : list.getItems()) {
      documents.add(MAPPER.valueToTree(item));
    }
    return documents;
  }

  @Override public @Nullable String defaultNamespace() {
    return client.getConfiguration().getNamespace();
  }

  @Override public void close() {
    client.close();
  }
}
