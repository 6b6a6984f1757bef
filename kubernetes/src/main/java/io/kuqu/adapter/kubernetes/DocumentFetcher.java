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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.kuqu.adapter.kubernetes.KubernetesStatic.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Retrieves the current objects of a resolved resource kind.
 *
 * <p>The list call runs on a separate thread so that the calling thread can
 * give up on it when the statement is cancelled or the timeout expires; the
 * call is then interrupted and its result, if any, discarded.
 *
 * <p>Returned documents are copies; the ones the client returned are not
 * modified.
 */
public class DocumentFetcher {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DocumentFetcher.class);

  private static final ExecutorService EXECUTOR =
      Executors.newCachedThreadPool(
          new ThreadFactoryBuilder()
              .setDaemon(true)
              .setNameFormat("kubernetes-fetch-%d")
              .build());

  /** How often the cancel flag is checked while a list call runs. */
  private static final long POLL_MILLIS = 100;

  private final KubernetesApi api;
  private final boolean stripManagedFields;
  private final long timeoutMillis;

  /** Creates a DocumentFetcher.
   *
   * @param api Cluster API
   * @param stripManagedFields Whether to remove
   *                           {@code metadata.managedFields}
   * @param timeoutMillis Maximum time to wait for a list call, in
   *                      milliseconds; zero or negative to wait forever
   */
  public DocumentFetcher(KubernetesApi api, boolean stripManagedFields,
      long timeoutMillis) {
    this.api = requireNonNull(api, "api");
    this.stripManagedFields = stripManagedFields;
    this.timeoutMillis = timeoutMillis;
  }

  /** Lists the objects of a resource.
   *
   * @param resource Resolved resource
   * @param cancelFlag Flag that is set when the statement is cancelled, or
   *                   null; the interrupt status of the current thread is
   *                   honored either way
   * @return Documents, in the order the cluster returned them
   * @throws ResourceFetchException if the list call fails, is cancelled or
   *         times out
   */
  public List<ObjectNode> fetch(ResolvedResource resource,
      @Nullable AtomicBoolean cancelFlag) {
    checkCancelled(resource, cancelFlag);
    LOGGER.debug("Listing {}", resource);
    final Future<List<ObjectNode>> future =
        EXECUTOR.submit(() ->
            api.listResources(resource.descriptor, resource.namespace));
    final List<ObjectNode> documents = await(future, resource, cancelFlag);
    final ImmutableList.Builder<ObjectNode> builder = ImmutableList.builder();
    for (ObjectNode document : documents) {
      builder.add(normalize(document, resource.descriptor));
    }
    final ImmutableList<ObjectNode> list = builder.build();
    LOGGER.debug("Listed {} objects of {}", list.size(), resource);
    return list;
  }

  /** Throws if the statement has been cancelled. */
  public static void checkCancelled(ResolvedResource resource,
      @Nullable AtomicBoolean cancelFlag) {
    if (isCancelled(cancelFlag)) {
      throw RESOURCE.fetchCancelled(resource.reference.rawName,
          resource.scope()).ex();
    }
  }

  private static boolean isCancelled(@Nullable AtomicBoolean cancelFlag) {
    return cancelFlag != null && cancelFlag.get()
        || Thread.currentThread().isInterrupted();
  }

  private List<ObjectNode> await(Future<List<ObjectNode>> future,
      ResolvedResource resource, @Nullable AtomicBoolean cancelFlag) {
    final long start = System.nanoTime();
    final long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    for (;;) {
      if (isCancelled(cancelFlag)) {
        future.cancel(true);
        throw RESOURCE.fetchCancelled(resource.reference.rawName,
            resource.scope()).ex();
      }
      long waitNanos = TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS);
      if (timeoutMillis > 0) {
        final long remaining = timeoutNanos - (System.nanoTime() - start);
        if (remaining <= 0) {
          future.cancel(true);
          throw RESOURCE.fetchTimedOut(resource.reference.rawName,
              resource.scope(), timeoutMillis).ex();
        }
        waitNanos = Math.min(waitNanos, remaining);
      }
      try {
        return future.get(waitNanos, TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        LOGGER.trace("Still listing {}", resource);
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        throw RESOURCE.fetchCancelled(resource.reference.rawName,
            resource.scope()).ex();
      } catch (ExecutionException e) {
        final Throwable cause = e.getCause() == null ? e : e.getCause();
        throw RESOURCE.fetchFailed(resource.reference.rawName,
            resource.scope()).ex(cause);
      }
    }
  }

  /** Returns a copy of a document that starts with {@code apiVersion} and
   * {@code kind} (list responses omit them from their items) and, if
   * configured, lacks {@code metadata.managedFields}. */
  ObjectNode normalize(ObjectNode document, ResourceDescriptor descriptor) {
    final ObjectNode normalized = document.objectNode();
    normalized.set("apiVersion",
        orDefault(document.get("apiVersion"), descriptor.apiVersion()));
    normalized.set("kind", orDefault(document.get("kind"), descriptor.kind));
    for (Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
         fields.hasNext();) {
      final Map.Entry<String, JsonNode> field = fields.next();
      switch (field.getKey()) {
      case "apiVersion":
      case "kind":
        break;
      case "metadata":
        normalized.set("metadata", metadata(field.getValue()));
        break;
      default:
        normalized.set(field.getKey(), field.getValue().deepCopy());
      }
    }
    return normalized;
  }

  private JsonNode metadata(JsonNode metadata) {
    final JsonNode copy = metadata.deepCopy();
    if (stripManagedFields && copy instanceof ObjectNode) {
      ((ObjectNode) copy).remove("managedFields");
    }
    return copy;
  }

  private static JsonNode orDefault(@Nullable JsonNode node, String value) {
    return node == null || node.isNull() ? TextNode.valueOf(value) : node;
  }
}
