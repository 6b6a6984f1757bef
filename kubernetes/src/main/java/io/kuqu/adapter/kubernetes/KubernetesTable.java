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

import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.schema.ProjectableFilterableTable;
import org.apache.calcite.schema.Statistic;
import org.apache.calcite.schema.Statistics;
import org.apache.calcite.schema.impl.AbstractTable;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Table whose rows are the objects of one Kubernetes resource kind in one
 * namespace (or in all namespaces).
 *
 * <p>The objects are listed once, when the row type or the rows are first
 * needed, and kept for the life of this table. The schema creates a table
 * for every reference to it, so each reference in a query sees its own
 * listing.
 *
 * <p>Filters are not pushed down to the API server; Calcite evaluates them
 * all.
 */
public class KubernetesTable extends AbstractTable
    implements ProjectableFilterableTable {
  private final ResolvedResource resource;
  private final DocumentFetcher fetcher;
  private final SchemaInferrer inferrer;

  private @Nullable List<ObjectNode> documents;
  private @Nullable InferredSchema schema;

  KubernetesTable(ResolvedResource resource, DocumentFetcher fetcher,
      SchemaInferrer inferrer) {
    this.resource = requireNonNull(resource, "resource");
    this.fetcher = requireNonNull(fetcher, "fetcher");
    this.inferrer = requireNonNull(inferrer, "inferrer");
  }

  /** Returns the resource kind and namespace this table lists. */
  public ResolvedResource resource() {
    return resource;
  }

  @Override public String toString() {
    return "KubernetesTable {" + resource.reference + "}";
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return schema(null).toRelDataType(typeFactory);
  }

  @Override public Statistic getStatistic() {
    final List<ObjectNode> documents = documentsIfKnown();
    if (documents == null) {
      return Statistics.UNKNOWN;
    }
    return Statistics.of(documents.size(), ImmutableList.of());
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root,
      List<RexNode> filters, int @Nullable [] projects) {
    final AtomicBoolean cancelFlag = DataContext.Variable.CANCEL_FLAG.get(root);
    final List<ObjectNode> documents = documents(cancelFlag);
    final RowMaterializer materializer =
        new RowMaterializer(schema(cancelFlag), projects);
    return Linq4j.asEnumerable(documents).select(materializer::materialize);
  }

  private synchronized @Nullable List<ObjectNode> documentsIfKnown() {
    return documents;
  }

  /** Returns the objects, listing them if that has not been done yet. */
  synchronized List<ObjectNode> documents(@Nullable AtomicBoolean cancelFlag) {
    List<ObjectNode> documents = this.documents;
    if (documents == null) {
      documents = fetcher.fetch(resource, cancelFlag);
      this.documents = documents;
    }
    return documents;
  }

  /** Returns the schema inferred from the objects. */
  synchronized InferredSchema schema(@Nullable AtomicBoolean cancelFlag) {
    InferredSchema schema = this.schema;
    if (schema == null) {
      final List<ObjectNode> documents = documents(cancelFlag);
      DocumentFetcher.checkCancelled(resource, cancelFlag);
      schema = inferrer.infer(documents);
      this.schema = schema;
    }
    return schema;
  }
}
