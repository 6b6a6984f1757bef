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

import org.apache.calcite.jdbc.JavaTypeFactoryImpl;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.lookup.LikePattern;
import org.apache.calcite.schema.lookup.Named;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit test for {@link KubernetesSchema} and {@link KubernetesTable}.
 */
class KubernetesSchemaTest {
  private final FixtureKubernetesApi api = FixtureKubernetesApi.cluster();
  private final KubernetesSchema schema =
      new KubernetesSchema(api, KubernetesSchemaConfigImpl.of(ImmutableMap.of()));

  private KubernetesTable table(String name) {
    return table(schema, name);
  }

  private static KubernetesTable table(KubernetesSchema schema, String name) {
    final Table table = schema.tables().get(name);
    assertThat(table, instanceOf(KubernetesTable.class));
    return (KubernetesTable) table;
  }

  @Test void testTableNames() {
    final Set<String> names = schema.tables().getNames(LikePattern.any());
    assertThat(names,
        hasItems("pods", "nodes", "deployments", "widgets", "gizmos"));
    assertThat(names.contains("po"), is(false));
  }

  @Test void testLookupIgnoringCase() {
    final Table table = Named.entityOrNull(schema.tables().getIgnoreCase("PODS"));
    assertThat(table, instanceOf(KubernetesTable.class));
    assertThat(((KubernetesTable) table).resource().descriptor
        .qualifiedName(), is("pods.core"));
  }

  @Test void testEveryLookupCreatesNewTable() {
    final KubernetesTable table1 = table("pods");
    final KubernetesTable table2 = table("pods");
    assertThat(table1, not(sameInstance(table2)));
    assertThat(api.listCalls(), empty());

    final JavaTypeFactoryImpl typeFactory = new JavaTypeFactoryImpl();
    table1.getRowType(typeFactory);
    table1.getRowType(typeFactory);
    table2.getRowType(typeFactory);
    assertThat(api.listCalls(),
        contains("pods.core/default", "pods.core/default"));
  }

  @Test void testUnknownTableIsNotFetched() {
    assertThrows(UnknownResourceException.class,
        () -> schema.tables().get("pdos"));
    assertThrows(InvalidTableNameException.class,
        () -> schema.tables().get("pods/a/b"));
    assertThat(api.listCalls(), empty());
  }

  @Test void testRowType() {
    final RelDataType rowType =
        table("pods").getRowType(new JavaTypeFactoryImpl());
    assertThat(rowType.getFieldNames(),
        contains("apiVersion", "kind", "metadata.name", "metadata.namespace",
            "metadata.labels.app", "metadata.labels.'app.kubernetes.io/name'",
            "spec.nodeName", "spec.priority", "spec.containers", "status.phase",
            "status.podIP"));
    assertThat(rowType.getField("metadata.name", true, false).getType()
        .isNullable(), is(false));
    assertThat(rowType.getField("spec.nodeName", true, false).getType()
        .isNullable(), is(true));
  }

  @Test void testStatistic() {
    final KubernetesTable table = table("pods");
    assertThat(table.getStatistic().getRowCount(), nullValue());
    table.getRowType(new JavaTypeFactoryImpl());
    assertThat(table.getStatistic().getRowCount(), is(3d));
  }

  @Test void testNamespaceQualifiedTable() {
    final KubernetesTable table = table("pods/kube-system");
    assertThat(table.documents(null), hasSize(1));
    assertThat(api.listCalls(), contains("pods.core/kube-system"));
  }

  @Test void testClusterScopedTableWithNamespace() {
    final KubernetesTable table = table("nodes/kube-system");
    assertThat(table.resource().warnings, hasSize(1));
    assertThat(table.documents(null), hasSize(3));
    assertThat(api.listCalls(), contains("nodes.core"));
  }

  @Test void testDefaultNamespaceFromOperand() {
    final KubernetesSchema schema =
        new KubernetesSchema(api,
            KubernetesSchemaConfigImpl.of(
                ImmutableMap.of("namespace", "kube-system")));
    final KubernetesTable table = table(schema, "po");
    assertThat(table.resource().namespace, is("kube-system"));
  }

  @Test void testTableListsOnce() {
    final KubernetesTable table = table("pods");
    final JavaTypeFactoryImpl typeFactory = new JavaTypeFactoryImpl();
    table.getRowType(typeFactory);
    table.getStatistic();
    table.documents(null);
    assertThat(api.listCalls(), contains("pods.core/default"));
  }

  @Test void testCloseClosesApiOnce() {
    final FixtureKubernetesApi api = FixtureKubernetesApi.cluster();
    final KubernetesSchema schema =
        new KubernetesSchema(api,
            KubernetesSchemaConfigImpl.of(ImmutableMap.of()));
    assertThat(api.closeCount(), is(0));
    schema.close();
    schema.close();
    assertThat(api.closeCount(), is(1));
  }

  @Test void testManagedFieldsAreStripped() {
    final KubernetesTable table = table("pods");
    table.getRowType(new JavaTypeFactoryImpl());
    assertThat(table.documents(null).get(0).get("metadata").has("managedFields"),
        is(false));
  }
}
