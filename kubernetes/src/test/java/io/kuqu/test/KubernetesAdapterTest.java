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
package io.kuqu.test;

import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import io.kuqu.adapter.kubernetes.AmbiguousResourceException;
import io.kuqu.adapter.kubernetes.FixtureKubernetesApi;
import io.kuqu.adapter.kubernetes.FixtureKubernetesApiFactory;
import io.kuqu.adapter.kubernetes.KubernetesSchema;
import io.kuqu.adapter.kubernetes.KubernetesSchemaConfigImpl;
import io.kuqu.adapter.kubernetes.KubernetesSchemaFactory;
import io.kuqu.adapter.kubernetes.UnknownResourceException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the {@code io.kuqu.adapter.kubernetes} package, running SQL
 * through Calcite's JDBC driver against a fixture cluster.
 *
 * <p>The fixture has three pods in namespace "default" (two of them
 * running, on nodes "node-a" and "node-b"), one pod in "kube-system" and
 * three nodes.
 */
class KubernetesAdapterTest {
  private final FixtureKubernetesApi api = FixtureKubernetesApi.cluster();

  /** Connects to a root schema that contains a Kubernetes schema "k8s"
   * backed by the fixture. */
  private Connection connect(Map<String, Object> operand) throws SQLException {
    final Connection connection = DriverManager.getConnection("jdbc:calcite:");
    final CalciteConnection calciteConnection =
        connection.unwrap(CalciteConnection.class);
    final SchemaPlus rootSchema = calciteConnection.getRootSchema();
    rootSchema.add("k8s",
            new KubernetesSchema(api, KubernetesSchemaConfigImpl.of(operand)))
        .setCacheEnabled(false);
    return connection;
  }

  private List<String> query(String sql) throws SQLException {
    try (Connection connection = connect(ImmutableMap.of())) {
      return query(connection, sql);
    }
  }

  /** Runs a query and returns its rows, each as its columns joined with
   * "; ". */
  private static List<String> query(Connection connection, String sql)
      throws SQLException {
    final List<String> rows = new ArrayList<>();
    try (Statement statement = connection.createStatement();
         ResultSet resultSet = statement.executeQuery(sql)) {
      final int columnCount = resultSet.getMetaData().getColumnCount();
      while (resultSet.next()) {
        final StringBuilder b = new StringBuilder();
        for (int i = 1; i <= columnCount; i++) {
          if (i > 1) {
            b.append("; ");
          }
          b.append(resultSet.getString(i));
        }
        rows.add(b.toString());
      }
    }
    return rows;
  }

  @Test void testFilterRunningPods() throws SQLException {
    final List<String> rows =
        query("select \"metadata.name\" from \"k8s\".\"pods\"\n"
            + "where \"status.phase\" = 'Running'\n"
            + "order by \"metadata.name\"");
    assertThat(rows, contains("web-1", "web-2"));
  }

  @Test void testShortNameAndProjection() throws SQLException {
    final List<String> rows =
        query("select \"metadata.name\", \"spec.nodeName\", \"spec.priority\"\n"
            + "from \"k8s\".\"po\"\n"
            + "order by \"spec.priority\" desc, \"metadata.name\"");
    assertThat(rows,
        contains("job-1; null; 1000", "web-1; node-a; 0", "web-2; node-b; 0"));
  }

  @Test void testJoinPodsToNodes() throws SQLException {
    final List<String> rows =
        query("select p.\"metadata.name\", n.\"metadata.name\"\n"
            + "from \"k8s\".\"pods\" as p\n"
            + "join \"k8s\".\"nodes\" as n\n"
            + "on p.\"spec.nodeName\" = n.\"metadata.name\"\n"
            + "order by 1");
    assertThat(rows, contains("web-1; node-a", "web-2; node-b"));
  }

  @Test void testJoinSameKindTwice() throws SQLException {
    final List<String> rows =
        query("select a.\"metadata.name\", b.\"metadata.name\"\n"
            + "from \"k8s\".\"pods\" as a\n"
            + "join \"k8s\".\"pods/kube-system\" as b\n"
            + "on a.\"spec.nodeName\" = b.\"spec.nodeName\"");
    assertThat(rows, contains("web-1; coredns-1"));
    assertThat(api.listCalls(), hasItem("pods.core/default"));
    assertThat(api.listCalls(), hasItem("pods.core/kube-system"));
  }

  @Test void testSelfJoinListsEachReference() throws SQLException {
    final List<String> rows =
        query("select count(*)\n"
            + "from \"k8s\".\"pods\" as a\n"
            + "join \"k8s\".\"pods\" as b\n"
            + "on a.\"metadata.name\" = b.\"metadata.name\"");
    assertThat(rows, contains("3"));
    assertThat(api.listCalls(),
        contains("pods.core/default", "pods.core/default"));
  }

  @Test void testSingleReferenceListsOnce() throws SQLException {
    final List<String> rows =
        query("select count(*) from \"k8s\".\"pods\"\n"
            + "where \"status.phase\" = 'Running'");
    assertThat(rows, contains("2"));
    assertThat(api.listCalls(), contains("pods.core/default"));
  }

  @Test void testAggregateAcrossNamespaces() throws SQLException {
    final List<String> rows =
        query("select \"metadata.namespace\", count(*)\n"
            + "from \"k8s\".\"pods/*\"\n"
            + "group by \"metadata.namespace\"\n"
            + "order by 1");
    assertThat(rows, contains("default; 3", "kube-system; 1"));
    assertThat(api.listCalls(), hasItem("pods.core"));
  }

  @Test void testNamespaceQualifierOnClusterScopedKind() throws SQLException {
    final List<String> rows =
        query("select count(*) from \"k8s\".\"nodes/kube-system\"");
    assertThat(rows, contains("3"));
  }

  @Test void testBooleanAndMissingColumns() throws SQLException {
    final List<String> rows =
        query("select \"metadata.name\" from \"k8s\".\"nodes\"\n"
            + "where \"spec.unschedulable\" is not true\n"
            + "order by 1");
    assertThat(rows, contains("node-a", "node-b"));
  }

  @Test void testDottedLabelColumn() throws SQLException {
    final List<String> rows =
        query("select \"metadata.labels.'kubernetes.io/hostname'\"\n"
            + "from \"k8s\".\"nodes\"\n"
            + "where \"status.capacity.cpu\" = '8'");
    assertThat(rows, contains("node-b"));
  }

  @Test void testListColumnIsJson() throws SQLException {
    final List<String> rows =
        query("select json_value(\"spec.containers\", 'lax $[0].image')\n"
            + "from \"k8s\".\"pods\"\n"
            + "where \"metadata.name\" = 'job-1'");
    assertThat(rows, contains("busybox:1.36"));
  }

  @Test void testGroupQualifiedName() throws SQLException {
    final List<String> rows =
        query("select \"kind\", \"apiVersion\", \"spec.replicas\"\n"
            + "from \"k8s\".\"deployments.apps\"");
    assertThat(rows, contains("Deployment; apps/v1; 2"));
  }

  @Test void testEmptyNamespace() throws SQLException {
    final List<String> rows =
        query("select \"metadata.name\" from \"k8s\".\"services\"");
    assertThat(rows, empty());
  }

  @Test void testUnknownTable() {
    final SQLException e =
        assertThrows(SQLException.class,
            () -> query("select * from \"k8s\".\"pdos\""));
    final UnknownResourceException cause =
        findCause(e, UnknownResourceException.class);
    assertThat(cause.getMessage(), containsString("Resource 'pdos' not found"));
    assertThat(cause.getMessage(), containsString("pods"));
    assertThat(api.listCalls(), empty());
  }

  @Test void testAmbiguousTable() {
    final SQLException e =
        assertThrows(SQLException.class,
            () -> query("select * from \"k8s\".\"x\""));
    final AmbiguousResourceException cause =
        findCause(e, AmbiguousResourceException.class);
    assertThat(cause.getMessage(),
        containsString("widgets.groupa.example.com"));
    assertThat(api.listCalls(), empty());
  }

  @Test void testGroupQualifierResolvesAmbiguity() throws SQLException {
    assertThat(query("select * from \"k8s\".\"x.groupb.example.com\""),
        empty());
    assertThat(api.listCalls(), hasItem("gizmos.groupb.example.com/default"));
  }

  @Test void testDefaultNamespaceOperand() throws SQLException {
    try (Connection connection =
             connect(ImmutableMap.of("namespace", "kube-system"))) {
      assertThat(query(connection, "select \"metadata.name\" from \"k8s\".\"pods\""),
          contains("coredns-1"));
    }
  }

  @Test void testModel() throws SQLException {
    final String model = "inline:"
        + "{\n"
        + "  version: '1.0',\n"
        + "  schemas: [\n"
        + "    {\n"
        + "      name: 'k8s',\n"
        + "      type: 'custom',\n"
        + "      factory: '" + KubernetesSchemaFactory.class.getName() + "',\n"
        + "      cache: false,\n"
        + "      operand: {\n"
        + "        apiFactory: '" + FixtureKubernetesApiFactory.class.getName()
        + "',\n"
        + "        namespace: 'kube-system',\n"
        + "        fanOutThreshold: 1\n"
        + "      }\n"
        + "    }\n"
        + "  ]\n"
        + "}";
    final Properties info = new Properties();
    info.setProperty("model", model);
    try (Connection connection =
             DriverManager.getConnection("jdbc:calcite:", info)) {
      final List<String> rows =
          query(connection,
              "select \"kind\", \"status\" from \"k8s\".\"pods\"");
      assertThat(rows,
          contains("Pod; {\"phase\":\"Running\",\"podIP\":\"10.0.1.2\"}"));
    }
  }

  @Test void testTableMetadata() throws SQLException {
    try (Connection connection = connect(ImmutableMap.of());
         ResultSet tables =
             connection.getMetaData().getTables(null, "k8s", "%", null)) {
      final List<String> names = new ArrayList<>();
      while (tables.next()) {
        names.add(tables.getString("TABLE_NAME"));
      }
      assertThat(names, hasItem("pods"));
      assertThat(names, hasSize(7));
    }
  }

  private static <T extends Throwable> T findCause(Throwable e,
      Class<T> causeClass) {
    for (Throwable t : Throwables.getCausalChain(e)) {
      if (causeClass.isInstance(t)) {
        return causeClass.cast(t);
      }
    }
    assertThat(e, instanceOf(causeClass));
    throw new AssertionError("unreachable");
  }
}
