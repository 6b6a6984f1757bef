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

import org.apache.calcite.runtime.CalciteException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class for the errors raised by the Kubernetes adapter.
 *
 * <p>Errors are unchecked, like the rest of Calcite's runtime errors, so
 * that they can travel through the {@link org.apache.calcite.schema.Schema}
 * and {@link org.apache.calcite.schema.Table} SPI and reach the JDBC caller
 * as the cause of the failed statement.
 */
public class KubernetesAdapterException extends CalciteException {
  private static final long serialVersionUID = 1L;

  public KubernetesAdapterException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
