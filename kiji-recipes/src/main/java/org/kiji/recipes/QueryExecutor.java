/**
 * (c) Copyright 2014 WibiData, Inc.
 *
 * See the NOTICE file distributed with this work for additional
 * information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.kiji.recipes;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Dispatches generated statements to a store. The default implementation is backed by the
 * DataStax Java driver; an in-memory implementation is available for tests.
 *
 * <p>
 *   Executors own retry policy. Callers of these methods never retry.
 * </p>
 */
public interface QueryExecutor extends Closeable {
  /**
   * Runs a read statement.
   *
   * @param statement to run.
   * @param options call-level options, such as consistency or fetch size.
   * @return the rows, as ordered field name to value mappings.
   * @throws IOException on store error.
   */
  List<Map<String, Object>> query(CQLStatement statement, Options options) throws IOException;

  /**
   * Runs a statement which returns no rows.
   *
   * @param statement to run.
   * @param options call-level options.
   * @throws IOException on store error.
   */
  void execute(CQLStatement statement, Options options) throws IOException;

  /**
   * Runs several write statements as one logged batch: all of them take effect, or none does.
   *
   * @param statements to run, in order.
   * @param options call-level options for the batch.
   * @throws IOException on store error.
   */
  void executeAtomically(List<CQLStatement> statements, Options options) throws IOException;
}
