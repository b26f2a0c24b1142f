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

package org.kiji.recipes.impl;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.kiji.recipes.CQLStatement;

/** Receives the rows of the read statements of an Op. */
public interface RowsHandler {
  /** Called once before the first statement of a run is dispatched. Resets previous results. */
  void begin();

  /**
   * Called once per read statement, in dispatch order.
   *
   * @param statement that was run.
   * @param rows it returned.
   * @throws IOException if the rows can not be decoded or do not satisfy the read.
   */
  void handle(CQLStatement statement, List<Map<String, Object>> rows) throws IOException;

  /**
   * @return whether the handler holds every row it needs. The remaining read statements
   *     delivering to it are then skipped.
   */
  boolean isComplete();
}
