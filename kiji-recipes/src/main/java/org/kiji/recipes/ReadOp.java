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

/**
 * An {@link Op} reading rows. The result of the latest run is available from
 * {@link #getResult()}, also when the read ran as part of a composite Op.
 *
 * @param <R> type of the result.
 */
public interface ReadOp<R> extends Op {
  /**
   * @return the result of the latest run.
   * @throws IllegalStateException if the Op has not run.
   */
  R getResult();

  /** {@inheritDoc} */
  @Override
  ReadOp<R> withOptions(Options options);
}
