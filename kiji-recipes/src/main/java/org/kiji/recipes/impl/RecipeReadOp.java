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

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.kiji.recipes.Options;
import org.kiji.recipes.QueryExecutor;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;

/**
 * A RecipeOp whose read operations deliver their rows to one result sink.
 *
 * <p>
 *   Ops derived with {@link #withOptions(Options)} share the sink: the result is that of the
 *   latest run of any of them. Composing a read Op with {@link #add} still fills the sink when
 *   the composite runs.
 * </p>
 *
 * @param <R> type of the result.
 */
public final class RecipeReadOp<R> extends RecipeOp implements ReadOp<R> {
  private final ResultSink<R> mSink;

  /**
   * @param executor the operations are dispatched to.
   * @param operations in execution order. Reads must deliver their rows to the sink.
   * @param failure raised instead of running, or null.
   * @param sink collecting the result.
   */
  private RecipeReadOp(
      final QueryExecutor executor,
      final List<Operation> operations,
      @Nullable final RecipeException failure,
      final ResultSink<R> sink
  ) {
    super(executor, operations, failure);
    mSink = Preconditions.checkNotNull(sink);
  }

  /**
   * @param executor the operations are dispatched to.
   * @param sink collecting the result.
   * @param operations reading into the sink. May be empty, in which case a run only resets the
   *     sink.
   * @param <R> type of the result.
   * @return the read Op.
   */
  public static <R> RecipeReadOp<R> of(
      final QueryExecutor executor,
      final ResultSink<R> sink,
      final List<Operation> operations
  ) {
    return new RecipeReadOp<R>(executor, operations, null, sink);
  }

  /**
   * @param executor the operations are dispatched to.
   * @param sink collecting the result.
   * @param operation reading into the sink.
   * @param <R> type of the result.
   * @return the read Op.
   */
  public static <R> RecipeReadOp<R> of(
      final QueryExecutor executor,
      final ResultSink<R> sink,
      final Operation operation
  ) {
    return of(executor, sink, ImmutableList.of(operation));
  }

  /**
   * @param executor the Op would run against.
   * @param sink the Op would read into.
   * @param failure raised when the Op is preflighted or run.
   * @param <R> type of the result.
   * @return a read Op that always fails without dispatching anything.
   */
  public static <R> RecipeReadOp<R> failed(
      final QueryExecutor executor,
      final ResultSink<R> sink,
      final RecipeException failure
  ) {
    Preconditions.checkNotNull(failure);
    return new RecipeReadOp<R>(executor, ImmutableList.<Operation>of(), failure, sink);
  }

  /** {@inheritDoc} */
  @Override
  protected Set<RowsHandler> getHandlers() {
    final Set<RowsHandler> handlers = super.getHandlers();
    handlers.add(mSink);
    return handlers;
  }

  /** {@inheritDoc} */
  @Override
  public RecipeReadOp<R> withOptions(final Options options) {
    return new RecipeReadOp<R>(getQueryExecutor(), applyOptions(options), getFailure(), mSink);
  }

  /** {@inheritDoc} */
  @Override
  public R getResult() {
    return mSink.getResult();
  }
}
