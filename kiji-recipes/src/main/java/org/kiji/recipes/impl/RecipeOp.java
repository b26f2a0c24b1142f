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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpContext;
import org.kiji.recipes.OpExecutionException;
import org.kiji.recipes.OpExecutionException.ExecutionMode;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.QueryExecutor;
import org.kiji.recipes.RecipeException;

/**
 * An Op made of table operations, rendered lazily and dispatched through a
 * {@link QueryExecutor}.
 *
 * <p>
 *   A RecipeOp never changes once built. A recipe that can not build its operations, for example
 *   because a row lacks its id, returns a failed Op: the failure is raised by
 *   {@link #preflight()} and by every run, before anything is dispatched.
 * </p>
 */
public class RecipeOp implements Op {
  private static final Logger LOG = LoggerFactory.getLogger(RecipeOp.class);

  private final QueryExecutor mExecutor;
  private final ImmutableList<Operation> mOperations;
  private final RecipeException mFailure;

  /**
   * @param executor the operations are dispatched to.
   * @param operations in execution order.
   * @param failure raised instead of running, or null.
   */
  protected RecipeOp(
      final QueryExecutor executor,
      final List<Operation> operations,
      @Nullable final RecipeException failure
  ) {
    mExecutor = Preconditions.checkNotNull(executor);
    mOperations = ImmutableList.copyOf(operations);
    mFailure = failure;
  }

  /**
   * @param executor the operations are dispatched to.
   * @param operations in execution order.
   * @return an Op running the operations.
   */
  public static RecipeOp of(final QueryExecutor executor, final Operation... operations) {
    return new RecipeOp(executor, Arrays.asList(operations), null);
  }

  /**
   * @param executor the Op would run against.
   * @param failure raised when the Op is preflighted or run.
   * @return an Op that always fails without dispatching anything.
   */
  public static RecipeOp failed(final QueryExecutor executor, final RecipeException failure) {
    Preconditions.checkNotNull(failure);
    return new RecipeOp(executor, ImmutableList.<Operation>of(), failure);
  }

  /**
   * @param executor the Op would run against.
   * @return an Op without statements.
   */
  public static RecipeOp noOp(final QueryExecutor executor) {
    return new RecipeOp(executor, ImmutableList.<Operation>of(), null);
  }

  /** @return the operations of this Op, in execution order. */
  public ImmutableList<Operation> getOperations() {
    return mOperations;
  }

  /** @return the failure raised instead of running, or null. */
  @Nullable
  protected RecipeException getFailure() {
    return mFailure;
  }

  /**
   * @return the handlers of the rows read by this Op, each once, in operation order.
   */
  protected Set<RowsHandler> getHandlers() {
    final Set<RowsHandler> handlers = Sets.newLinkedHashSet();
    for (Operation operation : mOperations) {
      if (operation.getHandler() != null) {
        handlers.add(operation.getHandler());
      }
    }
    return handlers;
  }

  // ----------------------------------------------------------------------------------------------
  // Composition.

  /** {@inheritDoc} */
  @Override
  public Op add(final Op... ops) {
    final List<Operation> operations = Lists.newArrayList(mOperations);
    RecipeException failure = mFailure;
    for (Op op : ops) {
      Preconditions.checkArgument(op instanceof RecipeOp,
          "Can not compose %s with an Op of type %s.", this, op.getClass().getName());
      final RecipeOp other = (RecipeOp) op;
      Preconditions.checkArgument(other.mExecutor == mExecutor,
          "Can not compose Ops running against different executors.");
      operations.addAll(other.mOperations);
      if (failure == null) {
        failure = other.mFailure;
      }
    }
    return new RecipeOp(mExecutor, operations, failure);
  }

  /** {@inheritDoc} */
  @Override
  public RecipeOp withOptions(final Options options) {
    return new RecipeOp(mExecutor, applyOptions(options), mFailure);
  }

  /**
   * @param options taking precedence over the options of every operation.
   * @return the operations with merged options.
   */
  protected List<Operation> applyOptions(final Options options) {
    final List<Operation> operations = Lists.newArrayList();
    for (Operation operation : mOperations) {
      operations.add(operation.withOptions(options));
    }
    return operations;
  }

  // ----------------------------------------------------------------------------------------------
  // Validation.

  /** {@inheritDoc} */
  @Override
  public void preflight() throws RecipeException {
    generateStatements();
  }

  /** {@inheritDoc} */
  @Override
  public List<CQLStatement> generateStatements() throws RecipeException {
    if (mFailure != null) {
      throw mFailure;
    }
    final List<CQLStatement> statements = Lists.newArrayList();
    for (Operation operation : mOperations) {
      statements.add(operation.generate());
    }
    return statements;
  }

  // ----------------------------------------------------------------------------------------------
  // Execution.

  /** {@inheritDoc} */
  @Override
  public void run() throws IOException {
    run(OpContext.background());
  }

  /** {@inheritDoc} */
  @Override
  public void run(final OpContext context) throws IOException {
    final List<CQLStatement> statements = generateStatements();
    context.checkActive(0);
    for (RowsHandler handler : getHandlers()) {
      handler.begin();
    }

    int applied = 0;
    for (int i = 0; i < statements.size(); i++) {
      context.checkActive(applied);
      final CQLStatement statement = statements.get(i);
      final RowsHandler handler = mOperations.get(i).getHandler();
      if (handler != null && handler.isComplete()) {
        LOG.debug("Skipping '{}': its rows are no longer needed.", statement.getQuery());
        continue;
      }
      logDispatch(statement);
      if (handler != null) {
        final List<Map<String, Object>> rows;
        try {
          rows = mExecutor.query(statement, statement.getOptions());
        } catch (IOException ioe) {
          throw new OpExecutionException(ExecutionMode.SEQUENTIAL, statement, applied, ioe);
        }
        applied += 1;
        handler.handle(statement, rows);
      } else {
        try {
          mExecutor.execute(statement, statement.getOptions());
        } catch (IOException ioe) {
          throw new OpExecutionException(ExecutionMode.SEQUENTIAL, statement, applied, ioe);
        }
        applied += 1;
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void runAtomically() throws IOException {
    runAtomically(OpContext.background());
  }

  /** {@inheritDoc} */
  @Override
  public void runAtomically(final OpContext context) throws IOException {
    for (Operation operation : mOperations) {
      if (operation.isRead()) {
        throw new OpValidationException(String.format(
            "Reads can not run in a batch: %s.", operation));
      }
    }
    final List<CQLStatement> statements = generateStatements();
    context.checkActive(0);
    if (statements.isEmpty()) {
      return;
    }

    Options batchOptions = Options.EMPTY;
    for (CQLStatement statement : statements) {
      batchOptions = batchOptions.merge(statement.getOptions());
      logDispatch(statement);
    }
    try {
      mExecutor.executeAtomically(statements, batchOptions);
    } catch (IOException ioe) {
      throw new OpExecutionException(ExecutionMode.ATOMIC, null, 0, ioe);
    }
  }

  /**
   * Logs a statement about to be dispatched, at INFO for tables in debug mode.
   *
   * @param statement to log.
   */
  private static void logDispatch(final CQLStatement statement) {
    if (statement.getTable().isDebug()) {
      LOG.info("Executing '{}' with values {}.", statement.getQuery(), statement.getValues());
    } else {
      LOG.debug("Executing '{}' with values {}.", statement.getQuery(), statement.getValues());
    }
  }

  /** {@inheritDoc} */
  @Override
  public QueryExecutor getQueryExecutor() {
    return mExecutor;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("operations", mOperations.size())
        .add("failure", mFailure)
        .toString();
  }
}
