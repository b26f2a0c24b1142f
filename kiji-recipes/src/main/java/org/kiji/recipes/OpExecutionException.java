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

import javax.annotation.Nullable;

/**
 * Wraps a failure reported by the {@link QueryExecutor}. The cause is passed through as-is and
 * is never retried or compensated.
 *
 * <p>
 *   During a sequential run, the {@link #getAppliedCount()} statements before the failed one
 *   already took effect. During an atomic run the batch took effect completely or not at all, as
 *   guaranteed by the store's logged batches.
 * </p>
 */
public final class OpExecutionException extends RecipeException {
  private static final long serialVersionUID = 1L;

  /** How the failed op was executed. */
  public static enum ExecutionMode {
    SEQUENTIAL,
    ATOMIC
  }

  private final ExecutionMode mMode;
  private final transient CQLStatement mStatement;
  private final int mAppliedCount;

  /**
   * @param mode of the failed execution.
   * @param statement that failed, or null for a failed batch.
   * @param appliedCount number of statements applied before the failure.
   * @param cause reported by the executor.
   */
  public OpExecutionException(
      final ExecutionMode mode,
      @Nullable final CQLStatement statement,
      final int appliedCount,
      final Throwable cause
  ) {
    super(String.format("%s execution failed after %d applied statement(s)%s: %s",
        mode, appliedCount, statement == null ? "" : " at '" + statement.getQuery() + "'",
        cause.getMessage()),
        cause);
    mMode = mode;
    mStatement = statement;
    mAppliedCount = appliedCount;
  }

  /** @return how the failed op was executed. */
  public ExecutionMode getMode() {
    return mMode;
  }

  /** @return the failed statement, or null for a failed batch. */
  @Nullable
  public CQLStatement getStatement() {
    return mStatement;
  }

  /** @return the number of statements applied before the failure. */
  public int getAppliedCount() {
    return mAppliedCount;
  }

  /**
   * @return whether some, but not all, of the op's statements may have taken effect.
   */
  public boolean mayBePartiallyApplied() {
    return mMode == ExecutionMode.SEQUENTIAL && mAppliedCount > 0;
  }
}
