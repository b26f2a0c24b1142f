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

import java.io.IOException;
import java.util.List;

/**
 * One or more statements that run when, and only when, one of the {@code run} methods is
 * called.
 *
 * <p>
 *   Ops are immutable: {@link #add(Op...)} and {@link #withOptions(Options)} return new Ops. Every
 *   run re-executes all statements. Both execution paths call {@link #preflight()} first and
 *   dispatch nothing if it fails.
 * </p>
 *
 * <pre>
 *   // op1 keeps a limit of 3 and op2 a limit of 2.
 *   op1.withOptions(limit3).add(op2.withOptions(limit2));
 *   // Both use a limit of 2.
 *   op1.withOptions(limit3).add(op2).withOptions(limit2);
 * </pre>
 */
public interface Op {
  /**
   * Runs the statements one after the other. A failure leaves earlier statements applied; see
   * {@link OpExecutionException}.
   *
   * @throws IOException on validation, cancellation or execution error.
   */
  void run() throws IOException;

  /**
   * Runs the statements one after the other, checking the context before each of them.
   *
   * @param context cancellation signal and deadline.
   * @throws IOException on validation, cancellation or execution error.
   */
  void run(OpContext context) throws IOException;

  /**
   * Runs all statements in one logged batch. Logged batches have a much higher coordination cost
   * than sequential runs; use them only when the statements must apply together, such as a main
   * row and its index entry. Reads can not be batched.
   *
   * @throws IOException on validation, cancellation or execution error.
   */
  void runAtomically() throws IOException;

  /**
   * Runs all statements in one logged batch, if the context is still active.
   *
   * @param context cancellation signal and deadline.
   * @throws IOException on validation, cancellation or execution error.
   */
  void runAtomically(OpContext context) throws IOException;

  /**
   * Composes Ops. The statements of the result are those of this Op followed by those of each
   * argument, in order. Every statement keeps its options.
   *
   * @param ops to append.
   * @return the composite Op.
   */
  Op add(Op... ops);

  /**
   * Derives an Op whose statements use these options, merged over the options each statement
   * already has. This Op is not modified.
   *
   * @param options taking precedence.
   * @return the derived Op.
   */
  Op withOptions(Options options);

  /**
   * Validates every statement of the Op without dispatching anything.
   *
   * @throws RecipeException the first validation or generation failure.
   */
  void preflight() throws RecipeException;

  /**
   * @return the statements of the Op, in execution order.
   * @throws RecipeException if a statement can not be generated.
   */
  List<CQLStatement> generateStatements() throws RecipeException;

  /** @return the executor the Op runs against. */
  QueryExecutor getQueryExecutor();
}
