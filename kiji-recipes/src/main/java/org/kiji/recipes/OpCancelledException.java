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
 * Raised when an {@link OpContext} is cancelled or past its deadline before or between
 * statements. Statements already handed to the executor are not recalled:
 * {@link #getAppliedCount()} of them took effect.
 */
public final class OpCancelledException extends RecipeException {
  private static final long serialVersionUID = 1L;

  private final int mAppliedCount;

  /**
   * @param message describing why execution stopped.
   * @param appliedCount number of statements dispatched before execution stopped.
   */
  public OpCancelledException(final String message, final int appliedCount) {
    super(message);
    mAppliedCount = appliedCount;
  }

  /** @return the number of statements dispatched before execution stopped. */
  public int getAppliedCount() {
    return mAppliedCount;
  }
}
