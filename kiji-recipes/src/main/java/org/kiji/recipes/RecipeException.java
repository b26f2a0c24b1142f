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

/**
 * Base class of the errors raised while building or running an {@link Op}.
 *
 * <p>
 *   Subclasses tell a caller what may have happened to the store:
 * </p>
 *
 * <ul>
 *   <li>{@link OpValidationException} and {@link StatementGenerationException}: nothing was
 *     dispatched.</li>
 *   <li>{@link OpExecutionException}: see {@link OpExecutionException#mayBePartiallyApplied()}.
 *     </li>
 *   <li>{@link OpCancelledException}: execution stopped between two statements.</li>
 * </ul>
 */
public class RecipeException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * @param message describing the error.
   */
  public RecipeException(final String message) {
    super(message);
  }

  /**
   * @param message describing the error.
   * @param cause of the error.
   */
  public RecipeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
