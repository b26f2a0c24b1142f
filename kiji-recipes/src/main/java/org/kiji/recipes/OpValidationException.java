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
 * Raised by {@link Op#preflight()} when an operation is not valid: a required key field is
 * missing from a written row, relations do not resolve to a complete partition key, or a time
 * range is malformed, or a row can not be encoded. Nothing was dispatched.
 */
public final class OpValidationException extends RecipeException {
  private static final long serialVersionUID = 1L;

  /**
   * @param message describing the failed validation.
   */
  public OpValidationException(final String message) {
    super(message);
  }

  /**
   * @param message describing the failed validation.
   * @param cause of the failure.
   */
  public OpValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
