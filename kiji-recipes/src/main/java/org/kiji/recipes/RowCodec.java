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
import java.util.Map;

/**
 * Converts application rows to and from field name to value mappings.
 *
 * <p>
 *   Recipes and tables only see rows through a codec, so a row may be any type: a bean, an
 *   immutable value class or a plain map.
 * </p>
 *
 * @param <T> type of the application rows.
 */
public interface RowCodec<T> {
  /**
   * Encodes a row. Fields the row does not hold may be absent from the mapping.
   *
   * @param row to encode.
   * @return an ordered mapping of field name to value.
   * @throws IOException if the row can not be encoded.
   */
  Map<String, Object> encode(T row) throws IOException;

  /**
   * Decodes a row read from a table.
   *
   * @param fields of the row, as returned by the executor.
   * @return the decoded row.
   * @throws IOException if the fields can not be decoded.
   */
  T decode(Map<String, Object> fields) throws IOException;
}
