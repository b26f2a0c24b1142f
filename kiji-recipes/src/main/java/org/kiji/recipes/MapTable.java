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

import java.util.List;
import java.util.Map;

/**
 * Map recipe: rows stored and looked up by a unique id.
 *
 * @param <T> type of the rows.
 */
public interface MapTable<T> extends TableChanger {
  /**
   * Inserts or replaces a row. The row must hold its id.
   *
   * @param row to write.
   * @return the write Op.
   */
  Op set(T row);

  /**
   * @param id of the row.
   * @param fields to write. Values may be {@link Modifier}s.
   * @return the partial write Op.
   */
  Op update(Object id, Map<String, Object> fields);

  /**
   * @param id of the row.
   * @return the delete Op.
   */
  Op delete(Object id);

  /**
   * @param id of the row.
   * @return the read Op.
   */
  ReadOp<T> read(Object id);

  /**
   * @param ids of the rows.
   * @return an Op reading the existing rows among the ids.
   */
  ReadOp<List<T>> multiRead(List<?> ids);

  /**
   * @param options taking precedence over the current ones.
   * @return a map table using the merged options.
   */
  MapTable<T> withOptions(Options options);
}
