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

import javax.annotation.Nullable;

/**
 * Multimap recipe over several indexed fields and several id fields, for example all sales where
 * seller = v and name = 'john'.
 *
 * <p>
 *   Index and id values are passed as maps from field name to value. The index table's partition
 *   key and clustering columns follow the declaration order of the fields.
 * </p>
 *
 * @param <T> type of the rows.
 */
public interface MultimapMkTable<T> extends TableChanger {
  /**
   * Inserts or replaces a row in both tables. The row must hold every id and indexed field.
   *
   * @param row to write.
   * @return the write Op.
   */
  Op set(T row);

  /**
   * @param values of the indexed fields.
   * @param ids of the id fields.
   * @param fields to write. Values may be {@link Modifier}s.
   * @return the partial write Op.
   */
  Op update(Map<String, Object> values, Map<String, Object> ids, Map<String, Object> fields);

  /**
   * @param values of the indexed fields.
   * @param ids of the id fields.
   * @return an Op deleting the row from both tables.
   */
  Op delete(Map<String, Object> values, Map<String, Object> ids);

  /**
   * Deletes every index entry for the values. Rows in the main table are kept.
   *
   * @param values of the indexed fields.
   * @return the delete Op.
   */
  Op deleteAll(Map<String, Object> values);

  /**
   * Lists the rows with the given indexed values, in id order.
   *
   * @param values of the indexed fields.
   * @param startIds exclusive continuation key holding every id field, or null for the first
   *     page.
   * @param limit maximum number of rows. Must be positive.
   * @return the list Op.
   */
  ReadOp<List<T>> list(
      Map<String, Object> values,
      @Nullable Map<String, Object> startIds,
      int limit);

  /**
   * @param values of the indexed fields.
   * @param ids of the id fields.
   * @return the read Op.
   */
  ReadOp<T> read(Map<String, Object> values, Map<String, Object> ids);

  /**
   * @param values of the indexed fields.
   * @param ids list of id maps, one per row.
   * @return an Op reading the existing rows among the ids.
   */
  ReadOp<List<T>> multiRead(Map<String, Object> values, List<Map<String, Object>> ids);

  /**
   * @param options taking precedence over the current ones.
   * @return a multimap table using the merged options.
   */
  MultimapMkTable<T> withOptions(Options options);
}
