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
 * Multimap recipe: rows listed by the value of one field, for example all sales of a seller.
 *
 * <p>
 *   Every row is stored twice: in a main table keyed by id, and in an index table partitioned by
 *   the indexed field and clustered by id. Writes produce one statement per table and run
 *   sequentially unless run atomically.
 * </p>
 *
 * @param <T> type of the rows.
 */
public interface MultimapTable<T> extends TableChanger {
  /**
   * Inserts or replaces a row in both tables. The row must hold its id and indexed field.
   *
   * @param row to write.
   * @return the write Op.
   */
  Op set(T row);

  /**
   * @param value of the indexed field.
   * @param id of the row.
   * @param fields to write. Values may be {@link Modifier}s.
   * @return the partial write Op.
   */
  Op update(Object value, Object id, Map<String, Object> fields);

  /**
   * @param value of the indexed field.
   * @param id of the row.
   * @return an Op deleting the row from both tables.
   */
  Op delete(Object value, Object id);

  /**
   * Deletes every index entry for a value. Rows in the main table are kept.
   *
   * @param value of the indexed field.
   * @return the delete Op.
   */
  Op deleteAll(Object value);

  /**
   * Lists the rows with a value of the indexed field, in id order.
   *
   * @param value of the indexed field.
   * @param startId exclusive continuation key: only rows with a greater id are listed. Pass the
   *     last id of the previous page, or null for the first page.
   * @param limit maximum number of rows. Must be positive.
   * @return the list Op.
   */
  ReadOp<List<T>> list(Object value, @Nullable Object startId, int limit);

  /**
   * @param value of the indexed field.
   * @param id of the row.
   * @return the read Op.
   */
  ReadOp<T> read(Object value, Object id);

  /**
   * @param value of the indexed field.
   * @param ids of the rows.
   * @return an Op reading the existing rows among the ids.
   */
  ReadOp<List<T>> multiRead(Object value, List<?> ids);

  /**
   * @param options taking precedence over the current ones.
   * @return a multimap table using the merged options.
   */
  MultimapTable<T> withOptions(Options options);
}
