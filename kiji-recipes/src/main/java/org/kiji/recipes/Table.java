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
 * A table without recipe, giving raw access through relations. Requires knowledge of how
 * Cassandra restricts queries.
 *
 * @param <T> type of the rows.
 */
public interface Table<T> extends TableChanger {
  /**
   * Inserts or replaces a row. Declared fields the row does not hold are cleared. To change only
   * some fields, use {@link Filter#update(java.util.Map)}.
   *
   * @param row to write.
   * @return the write Op.
   */
  Op set(T row);

  /**
   * Restricts the table to the rows matching the relations.
   *
   * @param relations of the WHERE clause.
   * @return a filter over the matching rows.
   */
  Filter<T> where(Relation... relations);

  /**
   * @param options table-level options taking precedence over the current ones.
   * @return a table using the merged options.
   */
  Table<T> withOptions(Options options);

  /** @return the descriptor of the table. */
  TableDescriptor getDescriptor();
}
