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

import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Indexed time series recipe, a cross between {@link TimeSeriesTable} and
 * {@link MultimapTable}: rows listed by the value of indexed fields and a time range.
 *
 * <p>
 *   The partition key is made of the indexed fields and the time bucket. With a single indexed
 *   field, index values are passed directly; with several, they are passed as a map from field
 *   name to value.
 * </p>
 *
 * @param <T> type of the rows.
 */
public interface MultiTimeSeriesTable<T> extends TableChanger {
  /**
   * Inserts or replaces a row. The row must hold its indexed, time and id fields.
   *
   * @param row to write.
   * @return the write Op.
   */
  Op set(T row);

  /**
   * @param value of the indexed field(s).
   * @param timestamp of the row.
   * @param id of the row.
   * @param fields to write. Values may be {@link Modifier}s.
   * @return the partial write Op.
   */
  Op update(Object value, Date timestamp, Object id, Map<String, Object> fields);

  /**
   * @param value of the indexed field(s).
   * @param timestamp of the row.
   * @param id of the row.
   * @return the delete Op.
   */
  Op delete(Object value, Date timestamp, Object id);

  /**
   * @param value of the indexed field(s).
   * @param timestamp of the row.
   * @param id of the row.
   * @return the read Op.
   */
  ReadOp<T> read(Object value, Date timestamp, Object id);

  /**
   * Lists the rows with the indexed value and a time in {@code [start, end)}, in non-decreasing
   * time order. A limit option caps the whole list.
   *
   * @param value of the indexed field(s).
   * @param start inclusive start of the range.
   * @param end exclusive end of the range. Must not be before start.
   * @return the list Op.
   */
  ReadOp<List<T>> list(Object value, Date start, Date end);

  /**
   * @param options taking precedence over the current ones.
   * @return a table using the merged options.
   */
  MultiTimeSeriesTable<T> withOptions(Options options);
}
