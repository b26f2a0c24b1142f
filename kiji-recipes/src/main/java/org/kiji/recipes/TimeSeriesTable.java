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
 * Time series recipe: rows listed by a time range.
 *
 * <p>
 *   Rows are partitioned by the bucket of their time field and clustered by time then id, so
 *   rows with equal timestamps are told apart by id.
 * </p>
 *
 * @param <T> type of the rows.
 */
public interface TimeSeriesTable<T> extends TableChanger {
  /**
   * Inserts or replaces a row. The row must hold its time and id fields.
   *
   * @param row to write.
   * @return the write Op.
   */
  Op set(T row);

  /**
   * @param timestamp of the row.
   * @param id of the row.
   * @param fields to write. Values may be {@link Modifier}s.
   * @return the partial write Op.
   */
  Op update(Date timestamp, Object id, Map<String, Object> fields);

  /**
   * @param timestamp of the row.
   * @param id of the row.
   * @return the delete Op.
   */
  Op delete(Date timestamp, Object id);

  /**
   * @param timestamp of the row.
   * @param id of the row.
   * @return the read Op.
   */
  ReadOp<T> read(Date timestamp, Object id);

  /**
   * Lists the rows with a time in {@code [start, end)}, in non-decreasing time order. One read is
   * issued per bucket overlapping the range. A limit option caps the whole list, not each read.
   *
   * @param start inclusive start of the range.
   * @param end exclusive end of the range. Must not be before start.
   * @return the list Op.
   */
  ReadOp<List<T>> list(Date start, Date end);

  /**
   * @param options taking precedence over the current ones.
   * @return a time series table using the merged options.
   */
  TimeSeriesTable<T> withOptions(Options options);
}
