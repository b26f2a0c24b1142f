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
 * A subset of a {@link Table} selected by relations.
 *
 * @param <T> type of the rows.
 */
public interface Filter<T> {
  /**
   * Changes only the given fields of the matching rows. Values may be {@link Modifier}s. The
   * relations must fix the whole primary key.
   *
   * @param fields to write.
   * @return the write Op.
   */
  Op update(Map<String, Object> fields);

  /** @return an Op deleting every matching row. */
  Op delete();

  /** @return an Op reading every matching row. */
  ReadOp<List<T>> read();

  /**
   * @return an Op reading the first matching row. Running it fails with
   *     {@link RowNotFoundException} when no row matches.
   */
  ReadOp<T> readOne();

  /** @return the relations of this filter. */
  List<Relation> getRelations();
}
