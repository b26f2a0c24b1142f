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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Entry point to the recipes of one Cassandra key space.
 *
 * <p>
 *   Factory methods only build descriptors, they do not touch the store. Call
 *   {@link TableChanger#createIfNotExist()} on a recipe to create its tables.
 * </p>
 *
 * <p>
 *   Closing the key space closes its {@link QueryExecutor}.
 * </p>
 */
public interface KeySpace extends Closeable {
  /** @return the name of the key space. */
  String getName();

  /**
   * Opens a map recipe.
   *
   * @param name logical name of the table.
   * @param idField field holding the unique id of a row.
   * @param schema declared fields of the rows.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the map recipe.
   */
  <T> MapTable<T> mapTable(String name, String idField, RowSchema schema, RowCodec<T> codec);

  /**
   * Opens a multimap recipe.
   *
   * @param name logical name of the table.
   * @param indexField field rows are listed by.
   * @param idField field holding the unique id of a row.
   * @param schema declared fields of the rows.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the multimap recipe.
   */
  <T> MultimapTable<T> multimapTable(
      String name,
      String indexField,
      String idField,
      RowSchema schema,
      RowCodec<T> codec);

  /**
   * Opens a multimap recipe over several indexed and id fields.
   *
   * @param name logical name of the table.
   * @param indexFields fields rows are listed by, in key order.
   * @param idFields fields identifying a row, in key order.
   * @param schema declared fields of the rows.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the multimap recipe.
   */
  <T> MultimapMkTable<T> multimapMultiKeyTable(
      String name,
      List<String> indexFields,
      List<String> idFields,
      RowSchema schema,
      RowCodec<T> codec);

  /**
   * Opens a time series recipe.
   *
   * @param name logical name of the table.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param bucketer fixed-duration bucketing of the time field.
   * @param schema declared fields of the rows.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the time series recipe.
   */
  <T> TimeSeriesTable<T> timeSeriesTable(
      String name,
      String timeField,
      String idField,
      FixedDurationBucketer bucketer,
      RowSchema schema,
      RowCodec<T> codec);

  /**
   * Opens an indexed time series recipe with a single indexed field.
   *
   * @param name logical name of the table.
   * @param indexField field rows are listed by.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param bucketer fixed-duration bucketing of the time field.
   * @param schema declared fields of the rows.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the indexed time series recipe.
   */
  <T> MultiTimeSeriesTable<T> multiTimeSeriesTable(
      String name,
      String indexField,
      String timeField,
      String idField,
      FixedDurationBucketer bucketer,
      RowSchema schema,
      RowCodec<T> codec);

  /**
   * Opens an indexed time series recipe with several indexed fields and any bucketing function.
   * The name of the physical table does not depend on the bucketer: changing the bucketer of an
   * existing table makes its rows unreachable.
   *
   * @param name logical name of the table.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param indexFields fields rows are listed by, in key order.
   * @param bucketer bucketing of the time field.
   * @param mirrorIds whether every write is also applied to a table keyed by id alone.
   * @param schema declared fields of the rows.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the indexed time series recipe.
   */
  <T> MultiTimeSeriesTable<T> flexMultiTimeSeriesTable(
      String name,
      String timeField,
      String idField,
      List<String> indexFields,
      Bucketer bucketer,
      boolean mirrorIds,
      RowSchema schema,
      RowCodec<T> codec);

  /**
   * Opens a table without recipe.
   *
   * @param name of the physical table.
   * @param schema declared fields of the rows.
   * @param keys primary key layout.
   * @param codec converting rows to field maps.
   * @param <T> type of the rows.
   * @return the raw table.
   */
  <T> Table<T> table(String name, RowSchema schema, Keys keys, RowCodec<T> codec);

  /**
   * @return the names of the tables of this key space.
   * @throws IOException on store error.
   */
  Set<String> getTableNames() throws IOException;

  /**
   * @param name of a physical table.
   * @return whether the table exists. Names are compared case-insensitively.
   * @throws IOException on store error.
   */
  boolean tableExists(String name) throws IOException;

  /**
   * @param options default options of the tables opened from the derived key space, taking
   *     precedence over the current defaults.
   * @return the derived key space, sharing this key space's executor.
   */
  KeySpace withOptions(Options options);

  /** @return an Op without statements, for use as the start of a composition. */
  Op noOp();

  /** @return the executor statements are dispatched to. */
  QueryExecutor getQueryExecutor();
}
