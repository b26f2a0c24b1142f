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

package org.kiji.recipes.impl;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kiji.recipes.Bucketer;
import org.kiji.recipes.ColumnType;
import org.kiji.recipes.FixedDurationBucketer;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.Keys;
import org.kiji.recipes.MapTable;
import org.kiji.recipes.MultiTimeSeriesTable;
import org.kiji.recipes.MultimapMkTable;
import org.kiji.recipes.MultimapTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.Options;
import org.kiji.recipes.QueryExecutor;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowCodec;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.Table;
import org.kiji.recipes.TableDescriptor;
import org.kiji.recipes.TimeSeriesTable;
import org.kiji.recipes.codec.MapRowCodec;

/**
 * Key space backed by a {@link QueryExecutor}.
 *
 * <h2>Physical table names</h2>
 *
 * <p>
 *   Recipe tables are named after the logical name, the recipe and its key fields, so that
 *   changing the key layout of a recipe never reuses an existing table:
 * </p>
 *
 * <ul>
 *   <li>map: {@code <name>_map_<id>}</li>
 *   <li>multimap: {@code <name>_multimap_<id>} and {@code <name>_multimap_<field>_<id>}</li>
 *   <li>multi-key multimap: {@code <name>_multimapmk_<ids>} and
 *     {@code <name>_multimapmk_<fields>_<ids>}</li>
 *   <li>time series: {@code <name>_timeseries_<time>_<id>_<bucket millis>}</li>
 *   <li>indexed time series: {@code <name>_multitimeseries_<fields>_<time>_<id>[_<bucket
 *     millis>]}, and {@code <name>_multitimeseries_<id>} for the id mirror</li>
 * </ul>
 */
public final class DefaultKeySpace implements KeySpace {
  private static final Logger LOG = LoggerFactory.getLogger(DefaultKeySpace.class);

  private static final Joiner FIELD_JOINER = Joiner.on('_');

  private final QueryExecutor mExecutor;
  private final String mName;
  private final KeySpaceConfig mConfig;

  /**
   * @param executor statements are dispatched to. Closed with the key space.
   * @param name of the key space.
   * @param config default options and debug flag of the tables.
   */
  public DefaultKeySpace(
      final QueryExecutor executor,
      final String name,
      final KeySpaceConfig config
  ) {
    mExecutor = Preconditions.checkNotNull(executor);
    mName = Preconditions.checkNotNull(name);
    mConfig = Preconditions.checkNotNull(config);
  }

  /**
   * @param tableName physical name of the table.
   * @param schema declared fields.
   * @param keys primary key layout.
   * @return the descriptor of a table of this key space.
   */
  private TableDescriptor descriptor(
      final String tableName,
      final RowSchema schema,
      final Keys keys
  ) {
    return new TableDescriptor(mName, tableName, schema, keys, mConfig.getDefaults(),
        mConfig.isDebug());
  }

  /**
   * @param descriptor of the table.
   * @param codec of the rows.
   * @param <T> type of the rows.
   * @return a physical table whose reads return every column.
   */
  private <T> DefaultTable<T> open(final TableDescriptor descriptor, final RowCodec<T> codec) {
    return new DefaultTable<T>(mExecutor, descriptor, codec, ImmutableSet.<String>of());
  }

  /**
   * @param descriptor of the table.
   * @param codec of the rows.
   * @param <T> type of the rows.
   * @return a physical table whose reads hide the time bucket.
   */
  private <T> DefaultTable<T> openBucketed(
      final TableDescriptor descriptor,
      final RowCodec<T> codec
  ) {
    return new DefaultTable<T>(mExecutor, descriptor, codec,
        ImmutableSet.of(TimeSeriesTableRecipe.BUCKET_FIELD));
  }

  /**
   * @param schema of the rows.
   * @return the schema with the bucket column.
   */
  private static RowSchema withBucket(final RowSchema schema) {
    Preconditions.checkArgument(!schema.contains(TimeSeriesTableRecipe.BUCKET_FIELD),
        "Field '%s' is reserved for the time bucket.", TimeSeriesTableRecipe.BUCKET_FIELD);
    return schema.with(TimeSeriesTableRecipe.BUCKET_FIELD, ColumnType.TIMESTAMP);
  }

  /** {@inheritDoc} */
  @Override
  public String getName() {
    return mName;
  }

  /** {@inheritDoc} */
  @Override
  public <T> MapTable<T> mapTable(
      final String name,
      final String idField,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    RecipeSupport.checkDeclared(schema, ImmutableList.of(idField));
    final TableDescriptor descriptor = descriptor(
        RecipeSupport.tableName(name, "map", idField),
        schema,
        Keys.of(ImmutableList.of(idField), ImmutableList.<String>of()));
    return new MapTableRecipe<T>(open(descriptor, codec), idField);
  }

  /** {@inheritDoc} */
  @Override
  public <T> MultimapTable<T> multimapTable(
      final String name,
      final String indexField,
      final String idField,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    RecipeSupport.checkDeclared(schema, ImmutableList.of(indexField, idField));
    final TableDescriptor main = descriptor(
        RecipeSupport.tableName(name, "multimap", idField),
        schema,
        Keys.of(ImmutableList.of(idField), ImmutableList.<String>of()));
    final TableDescriptor index = descriptor(
        RecipeSupport.tableName(name, "multimap", indexField, idField),
        schema,
        Keys.of(ImmutableList.of(indexField), ImmutableList.of(idField)));
    return new MultimapTableRecipe<T>(open(main, codec), open(index, codec), indexField, idField);
  }

  /** {@inheritDoc} */
  @Override
  public <T> MultimapMkTable<T> multimapMultiKeyTable(
      final String name,
      final List<String> indexFields,
      final List<String> idFields,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    Preconditions.checkArgument(!indexFields.isEmpty(), "No indexed field.");
    Preconditions.checkArgument(!idFields.isEmpty(), "No id field.");
    RecipeSupport.checkDeclared(schema, indexFields);
    RecipeSupport.checkDeclared(schema, idFields);
    final String ids = FIELD_JOINER.join(idFields);
    final TableDescriptor main = descriptor(
        RecipeSupport.tableName(name, "multimapmk", ids),
        schema,
        Keys.of(idFields, ImmutableList.<String>of()));
    final TableDescriptor index = descriptor(
        RecipeSupport.tableName(name, "multimapmk", FIELD_JOINER.join(indexFields), ids),
        schema,
        Keys.of(indexFields, idFields));
    return new MultimapMkTableRecipe<T>(
        open(main, codec), open(index, codec), indexFields, idFields);
  }

  /** {@inheritDoc} */
  @Override
  public <T> TimeSeriesTable<T> timeSeriesTable(
      final String name,
      final String timeField,
      final String idField,
      final FixedDurationBucketer bucketer,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    RecipeSupport.checkDeclared(schema, ImmutableList.of(timeField, idField));
    final TableDescriptor descriptor = descriptor(
        RecipeSupport.tableName(name, "timeseries", timeField, idField, bucketer.getSizeMillis()),
        withBucket(schema),
        Keys.of(ImmutableList.of(TimeSeriesTableRecipe.BUCKET_FIELD),
            ImmutableList.of(timeField, idField)));
    return new TimeSeriesTableRecipe<T>(
        openBucketed(descriptor, codec), timeField, idField, bucketer);
  }

  /** {@inheritDoc} */
  @Override
  public <T> MultiTimeSeriesTable<T> multiTimeSeriesTable(
      final String name,
      final String indexField,
      final String timeField,
      final String idField,
      final FixedDurationBucketer bucketer,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    return multiTimeSeries(
        RecipeSupport.tableName(name, "multitimeseries", indexField, timeField, idField,
            bucketer.getSizeMillis()),
        name, timeField, idField, ImmutableList.of(indexField), bucketer, false, schema, codec);
  }

  /** {@inheritDoc} */
  @Override
  public <T> MultiTimeSeriesTable<T> flexMultiTimeSeriesTable(
      final String name,
      final String timeField,
      final String idField,
      final List<String> indexFields,
      final Bucketer bucketer,
      final boolean mirrorIds,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    Preconditions.checkArgument(!indexFields.isEmpty(), "No indexed field.");
    return multiTimeSeries(
        RecipeSupport.tableName(name, "multitimeseries", FIELD_JOINER.join(indexFields),
            timeField, idField),
        name, timeField, idField, indexFields, bucketer, mirrorIds, schema, codec);
  }

  /**
   * @param tableName physical name of the main table.
   * @param name logical name of the recipe.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param indexFields fields rows are listed by, in key order.
   * @param bucketer of the time field.
   * @param mirrorIds whether writes are mirrored to a table keyed by id.
   * @param schema declared fields of the rows.
   * @param codec of the rows.
   * @param <T> type of the rows.
   * @return the indexed time series recipe.
   */
  private <T> MultiTimeSeriesTable<T> multiTimeSeries(
      final String tableName,
      final String name,
      final String timeField,
      final String idField,
      final List<String> indexFields,
      final Bucketer bucketer,
      final boolean mirrorIds,
      final RowSchema schema,
      final RowCodec<T> codec
  ) {
    RecipeSupport.checkDeclared(schema, indexFields);
    RecipeSupport.checkDeclared(schema, ImmutableList.of(timeField, idField));
    final List<String> partition = Lists.newArrayList(indexFields);
    partition.add(TimeSeriesTableRecipe.BUCKET_FIELD);
    final TableDescriptor main = descriptor(
        tableName,
        withBucket(schema),
        Keys.of(partition, ImmutableList.of(timeField, idField)));
    DefaultTable<T> mirror = null;
    if (mirrorIds) {
      mirror = open(descriptor(
          RecipeSupport.tableName(name, "multitimeseries", idField),
          schema,
          Keys.of(ImmutableList.of(idField), ImmutableList.<String>of())), codec);
    }
    return new MultiTimeSeriesTableRecipe<T>(
        openBucketed(main, codec), mirror, indexFields, timeField, idField, bucketer);
  }

  /** {@inheritDoc} */
  @Override
  public <T> Table<T> table(
      final String name,
      final RowSchema schema,
      final Keys keys,
      final RowCodec<T> codec
  ) {
    return open(descriptor(CQLStatements.sanitizeTableName(name), schema, keys), codec);
  }

  /** {@inheritDoc} */
  @Override
  public Set<String> getTableNames() throws IOException {
    final DefaultTable<Map<String, Object>> tables = new DefaultTable<Map<String, Object>>(
        mExecutor, SystemTables.DESCRIPTOR, MapRowCodec.get(), ImmutableSet.<String>of());
    final ReadOp<List<Map<String, Object>>> read =
        tables.where(Relation.eq(SystemTables.KEYSPACE_NAME_COL, mName)).read();
    read.run();

    final ImmutableSortedSet.Builder<String> names = ImmutableSortedSet.naturalOrder();
    for (Map<String, Object> row : read.getResult()) {
      names.add((String) row.get(SystemTables.TABLE_NAME_COL));
    }
    final Set<String> result = names.build();
    LOG.debug("Key space '{}' has tables {}.", mName, result);
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public boolean tableExists(final String name) throws IOException {
    return getTableNames().contains(name.toLowerCase(Locale.ROOT));
  }

  /** {@inheritDoc} */
  @Override
  public KeySpace withOptions(final Options options) {
    return new DefaultKeySpace(mExecutor, mName, mConfig.withOptions(options));
  }

  /** {@inheritDoc} */
  @Override
  public Op noOp() {
    return RecipeOp.noOp(mExecutor);
  }

  /** {@inheritDoc} */
  @Override
  public QueryExecutor getQueryExecutor() {
    return mExecutor;
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    mExecutor.close();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(DefaultKeySpace.class)
        .add("name", mName)
        .add("config", mConfig)
        .toString();
  }
}
