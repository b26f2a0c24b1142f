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

import java.util.Date;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.kiji.recipes.Bucketer;
import org.kiji.recipes.MultiTimeSeriesTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;

/**
 * Indexed time series recipe over a table partitioned by the indexed fields and the time bucket,
 * and clustered by time then id.
 *
 * <p>
 *   With an id mirror, every write is also applied to a table keyed by id alone, holding the
 *   latest version of each row without its bucket.
 * </p>
 *
 * @param <T> type of the rows.
 */
public final class MultiTimeSeriesTableRecipe<T>
    extends RecipeTables implements MultiTimeSeriesTable<T> {
  private final DefaultTable<T> mTable;
  private final DefaultTable<T> mMirror;
  private final ImmutableList<String> mIndexFields;
  private final String mTimeField;
  private final String mIdField;
  private final Bucketer mBucketer;

  /**
   * @param table partitioned by the indexed fields and bucket, clustered by time then id.
   * @param mirror table keyed by id, or null.
   * @param indexFields fields rows are listed by, in key order.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param bucketer of the time field.
   */
  public MultiTimeSeriesTableRecipe(
      final DefaultTable<T> table,
      @Nullable final DefaultTable<T> mirror,
      final List<String> indexFields,
      final String timeField,
      final String idField,
      final Bucketer bucketer
  ) {
    super(mirror == null ? ImmutableList.of(table) : ImmutableList.of(table, mirror));
    mTable = table;
    mMirror = mirror;
    mIndexFields = ImmutableList.copyOf(indexFields);
    mTimeField = timeField;
    mIdField = idField;
    mBucketer = Preconditions.checkNotNull(bucketer);
  }

  /** {@inheritDoc} */
  @Override
  public Op set(final T row) {
    try {
      final Map<String, Object> fields = mTable.encode(row);
      RecipeSupport.requireFields(getName(), fields, mIndexFields);
      RecipeSupport.requireFields(getName(), fields, ImmutableList.of(mTimeField, mIdField));
      final Map<String, Object> bucketed =
          TimeSeriesTableRecipe.withBucket(fields, mTimeField, mBucketer);
      final List<Operation> operations = Lists.newArrayList(mTable.insertOperation(bucketed));
      if (mMirror != null) {
        operations.add(mMirror.insertOperation(RecipeSupport.without(
            bucketed, ImmutableSet.of(TimeSeriesTableRecipe.BUCKET_FIELD))));
      }
      return RecipeOp.of(mTable.getQueryExecutor(), operations.toArray(new Operation[0]));
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op update(
      final Object value,
      final Date timestamp,
      final Object id,
      final Map<String, Object> fields
  ) {
    try {
      final List<Operation> operations = Lists.newArrayList(
          mTable.where(rowKey(value, timestamp, id)).updateOperation(fields));
      if (mMirror != null) {
        operations.add(
            mMirror.where(ImmutableList.of(Relation.eq(mIdField, id))).updateOperation(fields));
      }
      return RecipeOp.of(mTable.getQueryExecutor(), operations.toArray(new Operation[0]));
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op delete(final Object value, final Date timestamp, final Object id) {
    try {
      final List<Operation> operations = Lists.newArrayList(
          mTable.where(rowKey(value, timestamp, id)).deleteOperation());
      if (mMirror != null) {
        operations.add(
            mMirror.where(ImmutableList.of(Relation.eq(mIdField, id))).deleteOperation());
      }
      return RecipeOp.of(mTable.getQueryExecutor(), operations.toArray(new Operation[0]));
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<T> read(final Object value, final Date timestamp, final Object id) {
    try {
      return mTable.where(rowKey(value, timestamp, id)).readOne();
    } catch (RecipeException re) {
      return RecipeReadOp.failed(mTable.getQueryExecutor(), mTable.singleRowSink(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> list(final Object value, final Date start, final Date end) {
    final List<Relation> partition;
    try {
      partition = RecipeSupport.equalities(RecipeSupport.indexValues(mIndexFields, value));
    } catch (OpValidationException ove) {
      return RecipeReadOp.failed(mTable.getQueryExecutor(), mTable.listSink(null), ove);
    }
    return TimeSeriesTableRecipe.listRange(mTable, partition, mTimeField, mIdField, mBucketer,
        start, end);
  }

  /** {@inheritDoc} */
  @Override
  public MultiTimeSeriesTable<T> withOptions(final Options options) {
    return new MultiTimeSeriesTableRecipe<T>(
        mTable.withOptions(options),
        mMirror == null ? null : mMirror.withOptions(options),
        mIndexFields, mTimeField, mIdField, mBucketer);
  }

  /**
   * @param value of the indexed field(s).
   * @param timestamp of the row.
   * @param id of the row.
   * @return relations fixing the primary key of the row.
   * @throws OpValidationException if an indexed value or the timestamp is missing.
   */
  private List<Relation> rowKey(final Object value, final Date timestamp, final Object id)
      throws OpValidationException {
    if (timestamp == null) {
      throw new OpValidationException(String.format(
          "Missing timestamp for a row of '%s'.", getName()));
    }
    final List<Relation> relations =
        RecipeSupport.equalities(RecipeSupport.indexValues(mIndexFields, value));
    relations.add(Relation.eq(TimeSeriesTableRecipe.BUCKET_FIELD,
        new Date(mBucketer.bucket(timestamp.getTime()))));
    relations.add(Relation.eq(mTimeField, timestamp));
    relations.add(Relation.eq(mIdField, id));
    return relations;
  }
}
