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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.kiji.recipes.Bucketer;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;
import org.kiji.recipes.TimeSeriesTable;

/**
 * Time series recipe over one table partitioned by time bucket and clustered by time then id.
 *
 * <p>
 *   The bucket is stored in the {@value #BUCKET_FIELD} column as the start of its window. It is
 *   derived from the time field on every write and hidden from read rows.
 * </p>
 *
 * @param <T> type of the rows.
 */
public final class TimeSeriesTableRecipe<T> extends RecipeTables implements TimeSeriesTable<T> {
  /** Name of the column holding the time bucket. */
  public static final String BUCKET_FIELD = "bucket";

  private final DefaultTable<T> mTable;
  private final String mTimeField;
  private final String mIdField;
  private final Bucketer mBucketer;

  /**
   * @param table partitioned by bucket, clustered by time then id.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param bucketer of the time field.
   */
  public TimeSeriesTableRecipe(
      final DefaultTable<T> table,
      final String timeField,
      final String idField,
      final Bucketer bucketer
  ) {
    super(ImmutableList.of(table));
    mTable = table;
    mTimeField = timeField;
    mIdField = idField;
    mBucketer = Preconditions.checkNotNull(bucketer);
  }

  /** {@inheritDoc} */
  @Override
  public Op set(final T row) {
    try {
      final Map<String, Object> fields = mTable.encode(row);
      RecipeSupport.requireFields(getName(), fields, ImmutableList.of(mTimeField, mIdField));
      return mTable.setFields(withBucket(fields, mTimeField, mBucketer));
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op update(final Date timestamp, final Object id, final Map<String, Object> fields) {
    try {
      return RecipeOp.of(mTable.getQueryExecutor(),
          mTable.where(rowKey(timestamp, id)).updateOperation(fields));
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op delete(final Date timestamp, final Object id) {
    try {
      return RecipeOp.of(mTable.getQueryExecutor(),
          mTable.where(rowKey(timestamp, id)).deleteOperation());
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<T> read(final Date timestamp, final Object id) {
    try {
      return mTable.where(rowKey(timestamp, id)).readOne();
    } catch (RecipeException re) {
      return RecipeReadOp.failed(mTable.getQueryExecutor(), mTable.singleRowSink(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> list(final Date start, final Date end) {
    return listRange(mTable, ImmutableList.<Relation>of(), mTimeField, mIdField, mBucketer,
        start, end);
  }

  /** {@inheritDoc} */
  @Override
  public TimeSeriesTable<T> withOptions(final Options options) {
    return new TimeSeriesTableRecipe<T>(mTable.withOptions(options), mTimeField, mIdField,
        mBucketer);
  }

  /**
   * @param timestamp of the row.
   * @param id of the row.
   * @return relations fixing the primary key of the row.
   * @throws OpValidationException if the timestamp is missing.
   */
  private List<Relation> rowKey(final Date timestamp, final Object id)
      throws OpValidationException {
    if (timestamp == null) {
      throw new OpValidationException(String.format(
          "Missing timestamp for a row of '%s'.", getName()));
    }
    return ImmutableList.of(
        Relation.eq(BUCKET_FIELD, new Date(mBucketer.bucket(timestamp.getTime()))),
        Relation.eq(mTimeField, timestamp),
        Relation.eq(mIdField, id));
  }

  // ----------------------------------------------------------------------------------------------
  // Shared with the indexed time series.

  /**
   * Normalizes the time field of a row and adds its bucket.
   *
   * @param fields of the row, holding the time field.
   * @param timeField timestamp field of the rows.
   * @param bucketer of the time field.
   * @return a copy of the fields with a date in the time field and the bucket.
   * @throws OpValidationException if the time field does not hold a time.
   */
  static Map<String, Object> withBucket(
      final Map<String, Object> fields,
      final String timeField,
      final Bucketer bucketer
  ) throws OpValidationException {
    final Date time = RecipeSupport.toDate(timeField, fields.get(timeField));
    final Map<String, Object> bucketed =
        RecipeSupport.without(fields, ImmutableSet.of(BUCKET_FIELD));
    bucketed.put(timeField, time);
    bucketed.put(BUCKET_FIELD, new Date(bucketer.bucket(time.getTime())));
    return bucketed;
  }

  /**
   * Lists the rows of a bucketed table with a time in {@code [start, end)}: one read per bucket
   * overlapping the range, merged in (time, id) order. Buckets are read in ascending order; with
   * a limit, the merged list is cut to the limit and no bucket is read once enough rows are in.
   *
   * @param table partitioned by some fixed fields and the bucket.
   * @param partition equalities on the partition key fields other than the bucket.
   * @param timeField timestamp field of the rows.
   * @param idField field holding the unique id of a row.
   * @param bucketer of the time field.
   * @param start inclusive start of the range.
   * @param end exclusive end of the range.
   * @param <T> type of the rows.
   * @return the list Op.
   */
  static <T> ReadOp<List<T>> listRange(
      final DefaultTable<T> table,
      final List<Relation> partition,
      final String timeField,
      final String idField,
      final Bucketer bucketer,
      final Date start,
      final Date end
  ) {
    final RowListSink<T> sink = table.rangeSink(
        ValueOrdering.byFields(ImmutableList.of(timeField, idField)));
    if (start == null || end == null || end.before(start)) {
      return RecipeReadOp.failed(table.getQueryExecutor(), sink, new OpValidationException(
          String.format("Invalid time range [%s, %s) on '%s'.", start, end, table.getName())));
    }

    final List<Operation> operations = Lists.newArrayList();
    if (!start.before(end)) {
      return RecipeReadOp.of(table.getQueryExecutor(), sink, operations);
    }
    final long endMillis = end.getTime();
    for (long bucket = bucketer.bucket(start.getTime());
        bucket < endMillis;
        bucket = bucketer.next(bucket)) {
      final List<Relation> relations = Lists.newArrayList(partition);
      relations.add(Relation.eq(BUCKET_FIELD, new Date(bucket)));
      relations.add(Relation.gte(timeField, start));
      relations.add(Relation.lt(timeField, end));
      operations.add(table.where(relations).selectOperation(sink));
    }
    return RecipeReadOp.of(table.getQueryExecutor(), sink, operations);
  }
}
