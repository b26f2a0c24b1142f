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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.kiji.recipes.Filter;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.QueryExecutor;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowCodec;
import org.kiji.recipes.Table;
import org.kiji.recipes.TableDescriptor;

/**
 * A single physical table. Used directly as the raw {@link Table}, and by every recipe for each
 * of its physical tables.
 *
 * @param <T> type of the rows.
 */
public final class DefaultTable<T> implements Table<T> {
  private final QueryExecutor mExecutor;
  private final TableDescriptor mDescriptor;
  private final RowCodec<T> mCodec;
  private final ImmutableSet<String> mHiddenFields;

  /**
   * @param executor statements are dispatched to.
   * @param descriptor of the table.
   * @param codec converting rows to field maps.
   * @param hiddenFields internal fields stripped from read rows before decoding.
   */
  public DefaultTable(
      final QueryExecutor executor,
      final TableDescriptor descriptor,
      final RowCodec<T> codec,
      final Set<String> hiddenFields
  ) {
    mExecutor = Preconditions.checkNotNull(executor);
    mDescriptor = Preconditions.checkNotNull(descriptor);
    mCodec = Preconditions.checkNotNull(codec);
    mHiddenFields = ImmutableSet.copyOf(hiddenFields);
  }

  /**
   * Encodes a row, reporting codec failures as validation failures.
   *
   * @param row to encode.
   * @return the fields of the row.
   * @throws OpValidationException if the row can not be encoded.
   */
  public Map<String, Object> encode(final T row) throws OpValidationException {
    try {
      return mCodec.encode(row);
    } catch (IOException ioe) {
      throw new OpValidationException(
          String.format("Unable to encode row for table '%s'.", mDescriptor), ioe);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op set(final T row) {
    try {
      return setFields(encode(row));
    } catch (RecipeException re) {
      return RecipeOp.failed(mExecutor, re);
    }
  }

  /**
   * @param fields of the row to write.
   * @return an Op replacing the row.
   * @throws RecipeException if a timestamp field does not hold a time.
   */
  public RecipeOp setFields(final Map<String, Object> fields) throws RecipeException {
    return RecipeOp.of(mExecutor, insertOperation(fields));
  }

  /**
   * @param fields of the row to write.
   * @return the insert operation.
   * @throws RecipeException if a timestamp field does not hold a time.
   */
  Operation insertOperation(final Map<String, Object> fields) throws RecipeException {
    return Operation.insert(mDescriptor,
        RecipeSupport.normalizeTimestamps(mDescriptor.getSchema(), fields));
  }

  /** {@inheritDoc} */
  @Override
  public Filter<T> where(final Relation... relations) {
    return new DefaultFilter<T>(this, ImmutableList.copyOf(relations));
  }

  /**
   * @param relations of the filter.
   * @return a filter over the matching rows.
   */
  public DefaultFilter<T> where(final List<Relation> relations) {
    return new DefaultFilter<T>(this, relations);
  }

  /** {@inheritDoc} */
  @Override
  public DefaultTable<T> withOptions(final Options options) {
    return new DefaultTable<T>(mExecutor, mDescriptor.withOptions(options), mCodec, mHiddenFields);
  }

  /** {@inheritDoc} */
  @Override
  public TableDescriptor getDescriptor() {
    return mDescriptor;
  }

  /** @return the executor statements are dispatched to. */
  public QueryExecutor getQueryExecutor() {
    return mExecutor;
  }

  /** @return the codec of the rows. */
  public RowCodec<T> getCodec() {
    return mCodec;
  }

  /** @return the fields stripped from read rows before decoding. */
  public ImmutableSet<String> getHiddenFields() {
    return mHiddenFields;
  }

  /**
   * @param ordering of the merged rows of several reads, or null to keep the order of the store.
   * @return a sink decoding rows of this table into a list.
   */
  public RowListSink<T> listSink(@Nullable final Comparator<Map<String, Object>> ordering) {
    return new RowListSink<T>(mCodec, mHiddenFields, ordering, false);
  }

  /**
   * @param ordering of the merged rows. Each read must only return rows ordered after the rows
   *     of the reads dispatched before it.
   * @return a sink decoding rows of this table into a list, which completes once it holds as
   *     many rows as the read limit.
   */
  public RowListSink<T> rangeSink(final Comparator<Map<String, Object>> ordering) {
    return new RowListSink<T>(mCodec, mHiddenFields, Preconditions.checkNotNull(ordering), true);
  }

  /** @return a sink decoding one row of this table. */
  public SingleRowSink<T> singleRowSink() {
    return new SingleRowSink<T>(mCodec, mHiddenFields);
  }

  // ----------------------------------------------------------------------------------------------
  // TableChanger.

  /** {@inheritDoc} */
  @Override
  public void create() throws IOException {
    mExecutor.execute(CQLStatements.createTable(mDescriptor, false), mDescriptor.getOptions());
  }

  /** {@inheritDoc} */
  @Override
  public void createIfNotExist() throws IOException {
    mExecutor.execute(CQLStatements.createTable(mDescriptor, true), mDescriptor.getOptions());
  }

  /** {@inheritDoc} */
  @Override
  public List<String> createStatements() {
    return ImmutableList.of(CQLStatements.createTable(mDescriptor, false).getQuery());
  }

  /** {@inheritDoc} */
  @Override
  public List<String> createIfNotExistStatements() {
    return ImmutableList.of(CQLStatements.createTable(mDescriptor, true).getQuery());
  }

  /** {@inheritDoc} */
  @Override
  public void recreate() throws IOException {
    drop();
    create();
  }

  /** {@inheritDoc} */
  @Override
  public void drop() throws IOException {
    mExecutor.execute(CQLStatements.dropTable(mDescriptor), mDescriptor.getOptions());
  }

  /** {@inheritDoc} */
  @Override
  public void truncate() throws IOException {
    mExecutor.execute(CQLStatements.truncate(mDescriptor), mDescriptor.getOptions());
  }

  /** {@inheritDoc} */
  @Override
  public String getName() {
    return mDescriptor.getName();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(DefaultTable.class)
        .add("table", mDescriptor.getQualifiedName())
        .add("codec", mCodec.getClass().getSimpleName())
        .toString();
  }
}
