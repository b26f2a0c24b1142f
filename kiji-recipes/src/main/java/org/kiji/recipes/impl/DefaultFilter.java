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

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.kiji.recipes.Filter;
import org.kiji.recipes.Op;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;

/**
 * Rows of a {@link DefaultTable} selected by relations.
 *
 * @param <T> type of the rows.
 */
public final class DefaultFilter<T> implements Filter<T> {
  private static final Options READ_ONE = Options.builder().withLimit(1).build();

  private final DefaultTable<T> mTable;
  private final ImmutableList<Relation> mRelations;

  /**
   * @param table filtered.
   * @param relations selecting the rows.
   */
  DefaultFilter(final DefaultTable<T> table, final List<Relation> relations) {
    mTable = Preconditions.checkNotNull(table);
    mRelations = ImmutableList.copyOf(relations);
  }

  /** {@inheritDoc} */
  @Override
  public Op update(final Map<String, Object> fields) {
    try {
      return RecipeOp.of(mTable.getQueryExecutor(), updateOperation(fields));
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /**
   * @param fields to write.
   * @return the update operation.
   * @throws RecipeException if a timestamp field does not hold a time.
   */
  Operation updateOperation(final Map<String, Object> fields) throws RecipeException {
    return Operation.update(mTable.getDescriptor(), mRelations,
        RecipeSupport.normalizeTimestamps(mTable.getDescriptor().getSchema(), fields));
  }

  /** {@inheritDoc} */
  @Override
  public Op delete() {
    return RecipeOp.of(mTable.getQueryExecutor(), deleteOperation());
  }

  /** @return the delete operation. */
  Operation deleteOperation() {
    return Operation.delete(mTable.getDescriptor(), mRelations);
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> read() {
    final RowListSink<T> sink = mTable.listSink(null);
    return RecipeReadOp.of(mTable.getQueryExecutor(), sink, selectOperation(sink));
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<T> readOne() {
    final SingleRowSink<T> sink = mTable.singleRowSink();
    return RecipeReadOp.of(
        mTable.getQueryExecutor(), sink, selectOperation(sink).withOptions(READ_ONE));
  }

  /**
   * @param handler receiving the rows.
   * @return the select operation.
   */
  Operation selectOperation(final RowsHandler handler) {
    return Operation.select(mTable.getDescriptor(), mRelations, handler);
  }

  /** {@inheritDoc} */
  @Override
  public List<Relation> getRelations() {
    return mRelations;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(DefaultFilter.class)
        .add("table", mTable.getDescriptor().getQualifiedName())
        .add("relations", mRelations)
        .toString();
  }
}
