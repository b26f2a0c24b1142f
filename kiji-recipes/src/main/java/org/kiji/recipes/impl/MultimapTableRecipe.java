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

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.kiji.recipes.MultimapTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;

/**
 * Multimap recipe over a main table keyed by id and an index table partitioned by the indexed
 * field and clustered by id. Index rows are full copies of the main rows, so listing reads the
 * index table only.
 *
 * @param <T> type of the rows.
 */
public final class MultimapTableRecipe<T> extends RecipeTables implements MultimapTable<T> {
  private final DefaultTable<T> mMain;
  private final DefaultTable<T> mIndex;
  private final String mIndexField;
  private final String mIdField;

  /**
   * @param main table keyed by id.
   * @param index table keyed by indexed field then id.
   * @param indexField field rows are listed by.
   * @param idField field holding the unique id of a row.
   */
  public MultimapTableRecipe(
      final DefaultTable<T> main,
      final DefaultTable<T> index,
      final String indexField,
      final String idField
  ) {
    super(ImmutableList.of(main, index));
    mMain = main;
    mIndex = index;
    mIndexField = indexField;
    mIdField = idField;
  }

  /** {@inheritDoc} */
  @Override
  public Op set(final T row) {
    try {
      final Map<String, Object> fields = mMain.encode(row);
      RecipeSupport.requireFields(getName(), fields, ImmutableList.of(mIndexField, mIdField));
      return RecipeOp.of(mMain.getQueryExecutor(),
          mMain.insertOperation(fields),
          mIndex.insertOperation(fields));
    } catch (RecipeException re) {
      return RecipeOp.failed(mMain.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op update(final Object value, final Object id, final Map<String, Object> fields) {
    try {
      return RecipeOp.of(mMain.getQueryExecutor(),
          mMain.where(ImmutableList.of(Relation.eq(mIdField, id))).updateOperation(fields),
          mIndex.where(indexKey(value, id)).updateOperation(fields));
    } catch (RecipeException re) {
      return RecipeOp.failed(mMain.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op delete(final Object value, final Object id) {
    return RecipeOp.of(mMain.getQueryExecutor(),
        mMain.where(ImmutableList.of(Relation.eq(mIdField, id))).deleteOperation(),
        mIndex.where(indexKey(value, id)).deleteOperation());
  }

  /** {@inheritDoc} */
  @Override
  public Op deleteAll(final Object value) {
    return mIndex.where(Relation.eq(mIndexField, value)).delete();
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> list(final Object value, @Nullable final Object startId, final int limit) {
    final RowListSink<T> sink = mIndex.listSink(null);
    if (limit <= 0) {
      return RecipeReadOp.failed(mIndex.getQueryExecutor(), sink,
          new OpValidationException(String.format("List limit must be positive: %d", limit)));
    }
    final List<Relation> relations = Lists.newArrayList(Relation.eq(mIndexField, value));
    if (startId != null) {
      relations.add(Relation.gt(mIdField, startId));
    }
    return RecipeReadOp.of(mIndex.getQueryExecutor(), sink,
        mIndex.where(relations).selectOperation(sink)
            .withOptions(Options.builder().withLimit(limit).build()));
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<T> read(final Object value, final Object id) {
    return mIndex.where(indexKey(value, id)).readOne();
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> multiRead(final Object value, final List<?> ids) {
    if (ids.isEmpty()) {
      return RecipeReadOp.of(mIndex.getQueryExecutor(), mIndex.listSink(null),
          ImmutableList.<Operation>of());
    }
    return mIndex.where(Relation.eq(mIndexField, value), Relation.in(mIdField, ids)).read();
  }

  /** {@inheritDoc} */
  @Override
  public MultimapTable<T> withOptions(final Options options) {
    return new MultimapTableRecipe<T>(
        mMain.withOptions(options), mIndex.withOptions(options), mIndexField, mIdField);
  }

  /**
   * @param value of the indexed field.
   * @param id of the row.
   * @return relations fixing the primary key of an index row.
   */
  private List<Relation> indexKey(final Object value, final Object id) {
    return ImmutableList.of(Relation.eq(mIndexField, value), Relation.eq(mIdField, id));
  }
}
