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

import com.google.common.collect.ImmutableList;

import org.kiji.recipes.MapTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;

/**
 * Map recipe over one table keyed by id.
 *
 * @param <T> type of the rows.
 */
public final class MapTableRecipe<T> extends RecipeTables implements MapTable<T> {
  private final DefaultTable<T> mTable;
  private final String mIdField;

  /**
   * @param table keyed by the id field.
   * @param idField field holding the unique id of a row.
   */
  public MapTableRecipe(final DefaultTable<T> table, final String idField) {
    super(ImmutableList.of(table));
    mTable = table;
    mIdField = idField;
  }

  /** {@inheritDoc} */
  @Override
  public Op set(final T row) {
    try {
      final Map<String, Object> fields = mTable.encode(row);
      RecipeSupport.requireFields(getName(), fields, ImmutableList.of(mIdField));
      return mTable.setFields(fields);
    } catch (RecipeException re) {
      return RecipeOp.failed(mTable.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op update(final Object id, final Map<String, Object> fields) {
    return mTable.where(Relation.eq(mIdField, id)).update(fields);
  }

  /** {@inheritDoc} */
  @Override
  public Op delete(final Object id) {
    return mTable.where(Relation.eq(mIdField, id)).delete();
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<T> read(final Object id) {
    return mTable.where(Relation.eq(mIdField, id)).readOne();
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> multiRead(final List<?> ids) {
    if (ids.isEmpty()) {
      return RecipeReadOp.of(mTable.getQueryExecutor(), mTable.listSink(null),
          ImmutableList.<Operation>of());
    }
    return mTable.where(Relation.in(mIdField, ids)).read();
  }

  /** {@inheritDoc} */
  @Override
  public MapTable<T> withOptions(final Options options) {
    return new MapTableRecipe<T>(mTable.withOptions(options), mIdField);
  }
}
