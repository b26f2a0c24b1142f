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

import org.kiji.recipes.MultimapMkTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;

/**
 * Multimap recipe over several indexed fields and several id fields. The main table has a
 * composite partition key made of the id fields; the index table has a composite partition key
 * made of the indexed fields and is clustered by the id fields.
 *
 * @param <T> type of the rows.
 */
public final class MultimapMkTableRecipe<T> extends RecipeTables implements MultimapMkTable<T> {
  private final DefaultTable<T> mMain;
  private final DefaultTable<T> mIndex;
  private final ImmutableList<String> mIndexFields;
  private final ImmutableList<String> mIdFields;

  /**
   * @param main table keyed by the id fields.
   * @param index table keyed by the indexed fields then the id fields.
   * @param indexFields fields rows are listed by, in key order.
   * @param idFields fields identifying a row, in key order.
   */
  public MultimapMkTableRecipe(
      final DefaultTable<T> main,
      final DefaultTable<T> index,
      final List<String> indexFields,
      final List<String> idFields
  ) {
    super(ImmutableList.of(main, index));
    mMain = main;
    mIndex = index;
    mIndexFields = ImmutableList.copyOf(indexFields);
    mIdFields = ImmutableList.copyOf(idFields);
  }

  /** {@inheritDoc} */
  @Override
  public Op set(final T row) {
    try {
      final Map<String, Object> fields = mMain.encode(row);
      RecipeSupport.requireFields(getName(), fields, mIndexFields);
      RecipeSupport.requireFields(getName(), fields, mIdFields);
      return RecipeOp.of(mMain.getQueryExecutor(),
          mMain.insertOperation(fields),
          mIndex.insertOperation(fields));
    } catch (RecipeException re) {
      return RecipeOp.failed(mMain.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op update(
      final Map<String, Object> values,
      final Map<String, Object> ids,
      final Map<String, Object> fields
  ) {
    try {
      return RecipeOp.of(mMain.getQueryExecutor(),
          mMain.where(idRelations(ids)).updateOperation(fields),
          mIndex.where(indexKey(values, ids)).updateOperation(fields));
    } catch (RecipeException re) {
      return RecipeOp.failed(mMain.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op delete(final Map<String, Object> values, final Map<String, Object> ids) {
    try {
      return RecipeOp.of(mMain.getQueryExecutor(),
          mMain.where(idRelations(ids)).deleteOperation(),
          mIndex.where(indexKey(values, ids)).deleteOperation());
    } catch (RecipeException re) {
      return RecipeOp.failed(mMain.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Op deleteAll(final Map<String, Object> values) {
    try {
      return mIndex.where(indexRelations(values)).delete();
    } catch (RecipeException re) {
      return RecipeOp.failed(mIndex.getQueryExecutor(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> list(
      final Map<String, Object> values,
      @Nullable final Map<String, Object> startIds,
      final int limit
  ) {
    final RowListSink<T> sink = mIndex.listSink(null);
    try {
      if (limit <= 0) {
        throw new OpValidationException(String.format("List limit must be positive: %d", limit));
      }
      final List<Relation> relations = indexRelations(values);
      if (startIds != null) {
        final Map<String, Object> start = keyValues(mIdFields, startIds);
        relations.add(Relation.range(
            mIdFields, Relation.Operator.GT, Lists.newArrayList(start.values())));
      }
      return RecipeReadOp.of(mIndex.getQueryExecutor(), sink,
          mIndex.where(relations).selectOperation(sink)
              .withOptions(Options.builder().withLimit(limit).build()));
    } catch (RecipeException re) {
      return RecipeReadOp.failed(mIndex.getQueryExecutor(), sink, re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<T> read(final Map<String, Object> values, final Map<String, Object> ids) {
    try {
      return mIndex.where(indexKey(values, ids)).readOne();
    } catch (RecipeException re) {
      return RecipeReadOp.failed(mIndex.getQueryExecutor(), mIndex.singleRowSink(), re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ReadOp<List<T>> multiRead(
      final Map<String, Object> values,
      final List<Map<String, Object>> ids
  ) {
    final RowListSink<T> sink = mIndex.listSink(null);
    try {
      final List<Operation> operations = Lists.newArrayList();
      if (mIdFields.size() == 1 && !ids.isEmpty()) {
        final String idField = mIdFields.get(0);
        final List<Object> terms = Lists.newArrayList();
        for (Map<String, Object> id : ids) {
          terms.add(keyValues(mIdFields, id).get(idField));
        }
        final List<Relation> relations = indexRelations(values);
        relations.add(Relation.in(idField, terms));
        operations.add(mIndex.where(relations).selectOperation(sink));
      } else {
        // One read per row: a tuple of id fields can not be matched with IN.
        for (Map<String, Object> id : ids) {
          operations.add(mIndex.where(indexKey(values, id)).selectOperation(sink));
        }
      }
      return RecipeReadOp.of(mIndex.getQueryExecutor(), sink, operations);
    } catch (RecipeException re) {
      return RecipeReadOp.failed(mIndex.getQueryExecutor(), sink, re);
    }
  }

  /** {@inheritDoc} */
  @Override
  public MultimapMkTable<T> withOptions(final Options options) {
    return new MultimapMkTableRecipe<T>(
        mMain.withOptions(options), mIndex.withOptions(options), mIndexFields, mIdFields);
  }

  /**
   * @param fields required.
   * @param values holding the fields.
   * @return the values of the fields, in key order.
   * @throws OpValidationException if a field is missing.
   */
  private static Map<String, Object> keyValues(
      final List<String> fields,
      final Map<String, Object> values
  ) throws OpValidationException {
    final Map<String, Object> picked = RecipeSupport.pick(fields, values);
    for (Map.Entry<String, Object> entry : picked.entrySet()) {
      if (entry.getValue() == null) {
        throw new OpValidationException(String.format(
            "Missing value for key field '%s' in %s.", entry.getKey(), values));
      }
    }
    return picked;
  }

  /**
   * @param values of the indexed fields.
   * @return a mutable list of equalities on the indexed fields.
   * @throws OpValidationException if an indexed field is missing.
   */
  private List<Relation> indexRelations(final Map<String, Object> values)
      throws OpValidationException {
    return RecipeSupport.equalities(keyValues(mIndexFields, values));
  }

  /**
   * @param ids values of the id fields.
   * @return equalities on the id fields.
   * @throws OpValidationException if an id field is missing.
   */
  private List<Relation> idRelations(final Map<String, Object> ids) throws OpValidationException {
    return RecipeSupport.equalities(keyValues(mIdFields, ids));
  }

  /**
   * @param values of the indexed fields.
   * @param ids values of the id fields.
   * @return relations fixing the primary key of an index row.
   * @throws OpValidationException if a key field is missing.
   */
  private List<Relation> indexKey(
      final Map<String, Object> values,
      final Map<String, Object> ids
  ) throws OpValidationException {
    final List<Relation> relations = indexRelations(values);
    relations.addAll(idRelations(ids));
    return relations;
  }
}
