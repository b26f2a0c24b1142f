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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.Options;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;
import org.kiji.recipes.TableDescriptor;

/**
 * One unit of an Op: what a single statement will do, before it is rendered.
 *
 * <p>
 *   Rendering is deferred to {@link #generate()} so that options applied after the operation
 *   was built still reach the statement text.
 * </p>
 */
@Immutable
public final class Operation {
  private final CQLStatement.Kind mKind;
  private final TableDescriptor mTable;
  private final ImmutableList<Relation> mRelations;
  private final Map<String, Object> mFields;
  private final Options mOptions;
  private final RowsHandler mHandler;

  /**
   * @param kind of statement.
   * @param table targeted.
   * @param relations of the WHERE clause.
   * @param fields written by inserts and updates. May hold nulls.
   * @param options of the operation, merged over the table options when rendering.
   * @param handler of the rows of a SELECT, or null.
   */
  private Operation(
      final CQLStatement.Kind kind,
      final TableDescriptor table,
      final List<Relation> relations,
      final Map<String, Object> fields,
      final Options options,
      @Nullable final RowsHandler handler
  ) {
    mKind = kind;
    mTable = Preconditions.checkNotNull(table);
    mRelations = ImmutableList.copyOf(relations);
    mFields = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(fields));
    mOptions = Preconditions.checkNotNull(options);
    mHandler = handler;
  }

  /**
   * @param table targeted.
   * @param fields of the row.
   * @return an operation replacing a whole row.
   */
  public static Operation insert(final TableDescriptor table, final Map<String, Object> fields) {
    return new Operation(CQLStatement.Kind.INSERT, table, ImmutableList.<Relation>of(), fields,
        Options.EMPTY, null);
  }

  /**
   * @param table targeted.
   * @param relations fixing the primary key of the updated rows.
   * @param fields to write. Values may be modifiers.
   * @return an operation changing some fields of rows.
   */
  public static Operation update(
      final TableDescriptor table,
      final List<Relation> relations,
      final Map<String, Object> fields
  ) {
    return new Operation(CQLStatement.Kind.UPDATE, table, relations, fields, Options.EMPTY, null);
  }

  /**
   * @param table targeted.
   * @param relations selecting the deleted rows.
   * @return an operation deleting rows.
   */
  public static Operation delete(final TableDescriptor table, final List<Relation> relations) {
    return new Operation(CQLStatement.Kind.DELETE, table, relations,
        Collections.<String, Object>emptyMap(), Options.EMPTY, null);
  }

  /**
   * @param table targeted.
   * @param relations selecting the read rows.
   * @param handler receiving the rows.
   * @return an operation reading rows.
   */
  public static Operation select(
      final TableDescriptor table,
      final List<Relation> relations,
      final RowsHandler handler
  ) {
    return new Operation(CQLStatement.Kind.SELECT, table, relations,
        Collections.<String, Object>emptyMap(), Options.EMPTY, Preconditions.checkNotNull(handler));
  }

  /** @return the kind of statement. */
  public CQLStatement.Kind getKind() {
    return mKind;
  }

  /** @return the table targeted. */
  public TableDescriptor getTable() {
    return mTable;
  }

  /** @return the relations of the WHERE clause. */
  public ImmutableList<Relation> getRelations() {
    return mRelations;
  }

  /** @return the written fields. */
  public Map<String, Object> getFields() {
    return mFields;
  }

  /** @return the options of this operation, without the table options. */
  public Options getOptions() {
    return mOptions;
  }

  /** @return the options of the rendered statement: table options, then operation options. */
  public Options getEffectiveOptions() {
    return mTable.getOptions().merge(mOptions);
  }

  /** @return the handler of the rows read, or null for writes. */
  @Nullable
  public RowsHandler getHandler() {
    return mHandler;
  }

  /** @return whether this operation reads rows. */
  public boolean isRead() {
    return mKind == CQLStatement.Kind.SELECT;
  }

  /**
   * @param options taking precedence over the options of this operation.
   * @return the derived operation.
   */
  public Operation withOptions(final Options options) {
    return new Operation(mKind, mTable, mRelations, mFields, mOptions.merge(options), mHandler);
  }

  /**
   * Renders the statement.
   *
   * @return the statement.
   * @throws RecipeException if the operation is not valid against the table.
   */
  public CQLStatement generate() throws RecipeException {
    final Options options = getEffectiveOptions();
    switch (mKind) {
      case INSERT: return CQLStatements.insert(mTable, mFields, options);
      case UPDATE: return CQLStatements.update(mTable, mRelations, mFields, options);
      case DELETE: return CQLStatements.delete(mTable, mRelations, options);
      case SELECT: return CQLStatements.select(mTable, mRelations, options);
      default: throw new IllegalStateException(
          String.format("Unsupported operation kind %s.", mKind));
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(Operation.class)
        .add("kind", mKind)
        .add("table", mTable)
        .add("relations", mRelations)
        .add("fields", mFields.keySet())
        .add("options", mOptions)
        .toString();
  }
}
