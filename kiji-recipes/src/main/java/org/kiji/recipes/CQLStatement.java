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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A generated CQL statement: the query text with positional {@code ?} markers, the values bound
 * to those markers, and the structured parts the text was rendered from.
 *
 * <p>
 *   Executors backed by Cassandra only need {@link #getQuery()} and {@link #getValues()}. The
 *   structured parts let other executors, such as the in-memory one used in tests, interpret the
 *   statement without parsing CQL.
 * </p>
 */
@Immutable
public final class CQLStatement {

  /** Kinds of generated statements. */
  public static enum Kind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE_TABLE,
    DROP_TABLE,
    TRUNCATE;

    /** @return whether statements of this kind modify rows. */
    public boolean isWrite() {
      return this == INSERT || this == UPDATE || this == DELETE;
    }
  }

  private final Kind mKind;
  private final TableDescriptor mTable;
  private final String mQuery;
  private final List<Object> mValues;
  private final ImmutableList<Relation> mRelations;
  private final Map<String, Object> mAssignments;
  private final Options mOptions;
  private final boolean mIfNotExists;

  /**
   * Creates a statement. Values and assignments may hold nulls and are copied.
   *
   * @param kind of statement.
   * @param table the statement targets.
   * @param query CQL text.
   * @param values bound to the markers of the query, in order.
   * @param relations of the WHERE clause.
   * @param assignments written columns for inserts and updates, in statement order.
   * @param options the statement was rendered with.
   * @param ifNotExists whether a CREATE statement is guarded by an existence check.
   */
  public CQLStatement(
      final Kind kind,
      final TableDescriptor table,
      final String query,
      final List<Object> values,
      final List<Relation> relations,
      final Map<String, Object> assignments,
      final Options options,
      final boolean ifNotExists
  ) {
    mKind = Preconditions.checkNotNull(kind);
    mTable = Preconditions.checkNotNull(table);
    mQuery = Preconditions.checkNotNull(query);
    mValues = Collections.unmodifiableList(Lists.newArrayList(values));
    mRelations = ImmutableList.copyOf(relations);
    mAssignments = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(assignments));
    mOptions = Preconditions.checkNotNull(options);
    mIfNotExists = ifNotExists;
  }

  /** @return the kind of statement. */
  public Kind getKind() {
    return mKind;
  }

  /** @return the table the statement targets. */
  public TableDescriptor getTable() {
    return mTable;
  }

  /** @return the CQL text. */
  public String getQuery() {
    return mQuery;
  }

  /** @return the values bound to the positional markers. */
  public List<Object> getValues() {
    return mValues;
  }

  /** @return the relations of the WHERE clause. */
  public ImmutableList<Relation> getRelations() {
    return mRelations;
  }

  /** @return the written columns; values are plain values or {@link Modifier}s. */
  public Map<String, Object> getAssignments() {
    return mAssignments;
  }

  /** @return the options the statement was rendered with. */
  public Options getOptions() {
    return mOptions;
  }

  /** @return the row limit rendered into a SELECT, or null. */
  @Nullable
  public Integer getLimit() {
    return mKind == Kind.SELECT ? mOptions.getLimit() : null;
  }

  /** @return whether a CREATE statement is guarded by {@code IF NOT EXISTS}. */
  public boolean isIfNotExists() {
    return mIfNotExists;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(CQLStatement.class)
        .add("query", mQuery)
        .add("values", mValues)
        .toString();
  }
}
