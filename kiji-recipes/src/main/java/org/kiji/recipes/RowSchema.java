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

import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * The declared field set of a table: an ordered mapping of field name to {@link ColumnType}.
 *
 * <p>
 *   Declaration order is preserved. It is the column order of generated {@code INSERT} and
 *   {@code CREATE TABLE} statements.
 * </p>
 */
@Immutable
public final class RowSchema {
  /** Relies on the ordering guarantees of ImmutableMap. */
  private final ImmutableMap<String, ColumnType> mColumns;

  /**
   * Constructs a schema from an ordered column map.
   *
   * @param columns ordered columns. Must not be empty.
   */
  private RowSchema(final Map<String, ColumnType> columns) {
    Preconditions.checkArgument(!columns.isEmpty(),
        "A row schema must declare at least one field.");
    mColumns = ImmutableMap.copyOf(columns);
  }

  /** @return a new schema builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** @return the declared columns, in declaration order. */
  public ImmutableMap<String, ColumnType> getColumns() {
    return mColumns;
  }

  /** @return the declared field names, in declaration order. */
  public ImmutableList<String> getFieldNames() {
    return mColumns.keySet().asList();
  }

  /**
   * @param field name of a field.
   * @return whether the field is declared.
   */
  public boolean contains(final String field) {
    return mColumns.containsKey(field);
  }

  /**
   * @param field name of a declared field.
   * @return the type of the field.
   */
  public ColumnType getType(final String field) {
    final ColumnType type = mColumns.get(field);
    Preconditions.checkArgument(type != null, "Field '%s' is not declared.", field);
    return type;
  }

  /** @return whether any declared column is a counter. */
  public boolean hasCounters() {
    return mColumns.containsValue(ColumnType.COUNTER);
  }

  /**
   * Returns a copy of this schema with one more field appended.
   *
   * @param field name of the new field.
   * @param type of the new field.
   * @return the extended schema.
   */
  public RowSchema with(final String field, final ColumnType type) {
    return builder().addAll(mColumns).add(field, type).build();
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    return obj instanceof RowSchema && mColumns.equals(((RowSchema) obj).mColumns);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return mColumns.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(RowSchema.class)
        .add("columns", mColumns)
        .toString();
  }

  /** Builder for {@link RowSchema}. Fields are kept in insertion order. */
  public static final class Builder {
    private final LinkedHashMap<String, ColumnType> mColumns = Maps.newLinkedHashMap();

    /** Use {@link RowSchema#builder()}. */
    private Builder() {
    }

    /**
     * Declares a field.
     *
     * @param field name of the field.
     * @param type CQL type of the field.
     * @return this builder.
     */
    public Builder add(final String field, final ColumnType type) {
      Preconditions.checkNotNull(field);
      Preconditions.checkNotNull(type);
      Preconditions.checkArgument(!field.isEmpty(), "Field names must not be empty.");
      Preconditions.checkArgument(!mColumns.containsKey(field),
          "Field '%s' is declared twice.", field);
      mColumns.put(field, type);
      return this;
    }

    /**
     * Declares several fields.
     *
     * @param columns ordered fields to declare.
     * @return this builder.
     */
    public Builder addAll(final Map<String, ColumnType> columns) {
      for (Map.Entry<String, ColumnType> column : columns.entrySet()) {
        add(column.getKey(), column.getValue());
      }
      return this;
    }

    /** @return the schema. */
    public RowSchema build() {
      return new RowSchema(mColumns);
    }
  }
}
