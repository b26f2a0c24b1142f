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

import java.util.regex.Pattern;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Describes one physical Cassandra table: its key space, name, declared fields, key layout,
 * default options and whether dispatched statements are logged verbosely.
 *
 * <p>
 *   Descriptors are created once per table and never change. {@link #withOptions(Options)}
 *   returns a new descriptor.
 * </p>
 */
@Immutable
public final class TableDescriptor {
  /** Valid unquoted Cassandra key space and table names. */
  private static final Pattern RE_NAME = Pattern.compile("[a-zA-Z0-9_]{1,48}");

  private final String mKeyspace;
  private final String mName;
  private final RowSchema mSchema;
  private final Keys mKeys;
  private final Options mOptions;
  private final boolean mDebug;

  /**
   * Creates a table descriptor.
   *
   * @param keyspace name of the key space holding the table.
   * @param name of the table.
   * @param schema declared fields of the table.
   * @param keys primary key layout. Every key field must be declared in the schema.
   * @param options default options of statements against this table.
   * @param debug whether dispatched statements are logged at INFO.
   */
  public TableDescriptor(
      final String keyspace,
      final String name,
      final RowSchema schema,
      final Keys keys,
      final Options options,
      final boolean debug
  ) {
    mKeyspace = Preconditions.checkNotNull(keyspace);
    mName = Preconditions.checkNotNull(name);
    mSchema = Preconditions.checkNotNull(schema);
    mKeys = Preconditions.checkNotNull(keys);
    mOptions = Preconditions.checkNotNull(options);
    mDebug = debug;

    Preconditions.checkArgument(RE_NAME.matcher(keyspace).matches(),
        "Invalid key space name '%s'.", keyspace);
    Preconditions.checkArgument(RE_NAME.matcher(name).matches(),
        "Invalid table name '%s'.", name);
    for (String field : keys.getPrimaryKeyFields()) {
      Preconditions.checkArgument(schema.contains(field),
          "Key field '%s' of table '%s' is not declared in %s.", field, name, schema);
      Preconditions.checkArgument(!schema.getType(field).isCounter()
          && !schema.getType(field).isCollection(),
          "Key field '%s' of table '%s' can not have type %s.",
          field, name, schema.getType(field));
    }
  }

  /** @return the key space name. */
  public String getKeyspace() {
    return mKeyspace;
  }

  /** @return the table name. */
  public String getName() {
    return mName;
  }

  /** @return the table name qualified by its key space, as used in statements. */
  public String getQualifiedName() {
    return mKeyspace + "." + mName;
  }

  /** @return the declared fields. */
  public RowSchema getSchema() {
    return mSchema;
  }

  /** @return the primary key layout. */
  public Keys getKeys() {
    return mKeys;
  }

  /** @return the default options. */
  public Options getOptions() {
    return mOptions;
  }

  /** @return whether statements against this table are logged at INFO. */
  public boolean isDebug() {
    return mDebug;
  }

  /**
   * Derives a descriptor whose default options are these options merged with an override.
   *
   * @param options taking precedence over the current defaults.
   * @return the derived descriptor. This descriptor is not modified.
   */
  public TableDescriptor withOptions(final Options options) {
    return new TableDescriptor(mKeyspace, mName, mSchema, mKeys, mOptions.merge(options), mDebug);
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof TableDescriptor)) {
      return false;
    }
    final TableDescriptor other = (TableDescriptor) obj;
    return mKeyspace.equals(other.mKeyspace)
        && mName.equals(other.mName)
        && mSchema.equals(other.mSchema)
        && mKeys.equals(other.mKeys)
        && mOptions.equals(other.mOptions)
        && mDebug == other.mDebug;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mKeyspace, mName, mSchema, mKeys, mOptions, mDebug);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return getQualifiedName();
  }

  /** @return a detailed description of the descriptor. */
  public String describe() {
    return MoreObjects.toStringHelper(TableDescriptor.class)
        .add("table", getQualifiedName())
        .add("schema", mSchema)
        .add("keys", mKeys)
        .add("options", mOptions)
        .add("debug", mDebug)
        .toString();
  }
}
