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

import com.google.common.collect.ImmutableList;

import org.kiji.recipes.ColumnType;
import org.kiji.recipes.Keys;
import org.kiji.recipes.Options;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.TableDescriptor;

/** The columns of {@code system_schema.tables} that key space introspection reads. */
public final class SystemTables {
  public static final String KEYSPACE_NAME_COL = "keyspace_name";
  public static final String TABLE_NAME_COL = "table_name";

  /** Descriptor of {@code system_schema.tables}, reduced to its primary key. */
  public static final TableDescriptor DESCRIPTOR = new TableDescriptor(
      "system_schema",
      "tables",
      RowSchema.builder()
          .add(KEYSPACE_NAME_COL, ColumnType.VARCHAR)
          .add(TABLE_NAME_COL, ColumnType.VARCHAR)
          .build(),
      Keys.of(ImmutableList.of(KEYSPACE_NAME_COL), ImmutableList.of(TABLE_NAME_COL)),
      Options.EMPTY,
      false);

  /** Private constructor for utility class. */
  private SystemTables() {
  }
}
