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
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.kiji.recipes.TableChanger;

/**
 * Changes all the physical tables of a recipe together. The first table is the main one and
 * names the recipe.
 */
abstract class RecipeTables implements TableChanger {
  private final ImmutableList<DefaultTable<?>> mTables;

  /**
   * @param tables of the recipe, main table first.
   */
  protected RecipeTables(final List<? extends DefaultTable<?>> tables) {
    Preconditions.checkArgument(!tables.isEmpty(), "A recipe needs at least one table.");
    mTables = ImmutableList.<DefaultTable<?>>copyOf(tables);
  }

  /** {@inheritDoc} */
  @Override
  public void create() throws IOException {
    for (DefaultTable<?> table : mTables) {
      table.create();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void createIfNotExist() throws IOException {
    for (DefaultTable<?> table : mTables) {
      table.createIfNotExist();
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<String> createStatements() {
    final List<String> statements = Lists.newArrayList();
    for (DefaultTable<?> table : mTables) {
      statements.addAll(table.createStatements());
    }
    return statements;
  }

  /** {@inheritDoc} */
  @Override
  public List<String> createIfNotExistStatements() {
    final List<String> statements = Lists.newArrayList();
    for (DefaultTable<?> table : mTables) {
      statements.addAll(table.createIfNotExistStatements());
    }
    return statements;
  }

  /** {@inheritDoc} */
  @Override
  public void recreate() throws IOException {
    for (DefaultTable<?> table : mTables) {
      table.recreate();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void drop() throws IOException {
    for (DefaultTable<?> table : mTables) {
      table.drop();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void truncate() throws IOException {
    for (DefaultTable<?> table : mTables) {
      table.truncate();
    }
  }

  /** {@inheritDoc} */
  @Override
  public String getName() {
    return mTables.get(0).getName();
  }

  /** @return the physical tables, main table first. */
  public ImmutableList<DefaultTable<?>> getTables() {
    return mTables;
  }
}
