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

import java.io.IOException;
import java.util.List;

/**
 * Creates, recreates and drops the physical tables behind a table or recipe.
 *
 * <p>
 *   Danger zone: these methods change the schema of the key space.
 * </p>
 */
public interface TableChanger {
  /**
   * Creates the tables, failing if one of them exists.
   *
   * @throws IOException on store error.
   */
  void create() throws IOException;

  /**
   * Creates the tables that do not exist yet.
   *
   * @throws IOException on store error.
   */
  void createIfNotExist() throws IOException;

  /** @return the {@code CREATE TABLE} statements, usable from cqlsh. */
  List<String> createStatements();

  /** @return the {@code CREATE TABLE IF NOT EXISTS} statements, usable from cqlsh. */
  List<String> createIfNotExistStatements();

  /**
   * Drops the tables if they exist and creates them again. Meant for tests.
   *
   * @throws IOException on store error.
   */
  void recreate() throws IOException;

  /**
   * Drops the tables if they exist.
   *
   * @throws IOException on store error.
   */
  void drop() throws IOException;

  /**
   * Removes every row of the tables.
   *
   * @throws IOException on store error.
   */
  void truncate() throws IOException;

  /** @return the name of the main physical table. */
  String getName();
}
