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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.ColumnType;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.MapTable;
import org.kiji.recipes.MultimapTable;
import org.kiji.recipes.Options;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestDefaultKeySpace {
  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("id", ColumnType.VARCHAR)
      .add("team", ColumnType.VARCHAR)
      .add("name", ColumnType.VARCHAR)
      .build();

  private MemoryQueryExecutor mExecutor;
  private KeySpace mKeySpace;

  @Before
  public void setupKeySpace() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    mKeySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
  }

  @Test
  public void testTableNames() throws Exception {
    assertTrue(mKeySpace.getTableNames().isEmpty());

    final MultimapTable<Map<String, Object>> members = mKeySpace.multimapTable(
        "members", "team", "id", SCHEMA, MapRowCodec.get());
    assertEquals(2, members.createStatements().size());
    members.create();
    mKeySpace.mapTable("users", "id", SCHEMA, MapRowCodec.get()).create();

    // Tables of other key spaces are not listed.
    new DefaultKeySpace(mExecutor, "other", KeySpaceConfig.DEFAULT)
        .mapTable("users", "id", SCHEMA, MapRowCodec.get())
        .create();

    assertEquals(
        ImmutableSet.of("members_multimap_id", "members_multimap_team_id", "users_map_id"),
        mKeySpace.getTableNames());
    assertTrue(mKeySpace.tableExists("Users_Map_Id"));

    members.drop();
    assertFalse(mKeySpace.tableExists("members_multimap_id"));
    assertEquals(ImmutableSet.of("users_map_id"), mKeySpace.getTableNames());
  }

  @Test
  public void testDefaultOptions() throws Exception {
    final KeySpace withTtl =
        mKeySpace.withOptions(Options.builder().withTtl(60).build());
    final MapTable<Map<String, Object>> users =
        withTtl.mapTable("users", "id", SCHEMA, MapRowCodec.get());
    users.create();

    final List<CQLStatement> statements = users.set(
        ImmutableMap.<String, Object>of("id", "1", "name", "ada")).generateStatements();
    assertEquals(1, statements.size());
    assertTrue(statements.get(0).getQuery(), statements.get(0).getQuery().contains("USING TTL"));

    final List<CQLStatement> plain = mKeySpace.mapTable("users", "id", SCHEMA, MapRowCodec.get())
        .set(ImmutableMap.<String, Object>of("id", "1")).generateStatements();
    assertFalse(plain.get(0).getQuery().contains("USING TTL"));
  }

  @Test
  public void testNoOp() throws Exception {
    mKeySpace.noOp().run();
    assertTrue(mKeySpace.noOp().generateStatements().isEmpty());
    assertEquals(mExecutor, mKeySpace.getQueryExecutor());
    assertEquals("ks", mKeySpace.getName());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUndeclaredIdField() throws Exception {
    mKeySpace.mapTable("users", "email", SCHEMA, MapRowCodec.get());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyIndexFields() throws Exception {
    mKeySpace.multimapMultiKeyTable(
        "docs", ImmutableList.<String>of(), ImmutableList.of("id"), SCHEMA, MapRowCodec.get());
  }
}
