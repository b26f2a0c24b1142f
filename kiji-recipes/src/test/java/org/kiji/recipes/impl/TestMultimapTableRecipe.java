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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.ColumnType;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.MultimapTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestMultimapTableRecipe {
  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("user", ColumnType.VARCHAR)
      .add("id", ColumnType.VARCHAR)
      .add("note", ColumnType.VARCHAR)
      .build();

  private MemoryQueryExecutor mExecutor;
  private MultimapTable<Map<String, Object>> mFollows;

  @Before
  public void setupTable() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    final KeySpace keySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
    mFollows = keySpace.multimapTable("follows", "user", "id", SCHEMA, MapRowCodec.get());
    mFollows.create();

    mFollows.set(follow("u1", "a"))
        .add(mFollows.set(follow("u1", "b")),
            mFollows.set(follow("u1", "c")),
            mFollows.set(follow("u2", "d")))
        .run();
  }

  private static Map<String, Object> follow(final String user, final String id) {
    return ImmutableMap.<String, Object>of("user", user, "id", id, "note", user + "->" + id);
  }

  private List<String> listIds(final String user, final String startId, final int limit)
      throws Exception {
    final ReadOp<List<Map<String, Object>>> list = mFollows.list(user, startId, limit);
    list.run();
    final List<String> ids = Lists.newArrayList();
    for (Map<String, Object> row : list.getResult()) {
      ids.add((String) row.get("id"));
    }
    return ids;
  }

  @Test
  public void testTables() throws Exception {
    assertEquals(ImmutableList.of(
        "CREATE TABLE ks.follows_multimap_id (\"user\" varchar, \"id\" varchar,"
            + " \"note\" varchar, PRIMARY KEY ((\"id\")))",
        "CREATE TABLE ks.follows_multimap_user_id (\"user\" varchar, \"id\" varchar,"
            + " \"note\" varchar, PRIMARY KEY ((\"user\"), \"id\"))"),
        mFollows.createStatements());
  }

  @Test
  public void testSetWritesBothTables() throws Exception {
    final List<CQLStatement> statements = mFollows.set(follow("u3", "e")).generateStatements();
    assertEquals(2, statements.size());
    assertEquals("follows_multimap_id", statements.get(0).getTable().getName());
    assertEquals("follows_multimap_user_id", statements.get(1).getTable().getName());
  }

  @Test
  public void testList() throws Exception {
    assertEquals(ImmutableList.of("a", "b", "c"), listIds("u1", null, 10));
    assertEquals(ImmutableList.of("a", "b"), listIds("u1", null, 2));
    assertEquals(ImmutableList.of("d"), listIds("u2", null, 10));
    assertTrue(listIds("nobody", null, 10).isEmpty());
  }

  /** Listing from a continuation id excludes that id. */
  @Test
  public void testListContinuation() throws Exception {
    assertEquals(ImmutableList.of("c"), listIds("u1", "b", 10));
    assertEquals(ImmutableList.of("b"), listIds("u1", "a", 1));
    assertTrue(listIds("u1", "c", 10).isEmpty());
  }

  @Test(expected = OpValidationException.class)
  public void testListNonPositiveLimit() throws Exception {
    mFollows.list("u1", null, 0).preflight();
  }

  @Test
  public void testRead() throws Exception {
    final ReadOp<Map<String, Object>> read = mFollows.read("u1", "b");
    read.run();
    assertEquals(follow("u1", "b"), read.getResult());
  }

  @Test
  public void testMultiRead() throws Exception {
    final ReadOp<List<Map<String, Object>>> read =
        mFollows.multiRead("u1", ImmutableList.of("c", "a", "d"));
    read.run();
    assertEquals(ImmutableList.of(follow("u1", "a"), follow("u1", "c")), read.getResult());
  }

  @Test
  public void testUpdate() throws Exception {
    mFollows.update("u1", "a", ImmutableMap.<String, Object>of("note", "close friend")).run();
    final ReadOp<Map<String, Object>> read = mFollows.read("u1", "a");
    read.run();
    assertEquals("close friend", read.getResult().get("note"));
  }

  @Test
  public void testDelete() throws Exception {
    final Op delete = mFollows.delete("u1", "b");
    assertEquals(2, delete.generateStatements().size());
    delete.run();
    assertEquals(ImmutableList.of("a", "c"), listIds("u1", null, 10));
  }

  /** Deleting every row of a value only touches the index table. */
  @Test
  public void testDeleteAll() throws Exception {
    final Op deleteAll = mFollows.deleteAll("u1");
    final List<CQLStatement> statements = deleteAll.generateStatements();
    assertEquals(1, statements.size());
    assertEquals("DELETE FROM ks.follows_multimap_user_id WHERE \"user\" = ?",
        statements.get(0).getQuery());

    deleteAll.run();
    assertTrue(listIds("u1", null, 10).isEmpty());
    assertEquals(ImmutableList.of("d"), listIds("u2", null, 10));
  }

  /**
   * Runs an Op expected to fail validation, and checks that it dispatched nothing.
   *
   * @param op to run.
   * @param field holding the null value.
   */
  private void assertRejected(final Op op, final String field) throws Exception {
    final int before = mExecutor.getExecutedStatements().size();
    try {
      op.preflight();
      fail("Preflight should reject " + op);
    } catch (OpValidationException ove) {
      assertTrue(ove.getMessage(),
          ove.getMessage().contains("Null value for key field '" + field + "'"));
    }
    try {
      op.run();
      fail("Run should reject " + op);
    } catch (OpValidationException ove) {
      // Expected.
    }
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }

  @Test
  public void testNullKeysAreRejected() throws Exception {
    final Map<String, Object> note = ImmutableMap.<String, Object>of("note", "x");
    assertRejected(mFollows.update("u1", null, note), "id");
    assertRejected(mFollows.update(null, "a", note), "user");
    assertRejected(mFollows.delete("u1", null), "id");
    assertRejected(mFollows.delete(null, "a"), "user");
    assertRejected(mFollows.deleteAll(null), "user");
    assertRejected(mFollows.read("u1", null), "id");
    assertRejected(mFollows.read(null, "a"), "user");
    assertRejected(mFollows.list(null, null, 10), "user");
    assertEquals(ImmutableList.of("a", "b", "c"), listIds("u1", null, 10));
  }
}
