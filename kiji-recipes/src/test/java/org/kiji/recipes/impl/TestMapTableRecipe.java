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
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.ColumnType;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.MapTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.Modifier;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RowNotFoundException;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestMapTableRecipe {
  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("id", ColumnType.VARCHAR)
      .add("name", ColumnType.VARCHAR)
      .add("tags", ColumnType.set(ColumnType.VARCHAR))
      .build();

  private MemoryQueryExecutor mExecutor;
  private MapTable<Map<String, Object>> mUsers;

  @Before
  public void setupTable() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    final KeySpace keySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
    mUsers = keySpace.mapTable("users", "id", SCHEMA, MapRowCodec.get());
    mUsers.create();
  }

  private static Map<String, Object> row(final String id, final String name) {
    final Map<String, Object> row = Maps.newHashMap();
    row.put("id", id);
    row.put("name", name);
    row.put("tags", null);
    return row;
  }

  private Map<String, Object> read(final String id) throws Exception {
    final ReadOp<Map<String, Object>> read = mUsers.read(id);
    read.run();
    return read.getResult();
  }

  @Test
  public void testTableName() throws Exception {
    assertEquals("users_map_id", mUsers.getName());
  }

  @Test
  public void testSetAndRead() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann")).run();
    assertEquals(row("a", "Ann"), read("a"));
  }

  @Test
  public void testSetIsIdempotent() throws Exception {
    final Map<String, Object> ann = ImmutableMap.<String, Object>of("id", "a", "name", "Ann");
    mUsers.set(ann).run();
    mUsers.set(ann).run();
    final ReadOp<List<Map<String, Object>>> read = mUsers.multiRead(ImmutableList.of("a"));
    read.run();
    assertEquals(ImmutableList.of(row("a", "Ann")), read.getResult());
  }

  /** Setting a row replaces it: fields absent from the new row are cleared. */
  @Test
  public void testSetReplacesRow() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann")).run();
    mUsers.set(ImmutableMap.<String, Object>of("id", "a")).run();
    assertEquals(row("a", null), read("a"));
  }

  @Test
  public void testUpdate() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann")).run();
    mUsers.update("a", ImmutableMap.<String, Object>of(
        "name", "Anna", "tags", Modifier.setAdd("admin"))).run();

    final Map<String, Object> updated = read("a");
    assertEquals("Anna", updated.get("name"));
    assertTrue(((Set<?>) updated.get("tags")).contains("admin"));
  }

  @Test
  public void testDelete() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann")).run();
    mUsers.delete("a").run();
    try {
      read("a");
      fail("Deleted row should not be found.");
    } catch (RowNotFoundException rnfe) {
      assertEquals("ks.users_map_id", rnfe.getTable());
    }
  }

  @Test
  public void testMultiRead() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann"))
        .add(mUsers.set(ImmutableMap.<String, Object>of("id", "b", "name", "Bob")))
        .run();

    final ReadOp<List<Map<String, Object>>> read =
        mUsers.multiRead(ImmutableList.of("b", "missing", "a"));
    read.run();
    assertEquals(ImmutableList.of(row("a", "Ann"), row("b", "Bob")), read.getResult());
  }

  @Test
  public void testMultiReadNothing() throws Exception {
    final int before = mExecutor.getExecutedStatements().size();
    final ReadOp<List<Map<String, Object>>> read = mUsers.multiRead(ImmutableList.of());
    read.run();
    assertTrue(read.getResult().isEmpty());
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }

  @Test(expected = OpValidationException.class)
  public void testSetWithoutId() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("name", "Ann")).preflight();
  }

  /**
   * Runs an Op expected to fail validation, and checks that it dispatched nothing.
   *
   * @param op to run.
   */
  private void assertRejected(final Op op) throws Exception {
    final int before = mExecutor.getExecutedStatements().size();
    try {
      op.preflight();
      fail("Preflight should reject " + op);
    } catch (OpValidationException ove) {
      assertTrue(ove.getMessage(), ove.getMessage().contains("Null value for key field 'id'"));
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
  public void testNullIdIsRejected() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann")).run();
    assertRejected(mUsers.update(null, ImmutableMap.<String, Object>of("name", "Bob")));
    assertRejected(mUsers.delete(null));
    assertRejected(mUsers.read(null));
    assertRejected(mUsers.multiRead(Lists.newArrayList("a", null)));
    assertEquals(row("a", "Ann"), read("a"));
  }

  @Test
  public void testRecreateClearsRows() throws Exception {
    mUsers.set(ImmutableMap.<String, Object>of("id", "a", "name", "Ann")).run();
    mUsers.recreate();
    final ReadOp<List<Map<String, Object>>> read = mUsers.multiRead(ImmutableList.of("a"));
    read.run();
    assertTrue(read.getResult().isEmpty());
  }
}
