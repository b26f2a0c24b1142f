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

package org.kiji.recipes.impl.memory;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.ColumnType;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.Keys;
import org.kiji.recipes.Modifier;
import org.kiji.recipes.OpExecutionException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.Table;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.DefaultKeySpace;

public class TestMemoryQueryExecutor {
  private static final RowSchema COLLECTIONS_SCHEMA = RowSchema.builder()
      .add("id", ColumnType.VARCHAR)
      .add("items", ColumnType.list(ColumnType.INT))
      .add("tags", ColumnType.set(ColumnType.VARCHAR))
      .add("attrs", ColumnType.map(ColumnType.VARCHAR, ColumnType.VARCHAR))
      .build();

  private static final RowSchema EVENTS_SCHEMA = RowSchema.builder()
      .add("user", ColumnType.VARCHAR)
      .add("seq", ColumnType.INT)
      .add("payload", ColumnType.VARCHAR)
      .build();

  private static final Keys ID_KEY =
      Keys.of(ImmutableList.of("id"), ImmutableList.<String>of());

  private static final Keys EVENT_KEY =
      Keys.of(ImmutableList.of("user", "seq"), ImmutableList.<String>of());

  private MemoryQueryExecutor mExecutor;
  private KeySpace mKeySpace;
  private Table<Map<String, Object>> mCollections;
  private Table<Map<String, Object>> mEvents;

  @Before
  public void setupTables() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    mKeySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
    mCollections = mKeySpace.table("collections", COLLECTIONS_SCHEMA, ID_KEY, MapRowCodec.get());
    mCollections.create();
    mEvents = mKeySpace.table("events", EVENTS_SCHEMA,
        Keys.of(ImmutableList.of("user"), ImmutableList.of("seq")), MapRowCodec.get());
    mEvents.create();
  }

  private Map<String, Object> readCollections(final String id) throws Exception {
    final ReadOp<Map<String, Object>> read = mCollections.where(Relation.eq("id", id)).readOne();
    read.run();
    return read.getResult();
  }

  private void updateCollections(final String id, final String field, final Modifier modifier)
      throws Exception {
    mCollections.where(Relation.eq("id", id))
        .update(ImmutableMap.<String, Object>of(field, modifier))
        .run();
  }

  private static Map<String, Object> event(final String user, final int seq) {
    return ImmutableMap.<String, Object>of("user", user, "seq", seq, "payload", user + seq);
  }

  @Test
  public void testCounterIncrements() throws Exception {
    final Table<Map<String, Object>> counters = mKeySpace.table("counters",
        RowSchema.builder().add("id", ColumnType.VARCHAR).add("hits", ColumnType.COUNTER).build(),
        ID_KEY, MapRowCodec.get());
    counters.create();

    for (long delta : new long[] {1L, 5L, -2L}) {
      counters.where(Relation.eq("id", "page"))
          .update(ImmutableMap.<String, Object>of("hits", Modifier.counterIncrement(delta)))
          .run();
    }
    final ReadOp<Map<String, Object>> read = counters.where(Relation.eq("id", "page")).readOne();
    read.run();
    assertEquals(4L, read.getResult().get("hits"));
  }

  @Test
  public void testListModifiers() throws Exception {
    updateCollections("x", "items", Modifier.listAppend(1, 2));
    updateCollections("x", "items", Modifier.listPrepend(0));
    assertEquals(ImmutableList.of(0, 1, 2), readCollections("x").get("items"));

    updateCollections("x", "items", Modifier.listRemove(1));
    updateCollections("x", "items", Modifier.listSetAtIndex(1, 7));
    assertEquals(ImmutableList.of(0, 7), readCollections("x").get("items"));

    try {
      updateCollections("x", "items", Modifier.listSetAtIndex(5, 9));
      fail("Setting past the end of a list should fail.");
    } catch (OpExecutionException oee) {
      // Expected.
    }
    assertEquals(ImmutableList.of(0, 7), readCollections("x").get("items"));
  }

  @Test
  public void testSetModifiers() throws Exception {
    updateCollections("x", "tags", Modifier.setAdd("b", "a"));
    updateCollections("x", "tags", Modifier.setAdd("a", "c"));
    assertEquals(ImmutableSet.of("a", "b", "c"), readCollections("x").get("tags"));

    updateCollections("x", "tags", Modifier.setRemove("a", "b", "c"));
    final Map<String, Object> row = readCollections("x");
    assertTrue(row.containsKey("tags"));
    assertNull(row.get("tags"));
  }

  @Test
  public void testMapModifiers() throws Exception {
    updateCollections("x", "attrs", Modifier.mapSetField("k1", "v1"));
    updateCollections("x", "attrs",
        Modifier.mapSetFields(ImmutableMap.of("k2", "v2", "k1", "v0")));
    assertEquals(ImmutableMap.of("k1", "v0", "k2", "v2"), readCollections("x").get("attrs"));
  }

  @Test
  public void testInsertDropsNullFields() throws Exception {
    final Map<String, Object> row = Maps.newHashMap();
    row.put("user", "u1");
    row.put("seq", 1);
    row.put("payload", null);
    mEvents.set(row).run();

    final ReadOp<Map<String, Object>> read =
        mEvents.where(Relation.eq("user", "u1"), Relation.eq("seq", 1)).readOne();
    read.run();
    assertNull(read.getResult().get("payload"));
  }

  @Test
  public void testCreateExistingTable() throws Exception {
    try {
      mEvents.create();
      fail("Creating an existing table should fail.");
    } catch (IOException ioe) {
      // Expected.
    }
    mEvents.createIfNotExist();
  }

  @Test
  public void testWriteToMissingTable() throws Exception {
    final Table<Map<String, Object>> missing =
        mKeySpace.table("missing", EVENTS_SCHEMA, EVENT_KEY, MapRowCodec.get());
    try {
      missing.set(event("u1", 1)).run();
      fail("Writing to a missing table should fail.");
    } catch (OpExecutionException oee) {
      assertEquals(0, oee.getAppliedCount());
    }
  }

  @Test
  public void testTruncate() throws Exception {
    mEvents.set(event("u1", 1)).add(mEvents.set(event("u1", 2))).run();
    mEvents.truncate();
    final ReadOp<List<Map<String, Object>>> read =
        mEvents.where(Relation.eq("user", "u1")).read();
    read.run();
    assertTrue(read.getResult().isEmpty());
  }

  @Test
  public void testInWithLimit() throws Exception {
    mEvents.set(event("u2", 2))
        .add(mEvents.set(event("u1", 2)),
            mEvents.set(event("u2", 1)),
            mEvents.set(event("u1", 1)),
            mEvents.set(event("u3", 1)))
        .run();

    final ReadOp<List<Map<String, Object>>> read =
        mEvents.where(Relation.in("user", "u1", "u2")).read()
            .withOptions(Options.builder().withLimit(3).build());
    read.run();
    assertEquals(
        ImmutableList.of(event("u1", 1), event("u1", 2), event("u2", 1)),
        read.getResult());
  }

  @Test
  public void testBatchRejectsReads() throws Exception {
    final ReadOp<List<Map<String, Object>>> read =
        mEvents.where(Relation.eq("user", "u1")).read();
    try {
      mExecutor.executeAtomically(read.generateStatements(), Options.EMPTY);
      fail("A batch holding a read should fail.");
    } catch (IOException ioe) {
      // Expected.
    }
    assertEquals(0, mExecutor.getBatchCount());
  }

  @Test
  public void testRecordsExecutedStatements() throws Exception {
    final int before = mExecutor.getExecutedStatements().size();
    mEvents.set(event("u1", 1)).add(mEvents.set(event("u1", 2))).runAtomically();
    assertEquals(before + 2, mExecutor.getExecutedStatements().size());
    assertEquals(1, mExecutor.getBatchCount());
  }

  @Test
  public void testClearFailure() throws Exception {
    mExecutor.failAfter(0);
    try {
      mEvents.set(event("u1", 1)).run();
      fail("Injected failure expected.");
    } catch (OpExecutionException oee) {
      // Expected.
    }
    mExecutor.clearFailure();
    mEvents.set(event("u1", 1)).run();
  }

  @Test
  public void testClosedExecutor() throws Exception {
    mKeySpace.close();
    try {
      mEvents.set(event("u1", 1)).run();
      fail("A closed executor should reject statements.");
    } catch (OpExecutionException oee) {
      // Expected.
    }
  }
}
