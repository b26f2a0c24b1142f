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

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.ColumnType;
import org.kiji.recipes.FixedDurationBucketer;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.Keys;
import org.kiji.recipes.MultiTimeSeriesTable;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.Table;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestMultiTimeSeriesTableRecipe {
  /** 2024-01-01T00:00:00Z, aligned on an hour. */
  private static final long T0 = 1704067200000L;
  private static final long MINUTE = TimeUnit.MINUTES.toMillis(1);

  private static final FixedDurationBucketer HOURLY = FixedDurationBucketer.of(1, TimeUnit.HOURS);

  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("user", ColumnType.VARCHAR)
      .add("kind", ColumnType.VARCHAR)
      .add("time", ColumnType.TIMESTAMP)
      .add("id", ColumnType.VARCHAR)
      .add("value", ColumnType.INT)
      .build();

  private MemoryQueryExecutor mExecutor;
  private KeySpace mKeySpace;

  @Before
  public void setupKeySpace() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    mKeySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
  }

  private static Date at(final long minutes) {
    return new Date(T0 + minutes * MINUTE);
  }

  private static Map<String, Object> event(
      final String user,
      final String kind,
      final long minutes,
      final String id
  ) {
    return ImmutableMap.<String, Object>builder()
        .put("user", user)
        .put("kind", kind)
        .put("time", at(minutes))
        .put("id", id)
        .put("value", (int) minutes)
        .build();
  }

  private static List<String> ids(final ReadOp<List<Map<String, Object>>> read) throws Exception {
    read.run();
    final List<String> ids = Lists.newArrayList();
    for (Map<String, Object> row : read.getResult()) {
      ids.add((String) row.get("id"));
    }
    return ids;
  }

  @Test
  public void testListByIndexedValue() throws Exception {
    final MultiTimeSeriesTable<Map<String, Object>> events = mKeySpace.multiTimeSeriesTable(
        "mts", "user", "time", "id", HOURLY, SCHEMA, MapRowCodec.get());
    assertEquals("mts_multitimeseries_user_time_id_3600000", events.getName());
    events.create();

    events.set(event("u1", "click", 10, "a"))
        .add(events.set(event("u2", "click", 20, "b")),
            events.set(event("u1", "view", 70, "c")),
            events.set(event("u1", "view", 130, "d")))
        .run();

    assertEquals(ImmutableList.of("a", "c"), ids(events.list("u1", at(0), at(120))));
    assertEquals(ImmutableList.of("a", "c", "d"), ids(events.list("u1", at(0), at(180))));
    assertEquals(ImmutableList.of("b"), ids(events.list("u2", at(0), at(180))));
    assertEquals(3, events.list("u1", at(0), at(180)).generateStatements().size());
  }

  @Test
  public void testReadUpdateDelete() throws Exception {
    final MultiTimeSeriesTable<Map<String, Object>> events = mKeySpace.multiTimeSeriesTable(
        "mts", "user", "time", "id", HOURLY, SCHEMA, MapRowCodec.get());
    events.create();
    events.set(event("u1", "click", 10, "a")).run();

    events.update("u1", at(10), "a", ImmutableMap.<String, Object>of("kind", "tap")).run();
    final ReadOp<Map<String, Object>> read = events.read("u1", at(10), "a");
    read.run();
    assertEquals("tap", read.getResult().get("kind"));

    events.delete("u1", at(10), "a").run();
    assertTrue(ids(events.list("u1", at(0), at(60))).isEmpty());
  }

  @Test
  public void testFlexTableWithIdMirror() throws Exception {
    final MultiTimeSeriesTable<Map<String, Object>> events = mKeySpace.flexMultiTimeSeriesTable(
        "fx", "time", "id", ImmutableList.of("user", "kind"), HOURLY, true,
        SCHEMA, MapRowCodec.get());
    assertEquals("fx_multitimeseries_user_kind_time_id", events.getName());
    assertEquals(2, events.createStatements().size());
    events.create();
    assertTrue(mKeySpace.tableExists("fx_multitimeseries_id"));

    events.set(event("u1", "click", 10, "a"))
        .add(events.set(event("u1", "view", 15, "b")),
            events.set(event("u1", "click", 70, "c")))
        .run();

    final Map<String, Object> clicks =
        ImmutableMap.<String, Object>of("user", "u1", "kind", "click");
    assertEquals(ImmutableList.of("a", "c"), ids(events.list(clicks, at(0), at(120))));

    // The mirror is keyed by id alone and holds no bucket.
    final Table<Map<String, Object>> mirror = mKeySpace.table("fx_multitimeseries_id", SCHEMA,
        Keys.of(ImmutableList.of("id"), ImmutableList.<String>of()), MapRowCodec.get());
    final ReadOp<Map<String, Object>> byId = mirror.where(Relation.eq("id", "b")).readOne();
    byId.run();
    assertEquals(event("u1", "view", 15, "b"), byId.getResult());

    events.update(clicks, at(10), "a", ImmutableMap.<String, Object>of("value", 99)).run();
    final ReadOp<Map<String, Object>> updated = mirror.where(Relation.eq("id", "a")).readOne();
    updated.run();
    assertEquals(99, updated.getResult().get("value"));

    events.delete(clicks, at(70), "c").run();
    final ReadOp<List<Map<String, Object>>> remaining =
        mirror.where(Relation.in("id", "a", "b", "c")).read();
    assertEquals(ImmutableList.of("a", "b"), ids(remaining));
  }

  @Test(expected = OpValidationException.class)
  public void testFlexListNeedsEveryIndexedValue() throws Exception {
    final MultiTimeSeriesTable<Map<String, Object>> events = mKeySpace.flexMultiTimeSeriesTable(
        "fx", "time", "id", ImmutableList.of("user", "kind"), HOURLY, false,
        SCHEMA, MapRowCodec.get());
    events.list("u1", at(0), at(60)).preflight();
  }

  @Test(expected = OpValidationException.class)
  public void testSetWithoutIndexedValue() throws Exception {
    final MultiTimeSeriesTable<Map<String, Object>> events = mKeySpace.multiTimeSeriesTable(
        "mts", "user", "time", "id", HOURLY, SCHEMA, MapRowCodec.get());
    events.set(ImmutableMap.<String, Object>of("time", at(0), "id", "a")).preflight();
  }

  /** A null id is rejected before anything reaches the main table or the mirror. */
  @Test
  public void testNullIdWithMirror() throws Exception {
    final MultiTimeSeriesTable<Map<String, Object>> events = mKeySpace.flexMultiTimeSeriesTable(
        "fx", "time", "id", ImmutableList.of("user", "kind"), HOURLY, true,
        SCHEMA, MapRowCodec.get());
    events.create();
    final Map<String, Object> clicks =
        ImmutableMap.<String, Object>of("user", "u1", "kind", "click");

    final int before = mExecutor.getExecutedStatements().size();
    for (Op op : ImmutableList.<Op>of(
        events.update(clicks, at(10), null, ImmutableMap.<String, Object>of("value", 1)),
        events.delete(clicks, at(10), null),
        events.read(clicks, at(10), null))) {
      try {
        op.run();
        fail("A null id should be rejected: " + op);
      } catch (OpValidationException ove) {
        // Expected.
      }
    }
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }
}
