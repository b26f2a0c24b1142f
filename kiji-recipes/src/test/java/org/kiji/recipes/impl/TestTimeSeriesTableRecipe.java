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

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.ColumnType;
import org.kiji.recipes.FixedDurationBucketer;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RowNotFoundException;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.TimeSeriesTable;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestTimeSeriesTableRecipe {
  /** 2024-01-01T00:00:00Z, aligned on an hour. */
  private static final long T0 = 1704067200000L;
  private static final long MINUTE = TimeUnit.MINUTES.toMillis(1);

  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("time", ColumnType.TIMESTAMP)
      .add("id", ColumnType.VARCHAR)
      .add("value", ColumnType.INT)
      .build();

  private MemoryQueryExecutor mExecutor;
  private KeySpace mKeySpace;
  private TimeSeriesTable<Map<String, Object>> mEvents;

  @Before
  public void setupTable() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    mKeySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
    mEvents = mKeySpace.timeSeriesTable("ev", "time", "id",
        FixedDurationBucketer.of(1, TimeUnit.HOURS), SCHEMA, MapRowCodec.get());
    mEvents.create();

    // Events at 00:10, 00:50 and 01:05; times given as epoch millis and as dates.
    mEvents.set(event(T0 + 10 * MINUTE, "a", 1))
        .add(mEvents.set(event(new Date(T0 + 50 * MINUTE), "b", 2)),
            mEvents.set(event(T0 + 65 * MINUTE, "c", 3)))
        .run();
  }

  private static Map<String, Object> event(final Object time, final String id, final int value) {
    return ImmutableMap.<String, Object>of("time", time, "id", id, "value", value);
  }

  private static Date at(final long minutes) {
    return new Date(T0 + minutes * MINUTE);
  }

  private static List<String> ids(final List<Map<String, Object>> rows) {
    final List<String> ids = Lists.newArrayList();
    for (Map<String, Object> row : rows) {
      ids.add((String) row.get("id"));
    }
    return ids;
  }

  private List<String> list(final TimeSeriesTable<Map<String, Object>> table,
      final Date start, final Date end) throws Exception {
    final ReadOp<List<Map<String, Object>>> list = table.list(start, end);
    list.run();
    return ids(list.getResult());
  }

  @Test
  public void testTableName() throws Exception {
    assertEquals("ev_timeseries_time_id_3600000", mEvents.getName());
    assertTrue(mEvents.createStatements().get(0).contains(
        "\"bucket\" timestamp, PRIMARY KEY ((\"bucket\"), \"time\", \"id\"))"));
  }

  @Test
  public void testListWithinBucket() throws Exception {
    assertEquals(ImmutableList.of("a", "b"), list(mEvents, at(0), at(60)));
    assertEquals(ImmutableList.of("b"), list(mEvents, at(50), at(60)));
  }

  @Test
  public void testListAcrossBuckets() throws Exception {
    final ReadOp<List<Map<String, Object>>> list = mEvents.list(at(30), at(70));
    final List<CQLStatement> statements = list.generateStatements();
    assertEquals(2, statements.size());
    assertEquals(new Date(T0), statements.get(0).getValues().get(0));
    assertEquals(at(60), statements.get(1).getValues().get(0));

    list.run();
    assertEquals(ImmutableList.of("b", "c"), ids(list.getResult()));
  }

  /** The end of a range is exclusive, the start inclusive. */
  @Test
  public void testRangeBounds() throws Exception {
    assertEquals(ImmutableList.of("a"), list(mEvents, at(10), at(50)));
    assertEquals(ImmutableList.of("a", "b", "c"), list(mEvents, at(10), at(66)));
  }

  @Test
  public void testEmptyRange() throws Exception {
    final ReadOp<List<Map<String, Object>>> list = mEvents.list(at(10), at(10));
    assertTrue(list.generateStatements().isEmpty());
    list.run();
    assertTrue(list.getResult().isEmpty());
  }

  @Test(expected = OpValidationException.class)
  public void testInvertedRange() throws Exception {
    mEvents.list(at(60), at(0)).run();
  }

  @Test
  public void testRowsHideBucket() throws Exception {
    final ReadOp<List<Map<String, Object>>> list = mEvents.list(at(0), at(120));
    list.run();
    for (Map<String, Object> row : list.getResult()) {
      assertFalse(row.containsKey("bucket"));
      assertTrue(row.get("time") instanceof Date);
    }
  }

  /** Rows come back ordered by time then id, whatever the clustering order of the reads. */
  @Test
  public void testMergeOrder() throws Exception {
    mEvents.set(event(at(50), "a2", 4)).add(mEvents.set(event(at(65), "b2", 5))).run();
    final TimeSeriesTable<Map<String, Object>> descending = mEvents.withOptions(
        Options.builder()
            .withClusteringOrder(ImmutableList.of(
                new Options.ClusteringOrder("time", Options.Direction.DESC),
                new Options.ClusteringOrder("id", Options.Direction.DESC)))
            .build());
    final List<String> expected = ImmutableList.of("a", "a2", "b", "b2", "c");
    assertEquals(expected, list(mEvents, at(0), at(120)));
    assertEquals(expected, list(descending, at(0), at(120)));
  }

  /**
   * Lists a range with a limit.
   *
   * @param limit of the list.
   * @param expectedReads number of bucket reads dispatched.
   * @return the listed ids.
   */
  private List<String> listLimited(final int limit, final int expectedReads) throws Exception {
    final ReadOp<List<Map<String, Object>>> list =
        mEvents.list(at(0), at(180)).withOptions(Options.builder().withLimit(limit).build());
    assertEquals(3, list.generateStatements().size());
    final int before = mExecutor.getExecutedStatements().size();
    list.run();
    assertEquals(expectedReads, mExecutor.getExecutedStatements().size() - before);
    return ids(list.getResult());
  }

  /** A limit caps the merged list, and buckets past the limit are not read. */
  @Test
  public void testListLimitAcrossBuckets() throws Exception {
    mEvents.set(event(at(70), "d", 4))
        .add(mEvents.set(event(at(130), "e", 5)), mEvents.set(event(at(150), "f", 6)))
        .run();

    assertEquals(ImmutableList.of("a"), listLimited(1, 1));
    assertEquals(ImmutableList.of("a", "b", "c"), listLimited(3, 2));
    assertEquals(ImmutableList.of("a", "b", "c", "d", "e"), listLimited(5, 3));
    assertEquals(ImmutableList.of("a", "b", "c", "d", "e", "f"), listLimited(10, 3));

    final TimeSeriesTable<Map<String, Object>> limited =
        mEvents.withOptions(Options.builder().withLimit(1).build());
    assertEquals(ImmutableList.of("a"), list(limited, at(0), at(180)));
  }

  /** Null ids are rejected before anything is dispatched. */
  @Test
  public void testNullIdIsRejected() throws Exception {
    final int before = mExecutor.getExecutedStatements().size();
    try {
      mEvents.update(at(50), null, ImmutableMap.<String, Object>of("value", 20)).preflight();
      fail("Update with a null id should be rejected.");
    } catch (OpValidationException ove) {
      // Expected.
    }
    try {
      mEvents.delete(at(50), null).run();
      fail("Delete with a null id should be rejected.");
    } catch (OpValidationException ove) {
      // Expected.
    }
    try {
      mEvents.read(at(50), null).run();
      fail("Read with a null id should be rejected.");
    } catch (OpValidationException ove) {
      // Expected.
    }
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }

  @Test
  public void testReadUpdateDelete() throws Exception {
    mEvents.update(at(50), "b", ImmutableMap.<String, Object>of("value", 20)).run();
    final ReadOp<Map<String, Object>> read = mEvents.read(at(50), "b");
    read.run();
    assertEquals(20, read.getResult().get("value"));
    assertEquals(at(50), read.getResult().get("time"));

    mEvents.delete(at(50), "b").run();
    try {
      mEvents.read(at(50), "b").run();
      fail("Deleted row should not be found.");
    } catch (RowNotFoundException rnfe) {
      // Expected.
    }
  }

  @Test(expected = OpValidationException.class)
  public void testSetWithoutTime() throws Exception {
    mEvents.set(ImmutableMap.<String, Object>of("id", "x", "value", 1)).preflight();
  }

  @Test(expected = OpValidationException.class)
  public void testSetWithInvalidTime() throws Exception {
    mEvents.set(event("yesterday", "x", 1)).preflight();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testReservedBucketField() throws Exception {
    mKeySpace.timeSeriesTable("bad", "time", "id", FixedDurationBucketer.of(1, TimeUnit.HOURS),
        SCHEMA.with("bucket", ColumnType.BIGINT), MapRowCodec.get());
  }
}
