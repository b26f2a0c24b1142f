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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.ColumnType;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.Keys;
import org.kiji.recipes.Op;
import org.kiji.recipes.OpCancelledException;
import org.kiji.recipes.OpContext;
import org.kiji.recipes.OpExecutionException;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.Table;
import org.kiji.recipes.codec.MapRowCodec;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestRecipeOp {
  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("id", ColumnType.VARCHAR)
      .add("name", ColumnType.VARCHAR)
      .build();

  private static final Keys BY_ID = Keys.of(ImmutableList.of("id"), ImmutableList.<String>of());

  private MemoryQueryExecutor mExecutor;
  private KeySpace mKeySpace;
  private Table<Map<String, Object>> mUsers;

  @Before
  public void setupKeySpace() throws Exception {
    mExecutor = new MemoryQueryExecutor();
    mKeySpace = new DefaultKeySpace(mExecutor, "ks", KeySpaceConfig.DEFAULT);
    mUsers = mKeySpace.table("users", SCHEMA, BY_ID, MapRowCodec.get());
    mUsers.create();
  }

  private static Map<String, Object> user(final String id, final String name) {
    return ImmutableMap.<String, Object>of("id", id, "name", name);
  }

  /** @return the statements applied since {@code from} statements had been applied. */
  private List<CQLStatement> appliedSince(final int from) {
    final List<CQLStatement> executed = mExecutor.getExecutedStatements();
    return executed.subList(from, executed.size());
  }

  private List<Map<String, Object>> allUsers() throws Exception {
    final ReadOp<List<Map<String, Object>>> read = mUsers
        .withOptions(Options.builder().withAllowFiltering(true).build())
        .where()
        .read();
    read.run();
    return read.getResult();
  }

  @Test
  public void testAddKeepsOrder() throws Exception {
    final Op op = mUsers.set(user("b", "Bob"))
        .add(mUsers.set(user("a", "Ann")), mUsers.where(Relation.eq("id", "b")).delete());

    final int before = mExecutor.getExecutedStatements().size();
    op.run();
    final List<CQLStatement> applied = appliedSince(before);
    assertEquals(3, applied.size());
    assertEquals(CQLStatement.Kind.INSERT, applied.get(0).getKind());
    assertEquals("b", applied.get(0).getValues().get(0));
    assertEquals("a", applied.get(1).getValues().get(0));
    assertEquals(CQLStatement.Kind.DELETE, applied.get(2).getKind());

    assertEquals(ImmutableList.of(user("a", "Ann")), allUsers());
  }

  @Test
  public void testPreflightIssuesNothing() throws Exception {
    final Op op = mUsers.set(user("a", "Ann")).add(mUsers.set(user("b", "Bob")));
    final int before = mExecutor.getExecutedStatements().size();
    op.preflight();
    assertEquals(2, op.generateStatements().size());
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }

  @Test
  public void testDeleteWithoutPartitionKey() throws Exception {
    final Op delete = mUsers.where().delete();
    final int before = mExecutor.getExecutedStatements().size();
    try {
      delete.run();
      fail("A delete without partition key should not run.");
    } catch (OpValidationException ove) {
      // Expected.
    }
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }

  @Test
  public void testCompositeOptionsOverrideChildren() throws Exception {
    final Op first = mUsers.withOptions(Options.builder().withTtl(10).build())
        .set(user("a", "Ann"));
    final Op second = mUsers.withOptions(Options.builder().withTtl(20).build())
        .set(user("b", "Bob"));
    final Op composite = first.add(second);

    final List<CQLStatement> kept = composite.generateStatements();
    assertEquals(10, kept.get(0).getValues().get(kept.get(0).getValues().size() - 1));
    assertEquals(20, kept.get(1).getValues().get(kept.get(1).getValues().size() - 1));

    final List<CQLStatement> overridden =
        composite.withOptions(Options.builder().withTtl(5).build()).generateStatements();
    for (CQLStatement statement : overridden) {
      assertEquals(5, statement.getValues().get(statement.getValues().size() - 1));
    }
  }

  @Test
  public void testWithOptionsOverridesDefaults() throws Exception {
    final Table<Map<String, Object>> users =
        mUsers.withOptions(Options.builder().withTtl(100).build());
    final Op op = users.set(user("a", "Ann"));
    final Op derived = op.withOptions(Options.builder().withTtl(5).build());

    final CQLStatement statement = derived.generateStatements().get(0);
    assertTrue(statement.getQuery().endsWith("USING TTL ?"));
    assertEquals(5, statement.getValues().get(statement.getValues().size() - 1));

    // The Op it derives from is unchanged.
    final CQLStatement unchanged = op.generateStatements().get(0);
    assertEquals(100, unchanged.getValues().get(unchanged.getValues().size() - 1));
  }

  @Test
  public void testFailedOpRunsNothing() throws Exception {
    final Op op = mUsers.set(ImmutableMap.<String, Object>of("name", "Nobody"))
        .add(mUsers.set(user("a", "Ann")));
    final int before = mExecutor.getExecutedStatements().size();
    try {
      op.preflight();
      fail("Row without key should not validate.");
    } catch (OpValidationException ove) {
      // Expected.
    }
    try {
      op.run();
      fail("Row without key should not run.");
    } catch (OpValidationException ove) {
      // Expected.
    }
    assertEquals(before, mExecutor.getExecutedStatements().size());
    assertTrue(allUsers().isEmpty());
  }

  @Test
  public void testSequentialFailureReportsAppliedCount() throws Exception {
    final Op op = mUsers.set(user("a", "Ann"))
        .add(mUsers.set(user("b", "Bob")), mUsers.set(user("c", "Cid")));
    mExecutor.failAfter(1);
    try {
      op.run();
      fail("Second statement should fail.");
    } catch (OpExecutionException oee) {
      assertEquals(OpExecutionException.ExecutionMode.SEQUENTIAL, oee.getMode());
      assertEquals(1, oee.getAppliedCount());
      assertTrue(oee.mayBePartiallyApplied());
      assertEquals("b", oee.getStatement().getValues().get(0));
    }
    mExecutor.clearFailure();
    assertEquals(ImmutableList.of(user("a", "Ann")), allUsers());
  }

  @Test
  public void testFirstStatementFailureIsNotPartial() throws Exception {
    mExecutor.failAfter(0);
    try {
      mUsers.set(user("a", "Ann")).run();
      fail("Statement should fail.");
    } catch (OpExecutionException oee) {
      assertEquals(0, oee.getAppliedCount());
      assertFalse(oee.mayBePartiallyApplied());
    }
  }

  @Test
  public void testRunAtomically() throws Exception {
    final Op op = mUsers.set(user("a", "Ann"))
        .add(mUsers.set(user("b", "Bob")), mUsers.set(user("c", "Cid")));
    op.runAtomically();
    assertEquals(1, mExecutor.getBatchCount());
    assertEquals(3, allUsers().size());
  }

  @Test
  public void testFailedBatchAppliesNothing() throws Exception {
    final Table<Map<String, Object>> other =
        mKeySpace.table("other", SCHEMA, BY_ID, MapRowCodec.get());
    other.create();
    final Op op = mUsers.set(user("a", "Ann")).add(other.set(user("b", "Bob")));
    other.drop();

    try {
      op.runAtomically();
      fail("Batch writing to a dropped table should fail.");
    } catch (OpExecutionException oee) {
      assertEquals(OpExecutionException.ExecutionMode.ATOMIC, oee.getMode());
      assertNull(oee.getStatement());
      assertFalse(oee.mayBePartiallyApplied());
    }
    assertEquals(0, mExecutor.getBatchCount());
    assertTrue(allUsers().isEmpty());
  }

  @Test(expected = OpValidationException.class)
  public void testReadsCanNotBeBatched() throws Exception {
    mUsers.set(user("a", "Ann"))
        .add(mUsers.where(Relation.eq("id", "a")).read())
        .runAtomically();
  }

  @Test
  public void testEmptyBatchIsNotDispatched() throws Exception {
    mKeySpace.noOp().runAtomically();
    assertEquals(0, mExecutor.getBatchCount());
  }

  @Test
  public void testCancelledBeforeRun() throws Exception {
    final OpContext context = OpContext.background();
    context.cancel();
    final int before = mExecutor.getExecutedStatements().size();
    try {
      mUsers.set(user("a", "Ann")).run(context);
      fail("Cancelled Op should not run.");
    } catch (OpCancelledException oce) {
      assertEquals(0, oce.getAppliedCount());
    }
    assertEquals(before, mExecutor.getExecutedStatements().size());
  }

  @Test
  public void testDeadlineExceeded() throws Exception {
    final AtomicLong nanos = new AtomicLong(0L);
    final Ticker ticker = new Ticker() {
      @Override
      public long read() {
        return nanos.get();
      }
    };
    final OpContext context = OpContext.withTimeout(1, TimeUnit.SECONDS, ticker);
    assertFalse(context.isDone());
    nanos.set(TimeUnit.SECONDS.toNanos(2));
    assertTrue(context.isExpired());
    try {
      mUsers.set(user("a", "Ann")).runAtomically(context);
      fail("Expired Op should not run.");
    } catch (OpCancelledException oce) {
      assertEquals(0, oce.getAppliedCount());
    }
    assertEquals(0, mExecutor.getBatchCount());
  }

  @Test
  public void testNoOpComposes() throws Exception {
    final Op op = mKeySpace.noOp().add(mUsers.set(user("a", "Ann")));
    assertEquals(1, op.generateStatements().size());
    assertSame(mExecutor, op.getQueryExecutor());
    op.run();
    assertEquals(1, allUsers().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testComposeAcrossExecutors() throws Exception {
    final KeySpace other = new DefaultKeySpace(new MemoryQueryExecutor(), "ks",
        KeySpaceConfig.DEFAULT);
    mKeySpace.noOp().add(other.noOp());
  }

  @Test
  public void testReadResultIsSharedWithDerivedOps() throws Exception {
    mUsers.set(user("a", "Ann")).add(mUsers.set(user("b", "Bob"))).run();
    final ReadOp<List<Map<String, Object>>> read =
        mUsers.where(Relation.in("id", "a", "b")).read();
    final ReadOp<List<Map<String, Object>>> limited =
        read.withOptions(Options.builder().withLimit(1).build());
    limited.run();
    assertEquals(1, read.getResult().size());
    assertEquals(1, limited.getResult().size());
    read.run();
    assertEquals(2, limited.getResult().size());
  }

  @Test(expected = IllegalStateException.class)
  public void testResultBeforeRun() throws Exception {
    mUsers.where(Relation.eq("id", "a")).read().getResult();
  }
}
