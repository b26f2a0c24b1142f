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

package org.kiji.recipes.codec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.Date;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import org.kiji.recipes.ColumnType;
import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.MapTable;
import org.kiji.recipes.ReadOp;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.impl.DefaultKeySpace;
import org.kiji.recipes.impl.memory.MemoryQueryExecutor;

public class TestJacksonRowCodec {
  private static final RowSchema SCHEMA = RowSchema.builder()
      .add("id", ColumnType.VARCHAR)
      .add("age", ColumnType.INT)
      .add("since", ColumnType.TIMESTAMP)
      .build();

  /** Bean stored in the tables under test. */
  public static final class User {
    public String id;
    public int age;
    public Date since;
  }

  private final JacksonRowCodec<User> mCodec = new JacksonRowCodec<User>(User.class);
  private KeySpace mKeySpace;

  @Before
  public void setupKeySpace() throws Exception {
    mKeySpace = new DefaultKeySpace(new MemoryQueryExecutor(), "ks", KeySpaceConfig.DEFAULT);
  }

  private static User user(final String id, final int age, final long since) {
    final User user = new User();
    user.id = id;
    user.age = age;
    user.since = new Date(since);
    return user;
  }

  @Test
  public void testEncode() throws Exception {
    final Map<String, Object> fields = mCodec.encode(user("u1", 36, 1000L));
    assertEquals("u1", fields.get("id"));
    assertEquals(36, fields.get("age"));
    assertEquals(1000L, ((Number) fields.get("since")).longValue());
  }

  @Test
  public void testBeansThroughMapTable() throws Exception {
    final MapTable<User> users = mKeySpace.mapTable("users", "id", SCHEMA, mCodec);
    users.create();
    users.set(user("u1", 36, 1000L)).run();

    final ReadOp<User> read = users.read("u1");
    read.run();
    final User found = read.getResult();
    assertEquals("u1", found.id);
    assertEquals(36, found.age);
    assertEquals(new Date(1000L), found.since);
  }

  @Test
  public void testIgnoresUnknownFields() throws Exception {
    final User decoded = mCodec.decode(
        ImmutableMap.<String, Object>of("id", "u2", "age", 7, "bucket", new Date(0L)));
    assertEquals("u2", decoded.id);
    assertEquals(7, decoded.age);
  }

  @Test
  public void testDecodeBadValue() throws Exception {
    try {
      mCodec.decode(ImmutableMap.<String, Object>of("id", "u3", "age", "seven"));
      fail("Decoding a non numeric age should fail.");
    } catch (IOException ioe) {
      // Expected.
    }
  }
}
