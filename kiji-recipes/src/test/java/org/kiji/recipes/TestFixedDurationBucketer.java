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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class TestFixedDurationBucketer {
  private static final long HOUR = TimeUnit.HOURS.toMillis(1);

  @Test
  public void testBucket() throws Exception {
    final FixedDurationBucketer bucketer = FixedDurationBucketer.of(1, TimeUnit.HOURS);
    assertEquals(HOUR, bucketer.getSizeMillis());
    assertEquals(0L, bucketer.bucket(0L));
    assertEquals(0L, bucketer.bucket(HOUR - 1));
    assertEquals(HOUR, bucketer.bucket(HOUR));
    assertEquals(3 * HOUR, bucketer.bucket(3 * HOUR + 42));
  }

  @Test
  public void testNegativeTimestamp() throws Exception {
    final FixedDurationBucketer bucketer = new FixedDurationBucketer(HOUR);
    assertEquals(-HOUR, bucketer.bucket(-1L));
    assertEquals(-HOUR, bucketer.bucket(-HOUR));
  }

  @Test
  public void testNextAndPrev() throws Exception {
    final FixedDurationBucketer bucketer = new FixedDurationBucketer(HOUR);
    assertEquals(2 * HOUR, bucketer.next(HOUR));
    assertEquals(0L, bucketer.prev(HOUR));
    assertEquals(bucketer.bucket(5 * HOUR + 7), bucketer.prev(bucketer.next(5 * HOUR)));
  }

  @Test
  public void testMonotonic() throws Exception {
    final FixedDurationBucketer bucketer = FixedDurationBucketer.of(15, TimeUnit.MINUTES);
    final long size = bucketer.getSizeMillis();
    long previous = Long.MIN_VALUE;
    for (long t = -3 * size; t < 3 * size; t += size / 7) {
      final long bucket = bucketer.bucket(t);
      assertTrue(bucket >= previous);
      assertTrue(bucket <= t && t < bucket + size);
      assertTrue(bucketer.bucket(t + size) > bucket);
      previous = bucket;
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveSize() throws Exception {
    new FixedDurationBucketer(0L);
  }
}
