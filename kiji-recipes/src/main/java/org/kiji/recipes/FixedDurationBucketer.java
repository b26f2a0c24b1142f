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

import java.math.RoundingMode;
import java.util.concurrent.TimeUnit;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

/**
 * Buckets of a fixed duration aligned on the epoch: {@code floor(t / size) * size}.
 */
@Immutable
public final class FixedDurationBucketer implements Bucketer {
  private final long mSizeMillis;

  /**
   * @param sizeMillis bucket duration in milliseconds. Must be positive.
   */
  public FixedDurationBucketer(final long sizeMillis) {
    Preconditions.checkArgument(sizeMillis > 0, "Bucket size must be positive: %s", sizeMillis);
    mSizeMillis = sizeMillis;
  }

  /**
   * @param size bucket duration.
   * @param unit of the duration.
   * @return a bucketer with the given duration.
   */
  public static FixedDurationBucketer of(final long size, final TimeUnit unit) {
    return new FixedDurationBucketer(unit.toMillis(size));
  }

  /** @return the bucket duration in milliseconds. */
  public long getSizeMillis() {
    return mSizeMillis;
  }

  /** {@inheritDoc} */
  @Override
  public long bucket(final long timestampMillis) {
    // Floor division so that negative timestamps fall in the bucket below them.
    return LongMath.divide(timestampMillis, mSizeMillis, RoundingMode.FLOOR)
        * mSizeMillis;
  }

  /** {@inheritDoc} */
  @Override
  public long next(final long bucket) {
    return bucket + mSizeMillis;
  }

  /** {@inheritDoc} */
  @Override
  public long prev(final long bucket) {
    return bucket - mSizeMillis;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    return obj instanceof FixedDurationBucketer
        && mSizeMillis == ((FixedDurationBucketer) obj).mSizeMillis;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Long.valueOf(mSizeMillis).hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(FixedDurationBucketer.class)
        .add("sizeMillis", mSizeMillis)
        .toString();
  }
}
