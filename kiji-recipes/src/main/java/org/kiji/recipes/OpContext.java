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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;

/**
 * Cancellation signal and optional deadline passed to the execution entry points of an
 * {@link Op}.
 *
 * <p>
 *   The context is checked before the first statement and between statements. A statement
 *   already handed to the {@link QueryExecutor} is never interrupted.
 * </p>
 */
@ThreadSafe
public final class OpContext {
  private final AtomicBoolean mCancelled = new AtomicBoolean(false);
  private final Ticker mTicker;

  /** Deadline in ticker nanoseconds. Only meaningful when mHasDeadline is set. */
  private final long mDeadlineNanos;
  private final boolean mHasDeadline;

  /**
   * Use the static factory methods.
   *
   * @param ticker measuring time.
   * @param deadlineNanos deadline in ticker nanoseconds.
   * @param hasDeadline whether the deadline applies.
   */
  private OpContext(final Ticker ticker, final long deadlineNanos, final boolean hasDeadline) {
    mTicker = ticker;
    mDeadlineNanos = deadlineNanos;
    mHasDeadline = hasDeadline;
  }

  /** @return a new context without deadline. It stops only when cancelled. */
  public static OpContext background() {
    return new OpContext(Ticker.systemTicker(), 0L, false);
  }

  /**
   * @param timeout time allowed from now.
   * @param unit of the timeout.
   * @return a new context expiring after the timeout.
   */
  public static OpContext withTimeout(final long timeout, final TimeUnit unit) {
    return withTimeout(timeout, unit, Ticker.systemTicker());
  }

  /**
   * @param timeout time allowed from now.
   * @param unit of the timeout.
   * @param ticker measuring time.
   * @return a new context expiring after the timeout.
   */
  public static OpContext withTimeout(
      final long timeout,
      final TimeUnit unit,
      final Ticker ticker
  ) {
    Preconditions.checkArgument(timeout >= 0, "Timeout must not be negative: %s", timeout);
    Preconditions.checkNotNull(ticker);
    return new OpContext(ticker, ticker.read() + unit.toNanos(timeout), true);
  }

  /** Cancels the context. Statements not yet dispatched will not be. */
  public void cancel() {
    mCancelled.set(true);
  }

  /** @return whether the context was cancelled. */
  public boolean isCancelled() {
    return mCancelled.get();
  }

  /** @return whether the deadline has passed. */
  public boolean isExpired() {
    return mHasDeadline && mTicker.read() - mDeadlineNanos >= 0;
  }

  /** @return whether execution must stop. */
  public boolean isDone() {
    return isCancelled() || isExpired();
  }

  /**
   * Fails if execution must stop.
   *
   * @param appliedCount number of statements dispatched so far.
   * @throws OpCancelledException if the context is cancelled or expired.
   */
  public void checkActive(final int appliedCount) throws OpCancelledException {
    if (isCancelled()) {
      throw new OpCancelledException(
          String.format("Op cancelled after %d applied statement(s).", appliedCount),
          appliedCount);
    }
    if (isExpired()) {
      throw new OpCancelledException(
          String.format("Op deadline exceeded after %d applied statement(s).", appliedCount),
          appliedCount);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(OpContext.class)
        .add("cancelled", isCancelled())
        .add("expired", isExpired())
        .toString();
  }
}
