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

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.RowCodec;
import org.kiji.recipes.RowNotFoundException;

/**
 * Keeps the first row of a single read statement.
 *
 * @param <T> type of the decoded row.
 */
@NotThreadSafe
public final class SingleRowSink<T> implements ResultSink<T> {
  private final RowCodec<T> mCodec;
  private final Set<String> mHiddenFields;

  private boolean mDone = false;
  private T mResult = null;

  /**
   * @param codec decoding the row.
   * @param hiddenFields internal fields removed from the row before decoding.
   */
  public SingleRowSink(final RowCodec<T> codec, final Set<String> hiddenFields) {
    mCodec = Preconditions.checkNotNull(codec);
    mHiddenFields = ImmutableSet.copyOf(hiddenFields);
  }

  /** {@inheritDoc} */
  @Override
  public void begin() {
    mDone = false;
    mResult = null;
  }

  /** {@inheritDoc} */
  @Override
  public void handle(
      final CQLStatement statement,
      final List<Map<String, Object>> rows
  ) throws IOException {
    if (rows.isEmpty()) {
      throw new RowNotFoundException(statement.getTable().getQualifiedName());
    }
    mResult = mCodec.decode(RecipeSupport.without(rows.get(0), mHiddenFields));
    mDone = true;
  }

  /** {@inheritDoc} */
  @Override
  public boolean isComplete() {
    return false;
  }

  /** {@inheritDoc} */
  @Override
  public T getResult() {
    Preconditions.checkState(mDone, "The read has not completed.");
    return mResult;
  }
}
