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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.Options;
import org.kiji.recipes.RowCodec;

/**
 * Collects the rows of every read statement of a run into one list.
 *
 * <p>
 *   Without an ordering, rows are listed in dispatch order then in the order the store returned
 *   them. With an ordering, the rows of all statements are merged by it; rows comparing equal
 *   keep their dispatch order.
 * </p>
 *
 * <p>
 *   When the read statements carry a limit, the merged list is cut to that many rows. A sink
 *   built for ordered ranges also completes once it holds that many rows from reads in ascending
 *   clustering order, so that the reads of later ranges are skipped.
 * </p>
 *
 * @param <T> type of the decoded rows.
 */
@NotThreadSafe
public final class RowListSink<T> implements ResultSink<List<T>> {
  private final RowCodec<T> mCodec;
  private final Set<String> mHiddenFields;
  private final Comparator<Map<String, Object>> mOrdering;
  private final boolean mOrderedRanges;

  /** Rows of the current run, as read and as decoded. Null before the first run. */
  private List<DecodedRow<T>> mRows = null;

  /** Smallest limit of the read statements of the current run, or null. */
  private Integer mLimit = null;

  /** Whether a read of the current run asked for a descending clustering order. */
  private boolean mDescending = false;

  /**
   * @param codec decoding the rows.
   * @param hiddenFields internal fields removed from the rows before decoding.
   * @param ordering of the merged rows over their raw fields, or null to keep dispatch order.
   * @param orderedRanges whether each read returns rows ordered after those of earlier reads.
   */
  public RowListSink(
      final RowCodec<T> codec,
      final Set<String> hiddenFields,
      @Nullable final Comparator<Map<String, Object>> ordering,
      final boolean orderedRanges
  ) {
    Preconditions.checkArgument(!orderedRanges || ordering != null,
        "Ordered ranges require an ordering.");
    mCodec = Preconditions.checkNotNull(codec);
    mHiddenFields = ImmutableSet.copyOf(hiddenFields);
    mOrdering = ordering;
    mOrderedRanges = orderedRanges;
  }

  /** {@inheritDoc} */
  @Override
  public void begin() {
    mRows = Lists.newArrayList();
    mLimit = null;
    mDescending = false;
  }

  /** {@inheritDoc} */
  @Override
  public void handle(
      final CQLStatement statement,
      final List<Map<String, Object>> rows
  ) throws IOException {
    Preconditions.checkState(mRows != null, "Rows handled before the run began.");
    final Integer limit = statement.getLimit();
    if (limit != null && (mLimit == null || limit < mLimit)) {
      mLimit = limit;
    }
    if (statement.getOptions().hasClusteringOrder()) {
      for (Options.ClusteringOrder order : statement.getOptions().getClusteringOrder()) {
        mDescending |= order.getDirection() == Options.Direction.DESC;
      }
    }
    for (Map<String, Object> row : rows) {
      mRows.add(new DecodedRow<T>(row, mCodec.decode(RecipeSupport.without(row, mHiddenFields))));
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean isComplete() {
    return mOrderedRanges && !mDescending && mRows != null && mLimit != null
        && mRows.size() >= mLimit;
  }

  /** {@inheritDoc} */
  @Override
  public List<T> getResult() {
    Preconditions.checkState(mRows != null, "The read has not run.");
    final List<DecodedRow<T>> rows = Lists.newArrayList(mRows);
    if (mOrdering != null) {
      // Stable sort: rows comparing equal keep their dispatch order.
      Collections.sort(rows, new Comparator<DecodedRow<T>>() {
        @Override
        public int compare(final DecodedRow<T> left, final DecodedRow<T> right) {
          return mOrdering.compare(left.mFields, right.mFields);
        }
      });
    }
    final int size = (mLimit == null) ? rows.size() : Math.min(mLimit, rows.size());
    final List<T> result = Lists.newArrayListWithCapacity(size);
    for (DecodedRow<T> row : rows.subList(0, size)) {
      result.add(row.mValue);
    }
    return result;
  }

  /**
   * A row as read and as decoded.
   *
   * @param <T> type of the decoded row.
   */
  private static final class DecodedRow<T> {
    private final Map<String, Object> mFields;
    private final T mValue;

    /**
     * @param fields as read.
     * @param value as decoded.
     */
    private DecodedRow(final Map<String, Object> fields, final T value) {
      mFields = fields;
      mValue = value;
    }
  }
}
