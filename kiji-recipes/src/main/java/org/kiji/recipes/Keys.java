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

import java.util.List;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * The primary key layout of a table.
 *
 * <p>
 *   A CQL primary key is made of a partition key and optional clustering columns. With clustering
 *   columns the layout is always rendered as {@code PRIMARY KEY ((p1, p2), c1, c2)}. Without
 *   clustering columns, the {@code compound} flag decides how several partition-key fields are
 *   laid out:
 * </p>
 *
 * <ul>
 *   <li>compound: {@code PRIMARY KEY ((p1, p2))}, both fields form the partition key.</li>
 *   <li>not compound: {@code PRIMARY KEY (p1, p2)}, only {@code p1} is the partition key and
 *     {@code p2} acts as a clustering column.</li>
 * </ul>
 *
 * <p>
 *   {@link #getEffectivePartitionKeys()} and {@link #getEffectiveClusteringColumns()} resolve this
 *   rule; statement validation always uses the effective layout.
 * </p>
 */
@Immutable
public final class Keys {
  private final ImmutableList<String> mPartitionKeys;
  private final ImmutableList<String> mClusteringColumns;
  private final boolean mCompound;

  /**
   * Creates a key layout.
   *
   * @param partitionKeys ordered partition-key fields. Must not be empty.
   * @param clusteringColumns ordered clustering columns, disjoint from the partition keys.
   * @param compound whether partition keys form a composite key when there is no clustering.
   */
  public Keys(
      final List<String> partitionKeys,
      final List<String> clusteringColumns,
      final boolean compound
  ) {
    Preconditions.checkNotNull(partitionKeys);
    Preconditions.checkNotNull(clusteringColumns);
    Preconditions.checkArgument(!partitionKeys.isEmpty(),
        "A table must declare at least one partition key field.");
    mPartitionKeys = ImmutableList.copyOf(partitionKeys);
    mClusteringColumns = ImmutableList.copyOf(clusteringColumns);
    mCompound = compound;

    Preconditions.checkArgument(
        ImmutableSet.copyOf(mPartitionKeys).size() == mPartitionKeys.size(),
        "Duplicate partition key fields in %s.", mPartitionKeys);
    Preconditions.checkArgument(
        ImmutableSet.copyOf(mClusteringColumns).size() == mClusteringColumns.size(),
        "Duplicate clustering columns in %s.", mClusteringColumns);
    final Set<String> overlap = Sets.intersection(
        ImmutableSet.copyOf(mPartitionKeys),
        ImmutableSet.copyOf(mClusteringColumns));
    Preconditions.checkArgument(overlap.isEmpty(),
        "Fields %s are both partition keys and clustering columns.", overlap);
  }

  /**
   * Creates a layout with a composite partition key and the given clustering columns.
   *
   * @param partitionKeys ordered partition-key fields.
   * @param clusteringColumns ordered clustering columns.
   * @return the key layout.
   */
  public static Keys of(final List<String> partitionKeys, final List<String> clusteringColumns) {
    return new Keys(partitionKeys, clusteringColumns, true);
  }

  /** @return the declared partition key fields. */
  public ImmutableList<String> getPartitionKeys() {
    return mPartitionKeys;
  }

  /** @return the declared clustering columns. */
  public ImmutableList<String> getClusteringColumns() {
    return mClusteringColumns;
  }

  /** @return the compound flag. */
  public boolean isCompound() {
    return mCompound;
  }

  /** @return the fields that actually make up the partition key. */
  public ImmutableList<String> getEffectivePartitionKeys() {
    if (mClusteringColumns.isEmpty() && !mCompound) {
      return mPartitionKeys.subList(0, 1);
    }
    return mPartitionKeys;
  }

  /** @return the fields that actually act as clustering columns. */
  public ImmutableList<String> getEffectiveClusteringColumns() {
    if (mClusteringColumns.isEmpty() && !mCompound) {
      return mPartitionKeys.subList(1, mPartitionKeys.size());
    }
    return mClusteringColumns;
  }

  /** @return every primary key field, partition keys first. */
  public ImmutableList<String> getPrimaryKeyFields() {
    return ImmutableList.<String>builder()
        .addAll(mPartitionKeys)
        .addAll(mClusteringColumns)
        .build();
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Keys)) {
      return false;
    }
    final Keys other = (Keys) obj;
    return mPartitionKeys.equals(other.mPartitionKeys)
        && mClusteringColumns.equals(other.mClusteringColumns)
        && mCompound == other.mCompound;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mPartitionKeys, mClusteringColumns, mCompound);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(Keys.class)
        .add("partition", mPartitionKeys)
        .add("clustering", mClusteringColumns)
        .add("compound", mCompound)
        .toString();
  }
}
