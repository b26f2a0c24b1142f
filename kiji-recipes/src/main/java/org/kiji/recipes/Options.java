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
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.datastax.driver.core.ConsistencyLevel;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Table-level and call-level statement options.
 *
 * <p>
 *   Every field is either unset ({@code null}) or set, so an option explicitly set to zero or
 *   {@code false} is distinguishable from an absent one. Options are combined with
 *   {@link #merge(Options)}: fields set on the override win, all other fields are kept.
 * </p>
 */
@Immutable
public final class Options {
  /** Options with every field unset. */
  public static final Options EMPTY = builder().build();

  /** Sort direction of a clustering column. */
  public static enum Direction {
    ASC,
    DESC
  }

  /** The sort order of one clustering column. */
  @Immutable
  public static final class ClusteringOrder {
    private final String mColumn;
    private final Direction mDirection;

    /**
     * @param column clustering column.
     * @param direction sort direction of the column.
     */
    public ClusteringOrder(final String column, final Direction direction) {
      mColumn = Preconditions.checkNotNull(column);
      mDirection = Preconditions.checkNotNull(direction);
    }

    /** @return the clustering column. */
    public String getColumn() {
      return mColumn;
    }

    /** @return the sort direction. */
    public Direction getDirection() {
      return mDirection;
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(final Object obj) {
      if (!(obj instanceof ClusteringOrder)) {
        return false;
      }
      final ClusteringOrder other = (ClusteringOrder) obj;
      return mColumn.equals(other.mColumn) && mDirection == other.mDirection;
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
      return Objects.hashCode(mColumn, mDirection);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
      return mColumn + " " + mDirection;
    }
  }

  private final Integer mLimit;
  private final Integer mTtl;
  private final Long mTimestamp;
  private final ConsistencyLevel mConsistency;
  private final Boolean mAllowFiltering;
  private final ImmutableList<ClusteringOrder> mClusteringOrder;
  private final Boolean mCompactStorage;
  private final ImmutableMap<String, String> mCompressor;
  private final Integer mFetchSize;

  /**
   * Use {@link #builder()}.
   *
   * @param builder holding the option values.
   */
  private Options(final Builder builder) {
    mLimit = builder.mLimit;
    mTtl = builder.mTtl;
    mTimestamp = builder.mTimestamp;
    mConsistency = builder.mConsistency;
    mAllowFiltering = builder.mAllowFiltering;
    mClusteringOrder = builder.mClusteringOrder;
    mCompactStorage = builder.mCompactStorage;
    mCompressor = builder.mCompressor;
    mFetchSize = builder.mFetchSize;
  }

  /** @return a builder with every field unset. */
  public static Builder builder() {
    return new Builder();
  }

  /** @return a builder initialized with the fields of these options. */
  public Builder toBuilder() {
    final Builder builder = new Builder();
    builder.mLimit = mLimit;
    builder.mTtl = mTtl;
    builder.mTimestamp = mTimestamp;
    builder.mConsistency = mConsistency;
    builder.mAllowFiltering = mAllowFiltering;
    builder.mClusteringOrder = mClusteringOrder;
    builder.mCompactStorage = mCompactStorage;
    builder.mCompressor = mCompressor;
    builder.mFetchSize = mFetchSize;
    return builder;
  }

  /**
   * Merges these options with an override. Each field set in {@code override} takes precedence,
   * every other field keeps its value from this instance. Neither input is modified.
   *
   * @param override options taking precedence.
   * @return the merged options.
   */
  public Options merge(final Options override) {
    Preconditions.checkNotNull(override);
    final Builder merged = toBuilder();
    if (override.mLimit != null) {
      merged.mLimit = override.mLimit;
    }
    if (override.mTtl != null) {
      merged.mTtl = override.mTtl;
    }
    if (override.mTimestamp != null) {
      merged.mTimestamp = override.mTimestamp;
    }
    if (override.mConsistency != null) {
      merged.mConsistency = override.mConsistency;
    }
    if (override.mAllowFiltering != null) {
      merged.mAllowFiltering = override.mAllowFiltering;
    }
    if (override.mClusteringOrder != null) {
      merged.mClusteringOrder = override.mClusteringOrder;
    }
    if (override.mCompactStorage != null) {
      merged.mCompactStorage = override.mCompactStorage;
    }
    if (override.mCompressor != null) {
      merged.mCompressor = override.mCompressor;
    }
    if (override.mFetchSize != null) {
      merged.mFetchSize = override.mFetchSize;
    }
    return merged.build();
  }

  /** @return whether a result limit is set. */
  public boolean hasLimit() {
    return mLimit != null;
  }

  /** @return the result limit, or null if unset. */
  @Nullable
  public Integer getLimit() {
    return mLimit;
  }

  /** @return whether a time-to-live is set. */
  public boolean hasTtl() {
    return mTtl != null;
  }

  /** @return the time-to-live in seconds, or null if unset. */
  @Nullable
  public Integer getTtl() {
    return mTtl;
  }

  /** @return whether a write timestamp is set. */
  public boolean hasTimestamp() {
    return mTimestamp != null;
  }

  /** @return the write timestamp in microseconds, or null if unset. */
  @Nullable
  public Long getTimestamp() {
    return mTimestamp;
  }

  /** @return whether a consistency level is set. */
  public boolean hasConsistency() {
    return mConsistency != null;
  }

  /** @return the consistency level, or null if unset. */
  @Nullable
  public ConsistencyLevel getConsistency() {
    return mConsistency;
  }

  /** @return whether allow filtering is set. */
  public boolean hasAllowFiltering() {
    return mAllowFiltering != null;
  }

  /** @return whether reads may filter across partitions. Unset means false. */
  public boolean isAllowFiltering() {
    return Boolean.TRUE.equals(mAllowFiltering);
  }

  /** @return whether a clustering order is set. */
  public boolean hasClusteringOrder() {
    return mClusteringOrder != null;
  }

  /** @return the clustering order, or null if unset. */
  @Nullable
  public ImmutableList<ClusteringOrder> getClusteringOrder() {
    return mClusteringOrder;
  }

  /** @return whether compact storage is set. */
  public boolean hasCompactStorage() {
    return mCompactStorage != null;
  }

  /** @return whether tables are created with compact storage. Unset means false. */
  public boolean isCompactStorage() {
    return Boolean.TRUE.equals(mCompactStorage);
  }

  /** @return whether compression parameters are set. */
  public boolean hasCompressor() {
    return mCompressor != null;
  }

  /** @return the compression parameters used on table creation, or null if unset. */
  @Nullable
  public ImmutableMap<String, String> getCompressor() {
    return mCompressor;
  }

  /** @return whether a fetch size is set. */
  public boolean hasFetchSize() {
    return mFetchSize != null;
  }

  /** @return the page size requested from the driver, or null if unset. */
  @Nullable
  public Integer getFetchSize() {
    return mFetchSize;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Options)) {
      return false;
    }
    final Options other = (Options) obj;
    return Objects.equal(mLimit, other.mLimit)
        && Objects.equal(mTtl, other.mTtl)
        && Objects.equal(mTimestamp, other.mTimestamp)
        && mConsistency == other.mConsistency
        && Objects.equal(mAllowFiltering, other.mAllowFiltering)
        && Objects.equal(mClusteringOrder, other.mClusteringOrder)
        && Objects.equal(mCompactStorage, other.mCompactStorage)
        && Objects.equal(mCompressor, other.mCompressor)
        && Objects.equal(mFetchSize, other.mFetchSize);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(
        mLimit,
        mTtl,
        mTimestamp,
        mConsistency,
        mAllowFiltering,
        mClusteringOrder,
        mCompactStorage,
        mCompressor,
        mFetchSize);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(Options.class)
        .omitNullValues()
        .add("limit", mLimit)
        .add("ttl", mTtl)
        .add("timestamp", mTimestamp)
        .add("consistency", mConsistency)
        .add("allowFiltering", mAllowFiltering)
        .add("clusteringOrder", mClusteringOrder)
        .add("compactStorage", mCompactStorage)
        .add("compressor", mCompressor)
        .add("fetchSize", mFetchSize)
        .toString();
  }

  /** Builder for {@link Options}. Fields never set stay unset. */
  public static final class Builder {
    private Integer mLimit;
    private Integer mTtl;
    private Long mTimestamp;
    private ConsistencyLevel mConsistency;
    private Boolean mAllowFiltering;
    private ImmutableList<ClusteringOrder> mClusteringOrder;
    private Boolean mCompactStorage;
    private ImmutableMap<String, String> mCompressor;
    private Integer mFetchSize;

    /** Use {@link Options#builder()}. */
    private Builder() {
    }

    /**
     * @param limit maximum number of rows returned by a read. Must be positive.
     * @return this builder.
     */
    public Builder withLimit(final int limit) {
      Preconditions.checkArgument(limit > 0, "Limit must be positive: %s", limit);
      mLimit = limit;
      return this;
    }

    /**
     * @param ttlSeconds time-to-live of written cells, in seconds. Zero means no expiry.
     * @return this builder.
     */
    public Builder withTtl(final int ttlSeconds) {
      Preconditions.checkArgument(ttlSeconds >= 0, "TTL must not be negative: %s", ttlSeconds);
      mTtl = ttlSeconds;
      return this;
    }

    /**
     * @param timestampMicros write timestamp, in microseconds since the epoch.
     * @return this builder.
     */
    public Builder withTimestamp(final long timestampMicros) {
      mTimestamp = timestampMicros;
      return this;
    }

    /**
     * @param consistency consistency level of the statements.
     * @return this builder.
     */
    public Builder withConsistency(final ConsistencyLevel consistency) {
      mConsistency = Preconditions.checkNotNull(consistency);
      return this;
    }

    /**
     * @param allowFiltering whether reads may filter rows outside a single partition.
     * @return this builder.
     */
    public Builder withAllowFiltering(final boolean allowFiltering) {
      mAllowFiltering = allowFiltering;
      return this;
    }

    /**
     * @param clusteringOrder sort order of the clustering columns.
     * @return this builder.
     */
    public Builder withClusteringOrder(final List<ClusteringOrder> clusteringOrder) {
      mClusteringOrder = ImmutableList.copyOf(clusteringOrder);
      return this;
    }

    /**
     * @param compactStorage whether tables are created with compact storage.
     * @return this builder.
     */
    public Builder withCompactStorage(final boolean compactStorage) {
      mCompactStorage = compactStorage;
      return this;
    }

    /**
     * @param compressor compression sub-options used when creating tables, for example
     *     {@code {"class": "LZ4Compressor"}}.
     * @return this builder.
     */
    public Builder withCompressor(final Map<String, String> compressor) {
      mCompressor = ImmutableMap.copyOf(compressor);
      return this;
    }

    /**
     * @param fetchSize number of rows fetched per page by the driver. Must be positive.
     * @return this builder.
     */
    public Builder withFetchSize(final int fetchSize) {
      Preconditions.checkArgument(fetchSize > 0, "Fetch size must be positive: %s", fetchSize);
      mFetchSize = fetchSize;
      return this;
    }

    /** @return the options. */
    public Options build() {
      return new Options(this);
    }
  }
}
