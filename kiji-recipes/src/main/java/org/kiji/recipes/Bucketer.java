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

/**
 * Maps a timestamp to the bucket holding it. Buckets bound the size of time-ordered partitions.
 *
 * <p>
 *   A bucket is identified by the millisecond timestamp at which it starts. Implementations must
 *   be deterministic and monotonic: {@code t1 <= t2} implies {@code bucket(t1) <= bucket(t2)}.
 * </p>
 */
public interface Bucketer {
  /**
   * @param timestampMillis a timestamp, in milliseconds since the epoch.
   * @return the start of the bucket holding the timestamp.
   */
  long bucket(long timestampMillis);

  /**
   * @param bucket start of a bucket.
   * @return start of the following bucket.
   */
  long next(long bucket);

  /**
   * @param bucket start of a bucket.
   * @return start of the preceding bucket.
   */
  long prev(long bucket);
}
