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

import java.util.LinkedHashMap;
import java.util.Map;

import org.kiji.recipes.RowCodec;

/** Rows that already are field maps. Encoding and decoding copy the map. */
public final class MapRowCodec implements RowCodec<Map<String, Object>> {
  private static final MapRowCodec INSTANCE = new MapRowCodec();

  /** Use {@link #get()}. */
  private MapRowCodec() {
  }

  /** @return the singleton codec. */
  public static MapRowCodec get() {
    return INSTANCE;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Object> encode(final Map<String, Object> row) {
    return new LinkedHashMap<String, Object>(row);
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Object> decode(final Map<String, Object> fields) {
    return new LinkedHashMap<String, Object>(fields);
  }
}
