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

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

import org.kiji.recipes.RowCodec;

/**
 * Converts Java beans to field maps with Jackson. Bean property names are the field names.
 *
 * <p>
 *   Dates encode to epoch milliseconds; recipes convert them back for {@code timestamp} columns.
 *   Fields without a matching bean property, such as the time bucket, are ignored on decode.
 * </p>
 *
 * @param <T> type of the beans.
 */
public final class JacksonRowCodec<T> implements RowCodec<T> {
  private static final TypeReference<Map<String, Object>> FIELDS_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private final ObjectMapper mMapper;
  private final Class<T> mRowClass;

  /**
   * @param rowClass class of the beans.
   */
  public JacksonRowCodec(final Class<T> rowClass) {
    this(new ObjectMapper(), rowClass);
  }

  /**
   * @param mapper to convert with. A copy is configured to ignore unknown properties.
   * @param rowClass class of the beans.
   */
  public JacksonRowCodec(final ObjectMapper mapper, final Class<T> rowClass) {
    mMapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mRowClass = Preconditions.checkNotNull(rowClass);
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Object> encode(final T row) throws IOException {
    try {
      return mMapper.convertValue(row, FIELDS_TYPE);
    } catch (IllegalArgumentException iae) {
      throw new IOException(
          String.format("Unable to encode %s as fields.", mRowClass.getName()), iae);
    }
  }

  /** {@inheritDoc} */
  @Override
  public T decode(final Map<String, Object> fields) throws IOException {
    try {
      return mMapper.convertValue(fields, mRowClass);
    } catch (IllegalArgumentException iae) {
      throw new IOException(
          String.format("Unable to decode fields %s as %s.", fields.keySet(), mRowClass.getName()),
          iae);
    }
  }
}
