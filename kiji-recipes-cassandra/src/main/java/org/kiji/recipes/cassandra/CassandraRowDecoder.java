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

package org.kiji.recipes.cassandra;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import com.datastax.driver.core.ColumnDefinitions;
import com.datastax.driver.core.Row;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/** Converts driver rows to maps of field names to plain Java values. */
final class CassandraRowDecoder {

  /**
   * @param rows to decode. Iterating fetches further pages.
   * @return the decoded rows, in order.
   */
  static List<Map<String, Object>> decodeAll(final Iterable<Row> rows) {
    final List<Map<String, Object>> decoded = Lists.newArrayList();
    for (Row row : rows) {
      decoded.add(decode(row));
    }
    return decoded;
  }

  /**
   * @param row to decode.
   * @return the value of every column of the row, by column name.
   */
  static Map<String, Object> decode(final Row row) {
    final Map<String, Object> fields = Maps.newLinkedHashMap();
    for (ColumnDefinitions.Definition definition : row.getColumnDefinitions()) {
      final String name = definition.getName();
      fields.put(name, toJava(row.isNull(name) ? null : row.getObject(name)));
    }
    return fields;
  }

  /**
   * @param value as returned by the driver codecs.
   * @return the value with blobs copied to byte arrays.
   */
  static Object toJava(final Object value) {
    if (value instanceof ByteBuffer) {
      final ByteBuffer buffer = ((ByteBuffer) value).duplicate();
      final byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return bytes;
    }
    return value;
  }

  /** Utility class. */
  private CassandraRowDecoder() {
  }
}
