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

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Longs;

/**
 * Orders column values the way clustering columns sort them, nulls first.
 *
 * <p>
 *   Integral numbers compare by long value, other numbers by double value, so that an
 *   {@code Integer} written by an application equals the {@code Long} it was widened to. Other
 *   values must be mutually {@link Comparable}.
 * </p>
 */
public final class ValueOrdering extends Ordering<Object> {
  private static final ValueOrdering INSTANCE = new ValueOrdering();

  /** Use {@link #get()}. */
  private ValueOrdering() {
  }

  /** @return the singleton ordering. */
  public static ValueOrdering get() {
    return INSTANCE;
  }

  /** {@inheritDoc} */
  @Override
  @SuppressWarnings("unchecked")
  public int compare(final Object left, final Object right) {
    if (left == right) {
      return 0;
    } else if (left == null) {
      return -1;
    } else if (right == null) {
      return 1;
    }
    if (left instanceof Number && right instanceof Number) {
      if (isIntegral(left) && isIntegral(right)) {
        return Longs.compare(((Number) left).longValue(), ((Number) right).longValue());
      }
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (left instanceof Date && right instanceof Date) {
      return ((Date) left).compareTo((Date) right);
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    throw new ClassCastException(String.format("Can not compare %s with %s.",
        left.getClass().getName(), right.getClass().getName()));
  }

  /**
   * @param value a number.
   * @return whether it has no fractional part by type.
   */
  private static boolean isIntegral(final Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger;
  }

  /**
   * Builds an ordering of rows by some of their fields, compared in order.
   *
   * @param fields to compare, most significant first.
   * @return the row ordering.
   */
  public static Comparator<Map<String, Object>> byFields(final List<String> fields) {
    final List<String> ordered = ImmutableList.copyOf(fields);
    return new Comparator<Map<String, Object>>() {
      @Override
      public int compare(final Map<String, Object> left, final Map<String, Object> right) {
        for (String field : ordered) {
          final int comparison = INSTANCE.compare(left.get(field), right.get(field));
          if (comparison != 0) {
            return comparison;
          }
        }
        return 0;
      }
    };
  }
}
