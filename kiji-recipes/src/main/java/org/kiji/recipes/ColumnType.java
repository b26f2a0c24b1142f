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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;

/**
 * The CQL type of a declared column. Native types are available as constants, collection types
 * are built from their element types with {@link #list}, {@link #set} and {@link #map}.
 */
@Immutable
public final class ColumnType {
  public static final ColumnType BLOB = new ColumnType("blob", Family.NATIVE);
  public static final ColumnType VARCHAR = new ColumnType("varchar", Family.NATIVE);
  public static final ColumnType INT = new ColumnType("int", Family.NATIVE);
  public static final ColumnType BIGINT = new ColumnType("bigint", Family.NATIVE);
  public static final ColumnType VARINT = new ColumnType("varint", Family.NATIVE);
  public static final ColumnType FLOAT = new ColumnType("float", Family.NATIVE);
  public static final ColumnType DOUBLE = new ColumnType("double", Family.NATIVE);
  public static final ColumnType DECIMAL = new ColumnType("decimal", Family.NATIVE);
  public static final ColumnType BOOLEAN = new ColumnType("boolean", Family.NATIVE);
  public static final ColumnType TIMESTAMP = new ColumnType("timestamp", Family.NATIVE);
  public static final ColumnType UUID = new ColumnType("uuid", Family.NATIVE);
  public static final ColumnType TIMEUUID = new ColumnType("timeuuid", Family.NATIVE);
  public static final ColumnType COUNTER = new ColumnType("counter", Family.NATIVE);

  /** Native types and the three collection families. */
  private static enum Family {
    NATIVE,
    LIST,
    SET,
    MAP
  }

  /** The CQL name of this type. */
  private final String mName;

  private final Family mFamily;

  /**
   * Default constructor.
   *
   * @param name The CQL name for the column type.
   * @param family Whether the type is native, a list, a set or a map.
   */
  private ColumnType(final String name, final Family family) {
    mName = name;
    mFamily = family;
  }

  /**
   * Creates a {@code list<element>} type.
   *
   * @param element type of the list elements.
   * @return the list type.
   */
  public static ColumnType list(final ColumnType element) {
    checkElement(element);
    return new ColumnType(String.format("list<%s>", element), Family.LIST);
  }

  /**
   * Creates a {@code set<element>} type.
   *
   * @param element type of the set elements.
   * @return the set type.
   */
  public static ColumnType set(final ColumnType element) {
    checkElement(element);
    return new ColumnType(String.format("set<%s>", element), Family.SET);
  }

  /**
   * Creates a {@code map<key, value>} type.
   *
   * @param key type of the map keys.
   * @param value type of the map values.
   * @return the map type.
   */
  public static ColumnType map(final ColumnType key, final ColumnType value) {
    checkElement(key);
    checkElement(value);
    return new ColumnType(String.format("map<%s, %s>", key, value), Family.MAP);
  }

  private static void checkElement(final ColumnType element) {
    Preconditions.checkNotNull(element);
    Preconditions.checkArgument(element.mFamily == Family.NATIVE && element != COUNTER,
        "Type %s can not be a collection element.", element);
  }

  /** @return whether this is the counter type. */
  public boolean isCounter() {
    return this == COUNTER;
  }

  /** @return whether this is a collection type. */
  public boolean isCollection() {
    return mFamily != Family.NATIVE;
  }

  /** @return whether this is a list type. */
  public boolean isList() {
    return mFamily == Family.LIST;
  }

  /** @return whether this is a set type. */
  public boolean isSet() {
    return mFamily == Family.SET;
  }

  /** @return whether this is a map type. */
  public boolean isMap() {
    return mFamily == Family.MAP;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof ColumnType)) {
      return false;
    }
    return mName.equals(((ColumnType) obj).mName);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return mName.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return mName;
  }
}
