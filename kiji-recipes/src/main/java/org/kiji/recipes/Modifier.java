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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * A non-assignment update of a single column, for use as a value in an update field map.
 *
 * <pre>
 *   table.where(Relation.eq("id", id)).update(
 *       ImmutableMap.&lt;String, Object&gt;of("visits", Modifier.counterIncrement(1)));
 * </pre>
 */
@Immutable
public final class Modifier {

  /** Kinds of modifications. */
  public static enum Kind {
    COUNTER_INCREMENT,
    LIST_APPEND,
    LIST_PREPEND,
    LIST_REMOVE,
    LIST_SET_AT_INDEX,
    MAP_SET_FIELD,
    MAP_SET_FIELDS,
    SET_ADD,
    SET_REMOVE
  }

  private final Kind mKind;
  private final ImmutableList<Object> mArguments;

  /**
   * Use the static factory methods.
   *
   * @param kind of modification.
   * @param arguments of the modification.
   */
  private Modifier(final Kind kind, final Object... arguments) {
    mKind = kind;
    for (Object argument : arguments) {
      Preconditions.checkNotNull(argument, "Modifier arguments must not be null.");
    }
    mArguments = ImmutableList.copyOf(arguments);
  }

  /**
   * @param delta amount to add to a counter. May be negative.
   * @return a counter increment.
   */
  public static Modifier counterIncrement(final long delta) {
    return new Modifier(Kind.COUNTER_INCREMENT, delta);
  }

  /**
   * @param values to append to a list.
   * @return a list append.
   */
  public static Modifier listAppend(final Object... values) {
    return new Modifier(Kind.LIST_APPEND, ImmutableList.copyOf(values));
  }

  /**
   * @param values to prepend to a list.
   * @return a list prepend.
   */
  public static Modifier listPrepend(final Object... values) {
    return new Modifier(Kind.LIST_PREPEND, ImmutableList.copyOf(values));
  }

  /**
   * @param values to remove from a list, every occurrence.
   * @return a list removal.
   */
  public static Modifier listRemove(final Object... values) {
    return new Modifier(Kind.LIST_REMOVE, ImmutableList.copyOf(values));
  }

  /**
   * @param index of an existing list element.
   * @param value to store at the index.
   * @return a list element assignment.
   */
  public static Modifier listSetAtIndex(final int index, final Object value) {
    Preconditions.checkArgument(index >= 0, "List index must not be negative: %s", index);
    return new Modifier(Kind.LIST_SET_AT_INDEX, index, value);
  }

  /**
   * @param key of the map entry.
   * @param value of the map entry.
   * @return a single map entry assignment.
   */
  public static Modifier mapSetField(final Object key, final Object value) {
    return new Modifier(Kind.MAP_SET_FIELD, key, value);
  }

  /**
   * @param entries to put in the map.
   * @return a multiple map entry assignment.
   */
  public static Modifier mapSetFields(final Map<?, ?> entries) {
    return new Modifier(Kind.MAP_SET_FIELDS, ImmutableMap.copyOf(entries));
  }

  /**
   * @param values to add to a set.
   * @return a set addition.
   */
  public static Modifier setAdd(final Object... values) {
    return new Modifier(Kind.SET_ADD, ImmutableSet.copyOf(values));
  }

  /**
   * @param values to remove from a set.
   * @return a set removal.
   */
  public static Modifier setRemove(final Object... values) {
    return new Modifier(Kind.SET_REMOVE, ImmutableSet.copyOf(values));
  }

  /** @return the kind of modification. */
  public Kind getKind() {
    return mKind;
  }

  /** @return the arguments, as passed to the factory method. */
  public List<Object> getArguments() {
    return mArguments;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Modifier)) {
      return false;
    }
    final Modifier other = (Modifier) obj;
    return mKind == other.mKind && mArguments.equals(other.mArguments);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mKind, mArguments);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(Modifier.class)
        .add("kind", mKind)
        .add("arguments", mArguments)
        .toString();
  }
}
