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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A single predicate of a {@code WHERE} clause.
 *
 * <p>
 *   Most relations constrain one field. Range relations may also constrain several clustering
 *   columns at once, which renders as a tuple comparison such as {@code ("a", "b") > (?, ?)} and
 *   is used to page over composite clustering keys.
 * </p>
 */
@Immutable
public final class Relation {

  /** Comparison operators supported in relations. */
  public static enum Operator {
    EQ("="),
    IN("IN"),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String mSymbol;

    /**
     * Default constructor.
     *
     * @param symbol The CQL symbol of the operator.
     */
    Operator(final String symbol) {
      mSymbol = symbol;
    }

    /** @return the CQL symbol of the operator. */
    public String getSymbol() {
      return mSymbol;
    }

    /** @return whether this is a range operator. */
    public boolean isRange() {
      return this != EQ && this != IN;
    }
  }

  private final ImmutableList<String> mFields;
  private final Operator mOperator;

  /** Terms may contain nulls, so this is not an ImmutableList. */
  private final List<Object> mTerms;

  /**
   * Use the static factory methods.
   *
   * @param fields constrained fields.
   * @param operator comparison operator.
   * @param terms compared terms.
   */
  private Relation(final List<String> fields, final Operator operator, final List<Object> terms) {
    Preconditions.checkArgument(!fields.isEmpty(), "A relation must constrain a field.");
    mFields = ImmutableList.copyOf(fields);
    mOperator = operator;
    mTerms = Collections.unmodifiableList(Lists.newArrayList(terms));
  }

  /**
   * @param field constrained field.
   * @param term value the field must equal.
   * @return an equality relation.
   */
  public static Relation eq(final String field, final Object term) {
    return new Relation(ImmutableList.of(field), Operator.EQ, Arrays.asList(term));
  }

  /**
   * @param field constrained field.
   * @param terms values the field may take.
   * @return an inclusion relation.
   */
  public static Relation in(final String field, final Object... terms) {
    return new Relation(ImmutableList.of(field), Operator.IN, Arrays.asList(terms));
  }

  /**
   * @param field constrained field.
   * @param terms values the field may take.
   * @return an inclusion relation.
   */
  public static Relation in(final String field, final Collection<?> terms) {
    return new Relation(ImmutableList.of(field), Operator.IN, Lists.<Object>newArrayList(terms));
  }

  /**
   * @param field constrained field.
   * @param term exclusive lower bound.
   * @return a greater-than relation.
   */
  public static Relation gt(final String field, final Object term) {
    return range(ImmutableList.of(field), Operator.GT, Arrays.asList(term));
  }

  /**
   * @param field constrained field.
   * @param term inclusive lower bound.
   * @return a greater-than-or-equal relation.
   */
  public static Relation gte(final String field, final Object term) {
    return range(ImmutableList.of(field), Operator.GTE, Arrays.asList(term));
  }

  /**
   * @param field constrained field.
   * @param term exclusive upper bound.
   * @return a less-than relation.
   */
  public static Relation lt(final String field, final Object term) {
    return range(ImmutableList.of(field), Operator.LT, Arrays.asList(term));
  }

  /**
   * @param field constrained field.
   * @param term inclusive upper bound.
   * @return a less-than-or-equal relation.
   */
  public static Relation lte(final String field, final Object term) {
    return range(ImmutableList.of(field), Operator.LTE, Arrays.asList(term));
  }

  /**
   * Creates a range relation over one or several clustering columns. Several fields compare as a
   * tuple, in the given order.
   *
   * @param fields constrained fields.
   * @param operator range operator.
   * @param terms bound, one term per field.
   * @return a range relation.
   */
  public static Relation range(
      final List<String> fields,
      final Operator operator,
      final List<?> terms
  ) {
    Preconditions.checkArgument(operator.isRange(), "%s is not a range operator.", operator);
    Preconditions.checkArgument(fields.size() == terms.size(),
        "Range relation on %s needs one term per field, got %s.", fields, terms);
    return new Relation(fields, operator, Lists.<Object>newArrayList(terms));
  }

  /** @return the constrained fields. */
  public ImmutableList<String> getFields() {
    return mFields;
  }

  /**
   * @return the constrained field of a single-column relation.
   */
  public String getField() {
    Preconditions.checkState(!isMultiColumn(), "Relation %s constrains several fields.", this);
    return mFields.get(0);
  }

  /** @return whether this relation compares a tuple of fields. */
  public boolean isMultiColumn() {
    return mFields.size() > 1;
  }

  /** @return the operator. */
  public Operator getOperator() {
    return mOperator;
  }

  /** @return the terms of this relation. */
  public List<Object> getTerms() {
    return mTerms;
  }

  /** @return the single term of a single-column, non-IN relation. */
  public Object getTerm() {
    Preconditions.checkState(mTerms.size() == 1, "Relation %s has %s terms.", this, mTerms.size());
    return mTerms.get(0);
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Relation)) {
      return false;
    }
    final Relation other = (Relation) obj;
    return mFields.equals(other.mFields)
        && mOperator == other.mOperator
        && mTerms.equals(other.mTerms);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mFields, mOperator, mTerms);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(Relation.class)
        .add("fields", mFields)
        .add("operator", mOperator)
        .add("terms", mTerms)
        .toString();
  }
}
