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

import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.kiji.recipes.ColumnType;
import org.kiji.recipes.Modifier;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowSchema;

/** Helpers shared by the recipes. */
final class RecipeSupport {
  private static final Joiner NAME_JOINER = Joiner.on('_');

  /** Private constructor for utility class. */
  private RecipeSupport() {
  }

  /**
   * Builds a physical table name from its parts, sanitized.
   *
   * @param parts of the name.
   * @return the table name.
   */
  static String tableName(final Object... parts) {
    return CQLStatements.sanitizeTableName(NAME_JOINER.join(parts));
  }

  /**
   * @param row fields of a row.
   * @param hidden fields to remove.
   * @return a copy of the row without the hidden fields.
   */
  static Map<String, Object> without(final Map<String, Object> row, final Set<String> hidden) {
    final Map<String, Object> copy = Maps.newLinkedHashMap(row);
    copy.keySet().removeAll(hidden);
    return copy;
  }

  /**
   * Checks at recipe construction that fields are declared.
   *
   * @param schema of the rows.
   * @param fields required by the recipe.
   */
  static void checkDeclared(final RowSchema schema, final Collection<String> fields) {
    for (String field : fields) {
      Preconditions.checkArgument(schema.contains(field),
          "Field '%s' is not declared in %s.", field, schema);
    }
  }

  /**
   * Checks that a row holds every required field before any statement is built.
   *
   * @param recipe name of the recipe table, for error messages.
   * @param fields of the row.
   * @param required fields.
   * @throws OpValidationException if a field is missing or null.
   */
  static void requireFields(
      final String recipe,
      final Map<String, Object> fields,
      final Collection<String> required
  ) throws OpValidationException {
    for (String field : required) {
      if (fields.get(field) == null) {
        throw new OpValidationException(String.format(
            "Row written to '%s' is missing required field '%s'.", recipe, field));
      }
    }
  }

  /**
   * Converts a time value to a date.
   *
   * @param field holding the value, for error messages.
   * @param value a {@link Date}, an {@link Instant} or epoch milliseconds.
   * @return the date.
   * @throws OpValidationException if the value is not a time.
   */
  static Date toDate(final String field, final Object value) throws OpValidationException {
    if (value instanceof Date) {
      return (Date) value;
    } else if (value instanceof Instant) {
      return Date.from((Instant) value);
    } else if (value instanceof Long || value instanceof Integer) {
      return new Date(((Number) value).longValue());
    }
    throw new OpValidationException(String.format(
        "Field '%s' must hold a time, got %s.", field, value));
  }

  /**
   * Converts the plain values of {@code timestamp} columns to dates, the type the driver binds.
   *
   * @param schema of the rows.
   * @param fields to convert.
   * @return a converted copy of the fields.
   * @throws OpValidationException if a timestamp column holds something else than a time.
   */
  static Map<String, Object> normalizeTimestamps(
      final RowSchema schema,
      final Map<String, Object> fields
  ) throws OpValidationException {
    final Map<String, Object> normalized = Maps.newLinkedHashMap(fields);
    for (Map.Entry<String, Object> entry : normalized.entrySet()) {
      final Object value = entry.getValue();
      if (value != null
          && !(value instanceof Modifier)
          && schema.contains(entry.getKey())
          && ColumnType.TIMESTAMP.equals(schema.getType(entry.getKey()))) {
        entry.setValue(toDate(entry.getKey(), value));
      }
    }
    return normalized;
  }

  /**
   * Resolves the values of indexed fields passed either directly, for a single field, or as a
   * map from field name to value.
   *
   * @param indexFields indexed fields, in key order.
   * @param value of the single field, or map of the values.
   * @return the values, in key order.
   * @throws OpValidationException if a value is missing.
   */
  static Map<String, Object> indexValues(
      final List<String> indexFields,
      final Object value
  ) throws OpValidationException {
    final Map<String, Object> values = Maps.newLinkedHashMap();
    if (value instanceof Map) {
      final Map<?, ?> map = (Map<?, ?>) value;
      for (String field : indexFields) {
        values.put(field, map.get(field));
      }
    } else if (indexFields.size() == 1) {
      values.put(indexFields.get(0), value);
    } else {
      throw new OpValidationException(String.format(
          "Values of indexed fields %s must be passed as a map, got %s.", indexFields, value));
    }
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      if (entry.getValue() == null) {
        throw new OpValidationException(String.format(
            "Missing value for indexed field '%s'.", entry.getKey()));
      }
    }
    return values;
  }

  /**
   * @param values fields and their values.
   * @return one equality relation per field, in order.
   */
  static List<Relation> equalities(final Map<String, Object> values) {
    final List<Relation> relations = Lists.newArrayList();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      relations.add(Relation.eq(entry.getKey(), entry.getValue()));
    }
    return relations;
  }

  /**
   * @param fields to pick.
   * @param values holding at least the fields.
   * @return the picked values, in field order.
   */
  static Map<String, Object> pick(final List<String> fields, final Map<String, Object> values) {
    final Map<String, Object> picked = Maps.newLinkedHashMap();
    for (String field : fields) {
      picked.put(field, values.get(field));
    }
    return picked;
  }
}
