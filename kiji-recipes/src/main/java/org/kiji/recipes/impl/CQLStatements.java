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

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.ColumnType;
import org.kiji.recipes.Keys;
import org.kiji.recipes.Modifier;
import org.kiji.recipes.OpValidationException;
import org.kiji.recipes.Options;
import org.kiji.recipes.RecipeException;
import org.kiji.recipes.Relation;
import org.kiji.recipes.RowSchema;
import org.kiji.recipes.StatementGenerationException;
import org.kiji.recipes.TableDescriptor;

/**
 * Renders table operations as CQL statements with positional {@code ?} markers.
 *
 * <h2>Notes on key validation</h2>
 *
 * <p>
 *   Validation uses the effective key layout of the table (see {@link Keys}). Reads and deletes
 *   must fix every partition key field with {@code =} or {@code IN}; updates must also fix every
 *   clustering column. Two kinds of failures are told apart:
 * </p>
 *
 * <ul>
 *   <li>{@link StatementGenerationException}: the relations can never be rendered against this
 *     table, for example a clustering predicate without any partition predicate, or a relation
 *     on an undeclared field.</li>
 *   <li>{@link OpValidationException}: the relations are well-formed but incomplete, for example
 *     one of two partition key fields is missing, or a written row lacks a key field.</li>
 * </ul>
 *
 * <p>
 *   Column names are always double-quoted so that they may be CQL keywords or mixed case. Key
 *   space and table names are not quoted and must be valid unquoted identifiers.
 * </p>
 */
public final class CQLStatements {
  private static final Logger LOG = LoggerFactory.getLogger(CQLStatements.class);

  private static final Joiner COMMA_JOINER = Joiner.on(", ");
  private static final Joiner AND_JOINER = Joiner.on(" AND ");

  /** Private constructor for utility class. */
  private CQLStatements() {
  }

  /**
   * @param identifier column name.
   * @return the double-quoted identifier.
   */
  public static String quote(final String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  /**
   * Lower-cases a name and removes every character that is not a letter, a digit or an
   * underscore.
   *
   * @param name to sanitize.
   * @return a valid unquoted table name.
   */
  public static String sanitizeTableName(final String name) {
    return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "");
  }

  /**
   * @param count of markers.
   * @return {@code count} comma separated {@code ?} markers.
   */
  private static String markers(final int count) {
    return COMMA_JOINER.join(Collections.nCopies(count, "?"));
  }

  /**
   * @param fields to quote.
   * @return the comma separated quoted fields.
   */
  private static String quoteAll(final List<String> fields) {
    final List<String> quoted = Lists.newArrayList();
    for (String field : fields) {
      quoted.add(quote(field));
    }
    return COMMA_JOINER.join(quoted);
  }

  /**
   * Renders a row replacement. Every declared field is written; fields absent from the row are
   * bound as null, which clears them.
   *
   * @param table to write to.
   * @param fields of the row.
   * @param options of the statement.
   * @return an {@code INSERT} statement.
   * @throws RecipeException if the row does not fit the table.
   */
  public static CQLStatement insert(
      final TableDescriptor table,
      final Map<String, Object> fields,
      final Options options
  ) throws RecipeException {
    final RowSchema schema = table.getSchema();
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      if (!schema.contains(entry.getKey())) {
        throw new StatementGenerationException(String.format(
            "Field '%s' is not declared in table '%s'.", entry.getKey(), table));
      }
      if (entry.getValue() instanceof Modifier) {
        throw new StatementGenerationException(String.format(
            "Field '%s' of table '%s' is written with a modifier, which requires an update.",
            entry.getKey(), table));
      }
    }
    if (schema.hasCounters()) {
      throw new StatementGenerationException(String.format(
          "Table '%s' has counter columns, its rows can only be updated.", table));
    }
    for (String key : table.getKeys().getPrimaryKeyFields()) {
      if (fields.get(key) == null) {
        throw new OpValidationException(String.format(
            "Missing value for key field '%s' of table '%s'.", key, table));
      }
    }

    final List<Object> values = Lists.newArrayList();
    final Map<String, Object> assignments = Maps.newLinkedHashMap();
    for (String field : schema.getFieldNames()) {
      values.add(fields.get(field));
      assignments.put(field, fields.get(field));
    }

    final StringBuilder sb = new StringBuilder();
    sb.append("INSERT INTO ").append(table.getQualifiedName())
        .append(" (").append(quoteAll(schema.getFieldNames())).append(")")
        .append(" VALUES (").append(markers(values.size())).append(")");
    appendUsing(sb, values, options, true);

    return new CQLStatement(CQLStatement.Kind.INSERT, table, sb.toString(), values,
        ImmutableList.<Relation>of(), assignments, options, false);
  }

  /**
   * Renders a partial write of the rows fixed by the relations.
   *
   * @param table to write to.
   * @param relations fixing the whole primary key.
   * @param fields to write. Values may be {@link Modifier}s.
   * @param options of the statement.
   * @return an {@code UPDATE} statement.
   * @throws RecipeException if the update does not fit the table.
   */
  public static CQLStatement update(
      final TableDescriptor table,
      final List<Relation> relations,
      final Map<String, Object> fields,
      final Options options
  ) throws RecipeException {
    if (fields.isEmpty()) {
      throw new StatementGenerationException(String.format(
          "Update of table '%s' assigns no field.", table));
    }
    final RowSchema schema = table.getSchema();
    final List<String> keyFields = table.getKeys().getPrimaryKeyFields();
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      final String field = entry.getKey();
      if (!schema.contains(field)) {
        throw new StatementGenerationException(String.format(
            "Field '%s' is not declared in table '%s'.", field, table));
      }
      if (keyFields.contains(field)) {
        throw new StatementGenerationException(String.format(
            "Key field '%s' of table '%s' can not be updated.", field, table));
      }
      checkAssignment(table, field, schema.getType(field), entry.getValue());
    }
    checkRelations(table, relations, CQLStatement.Kind.UPDATE, false);

    final List<Object> values = Lists.newArrayList();
    final StringBuilder sb = new StringBuilder();
    sb.append("UPDATE ").append(table.getQualifiedName());
    appendUsing(sb, values, options, true);

    final List<String> assignments = Lists.newArrayList();
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      assignments.add(renderAssignment(entry.getKey(), entry.getValue(), values));
    }
    sb.append(" SET ");
    COMMA_JOINER.appendTo(sb, assignments);
    appendWhere(sb, relations, values);

    return new CQLStatement(CQLStatement.Kind.UPDATE, table, sb.toString(), values, relations,
        fields, options, false);
  }

  /**
   * Renders a deletion of the rows selected by the relations.
   *
   * @param table to delete from.
   * @param relations fixing at least the whole partition key.
   * @param options of the statement. Only the timestamp applies.
   * @return a {@code DELETE} statement.
   * @throws RecipeException if the relations do not fit the table.
   */
  public static CQLStatement delete(
      final TableDescriptor table,
      final List<Relation> relations,
      final Options options
  ) throws RecipeException {
    checkRelations(table, relations, CQLStatement.Kind.DELETE, false);

    final List<Object> values = Lists.newArrayList();
    final StringBuilder sb = new StringBuilder();
    sb.append("DELETE FROM ").append(table.getQualifiedName());
    appendUsing(sb, values, options, false);
    appendWhere(sb, relations, values);

    return new CQLStatement(CQLStatement.Kind.DELETE, table, sb.toString(), values, relations,
        ImmutableMap.<String, Object>of(), options, false);
  }

  /**
   * Renders a read of the rows selected by the relations.
   *
   * @param table to read from.
   * @param relations fixing the whole partition key, unless filtering is allowed.
   * @param options of the statement: limit, clustering order and filtering.
   * @return a {@code SELECT} statement.
   * @throws RecipeException if the relations do not fit the table.
   */
  public static CQLStatement select(
      final TableDescriptor table,
      final List<Relation> relations,
      final Options options
  ) throws RecipeException {
    checkRelations(table, relations, CQLStatement.Kind.SELECT, options.isAllowFiltering());

    final List<Object> values = Lists.newArrayList();
    final StringBuilder sb = new StringBuilder();
    sb.append("SELECT * FROM ").append(table.getQualifiedName());
    appendWhere(sb, relations, values);
    if (options.hasClusteringOrder() && !options.getClusteringOrder().isEmpty()) {
      sb.append(" ORDER BY ");
      COMMA_JOINER.appendTo(sb, renderClusteringOrder(options.getClusteringOrder()));
    }
    if (options.hasLimit()) {
      sb.append(" LIMIT ?");
      values.add(options.getLimit());
    }
    if (options.isAllowFiltering()) {
      sb.append(" ALLOW FILTERING");
    }

    return new CQLStatement(CQLStatement.Kind.SELECT, table, sb.toString(), values, relations,
        ImmutableMap.<String, Object>of(), options, false);
  }

  /**
   * Renders the creation of a table from its key layout and options.
   *
   * @param table to create.
   * @param ifNotExists whether to guard the creation with an existence check.
   * @return a {@code CREATE TABLE} statement.
   */
  public static CQLStatement createTable(final TableDescriptor table, final boolean ifNotExists) {
    final Keys keys = table.getKeys();
    final Options options = table.getOptions();

    // statement being built:
    //  "CREATE TABLE [IF NOT EXISTS] ${keyspace}.${table} (
    //   "${column1}" ${type1}, "${column2}" ${type2}...,
    //   PRIMARY KEY (("${partitionKey1}", ...), "${clusteringColumn1}", ...))
    //   [WITH CLUSTERING ORDER BY (...) [AND COMPACT STORAGE] [AND compression = {...}]]
    final StringBuilder sb = new StringBuilder();
    sb.append("CREATE TABLE ");
    if (ifNotExists) {
      sb.append("IF NOT EXISTS ");
    }
    sb.append(table.getQualifiedName()).append(" (");

    for (Map.Entry<String, ColumnType> column : table.getSchema().getColumns().entrySet()) {
      sb.append(quote(column.getKey())).append(' ').append(column.getValue()).append(", ");
    }

    sb.append("PRIMARY KEY (");
    if (!keys.getClusteringColumns().isEmpty()) {
      sb.append('(').append(quoteAll(keys.getPartitionKeys())).append("), ")
          .append(quoteAll(keys.getClusteringColumns()));
    } else if (keys.isCompound()) {
      sb.append('(').append(quoteAll(keys.getPartitionKeys())).append(')');
    } else {
      sb.append(quoteAll(keys.getPartitionKeys()));
    }
    sb.append("))");

    final List<String> properties = Lists.newArrayList();
    if (options.hasClusteringOrder() && !options.getClusteringOrder().isEmpty()) {
      properties.add(String.format("CLUSTERING ORDER BY (%s)",
          COMMA_JOINER.join(renderClusteringOrder(options.getClusteringOrder()))));
    }
    if (options.isCompactStorage()) {
      properties.add("COMPACT STORAGE");
    }
    if (options.hasCompressor()) {
      final List<String> entries = Lists.newArrayList();
      for (Map.Entry<String, String> entry : options.getCompressor().entrySet()) {
        entries.add(String.format("%s: %s", literal(entry.getKey()), literal(entry.getValue())));
      }
      properties.add(String.format("compression = {%s}", COMMA_JOINER.join(entries)));
    }
    if (!properties.isEmpty()) {
      sb.append(" WITH ");
      AND_JOINER.appendTo(sb, properties);
    }

    final String query = sb.toString();
    LOG.info("Prepared query string for table create: {}", query);

    return new CQLStatement(CQLStatement.Kind.CREATE_TABLE, table, query,
        ImmutableList.of(), ImmutableList.<Relation>of(), ImmutableMap.<String, Object>of(),
        options, ifNotExists);
  }

  /**
   * @param table to drop.
   * @return a {@code DROP TABLE IF EXISTS} statement.
   */
  public static CQLStatement dropTable(final TableDescriptor table) {
    return new CQLStatement(CQLStatement.Kind.DROP_TABLE, table,
        String.format("DROP TABLE IF EXISTS %s", table.getQualifiedName()),
        ImmutableList.of(), ImmutableList.<Relation>of(), ImmutableMap.<String, Object>of(),
        table.getOptions(), false);
  }

  /**
   * @param table to empty.
   * @return a {@code TRUNCATE} statement.
   */
  public static CQLStatement truncate(final TableDescriptor table) {
    return new CQLStatement(CQLStatement.Kind.TRUNCATE, table,
        String.format("TRUNCATE %s", table.getQualifiedName()),
        ImmutableList.of(), ImmutableList.<Relation>of(), ImmutableMap.<String, Object>of(),
        table.getOptions(), false);
  }

  /**
   * Checks that relations select rows the way Cassandra allows for a kind of statement.
   *
   * @param table the relations apply to.
   * @param relations to check.
   * @param kind of statement.
   * @param allowFiltering whether a SELECT may scan partitions.
   * @throws RecipeException if the relations do not fit the table.
   */
  private static void checkRelations(
      final TableDescriptor table,
      final List<Relation> relations,
      final CQLStatement.Kind kind,
      final boolean allowFiltering
  ) throws RecipeException {
    final Keys keys = table.getKeys();
    final List<String> partitionKeys = keys.getEffectivePartitionKeys();
    final List<String> clusteringColumns = keys.getEffectiveClusteringColumns();
    final boolean filtering = kind == CQLStatement.Kind.SELECT && allowFiltering;

    final Set<String> fixed = Sets.newHashSet();
    boolean clusteringConstrained = false;
    for (Relation relation : relations) {
      if (relation.getOperator() == Relation.Operator.IN && relation.getTerms().isEmpty()) {
        throw new StatementGenerationException(String.format(
            "Empty IN relation on '%s' of table '%s'.", relation.getFields(), table));
      }
      if (!relation.isMultiColumn() && relation.getTerms().contains(null)
          && keys.getPrimaryKeyFields().contains(relation.getField())) {
        throw new OpValidationException(String.format(
            "Null value for key field '%s' of table '%s'.", relation.getField(), table));
      }
      for (String field : relation.getFields()) {
        if (!table.getSchema().contains(field)) {
          throw new StatementGenerationException(String.format(
              "Relation on undeclared field '%s' of table '%s'.", field, table));
        }
        if (relation.isMultiColumn() && !clusteringColumns.contains(field)) {
          throw new StatementGenerationException(String.format(
              "Tuple relation on %s of table '%s' may only constrain clustering columns.",
              relation.getFields(), table));
        }
        if (partitionKeys.contains(field)) {
          if (!relation.getOperator().isRange()) {
            fixed.add(field);
          } else if (!filtering) {
            throw new StatementGenerationException(String.format(
                "Range relation on partition key field '%s' of table '%s'.", field, table));
          }
        } else if (clusteringColumns.contains(field)) {
          clusteringConstrained = true;
          if (!relation.getOperator().isRange()) {
            fixed.add(field);
          }
        } else if (!filtering) {
          throw new StatementGenerationException(String.format(
              "Relation on non-key field '%s' of table '%s' requires filtering.", field, table));
        }
      }
    }

    if (!filtering) {
      final List<String> missing = missingFields(partitionKeys, fixed);
      if (!missing.isEmpty() && missing.size() == partitionKeys.size() && clusteringConstrained) {
        throw new StatementGenerationException(String.format(
            "Clustering relation without partition key relation on table '%s'.", table));
      }
      if (!missing.isEmpty()) {
        throw new OpValidationException(String.format(
            "%s of table '%s' must fix partition key fields %s.", kind, table, missing));
      }
    }
    if (kind == CQLStatement.Kind.UPDATE) {
      final List<String> missing = missingFields(clusteringColumns, fixed);
      if (!missing.isEmpty()) {
        throw new OpValidationException(String.format(
            "UPDATE of table '%s' must fix clustering columns %s.", table, missing));
      }
    }
  }

  /**
   * @param fields required.
   * @param fixed fields constrained by an equality.
   * @return the required fields that are not fixed, in order.
   */
  private static List<String> missingFields(final List<String> fields, final Set<String> fixed) {
    final List<String> missing = Lists.newArrayList();
    for (String field : fields) {
      if (!fixed.contains(field)) {
        missing.add(field);
      }
    }
    return missing;
  }

  /**
   * Checks that a value can be assigned to a column in an update.
   *
   * @param table of the column.
   * @param field name of the column.
   * @param type of the column.
   * @param value assigned, plain or a modifier.
   * @throws StatementGenerationException if the value does not fit the column type.
   */
  private static void checkAssignment(
      final TableDescriptor table,
      final String field,
      final ColumnType type,
      final Object value
  ) throws StatementGenerationException {
    final boolean fits;
    if (!(value instanceof Modifier)) {
      fits = !type.isCounter();
    } else {
      switch (((Modifier) value).getKind()) {
        case COUNTER_INCREMENT: fits = type.isCounter(); break;
        case LIST_APPEND:
        case LIST_PREPEND:
        case LIST_REMOVE:
        case LIST_SET_AT_INDEX: fits = type.isList(); break;
        case MAP_SET_FIELD:
        case MAP_SET_FIELDS: fits = type.isMap(); break;
        case SET_ADD:
        case SET_REMOVE: fits = type.isSet(); break;
        default: fits = false;
      }
    }
    if (!fits) {
      throw new StatementGenerationException(String.format(
          "Can not assign %s to column '%s' of type %s in table '%s'.",
          value instanceof Modifier ? ((Modifier) value).getKind() : "a value",
          field, type, table));
    }
  }

  /**
   * Renders one element of a SET clause and binds its values.
   *
   * @param field assigned.
   * @param value plain value or modifier.
   * @param values bound values, appended to.
   * @return the rendered assignment.
   */
  private static String renderAssignment(
      final String field,
      final Object value,
      final List<Object> values
  ) {
    final String column = quote(field);
    if (!(value instanceof Modifier)) {
      values.add(value);
      return column + " = ?";
    }
    final Modifier modifier = (Modifier) value;
    final List<Object> arguments = modifier.getArguments();
    switch (modifier.getKind()) {
      case COUNTER_INCREMENT:
      case LIST_APPEND:
      case MAP_SET_FIELDS:
      case SET_ADD: {
        values.add(arguments.get(0));
        return column + " = " + column + " + ?";
      }
      case LIST_PREPEND: {
        values.add(arguments.get(0));
        return column + " = ? + " + column;
      }
      case LIST_REMOVE:
      case SET_REMOVE: {
        values.add(arguments.get(0));
        return column + " = " + column + " - ?";
      }
      case LIST_SET_AT_INDEX: {
        values.add(arguments.get(1));
        return String.format("%s[%d] = ?", column, (Integer) arguments.get(0));
      }
      case MAP_SET_FIELD: {
        values.add(arguments.get(0));
        values.add(arguments.get(1));
        return column + "[?] = ?";
      }
      default: throw new IllegalArgumentException(
          String.format("Unknown modifier kind %s.", modifier.getKind()));
    }
  }

  /**
   * Appends the USING clause of a write, if any option requires one.
   *
   * @param sb statement being built.
   * @param values bound values, appended to.
   * @param options of the statement.
   * @param withTtl whether the statement accepts a time-to-live.
   */
  private static void appendUsing(
      final StringBuilder sb,
      final List<Object> values,
      final Options options,
      final boolean withTtl
  ) {
    final List<String> clauses = Lists.newArrayList();
    if (withTtl && options.hasTtl()) {
      clauses.add("TTL ?");
      values.add(options.getTtl());
    }
    if (options.hasTimestamp()) {
      clauses.add("TIMESTAMP ?");
      values.add(options.getTimestamp());
    }
    if (!clauses.isEmpty()) {
      sb.append(" USING ");
      AND_JOINER.appendTo(sb, clauses);
    }
  }

  /**
   * Appends the WHERE clause for some relations, if any.
   *
   * @param sb statement being built.
   * @param relations to render.
   * @param values bound values, appended to.
   */
  private static void appendWhere(
      final StringBuilder sb,
      final List<Relation> relations,
      final List<Object> values
  ) {
    if (relations.isEmpty()) {
      return;
    }
    final List<String> clauses = Lists.newArrayList();
    for (Relation relation : relations) {
      final List<Object> terms = relation.getTerms();
      if (relation.getOperator() == Relation.Operator.IN) {
        clauses.add(String.format("%s IN (%s)",
            quote(relation.getField()), markers(terms.size())));
      } else if (relation.isMultiColumn()) {
        clauses.add(String.format("(%s) %s (%s)",
            quoteAll(relation.getFields()),
            relation.getOperator().getSymbol(),
            markers(terms.size())));
      } else {
        clauses.add(String.format("%s %s ?",
            quote(relation.getField()), relation.getOperator().getSymbol()));
      }
      values.addAll(terms);
    }
    sb.append(" WHERE ");
    AND_JOINER.appendTo(sb, clauses);
  }

  /**
   * @param order of clustering columns.
   * @return the rendered {@code "column" ASC|DESC} elements.
   */
  private static List<String> renderClusteringOrder(final List<Options.ClusteringOrder> order) {
    final List<String> rendered = Lists.newArrayList();
    for (Options.ClusteringOrder column : order) {
      rendered.add(quote(column.getColumn()) + " " + column.getDirection());
    }
    return rendered;
  }

  /**
   * @param value string literal.
   * @return the single-quoted CQL literal.
   */
  private static String literal(final String value) {
    return "'" + value.replace("'", "''") + "'";
  }
}
