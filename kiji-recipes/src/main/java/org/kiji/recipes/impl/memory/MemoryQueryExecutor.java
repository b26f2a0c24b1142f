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

package org.kiji.recipes.impl.memory;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;

import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.Keys;
import org.kiji.recipes.Modifier;
import org.kiji.recipes.Options;
import org.kiji.recipes.QueryExecutor;
import org.kiji.recipes.Relation;
import org.kiji.recipes.TableDescriptor;
import org.kiji.recipes.impl.SystemTables;
import org.kiji.recipes.impl.ValueOrdering;

/**
 * Query executor interpreting statements against tables held in memory.
 *
 * <p>
 *   Statements are interpreted from their structure (relations and assignments), never from
 *   their query text. Rows are upserted the way Cassandra does: an {@code INSERT} replaces
 *   every column of the row, an {@code UPDATE} creates the row when missing, counters start
 *   at 0 and collections emptied by a removal read as {@code null}. Time to live and write
 *   timestamps are not simulated.
 * </p>
 *
 * <p>
 *   Partitions are returned ordered by the values of their partition key, rows within a
 *   partition by their clustering columns in the requested clustering order.
 * </p>
 *
 * <p>
 *   Tests can inspect the executed statements and make dispatches fail with
 *   {@link #failAfter(int)}. A failed atomic batch applies none of its statements.
 * </p>
 */
@ThreadSafe
public final class MemoryQueryExecutor implements QueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(MemoryQueryExecutor.class);

  private static final Comparator<Iterable<Object>> KEY_ORDERING =
      ValueOrdering.get().<Object>lexicographical();

  /** Rows of every table, by qualified table name, then by primary key values. */
  private final Map<String, NavigableMap<List<Object>, Map<String, Object>>> mTables =
      Maps.newHashMap();

  private final List<CQLStatement> mExecuted = Lists.newArrayList();

  private int mBatchCount = 0;

  /** Number of dispatches still allowed to succeed, negative when failures are disabled. */
  private int mRemainingSuccesses = -1;

  private boolean mClosed = false;

  /** Creates an executor with no user table. */
  public MemoryQueryExecutor() {
    createTable(SystemTables.DESCRIPTOR);
  }

  // -----------------------------------------------------------------------------------------------
  // Test hooks.

  /** @return every statement applied so far, batched ones included, in order. */
  public synchronized List<CQLStatement> getExecutedStatements() {
    return ImmutableList.copyOf(mExecuted);
  }

  /** @return the number of atomic batches applied so far. */
  public synchronized int getBatchCount() {
    return mBatchCount;
  }

  /**
   * Makes every dispatch fail once {@code successes} more dispatches succeeded.
   * An atomic batch counts as one dispatch.
   *
   * @param successes number of dispatches to let through.
   */
  public synchronized void failAfter(final int successes) {
    Preconditions.checkArgument(successes >= 0, "Negative number of dispatches: %s", successes);
    mRemainingSuccesses = successes;
  }

  /** Lets every dispatch succeed again. */
  public synchronized void clearFailure() {
    mRemainingSuccesses = -1;
  }

  // -----------------------------------------------------------------------------------------------
  // QueryExecutor.

  /** {@inheritDoc} */
  @Override
  public synchronized List<Map<String, Object>> query(
      final CQLStatement statement,
      final Options options
  ) throws IOException {
    dispatch(statement);
    mExecuted.add(statement);
    if (statement.getKind() == CQLStatement.Kind.SELECT) {
      return select(statement);
    }
    apply(statement);
    return ImmutableList.of();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void execute(
      final CQLStatement statement,
      final Options options
  ) throws IOException {
    dispatch(statement);
    mExecuted.add(statement);
    if (statement.getKind() == CQLStatement.Kind.SELECT) {
      select(statement);
    } else {
      apply(statement);
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void executeAtomically(
      final List<CQLStatement> statements,
      final Options options
  ) throws IOException {
    dispatch(null);
    for (CQLStatement statement : statements) {
      if (!statement.getKind().isWrite()) {
        throw new IOException(String.format(
            "Only writes can be batched, got: '%s'.", statement.getQuery()));
      }
    }

    final Map<String, NavigableMap<List<Object>, Map<String, Object>>> snapshot =
        Maps.newHashMap();
    for (Map.Entry<String, NavigableMap<List<Object>, Map<String, Object>>> entry
        : mTables.entrySet()) {
      snapshot.put(entry.getKey(), copyRows(entry.getValue()));
    }
    try {
      for (CQLStatement statement : statements) {
        apply(statement);
      }
    } catch (IOException ioe) {
      mTables.clear();
      mTables.putAll(snapshot);
      throw ioe;
    }
    mExecuted.addAll(statements);
    mBatchCount += 1;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void close() throws IOException {
    mClosed = true;
  }

  // -----------------------------------------------------------------------------------------------
  // Interpretation.

  /**
   * Accounts for one dispatch.
   *
   * @param statement dispatched, or null for a batch.
   * @throws IOException if the executor is closed or failures were requested.
   */
  private void dispatch(final CQLStatement statement) throws IOException {
    if (mClosed) {
      throw new IOException("Query executor is closed.");
    }
    if (mRemainingSuccesses == 0) {
      throw new IOException(String.format("Injected failure of %s.",
          (statement == null) ? "atomic batch" : "'" + statement.getQuery() + "'"));
    }
    if (mRemainingSuccesses > 0) {
      mRemainingSuccesses -= 1;
    }
    if (statement != null) {
      LOG.debug("Interpreting statement: {}", statement);
    }
  }

  /**
   * Applies a statement that does not return rows.
   *
   * @param statement to apply.
   * @throws IOException if the statement can not be applied.
   */
  private void apply(final CQLStatement statement) throws IOException {
    final TableDescriptor table = statement.getTable();
    try {
      switch (statement.getKind()) {
        case CREATE_TABLE:
          if (mTables.containsKey(table.getQualifiedName())) {
            if (!statement.isIfNotExists()) {
              throw new IOException(String.format(
                  "Table %s already exists.", table.getQualifiedName()));
            }
          } else {
            createTable(table);
          }
          break;
        case DROP_TABLE:
          if (mTables.remove(table.getQualifiedName()) != null) {
            rows(SystemTables.DESCRIPTOR).remove(systemKey(table));
          }
          break;
        case TRUNCATE:
          rows(table).clear();
          break;
        case INSERT:
          insert(table, statement.getAssignments());
          break;
        case UPDATE:
          update(table, statement.getRelations(), statement.getAssignments());
          break;
        case DELETE:
          delete(table, statement.getRelations());
          break;
        default:
          throw new IOException(String.format(
              "Statement kind %s can not be applied.", statement.getKind()));
      }
    } catch (ClassCastException cce) {
      throw new IOException(String.format(
          "Incompatible values in statement '%s'.", statement.getQuery()), cce);
    }
  }

  /** @param table to register. */
  private void createTable(final TableDescriptor table) {
    final String name = table.getQualifiedName();
    mTables.put(name, Maps.<Iterable<Object>, List<Object>, Map<String, Object>>newTreeMap(
        KEY_ORDERING));
    if (!table.equals(SystemTables.DESCRIPTOR)) {
      final Map<String, Object> row = Maps.newLinkedHashMap();
      row.put(SystemTables.KEYSPACE_NAME_COL, table.getKeyspace());
      row.put(SystemTables.TABLE_NAME_COL, table.getName());
      mTables.get(SystemTables.DESCRIPTOR.getQualifiedName()).put(systemKey(table), row);
    }
    LOG.debug("Created in-memory table {}.", name);
  }

  /**
   * @param table a user table.
   * @return the key of its row in the system table.
   */
  private static List<Object> systemKey(final TableDescriptor table) {
    return ImmutableList.<Object>of(table.getKeyspace(), table.getName());
  }

  /**
   * @param table to look up.
   * @return the rows of the table.
   * @throws IOException if the table does not exist.
   */
  private NavigableMap<List<Object>, Map<String, Object>> rows(final TableDescriptor table)
      throws IOException {
    final NavigableMap<List<Object>, Map<String, Object>> rows =
        mTables.get(table.getQualifiedName());
    if (rows == null) {
      throw new IOException(String.format(
          "Table %s does not exist.", table.getQualifiedName()));
    }
    return rows;
  }

  /**
   * @param rows to copy.
   * @return a copy of the row index. Rows are never mutated in place and are shared.
   */
  private static NavigableMap<List<Object>, Map<String, Object>> copyRows(
      final NavigableMap<List<Object>, Map<String, Object>> rows
  ) {
    final NavigableMap<List<Object>, Map<String, Object>> copy =
        Maps.<Iterable<Object>, List<Object>, Map<String, Object>>newTreeMap(KEY_ORDERING);
    copy.putAll(rows);
    return copy;
  }

  /**
   * @param keys of the table.
   * @param row with every primary key field set.
   * @return the primary key values of the row.
   */
  private static List<Object> primaryKey(final Keys keys, final Map<String, Object> row) {
    final List<Object> key = Lists.newArrayList();
    for (String field : keys.getPrimaryKeyFields()) {
      key.add(row.get(field));
    }
    return key;
  }

  /**
   * @param table to write to.
   * @param assignments every column of the row.
   * @throws IOException if the table does not exist.
   */
  private void insert(final TableDescriptor table, final Map<String, Object> assignments)
      throws IOException {
    final Map<String, Object> row = Maps.newLinkedHashMap();
    for (Map.Entry<String, Object> entry : assignments.entrySet()) {
      if (entry.getValue() != null) {
        row.put(entry.getKey(), entry.getValue());
      }
    }
    rows(table).put(primaryKey(table.getKeys(), row), row);
  }

  /**
   * @param table to write to.
   * @param relations fixing every primary key field.
   * @param assignments plain values and modifiers.
   * @throws IOException if the table does not exist or an assignment can not be applied.
   */
  private void update(
      final TableDescriptor table,
      final List<Relation> relations,
      final Map<String, Object> assignments
  ) throws IOException {
    final NavigableMap<List<Object>, Map<String, Object>> rows = rows(table);
    final List<String> keyFields = table.getKeys().getPrimaryKeyFields();

    final List<List<Object>> candidates = Lists.newArrayList();
    for (String field : keyFields) {
      candidates.add(fixedValues(field, relations));
    }
    for (List<Object> key : Lists.cartesianProduct(candidates)) {
      final Map<String, Object> existing = rows.get(key);
      final Map<String, Object> row = Maps.newLinkedHashMap();
      if (existing != null) {
        row.putAll(existing);
      } else {
        for (int i = 0; i < keyFields.size(); i++) {
          row.put(keyFields.get(i), key.get(i));
        }
      }
      for (Map.Entry<String, Object> entry : assignments.entrySet()) {
        final Object value = (entry.getValue() instanceof Modifier)
            ? modify(entry.getKey(), row.get(entry.getKey()), (Modifier) entry.getValue())
            : entry.getValue();
        if (value == null) {
          row.remove(entry.getKey());
        } else {
          row.put(entry.getKey(), value);
        }
      }
      rows.put(ImmutableList.copyOf(key), row);
    }
  }

  /**
   * @param field a primary key field.
   * @param relations of an update.
   * @return the values the relations fix the field to.
   * @throws IOException if the field is not fixed.
   */
  private static List<Object> fixedValues(final String field, final List<Relation> relations)
      throws IOException {
    for (Relation relation : relations) {
      if (!relation.isMultiColumn() && relation.getField().equals(field)) {
        if (relation.getOperator() == Relation.Operator.EQ
            || relation.getOperator() == Relation.Operator.IN) {
          return relation.getTerms();
        }
      }
    }
    throw new IOException(String.format("Key field '%s' is not fixed by %s.", field, relations));
  }

  /**
   * @param field modified.
   * @param current value of the field, possibly null.
   * @param modifier to apply.
   * @return the new value of the field, null when a collection ends up empty.
   * @throws IOException if the modifier does not apply to the current value.
   */
  @SuppressWarnings("unchecked")
  private static Object modify(
      final String field,
      final Object current,
      final Modifier modifier
  ) throws IOException {
    final List<Object> arguments = modifier.getArguments();
    switch (modifier.getKind()) {
      case COUNTER_INCREMENT: {
        final long base = (current == null) ? 0L : ((Number) current).longValue();
        return base + ((Number) arguments.get(0)).longValue();
      }
      case LIST_APPEND: {
        final List<Object> list = listOf(current);
        list.addAll((Collection<Object>) arguments.get(0));
        return nullIfEmpty(list);
      }
      case LIST_PREPEND: {
        final List<Object> list = Lists.newArrayList((Collection<Object>) arguments.get(0));
        list.addAll(listOf(current));
        return nullIfEmpty(list);
      }
      case LIST_REMOVE: {
        final List<Object> list = listOf(current);
        list.removeAll((Collection<Object>) arguments.get(0));
        return nullIfEmpty(list);
      }
      case LIST_SET_AT_INDEX: {
        final List<Object> list = listOf(current);
        final int index = (Integer) arguments.get(0);
        if (index >= list.size()) {
          throw new IOException(String.format(
              "List index %d out of bound for field '%s' of size %d.",
              index, field, list.size()));
        }
        list.set(index, arguments.get(1));
        return list;
      }
      case MAP_SET_FIELD: {
        final Map<Object, Object> map = mapOf(current);
        map.put(arguments.get(0), arguments.get(1));
        return map;
      }
      case MAP_SET_FIELDS: {
        final Map<Object, Object> map = mapOf(current);
        map.putAll((Map<Object, Object>) arguments.get(0));
        return nullIfEmpty(map);
      }
      case SET_ADD: {
        final Set<Object> set = setOf(current);
        set.addAll((Collection<Object>) arguments.get(0));
        return nullIfEmpty(set);
      }
      case SET_REMOVE: {
        final Set<Object> set = setOf(current);
        set.removeAll((Collection<Object>) arguments.get(0));
        return nullIfEmpty(set);
      }
      default:
        throw new IOException(String.format("Unsupported modifier %s.", modifier));
    }
  }

  /**
   * @param current list value, possibly null.
   * @return a mutable copy of the list.
   */
  @SuppressWarnings("unchecked")
  private static List<Object> listOf(final Object current) {
    return (current == null)
        ? Lists.newArrayList()
        : Lists.newArrayList((Collection<Object>) current);
  }

  /**
   * @param current set value, possibly null.
   * @return a mutable sorted copy of the set.
   */
  @SuppressWarnings("unchecked")
  private static Set<Object> setOf(final Object current) {
    final Set<Object> set = Sets.newTreeSet(ValueOrdering.get());
    if (current != null) {
      set.addAll((Collection<Object>) current);
    }
    return set;
  }

  /**
   * @param current map value, possibly null.
   * @return a mutable copy of the map, sorted by key.
   */
  @SuppressWarnings("unchecked")
  private static Map<Object, Object> mapOf(final Object current) {
    final Map<Object, Object> map = Maps.newTreeMap(ValueOrdering.get());
    if (current != null) {
      map.putAll((Map<Object, Object>) current);
    }
    return map;
  }

  /**
   * @param collection a list or set.
   * @return the collection, or null when it is empty.
   */
  private static Object nullIfEmpty(final Collection<?> collection) {
    return collection.isEmpty() ? null : collection;
  }

  /**
   * @param map a map value.
   * @return the map, or null when it is empty.
   */
  private static Object nullIfEmpty(final Map<?, ?> map) {
    return map.isEmpty() ? null : map;
  }

  /**
   * @param table to delete from.
   * @param relations selecting the rows to delete.
   * @throws IOException if the table does not exist.
   */
  private void delete(final TableDescriptor table, final List<Relation> relations)
      throws IOException {
    final NavigableMap<List<Object>, Map<String, Object>> rows = rows(table);
    final List<List<Object>> deleted = Lists.newArrayList();
    for (Map.Entry<List<Object>, Map<String, Object>> entry : rows.entrySet()) {
      if (matches(entry.getValue(), relations)) {
        deleted.add(entry.getKey());
      }
    }
    for (List<Object> key : deleted) {
      rows.remove(key);
    }
  }

  /**
   * @param statement a {@code SELECT}.
   * @return the selected rows, with every declared field, absent ones mapped to null.
   * @throws IOException if the table does not exist or values can not be compared.
   */
  private List<Map<String, Object>> select(final CQLStatement statement) throws IOException {
    final TableDescriptor table = statement.getTable();
    final List<Map<String, Object>> selected = Lists.newArrayList();
    try {
      for (Map<String, Object> row : rows(table).values()) {
        if (matches(row, statement.getRelations())) {
          selected.add(row);
        }
      }
      Collections.sort(selected, rowOrdering(table, statement.getOptions()));
    } catch (ClassCastException cce) {
      throw new IOException(String.format(
          "Incompatible values in statement '%s'.", statement.getQuery()), cce);
    }

    final Integer limit = statement.getLimit();
    final List<Map<String, Object>> result = Lists.newArrayList();
    for (Map<String, Object> row : selected) {
      if (limit != null && result.size() >= limit) {
        break;
      }
      final Map<String, Object> output = Maps.newLinkedHashMap();
      for (String field : table.getSchema().getFieldNames()) {
        output.put(field, row.get(field));
      }
      result.add(output);
    }
    return result;
  }

  /**
   * @param table read from.
   * @param options of the read, possibly carrying a clustering order.
   * @return the order rows of the table are returned in.
   */
  private static Comparator<Map<String, Object>> rowOrdering(
      final TableDescriptor table,
      final Options options
  ) {
    final Map<String, Options.Direction> directions = Maps.newHashMap();
    if (options.hasClusteringOrder()) {
      for (Options.ClusteringOrder order : options.getClusteringOrder()) {
        directions.put(order.getColumn(), order.getDirection());
      }
    }
    final Keys keys = table.getKeys();
    final List<String> partition = keys.getEffectivePartitionKeys();
    final List<String> clustering = keys.getEffectiveClusteringColumns();
    final Comparator<Map<String, Object>> byPartition = ValueOrdering.byFields(partition);
    return new Comparator<Map<String, Object>>() {
      @Override
      public int compare(final Map<String, Object> left, final Map<String, Object> right) {
        final int comparison = byPartition.compare(left, right);
        if (comparison != 0) {
          return comparison;
        }
        for (String column : clustering) {
          final int columnComparison =
              ValueOrdering.get().compare(left.get(column), right.get(column));
          if (columnComparison != 0) {
            return (directions.get(column) == Options.Direction.DESC)
                ? -columnComparison
                : columnComparison;
          }
        }
        return 0;
      }
    };
  }

  /**
   * @param row to test.
   * @param relations to satisfy.
   * @return whether the row satisfies every relation.
   */
  private static boolean matches(final Map<String, Object> row, final List<Relation> relations) {
    for (Relation relation : relations) {
      if (!matches(row, relation)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @param row to test.
   * @param relation to satisfy.
   * @return whether the row satisfies the relation.
   */
  private static boolean matches(final Map<String, Object> row, final Relation relation) {
    final ValueOrdering ordering = ValueOrdering.get();
    final int comparison;
    if (relation.isMultiColumn()) {
      final List<Object> values = Lists.newArrayList();
      for (String field : relation.getFields()) {
        values.add(row.get(field));
      }
      comparison = KEY_ORDERING.compare(values, relation.getTerms());
    } else {
      final Object value = row.get(relation.getField());
      if (value == null) {
        return false;
      }
      if (relation.getOperator() == Relation.Operator.IN) {
        for (Object term : relation.getTerms()) {
          if (ordering.compare(value, term) == 0) {
            return true;
          }
        }
        return false;
      }
      comparison = ordering.compare(value, relation.getTerm());
    }
    switch (relation.getOperator()) {
      case EQ:
        return comparison == 0;
      case GT:
        return comparison > 0;
      case GTE:
        return comparison >= 0;
      case LT:
        return comparison < 0;
      case LTE:
        return comparison <= 0;
      default:
        throw new IllegalArgumentException("Unexpected relation: " + relation);
    }
  }
}
