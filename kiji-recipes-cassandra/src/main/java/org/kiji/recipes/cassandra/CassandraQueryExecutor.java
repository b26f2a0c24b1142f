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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import com.datastax.driver.core.BatchStatement;
import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.SimpleStatement;
import com.datastax.driver.core.Statement;
import com.datastax.driver.core.exceptions.DriverException;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kiji.recipes.CQLStatement;
import org.kiji.recipes.Options;
import org.kiji.recipes.QueryExecutor;

/**
 * Query executor dispatching statements through a DataStax driver {@link Session}.
 *
 * <p>
 *   Statements are sent unprepared, with their values bound positionally. Driver failures are
 *   surfaced as {@link IOException}s.
 * </p>
 */
@ThreadSafe
public final class CassandraQueryExecutor implements QueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(CassandraQueryExecutor.class);

  private final Session mSession;

  /** Cluster owned by this executor, closed with it. Null when the session is borrowed. */
  @Nullable
  private final Cluster mCluster;

  /**
   * Creates an executor borrowing a session. Closing the executor leaves the session open.
   *
   * @param session to dispatch statements through.
   */
  public CassandraQueryExecutor(final Session session) {
    this(session, null);
  }

  /**
   * @param session to dispatch statements through.
   * @param cluster owning the session, closed with this executor. Null to borrow the session.
   */
  public CassandraQueryExecutor(final Session session, @Nullable final Cluster cluster) {
    mSession = Preconditions.checkNotNull(session);
    mCluster = cluster;
  }

  /** @return the driver session statements go through. */
  public Session getSession() {
    return mSession;
  }

  /** {@inheritDoc} */
  @Override
  public List<Map<String, Object>> query(
      final CQLStatement statement,
      final Options options
  ) throws IOException {
    final ResultSet resultSet = dispatch(toDriverStatement(statement, options));
    try {
      return CassandraRowDecoder.decodeAll(resultSet);
    } catch (DriverException de) {
      // Paging through the result set fetches more rows.
      throw new IOException(String.format(
          "Error fetching rows of '%s'.", statement.getQuery()), de);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void execute(final CQLStatement statement, final Options options) throws IOException {
    dispatch(toDriverStatement(statement, options));
  }

  /** {@inheritDoc} */
  @Override
  public void executeAtomically(
      final List<CQLStatement> statements,
      final Options options
  ) throws IOException {
    dispatch(toBatchStatement(statements, options));
  }

  /**
   * @param statement to execute.
   * @return the result set of the statement.
   * @throws IOException on driver error.
   */
  private ResultSet dispatch(final Statement statement) throws IOException {
    try {
      return mSession.execute(statement);
    } catch (DriverException de) {
      throw new IOException(String.format("Error executing %s.", statement), de);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    if (mCluster != null) {
      LOG.debug("Closing Cassandra cluster connection {}.", mCluster.getClusterName());
      mCluster.close();
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(CassandraQueryExecutor.class)
        .add("keyspace", mSession.getLoggedKeyspace())
        .add("owns_cluster", mCluster != null)
        .toString();
  }

  // -----------------------------------------------------------------------------------------------
  // Driver statements.

  /**
   * @param statement to convert.
   * @param options of the dispatch: consistency and fetch size.
   * @return the driver statement.
   */
  static SimpleStatement toDriverStatement(final CQLStatement statement, final Options options) {
    final SimpleStatement simple =
        new SimpleStatement(statement.getQuery(), toDriverValues(statement.getValues()));
    configure(simple, options);
    return simple;
  }

  /**
   * @param statements writes to group.
   * @param options of the batch: consistency, fetch size and write timestamp.
   * @return a logged batch of the statements.
   */
  static BatchStatement toBatchStatement(
      final List<CQLStatement> statements,
      final Options options
  ) {
    final BatchStatement batch = new BatchStatement(BatchStatement.Type.LOGGED);
    for (CQLStatement statement : statements) {
      batch.add(new SimpleStatement(statement.getQuery(), toDriverValues(statement.getValues())));
    }
    configure(batch, options);
    if (options.hasTimestamp()) {
      batch.setDefaultTimestamp(options.getTimestamp());
    }
    return batch;
  }

  /**
   * @param statement to configure.
   * @param options to apply.
   */
  private static void configure(final Statement statement, final Options options) {
    if (options.hasConsistency()) {
      statement.setConsistencyLevel(options.getConsistency());
    }
    if (options.hasFetchSize()) {
      statement.setFetchSize(options.getFetchSize());
    }
  }

  /**
   * @param values bound by a statement.
   * @return the values as the driver codecs expect them: byte arrays are wrapped.
   */
  static Object[] toDriverValues(final List<Object> values) {
    final List<Object> converted = Lists.newArrayListWithCapacity(values.size());
    for (Object value : values) {
      if (value instanceof byte[]) {
        converted.add(ByteBuffer.wrap((byte[]) value));
      } else {
        converted.add(value);
      }
    }
    return converted.toArray();
  }
}
