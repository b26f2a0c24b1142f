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
import java.util.Properties;

import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.exceptions.DriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kiji.recipes.KeySpace;
import org.kiji.recipes.KeySpaceConfig;
import org.kiji.recipes.impl.DefaultKeySpace;

/** Opens key spaces stored in Cassandra. */
public final class CassandraKeySpaces {
  private static final Logger LOG = LoggerFactory.getLogger(CassandraKeySpaces.class);

  /**
   * Connects to the cluster described by the properties. The key space owns the connection
   * and closes it when closed.
   *
   * @param properties overriding the settings of {@link CassandraConfiguration#DEFAULTS_RESOURCE}.
   * @return the opened key space.
   * @throws IOException if the cluster can not be reached.
   */
  public static KeySpace open(final Properties properties) throws IOException {
    return open(CassandraConfiguration.load(properties));
  }

  /**
   * @param configuration of the connection.
   * @return the opened key space, owning the cluster connection.
   * @throws IOException if the cluster can not be reached.
   */
  public static KeySpace open(final CassandraConfiguration configuration) throws IOException {
    LOG.info("Connecting to Cassandra key space with {}.", configuration);
    final Cluster cluster = Cluster.builder()
        .addContactPoints(configuration.getContactPoints().toArray(new String[0]))
        .withPort(configuration.getPort())
        .build();
    final Session session;
    try {
      session = cluster.connect(configuration.getKeyspace());
    } catch (DriverException de) {
      cluster.close();
      throw new IOException(String.format(
          "Error connecting to Cassandra key space '%s'.", configuration.getKeyspace()), de);
    }
    return new DefaultKeySpace(new CassandraQueryExecutor(session, cluster),
        configuration.getKeyspace(), configuration.getKeySpaceConfig());
  }

  /**
   * Opens a key space over an existing session. Closing the key space leaves the session open.
   *
   * @param session bound to any key space.
   * @param keyspace name of the key space tables are created in.
   * @param config default options and debug flag of the key space.
   * @return the key space.
   */
  public static KeySpace open(
      final Session session,
      final String keyspace,
      final KeySpaceConfig config
  ) {
    return new DefaultKeySpace(new CassandraQueryExecutor(session), keyspace, config);
  }

  /** Utility class. */
  private CassandraKeySpaces() {
  }
}
