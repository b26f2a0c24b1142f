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
import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closeables;
import com.google.common.io.Resources;

import org.kiji.recipes.KeySpaceConfig;

/**
 * Connection settings of a Cassandra key space.
 *
 * <p>
 *   Settings are read from properties layered over the classpath resource
 *   {@value #DEFAULTS_RESOURCE}:
 * </p>
 *
 * <ul>
 *   <li>{@value #CONTACT_POINTS_PROPERTY}: comma separated host names.</li>
 *   <li>{@value #PORT_PROPERTY}: native protocol port.</li>
 *   <li>{@value #KEYSPACE_PROPERTY}: key space the session is bound to.</li>
 *   <li>the key space defaults read by {@link KeySpaceConfig#fromProperties(Properties)}.</li>
 * </ul>
 */
@Immutable
public final class CassandraConfiguration {
  public static final String DEFAULTS_RESOURCE =
      "org/kiji/recipes/cassandra/recipes-default.properties";

  public static final String CONTACT_POINTS_PROPERTY = "kiji.recipes.cassandra.contact-points";
  public static final String PORT_PROPERTY = "kiji.recipes.cassandra.port";
  public static final String KEYSPACE_PROPERTY = "kiji.recipes.cassandra.keyspace";

  private static final Splitter HOST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final ImmutableList<String> mContactPoints;
  private final int mPort;
  private final String mKeyspace;
  private final KeySpaceConfig mKeySpaceConfig;

  /**
   * @param contactPoints host names of the cluster nodes to contact first.
   * @param port of the native protocol.
   * @param keyspace the session is bound to.
   * @param keySpaceConfig default options and debug flag of the key space.
   */
  public CassandraConfiguration(
      final List<String> contactPoints,
      final int port,
      final String keyspace,
      final KeySpaceConfig keySpaceConfig
  ) {
    Preconditions.checkArgument(!contactPoints.isEmpty(), "No Cassandra contact point.");
    Preconditions.checkArgument(port > 0 && port < 65536, "Invalid Cassandra port: %s", port);
    mContactPoints = ImmutableList.copyOf(contactPoints);
    mPort = port;
    mKeyspace = Preconditions.checkNotNull(keyspace);
    mKeySpaceConfig = Preconditions.checkNotNull(keySpaceConfig);
  }

  /**
   * Loads the settings from the defaults resource, overridden by the given properties.
   *
   * @param overrides properties taking precedence over the defaults.
   * @return the settings.
   * @throws IOException if the defaults resource can not be read.
   */
  public static CassandraConfiguration load(final Properties overrides) throws IOException {
    final Properties properties = loadDefaults();
    properties.putAll(overrides);
    return fromProperties(properties);
  }

  /**
   * @param properties with every connection setting.
   * @return the settings.
   */
  public static CassandraConfiguration fromProperties(final Properties properties) {
    final String port = required(properties, PORT_PROPERTY);
    final int parsedPort;
    try {
      parsedPort = Integer.parseInt(port);
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException(String.format(
          "Property '%s' must be an integer, got '%s'.", PORT_PROPERTY, port), nfe);
    }
    return new CassandraConfiguration(
        HOST_SPLITTER.splitToList(required(properties, CONTACT_POINTS_PROPERTY)),
        parsedPort,
        required(properties, KEYSPACE_PROPERTY),
        KeySpaceConfig.fromProperties(properties));
  }

  /**
   * @return the properties of the defaults resource.
   * @throws IOException if the resource can not be read.
   */
  private static Properties loadDefaults() throws IOException {
    final Properties properties = new Properties();
    final InputStream input =
        Resources.getResource(CassandraConfiguration.class, "/" + DEFAULTS_RESOURCE).openStream();
    try {
      properties.load(input);
    } finally {
      Closeables.closeQuietly(input);
    }
    return properties;
  }

  /**
   * @param properties to read.
   * @param key of the property.
   * @return the trimmed value of the property.
   */
  private static String required(final Properties properties, final String key) {
    final String value = properties.getProperty(key);
    Preconditions.checkArgument(value != null && !value.trim().isEmpty(),
        "Missing property '%s'.", key);
    return value.trim();
  }

  /** @return the host names of the nodes to contact first. */
  public ImmutableList<String> getContactPoints() {
    return mContactPoints;
  }

  /** @return the native protocol port. */
  public int getPort() {
    return mPort;
  }

  /** @return the key space name. */
  public String getKeyspace() {
    return mKeyspace;
  }

  /** @return the default options and debug flag of the key space. */
  public KeySpaceConfig getKeySpaceConfig() {
    return mKeySpaceConfig;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(CassandraConfiguration.class)
        .add("contact_points", mContactPoints)
        .add("port", mPort)
        .add("keyspace", mKeyspace)
        .add("config", mKeySpaceConfig)
        .toString();
  }
}
