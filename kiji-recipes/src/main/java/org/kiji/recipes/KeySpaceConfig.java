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

import java.util.Locale;
import java.util.Properties;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.datastax.driver.core.ConsistencyLevel;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Per key space configuration: the default options of every table and whether dispatched
 * statements are logged at INFO instead of DEBUG.
 */
@Immutable
public final class KeySpaceConfig {
  /** Property enabling statement logging at INFO. */
  public static final String DEBUG_PROPERTY = "kiji.recipes.debug";

  /** Property holding the default consistency level, for example {@code LOCAL_QUORUM}. */
  public static final String CONSISTENCY_PROPERTY = "kiji.recipes.consistency";

  /** Property holding the default time-to-live of written cells, in seconds. */
  public static final String TTL_PROPERTY = "kiji.recipes.ttl";

  /** Property holding the default result limit of reads. */
  public static final String LIMIT_PROPERTY = "kiji.recipes.limit";

  /** No default options, no debug logging. */
  public static final KeySpaceConfig DEFAULT = new KeySpaceConfig(Options.EMPTY, false);

  private final Options mDefaults;
  private final boolean mDebug;

  /**
   * @param defaults options every table of the key space starts from.
   * @param debug whether dispatched statements are logged at INFO.
   */
  public KeySpaceConfig(final Options defaults, final boolean debug) {
    mDefaults = Preconditions.checkNotNull(defaults);
    mDebug = debug;
  }

  /**
   * Reads a configuration from properties. Missing properties leave the matching option unset.
   *
   * @param properties to read.
   * @return the configuration.
   * @throws IllegalArgumentException if a property value can not be parsed.
   */
  public static KeySpaceConfig fromProperties(final Properties properties) {
    final Options.Builder builder = Options.builder();
    final String consistency = trimmed(properties, CONSISTENCY_PROPERTY);
    if (consistency != null) {
      builder.withConsistency(ConsistencyLevel.valueOf(consistency.toUpperCase(Locale.ROOT)));
    }
    final String ttl = trimmed(properties, TTL_PROPERTY);
    if (ttl != null) {
      builder.withTtl(parseInt(TTL_PROPERTY, ttl));
    }
    final String limit = trimmed(properties, LIMIT_PROPERTY);
    if (limit != null) {
      builder.withLimit(parseInt(LIMIT_PROPERTY, limit));
    }
    final boolean debug = Boolean.parseBoolean(trimmed(properties, DEBUG_PROPERTY));
    return new KeySpaceConfig(builder.build(), debug);
  }

  /**
   * @param properties to read.
   * @param key of the property.
   * @return the trimmed value, or null if the property is missing or blank.
   */
  @Nullable
  private static String trimmed(final Properties properties, final String key) {
    final String value = properties.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    return value.trim();
  }

  /**
   * @param key of the property, for error messages.
   * @param value to parse.
   * @return the parsed integer.
   */
  private static int parseInt(final String key, final String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException(
          String.format("Invalid integer '%s' for property '%s'.", value, key), nfe);
    }
  }

  /** @return the default options. */
  public Options getDefaults() {
    return mDefaults;
  }

  /** @return whether dispatched statements are logged at INFO. */
  public boolean isDebug() {
    return mDebug;
  }

  /**
   * @param options taking precedence over the current defaults.
   * @return a configuration with merged defaults.
   */
  public KeySpaceConfig withOptions(final Options options) {
    return new KeySpaceConfig(mDefaults.merge(options), mDebug);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(KeySpaceConfig.class)
        .add("defaults", mDefaults)
        .add("debug", mDebug)
        .toString();
  }
}
