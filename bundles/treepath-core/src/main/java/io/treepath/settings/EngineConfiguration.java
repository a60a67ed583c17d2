/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.treepath.settings;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Holds the settings of an {@link io.treepath.xpath.XPathEngine}.
 * <p>
 * Defaults may be overridden by system properties, read whenever a {@link Builder} is created:
 * <ul>
 *   <li>{@code treepath.xpath.parseCacheSize} - capacity of the parse cache (default 100)</li>
 *   <li>{@code treepath.xpath.compileCacheSize} - capacity of the compile cache (default 1000)</li>
 *   <li>{@code treepath.xpath.backend} - {@code closures} or {@code generated_source}</li>
 *   <li>{@code treepath.xpath.logSource} - log generated Java source at DEBUG level</li>
 * </ul>
 * Malformed property values are ignored with a warning.
 */
public final class EngineConfiguration {

  private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfiguration.class);

  /** Default capacity of the parse cache. */
  public static final int DEFAULT_PARSE_CACHE_SIZE = 100;

  /** Default capacity of the compile cache. */
  public static final int DEFAULT_COMPILE_CACHE_SIZE = 1000;

  /** Default backend. */
  public static final CompilerBackend DEFAULT_BACKEND = CompilerBackend.CLOSURES;

  static final String PARSE_CACHE_SIZE_PROPERTY = "treepath.xpath.parseCacheSize";

  static final String COMPILE_CACHE_SIZE_PROPERTY = "treepath.xpath.compileCacheSize";

  static final String BACKEND_PROPERTY = "treepath.xpath.backend";

  static final String LOG_SOURCE_PROPERTY = "treepath.xpath.logSource";

  private final int parseCacheSize;

  private final int compileCacheSize;

  private final CompilerBackend backend;

  private final boolean logGeneratedSource;

  private EngineConfiguration(final Builder builder) {
    parseCacheSize = builder.parseCacheSize;
    compileCacheSize = builder.compileCacheSize;
    backend = builder.backend;
    logGeneratedSource = builder.logGeneratedSource;
  }

  /**
   * Get the default configuration, including system property overrides.
   *
   * @return the configuration
   */
  public static EngineConfiguration defaults() {
    return new Builder().build();
  }

  /**
   * Get a new builder, initialized with the defaults.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public int getParseCacheSize() {
    return parseCacheSize;
  }

  public int getCompileCacheSize() {
    return compileCacheSize;
  }

  public CompilerBackend getBackend() {
    return backend;
  }

  public boolean isLogGeneratedSource() {
    return logGeneratedSource;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("parseCacheSize", parseCacheSize)
                      .add("compileCacheSize", compileCacheSize)
                      .add("backend", backend)
                      .add("logGeneratedSource", logGeneratedSource)
                      .toString();
  }

  private static int intProperty(final String name, final int defaultValue) {
    final @Nullable String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      final int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
    } catch (final NumberFormatException e) {
      LOGGER.debug("Not a number: {}", value, e);
    }
    LOGGER.warn("Ignoring invalid value '{}' of system property {}, using {}", value, name,
        defaultValue);
    return defaultValue;
  }

  private static CompilerBackend backendProperty() {
    final @Nullable String value = System.getProperty(BACKEND_PROPERTY);
    if (value == null) {
      return DEFAULT_BACKEND;
    }
    try {
      return CompilerBackend.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (final IllegalArgumentException e) {
      LOGGER.warn("Ignoring invalid value '{}' of system property {}, using {}", value,
          BACKEND_PROPERTY, DEFAULT_BACKEND);
      return DEFAULT_BACKEND;
    }
  }

  /**
   * Builder to create an {@link EngineConfiguration}.
   */
  public static final class Builder {

    private int parseCacheSize;

    private int compileCacheSize;

    private CompilerBackend backend;

    private boolean logGeneratedSource;

    /**
     * Constructor, reading the system property overrides.
     */
    public Builder() {
      parseCacheSize = intProperty(PARSE_CACHE_SIZE_PROPERTY, DEFAULT_PARSE_CACHE_SIZE);
      compileCacheSize = intProperty(COMPILE_CACHE_SIZE_PROPERTY, DEFAULT_COMPILE_CACHE_SIZE);
      backend = backendProperty();
      logGeneratedSource = Boolean.getBoolean(LOG_SOURCE_PROPERTY);
    }

    /**
     * Set the capacity of the parse cache.
     *
     * @param parseCacheSize number of cached syntax trees
     * @return reference to the builder object
     */
    public Builder parseCacheSize(final @Positive int parseCacheSize) {
      checkArgument(parseCacheSize > 0, "parseCacheSize must be > 0!");
      this.parseCacheSize = parseCacheSize;
      return this;
    }

    /**
     * Set the capacity of the compile cache.
     *
     * @param compileCacheSize number of cached compiled queries
     * @return reference to the builder object
     */
    public Builder compileCacheSize(final @Positive int compileCacheSize) {
      checkArgument(compileCacheSize > 0, "compileCacheSize must be > 0!");
      this.compileCacheSize = compileCacheSize;
      return this;
    }

    /**
     * Set the compiler backend.
     *
     * @param backend the backend
     * @return reference to the builder object
     */
    public Builder backend(final CompilerBackend backend) {
      this.backend = checkNotNull(backend);
      return this;
    }

    /**
     * Log the generated Java source of every query compiled by the
     * {@link CompilerBackend#GENERATED_SOURCE} backend.
     *
     * @param logGeneratedSource {@code true} to log
     * @return reference to the builder object
     */
    public Builder logGeneratedSource(final boolean logGeneratedSource) {
      this.logGeneratedSource = logGeneratedSource;
      return this;
    }

    /**
     * Create the configuration.
     *
     * @return the configuration
     */
    public EngineConfiguration build() {
      return new EngineConfiguration(this);
    }
  }
}
