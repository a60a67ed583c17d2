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

package io.treepath.cache;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Interface for all caches used by the engine. Implementations never fail on their own: the only
 * exceptions leaving a cache are the ones thrown by a {@link ValueLoader}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface Cache<K, V> {

  /**
   * Clearing the cache. That is removing all elements.
   */
  void clear();

  /**
   * Getting a value related to a given key. A hit marks the entry as most recently used.
   *
   * @param key the key for the requested value
   * @return the value, or {@code null} if the key is not cached
   */
  @Nullable
  V get(@NonNull K key);

  /**
   * Putting a key/value into the cache, replacing and refreshing an existing entry.
   *
   * @param key the key
   * @param value the value
   */
  void put(@NonNull K key, @NonNull V value);

  /**
   * Determines if the key is cached, without touching its recency.
   *
   * @param key the key
   * @return {@code true} if the key is cached
   */
  boolean containsKey(@NonNull K key);

  /**
   * Get the cached value for a key or compute, store and return it. If another caller stored a
   * value for the key while this one was computing, the stored value wins.
   *
   * @param key the key
   * @param loader computes the value on a miss
   * @param <E> the exception the loader may throw
   * @return the cached or computed value
   * @throws E if the loader fails, nothing is stored in that case
   */
  <E extends Exception> V getOrSet(@NonNull K key, ValueLoader<? extends V, E> loader) throws E;

  /**
   * Get the number of cached entries.
   *
   * @return number of entries
   */
  int size();
}
