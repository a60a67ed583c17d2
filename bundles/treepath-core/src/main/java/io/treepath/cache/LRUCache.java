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

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A bounded LRU cache, based on an access-ordered {@code LinkedHashMap}. Inserting beyond the
 * capacity drops exactly the least recently used entry. All map accesses are guarded by the cache's
 * monitor, loaders of {@link #getOrSet(Object, ValueLoader)} run outside of it.
 */
public final class LRUCache<K, V> implements Cache<K, V> {

  /**
   * Capacity of the cache. Number of stored entries.
   */
  private final int capacity;

  /**
   * The collection to hold the entries, in access order.
   */
  private final Map<K, V> map;

  /**
   * Creates a new LRU cache.
   *
   * @param capacity maximum number of entries
   */
  public LRUCache(final @Positive int capacity) {
    checkArgument(capacity > 0, "capacity must be > 0: %s", capacity);
    this.capacity = capacity;
    map = new LinkedHashMap<>(16, 0.75f, true) {
      private static final long serialVersionUID = 1;

      @Override
      protected boolean removeEldestEntry(final Map.@Nullable Entry<K, V> eldest) {
        return size() > LRUCache.this.capacity;
      }
    };
  }

  /**
   * Retrieves an entry from the cache.<br>
   * The retrieved entry becomes the MRU (most recently used) entry.
   *
   * @param key the key whose associated value is to be returned.
   * @return the value associated to this key, or {@code null} if no value with this key exists in
   *         the cache
   */
  @Override
  public synchronized @Nullable V get(final K key) {
    return map.get(checkNotNull(key));
  }

  /**
   *
   * Adds an entry to this cache. If the cache is full, the LRU (least recently used) entry is
   * dropped.
   *
   * @param key the key with which the specified value is to be associated
   * @param value a value to be associated with the specified key
   */
  @Override
  public synchronized void put(final K key, final V value) {
    map.put(checkNotNull(key), checkNotNull(value));
  }

  @Override
  public synchronized boolean containsKey(final K key) {
    // containsKey() of an access-ordered LinkedHashMap does not reorder.
    return map.containsKey(checkNotNull(key));
  }

  @Override
  public <E extends Exception> V getOrSet(final K key, final ValueLoader<? extends V, E> loader)
      throws E {
    checkNotNull(key);
    checkNotNull(loader);
    synchronized (this) {
      final V cached = map.get(key);
      if (cached != null) {
        return cached;
      }
    }
    final V computed = checkNotNull(loader.load(), "loader returned null for %s", key);
    synchronized (this) {
      final V raced = map.get(key);
      if (raced != null) {
        return raced;
      }
      map.put(key, computed);
      return computed;
    }
  }

  /**
   * Clears the cache.
   */
  @Override
  public synchronized void clear() {
    map.clear();
  }

  /**
   * Returns the number of used entries in the cache.
   *
   * @return the number of entries currently in the cache.
   */
  @Override
  public synchronized int size() {
    return map.size();
  }

  public int capacity() {
    return capacity;
  }

  @Override
  public synchronized String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("capacity", capacity)
                      .add("size", map.size())
                      .toString();
  }
}
