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

package io.treepath.api;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orders nodes of one tree in document order. Attributes of an element follow the element and
 * precede its children. Nodes of unrelated trees are ordered by tree, in the order the trees were
 * first compared.
 */
public final class DocumentOrder implements Comparator<XmlNode> {

  /** Shared instance. */
  public static final DocumentOrder INSTANCE = new DocumentOrder();

  private static final AtomicLong TREE_COUNTER = new AtomicLong();

  /** Sequence number per tree, keyed weakly by the identity of the root. */
  private static final LoadingCache<Object, Long> TREE_SEQUENCE =
      CacheBuilder.newBuilder().weakKeys().build(new CacheLoader<Object, Long>() {
        @Override
        public Long load(final Object root) {
          return TREE_COUNTER.incrementAndGet();
        }
      });

  private DocumentOrder() {
  }

  @Override
  public int compare(final XmlNode first, final XmlNode second) {
    if (first.equals(second)) {
      return 0;
    }
    final List<XmlNode> firstPath = pathFromRoot(first);
    final List<XmlNode> secondPath = pathFromRoot(second);
    if (!firstPath.get(0).equals(secondPath.get(0))) {
      return Long.compare(TREE_SEQUENCE.getUnchecked(firstPath.get(0).getIdentity()),
          TREE_SEQUENCE.getUnchecked(secondPath.get(0).getIdentity()));
    }

    // Descend while both paths share the ancestor.
    int depth = 1;
    final int common = Math.min(firstPath.size(), secondPath.size());
    while (depth < common && firstPath.get(depth).equals(secondPath.get(depth))) {
      depth++;
    }
    if (depth == firstPath.size()) {
      // first is an ancestor of second
      return -1;
    }
    if (depth == secondPath.size()) {
      return 1;
    }
    return compareSiblings(firstPath.get(depth - 1), firstPath.get(depth), secondPath.get(depth));
  }

  private static int compareSiblings(final XmlNode parent, final XmlNode first,
      final XmlNode second) {
    final boolean firstIsAttribute = first.getKind() == NodeKind.ATTRIBUTE;
    final boolean secondIsAttribute = second.getKind() == NodeKind.ATTRIBUTE;
    if (firstIsAttribute != secondIsAttribute) {
      return firstIsAttribute ? -1 : 1;
    }
    final List<XmlNode> siblings =
        firstIsAttribute ? parent.getAttributes() : parent.getChildren();
    return Integer.compare(siblings.indexOf(first), siblings.indexOf(second));
  }

  private static List<XmlNode> pathFromRoot(final XmlNode node) {
    final List<XmlNode> path = new ArrayList<>();
    for (XmlNode current = node; current != null; current = current.getParent()) {
      path.add(current);
    }
    Collections.reverse(path);
    return path;
  }
}
