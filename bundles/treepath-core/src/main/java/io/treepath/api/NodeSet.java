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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable, ordered set of nodes without duplicates (node identity as defined by
 * {@link XmlNode#equals(Object)}). Location paths produce node-sets in document order.
 */
public final class NodeSet implements Iterable<XmlNode> {

  private static final NodeSet EMPTY = new NodeSet(ImmutableList.of());

  /** The nodes, free of duplicates. */
  private final ImmutableList<XmlNode> nodes;

  private NodeSet(final ImmutableList<XmlNode> nodes) {
    this.nodes = nodes;
  }

  /**
   * Get the empty node-set.
   *
   * @return the empty node-set
   */
  public static NodeSet empty() {
    return EMPTY;
  }

  /**
   * Create a node-set holding a single node.
   *
   * @param node the node
   * @return singleton node-set
   */
  public static NodeSet of(final XmlNode node) {
    return new NodeSet(ImmutableList.of(checkNotNull(node)));
  }

  /**
   * Create a node-set from the given nodes, keeping the first occurrence of every node.
   *
   * @param nodes the nodes in the order they should keep
   * @return a new node-set
   */
  public static NodeSet copyOf(final Iterable<? extends XmlNode> nodes) {
    checkNotNull(nodes);
    if (nodes instanceof NodeSet) {
      return (NodeSet) nodes;
    }
    final Set<XmlNode> unique = new LinkedHashSet<>();
    for (final XmlNode node : nodes) {
      unique.add(checkNotNull(node));
    }
    return unique.isEmpty() ? EMPTY : new NodeSet(ImmutableList.copyOf(unique));
  }

  /**
   * Create a node-set in document order from the given nodes.
   *
   * @param nodes nodes in any order, possibly with duplicates
   * @return a new node-set in document order
   */
  public static NodeSet sorted(final Collection<? extends XmlNode> nodes) {
    final List<XmlNode> list = new ArrayList<>(new LinkedHashSet<XmlNode>(nodes));
    list.sort(DocumentOrder.INSTANCE);
    return list.isEmpty() ? EMPTY : new NodeSet(ImmutableList.copyOf(list));
  }

  /**
   * Get the node at a one-based position.
   *
   * @param position position, starting at {@code 1}
   * @return the node, or {@code null} if the position is out of range
   */
  public @Nullable XmlNode item(final @Positive int position) {
    if (position < 1 || position > nodes.size()) {
      return null;
    }
    return nodes.get(position - 1);
  }

  /**
   * Get the first node.
   *
   * @return first node, or {@code null} if empty
   */
  public @Nullable XmlNode first() {
    return nodes.isEmpty() ? null : nodes.get(0);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public boolean contains(final XmlNode node) {
    return nodes.contains(node);
  }

  /**
   * Get the union with another node-set, in document order.
   *
   * @param other the other node-set
   * @return the union
   */
  public NodeSet union(final NodeSet other) {
    final List<XmlNode> all = new ArrayList<>(nodes.size() + other.size());
    all.addAll(nodes);
    all.addAll(other.nodes);
    return sorted(all);
  }

  /**
   * Get this node-set sorted in document order.
   *
   * @return a node-set in document order
   */
  public NodeSet inDocumentOrder() {
    return sorted(nodes);
  }

  /**
   * Get the nodes as a list.
   *
   * @return immutable list view
   */
  public List<XmlNode> asList() {
    return nodes;
  }

  @Override
  public Iterator<XmlNode> iterator() {
    return nodes.iterator();
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return other instanceof NodeSet && nodes.equals(((NodeSet) other).nodes);
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("nodes", nodes).toString();
  }
}
