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

package io.treepath.xpath.runtime;

import io.treepath.api.NodeKind;
import io.treepath.api.XmlNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Axis walks. Every axis delivers its nodes in axis order: document order for forward axes, nearest
 * first for reverse axes.
 */
public final class Axes {

  private Axes() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Select all nodes on an axis of a context node.
   *
   * @param axis the axis
   * @param node the context node
   * @return the nodes in axis order
   */
  public static List<XmlNode> select(final Axis axis, final XmlNode node) {
    return switch (axis) {
      case CHILD -> node.getChildren();
      case DESCENDANT -> descendant(node, false);
      case DESCENDANT_OR_SELF -> descendant(node, true);
      case PARENT -> parent(node);
      case ANCESTOR -> ancestor(node, false);
      case ANCESTOR_OR_SELF -> ancestor(node, true);
      case FOLLOWING_SIBLING -> followingSibling(node);
      case PRECEDING_SIBLING -> precedingSibling(node);
      case FOLLOWING -> following(node);
      case PRECEDING -> preceding(node);
      case ATTRIBUTE -> node.getAttributes();
      case SELF -> Collections.singletonList(node);
      case NAMESPACE -> throw new IllegalStateException("The namespace axis is not supported.");
    };
  }

  private static List<XmlNode> descendant(final XmlNode node, final boolean includeSelf) {
    final List<XmlNode> result = new ArrayList<>();
    if (includeSelf) {
      result.add(node);
    }
    addDescendants(node, result);
    return result;
  }

  private static void addDescendants(final XmlNode node, final List<XmlNode> result) {
    for (final XmlNode child : node.getChildren()) {
      result.add(child);
      addDescendants(child, result);
    }
  }

  private static List<XmlNode> parent(final XmlNode node) {
    final XmlNode parent = node.getParent();
    return parent == null ? Collections.emptyList() : Collections.singletonList(parent);
  }

  private static List<XmlNode> ancestor(final XmlNode node, final boolean includeSelf) {
    final List<XmlNode> result = new ArrayList<>();
    if (includeSelf) {
      result.add(node);
    }
    for (XmlNode current = node.getParent(); current != null; current = current.getParent()) {
      result.add(current);
    }
    return result;
  }

  private static List<XmlNode> followingSibling(final XmlNode node) {
    final XmlNode parent = node.getParent();
    if (parent == null || isAttributeOrNamespace(node)) {
      return Collections.emptyList();
    }
    final List<XmlNode> siblings = parent.getChildren();
    final int index = siblings.indexOf(node);
    return new ArrayList<>(siblings.subList(index + 1, siblings.size()));
  }

  private static List<XmlNode> precedingSibling(final XmlNode node) {
    final XmlNode parent = node.getParent();
    if (parent == null || isAttributeOrNamespace(node)) {
      return Collections.emptyList();
    }
    final List<XmlNode> siblings = parent.getChildren();
    final List<XmlNode> result = new ArrayList<>(siblings.subList(0, siblings.indexOf(node)));
    Collections.reverse(result);
    return result;
  }

  private static List<XmlNode> following(final XmlNode node) {
    final List<XmlNode> result = new ArrayList<>();
    XmlNode current = node;
    if (isAttributeOrNamespace(node)) {
      // The owner's content follows its attributes.
      current = node.getParent();
      if (current == null) {
        return result;
      }
      addDescendants(current, result);
    }
    for (; current != null; current = current.getParent()) {
      for (final XmlNode sibling : followingSibling(current)) {
        result.add(sibling);
        addDescendants(sibling, result);
      }
    }
    return result;
  }

  private static List<XmlNode> preceding(final XmlNode node) {
    final List<XmlNode> result = new ArrayList<>();
    XmlNode current = isAttributeOrNamespace(node) ? node.getParent() : node;
    for (; current != null; current = current.getParent()) {
      for (final XmlNode sibling : precedingSibling(current)) {
        final List<XmlNode> subtree = descendant(sibling, true);
        Collections.reverse(subtree);
        result.addAll(subtree);
      }
    }
    return result;
  }

  private static boolean isAttributeOrNamespace(final XmlNode node) {
    return node.getKind() == NodeKind.ATTRIBUTE || node.getKind() == NodeKind.NAMESPACE;
  }
}
