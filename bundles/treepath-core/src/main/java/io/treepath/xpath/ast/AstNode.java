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

package io.treepath.xpath.ast;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable node of the query syntax tree. Equality is structural, so that trees parsed from
 * equal queries can serve as cache keys.
 */
public final class AstNode {

  private final AstType type;

  private final ImmutableList<AstNode> children;

  private final @Nullable Object value;

  /** Hash code, computed once. */
  private final int hash;

  private AstNode(final AstType type, final @Nullable Object value,
      final ImmutableList<AstNode> children) {
    this.type = checkNotNull(type);
    this.value = value;
    this.children = children;
    hash = Objects.hash(type, value, children);
  }

  /**
   * Create an interior node without a value.
   *
   * @param type node type
   * @param children the children
   * @return the node
   */
  public static AstNode of(final AstType type, final AstNode... children) {
    return new AstNode(type, null, ImmutableList.copyOf(children));
  }

  /**
   * Create an interior node without a value.
   *
   * @param type node type
   * @param children the children
   * @return the node
   */
  public static AstNode of(final AstType type, final List<AstNode> children) {
    return new AstNode(type, null, ImmutableList.copyOf(children));
  }

  /**
   * Create a node carrying a value and children, e.g. a step or a function call.
   *
   * @param type node type
   * @param value the value
   * @param children the children
   * @return the node
   */
  public static AstNode withValue(final AstType type, final @Nullable Object value,
      final List<AstNode> children) {
    return new AstNode(type, value, ImmutableList.copyOf(children));
  }

  /**
   * Create a leaf.
   *
   * @param type node type
   * @param value the value
   * @return the node
   */
  public static AstNode leaf(final AstType type, final @Nullable Object value) {
    return new AstNode(type, value, ImmutableList.of());
  }

  public AstType getType() {
    return type;
  }

  public ImmutableList<AstNode> getChildren() {
    return children;
  }

  public AstNode getChild(final int index) {
    return children.get(index);
  }

  public @Nullable Object getValue() {
    return value;
  }

  /**
   * Get the value as a string.
   *
   * @return the value
   * @throws IllegalStateException if the node has no value
   */
  public String getStringValue() {
    if (value == null) {
      throw new IllegalStateException(type + " node has no value");
    }
    return value.toString();
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AstNode)) {
      return false;
    }
    final AstNode other = (AstNode) obj;
    return hash == other.hash && type == other.type && Objects.equals(value, other.value)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /**
   * Renders the tree as an s-expression, e.g. {@code (relative-path (axis child (test a)))}.
   */
  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    appendTo(builder);
    return builder.toString();
  }

  private void appendTo(final StringBuilder builder) {
    builder.append('(').append(type.label());
    if (value != null) {
      builder.append(' ');
      if (type == AstType.STRING) {
        builder.append('"').append(value).append('"');
      } else {
        builder.append(value);
      }
    }
    for (final AstNode child : children) {
      builder.append(' ');
      child.appendTo(builder);
    }
    builder.append(')');
  }
}
