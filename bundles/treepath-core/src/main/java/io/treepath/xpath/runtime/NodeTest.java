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
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tests a node selected by an axis.
 */
@FunctionalInterface
public interface NodeTest {

  /**
   * Determines if the node passes the test.
   *
   * @param node the node
   * @return {@code true} if the node passes
   */
  boolean matches(XmlNode node);

  /**
   * Name test. Local names compare case-insensitively. With a prefix, the namespace URI of the node
   * must equal the URI the prefix is bound to, or, if the prefix is not bound, the node's prefix
   * must equal it. Without a prefix the namespace of the node is ignored.
   *
   * @param principalKind the principal node kind of the axis
   * @param prefix the prefix or {@code null}
   * @param namespaceUri the URI bound to the prefix, or {@code null}
   * @param localName the local name
   * @return the test
   */
  static NodeTest name(final NodeKind principalKind, final @Nullable String prefix,
      final @Nullable String namespaceUri, final String localName) {
    checkNotNull(principalKind);
    checkNotNull(localName);
    return node -> node.getKind() == principalKind && localName.equalsIgnoreCase(
        node.getLocalName()) && matchesNamespace(node, prefix, namespaceUri);
  }

  /**
   * Wildcard test, {@code *} or {@code prefix:*}.
   *
   * @param principalKind the principal node kind of the axis
   * @param prefix the prefix or {@code null} for {@code *}
   * @param namespaceUri the URI bound to the prefix, or {@code null}
   * @return the test
   */
  static NodeTest wildcard(final NodeKind principalKind, final @Nullable String prefix,
      final @Nullable String namespaceUri) {
    checkNotNull(principalKind);
    return node -> node.getKind() == principalKind
        && matchesNamespace(node, prefix, namespaceUri);
  }

  /**
   * The {@code node()} test.
   *
   * @return a test passing every node
   */
  static NodeTest anyNode() {
    return node -> true;
  }

  /**
   * The {@code text()} test, also passing CDATA sections.
   *
   * @return the test
   */
  static NodeTest text() {
    return node -> node.getKind() == NodeKind.TEXT || node.getKind() == NodeKind.CDATA;
  }

  /**
   * The {@code comment()} test.
   *
   * @return the test
   */
  static NodeTest comment() {
    return node -> node.getKind() == NodeKind.COMMENT;
  }

  /**
   * The {@code processing-instruction()} test.
   *
   * @param target the target the instruction must have, or {@code null} for any
   * @return the test
   */
  static NodeTest processingInstruction(final @Nullable String target) {
    return node -> node.getKind() == NodeKind.PROCESSING_INSTRUCTION
        && (target == null || target.equals(node.getName()));
  }

  private static boolean matchesNamespace(final XmlNode node, final @Nullable String prefix,
      final @Nullable String namespaceUri) {
    if (prefix == null) {
      return true;
    }
    if (namespaceUri != null) {
      return namespaceUri.equals(node.getNamespaceUri());
    }
    return prefix.equals(node.getNamespacePrefix());
  }
}
