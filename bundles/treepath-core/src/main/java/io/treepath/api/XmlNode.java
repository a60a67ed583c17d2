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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Read-only view of a node in an XML tree, as consumed by the query engine. Implementations adapt
 * a concrete tree model (see {@link io.treepath.node.dom.DomNode}).
 *
 * <p>
 * {@link #equals(Object)} and {@link #hashCode()} must reflect node identity: two instances are
 * equal iff they denote the same node of the same tree.
 * </p>
 */
public interface XmlNode {

  /**
   * Get the kind of this node.
   *
   * @return node kind
   */
  NodeKind getKind();

  /**
   * Get the parent node. The parent of an attribute is its owner element.
   *
   * @return parent node, or {@code null} for the root
   */
  @Nullable
  XmlNode getParent();

  /**
   * Get the child nodes in document order. Attributes are not children.
   *
   * @return the children, empty for leaf nodes
   */
  List<XmlNode> getChildren();

  /**
   * Get the attributes of an element in document order, excluding namespace declarations.
   *
   * @return the attributes, empty for non-elements
   */
  List<XmlNode> getAttributes();

  /**
   * Get the qualified name ({@code prefix:local} or {@code local}).
   *
   * @return the name, the target for processing instructions, {@code ""} for unnamed nodes
   */
  String getName();

  /**
   * Get the local part of the name.
   *
   * @return local name, {@code ""} for unnamed nodes
   */
  String getLocalName();

  /**
   * Get the namespace prefix as written in the document.
   *
   * @return the prefix or {@code null}
   */
  @Nullable
  String getNamespacePrefix();

  /**
   * Get the namespace URI the node's name is bound to.
   *
   * @return the URI or {@code null}
   */
  @Nullable
  String getNamespaceUri();

  /**
   * Get the value of an attribute by its qualified name.
   *
   * @param name qualified attribute name
   * @return the value, or {@code null} if the element has no such attribute
   */
  @Nullable
  String getAttributeValue(String name);

  /**
   * Get the string-value of the node: the concatenated text descendants of documents and elements,
   * the value of attributes, the content of every other kind.
   *
   * @return string-value, never {@code null}
   */
  String getText();

  /**
   * Get the object behind this view. Equal nodes return the same instance, so it can serve as an
   * identity key for the underlying node.
   *
   * @return the underlying node
   */
  Object getIdentity();
}
