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

package io.treepath.node.dom;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.treepath.api.NodeKind;
import io.treepath.api.XmlNode;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;

import javax.xml.XMLConstants;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link XmlNode} adapter over a W3C DOM node. Two adapters are equal iff they wrap the same DOM
 * node, so adapters can be created freely while walking the tree.
 */
public final class DomNode implements XmlNode {

  /** The wrapped DOM node. */
  private final Node node;

  /** Kind of the wrapped node. */
  private final NodeKind kind;

  private DomNode(final Node node, final NodeKind kind) {
    this.node = node;
    this.kind = kind;
  }

  /**
   * Wrap a DOM node.
   *
   * @param node the DOM node
   * @return the adapter
   * @throws IllegalArgumentException if the node kind has no XPath counterpart (e.g. a DTD)
   */
  public static DomNode wrap(final Node node) {
    checkNotNull(node);
    final NodeKind kind = kindOf(node);
    if (kind == null) {
      throw new IllegalArgumentException("Unsupported DOM node type: " + node.getNodeType());
    }
    return new DomNode(node, kind);
  }

  private static @Nullable NodeKind kindOf(final Node node) {
    switch (node.getNodeType()) {
      case Node.DOCUMENT_NODE:
        return NodeKind.DOCUMENT;
      case Node.ELEMENT_NODE:
        return NodeKind.ELEMENT;
      case Node.TEXT_NODE:
        return NodeKind.TEXT;
      case Node.CDATA_SECTION_NODE:
        return NodeKind.CDATA;
      case Node.COMMENT_NODE:
        return NodeKind.COMMENT;
      case Node.PROCESSING_INSTRUCTION_NODE:
        return NodeKind.PROCESSING_INSTRUCTION;
      case Node.ATTRIBUTE_NODE:
        return isNamespaceDeclaration(node) ? NodeKind.NAMESPACE : NodeKind.ATTRIBUTE;
      default:
        return null;
    }
  }

  private static boolean isNamespaceDeclaration(final Node attribute) {
    final String name = attribute.getNodeName();
    return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())
        || XMLConstants.XMLNS_ATTRIBUTE.equals(name) || name.startsWith("xmlns:");
  }

  /**
   * Get the wrapped DOM node.
   *
   * @return the DOM node
   */
  public Node unwrap() {
    return node;
  }

  @Override
  public NodeKind getKind() {
    return kind;
  }

  @Override
  public @Nullable XmlNode getParent() {
    final Node parent =
        kind == NodeKind.ATTRIBUTE ? ((Attr) node).getOwnerElement() : node.getParentNode();
    return parent == null ? null : wrap(parent);
  }

  @Override
  public List<XmlNode> getChildren() {
    if (!kind.isContainer()) {
      return ImmutableList.of();
    }
    final NodeList children = node.getChildNodes();
    final ImmutableList.Builder<XmlNode> builder = ImmutableList.builder();
    for (int i = 0, length = children.getLength(); i < length; i++) {
      final Node child = children.item(i);
      if (kindOf(child) != null) {
        builder.add(wrap(child));
      }
    }
    return builder.build();
  }

  @Override
  public List<XmlNode> getAttributes() {
    if (kind != NodeKind.ELEMENT) {
      return ImmutableList.of();
    }
    final NamedNodeMap attributes = node.getAttributes();
    final ImmutableList.Builder<XmlNode> builder = ImmutableList.builder();
    for (int i = 0, length = attributes.getLength(); i < length; i++) {
      final Node attribute = attributes.item(i);
      if (!isNamespaceDeclaration(attribute)) {
        builder.add(wrap(attribute));
      }
    }
    return builder.build();
  }

  @Override
  public String getName() {
    switch (kind) {
      case ELEMENT:
      case ATTRIBUTE:
      case NAMESPACE:
        return node.getNodeName();
      case PROCESSING_INSTRUCTION:
        return ((ProcessingInstruction) node).getTarget();
      default:
        return "";
    }
  }

  @Override
  public String getLocalName() {
    switch (kind) {
      case ELEMENT:
      case ATTRIBUTE:
      case NAMESPACE:
        final String localName = node.getLocalName();
        if (localName != null) {
          return localName;
        }
        // Not namespace aware.
        final String name = node.getNodeName();
        return name.substring(name.indexOf(':') + 1);
      case PROCESSING_INSTRUCTION:
        return ((ProcessingInstruction) node).getTarget();
      default:
        return "";
    }
  }

  @Override
  public @Nullable String getNamespacePrefix() {
    if (kind != NodeKind.ELEMENT && kind != NodeKind.ATTRIBUTE) {
      return null;
    }
    final String prefix = node.getPrefix();
    if (prefix != null) {
      return prefix;
    }
    final String name = node.getNodeName();
    final int colon = name.indexOf(':');
    return colon > 0 ? name.substring(0, colon) : null;
  }

  @Override
  public @Nullable String getNamespaceUri() {
    if (kind != NodeKind.ELEMENT && kind != NodeKind.ATTRIBUTE) {
      return null;
    }
    return node.getNamespaceURI();
  }

  @Override
  public @Nullable String getAttributeValue(final String name) {
    if (kind != NodeKind.ELEMENT) {
      return null;
    }
    final Attr attribute = ((Element) node).getAttributeNode(name);
    return attribute == null ? null : attribute.getValue();
  }

  @Override
  public String getText() {
    switch (kind) {
      case DOCUMENT:
        final Element root = ((Document) node).getDocumentElement();
        return root == null ? "" : root.getTextContent();
      case ELEMENT:
        return node.getTextContent();
      case ATTRIBUTE:
      case NAMESPACE:
        return ((Attr) node).getValue();
      default:
        final String value = node.getNodeValue();
        return value == null ? "" : value;
    }
  }

  @Override
  public Object getIdentity() {
    return node;
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return other instanceof DomNode && ((DomNode) other).node == node;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(node);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("name", getName()).toString();
  }
}
