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

package io.treepath;

import io.treepath.api.NodeKind;
import io.treepath.api.NodeSet;
import io.treepath.api.XmlNode;
import io.treepath.exception.TreepathException;
import io.treepath.node.dom.DomDocuments;
import io.treepath.node.dom.DomNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Documents and helpers shared by the tests.
 */
public final class XmlTestHelper {

  /** Small tree used for axis tests. */
  public static final String SIMPLE = "<root><a><b/><b/></a></root>";

  /** A library with ids, attributes and text. */
  public static final String LIBRARY = "<library>"
      + "<book id=\"b1\" year=\"1999\"><title>XPath</title><price>10</price></book>"
      + "<book><title>Java</title><price>25.5</price></book>"
      + "<book id=\"b3\" year=\"2011\"><title>XML</title><price>4.5</price></book>"
      + "</library>";

  /** Items with prices in attributes. */
  public static final String SHOP = "<shop>"
      + "<item price=\"3\" name=\"pen\"/>"
      + "<item price=\"7\" name=\"ink\"/>"
      + "<item price=\"20\" name=\"book\"/>"
      + "</shop>";

  /** Mixed content with comments, processing instructions and CDATA. */
  public static final String MIXED = "<doc xml:lang=\"en-GB\">"
      + "<p>one<!--note--><?render fast?><![CDATA[two]]></p>"
      + "<p>  three   four </p>"
      + "</doc>";

  /** Elements in two namespaces. */
  public static final String NAMESPACED = "<r xmlns=\"urn:default\" xmlns:x=\"urn:x\">"
      + "<x:e>first</x:e><e>second</e><x:E>third</x:E>"
      + "</r>";

  private XmlTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Parse a document.
   *
   * @param xml the document
   * @return the document node
   * @throws TreepathException if the document is malformed
   */
  public static DomNode parse(final String xml) throws TreepathException {
    return DomDocuments.parse(xml);
  }

  /**
   * Get the document element of a document node.
   *
   * @param document the document
   * @return the first element child
   */
  public static XmlNode documentElement(final XmlNode document) {
    for (final XmlNode child : document.getChildren()) {
      if (child.getKind() == NodeKind.ELEMENT) {
        return child;
      }
    }
    throw new IllegalArgumentException("No document element");
  }

  /**
   * Get the names of the nodes, in node-set order.
   *
   * @param nodes the nodes
   * @return the names
   */
  public static List<String> names(final NodeSet nodes) {
    final List<String> names = new ArrayList<>();
    for (final XmlNode node : nodes) {
      names.add(node.getName());
    }
    return names;
  }

  /**
   * Get the string-values of the nodes, in node-set order.
   *
   * @param nodes the nodes
   * @return the string-values
   */
  public static List<String> texts(final NodeSet nodes) {
    final List<String> texts = new ArrayList<>();
    for (final XmlNode node : nodes) {
      texts.add(node.getText());
    }
    return texts;
  }
}
