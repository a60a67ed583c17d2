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

import io.treepath.XmlTestHelper;
import io.treepath.api.NodeKind;
import io.treepath.api.XmlNode;
import io.treepath.exception.TreepathException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DomNodeTest {

  @Test
  public void testKindsAndText() throws TreepathException {
    final XmlNode document = XmlTestHelper.parse(XmlTestHelper.MIXED);
    assertEquals(NodeKind.DOCUMENT, document.getKind());
    assertNull(document.getParent());

    final XmlNode doc = XmlTestHelper.documentElement(document);
    final XmlNode p = doc.getChildren().get(0);
    final List<XmlNode> content = p.getChildren();
    assertEquals(4, content.size());
    assertEquals(NodeKind.TEXT, content.get(0).getKind());
    assertEquals(NodeKind.COMMENT, content.get(1).getKind());
    assertEquals(NodeKind.PROCESSING_INSTRUCTION, content.get(2).getKind());
    assertEquals(NodeKind.CDATA, content.get(3).getKind());

    assertEquals("note", content.get(1).getText());
    assertEquals("render", content.get(2).getName());
    assertEquals("fast", content.get(2).getText());
    assertEquals("two", content.get(3).getText());
    assertEquals("onetwo", p.getText());
    assertEquals("onetwo  three   four ", document.getText());
    assertEquals("", content.get(0).getName());
  }

  @Test
  public void testAttributes() throws TreepathException {
    final XmlNode item = XmlTestHelper.documentElement(XmlTestHelper.parse(XmlTestHelper.SHOP))
                                      .getChildren()
                                      .get(0);
    assertEquals(2, item.getAttributes().size());
    assertEquals("3", item.getAttributeValue("price"));
    assertNull(item.getAttributeValue("missing"));

    final XmlNode attribute = item.getAttributes().get(0);
    assertEquals(NodeKind.ATTRIBUTE, attribute.getKind());
    assertEquals(item, attribute.getParent());
    assertEquals(0, attribute.getChildren().size());
    assertEquals(0, attribute.getAttributes().size());
  }

  @Test
  public void testNamespaces() throws TreepathException {
    final XmlNode r =
        XmlTestHelper.documentElement(XmlTestHelper.parse(XmlTestHelper.NAMESPACED));
    // namespace declarations are no attributes
    assertEquals(0, r.getAttributes().size());
    assertEquals("urn:default", r.getNamespaceUri());
    assertNull(r.getNamespacePrefix());

    final XmlNode prefixed = r.getChildren().get(0);
    assertEquals("x:e", prefixed.getName());
    assertEquals("e", prefixed.getLocalName());
    assertEquals("x", prefixed.getNamespacePrefix());
    assertEquals("urn:x", prefixed.getNamespaceUri());
  }

  @Test
  public void testIdentity() throws TreepathException {
    final XmlNode document = XmlTestHelper.parse(XmlTestHelper.SIMPLE);
    final XmlNode root = XmlTestHelper.documentElement(document);
    final XmlNode a = root.getChildren().get(0);
    assertEquals(a, root.getChildren().get(0));
    assertEquals(a.hashCode(), root.getChildren().get(0).hashCode());
    assertNotEquals(a.getChildren().get(0), a.getChildren().get(1));
    assertEquals(root, a.getParent());
    assertSame(((DomNode) a).unwrap(), ((DomNode) root.getChildren().get(0)).unwrap());
  }

  @Test
  public void testParseStream() throws TreepathException {
    final XmlNode document = DomDocuments.parse(
        new ByteArrayInputStream("<x>y</x>".getBytes(StandardCharsets.UTF_8)));
    assertEquals("y", document.getText());
  }

  @Test
  public void testMalformedDocument() {
    assertThrows(TreepathException.class, () -> DomDocuments.parse("<open>"));
  }
}
