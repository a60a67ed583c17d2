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

import io.treepath.XmlTestHelper;
import io.treepath.exception.TreepathException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeSetTest {

  private XmlNode document;

  private XmlNode root;

  private XmlNode a;

  private XmlNode firstB;

  private XmlNode secondB;

  @BeforeEach
  public void setUp() throws TreepathException {
    document = XmlTestHelper.parse(XmlTestHelper.SIMPLE);
    root = XmlTestHelper.documentElement(document);
    a = root.getChildren().get(0);
    firstB = a.getChildren().get(0);
    secondB = a.getChildren().get(1);
  }

  @Test
  public void testNodesOfUnrelatedTreesStayGroupedByTree() throws TreepathException {
    final XmlNode otherRoot =
        XmlTestHelper.documentElement(XmlTestHelper.parse(XmlTestHelper.SIMPLE));
    final XmlNode otherA = otherRoot.getChildren().get(0);
    final XmlNode otherB = otherA.getChildren().get(0);

    final int order = DocumentOrder.INSTANCE.compare(a, otherA);
    assertTrue(order != 0);
    assertEquals(-order, DocumentOrder.INSTANCE.compare(otherA, a));
    assertEquals(order, DocumentOrder.INSTANCE.compare(firstB, otherB));
    assertEquals(order, DocumentOrder.INSTANCE.compare(root, otherB));

    final NodeSet sorted = NodeSet.sorted(Arrays.asList(otherB, secondB, otherRoot, a, otherA));
    final List<XmlNode> expected = order < 0
        ? List.of(a, secondB, otherRoot, otherA, otherB)
        : List.of(otherRoot, otherA, otherB, a, secondB);
    assertEquals(expected, sorted.asList());
  }

  @Test
  public void testSortedInDocumentOrder() {
    final NodeSet nodes = NodeSet.sorted(Arrays.asList(secondB, a, firstB, root, document));
    assertEquals(List.of(document, root, a, firstB, secondB), nodes.asList());
  }

  @Test
  public void testDuplicatesAreRemoved() {
    final NodeSet sorted = NodeSet.sorted(Arrays.asList(firstB, firstB, a, firstB));
    assertEquals(List.of(a, firstB), sorted.asList());

    final NodeSet copied = NodeSet.copyOf(Arrays.asList(secondB, firstB, secondB));
    assertEquals(List.of(secondB, firstB), copied.asList());
  }

  @Test
  public void testAdaptersOfTheSameNodeAreOneNode() {
    final XmlNode again = root.getChildren().get(0);
    assertEquals(a, again);
    assertEquals(1, NodeSet.copyOf(Arrays.asList(a, again)).size());
  }

  @Test
  public void testItem() {
    final NodeSet nodes = NodeSet.copyOf(Arrays.asList(firstB, secondB));
    assertSame(firstB, nodes.item(1));
    assertSame(secondB, nodes.item(2));
    assertNull(nodes.item(0));
    assertNull(nodes.item(3));
    assertSame(firstB, nodes.first());
    assertNull(NodeSet.empty().first());
  }

  @Test
  public void testUnion() {
    final NodeSet union = NodeSet.of(secondB).union(NodeSet.copyOf(Arrays.asList(a, secondB)));
    assertEquals(List.of(a, secondB), union.asList());
    assertTrue(union.contains(a));
    assertFalse(union.contains(firstB));
  }

  @Test
  public void testInDocumentOrder() {
    final NodeSet reversed = NodeSet.copyOf(Arrays.asList(secondB, firstB, a));
    assertEquals(List.of(a, firstB, secondB), reversed.inDocumentOrder().asList());
    assertEquals(NodeSet.copyOf(Arrays.asList(a, firstB, secondB)), reversed.inDocumentOrder());
  }

  @Test
  public void testAttributesPrecedeChildren() throws TreepathException {
    final XmlNode element =
        XmlTestHelper.documentElement(XmlTestHelper.parse("<e x=\"1\"><c/></e>"));
    final XmlNode attribute = element.getAttributes().get(0);
    final XmlNode child = element.getChildren().get(0);
    assertEquals(List.of(element, attribute, child),
        NodeSet.sorted(Arrays.asList(child, attribute, element)).asList());
    assertTrue(DocumentOrder.INSTANCE.compare(attribute, child) < 0);
    assertTrue(DocumentOrder.INSTANCE.compare(child, element) > 0);
    assertEquals(0, DocumentOrder.INSTANCE.compare(child, child));
  }

  @Test
  public void testEmpty() {
    assertTrue(NodeSet.empty().isEmpty());
    assertSame(NodeSet.empty(), NodeSet.copyOf(List.of()));
    assertEquals(0, NodeSet.sorted(List.of()).size());
  }
}
