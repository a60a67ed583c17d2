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

import io.treepath.exception.TreepathException;
import org.w3c.dom.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parses XML into namespace-aware DOM trees wrapped as {@link DomNode}s. CDATA sections are kept
 * apart from text and external entities are not resolved.
 */
public final class DomDocuments {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DomDocuments.class);

  /** Reports failures through the thrown exception instead of standard error. */
  private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
    @Override
    public void warning(final SAXParseException exception) {
      LOGGER.debug("XML parser warning: {}", exception.getMessage());
    }

    @Override
    public void error(final SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void fatalError(final SAXParseException exception) throws SAXException {
      throw exception;
    }
  };

  private DomDocuments() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Parse a document from a string.
   *
   * @param xml the document
   * @return the document node
   * @throws TreepathException if the document is not well-formed
   */
  public static DomNode parse(final String xml) throws TreepathException {
    checkNotNull(xml);
    return parse(new InputSource(new StringReader(xml)));
  }

  /**
   * Parse a document from a stream. The stream is not closed.
   *
   * @param input the document
   * @return the document node
   * @throws TreepathException if reading fails or the document is not well-formed
   */
  public static DomNode parse(final InputStream input) throws TreepathException {
    checkNotNull(input);
    return parse(new InputSource(input));
  }

  private static DomNode parse(final InputSource source) throws TreepathException {
    try {
      final DocumentBuilder builder = newFactory().newDocumentBuilder();
      builder.setErrorHandler(RETHROWING_HANDLER);
      final Document document = builder.parse(source);
      return DomNode.wrap(document);
    } catch (final ParserConfigurationException | SAXException | IOException e) {
      throw new TreepathException("Failed to parse XML document: " + e.getMessage(), e);
    }
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setCoalescing(false);
    factory.setIgnoringComments(false);
    factory.setExpandEntityReferences(true);
    factory.setXIncludeAware(false);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    return factory;
  }
}
