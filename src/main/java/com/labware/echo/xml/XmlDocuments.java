package com.labware.echo.xml;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import com.labware.echo.exception.MalformedXmlException;

/**
 * XML plumbing: DOM parse, StAX serialization and child element lookup.
 */
public final class XmlDocuments {

    private XmlDocuments() {
        // Utility class
    }

    /**
     * Parses raw bytes into a DOM document. DOCTYPE declarations are rejected.
     */
    public static Document parse(byte[] raw) {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            // Report fatal errors by exception only, not on stderr
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(raw));
        } catch (SAXException e) {
            throw new MalformedXmlException("Input is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedXmlException("Input could not be read as XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Serializes whatever {@code body} writes, prefixed by the XML declaration
     * when requested. Line breaks are always {@code \n}.
     */
    public static byte[] toBytes(XmlWriteOptions options, StreamBody body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            Writer writer = new OutputStreamWriter(out, options.getEncoding());
            if (options.isXmlDeclaration()) {
                writer.write("<?xml version=\"1.0\" encoding=\"" + options.getEncoding().name() + "\"?>\n");
            }
            XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(writer);
            body.writeTo(xml);
            xml.writeEndDocument();
            xml.flush();
            if (options.isIndent()) {
                writer.write("\n");
            }
            writer.flush();
            xml.close();
            return out.toByteArray();
        } catch (XMLStreamException | IOException e) {
            throw new IllegalStateException("Failed to serialize XML document", e);
        }
    }

    /**
     * Direct element children with the given tag, in document order.
     */
    public static List<Element> childElements(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element child && tag.equals(child.getTagName())) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Writes the content of one document.
     */
    @FunctionalInterface
    public interface StreamBody {
        void writeTo(XMLStreamWriter writer) throws XMLStreamException;
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        return factory;
    }
}
