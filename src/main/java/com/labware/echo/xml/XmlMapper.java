package com.labware.echo.xml;

import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import org.w3c.dom.Element;

import com.labware.echo.codec.ScalarCodec;
import com.labware.echo.exception.InvalidFieldValueException;
import com.labware.echo.exception.MalformedXmlException;
import com.labware.echo.exception.MissingRequiredFieldException;

/**
 * Generic bidirectional mapping between DOM elements and {@link XmlRecord}s,
 * driven entirely by an {@link XmlSchema}.
 *
 * Reading:
 * - attributes are looked up by raw name; an absent optional attribute yields the
 *   field default, an absent required one is a {@link MissingRequiredFieldException}
 * - list items are read in document order
 * - attributes and elements the schema does not declare are ignored
 *
 * Writing:
 * - attributes, then child elements, each in schema order
 * - optional attributes equal to their default are omitted
 * - a required attribute holding {@code null} is written only if its codec has
 *   a wire form for "absent"
 * - elements without children are written in empty-element form
 */
public class XmlMapper {

    public XmlRecord read(Element element, XmlSchema schema) {
        if (!schema.getTag().equals(element.getTagName())) {
            throw new MalformedXmlException(
                    "Expected element <" + schema.getTag() + "> but found <" + element.getTagName() + ">");
        }
        XmlRecord record = new XmlRecord(schema.getTag());
        for (XmlField field : schema.getFields()) {
            Object value = switch (field.getKind()) {
                case ATTRIBUTE -> readAttribute(element, schema, field);
                case ELEMENT -> readElement(element, schema, field);
                case ELEMENT_LIST -> readList(element, schema, field);
            };
            record.put(field.getName(), value);
        }
        return record;
    }

    /**
     * Serializes {@code record} as a standalone document. Attributes and child
     * elements are written in schema order.
     */
    public byte[] toBytes(XmlSchema schema, XmlRecord record, XmlWriteOptions options) {
        return XmlDocuments.toBytes(options, writer -> writeElement(writer, schema, record, 0, options));
    }

    private Object readAttribute(Element element, XmlSchema schema, XmlField field) {
        if (!element.hasAttribute(field.getRawName())) {
            if (field.isRequired()) {
                throw new MissingRequiredFieldException(schema.getTag(), field.getRawName());
            }
            return field.getDefaultValue();
        }
        String raw = element.getAttribute(field.getRawName());
        try {
            return field.getCodec().decode(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidFieldValueException(schema.getTag(), field.getRawName(), raw, e);
        }
    }

    private XmlRecord readElement(Element element, XmlSchema schema, XmlField field) {
        Element child = singleChild(element, schema, field.getRawName(), field.isRequired());
        return child == null ? null : read(child, field.getSchema());
    }

    private List<XmlRecord> readList(Element element, XmlSchema schema, XmlField field) {
        Element container = element;
        if (field.getWrapperTag() != null) {
            container = singleChild(element, schema, field.getWrapperTag(), field.isRequired());
            if (container == null) {
                return List.of();
            }
        }
        List<XmlRecord> items = new ArrayList<>();
        for (Element item : XmlDocuments.childElements(container, field.getRawName())) {
            items.add(read(item, field.getSchema()));
        }
        return items;
    }

    private Element singleChild(Element element, XmlSchema schema, String tag, boolean required) {
        List<Element> children = XmlDocuments.childElements(element, tag);
        if (children.size() > 1) {
            throw new MalformedXmlException(String.format("Expected 1 <%s> in <%s> but got %d.",
                    tag, schema.getTag(), children.size()));
        }
        if (children.isEmpty()) {
            if (required) {
                throw new MissingRequiredFieldException(schema.getTag(), tag);
            }
            return null;
        }
        return children.get(0);
    }

    private void writeElement(XMLStreamWriter writer, XmlSchema schema, XmlRecord record, int depth,
                              XmlWriteOptions options) throws XMLStreamException {
        if (depth > 0) {
            newline(writer, depth, options);
        }
        boolean hasChildren = hasChildren(schema, record);
        if (hasChildren) {
            writer.writeStartElement(schema.getTag());
        } else {
            writer.writeEmptyElement(schema.getTag());
        }
        for (XmlField field : schema.scalarFields()) {
            String encoded = encodeAttribute(schema, field, record.get(field.getName()));
            if (encoded != null) {
                writer.writeAttribute(field.getRawName(), encoded);
            }
        }
        for (XmlField field : schema.getFields()) {
            if (field.getKind() == XmlFieldKind.ELEMENT) {
                writeChild(writer, schema, field, record.getRecord(field.getName()), depth + 1, options);
            } else if (field.getKind() == XmlFieldKind.ELEMENT_LIST) {
                writeList(writer, field, record.getRecords(field.getName()), depth + 1, options);
            }
        }
        if (hasChildren) {
            newline(writer, depth, options);
            writer.writeEndElement();
        }
    }

    /**
     * @return the wire text, or {@code null} when the attribute is omitted
     */
    @SuppressWarnings("unchecked")
    private String encodeAttribute(XmlSchema schema, XmlField field, Object value) {
        ScalarCodec<Object> codec = (ScalarCodec<Object>) field.getCodec();
        if (value == null) {
            if (!field.isRequired()) {
                return null;
            }
            if (!codec.encodesAbsence()) {
                throw new MissingRequiredFieldException(schema.getTag(), field.getRawName());
            }
        } else if (!field.isRequired() && value.equals(field.getDefaultValue())) {
            return null;
        }
        try {
            return codec.encode(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidFieldValueException(schema.getTag(), field.getRawName(), String.valueOf(value), e);
        }
    }

    private void writeChild(XMLStreamWriter writer, XmlSchema schema, XmlField field, XmlRecord child, int depth,
                            XmlWriteOptions options) throws XMLStreamException {
        if (child == null) {
            if (field.isRequired()) {
                throw new MissingRequiredFieldException(schema.getTag(), field.getRawName());
            }
            return;
        }
        writeElement(writer, field.getSchema(), child, depth, options);
    }

    private void writeList(XMLStreamWriter writer, XmlField field, List<XmlRecord> items, int depth,
                           XmlWriteOptions options) throws XMLStreamException {
        if (field.getWrapperTag() == null) {
            for (XmlRecord item : items) {
                writeElement(writer, field.getSchema(), item, depth, options);
            }
            return;
        }
        newline(writer, depth, options);
        if (items.isEmpty()) {
            writer.writeEmptyElement(field.getWrapperTag());
            return;
        }
        writer.writeStartElement(field.getWrapperTag());
        for (XmlRecord item : items) {
            writeElement(writer, field.getSchema(), item, depth + 1, options);
        }
        newline(writer, depth, options);
        writer.writeEndElement();
    }

    private static boolean hasChildren(XmlSchema schema, XmlRecord record) {
        for (XmlField field : schema.getFields()) {
            if (field.getKind() == XmlFieldKind.ELEMENT && record.getRecord(field.getName()) != null) {
                return true;
            }
            if (field.getKind() == XmlFieldKind.ELEMENT_LIST
                    && (field.getWrapperTag() != null || !record.getRecords(field.getName()).isEmpty())) {
                return true;
            }
        }
        return false;
    }

    private static void newline(XMLStreamWriter writer, int depth, XmlWriteOptions options)
            throws XMLStreamException {
        if (options.isIndent()) {
            writer.writeCharacters("\n" + " ".repeat(depth * options.getIndentAmount()));
        }
    }
}
