package com.labware.echo.xml;

import com.labware.echo.codec.ScalarCodec;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One row of a schema table: a logical field and how it maps to XML.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class XmlField {

    /**
     * Logical name, used as record key and table column name.
     */
    @NonNull
    String name;

    /**
     * Attribute name for attributes; child tag for elements; item tag for lists.
     */
    @NonNull
    String rawName;

    @NonNull
    XmlFieldKind kind;

    boolean required;

    /**
     * Value used when an optional field is absent. Optional attributes equal to
     * it are not written.
     */
    Object defaultValue;

    ScalarCodec<?> codec;

    /**
     * Schema of the nested element, or of each list item.
     */
    XmlSchema schema;

    /**
     * Tag of the element wrapping a list, {@code null} when items are direct children.
     */
    String wrapperTag;

    public boolean isScalar() {
        return kind == XmlFieldKind.ATTRIBUTE;
    }

    public static XmlField attribute(String name, ScalarCodec<?> codec) {
        return attribute(name, name, codec);
    }

    public static XmlField attribute(String name, String rawName, ScalarCodec<?> codec) {
        return XmlField.builder()
                .name(name)
                .rawName(rawName)
                .kind(XmlFieldKind.ATTRIBUTE)
                .required(true)
                .codec(codec)
                .build();
    }

    public static XmlField optionalAttribute(String name, ScalarCodec<?> codec) {
        return optionalAttribute(name, name, codec);
    }

    public static XmlField optionalAttribute(String name, String rawName, ScalarCodec<?> codec) {
        return optionalAttribute(name, rawName, codec, null);
    }

    /**
     * Optional attribute read as {@code defaultValue} when absent and omitted on
     * write when equal to it.
     */
    public static <T> XmlField optionalAttribute(String name, String rawName, ScalarCodec<T> codec, T defaultValue) {
        return XmlField.builder()
                .name(name)
                .rawName(rawName)
                .kind(XmlFieldKind.ATTRIBUTE)
                .required(false)
                .defaultValue(defaultValue)
                .codec(codec)
                .build();
    }

    public static XmlField element(String name, XmlSchema schema) {
        return XmlField.builder()
                .name(name)
                .rawName(schema.getTag())
                .kind(XmlFieldKind.ELEMENT)
                .required(true)
                .schema(schema)
                .build();
    }

    public static XmlField elementList(String name, XmlSchema itemSchema) {
        return XmlField.builder()
                .name(name)
                .rawName(itemSchema.getTag())
                .kind(XmlFieldKind.ELEMENT_LIST)
                .required(false)
                .schema(itemSchema)
                .build();
    }

    public static XmlField wrappedElementList(String name, String wrapperTag, XmlSchema itemSchema) {
        return XmlField.builder()
                .name(name)
                .rawName(itemSchema.getTag())
                .kind(XmlFieldKind.ELEMENT_LIST)
                .required(true)
                .schema(itemSchema)
                .wrapperTag(wrapperTag)
                .build();
    }
}
