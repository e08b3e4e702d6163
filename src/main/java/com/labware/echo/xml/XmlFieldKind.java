package com.labware.echo.xml;

/**
 * How a schema field is carried in XML.
 */
public enum XmlFieldKind {
    /**
     * Scalar attribute on the element itself.
     */
    ATTRIBUTE,

    /**
     * Exactly one nested child element, mapped recursively.
     */
    ELEMENT,

    /**
     * Ordered run of child elements, either directly under the element or inside
     * a wrapper element.
     */
    ELEMENT_LIST
}
