package com.labware.echo.xml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered field table for one element type.
 */
public final class XmlSchema {

    private final String tag;
    private final List<XmlField> fields;

    private XmlSchema(String tag, List<XmlField> fields) {
        this.tag = tag;
        this.fields = List.copyOf(fields);
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    public String getTag() {
        return tag;
    }

    public List<XmlField> getFields() {
        return fields;
    }

    public Optional<XmlField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    /**
     * Attribute fields only, in declaration order.
     */
    public List<XmlField> scalarFields() {
        return fields.stream().filter(XmlField::isScalar).toList();
    }

    /**
     * Same element, without the named fields. Used for layouts that derive some
     * fields instead of storing them.
     */
    public XmlSchema excluding(String... names) {
        Set<String> excluded = new HashSet<>(Arrays.asList(names));
        for (String name : excluded) {
            if (field(name).isEmpty()) {
                throw new IllegalArgumentException("No field " + name + " in <" + tag + ">");
            }
        }
        return new XmlSchema(tag, fields.stream().filter(f -> !excluded.contains(f.getName())).toList());
    }

    public static final class Builder {
        private final String tag;
        private final List<XmlField> fields = new ArrayList<>();

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder field(XmlField field) {
            boolean clash = fields.stream().anyMatch(f -> f.getName().equals(field.getName()));
            if (clash) {
                throw new IllegalArgumentException("Duplicate field " + field.getName() + " in <" + tag + ">");
            }
            fields.add(field);
            return this;
        }

        public XmlSchema build() {
            return new XmlSchema(tag, fields);
        }
    }
}
