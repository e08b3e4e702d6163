package com.labware.echo.xml;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Field-value map for one element, keyed by logical field name in schema order.
 *
 * Scalars hold decoded values, nested elements hold {@link XmlRecord}s and lists
 * hold {@code List<XmlRecord>}.
 */
@ToString
@EqualsAndHashCode
public final class XmlRecord {

    private final String tag;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public XmlRecord(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public XmlRecord put(String name, Object value) {
        values.put(name, value);
        return this;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public String getString(String name) {
        return (String) values.get(name);
    }

    public Integer getInteger(String name) {
        return (Integer) values.get(name);
    }

    public Double getDouble(String name) {
        return (Double) values.get(name);
    }

    public LocalDateTime getTimestamp(String name) {
        return (LocalDateTime) values.get(name);
    }

    public XmlRecord getRecord(String name) {
        return (XmlRecord) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<XmlRecord> getRecords(String name) {
        Object value = values.get(name);
        return value == null ? List.of() : (List<XmlRecord>) value;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
