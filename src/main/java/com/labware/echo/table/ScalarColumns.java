package com.labware.echo.table;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.labware.echo.codec.ScalarCodec;
import com.labware.echo.codec.ScalarType;
import com.labware.echo.xml.XmlField;
import com.labware.echo.xml.XmlRecord;
import com.labware.echo.xml.XmlSchema;

/**
 * Derives table columns from schema field tables and turns records into cells.
 */
final class ScalarColumns {

    private ScalarColumns() {
        // Utility class
    }

    static List<TableColumn> of(XmlSchema schema) {
        return schema.scalarFields().stream()
                .map(f -> new TableColumn(f.getName(), f.getCodec().type()))
                .toList();
    }

    /**
     * Scalar cells of a record, in schema order. Values that are not already of
     * the column's Java type (enums) are stored in their wire form.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> cells(XmlSchema schema, XmlRecord record) {
        Map<String, Object> cells = new LinkedHashMap<>();
        for (XmlField field : schema.scalarFields()) {
            Object value = record.get(field.getName());
            ScalarType type = field.getCodec().type();
            if (value != null && !type.getJavaType().isInstance(value)) {
                value = ((ScalarCodec<Object>) field.getCodec()).encode(value);
            }
            cells.put(field.getName(), value);
        }
        return cells;
    }
}
