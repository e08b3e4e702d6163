package com.labware.echo.labware;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.labware.echo.util.FileWriteUtil;
import com.labware.echo.xml.XmlMapper;
import com.labware.echo.xml.XmlRecord;
import com.labware.echo.xml.XmlWriteOptions;

/**
 * Writes labware as an ELWX document, whatever layout it was read from.
 */
public class LabwareXmlWriter {

    private final XmlMapper mapper = new XmlMapper();

    public byte[] write(Labware labware, XmlWriteOptions options) {
        XmlRecord root = new XmlRecord(LabwareSchemas.ROOT_TAG)
                .put(LabwareSchemas.SOURCE_PLATES, toRecords(labware.getSourcePlates()))
                .put(LabwareSchemas.DESTINATION_PLATES, toRecords(labware.getDestinationPlates()));
        return mapper.toBytes(LabwareSchemas.ELWX_DOCUMENT, root, options);
    }

    public void write(Labware labware, Path path, XmlWriteOptions options) throws IOException {
        FileWriteUtil.safeWrite(path, write(labware, options));
    }

    private static List<XmlRecord> toRecords(List<PlateInfo> plates) {
        return plates.stream().map(LabwareSchemas::toRecord).toList();
    }
}
