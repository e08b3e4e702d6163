package com.labware.echo.labware;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import com.labware.echo.exception.VariantMismatchException;
import com.labware.echo.xml.ParseAttempt;
import com.labware.echo.xml.XmlDocuments;
import com.labware.echo.xml.XmlMapper;
import com.labware.echo.xml.XmlRecord;

/**
 * Reads labware files in either layout.
 *
 * The generic ELWX layout is tried first because it keeps every field. Failing
 * it only means "not this layout"; the fixed-geometry ELW layout is tried next,
 * and only when both fail is the document rejected.
 */
public class LabwareXmlReader {

    private static final Logger log = LoggerFactory.getLogger(LabwareXmlReader.class);

    private final XmlMapper mapper = new XmlMapper();

    public Labware read(Path path) throws IOException {
        log.debug("Reading labware file {}", path);
        return read(Files.readAllBytes(path));
    }

    public Labware read(byte[] raw) {
        Element root = XmlDocuments.parse(raw).getDocumentElement();

        ParseAttempt<List<PlateInfo>> generic = ParseAttempt.of(() -> readGeneric(root));
        if (generic.isSuccess()) {
            return new Labware(generic.getValue());
        }
        log.debug("Not an ELWX labware document ({}), trying ELW layout", generic.getFailure().getMessage());

        ParseAttempt<List<PlateInfo>> fixedGeometry = ParseAttempt.of(() -> readFixedGeometry(root));
        if (fixedGeometry.isSuccess()) {
            return new Labware(fixedGeometry.getValue());
        }
        throw new VariantMismatchException(generic.getFailure(), fixedGeometry.getFailure());
    }

    List<PlateInfo> readGeneric(Element root) {
        XmlRecord document = mapper.read(root, LabwareSchemas.ELWX_DOCUMENT);
        List<PlateInfo> plates = new ArrayList<>();
        for (XmlRecord plate : document.getRecords(LabwareSchemas.SOURCE_PLATES)) {
            plates.add(LabwareSchemas.genericFromRecord(plate));
        }
        for (XmlRecord plate : document.getRecords(LabwareSchemas.DESTINATION_PLATES)) {
            plates.add(LabwareSchemas.genericFromRecord(plate));
        }
        return plates;
    }

    List<PlateInfo> readFixedGeometry(Element root) {
        XmlRecord document = mapper.read(root, LabwareSchemas.ELW_DOCUMENT);
        List<PlateInfo> plates = new ArrayList<>();
        for (XmlRecord plate : document.getRecords(LabwareSchemas.SOURCE_PLATES)) {
            plates.add(LabwareSchemas.fixedGeometryFromRecord(plate, PlateUsage.SOURCE));
        }
        for (XmlRecord plate : document.getRecords(LabwareSchemas.DESTINATION_PLATES)) {
            plates.add(LabwareSchemas.fixedGeometryFromRecord(plate, PlateUsage.DESTINATION));
        }
        return plates;
    }
}
