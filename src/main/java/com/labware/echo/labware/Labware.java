package com.labware.echo.labware;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.labware.echo.exception.DuplicatePlateTypeException;
import com.labware.echo.exception.PlateNotFoundException;
import com.labware.echo.table.LabwareTableProjection;
import com.labware.echo.table.Table;
import com.labware.echo.xml.XmlWriteOptions;

/**
 * Ordered collection of plate type definitions, unique by {@code platetype}.
 *
 * Source and destination plates live in one list tagged by
 * {@link PlateInfo#getUsage()}; they are split again only when written.
 */
public class Labware {

    private final List<PlateInfo> plates = new ArrayList<>();

    public Labware() {
    }

    /**
     * @throws DuplicatePlateTypeException if two plates share a plate type
     */
    public Labware(List<? extends PlateInfo> plates) {
        plates.forEach(this::add);
    }

    /**
     * Parses ELWX or, failing that, ELW bytes.
     */
    public static Labware fromBytes(byte[] raw) {
        return new LabwareXmlReader().read(raw);
    }

    public static Labware fromFile(Path path) throws IOException {
        return new LabwareXmlReader().read(path);
    }

    public byte[] toBytes() {
        return toBytes(XmlWriteOptions.DEFAULTS);
    }

    public byte[] toBytes(XmlWriteOptions options) {
        return new LabwareXmlWriter().write(this, options);
    }

    public void toFile(Path path) throws IOException {
        toFile(path, XmlWriteOptions.DEFAULTS);
    }

    public void toFile(Path path, XmlWriteOptions options) throws IOException {
        new LabwareXmlWriter().write(this, path, options);
    }

    public Table toTable() {
        return LabwareTableProjection.project(this);
    }

    /**
     * Appends a plate. The collection is left unchanged when the plate type is
     * already present.
     *
     * @throws DuplicatePlateTypeException if a plate with the same type exists
     */
    public void add(PlateInfo plate) {
        if (contains(plate.getPlatetype())) {
            throw new DuplicatePlateTypeException(plate.getPlatetype());
        }
        plates.add(plate);
    }

    public Optional<PlateInfo> findPlate(String platetype) {
        return plates.stream()
                .filter(p -> p.getPlatetype().equals(platetype))
                .findFirst();
    }

    /**
     * @throws PlateNotFoundException if no plate has this type
     */
    public PlateInfo getPlate(String platetype) {
        return findPlate(platetype).orElseThrow(() -> new PlateNotFoundException(platetype));
    }

    public boolean contains(String platetype) {
        return findPlate(platetype).isPresent();
    }

    public List<String> keys() {
        return plates.stream().map(PlateInfo::getPlatetype).toList();
    }

    public List<PlateInfo> getPlates() {
        return Collections.unmodifiableList(plates);
    }

    public List<PlateInfo> getSourcePlates() {
        return plates.stream().filter(p -> p.getUsage() == PlateUsage.SOURCE).toList();
    }

    public List<PlateInfo> getDestinationPlates() {
        return plates.stream().filter(p -> p.getUsage() == PlateUsage.DESTINATION).toList();
    }

    public int size() {
        return plates.size();
    }

    /**
     * Labware collections are equal when they hold the same plates in the same
     * order, comparing every field including derived ones, whatever layout each
     * plate came from.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Labware other)) {
            return false;
        }
        return materialized().equals(other.materialized());
    }

    @Override
    public int hashCode() {
        return materialized().hashCode();
    }

    @Override
    public String toString() {
        return "Labware" + keys();
    }

    private List<GenericPlateInfo> materialized() {
        return plates.stream().map(GenericPlateInfo::copyOf).toList();
    }
}
