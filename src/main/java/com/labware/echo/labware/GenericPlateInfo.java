package com.labware.echo.labware;

import static com.labware.echo.util.ModelChecks.nonNegative;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Plate type carrying every field explicitly, as in ELWX files.
 */
@Value
public class GenericPlateInfo implements PlateInfo {
    String platetype;
    String plateformat;
    PlateUsage usage;
    String fluid;
    String manufacturer;
    String lotnumber;
    String partnumber;
    int rows;
    int cols;
    int a1offsety;
    int centerspacingx;
    int centerspacingy;
    int plateheight;
    int skirtheight;
    int wellwidth;
    int welllength;
    int wellcapacity;
    double bottominset;
    double centerwellposx;
    double centerwellposy;
    Double minwellvol;
    Double maxwellvol;
    Double maxvoltotal;
    Double minvolume;
    Double dropvolume;

    @Builder(toBuilder = true)
    public GenericPlateInfo(@NonNull String platetype, @NonNull String plateformat, @NonNull PlateUsage usage,
                            String fluid, @NonNull String manufacturer, @NonNull String lotnumber,
                            @NonNull String partnumber, int rows, int cols, int a1offsety,
                            int centerspacingx, int centerspacingy, int plateheight, int skirtheight,
                            int wellwidth, int welllength, int wellcapacity, double bottominset,
                            double centerwellposx, double centerwellposy, Double minwellvol,
                            Double maxwellvol, Double maxvoltotal, Double minvolume, Double dropvolume) {
        this.platetype = platetype;
        this.plateformat = plateformat;
        this.usage = usage;
        this.fluid = fluid;
        this.manufacturer = manufacturer;
        this.lotnumber = lotnumber;
        this.partnumber = partnumber;
        this.rows = nonNegative("rows", rows);
        this.cols = nonNegative("cols", cols);
        this.a1offsety = nonNegative("a1offsety", a1offsety);
        this.centerspacingx = nonNegative("centerspacingx", centerspacingx);
        this.centerspacingy = nonNegative("centerspacingy", centerspacingy);
        this.plateheight = nonNegative("plateheight", plateheight);
        this.skirtheight = nonNegative("skirtheight", skirtheight);
        this.wellwidth = nonNegative("wellwidth", wellwidth);
        this.welllength = nonNegative("welllength", welllength);
        this.wellcapacity = nonNegative("wellcapacity", wellcapacity);
        this.bottominset = bottominset;
        this.centerwellposx = centerwellposx;
        this.centerwellposy = centerwellposy;
        this.minwellvol = minwellvol;
        this.maxwellvol = maxwellvol;
        this.maxvoltotal = maxvoltotal;
        this.minvolume = minvolume;
        this.dropvolume = dropvolume;
    }

    /**
     * Materializes any plate view, including derived fields, as a generic plate.
     */
    public static GenericPlateInfo copyOf(PlateInfo plate) {
        if (plate instanceof GenericPlateInfo generic) {
            return generic;
        }
        return GenericPlateInfo.builder()
                .platetype(plate.getPlatetype())
                .plateformat(plate.getPlateformat())
                .usage(plate.getUsage())
                .fluid(plate.getFluid())
                .manufacturer(plate.getManufacturer())
                .lotnumber(plate.getLotnumber())
                .partnumber(plate.getPartnumber())
                .rows(plate.getRows())
                .cols(plate.getCols())
                .a1offsety(plate.getA1offsety())
                .centerspacingx(plate.getCenterspacingx())
                .centerspacingy(plate.getCenterspacingy())
                .plateheight(plate.getPlateheight())
                .skirtheight(plate.getSkirtheight())
                .wellwidth(plate.getWellwidth())
                .welllength(plate.getWelllength())
                .wellcapacity(plate.getWellcapacity())
                .bottominset(plate.getBottominset())
                .centerwellposx(plate.getCenterwellposx())
                .centerwellposy(plate.getCenterwellposy())
                .minwellvol(plate.getMinwellvol())
                .maxwellvol(plate.getMaxwellvol())
                .maxvoltotal(plate.getMaxvoltotal())
                .minvolume(plate.getMinvolume())
                .dropvolume(plate.getDropvolume())
                .build();
    }
}
