package com.labware.echo.labware;

import static com.labware.echo.util.ModelChecks.nonNegative;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Plate type read from an ELW file. The file does not store {@code usage},
 * {@code welllength} or {@code plateformat}: usage comes from the list the plate
 * was found in, well length equals well width and the format is unknown.
 */
@Value
public class FixedGeometryPlateInfo implements PlateInfo {

    public static final String UNKNOWN_PLATEFORMAT = "UNKNOWN";

    String platetype;
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
    int wellcapacity;
    double bottominset;
    double centerwellposx;
    double centerwellposy;
    Double minwellvol;
    Double maxwellvol;
    Double maxvoltotal;
    Double minvolume;
    Double dropvolume;

    @Builder
    public FixedGeometryPlateInfo(@NonNull String platetype, @NonNull PlateUsage usage, String fluid,
                                  @NonNull String manufacturer, @NonNull String lotnumber,
                                  @NonNull String partnumber, int rows, int cols, int a1offsety,
                                  int centerspacingx, int centerspacingy, int plateheight, int skirtheight,
                                  int wellwidth, int wellcapacity, double bottominset, double centerwellposx,
                                  double centerwellposy, Double minwellvol, Double maxwellvol,
                                  Double maxvoltotal, Double minvolume, Double dropvolume) {
        this.platetype = platetype;
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

    @Override
    public String getPlateformat() {
        return UNKNOWN_PLATEFORMAT;
    }

    @Override
    public int getWelllength() {
        return wellwidth;
    }
}
