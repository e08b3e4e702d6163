package com.labware.echo.labware;

/**
 * Read-only view of one plate type definition, shared by the generic layout,
 * which stores every field, and the fixed-geometry layout, which derives
 * {@code usage}, {@code welllength} and {@code plateformat}.
 *
 * Boxed float getters return {@code null} when the optional attribute is absent,
 * as does {@link #getFluid()}.
 */
public interface PlateInfo {

    String getPlatetype();

    String getPlateformat();

    PlateUsage getUsage();

    String getFluid();

    String getManufacturer();

    String getLotnumber();

    String getPartnumber();

    int getRows();

    int getCols();

    int getA1offsety();

    int getCenterspacingx();

    int getCenterspacingy();

    int getPlateheight();

    int getSkirtheight();

    int getWellwidth();

    int getWelllength();

    int getWellcapacity();

    double getBottominset();

    double getCenterwellposx();

    double getCenterwellposy();

    Double getMinwellvol();

    Double getMaxwellvol();

    Double getMaxvoltotal();

    Double getMinvolume();

    Double getDropvolume();

    default PlateShape getShape() {
        return PlateShape.of(getRows(), getCols());
    }
}
