package com.ccdsim.model;

/**
 * Fixed layout of a slice: illuminated rows, then smear rows, then final dark rows;
 * early dark columns, then illuminated columns, then late dark columns.
 */
public final class SliceGeometry {

    private final int earlyDarkColumns;
    private final int lateDarkColumns;
    private final int finalDarkRows;
    private final int smearRows;

    public SliceGeometry(int earlyDarkColumns, int lateDarkColumns, int finalDarkRows, int smearRows) {
        this.earlyDarkColumns = earlyDarkColumns;
        this.lateDarkColumns = lateDarkColumns;
        this.finalDarkRows = finalDarkRows;
        this.smearRows = smearRows;
    }

    public int getEarlyDarkColumns() { return earlyDarkColumns; }
    public int getLateDarkColumns() { return lateDarkColumns; }
    public int getFinalDarkRows() { return finalDarkRows; }
    public int getSmearRows() { return smearRows; }

    public int imageRowEnd(Slice slice) {
        return slice.rows() - finalDarkRows - smearRows;
    }

    public int smearRowEnd(Slice slice) {
        return slice.rows() - finalDarkRows;
    }

    public int illuminatedColumnStart() {
        return earlyDarkColumns;
    }

    public int illuminatedColumnEnd(Slice slice) {
        return slice.columns() - lateDarkColumns;
    }

    public int illuminatedColumns(Slice slice) {
        return illuminatedColumnEnd(slice) - earlyDarkColumns;
    }

    public void requireFits(Slice slice) {
        if (imageRowEnd(slice) < 0 || illuminatedColumnEnd(slice) < earlyDarkColumns) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Slice " + slice.getIndex() + " (" + slice.rows() + "x"
                    + slice.columns() + ") cannot hold " + smearRows + " smear rows, " + finalDarkRows
                    + " final dark rows and " + (earlyDarkColumns + lateDarkColumns) + " dark columns");
        }
    }

    @Override
    public String toString() {
        return "SliceGeometry{early=" + earlyDarkColumns + ", late=" + lateDarkColumns
                + ", finalDark=" + finalDarkRows + ", smear=" + smearRows + "}";
    }
}
