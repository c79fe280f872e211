package com.driftsentinel.core.model;

import com.driftsentinel.core.error.SchemaMismatchException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable fixed-width numeric matrix: one row per record, one column per
 * feature.
 *
 * <p>
 * Feature names are not stored here; they travel next to the dataset so two
 * datasets can be checked against the same ordered name list.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dataset {

    private final int width;
    private final double[][] rows;

    private Dataset(int width, double[][] rows) {
        this.width = width;
        this.rows = rows;
    }

    /**
     * Create a dataset from a row-major matrix. The matrix is copied.
     *
     * @param rows row-major values; must not be {@code null}
     * @return the dataset
     * @throws NullPointerException    if {@code rows} or any row is {@code null}
     * @throws SchemaMismatchException if rows differ in width
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Dataset of(double[][] rows) {
        Objects.requireNonNull(rows, "Dataset rows must not be null");
        if (rows.length == 0) {
            return new Dataset(0, new double[0][]);
        }
        int width = Objects.requireNonNull(rows[0], "Row 0 is null").length;
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] row = Objects.requireNonNull(rows[i], "Row " + i + " is null");
            if (row.length != width) {
                throw new SchemaMismatchException(
                        "Row " + i + " has width " + row.length + ", expected " + width);
            }
            copy[i] = row.clone();
        }
        return new Dataset(width, copy);
    }

    /**
     * Create a dataset with a known width and no rows.
     *
     * @param width number of features; must be &gt;= 0
     * @return empty dataset
     */
    public static Dataset empty(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must be >= 0, got: " + width);
        }
        return new Dataset(width, new double[0][]);
    }

    public int width() {
        return width;
    }

    public int rowCount() {
        return rows.length;
    }

    /**
     * Extract one feature column.
     *
     * @param index zero-based column index
     * @return a fresh array holding the column values in row order
     * @throws IndexOutOfBoundsException if {@code index} is not a valid column
     */
    public double[] column(int index) {
        Objects.checkIndex(index, width);
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            column[i] = rows[i][index];
        }
        return column;
    }

    /**
     * @return a deep copy of the row-major values
     */
    @JsonValue
    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Dataset that))
            return false;
        return width == that.width && Arrays.deepEquals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * width + Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "Dataset{rows=" + rows.length + ", width=" + width + '}';
    }
}
