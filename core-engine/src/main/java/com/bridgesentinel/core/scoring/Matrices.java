package com.bridgesentinel.core.scoring;

import java.util.Arrays;

/**
 * Row-major matrix helpers shared by the fitting steps.
 */
final class Matrices {

    private Matrices() {
    }

    static int width(double[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("At least one row is required");
        }
        int width = rows[0].length;
        if (width == 0) {
            throw new IllegalArgumentException("Rows must have at least one feature");
        }
        for (int i = 1; i < rows.length; i++) {
            if (rows[i].length != width) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length
                        + " features, expected " + width);
            }
        }
        return width;
    }

    static void requireWidth(double[] row, int width) {
        if (row == null || row.length != width) {
            throw new IllegalArgumentException("Expected " + width + " features, got: "
                    + (row == null ? "null" : row.length));
        }
    }

    static double[] column(double[][] rows, int j) {
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            column[i] = rows[i][j];
        }
        return column;
    }

    static double[] presentValues(double[][] rows, int j) {
        return Arrays.stream(rows)
                .mapToDouble(row -> row[j])
                .filter(Double::isFinite)
                .toArray();
    }
}
