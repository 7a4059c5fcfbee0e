package io.dynamis.bsdf.core;

import io.dynamis.bsdf.api.PolarMap;
import io.dynamis.bsdf.api.ShapeMismatchException;

import java.util.List;

/**
 * Reshapes flat, iteration-ordered per-cell results into the exported tensor layout.
 *
 * Flat index k of a cell is incidenceIndex * wavelengthCount + wavelengthIndex.
 *
 * ALIASING: reshape places each map's backing array into the result without copying, and
 * reverseFirstAxis shares inner arrays with its input. swapLastAxes always allocates, so the
 * reshape -> swapLastAxes pipeline never hands out a map's own buffer.
 */
public final class TensorAssembly {

    private TensorAssembly() {}

    /**
     * Flat polar maps -> [incidence][wavelength][theta][phi]. The planes are the maps' own
     * arrays.
     *
     * @throws ShapeMismatchException if the map count is not ni * nw or any map is not
     *         thetaCount x phiCount
     */
    public static double[][][][] reshape(String tensor, List<PolarMap> maps,
                                         int ni, int nw, int thetaCount, int phiCount)
        throws ShapeMismatchException {
        if (maps.size() != ni * nw) {
            throw new ShapeMismatchException(tensor + " cells",
                new int[] { ni * nw }, new int[] { maps.size() });
        }
        double[][][][] out = new double[ni][nw][][];
        for (int k = 0; k < maps.size(); k++) {
            PolarMap map = maps.get(k);
            if (map.thetaCount() != thetaCount || map.phiCount() != phiCount) {
                throw new ShapeMismatchException(tensor + " cell " + k,
                    new int[] { thetaCount, phiCount },
                    new int[] { map.thetaCount(), map.phiCount() });
            }
            out[k / nw][k % nw] = map.values();
        }
        return out;
    }

    /**
     * Flat scalars -> [incidence][wavelength].
     *
     * @throws ShapeMismatchException if the value count is not ni * nw
     */
    public static double[][] reshape(String tensor, double[] flat, int ni, int nw)
        throws ShapeMismatchException {
        if (flat.length != ni * nw) {
            throw new ShapeMismatchException(tensor + " cells",
                new int[] { ni * nw }, new int[] { flat.length });
        }
        double[][] out = new double[ni][nw];
        for (int k = 0; k < flat.length; k++) {
            out[k / nw][k % nw] = flat[k];
        }
        return out;
    }

    /** [a][b][x][y] -> [a][b][y][x]. */
    public static double[][][][] swapLastAxes(double[][][][] src) {
        double[][][][] out = new double[src.length][][][];
        for (int a = 0; a < src.length; a++) {
            out[a] = new double[src[a].length][][];
            for (int b = 0; b < src[a].length; b++) {
                double[][] plane = src[a][b];
                int nx = plane.length;
                int ny = nx == 0 ? 0 : plane[0].length;
                double[][] swapped = new double[ny][nx];
                for (int x = 0; x < nx; x++) {
                    for (int y = 0; y < ny; y++) {
                        swapped[y][x] = plane[x][y];
                    }
                }
                out[a][b] = swapped;
            }
        }
        return out;
    }

    /** Reverses the order of the first axis. Inner arrays are shared with the input. */
    public static double[][][][] reverseFirstAxis(double[][][][] src) {
        double[][][][] out = new double[src.length][][][];
        for (int a = 0; a < src.length; a++) {
            out[a] = src[src.length - 1 - a];
        }
        return out;
    }

    /** Dimensions of a rectangular 4D tensor; ragged inner arrays report -1 on that axis. */
    public static int[] shape(double[][][][] t) {
        int n0 = t.length;
        int n1 = n0 == 0 ? 0 : t[0].length;
        int n2 = n1 == 0 ? 0 : t[0][0].length;
        int n3 = n2 == 0 ? 0 : t[0][0][0].length;
        for (double[][][] a : t) {
            if (a.length != n1) {
                n1 = -1;
                break;
            }
            for (double[][] b : a) {
                if (b.length != n2) {
                    n2 = -1;
                    break;
                }
                for (double[] c : b) {
                    if (c.length != n3) {
                        n3 = -1;
                        break;
                    }
                }
            }
        }
        return new int[] { n0, n1, n2, n3 };
    }

    public static int[] shape(double[][] m) {
        int n0 = m.length;
        int n1 = n0 == 0 ? 0 : m[0].length;
        for (double[] row : m) {
            if (row.length != n1) {
                return new int[] { n0, -1 };
            }
        }
        return new int[] { n0, n1 };
    }

    /** True when every element is exactly zero. An empty tensor counts as all-zero. */
    public static boolean isAllZero(double[][][][] t) {
        for (double[][][] a : t) {
            for (double[][] b : a) {
                for (double[] c : b) {
                    for (double v : c) {
                        if (v != 0.0) {
                            return false;
                        }
                    }
                }
            }
        }
        return true;
    }
}
