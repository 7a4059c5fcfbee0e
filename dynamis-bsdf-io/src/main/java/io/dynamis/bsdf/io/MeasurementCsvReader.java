package io.dynamis.bsdf.io;

import io.dynamis.bsdf.api.MeasurementPoint;
import io.dynamis.bsdf.api.SampleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads in-plane BSDF measurements from a comma-separated table.
 *
 * FORMAT:
 *   incidence, theta, 450nm, 555nm, ...        header; first two labels are ignored
 *   30, -80, 0.012, 0.015, ...                 incidence (deg), theta (deg), one value per
 *   30, -70, 0.020, 0.022, ...                 wavelength column (1/sr)
 *
 * Wavelength labels may carry an "nm" suffix. Blank lines are skipped. Angles are converted
 * to radians; values are taken as is.
 *
 * QUOTING: any cell may be wrapped in double quotes, with "" standing for a literal quote
 * inside a quoted cell. Unquoted cells are trimmed. A quoted cell may not span lines.
 */
public final class MeasurementCsvReader {

    private static final Logger log = LoggerFactory.getLogger(MeasurementCsvReader.class);

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String WAVELENGTH_UNIT = "nm";
    private static final int LEADING_COLUMNS = 2;

    private MeasurementCsvReader() {}

    /**
     * @throws IOException                if the file cannot be read
     * @throws MeasurementFormatException if the content is malformed
     */
    public static MeasurementTable read(Path file) throws IOException, MeasurementFormatException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            MeasurementTable table = read(in);
            log.debug("Read {} measurement point(s) at {} wavelength(s) from {}",
                table.points().size(), table.wavelengths().size(), file);
            return table;
        }
    }

    /**
     * Parses a table from an open reader. The reader is not closed.
     *
     * @throws IOException                if reading fails
     * @throws MeasurementFormatException if the content is malformed
     */
    public static MeasurementTable read(Reader reader)
        throws IOException, MeasurementFormatException {
        BufferedReader in = reader instanceof BufferedReader buffered
            ? buffered : new BufferedReader(reader);

        double[] columnWavelengths = null;
        List<MeasurementPoint> points = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cells = splitCells(line, lineNumber);
            if (columnWavelengths == null) {
                columnWavelengths = parseHeader(cells, lineNumber);
                continue;
            }
            if (cells.length != LEADING_COLUMNS + columnWavelengths.length) {
                throw new MeasurementFormatException(
                    "expected " + (LEADING_COLUMNS + columnWavelengths.length)
                        + " columns, found " + cells.length, lineNumber);
            }
            double incidence = Math.toRadians(parse(cells[0], lineNumber));
            double theta = Math.toRadians(parse(cells[1], lineNumber));
            for (int w = 0; w < columnWavelengths.length; w++) {
                double value = parse(cells[LEADING_COLUMNS + w], lineNumber);
                points.add(new MeasurementPoint(incidence, columnWavelengths[w], theta, value));
            }
        }
        if (columnWavelengths == null) {
            throw new MeasurementFormatException("measurement table is empty", 0);
        }
        if (points.isEmpty()) {
            throw new MeasurementFormatException("measurement table has no data rows", 0);
        }
        return new MeasurementTable(points, SampleSet.ascending(columnWavelengths));
    }

    /** Splits one line into cells, removing quotes and un-escaping doubled quotes. */
    private static String[] splitCells(String line, int lineNumber)
        throws MeasurementFormatException {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        int i = 0;
        int n = line.length();
        while (true) {
            while (i < n && Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            if (i < n && line.charAt(i) == QUOTE) {
                i++;
                boolean closed = false;
                while (i < n) {
                    char c = line.charAt(i++);
                    if (c != QUOTE) {
                        cell.append(c);
                    } else if (i < n && line.charAt(i) == QUOTE) {
                        cell.append(QUOTE);
                        i++;
                    } else {
                        closed = true;
                        break;
                    }
                }
                if (!closed) {
                    throw new MeasurementFormatException("unterminated quoted cell", lineNumber);
                }
                while (i < n && Character.isWhitespace(line.charAt(i))) {
                    i++;
                }
                if (i < n && line.charAt(i) != DELIMITER) {
                    throw new MeasurementFormatException(
                        "unexpected character after quoted cell at column " + (i + 1), lineNumber);
                }
            } else {
                while (i < n && line.charAt(i) != DELIMITER) {
                    cell.append(line.charAt(i++));
                }
                // trailing whitespace before the delimiter
                int end = cell.length();
                while (end > 0 && Character.isWhitespace(cell.charAt(end - 1))) {
                    end--;
                }
                cell.setLength(end);
            }
            cells.add(cell.toString());
            cell.setLength(0);
            if (i >= n) {
                return cells.toArray(new String[0]);
            }
            i++; // delimiter
        }
    }

    private static double[] parseHeader(String[] cells, int lineNumber)
        throws MeasurementFormatException {
        if (cells.length <= LEADING_COLUMNS) {
            throw new MeasurementFormatException(
                "header must name at least one wavelength column", lineNumber);
        }
        double[] wavelengths = new double[cells.length - LEADING_COLUMNS];
        for (int i = 0; i < wavelengths.length; i++) {
            String label = cells[LEADING_COLUMNS + i];
            int unit = label.indexOf(WAVELENGTH_UNIT);
            if (unit >= 0) {
                label = label.substring(0, unit);
            }
            wavelengths[i] = parse(label.trim(), lineNumber);
        }
        return wavelengths;
    }

    private static double parse(String cell, int lineNumber) throws MeasurementFormatException {
        try {
            double v = Double.parseDouble(cell);
            if (!Double.isFinite(v)) {
                throw new MeasurementFormatException("non-finite value '" + cell + "'", lineNumber);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new MeasurementFormatException("not a number: '" + cell + "'", lineNumber, e);
        }
    }
}
