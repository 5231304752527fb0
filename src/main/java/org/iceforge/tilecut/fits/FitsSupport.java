package org.iceforge.tilecut.fits;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;
import nom.tam.fits.TableHDU;

import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions between nom-tam-fits data kernels and the plain arrays used by the
 * rest of the service.
 * <p>
 * Image kernels come back typed by BITPIX and tables hand out columns in whatever
 * shape the binary table stored them. Everything here normalises to
 * {@code double[][]} images (row-major, {@code [y][x]}) and {@code double[]} columns.
 */
public final class FitsSupport {

    static {
        FitsFactory.setLongStringsEnabled(true);
    }

    private FitsSupport() {}

    /**
     * Adds header cards from an ordered map. Strings, booleans and integral numbers keep
     * their type; other numbers are written as doubles. Nulls and non-finite doubles are
     * skipped since FITS cannot represent them.
     */
    public static void addCards(Header header, Map<String, ?> cards) throws HeaderCardException {
        for (Map.Entry<String, ?> e : cards.entrySet()) {
            Object v = e.getValue();
            if (v == null) {
                continue;
            }
            String key = e.getKey();
            if (v instanceof String) {
                header.addValue(key, (String) v, null);
            } else if (v instanceof Boolean) {
                header.addValue(key, (Boolean) v, null);
            } else if (v instanceof Integer || v instanceof Long || v instanceof Short) {
                header.addValue(key, ((Number) v).longValue(), null);
            } else if (v instanceof Number) {
                double d = ((Number) v).doubleValue();
                if (Double.isFinite(d)) {
                    header.addValue(key, d, null);
                }
            } else {
                header.addValue(key, String.valueOf(v), null);
            }
        }
    }

    /**
     * Reads the kernel of a 2-D image HDU as doubles, applying BSCALE/BZERO.
     */
    public static double[][] readImage(BasicHDU<?> hdu) throws FitsException {
        Header h = hdu.getHeader();
        double bscale = h.getDoubleValue("BSCALE", 1.0);
        double bzero = h.getDoubleValue("BZERO", 0.0);
        Object kernel = hdu.getKernel();
        if (kernel == null || !kernel.getClass().isArray()) {
            throw new FitsException("HDU has no image data");
        }
        int rows = Array.getLength(kernel);
        if (rows == 0 || !Array.get(kernel, 0).getClass().isArray()) {
            throw new FitsException("Image HDU is not two-dimensional");
        }
        double[][] out = new double[rows][];
        for (int y = 0; y < rows; y++) {
            double[] row = toDoubles(Array.get(kernel, y));
            if (bscale != 1.0 || bzero != 0.0) {
                for (int x = 0; x < row.length; x++) {
                    row[x] = row[x] * bscale + bzero;
                }
            }
            out[y] = row;
        }
        return out;
    }

    /**
     * Converts a primitive or boxed one-dimensional array to {@code double[]}.
     * Nested single-element arrays (scalar table cells) are unwrapped.
     */
    public static double[] toDoubles(Object array) {
        if (array instanceof double[]) {
            return ((double[]) array).clone();
        }
        int n = Array.getLength(array);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = asDouble(Array.get(array, i));
        }
        return out;
    }

    /**
     * Converts a table column to strings, one per row.
     */
    public static String[] toStrings(Object array) {
        int n = Array.getLength(array);
        String[] out = new String[n];
        for (int i = 0; i < n; i++) {
            Object v = Array.get(array, i);
            if (v != null && v.getClass().isArray() && Array.getLength(v) == 1) {
                v = Array.get(v, 0);
            }
            out[i] = v == null ? null : String.valueOf(v).trim();
        }
        return out;
    }

    /**
     * Whether a table column holds string cells.
     */
    public static boolean isStringColumn(Object array) {
        return array instanceof String[];
    }

    static double asDouble(Object v) {
        if (v == null) {
            return Double.NaN;
        }
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if (v instanceof Boolean) {
            return ((Boolean) v) ? 1.0 : 0.0;
        }
        if (v.getClass().isArray()) {
            return Array.getLength(v) == 0 ? Double.NaN : asDouble(Array.get(v, 0));
        }
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * Finds a table column by name: exact match first, then case-insensitive.
     */
    public static Optional<Integer> findColumn(TableHDU<?> table, String... names) {
        int cols = table.getNCols();
        for (String name : names) {
            for (int i = 0; i < cols; i++) {
                if (name.equals(columnName(table, i))) {
                    return Optional.of(i);
                }
            }
        }
        for (String name : names) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (int i = 0; i < cols; i++) {
                String c = columnName(table, i);
                if (c != null && c.toLowerCase(Locale.ROOT).equals(lower)) {
                    return Optional.of(i);
                }
            }
        }
        return Optional.empty();
    }

    public static String columnName(TableHDU<?> table, int index) {
        String name = table.getColumnName(index);
        return name == null ? null : name.trim();
    }

    /**
     * Reads a numeric table column as doubles.
     */
    public static double[] readColumn(TableHDU<?> table, int index) throws FitsException {
        return toDoubles(table.getColumn(index));
    }

    /**
     * Returns the first table HDU in the file, or empty if there is none.
     */
    public static Optional<TableHDU<?>> firstTable(Fits fits) throws FitsException, IOException {
        for (int i = 0; ; i++) {
            BasicHDU<?> hdu = fits.getHDU(i);
            if (hdu == null) {
                return Optional.empty();
            }
            if (hdu instanceof TableHDU) {
                return Optional.of((TableHDU<?>) hdu);
            }
        }
    }

    /**
     * Writes a FITS file through a temp file in the destination directory and moves it
     * into place atomically.
     */
    public static void writeAtomically(Fits fits, Path dst) throws IOException, FitsException {
        Files.createDirectories(dst.getParent());
        Path tmp = Files.createTempFile(dst.getParent(), "tilecut-", ".tmp");
        try {
            Files.delete(tmp);
            fits.write(tmp.toFile());
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
