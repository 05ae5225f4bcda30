package asciimap.adapter.out.render;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

import org.jboss.logging.Logger;

import asciimap.core.model.render.LandMask;
import asciimap.core.port.out.LandMaskLoader;

/**
 * Loads the land mask from a binary PBM ({@code P4}) image on the classpath.
 *
 * <p>Set pixels are land. The image is read as an equirectangular projection of the whole
 * globe, north up, starting at longitude -180.
 */
public final class ClasspathLandMaskLoader implements LandMaskLoader {

    public static final String DEFAULT_RESOURCE = "landmask/world-1deg.pbm";

    private static final Logger LOG = Logger.getLogger(ClasspathLandMaskLoader.class);

    private final String resource;
    private final ClassLoader classLoader;

    public ClasspathLandMaskLoader(String resource) {
        this(resource, ClasspathLandMaskLoader.class.getClassLoader());
    }

    ClasspathLandMaskLoader(String resource, ClassLoader classLoader) {
        this.resource = resource;
        this.classLoader = classLoader;
    }

    @Override
    public LandMask load() {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Land mask resource not found: " + resource);
            }
            final var mask = parse(in.readAllBytes());
            LOG.debugv(
                    "Loaded land mask {0} ({1}x{2}, {3} land cells)",
                    resource,
                    mask.columns(),
                    mask.rows(),
                    mask.landCells());
            return mask;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read land mask " + resource, e);
        }
    }

    @Override
    public String source() {
        return "classpath:" + resource;
    }

    static LandMask parse(byte[] data) {
        final var header = new HeaderReader(data);
        final var magic = header.nextToken();
        if (!"P4".equals(magic)) {
            throw new IllegalStateException("Land mask is not a binary PBM image (magic " + magic + ")");
        }
        final var columns = header.nextInt();
        final var rows = header.nextInt();
        // exactly one whitespace byte separates the header from the raster
        final var rasterStart = header.position() + 1;

        final var bytesPerRow = (columns + 7) / 8;
        final var expected = (long) bytesPerRow * rows;
        if (data.length - rasterStart < expected) {
            throw new IllegalStateException("Land mask raster is truncated: expected %d bytes, found %d"
                    .formatted(expected, data.length - rasterStart));
        }

        final var land = new BitSet(columns * rows);
        for (int row = 0; row < rows; row++) {
            final var rowOffset = rasterStart + row * bytesPerRow;
            for (int col = 0; col < columns; col++) {
                final var packed = data[rowOffset + col / 8];
                if ((packed & (0x80 >>> (col % 8))) != 0) {
                    land.set(row * columns + col);
                }
            }
        }
        return new LandMask(columns, rows, land);
    }

    private static final class HeaderReader {

        private final byte[] data;
        private int position;

        HeaderReader(byte[] data) {
            this.data = data;
        }

        int position() {
            return position;
        }

        String nextToken() {
            skipWhitespaceAndComments();
            final var start = position;
            while (position < data.length && !isWhitespace(data[position])) {
                position++;
            }
            if (start == position) {
                throw new IllegalStateException("Land mask header ended unexpectedly");
            }
            return new String(data, start, position - start, StandardCharsets.US_ASCII);
        }

        int nextInt() {
            final var token = nextToken();
            try {
                final var value = Integer.parseInt(token);
                if (value <= 0) {
                    throw new IllegalStateException("Land mask dimension must be positive: " + value);
                }
                return value;
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Land mask dimension is not a number: " + token, e);
            }
        }

        private void skipWhitespaceAndComments() {
            while (position < data.length) {
                if (data[position] == '#') {
                    while (position < data.length && data[position] != '\n') {
                        position++;
                    }
                } else if (isWhitespace(data[position])) {
                    position++;
                } else {
                    return;
                }
            }
        }

        private static boolean isWhitespace(byte b) {
            return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0B || b == 0x0C;
        }
    }
}
