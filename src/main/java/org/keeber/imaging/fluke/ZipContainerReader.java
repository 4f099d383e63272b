package org.keeber.imaging.fluke;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads an `.is2` archive into a {@link RawContainer}, entirely in memory.
 */
public class ZipContainerReader {
    private static final Logger logger = Logger.getLogger(ZipContainerReader.class.getName());

    /**
     * @param is the archive stream, closed on return.
     * @param fileName name of the source file (kept for reference), may be null.
     * @return the container.
     * @throws IOException if the stream is not a readable ZIP archive.
     */
    public static RawContainer read(InputStream is, String fileName) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(is)) {
            ZipEntry entry;
            byte[] b = new byte[1024 * 8];int len;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                ByteArrayOutputStream os = new ByteArrayOutputStream();
                while ((len = zip.read(b)) > 0) { os.write(b, 0, len); }
                entries.put(entry.getName(), os.toByteArray());
            }
        }
        if (entries.isEmpty()) {
            throw new IOException("Content does not appear to be a valid .is2 archive (no entries).");
        }
        logger.log(Level.FINE, "Read {0} entries from {1}", new Object[] { entries.size(), fileName });
        return new RawContainer(fileName, entries);
    }

}
