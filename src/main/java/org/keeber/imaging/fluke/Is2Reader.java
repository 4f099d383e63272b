package org.keeber.imaging.fluke;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.keeber.imaging.fluke.ThermalRecord.ThermalRecordException;

import lombok.Getter;
import lombok.NonNull;

/**
 * Reads `.is2` files from disk or streams.
 *
 * <pre>
 * ThermalRecord record = new Is2Reader().read(Path.of("Compressor1.is2"));
 * float t = record.getFrame().temperatureAt(10, 20);
 * </pre>
 */
public class Is2Reader {
    private static final Logger logger = Logger.getLogger(Is2Reader.class.getName());
    public static final String IS2 = ".is2";
    public static final String IS3 = ".is3";

    @Getter private final Is2Decoder decoder;

    public Is2Reader() {
        this(new Is2Decoder());
    }

    public Is2Reader(@NonNull Is2Decoder decoder) {
        this.decoder = decoder;
    }

    public List<String> getSupportedFormats() {
        return List.of(IS2);
    }

    /**
     * @param file an `.is2` file.
     * @return the decoded record.
     * @throws IOException if the file cannot be read as an archive.
     * @throws ThermalRecordException if the file is missing, not `.is2`, or cannot be decoded.
     */
    public ThermalRecord read(@NonNull Path file) throws IOException, ThermalRecordException {
        if (!Files.isRegularFile(file)) {
            throw new ThermalRecordException(ThermalRecordException.Reason.FILE_NOT_FOUND, null, "File not found: " + file);
        }
        String name = file.getFileName().toString();
        String extension = extension(name);
        if (IS3.equals(extension)) {
            throw new ThermalRecordException(ThermalRecordException.Reason.UNSUPPORTED_FORMAT, null,
                    "Unsupported file format: " + extension + " (video files are not supported). Supported formats: " + IS2);
        }
        if (!IS2.equals(extension)) {
            throw new ThermalRecordException(ThermalRecordException.Reason.UNSUPPORTED_FORMAT, null,
                    "Unsupported file format: " + (extension.isEmpty() ? "(none)" : extension) + ". Supported formats: " + IS2);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return read(is, name);
        }
    }

    /**
     * @param is the archive, closed on return.
     * @param fileName name to record on the result, may be null.
     */
    public ThermalRecord read(@NonNull InputStream is, String fileName) throws IOException, ThermalRecordException {
        return decoder.decode(ZipContainerReader.read(is, fileName));
    }

    /**
     * Decode every `.is2` file in a directory. Files that fail are logged and left out.
     *
     * @throws IOException if the directory cannot be listed.
     */
    public List<ThermalRecord> readDirectory(@NonNull Path directory, boolean recursive) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> paths = recursive ? Files.walk(directory) : Files.list(directory)) {
            files = paths.filter(Files::isRegularFile).filter(p -> IS2.equals(extension(p.getFileName().toString()))).sorted().collect(Collectors.toList());
        }
        List<ThermalRecord> records = new ArrayList<>();
        for (Path file : files) {
            try {
                records.add(read(file));
            } catch (IOException | ThermalRecordException e) {
                logger.log(Level.WARNING, "Skipping " + file + ": " + e.getMessage(), e);
            }
        }
        return records;
    }

    /**
     * @return true if the file decodes without error.
     */
    public boolean validate(@NonNull Path file) {
        try {
            read(file);
            return true;
        } catch (IOException | ThermalRecordException e) {
            logger.log(Level.FINE, file + " is not a readable .is2 file", e);
            return false;
        }
    }

    static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

}
