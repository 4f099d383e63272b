package org.keeber.imaging.fluke;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The named byte buffers of one archive. Lookups ignore case and treat `\` as `/`.
 */
public class RawContainer {
    @Getter private final String fileName;
    private final Map<String, byte[]> entries;
    private final Map<String, String> names = new LinkedHashMap<>();

    /**
     * A file inside the archive.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Entry {
        private final String path;
        private final int size;

        public String getName() {
            int slash = path.lastIndexOf('/');
            return slash < 0 ? path : path.substring(slash + 1);
        }

        /**
         * File name without extension.
         */
        public String getStem() {
            String name = getName();
            int dot = name.lastIndexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    public RawContainer(String fileName, @NonNull Map<String, byte[]> entries) {
        this.fileName = fileName;
        Map<String, byte[]> copy = new LinkedHashMap<>();
        entries.forEach((path, bytes) -> {
            String normal = normalise(path);
            copy.put(normal, bytes);
            names.put(normal.toLowerCase(Locale.ROOT), normal);
        });
        this.entries = Collections.unmodifiableMap(copy);
    }

    public Set<String> getPaths() {
        return entries.keySet();
    }

    public boolean contains(String path) {
        return names.containsKey(normalise(path).toLowerCase(Locale.ROOT));
    }

    public Optional<byte[]> get(String path) {
        return Optional.ofNullable(names.get(normalise(path).toLowerCase(Locale.ROOT))).map(entries::get);
    }

    /**
     * Files directly inside a directory whose name ends with the suffix (case-insensitive), in archive order.
     */
    public List<Entry> list(String directory, String suffix) {
        String prefix = normalise(directory).toLowerCase(Locale.ROOT) + "/";
        String end = suffix.toLowerCase(Locale.ROOT);
        return entries.entrySet().stream()
                .filter(e -> {
                    String lower = e.getKey().toLowerCase(Locale.ROOT);
                    return lower.startsWith(prefix) && lower.indexOf('/', prefix.length()) < 0 && lower.endsWith(end);
                })
                .map(e -> new Entry(e.getKey(), e.getValue().length))
                .toList();
    }

    /**
     * The biggest matching file in a directory.
     */
    public Optional<Entry> largest(String directory, String suffix) {
        return list(directory, suffix).stream().max(Comparator.comparingInt(Entry::getSize));
    }

    static String normalise(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("/") || p.startsWith("./")) {
            p = p.startsWith("/") ? p.substring(1) : p.substring(2);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

}
