package org.dxworks.adocframe;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class AsciiDocFiles {

    private static final List<String> EXTENSIONS = List.of(".adoc", ".asciidoc", ".asc", ".ad");

    public static boolean isAsciiDoc(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(fileName::endsWith);
    }

    /**
     * {@code guide.adoc} becomes {@code guide.html}.
     */
    public static String htmlFileName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return stem + ".html";
    }
}
