package org.dxworks.adocframe;

import org.dxworks.adocframe.model.outline.DocumentOutline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path dir;

    @Test
    void collects_asciidoc_files_in_sorted_order() throws IOException {
        Path b = write("b.adoc", "B\n");
        Path a = write("nested/a.asciidoc", "A\n");
        write("notes.txt", "ignored\n");
        write("README.md", "ignored\n");

        List<Path> files = App.collectAsciiDocFiles(dir, 100);

        assertEquals(List.of(b, a), files);
    }

    @Test
    void skips_files_longer_than_the_limit() throws IOException {
        write("short.adoc", "one\ntwo\n");
        write("long.adoc", "one\ntwo\nthree\n");

        List<Path> files = App.collectAsciiDocFiles(dir, 2);

        assertEquals(1, files.size());
        assertEquals("short.adoc", files.get(0).getFileName().toString());
    }

    @Test
    void single_file_input() throws IOException {
        Path file = write("guide.adoc", "Text\n");
        Path other = write("guide.txt", "Text\n");

        assertEquals(List.of(file), App.collectAsciiDocFiles(file, 100));
        assertTrue(App.collectAsciiDocFiles(other, 100).isEmpty());
    }

    @Test
    void html_target_mirrors_the_input_layout() throws IOException {
        Path file = write("docs/guide.adoc", "Text\n");
        Path htmlDir = dir.resolve("out");

        assertEquals(htmlDir.resolve("docs/guide.html"), App.htmlTarget(dir, file, htmlDir));
        assertEquals(htmlDir.resolve("guide.html"), App.htmlTarget(file, file, htmlDir));
    }

    @Test
    void recognises_asciidoc_extensions() {
        assertTrue(AsciiDocFiles.isAsciiDoc(Paths.get("a.adoc")));
        assertTrue(AsciiDocFiles.isAsciiDoc(Paths.get("a.ASCIIDOC")));
        assertTrue(AsciiDocFiles.isAsciiDoc(Paths.get("dir/a.asc")));
        assertTrue(AsciiDocFiles.isAsciiDoc(Paths.get("a.ad")));
        assertFalse(AsciiDocFiles.isAsciiDoc(Paths.get("a.md")));
        assertEquals("guide.html", AsciiDocFiles.htmlFileName(Paths.get("docs/guide.adoc")));
        assertEquals("README.html", AsciiDocFiles.htmlFileName(Paths.get("README")));
    }

    @Test
    void analyzes_a_file_into_an_outline() throws IOException {
        Path file = write("doc.adoc", "= Doc\n\nIntro\n\n== Part\n\n* item\n");

        DocumentOutline outline = App.analyzeFile(file, AdocframeConfig.with(100, 8, true));

        assertEquals("Doc", outline.title);
        assertEquals("paragraph", outline.preamble.elements.get(0).type);
        assertEquals("Part", outline.sections.get(0).heading);
        assertEquals("list", outline.sections.get(0).elements.get(0).type);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
