package com.wikisqldump;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WikipediaDumpFileTest {

    private static String readAll(Reader reader) throws IOException {
        try (BufferedReader in = new BufferedReader(reader)) {
            StringBuilder sb = new StringBuilder();
            int c;
            while ((c = in.read()) != -1) {
                sb.append((char) c);
            }
            return sb.toString();
        }
    }

    @Test
    void of_compressedName_parsesParts() {
        WikipediaDumpFile dump = WikipediaDumpFile.of(Path.of("/data/enwiki-20200901-page_props.sql.gz"));

        assertEquals("enwiki", dump.wiki());
        assertEquals("20200901", dump.yyyymmdd());
        assertEquals("page_props", dump.tableName());
        assertEquals("enwiki-20200901-page_props", dump.basename());
        assertTrue(dump.compressed());
        assertEquals(Path.of("enwiki-20200901-page_props.csv"), dump.defaultOutput());
    }

    @Test
    void of_plainName_isUncompressed() {
        assertFalse(WikipediaDumpFile.of(Path.of("simplewiki-20200901-page.sql")).compressed());
    }

    @Test
    void of_badNames_fail() {
        assertThrows(ConfigurationException.class, () -> WikipediaDumpFile.of(Path.of("page.sql")));
        assertThrows(ConfigurationException.class, () -> WikipediaDumpFile.of(Path.of("enwiki-2020-page.sql")));
        assertThrows(ConfigurationException.class,
                () -> WikipediaDumpFile.of(Path.of("enwiki-20200901-page.csv")));
    }

    @Test
    void openReader_gzipFile_decompressesUtf8(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("dewiki-20200901-redirect.sql.gz");
        String text = "INSERT INTO `redirect` VALUES (1,0,'Straße','',NULL);\n";
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(text.getBytes(StandardCharsets.UTF_8));
        }

        assertEquals(text, readAll(WikipediaDumpFile.of(file).openReader()));
    }

    @Test
    void openReader_invalidUtf8_isDropped(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("enwiki-20200901-category.sql");
        Files.write(file, new byte[] { 'a', (byte) 0xff, 'b', '\n' });

        assertEquals("ab\n", readAll(WikipediaDumpFile.of(file).openReader()));
    }
}
