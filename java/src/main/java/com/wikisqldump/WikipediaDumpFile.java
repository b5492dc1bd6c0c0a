package com.wikisqldump;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * A Wikipedia SQL table dump named {@code WIKI-YYYYMMDD-TABLE.sql} or
 * {@code WIKI-YYYYMMDD-TABLE.sql.gz}, for example
 * {@code enwiki-20200901-page.sql.gz}.
 */
public final class WikipediaDumpFile {

    private static final Pattern FILE_NAME = Pattern.compile(
            "(?<basename>(?<wiki>[a-z]+)-(?<yyyymmdd>\\d{8})-(?<table>\\w+))(?<extension>\\.sql(?:\\.gz)?)");
    private static final int BUFFER_SIZE = 1 << 16;

    private final Path path;
    private final String wiki;
    private final String yyyymmdd;
    private final String tableName;
    private final String basename;
    private final boolean compressed;

    private WikipediaDumpFile(Path path, Matcher matcher) {
        this.path = path;
        this.wiki = matcher.group("wiki");
        this.yyyymmdd = matcher.group("yyyymmdd");
        this.tableName = matcher.group("table");
        this.basename = matcher.group("basename");
        this.compressed = ".sql.gz".equals(matcher.group("extension"));
    }

    /**
     * @throws ConfigurationException if the file name does not follow the dump naming pattern
     */
    public static WikipediaDumpFile of(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            throw new ConfigurationException("basename of filename " + fileName
                    + " does not match the required pattern \"WIKI-YYYYMMDD-TABLE_NAME.sql{.gz}\"");
        }
        return new WikipediaDumpFile(path, matcher);
    }

    /**
     * Opens the dump as UTF-8 text. Bytes that are not valid UTF-8 are dropped.
     */
    public Reader openReader() throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE);
        try {
            if (compressed) {
                in = new GZIPInputStream(in, BUFFER_SIZE);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        return new BufferedReader(new InputStreamReader(in, decoder), BUFFER_SIZE);
    }

    /**
     * @return {@code BASENAME.csv} in the working directory
     */
    public Path defaultOutput() {
        return Path.of(basename + ".csv");
    }

    public Path path() {
        return path;
    }

    public String wiki() {
        return wiki;
    }

    public String yyyymmdd() {
        return yyyymmdd;
    }

    public String tableName() {
        return tableName;
    }

    public String basename() {
        return basename;
    }

    public boolean compressed() {
        return compressed;
    }

    @Override
    public String toString() {
        return "WikipediaDumpFile(path=" + path + ", wiki=" + wiki + ", yyyymmdd=" + yyyymmdd
                + ", table=" + tableName + ", compressed=" + compressed + ")";
    }
}
