package com.wikisqldump;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class DumpStatementScannerTest {

    private static final TableSchema PAGELINKS = new TableSchema("pagelinks",
            List.of("pl_from", "pl_namespace", "pl_title", "pl_from_namespace"));

    private static List<RawTuple> scanAll(DumpStatementScanner scanner) {
        List<RawTuple> tuples = new ArrayList<>();
        scanner.tuples().forEach(tuples::add);
        return tuples;
    }

    private static List<RawTuple> scanAll(String dump) {
        return scanAll(new DumpStatementScanner(new StringReader(dump), PAGELINKS, 0));
    }

    @Test
    void tuples_singleStatement_yieldsTupleInteriors() {
        List<RawTuple> tuples = scanAll("INSERT INTO `pagelinks` VALUES (9773,0,'!',0),(15154,0,'!',0);\n");

        assertEquals(2, tuples.size());
        assertEquals("9773,0,'!',0", tuples.get(0).text());
        assertEquals("15154,0,'!',0", tuples.get(1).text());
        assertEquals("pagelinks", tuples.get(1).tableName());
        assertEquals(1, tuples.get(1).statementNumber());
        assertEquals(2, tuples.get(1).tupleInStatement());
        assertEquals(2, tuples.get(1).rowIndex());
    }

    @Test
    void tuples_parenthesesAndEscapesInsideQuotes_doNotEndTuple() {
        List<RawTuple> tuples = scanAll(
                "INSERT INTO `pagelinks` VALUES (1,0,'Foo_(bar)',0),(2,0,'It\\'s_)_\\\\',0);\n");

        assertEquals("1,0,'Foo_(bar)',0", tuples.get(0).text());
        assertEquals("2,0,'It\\'s_)_\\\\',0", tuples.get(1).text());
    }

    @Test
    void tuples_skipsDdlCommentsAndBlankLines() {
        String dump = "-- MySQL dump\n"
                + "\n"
                + "CREATE TABLE `pagelinks` (\n"
                + "  `pl_from` int(8) unsigned NOT NULL DEFAULT 0,\n"
                + "  PRIMARY KEY (`pl_from`)\n"
                + ") ENGINE=InnoDB;\n"
                + "/*!40000 ALTER TABLE `pagelinks` DISABLE KEYS */;\n"
                + "INSERT INTO `pagelinks` VALUES (1,0,'A',0);\n"
                + "LOCK TABLES `pagelinks` WRITE;\n"
                + "INSERT INTO `pagelinks` VALUES (2,0,'B',0);\n"
                + "UNLOCK TABLES;\n";

        List<RawTuple> tuples = scanAll(dump);

        assertEquals(2, tuples.size());
        assertEquals(2, tuples.get(1).statementNumber());
        assertEquals(1, tuples.get(1).tupleInStatement());
    }

    @Test
    void tuples_statementsForOtherTables_areSkipped() {
        String dump = "INSERT INTO `page` VALUES (1,0,'Skip;me',''),(2,0,'x','');\n"
                + "INSERT INTO `pagelinks` VALUES (3,0,'Keep',0);\n";
        DumpStatementScanner scanner = new DumpStatementScanner(new StringReader(dump), PAGELINKS, 0);

        List<RawTuple> tuples = scanAll(scanner);

        assertEquals(1, tuples.size());
        assertEquals("3,0,'Keep',0", tuples.get(0).text());
        assertEquals(1, scanner.skippedStatementCount());
        assertEquals(1, scanner.statementCount());
    }

    @Test
    void tuples_tuplesSpreadOverLines_areFound() {
        String dump = "insert into pagelinks values\n"
                + "  (1,0,'A',0),\n"
                + "  (2,0,'multi\nline',0)\n"
                + ";\n";

        List<RawTuple> tuples = scanAll(dump);

        assertEquals(2, tuples.size());
        assertEquals("2,0,'multi\nline',0", tuples.get(1).text());
    }

    @Test
    void tuples_matchingColumnList_isAccepted() {
        String dump = "INSERT INTO `pagelinks` (`pl_from`, `pl_namespace`, `pl_title`, `pl_from_namespace`)"
                + " VALUES (1,0,'A',0);\n";

        assertEquals(1, scanAll(dump).size());
    }

    @Test
    void tuples_differentColumnList_failsWithSchemaMismatch() {
        String dump = "INSERT INTO `pagelinks` (`pl_from`, `pl_title`, `pl_namespace`, `pl_from_namespace`)"
                + " VALUES (1,'A',0,0);\n";

        assertThrows(SchemaMismatchException.class, () -> scanAll(dump));
    }

    @Test
    void tuples_truncatedTuple_fails() {
        String dump = "INSERT INTO `pagelinks` VALUES (1,0,'A',0),(2,0,'unfinish";

        MalformedTupleException e = assertThrows(MalformedTupleException.class, () -> scanAll(dump));
        assertTrue(e.getMessage().contains("truncated"), e.getMessage());
    }

    @Test
    void tuples_missingTerminator_fails() {
        assertThrows(MalformedTupleException.class, () -> scanAll("INSERT INTO `pagelinks` VALUES (1,0,'A',0)"));
    }

    @Test
    void tuples_strayCharacterBetweenTuples_fails() {
        assertThrows(MalformedTupleException.class,
                () -> scanAll("INSERT INTO `pagelinks` VALUES (1,0,'A',0) x (2,0,'B',0);\n"));
    }

    @Test
    void tuples_insertWithoutValues_fails() {
        assertThrows(MalformedTupleException.class, () -> scanAll("INSERT INTO `pagelinks` SELECT 1;\n"));
    }

    @Test
    void tuples_statementLimit_stopsAfterLimit() {
        String dump = "INSERT INTO `pagelinks` VALUES (1,0,'A',0),(2,0,'B',0);\n"
                + "INSERT INTO `pagelinks` VALUES (3,0,'C',0);\n";
        DumpStatementScanner scanner = new DumpStatementScanner(new StringReader(dump), PAGELINKS, 1);

        assertEquals(2, scanAll(scanner).size());
        assertTrue(scanner.statementLimitReached());
        assertFalse(scanner.tuples().iterator().hasNext());
    }

    @Test
    void tuples_noInserts_isEmpty() {
        DumpStatementScanner scanner = new DumpStatementScanner(new StringReader("-- nothing\n"), PAGELINKS, 0);

        Iterator<RawTuple> it = scanner.tuples().iterator();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
        assertFalse(scanner.statementLimitReached());
    }

    @Test
    void tuples_twoStatementsOnOneLine_yieldsRowsOfBoth() {
        List<RawTuple> tuples = scanAll(
                "INSERT INTO `pagelinks` VALUES (1,0,'A',0);INSERT INTO `pagelinks` VALUES (2,0,'B',0);\n");

        assertEquals(2, tuples.size());
        assertEquals("2,0,'B',0", tuples.get(1).text());
        assertEquals(2, tuples.get(1).statementNumber());
    }

    @Test
    void tuples_targetAfterSkippedStatementOnSameLine_isFound() {
        DumpStatementScanner scanner = new DumpStatementScanner(new StringReader(
                "INSERT INTO `page` VALUES (1,0,'x',''); INSERT INTO `pagelinks` VALUES (3,0,'C',0);\r\n"),
                PAGELINKS, 0);

        List<RawTuple> tuples = scanAll(scanner);

        assertEquals(1, tuples.size());
        assertEquals("3,0,'C',0", tuples.get(0).text());
        assertEquals(1, scanner.skippedStatementCount());
    }

    @Test
    void tuples_trailingWhitespaceAfterTerminator_isAccepted() {
        assertEquals(2, scanAll("INSERT INTO `pagelinks` VALUES (1,0,'A',0);  \t\r\n"
                + "INSERT INTO `pagelinks` VALUES (2,0,'B',0);\n").size());
    }

    @Test
    void tuples_otherTextAfterTerminatorOnSameLine_fails() {
        MalformedTupleException e = assertThrows(MalformedTupleException.class,
                () -> scanAll("INSERT INTO `pagelinks` VALUES (1,0,'A',0); (2,0,'B',0);\n"));
        assertTrue(e.getMessage().contains("after ';'"), e.getMessage());
    }

    @Test
    void tuples_byteOrderMarkBeforeFirstInsert_isIgnored() {
        List<RawTuple> tuples = scanAll("\uFEFFINSERT INTO `pagelinks` VALUES (1,0,'A',0);\n");

        assertEquals(1, tuples.size());
        assertEquals("1,0,'A',0", tuples.get(0).text());
    }

    @Test
    void tuples_readFailure_surfacesAsUncheckedIOException() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
            }
        };
        DumpStatementScanner scanner = new DumpStatementScanner(failing, PAGELINKS, 0);

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> scanner.tuples().iterator());
        assertEquals("disk gone", e.getCause().getMessage());
    }

    @Test
    void tuples_largeStatement_buffersOnlyOneTuple() {
        int tupleCount = 200_000;
        DumpStatementScanner scanner = new DumpStatementScanner(new SyntheticStatementReader(tupleCount),
                PAGELINKS, 0);

        long count = 0;
        int longest = 0;
        for (RawTuple tuple : scanner.tuples()) {
            count++;
            longest = Math.max(longest, tuple.text().length());
        }

        assertEquals(tupleCount, count);
        assertEquals(longest, scanner.peakTupleLength());
        assertTrue(scanner.peakTupleLength() < 64, "peak " + scanner.peakTupleLength());
        assertTrue(scanner.charsConsumed() > (long) tupleCount * 10);
    }

    /**
     * Generates one INSERT statement with many tuples on the fly, so the test
     * itself never holds the whole dump in memory.
     */
    private static final class SyntheticStatementReader extends Reader {
        private final int tupleCount;
        private final StringBuilder pending = new StringBuilder("INSERT INTO `pagelinks` VALUES ");
        private int produced;
        private boolean finished;

        SyntheticStatementReader(int tupleCount) {
            this.tupleCount = tupleCount;
        }

        @Override
        public int read(char[] cbuf, int off, int len) {
            while (pending.length() < len && !finished) {
                if (produced == tupleCount) {
                    pending.append(";\n");
                    finished = true;
                } else {
                    if (produced > 0) {
                        pending.append(',');
                    }
                    produced++;
                    pending.append('(').append(produced).append(",0,'Title_").append(produced % 97).append("',0)");
                }
            }
            if (pending.length() == 0) {
                return -1;
            }
            int n = Math.min(len, pending.length());
            pending.getChars(0, n, cbuf, off);
            pending.delete(0, n);
            return n;
        }

        @Override
        public void close() {
        }
    }
}
