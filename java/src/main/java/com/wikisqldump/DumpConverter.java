package com.wikisqldump;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.logging.Level;

import lombok.extern.java.Log;

/**
 * Converts the INSERT statements of one table into CSV.
 * <p>
 * The pipeline is strictly streaming: each tuple is scanned, tokenized,
 * bound to the schema, filtered and written before the next one is read.
 * The first error aborts the run.
 */
@Log
public class DumpConverter {

    private final TableSchema schema;
    private final RowFilter filter;
    private final ConverterOptions options;
    private final ValueTokenizer tokenizer = new ValueTokenizer();
    private final RowAssembler assembler;

    /**
     * @throws ConfigurationException if the filter spec does not fit the schema
     */
    public DumpConverter(TableSchema schema, FilterSpec spec, ConverterOptions options) {
        this.schema = schema;
        this.filter = new RowFilter(schema, spec);
        this.options = options;
        this.assembler = new RowAssembler(schema);
    }

    public List<String> outputColumns() {
        return filter.outputColumns();
    }

    public ConversionResult convert(Reader in, Writer out) throws IOException {
        long start = System.nanoTime();
        log.log(Level.INFO, "Converting table {0} to columns {1}",
                new Object[] { schema.name(), filter.outputColumns() });

        DumpStatementScanner scanner = new DumpStatementScanner(in, schema, options.maxStatements());
        CsvRowWriter csv = new CsvRowWriter(out);
        csv.writeHeader(filter.outputColumns());

        long parsed = 0;
        long written = 0;
        long filtered = 0;
        try {
            for (RawTuple tuple : scanner.tuples()) {
                Row row = assembler.assemble(tuple, tokenize(tuple));
                parsed++;
                if (filter.accepts(row)) {
                    csv.writeRecord(filter.project(row));
                    written++;
                } else {
                    filtered++;
                }

                if (parsed % ConverterOptions.LISTENER_INTERVAL == 0) {
                    options.progressListener().accept(scanner.charsConsumed());
                }
                if (parsed % options.progressInterval() == 0) {
                    logProgress(start, parsed, written, filtered);
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        csv.flush();
        options.progressListener().accept(scanner.charsConsumed());

        if (scanner.statementLimitReached()) {
            log.log(Level.INFO, "Stopped after {0} INSERT statements", scanner.statementCount());
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        ConversionResult result = new ConversionResult(schema.name(), scanner.statementCount(),
                scanner.skippedStatementCount(), parsed, written, filtered, scanner.peakTupleLength(), elapsedMs,
                scanner.statementLimitReached());
        log.info(() -> String.format("Finished table %s: %,d statements, %,d rows parsed, %,d written, "
                + "%,d skipped by allow/block lists in %d ms", result.tableName(), result.statements(),
                result.rowsParsed(), result.rowsWritten(), result.rowsFiltered(), result.elapsedMs()));
        return result;
    }

    private List<FieldToken> tokenize(RawTuple tuple) {
        try {
            return tokenizer.tokenize(tuple.text());
        } catch (MalformedTupleException e) {
            throw new MalformedTupleException("Row " + tuple.rowIndex() + " (tuple " + tuple.tupleInStatement()
                    + " of INSERT statement " + tuple.statementNumber() + ") is malformed: " + e.getMessage(), e);
        }
    }

    private void logProgress(long start, long parsed, long written, long filtered) {
        double seconds = (System.nanoTime() - start) / 1e9;
        log.info(() -> String.format("  time elapsed: %.2fs, rows parsed per second: %.2f, rows parsed: %d, "
                + "rows written: %d, rows skipped b/c allow/block lists: %d",
                seconds, parsed / Math.max(seconds, 1e-9), parsed, written, filtered));
    }
}
