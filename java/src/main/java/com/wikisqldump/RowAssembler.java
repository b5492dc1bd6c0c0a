package com.wikisqldump;

import java.util.List;

/**
 * Binds tokenized tuples to a {@link TableSchema}.
 */
public class RowAssembler {

    private final TableSchema schema;

    public RowAssembler(TableSchema schema) {
        this.schema = schema;
    }

    /**
     * @throws SchemaMismatchException if the token count differs from the
     *                                 column count; a silent column shift is
     *                                 never acceptable
     */
    public Row assemble(RawTuple tuple, List<FieldToken> tokens) {
        if (tokens.size() != schema.size()) {
            throw new SchemaMismatchException(schema.name(), tuple.rowIndex(), schema.size(), tokens.size(),
                    tuple.text());
        }
        return new Row(schema, tuple.rowIndex(), tokens);
    }
}
