package com.wikisqldump;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cells of one output line. A {@code null} cell is an SQL NULL.
 */
public record OutputRecord(List<String> cells) {

    public OutputRecord {
        // List.copyOf rejects null elements
        cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }
}
