package com.conveyor.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, ordered set of substitution values, e.g. PYTHON_VERSION = 3.9..3.12.
 * Values may be empty here; the matrix expander rejects that at compile time.
 */
public record MatrixAxis(String name, List<String> values) {

    public MatrixAxis {
        // List.copyOf rejects null elements; keep them so validation can report them.
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static MatrixAxis of(String name, String... values) {
        return new MatrixAxis(name, List.of(values));
    }
}
