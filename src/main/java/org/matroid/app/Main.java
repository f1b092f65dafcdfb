package org.matroid.app;

import org.matroid.engine.catalog.MatroidCatalog;
import org.matroid.engine.core.Matroid;

import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {
    /**
     * Prints rank, validity and circuit count of each catalog matroid.
     *
     * @param args command-line arguments (ignored).
     */
    public static void main(String[] args) {
        List<Matroid<?>> catalog = List.of(
                MatroidCatalog.u24(),
                MatroidCatalog.uniform(3, 5),
                MatroidCatalog.fano(),
                MatroidCatalog.nonFano(),
                MatroidCatalog.freeMatroid(3)
        );
        for (Matroid<?> matroid : catalog) {
            System.out.printf(
                    "%s: rank=%d size=%d valid=%s circuits=%d%n",
                    matroid.name().orElse("unnamed"),
                    matroid.rank(),
                    matroid.size(),
                    matroid.isValid(),
                    matroid.circuitFamily().size()
            );
        }
    }
}
