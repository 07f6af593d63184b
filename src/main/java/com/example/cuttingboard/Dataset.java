package com.example.cuttingboard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The records a cutting board aggregates.
 *
 * <p>A dataset wraps a list, an iterable or a supplier of records. It is
 * materialized into a list the first time it is read and reused for every
 * later scan; concurrent first reads materialize it only once.
 *
 * <pre>{@code
 * Dataset sales = Dataset.lazy(() -> repository.findAll());
 * List<Object> records = sales.records();   // calls findAll()
 * sales.records();                           // same list, no call
 * }</pre>
 */
public final class Dataset {

    private final Supplier<? extends Iterable<?>> source;
    private volatile List<Object> records;

    private Dataset(Supplier<? extends Iterable<?>> source, List<Object> records) {
        this.source = source;
        this.records = records;
    }

    /**
     * Wraps a list as it is, without copying it.
     */
    public static Dataset of(List<?> records) {
        Objects.requireNonNull(records, "records");
        return new Dataset(() -> records, Collections.unmodifiableList(records));
    }

    public static Dataset of(Iterable<?> records) {
        Objects.requireNonNull(records, "records");
        return new Dataset(() -> records, null);
    }

    /**
     * A dataset whose records are produced by the supplier on first read.
     */
    public static Dataset lazy(Supplier<? extends Iterable<?>> supplier) {
        return new Dataset(Objects.requireNonNull(supplier, "supplier"), null);
    }

    /**
     * Returns the records, materializing them on the first call.
     *
     * @throws DataException if the source fails or yields {@code null}
     */
    public List<Object> records() {
        List<Object> rv = records;
        if (rv == null) {
            synchronized (this) {
                rv = records;
                if (rv == null) {
                    rv = materialize();
                    records = rv;
                }
            }
        }
        return rv;
    }

    public boolean isMaterialized() {
        return records != null;
    }

    private List<Object> materialize() {
        Iterable<?> iterable;
        List<Object> rv = new ArrayList<>();
        try {
            iterable = source.get();
            if (iterable == null) {
                throw new DataException("dataset source returned no records");
            }
            for (Object record : iterable) {
                rv.add(record);
            }
        } catch (CubeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataException("failed to read dataset: " + e.getMessage(), e);
        }
        return Collections.unmodifiableList(rv);
    }
}
