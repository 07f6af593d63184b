package com.example.cuttingboard.reactor;

import com.example.cuttingboard.CuttingBoard;
import com.example.cuttingboard.Dataset;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.slice.Slice;
import com.example.cuttingboard.slice.SliceRows;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Reactor front-end of a {@link CuttingBoard}.
 *
 * <p>Slicing scans the dataset and blocks on the cache lock, so every call
 * runs on a scheduler suited to blocking work, {@link Schedulers#boundedElastic()}
 * unless another one is given. Nothing happens until subscription.
 *
 * <pre>{@code
 * ReactiveCuttingBoard board = new ReactiveCuttingBoard(
 *     new CuttingBoard(cube, ReactiveCuttingBoard.dataset(salesFlux)));
 *
 * board.rows(query.setPivot("month"))
 *     .take(10)
 *     .subscribe(row -> render(row));
 * }</pre>
 */
public class ReactiveCuttingBoard {

    private final CuttingBoard board;
    private final Scheduler scheduler;

    public ReactiveCuttingBoard(CuttingBoard board) {
        this(board, Schedulers.boundedElastic());
    }

    public ReactiveCuttingBoard(CuttingBoard board, Scheduler scheduler) {
        this.board = board;
        this.scheduler = scheduler;
    }

    /**
     * A dataset fed by a finite Flux, collected the first time the dataset is read.
     */
    public static Dataset dataset(Flux<?> records) {
        return Dataset.lazy(() -> {
            List<?> rv = records.collectList().block();
            return rv != null ? rv : List.of();
        });
    }

    public CuttingBoard board() {
        return board;
    }

    public Mono<Slice> slice(CubeQuery query) {
        return Mono.fromCallable(() -> board.slice(query))
                .subscribeOn(scheduler);
    }

    /**
     * Emits the records of the dataset that pass the filters of the query.
     */
    public Flux<Object> filter(CubeQuery query) {
        return Mono.fromCallable(() -> board.filter(query))
                .flatMapMany(Flux::fromIterable)
                .subscribeOn(scheduler);
    }

    /**
     * Emits the table rows of the slice of a query, in row order.
     */
    public Flux<SliceRows.Row> rows(CubeQuery query) {
        return slice(query)
                .flatMapMany(slice -> Flux.fromIterable(SliceRows.of(slice)));
    }
}
