package org.mazesat.service;

import org.mazesat.encoding.ProblemEncoder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Esecuzione asincrona delle richieste.
 *
 * Ogni richiesta diventa un task con sessione e motore propri. Il chiamante
 * annulla con {@code future.cancel(true)}: l'interruzione del thread viene
 * rilevata dal motore, che risponde UNKNOWN, e la pipeline riporta CANCELLED.
 */
public class SolveWorker implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SolveWorker.class.getName());

    private final SolvePipeline pipeline;
    private final ExecutorService executor;

    public SolveWorker(SolvePipeline pipeline) {
        this(pipeline, 1);
    }

    public SolveWorker(SolvePipeline pipeline, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Numero di thread deve essere >= 1: " + threads);
        }
        this.pipeline = pipeline;
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "mazesat-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public <R> Future<SolveOutcome<R>> submit(ProblemEncoder<R> encoder, ProgressListener listener) {
        LOGGER.fine("Richiesta accodata: " + encoder.describe());
        return executor.submit(() -> pipeline.run(encoder, listener));
    }

    public <R> Future<SolveOutcome<R>> submit(ProblemEncoder<R> encoder) {
        return submit(encoder, ProgressListener.none());
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Worker non terminati entro 5 secondi");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
