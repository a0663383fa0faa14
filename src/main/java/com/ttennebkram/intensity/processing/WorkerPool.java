package com.ttennebkram.intensity.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of daemon worker threads shared by the data-parallel strategies.
 *
 * Created once and reused for every call. {@link #run(List)} blocks the caller until
 * every submitted chunk has finished, so a call never returns with workers still
 * writing into its buffers.
 */
public class WorkerPool implements AutoCloseable {

    private static volatile WorkerPool shared;

    private final int parallelism;
    private final ThreadPoolExecutor executor;
    private final ThreadLocal<Boolean> onWorker = ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Work on the half-open range {@code [start, end)}.
     */
    @FunctionalInterface
    public interface RangeTask {
        void run(int start, int end);
    }

    /**
     * @param parallelism number of worker threads; 0 or less means one per available processor
     */
    public WorkerPool(int parallelism) {
        this.parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                this.parallelism, this.parallelism, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> {
                    Runnable marked = () -> {
                        onWorker.set(Boolean.TRUE);
                        runnable.run();
                    };
                    Thread t = new Thread(marked, "intensity-worker-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * The process-wide pool, sized to the number of available processors on first use.
     */
    public static WorkerPool shared() {
        WorkerPool pool = shared;
        if (pool == null) {
            synchronized (WorkerPool.class) {
                pool = shared;
                if (pool == null) {
                    pool = new WorkerPool(0);
                    shared = pool;
                    System.out.println("[WorkerPool] Started shared pool with " + pool.parallelism + " workers");
                }
            }
        }
        return pool;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Split {@code [0, length)} into consecutive ranges of at most {@code chunkSize} and run
     * {@code task} on each range in parallel. Returns when all ranges are done.
     *
     * @throws WorkerFailureException if any range fails
     */
    public void forEachRange(int length, int chunkSize, RangeTask task) {
        if (length <= 0) {
            return;
        }
        int step = Math.max(1, chunkSize);
        if (step >= length) {
            // One chunk: no point in handing it to another thread
            runInline(task, 0, length);
            return;
        }
        List<Callable<Void>> chunks = new ArrayList<>((length + step - 1) / step);
        for (int start = 0; start < length; start += step) {
            final int from = start;
            final int to = Math.min(length, start + step);
            chunks.add(() -> {
                task.run(from, to);
                return null;
            });
        }
        run(chunks);
    }

    /**
     * Chunk size that gives each worker a few chunks, but never less than {@code minChunk}.
     */
    public int chunkSizeFor(int length, int minChunk) {
        int target = parallelism * 4;
        int size = (length + target - 1) / target;
        return Math.max(Math.max(1, minChunk), size);
    }

    /**
     * Run all tasks and wait for every one of them.
     * Called from one of this pool's own workers, the tasks run on that worker in order,
     * since waiting on the queue behind it could block every worker.
     *
     * @throws WorkerFailureException if any task throws or the caller is interrupted
     */
    public void run(List<? extends Callable<Void>> tasks) {
        if (isWorkerThread()) {
            runAllInline(tasks);
            return;
        }
        List<Future<Void>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerFailureException("Interrupted while waiting for workers", e);
        }

        WorkerFailureException failure = null;
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = new WorkerFailureException("Worker failed: " + e.getCause(), e.getCause());
                } else {
                    failure.addSuppressed(e.getCause());
                }
            } catch (InterruptedException e) {
                // invokeAll already waited, so this only happens on a pending interrupt
                Thread.currentThread().interrupt();
                throw new WorkerFailureException("Interrupted while collecting worker results", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * True when the calling thread belongs to this pool.
     */
    public boolean isWorkerThread() {
        return onWorker.get();
    }

    private static void runAllInline(List<? extends Callable<Void>> tasks) {
        WorkerFailureException failure = null;
        for (Callable<Void> task : tasks) {
            try {
                task.call();
            } catch (Exception | Error e) {
                if (failure == null) {
                    failure = new WorkerFailureException("Worker failed: " + e, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void runInline(RangeTask task, int start, int end) {
        try {
            task.run(start, end);
        } catch (RuntimeException | Error e) {
            throw new WorkerFailureException("Worker failed: " + e, e);
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stop the worker threads. The shared pool is never closed.
     */
    @Override
    public void close() {
        if (this == shared) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
