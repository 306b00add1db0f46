package com.libragraph.unwrap.core.convert;

import com.libragraph.unwrap.core.collect.Counts;
import com.libragraph.unwrap.core.collect.EntryCollector;
import com.libragraph.unwrap.core.collect.InputFailure;
import com.libragraph.unwrap.core.collect.LeafEntry;
import com.libragraph.unwrap.core.error.ConversionException;
import com.libragraph.unwrap.core.error.DecodeException;
import com.libragraph.unwrap.core.input.SourceInput;
import com.libragraph.unwrap.core.options.ConversionOptions;
import com.libragraph.unwrap.core.options.DecodeErrorPolicy;
import com.libragraph.unwrap.core.progress.ProgressEvent;
import com.libragraph.unwrap.core.progress.ProgressListener;
import com.libragraph.unwrap.core.walk.ArchiveWalker;
import com.libragraph.unwrap.core.walk.DecodeLayer;
import com.libragraph.unwrap.core.walk.LeafVisitor;
import com.libragraph.unwrap.formats.api.SkippedMember;
import com.libragraph.unwrap.formats.registry.FormatRegistry;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.ByteBudget;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One pass over the registered inputs: walk, filter, deduplicate, hand to the sink.
 *
 * <p>With one thread and the abort policy, leaves stream straight to the sink. Otherwise each
 * input is walked into its own buffer (in parallel when several threads are configured) and
 * the buffers are drained strictly in registration order, so the output and the deduplication
 * outcome never depend on the thread count.
 */
class ConversionRun {

    private static final Logger log = Logger.getLogger(ConversionRun.class);

    private final ConversionOptions options;
    private final ArchiveWalker walker;
    private final EntryCollector collector;
    private final ProgressListener listener;
    private final ProgressEvent emitted;
    private final ByteBudget runBudget;

    ConversionRun(FormatRegistry registry, ConversionOptions options, ProgressListener listener,
                  ProgressEvent emitted) {
        this.options = options;
        this.walker = new ArchiveWalker(registry, options.getMaxDepth());
        this.collector = new EntryCollector(options.getMinSize(),
                options.getMaxSize().isPresent() ? options.getMaxSize().getAsLong() : null,
                options.includeType(), options.isUnique());
        this.listener = listener;
        this.emitted = emitted;
        this.runBudget = options.getMaxExpandedBytesPerRun().isPresent()
                ? ByteBudget.of("run", options.getMaxExpandedBytesPerRun().getAsLong())
                : null;
    }

    Counts execute(List<SourceInput> inputs, LeafSink sink) {
        log.debugf("Starting run over %d inputs with %s", inputs.size(), options);
        if (options.getThreads() > 1 && inputs.size() > 1) {
            runParallel(inputs, sink);
        } else {
            runSequential(inputs, sink);
        }
        Counts counts = collector.counts();
        log.debugf("Run finished: read=%d skipped=%d deduplicated=%d written=%d failures=%d",
                counts.read(), counts.skipped(), counts.deduplicated(), counts.written(), counts.failures().size());
        return counts;
    }

    private void runSequential(List<SourceInput> inputs, LeafSink sink) {
        for (SourceInput input : inputs) {
            if (options.getDecodeErrorPolicy() == DecodeErrorPolicy.ABORT) {
                walkInto(input, entry -> emit(entry, sink));
            } else {
                drain(collect(input), sink);
            }
        }
    }

    private void runParallel(List<SourceInput> inputs, LeafSink sink) {
        int threads = options.getThreads();
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreads());
        try {
            Deque<Future<InputResult>> window = new ArrayDeque<>();
            Iterator<SourceInput> pending = inputs.iterator();
            while (pending.hasNext() || !window.isEmpty()) {
                while (pending.hasNext() && window.size() < threads * 2) {
                    SourceInput input = pending.next();
                    window.add(pool.submit(() -> collect(input)));
                }
                drain(await(window.poll()), sink);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private InputResult collect(SourceInput input) {
        List<LeafEntry> entries = new ArrayList<>();
        try {
            walkInto(input, entries::add);
            return InputResult.success(input, entries);
        } catch (DecodeException e) {
            if (options.getDecodeErrorPolicy() == DecodeErrorPolicy.ABORT) {
                throw e;
            }
            return InputResult.failed(input, e);
        }
    }

    private void walkInto(SourceInput input, Consumer<LeafEntry> consumer) {
        String source = input.identity();
        log.debugf("Walking %s (%d bytes)", source, input.rawSize());
        BinaryData data = input.open();
        try {
            walker.walk(source, data, inputBudget(source), new LeafVisitor() {
                @Override
                public void visitLeaf(String path, BinaryData leaf, List<DecodeLayer> layers) {
                    collector.admit(source, path, leaf).ifPresentOrElse(consumer,
                            () -> listener.onProgress(path, ProgressEvent.SKIPPED));
                }

                @Override
                public void visitSkipped(String path, SkippedMember member) {
                    collector.skipEntry();
                }
            });
        } catch (DecodeException e) {
            if (options.getDecodeErrorPolicy() == DecodeErrorPolicy.ABORT) {
                log.errorf("Failed to decode %s: %s", source, e.getMessage());
            }
            throw e;
        }
    }

    private void drain(InputResult result, LeafSink sink) {
        if (result.isFailed()) {
            DecodeException failure = result.failure();
            String source = result.input().identity();
            log.warnf("Skipping input %s: %s", source, failure.getMessage());
            collector.recordFailure(new InputFailure(source, failure.pathPrefix(), failure.getMessage()));
            listener.onProgress(source, ProgressEvent.INPUT_FAILED);
            return;
        }
        for (LeafEntry entry : result.entries()) {
            emit(entry, sink);
        }
    }

    private void emit(LeafEntry entry, LeafSink sink) {
        if (!collector.firstOccurrence(entry)) {
            listener.onProgress(entry.path(), ProgressEvent.DUPLICATE);
            return;
        }
        sink.accept(entry);
        collector.recordWritten();
        listener.onProgress(entry.path(), emitted);
    }

    private ByteBudget inputBudget(String source) {
        if (options.getMaxExpandedBytesPerInput().isPresent()) {
            long limit = options.getMaxExpandedBytesPerInput().getAsLong();
            String scope = "input " + source;
            return runBudget != null ? runBudget.child(scope, limit) : ByteBudget.of(scope, limit);
        }
        return runBudget != null ? runBudget : ByteBudget.unlimited();
    }

    private static InputResult await(Future<InputResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted while waiting for an input", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ConversionException("Input worker failed", cause);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "unwrap-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
