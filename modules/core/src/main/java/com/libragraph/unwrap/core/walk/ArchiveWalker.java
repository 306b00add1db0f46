package com.libragraph.unwrap.core.walk;

import com.libragraph.unwrap.core.error.DecodeException;
import com.libragraph.unwrap.core.error.ExpansionLimitExceededException;
import com.libragraph.unwrap.core.error.RecursionLimitExceededException;
import com.libragraph.unwrap.core.error.SourceReadException;
import com.libragraph.unwrap.formats.api.ArchiveMember;
import com.libragraph.unwrap.formats.api.FormatException;
import com.libragraph.unwrap.formats.api.Handler;
import com.libragraph.unwrap.formats.api.SkippedMember;
import com.libragraph.unwrap.formats.registry.FormatRegistry;
import com.libragraph.unwrap.formats.registry.SniffResult;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.BudgetExceededException;
import com.libragraph.unwrap.util.buffer.ByteBudget;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Unwraps one source down to its leaves: sniff, decompress or expand, repeat.
 *
 * <p>Traversal runs on an explicit stack of frames, so nesting depth never touches the
 * call stack. Containers are expanded lazily, one member at a time, which keeps the output
 * in depth-first member-declaration order. Every decode step counts towards the depth limit.
 */
public class ArchiveWalker {

    private static final Logger log = Logger.getLogger(ArchiveWalker.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final FormatRegistry registry;
    private final int maxDepth;

    public ArchiveWalker(FormatRegistry registry, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got: " + maxDepth);
        }
        this.registry = registry;
        this.maxDepth = maxDepth;
    }

    public ArchiveWalker(FormatRegistry registry) {
        this(registry, DEFAULT_MAX_DEPTH);
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Walks {@code data} and reports every leaf to {@code visitor}.
     * The walker takes ownership of {@code data} and closes it.
     *
     * @param source identity of the source, used as the root of every logical path
     * @param budget charged for every byte materialized while decoding
     * @throws DecodeException if the data is malformed, too deep or expands past the budget
     */
    public void walk(String source, BinaryData data, ByteBudget budget, LeafVisitor visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(source, data, 0, List.of()));
        try {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.handler != null) {
                    ArchiveMember member = nextMember(source, frame);
                    reportSkipped(frame, visitor);
                    if (member == null) {
                        stack.pop();
                        frame.close();
                    } else {
                        stack.push(new Frame(frame.path + "/" + member.name(), member.data(),
                                frame.depth, frame.layers));
                    }
                    continue;
                }
                stack.pop();
                expand(source, frame, budget, stack, visitor);
            }
        } finally {
            while (!stack.isEmpty()) {
                stack.pop().close();
            }
        }
    }

    private void expand(String source, Frame frame, ByteBudget budget, Deque<Frame> stack, LeafVisitor visitor) {
        SniffResult sniff;
        try {
            sniff = registry.sniff(frame.data);
        } catch (UncheckedIOException e) {
            frame.close();
            throw new SourceReadException(source, e);
        } catch (RuntimeException e) {
            frame.close();
            throw translate(e, source, frame.path, frame.layers);
        }

        if (sniff.isLeaf()) {
            if (frame.data.size() > BinaryData.MAX_ARRAY_SIZE) {
                frame.close();
                throw new DecodeException("Leaf of " + frame.data.size() + " bytes exceeds the largest storable value",
                        source, frame.path, frame.layers, null);
            }
            try {
                log.tracef("Leaf %s (%d bytes)", frame.path, frame.data.size());
                visitor.visitLeaf(frame.path, frame.data, frame.layers);
            } finally {
                frame.close();
            }
            return;
        }

        DecodeLayer layer = sniff.compression().isCompressed()
                ? DecodeLayer.of(sniff.compression(), frame.path)
                : DecodeLayer.of(sniff.archive(), frame.path);
        List<DecodeLayer> layers = append(frame.layers, layer);
        int depth = frame.depth + 1;
        if (depth > maxDepth) {
            frame.close();
            throw new RecursionLimitExceededException(maxDepth, source, frame.path, layers);
        }

        if (layer.isContainer()) {
            Handler handler;
            try {
                handler = registry.handlerFor(sniff.archive()).createInstance(frame.data, budget);
            } catch (RuntimeException e) {
                frame.close();
                throw translate(e, source, frame.path, layers);
            }
            log.debugf("Expanding %s container at %s (depth %d)", layer.label(), frame.path, depth);
            Frame container = new Frame(frame.path, frame.data, depth, layers);
            container.handler = handler;
            stack.push(container);
            return;
        }

        BinaryData decoded;
        try {
            decoded = registry.codecFor(sniff.compression()).decode(frame.data, budget);
        } catch (RuntimeException e) {
            throw translate(e, source, frame.path, layers);
        } finally {
            frame.close();
        }
        log.debugf("Decoded %s layer at %s: %d bytes (depth %d)", layer.label(), frame.path, decoded.size(), depth);
        stack.push(new Frame(frame.path, decoded, depth, layers));
    }

    private ArchiveMember nextMember(String source, Frame frame) {
        try {
            return frame.handler.nextMember();
        } catch (RuntimeException e) {
            throw translate(e, source, frame.path, frame.layers);
        }
    }

    private static void reportSkipped(Frame frame, LeafVisitor visitor) {
        List<SkippedMember> skipped = frame.handler.skipped();
        while (frame.reportedSkips < skipped.size()) {
            SkippedMember member = skipped.get(frame.reportedSkips++);
            log.tracef("Skipping %s entry %s/%s", member.type(), frame.path, member.name());
            visitor.visitSkipped(frame.path + "/" + member.name(), member);
        }
    }

    private static RuntimeException translate(RuntimeException e, String source, String path,
                                              List<DecodeLayer> layers) {
        if (e instanceof BudgetExceededException budget) {
            return new ExpansionLimitExceededException(budget, source, path, layers);
        }
        if (e instanceof FormatException) {
            return new DecodeException(e.getMessage(), source, path, layers, e);
        }
        if (e instanceof UncheckedIOException io) {
            return new DecodeException("I/O failure while decoding", source, path, layers, io);
        }
        if (e instanceof IllegalStateException || e instanceof IllegalArgumentException) {
            return new DecodeException("Decoder failure: " + e.getMessage(), source, path, layers, e);
        }
        return e;
    }

    private static List<DecodeLayer> append(List<DecodeLayer> layers, DecodeLayer layer) {
        List<DecodeLayer> result = new ArrayList<>(layers.size() + 1);
        result.addAll(layers);
        result.add(layer);
        return Collections.unmodifiableList(result);
    }

    /**
     * Pending work: a payload still to be sniffed, or an open container being iterated.
     * A frame owns its data; a container frame's handler owns it instead.
     */
    private static final class Frame {
        final String path;
        final BinaryData data;
        final int depth;
        final List<DecodeLayer> layers;
        Handler handler;
        int reportedSkips;

        Frame(String path, BinaryData data, int depth, List<DecodeLayer> layers) {
            this.path = path;
            this.data = data;
            this.depth = depth;
            this.layers = layers;
        }

        void close() {
            if (handler != null) {
                handler.close();
                return;
            }
            try {
                data.close();
            } catch (IOException e) {
                log.debugf(e, "Failed to release buffer for %s", path);
            }
        }
    }
}
