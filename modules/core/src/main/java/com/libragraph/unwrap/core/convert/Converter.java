package com.libragraph.unwrap.core.convert;

import com.libragraph.unwrap.core.collect.Counts;
import com.libragraph.unwrap.core.error.OutputWriteException;
import com.libragraph.unwrap.core.error.SourceReadException;
import com.libragraph.unwrap.core.extract.LeafDescriptor;
import com.libragraph.unwrap.core.extract.LeafExtractor;
import com.libragraph.unwrap.core.input.BufferSource;
import com.libragraph.unwrap.core.input.FileSource;
import com.libragraph.unwrap.core.input.InputRecord;
import com.libragraph.unwrap.core.input.SourceInput;
import com.libragraph.unwrap.core.options.ConversionOptions;
import com.libragraph.unwrap.core.output.ParquetTableWriter;
import com.libragraph.unwrap.core.output.TableWriter;
import com.libragraph.unwrap.core.progress.ProgressEvent;
import com.libragraph.unwrap.core.progress.ProgressListener;
import com.libragraph.unwrap.formats.registry.FormatRegistry;
import com.libragraph.unwrap.types.FormatKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Entry point: register inputs, then convert them to a Parquet table or extract them to files.
 *
 * <p>Registration sniffs the top level of each input and records it; the full walk happens
 * only when a run is requested. Options are read once at the start of each run, so changing
 * them afterwards affects only later runs. A converter is not meant to be shared between threads.
 */
public class Converter {

    private static final Logger log = Logger.getLogger(Converter.class);

    private final ConversionOptions options;
    private final FormatRegistry registry;
    private final List<SourceInput> sources = new ArrayList<>();
    private final List<InputRecord> records = new ArrayList<>();
    private ProgressListener progressListener = ProgressListener.NONE;

    public Converter(ConversionOptions options, FormatRegistry registry) {
        this.options = Objects.requireNonNull(options, "options");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Converter(ConversionOptions options) {
        this(options, FormatRegistry.defaults());
    }

    public Converter() {
        this(new ConversionOptions());
    }

    public ConversionOptions options() {
        return options;
    }

    /**
     * Listener notified during {@link #convert} runs.
     */
    public void setProgressListener(ProgressListener listener) {
        this.progressListener = listener == null ? ProgressListener.NONE : listener;
    }

    /**
     * Registers a file. Its identity is the path as given.
     *
     * @throws SourceReadException if the file is missing or unreadable
     */
    public InputRecord addPath(Path path) {
        return register(FileSource.of(path));
    }

    /**
     * Registers an in-memory input. The array is not copied and must not change until the run ends.
     */
    public InputRecord addBuffer(String identity, byte[] data) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(data, "data");
        return register(new BufferSource(identity, data));
    }

    /**
     * Registers every regular file below {@code directory}, in sorted path order.
     */
    public List<InputRecord> addDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException | UncheckedIOException e) {
            throw new SourceReadException(directory.toString(), e);
        }
        List<InputRecord> added = new ArrayList<>(files.size());
        for (Path file : files) {
            added.add(addPath(file));
        }
        return added;
    }

    /**
     * Every registration so far, in order.
     */
    public List<InputRecord> inputs() {
        return List.copyOf(records);
    }

    /**
     * Writes one Parquet row per surviving leaf to {@code output}, replacing any existing file.
     * If the run fails, no file is left at {@code output}.
     */
    public Counts convert(Path output) {
        log.infof("Converting %d inputs to %s", sources.size(), output);
        TableWriter writer = ParquetTableWriter.create(output, options.compressionSpec());
        try {
            return convertTo(writer);
        } catch (RuntimeException e) {
            discard(output, e);
            throw e;
        }
    }

    private static void discard(Path output, RuntimeException failure) {
        try {
            Files.deleteIfExists(output);
            log.debugf("Removed incomplete output %s", output);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Writes the Parquet table to {@code output}. The stream is flushed but not closed.
     * A failed run may leave a partial table in the stream.
     */
    public Counts convert(OutputStream output) {
        log.infof("Converting %d inputs to a stream", sources.size());
        return convertTo(ParquetTableWriter.create(output, options.compressionSpec()));
    }

    private Counts convertTo(TableWriter writer) {
        ConversionRun run = new ConversionRun(registry, options.copy(), progressListener, ProgressEvent.WRITTEN);
        Counts counts;
        try (writer) {
            counts = run.execute(List.copyOf(sources), writer::write);
        }
        log.infof("Wrote %d rows (%d read, %d skipped, %d deduplicated)",
                counts.written(), counts.read(), counts.skipped(), counts.deduplicated());
        return counts;
    }

    /**
     * Writes every surviving leaf as a file below {@code destinationDir} and indexes them in
     * {@code unwrap-index.json}. The same filters apply as for {@link #convert(Path)}.
     *
     * @param listener called after each processed leaf, may be null
     */
    public List<LeafDescriptor> extract(Path destinationDir, ProgressListener listener) {
        try {
            Files.createDirectories(destinationDir);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to create extraction directory " + destinationDir, e);
        }
        log.infof("Extracting %d inputs to %s", sources.size(), destinationDir);

        LeafExtractor extractor = new LeafExtractor(destinationDir);
        ConversionRun run = new ConversionRun(registry, options.copy(),
                listener == null ? ProgressListener.NONE : listener, ProgressEvent.EXTRACTED);
        Counts counts = run.execute(List.copyOf(sources), extractor::write);
        extractor.writeIndex();

        log.infof("Extracted %d leaves (%d read, %d skipped, %d deduplicated)",
                counts.written(), counts.read(), counts.skipped(), counts.deduplicated());
        return extractor.descriptors();
    }

    private InputRecord register(SourceInput source) {
        FormatKind kind;
        try (BinaryData data = source.open()) {
            kind = registry.describe(data);
        } catch (IOException | UncheckedIOException e) {
            throw new SourceReadException(source.identity(), e);
        }
        InputRecord record = new InputRecord(kind, source.identity(), source.rawSize());
        sources.add(source);
        records.add(record);
        log.infof("Registered %s as %s (%d bytes)", record.identity(), kind, record.rawSize());
        return record;
    }
}
