package com.libragraph.unwrap.core.output;

import com.libragraph.unwrap.core.collect.LeafEntry;
import com.libragraph.unwrap.core.error.OutputWriteException;
import com.libragraph.unwrap.core.error.SchemaException;
import com.libragraph.unwrap.core.options.CompressionSpec;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.api.Binary;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Writes leaf rows to a Parquet file or stream with the configured codec.
 * Dictionary encoding and bloom filters are enabled on the columns that repeat
 * ({@code source}, {@code path}, {@code hash}); {@code content} is stored plain.
 */
public class ParquetTableWriter implements TableWriter {

    private static final Logger log = Logger.getLogger(ParquetTableWriter.class);

    private final ParquetWriter<Group> writer;
    private final SimpleGroupFactory rows = new SimpleGroupFactory(LeafSchema.SCHEMA);
    private final String destination;
    private long rowCount;
    private boolean closed;

    private ParquetTableWriter(ParquetWriter<Group> writer, String destination) {
        this.writer = writer;
        this.destination = destination;
    }

    /**
     * Creates or replaces the Parquet file at {@code file}.
     */
    public static ParquetTableWriter create(Path file, CompressionSpec compression) {
        return open(new LocalOutputFile(file), file.toString(), compression);
    }

    /**
     * Writes to {@code out}, which stays open after {@link #close()}.
     */
    public static ParquetTableWriter create(OutputStream out, CompressionSpec compression) {
        return open(new StreamOutputFile(out), "output stream", compression);
    }

    private static ParquetTableWriter open(OutputFile file, String destination, CompressionSpec compression) {
        Configuration conf = new Configuration();
        compression.applyTo(conf);
        try {
            ParquetWriter<Group> writer = ExampleParquetWriter.builder(file)
                    .withType(LeafSchema.SCHEMA)
                    .withConf(conf)
                    .withCompressionCodec(compression.codec())
                    .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                    .withDictionaryEncoding(true)
                    .withDictionaryEncoding(LeafSchema.CONTENT, false)
                    .withBloomFilterEnabled(LeafSchema.SOURCE, true)
                    .withBloomFilterEnabled(LeafSchema.PATH, true)
                    .withBloomFilterEnabled(LeafSchema.HASH, true)
                    .build();
            log.debugf("Opened Parquet writer on %s with %s", destination, compression);
            return new ParquetTableWriter(writer, destination);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to open Parquet output " + destination, e);
        }
    }

    @Override
    public synchronized void write(LeafEntry entry) {
        validate(entry);
        Group row = rows.newGroup()
                .append(LeafSchema.SOURCE, entry.source())
                .append(LeafSchema.PATH, entry.path())
                .append(LeafSchema.SIZE, entry.size())
                .append(LeafSchema.CONTENT, Binary.fromConstantByteArray(entry.content()))
                .append(LeafSchema.HASH, Binary.fromConstantByteArray(entry.hash().bytes()));
        try {
            writer.write(row);
            rowCount++;
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write row " + entry.path() + " to " + destination, e);
        }
    }

    @Override
    public synchronized long rowCount() {
        return rowCount;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
            log.debugf("Wrote %d rows to %s", rowCount, destination);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to finish Parquet output " + destination, e);
        }
    }

    private static void validate(LeafEntry entry) {
        if (entry.source() == null || entry.path() == null) {
            throw new SchemaException("Leaf row needs both source and path");
        }
        if (!entry.path().startsWith(entry.source())) {
            throw new SchemaException("Path " + entry.path() + " is not under source " + entry.source());
        }
        if (entry.size() < 0 || entry.content().length != entry.size()) {
            throw new SchemaException("Size " + entry.size() + " does not match content length "
                    + entry.content().length + " for " + entry.path());
        }
        if (entry.hash().bytes().length != LeafSchema.HASH_LENGTH) {
            throw new SchemaException("Hash must be " + LeafSchema.HASH_LENGTH + " bytes for " + entry.path());
        }
    }
}
