package com.libragraph.unwrap.formats.registry;

import com.libragraph.unwrap.formats.api.Codec;
import com.libragraph.unwrap.formats.api.FormatHandlerFactory;
import com.libragraph.unwrap.formats.codecs.Bzip2Codec;
import com.libragraph.unwrap.formats.codecs.GzipCodec;
import com.libragraph.unwrap.formats.codecs.XzCodec;
import com.libragraph.unwrap.formats.codecs.ZstdCodec;
import com.libragraph.unwrap.formats.handlers.TarHandlerFactory;
import com.libragraph.unwrap.formats.handlers.ZipHandlerFactory;
import com.libragraph.unwrap.types.ArchiveKind;
import com.libragraph.unwrap.types.CompressionKind;
import com.libragraph.unwrap.types.FormatKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central registry that matches payload headers to codecs and container handlers.
 * Sniffing only ever reads the header; it never consumes the payload.
 */
public class FormatRegistry {

    private static final Logger log = Logger.getLogger(FormatRegistry.class);

    /** Header size to read for detection (covers TAR magic at offset 257 and a full TAR block). */
    public static final int HEADER_SIZE = 512;

    private final List<Codec> codecs;
    private final List<FormatHandlerFactory> factories;
    private final Map<CompressionKind, Codec> codecsByKind = new EnumMap<>(CompressionKind.class);
    private final Map<ArchiveKind, FormatHandlerFactory> factoriesByKind = new EnumMap<>(ArchiveKind.class);

    public FormatRegistry(List<Codec> codecs, List<FormatHandlerFactory> factories) {
        this.codecs = List.copyOf(codecs);
        this.factories = factories.stream()
                .sorted(Comparator.comparingInt(
                        (FormatHandlerFactory f) -> f.getDetectionCriteria().priority()).reversed())
                .toList();
        for (Codec codec : this.codecs) {
            codecsByKind.put(codec.kind(), codec);
        }
        for (FormatHandlerFactory factory : this.factories) {
            factoriesByKind.put(factory.kind(), factory);
        }
    }

    /**
     * Registry with every supported codec (gzip, zstd, bzip2, xz) and container (zip, tar).
     */
    public static FormatRegistry defaults() {
        return new FormatRegistry(
                List.of(new GzipCodec(), new ZstdCodec(), new Bzip2Codec(), new XzCodec()),
                List.of(new ZipHandlerFactory(), new TarHandlerFactory()));
    }

    /**
     * Classifies the payload by its leading bytes.
     */
    public SniffResult sniff(BinaryData buffer) {
        return sniff(buffer.readHeader(HEADER_SIZE));
    }

    /**
     * Classifies a header on both axes independently.
     */
    public SniffResult sniff(byte[] header) {
        CompressionKind compression = findCodec(header).map(Codec::kind).orElse(CompressionKind.NONE);
        ArchiveKind archive = findHandlerFactory(header).map(FormatHandlerFactory::kind).orElse(ArchiveKind.UNKNOWN);
        return new SniffResult(archive, compression);
    }

    /**
     * Registration-time label. For a compressed payload, the first decompressed block
     * is sniffed again so that a compressed archive reports the archive kind.
     */
    public FormatKind describe(BinaryData buffer) {
        SniffResult outer = sniff(buffer);
        if (!outer.compression().isCompressed()) {
            return FormatKind.of(outer.archive());
        }

        Codec codec = codecFor(outer.compression());
        try (InputStream in = codec.openStream(buffer.inputStream(0))) {
            byte[] inner = in.readNBytes(HEADER_SIZE);
            return findHandlerFactory(inner)
                    .map(f -> FormatKind.of(f.kind()))
                    .orElse(FormatKind.of(outer.compression()));
        } catch (IOException e) {
            log.debugf(e, "Could not peek inside %s payload, reporting the compression kind",
                    outer.compression().label());
            return FormatKind.of(outer.compression());
        }
    }

    /**
     * Finds a codec matching the given header.
     */
    public Optional<Codec> findCodec(byte[] header) {
        return codecs.stream()
                .filter(c -> c.matches(header))
                .findFirst();
    }

    /**
     * Finds the highest-priority container factory matching the given header.
     */
    public Optional<FormatHandlerFactory> findHandlerFactory(byte[] header) {
        return factories.stream()
                .filter(f -> f.matches(header))
                .findFirst();
    }

    public Codec codecFor(CompressionKind kind) {
        Codec codec = codecsByKind.get(kind);
        if (codec == null) {
            throw new IllegalArgumentException("No codec registered for " + kind.label());
        }
        return codec;
    }

    public FormatHandlerFactory handlerFor(ArchiveKind kind) {
        FormatHandlerFactory factory = factoriesByKind.get(kind);
        if (factory == null) {
            throw new IllegalArgumentException("No handler registered for " + kind.label());
        }
        return factory;
    }
}
