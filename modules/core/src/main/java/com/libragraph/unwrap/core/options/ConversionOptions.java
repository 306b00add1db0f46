package com.libragraph.unwrap.core.options;

import com.libragraph.unwrap.core.collect.IncludeType;
import com.libragraph.unwrap.core.error.ConfigException;
import com.libragraph.unwrap.core.walk.ArchiveWalker;

import java.util.OptionalLong;

/**
 * Settings for one conversion. Every setter validates its argument immediately and
 * throws {@link ConfigException} on a bad value, leaving the previous value in place.
 */
public class ConversionOptions {

    private CompressionSpec compression = CompressionSpec.UNCOMPRESSED;
    private IncludeType include = IncludeType.ALL;
    private boolean unique;
    private long minSize = 1;
    private Long maxSize;
    private int maxDepth = ArchiveWalker.DEFAULT_MAX_DEPTH;
    private int threads = 1;
    private DecodeErrorPolicy decodeErrorPolicy = DecodeErrorPolicy.ABORT;
    private Long maxExpandedBytesPerInput;
    private Long maxExpandedBytesPerRun;

    public ConversionOptions() {
    }

    private ConversionOptions(ConversionOptions other) {
        this.compression = other.compression;
        this.include = other.include;
        this.unique = other.unique;
        this.minSize = other.minSize;
        this.maxSize = other.maxSize;
        this.maxDepth = other.maxDepth;
        this.threads = other.threads;
        this.decodeErrorPolicy = other.decodeErrorPolicy;
        this.maxExpandedBytesPerInput = other.maxExpandedBytesPerInput;
        this.maxExpandedBytesPerRun = other.maxExpandedBytesPerRun;
    }

    /**
     * Builds options from configuration, validating every value.
     */
    public static ConversionOptions fromSettings(ExtractionSettings settings) {
        ConversionOptions options = new ConversionOptions();
        options.setCompression(settings.compression());
        options.setInclude(settings.include());
        options.setUnique(settings.unique());
        options.setMinSize(settings.minSize());
        options.setMaxSize(settings.maxSize().orElse(null));
        options.setMaxDepth(settings.maxDepth());
        options.setThreads(settings.threads());
        options.setDecodeErrorPolicy(DecodeErrorPolicy.fromToken(settings.decodeErrorPolicy()));
        options.setMaxExpandedBytesPerInput(settings.maxExpandedBytesPerInput().orElse(null));
        options.setMaxExpandedBytesPerRun(settings.maxExpandedBytesPerRun().orElse(null));
        return options;
    }

    /** Snapshot taken at the start of a run. */
    public ConversionOptions copy() {
        return new ConversionOptions(this);
    }

    /** Canonical codec string, e.g. {@code ZSTD(ZstdLevel(3))}. */
    public String getCompression() {
        return compression.canonical();
    }

    public void setCompression(String value) {
        this.compression = CompressionSpec.parse(value);
    }

    public CompressionSpec compressionSpec() {
        return compression;
    }

    public String getInclude() {
        return include.token();
    }

    public void setInclude(String value) {
        this.include = IncludeType.fromToken(value);
    }

    public IncludeType includeType() {
        return include;
    }

    public boolean isUnique() {
        return unique;
    }

    public void setUnique(boolean unique) {
        this.unique = unique;
    }

    public long getMinSize() {
        return minSize;
    }

    public void setMinSize(long minSize) {
        if (minSize < 0) {
            throw new ConfigException("min-size", Long.toString(minSize), "a non-negative byte count");
        }
        this.minSize = minSize;
    }

    public OptionalLong getMaxSize() {
        return maxSize == null ? OptionalLong.empty() : OptionalLong.of(maxSize);
    }

    /**
     * @param maxSize largest leaf kept, in bytes, or null for no upper bound
     */
    public void setMaxSize(Long maxSize) {
        if (maxSize != null && maxSize < 0) {
            throw new ConfigException("max-size", Long.toString(maxSize), "a non-negative byte count");
        }
        this.maxSize = maxSize;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new ConfigException("max-depth", Integer.toString(maxDepth), "at least 1");
        }
        this.maxDepth = maxDepth;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        if (threads < 1) {
            throw new ConfigException("threads", Integer.toString(threads), "at least 1");
        }
        this.threads = threads;
    }

    public DecodeErrorPolicy getDecodeErrorPolicy() {
        return decodeErrorPolicy;
    }

    public void setDecodeErrorPolicy(DecodeErrorPolicy decodeErrorPolicy) {
        if (decodeErrorPolicy == null) {
            throw new ConfigException("decode-error-policy", "null", "one of abort, skip");
        }
        this.decodeErrorPolicy = decodeErrorPolicy;
    }

    public OptionalLong getMaxExpandedBytesPerInput() {
        return maxExpandedBytesPerInput == null ? OptionalLong.empty() : OptionalLong.of(maxExpandedBytesPerInput);
    }

    /**
     * @param limit cap on bytes materialized while decoding one input, or null for none
     */
    public void setMaxExpandedBytesPerInput(Long limit) {
        this.maxExpandedBytesPerInput = positiveOrNull("max-expanded-bytes-per-input", limit);
    }

    public OptionalLong getMaxExpandedBytesPerRun() {
        return maxExpandedBytesPerRun == null ? OptionalLong.empty() : OptionalLong.of(maxExpandedBytesPerRun);
    }

    /**
     * @param limit cap on bytes materialized while decoding all inputs of a run, or null for none
     */
    public void setMaxExpandedBytesPerRun(Long limit) {
        this.maxExpandedBytesPerRun = positiveOrNull("max-expanded-bytes-per-run", limit);
    }

    private static Long positiveOrNull(String option, Long limit) {
        if (limit != null && limit <= 0) {
            throw new ConfigException(option, Long.toString(limit), "a positive byte count");
        }
        return limit;
    }

    @Override
    public String toString() {
        return "ConversionOptions{compression=" + compression.canonical()
                + ", include=" + include.token()
                + ", unique=" + unique
                + ", minSize=" + minSize
                + ", maxSize=" + maxSize
                + ", maxDepth=" + maxDepth
                + ", threads=" + threads
                + ", decodeErrorPolicy=" + decodeErrorPolicy
                + "}";
    }
}
