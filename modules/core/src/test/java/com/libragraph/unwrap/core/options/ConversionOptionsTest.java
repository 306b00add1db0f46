package com.libragraph.unwrap.core.options;

import com.libragraph.unwrap.core.collect.IncludeType;
import com.libragraph.unwrap.core.error.ConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionOptionsTest {

    @Test
    void shouldStartWithDefaults() {
        ConversionOptions options = new ConversionOptions();

        assertThat(options.getCompression()).isEqualTo("UNCOMPRESSED");
        assertThat(options.getInclude()).isEqualTo("all");
        assertThat(options.isUnique()).isFalse();
        assertThat(options.getMinSize()).isEqualTo(1);
        assertThat(options.getMaxSize()).isEmpty();
        assertThat(options.getMaxDepth()).isEqualTo(64);
        assertThat(options.getThreads()).isEqualTo(1);
        assertThat(options.getDecodeErrorPolicy()).isEqualTo(DecodeErrorPolicy.ABORT);
        assertThat(options.getMaxExpandedBytesPerInput()).isEmpty();
        assertThat(options.getMaxExpandedBytesPerRun()).isEmpty();
    }

    @Test
    void shouldCanonicalizeCompressionOnAssignment() {
        ConversionOptions options = new ConversionOptions();

        options.setCompression("zstd(3)");

        assertThat(options.getCompression()).isEqualTo("ZSTD(ZstdLevel(3))");
    }

    @Test
    void shouldKeepPreviousCompressionWhenAssignmentFails() {
        ConversionOptions options = new ConversionOptions();
        options.setCompression("gzip");

        assertThatThrownBy(() -> options.setCompression("foobar"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value \"foobar\"");
        assertThat(options.getCompression()).isEqualTo("GZIP(GzipLevel(6))");
    }

    @Test
    void shouldCycleIncludeValues() {
        ConversionOptions options = new ConversionOptions();

        for (String value : new String[]{"all", "binary", "all", "text"}) {
            options.setInclude(value);
            assertThat(options.getInclude()).isEqualTo(value);
        }
        assertThat(options.includeType()).isEqualTo(IncludeType.TEXT);

        assertThatThrownBy(() -> options.setInclude("foobar"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value \"foobar\"");
        assertThat(options.getInclude()).isEqualTo("text");
    }

    @Test
    void shouldRejectOutOfRangeNumbers() {
        ConversionOptions options = new ConversionOptions();

        assertThatThrownBy(() -> options.setMinSize(-1)).isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value \"-1\"");
        assertThatThrownBy(() -> options.setMaxSize(-5L)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> options.setMaxDepth(0)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> options.setThreads(0)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> options.setMaxExpandedBytesPerInput(0L)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> options.setMaxExpandedBytesPerRun(-1L)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> options.setDecodeErrorPolicy(null)).isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldClearOptionalBoundsWithNull() {
        ConversionOptions options = new ConversionOptions();
        options.setMaxSize(10L);
        options.setMaxSize(null);

        assertThat(options.getMaxSize()).isEmpty();
    }

    @Test
    void shouldSnapshotIndependently() {
        ConversionOptions options = new ConversionOptions();
        options.setThreads(4);
        ConversionOptions copy = options.copy();

        options.setThreads(2);

        assertThat(copy.getThreads()).isEqualTo(4);
    }

    @Test
    void shouldParsePolicyTokens() {
        assertThat(DecodeErrorPolicy.fromToken("skip")).isEqualTo(DecodeErrorPolicy.SKIP);
        assertThat(DecodeErrorPolicy.fromToken(" Abort ")).isEqualTo(DecodeErrorPolicy.ABORT);
        assertThatThrownBy(() -> DecodeErrorPolicy.fromToken("retry"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value \"retry\"");
    }
}
