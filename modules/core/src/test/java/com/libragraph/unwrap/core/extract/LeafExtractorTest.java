package com.libragraph.unwrap.core.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.unwrap.core.collect.LeafEntry;
import com.libragraph.unwrap.core.convert.Converter;
import com.libragraph.unwrap.core.options.ConversionOptions;
import com.libragraph.unwrap.core.progress.ProgressEvent;
import com.libragraph.unwrap.core.test.TestArchives;
import com.libragraph.unwrap.util.ContentHash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static com.libragraph.unwrap.core.test.TestArchives.bytes;
import static org.assertj.core.api.Assertions.assertThat;

class LeafExtractorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldExtractNestedLeavesWithIndex() throws IOException {
        Converter converter = new Converter();
        converter.addBuffer("bundle.tar.gz", TestArchives.gzip(TestArchives.tar()
                .add("docs/readme.txt", "read me")
                .add("inner.zip", TestArchives.zip().add("data", "nested").build())
                .build()));
        converter.addBuffer("/abs/plain.txt", bytes("plain"));
        Path out = tempDir.resolve("out");
        List<String> events = new ArrayList<>();

        List<LeafDescriptor> leaves = converter.extract(out, (path, event) -> events.add(path + "=" + event));

        assertThat(leaves).extracting(LeafDescriptor::path).containsExactly(
                "bundle.tar.gz/docs/readme.txt", "bundle.tar.gz/inner.zip/data", "/abs/plain.txt");
        assertThat(leaves).extracting(LeafDescriptor::file).containsExactly(
                "bundle.tar.gz/docs/readme.txt", "bundle.tar.gz/inner.zip/data", "plain.txt");
        assertThat(out.resolve("bundle.tar.gz/docs/readme.txt")).hasContent("read me");
        assertThat(out.resolve("bundle.tar.gz/inner.zip/data")).hasContent("nested");
        assertThat(out.resolve("plain.txt")).hasContent("plain");
        assertThat(leaves.get(2).sha256()).isEqualTo(ContentHash.of(bytes("plain")).toHex());
        assertThat(events).containsExactly(
                "bundle.tar.gz/docs/readme.txt=" + ProgressEvent.EXTRACTED,
                "bundle.tar.gz/inner.zip/data=" + ProgressEvent.EXTRACTED,
                "/abs/plain.txt=" + ProgressEvent.EXTRACTED);

        JsonNode index = new ObjectMapper().readTree(out.resolve(ExtractionIndex.FILE_NAME).toFile());
        assertThat(index.get("version").asInt()).isEqualTo(1);
        assertThat(index.get("leaves")).hasSize(3);
        assertThat(index.get("leaves").get(0).get("file").asText()).isEqualTo("bundle.tar.gz/docs/readme.txt");
        assertThat(index.get("leaves").get(0).get("size").asLong()).isEqualTo(7);
    }

    @Test
    void shouldNeutralizeTraversalSegments() throws IOException {
        Converter converter = new Converter();
        converter.addBuffer("evil.tar", TestArchives.tar()
                .add("../../escape", "x")
                .add("/etc/passwd", "y")
                .add("./a/./b", "z")
                .build());
        Path out = tempDir.resolve("out");

        List<LeafDescriptor> leaves = converter.extract(out, null);

        assertThat(leaves).extracting(LeafDescriptor::file).containsExactly(
                "evil.tar/__/__/escape", "evil.tar/etc/passwd", "evil.tar/a/b");
        try (Stream<Path> files = Files.walk(tempDir)) {
            assertThat(files.filter(Files::isRegularFile).map(p -> p.startsWith(out)))
                    .allMatch(Boolean::booleanValue);
        }
    }

    @Test
    void shouldGiveCollidingSourcesDistinctRoots() {
        Converter converter = new Converter();
        converter.addBuffer("one/same.txt", bytes("first"));
        converter.addBuffer("two/same.txt", bytes("second"));
        Path out = tempDir.resolve("out");

        List<LeafDescriptor> leaves = converter.extract(out, null);

        assertThat(leaves).extracting(LeafDescriptor::file).containsExactly("same.txt", "same.txt-1");
        assertThat(out.resolve("same.txt-1")).hasContent("second");
    }

    @Test
    void shouldKeepRepeatedMemberNamesApart() {
        Converter converter = new Converter();
        converter.addBuffer("dup.tar", TestArchives.tar()
                .add("data", "first")
                .add("data", "second")
                .build());
        Path out = tempDir.resolve("out");

        List<LeafDescriptor> leaves = converter.extract(out, null);

        assertThat(leaves).extracting(LeafDescriptor::path).containsExactly("dup.tar/data", "dup.tar/data");
        assertThat(leaves).extracting(LeafDescriptor::file).containsExactly("dup.tar/data", "dup.tar/data-1");
        assertThat(out.resolve("dup.tar/data")).hasContent("first");
        assertThat(out.resolve("dup.tar/data-1")).hasContent("second");
        assertThat(leaves.get(1).sha256()).isEqualTo(ContentHash.of(bytes("second")).toHex());
    }

    @Test
    void shouldSeparateFileFromDirectoryOfSameName() {
        Converter converter = new Converter();
        converter.addBuffer("mixed.tar", TestArchives.tar()
                .add("a", "file")
                .add("a/b", "nested")
                .add("c/d", "dir first")
                .add("c", "file after dir")
                .build());
        Path out = tempDir.resolve("out");

        List<LeafDescriptor> leaves = converter.extract(out, null);

        assertThat(leaves).extracting(LeafDescriptor::file).containsExactly(
                "mixed.tar/a", "mixed.tar/a-1/b", "mixed.tar/c/d", "mixed.tar/c-1");
        assertThat(out.resolve("mixed.tar/a")).hasContent("file");
        assertThat(out.resolve("mixed.tar/a-1/b")).hasContent("nested");
        assertThat(out.resolve("mixed.tar/c/d")).hasContent("dir first");
        assertThat(out.resolve("mixed.tar/c-1")).hasContent("file after dir");
    }

    @Test
    void shouldApplyCollectorFiltersAndReportThem() {
        ConversionOptions options = new ConversionOptions();
        options.setUnique(true);
        options.setMaxSize(5L);
        Converter converter = new Converter(options);
        converter.addBuffer("z", TestArchives.zip()
                .add("a", "dup")
                .add("b", "dup")
                .add("big", "too large for the cap")
                .build());
        List<String> events = new ArrayList<>();

        List<LeafDescriptor> leaves = converter.extract(tempDir.resolve("out"),
                (path, event) -> events.add(path + "=" + event));

        assertThat(leaves).extracting(LeafDescriptor::path).containsExactly("z/a");
        assertThat(events).containsExactly(
                "z/a=" + ProgressEvent.EXTRACTED,
                "z/b=" + ProgressEvent.DUPLICATE,
                "z/big=" + ProgressEvent.SKIPPED);
    }

    @Test
    void shouldMapSegmentsWithoutTouchingDisk() {
        LeafExtractor extractor = new LeafExtractor(tempDir);

        assertThat(extractor.relativePath(LeafEntry.of("src", "src/a//b/../c", bytes("x"))))
                .isEqualTo("src/a/b/__/c");
        assertThat(extractor.relativePath(LeafEntry.of("src", "src/a//b/../c", bytes("y"))))
                .isEqualTo("src/a/b/__/c-1");
        assertThat(LeafExtractor.sanitize("C:\\win")).isEqualTo("C__win");
        assertThat(LeafExtractor.sanitize(".")).isNull();
    }

    @Test
    void shouldReserveIndexFileName() {
        LeafExtractor extractor = new LeafExtractor(tempDir);

        assertThat(extractor.relativePath(LeafEntry.of(ExtractionIndex.FILE_NAME, ExtractionIndex.FILE_NAME, bytes("x"))))
                .isEqualTo(ExtractionIndex.FILE_NAME + "-1");
    }
}
