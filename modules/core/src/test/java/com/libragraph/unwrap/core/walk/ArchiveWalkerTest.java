package com.libragraph.unwrap.core.walk;

import com.libragraph.unwrap.core.error.DecodeException;
import com.libragraph.unwrap.core.error.ExpansionLimitExceededException;
import com.libragraph.unwrap.core.error.RecursionLimitExceededException;
import com.libragraph.unwrap.core.test.TestArchives;
import com.libragraph.unwrap.formats.api.SkippedMember;
import com.libragraph.unwrap.formats.registry.FormatRegistry;
import com.libragraph.unwrap.types.FormatKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.ByteBudget;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.libragraph.unwrap.core.test.TestArchives.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveWalkerTest {

    private final FormatRegistry registry = FormatRegistry.defaults();

    private record Visit(String path, String content, List<FormatKind> layers) {
    }

    private static class Recorder implements LeafVisitor {
        final List<Visit> leaves = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();

        @Override
        public void visitLeaf(String path, BinaryData data, List<DecodeLayer> layers) {
            leaves.add(new Visit(path, new String(data.toByteArray(), StandardCharsets.UTF_8),
                    layers.stream().map(DecodeLayer::format).toList()));
        }

        @Override
        public void visitSkipped(String path, SkippedMember member) {
            skipped.add(path);
        }
    }

    private Recorder walk(byte[] payload) {
        return walk(new ArchiveWalker(registry), payload, ByteBudget.unlimited());
    }

    private static Recorder walk(ArchiveWalker walker, byte[] payload, ByteBudget budget) {
        Recorder recorder = new Recorder();
        walker.walk("src", BinaryData.of(payload), budget, recorder);
        return recorder;
    }

    @Test
    void shouldReportPlainPayloadAsSingleLeaf() {
        Recorder recorder = walk(bytes("hello world"));

        assertThat(recorder.leaves).containsExactly(new Visit("src", "hello world", List.of()));
    }

    @Test
    void shouldTreatLongTextAsLeafAtEveryLevel() {
        String text = "hello world ".repeat(60);
        byte[] payload = TestArchives.tar()
                .add("notes.txt", text)
                .add("notes.txt.gz", TestArchives.gzip(bytes(text)))
                .build();

        assertThat(walk(bytes(text)).leaves).containsExactly(new Visit("src", text, List.of()));
        assertThat(walk(payload).leaves).containsExactly(
                new Visit("src/notes.txt", text, List.of(FormatKind.TAR)),
                new Visit("src/notes.txt.gz", text, List.of(FormatKind.TAR, FormatKind.GZIP)));
    }

    @Test
    void shouldNotAddPathSegmentForCompressionLayers() {
        Recorder recorder = walk(TestArchives.xz(TestArchives.gzip(bytes("hello"))));

        assertThat(recorder.leaves).containsExactly(
                new Visit("src", "hello", List.of(FormatKind.XZ, FormatKind.GZIP)));
    }

    @Test
    void shouldWalkMembersDepthFirstInDeclarationOrder() {
        byte[] payload = TestArchives.zip()
                .add("a", "first")
                .addNested("inner.tar", TestArchives.tar()
                        .add("x", "second")
                        .add("y", TestArchives.gzip(bytes("third"))))
                .add("z", "fourth")
                .build();

        Recorder recorder = walk(payload);

        assertThat(recorder.leaves).extracting(Visit::path).containsExactly(
                "src/a", "src/inner.tar/x", "src/inner.tar/y", "src/z");
        assertThat(recorder.leaves).extracting(Visit::content).containsExactly(
                "first", "second", "third", "fourth");
        assertThat(recorder.leaves.get(2).layers()).containsExactly(
                FormatKind.ZIP, FormatKind.TAR, FormatKind.GZIP);
    }

    @Test
    void shouldReportDirectoriesAndLinksAsSkipped() {
        byte[] payload = TestArchives.tar()
                .addDirectory("dir")
                .addSymlink("link", "dir/file")
                .add("dir/file", "content")
                .build();

        Recorder recorder = walk(payload);

        assertThat(recorder.leaves).extracting(Visit::path).containsExactly("src/dir/file");
        assertThat(recorder.skipped).containsExactly("src/dir/", "src/link");
    }

    @Test
    void shouldYieldNothingForEmptyContainer() {
        Recorder recorder = walk(TestArchives.zip().addDirectory("only-a-dir").build());

        assertThat(recorder.leaves).isEmpty();
    }

    @Test
    void shouldCountEveryDecodeStepTowardsDepth() {
        byte[] payload = TestArchives.gzip(TestArchives.zip().add("data", "hello").build());

        // gzip + zip = depth 2
        Recorder recorder = walk(new ArchiveWalker(registry, 2), payload, ByteBudget.unlimited());
        assertThat(recorder.leaves).extracting(Visit::path).containsExactly("src/data");

        assertThatThrownBy(() -> walk(new ArchiveWalker(registry, 1), payload, ByteBudget.unlimited()))
                .isInstanceOf(RecursionLimitExceededException.class)
                .satisfies(e -> {
                    RecursionLimitExceededException limit = (RecursionLimitExceededException) e;
                    assertThat(limit.maxDepth()).isEqualTo(1);
                    assertThat(limit.source()).isEqualTo("src");
                    assertThat(limit.layers()).extracting(DecodeLayer::format)
                            .containsExactly(FormatKind.GZIP, FormatKind.ZIP);
                });
    }

    @Test
    void shouldHandleDeepNestingWithoutRecursion() {
        byte[] payload = bytes("core");
        for (int i = 0; i < 200; i++) {
            payload = TestArchives.zip().add("d", payload).build();
        }

        Recorder recorder = walk(new ArchiveWalker(registry, 256), payload, ByteBudget.unlimited());

        assertThat(recorder.leaves).hasSize(1);
        assertThat(recorder.leaves.get(0).path()).isEqualTo("src" + "/d".repeat(200));
        assertThat(recorder.leaves.get(0).content()).isEqualTo("core");
    }

    @Test
    void shouldRejectNestingPastDefaultDepth() {
        byte[] payload = bytes("core");
        for (int i = 0; i < 65; i++) {
            payload = TestArchives.gzip(payload);
        }
        byte[] nested = payload;

        assertThatThrownBy(() -> walk(nested))
                .isInstanceOf(RecursionLimitExceededException.class)
                .hasMessageContaining("maximum depth 64");
    }

    @Test
    void shouldWrapCorruptCompressedDataWithContext() {
        byte[] gzip = TestArchives.gzip(bytes("hello world, hello world, hello world"));
        byte[] truncated = Arrays.copyOf(gzip, gzip.length / 2);
        byte[] payload = TestArchives.tar().add("broken.gz", truncated).build();

        assertThatThrownBy(() -> walk(payload))
                .isInstanceOf(DecodeException.class)
                .satisfies(e -> {
                    DecodeException decode = (DecodeException) e;
                    assertThat(decode.source()).isEqualTo("src");
                    assertThat(decode.pathPrefix()).isEqualTo("src/broken.gz");
                    assertThat(decode.layers()).extracting(DecodeLayer::format)
                            .containsExactly(FormatKind.TAR, FormatKind.GZIP);
                })
                .hasMessageContaining("layers=tar > gzip");
    }

    @Test
    void shouldMapBudgetOverrunToExpansionLimit() {
        byte[] payload = TestArchives.gzip(new byte[100_000]);
        ByteBudget budget = ByteBudget.of("input src", 10_000);

        assertThatThrownBy(() -> walk(new ArchiveWalker(registry), payload, budget))
                .isInstanceOf(ExpansionLimitExceededException.class)
                .hasMessageContaining("input src");
    }
}
