package com.libragraph.unwrap.core.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.unwrap.core.collect.LeafEntry;
import com.libragraph.unwrap.core.error.OutputWriteException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes leaves as plain files below a destination directory.
 *
 * <p>Each source gets its own top-level entry named after the last segment of its identity
 * ({@code name}, then {@code name-1}, {@code name-2} on collisions). Member segments follow
 * below it. Empty and {@code .} segments are dropped, {@code ..} becomes {@code __}, so
 * nothing is ever written outside the destination.
 *
 * <p>A path already taken by an earlier leaf, or by a directory, gets the same numeric
 * suffix, so every descriptor names its own file.
 */
public class LeafExtractor {

    private static final Logger log = Logger.getLogger(LeafExtractor.class);

    private final Path destination;
    private final ObjectMapper mapper;
    private final Map<String, String> sourceRoots = new HashMap<>();
    private final Set<String> usedRoots = new HashSet<>();
    private final Map<String, String> directoryNames = new HashMap<>();
    private final Set<String> claimedDirectories = new HashSet<>();
    private final Set<String> claimedFiles = new HashSet<>();
    private final List<LeafDescriptor> descriptors = new ArrayList<>();

    public LeafExtractor(Path destination, ObjectMapper mapper) {
        this.destination = destination.toAbsolutePath().normalize();
        this.mapper = mapper;
        usedRoots.add(ExtractionIndex.FILE_NAME);
    }

    public LeafExtractor(Path destination) {
        this(destination, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public Path destination() {
        return destination;
    }

    /**
     * Writes one leaf and records its descriptor.
     *
     * @throws OutputWriteException if the file cannot be written
     */
    public LeafDescriptor write(LeafEntry entry) {
        String relative = relativePath(entry);
        Path target = destination.resolve(relative).normalize();
        if (!target.startsWith(destination)) {
            throw new OutputWriteException("Refusing to write " + entry.path() + " outside " + destination, null);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, entry.content());
        } catch (IOException e) {
            throw new OutputWriteException("Failed to extract " + entry.path() + " to " + target, e);
        }
        log.tracef("Extracted %s -> %s", entry.path(), relative);

        LeafDescriptor descriptor = new LeafDescriptor(entry.source(), entry.path(), entry.size(),
                entry.hash().toHex(), relative);
        descriptors.add(descriptor);
        return descriptor;
    }

    public List<LeafDescriptor> descriptors() {
        return List.copyOf(descriptors);
    }

    /**
     * Writes {@value ExtractionIndex#FILE_NAME} describing every leaf written so far.
     */
    public Path writeIndex() {
        Path index = destination.resolve(ExtractionIndex.FILE_NAME);
        try {
            mapper.writeValue(index.toFile(), ExtractionIndex.of(descriptors));
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write extraction index " + index, e);
        }
        log.debugf("Wrote index of %d leaves to %s", descriptors.size(), index);
        return index;
    }

    String relativePath(LeafEntry entry) {
        String root = rootFor(entry.source());
        List<String> segments = new ArrayList<>();
        for (String segment : entry.path().substring(entry.source().length()).split("/")) {
            String safe = sanitize(segment);
            if (safe != null) {
                segments.add(safe);
            }
        }
        if (segments.isEmpty()) {
            return claimFile("", root, root);
        }

        String requested = root;
        String resolved = directoryNames.computeIfAbsent(root, k -> claimDirectory("", root, root));
        for (int i = 0; i < segments.size() - 1; i++) {
            String parent = resolved;
            String name = segments.get(i);
            requested = requested + "/" + name;
            resolved = directoryNames.computeIfAbsent(requested, k -> claimDirectory(parent, name, root));
        }
        return claimFile(resolved, segments.get(segments.size() - 1), root);
    }

    private String rootFor(String source) {
        return sourceRoots.computeIfAbsent(source, s -> {
            String name = sanitize(lastSegment(s));
            String base = name == null ? "input" : name;
            String candidate = base;
            for (int i = 1; usedRoots.contains(candidate) || claimedFiles.contains(candidate)
                    || claimedDirectories.contains(candidate); i++) {
                candidate = base + "-" + i;
            }
            usedRoots.add(candidate);
            return candidate;
        });
    }

    private String claimDirectory(String parent, String name, String root) {
        String candidate = name;
        for (int i = 1; claimedFiles.contains(join(parent, candidate))
                || isOtherRoot(join(parent, candidate), root); i++) {
            candidate = name + "-" + i;
        }
        String path = join(parent, candidate);
        claimedDirectories.add(path);
        return path;
    }

    private String claimFile(String parent, String name, String root) {
        String candidate = name;
        for (int i = 1; claimedFiles.contains(join(parent, candidate))
                || claimedDirectories.contains(join(parent, candidate))
                || isOtherRoot(join(parent, candidate), root); i++) {
            candidate = name + "-" + i;
        }
        String path = join(parent, candidate);
        claimedFiles.add(path);
        if (!candidate.equals(name)) {
            log.debugf("Renamed colliding leaf %s/%s to %s", parent, name, path);
        }
        return path;
    }

    private boolean isOtherRoot(String path, String root) {
        return !path.equals(root) && usedRoots.contains(path);
    }

    private static String join(String parent, String name) {
        return parent.isEmpty() ? name : parent + "/" + name;
    }

    private static String lastSegment(String identity) {
        int slash = Math.max(identity.lastIndexOf('/'), identity.lastIndexOf('\\'));
        return identity.substring(slash + 1);
    }

    /**
     * Returns a file-system safe segment, or null if the segment should be dropped.
     */
    static String sanitize(String segment) {
        if (segment.isEmpty() || segment.equals(".")) {
            return null;
        }
        if (segment.equals("..")) {
            return "__";
        }
        return segment.replace('\\', '_').replace(':', '_').replace('\0', '_');
    }
}
