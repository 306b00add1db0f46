package com.libragraph.unwrap.core.error;

import com.libragraph.unwrap.core.walk.DecodeLayer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Malformed compressed or archive data in one input.
 * Carries the source identity, the logical path reached so far and the
 * decode layers applied on the way, the last one being the layer at fault.
 */
public class DecodeException extends ConversionException {

    private final String source;
    private final String pathPrefix;
    private final List<DecodeLayer> layers;

    public DecodeException(String message, String source, String pathPrefix,
                           List<DecodeLayer> layers, Throwable cause) {
        super(describe(message, source, pathPrefix, layers), cause);
        this.source = source;
        this.pathPrefix = pathPrefix;
        this.layers = List.copyOf(layers);
    }

    public String source() {
        return source;
    }

    public String pathPrefix() {
        return pathPrefix;
    }

    public List<DecodeLayer> layers() {
        return layers;
    }

    private static String describe(String message, String source, String pathPrefix, List<DecodeLayer> layers) {
        String chain = layers.isEmpty()
                ? "none"
                : layers.stream().map(DecodeLayer::label).collect(Collectors.joining(" > "));
        return message + " [source=" + source + ", path=" + pathPrefix + ", layers=" + chain + "]";
    }
}
