package net.panotour.model.image;

/**
 * Where the bytes handed to the resolution pipeline came from.
 */
public enum SourceKind {

    /** The upload itself was a directly decodable image. */
    DIRECT_IMAGE,

    /** The bytes are a JPEG preview carved out of a RAW container. */
    EMBEDDED_PREVIEW
}
