package net.panotour.util;

import java.util.Optional;

/**
 * Single Source of Truth for object-storage keys of panorama derivatives.
 *
 * Key format: panoramas/{panoramaId}/{label}.webp
 * Example: panoramas/pano_1718000000000_k3j9x0a/high.webp
 */
public final class PanoramaKeyGenerator {

    public static final String PANORAMA_DIRECTORY = "panoramas/";
    private static final String DEFAULT_EXTENSION = ".webp";

    private PanoramaKeyGenerator() {
        // Utility class - prevent instantiation
    }

    /**
     * Generates the storage key for one rendered resolution.
     *
     * @param panoramaId panorama identifier
     * @param label resolution label
     * @param fileExtension extension with or without leading dot
     * @return storage key
     * @throws IllegalArgumentException if the id or label contain characters outside [a-zA-Z0-9_-]
     */
    public static String generateAssetKey(String panoramaId, String label, String fileExtension) {
        validateSegment("Panorama ID", panoramaId);
        validateSegment("Resolution label", label);
        return PANORAMA_DIRECTORY + panoramaId + "/" + label + normalizeExtension(fileExtension);
    }

    /**
     * Splits a listed key back into panorama id and resolution label.
     * Keys that are not exactly {@code panoramas/{id}/{file}} yield empty.
     */
    public static Optional<ParsedKey> parse(String key) {
        if (key == null || !key.startsWith(PANORAMA_DIRECTORY)) {
            return Optional.empty();
        }
        String[] parts = key.substring(PANORAMA_DIRECTORY.length()).split("/", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return Optional.empty();
        }
        String fileName = parts[1];
        int dot = fileName.lastIndexOf('.');
        String resolution = dot > 0 ? fileName.substring(0, dot) : fileName;
        return Optional.of(new ParsedKey(parts[0], resolution));
    }

    private static void validateSegment(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        if (!value.matches("[a-zA-Z0-9_-]+")) {
            throw new IllegalArgumentException(
                name + " contains invalid characters: " + value
                    + ". Only alphanumeric characters, hyphens, and underscores are allowed."
            );
        }
    }

    private static String normalizeExtension(String fileExtension) {
        if (fileExtension == null || fileExtension.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        String trimmed = fileExtension.trim().toLowerCase();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    /**
     * @param panoramaId panorama identifier segment
     * @param resolution file name without extension
     */
    public record ParsedKey(String panoramaId, String resolution) {
    }
}
