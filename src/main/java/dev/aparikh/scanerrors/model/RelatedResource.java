package dev.aparikh.scanerrors.model;

/**
 * Codebase resource an error was raised against.
 */
public record RelatedResource(
        String id,
        String path
) {
}
