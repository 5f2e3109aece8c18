package dev.aparikh.scanerrors.source;

/**
 * Supplies the error records the scanning pipeline stored for a project.
 */
public interface ErrorRecordSource {

    ErrorSnapshot snapshot(String project);
}
