package org.carball.tiercheck.validation;

/**
 * Receives progress events while scenarios are validated. Batch events are delivered one at a time.
 */
@FunctionalInterface
public interface ValidationProgressListener {

    ValidationProgressListener NONE = event -> { };

    void onProgress(ValidationProgressEvent event);
}
