package net.panotour.exception;

import net.panotour.model.panorama.IngestStage;

/**
 * Base class for every classified ingest failure.
 * The message is the German, client-facing text; the kind is the stable contract.
 */
public abstract class PanoramaIngestException extends RuntimeException {

    private final IngestErrorKind kind;
    private transient IngestStage lastCompletedStage;

    protected PanoramaIngestException(IngestErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public IngestErrorKind getKind() {
        return kind;
    }

    /**
     * Records the last stage the ingest finished before this failure. Only the first call sticks.
     */
    public void recordLastCompletedStage(IngestStage stage) {
        if (lastCompletedStage == null) {
            lastCompletedStage = stage;
        }
    }

    /**
     * @return the last finished stage, or {@code null} when the failure was raised outside an ingest
     */
    public IngestStage getLastCompletedStage() {
        return lastCompletedStage;
    }
}
