package net.panotour.model.panorama;

/**
 * Linear stages of a single ingest. {@link #FAILED} is reachable from every non-terminal stage.
 */
public enum IngestStage {
    RECEIVED,
    EXTRACTED,
    RENDERED,
    STORED,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
