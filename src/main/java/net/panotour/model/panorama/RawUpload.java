package net.panotour.model.panorama;

/**
 * Immutable uploaded file as received from the transport layer.
 *
 * <p>The byte array is handed over, not copied: uploads may be hundreds of megabytes and
 * the pipeline bounds peak memory by never duplicating the payload. Callers must not
 * modify the array after constructing the record.</p>
 *
 * @param bytes complete payload, buffered in memory
 * @param filename original client filename, used only for extension sniffing
 */
public record RawUpload(byte[] bytes, String filename) {

    public long size() {
        return bytes == null ? 0L : bytes.length;
    }

    public boolean isEmpty() {
        return bytes == null || bytes.length == 0;
    }
}
