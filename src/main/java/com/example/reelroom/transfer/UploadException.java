package com.example.reelroom.transfer;

/**
 * The sink rejected the upload or could not be reached. Status is 0 when no HTTP answer arrived.
 */
public class UploadException extends RuntimeException {

    private final int status;

    public UploadException(int status, String message) {
        super(message);
        this.status = status;
    }

    public UploadException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() { return status; }
}
