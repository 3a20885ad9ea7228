package com.usermanagement.api.components.eventbus;

/**
 * Fired when the files of a multipart request have passed validation and been stored.
 */
public class FileUploadEvent extends Event {

    public final String route;

    public final int fileCount;

    public final long totalBytes;

    public FileUploadEvent (String route, int fileCount, long totalBytes) {
        this.route = route;
        this.fileCount = fileCount;
        this.totalBytes = totalBytes;
    }

    @Override
    public String toString () {
        return String.format("[Upload on route %s by %s: %d files, %d bytes]", route, user, fileCount, totalBytes);
    }

}
