package com.usermanagement.api.util;

import org.apache.commons.fileupload.FileCountLimitExceededException;
import org.apache.commons.fileupload.FileItem;
import org.apache.commons.fileupload.FileItemIterator;
import org.apache.commons.fileupload.FileItemStream;
import org.apache.commons.fileupload.FileUploadBase;
import org.apache.commons.fileupload.FileUploadException;
import org.apache.commons.fileupload.disk.DiskFileItemFactory;
import org.apache.commons.fileupload.servlet.ServletFileUpload;
import org.apache.commons.io.output.NullOutputStream;
import spark.Request;

import javax.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public abstract class HttpUtils {

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private static final int COPY_BUFFER_BYTES = 64 * 1024;

    public static boolean isMultipart (HttpServletRequest req) {
        return ServletFileUpload.isMultipartContent(req);
    }

    /**
     * Extract the files under one field of a request containing RFC 1867 multipart form-based file upload data.
     * The body is read as a stream, one part at a time, so the number of files is known before any of them has been
     * fully buffered. Parts larger than the DiskFileItemFactory threshold (10KiB) are buffered in temporary files,
     * which the caller must remove with deleteFileItems once it is done with them. Other fields are read and dropped.
     *
     * @param maxFiles a FileCountLimitExceededException is thrown as soon as a further file part begins.
     * @param maxFileBytes only this many bytes plus one of each file are kept, enough to tell that it is too large.
     * @param maxRequestBytes a SizeLimitExceededException is thrown once this many bytes of part content were read.
     */
    public static Map<String, List<FileItem>> getRequestFiles (
            HttpServletRequest req, String fieldName, int maxFiles, long maxFileBytes, long maxRequestBytes
    ) throws FileUploadException, IOException {
        // The Javadoc on this factory class doesn't say anything about thread safety, but it is very lightweight to
        // instantiate, so in this code run by multiple threads we always create a new factory.
        DiskFileItemFactory factory = new DiskFileItemFactory();
        ServletFileUpload sfu = new ServletFileUpload(factory);
        List<FileItem> files = new ArrayList<>();
        try {
            FileItemIterator parts = sfu.getItemIterator(req);
            long requestBytes = 0;
            while (parts.hasNext()) {
                FileItemStream part = parts.next();
                FileItem item = null;
                if (isFileInField(part, fieldName)) {
                    if (files.size() >= maxFiles) {
                        throw new FileCountLimitExceededException(
                                String.format("More than %d files in field '%s'", maxFiles, fieldName), maxFiles);
                    }
                    item = factory.createItem(part.getFieldName(), part.getContentType(), false, part.getName());
                    files.add(item);
                }
                try (InputStream in = part.openStream();
                     OutputStream out = item == null ? NullOutputStream.INSTANCE : item.getOutputStream()) {
                    requestBytes = copyBounded(in, out, maxFileBytes + 1, requestBytes, maxRequestBytes);
                }
            }
        } catch (FileUploadException | IOException | RuntimeException e) {
            files.forEach(FileItem::delete);
            throw e;
        }
        Map<String, List<FileItem>> formFields = new HashMap<>();
        formFields.put(fieldName, files);
        return formFields;
    }

    /** Browsers send an empty file part, without a filename, when no file was chosen. */
    private static boolean isFileInField (FileItemStream part, String fieldName) {
        return !part.isFormField() && fieldName.equals(part.getFieldName())
                && part.getName() != null && !part.getName().isEmpty();
    }

    /**
     * Read the whole part, writing at most maxKeptBytes of it.
     * @return the number of part content bytes read from the request so far.
     */
    private static long copyBounded (InputStream in, OutputStream out, long maxKeptBytes,
                                     long requestBytes, long maxRequestBytes) throws IOException, FileUploadException {
        byte[] buffer = new byte[COPY_BUFFER_BYTES];
        long kept = 0;
        int n;
        while ((n = in.read(buffer)) >= 0) {
            requestBytes += n;
            if (requestBytes > maxRequestBytes) {
                throw new FileUploadBase.SizeLimitExceededException(
                        String.format("Request body exceeds the maximum size of %d bytes", maxRequestBytes),
                        requestBytes, maxRequestBytes);
            }
            int toKeep = (int) Math.min(n, maxKeptBytes - kept);
            if (toKeep > 0) {
                out.write(buffer, 0, toKeep);
                kept += toKeep;
            }
        }
        return requestBytes;
    }

    /** Remove the temporary files backing all items of a parsed multipart form. */
    public static void deleteFileItems (Map<String, List<FileItem>> formFields) {
        if (formFields == null) {
            return;
        }
        for (List<FileItem> items : formFields.values()) {
            for (FileItem item : items) {
                item.delete();
            }
        }
    }

    /**
     * The address of the client that sent the request. Behind a reverse proxy all requests come from the proxy, which
     * records the real client as the first entry of X-Forwarded-For. That header is set by the client itself when
     * there is no proxy, so it must only be used when the deployment guarantees a proxy overwrites it.
     */
    public static String clientAddress (Request req, boolean trustForwardedFor) {
        if (trustForwardedFor) {
            String forwardedFor = req.headers(FORWARDED_FOR_HEADER);
            if (forwardedFor != null) {
                String first = forwardedFor.split(",", 2)[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        return req.ip();
    }

}
