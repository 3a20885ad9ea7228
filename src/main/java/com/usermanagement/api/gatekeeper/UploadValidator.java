package com.usermanagement.api.gatekeeper;

import org.apache.commons.fileupload.FileItem;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks the files in a parsed multipart form against an UploadConstraints and stores the ones that pass under the
 * upload root. Checks run in a fixed order (presence, count, then size, extension and sniffed content type of each file)
 * and no byte is written to the destination until every file has passed every check.
 *
 * Storage is all-or-nothing. Each file is first copied to a hidden staging file in the destination directory, then all
 * staging files are renamed to their final names. If anything fails along the way, every staged and renamed file of
 * the request is deleted again. Copying proceeds in chunks and gives up when the request deadline passes or the
 * handler thread is interrupted.
 */
public class UploadValidator {

    private static final Logger LOG = LoggerFactory.getLogger(UploadValidator.class);

    private static final int COPY_BUFFER_BYTES = 64 * 1024;

    private static final int MAX_BASE_NAME_LENGTH = 100;

    private static final String STAGING_SUFFIX = ".part";

    private final Path uploadRoot;

    private final Clock clock;

    /** Last timestamp handed out for a generated filename, kept strictly increasing across all threads. */
    private final AtomicLong lastNameMillis = new AtomicLong();

    public UploadValidator (Path uploadRoot) {
        this(uploadRoot, Clock.systemUTC());
    }

    public UploadValidator (Path uploadRoot, Clock clock) {
        this.uploadRoot = checkNotNull(uploadRoot);
        this.clock = checkNotNull(clock);
    }

    /**
     * Validate and store the files found under constraints.fieldName in the given form.
     * @param formFields the parsed multipart form, as returned by ServletFileUpload.parseParameterMap.
     * @param deadline instant after which storage is abandoned and any partial writes removed.
     * @return the stored files, or the first failure encountered. Never throws on bad input or storage problems.
     */
    public UploadResult process (Map<String, List<FileItem>> formFields, UploadConstraints constraints, Instant deadline) {
        checkNotNull(constraints);
        checkNotNull(deadline);
        List<FileItem> files = filesInField(formFields, constraints.fieldName);
        if (files.isEmpty()) {
            if (constraints.required) {
                return UploadResult.failed(UploadFailure.FILE_REQUIRED,
                        String.format("No file provided in field '%s'", constraints.fieldName));
            }
            return UploadResult.stored(List.of());
        }
        if (files.size() > constraints.maxFiles) {
            return UploadResult.failed(UploadFailure.TOO_MANY_FILES,
                    String.format("Too many files: at most %d allowed", constraints.maxFiles));
        }
        for (FileItem file : files) {
            UploadResult rejection = checkFile(file, constraints);
            if (rejection != null) {
                return rejection;
            }
        }
        return store(files, constraints, deadline);
    }

    /** Only genuine file parts with a filename count as uploaded files. Browsers send an empty part for no file. */
    private static List<FileItem> filesInField (Map<String, List<FileItem>> formFields, String fieldName) {
        List<FileItem> files = new ArrayList<>();
        if (formFields == null) {
            return files;
        }
        List<FileItem> items = formFields.get(fieldName);
        if (items == null) {
            return files;
        }
        for (FileItem item : items) {
            if (!item.isFormField() && item.getName() != null && !item.getName().isEmpty()) {
                files.add(item);
            }
        }
        return files;
    }

    /** @return null if the file passes all checks, otherwise the failed result. */
    private UploadResult checkFile (FileItem file, UploadConstraints constraints) {
        String name = file.getName();
        if (file.getSize() > constraints.maxSizeBytes) {
            return UploadResult.failed(UploadFailure.FILE_TOO_LARGE,
                    String.format("File '%s' exceeds the maximum size of %d bytes", name, constraints.maxSizeBytes));
        }
        if (!constraints.allowsExtension(name)) {
            return UploadResult.failed(UploadFailure.DISALLOWED_EXTENSION,
                    String.format("File '%s' does not have an allowed extension %s", name,
                            constraints.allowedExtensions));
        }
        String sniffedType;
        try (InputStream inputStream = file.getInputStream()) {
            sniffedType = ContentSniffer.sniff(inputStream);
        } catch (IOException e) {
            LOG.error("Could not read uploaded file {} for content detection.", name, e);
            return UploadResult.failed(UploadFailure.STORAGE_FAILURE, "Failed to read uploaded file");
        }
        if (!constraints.allowsContentType(sniffedType)) {
            return UploadResult.failed(UploadFailure.DISALLOWED_CONTENT_TYPE,
                    String.format("Content of file '%s' is not an allowed type", name));
        }
        return null;
    }

    private UploadResult store (List<FileItem> files, UploadConstraints constraints, Instant deadline) {
        Path directory = uploadRoot.resolve(constraints.destination);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            LOG.error("Could not create upload directory {}.", directory, e);
            return UploadResult.failed(UploadFailure.DESTINATION_UNAVAILABLE, "Failed to create upload directory");
        }
        List<Path> staged = new ArrayList<>();
        List<Path> committed = new ArrayList<>();
        List<String> storedNames = new ArrayList<>();
        try {
            for (FileItem file : files) {
                String storedName = uniqueName(file.getName());
                Path stagingPath = directory.resolve("." + storedName + STAGING_SUFFIX);
                staged.add(stagingPath);
                copyBeforeDeadline(file, stagingPath, deadline);
                storedNames.add(storedName);
            }
            checkDeadline(deadline);
            for (int i = 0; i < staged.size(); i++) {
                Path finalPath = directory.resolve(storedNames.get(i));
                Files.move(staged.get(i), finalPath);
                committed.add(finalPath);
            }
        } catch (IOException e) {
            LOG.warn("Storing {} uploaded files in {} failed, removing partial writes: {}",
                    files.size(), directory, e.toString());
            deleteAll(staged);
            deleteAll(committed);
            return UploadResult.failed(UploadFailure.STORAGE_FAILURE, "Failed to save uploaded file");
        }
        Instant uploadedAt = clock.instant();
        List<StoredFileRecord> records = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            FileItem file = files.get(i);
            Path finalPath = committed.get(i);
            records.add(new StoredFileRecord(
                    file.getName(),
                    storedNames.get(i),
                    file.getSize(),
                    FilenameUtils.separatorsToUnix(finalPath.toString()),
                    uploadedAt
            ));
        }
        LOG.debug("Stored {} uploaded files in {}.", records.size(), directory);
        return UploadResult.stored(records);
    }

    private void copyBeforeDeadline (FileItem file, Path target, Instant deadline) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER_BYTES];
        try (InputStream in = file.getInputStream();
             OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW)) {
            int n;
            while ((n = in.read(buffer)) >= 0) {
                checkDeadline(deadline);
                out.write(buffer, 0, n);
            }
        }
    }

    private void checkDeadline (Instant deadline) throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Request thread was interrupted while storing uploads.");
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new InterruptedIOException("Request deadline passed while storing uploads.");
        }
    }

    private static void deleteAll (List<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.error("Could not remove partially stored upload {}.", path, e);
            }
        }
    }

    /**
     * Build a collision-resistant filename that keeps a recognizable, filesystem-safe version of the client's name:
     * sanitized base name, a strictly increasing millisecond timestamp, a random UUID and the original extension.
     */
    String uniqueName (String originalName) {
        // Commons IO refuses names containing NUL, and they have no business in a filename anyway.
        String name = FilenameUtils.getName(originalName.replace("\0", ""));
        String extension = FilenameUtils.getExtension(name);
        String base = sanitize(FilenameUtils.removeExtension(name));
        long millis = lastNameMillis.accumulateAndGet(clock.millis(), (last, now) -> Math.max(last + 1, now));
        String uuid = UUID.randomUUID().toString().replace("-", "");
        String suffix = extension.isEmpty() ? "" : "." + sanitize(extension);
        return String.format("%s_%d_%s%s", base, millis, uuid, suffix);
    }

    private static String sanitize (String name) {
        String safe = name.replaceAll("[^A-Za-z0-9._-]", "_").replaceAll("^\\.+", "");
        if (safe.length() > MAX_BASE_NAME_LENGTH) {
            safe = safe.substring(0, MAX_BASE_NAME_LENGTH);
        }
        return safe.isEmpty() ? "file" : safe;
    }

}
