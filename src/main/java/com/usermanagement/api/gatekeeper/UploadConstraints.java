package com.usermanagement.api.gatekeeper;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The rules an upload route imposes on the files submitted to it. Instances are immutable and are declared once per
 * route when the HTTP API is set up. Extensions are stored lowercase with their leading dot; content types are
 * compared against the type sniffed from the file bytes, never the type declared by the client.
 */
public class UploadConstraints {

    private static final long MEBIBYTE = 1024 * 1024;

    public static final UploadConstraints DEFAULT = builder()
            .maxSizeBytes(10 * MEBIBYTE)
            .allowedExtensions(".jpg", ".jpeg", ".png", ".gif", ".pdf")
            .allowedContentTypes("image/jpeg", "image/png", "image/gif", "application/pdf")
            .fieldName("file")
            .build();

    public static final UploadConstraints IMAGE = builder()
            .maxSizeBytes(5 * MEBIBYTE)
            .allowedExtensions(".jpg", ".jpeg", ".png", ".gif", ".webp")
            .allowedContentTypes("image/jpeg", "image/png", "image/gif", "image/webp")
            .fieldName("image")
            .destination("images")
            .build();

    public static final UploadConstraints DOCUMENT = builder()
            .maxSizeBytes(20 * MEBIBYTE)
            .allowedExtensions(".pdf", ".doc", ".docx")
            .allowedContentTypes("application/pdf", "application/msword", ContentSniffer.DOCX)
            .fieldName("document")
            .destination("documents")
            .build();

    /** Image constraints for a form carrying up to maxFiles images under the field "images". */
    public static UploadConstraints multipleImages (int maxFiles) {
        return IMAGE.toBuilder().fieldName("images").maxFiles(maxFiles).build();
    }

    public final long maxSizeBytes;

    public final Set<String> allowedExtensions;

    public final Set<String> allowedContentTypes;

    /** Name of the multipart form field holding the files. */
    public final String fieldName;

    public final boolean required;

    public final int maxFiles;

    /** Subdirectory of the upload root where accepted files are stored. The empty string means the root itself. */
    public final String destination;

    private UploadConstraints (Builder builder) {
        this.maxSizeBytes = builder.maxSizeBytes;
        this.allowedExtensions = builder.allowedExtensions;
        this.allowedContentTypes = builder.allowedContentTypes;
        this.fieldName = builder.fieldName;
        this.required = builder.required;
        this.maxFiles = builder.maxFiles;
        this.destination = builder.destination;
    }

    public boolean allowsExtension (String filename) {
        String lowerCaseName = filename.toLowerCase(Locale.ROOT);
        for (String extension : allowedExtensions) {
            if (lowerCaseName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public boolean allowsContentType (String contentType) {
        return allowedContentTypes.contains(contentType);
    }

    public static Builder builder () {
        return new Builder();
    }

    public Builder toBuilder () {
        Builder builder = new Builder();
        builder.maxSizeBytes = maxSizeBytes;
        builder.allowedExtensions = allowedExtensions;
        builder.allowedContentTypes = allowedContentTypes;
        builder.fieldName = fieldName;
        builder.required = required;
        builder.maxFiles = maxFiles;
        builder.destination = destination;
        return builder;
    }

    @Override
    public String toString () {
        return String.format("UploadConstraints{field=%s, max %d files of %d bytes, extensions %s, types %s, to '%s'}",
                fieldName, maxFiles, maxSizeBytes, allowedExtensions, allowedContentTypes, destination);
    }

    public static class Builder {

        private long maxSizeBytes = 10 * MEBIBYTE;
        private Set<String> allowedExtensions = ImmutableSet.of();
        private Set<String> allowedContentTypes = ImmutableSet.of();
        private String fieldName = "file";
        private boolean required = true;
        private int maxFiles = 1;
        private String destination = "";

        private Builder () { }

        public Builder maxSizeBytes (long maxSizeBytes) {
            this.maxSizeBytes = maxSizeBytes;
            return this;
        }

        public Builder allowedExtensions (String... extensions) {
            ImmutableSet.Builder<String> set = ImmutableSet.builder();
            for (String extension : extensions) {
                String lowerCase = extension.toLowerCase(Locale.ROOT);
                set.add(lowerCase.startsWith(".") ? lowerCase : "." + lowerCase);
            }
            this.allowedExtensions = set.build();
            return this;
        }

        public Builder allowedContentTypes (String... contentTypes) {
            this.allowedContentTypes = ImmutableSet.copyOf(contentTypes);
            return this;
        }

        public Builder fieldName (String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder required (boolean required) {
            this.required = required;
            return this;
        }

        public Builder maxFiles (int maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        public Builder destination (String destination) {
            this.destination = destination;
            return this;
        }

        public UploadConstraints build () {
            checkArgument(maxSizeBytes > 0, "Maximum file size must be positive.");
            checkArgument(maxFiles >= 1, "At least one file must be allowed.");
            checkArgument(!allowedExtensions.isEmpty(), "At least one file extension must be allowed.");
            checkArgument(!allowedContentTypes.isEmpty(), "At least one content type must be allowed.");
            checkArgument(fieldName != null && !fieldName.isBlank(), "Form field name must be supplied.");
            checkNotNull(destination);
            checkArgument(!destination.contains(".."), "Upload destination must stay within the upload root.");
            return new UploadConstraints(this);
        }
    }

}
