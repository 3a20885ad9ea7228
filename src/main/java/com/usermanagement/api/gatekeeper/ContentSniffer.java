package com.usermanagement.api.gatekeeper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Classifies the content of an uploaded file from its leading bytes, ignoring the filename and any content type the
 * client declared. Only the first SNIFF_LENGTH bytes are examined.
 */
public abstract class ContentSniffer {

    public static final int SNIFF_LENGTH = 512;

    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    /** Wildcard in a signature: any byte value matches at this position. */
    private static final int ANY = -1;

    /**
     * Magic numbers of the file types we recognize, checked in declaration order. A signature matches if each of its
     * bytes equals the byte at the same position of the file (from the start), apart from wildcard positions.
     */
    public enum Signature {
        JPEG("image/jpeg", 0xFF, 0xD8, 0xFF),
        PNG("image/png", 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A),
        GIF87("image/gif", 'G', 'I', 'F', '8', '7', 'a'),
        GIF89("image/gif", 'G', 'I', 'F', '8', '9', 'a'),
        WEBP("image/webp", 'R', 'I', 'F', 'F', ANY, ANY, ANY, ANY, 'W', 'E', 'B', 'P', 'V', 'P'),
        PDF("application/pdf", '%', 'P', 'D', 'F', '-'),
        // OLE2 compound document, the container of legacy Word files.
        OLE2("application/msword", 0xD0, 0xCF, 0x11, 0xE0, 0xA1, 0xB1, 0x1A, 0xE1),
        ZIP("application/zip", 'P', 'K', 0x03, 0x04),
        WINDOWS_EXECUTABLE("application/vnd.microsoft.portable-executable", 'M', 'Z'),
        ELF("application/x-executable", 0x7F, 'E', 'L', 'F'),
        MACH_O_64("application/x-mach-binary", 0xCF, 0xFA, 0xED, 0xFE);

        public final String mimeType;
        private final int[] pattern;

        Signature (String mimeType, int... pattern) {
            this.mimeType = mimeType;
            this.pattern = pattern;
        }

        public boolean matches (byte[] prefix, int length) {
            if (length < pattern.length) {
                return false;
            }
            for (int i = 0; i < pattern.length; i++) {
                if (pattern[i] != ANY && pattern[i] != (prefix[i] & 0xFF)) {
                    return false;
                }
            }
            return true;
        }
    }

    /** Read up to SNIFF_LENGTH bytes from the stream (without closing it) and classify them. */
    public static String sniff (InputStream inputStream) throws IOException {
        byte[] prefix = inputStream.readNBytes(SNIFF_LENGTH);
        return sniff(prefix, prefix.length);
    }

    /**
     * Classify the first length bytes of the supplied array.
     * @return a MIME type, never null. Unrecognized binary content is application/octet-stream.
     */
    public static String sniff (byte[] prefix, int length) {
        length = Math.min(length, Math.min(prefix.length, SNIFF_LENGTH));
        for (Signature signature : Signature.values()) {
            if (signature.matches(prefix, length)) {
                if (signature == Signature.ZIP && isWordDocument(prefix, length)) {
                    return DOCX;
                }
                return signature.mimeType;
            }
        }
        return looksLikeText(prefix, length) ? TEXT_PLAIN : OCTET_STREAM;
    }

    /**
     * Office Open XML documents are zip archives. Their first entry is normally the package manifest, whose name
     * appears in the local file header at the very start of the archive.
     * TODO distinguish Word from spreadsheet and presentation packages, which share the same manifest entry name.
     */
    private static boolean isWordDocument (byte[] prefix, int length) {
        String header = new String(prefix, 0, length, StandardCharsets.ISO_8859_1);
        return header.contains("[Content_Types].xml") || header.contains("word/");
    }

    /** Text contains no control bytes other than tab, line feed, form feed, carriage return and escape. */
    private static boolean looksLikeText (byte[] prefix, int length) {
        for (int i = 0; i < length; i++) {
            int b = prefix[i] & 0xFF;
            if (b <= 0x08 || b == 0x0B || (b >= 0x0E && b <= 0x1A) || (b >= 0x1C && b <= 0x1F)) {
                return false;
            }
        }
        return true;
    }

}
