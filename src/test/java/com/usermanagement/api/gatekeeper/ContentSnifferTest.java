package com.usermanagement.api.gatekeeper;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ContentSnifferTest {

    static final byte[] PNG = {
            (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R', 0, 0, 0, 1
    };

    static final byte[] JPEG = { (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10, 'J', 'F', 'I', 'F', 0 };

    static final byte[] WINDOWS_EXE = { 'M', 'Z', (byte) 0x90, 0, 3, 0, 0, 0, 4, 0, 0, 0, (byte) 0xFF, (byte) 0xFF };

    private static String sniff (byte[] bytes) {
        return ContentSniffer.sniff(bytes, bytes.length);
    }

    private static String sniff (String text) {
        return sniff(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void images () {
        assertEquals("image/png", sniff(PNG));
        assertEquals("image/jpeg", sniff(JPEG));
        assertEquals("image/gif", sniff("GIF89a\u0001\u0000\u0001\u0000"));
        assertEquals("image/gif", sniff("GIF87a\u0001\u0000\u0001\u0000"));
        assertEquals("image/webp", sniff("RIFF$\u0000\u0000\u0000WEBPVP8 "));
    }

    @Test
    void riffWithoutWebpIsNotAnImage () {
        assertEquals(ContentSniffer.OCTET_STREAM, sniff("RIFF$\u0000\u0000\u0000WAVEfmt "));
    }

    @Test
    void documents () {
        assertEquals("application/pdf", sniff("%PDF-1.7\n%âãÏÓ\n"));
        byte[] ole2 = { (byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1, 0 };
        assertEquals("application/msword", sniff(ole2));
        assertEquals(ContentSniffer.DOCX, sniff("PK\u0003\u0004\u0014\u0000\u0006\u0000[Content_Types].xml"));
        assertEquals("application/zip", sniff("PK\u0003\u0004\u0014\u0000\u0000\u0000notes.txt"));
    }

    @Test
    void executables () {
        assertEquals("application/vnd.microsoft.portable-executable", sniff(WINDOWS_EXE));
        assertEquals("application/x-executable", sniff("\u007FELF\u0002\u0001\u0001\u0000"));
    }

    @Test
    void textAndUnknownBinary () {
        assertEquals(ContentSniffer.TEXT_PLAIN, sniff("hello, world\r\n\tindented"));
        assertEquals(ContentSniffer.TEXT_PLAIN, sniff(new byte[0]));
        assertEquals(ContentSniffer.OCTET_STREAM, sniff(new byte[] { 1, 2, 3, 4 }));
    }

    @Test
    void onlyTheFirstBytesAreExamined () throws IOException {
        byte[] bytes = new byte[4096];
        System.arraycopy(PNG, 0, bytes, 0, PNG.length);
        ByteArrayInputStream stream = new ByteArrayInputStream(bytes);
        assertEquals("image/png", ContentSniffer.sniff(stream));
        assertEquals(4096 - ContentSniffer.SNIFF_LENGTH, stream.available());
        // A signature placed after the sniffed prefix is not seen.
        byte[] late = new byte[1024];
        System.arraycopy(PNG, 0, late, 600, PNG.length);
        assertEquals(ContentSniffer.OCTET_STREAM, sniff(late));
    }

}
