package in.folioledger.service.ingest.format;

import in.folioledger.service.ingest.csv.SourceLine;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Bytes to lines. Detects UTF-16 (with or without BOM) and UTF-8, strips the BOM and
 * drops blank lines while keeping original line numbers.
 */
public final class TextDecoder {

    private TextDecoder() {}

    public static String decode(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (content.length >= 2 && (content[0] & 0xFF) == 0xFF && (content[1] & 0xFF) == 0xFE) {
            charset = StandardCharsets.UTF_16LE;
            offset = 2;
        } else if (content.length >= 2 && (content[0] & 0xFF) == 0xFE && (content[1] & 0xFF) == 0xFF) {
            charset = StandardCharsets.UTF_16BE;
            offset = 2;
        } else if (content.length >= 3 && (content[0] & 0xFF) == 0xEF
                && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            offset = 3;
        } else if (content.length >= 4 && content[0] != 0 && content[1] == 0 && content[3] == 0) {
            // UTF-16LE without BOM: every second byte of ASCII text is zero
            charset = StandardCharsets.UTF_16LE;
        }
        String text = new String(content, offset, content.length - offset, charset);
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    public static List<SourceLine> lines(String text) {
        List<SourceLine> lines = new ArrayList<>();
        String[] raw = text.split("\r\n|\n|\r", -1);
        for (int i = 0; i < raw.length; i++) {
            if (!raw[i].isBlank()) {
                lines.add(new SourceLine(i + 1, raw[i]));
            }
        }
        return lines;
    }

    /** True when the text is not plain delimited text (PDF, archive, image). */
    public static boolean looksBinary(String text) {
        if (text.startsWith("%PDF") || text.startsWith("PK")) {
            return true;
        }
        int sample = Math.min(text.length(), 4096);
        int control = 0;
        for (int i = 0; i < sample; i++) {
            char c = text.charAt(i);
            if (c == 0 || c == '\uFFFD' || (c < 0x20 && c != '\t' && c != '\n' && c != '\r')) {
                control++;
            }
        }
        return sample > 0 && control * 10 > sample;
    }
}
