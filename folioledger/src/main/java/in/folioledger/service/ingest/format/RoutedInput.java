package in.folioledger.service.ingest.format;

import in.folioledger.domain.model.FormatTag;
import in.folioledger.service.ingest.csv.SourceLine;

import java.util.List;

/**
 * Classified file content, ready for a parser.
 *
 * {@code lines} holds the non-blank lines with repeated copies of the header removed.
 * {@code reason} explains an {@link FormatTag#UNRECOGNIZED} result.
 */
public record RoutedInput(
    FormatTag format,
    char delimiter,
    List<SourceLine> lines,
    String reason
) {
    public RoutedInput {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static RoutedInput unrecognized(String reason, List<SourceLine> lines) {
        return new RoutedInput(FormatTag.UNRECOGNIZED, ',', lines, reason);
    }

    public boolean isRecognized() {
        return format != FormatTag.UNRECOGNIZED;
    }

    public SourceLine header() {
        return lines.isEmpty() ? null : lines.get(0);
    }

    /** Lines after the header. */
    public List<SourceLine> body() {
        return lines.size() <= 1 ? List.of() : lines.subList(1, lines.size());
    }
}
