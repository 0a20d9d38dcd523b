package in.folioledger.service.ingest;

import in.folioledger.domain.model.FormatTag;

import java.util.List;
import java.util.Map;

/**
 * What happened to one file.
 *
 * {@code failed} counts rows that produced no record (parse or resolution errors), all
 * listed in {@code errors}. {@code reason} is set when the file was not recognized.
 */
public record FileImportResult(
    String sourceName,
    FormatTag format,
    int created,
    int skipped,
    int failed,
    Map<String, Integer> ignored,       // Rows deliberately not imported, by reason
    int orphanedWithholdings,
    List<RowError> errors,
    List<String> warnings,              // Resolution conflicts and unlinked records
    String reason
) {
    public FileImportResult {
        ignored = ignored == null ? Map.of() : Map.copyOf(ignored);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static FileImportResult unrecognized(String sourceName, String reason) {
        return new FileImportResult(sourceName, FormatTag.UNRECOGNIZED, 0, 0, 0, Map.of(), 0,
            List.of(), List.of(), reason);
    }

    public boolean isRecognized() {
        return format != FormatTag.UNRECOGNIZED;
    }

    /** ok, partial or unrecognized. */
    public String status() {
        if (!isRecognized()) return "unrecognized";
        return failed > 0 ? "partial" : "ok";
    }
}
