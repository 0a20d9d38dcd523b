package in.folioledger.service.ingest;

import java.util.List;

/**
 * Totals over a batch of files, with the per-file results in input order.
 */
public record ImportSummary(List<FileImportResult> files) {

    public ImportSummary {
        files = List.copyOf(files);
    }

    public int created() {
        return files.stream().mapToInt(FileImportResult::created).sum();
    }

    public int skipped() {
        return files.stream().mapToInt(FileImportResult::skipped).sum();
    }

    public int failed() {
        return files.stream().mapToInt(FileImportResult::failed).sum();
    }

    public List<FileImportResult> unrecognized() {
        return files.stream().filter(f -> !f.isRecognized()).toList();
    }

    @Override
    public String toString() {
        return String.format("%d files: %d created, %d skipped, %d failed, %d unrecognized",
            files.size(), created(), skipped(), failed(), unrecognized().size());
    }
}
