package in.folioledger.service.ingest;

import in.folioledger.config.LedgerConfig;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.domain.model.Provenance;
import in.folioledger.infrastructure.metrics.LedgerMetrics;
import in.folioledger.service.ingest.format.FormatRouter;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.parser.ActivityActionsParser;
import in.folioledger.service.ingest.parser.CashSummaryParser;
import in.folioledger.service.ingest.parser.CorporateActionDraft;
import in.folioledger.service.ingest.parser.DividendDraft;
import in.folioledger.service.ingest.parser.DividendReportParser;
import in.folioledger.service.ingest.parser.EnrichmentDraft;
import in.folioledger.service.ingest.parser.HoldingsSnapshotParser;
import in.folioledger.service.ingest.parser.ParseContext;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.ReportParser;
import in.folioledger.service.ingest.parser.SnapshotDraft;
import in.folioledger.service.ingest.parser.TradeDraft;
import in.folioledger.service.ingest.parser.TradeReportParser;
import in.folioledger.service.ingest.parser.TransactionExportParser;
import in.folioledger.service.ingest.parser.statement.MultiSectionStatementParser;
import in.folioledger.service.instrument.InstrumentResolver;
import in.folioledger.service.instrument.Resolution;
import in.folioledger.service.instrument.ResolutionException;
import in.folioledger.service.ledger.LedgerWriter;
import in.folioledger.service.ledger.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Import pipeline: route, parse, resolve instruments, write.
 *
 * Each file is processed sequentially. Several files may run in parallel on a fixed pool
 * ({@code IMPORT_THREADS}); the repositories' atomic get-or-create and insert-if-absent
 * operations are the only shared state.
 *
 * ERRORS:
 * - Unrecognized files are reported, never raised.
 * - Row parse errors and resolution failures are reported per file; the file continues.
 * - Unreadable files and storage failures raise {@link ImportException} naming the file.
 */
public final class ImportService {
    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    private final LedgerConfig config;
    private final FormatRouter router;
    private final Map<FormatTag, ReportParser> parsers;
    private final InstrumentResolver resolver;
    private final LedgerWriter writer;
    private final LedgerMetrics metrics;

    public ImportService(LedgerConfig config, InstrumentResolver resolver, LedgerWriter writer, LedgerMetrics metrics) {
        this(config, new FormatRouter(), defaultParsers(), resolver, writer, metrics);
    }

    public ImportService(LedgerConfig config, FormatRouter router, List<ReportParser> parsers,
                         InstrumentResolver resolver, LedgerWriter writer, LedgerMetrics metrics) {
        this.config = config;
        this.router = router;
        this.parsers = new EnumMap<>(FormatTag.class);
        for (ReportParser parser : parsers) {
            this.parsers.put(parser.format(), parser);
        }
        this.resolver = resolver;
        this.writer = writer;
        this.metrics = metrics;
    }

    public static List<ReportParser> defaultParsers() {
        return List.of(
            new HoldingsSnapshotParser(),
            new DividendReportParser(),
            new TradeReportParser(),
            new CashSummaryParser(),
            new ActivityActionsParser(),
            new TransactionExportParser(),
            new MultiSectionStatementParser()
        );
    }

    /**
     * Import files or directories. Results keep the order of the expanded file list.
     */
    public ImportSummary importFiles(List<Path> paths) {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            files.addAll(expand(path));
        }
        if (files.isEmpty()) {
            return new ImportSummary(List.of());
        }

        int threads = Math.max(1, Math.min(config.importThreads(), files.size()));
        if (threads == 1) {
            List<FileImportResult> results = new ArrayList<>();
            for (Path file : files) {
                results.add(importFile(file));
            }
            return logged(new ImportSummary(results));
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "import-worker");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Callable<FileImportResult>> tasks = files.stream()
                .<Callable<FileImportResult>>map(file -> () -> importFile(file))
                .toList();
            List<FileImportResult> results = new ArrayList<>();
            for (Future<FileImportResult> future : executor.invokeAll(tasks)) {
                results.add(await(future));
            }
            return logged(new ImportSummary(results));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImportException("batch", "Import interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /** A file, or every regular file under a directory (sorted by path). */
    public ImportSummary importPath(Path path) {
        return importFiles(List.of(path));
    }

    public FileImportResult importFile(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("[IMPORT] Cannot read {}: {}", file, e.getMessage(), e);
            throw new ImportException(file.toString(), "Failed to read file", e);
        }
        return importBytes(file.getFileName().toString(), content);
    }

    public FileImportResult importBytes(String sourceName, byte[] content) {
        Instant start = Instant.now();
        RoutedInput input = router.route(content);
        if (!input.isRecognized()) {
            log.warn("[IMPORT] {} not recognized: {}", sourceName, input.reason());
            metrics.recordFile(FormatTag.UNRECOGNIZED.name(), "unrecognized", Duration.between(start, Instant.now()));
            return FileImportResult.unrecognized(sourceName, input.reason());
        }

        ReportParser parser = parsers.get(input.format());
        if (parser == null) {
            String reason = "no parser registered for " + input.format();
            log.warn("[IMPORT] {}: {}", sourceName, reason);
            return FileImportResult.unrecognized(sourceName, reason);
        }

        ParseResult parsed = parser.parse(input, new ParseContext(sourceName, config.baseCurrency()));
        FileImportResult result;
        try {
            result = new FileWrite(sourceName, parsed).run();
        } catch (RuntimeException e) {
            log.error("[IMPORT] Storage failure while importing {}: {}", sourceName, e.getMessage(), e);
            metrics.recordFile(input.format().name(), "error", Duration.between(start, Instant.now()));
            throw new ImportException(sourceName, "Failed to write ledger records", e);
        }

        String format = input.format().name();
        metrics.recordRecords(format, "created", result.created());
        metrics.recordRecords(format, "skipped", result.skipped());
        metrics.recordRecords(format, "failed", result.failed());
        metrics.recordFile(format, result.status(), Duration.between(start, Instant.now()));

        log.info("[IMPORT] {} ({}): {} created, {} skipped, {} failed, {} ignored",
            sourceName, format, result.created(), result.skipped(), result.failed(),
            result.ignored().values().stream().mapToInt(Integer::intValue).sum());
        if (result.orphanedWithholdings() > 0) {
            log.warn("[IMPORT] {}: {} withholding rows without a matching dividend", sourceName, result.orphanedWithholdings());
        }
        return result;
    }

    private List<Path> expand(Path path) {
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted()
                .toList();
        } catch (IOException e) {
            log.error("[IMPORT] Cannot list {}: {}", path, e.getMessage(), e);
            throw new ImportException(path.toString(), "Failed to list directory", e);
        }
    }

    private static FileImportResult await(Future<FileImportResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ImportException) {
                throw (ImportException) e.getCause();
            }
            throw new ImportException("batch", "Import worker failed", e.getCause());
        }
    }

    private static ImportSummary logged(ImportSummary summary) {
        log.info("[IMPORT] {}", summary);
        return summary;
    }

    /**
     * Resolution and writes for one parsed file. Snapshots and observed rates go first so
     * that position rates are available to the dividends and cash flows of the same file.
     */
    private final class FileWrite {
        private final String sourceName;
        private final ParseResult parsed;
        private final List<RowError> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<InstrumentRef, Resolution> resolved = new HashMap<>();
        private int created;
        private int skipped;

        FileWrite(String sourceName, ParseResult parsed) {
            this.sourceName = sourceName;
            this.parsed = parsed;
        }

        FileImportResult run() {
            errors.addAll(parsed.errors());

            for (InstrumentRef ref : parsed.instruments()) {
                try {
                    resolve(ref);
                } catch (ResolutionException e) {
                    warnings.add(e.getMessage());
                }
            }
            parsed.observedRates().forEach(writer::recordRate);

            for (SnapshotDraft draft : parsed.snapshots()) {
                count(writer.write(resolvePositions(draft)));
            }
            for (TradeDraft draft : parsed.trades()) {
                linked(draft.instrument(), draft.trade().provenance(),
                    id -> count(writer.write(draft.trade().withInstrumentId(id))));
            }
            for (DividendDraft draft : parsed.dividends()) {
                linked(draft.instrument(), draft.dividend().provenance(),
                    id -> count(writer.write(draft.dividend().withInstrumentId(id))));
            }
            parsed.cashFlows().forEach(cf -> count(writer.write(cf)));
            for (CorporateActionDraft draft : parsed.corporateActions()) {
                count(writer.write(linkOptional(draft)));
            }
            parsed.soldPositions().forEach(sp -> count(writer.write(sp)));
            parsed.cashBalances().forEach(b -> count(writer.write(b)));
            parsed.valuations().forEach(v -> count(writer.write(v)));

            for (EnrichmentDraft draft : parsed.enrichments()) {
                try {
                    if (!resolver.enrich(draft.instrument(), draft.values())) {
                        warnings.add("Enrichment for unknown instrument " + draft.instrument().naturalKey());
                    }
                } catch (ResolutionException e) {
                    warnings.add("Enrichment skipped: " + e.getMessage());
                }
            }

            return new FileImportResult(sourceName, parsed.format(), created, skipped, errors.size(),
                parsed.ignored(), parsed.orphanedWithholdings().size(), errors, warnings, null);
        }

        private Resolution resolve(InstrumentRef ref) {
            Resolution resolution = resolved.get(ref);
            if (resolution == null) {
                resolution = resolver.resolve(ref);
                resolved.put(ref, resolution);
                warnings.addAll(resolution.warnings());
            }
            return resolution;
        }

        private void linked(InstrumentRef ref, Provenance provenance, Consumer<String> write) {
            String instrumentId;
            try {
                instrumentId = resolve(ref).instrumentId();
            } catch (ResolutionException e) {
                errors.add(new RowError(sourceName, provenance.section(), provenance.lineNumber(),
                    e.getMessage(), provenance.rawRow()));
                return;
            }
            write.accept(instrumentId);
        }

        private PortfolioSnapshot resolvePositions(SnapshotDraft draft) {
            PortfolioSnapshot snapshot = draft.snapshot();
            List<Position> positions = new ArrayList<>(snapshot.positions().size());
            for (int i = 0; i < snapshot.positions().size(); i++) {
                Position position = snapshot.positions().get(i);
                InstrumentRef ref = draft.positionRefs().get(i);
                String instrumentId = optionalId(ref, () -> "Position " + ref.naturalKey() + " on "
                    + snapshot.reportDate() + " not linked");
                positions.add(position.withInstrumentId(instrumentId));
            }
            return snapshot.withPositions(positions);
        }

        private CorporateAction linkOptional(CorporateActionDraft draft) {
            if (draft.instrument() == null) {
                return draft.action();
            }
            String id = optionalId(draft.instrument(), () -> "Corporate action " + draft.action().externalId()
                + " not linked to " + draft.instrument().naturalKey());
            return draft.action().withInstrumentId(id);
        }

        private String optionalId(InstrumentRef ref, Supplier<String> warning) {
            try {
                return resolve(ref).instrumentId();
            } catch (ResolutionException e) {
                warnings.add(warning.get() + ": " + e.getMessage());
                return null;
            }
        }

        private void count(WriteOutcome outcome) {
            if (outcome == WriteOutcome.CREATED) {
                created++;
            } else {
                skipped++;
            }
        }
    }
}
