package in.folioledger.service.instrument;

import in.folioledger.application.port.output.InstrumentAliasRepository;
import in.folioledger.application.port.output.InstrumentRepository;
import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.Instrument;
import in.folioledger.domain.model.InstrumentAlias;
import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.domain.model.InstrumentRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical instrument catalog and symbol alias table.
 *
 * RESOLUTION:
 * - By ISIN: atomic get-or-create, then fill empty catalog fields from the hints.
 * - Without ISIN: through the alias table by symbol, only when exactly one instrument matches.
 *
 * ALIASES:
 * Keyed by (instrument, symbol, exchange). A new venue adds a row; a repeated sighting only
 * widens the validity interval. The primary alias is elected by source priority, then by
 * most recent validFrom, then by creation time.
 */
public final class InstrumentResolver {
    private static final Logger log = LoggerFactory.getLogger(InstrumentResolver.class);

    private static final Comparator<InstrumentAlias> PRIMARY_ORDER = Comparator
        .comparingInt((InstrumentAlias a) -> a.source().priority())
        .thenComparing(InstrumentAlias::validFrom, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(InstrumentAlias::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final InstrumentRepository instrumentRepo;
    private final InstrumentAliasRepository aliasRepo;

    public InstrumentResolver(InstrumentRepository instrumentRepo, InstrumentAliasRepository aliasRepo) {
        this.instrumentRepo = instrumentRepo;
        this.aliasRepo = aliasRepo;
    }

    /**
     * Resolve a parsed reference to a catalog instrument and record the symbol it was seen under.
     *
     * @throws ResolutionException when the reference has no ISIN and its symbol is unknown or ambiguous
     */
    public Resolution resolve(InstrumentRef ref) {
        if (ref.hasIsin()) {
            return resolveByIsin(ref);
        }
        return resolveBySymbol(ref);
    }

    private Resolution resolveByIsin(InstrumentRef ref) {
        InstrumentHints hints = ref.hints();
        Instrument candidate = Instrument.create(ref.isin(), hints);
        Instrument stored = instrumentRepo.getOrCreate(candidate);
        boolean created = stored.id().equals(candidate.id());

        List<String> conflicts = new ArrayList<>();
        if (!created) {
            Instrument merged = stored.mergeHints(hints, conflicts);
            if (merged != stored) {
                instrumentRepo.update(merged);
                stored = merged;
            }
            conflicts.forEach(c -> log.warn("[RESOLVER] Resolution conflict: {}", c));
        } else {
            log.debug("[RESOLVER] New instrument {} ({})", stored.isin(), hints.symbol());
        }

        if (hints.symbol() != null) {
            recordAlias(stored.id(), hints.symbol(), hints.exchange(), hints.source(), hints.seenOn());
        }
        return new Resolution(stored, created, conflicts);
    }

    private Resolution resolveBySymbol(InstrumentRef ref) {
        String symbol = ref.hints().symbol();
        if (symbol == null) {
            throw new ResolutionException("Reference has neither ISIN nor symbol");
        }
        LocalDate seenOn = ref.hints().seenOn();
        List<InstrumentAlias> matches = aliasRepo.findBySymbol(symbol);
        List<InstrumentAlias> current = matches.stream()
            .filter(a -> a.isValidOn(seenOn))
            .toList();
        Set<String> instrumentIds = (current.isEmpty() ? matches : current).stream()
            .map(InstrumentAlias::instrumentId)
            .collect(Collectors.toSet());

        if (instrumentIds.isEmpty()) {
            throw new ResolutionException("Unknown symbol '" + symbol + "' and no ISIN");
        }
        if (instrumentIds.size() > 1) {
            throw new ResolutionException("Symbol '" + symbol + "' is ambiguous across "
                + instrumentIds.size() + " instruments and no ISIN");
        }
        String instrumentId = instrumentIds.iterator().next();
        Instrument instrument = instrumentRepo.findById(instrumentId)
            .orElseThrow(() -> new ResolutionException("Alias '" + symbol + "' points to missing instrument " + instrumentId));
        return new Resolution(instrument, false, List.of());
    }

    /**
     * Idempotent alias upsert keyed by (instrument, symbol, exchange). Re-electing the
     * primary alias follows every change.
     */
    public InstrumentAlias recordAlias(String instrumentId, String symbol, String exchange,
                                       AliasSource source, LocalDate seenOn) {
        String cleanSymbol = symbol.trim();
        String cleanExchange = exchange == null ? "" : exchange.trim();
        Optional<InstrumentAlias> existing = aliasRepo.find(instrumentId, cleanSymbol, cleanExchange);

        InstrumentAlias stored;
        if (existing.isPresent()) {
            InstrumentAlias alias = existing.get();
            InstrumentAlias widened = alias.widenedTo(seenOn, null);
            AliasSource better = source != null && source.priority() > alias.source().priority() ? source : alias.source();
            if (widened.equals(alias) && better == alias.source()) {
                return alias;
            }
            stored = aliasRepo.upsert(new InstrumentAlias(widened.id(), widened.instrumentId(), widened.symbol(),
                widened.exchange(), widened.validFrom(), widened.validTo(), better, widened.primary(), widened.createdAt()));
        } else {
            stored = aliasRepo.upsert(InstrumentAlias.create(instrumentId, cleanSymbol, cleanExchange, source, seenOn));
            log.debug("[RESOLVER] Alias {}@{} -> {} ({})", cleanSymbol, cleanExchange, instrumentId, stored.source().code());
        }
        electPrimary(instrumentId);
        return stored;
    }

    /**
     * Choose the primary alias of an instrument and flip the flag atomically.
     *
     * @return the primary alias, empty when the instrument has no aliases
     */
    public Optional<InstrumentAlias> electPrimary(String instrumentId) {
        List<InstrumentAlias> aliases = aliasRepo.findByInstrument(instrumentId);
        Optional<InstrumentAlias> winner = aliases.stream().max(PRIMARY_ORDER);
        winner.ifPresent(w -> {
            boolean alreadyPrimary = aliases.stream().filter(InstrumentAlias::primary)
                .map(InstrumentAlias::id).toList().equals(List.of(w.id()));
            if (!alreadyPrimary) {
                aliasRepo.setPrimary(instrumentId, w.id());
            }
        });
        return winner.map(w -> w.withPrimary(true));
    }

    /**
     * Overwrite enrichment keys of an instrument. Unknown ISINs are ignored.
     *
     * @return true when the instrument exists
     */
    public boolean enrich(String isin, Map<String, String> values) {
        Optional<Instrument> found = instrumentRepo.findByIsin(isin);
        if (found.isEmpty()) {
            log.debug("[RESOLVER] Enrichment for unknown ISIN {} dropped", isin);
            return false;
        }
        instrumentRepo.update(found.get().withEnrichment(values));
        return true;
    }

    /**
     * Enrich through a reference that may only carry a symbol. Never creates an instrument.
     *
     * @throws ResolutionException when a symbol-only reference cannot be resolved
     */
    public boolean enrich(InstrumentRef ref, Map<String, String> values) {
        if (ref.hasIsin()) {
            return enrich(ref.isin(), values);
        }
        Instrument instrument = resolveBySymbol(ref).instrument();
        instrumentRepo.update(instrument.withEnrichment(values));
        return true;
    }
}
