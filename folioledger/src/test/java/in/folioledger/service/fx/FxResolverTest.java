package in.folioledger.service.fx;

import in.folioledger.config.LedgerConfig;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.infrastructure.persistence.memory.InMemoryFxRateRepository;
import in.folioledger.infrastructure.persistence.memory.InMemorySnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FxResolver")
class FxResolverTest {

    private static final LocalDate DAY = LocalDate.of(2026, 4, 1);

    @Mock
    private ExternalRateSource external;

    private InMemorySnapshotRepository snapshots;
    private InMemoryFxRateRepository rates;
    private FxResolver resolver;

    @BeforeEach
    void setUp() {
        snapshots = new InMemorySnapshotRepository();
        rates = new InMemoryFxRateRepository();
        resolver = FxResolver.standard(LedgerConfig.defaults(), snapshots, rates, external);
    }

    private void snapshotWithRate(String id, LocalDate date, String instrumentId, String currency, String rate) {
        Position position = new Position(instrumentId, "KO", "US1912161007", currency, BigDecimal.TEN,
            new BigDecimal("60"), new BigDecimal("600"), null, null, null, new BigDecimal(rate), "STK", null, null);
        snapshots.insertIfAbsent(new PortfolioSnapshot(id, date, "ibkr_flex", null, null, List.of(position), null));
    }

    @Test
    void resolve_explicitRate_winsOverEverything() {
        rates.upsert(new FxRate(DAY, "USD", new BigDecimal("0.90"), "trade"));

        FxResolution resolution = resolver.resolve(new FxQuery("USD", DAY, new BigDecimal("0.86"), null));

        assertEquals(FxSource.EXPLICIT, resolution.source());
        assertEquals(0, new BigDecimal("0.86").compareTo(resolution.rate()));
        verifyNoInteractions(external);
    }

    @Test
    void resolve_baseCurrency_isIdentity() {
        FxResolution resolution = resolver.resolve(FxQuery.of("eur", DAY));

        assertEquals(FxSource.BASE, resolution.source());
        assertEquals(new BigDecimal("143.00"), resolution.convert(new BigDecimal("143.00")));
    }

    @Test
    @DisplayName("same-currency position rate is used; nearest date wins")
    void resolve_positionRate_nearestSnapshot() {
        snapshotWithRate("s1", DAY.minusDays(20), "i1", "USD", "0.80");
        snapshotWithRate("s2", DAY.plusDays(3), "i2", "USD", "0.85");

        FxResolution resolution = resolver.resolve(FxQuery.of("USD", DAY));

        assertEquals(FxSource.POSITION, resolution.source());
        assertEquals(0, new BigDecimal("0.85").compareTo(resolution.rate()));
        assertEquals(DAY.plusDays(3), resolution.rateDate());
        assertEquals(0, new BigDecimal("36.8475").compareTo(resolution.convert(new BigDecimal("43.35"))));
    }

    @Test
    void resolve_positionRate_prefersSameInstrument() {
        snapshotWithRate("s1", DAY.minusDays(20), "i1", "USD", "0.80");
        snapshotWithRate("s2", DAY.plusDays(3), "i2", "USD", "0.85");

        FxResolution resolution = resolver.resolve(new FxQuery("USD", DAY, null, "i1"));

        assertEquals(0, new BigDecimal("0.80").compareTo(resolution.rate()));
    }

    @Test
    void resolve_positionInOtherCurrency_isNeverUsed() {
        snapshotWithRate("s1", DAY, "i1", "SEK", "0.087");
        when(external.fetch("USD", DAY, "EUR")).thenReturn(Optional.empty());

        FxResolution resolution = resolver.resolve(FxQuery.of("USD", DAY));

        assertEquals(FxSource.UNCONVERTED, resolution.source());
        assertNull(resolution.convert(BigDecimal.TEN));
    }

    @Test
    void resolve_rateTable_nearestPriorWithinWindow() {
        rates.upsert(new FxRate(DAY.minusDays(3), "USD", new BigDecimal("0.91"), "trade"));
        rates.upsert(new FxRate(DAY.plusDays(1), "USD", new BigDecimal("0.99"), "trade"));

        FxResolution resolution = resolver.resolve(FxQuery.of("USD", DAY));

        assertEquals(FxSource.RATE_TABLE, resolution.source());
        assertEquals(0, new BigDecimal("0.91").compareTo(resolution.rate()));
        assertEquals(DAY.minusDays(3), resolution.rateDate());
    }

    @Test
    @DisplayName("stale rate falls through to the external source, whose answer is stored")
    void resolve_rateTableMiss_fetchesAndStores() {
        rates.upsert(new FxRate(DAY.minusDays(30), "USD", new BigDecimal("0.91"), "trade"));
        when(external.fetch("USD", DAY, "EUR")).thenReturn(Optional.of(new BigDecimal("0.92")));

        FxResolution first = resolver.resolve(FxQuery.of("USD", DAY));
        FxResolution second = resolver.resolve(FxQuery.of("USD", DAY));

        assertEquals(FxSource.EXTERNAL, first.source());
        assertEquals(FxSource.RATE_TABLE, second.source());
        verify(external, times(1)).fetch(any(), any(), any());
        assertEquals("external", rates.findNearestPrior("USD", DAY, DAY).orElseThrow().source());
    }

    @Test
    void resolve_withoutExternalSource_isUnconverted() {
        FxResolver noExternal = FxResolver.standard(LedgerConfig.defaults(), snapshots, rates);

        assertEquals(FxSource.UNCONVERTED, noExternal.resolve(FxQuery.of("JPY", DAY)).source());
        assertTrue(noExternal.rate("JPY", DAY).isEmpty());
        assertNull(noExternal.toBase(BigDecimal.ONE, "JPY", DAY));
    }

    @Test
    void resolve_nonPositiveExplicitRate_isIgnored() {
        FxResolution resolution = resolver.resolve(new FxQuery("EUR", DAY, BigDecimal.ZERO, null));

        assertEquals(FxSource.BASE, resolution.source());
    }

    @Test
    @DisplayName("foreign amounts never fall back to 1 when only other currencies are known")
    void resolve_crossCurrency_neverDefaultsToOne() {
        FxResolver noExternal = FxResolver.standard(LedgerConfig.defaults(), snapshots, rates);
        List<String> known = List.of("SEK", "GBP", "JPY");
        for (int i = 0; i < known.size(); i++) {
            snapshotWithRate("s" + i, DAY.minusDays(i), "i" + i, known.get(i), "0.5");
            rates.upsert(new FxRate(DAY.minusDays(i), known.get(i), new BigDecimal("0.5"), "trade"));
        }

        for (String currency : List.of("USD", "CHF", "NOK", "CAD")) {
            for (int offset = -100; offset <= 100; offset += 25) {
                FxResolution resolution = noExternal.resolve(FxQuery.of(currency, DAY.plusDays(offset)));
                assertEquals(FxSource.UNCONVERTED, resolution.source(), currency + " at offset " + offset);
                assertNull(resolution.convert(new BigDecimal("100")));
            }
        }
    }

    @Test
    void resolve_baseCurrency_ignoresRateTableAndPositions() {
        snapshotWithRate("s1", DAY, "i1", "EUR", "1.10");
        rates.upsert(new FxRate(DAY, "EUR", new BigDecimal("0.95"), "trade"));

        for (int offset = -10; offset <= 10; offset++) {
            FxResolution resolution = resolver.resolve(new FxQuery("EUR", DAY.plusDays(offset), null, "i1"));
            assertEquals(FxSource.BASE, resolution.source());
            assertEquals(0, BigDecimal.ONE.compareTo(resolution.rate()));
        }
        verifyNoInteractions(external);
    }
}
