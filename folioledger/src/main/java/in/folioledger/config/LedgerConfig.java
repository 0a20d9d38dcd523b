package in.folioledger.config;

import in.folioledger.util.Env;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Runtime configuration for import, FX resolution and audit.
 *
 * Built from environment variables by {@link #fromEnv()}; tests build it directly.
 */
public record LedgerConfig(
    String baseCurrency,              // All reconciled totals are expressed in this currency
    int fxRateWindowDays,             // Max age of a rate-table entry for nearest-prior lookup
    int fxPositionWindowDays,         // Max distance to a same-currency position rate
    String fxHttpUrl,                 // External rate source, null = disabled
    int fxHttpTimeoutMs,
    ToleranceBand standardBand,
    ToleranceBand marginBand,
    boolean marginAccount,
    Set<String> disabledChecks,       // Audit check ids switched off
    int importThreads
) {
    public static final String DEFAULT_BASE_CURRENCY = "EUR";

    public static LedgerConfig defaults() {
        return new LedgerConfig(
            DEFAULT_BASE_CURRENCY,
            7,
            90,
            null,
            3000,
            ToleranceBand.standard(),
            ToleranceBand.margin(),
            false,
            Set.of(),
            1
        );
    }

    public static LedgerConfig fromEnv() {
        return new LedgerConfig(
            Env.get("BASE_CURRENCY", DEFAULT_BASE_CURRENCY).toUpperCase(),
            Env.getInt("FX_RATE_WINDOW_DAYS", 7),
            Env.getInt("FX_POSITION_WINDOW_DAYS", 90),
            Env.get("FX_HTTP_URL", null),
            Env.getInt("FX_HTTP_TIMEOUT_MS", 3000),
            new ToleranceBand(
                Env.getDecimal("BALANCE_WARN_PCT", new BigDecimal("1.0")),
                Env.getDecimal("BALANCE_FAIL_PCT", new BigDecimal("5.0"))),
            new ToleranceBand(
                Env.getDecimal("MARGIN_WARN_PCT", new BigDecimal("2.0")),
                Env.getDecimal("MARGIN_FAIL_PCT", new BigDecimal("10.0"))),
            Env.getBool("MARGIN_ACCOUNT", false),
            Set.copyOf(Env.getList("AUDIT_DISABLED_CHECKS")),
            Math.max(1, Env.getInt("IMPORT_THREADS", 1))
        );
    }

    /** Band applied by the balance check for this account. */
    public ToleranceBand activeBand() {
        return marginAccount ? marginBand : standardBand;
    }

    public boolean isCheckEnabled(String checkId) {
        return !disabledChecks.contains(checkId);
    }

    public boolean isBaseCurrency(String currency) {
        return currency != null && baseCurrency.equalsIgnoreCase(currency);
    }

    public LedgerConfig withBaseCurrency(String currency) {
        return new LedgerConfig(currency, fxRateWindowDays, fxPositionWindowDays, fxHttpUrl,
            fxHttpTimeoutMs, standardBand, marginBand, marginAccount, disabledChecks, importThreads);
    }

    public LedgerConfig withMarginAccount(boolean margin) {
        return new LedgerConfig(baseCurrency, fxRateWindowDays, fxPositionWindowDays, fxHttpUrl,
            fxHttpTimeoutMs, standardBand, marginBand, margin, disabledChecks, importThreads);
    }

    public LedgerConfig withStandardBand(ToleranceBand band) {
        return new LedgerConfig(baseCurrency, fxRateWindowDays, fxPositionWindowDays, fxHttpUrl,
            fxHttpTimeoutMs, band, marginBand, marginAccount, disabledChecks, importThreads);
    }

    public LedgerConfig withDisabledChecks(Set<String> checks) {
        return new LedgerConfig(baseCurrency, fxRateWindowDays, fxPositionWindowDays, fxHttpUrl,
            fxHttpTimeoutMs, standardBand, marginBand, marginAccount, Set.copyOf(checks), importThreads);
    }

    public LedgerConfig withImportThreads(int threads) {
        return new LedgerConfig(baseCurrency, fxRateWindowDays, fxPositionWindowDays, fxHttpUrl,
            fxHttpTimeoutMs, standardBand, marginBand, marginAccount, disabledChecks, Math.max(1, threads));
    }
}
