package in.folioledger.infrastructure.persistence;

import in.folioledger.application.port.output.LedgerRepository;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.Time;
import java.util.List;

/**
 * PostgreSQL implementation of LedgerRepository.
 *
 * Each table carries a unique external_id; inserts use ON CONFLICT DO NOTHING so a
 * re-import of the same file writes nothing.
 */
public final class PostgresLedgerRepository implements LedgerRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLedgerRepository.class);

    private final JdbcSupport jdbc;

    public PostgresLedgerRepository(DataSource dataSource) {
        this.jdbc = new JdbcSupport(dataSource, log);
    }

    // ═══════════════════════════════════════════════════════════════
    // TRADES
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean insertTradeIfAbsent(Trade t) {
        String sql = """
                INSERT INTO trades (
                    external_id, instrument_id, trade_date, trade_time, settlement_date,
                    quantity, price, amount, commission, currency, fx_rate,
                    asset_category, exchange, description, realized_pnl, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "trade", t.externalId(), ps -> {
            ps.setString(1, t.externalId());
            ps.setString(2, t.instrumentId());
            ps.setDate(3, JsonColumns.sqlDate(t.tradeDate()));
            ps.setTime(4, t.tradeTime() == null ? null : Time.valueOf(t.tradeTime()));
            ps.setDate(5, JsonColumns.sqlDate(t.settlementDate()));
            ps.setBigDecimal(6, t.quantity());
            ps.setBigDecimal(7, t.price());
            ps.setBigDecimal(8, t.amount());
            ps.setBigDecimal(9, t.commission());
            ps.setString(10, t.currency());
            ps.setBigDecimal(11, t.fxRate());
            ps.setString(12, t.assetCategory());
            ps.setString(13, t.exchange());
            ps.setString(14, t.description());
            ps.setBigDecimal(15, t.realizedPnl());
            ps.setString(16, JsonColumns.write(t.provenance()));
        });
    }

    @Override
    public List<Trade> findAllTrades() {
        String sql = """
                SELECT external_id, instrument_id, trade_date, trade_time, settlement_date,
                       quantity, price, amount, commission, currency, fx_rate,
                       asset_category, exchange, description, realized_pnl, provenance
                FROM trades
                ORDER BY trade_date, trade_time, external_id
                """;

        return jdbc.queryAll(sql, "trades", rs -> {
            Time time = rs.getTime("trade_time");
            return new Trade(
                    rs.getString("external_id"),
                    rs.getString("instrument_id"),
                    JsonColumns.date(rs, "trade_date"),
                    time == null ? null : time.toLocalTime(),
                    JsonColumns.date(rs, "settlement_date"),
                    rs.getBigDecimal("quantity"),
                    rs.getBigDecimal("price"),
                    rs.getBigDecimal("amount"),
                    rs.getBigDecimal("commission"),
                    rs.getString("currency"),
                    rs.getBigDecimal("fx_rate"),
                    rs.getString("asset_category"),
                    rs.getString("exchange"),
                    rs.getString("description"),
                    rs.getBigDecimal("realized_pnl"),
                    JsonColumns.provenance(rs, "provenance"));
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // DIVIDENDS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean insertDividendIfAbsent(DividendPayment d) {
        String sql = """
                INSERT INTO dividends (
                    external_id, instrument_id, ex_date, pay_date, gross_amount, withholding_tax,
                    net_amount, currency, fx_rate, amount_base, quantity, per_share,
                    amount_type, description, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "dividend", d.externalId(), ps -> {
            ps.setString(1, d.externalId());
            ps.setString(2, d.instrumentId());
            ps.setDate(3, JsonColumns.sqlDate(d.exDate()));
            ps.setDate(4, JsonColumns.sqlDate(d.payDate()));
            ps.setBigDecimal(5, d.grossAmount());
            ps.setBigDecimal(6, d.withholdingTax());
            ps.setBigDecimal(7, d.netAmount());
            ps.setString(8, d.currency());
            ps.setBigDecimal(9, d.fxRate());
            ps.setBigDecimal(10, d.amountBase());
            ps.setBigDecimal(11, d.quantity());
            ps.setBigDecimal(12, d.perShare());
            ps.setString(13, d.amountType() == null ? null : d.amountType().name());
            ps.setString(14, d.description());
            ps.setString(15, JsonColumns.write(d.provenance()));
        });
    }

    @Override
    public List<DividendPayment> findAllDividends() {
        String sql = """
                SELECT external_id, instrument_id, ex_date, pay_date, gross_amount, withholding_tax,
                       net_amount, currency, fx_rate, amount_base, quantity, per_share,
                       amount_type, description, provenance
                FROM dividends
                ORDER BY pay_date, external_id
                """;

        return jdbc.queryAll(sql, "dividends", rs -> {
            String amountType = rs.getString("amount_type");
            return new DividendPayment(
                    rs.getString("external_id"),
                    rs.getString("instrument_id"),
                    JsonColumns.date(rs, "ex_date"),
                    JsonColumns.date(rs, "pay_date"),
                    rs.getBigDecimal("gross_amount"),
                    rs.getBigDecimal("withholding_tax"),
                    rs.getBigDecimal("net_amount"),
                    rs.getString("currency"),
                    rs.getBigDecimal("fx_rate"),
                    rs.getBigDecimal("amount_base"),
                    rs.getBigDecimal("quantity"),
                    rs.getBigDecimal("per_share"),
                    amountType == null ? null : DividendAmountType.valueOf(amountType),
                    rs.getString("description"),
                    JsonColumns.provenance(rs, "provenance"));
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // CASH FLOWS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean insertCashFlowIfAbsent(CashFlow c) {
        String sql = """
                INSERT INTO cash_flows (
                    external_id, flow_type, flow_date, amount, currency, fx_rate, amount_base,
                    description, source, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "cash flow", c.externalId(), ps -> {
            ps.setString(1, c.externalId());
            ps.setString(2, c.flowType().code());
            ps.setDate(3, JsonColumns.sqlDate(c.date()));
            ps.setBigDecimal(4, c.amount());
            ps.setString(5, c.currency());
            ps.setBigDecimal(6, c.fxRate());
            ps.setBigDecimal(7, c.amountBase());
            ps.setString(8, c.description());
            ps.setString(9, c.source());
            ps.setString(10, JsonColumns.write(c.provenance()));
        });
    }

    @Override
    public List<CashFlow> findAllCashFlows() {
        String sql = """
                SELECT external_id, flow_type, flow_date, amount, currency, fx_rate, amount_base,
                       description, source, provenance
                FROM cash_flows
                ORDER BY flow_date, external_id
                """;

        return jdbc.queryAll(sql, "cash flows", rs -> new CashFlow(
                rs.getString("external_id"),
                CashFlowType.fromCode(rs.getString("flow_type")),
                JsonColumns.date(rs, "flow_date"),
                rs.getBigDecimal("amount"),
                rs.getString("currency"),
                rs.getBigDecimal("fx_rate"),
                rs.getBigDecimal("amount_base"),
                rs.getString("description"),
                rs.getString("source"),
                JsonColumns.provenance(rs, "provenance")));
    }

    // ═══════════════════════════════════════════════════════════════
    // CORPORATE ACTIONS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean insertCorporateActionIfAbsent(CorporateAction a) {
        String sql = """
                INSERT INTO corporate_actions (
                    external_id, instrument_id, action_type, action_date, description,
                    quantity, amount, proceeds, currency, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "corporate action", a.externalId(), ps -> {
            ps.setString(1, a.externalId());
            ps.setString(2, a.instrumentId());
            ps.setString(3, a.actionType());
            ps.setDate(4, JsonColumns.sqlDate(a.date()));
            ps.setString(5, a.description());
            ps.setBigDecimal(6, a.quantity());
            ps.setBigDecimal(7, a.amount());
            ps.setBigDecimal(8, a.proceeds());
            ps.setString(9, a.currency());
            ps.setString(10, JsonColumns.write(a.provenance()));
        });
    }

    @Override
    public List<CorporateAction> findAllCorporateActions() {
        String sql = """
                SELECT external_id, instrument_id, action_type, action_date, description,
                       quantity, amount, proceeds, currency, provenance
                FROM corporate_actions
                ORDER BY action_date, external_id
                """;

        return jdbc.queryAll(sql, "corporate actions", rs -> new CorporateAction(
                rs.getString("external_id"),
                rs.getString("instrument_id"),
                rs.getString("action_type"),
                JsonColumns.date(rs, "action_date"),
                rs.getString("description"),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("amount"),
                rs.getBigDecimal("proceeds"),
                rs.getString("currency"),
                JsonColumns.provenance(rs, "provenance")));
    }

    // ═══════════════════════════════════════════════════════════════
    // SOLD POSITIONS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean insertSoldPositionIfAbsent(SoldPosition s) {
        String sql = """
                INSERT INTO sold_positions (
                    external_id, isin, symbol, sale_date, quantity, purchase_price, sale_price,
                    realized_pnl, currency, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "sold position", s.externalId(), ps -> {
            ps.setString(1, s.externalId());
            ps.setString(2, s.isin());
            ps.setString(3, s.symbol());
            ps.setDate(4, JsonColumns.sqlDate(s.saleDate()));
            ps.setBigDecimal(5, s.quantity());
            ps.setBigDecimal(6, s.purchasePrice());
            ps.setBigDecimal(7, s.salePrice());
            ps.setBigDecimal(8, s.realizedPnl());
            ps.setString(9, s.currency());
            ps.setString(10, JsonColumns.write(s.provenance()));
        });
    }

    @Override
    public List<SoldPosition> findAllSoldPositions() {
        String sql = """
                SELECT external_id, isin, symbol, sale_date, quantity, purchase_price, sale_price,
                       realized_pnl, currency, provenance
                FROM sold_positions
                ORDER BY sale_date, external_id
                """;

        return jdbc.queryAll(sql, "sold positions", this::mapSoldPosition);
    }

    private SoldPosition mapSoldPosition(ResultSet rs) throws Exception {
        return new SoldPosition(
                rs.getString("external_id"),
                rs.getString("isin"),
                rs.getString("symbol"),
                JsonColumns.date(rs, "sale_date"),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("purchase_price"),
                rs.getBigDecimal("sale_price"),
                rs.getBigDecimal("realized_pnl"),
                rs.getString("currency"),
                JsonColumns.provenance(rs, "provenance"));
    }
}
