package io.allocations.ledger;

import io.allocations.core.Allocation;
import io.allocations.core.Cluster;
import io.allocations.core.Team;
import io.allocations.source.UsageSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Allocation ledger over a relational store reached through a {@link DataSource}. Transactions run with
 * auto-commit off at the configured isolation level (repeatable read unless told otherwise).
 */
public class JdbcAllocationLedger implements AllocationLedger {
    private static final Logger log = LoggerFactory.getLogger(JdbcAllocationLedger.class);

    private static final String ALLOCATIONS_BASE =
            "FROM allocation a JOIN allocation_request r ON a.request_id = r.id " +
            "WHERE r.team_id = ? AND a.cluster_id = ? AND r.status = 'AP' AND ";

    private final DataSource dataSource;
    private final int isolation;

    public JdbcAllocationLedger(DataSource dataSource) {
        this(dataSource, Connection.TRANSACTION_REPEATABLE_READ);
    }

    public JdbcAllocationLedger(DataSource dataSource, int isolation) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.isolation = isolation;
    }

    @Override
    public List<Cluster> enabledClusters() throws LedgerException {
        String sql = "SELECT " + Rows.CLUSTER_COLUMNS + " FROM cluster WHERE enabled = TRUE ORDER BY name";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<Cluster> out = new ArrayList<>();
            while (rs.next()) out.add(Rows.cluster(rs));
            return out;
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to list enabled clusters", e);
        }
    }

    @Override
    public Optional<Cluster> findCluster(String name) throws LedgerException {
        String sql = "SELECT " + Rows.CLUSTER_COLUMNS + " FROM cluster WHERE name = ?";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Rows.cluster(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to look up cluster " + name, e);
        }
    }

    @Override
    public <T> T inTransaction(LedgerWork<T> work) throws LedgerException, UsageSourceException {
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            int previousIsolation = c.getTransactionIsolation();
            c.setAutoCommit(false);
            c.setTransactionIsolation(isolation);
            try {
                T result = work.run(new JdbcLedgerTransaction(c));
                c.commit();
                return result;
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                restore(c, autoCommit, previousIsolation);
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Ledger transaction failed", e);
        }
    }

    static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    // pooled connections go back with the settings they came with
    private static void restore(Connection c, boolean autoCommit, int isolation) {
        try {
            c.setTransactionIsolation(isolation);
            c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Failed to restore connection settings after ledger transaction", e);
        }
    }

    private static final class JdbcLedgerTransaction implements LedgerTransaction {
        private final Connection c;

        JdbcLedgerTransaction(Connection c) { this.c = c; }

        @Override
        public Optional<Team> findTeam(String name) throws LedgerException {
            String sql = "SELECT " + Rows.TEAM_COLUMNS + " FROM team WHERE name = ?";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(Rows.team(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new LedgerUnavailableException("Failed to look up team " + name, e);
            }
        }

        @Override
        public List<Allocation> allocations(long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException {
            String sql = "SELECT " + Rows.ALLOCATION_COLUMNS + " " + ALLOCATIONS_BASE + state.predicate() +
                    " ORDER BY r.expire_date, a.id";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, teamId, clusterId, state, today);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Allocation> out = new ArrayList<>();
                    while (rs.next()) out.add(Rows.allocation(rs));
                    return out;
                }
            } catch (SQLException e) {
                throw new LedgerUnavailableException("Failed to read " + state + " allocations", e);
            }
        }

        @Override
        public long sumAwarded(long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException {
            return sum("a.awarded", teamId, clusterId, state, today);
        }

        @Override
        public long sumFinalUsage(long teamId, long clusterId, LocalDate today) throws LedgerException {
            return sum("a.final_usage", teamId, clusterId, AllocationState.HISTORICAL, today);
        }

        private long sum(String column, long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException {
            // SUM over no rows is NULL, not 0
            String sql = "SELECT COALESCE(SUM(" + column + "), 0) " + ALLOCATIONS_BASE + state.predicate();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, teamId, clusterId, state, today);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getLong(1);
                }
            } catch (SQLException e) {
                throw new LedgerUnavailableException("Failed to sum " + column + " over " + state + " allocations", e);
            }
        }

        @Override
        public void closeAllocation(long allocationId, long finalUsage) throws LedgerException {
            if (finalUsage < 0) throw new IllegalArgumentException("Final usage must not be negative: " + finalUsage);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE allocation SET final_usage = ? WHERE id = ? AND final_usage IS NULL")) {
                ps.setLong(1, finalUsage);
                ps.setLong(2, allocationId);
                if (ps.executeUpdate() == 1) return;
            } catch (SQLException e) {
                throw new LedgerUnavailableException("Failed to close allocation " + allocationId, e);
            }
            try (PreparedStatement ps = c.prepareStatement("SELECT final_usage FROM allocation WHERE id = ?")) {
                ps.setLong(1, allocationId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) throw new LedgerException("Unknown allocation " + allocationId);
                    throw new AlreadyClosedException(allocationId, rs.getLong(1));
                }
            } catch (SQLException e) {
                throw new LedgerUnavailableException("Failed to read allocation " + allocationId, e);
            }
        }

        private static void bind(PreparedStatement ps, long teamId, long clusterId, AllocationState state, LocalDate today) throws SQLException {
            ps.setLong(1, teamId);
            ps.setLong(2, clusterId);
            for (int i = 0; i < state.dateParameters(); i++) {
                Rows.setDate(ps, 3 + i, today);
            }
        }
    }
}
