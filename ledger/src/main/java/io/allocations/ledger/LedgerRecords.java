package io.allocations.ledger;

import io.allocations.core.Allocation;
import io.allocations.core.AllocationRequest;
import io.allocations.core.AllocationReview;
import io.allocations.core.Cluster;
import io.allocations.core.Team;
import io.allocations.core.TeamMembership;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Administrative writes and lookups that populate the ledger: clusters, teams and their members, allocation
 * requests with their reviews and allocations. Approval sets the awarded amounts, which can only be set once.
 */
public class LedgerRecords {
    private final DataSource dataSource;

    public LedgerRecords(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource);
    }

    public Cluster createCluster(String name, String description, boolean enabled) throws LedgerException {
        long id = insert("INSERT INTO cluster (name, description, enabled) VALUES (?, ?, ?)", ps -> {
            ps.setString(1, name);
            Rows.setNullableString(ps, 2, description);
            ps.setBoolean(3, enabled);
        });
        return new Cluster(id, name, description, enabled);
    }

    public void setClusterEnabled(String name, boolean enabled) throws LedgerException {
        int updated = update("UPDATE cluster SET enabled = ? WHERE name = ?", ps -> {
            ps.setBoolean(1, enabled);
            ps.setString(2, name);
        });
        if (updated == 0) throw new LedgerException("Unknown cluster " + name);
    }

    public Team createTeam(String name) throws LedgerException {
        long id = insert("INSERT INTO team (name, is_active) VALUES (?, TRUE)", ps -> ps.setString(1, name));
        return new Team(id, name, true);
    }

    public TeamMembership addMember(long teamId, String userName, TeamMembership.Role role) throws LedgerException {
        long id = insert("INSERT INTO team_membership (team_id, user_name, member_role) VALUES (?, ?, ?)", ps -> {
            ps.setLong(1, teamId);
            ps.setString(2, userName);
            ps.setString(3, role.code());
        });
        return new TeamMembership(id, teamId, userName, role);
    }

    public List<TeamMembership> members(long teamId) throws LedgerException {
        return query("SELECT id, team_id, user_name, member_role FROM team_membership WHERE team_id = ? ORDER BY user_name",
                ps -> ps.setLong(1, teamId), Rows::membership);
    }

    public AllocationRequest submitRequest(long teamId, String title, String description, LocalDate submitted) throws LedgerException {
        long id = insert("INSERT INTO allocation_request (team_id, title, description, submitted, status) VALUES (?, ?, ?, ?, ?)", ps -> {
            ps.setLong(1, teamId);
            ps.setString(2, title);
            Rows.setNullableString(ps, 3, description);
            Rows.setDate(ps, 4, submitted);
            ps.setString(5, AllocationRequest.Status.PENDING.code());
        });
        return new AllocationRequest(id, teamId, title, description, submitted, null, null, null, AllocationRequest.Status.PENDING);
    }

    public Optional<AllocationRequest> findRequest(long requestId) throws LedgerException {
        List<AllocationRequest> found = query("SELECT " + Rows.REQUEST_COLUMNS + " FROM allocation_request WHERE id = ?",
                ps -> ps.setLong(1, requestId), Rows::request);
        return found.stream().findFirst();
    }

    public Allocation addAllocation(long requestId, long clusterId, long requested) throws LedgerException {
        if (requested < 0) throw new IllegalArgumentException("Requested units must not be negative: " + requested);
        long id = insert("INSERT INTO allocation (request_id, cluster_id, requested) VALUES (?, ?, ?)", ps -> {
            ps.setLong(1, requestId);
            ps.setLong(2, clusterId);
            ps.setLong(3, requested);
        });
        return findAllocation(id).orElseThrow(() -> new LedgerException("Allocation " + id + " vanished after insert"));
    }

    public Optional<Allocation> findAllocation(long allocationId) throws LedgerException {
        List<Allocation> found = query("SELECT " + Rows.ALLOCATION_COLUMNS +
                        " FROM allocation a JOIN allocation_request r ON a.request_id = r.id WHERE a.id = ?",
                ps -> ps.setLong(1, allocationId), Rows::allocation);
        return found.stream().findFirst();
    }

    public List<Allocation> allocationsForRequest(long requestId) throws LedgerException {
        return query("SELECT " + Rows.ALLOCATION_COLUMNS +
                        " FROM allocation a JOIN allocation_request r ON a.request_id = r.id WHERE a.request_id = ? ORDER BY a.id",
                ps -> ps.setLong(1, requestId), Rows::allocation);
    }

    public AllocationReview recordReview(long requestId, String reviewer, AllocationRequest.Status status,
                                         String publicComments, String privateComments, Instant modified) throws LedgerException {
        if (status == AllocationRequest.Status.PENDING) throw new IllegalArgumentException("A review cannot leave a request pending");
        long id = insert("INSERT INTO allocation_review (request_id, reviewer, status, public_comments, private_comments, date_modified) " +
                "VALUES (?, ?, ?, ?, ?, ?)", ps -> {
            ps.setLong(1, requestId);
            ps.setString(2, reviewer);
            ps.setString(3, status.code());
            Rows.setNullableString(ps, 4, publicComments);
            Rows.setNullableString(ps, 5, privateComments);
            ps.setTimestamp(6, Timestamp.from(modified));
        });
        return new AllocationReview(id, requestId, reviewer, status, publicComments, privateComments, modified);
    }

    public List<AllocationReview> reviews(long requestId) throws LedgerException {
        return query("SELECT id, request_id, reviewer, status, public_comments, private_comments, date_modified " +
                        "FROM allocation_review WHERE request_id = ? ORDER BY date_modified, id",
                ps -> ps.setLong(1, requestId), Rows::review);
    }

    /**
     * Approve a request: set its approval, activation and expiration dates and award units to its allocations.
     * Every allocation id in {@code awards} must belong to the request and not yet carry an award.
     */
    public AllocationRequest approve(long requestId, LocalDate approved, LocalDate active, LocalDate expire,
                                     Map<Long, Long> awards) throws LedgerException {
        Objects.requireNonNull(approved, "approved");
        Objects.requireNonNull(active, "active");
        Objects.requireNonNull(expire, "expire");
        if (!active.isBefore(expire)) throw new IllegalArgumentException("Activation " + active + " must precede expiration " + expire);
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE allocation_request SET status = ?, approved_date = ?, active_date = ?, expire_date = ? " +
                        "WHERE id = ? AND status <> ?")) {
                    ps.setString(1, AllocationRequest.Status.APPROVED.code());
                    Rows.setDate(ps, 2, approved);
                    Rows.setDate(ps, 3, active);
                    Rows.setDate(ps, 4, expire);
                    ps.setLong(5, requestId);
                    ps.setString(6, AllocationRequest.Status.APPROVED.code());
                    if (ps.executeUpdate() == 0) throw new LedgerException("Request " + requestId + " is unknown or already approved");
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE allocation SET awarded = ? WHERE id = ? AND request_id = ? AND awarded IS NULL")) {
                    for (Map.Entry<Long, Long> award : awards.entrySet()) {
                        if (award.getValue() == null || award.getValue() < 0) {
                            throw new IllegalArgumentException("Award for allocation " + award.getKey() + " must be a non-negative amount");
                        }
                        ps.setLong(1, award.getValue());
                        ps.setLong(2, award.getKey());
                        ps.setLong(3, requestId);
                        if (ps.executeUpdate() == 0) {
                            throw new LedgerException("Allocation " + award.getKey() + " is not part of request " + requestId + " or is already awarded");
                        }
                    }
                }
                c.commit();
            } catch (Exception e) {
                JdbcAllocationLedger.rollback(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to approve request " + requestId, e);
        }
        return findRequest(requestId).orElseThrow(() -> new LedgerException("Request " + requestId + " vanished after approval"));
    }

    public void decline(long requestId) throws LedgerException {
        int updated = update("UPDATE allocation_request SET status = ? WHERE id = ? AND status <> ?", ps -> {
            ps.setString(1, AllocationRequest.Status.DECLINED.code());
            ps.setLong(2, requestId);
            ps.setString(3, AllocationRequest.Status.APPROVED.code());
        });
        if (updated == 0) throw new LedgerException("Request " + requestId + " is unknown or already approved");
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface Mapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private long insert(String sql, Binder binder) throws LedgerException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            binder.bind(ps);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new LedgerException("No key generated by: " + sql);
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Insert failed: " + sql, e);
        }
    }

    private int update(String sql, Binder binder) throws LedgerException {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Update failed: " + sql, e);
        }
    }

    private <T> List<T> query(String sql, Binder binder, Mapper<T> mapper) throws LedgerException {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> out = new ArrayList<>();
                while (rs.next()) out.add(mapper.map(rs));
                return out;
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Query failed: " + sql, e);
        }
    }
}
