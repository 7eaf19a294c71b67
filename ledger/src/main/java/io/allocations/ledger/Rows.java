package io.allocations.ledger;

import io.allocations.core.Allocation;
import io.allocations.core.AllocationRequest;
import io.allocations.core.AllocationReview;
import io.allocations.core.Cluster;
import io.allocations.core.Team;
import io.allocations.core.TeamMembership;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;

/**
 * Row mappers and parameter helpers shared by the JDBC ledger classes.
 */
final class Rows {
    static final String CLUSTER_COLUMNS = "id, name, description, enabled";
    static final String TEAM_COLUMNS = "id, name, is_active";
    static final String REQUEST_COLUMNS = "id, team_id, title, description, submitted, approved_date, active_date, expire_date, status";
    static final String ALLOCATION_COLUMNS = "a.id, a.request_id, a.cluster_id, a.requested, a.awarded, a.final_usage, r.expire_date";

    private Rows() {}

    static Cluster cluster(ResultSet rs) throws SQLException {
        return new Cluster(rs.getLong("id"), rs.getString("name"), rs.getString("description"), rs.getBoolean("enabled"));
    }

    static Team team(ResultSet rs) throws SQLException {
        return new Team(rs.getLong("id"), rs.getString("name"), rs.getBoolean("is_active"));
    }

    static TeamMembership membership(ResultSet rs) throws SQLException {
        return new TeamMembership(rs.getLong("id"), rs.getLong("team_id"), rs.getString("user_name"),
                TeamMembership.Role.fromCode(rs.getString("member_role")));
    }

    static AllocationRequest request(ResultSet rs) throws SQLException {
        return new AllocationRequest(
                rs.getLong("id"),
                rs.getLong("team_id"),
                rs.getString("title"),
                rs.getString("description"),
                date(rs, "submitted"),
                date(rs, "approved_date"),
                date(rs, "active_date"),
                date(rs, "expire_date"),
                AllocationRequest.Status.fromCode(rs.getString("status")));
    }

    static AllocationReview review(ResultSet rs) throws SQLException {
        Timestamp modified = rs.getTimestamp("date_modified");
        return new AllocationReview(
                rs.getLong("id"),
                rs.getLong("request_id"),
                rs.getString("reviewer"),
                AllocationRequest.Status.fromCode(rs.getString("status")),
                rs.getString("public_comments"),
                rs.getString("private_comments"),
                modified == null ? null : modified.toInstant());
    }

    static Allocation allocation(ResultSet rs) throws SQLException {
        return new Allocation(
                rs.getLong(1),
                rs.getLong(2),
                rs.getLong(3),
                rs.getLong(4),
                nullableLong(rs, 5),
                nullableLong(rs, 6),
                date(rs, 7));
    }

    static LocalDate date(ResultSet rs, String column) throws SQLException {
        Date d = rs.getDate(column);
        return d == null ? null : d.toLocalDate();
    }

    static LocalDate date(ResultSet rs, int column) throws SQLException {
        Date d = rs.getDate(column);
        return d == null ? null : d.toLocalDate();
    }

    static Long nullableLong(ResultSet rs, int column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    static void setDate(PreparedStatement ps, int index, LocalDate value) throws SQLException {
        if (value == null) ps.setNull(index, Types.DATE);
        else ps.setDate(index, Date.valueOf(value));
    }

    static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) ps.setNull(index, Types.VARCHAR);
        else ps.setString(index, value);
    }
}
