package net.labsched.adapter.jdbc.mapper;

import net.labsched.adapter.jdbc.JdbcUtil;
import net.labsched.core.model.*;

import java.sql.*;
import java.util.Set;

public final class RowMappers {
    private RowMappers() {}

    // --- Host (labels and ACL groups are loaded separately) ---
    public static Host toHost(ResultSet rs, Set<String> labels, Set<Long> aclGroupIds) throws SQLException {
        return new Host(
                rs.getLong("ID"),
                rs.getString("HOSTNAME"),
                HostStatus.from(rs.getString("STATUS")),
                JdbcUtil.isY(rs.getString("LOCKED")),
                rs.getString("LOCKED_BY"),
                JdbcUtil.isY(rs.getString("LEASED")),
                labels,
                aclGroupIds
        );
    }

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        Long parent = rs.getLong("PARENT_JOB_ID");
        if (rs.wasNull()) parent = null;
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("OWNER"),
                rs.getInt("PRIORITY"),
                parent,
                JdbcUtil.toInstant(rs.getTimestamp("CREATED_AT"))
        );
    }

    // --- HostQueueEntry ---
    public static HostQueueEntry toEntry(ResultSet rs) throws SQLException {
        Long hostId = rs.getLong("HOST_ID");
        if (rs.wasNull()) hostId = null;
        return new HostQueueEntry(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                hostId,
                rs.getString("META_HOST"),
                HostQueueEntry.Status.from(rs.getString("STATUS")),
                JdbcUtil.isY(rs.getString("ACTIVE")),
                JdbcUtil.isY(rs.getString("COMPLETE")),
                JdbcUtil.toInstant(rs.getTimestamp("CREATED_AT"))
        );
    }
}
