package net.labsched.adapter.jdbc.repo;

import net.labsched.adapter.jdbc.JdbcUtil;
import net.labsched.adapter.jdbc.mapper.RowMappers;
import net.labsched.core.model.Host;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Host rows plus their labels and ACL groups, loaded in three batched queries. */
final class HostLoader {
    private HostLoader() {}

    static List<Host> byIds(Connection c, Collection<Long> ids) throws SQLException {
        Map<Long, Host> bare = new TreeMap<>();
        for (List<Long> chunk : JdbcUtil.chunks(ids)) {
            try (var ps = c.prepareStatement(
                    "SELECT * FROM TB_HOST WHERE ID IN (" + JdbcUtil.placeholders(chunk.size()) + ")")) {
                bindAll(ps, chunk);
                collect(ps, bare);
            }
        }
        return attachMemberships(c, bare);
    }

    static List<Host> byLabelNames(Connection c, Collection<String> labelNames) throws SQLException {
        Map<Long, Host> bare = new TreeMap<>();
        for (List<String> chunk : JdbcUtil.chunks(labelNames)) {
            try (var ps = c.prepareStatement("""
                SELECT h.*
                FROM   TB_HOST h
                WHERE  h.ID IN (
                    SELECT hl.HOST_ID
                    FROM   TB_HOST_LABEL hl
                    JOIN   TB_LABEL l ON l.ID = hl.LABEL_ID
                    WHERE  l.NAME IN (%s)
                )
            """.formatted(JdbcUtil.placeholders(chunk.size())))) {
                bindAll(ps, chunk);
                collect(ps, bare);
            }
        }
        return attachMemberships(c, bare);
    }

    static void bindAll(PreparedStatement ps, List<?> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) ps.setObject(i + 1, values.get(i));
    }

    private static void collect(PreparedStatement ps, Map<Long, Host> into) throws SQLException {
        try (var rs = ps.executeQuery()) {
            while (rs.next()) {
                Host h = RowMappers.toHost(rs, Set.of(), Set.of());
                into.put(h.id(), h);
            }
        }
    }

    private static List<Host> attachMemberships(Connection c, Map<Long, Host> bare) throws SQLException {
        if (bare.isEmpty()) return List.of();
        Map<Long, Set<String>> labels = new HashMap<>();
        Map<Long, Set<Long>> acls = new HashMap<>();
        for (List<Long> chunk : JdbcUtil.chunks(bare.keySet())) {
            String in = JdbcUtil.placeholders(chunk.size());
            try (var ps = c.prepareStatement("""
                SELECT hl.HOST_ID, l.NAME
                FROM   TB_HOST_LABEL hl
                JOIN   TB_LABEL l ON l.ID = hl.LABEL_ID
                WHERE  hl.HOST_ID IN (%s)
            """.formatted(in))) {
                bindAll(ps, chunk);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) labels.computeIfAbsent(rs.getLong(1), k -> new LinkedHashSet<>()).add(rs.getString(2));
                }
            }
            try (var ps = c.prepareStatement(
                    "SELECT HOST_ID, ACL_GROUP_ID FROM TB_ACL_GROUP_HOST WHERE HOST_ID IN (" + in + ")")) {
                bindAll(ps, chunk);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) acls.computeIfAbsent(rs.getLong(1), k -> new LinkedHashSet<>()).add(rs.getLong(2));
                }
            }
        }
        var out = new ArrayList<Host>(bare.size());
        for (Host h : bare.values()) {
            out.add(new Host(h.id(), h.hostname(), h.status(), h.locked(), h.lockedBy(), h.leased(),
                    labels.getOrDefault(h.id(), Set.of()), acls.getOrDefault(h.id(), Set.of())));
        }
        return out;
    }

    /** MERGE-then-select, so concurrent registrars converge on one row. */
    static long upsertLabel(Connection c, String name) throws SQLException {
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_LABEL t
            USING (SELECT ? AS NAME FROM dual) s
            ON (t.NAME = s.NAME)
            WHEN NOT MATCHED THEN INSERT (NAME) VALUES (s.NAME)
        """)) {
            ps.setString(1, name);
            ps.executeUpdate();
        }
        try (var ps = c.prepareStatement("SELECT ID FROM TB_LABEL WHERE NAME = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }
}
