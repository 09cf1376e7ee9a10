package net.labsched.adapter.jdbc.repo;

import net.labsched.adapter.jdbc.JdbcUtil;
import net.labsched.adapter.jdbc.TxContext;
import net.labsched.adapter.jdbc.mapper.RowMappers;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.spi.QueueEntryRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class JdbcQueueEntryRepository implements QueueEntryRepository {
    private final DataSource ds;

    public JdbcQueueEntryRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public List<HostQueueEntry> findPending() throws Exception {
        var out = new ArrayList<HostQueueEntry>();
        try (var ps = mustConn().prepareStatement("""
            SELECT *
            FROM   TB_HOST_QUEUE_ENTRY
            WHERE  COMPLETE = 'N'
              AND  ACTIVE = 'N'
              AND  STATUS = 'QUEUED'
            ORDER BY ID
        """)) {
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toEntry(rs));
            }
        }
        return out;
    }

    @Override
    public Optional<HostQueueEntry> findById(long entryId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_HOST_QUEUE_ENTRY WHERE ID = ?")) {
            ps.setLong(1, entryId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toEntry(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<HostQueueEntry> lockById(long entryId) throws Exception {
        // waits for a concurrent assignHost on the same row to commit
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_HOST_QUEUE_ENTRY WHERE ID = ? FOR UPDATE")) {
            ps.setLong(1, entryId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toEntry(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean assignHost(long entryId, long hostId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_HOST_QUEUE_ENTRY
               SET HOST_ID    = ?,
                   ACTIVE     = 'Y',
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND ACTIVE = 'N'
               AND COMPLETE = 'N'
        """)) {
            ps.setLong(1, hostId);
            ps.setLong(2, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean activate(long entryId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_HOST_QUEUE_ENTRY
               SET STATUS     = 'STARTING',
                   ACTIVE     = 'Y',
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND ACTIVE = 'N'
               AND COMPLETE = 'N'
        """)) {
            ps.setLong(1, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void clearHost(long entryId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_HOST_QUEUE_ENTRY
               SET HOST_ID    = NULL,
                   ACTIVE     = 'N',
                   STATUS     = 'QUEUED',
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
        """)) {
            ps.setLong(1, entryId);
            ps.executeUpdate();
        }
    }

    @Override
    public Map<Long, Set<Long>> findIneligibleHosts(Collection<Long> entryIds) throws Exception {
        Map<Long, Set<Long>> out = new HashMap<>();
        for (List<Long> chunk : JdbcUtil.chunks(entryIds)) {
            try (var ps = mustConn().prepareStatement(
                    "SELECT ENTRY_ID, HOST_ID FROM TB_INELIGIBLE_HOST WHERE ENTRY_ID IN ("
                            + JdbcUtil.placeholders(chunk.size()) + ")")) {
                HostLoader.bindAll(ps, chunk);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) out.computeIfAbsent(rs.getLong(1), k -> new LinkedHashSet<>()).add(rs.getLong(2));
                }
            }
        }
        return out;
    }

    @Override
    public void addIneligibleHost(long entryId, long hostId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_INELIGIBLE_HOST t
            USING (SELECT ? AS ENTRY_ID, ? AS HOST_ID FROM dual) s
            ON (t.ENTRY_ID = s.ENTRY_ID AND t.HOST_ID = s.HOST_ID)
            WHEN NOT MATCHED THEN INSERT (ENTRY_ID, HOST_ID) VALUES (s.ENTRY_ID, s.HOST_ID)
        """)) {
            ps.setLong(1, entryId);
            ps.setLong(2, hostId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean markComplete(long entryId, HostQueueEntry.Status status) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_HOST_QUEUE_ENTRY
               SET STATUS     = ?,
                   ACTIVE     = 'N',
                   COMPLETE   = 'Y',
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND COMPLETE = 'N'
        """)) {
            ps.setString(1, status.code());
            ps.setLong(2, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public HostQueueEntry insert(long jobId, Long hostId, String metaHost) throws Exception {
        long id;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_HOST_QUEUE_ENTRY (JOB_ID, HOST_ID, META_HOST, STATUS, ACTIVE, COMPLETE, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, 'QUEUED', 'N', 'N', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """, new String[]{"ID"})) {
            ps.setLong(1, jobId);
            if (hostId == null) ps.setNull(2, Types.NUMERIC);
            else ps.setLong(2, hostId);
            ps.setString(3, metaHost);
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                keys.next();
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow();
    }
}
