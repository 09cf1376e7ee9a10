package net.labsched.adapter.jdbc.repo;

import net.labsched.adapter.jdbc.JdbcUtil;
import net.labsched.adapter.jdbc.TxContext;
import net.labsched.core.model.Host;
import net.labsched.core.model.HostStatus;
import net.labsched.core.spi.HostRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class JdbcHostRepository implements HostRepository {
    private final DataSource ds;
    private final HostStatus leasedStatus;

    public JdbcHostRepository(DataSource ds) {
        this(ds, HostStatus.PENDING);
    }

    /** @param leasedStatus status {@link #release} turns back into READY */
    public JdbcHostRepository(DataSource ds, HostStatus leasedStatus) {
        this.ds = ds;
        this.leasedStatus = leasedStatus;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public List<Host> findByLabelNames(Collection<String> labelNames) throws Exception {
        if (labelNames.isEmpty()) return List.of();
        return HostLoader.byLabelNames(mustConn(), labelNames);
    }

    @Override
    public List<Host> findByIds(Collection<Long> hostIds) throws Exception {
        if (hostIds.isEmpty()) return List.of();
        return HostLoader.byIds(mustConn(), hostIds);
    }

    /**
     * Compare-and-set on the host row. The row lock taken by the UPDATE serializes competing
     * schedulers; the loser sees zero rows once the winner commits.
     */
    @Override
    public boolean tryLease(long hostId, Set<HostStatus> usable, HostStatus leasedStatus) throws Exception {
        if (usable.isEmpty()) return false;
        var statuses = new ArrayList<String>();
        for (HostStatus s : usable) statuses.add(s.code());
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_HOST
               SET LEASED     = 'Y',
                   STATUS     = ?,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND LEASED = 'N'
               AND LOCKED = 'N'
               AND STATUS IN (%s)
        """.formatted(JdbcUtil.placeholders(statuses.size())))) {
            ps.setString(1, leasedStatus.code());
            ps.setLong(2, hostId);
            for (int i = 0; i < statuses.size(); i++) ps.setString(3 + i, statuses.get(i));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void release(long hostId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_HOST
               SET LEASED     = 'N',
                   STATUS     = CASE WHEN STATUS = ? THEN 'READY' ELSE STATUS END,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
        """)) {
            ps.setString(1, leasedStatus.code());
            ps.setLong(2, hostId);
            ps.executeUpdate();
        }
    }

    @Override
    public void setStatus(long hostId, HostStatus status) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_HOST SET STATUS = ?, UPDATED_AT = CURRENT_TIMESTAMP WHERE ID = ?")) {
            ps.setString(1, status.code());
            ps.setLong(2, hostId);
            ps.executeUpdate();
        }
    }

    @Override
    public List<Long> releaseUnused() throws Exception {
        Connection c = mustConn();
        var candidates = new ArrayList<Long>();
        try (var ps = c.prepareStatement("""
            SELECT h.ID
            FROM   TB_HOST h
            WHERE  h.LEASED = 'Y'
              AND  h.STATUS = 'READY'
              AND  NOT EXISTS (
                    SELECT 1 FROM TB_HOST_QUEUE_ENTRY q
                    WHERE  q.HOST_ID = h.ID AND q.ACTIVE = 'Y' AND q.COMPLETE = 'N')
            ORDER BY h.ID
            FOR UPDATE SKIP LOCKED
        """)) {
            try (var rs = ps.executeQuery()) {
                while (rs.next()) candidates.add(rs.getLong(1));
            }
        }
        var released = new ArrayList<Long>();
        try (var up = c.prepareStatement("""
            UPDATE TB_HOST
               SET LEASED = 'N', UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ? AND LEASED = 'Y' AND STATUS = 'READY'
        """)) {
            for (Long id : candidates) {
                up.setLong(1, id);
                if (up.executeUpdate() == 1) released.add(id);
            }
        }
        return released;
    }

    @Override
    public Map<Long, List<Long>> findOverlappingAssignments() throws Exception {
        Map<Long, List<Long>> out = new TreeMap<>();
        try (var ps = mustConn().prepareStatement("""
            SELECT q.HOST_ID, q.ID
            FROM   TB_HOST_QUEUE_ENTRY q
            WHERE  q.ACTIVE = 'Y' AND q.COMPLETE = 'N'
              AND  q.HOST_ID IN (
                    SELECT HOST_ID
                    FROM   TB_HOST_QUEUE_ENTRY
                    WHERE  ACTIVE = 'Y' AND COMPLETE = 'N' AND HOST_ID IS NOT NULL
                    GROUP BY HOST_ID
                    HAVING COUNT(*) > 1)
            ORDER BY q.HOST_ID, q.ID
        """)) {
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.computeIfAbsent(rs.getLong(1), k -> new ArrayList<>()).add(rs.getLong(2));
            }
        }
        return out;
    }
}
