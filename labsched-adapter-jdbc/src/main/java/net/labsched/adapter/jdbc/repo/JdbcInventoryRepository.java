package net.labsched.adapter.jdbc.repo;

import net.labsched.adapter.jdbc.JdbcUtil;
import net.labsched.adapter.jdbc.TxContext;
import net.labsched.core.model.Host;
import net.labsched.core.spi.InventoryRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/** Inventory MERGEs; re-running a registration leaves the tables unchanged. */
public final class JdbcInventoryRepository implements InventoryRepository {
    private final DataSource ds;

    public JdbcInventoryRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    /** Lock state follows the registration; status and lease belong to the scheduler and are left alone. */
    @Override
    public long upsertHost(String hostname, boolean locked, String lockedBy) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_HOST t
            USING (SELECT ? AS HOSTNAME, ? AS LOCKED, ? AS LOCKED_BY FROM dual) s
            ON (t.HOSTNAME = s.HOSTNAME)
            WHEN MATCHED THEN UPDATE SET
                t.LOCKED     = s.LOCKED,
                t.LOCKED_BY  = s.LOCKED_BY,
                t.UPDATED_AT = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN INSERT (HOSTNAME, STATUS, LOCKED, LOCKED_BY, LEASED, CREATED_AT, UPDATED_AT)
                VALUES (s.HOSTNAME, 'READY', s.LOCKED, s.LOCKED_BY, 'N', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """)) {
            ps.setString(1, hostname);
            ps.setString(2, JdbcUtil.yn(locked));
            ps.setString(3, locked ? lockedBy : null);
            ps.executeUpdate();
        }
        return idByName(c, "TB_HOST", "HOSTNAME", hostname);
    }

    @Override
    public long upsertLabel(String name) throws Exception {
        return HostLoader.upsertLabel(mustConn(), name);
    }

    @Override
    public void addLabelToHost(long hostId, long labelId) throws Exception {
        link("TB_HOST_LABEL", "HOST_ID", hostId, "LABEL_ID", labelId);
    }

    @Override
    public long upsertAclGroup(String name) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_ACL_GROUP t
            USING (SELECT ? AS NAME FROM dual) s
            ON (t.NAME = s.NAME)
            WHEN NOT MATCHED THEN INSERT (NAME) VALUES (s.NAME)
        """)) {
            ps.setString(1, name);
            ps.executeUpdate();
        }
        return idByName(c, "TB_ACL_GROUP", "NAME", name);
    }

    @Override
    public void addHostToAclGroup(long aclGroupId, long hostId) throws Exception {
        link("TB_ACL_GROUP_HOST", "ACL_GROUP_ID", aclGroupId, "HOST_ID", hostId);
    }

    @Override
    public void addUserToAclGroup(long aclGroupId, String login) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_ACL_GROUP_USER t
            USING (SELECT ? AS ACL_GROUP_ID, ? AS LOGIN FROM dual) s
            ON (t.ACL_GROUP_ID = s.ACL_GROUP_ID AND t.LOGIN = s.LOGIN)
            WHEN NOT MATCHED THEN INSERT (ACL_GROUP_ID, LOGIN) VALUES (s.ACL_GROUP_ID, s.LOGIN)
        """)) {
            ps.setLong(1, aclGroupId);
            ps.setString(2, login);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Host> findHostByName(String hostname) throws Exception {
        Connection c = mustConn();
        Long id = null;
        try (var ps = c.prepareStatement("SELECT ID FROM TB_HOST WHERE HOSTNAME = ?")) {
            ps.setString(1, hostname);
            try (var rs = ps.executeQuery()) {
                if (rs.next()) id = rs.getLong(1);
            }
        }
        if (id == null) return Optional.empty();
        return HostLoader.byIds(c, List.of(id)).stream().findFirst();
    }

    // table and column names are constants of this class, never user input
    private void link(String table, String leftCol, long left, String rightCol, long right) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO %1$s t
            USING (SELECT ? AS %2$s, ? AS %3$s FROM dual) s
            ON (t.%2$s = s.%2$s AND t.%3$s = s.%3$s)
            WHEN NOT MATCHED THEN INSERT (%2$s, %3$s) VALUES (s.%2$s, s.%3$s)
        """.formatted(table, leftCol, rightCol))) {
            ps.setLong(1, left);
            ps.setLong(2, right);
            ps.executeUpdate();
        }
    }

    private static long idByName(Connection c, String table, String column, String value) throws Exception {
        try (var ps = c.prepareStatement("SELECT ID FROM " + table + " WHERE " + column + " = ?")) {
            ps.setString(1, value);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) throw new IllegalStateException(table + " row missing after merge: " + value);
                return rs.getLong(1);
            }
        }
    }
}
