package net.labsched.adapter.jdbc.repo;

import net.labsched.adapter.jdbc.JdbcUtil;
import net.labsched.adapter.jdbc.TxContext;
import net.labsched.adapter.jdbc.mapper.RowMappers;
import net.labsched.core.model.Job;
import net.labsched.core.spi.JobRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Types;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class JdbcJobRepository implements JobRepository {
    private final DataSource ds;

    public JdbcJobRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Map<Long, Job> findByIds(Collection<Long> jobIds) throws Exception {
        Map<Long, Job> out = new HashMap<>();
        for (List<Long> chunk : JdbcUtil.chunks(jobIds)) {
            try (var ps = mustConn().prepareStatement(
                    "SELECT * FROM TB_JOB WHERE ID IN (" + JdbcUtil.placeholders(chunk.size()) + ")")) {
                HostLoader.bindAll(ps, chunk);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        Job j = RowMappers.toJob(rs);
                        out.put(j.id(), j);
                    }
                }
            }
        }
        return out;
    }

    /** ACL groups come from the owner's group memberships. */
    @Override
    public Map<Long, Set<Long>> findAclGroups(Collection<Long> jobIds) throws Exception {
        Map<Long, Set<Long>> out = new HashMap<>();
        for (List<Long> chunk : JdbcUtil.chunks(jobIds)) {
            try (var ps = mustConn().prepareStatement("""
                SELECT j.ID, agu.ACL_GROUP_ID
                FROM   TB_JOB j
                JOIN   TB_ACL_GROUP_USER agu ON agu.LOGIN = j.OWNER
                WHERE  j.ID IN (%s)
            """.formatted(JdbcUtil.placeholders(chunk.size())))) {
                HostLoader.bindAll(ps, chunk);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) out.computeIfAbsent(rs.getLong(1), k -> new LinkedHashSet<>()).add(rs.getLong(2));
                }
            }
        }
        return out;
    }

    @Override
    public Map<Long, Set<String>> findDependencies(Collection<Long> jobIds) throws Exception {
        Map<Long, Set<String>> out = new HashMap<>();
        for (List<Long> chunk : JdbcUtil.chunks(jobIds)) {
            try (var ps = mustConn().prepareStatement("""
                SELECT jd.JOB_ID, l.NAME
                FROM   TB_JOB_DEPENDENCY jd
                JOIN   TB_LABEL l ON l.ID = jd.LABEL_ID
                WHERE  jd.JOB_ID IN (%s)
            """.formatted(JdbcUtil.placeholders(chunk.size())))) {
                HostLoader.bindAll(ps, chunk);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) out.computeIfAbsent(rs.getLong(1), k -> new LinkedHashSet<>()).add(rs.getString(2));
                }
            }
        }
        return out;
    }

    @Override
    public Job insert(Job job, Set<String> dependencies) throws Exception {
        Connection c = mustConn();
        long id;
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_JOB (NAME, OWNER, PRIORITY, PARENT_JOB_ID, CREATED_AT)
            VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)
        """, new String[]{"ID"})) {
            ps.setString(1, job.name());
            ps.setString(2, job.owner());
            ps.setInt(3, job.priority());
            if (job.parentJobId() == null) ps.setNull(4, Types.NUMERIC);
            else ps.setLong(4, job.parentJobId());
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                keys.next();
                id = keys.getLong(1);
            }
        }

        if (!dependencies.isEmpty()) {
            try (var ps = c.prepareStatement("INSERT INTO TB_JOB_DEPENDENCY (JOB_ID, LABEL_ID) VALUES (?, ?)")) {
                for (String dep : new LinkedHashSet<>(dependencies)) {
                    ps.setLong(1, id);
                    ps.setLong(2, HostLoader.upsertLabel(c, dep));
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }

        return findByIds(List.of(id)).get(id);
    }
}
