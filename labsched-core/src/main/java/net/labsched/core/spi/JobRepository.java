package net.labsched.core.spi;

import net.labsched.core.model.Job;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

public interface JobRepository {
    Map<Long, Job> findByIds(Collection<Long> jobIds) throws Exception;

    /** job id -> ACL groups of the job owner. Jobs whose owner is in no group are absent. */
    Map<Long, Set<Long>> findAclGroups(Collection<Long> jobIds) throws Exception;

    /** job id -> required label names. Jobs without dependencies are absent. */
    Map<Long, Set<String>> findDependencies(Collection<Long> jobIds) throws Exception;

    /** Inserts the job with its dependency labels (created when missing). */
    Job insert(Job job, Set<String> dependencies) throws Exception;
}
