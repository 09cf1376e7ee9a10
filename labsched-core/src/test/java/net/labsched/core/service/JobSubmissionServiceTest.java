package net.labsched.core.service;

import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.Job;
import net.labsched.core.spi.TxRunner;
import net.labsched.core.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobSubmissionServiceTest {

    private InMemoryEntityStore store;
    private JobSubmissionService submissions;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        submissions = new JobSubmissionService(store.jobRepo, store.entryRepo, TxRunner.direct());
    }

    @Test
    void submitOnHosts_createsOneEntryPerHost() throws Exception {
        var created = submissions.submitOnHosts(Job.ofNew("dummy_Pass", "debug_user", 20, null),
                Set.of("bluetooth"), List.of(3L, 5L));

        assertEquals(2, created.size());
        assertEquals(List.of(3L, 5L), created.stream().map(HostQueueEntry::hostId).toList());
        long jobId = created.get(0).jobId();
        assertEquals(20, store.jobs.get(jobId).priority());
        assertEquals(Set.of("bluetooth"), store.jobDeps.get(jobId));
        assertTrue(created.stream().allMatch(e -> e.status() == HostQueueEntry.Status.QUEUED && !e.active()));
    }

    @Test
    void submitOnMetahost_normalizesExpression() throws Exception {
        var created = submissions.submitOnMetahost(Job.ofNew("j", "u", 0, null), Set.of(),
                " platform_Fake1 + has_awesome_card ", 3);

        assertEquals(3, created.size());
        assertTrue(created.stream().allMatch(e -> "platform_Fake1+has_awesome_card".equals(e.metaHost())));
        assertTrue(created.stream().noneMatch(HostQueueEntry::hasHost));
    }

    @Test
    void submitOnMetahost_rejectsEmptyExpressionAndCount() {
        var job = Job.ofNew("j", "u", 0, null);
        assertThrows(IllegalArgumentException.class, () -> submissions.submitOnMetahost(job, Set.of(), " + ", 1));
        assertThrows(IllegalArgumentException.class, () -> submissions.submitOnMetahost(job, Set.of(), "X", 0));
        assertThrows(IllegalArgumentException.class, () -> submissions.submitOnHosts(job, Set.of(), List.of()));
        assertTrue(store.jobs.isEmpty());
    }

    @Test
    void submitHostless_createsSingleHostlessEntry() throws Exception {
        var entry = submissions.submitHostless(Job.ofNew("suite", "u", 10, null));
        assertTrue(entry.isHostless());
        assertEquals(1, store.entries.size());
    }
}
