package net.labsched.app;

import net.labsched.core.model.Assignment;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.Job;
import net.labsched.core.service.JobSubmissionService;
import net.labsched.core.service.QueueEntryService;
import net.labsched.core.spi.DispatchAdapter;
import net.labsched.core.spi.QueueEntryRepository;
import net.labsched.core.spi.TxRunner;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application against Oracle: inventory comes from application.yml, the fixed-delay
 * loop schedules submitted jobs, and a recording adapter stands in for the job runner.
 */
@SpringBootTest(properties = {
        "labsched.scheduler.tick-delay-ms=300",
        "labsched.scheduler.maintenance-delay-ms=1000"
})
@Testcontainers(disabledWithoutDocker = true)
class SchedulingFlowIT {

    @Container
    static OracleContainer oracle = new OracleContainer("gvenzl/oracle-xe:21-slim")
            .withReuse(true);

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", oracle::getJdbcUrl);
        r.add("spring.datasource.username", oracle::getUsername);
        r.add("spring.datasource.password", oracle::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "oracle.jdbc.OracleDriver");
        r.add("spring.flyway.enabled", () -> true);
        r.add("spring.flyway.locations", () -> "classpath:db/migration/oracle");
    }

    @TestConfiguration
    static class RecordingDispatch {
        static final List<Assignment> DISPATCHED = new CopyOnWriteArrayList<>();

        @Bean
        DispatchAdapter recordingDispatchAdapter() {
            return DISPATCHED::add;
        }
    }

    @Autowired JdbcTemplate jdbc;
    @Autowired TxRunner tx;
    @Autowired JobSubmissionService submissions;
    @Autowired QueueEntryService queue;
    @Autowired QueueEntryRepository entries;

    @Test
    void submitted_jobs_are_leased_by_the_loop_and_hosts_come_back_on_completion() throws Exception {
        // configured inventory: host1 {platform_Fake1}, host2 {platform_Fake1, has_awesome_card}
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM TB_HOST", Integer.class)).isEqualTo(2);

        HostQueueEntry card = submissions.submitOnMetahost(
                Job.ofNew("card_test", "debug_user", 50, null), Set.of("bluetooth"),
                "platform_Fake1+has_awesome_card", 1).get(0);
        HostQueueEntry suite = submissions.submitHostless(Job.ofNew("suite", "debug_user", 10, null));

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            HostQueueEntry after = tx.required(() -> entries.findById(card.id()).orElseThrow());
            assertThat(after.active()).isTrue();
            assertThat(hostnameOf(after.hostId())).isEqualTo("chromeos1-row1-rack1-host2");
            assertThat(RecordingDispatch.DISPATCHED)
                    .extracting(a -> a.entry().id())
                    .contains(card.id(), suite.id());
        });

        // a second card job waits until the first one finishes
        HostQueueEntry next = submissions.submitOnMetahost(
                Job.ofNew("card_test_2", "debug_user", 50, null), Set.of(),
                "platform_Fake1+has_awesome_card", 1).get(0);
        Thread.sleep(1000);
        assertThat(tx.required(() -> entries.findById(next.id()).orElseThrow()).hostId()).isNull();

        queue.complete(card.id(), HostQueueEntry.Status.COMPLETED);

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() ->
                assertThat(tx.required(() -> entries.findById(next.id()).orElseThrow()).hostId())
                        .isEqualTo(tx.required(() -> entries.findById(card.id()).orElseThrow()).hostId()));

        Integer overlapping = jdbc.queryForObject("""
            SELECT COUNT(*) FROM (
                SELECT HOST_ID FROM TB_HOST_QUEUE_ENTRY
                WHERE ACTIVE = 'Y' AND COMPLETE = 'N' AND HOST_ID IS NOT NULL
                GROUP BY HOST_ID HAVING COUNT(*) > 1)
        """, Integer.class);
        assertThat(overlapping).isZero();
    }

    private String hostnameOf(Long hostId) {
        if (hostId == null) return null;
        return jdbc.queryForObject("SELECT HOSTNAME FROM TB_HOST WHERE ID = ?", String.class, hostId);
    }
}
