package net.labsched.core.index;

import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.HostStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LabelIndexTest {

    private static Host host(long id, String... labels) {
        return new Host(id, "host" + id, HostStatus.READY, false, null, false, Set.of(labels), Set.of(1L));
    }

    private static HostQueueEntry metahost(long id, long jobId, String expr) {
        return new HostQueueEntry(id, jobId, null, expr, HostQueueEntry.Status.QUEUED, false, false, Instant.EPOCH);
    }

    @Test
    void conjunctiveExpression_returnsHostsCarryingAllLabels() {
        var index = LabelIndex.build(
                List.of(metahost(1, 1, "platform_Fake1+has_awesome_card")),
                List.of(host(1, "platform_Fake1"), host(2, "platform_Fake1", "has_awesome_card")),
                Map.of(), Map.of());

        assertEquals(Set.of(1L, 2L), index.hostsForLabel("platform_Fake1"));
        assertEquals(Set.of(2L), index.hostsForLabelExpression("platform_Fake1+has_awesome_card"));
    }

    @Test
    void expressionWithUnknownOrEmptyLabelSet_isEmpty() {
        var index = LabelIndex.build(
                List.of(metahost(1, 1, "a")),
                List.of(host(1, "a"), host(2, "b")),
                Map.of(), Map.of());

        assertTrue(index.hostsForLabelExpression("a+nope").isEmpty());
        assertTrue(index.hostsForLabelExpression("a+b").isEmpty());
        assertTrue(index.hostsForLabelExpression("").isEmpty());
        assertTrue(index.hostsForLabel("nope").isEmpty());
    }

    @Test
    void hostsIterateInAscendingIdOrder_regardlessOfInputOrder() {
        var index = LabelIndex.build(
                List.of(metahost(1, 1, "x")),
                List.of(host(30, "x"), host(4, "x"), host(17, "x")),
                Map.of(), Map.of());

        assertEquals(List.of(4L, 17L, 30L), List.copyOf(index.hostsForLabel("x")));
        assertEquals(List.of(4L, 17L, 30L), index.hosts().stream().map(Host::id).toList());
    }

    @Test
    void jobRequirements_areKeyedByJob_andDefaultToEmpty() {
        var index = LabelIndex.build(
                List.of(metahost(1, 7, "x"), metahost(2, 8, "x")),
                List.of(host(1, "x")),
                Map.of(7L, Set.of("bluetooth")),
                Map.of(7L, Set.of(3L), 8L, Set.of(4L)));

        assertEquals(Set.of("bluetooth"), index.dependencies(7));
        assertEquals(Set.of(), index.dependencies(8));
        assertEquals(Set.of(3L), index.aclGroups(7));
        assertEquals(Set.of(), index.aclGroups(99));
        assertEquals(List.of("x"), index.expressionFor(metahost(1, 7, "x")).labels());
    }

    @Test
    void emptyBatch_yieldsEmptyIndex() {
        var index = LabelIndex.build(List.of(), List.of(host(1, "x")), Map.of(), Map.of());
        assertTrue(index.labelHosts().isEmpty());
        assertTrue(index.hosts().isEmpty());
        assertTrue(index.hostsForLabelExpression("x").isEmpty());
    }
}
