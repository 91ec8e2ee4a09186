package com.runwarden.orchestrator.events;

import com.runwarden.orchestrator.TestClock;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeStreamTest {

    final List<Object> published = new ArrayList<>();
    final TestClock    clock     = new TestClock();
    final ChangeStream stream    = new ChangeStream(published::add, clock);

    @Test
    void publish_raisesApplicationEventEvenWithoutSubscribers() {
        UUID runId = UUID.randomUUID();

        stream.publish("org-1", OrganizationChange.Kind.RUNS, runId);

        assertThat(published).singleElement().isInstanceOfSatisfying(OrganizationChange.class, c -> {
            assertThat(c.organizationId()).isEqualTo("org-1");
            assertThat(c.kind()).isEqualTo(OrganizationChange.Kind.RUNS);
            assertThat(c.subjectId()).isEqualTo(runId);
            assertThat(c.at()).isEqualTo(clock.instant());
        });
    }

    @Test
    void subscribe_isScopedPerOrganization() {
        stream.subscribe("org-1");
        stream.subscribe("org-1");
        stream.subscribe("org-2");

        assertThat(stream.subscriberCount("org-1")).isEqualTo(2);
        assertThat(stream.subscriberCount("org-2")).isEqualTo(1);
        assertThat(stream.subscriberCount("org-3")).isZero();
    }

    @Test
    void publish_toCompletedSubscriber_dropsIt() {
        SseEmitter emitter = stream.subscribe("org-1");
        emitter.complete();

        stream.publish("org-1", OrganizationChange.Kind.PIPELINE, UUID.randomUUID());

        assertThat(stream.subscriberCount("org-1")).isZero();
    }
}
