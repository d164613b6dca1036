package net.orrery.core.service;

import net.orrery.core.model.*;
import net.orrery.core.support.DirectTxRunner;
import net.orrery.core.support.InMemoryFlowRunRepository;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunMaterializerTest {
    static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    static final UUID FLOW = UUID.randomUUID();
    static final UUID DEPLOYMENT = UUID.randomUUID();

    final InMemoryFlowRunRepository runs = new InMemoryFlowRunRepository();
    final RunMaterializer materializer = new RunMaterializer(runs, new DirectTxRunner(), () -> T0);
    final Schedule schedule = new Schedule(UUID.randomUUID(), DEPLOYMENT,
            ClockSpec.interval(Duration.ofHours(1)), Map.of(), true, T0);

    List<CandidateRun> hours(int from, int to) {
        return IntStream.range(from, to)
                .mapToObj(h -> CandidateRun.of(FLOW, DEPLOYMENT, schedule, T0.plus(Duration.ofHours(h))))
                .toList();
    }

    @Test
    void createsOnceAndReturnsOnlyNewRuns() throws Exception {
        List<FlowRun> first = materializer.materialize(hours(0, 4));
        List<FlowRun> again = materializer.materialize(hours(0, 6));

        assertThat(first).hasSize(4).allSatisfy(r -> assertThat(r.stateId()).isNotNull());
        assertThat(again).extracting(FlowRun::expectedStartTime)
                .containsExactly(T0.plus(Duration.ofHours(4)), T0.plus(Duration.ofHours(5)));
        assertThat(runs.all()).hasSize(6).allSatisfy(r -> assertThat(r.initialized()).isTrue());
        assertThat(runs.stateCount()).isEqualTo(6);
    }

    @Test
    void storageFailurePropagates() {
        runs.failNextLink();
        assertThatThrownBy(() -> materializer.materialize(hours(0, 3)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("link failed");
    }

    @Test
    void statelessRunsFromInterruptedInsertAreCompleted() throws Exception {
        runs.insertIgnoringConflicts(hours(0, 2).stream().map(c -> c.toFlowRun(T0)).toList());

        List<FlowRun> created = materializer.materialize(hours(0, 3));

        assertThat(created).hasSize(3);
        assertThat(runs.all()).allSatisfy(r -> assertThat(r.stateId()).isEqualTo(FlowRunState.initialStateId(r.id())));
    }

    @Test
    void duplicatesAndEmptyInput() throws Exception {
        assertThat(materializer.materialize(List.of())).isEmpty();

        CandidateRun c = hours(0, 1).get(0);
        assertThat(materializer.materialize(List.of(c, c))).hasSize(1);
        assertThat(runs.all()).hasSize(1);
    }

    @Test
    void initialStateDescribesTheOccurrence() throws Exception {
        FlowRun run = materializer.materialize(hours(2, 3)).get(0);
        FlowRunState state = runs.findStates(run.id()).get(0);

        assertThat(state.type()).isEqualTo(StateType.SCHEDULED);
        assertThat(state.message()).isEqualTo(FlowRunState.SCHEDULED_MESSAGE);
        assertThat(state.details()).isEqualTo(new StateDetails(T0.plus(Duration.ofHours(2)), schedule.id(), true));
        assertThat(run.stateId()).isEqualTo(state.id());
    }
}
