package com.alertwarden.core.state;

import com.alertwarden.core.evaluation.Evaluation;
import com.alertwarden.core.evaluation.EvaluationException;
import com.alertwarden.core.evaluation.MissingDataPolicy;
import com.alertwarden.core.model.AlertEvent;
import com.alertwarden.core.model.AlertEventType;
import com.alertwarden.core.model.AlertInstance;
import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.AlertState;
import com.alertwarden.core.testing.MutableClock;
import com.alertwarden.core.testing.TestRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertStateMachine}.
 */
class AlertStateMachineTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final AtomicInteger ids = new AtomicInteger();

    private AlertStateMachine machine(Duration reNotify, MissingDataPolicy policy) {
        return new AlertStateMachine(clock, () -> "corr-" + ids.incrementAndGet(), reNotify, policy);
    }

    private AlertStateMachine machine() {
        return machine(null, MissingDataPolicy.NEITHER);
    }

    private Optional<AlertEvent> breach(AlertStateMachine machine, AlertRule rule) {
        clock.advance(Duration.ofMinutes(1));
        return machine.apply(rule, Evaluation.breach(rule.getId(), 150, clock.instant()));
    }

    private Optional<AlertEvent> clear(AlertStateMachine machine, AlertRule rule) {
        clock.advance(Duration.ofMinutes(1));
        return machine.apply(rule, Evaluation.clear(rule.getId(), 50, clock.instant()));
    }

    private Optional<AlertEvent> error(AlertStateMachine machine, AlertRule rule) {
        clock.advance(Duration.ofMinutes(1));
        return machine.apply(rule, Evaluation.error(rule.getId(),
                new EvaluationException(EvaluationException.Reason.UNAVAILABLE, "down"), clock.instant()));
    }

    private AlertInstance current(AlertStateMachine machine, AlertRule rule) {
        return machine.current(rule.getId()).orElseThrow();
    }

    @Test
    @DisplayName("Registered rule starts Pending with zero counters")
    void registerStartsPending() {
        AlertStateMachine machine = machine();

        AlertInstance instance = machine.register("r1");

        assertThat(instance.getState()).isEqualTo(AlertState.PENDING);
        assertThat(instance.getConsecutiveBreaches()).isZero();
        assertThat(instance.getCorrelationId()).isNull();
        assertThat(instance.getEpisode()).isEqualTo(1);
        assertThat(machine.register("r1")).isSameAs(instance);
    }

    @Nested
    @DisplayName("Hysteresis")
    class Hysteresis {

        @Test
        @DisplayName("A clear resets the breach streak; fires on the 6th evaluation of B,B,C,B,B,B")
        void clearResetsBreachStreak() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").consecutiveBreachesToFire(3).build();
            List<Optional<AlertEvent>> events = new ArrayList<>();

            events.add(breach(machine, rule));
            events.add(breach(machine, rule));
            events.add(clear(machine, rule));
            assertThat(current(machine, rule).getConsecutiveBreaches()).isZero();
            events.add(breach(machine, rule));
            events.add(breach(machine, rule));
            assertThat(current(machine, rule).getState()).isEqualTo(AlertState.PENDING);
            events.add(breach(machine, rule));

            assertThat(events.subList(0, 5)).allMatch(Optional::isEmpty);
            AlertEvent fired = events.get(5).orElseThrow();
            assertThat(fired.getType()).isEqualTo(AlertEventType.FIRED);
            assertThat(fired.getCorrelationId()).isEqualTo("corr-1");
            assertThat(fired.getInstance().getFirstBreachAt())
                    .isEqualTo(fired.getOccurredAt().minus(Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("Resolves exactly on the 2nd consecutive clear")
        void resolvesOnSecondClear() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").consecutiveClearsToResolve(2).build();
            breach(machine, rule);

            assertThat(clear(machine, rule)).isEmpty();
            assertThat(current(machine, rule).getState()).isEqualTo(AlertState.FIRING);
            breach(machine, rule);
            assertThat(clear(machine, rule)).isEmpty();

            AlertEvent resolved = clear(machine, rule).orElseThrow();
            assertThat(resolved.getType()).isEqualTo(AlertEventType.RESOLVED);
            assertThat(resolved.getCorrelationId()).isEqualTo("corr-1");
            assertThat(resolved.getInstance().getResolvedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Without auto-mitigation a clear never resolves")
        void noAutoMitigate() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").autoMitigate(false).build();
            breach(machine, rule);

            for (int i = 0; i < 5; i++) {
                assertThat(clear(machine, rule)).isEmpty();
            }
            assertThat(current(machine, rule).getState()).isEqualTo(AlertState.FIRING);

            AlertEvent resolved = machine.manualResolve(rule).orElseThrow();
            assertThat(resolved.getType()).isEqualTo(AlertEventType.RESOLVED);
            assertThat(current(machine, rule).getState()).isEqualTo(AlertState.RESOLVED);
        }
    }

    @Nested
    @DisplayName("Re-notification")
    class ReNotification {

        @Test
        @DisplayName("No StillFiring without a re-notify interval")
        void noIntervalNoStillFiring() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").build();
            breach(machine, rule);

            for (int i = 0; i < 10; i++) {
                assertThat(breach(machine, rule)).isEmpty();
            }
            assertThat(current(machine, rule).getConsecutiveBreaches()).isEqualTo(11);
        }

        @Test
        @DisplayName("StillFiring only once the interval has elapsed since the last notification")
        void stillFiringGated() {
            AlertStateMachine machine = machine(Duration.ofMinutes(3), MissingDataPolicy.NEITHER);
            AlertRule rule = TestRules.rule("r").build();
            breach(machine, rule);

            assertThat(breach(machine, rule)).isEmpty();
            assertThat(breach(machine, rule)).isEmpty();
            AlertEvent still = breach(machine, rule).orElseThrow();
            assertThat(still.getType()).isEqualTo(AlertEventType.STILL_FIRING);
            assertThat(still.getCorrelationId()).isEqualTo("corr-1");
            assertThat(still.getInstance().getLastNotifiedAt()).isEqualTo(clock.instant());

            assertThat(breach(machine, rule)).isEmpty();
            assertThat(breach(machine, rule)).isEmpty();
            assertThat(breach(machine, rule)).isPresent();
        }

        @Test
        @DisplayName("Interval must be positive")
        void intervalValidated() {
            assertThatThrownBy(() -> machine(Duration.ZERO, MissingDataPolicy.NEITHER))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Episodes")
    class Episodes {

        @Test
        @DisplayName("A breach after resolution opens a new episode with a new correlation id")
        void newEpisodeAfterResolution() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").build();
            AlertEvent first = breach(machine, rule).orElseThrow();
            clear(machine, rule).orElseThrow();
            assertThat(clear(machine, rule)).isEmpty();

            AlertEvent second = breach(machine, rule).orElseThrow();

            assertThat(second.getType()).isEqualTo(AlertEventType.FIRED);
            assertThat(second.getCorrelationId()).isNotEqualTo(first.getCorrelationId());
            assertThat(second.getInstance().getEpisode()).isEqualTo(2);
            assertThat(machine.history("r")).singleElement()
                    .satisfies(old -> {
                        assertThat(old.getState()).isEqualTo(AlertState.RESOLVED);
                        assertThat(old.getCorrelationId()).isEqualTo(first.getCorrelationId());
                    });
        }

        @Test
        @DisplayName("A resolved episode needs the full breach streak again")
        void newEpisodeHonoursHysteresis() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").consecutiveBreachesToFire(2).build();
            breach(machine, rule);
            breach(machine, rule).orElseThrow();
            clear(machine, rule).orElseThrow();

            assertThat(breach(machine, rule)).isEmpty();
            AlertInstance pending = current(machine, rule);
            assertThat(pending.getState()).isEqualTo(AlertState.PENDING);
            assertThat(pending.getEpisode()).isEqualTo(2);
            assertThat(pending.getConsecutiveBreaches()).isEqualTo(1);
            assertThat(breach(machine, rule)).isPresent();
        }

        @Test
        @DisplayName("Manual resolve of a rule that is not firing is a no-op")
        void manualResolveNotFiring() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").build();
            machine.register("r");

            assertThat(machine.manualResolve(rule)).isEmpty();
            assertThat(machine.manualResolve(TestRules.rule("never-seen").build())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Missing data")
    class MissingData {

        @Test
        @DisplayName("NEITHER leaves counters untouched")
        void neitherLeavesCounters() {
            AlertStateMachine machine = machine();
            AlertRule rule = TestRules.rule("r").consecutiveBreachesToFire(3).build();
            breach(machine, rule);
            breach(machine, rule);

            assertThat(error(machine, rule)).isEmpty();

            AlertInstance instance = current(machine, rule);
            assertThat(instance.getConsecutiveBreaches()).isEqualTo(2);
            assertThat(instance.getLastEvaluatedAt()).isEqualTo(clock.instant());
            assertThat(breach(machine, rule)).isPresent();
        }

        @Test
        @DisplayName("BREACH treats errors as breaches")
        void breachPolicy() {
            AlertStateMachine machine = machine(null, MissingDataPolicy.BREACH);
            AlertRule rule = TestRules.rule("r").build();

            AlertEvent fired = error(machine, rule).orElseThrow();

            assertThat(fired.getType()).isEqualTo(AlertEventType.FIRED);
            assertThat(fired.getInstance().getLastValue()).isNull();
        }

        @Test
        @DisplayName("CLEAR treats errors as clears")
        void clearPolicy() {
            AlertStateMachine machine = machine(null, MissingDataPolicy.CLEAR);
            AlertRule rule = TestRules.rule("r").build();
            breach(machine, rule);

            assertThat(error(machine, rule).orElseThrow().getType()).isEqualTo(AlertEventType.RESOLVED);
        }
    }

    @Test
    @DisplayName("Disabled rule keeps its instance frozen")
    void disabledRuleFrozen() {
        AlertStateMachine machine = machine();
        AlertRule rule = TestRules.rule("r").build();
        breach(machine, rule);
        AlertInstance firing = current(machine, rule);

        AlertRule disabled = rule.toBuilder().enabled(false).build();
        assertThat(clear(machine, disabled)).isEmpty();

        assertThat(current(machine, rule)).isEqualTo(firing);
    }

    @Test
    @DisplayName("Evaluation for another rule is rejected")
    void mismatchedEvaluationRejected() {
        AlertStateMachine machine = machine();
        AlertRule rule = TestRules.rule("r").build();

        assertThatThrownBy(() -> machine.apply(rule, Evaluation.clear("other", 1, clock.instant())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("firing lists active instances by fire time and skips retired rules")
    void firingListing() {
        AlertStateMachine machine = machine();
        AlertRule a = TestRules.rule("a").build();
        AlertRule b = TestRules.rule("b").build();
        breach(machine, b);
        breach(machine, a);

        assertThat(machine.firing()).extracting(AlertInstance::getRuleId).containsExactly("b", "a");

        machine.retire("b");
        assertThat(machine.firing()).extracting(AlertInstance::getRuleId).containsExactly("a");

        AlertInstance resumed = machine.register("b");
        assertThat(resumed.getState()).isEqualTo(AlertState.FIRING);
        assertThat(machine.firing()).hasSize(2);
    }

    @Test
    @DisplayName("Never more than one firing instance per rule")
    void singleActiveInstance() {
        AlertStateMachine machine = machine();
        AlertRule rule = TestRules.rule("r").consecutiveBreachesToFire(2).consecutiveClearsToResolve(2).build();
        boolean[] pattern = {true, true, false, true, false, false, true, true, true, false, false, true};

        for (boolean isBreach : pattern) {
            if (isBreach) {
                breach(machine, rule);
            } else {
                clear(machine, rule);
            }
            List<AlertInstance> all = new ArrayList<>(machine.history("r"));
            all.add(current(machine, rule));
            assertThat(all).filteredOn(AlertInstance::isFiring).hasSizeLessThanOrEqualTo(1);
            assertThat(all.subList(0, all.size() - 1))
                    .allMatch(old -> old.getState() == AlertState.RESOLVED);
        }
    }

    @Test
    @DisplayName("DedupViolationException carries the rule id")
    void dedupViolationMessage() {
        DedupViolationException e = new DedupViolationException("r", "instance c-1 is already firing");

        assertThat(e.getRuleId()).isEqualTo("r");
        assertThat(e).hasMessage("Dedup violation for rule 'r': instance c-1 is already firing");
    }
}
