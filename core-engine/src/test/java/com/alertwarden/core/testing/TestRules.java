package com.alertwarden.core.testing;

import com.alertwarden.core.model.ActionGroup;
import com.alertwarden.core.model.Aggregation;
import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.ComparisonOperator;
import com.alertwarden.core.model.EmailReceiver;
import com.alertwarden.core.model.Receiver;
import com.alertwarden.core.model.SmsReceiver;
import com.alertwarden.core.model.WebhookReceiver;

import java.time.Duration;

/**
 * Shared fixtures: rules fire when the average of {@code q:<id>} exceeds 100.
 */
public final class TestRules {

    public static final Receiver OPS_MAIL = new EmailReceiver("ops-mail", "ops@example.com");
    public static final Receiver OPS_PAGER = new SmsReceiver("ops-pager", "1", "5550100");
    public static final Receiver DBA_MAIL = new EmailReceiver("dba-mail", "dba@example.com");
    public static final Receiver ESCALATION_HOOK =
            new WebhookReceiver("escalation", "https://hooks.example.com/escalate", true);

    private TestRules() {
    }

    public static AlertRule.Builder rule(String id) {
        return AlertRule.builder(id)
                .conditionQuery(query(id))
                .aggregation(Aggregation.AVG)
                .comparator(ComparisonOperator.GREATER_THAN)
                .threshold(100)
                .evaluationFrequency(Duration.ofMinutes(1))
                .windowSize(Duration.ofMinutes(5))
                .severity(2)
                .actionGroupRef("ops");
    }

    public static String query(String ruleId) {
        return "q:" + ruleId;
    }

    public static ActionGroup ops() {
        return ActionGroup.builder("ops").shortName("ops").receiver(OPS_MAIL).receiver(OPS_PAGER).build();
    }

    public static ActionGroup dba() {
        return ActionGroup.builder("dba").shortName("dba").receiver(DBA_MAIL).receiver(OPS_MAIL).build();
    }

    public static ActionGroup escalation() {
        return ActionGroup.builder("escalation").shortName("esc").receiver(ESCALATION_HOOK).build();
    }
}
