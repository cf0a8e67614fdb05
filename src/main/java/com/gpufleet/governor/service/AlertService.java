package com.gpufleet.governor.service;

import com.gpufleet.governor.model.AlertKind;
import com.gpufleet.governor.model.BudgetAlert;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Posts budget alerts to an incoming webhook. Delivery is fire-and-forget: a failure is logged and
 * reported to the caller, never retried.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    static final String COLOR_OVER_BUDGET = "#FF0000";
    static final String COLOR_MILESTONE = "#FFA500";

    @Value("${fleet.alerts.footer:GPU Fleet Governor}")
    private String footer = "GPU Fleet Governor";

    private final Slack slack;

    @Autowired
    public AlertService() {
        this(Slack.getInstance());
    }

    AlertService(Slack slack) {
        this.slack = slack;
    }

    public boolean postAlert(String webhookUrl, BudgetAlert alert) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            return false;
        }
        try {
            WebhookResponse response = slack.send(webhookUrl, buildPayload(alert));
            Integer code = response.getCode();
            if (code != null && code >= 200 && code < 300) {
                log.info("Delivered {} alert for {} '{}'", alert.getKind(), alert.getScope(), alert.getIdentity());
                return true;
            }
            log.warn("Alert webhook for {} '{}' answered {}: {}", alert.getScope(), alert.getIdentity(),
                code, response.getBody());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to deliver {} alert for {} '{}': {}", alert.getKind(), alert.getScope(),
                alert.getIdentity(), e.getMessage());
        }
        return false;
    }

    public Payload buildPayload(BudgetAlert alert) {
        String title = title(alert);
        Attachment attachment = Attachment.builder()
            .fallback(title)
            .color(alert.isOverBudget() ? COLOR_OVER_BUDGET : COLOR_MILESTONE)
            .title(title)
            .text(description(alert))
            .fields(fields(alert))
            .footer(footer)
            .ts(String.valueOf(alert.getRaisedAt().getEpochSecond()))
            .build();
        return Payload.builder()
            .text(title)
            .attachments(List.of(attachment))
            .build();
    }

    public String title(BudgetAlert alert) {
        String who = alert.getScope().name().toLowerCase(Locale.ROOT) + " " + alert.getIdentity();
        if (alert.getKind() == AlertKind.BUDGET_EXCEEDED) {
            return "Budget exceeded: " + who;
        }
        return (alert.isOverBudget() ? "Spending milestone (over budget): " : "Spending milestone: ") + who
            + " passed " + formatMoney(alert.getMilestoneCents());
    }

    private String description(BudgetAlert alert) {
        if (alert.isOverBudget()) {
            return "Machines without an allowlist marker in their name will be terminated.";
        }
        return "Spending is within budget.";
    }

    private List<Field> fields(BudgetAlert alert) {
        long difference = alert.getLimitCents() - alert.getSpentCents();
        return List.of(
            Field.builder().title("Spent").value(formatMoney(alert.getSpentCents())).valueShortEnough(true).build(),
            Field.builder().title("Limit").value(formatMoney(alert.getLimitCents())).valueShortEnough(true).build(),
            Field.builder()
                .title(difference < 0 ? "Over by" : "Remaining")
                .value(formatMoney(Math.abs(difference)))
                .valueShortEnough(true)
                .build());
    }

    public static String formatMoney(long cents) {
        return String.format(Locale.ROOT, "$%,.2f", cents / 100.0);
    }
}
