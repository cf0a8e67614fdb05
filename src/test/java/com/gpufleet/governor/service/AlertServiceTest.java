package com.gpufleet.governor.service;

import com.gpufleet.governor.model.AlertKind;
import com.gpufleet.governor.model.BudgetAlert;
import com.gpufleet.governor.model.LedgerScope;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    private static final String WEBHOOK = "https://hooks.example.test/T000/B000/xyz";

    @Mock
    private Slack slack;

    private AlertService alertService;

    @BeforeEach
    void setUp() {
        alertService = new AlertService(slack);
    }

    private static BudgetAlert alert(AlertKind kind, long spent, long limit, long milestone) {
        return BudgetAlert.builder()
            .kind(kind)
            .scope(LedgerScope.KEY)
            .identity("alice")
            .spentCents(spent)
            .limitCents(limit)
            .milestoneCents(milestone)
            .raisedAt(Instant.parse("2024-05-01T00:00:00Z"))
            .build();
    }

    @Test
    void shouldPostAlertToWebhook() throws Exception {
        when(slack.send(eq(WEBHOOK), any(Payload.class))).thenReturn(WebhookResponse.builder().code(200).body("ok").build());

        assertTrue(alertService.postAlert(WEBHOOK, alert(AlertKind.MILESTONE, 4100, 10000, 4000)));
    }

    @Test
    void shouldReportFailureOnErrorStatus() throws Exception {
        when(slack.send(eq(WEBHOOK), any(Payload.class))).thenReturn(WebhookResponse.builder().code(404).body("no_team").build());

        assertFalse(alertService.postAlert(WEBHOOK, alert(AlertKind.MILESTONE, 4100, 10000, 4000)));
    }

    @Test
    void shouldSwallowDeliveryErrors() throws Exception {
        when(slack.send(eq(WEBHOOK), any(Payload.class))).thenThrow(new IOException("connection reset"));

        assertFalse(alertService.postAlert(WEBHOOK, alert(AlertKind.BUDGET_EXCEEDED, 11500, 10000, 10000)));
    }

    @Test
    void shouldNotCallWebhookWithoutUrl() {
        assertFalse(alertService.postAlert(" ", alert(AlertKind.MILESTONE, 4100, 10000, 4000)));
        verifyNoInteractions(slack);
    }

    @Test
    void shouldBuildOverBudgetPayload() {
        Payload payload = alertService.buildPayload(alert(AlertKind.BUDGET_EXCEEDED, 11500, 10000, 10000));

        assertEquals("Budget exceeded: key alice", payload.getText());
        Attachment attachment = payload.getAttachments().get(0);
        assertEquals(AlertService.COLOR_OVER_BUDGET, attachment.getColor());
        assertEquals("Over by", attachment.getFields().get(2).getTitle());
        assertEquals("$15.00", attachment.getFields().get(2).getValue());
        assertEquals("1714521600", attachment.getTs());
    }

    @Test
    void shouldTitleMilestones() {
        assertEquals("Spending milestone: key alice passed $40.00",
            alertService.title(alert(AlertKind.MILESTONE, 4100, 10000, 4000)));
        assertEquals("Spending milestone (over budget): key alice passed $100.00",
            alertService.title(alert(AlertKind.MILESTONE, 11500, 10000, 10000)));
    }

    @Test
    void shouldFormatMoney() {
        assertEquals("$1,234.56", AlertService.formatMoney(123456));
        assertEquals("$0.05", AlertService.formatMoney(5));
    }
}
