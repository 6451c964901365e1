package com.bank.aml.service;

import com.bank.aml.config.AlertNotificationConfig;
import com.bank.aml.config.MetricsConfig;
import com.bank.aml.model.Alert;
import com.bank.aml.model.RiskLevel;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Pages the compliance desk for alerts at or above {@code aml.notify.min-risk-level}.
 * Sending is asynchronous and never affects the monitoring pass.
 */
@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final AlertNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(AlertNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Alert paging enabled: channel {}, alerts at {} risk and above",
                    config.getChannel(), config.getMinRiskLevel());
        } else {
            log.info("Alert paging is DISABLED.");
        }
    }

    public boolean shouldNotify(RiskLevel riskLevel) {
        return config.isEnabled() && riskLevel != null
                && riskLevel.compareTo(config.getMinRiskLevel()) >= 0;
    }

    @Async
    public void notifyAlert(Alert alert) {
        if (!config.isEnabled()) {
            return;
        }
        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getComplianceDeskNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Compliance desk paged for txn={}, sid={}", alert.getTxnId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to page compliance desk for txn={}: {}", alert.getTxnId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(Alert alert) {
        return String.format(
                "[AML ALERT] %s risk transaction\n" +
                "Txn ID: %s\n" +
                "Risk Score: %d\n" +
                "Rules: %s\n" +
                "Alert ID: %s",
                alert.getRiskLevel(),
                alert.getTxnId(),
                alert.getRiskScore(),
                alert.getAlertType(),
                alert.getAlertId()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
