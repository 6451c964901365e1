package com.bank.aml.config;

import com.bank.aml.model.RiskLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Compliance-desk paging for newly recorded alerts, sent through Twilio.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "aml.notify")
public class AlertNotificationConfig {

    private boolean enabled = false;

    // Alerts at or above this level page the desk
    private RiskLevel minRiskLevel = RiskLevel.HIGH;

    // "sms" or "whatsapp"
    private String channel = "sms";

    private String accountSid;
    private String authToken;

    // Sender registered with Twilio and the on-call compliance number
    private String fromNumber;
    private String complianceDeskNumber;
}
