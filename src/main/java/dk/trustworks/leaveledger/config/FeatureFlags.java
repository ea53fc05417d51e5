package dk.trustworks.leaveledger.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class FeatureFlags {

    @ConfigProperty(name = "feature.notifications.enabled", defaultValue = "true")
    boolean notificationsEnabled;

    // Email still goes out when Slack is switched off
    @ConfigProperty(name = "feature.notifications.slack.enabled", defaultValue = "true")
    boolean slackNotificationsEnabled;

    @ConfigProperty(name = "feature.reconciliation.schedule.enabled", defaultValue = "false")
    boolean scheduledReconciliationEnabled;

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    public boolean isSlackNotificationsEnabled() {
        return notificationsEnabled && slackNotificationsEnabled;
    }

    public boolean isScheduledReconciliationEnabled() {
        return scheduledReconciliationEnabled;
    }
}
