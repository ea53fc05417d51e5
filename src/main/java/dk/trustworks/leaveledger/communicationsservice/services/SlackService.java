package dk.trustworks.leaveledger.communicationsservice.services;

import com.slack.api.Slack;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import dk.trustworks.leaveledger.aggregates.employees.model.Employee;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;

@JBossLog
@ApplicationScoped
public class SlackService {

    @ConfigProperty(name = "slack.motherSlackBotToken")
    String motherSlackBotToken;

    /**
     * Posts a direct message to the employee's Slack id.
     *
     * @return false when the employee has no Slack id or Slack refused the message
     */
    public boolean sendMessage(Employee employee, String textMessage) throws SlackApiException, IOException {
        if (employee.getSlackusername() == null || employee.getSlackusername().isBlank()) {
            log.debugf("Employee %s has no Slack id, message skipped", employee.getUuid());
            return false;
        }
        log.infof("Sending Slack message to %s", employee.getUuid());
        ChatPostMessageResponse response = Slack.getInstance().methods(motherSlackBotToken)
                .chatPostMessage(req -> req
                        .channel(employee.getSlackusername())
                        .text(textMessage));
        if (!response.isOk()) {
            log.warnf("Slack refused message to %s: %s", employee.getUuid(), response.getError());
        }
        return response.isOk();
    }
}
