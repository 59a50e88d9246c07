package com.linlay.carassist.tool;

import com.linlay.carassist.sms.SmsDeliveryException;
import com.linlay.carassist.sms.SmsGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Component
public class EscalationMessageTool implements BaseTool {

    private static final Logger log = LoggerFactory.getLogger(EscalationMessageTool.class);

    private final SmsGateway smsGateway;

    public EscalationMessageTool(SmsGateway smsGateway) {
        this.smsGateway = smsGateway;
    }

    @Override
    public ToolName name() {
        return ToolName.SEND_ESCALATE_MESSAGE;
    }

    @Override
    public String description() {
        return "Urgent internal SMS to the escalation phone number. Use when the user is frustrated, "
                + "angry, or needs immediate human intervention.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("message_text");
    }

    @Override
    public ToolResult invoke(ToolInvocation invocation) {
        String receiver = invocation.session().escalationPhone();
        if (!StringUtils.hasText(receiver)) {
            return ToolResult.error(ErrorCode.PRECONDITION_FAILED, "No escalation phone number is set for this session.");
        }
        String text = invocation.text("message_text");
        if (text.isEmpty()) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "message_text is required.");
        }
        log.info("[{}] escalation sms text={}", invocation.session().shortId(), text.length() > 60 ? text.substring(0, 60) : text);
        try {
            smsGateway.send(receiver, text);
        } catch (SmsDeliveryException ex) {
            log.warn("[{}] escalation sms failed: {}", invocation.session().shortId(), ex.getMessage());
            return ToolResult.error(ErrorCode.TXN_FAILED, "Failed to send: " + ex.getMessage(), Map.of("error", String.valueOf(ex.getMessage())));
        }
        return ToolResult.success("Escalation SMS sent.", Map.of());
    }
}
