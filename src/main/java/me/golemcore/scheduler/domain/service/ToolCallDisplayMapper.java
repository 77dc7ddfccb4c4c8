package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.ToolCallDisplay;
import me.golemcore.scheduler.domain.model.ToolCallDisplayStatus;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolCallStatus;
import me.golemcore.scheduler.domain.scheduler.ToolCall;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Projects tracked calls into render-ready views for display layers.
 */
@Component
public class ToolCallDisplayMapper {

    public ToolCallDisplayStatus toDisplayStatus(ToolCallStatus status) {
        return switch (status) {
        case SCHEDULED, VALIDATING -> ToolCallDisplayStatus.PENDING;
        case AWAITING_APPROVAL -> ToolCallDisplayStatus.CONFIRMING;
        case EXECUTING -> ToolCallDisplayStatus.EXECUTING;
        case SUCCESS -> ToolCallDisplayStatus.SUCCESS;
        case ERROR -> ToolCallDisplayStatus.ERROR;
        case CANCELLED -> ToolCallDisplayStatus.CANCELED;
        };
    }

    public ToolCallDisplay toDisplay(ToolCall call) {
        ToolCallStatus status = call.getStatus();
        ToolCallResponse response = call.getResponse();
        return ToolCallDisplay.builder()
                .callId(call.getCallId())
                .name(call.getRequest().name())
                .description(describeArgs(call))
                .status(toDisplayStatus(status))
                .resultDisplay(resultDisplay(call, status, response))
                .suppressOutput(response != null && response.suppressOutput())
                .agentId(call.getRequest().agentId())
                .build();
    }

    public List<ToolCallDisplay> toDisplays(List<ToolCall> calls) {
        return calls.stream().map(this::toDisplay).toList();
    }

    private String resultDisplay(ToolCall call, ToolCallStatus status, ToolCallResponse response) {
        return switch (status) {
        case SCHEDULED, VALIDATING, AWAITING_APPROVAL -> null;
        case EXECUTING -> {
            String live = call.getLiveOutput();
            yield live.isEmpty() ? null : live;
        }
        case SUCCESS, ERROR, CANCELLED -> response != null ? response.toModelContent() : null;
        };
    }

    private String describeArgs(ToolCall call) {
        return call.getRequest().args().isEmpty() ? "" : call.getRequest().args().toString();
    }
}
