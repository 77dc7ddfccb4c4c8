package me.golemcore.scheduler.port.outbound;

import me.golemcore.scheduler.domain.model.ToolCallResponse;

import java.util.List;

/**
 * Port for handing completed primary-conversation results back to the model.
 */
public interface ConversationResultPort {

    /**
     * Submits the responses of one batch as the next model turn.
     *
     * @param sessionId
     *            session the batch belongs to
     * @param responses
     *            responses in submission order
     */
    void submitToolResponses(String sessionId, List<ToolCallResponse> responses);
}
