package com.sds.phucth.assistantrelay.client;

import com.sds.phucth.assistantrelay.dto.openai.AssistantOps;
import com.sds.phucth.assistantrelay.dto.openai.MessageObject;
import com.sds.phucth.assistantrelay.dto.openai.RunObject;
import com.sds.phucth.assistantrelay.dto.openai.ThreadObject;

import java.util.List;

/**
 * Operations of the remote assistant service used by the relay. Failures surface as
 * {@link com.sds.phucth.assistantrelay.exceptions.AssistantException} or its transient subtype.
 */
public interface AssistantClient {
    ThreadObject createThread();

    MessageObject createMessage(String threadId, String role, String content);

    RunObject createRun(String threadId, AssistantOps.CreateRunOp op);

    RunObject retrieveRun(String threadId, String runId);

    RunObject cancelRun(String threadId, String runId);

    RunObject submitToolOutputs(String threadId, String runId, List<AssistantOps.ToolOutput> outputs);

    /**
     * @param order {@code asc} or {@code desc} by creation time
     */
    List<MessageObject> listMessages(String threadId, int limit, String order);

    void deleteMessage(String threadId, String messageId);
}
