package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.client.AssistantClient;
import com.sds.phucth.assistantrelay.consts.AssistantConstants;
import com.sds.phucth.assistantrelay.dto.AssistantProfile;
import com.sds.phucth.assistantrelay.dto.AssistantTurn;
import com.sds.phucth.assistantrelay.dto.openai.AssistantOps;
import com.sds.phucth.assistantrelay.dto.openai.MessageObject;
import com.sds.phucth.assistantrelay.dto.openai.RunObject;
import com.sds.phucth.assistantrelay.dto.openai.RunStatus;
import com.sds.phucth.assistantrelay.dto.openai.ThreadObject;
import com.sds.phucth.assistantrelay.dto.openai.ToolCall;
import com.sds.phucth.assistantrelay.exceptions.AssistantException;
import com.sds.phucth.assistantrelay.exceptions.RunTimeoutException;
import com.sds.phucth.assistantrelay.exceptions.TransientAssistantException;
import com.sds.phucth.assistantrelay.store.ThreadStore;
import com.sds.phucth.assistantrelay.utils.FunctionArguments;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one assistant turn: resolve the thread, trim it, append the user message, start a run
 * and poll it to a terminal state, answering {@code requires_action} with tool outputs on the
 * way. One invocation is one attempt; retrying is the caller's business.
 */
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class AssistantRunService {
    AssistantClient assistantClient;
    ThreadStore threadStore;
    HistoryTrimService historyTrimService;

    @Value("${app.assistant.poll.interval:200ms}")
    @NonFinal
    Duration pollInterval;

    @Value("${app.assistant.poll.max-wait:60s}")
    @NonFinal
    Duration maxWait;

    public AssistantTurn execute(String sessionId, String message, AssistantProfile profile) {
        try {
            String threadId = resolveThread(sessionId);
            historyTrimService.trim(threadId);

            assistantClient.createMessage(threadId, AssistantConstants.Role.USER, message);
            RunObject run = assistantClient.createRun(threadId, runOp(profile));

            long deadline = System.nanoTime() + maxWait.toNanos();
            run = awaitRun(threadId, run, deadline);

            Map<String, Object> structured = null;
            boolean actionHandled = false;
            while (statusOf(run) == RunStatus.REQUIRES_ACTION) {
                List<ToolCall> toolCalls = run.pendingToolCalls();
                if (toolCalls.isEmpty()) {
                    throw new TransientAssistantException("Run " + run.getId() + " requires action but carries no tool calls");
                }
                Map<String, Object> parsed = extractFunctionResult(toolCalls, profile);
                if (parsed != null) {
                    structured = parsed;
                }
                actionHandled = true;
                run = submitToolOutputs(threadId, run, toolCalls, parsed);
                run = awaitRun(threadId, run, deadline);
            }

            RunStatus status = statusOf(run);
            if (status == RunStatus.COMPLETED) {
                if (!actionHandled) {
                    structured = extractFunctionResult(run.pendingToolCalls(), profile);
                }
                String reply = latestReply(threadId, actionHandled
                        ? "No assistant response after function call"
                        : "No assistant response found");
                return new AssistantTurn(reply, structured);
            }
            if (status == RunStatus.FAILED) {
                log.error("Run failed: {}", describe(run.getLastError()));
                throw new TransientAssistantException("Assistant run failed: " + describe(run.getLastError()));
            }
            log.error("Unexpected run status: {}", status.getWireName());
            throw new TransientAssistantException("Unexpected run status: " + status.getWireName());
        } catch (AssistantException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI API error for session {}: {}", sessionId, e.getMessage());
            throw new TransientAssistantException("OpenAI API error: " + e.getMessage(), e);
        }
    }

    private String resolveThread(String sessionId) {
        Optional<String> existing = threadStore.get(sessionId);
        if (existing.isPresent()) {
            log.info("Using existing thread {} for session {}", existing.get(), sessionId);
            return existing.get();
        }
        ThreadObject thread = assistantClient.createThread();
        if (thread == null || thread.getId() == null) {
            throw new TransientAssistantException("Thread creation returned no id");
        }
        threadStore.put(sessionId, thread.getId());
        log.info("Created new thread {} for session {}", thread.getId(), sessionId);
        return thread.getId();
    }

    private AssistantOps.CreateRunOp runOp(AssistantProfile profile) {
        AssistantOps.CreateRunOp.CreateRunOpBuilder op = AssistantOps.CreateRunOp.builder()
                .assistantId(profile.getAssistantId())
                .temperature(profile.getTemperature())
                .maxCompletionTokens(profile.getMaxTokens());
        if (profile.expectsFunction()) {
            op.tools(List.of(new AssistantOps.ToolSpec(
                    AssistantConstants.Function.TOOL_TYPE,
                    new AssistantOps.FunctionSpec(profile.getFunctionName()))));
        }
        return op.build();
    }

    private RunObject awaitRun(String threadId, RunObject run, long deadline) {
        while (statusOf(run).isPending()) {
            if (System.nanoTime() - deadline > 0) {
                cancelQuietly(threadId, run.getId());
                throw new RunTimeoutException(run.getId(), maxWait);
            }
            sleep(run.getId());
            run = assistantClient.retrieveRun(threadId, run.getId());
        }
        return run;
    }

    /**
     * Acknowledges every pending call with the parsed result, or {@code {}} when there is none,
     * so the remote run can resume.
     */
    private RunObject submitToolOutputs(String threadId, RunObject run, List<ToolCall> toolCalls,
                                        Map<String, Object> parsed) {
        String output = FunctionArguments.toOutput(parsed);
        List<AssistantOps.ToolOutput> outputs = new ArrayList<>(toolCalls.size());
        for (ToolCall toolCall : toolCalls) {
            outputs.add(new AssistantOps.ToolOutput(toolCall.getId(), output));
        }
        RunObject submitted = assistantClient.submitToolOutputs(threadId, run.getId(), outputs);
        return submitted != null ? submitted : assistantClient.retrieveRun(threadId, run.getId());
    }

    private Map<String, Object> extractFunctionResult(List<ToolCall> toolCalls, AssistantProfile profile) {
        Map<String, Object> result = null;
        for (ToolCall toolCall : toolCalls) {
            if (matches(toolCall, profile)) {
                Map<String, Object> parsed = parseArguments(toolCall);
                if (parsed != null) {
                    result = parsed;
                }
            }
        }
        return result;
    }

    private static boolean matches(ToolCall toolCall, AssistantProfile profile) {
        return profile.expectsFunction()
                && toolCall.getFunction() != null
                && profile.getFunctionName().equals(toolCall.getFunction().getName());
    }

    private static Map<String, Object> parseArguments(ToolCall toolCall) {
        String raw = toolCall.getFunction().getArguments();
        Map<String, Object> parsed = FunctionArguments.parse(raw);
        if (parsed == null) {
            log.warn("Failed to parse function arguments: {}", raw);
        }
        return parsed;
    }

    private String latestReply(String threadId, String missingMessage) {
        List<MessageObject> latest = assistantClient.listMessages(threadId, 1, AssistantConstants.Order.DESC);
        if (latest.isEmpty() || !AssistantConstants.Role.ASSISTANT.equals(latest.get(0).getRole())) {
            throw new TransientAssistantException(missingMessage);
        }
        return latest.get(0).firstText()
                .orElseThrow(() -> new TransientAssistantException(missingMessage));
    }

    private void cancelQuietly(String threadId, String runId) {
        try {
            assistantClient.cancelRun(threadId, runId);
        } catch (Exception e) {
            log.warn("Failed to cancel run {} on thread {}: {}", runId, threadId, e.getMessage());
        }
    }

    private void sleep(String runId) {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssistantException("Interrupted while waiting for run " + runId, e);
        }
    }

    private static RunStatus statusOf(RunObject run) {
        if (run == null || run.getStatus() == null) {
            return RunStatus.UNKNOWN;
        }
        return run.getStatus();
    }

    private static String describe(RunObject.LastError lastError) {
        if (lastError == null) {
            return "unknown error";
        }
        return lastError.getCode() + ": " + lastError.getMessage();
    }
}
