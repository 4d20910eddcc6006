package com.sds.phucth.assistantrelay.consts;

public interface AssistantConstants {
    interface Api {
        String THREADS = "/v1/threads";
        String THREAD_MESSAGES = "/v1/threads/{threadId}/messages";
        String THREAD_MESSAGE = "/v1/threads/{threadId}/messages/{messageId}";
        String THREAD_RUNS = "/v1/threads/{threadId}/runs";
        String THREAD_RUN = "/v1/threads/{threadId}/runs/{runId}";
        String SUBMIT_TOOL_OUTPUTS = "/v1/threads/{threadId}/runs/{runId}/submit_tool_outputs";
        String CANCEL_RUN = "/v1/threads/{threadId}/runs/{runId}/cancel";
        String BETA_HEADER = "OpenAI-Beta";
        String BETA_VALUE = "assistants=v2";
    }

    interface Role {
        String USER = "user";
        String ASSISTANT = "assistant";
    }

    interface Order {
        String DESC = "desc";
    }

    interface Function {
        String NEEDS_MORE_DATA = "needs_more_data";
        String TOOL_TYPE = "function";
        String EMPTY_OUTPUT = "{}";
    }
}
