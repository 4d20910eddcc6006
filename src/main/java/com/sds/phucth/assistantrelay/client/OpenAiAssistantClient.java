package com.sds.phucth.assistantrelay.client;

import com.sds.phucth.assistantrelay.consts.AssistantConstants;
import com.sds.phucth.assistantrelay.dto.openai.AssistantOps;
import com.sds.phucth.assistantrelay.dto.openai.MessageObject;
import com.sds.phucth.assistantrelay.dto.openai.MessagePage;
import com.sds.phucth.assistantrelay.dto.openai.RunObject;
import com.sds.phucth.assistantrelay.dto.openai.ThreadObject;
import com.sds.phucth.assistantrelay.exceptions.TransientAssistantException;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link AssistantClient} over the OpenAI Assistants v2 REST API.
 */
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class OpenAiAssistantClient implements AssistantClient {
    RestTemplate restTemplate;
    RemoteErrorClassifier errorClassifier;

    @Value("${app.assistant.openai.base-url:https://api.openai.com}")
    @NonFinal
    String baseUrl;

    @Value("${app.assistant.openai.api-key:}")
    @NonFinal
    String apiKey;

    @Override
    public ThreadObject createThread() {
        return call("create thread", () -> exchange(HttpMethod.POST,
                uri(AssistantConstants.Api.THREADS), Map.of(), ThreadObject.class));
    }

    @Override
    public MessageObject createMessage(String threadId, String role, String content) {
        return call("create message", () -> exchange(HttpMethod.POST,
                uri(AssistantConstants.Api.THREAD_MESSAGES, threadId),
                new AssistantOps.CreateMessageOp(role, content), MessageObject.class));
    }

    @Override
    public RunObject createRun(String threadId, AssistantOps.CreateRunOp op) {
        return call("create run", () -> exchange(HttpMethod.POST,
                uri(AssistantConstants.Api.THREAD_RUNS, threadId), op, RunObject.class));
    }

    @Override
    public RunObject retrieveRun(String threadId, String runId) {
        return call("retrieve run", () -> exchange(HttpMethod.GET,
                uri(AssistantConstants.Api.THREAD_RUN, threadId, runId), null, RunObject.class));
    }

    @Override
    public RunObject cancelRun(String threadId, String runId) {
        return call("cancel run", () -> exchange(HttpMethod.POST,
                uri(AssistantConstants.Api.CANCEL_RUN, threadId, runId), Map.of(), RunObject.class));
    }

    @Override
    public RunObject submitToolOutputs(String threadId, String runId, List<AssistantOps.ToolOutput> outputs) {
        return call("submit tool outputs", () -> exchange(HttpMethod.POST,
                uri(AssistantConstants.Api.SUBMIT_TOOL_OUTPUTS, threadId, runId),
                new AssistantOps.SubmitToolOutputsOp(outputs), RunObject.class));
    }

    @Override
    public List<MessageObject> listMessages(String threadId, int limit, String order) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(AssistantConstants.Api.THREAD_MESSAGES)
                .queryParam("limit", limit)
                .queryParam("order", order)
                .buildAndExpand(threadId)
                .toUri();
        MessagePage page = call("list messages", () -> exchange(HttpMethod.GET, uri, null, MessagePage.class));
        if (page == null || page.getData() == null) {
            return Collections.emptyList();
        }
        return page.getData();
    }

    @Override
    public void deleteMessage(String threadId, String messageId) {
        call("delete message", () -> exchange(HttpMethod.DELETE,
                uri(AssistantConstants.Api.THREAD_MESSAGE, threadId, messageId), null, Map.class));
    }

    private <T> T exchange(HttpMethod method, URI uri, Object body, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(AssistantConstants.Api.BETA_HEADER, AssistantConstants.Api.BETA_VALUE);

        ResponseEntity<T> resp = restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), responseType);
        return resp.getBody();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw errorClassifier.toException(e.getStatusCode().value(), operation, e);
        } catch (ResourceAccessException e) {
            log.warn("I/O error during {}: {}", operation, e.getMessage());
            throw new TransientAssistantException("Connection error during " + operation, e);
        } catch (RestClientException e) {
            log.error("OpenAI API error during {}: {}", operation, e.getMessage());
            throw new TransientAssistantException("OpenAI API error: " + e.getMessage(), e);
        }
    }

    private URI uri(String path, Object... vars) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(path)
                .buildAndExpand(vars)
                .toUri();
    }
}
