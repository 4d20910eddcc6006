package com.sds.phucth.assistantrelay.controllers;

import com.sds.phucth.assistantrelay.consts.ReplyConstants;
import com.sds.phucth.assistantrelay.dto.AssistantRequest;
import com.sds.phucth.assistantrelay.dto.Intent;
import com.sds.phucth.assistantrelay.exceptions.AssistantException;
import com.sds.phucth.assistantrelay.services.IntentService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Function;

@RestController
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
@RequiredArgsConstructor
public class AssistantController {
    IntentService intentService;

    @GetMapping("/ping")
    public Map<String, String> ping() {
        return Map.of(ReplyConstants.Field.STATUS, ReplyConstants.Value.STATUS_OK);
    }

    @PostMapping(value = "/intake", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> intake(@RequestBody @Valid AssistantRequest request) {
        return handle(Intent.INTAKE, request, intentService::intake);
    }

    @PostMapping(value = "/needs_more_data", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> needsMoreData(@RequestBody @Valid AssistantRequest request) {
        return handle(Intent.NEEDS_MORE_DATA, request, intentService::needsMoreData);
    }

    @PostMapping(value = "/give_advice", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> giveAdvice(@RequestBody @Valid AssistantRequest request) {
        return handle(Intent.GIVE_ADVICE, request, intentService::giveAdvice);
    }

    private ResponseEntity<Map<String, Object>> handle(Intent intent, AssistantRequest request,
                                                       Function<AssistantRequest, Map<String, Object>> action) {
        log.info("Processing {} request for session {}", intent.getPath(), request.getSessionId());
        try {
            Map<String, Object> body = action.apply(request);
            log.info("{} response generated for session {}", intent.getPath(), request.getSessionId());
            return ResponseEntity.ok(body);
        } catch (AssistantException e) {
            log.error("OpenAI error in {}: {}", intent.getPath(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(intentService.fallback(intent, e));
        } catch (Exception e) {
            log.error("Unexpected error in {}: {}", intent.getPath(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(intentService.fallback(intent, e));
        }
    }
}
