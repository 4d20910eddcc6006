package com.sds.phucth.assistantrelay.controllers;

import com.sds.phucth.assistantrelay.consts.ReplyConstants;
import com.sds.phucth.assistantrelay.services.IntakeProgressService;
import com.sds.phucth.assistantrelay.utils.Truthiness;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Function-call webhooks the assistant invokes directly.
 */
@RestController
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@RequiredArgsConstructor
public class WebhookController {
    IntakeProgressService intakeProgressService;

    @PostMapping("/evaluate_intake_progress")
    public Map<String, Object> evaluateIntakeProgress(@RequestBody Map<String, Object> payload) {
        Map<String, Object> result = intakeProgressService.evaluate(payload);
        result.put(ReplyConstants.Field.STATUS, ReplyConstants.Value.STATUS_OK);
        return result;
    }

    @PostMapping("/switch_chat_mode")
    public Map<String, Object> switchChatMode(@RequestBody Map<String, Object> payload) {
        Object requested = payload.get("requested_mode");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ReplyConstants.Field.STATUS, ReplyConstants.Value.STATUS_OK);
        result.put("new_mode", Truthiness.isTruthy(requested) ? requested : "default");
        return result;
    }
}
