package com.sds.phucth.assistantrelay.services;

import com.sds.phucth.assistantrelay.utils.Truthiness;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how much of the intake questionnaire has been answered.
 */
@Service
@Slf4j
public class IntakeProgressService {
    static final List<String> CATEGORIES = List.of("symptoms", "duration", "severity", "triggers", "meds");
    static final int ENOUGH_DATA_THRESHOLD = 3;

    public Map<String, Object> evaluate(Map<String, Object> data) {
        int score = (int) CATEGORIES.stream()
                .filter(category -> data != null && Truthiness.isTruthy(data.get(category)))
                .count();
        log.debug("Intake progress score {}", score);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("enough_data", score >= ENOUGH_DATA_THRESHOLD);
        result.put("score", score);
        return result;
    }
}
