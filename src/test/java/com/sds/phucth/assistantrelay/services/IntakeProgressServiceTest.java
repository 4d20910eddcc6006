package com.sds.phucth.assistantrelay.services;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntakeProgressServiceTest {

    private final IntakeProgressService intakeProgressService = new IntakeProgressService();

    @Test
    void threeAnsweredCategoriesAreEnough() {
        Map<String, Object> result = intakeProgressService.evaluate(Map.of(
                "symptoms", "dolor de cabeza",
                "duration", "3 días",
                "severity", 7,
                "triggers", "",
                "notes", "ignored"));

        assertEquals(3, result.get("score"));
        assertEquals(true, result.get("enough_data"));
    }

    @Test
    void emptyAndFalsyValuesDoNotCount() {
        Map<String, Object> data = new HashMap<>();
        data.put("symptoms", "tos");
        data.put("duration", null);
        data.put("severity", 0);
        data.put("meds", List.of());

        Map<String, Object> result = intakeProgressService.evaluate(data);

        assertEquals(1, result.get("score"));
        assertEquals(false, result.get("enough_data"));
    }

    @Test
    void missingPayloadScoresZero() {
        assertEquals(0, intakeProgressService.evaluate(null).get("score"));
    }
}
