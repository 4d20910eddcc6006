package com.sds.phucth.assistantrelay.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Intent {
    INTAKE("intake"),
    NEEDS_MORE_DATA("needs_more_data"),
    GIVE_ADVICE("give_advice");

    private final String path;
}
