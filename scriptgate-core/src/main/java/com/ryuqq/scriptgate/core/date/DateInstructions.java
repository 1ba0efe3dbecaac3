package com.ryuqq.scriptgate.core.date;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 날짜 하나를 외부 엔진에 구성하는 순서 있는 대입 목록.
 *
 * @param variable 날짜 변수 이름
 * @param assignments 대입 목록 (순서 고정)
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record DateInstructions(String variable, List<DateAssignment> assignments) {

    public DateInstructions {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("variable cannot be null or blank");
        }
        if (assignments == null || assignments.isEmpty()) {
            throw new IllegalArgumentException("assignments cannot be null or empty");
        }
        assignments = List.copyOf(assignments);
    }

    /**
     * 대입별 AppleScript 문장 목록.
     */
    public List<String> lines() {
        return assignments.stream()
            .map(a -> a.render(variable))
            .collect(Collectors.toList());
    }

    /**
     * 줄바꿈으로 연결한 스크립트 조각.
     */
    public String render() {
        return String.join("\n", lines());
    }
}
