package com.ryuqq.scriptgate.core.date;

/**
 * 숫자형 일/월 표기의 해석 순서 힌트.
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum DateFormatHint {

    /**
     * 데이터로 순서를 판단. 두 필드가 모두 12 이하이고 서로 다르면 모호한 입력으로 거부합니다.
     */
    AUTO,

    /**
     * ISO 형식(YYYY-MM-DD)만 허용.
     */
    ISO,

    /**
     * 월/일/연 (M/D/YYYY).
     */
    US,

    /**
     * 일.월.연 (D.M.YYYY).
     */
    EUROPEAN
}
