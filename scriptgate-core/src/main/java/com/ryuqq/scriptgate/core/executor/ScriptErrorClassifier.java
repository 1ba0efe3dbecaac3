package com.ryuqq.scriptgate.core.executor;

import com.ryuqq.scriptgate.core.result.ErrorKind;
import com.ryuqq.scriptgate.core.result.ScriptError;
import com.ryuqq.scriptgate.core.spi.EngineResponse;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 엔진 응답을 {@link ScriptError}로 분류.
 *
 * <p><strong>실패 판정:</strong></p>
 * <ul>
 *   <li>엔진 백스톱 타임아웃 → TIMEOUT</li>
 *   <li>0이 아닌 종료 코드 → stderr(비어 있으면 stdout) 분류</li>
 *   <li>종료 코드 0이라도 출력이 소문자 {@code error:}로 시작하면 애플리케이션 오류로 분류
 *       (스크립트가 {@code on error} 블록에서 {@code "error: " & errMsg}를 반환하는 관례).
 *       대소문자가 다른 {@code Error:}, {@code ERROR:}는 일반 결과로 취급합니다.</li>
 * </ul>
 *
 * <p><strong>분류 기준 (오류 번호 우선, 없으면 메시지 키워드):</strong></p>
 * <ul>
 *   <li>-2741, -2740, -2750, -2753 → SYNTAX</li>
 *   <li>-1728, -1719, -10006 → REFERENCE_NOT_FOUND</li>
 *   <li>-1743, -1744, -10004 → PERMISSION_DENIED</li>
 *   <li>-600, -609, -903, -10810 → APPLICATION_UNAVAILABLE</li>
 *   <li>-1712 → TIMEOUT</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class ScriptErrorClassifier {

    static final String PERMISSION_HINT =
        "Grant automation access in System Settings > Privacy & Security > Automation";

    private static final String ERROR_PREFIX = "error:";

    private static final Pattern ERROR_NUMBER = Pattern.compile("\\((-\\d+)\\)\\s*$");

    private static final Map<Integer, ErrorKind> CODES = Map.ofEntries(
        Map.entry(-2741, ErrorKind.SYNTAX),
        Map.entry(-2740, ErrorKind.SYNTAX),
        Map.entry(-2750, ErrorKind.SYNTAX),
        Map.entry(-2753, ErrorKind.SYNTAX),
        Map.entry(-1728, ErrorKind.REFERENCE_NOT_FOUND),
        Map.entry(-1719, ErrorKind.REFERENCE_NOT_FOUND),
        Map.entry(-10006, ErrorKind.REFERENCE_NOT_FOUND),
        Map.entry(-1743, ErrorKind.PERMISSION_DENIED),
        Map.entry(-1744, ErrorKind.PERMISSION_DENIED),
        Map.entry(-10004, ErrorKind.PERMISSION_DENIED),
        Map.entry(-600, ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry(-609, ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry(-903, ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry(-10810, ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry(-1712, ErrorKind.TIMEOUT)
    );

    private static final List<Map.Entry<String, ErrorKind>> KEYWORDS = List.of(
        Map.entry("syntax error", ErrorKind.SYNTAX),
        Map.entry("expected end of line", ErrorKind.SYNTAX),
        Map.entry("not authorized", ErrorKind.PERMISSION_DENIED),
        Map.entry("not allowed", ErrorKind.PERMISSION_DENIED),
        Map.entry("privilege violation", ErrorKind.PERMISSION_DENIED),
        Map.entry("isn't running", ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry("is not running", ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry("connection is invalid", ErrorKind.APPLICATION_UNAVAILABLE),
        Map.entry("timed out", ErrorKind.TIMEOUT),
        Map.entry("timeout", ErrorKind.TIMEOUT),
        Map.entry("can't get", ErrorKind.REFERENCE_NOT_FOUND),
        Map.entry("not found", ErrorKind.REFERENCE_NOT_FOUND),
        Map.entry("invalid index", ErrorKind.REFERENCE_NOT_FOUND)
    );

    /**
     * 응답이 실패인 경우 오류 분류.
     *
     * @param response 엔진 응답
     * @return 실패면 분류된 오류, 성공이면 empty
     */
    public Optional<ScriptError> classify(EngineResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        if (response.timedOut()) {
            return Optional.of(ScriptError.of(ErrorKind.TIMEOUT, "Engine backstop timeout reached"));
        }
        if (response.exitCode() != 0) {
            String message = response.stderr().isBlank() ? response.stdout() : response.stderr();
            if (message.isBlank()) {
                message = "Engine exited with code " + response.exitCode();
            }
            return Optional.of(classifyMessage(message.strip()));
        }
        String output = response.stdout().strip();
        if (output.startsWith(ERROR_PREFIX)) {
            String message = output.substring(ERROR_PREFIX.length()).strip();
            return Optional.of(classifyMessage(message.isEmpty() ? "Application reported an error" : message));
        }
        return Optional.empty();
    }

    /**
     * 오류 메시지 분류.
     *
     * @param message 엔진 오류 메시지 (예: {@code execution error: Can't get to do id "X". (-1728)})
     * @return 분류된 오류
     */
    public ScriptError classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return ScriptError.of(ErrorKind.UNKNOWN, "Unknown engine error");
        }
        Integer code = extractCode(message);
        ErrorKind kind = code == null ? null : CODES.get(code);
        if (kind == null) {
            kind = byKeyword(message);
        }
        String finalMessage = kind == ErrorKind.PERMISSION_DENIED ? message + " (" + PERMISSION_HINT + ")" : message;
        return new ScriptError(kind, finalMessage, code);
    }

    private static Integer extractCode(String message) {
        Matcher matcher = ERROR_NUMBER.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static ErrorKind byKeyword(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, ErrorKind> entry : KEYWORDS) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return ErrorKind.UNKNOWN;
    }
}
