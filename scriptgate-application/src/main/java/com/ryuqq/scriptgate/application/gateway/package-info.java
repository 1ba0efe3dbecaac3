/**
 * ScriptGate Application Layer - 명령 제출 API.
 *
 * <p>호출자가 읽기/쓰기 명령을 제출하고 결과를 기다리는 포트입니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.application.gateway.CommandGateway} - READ/WRITE 라우팅 진입점</li>
 *   <li>{@link com.ryuqq.scriptgate.application.gateway.OperationHandle} - 결과 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
package com.ryuqq.scriptgate.application.gateway;
