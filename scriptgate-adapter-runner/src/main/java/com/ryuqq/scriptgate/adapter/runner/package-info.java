/**
 * Runner Adapter Layer - Executor, 큐, Gateway 구현체.
 *
 * <p>이 패키지는 application 인터페이스와 core Executor 계약의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.adapter.runner.IsolatedScriptExecutor} - 호출별 격리 + 하드 타임아웃</li>
 *   <li>{@link com.ryuqq.scriptgate.adapter.runner.RetryingScriptExecutor} - 읽기 경로 재시도 데코레이터</li>
 *   <li>{@link com.ryuqq.scriptgate.adapter.runner.SingleFlightOperationQueue} - 쓰기 단일 실행 큐</li>
 *   <li>{@link com.ryuqq.scriptgate.adapter.runner.RoutingCommandGateway} - 읽기/쓰기 라우팅</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RoutingCommandGateway, SingleFlightOperationQueue)
 *   ↓ implements
 * application (CommandGateway, OperationQueue interface)
 *   ↓ depends on
 * core (ScriptCommand, ExecutionResult, OperationState, CacheInvalidationRules)
 *   ↓ depends on
 * core/spi (ScriptEngine, ResultCache interface)
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
package com.ryuqq.scriptgate.adapter.runner;
