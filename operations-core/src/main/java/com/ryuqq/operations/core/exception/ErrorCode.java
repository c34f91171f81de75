package com.ryuqq.operations.core.exception;

/**
 * Operation 레지스트리 오류 코드.
 *
 * <p>전송 계층(HTTP, CLI)은 이 코드를 기준으로 자신의 오류 표현(상태 코드, 종료 코드)으로 변환합니다.
 * 코드 값은 외부에 노출되므로 변경하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 알 수 없는 Operation ID.
     */
    NOT_FOUND("OPERATIONS-NotFound"),

    /**
     * 현재 상태에서 허용되지 않는 생명주기 호출.
     */
    INVALID_TRANSITION("OPERATIONS-InvalidTransition"),

    /**
     * 종료 전 결과 조회.
     */
    NOT_READY("OPERATIONS-NotReady"),

    /**
     * 원격 실행자 연결 실패 (재시도 소진).
     */
    CONNECTIVITY("OPERATIONS-Connectivity");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * 외부 노출용 코드 값 조회.
     *
     * @return 코드 값 (예: OPERATIONS-NotFound)
     */
    public String getCode() {
        return code;
    }
}
