package dustin.referral.shared.exception;

import org.springframework.http.HttpStatus;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 원장 오류 코드
 * Ledger Error Codes
 * 
 * 재시도 가능 여부:
 * - SERIALIZATION_CONFLICT: 내부에서 자동 재시도 (외부로 노출되지 않음)
 * - TRANSACTION_FAILED: 재시도 소진 후 노출, 호출자가 상위 수준에서 재요청 가능
 * - 그 외: 입력을 바꾸지 않는 한 재시도 불가
 */
@Getter
@RequiredArgsConstructor
public enum LedgerErrorCode {

    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    ALREADY_REFERRED(HttpStatus.CONFLICT),
    SELF_REFERRAL(HttpStatus.BAD_REQUEST),
    CIRCULAR_REFERENCE(HttpStatus.CONFLICT),
    MAX_DEPTH_EXCEEDED(HttpStatus.BAD_REQUEST),
    ALREADY_PROCESSED(HttpStatus.CONFLICT),
    NOT_OWNER(HttpStatus.FORBIDDEN),
    SERIALIZATION_CONFLICT(HttpStatus.CONFLICT),
    TRANSACTION_FAILED(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;
}
