package dustin.referral.shared.exception;

import lombok.Getter;

/**
 * 원장 비즈니스 예외
 * Ledger business exception
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
