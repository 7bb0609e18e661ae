package dustin.referral.shared.exception;

/**
 * 직렬화 충돌 예외 (재시도 대상)
 * Transient store conflict, retried by SerializableTransactionExecutor
 */
public class SerializationConflictException extends LedgerException {

    public SerializationConflictException(String message, Throwable cause) {
        super(LedgerErrorCode.SERIALIZATION_CONFLICT, message, cause);
    }
}
