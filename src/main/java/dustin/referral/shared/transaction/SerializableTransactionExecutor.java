package dustin.referral.shared.transaction;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import dustin.referral.config.LedgerProperties;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.exception.SerializationConflictException;
import lombok.extern.slf4j.Slf4j;

/**
 * 직렬화 트랜잭션 실행기
 * Serializable Transaction Executor
 * 
 * 역할:
 * - 작업 단위(unit of work)를 SERIALIZABLE 격리 수준의 트랜잭션으로 실행
 * - 정상 반환 시에만 커밋, 예외 발생 시 전체 롤백
 * - 직렬화 충돌 시 작업 전체를 재시도 (부분 재시도 없음)
 * 
 * 재시도 정책:
 * - 직렬화 충돌(SerializationConflictException)만 재시도
 * - 지수 백오프: 10ms → 20ms → 40ms (기본 3회 시도)
 * - 재시도 소진 시 TRANSACTION_FAILED
 * - 비즈니스 거부, 제약 조건 위반 등은 즉시 전파
 * 
 * 사용 예시:
 * ```java
 * TradeProcessingResponse response = transactionExecutor.execute(status -> {
 *     Trade trade = tradeRepository.save(...);
 *     ...
 *     return response;
 * });
 * ```
 */
@Slf4j
@Component
public class SerializableTransactionExecutor {

    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final SerializationFailureDetector failureDetector;
    private final int maxAttempts;

    public SerializableTransactionExecutor(
            PlatformTransactionManager transactionManager,
            SerializationFailureDetector failureDetector,
            LedgerProperties ledgerProperties) {
        LedgerProperties.Transaction config = ledgerProperties.getTransaction();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
        this.failureDetector = failureDetector;
        this.maxAttempts = Math.max(1, config.getMaxAttempts());
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(this.maxAttempts)
                .exponentialBackoff(config.getInitialBackoffMs(), config.getBackoffMultiplier(),
                        config.getMaxBackoffMs())
                .retryOn(SerializationConflictException.class)
                .build();
    }

    /**
     * 작업 단위 실행
     * Execute a unit of work with serializable isolation and conflict retry
     * 
     * @param work 트랜잭션 내에서 실행할 작업
     * @return 작업 결과 (커밋 완료 후 반환)
     * @throws LedgerException 비즈니스 거부 (그대로 전파) 또는 TRANSACTION_FAILED (재시도 소진)
     */
    public <T> T execute(TransactionCallback<T> work) {
        try {
            return retryTemplate.execute(context -> {
                int attempt = context.getRetryCount() + 1;
                try {
                    return transactionTemplate.execute(work);
                } catch (RuntimeException e) {
                    if (e instanceof LedgerException || !failureDetector.isSerializationFailure(e)) {
                        throw e;
                    }
                    log.warn("[SerializableTransactionExecutor] 직렬화 충돌: attempt={}/{}, cause={}",
                            attempt, maxAttempts, e.getMessage());
                    throw new SerializationConflictException("Serialization conflict on attempt " + attempt, e);
                }
            });
        } catch (SerializationConflictException e) {
            log.error("[SerializableTransactionExecutor] 재시도 소진: attempts={}", maxAttempts);
            throw new LedgerException(LedgerErrorCode.TRANSACTION_FAILED,
                    "Transaction failed after " + maxAttempts + " attempts", e);
        }
    }
}
