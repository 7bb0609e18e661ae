package dustin.referral.shared.transaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

import dustin.referral.config.LedgerProperties;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;

/**
 * 직렬화 트랜잭션 실행기 테스트
 * Serializable Transaction Executor Test
 * 
 * 테스트 항목:
 * 1. 성공 시 한 번 커밋
 * 2. 충돌 시 작업 전체 재시도, 소진 시 TRANSACTION_FAILED
 * 3. 비즈니스 거부 / 제약 조건 위반은 재시도하지 않음
 */
class SerializableTransactionExecutorTest {

    private PlatformTransactionManager transactionManager;
    private TransactionStatus transactionStatus;
    private SerializableTransactionExecutor executor;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        transactionStatus = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any(TransactionDefinition.class))).thenReturn(transactionStatus);

        LedgerProperties properties = new LedgerProperties();
        properties.getTransaction().setMaxAttempts(3);
        properties.getTransaction().setInitialBackoffMs(1);
        properties.getTransaction().setMaxBackoffMs(10);

        executor = new SerializableTransactionExecutor(transactionManager,
                new SerializationFailureDetector(properties), properties);
    }

    @Test
    @DisplayName("정상 완료 시 SERIALIZABLE 트랜잭션으로 한 번 커밋")
    void commitsOnce() {
        String result = executor.execute(status -> "done");

        assertThat(result).isEqualTo("done");
        verify(transactionManager).getTransaction(argThat(definition -> definition.getIsolationLevel() == TransactionDefinition.ISOLATION_SERIALIZABLE));
        verify(transactionManager, times(1)).commit(transactionStatus);
    }

    @Test
    @DisplayName("충돌 후 재시도하여 성공")
    void retriesConflictThenSucceeds() {
        AtomicInteger attempts = new AtomicInteger();

        Integer result = executor.execute(status -> {
            if (attempts.incrementAndGet() < 3) {
                throw new PessimisticLockingFailureException("could not serialize access");
            }
            return attempts.get();
        });

        assertThat(result).isEqualTo(3);
        verify(transactionManager, times(2)).rollback(transactionStatus);
        verify(transactionManager, times(1)).commit(transactionStatus);
    }

    @Test
    @DisplayName("SQLState 40001도 충돌로 판단")
    void retriesOnSqlState() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute(status -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("wrapped",
                        new SQLException("could not serialize access", "40001"));
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("재시도 소진 시 TRANSACTION_FAILED")
    void exhaustsRetries() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(status -> {
            attempts.incrementAndGet();
            throw new PessimisticLockingFailureException("could not serialize access");
        }))
                .isInstanceOf(LedgerException.class)
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.TRANSACTION_FAILED);

        assertThat(attempts.get()).isEqualTo(3);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("비즈니스 거부는 재시도 없이 그대로 전파")
    void doesNotRetryLedgerException() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(status -> {
            attempts.incrementAndGet();
            throw new LedgerException(LedgerErrorCode.SELF_REFERRAL, "self");
        }))
                .isInstanceOf(LedgerException.class)
                .hasFieldOrPropertyWithValue("errorCode", LedgerErrorCode.SELF_REFERRAL);

        assertThat(attempts.get()).isEqualTo(1);
        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    @DisplayName("제약 조건 위반은 충돌이 아님")
    void doesNotRetryConstraintViolation() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(status -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key",
                    new SQLException("duplicate key value", "23505"));
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(attempts.get()).isEqualTo(1);
    }
}
