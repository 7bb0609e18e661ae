package dustin.referral.shared.transaction;

import java.sql.SQLException;
import java.util.List;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

import dustin.referral.config.LedgerProperties;
import lombok.RequiredArgsConstructor;

/**
 * 저장소 충돌 신호 판별기
 * Store conflict signal detector
 * 
 * 충돌로 판단하는 경우:
 * 1. 원인 체인에 Spring ConcurrencyFailureException이 있음
 *    (CannotSerializeTransactionException, CannotAcquireLockException, DeadlockLoser 등)
 * 2. 원인 체인의 SQLException SQLState가 설정 목록에 포함됨
 *    (PostgreSQL 40001 serialization_failure, 40P01 deadlock_detected)
 * 
 * 제약 조건 위반, 조회 실패 등은 충돌이 아님 (재시도하지 않음)
 */
@Component
@RequiredArgsConstructor
public class SerializationFailureDetector {

    private final LedgerProperties ledgerProperties;

    public boolean isSerializationFailure(Throwable error) {
        List<String> conflictStates = ledgerProperties.getTransaction().getConflictSqlStates();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 32) {
            if (current instanceof ConcurrencyFailureException) {
                return true;
            }
            if (current instanceof SQLException) {
                String state = ((SQLException) current).getSQLState();
                if (state != null && conflictStates.contains(state)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
