package dustin.referral.domains.commission.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.referral.domains.commission.model.entity.Commission;
import dustin.referral.shared.model.TokenType;

/**
 * 커미션 리포지토리
 * Commission Repository
 */
@Repository
public interface CommissionRepository extends JpaRepository<Commission, Long> {

    List<Commission> findByTradeIdOrderByLevelAsc(Long tradeId);

    List<Commission> findByUserIdOrderByIdAsc(Long userId);

    List<Commission> findByUserIdAndTokenTypeOrderByIdAsc(Long userId, TokenType tokenType);

    /**
     * 미청구 커미션 조회 (청구 대상)
     */
    List<Commission> findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(Long userId, TokenType tokenType);

    /**
     * 미청구 커미션 합계
     */
    @Query("""
        SELECT COALESCE(SUM(c.amount), 0)
        FROM Commission c
        WHERE c.userId = :userId AND c.tokenType = :tokenType AND c.claimed = false
        """)
    BigDecimal sumUnclaimed(@Param("userId") Long userId, @Param("tokenType") TokenType tokenType);

    /**
     * 청구 처리 (compare-and-set)
     * Mark a commission as claimed only if it is still unclaimed
     * 
     * @return 1 = 이번 호출이 청구에 성공, 0 = 이미 청구됨
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Commission c
        SET c.claimed = true, c.claimedAt = :now
        WHERE c.id = :id AND c.claimed = false
        """)
    int markClaimed(@Param("id") Long id, @Param("now") LocalDateTime now);
}
