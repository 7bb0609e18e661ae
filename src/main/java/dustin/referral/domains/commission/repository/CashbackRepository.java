package dustin.referral.domains.commission.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.referral.domains.commission.model.entity.Cashback;
import dustin.referral.shared.model.TokenType;

/**
 * 캐시백 리포지토리
 * Cashback Repository
 */
@Repository
public interface CashbackRepository extends JpaRepository<Cashback, Long> {

    Optional<Cashback> findByTradeId(Long tradeId);

    List<Cashback> findByUserIdOrderByIdAsc(Long userId);

    List<Cashback> findByUserIdAndTokenTypeOrderByIdAsc(Long userId, TokenType tokenType);

    List<Cashback> findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(Long userId, TokenType tokenType);

    @Query("""
        SELECT COALESCE(SUM(c.amount), 0)
        FROM Cashback c
        WHERE c.userId = :userId AND c.tokenType = :tokenType AND c.claimed = false
        """)
    BigDecimal sumUnclaimed(@Param("userId") Long userId, @Param("tokenType") TokenType tokenType);

    /**
     * 청구 처리 (compare-and-set)
     * 
     * @return 1 = 청구 성공, 0 = 이미 청구됨
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Cashback c
        SET c.claimed = true, c.claimedAt = :now
        WHERE c.id = :id AND c.claimed = false
        """)
    int markClaimed(@Param("id") Long id, @Param("now") LocalDateTime now);
}
