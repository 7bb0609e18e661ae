package dustin.referral.domains.trade.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.referral.domains.trade.model.entity.Trade;
import jakarta.persistence.LockModeType;

/**
 * 거래 리포지토리
 * Trade Repository
 */
@Repository
public interface TradeRepository extends JpaRepository<Trade, Long> {

    /**
     * 비관적 락으로 거래 조회 (SELECT FOR UPDATE)
     * 같은 거래를 동시에 처리하려는 요청을 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Trade t WHERE t.id = :tradeId")
    Optional<Trade> findByIdForUpdate(@Param("tradeId") Long tradeId);

    List<Trade> findByUserIdOrderByCreatedAtDesc(Long userId);
}
