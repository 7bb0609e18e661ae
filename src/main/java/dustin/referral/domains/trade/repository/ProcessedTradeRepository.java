package dustin.referral.domains.trade.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.referral.domains.trade.model.entity.ProcessedTrade;

/**
 * 처리 완료 마커 리포지토리
 * Processed Trade Repository
 */
@Repository
public interface ProcessedTradeRepository extends JpaRepository<ProcessedTrade, Long> {
}
