package dustin.referral.domains.commission.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.referral.domains.commission.model.entity.TreasuryAllocation;

/**
 * 트레저리 귀속 리포지토리
 * Treasury Allocation Repository
 */
@Repository
public interface TreasuryAllocationRepository extends JpaRepository<TreasuryAllocation, Long> {

    Optional<TreasuryAllocation> findByTradeId(Long tradeId);
}
