package dustin.referral.domains.commission.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.referral.domains.commission.model.dto.CommissionBreakdown;
import dustin.referral.domains.commission.model.dto.LevelCommission;
import dustin.referral.domains.commission.model.entity.Cashback;
import dustin.referral.domains.commission.model.entity.Commission;
import dustin.referral.domains.commission.model.entity.TreasuryAllocation;
import dustin.referral.domains.commission.repository.CashbackRepository;
import dustin.referral.domains.commission.repository.CommissionRepository;
import dustin.referral.domains.commission.repository.TreasuryAllocationRepository;
import dustin.referral.domains.referral.model.dto.UplineMember;
import dustin.referral.domains.referral.service.ReferralGraphService;
import dustin.referral.domains.trade.model.entity.Trade;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.model.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 커미션 분배 서비스
 * Commission Distribution Engine
 * 
 * 역할:
 * - 거래자의 상위 추천인 체인을 조회하여 수수료 분배 계산
 * - 분배 결과를 원장 행(커미션, 캐시백, 트레저리)으로 기록
 * 
 * 트랜잭션:
 * - 거래 처리 트랜잭션(SERIALIZABLE) 안에서 호출됨
 * - 체인 조회와 원장 기록이 같은 스냅샷에서 수행되어 추천인 변경이 절반만 보이지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommissionDistributionService {

    private final ReferralGraphService referralGraphService;
    private final CommissionCalculator commissionCalculator;
    private final CommissionBreakdownValidator breakdownValidator;
    private final CommissionRepository commissionRepository;
    private final CashbackRepository cashbackRepository;
    private final TreasuryAllocationRepository treasuryAllocationRepository;

    /**
     * 수수료 분배 계산
     * Distribute a fee over the trader's upline
     * 
     * @param traderId 거래자 ID
     * @param feeAmount 수수료
     * @param tokenType 토큰 종류
     * @return 분배 결과 (저장하지 않음)
     * @throws dustin.referral.shared.exception.LedgerException NOT_FOUND (거래자 없음)
     */
    @Transactional(readOnly = true)
    public CommissionBreakdown distribute(Long traderId, BigDecimal feeAmount, TokenType tokenType) {
        List<UplineMember> upline = referralGraphService.getUplineChain(traderId);
        CommissionBreakdown breakdown = commissionCalculator.calculate(traderId, feeAmount, tokenType, upline);

        if (!breakdownValidator.isValid(traderId, DecimalMath.normalize(feeAmount), tokenType, upline, breakdown)) {
            // 계산기 결함: 기록하지 않고 트랜잭션 전체를 롤백
            throw new IllegalStateException("Commission breakdown failed validation for trader " + traderId);
        }
        return breakdown;
    }

    /**
     * 분배 결과를 원장 행으로 기록
     * Persist ledger rows for a trade
     * 
     * 생성 행:
     * - 커미션: 추천인이 있는 단계마다 한 행
     * - 캐시백: 한 행 (금액 0이어도 기록)
     * - 트레저리: 한 행
     */
    @Transactional
    public void record(Trade trade, CommissionBreakdown breakdown) {
        List<Commission> commissions = new ArrayList<>();
        for (LevelCommission share : breakdown.getCommissions()) {
            commissions.add(Commission.builder()
                    .userId(share.getBeneficiaryId())
                    .tradeId(trade.getId())
                    .amount(share.getAmount())
                    .level(share.getLevel())
                    .tokenType(trade.getTokenType())
                    .build());
        }
        commissionRepository.saveAll(commissions);

        cashbackRepository.save(Cashback.builder()
                .userId(trade.getUserId())
                .tradeId(trade.getId())
                .amount(breakdown.getCashback())
                .tokenType(trade.getTokenType())
                .build());

        treasuryAllocationRepository.save(TreasuryAllocation.builder()
                .tradeId(trade.getId())
                .amount(breakdown.getTreasury())
                .absorbedAmount(breakdown.getAbsorbed())
                .tokenType(trade.getTokenType())
                .build());

        log.debug("[CommissionDistributionService] 원장 기록: tradeId={}, commissions={}, cashback={}, treasury={}",
                trade.getId(), commissions.size(), breakdown.getCashback().toPlainString(),
                breakdown.getTreasury().toPlainString());
    }
}
