package dustin.referral.domains.commission.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import dustin.referral.domains.commission.model.CommissionRates;
import dustin.referral.domains.commission.model.dto.CommissionBreakdown;
import dustin.referral.domains.commission.model.dto.LevelCommission;
import dustin.referral.domains.referral.model.dto.UplineMember;
import dustin.referral.domains.referral.service.ReferralGraphService;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.model.TokenType;

/**
 * 커미션 계산기 (순수 계산, DB 접근 없음)
 * Commission Calculator
 * 
 * 계산 과정:
 * 1. 각 몫의 명목 금액 = 수수료 × 비율 (18자리 절사)
 * 2. 단계 1~3: 해당 단계 추천인이 있으면 커미션, 없으면 트레저리 귀속
 * 3. 캐시백은 추천인 유무와 관계없이 항상 거래자에게 지급
 * 4. 트레저리 = 수수료 - (캐시백 + 지급 커미션 합계)
 * 
 * 4번을 나머지로 계산하므로 절사 잔여분은 트레저리에 남고,
 * 합계 항등식이 모든 입력에서 정확히 성립합니다.
 * 
 * 예시 (수수료 10, 추천인 3단계 모두 존재):
 * - level1=3.00, level2=0.30, level3=0.20, cashback=1.00, treasury=5.50
 * 
 * 예시 (수수료 100, 추천인 1명):
 * - level1=30.00, cashback=10.00, treasury=60.00 (55 + 3 + 2)
 */
@Component
public class CommissionCalculator {

    /**
     * 수수료 분배 계산
     * 
     * @param traderId 거래자 ID (캐시백 수령인)
     * @param feeAmount 분배할 수수료 (0 이상)
     * @param tokenType 토큰 종류
     * @param upline 상위 추천인 체인 (가까운 단계부터, 최대 3단계)
     * @return 분배 결과
     */
    public CommissionBreakdown calculate(Long traderId, BigDecimal feeAmount, TokenType tokenType,
            List<UplineMember> upline) {
        BigDecimal fee = DecimalMath.normalize(feeAmount);

        Map<Integer, Long> beneficiaryByLevel = new HashMap<>();
        for (UplineMember member : upline) {
            if (member.getLevel() >= 1 && member.getLevel() <= ReferralGraphService.MAX_LEVELS) {
                beneficiaryByLevel.putIfAbsent(member.getLevel(), member.getUserId());
            }
        }

        BigDecimal cashback = DecimalMath.multiply(fee, CommissionRates.CASHBACK);
        BigDecimal baseTreasury = DecimalMath.multiply(fee, CommissionRates.TREASURY);

        List<LevelCommission> commissions = new ArrayList<>();
        BigDecimal paid = DecimalMath.ZERO;
        BigDecimal absorbed = DecimalMath.ZERO;
        for (int level = 1; level <= ReferralGraphService.MAX_LEVELS; level++) {
            BigDecimal share = DecimalMath.multiply(fee, CommissionRates.rateForLevel(level));
            Long beneficiaryId = beneficiaryByLevel.get(level);
            if (beneficiaryId != null) {
                commissions.add(LevelCommission.builder()
                        .beneficiaryId(beneficiaryId)
                        .level(level)
                        .amount(share)
                        .build());
                paid = DecimalMath.add(paid, share);
            } else {
                absorbed = DecimalMath.add(absorbed, share);
            }
        }

        BigDecimal treasury = DecimalMath.subtract(fee, DecimalMath.add(cashback, paid));

        return CommissionBreakdown.builder()
                .feeAmount(fee)
                .tokenType(tokenType)
                .traderId(traderId)
                .commissions(commissions)
                .cashback(cashback)
                .treasury(treasury)
                .baseTreasury(baseTreasury)
                .absorbed(absorbed)
                .build();
    }
}
