package dustin.referral.domains.commission.service;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import dustin.referral.domains.commission.model.CommissionRates;
import dustin.referral.domains.commission.model.dto.CommissionBreakdown;
import dustin.referral.domains.commission.model.dto.LevelCommission;
import dustin.referral.domains.referral.model.dto.UplineMember;
import dustin.referral.domains.referral.service.ReferralGraphService;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.model.TokenType;
import lombok.extern.slf4j.Slf4j;

/**
 * 분배 결과 검증기
 * Commission Breakdown Validator
 * 
 * 계산기와 독립적으로 다시 계산하여 비교합니다.
 * 
 * 검증 항목:
 * 1. 거래자 ID, 토큰 종류, feeAmount 일치
 * 2. 합계 항등식: Σ 커미션 + 캐시백 + 트레저리 = 수수료
 * 3. 캐시백 = 수수료 × 10%
 * 4. 각 커미션 = 수수료 × 해당 단계 비율, 단계는 1~3이고 중복 없음
 * 5. 기본 트레저리 = 수수료 × 55%, 귀속분 = 비어 있는 단계 몫의 합
 * 6. 각 단계의 수령인이 분배 시점의 상위 체인과 일치
 * 
 * 어느 한 필드라도 변조되면 false를 반환합니다.
 */
@Slf4j
@Component
public class CommissionBreakdownValidator {

    /**
     * 분배 결과 검증
     * Validate a breakdown against the inputs it was computed from
     * 
     * @param traderId 거래자 ID (캐시백 수령인)
     * @param feeAmount 분배한 수수료
     * @param tokenType 토큰 종류
     * @param upline 분배 시점의 상위 추천인 체인 (없으면 빈 목록)
     * @param breakdown 검증할 분배 결과
     * @return 모든 필드가 입력과 일치하면 true
     */
    public boolean isValid(Long traderId, BigDecimal feeAmount, TokenType tokenType,
            List<UplineMember> upline, CommissionBreakdown breakdown) {
        if (traderId == null || feeAmount == null || tokenType == null || upline == null || breakdown == null
                || breakdown.getCommissions() == null || breakdown.getCashback() == null
                || breakdown.getTreasury() == null || breakdown.getBaseTreasury() == null
                || breakdown.getAbsorbed() == null) {
            return false;
        }
        if (!traderId.equals(breakdown.getTraderId()) || tokenType != breakdown.getTokenType()) {
            return false;
        }
        if (!DecimalMath.isEqual(feeAmount, breakdown.getFeeAmount())) {
            return false;
        }

        BigDecimal total = DecimalMath.add(breakdown.getCashback(), breakdown.getTreasury());
        Set<Integer> levels = new HashSet<>();
        for (LevelCommission commission : breakdown.getCommissions()) {
            if (commission == null) {
                return false;
            }
            int level = commission.getLevel();
            if (level < 1 || level > ReferralGraphService.MAX_LEVELS || !levels.add(level)
                    || commission.getAmount() == null || commission.getBeneficiaryId() == null) {
                return false;
            }
            BigDecimal expected = DecimalMath.multiply(feeAmount, CommissionRates.rateForLevel(level));
            if (!DecimalMath.isEqual(expected, commission.getAmount())) {
                return false;
            }
            total = DecimalMath.add(total, commission.getAmount());
        }

        if (!DecimalMath.isEqual(total, feeAmount)) {
            log.warn("[CommissionBreakdownValidator] 합계 불일치: fee={}, total={}",
                    feeAmount.toPlainString(), total.toPlainString());
            return false;
        }
        if (!DecimalMath.isEqual(breakdown.getCashback(), DecimalMath.multiply(feeAmount, CommissionRates.CASHBACK))) {
            return false;
        }
        if (!DecimalMath.isEqual(breakdown.getBaseTreasury(),
                DecimalMath.multiply(feeAmount, CommissionRates.TREASURY))) {
            return false;
        }

        BigDecimal absorbed = DecimalMath.ZERO;
        for (int level = 1; level <= ReferralGraphService.MAX_LEVELS; level++) {
            if (!levels.contains(level)) {
                absorbed = DecimalMath.add(absorbed,
                        DecimalMath.multiply(feeAmount, CommissionRates.rateForLevel(level)));
            }
        }
        if (!DecimalMath.isEqual(absorbed, breakdown.getAbsorbed())) {
            return false;
        }
        return matchesUpline(breakdown.getCommissions(), upline);
    }

    private boolean matchesUpline(List<LevelCommission> commissions, List<UplineMember> upline) {
        if (commissions.size() != upline.size()) {
            return false;
        }
        for (LevelCommission commission : commissions) {
            boolean matched = upline.stream().anyMatch(member -> member.getLevel() == commission.getLevel()
                    && member.getUserId().equals(commission.getBeneficiaryId()));
            if (!matched) {
                return false;
            }
        }
        return true;
    }
}
