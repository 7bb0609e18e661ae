package dustin.referral.domains.earnings.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.referral.domains.commission.model.entity.Cashback;
import dustin.referral.domains.commission.model.entity.Commission;
import dustin.referral.domains.commission.repository.CashbackRepository;
import dustin.referral.domains.commission.repository.CommissionRepository;
import dustin.referral.domains.earnings.model.dto.EarningsAmounts;
import dustin.referral.domains.earnings.model.dto.EarningsHistoryItem;
import dustin.referral.domains.earnings.model.dto.EarningsResponse;
import dustin.referral.domains.earnings.model.dto.EarningsType;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.model.TokenType;
import dustin.referral.shared.model.dto.PageResponse;
import lombok.RequiredArgsConstructor;

/**
 * 수익 조회 서비스
 * Earnings Service
 * 
 * 역할:
 * - 수익 요약 (커미션: 합계/청구/미청구/단계별/토큰별, 캐시백: 합계/청구/미청구/토큰별)
 * - 수익 내역 (커미션 + 캐시백 최신순, 페이지 단위)
 * 
 * 읽기 전용, 원장 행을 변경하지 않음
 */
@Service
@RequiredArgsConstructor
public class EarningsService {

    public static final int MAX_PAGE_SIZE = 100;

    private final CommissionRepository commissionRepository;
    private final CashbackRepository cashbackRepository;

    /**
     * 수익 요약
     * 
     * @param userId 사용자 ID
     * @param tokenType 토큰 종류 (null이면 전체)
     */
    @Transactional(readOnly = true)
    public EarningsResponse getEarnings(Long userId, TokenType tokenType) {
        List<Commission> commissions = loadCommissions(userId, tokenType);
        List<Cashback> cashbacks = loadCashbacks(userId, tokenType);

        EarningsAmounts commissionSummary = EarningsAmounts.builder().build();
        Map<TokenType, EarningsAmounts> commissionByToken = new EnumMap<>(TokenType.class);
        EarningsResponse.CommissionEarnings commissionEarnings = EarningsResponse.CommissionEarnings.builder().build();

        for (Commission commission : commissions) {
            commissionSummary.accumulate(commission.getAmount(), commission.isClaimed());
            tokenBucket(commissionByToken, commission.getTokenType())
                    .accumulate(commission.getAmount(), commission.isClaimed());
            int level = commission.getLevel();
            if (level == 1) {
                commissionEarnings.setLevel1(DecimalMath.add(commissionEarnings.getLevel1(), commission.getAmount()));
            } else if (level == 2) {
                commissionEarnings.setLevel2(DecimalMath.add(commissionEarnings.getLevel2(), commission.getAmount()));
            } else if (level == 3) {
                commissionEarnings.setLevel3(DecimalMath.add(commissionEarnings.getLevel3(), commission.getAmount()));
            }
        }
        commissionEarnings.setSummary(commissionSummary);
        commissionEarnings.setByToken(new ArrayList<>(commissionByToken.values()));

        EarningsAmounts cashbackSummary = EarningsAmounts.builder().build();
        Map<TokenType, EarningsAmounts> cashbackByToken = new EnumMap<>(TokenType.class);
        for (Cashback cashback : cashbacks) {
            cashbackSummary.accumulate(cashback.getAmount(), cashback.isClaimed());
            tokenBucket(cashbackByToken, cashback.getTokenType())
                    .accumulate(cashback.getAmount(), cashback.isClaimed());
        }

        return EarningsResponse.builder()
                .commissions(commissionEarnings)
                .cashback(EarningsResponse.CashbackEarnings.builder()
                        .summary(cashbackSummary)
                        .byToken(new ArrayList<>(cashbackByToken.values()))
                        .build())
                .build();
    }

    /**
     * 수익 내역 (최신순)
     * 
     * @param type 항목 종류 필터 (null이면 ALL)
     * @param page 페이지 번호 (0부터)
     * @param size 페이지 크기 (1 ~ 100)
     * @throws LedgerException INVALID_INPUT (페이지 범위 오류)
     */
    @Transactional(readOnly = true)
    public PageResponse<EarningsHistoryItem> getEarningsHistory(Long userId, TokenType tokenType,
            EarningsType type, int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT,
                    "page must be >= 0 and size must be between 1 and " + MAX_PAGE_SIZE);
        }
        EarningsType filter = type == null ? EarningsType.ALL : type;

        List<EarningsHistoryItem> items = new ArrayList<>();
        if (filter != EarningsType.CASHBACK) {
            for (Commission c : loadCommissions(userId, tokenType)) {
                items.add(EarningsHistoryItem.builder()
                        .id(c.getId())
                        .type(EarningsType.COMMISSION)
                        .amount(c.getAmount())
                        .tokenType(c.getTokenType())
                        .claimed(c.isClaimed())
                        .claimedAt(c.getClaimedAt())
                        .createdAt(c.getCreatedAt())
                        .level(c.getLevel())
                        .tradeId(c.getTradeId())
                        .build());
            }
        }
        if (filter != EarningsType.COMMISSION) {
            for (Cashback cb : loadCashbacks(userId, tokenType)) {
                items.add(EarningsHistoryItem.builder()
                        .id(cb.getId())
                        .type(EarningsType.CASHBACK)
                        .amount(cb.getAmount())
                        .tokenType(cb.getTokenType())
                        .claimed(cb.isClaimed())
                        .claimedAt(cb.getClaimedAt())
                        .createdAt(cb.getCreatedAt())
                        .tradeId(cb.getTradeId())
                        .build());
            }
        }

        items.sort(Comparator.comparing(EarningsHistoryItem::getCreatedAt, Comparator.reverseOrder())
                .thenComparing(EarningsHistoryItem::getTradeId, Comparator.reverseOrder())
                .thenComparing(EarningsHistoryItem::getId, Comparator.reverseOrder()));
        return PageResponse.slice(items, page, size);
    }

    private List<Commission> loadCommissions(Long userId, TokenType tokenType) {
        return tokenType == null
                ? commissionRepository.findByUserIdOrderByIdAsc(userId)
                : commissionRepository.findByUserIdAndTokenTypeOrderByIdAsc(userId, tokenType);
    }

    private List<Cashback> loadCashbacks(Long userId, TokenType tokenType) {
        return tokenType == null
                ? cashbackRepository.findByUserIdOrderByIdAsc(userId)
                : cashbackRepository.findByUserIdAndTokenTypeOrderByIdAsc(userId, tokenType);
    }

    private EarningsAmounts tokenBucket(Map<TokenType, EarningsAmounts> buckets, TokenType tokenType) {
        return buckets.computeIfAbsent(tokenType, t -> EarningsAmounts.builder().tokenType(t).build());
    }
}
