package dustin.referral.domains.claim.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.referral.domains.claim.model.dto.ClaimResponse;
import dustin.referral.domains.claim.model.dto.ClaimableBalanceResponse;
import dustin.referral.domains.claim.model.dto.SingleClaimResponse;
import dustin.referral.domains.commission.model.entity.Cashback;
import dustin.referral.domains.commission.model.entity.Commission;
import dustin.referral.domains.commission.repository.CashbackRepository;
import dustin.referral.domains.commission.repository.CommissionRepository;
import dustin.referral.domains.user.repository.UserRepository;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.kafka.KafkaEventProducer;
import dustin.referral.shared.kafka.model.EarningsClaimedEvent;
import dustin.referral.shared.model.TokenType;
import dustin.referral.shared.transaction.SerializableTransactionExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 수익 청구 서비스
 * Claim Engine
 * 
 * 역할:
 * - 미청구 커미션/캐시백을 청구 상태로 전환하고 합계를 반환
 * - 청구 가능 잔액 조회 (읽기 전용)
 * 
 * 중복 청구 방지:
 * - 행마다 조건부 UPDATE (WHERE claimed = false)
 * - 동시에 같은 행을 청구하면 한쪽만 1건 갱신, 다른 쪽은 0건 (합계에서 제외)
 * - SERIALIZABLE 트랜잭션, 충돌 시 전체 재시도
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimService {

    private final UserRepository userRepository;
    private final CommissionRepository commissionRepository;
    private final CashbackRepository cashbackRepository;
    private final SerializableTransactionExecutor transactionExecutor;
    private final KafkaEventProducer eventProducer;

    /**
     * 토큰 종류별 전체 청구
     * Claim all unclaimed commissions and cashback for a token type
     * 
     * @return 청구 합계 (청구할 항목이 없으면 0)
     * @throws LedgerException INVALID_INPUT, NOT_FOUND, TRANSACTION_FAILED
     */
    public ClaimResponse claim(Long userId, TokenType tokenType) {
        if (tokenType == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Token type is required");
        }

        ClaimResponse response = transactionExecutor.execute(status -> {
            requireUser(userId);
            LocalDateTime now = LocalDateTime.now();

            List<Commission> commissions = commissionRepository
                    .findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(userId, tokenType);
            List<Cashback> cashbacks = cashbackRepository
                    .findByUserIdAndTokenTypeAndClaimedFalseOrderByIdAsc(userId, tokenType);

            BigDecimal commissionTotal = DecimalMath.ZERO;
            int commissionCount = 0;
            for (Commission commission : commissions) {
                if (commissionRepository.markClaimed(commission.getId(), now) == 1) {
                    commissionTotal = DecimalMath.add(commissionTotal, commission.getAmount());
                    commissionCount++;
                }
            }

            BigDecimal cashbackTotal = DecimalMath.ZERO;
            int cashbackCount = 0;
            for (Cashback cashback : cashbacks) {
                if (cashbackRepository.markClaimed(cashback.getId(), now) == 1) {
                    cashbackTotal = DecimalMath.add(cashbackTotal, cashback.getAmount());
                    cashbackCount++;
                }
            }

            return ClaimResponse.builder()
                    .tokenType(tokenType)
                    .claimedCommissionTotal(commissionTotal)
                    .claimedCashbackTotal(cashbackTotal)
                    .claimedTotal(DecimalMath.add(commissionTotal, cashbackTotal))
                    .claimedCommissionCount(commissionCount)
                    .claimedCashbackCount(cashbackCount)
                    .build();
        });

        if (response.getClaimedCommissionCount() + response.getClaimedCashbackCount() > 0) {
            log.info("[ClaimService] 수익 청구 완료: userId={}, tokenType={}, commissions={}, cashback={}, total={}",
                    userId, tokenType.getCode(), response.getClaimedCommissionCount(),
                    response.getClaimedCashbackCount(), response.getClaimedTotal().toPlainString());
            publishClaimed(userId, tokenType, response.getClaimedCommissionTotal(), response.getClaimedCashbackTotal());
        }
        return response;
    }

    /**
     * 커미션 단건 청구
     * 
     * 청구에 성공한 경우에만 earnings-claimed 이벤트 발행
     * 
     * @throws LedgerException NOT_FOUND (커미션 없음), NOT_OWNER (다른 사용자의 커미션)
     */
    public SingleClaimResponse claimCommission(Long userId, Long commissionId) {
        SingleClaimResponse response = transactionExecutor.execute(status -> {
            Commission commission = commissionRepository.findById(commissionId)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND,
                            "Commission not found: " + commissionId));
            requireOwner(userId, commission.getUserId(), "commission", commissionId);

            boolean claimed = commissionRepository.markClaimed(commissionId, LocalDateTime.now()) == 1;
            return singleResult(commissionId, commission.getTokenType(), commission.getAmount(), claimed);
        });

        if (response.isClaimed()) {
            log.info("[ClaimService] 커미션 단건 청구 완료: userId={}, commissionId={}, tokenType={}, amount={}",
                    userId, commissionId, response.getTokenType().getCode(), response.getAmount().toPlainString());
            publishClaimed(userId, response.getTokenType(), response.getAmount(), DecimalMath.ZERO);
        }
        return response;
    }

    /**
     * 캐시백 단건 청구
     * 
     * @throws LedgerException NOT_FOUND (캐시백 없음), NOT_OWNER (다른 사용자의 캐시백)
     */
    public SingleClaimResponse claimCashback(Long userId, Long cashbackId) {
        SingleClaimResponse response = transactionExecutor.execute(status -> {
            Cashback cashback = cashbackRepository.findById(cashbackId)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND,
                            "Cashback not found: " + cashbackId));
            requireOwner(userId, cashback.getUserId(), "cashback", cashbackId);

            boolean claimed = cashbackRepository.markClaimed(cashbackId, LocalDateTime.now()) == 1;
            return singleResult(cashbackId, cashback.getTokenType(), cashback.getAmount(), claimed);
        });

        if (response.isClaimed()) {
            log.info("[ClaimService] 캐시백 단건 청구 완료: userId={}, cashbackId={}, tokenType={}, amount={}",
                    userId, cashbackId, response.getTokenType().getCode(), response.getAmount().toPlainString());
            publishClaimed(userId, response.getTokenType(), DecimalMath.ZERO, response.getAmount());
        }
        return response;
    }

    /**
     * 청구 가능 잔액 조회
     * Claimable balance per token type
     */
    @Transactional(readOnly = true)
    public ClaimableBalanceResponse getClaimableBalance(Long userId) {
        List<ClaimableBalanceResponse.TokenBalance> balances = new ArrayList<>();
        for (TokenType tokenType : TokenType.values()) {
            BigDecimal commissions = orZero(commissionRepository.sumUnclaimed(userId, tokenType));
            BigDecimal cashback = orZero(cashbackRepository.sumUnclaimed(userId, tokenType));
            balances.add(ClaimableBalanceResponse.TokenBalance.builder()
                    .tokenType(tokenType)
                    .commissions(commissions)
                    .cashback(cashback)
                    .total(DecimalMath.add(commissions, cashback))
                    .build());
        }
        return ClaimableBalanceResponse.builder().balances(balances).build();
    }

    /**
     * 커밋 이후 청구 이벤트 발행
     */
    private void publishClaimed(Long userId, TokenType tokenType, BigDecimal commissionTotal, BigDecimal cashbackTotal) {
        eventProducer.publishEarningsClaimed(EarningsClaimedEvent.builder()
                .userId(userId)
                .tokenType(tokenType.getCode())
                .commissionTotal(DecimalMath.toPlainString(commissionTotal))
                .cashbackTotal(DecimalMath.toPlainString(cashbackTotal))
                .total(DecimalMath.toPlainString(DecimalMath.add(commissionTotal, cashbackTotal)))
                .timestamp(LocalDateTime.now())
                .build());
    }

    private SingleClaimResponse singleResult(Long id, TokenType tokenType, BigDecimal amount, boolean claimed) {
        return SingleClaimResponse.builder()
                .id(id)
                .tokenType(tokenType)
                .amount(claimed ? amount : DecimalMath.ZERO)
                .claimed(claimed)
                .build();
    }

    private void requireOwner(Long userId, Long ownerId, String kind, Long id) {
        if (!ownerId.equals(userId)) {
            log.warn("[ClaimService] 소유자 불일치: userId={}, {}Id={}", userId, kind, id);
            throw new LedgerException(LedgerErrorCode.NOT_OWNER, "The " + kind + " does not belong to the caller");
        }
    }

    private void requireUser(Long userId) {
        if (userId == null || !userRepository.existsById(userId)) {
            throw new LedgerException(LedgerErrorCode.NOT_FOUND, "User not found: " + userId);
        }
    }

    private BigDecimal orZero(BigDecimal value) {
        return value == null ? DecimalMath.ZERO : DecimalMath.normalize(value);
    }
}
