package dustin.referral.domains.trade.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import dustin.referral.domains.commission.model.dto.CommissionBreakdown;
import dustin.referral.domains.commission.service.CommissionDistributionService;
import dustin.referral.domains.trade.model.dto.TradeProcessingResponse;
import dustin.referral.domains.trade.model.entity.ProcessedTrade;
import dustin.referral.domains.trade.model.entity.Trade;
import dustin.referral.domains.trade.repository.ProcessedTradeRepository;
import dustin.referral.domains.trade.repository.TradeRepository;
import dustin.referral.domains.user.model.entity.User;
import dustin.referral.domains.user.repository.UserRepository;
import dustin.referral.shared.decimal.DecimalMath;
import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import dustin.referral.shared.kafka.KafkaEventProducer;
import dustin.referral.shared.kafka.model.TradeCommissionProcessedEvent;
import dustin.referral.shared.model.TokenType;
import dustin.referral.shared.transaction.SerializableTransactionExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 거래 처리 서비스
 * Trade Processing Transaction
 * 
 * 역할:
 * - 거래 생성 → 수수료 분배 → 원장 기록 → 처리 완료 표시를 하나의 원자적 작업으로 실행
 * - 같은 거래가 두 번 분배되지 않도록 보장 (처리 플래그 + 처리 완료 마커)
 * 
 * 처리 순서 (SERIALIZABLE 트랜잭션 하나):
 * 1. 거래자의 수수료 등급 조회 (또는 명시된 등급 사용)
 * 2. 수수료 = 거래량 × 수수료 등급
 * 3. 거래 INSERT (processed_for_commissions = false)
 * 4. 분배 계산 (상위 추천인 체인 조회)
 * 5. 커미션 / 캐시백 / 트레저리 INSERT
 * 6. 거래 UPDATE (processed_for_commissions = true)
 * 7. 처리 완료 마커 INSERT (PK = 거래 ID)
 * 8. 커밋 후 분배 완료 이벤트 발행
 * 
 * 멱등성:
 * - 입력 단위 중복 제거는 하지 않음 (같은 요청을 두 번 보내면 두 거래)
 * - 이미 처리된 거래 ID의 재처리는 ALREADY_PROCESSED
 * 
 * 동시성:
 * - 직렬화 충돌 시 트랜잭션 전체 재시도 (SerializableTransactionExecutor)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeProcessingService {

    /**
     * 수수료 등급 소수점 이하 최대 자릿수 (numeric(5, 4))
     */
    private static final int FEE_TIER_SCALE = 4;

    private final UserRepository userRepository;
    private final TradeRepository tradeRepository;
    private final ProcessedTradeRepository processedTradeRepository;
    private final CommissionDistributionService distributionService;
    private final SerializableTransactionExecutor transactionExecutor;
    private final KafkaEventProducer eventProducer;

    /**
     * 거래 기록 및 분배 (사용자 저장 수수료 등급 사용)
     * Record a trade using the trader's stored fee tier
     * 
     * @param userId 거래자 ID
     * @param volume 거래량 (0보다 커야 함)
     * @param tokenType 토큰 종류
     * @return 거래 ID, 수수료, 분배 결과
     * @throws LedgerException INVALID_INPUT, NOT_FOUND, TRANSACTION_FAILED
     */
    public TradeProcessingResponse recordTrade(Long userId, BigDecimal volume, TokenType tokenType) {
        BigDecimal tradeVolume = requirePositiveVolume(volume);
        requireTokenType(tokenType);

        TradeProcessingResponse response = transactionExecutor.execute(status -> {
            User user = findUser(userId);
            Trade trade = insertPendingTrade(userId, tradeVolume, user.getFeeTier(), tokenType);
            return distributeAndMark(trade);
        });

        afterCommit(response);
        return response;
    }

    /**
     * 거래 기록 및 분배 (수수료 등급 명시)
     * Record a trade with an explicit fee tier (webhook / simulation path)
     * 
     * @param feeTier 0 ~ 1, 소수점 이하 최대 4자리
     * @throws LedgerException INVALID_INPUT, NOT_FOUND, TRANSACTION_FAILED
     */
    public TradeProcessingResponse simulateTrade(Long userId, BigDecimal volume, BigDecimal feeTier,
            TokenType tokenType) {
        BigDecimal tradeVolume = requirePositiveVolume(volume);
        BigDecimal tier = requireValidFeeTier(feeTier);
        requireTokenType(tokenType);

        TradeProcessingResponse response = transactionExecutor.execute(status -> {
            findUser(userId);
            Trade trade = insertPendingTrade(userId, tradeVolume, tier, tokenType);
            return distributeAndMark(trade);
        });

        afterCommit(response);
        return response;
    }

    /**
     * 기존 pending 거래의 분배 처리
     * Process an already inserted pending trade
     * 
     * @param tradeId 거래 ID
     * @throws LedgerException NOT_FOUND (거래 없음), ALREADY_PROCESSED (이미 처리됨)
     */
    public TradeProcessingResponse processTrade(Long tradeId) {
        if (tradeId == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Trade id is required");
        }
        TradeProcessingResponse response = transactionExecutor.execute(status -> {
            Trade trade = tradeRepository.findByIdForUpdate(tradeId)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND,
                            "Trade not found: " + tradeId));
            return distributeAndMark(trade);
        });

        afterCommit(response);
        return response;
    }

    private Trade insertPendingTrade(Long userId, BigDecimal volume, BigDecimal feeTier, TokenType tokenType) {
        BigDecimal feeAmount = DecimalMath.multiply(volume, feeTier);
        Trade trade = Trade.builder()
                .userId(userId)
                .volume(volume)
                .feeTier(feeTier)
                .feeAmount(feeAmount)
                .tokenType(tokenType)
                .processedForCommissions(false)
                .build();
        return tradeRepository.saveAndFlush(trade);
    }

    /**
     * 분배 + 원장 기록 + 처리 완료 표시 (트랜잭션 내부에서만 호출)
     */
    private TradeProcessingResponse distributeAndMark(Trade trade) {
        Long tradeId = trade.getId();
        if (trade.isProcessedForCommissions() || processedTradeRepository.existsById(tradeId)) {
            throw new LedgerException(LedgerErrorCode.ALREADY_PROCESSED, "Trade already processed: " + tradeId);
        }

        CommissionBreakdown breakdown = distributionService.distribute(
                trade.getUserId(), trade.getFeeAmount(), trade.getTokenType());
        distributionService.record(trade, breakdown);

        trade.setProcessedForCommissions(true);
        tradeRepository.save(trade);

        ProcessedTrade marker;
        try {
            marker = processedTradeRepository.saveAndFlush(ProcessedTrade.builder()
                    .tradeId(tradeId)
                    .processedAt(LocalDateTime.now())
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new LedgerException(LedgerErrorCode.ALREADY_PROCESSED, "Trade already processed: " + tradeId, e);
        }

        return TradeProcessingResponse.builder()
                .tradeId(tradeId)
                .userId(trade.getUserId())
                .volume(trade.getVolume())
                .feeTier(trade.getFeeTier())
                .feeAmount(trade.getFeeAmount())
                .tokenType(trade.getTokenType())
                .breakdown(breakdown)
                .processedAt(marker.getProcessedAt())
                .build();
    }

    private void afterCommit(TradeProcessingResponse response) {
        CommissionBreakdown breakdown = response.getBreakdown();
        log.info("[TradeProcessingService] 거래 분배 완료: tradeId={}, userId={}, fee={}, commissions={}, treasury={}",
                response.getTradeId(), response.getUserId(), response.getFeeAmount().toPlainString(),
                breakdown.getCommissions().size(), breakdown.getTreasury().toPlainString());

        eventProducer.publishTradeProcessed(TradeCommissionProcessedEvent.builder()
                .tradeId(response.getTradeId())
                .userId(response.getUserId())
                .tokenType(response.getTokenType().getCode())
                .feeAmount(DecimalMath.toPlainString(response.getFeeAmount()))
                .cashback(DecimalMath.toPlainString(breakdown.getCashback()))
                .treasury(DecimalMath.toPlainString(breakdown.getTreasury()))
                .commissions(breakdown.getCommissions().stream()
                        .map(share -> TradeCommissionProcessedEvent.Share.builder()
                                .userId(share.getBeneficiaryId())
                                .level(share.getLevel())
                                .amount(DecimalMath.toPlainString(share.getAmount()))
                                .build())
                        .collect(Collectors.toList()))
                .timestamp(response.getProcessedAt())
                .build());
    }

    private User findUser(Long userId) {
        if (userId == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "User id is required");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND, "User not found: " + userId));
    }

    private BigDecimal requirePositiveVolume(BigDecimal volume) {
        BigDecimal normalized = DecimalMath.normalize(volume);
        if (normalized.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Volume must be greater than zero");
        }
        return normalized;
    }

    private BigDecimal requireValidFeeTier(BigDecimal feeTier) {
        if (feeTier == null || feeTier.signum() < 0 || feeTier.compareTo(BigDecimal.ONE) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Fee tier must be between 0 and 1");
        }
        if (feeTier.stripTrailingZeros().scale() > FEE_TIER_SCALE) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT,
                    "Fee tier supports at most " + FEE_TIER_SCALE + " decimal places");
        }
        return feeTier.setScale(FEE_TIER_SCALE);
    }

    private void requireTokenType(TokenType tokenType) {
        if (tokenType == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Token type is required");
        }
    }
}
