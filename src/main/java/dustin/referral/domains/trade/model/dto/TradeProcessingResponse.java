package dustin.referral.domains.trade.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.referral.domains.commission.model.dto.CommissionBreakdown;
import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 처리 결과 DTO
 * Trade Processing Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "거래 처리 결과")
public class TradeProcessingResponse {

    @Schema(description = "거래 ID", example = "101")
    private Long tradeId;

    @Schema(description = "거래자 사용자 ID", example = "7")
    private Long userId;

    @Schema(description = "거래량", example = "1000.000000000000000000")
    private BigDecimal volume;

    @Schema(description = "적용된 수수료 등급", example = "0.0100")
    private BigDecimal feeTier;

    @Schema(description = "수수료", example = "10.000000000000000000")
    private BigDecimal feeAmount;

    @Schema(description = "토큰 종류", example = "USDC-ARBITRUM")
    private TokenType tokenType;

    @Schema(description = "분배 결과")
    private CommissionBreakdown breakdown;

    @Schema(description = "처리 시각")
    private LocalDateTime processedAt;
}
