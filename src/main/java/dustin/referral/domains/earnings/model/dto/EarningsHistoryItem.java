package dustin.referral.domains.earnings.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수익 내역 항목 DTO
 * Earnings History Item
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "수익 내역 항목")
public class EarningsHistoryItem {

    @Schema(description = "커미션 또는 캐시백 ID", example = "15")
    private Long id;

    @Schema(description = "항목 종류", example = "COMMISSION")
    private EarningsType type;

    private BigDecimal amount;

    private TokenType tokenType;

    private boolean claimed;

    private LocalDateTime claimedAt;

    private LocalDateTime createdAt;

    /**
     * 커미션 단계 (캐시백은 null)
     */
    @Schema(description = "커미션 단계 (캐시백은 null)", example = "1")
    private Integer level;

    private Long tradeId;
}
