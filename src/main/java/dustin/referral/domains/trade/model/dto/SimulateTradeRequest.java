package dustin.referral.domains.trade.model.dto;

import dustin.referral.shared.model.TokenType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 웹훅 요청 DTO
 * Trade Webhook (Simulation) Request DTO
 * 
 * 인증된 사용자의 거래를 수수료 등급을 명시하여 전달 (거래 시뮬레이션, 외부 거래 시스템 연동)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "거래 웹훅 요청 (수수료 등급 명시)")
public class SimulateTradeRequest {

    @NotBlank
    @Schema(description = "거래량", example = "1000", required = true)
    private String volume;

    /**
     * 0 ~ 1, 소수점 이하 최대 4자리
     */
    @NotBlank
    @Schema(description = "수수료 등급", example = "0.01", required = true)
    private String feeTier;

    @NotNull
    @Schema(description = "토큰 종류", example = "USDC-SOLANA", required = true)
    private TokenType tokenType;
}
