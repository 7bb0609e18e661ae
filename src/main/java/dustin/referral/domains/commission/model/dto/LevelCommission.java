package dustin.referral.domains.commission.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 단계별 커미션 항목
 * Commission share for one upline level
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "단계별 커미션")
public class LevelCommission {

    @Schema(description = "수령인 사용자 ID", example = "42")
    private Long beneficiaryId;

    @Schema(description = "추천 단계 (1~3)", example = "1")
    private int level;

    @Schema(description = "커미션 금액", example = "3.000000000000000000")
    private BigDecimal amount;
}
