package dustin.referral.domains.referral.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 추천인 등록 응답 DTO
 * Register Referral Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "추천인 등록 결과")
public class RegisterReferralResponse {

    @Schema(description = "등록된 사용자 ID", example = "7")
    private Long userId;

    @Schema(description = "추천인 사용자 ID", example = "42")
    private Long referrerId;

    @Schema(description = "등록 후 추천 깊이 (추천인 깊이 + 1)", example = "1")
    private int referralDepth;
}
