package dustin.referral.domains.referral.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 내 추천 코드 조회 응답 DTO
 * My Referral Code Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "내 추천 코드와 직접 추천 수")
public class MyReferralCodeResponse {

    @Schema(description = "추천 코드 (미발급 시 null)", example = "3F9A0C1B")
    private String code;

    @Schema(description = "직접 추천한 사용자 수", example = "4")
    private long referralCount;

    @Schema(description = "공유 경로 (미발급 시 null)", example = "/register?ref=3F9A0C1B")
    private String shareUrl;
}
