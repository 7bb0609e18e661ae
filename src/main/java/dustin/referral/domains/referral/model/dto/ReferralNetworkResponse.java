package dustin.referral.domains.referral.model.dto;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 추천 네트워크 응답 DTO
 * Referral Network Response DTO
 * 
 * 직접 추천 목록과 단계별 하위 추천 수
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "내 추천 네트워크")
public class ReferralNetworkResponse {

    @Builder.Default
    @Schema(description = "직접 추천한 사용자 목록")
    private List<DirectReferral> direct = new ArrayList<>();

    @Schema(description = "1단계 (직접 추천) 수", example = "3")
    private int level1Count;

    @Schema(description = "2단계 수", example = "5")
    private int level2Count;

    @Schema(description = "3단계 수", example = "2")
    private int level3Count;

    @Schema(description = "전체 네트워크 크기 (1~3단계 합)", example = "10")
    private int totalNetwork;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DirectReferral {

        private Long userId;

        private String email;

        private Integer depth;

        private LocalDateTime joinedAt;
    }
}
