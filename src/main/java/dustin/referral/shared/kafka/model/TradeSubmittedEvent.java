package dustin.referral.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 제출 이벤트
 * Trade Submitted Event
 * 
 * 거래 서비스가 trade-submitted 토픽으로 발행하는 이벤트
 * 금액은 정밀도 손실을 막기 위해 문자열로 전달합니다.
 * 
 * 예시:
 * {"user_id": 7, "volume": "1000", "token_type": "USDC-ARBITRUM", "fee_tier": "0.01"}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSubmittedEvent {

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("volume")
    private String volume;

    @JsonProperty("token_type")
    private String tokenType;

    /**
     * 수수료 등급 (선택, 없으면 사용자 저장 등급 사용)
     */
    @JsonProperty("fee_tier")
    private String feeTier;
}
