package dustin.referral.shared.kafka.model;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수익 청구 이벤트
 * Earnings Claimed Event
 * 
 * 청구된 금액이 있을 때만 커밋 후 발행 (출금 처리 서비스가 소비)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EarningsClaimedEvent {

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("token_type")
    private String tokenType;

    @JsonProperty("commission_total")
    private String commissionTotal;

    @JsonProperty("cashback_total")
    private String cashbackTotal;

    @JsonProperty("total")
    private String total;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;
}
