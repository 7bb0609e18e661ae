package dustin.referral.shared.kafka.model;

import java.time.LocalDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 수수료 분배 완료 이벤트
 * Trade Commission Processed Event
 * 
 * 거래 처리 트랜잭션이 커밋된 후에만 발행됩니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeCommissionProcessedEvent {

    @JsonProperty("trade_id")
    private Long tradeId;

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("token_type")
    private String tokenType;

    @JsonProperty("fee_amount")
    private String feeAmount;

    @JsonProperty("cashback")
    private String cashback;

    @JsonProperty("treasury")
    private String treasury;

    @JsonProperty("commissions")
    private List<Share> commissions;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Share {

        @JsonProperty("user_id")
        private Long userId;

        @JsonProperty("level")
        private int level;

        @JsonProperty("amount")
        private String amount;
    }
}
