package dustin.referral.domains.commission.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import dustin.referral.domains.trade.model.entity.Trade;
import dustin.referral.shared.model.TokenType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 캐시백 엔티티
 * Cashback Entity
 * 
 * 거래자 본인에게 돌려주는 수수료 몫 (수수료 × 10%)
 * 처리된 거래당 정확히 한 행
 */
@Entity
@Table(name = "cashback",
       indexes = {
           @Index(name = "idx_cashback_trade_id", columnList = "trade_id", unique = true),
           @Index(name = "idx_cashback_user_token_claimed", columnList = "user_id, token_type, claimed")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cashback {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 거래자 사용자 ID
     */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "trade_id", nullable = false)
    private Long tradeId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "trade_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Trade trade;

    @Column(name = "amount", nullable = false, precision = 28, scale = 18)
    private BigDecimal amount;

    @Column(name = "token_type", nullable = false, length = 32)
    private TokenType tokenType;

    @Column(name = "claimed", nullable = false)
    @Builder.Default
    private boolean claimed = false;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
