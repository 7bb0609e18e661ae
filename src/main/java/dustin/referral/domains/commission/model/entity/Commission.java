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
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 추천 커미션 엔티티
 * Commission Entity
 * 
 * 역할:
 * - 거래 한 건에서 상위 추천인 한 명에게 지급할 몫
 * - 거래 처리 중에만 생성, 이후에는 청구(claimed, claimed_at)만 변경
 * 
 * 제약:
 * - (trade_id, level) 유니크: 단계별 수령인은 최대 한 명
 * - 거래 삭제 시 함께 삭제 (ON DELETE CASCADE)
 */
@Entity
@Table(name = "commissions",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_commissions_trade_level", columnNames = {"trade_id", "level"})
       },
       indexes = {
           @Index(name = "idx_commissions_user_token_claimed", columnList = "user_id, token_type, claimed")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Commission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 수령인 (상위 추천인) 사용자 ID
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

    /**
     * 추천 단계 (1 = 직접 추천인, 2, 3)
     */
    @Column(name = "level", nullable = false)
    private Integer level;

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
