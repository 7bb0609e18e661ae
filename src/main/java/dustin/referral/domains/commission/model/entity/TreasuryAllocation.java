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
 * 트레저리 귀속 엔티티
 * Treasury Allocation Entity
 * 
 * 플랫폼 몫 = 기본 55% + 추천인이 없는 단계의 몫
 * 처리된 거래당 정확히 한 행, 청구 대상 아님
 */
@Entity
@Table(name = "treasury_allocations",
       indexes = {
           @Index(name = "idx_treasury_allocations_trade_id", columnList = "trade_id", unique = true)
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreasuryAllocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

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
     * 추천인이 없는 단계에서 귀속된 몫 (amount에 포함)
     */
    @Column(name = "absorbed_amount", nullable = false, precision = 28, scale = 18)
    private BigDecimal absorbedAmount;

    @Column(name = "token_type", nullable = false, length = 32)
    private TokenType tokenType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
