package dustin.referral.domains.earnings.model.dto;

import java.util.Locale;

import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;

/**
 * 수익 내역 필터
 */
public enum EarningsType {
    ALL,
    COMMISSION,
    CASHBACK;

    /**
     * 대소문자 무관 변환 (null 또는 빈 값은 ALL)
     * 
     * @throws LedgerException INVALID_INPUT
     */
    public static EarningsType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Unsupported earnings type: " + value, e);
        }
    }
}
