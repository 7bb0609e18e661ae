package dustin.referral.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 정산 토큰 종류
 * Settlement token type
 * 
 * 원장은 토큰 종류를 파티션 키로만 사용합니다.
 * 토큰 간 환산은 하지 않습니다.
 */
@Getter
@RequiredArgsConstructor
public enum TokenType {

    USDC_ARBITRUM("USDC-ARBITRUM"),
    USDC_SOLANA("USDC-SOLANA");

    /**
     * 외부 표기 코드 (API, Kafka, DB 저장 값)
     */
    @JsonValue
    private final String code;

    /**
     * 코드로 토큰 종류 조회
     * 
     * @param code 예: "USDC-ARBITRUM"
     * @throws LedgerException INVALID_INPUT (지원하지 않는 코드)
     */
    @JsonCreator
    public static TokenType fromCode(String code) {
        if (code != null) {
            for (TokenType type : values()) {
                if (type.code.equalsIgnoreCase(code.trim())) {
                    return type;
                }
            }
        }
        throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Unsupported token type: " + code);
    }
}
