package dustin.referral.shared.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * TokenType ↔ DB 문자열 변환 ("USDC-ARBITRUM")
 */
@Converter(autoApply = true)
public class TokenTypeConverter implements AttributeConverter<TokenType, String> {

    @Override
    public String convertToDatabaseColumn(TokenType attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public TokenType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TokenType.fromCode(dbData);
    }
}
