package dustin.referral.domains.referral.service;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * 추천 코드 생성기
 * Referral code generator
 * 
 * - 생성: UUID 앞 8자리 (대문자 16진수), 예: "3F9A0C1B"
 * - 정규화: 앞뒤 공백 제거 + 대문자 (대소문자 구분 없음)
 * - 형식: 영문 대문자/숫자 4~20자
 */
@Component
public class ReferralCodeGenerator {

    private static final Pattern CODE_FORMAT = Pattern.compile("^[A-Z0-9]{4,20}$");

    public String generate() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }

    public String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isValidFormat(String normalizedCode) {
        return normalizedCode != null && CODE_FORMAT.matcher(normalizedCode).matches();
    }
}
