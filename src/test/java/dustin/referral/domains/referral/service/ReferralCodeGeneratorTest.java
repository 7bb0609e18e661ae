package dustin.referral.domains.referral.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReferralCodeGeneratorTest {

    private final ReferralCodeGenerator generator = new ReferralCodeGenerator();

    @Test
    @DisplayName("8자리 대문자 코드 발급")
    void generatesEightCharacterCodes() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            String code = generator.generate();
            assertThat(code).hasSize(8).matches("[A-Z0-9]{8}");
            codes.add(code);
        }
        assertThat(codes.size()).isGreaterThan(190);
    }

    @Test
    @DisplayName("정규화: 앞뒤 공백 제거, 대문자 변환")
    void normalizesInput() {
        assertThat(generator.normalize("  ab12cd34 ")).isEqualTo("AB12CD34");
        assertThat(generator.normalize(null)).isNull();
    }

    @Test
    @DisplayName("형식 검증: 영문 대문자/숫자 4~20자")
    void validatesFormat() {
        assertThat(generator.isValidFormat("AB12")).isTrue();
        assertThat(generator.isValidFormat("ABC")).isFalse();
        assertThat(generator.isValidFormat("AB-12")).isFalse();
        assertThat(generator.isValidFormat("A".repeat(21))).isFalse();
        assertThat(generator.isValidFormat(null)).isFalse();
    }
}
