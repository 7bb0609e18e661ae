package dustin.referral.shared.decimal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

import dustin.referral.shared.exception.LedgerErrorCode;
import dustin.referral.shared.exception.LedgerException;

/**
 * 정밀 소수 연산 유틸리티
 * Exact Decimal Arithmetic
 *
 * 역할:
 * - 모든 금액 계산의 기반 (부동소수점 사용 금지)
 * - 유효숫자 28자리, 소수점 이하 18자리 고정
 * - 절사 모드: ROUND_DOWN (0 방향) - 어떤 구현에서도 동일한 결과 재현
 *
 * 저장 형식:
 * - DB 컬럼: numeric(28, 18)
 * - 문자열: 소수점 이하 정확히 18자리 (예: "10.000000000000000000")
 *
 * 예시:
 * - 33.33 × 0.03 = 0.9999
 * - 0.000000000000000001 × 0.3 = 0 (18자리 이하 절사)
 */
public final class DecimalMath {

    /**
     * 소수점 이하 자릿수
     */
    public static final int SCALE = 18;

    /**
     * 전체 유효숫자 자릿수
     */
    public static final int PRECISION = 28;

    /**
     * 정수부 최대 자릿수 (numeric(28, 18) → 10자리)
     */
    public static final int MAX_INTEGER_DIGITS = PRECISION - SCALE;

    public static final RoundingMode ROUNDING = RoundingMode.DOWN;

    public static final MathContext CONTEXT = new MathContext(PRECISION, ROUNDING);

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    private DecimalMath() {
    }

    /**
     * 문자열을 금액으로 변환
     * Parse a plain decimal string
     *
     * 허용 형식: "1000", "0.01", "50.75" (부호, 지수 표기 불가)
     *
     * @param value 소수 문자열
     * @return 스케일 18로 절사된 값
     * @throws LedgerException INVALID_INPUT (형식 오류 또는 범위 초과)
     */
    public static BigDecimal parse(String value) {
        if (value == null || !PLAIN_DECIMAL.matcher(value.trim()).matches()) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT,
                    "Invalid decimal value: " + value);
        }
        return normalize(new BigDecimal(value.trim()));
    }

    /**
     * 저장 가능한 형태로 정규화 (스케일 18, 절사)
     * Normalize to storage scale, truncating toward zero
     *
     * @throws LedgerException INVALID_INPUT (음수 또는 정수부 10자리 초과)
     */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT, "Decimal value is required");
        }
        if (value.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT,
                    "Negative amounts are not allowed: " + value.toPlainString());
        }
        BigDecimal scaled = value.setScale(SCALE, ROUNDING);
        if (scaled.precision() - scaled.scale() > MAX_INTEGER_DIGITS) {
            throw new LedgerException(LedgerErrorCode.INVALID_INPUT,
                    "Amount exceeds supported range: " + value.toPlainString());
        }
        return scaled;
    }

    /**
     * 곱셈 (유효숫자 28자리 절사 후 스케일 18 절사)
     * Multiply with truncation
     */
    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return left.multiply(right, CONTEXT).setScale(SCALE, ROUNDING);
    }

    /**
     * 덧셈 (스케일 18 입력끼리는 항상 정확)
     */
    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return left.add(right).setScale(SCALE, ROUNDING);
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return left.subtract(right).setScale(SCALE, ROUNDING);
    }

    /**
     * 여러 값 합산
     */
    public static BigDecimal sum(BigDecimal... values) {
        BigDecimal total = ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return total.setScale(SCALE, ROUNDING);
    }

    /**
     * 값 비교 (스케일 무시, "10" == "10.000")
     * Scale-insensitive equality
     */
    public static boolean isEqual(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }

    /**
     * 소수점 이하 18자리 문자열
     * Format with exactly 18 fractional digits
     */
    public static String toPlainString(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING).toPlainString();
    }
}
