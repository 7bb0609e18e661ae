package dustin.referral.shared.exception;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 * 
 * 응답 형식:
 * {"error": "ALREADY_REFERRED", "message": "User already has a referrer"}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, String>> handleLedgerException(LedgerException e) {
        LedgerErrorCode code = e.getErrorCode();
        if (code == LedgerErrorCode.TRANSACTION_FAILED) {
            log.error("[GlobalExceptionHandler] 트랜잭션 실패: {}", e.getMessage(), e);
        } else {
            log.debug("[GlobalExceptionHandler] 요청 거부: code={}, message={}", code, e.getMessage());
        }
        return ResponseEntity.status(code.getStatus()).body(body(code.name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(LedgerErrorCode.INVALID_INPUT.name(), message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(LedgerErrorCode.INVALID_INPUT.name(), "Malformed request body"));
    }

    private Map<String, String> body(String code, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", code);
        error.put("message", message);
        return error;
    }
}
