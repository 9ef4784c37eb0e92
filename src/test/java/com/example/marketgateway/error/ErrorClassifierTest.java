package com.example.marketgateway.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.mock.http.MockHttpInputMessage;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorClassifier 테스트")
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    @DisplayName("NOT_FOUND는 404")
    void notFound() {
        ClassifiedError result = classifier.classify(GatewayException.notFound("Quotation not found: BTC"));

        assertThat(result.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(result.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(result.getMessage()).isEqualTo("Quotation not found: BTC");
    }

    @Test
    @DisplayName("검증 실패는 VALIDATION_ERROR, 상태는 500")
    void validation() {
        ClassifiedError result = classifier.classify(GatewayException.validation("Missing symbol"));

        assertThat(result.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(result.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    @DisplayName("읽을 수 없는 요청 본문은 VALIDATION_ERROR")
    void unreadableBody() {
        HttpMessageNotReadableException error = new HttpMessageNotReadableException(
                "JSON parse error", new MockHttpInputMessage(new byte[0]));

        assertThat(classifier.classify(error).getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("저장소 오류는 INTERNAL_ERROR, 상세 메시지는 숨긴다")
    void backendFailures_areInternalWithoutDetails() {
        ClassifiedError redis = classifier.classify(
                new RedisConnectionFailureException("Unable to connect to 10.0.0.12:6379"));
        ClassifiedError jdbc = classifier.classify(
                new CannotGetJdbcConnectionException("reference-store - Connection is not available"));
        ClassifiedError timeout = classifier.classify(new QueryTimeoutException("Redis command timed out"));

        assertThat(redis.getKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(jdbc.getKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(timeout.getKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(redis.getMessage()).doesNotContain("10.0.0.12");
        assertThat(jdbc.getMessage()).isEqualTo(ErrorClassifier.BACKEND_UNAVAILABLE);
    }

    @Test
    @DisplayName("메시지가 'not found'여도 타입이 다르면 INTERNAL_ERROR")
    void classification_ignoresMessageContent() {
        ClassifiedError result = classifier.classify(new IllegalStateException("not found"));

        assertThat(result.getKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(result.getMessage()).isEqualTo(ErrorClassifier.INTERNAL);
    }

    @Test
    @DisplayName("손상된 저장소 값은 INTERNAL_ERROR")
    void storeDecodeFailure_isInternal() {
        ClassifiedError result = classifier.classify(new StoreException("Cannot decode value at dia_coins", null));

        assertThat(result.getKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
    }
}
