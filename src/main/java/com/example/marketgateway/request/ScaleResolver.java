package com.example.marketgateway.request;

import com.example.marketgateway.config.GatewayProperties;
import com.example.marketgateway.domain.Scale;
import com.example.marketgateway.error.GatewayException;
import org.springframework.stereotype.Component;

/**
 * scale 토큰 해석
 * - 빈 값: 설정된 기본 버킷
 * - 그 외: 5m 30m 1h 4h 1d 1w 중 정확히 일치해야 함
 */
@Component
public class ScaleResolver {

    private final Scale defaultScale;

    public ScaleResolver(GatewayProperties properties) {
        String token = properties.getChart().getDefaultScale();
        this.defaultScale = Scale.fromToken(token)
                .orElseThrow(() -> new IllegalStateException(
                        "gateway.chart.default-scale must be one of " + Scale.tokens() + " but was '" + token + "'"));
    }

    public Scale resolve(String rawScale) {
        if (rawScale == null || rawScale.isEmpty()) {
            return defaultScale;
        }
        return Scale.fromToken(rawScale)
                .orElseThrow(() -> GatewayException.validation(
                        "Unsupported scale '" + rawScale + "', expected one of " + Scale.tokens()));
    }
}
