package com.example.marketgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private Supply supply = new Supply();

    private Chart chart = new Chart();

    private Tokens tokens = new Tokens();

    @Data
    public static class Supply {

        /**
         * source 미입력 시 기본 출처
         */
        private String defaultSource = "diadata.org";
    }

    @Data
    public static class Chart {

        /**
         * scale 미입력 시 기본 시간 버킷 (5m 30m 1h 4h 1d 1w 중 하나)
         */
        private String defaultScale = "5m";

        /**
         * 차트 조회당 최대 포인트 수 (최신 순으로 자름)
         */
        private int maxPoints = 1000;
    }

    @Data
    public static class Tokens {

        /**
         * true면 참조 DB 장애 시 빈 결과(count=0)로 200 응답
         */
        private boolean degradeOnFailure = false;
    }
}
