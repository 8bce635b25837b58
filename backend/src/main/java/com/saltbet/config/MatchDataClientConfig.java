package com.saltbet.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(
        prefix = "saltbet.match-data",
        name = "mode",
        havingValue = "http",
        matchIfMissing = true
)
public class MatchDataClientConfig {

    @Bean
    RestClient matchDataRestClient(RestClient.Builder builder, SaltbetProperties saltbetProperties) {
        SaltbetProperties.MatchData matchData = saltbetProperties.getMatchData();
        if (matchData.getBaseUrl() == null || matchData.getBaseUrl().isBlank()) {
            throw new IllegalStateException("saltbet.match-data.base-url must not be blank");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(matchData.getConnectTimeoutMs());
        requestFactory.setReadTimeout(matchData.getReadTimeoutMs());
        return builder
                .baseUrl(matchData.getBaseUrl().trim())
                .requestFactory(requestFactory)
                .build();
    }
}
