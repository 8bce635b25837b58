package com.saltbet.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.saltbet.config.SaltbetProperties;
import com.saltbet.web.MatchDataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link MatchDataClient} over the public bout-tracking HTTP API.
 */
@Service
@ConditionalOnProperty(
        prefix = "saltbet.match-data",
        name = "mode",
        havingValue = "http",
        matchIfMissing = true
)
public class HttpMatchDataClient implements MatchDataClient {

    private static final Logger log = LoggerFactory.getLogger(HttpMatchDataClient.class);

    private final RestClient matchDataRestClient;
    private final SaltbetProperties saltbetProperties;

    public HttpMatchDataClient(RestClient matchDataRestClient, SaltbetProperties saltbetProperties) {
        this.matchDataRestClient = matchDataRestClient;
        this.saltbetProperties = saltbetProperties;
    }

    @Override
    public CurrentBout getCurrentBout() {
        CurrentMatchInfo info = fetch("current bout", () -> matchDataRestClient.get()
                .uri("/current_match_info/")
                .retrieve()
                .body(CurrentMatchInfo.class));
        if (info == null || info.fighterBlueInfo() == null || info.fighterRedInfo() == null) {
            log.error("Current bout is missing fighter info, most likely an exhibition match");
            throw new MatchDataUnavailableException(
                    "Current bout data is missing fighter information. The bout may be an exhibition match."
            );
        }
        return new CurrentBout(info.fighterBlueInfo().id(), info.fighterRedInfo().id(), info.updatedAt());
    }

    @Override
    public Optional<ExternalBout> getBout(long boutId) {
        try {
            BoutPayload payload = matchDataRestClient.get()
                    .uri("/match/{id}/", boutId)
                    .retrieve()
                    .body(BoutPayload.class);
            if (payload == null || payload.winner() == null) {
                log.debug("Bout {} has no result yet", boutId);
                return Optional.empty();
            }
            return Optional.of(payload.toExternalBout());
        } catch (HttpClientErrorException.NotFound ex) {
            log.debug("Bout {} is not recorded yet", boutId);
            return Optional.empty();
        } catch (RestClientException ex) {
            throw new MatchDataUnavailableException("Failed to fetch bout " + boutId, ex);
        }
    }

    @Override
    public Optional<ExternalBout> getMostRecentBout() {
        BoutPage countPage = fetch("bout count", () -> matchDataRestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/match/")
                        .queryParam("page_size", 1)
                        .queryParam("page", 0)
                        .build())
                .retrieve()
                .body(BoutPage.class));
        if (countPage == null || countPage.count() <= 0) {
            log.warn("Match data source has no recorded bouts");
            return Optional.empty();
        }

        int pageSize = resolvePageSize();
        long lastPage = (countPage.count() + pageSize - 1) / pageSize;
        BoutPage page = fetch("last bout page", () -> matchDataRestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/match/")
                        .queryParam("page_size", pageSize)
                        .queryParam("page", lastPage - 1)
                        .build())
                .retrieve()
                .body(BoutPage.class));
        if (page == null || page.results() == null || page.results().isEmpty()) {
            log.warn("Last page of bouts came back empty");
            return Optional.empty();
        }
        List<BoutPayload> results = page.results();
        for (int i = results.size() - 1; i >= 0; i--) {
            BoutPayload payload = results.get(i);
            if (payload != null && payload.winner() != null) {
                return Optional.of(payload.toExternalBout());
            }
        }
        log.warn("No concluded bout on the last page of bouts");
        return Optional.empty();
    }

    @Override
    public Fighter getFighter(long fighterId) {
        FighterPayload payload = fetch("fighter " + fighterId, () -> matchDataRestClient.get()
                .uri("/fighter/{id}/", fighterId)
                .retrieve()
                .body(FighterPayload.class));
        if (payload == null) {
            throw new MatchDataUnavailableException("Empty fighter response for " + fighterId);
        }
        return new Fighter(
                payload.id(),
                payload.name(),
                payload.tier(),
                payload.elo(),
                payload.tierElo(),
                payload.bestStreak()
        );
    }

    private int resolvePageSize() {
        int pageSize = saltbetProperties.getMatchData().getPageSize();
        if (pageSize <= 0) {
            throw new IllegalStateException("saltbet.match-data.page-size must be greater than zero");
        }
        return pageSize;
    }

    private <T> T fetch(String what, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException ex) {
            log.warn("Failed to fetch {} from match data source: {}", what, ex.getMessage());
            throw new MatchDataUnavailableException("Failed to fetch " + what + " from match data source", ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CurrentMatchInfo(
            @JsonProperty("fighter_blue_info") FighterPayload fighterBlueInfo,
            @JsonProperty("fighter_red_info") FighterPayload fighterRedInfo,
            @JsonProperty("updated_at") String updatedAt
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BoutPayload(
            long id,
            String date,
            @JsonProperty("fighter_blue") long fighterBlue,
            @JsonProperty("fighter_red") long fighterRed,
            Long winner
    ) {
        ExternalBout toExternalBout() {
            return new ExternalBout(id, fighterBlue, fighterRed, winner, date);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BoutPage(
            long count,
            List<BoutPayload> results
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FighterPayload(
            long id,
            String name,
            String tier,
            Integer elo,
            @JsonProperty("tier_elo") Integer tierElo,
            @JsonProperty("best_streak") Integer bestStreak
    ) {}
}
