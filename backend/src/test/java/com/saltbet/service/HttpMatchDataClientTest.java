package com.saltbet.service;

import com.saltbet.config.SaltbetProperties;
import com.saltbet.web.MatchDataUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpMatchDataClientTest {

    private static final String BASE_URL = "http://match-data.test/api";

    private MockRestServiceServer server;
    private HttpMatchDataClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpMatchDataClient(builder.build(), new SaltbetProperties());
    }

    @Test
    void currentBoutIsBuiltFromFighterInfoAndFreshnessToken() {
        server.expect(requestTo(BASE_URL + "/current_match_info/"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {
                          "fighter_blue_info": {"id": 11, "name": "Blue Fighter"},
                          "fighter_red_info": {"id": 22, "name": "Red Fighter"},
                          "updated_at": "2026-10-19T20:00:00Z",
                          "status": "open"
                        }
                        """, MediaType.APPLICATION_JSON));

        MatchDataClient.CurrentBout bout = client.getCurrentBout();

        assertEquals(11L, bout.fighterBlueId());
        assertEquals(22L, bout.fighterRedId());
        assertEquals("2026-10-19T20:00:00Z", bout.freshnessToken());
        server.verify();
    }

    @Test
    void currentBoutWithoutFighterInfoIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/current_match_info/"))
                .andRespond(withSuccess("""
                        {"fighter_blue_info": null, "fighter_red_info": null, "updated_at": "x"}
                        """, MediaType.APPLICATION_JSON));

        assertThrows(MatchDataUnavailableException.class, () -> client.getCurrentBout());
    }

    @Test
    void boutIsMappedFromSnakeCasePayload() {
        server.expect(requestTo(BASE_URL + "/match/42/"))
                .andRespond(withSuccess("""
                        {"id": 42, "date": "2026-10-19", "fighter_blue": 11, "fighter_red": 22, "winner": 22, "bet_count": 7}
                        """, MediaType.APPLICATION_JSON));

        Optional<MatchDataClient.ExternalBout> bout = client.getBout(42);

        assertEquals(Optional.of(new MatchDataClient.ExternalBout(42, 11, 22, 22, "2026-10-19")), bout);
    }

    @Test
    void boutWithoutWinnerIsNotConcludedYet() {
        server.expect(requestTo(BASE_URL + "/match/45/"))
                .andRespond(withSuccess("""
                        {"id": 45, "date": "2026-10-19", "fighter_blue": 11, "fighter_red": 22, "winner": null}
                        """, MediaType.APPLICATION_JSON));

        assertTrue(client.getBout(45).isEmpty());
    }

    @Test
    void mostRecentBoutSkipsEntriesWithoutWinner() {
        server.expect(requestTo(BASE_URL + "/match/?page_size=1&page=0"))
                .andRespond(withSuccess("""
                        {"count": 2, "results": [{"id": 1, "date": "a", "fighter_blue": 1, "fighter_red": 2, "winner": 1}]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/match/?page_size=100&page=0"))
                .andRespond(withSuccess("""
                        {"count": 2, "results": [
                          {"id": 1, "date": "a", "fighter_blue": 1, "fighter_red": 2, "winner": 1},
                          {"id": 2, "date": "b", "fighter_blue": 3, "fighter_red": 4}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        assertEquals(Optional.of(new MatchDataClient.ExternalBout(1, 1, 2, 1, "a")), client.getMostRecentBout());
        server.verify();
    }

    @Test
    void unknownBoutIsEmpty() {
        server.expect(requestTo(BASE_URL + "/match/43/"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(client.getBout(43).isEmpty());
    }

    @Test
    void serverErrorOnBoutIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/match/44/"))
                .andRespond(withServerError());

        assertThrows(MatchDataUnavailableException.class, () -> client.getBout(44));
    }

    @Test
    void mostRecentBoutIsLastEntryOfLastPage() {
        server.expect(requestTo(BASE_URL + "/match/?page_size=1&page=0"))
                .andRespond(withSuccess("""
                        {"count": 250, "results": [{"id": 1, "date": "a", "fighter_blue": 1, "fighter_red": 2, "winner": 1}]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/match/?page_size=100&page=2"))
                .andRespond(withSuccess("""
                        {"count": 250, "results": [
                          {"id": 249, "date": "b", "fighter_blue": 3, "fighter_red": 4, "winner": 3},
                          {"id": 250, "date": "c", "fighter_blue": 5, "fighter_red": 6, "winner": 6}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        Optional<MatchDataClient.ExternalBout> bout = client.getMostRecentBout();

        assertEquals(Optional.of(new MatchDataClient.ExternalBout(250, 5, 6, 6, "c")), bout);
        server.verify();
    }

    @Test
    void emptyHistoryHasNoMostRecentBout() {
        server.expect(requestTo(BASE_URL + "/match/?page_size=1&page=0"))
                .andRespond(withSuccess("""
                        {"count": 0, "results": []}
                        """, MediaType.APPLICATION_JSON));

        assertTrue(client.getMostRecentBout().isEmpty());
    }

    @Test
    void fighterDetailsAreMapped() {
        server.expect(requestTo(BASE_URL + "/fighter/11/"))
                .andRespond(withSuccess("""
                        {"id": 11, "name": "Blue Fighter", "tier": "A", "elo": 1500, "tier_elo": 1550, "best_streak": 9}
                        """, MediaType.APPLICATION_JSON));

        MatchDataClient.Fighter fighter = client.getFighter(11);

        assertEquals(new MatchDataClient.Fighter(11, "Blue Fighter", "A", 1500, 1550, 9), fighter);
    }
}
