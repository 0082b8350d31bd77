package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.model.CoinMarket;
import com.coinpulse.core.model.PriceQuote;
import com.coinpulse.core.model.SearchResults;
import com.coinpulse.core.model.SortOrder;
import com.coinpulse.core.model.TrendingCoin;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoinGeckoAdapterTest {

    private ProviderServer upstream;
    private CoinGeckoAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        upstream = new ProviderServer();
        adapter = new CoinGeckoAdapter(upstream.fetcher, upstream.baseUrl("/coingecko"));
    }

    @AfterEach
    void tearDown() throws IOException {
        upstream.close();
    }

    @Nested
    @DisplayName("Trending")
    class TrendingTests {

        @Test
        @DisplayName("Should unwrap coins[].item entries")
        void parsesTrending() throws InterruptedException {
            upstream.server.enqueue(new MockResponse().setBody("""
                {"coins":[
                  {"item":{"id":"pepe","name":"Pepe","symbol":"PEPE","market_cap_rank":30,"thumb":"t.png","score":0,"price_btc":1.5E-10}},
                  {"item":{"id":"kaspa","name":"Kaspa","symbol":"KAS","market_cap_rank":null,"score":1}}
                ]}"""));

            FetchOutcome<List<TrendingCoin>> outcome = adapter.trending();

            assertEquals(FetchOutcome.Status.DATA, outcome.status());
            assertEquals(2, outcome.value().size());
            TrendingCoin pepe = outcome.value().get(0);
            assertEquals("pepe", pepe.id());
            assertEquals(30, pepe.marketCapRank());
            assertEquals(1.5E-10, pepe.priceBtc());
            assertNull(outcome.value().get(1).marketCapRank());
            assertEquals("/coingecko/search/trending", upstream.server.takeRequest().getPath());
        }

        @Test
        @DisplayName("Should be EMPTY when the upstream keeps failing")
        void emptyOnFailure() {
            for (int i = 0; i < 3; i++) {
                upstream.server.enqueue(new MockResponse().setResponseCode(500));
            }

            FetchOutcome<List<TrendingCoin>> outcome = adapter.trending();

            assertEquals(FetchOutcome.Status.EMPTY, outcome.status());
            assertTrue(outcome.value().isEmpty());
        }
    }

    @Nested
    @DisplayName("Markets")
    class MarketsTests {

        @Test
        @DisplayName("Should pass paging and sort order upstream without re-sorting")
        void passesOrder() throws InterruptedException {
            upstream.server.enqueue(new MockResponse().setBody("""
                [{"id":"tether","symbol":"usdt","name":"Tether","current_price":1.0,"total_volume":9.0E10,"market_cap_rank":3},
                 {"id":"bitcoin","symbol":"btc","name":"Bitcoin","current_price":64000.5,"total_volume":3.0E10,"market_cap_rank":1,
                  "price_change_percentage_7d_in_currency":2.5}]"""));

            List<CoinMarket> coins = adapter.markets(500, 2, SortOrder.VOLUME_DESC).value();

            assertEquals(List.of("tether", "bitcoin"), coins.stream().map(CoinMarket::id).toList());
            assertEquals(2.5, coins.get(1).priceChangePercentage7d());

            RecordedRequest request = upstream.server.takeRequest();
            assertEquals("volume_desc", request.getRequestUrl().queryParameter("order"));
            assertEquals("250", request.getRequestUrl().queryParameter("per_page"));
            assertEquals("2", request.getRequestUrl().queryParameter("page"));
            assertEquals("usd", request.getRequestUrl().queryParameter("vs_currency"));
        }

        @Test
        @DisplayName("Should reject non-positive paging without a request")
        void rejectsBadPaging() {
            assertEquals(FetchOutcome.Status.EMPTY, adapter.markets(0, 1, SortOrder.MARKET_CAP_DESC).status());
            assertEquals(FetchOutcome.Status.EMPTY, adapter.markets(10, 0, SortOrder.MARKET_CAP_DESC).status());
            assertEquals(0, upstream.server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("Should split coins, exchanges and categories")
        void parsesSearch() {
            upstream.server.enqueue(new MockResponse().setBody("""
                {"coins":[{"id":"solana","name":"Solana","symbol":"SOL","market_cap_rank":5,"thumb":"s.png"}],
                 "exchanges":[{"id":"binance","name":"Binance","thumb":"b.png"}],
                 "categories":[{"id":1,"name":"Layer 1"}]}"""));

            SearchResults results = adapter.search(" sol ").value();

            assertEquals("solana", results.coins().get(0).id());
            assertEquals("binance", results.exchanges().get(0).id());
            assertEquals(List.of("Layer 1"), results.categories());
        }

        @Test
        @DisplayName("Should treat an answered search with no matches as data")
        void noMatchesIsData() {
            upstream.server.enqueue(new MockResponse().setBody("{\"coins\":[],\"exchanges\":[],\"categories\":[]}"));

            FetchOutcome<SearchResults> outcome = adapter.search("zzzz");

            assertEquals(FetchOutcome.Status.DATA, outcome.status());
            assertTrue(outcome.value().isEmpty());
        }
    }

    @Nested
    @DisplayName("Simple prices")
    class PriceTests {

        @Test
        @DisplayName("Should return exactly the coins the upstream priced")
        void skipsMissingCoins() throws InterruptedException {
            upstream.server.enqueue(new MockResponse().setBody("""
                {"bitcoin":{"eur":58000.0,"eur_24h_change":-1.2,"eur_market_cap":1.1E12,"eur_24h_vol":2.0E10},
                 "ethereum":{}}"""));

            Map<String, PriceQuote> quotes = adapter.simplePrices(List.of("bitcoin", "ethereum", "nosuchcoin"), "EUR").value();

            assertEquals(1, quotes.size());
            PriceQuote btc = quotes.get("bitcoin");
            assertEquals("eur", btc.currency());
            assertEquals(58000.0, btc.value());
            assertEquals(-1.2, btc.change24h());

            RecordedRequest request = upstream.server.takeRequest();
            assertEquals("bitcoin,ethereum,nosuchcoin", request.getRequestUrl().queryParameter("ids"));
            assertEquals("eur", request.getRequestUrl().queryParameter("vs_currencies"));
        }

        @Test
        @DisplayName("Should skip a coin whose price is not a finite number")
        void skipsNonFinitePrice() {
            upstream.server.enqueue(new MockResponse().setBody("""
                {"bitcoin":{"usd":"NaN"},"ethereum":{"usd":"Infinity"},"solana":{"usd":"150.25"}}"""));

            Map<String, PriceQuote> quotes =
                adapter.simplePrices(List.of("bitcoin", "ethereum", "solana"), "usd").value();

            assertEquals(List.of("solana"), List.copyOf(quotes.keySet()));
            assertEquals(150.25, quotes.get("solana").value());
        }

        @Test
        @DisplayName("Should be EMPTY when nothing was priced")
        void emptyWhenNothingPriced() {
            upstream.server.enqueue(new MockResponse().setBody("{}"));

            assertEquals(FetchOutcome.Status.EMPTY, adapter.simplePrices(List.of("nosuchcoin"), "usd").status());
        }
    }
}
