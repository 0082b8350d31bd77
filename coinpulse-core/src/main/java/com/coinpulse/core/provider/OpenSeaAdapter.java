package com.coinpulse.core.provider;

import com.coinpulse.core.http.FetchOutcome;
import com.coinpulse.core.http.HttpFetcher;
import com.coinpulse.core.model.NftAsset;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * NFTs held by a wallet.
 *
 * API Endpoint: GET /chain/{chain}/account/{address}/nfts (X-API-KEY header required)
 * Without an API key the adapter logs a warning and returns nothing.
 */
public class OpenSeaAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenSeaAdapter.class);

    private final HttpFetcher fetcher;
    private final String baseUrl;
    private final String apiKey;

    public OpenSeaAdapter(HttpFetcher fetcher, String baseUrl, String apiKey) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey != null ? apiKey : "";
    }

    public boolean isConfigured() {
        return !apiKey.isBlank();
    }

    public FetchOutcome<List<NftAsset>> nftsByWallet(String walletAddress, String chain) {
        if (!isConfigured()) {
            log.warn("OpenSea API key missing. Set OPENSEA_API_KEY.");
            return FetchOutcome.empty(List.of(), "api key missing");
        }
        if (walletAddress == null || walletAddress.isBlank() || chain == null || chain.isBlank()) {
            return FetchOutcome.empty(List.of(), "wallet address and chain required");
        }

        String url = String.format("%s/chain/%s/account/%s/nfts",
            baseUrl, pathSegment(chain), pathSegment(walletAddress));
        FetchOutcome<JsonNode> response = fetcher.fetchJson(url, Map.of(), Map.of("X-API-KEY", apiKey));

        List<NftAsset> nfts = new ArrayList<>();
        for (JsonNode nft : response.value().path("nfts")) {
            nfts.add(new NftAsset(
                JsonFields.text(nft, "identifier"),
                JsonFields.text(nft, "collection"),
                JsonFields.text(nft, "contract"),
                JsonFields.text(nft, "token_standard"),
                JsonFields.text(nft, "name"),
                JsonFields.text(nft, "description"),
                JsonFields.text(nft, "image_url"),
                JsonFields.text(nft, "opensea_url")
            ));
        }

        log.debug("Wallet {} on {}: {} NFTs", walletAddress, chain, nfts.size());
        if (!response.hasData()) {
            return FetchOutcome.empty(List.of(), response.detail());
        }
        // An empty wallet is a real answer
        return FetchOutcome.data(List.copyOf(nfts));
    }

    private static String pathSegment(String value) {
        return URLEncoder.encode(value.trim(), StandardCharsets.UTF_8).replace("+", "%20");
    }
}
