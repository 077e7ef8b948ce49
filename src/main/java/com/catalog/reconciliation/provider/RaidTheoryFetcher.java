package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * RaidTheory: item files in a GitHub repository. The version is the sha of the latest
 * commit on the branch; the directory listing yields one download URL per item file,
 * fetched with bounded concurrency.
 */
public class RaidTheoryFetcher extends AbstractProviderFetcher {

    static final String GITHUB_API = "https://api.github.com";

    private final String apiBase;
    private final String owner;
    private final String repo;
    private final String branch;
    private final String itemsPath;
    private final int concurrency;
    private final int maxItems;

    public RaidTheoryFetcher(JsonHttpClient http, String owner, String repo, String branch, String itemsPath,
                             int concurrency, int maxItems) {
        this(http, GITHUB_API, owner, repo, branch, itemsPath, concurrency, maxItems, Clock.systemUTC());
    }

    public RaidTheoryFetcher(JsonHttpClient http, String apiBase, String owner, String repo, String branch,
                             String itemsPath, int concurrency, int maxItems, Clock clock) {
        super(Provider.RAIDTHEORY, http, clock);
        this.apiBase = apiBase;
        this.owner = owner;
        this.repo = repo;
        this.branch = branch;
        this.itemsPath = itemsPath;
        this.concurrency = concurrency;
        this.maxItems = maxItems;
    }

    @Override
    protected FetchResult fetch(String fetchedAt) {
        String repoBase = apiBase + "/repos/" + owner + "/" + repo;
        String ref = URLEncoder.encode(branch, StandardCharsets.UTF_8);

        JsonNode commits = http.getJson(repoBase + "/commits?sha=" + ref + "&per_page=1");
        String sha = commits.path(0).path("sha").asText("");
        String version = sha.isEmpty() ? FetchResult.UNKNOWN_VERSION : sha;

        JsonNode listing = http.getJson(repoBase + "/contents/" + itemsPath + "?ref=" + ref);
        if (!listing.isArray()) {
            String message = listing.path("message").asText("");
            throw new ProviderFetchException(Provider.RAIDTHEORY,
                    message.isEmpty() ? "Unable to fetch RaidTheory items listing" : message);
        }

        List<String> fileUrls = new ArrayList<>();
        for (JsonNode entry : listing) {
            String downloadUrl = entry.path("download_url").asText("");
            if ("file".equals(entry.path("type").asText()) && !downloadUrl.isEmpty()) {
                fileUrls.add(downloadUrl);
            }
        }
        if (maxItems > 0 && fileUrls.size() > maxItems) {
            fileUrls = fileUrls.subList(0, maxItems);
        }

        List<JsonNode> items = BoundedParallelism.map(fileUrls, concurrency, http::getJson);
        return new FetchResult(Provider.RAIDTHEORY, fetchedAt, version, items);
    }
}
