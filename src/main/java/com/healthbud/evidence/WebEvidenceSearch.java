package com.healthbud.evidence;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Web search restricted to trusted medical domains.
 * Fetches the DuckDuckGo HTML results page and scrapes it with jsoup.
 */
public class WebEvidenceSearch implements EvidenceSearch {

    private static final Logger log = LoggerFactory.getLogger(WebEvidenceSearch.class);

    public static final HttpUrl DEFAULT_ENDPOINT = HttpUrl.get("https://html.duckduckgo.com/html/");

    private final OkHttpClient httpClient;
    private final HttpUrl endpoint;
    private final boolean enabled;
    private final int maxResults;
    private final List<String> trustedDomains;

    public WebEvidenceSearch(OkHttpClient baseClient, boolean enabled, int maxResults, List<String> trustedDomains) {
        this(baseClient, DEFAULT_ENDPOINT, enabled, maxResults, trustedDomains);
    }

    public WebEvidenceSearch(OkHttpClient baseClient, HttpUrl endpoint, boolean enabled, int maxResults,
                             List<String> trustedDomains) {
        this.httpClient = baseClient.newBuilder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .callTimeout(20, TimeUnit.SECONDS)
            .followRedirects(true)
            .build();
        this.endpoint = endpoint;
        this.enabled = enabled;
        this.maxResults = maxResults;
        this.trustedDomains = trustedDomains.stream()
            .map(d -> d.trim().toLowerCase(Locale.ROOT))
            .filter(d -> !d.isEmpty())
            .collect(Collectors.toList());
    }

    @Override
    public List<EvidenceSource> search(String query) {
        if (!enabled || maxResults <= 0 || query == null || query.isBlank()) {
            return List.of();
        }

        Request request = new Request.Builder()
            .url(endpoint.newBuilder().addQueryParameter("q", query).build())
            .header("User-Agent", "Mozilla/5.0 (HealthBud-Triage)")
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.warn("Evidence search returned HTTP {} for '{}'", response.code(), query);
                return List.of();
            }
            return parseResults(body.string());
        } catch (Exception e) {
            log.warn("Evidence search failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    List<EvidenceSource> parseResults(String html) {
        Document doc = Jsoup.parse(html);
        List<EvidenceSource> evidence = new ArrayList<>();

        for (Element result : doc.select(".result")) {
            Element link = result.selectFirst("a.result__a");
            if (link == null) {
                continue;
            }
            String url = resolveUrl(link.attr("href"));
            if (url == null || !isTrusted(url)) {
                continue;
            }
            String title = link.text().trim();
            if (title.isEmpty()) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            evidence.add(new EvidenceSource(title, url, snippet != null ? snippet.text().trim() : ""));

            if (evidence.size() >= maxResults) {
                break;
            }
        }
        return evidence;
    }

    /**
     * Unwraps DuckDuckGo redirect links ({@code //duckduckgo.com/l/?uddg=...}).
     */
    static String resolveUrl(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String absolute = href.startsWith("//") ? "https:" + href : href;
        HttpUrl parsed = HttpUrl.parse(absolute);
        if (parsed == null) {
            return null;
        }
        String target = parsed.queryParameter("uddg");
        return target != null ? target : parsed.toString();
    }

    boolean isTrusted(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            return false;
        }
        String host = parsed.host().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        for (String domain : trustedDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
