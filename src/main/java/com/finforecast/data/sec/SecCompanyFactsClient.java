package com.finforecast.data.sec;

import com.finforecast.data.http.HttpClientEx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Downloads company facts from the SEC and turns them into per-year fact documents.
 */
public final class SecCompanyFactsClient {
    private static final Logger LOG = LogManager.getLogger(SecCompanyFactsClient.class);

    private final SecClientSettings settings;
    private final HttpClientEx http;
    private final CompanyFactsConverter converter;

    public SecCompanyFactsClient(SecClientSettings settings) {
        this(settings, new HttpClientEx(settings.userAgent), new CompanyFactsConverter());
    }

    public SecCompanyFactsClient(SecClientSettings settings, HttpClientEx http, CompanyFactsConverter converter) {
        this.settings = settings;
        this.http = http;
        this.converter = converter;
    }

    /**
     * Ten-digit zero-padded CIK for a ticker, e.g. {@code AAPL -> 0000320193}.
     */
    public String lookupCik(String ticker) throws IOException, InterruptedException {
        String wanted = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (wanted.isEmpty()) {
            throw new IllegalArgumentException("ticker is empty");
        }
        JSONObject mapping = parse(http.getText(settings.tickerMapUrl, settings.timeoutSec), settings.tickerMapUrl);
        for (String key : mapping.keySet()) {
            JSONObject entry = mapping.optJSONObject(key);
            if (entry == null) {
                continue;
            }
            if (wanted.equals(entry.optString("ticker").toUpperCase(Locale.ROOT))) {
                return String.format(Locale.ROOT, "%010d", entry.getLong("cik_str"));
            }
        }
        throw new IllegalArgumentException("ticker '" + wanted + "' not found in SEC mapping");
    }

    public JSONObject fetchCompanyFacts(String cik) throws IOException, InterruptedException {
        String url = settings.companyFactsUrl(cik);
        LOG.info("downloading company facts cik={} url={}", cik, url);
        return parse(http.getText(url, settings.timeoutSec), url);
    }

    /**
     * One fact document per requested year; years without any 10-K fact are left out.
     */
    public Map<Integer, JSONObject> download(String ticker, List<Integer> years) throws IOException, InterruptedException {
        String cik = lookupCik(ticker);
        JSONObject companyFacts = fetchCompanyFacts(cik);
        Map<Integer, JSONObject> out = new LinkedHashMap<>();
        for (Integer year : years) {
            JSONObject doc = converter.toFactDocument(companyFacts, year);
            if (doc.isEmpty()) {
                LOG.warn("no 10-K facts ticker={} year={}", ticker, year);
                continue;
            }
            out.put(year, doc);
        }
        return out;
    }

    public List<Integer> availableYears(String ticker) throws IOException, InterruptedException {
        return converter.availableYears(fetchCompanyFacts(lookupCik(ticker)));
    }

    private static JSONObject parse(String body, String url) throws IOException {
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new IOException("invalid JSON from " + url + ": " + e.getMessage(), e);
        }
    }
}
