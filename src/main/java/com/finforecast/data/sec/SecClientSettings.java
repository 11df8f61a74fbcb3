package com.finforecast.data.sec;

import com.finforecast.config.Config;

/**
 * Connection settings for the SEC company-facts endpoints. {@code companyFactsUrl} is a format
 * string taking the zero-padded CIK.
 */
public final class SecClientSettings {
    public final String userAgent;
    public final String tickerMapUrl;
    public final String companyFactsUrl;
    public final int timeoutSec;

    public SecClientSettings(String userAgent, String tickerMapUrl, String companyFactsUrl, int timeoutSec) {
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("SEC requests need a User-Agent");
        }
        if (companyFactsUrl == null || !companyFactsUrl.contains("%s")) {
            throw new IllegalArgumentException("company facts url must contain %s for the CIK: " + companyFactsUrl);
        }
        this.userAgent = userAgent.trim();
        this.tickerMapUrl = tickerMapUrl;
        this.companyFactsUrl = companyFactsUrl;
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    public static SecClientSettings fromConfig(Config config) {
        return new SecClientSettings(
                config.getString("sec.user_agent"),
                config.getString("sec.ticker_map_url"),
                config.getString("sec.company_facts_url"),
                config.getInt("sec.timeout_sec", 30)
        );
    }

    public String companyFactsUrl(String cik) {
        return String.format(companyFactsUrl, cik);
    }
}
