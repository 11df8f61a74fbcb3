package com.finforecast.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered settings: in-code defaults, then {@code config.properties} on the classpath, then a
 * {@code config.properties} in the working directory.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Config with explicit overrides on top of the defaults only; no files are read.
     */
    public static Config of(Path workingDir, Map<String, String> overrides) {
        Config config = new Config(workingDir);
        if (overrides != null) {
            for (Map.Entry<String, String> e : overrides.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) {
                    continue;
                }
                config.overrideProps.setProperty(e.getKey().trim(), e.getValue());
            }
            config.props.putAll(config.overrideProps);
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Optional number: {@code null} when the key is blank or unparseable.
     */
    public Double getOptionalDouble(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return null;
        }
        double parsed = parseDouble(value, Double.NaN);
        return Double.isNaN(parsed) ? null : parsed;
    }

    public Integer getOptionalInt(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Where a key's value came from: {@code override}, {@code resource} or {@code default}.
     */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put("input.dir", "input");
        defaults.put("outputs.dir", "outputs");
        defaults.put("logs.dir", "outputs/logs");

        defaults.put("history.years_back", "5");
        defaults.put("extract.threads", "1");
        defaults.put("projection.threads", "3");

        defaults.put("projection.years", "5");
        defaults.put("projection.growth.bear", "0.02");
        defaults.put("projection.growth.base", "0.05");
        defaults.put("projection.growth.bull", "0.09");
        defaults.put("projection.capex_pct", "0.03");
        defaults.put("projection.share_dilution", "0.01");
        defaults.put("projection.target_net_margin", "");
        defaults.put("projection.years_to_profitability", "");

        defaults.put("valuation.discount_rate", "0.10");
        defaults.put("valuation.terminal_growth", "0.025");
        defaults.put("valuation.pe.bear", "12");
        defaults.put("valuation.pe.base", "15");
        defaults.put("valuation.pe.bull", "20");

        defaults.put("model.tax_rate", "0.25");
        defaults.put("model.depreciation_pct", "0.02");
        defaults.put("model.working_capital_pct", "0.01");
        defaults.put("model.cogs_efficiency_step", "0.005");
        defaults.put("model.default_cogs_ratio", "0.6");
        defaults.put("model.rd_growth_leverage", "0.8");
        defaults.put("model.sga_growth_leverage", "0.6");

        defaults.put("sec.user_agent", "finforecast research contact@example.com");
        defaults.put("sec.ticker_map_url", "https://www.sec.gov/files/company_tickers.json");
        defaults.put("sec.company_facts_url", "https://data.sec.gov/api/xbrl/companyfacts/CIK%s.json");
        defaults.put("sec.timeout_sec", "30");
        return Collections.unmodifiableMap(defaults);
    }
}
